package com.gprintex.gtm.service;

import com.gprintex.gtm.domain.Agreement;
import com.gprintex.gtm.domain.AgreementStatus;
import com.gprintex.gtm.domain.AgreementView;
import com.gprintex.gtm.domain.AgingBucket;
import com.gprintex.gtm.domain.DerivedMetrics;
import com.gprintex.gtm.domain.PurchaseOrder;
import com.gprintex.gtm.domain.RiskFlag;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Collection;
import java.util.Optional;

/**
 * Computes the monetization fields of an agreement from its stored record and purchase orders.
 * Nothing here is cached; callers recompute on every read.
 */
@Component
public class DerivedFieldCalculator {

    static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final BigDecimal LOW_UTILIZATION_PERCENT = BigDecimal.TEN;
    private static final int PERCENT_SCALE = 4;

    private final CurrencyNormalizer normalizer;
    private final Clock clock;

    public DerivedFieldCalculator(CurrencyNormalizer normalizer, Clock clock) {
        this.normalizer = normalizer;
        this.clock = clock;
    }

    public AgreementView view(Agreement agreement, Collection<PurchaseOrder> purchaseOrders) {
        return new AgreementView(agreement, derive(agreement, purchaseOrders));
    }

    public DerivedMetrics derive(Agreement agreement, Collection<PurchaseOrder> purchaseOrders) {
        var total = totalPosValue(purchaseOrders);
        var ceiling = ceilingNormalized(agreement);
        var utilization = utilization(total, ceiling);
        var days = daysSinceSignature(agreement.signedDate());
        return new DerivedMetrics(
            total,
            ceiling,
            utilization,
            days,
            days.map(AgingBucket::forDays),
            riskFlag(agreement.status(), days, total, ceiling)
        );
    }

    public BigDecimal totalPosValue(Collection<PurchaseOrder> purchaseOrders) {
        return purchaseOrders.stream()
            .map(po -> normalizer.normalize(po.value(), po.currency()))
            .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public BigDecimal ceilingNormalized(Agreement agreement) {
        return normalizer.normalize(agreement.valueCeiling(), agreement.currency());
    }

    public Optional<Long> daysSinceSignature(Optional<LocalDate> signedDate) {
        var today = LocalDate.now(clock);
        return signedDate.map(signed -> ChronoUnit.DAYS.between(signed, today));
    }

    /**
     * Percentage of the ceiling drawn down; 0 when the ceiling is not positive.
     */
    public static BigDecimal utilization(BigDecimal totalPosValue, BigDecimal ceilingNormalized) {
        if (ceilingNormalized == null || ceilingNormalized.signum() <= 0) {
            return BigDecimal.ZERO;
        }
        return totalPosValue.multiply(HUNDRED).divide(ceilingNormalized, PERCENT_SCALE, RoundingMode.HALF_UP);
    }

    /**
     * Risk rules, first match wins:
     * Red when more than 90 days signed with nothing drawn;
     * Amber when 31-90 days signed with nothing drawn, or more than 60 days signed under 10% utilization;
     * Green otherwise. Only Signed and Active agreements can be anything but Green.
     * Utilization is compared unrounded.
     */
    public static RiskFlag riskFlag(
        AgreementStatus status, Optional<Long> daysSinceSignature, BigDecimal totalPosValue, BigDecimal ceilingNormalized
    ) {
        if (!status.isPostSignature() || daysSinceSignature.isEmpty()) {
            return RiskFlag.GREEN;
        }
        long days = daysSinceSignature.get();
        boolean nothingDrawn = totalPosValue.signum() == 0;

        if (days > 90 && nothingDrawn) {
            return RiskFlag.RED;
        }
        if ((days >= 31 && days <= 90 && nothingDrawn)
            || (days > 60 && belowLowUtilization(totalPosValue, ceilingNormalized))) {
            return RiskFlag.AMBER;
        }
        return RiskFlag.GREEN;
    }

    private static boolean belowLowUtilization(BigDecimal totalPosValue, BigDecimal ceilingNormalized) {
        if (ceilingNormalized == null || ceilingNormalized.signum() <= 0) {
            return true;
        }
        return totalPosValue.multiply(HUNDRED).compareTo(ceilingNormalized.multiply(LOW_UTILIZATION_PERCENT)) < 0;
    }
}
