package com.gprintex.gtm.service;

import com.gprintex.gtm.domain.AccountManagerStatistics;
import com.gprintex.gtm.domain.AgingBucket;
import com.gprintex.gtm.domain.AgingRiskMatrix;
import com.gprintex.gtm.domain.AgreementStatus;
import com.gprintex.gtm.domain.AgreementView;
import com.gprintex.gtm.domain.ForecastData;
import com.gprintex.gtm.domain.MonetizationStatistics;
import com.gprintex.gtm.domain.PipelineStatistics;
import com.gprintex.gtm.domain.PurchaseOrder;
import com.gprintex.gtm.domain.RiskFlag;
import com.gprintex.gtm.repository.AgreementRepository.AgreementFilter;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Portfolio statistics. Everything is recomputed from the ledger on each call.
 */
@Service
@Transactional(readOnly = true)
public class AnalyticsService {

    private static final DateTimeFormatter MONTH = DateTimeFormatter.ofPattern("yyyy-MM");
    private static final int AVERAGE_SCALE = 2;

    private final LedgerService ledger;
    private final CurrencyNormalizer normalizer;

    public AnalyticsService(LedgerService ledger, CurrencyNormalizer normalizer) {
        this.ledger = ledger;
        this.normalizer = normalizer;
    }

    /**
     * Pre-signature pipeline. Every pre-signature status appears in the breakdown;
     * a missing probability counts as zero.
     */
    public PipelineStatistics pipeline(AgreementFilter filter) {
        var pipeline = preSignature(ledger.findAgreements(filter));

        var byStatus = new LinkedHashMap<String, Long>();
        AgreementStatus.preSignature().forEach(s -> byStatus.put(s.label(), 0L));
        pipeline.forEach(v -> byStatus.merge(v.status().label(), 1L, Long::sum));

        var totalCeiling = BigDecimal.ZERO;
        var probabilitySum = BigDecimal.ZERO;
        for (var view : pipeline) {
            totalCeiling = totalCeiling.add(view.metrics().ceilingNormalized());
            probabilitySum = probabilitySum.add(probability(view));
        }
        var average = pipeline.isEmpty()
            ? BigDecimal.ZERO
            : probabilitySum.divide(BigDecimal.valueOf(pipeline.size()), AVERAGE_SCALE, RoundingMode.HALF_UP);

        return new PipelineStatistics(pipeline.size(), byStatus, totalCeiling, average, weightedValue(pipeline));
    }

    /**
     * Signed and active agreements: drawn value against ceiling and risk distribution.
     */
    public MonetizationStatistics monetization(AgreementFilter filter) {
        var signed = postSignature(ledger.findAgreements(filter));

        var byRisk = new LinkedHashMap<String, Long>();
        for (var flag : RiskFlag.values()) {
            byRisk.put(flag.label(), 0L);
        }

        var signedCeiling = BigDecimal.ZERO;
        var monetized = BigDecimal.ZERO;
        long withoutPos = 0;
        for (var view : signed) {
            signedCeiling = signedCeiling.add(view.metrics().ceilingNormalized());
            monetized = monetized.add(view.metrics().totalPosValue());
            if (!view.metrics().monetizing()) {
                withoutPos++;
            }
            byRisk.merge(view.riskFlag().label(), 1L, Long::sum);
        }

        return new MonetizationStatistics(
            signed.size(),
            signedCeiling,
            monetized,
            DerivedFieldCalculator.utilization(monetized, signedCeiling),
            withoutPos,
            byRisk
        );
    }

    /**
     * One row per account manager, highest monetized value first.
     */
    public List<AccountManagerStatistics> accountManagers(AgreementFilter filter) {
        var grouped = new LinkedHashMap<String, List<AgreementView>>();
        for (var view : ledger.findAgreements(filter)) {
            grouped.computeIfAbsent(view.agreement().accountManager(), k -> new ArrayList<>()).add(view);
        }

        var result = new ArrayList<AccountManagerStatistics>();
        grouped.forEach((manager, views) -> {
            var signed = postSignature(views);
            var signedValue = signed.stream()
                .map(v -> v.metrics().ceilingNormalized())
                .reduce(BigDecimal.ZERO, BigDecimal::add);
            var monetizedValue = signed.stream()
                .map(v -> v.metrics().totalPosValue())
                .reduce(BigDecimal.ZERO, BigDecimal::add);
            result.add(new AccountManagerStatistics(
                manager,
                views.size(),
                signed.size(),
                signedValue,
                monetizedValue,
                DerivedFieldCalculator.utilization(monetizedValue, signedValue)
            ));
        });

        result.sort(Comparator.comparing(AccountManagerStatistics::monetizedValue).reversed());
        return result;
    }

    /**
     * Post-signature agreements counted by aging bucket and risk flag; all twelve cells present.
     */
    public AgingRiskMatrix agingRiskMatrix(AgreementFilter filter) {
        var cells = new LinkedHashMap<String, Map<String, Long>>();
        for (var bucket : AgingBucket.values()) {
            var row = new LinkedHashMap<String, Long>();
            for (var flag : RiskFlag.values()) {
                row.put(flag.label(), 0L);
            }
            cells.put(bucket.label(), row);
        }

        for (var view : postSignature(ledger.findAgreements(filter))) {
            view.metrics().agingBucket().ifPresent(bucket ->
                cells.get(bucket.label()).merge(view.riskFlag().label(), 1L, Long::sum));
        }
        return new AgingRiskMatrix(cells);
    }

    /**
     * Probability-weighted pipeline plus normalized purchase order value per month,
     * restricted to the purchase orders of the filtered agreements.
     */
    public ForecastData forecast(AgreementFilter filter) {
        var views = ledger.findAgreements(filter);
        var posByAgreement = ledger.purchaseOrdersByAgreement();

        var monthly = new TreeMap<String, BigDecimal>();
        for (var view : views) {
            for (PurchaseOrder po : posByAgreement.getOrDefault(view.agreementId(), List.of())) {
                monthly.merge(po.poDate().format(MONTH),
                    normalizer.normalize(po.value(), po.currency()), BigDecimal::add);
            }
        }

        return new ForecastData(weightedValue(preSignature(views)), monthly);
    }

    private static BigDecimal weightedValue(List<AgreementView> pipeline) {
        return pipeline.stream()
            .map(v -> v.metrics().ceilingNormalized().multiply(probability(v))
                .divide(DerivedFieldCalculator.HUNDRED))
            .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    private static BigDecimal probability(AgreementView view) {
        return view.agreement().probabilityToSign().orElse(BigDecimal.ZERO);
    }

    private static List<AgreementView> preSignature(List<AgreementView> views) {
        return views.stream().filter(v -> v.status().isPreSignature()).toList();
    }

    private static List<AgreementView> postSignature(List<AgreementView> views) {
        return views.stream().filter(v -> v.status().isPostSignature()).toList();
    }
}
