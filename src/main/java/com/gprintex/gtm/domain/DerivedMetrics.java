package com.gprintex.gtm.domain;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Monetization fields computed from an agreement and its purchase orders on every read.
 * Monetary values are normalized to the base currency.
 */
public record DerivedMetrics(
    BigDecimal totalPosValue,
    BigDecimal ceilingNormalized,
    BigDecimal utilizationPercent,
    Optional<Long> daysSinceSignature,
    Optional<AgingBucket> agingBucket,
    RiskFlag riskFlag
) {
    public DerivedMetrics {
        daysSinceSignature = daysSinceSignature != null ? daysSinceSignature : Optional.empty();
        agingBucket = agingBucket != null ? agingBucket : Optional.empty();
    }

    public boolean monetizing() {
        return totalPosValue.signum() > 0;
    }
}
