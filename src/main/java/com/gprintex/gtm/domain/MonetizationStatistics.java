package com.gprintex.gtm.domain;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Monetization summary over signed and active agreements. Risk counts are keyed by flag label.
 */
public record MonetizationStatistics(
    long agreementsCount,
    BigDecimal totalSignedCeiling,
    BigDecimal totalMonetizedValue,
    BigDecimal overallUtilization,
    long agreementsWithoutPos,
    Map<String, Long> byRisk
) {
}
