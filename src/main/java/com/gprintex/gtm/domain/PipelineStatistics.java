package com.gprintex.gtm.domain;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Pre-signature pipeline summary. Status counts are keyed by status label.
 */
public record PipelineStatistics(
    long totalCount,
    Map<String, Long> byStatus,
    BigDecimal totalPotentialCeiling,
    BigDecimal averageProbability,
    BigDecimal weightedValue
) {
}
