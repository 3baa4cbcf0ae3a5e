package com.gprintex.gtm.domain;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Expected pipeline value plus normalized purchase order totals per calendar month ({@code yyyy-MM}).
 */
public record ForecastData(
    BigDecimal expectedPipelineValue,
    Map<String, BigDecimal> monthlyPoValues
) {
}
