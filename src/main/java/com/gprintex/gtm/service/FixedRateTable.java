package com.gprintex.gtm.service;

import com.gprintex.gtm.domain.Currency;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Static SAR-based rates. Process-wide constants, not configuration.
 */
public final class FixedRateTable implements RateTable {

    private static final Map<String, BigDecimal> RATES = Map.of(
        Currency.SAR.name(), BigDecimal.ONE,
        Currency.USD.name(), new BigDecimal("3.75"),
        Currency.EUR.name(), new BigDecimal("4.05")
    );

    @Override
    public Optional<BigDecimal> rateFor(String currencyCode) {
        if (currencyCode == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(RATES.get(currencyCode.trim().toUpperCase(Locale.ROOT)));
    }
}
