package com.gprintex.gtm.service;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Read-only lookup of conversion rates into the base currency.
 */
@FunctionalInterface
public interface RateTable {

    /**
     * Rate that converts one unit of {@code currencyCode} into the base currency, if known.
     */
    Optional<BigDecimal> rateFor(String currencyCode);
}
