package com.gprintex.gtm.service;

import com.gprintex.gtm.domain.Currency;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Converts amounts into the base currency (SAR).
 * Unknown currency codes are treated as already normalized (rate 1) so malformed legacy
 * rows still aggregate instead of failing a whole report.
 */
@Component
public class CurrencyNormalizer {

    private final RateTable rates;

    public CurrencyNormalizer(RateTable rates) {
        this.rates = rates;
    }

    public BigDecimal normalize(BigDecimal amount, Currency currency) {
        return normalize(amount, currency != null ? currency.name() : null);
    }

    public BigDecimal normalize(BigDecimal amount, String currencyCode) {
        if (amount == null) {
            return BigDecimal.ZERO;
        }
        return amount.multiply(rates.rateFor(currencyCode).orElse(BigDecimal.ONE));
    }
}
