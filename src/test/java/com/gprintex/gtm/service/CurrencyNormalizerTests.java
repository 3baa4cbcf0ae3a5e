package com.gprintex.gtm.service;

import com.gprintex.gtm.domain.Currency;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.math.BigDecimal;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class CurrencyNormalizerTests {

    private final CurrencyNormalizer normalizer = new CurrencyNormalizer(new FixedRateTable());

    @ParameterizedTest
    @CsvSource({
        "100, SAR, 100",
        "100, USD, 375",
        "100, EUR, 405",
        "0.5, USD, 1.875"
    })
    void normalize_shouldApplyFixedRates(String amount, String currency, String expected) {
        var result = normalizer.normalize(new BigDecimal(amount), Currency.valueOf(currency));

        assertEquals(0, new BigDecimal(expected).compareTo(result), () -> "got " + result);
    }

    @ParameterizedTest
    @CsvSource({"GBP", "'   '", "usd-x"})
    void normalize_shouldTreatUnknownCodesAsBase(String code) {
        assertEquals(0, new BigDecimal("250").compareTo(normalizer.normalize(new BigDecimal("250"), code)));
    }

    @Test
    void normalize_shouldAcceptLowerCaseCodes() {
        assertEquals(0, new BigDecimal("375").compareTo(normalizer.normalize(new BigDecimal("100"), " usd ")));
    }

    @Test
    void normalize_shouldTreatMissingAmountAsZero() {
        assertEquals(BigDecimal.ZERO, normalizer.normalize(null, Currency.EUR));
    }

    @Test
    void normalize_shouldUseInjectedRates() {
        var custom = new CurrencyNormalizer(code -> Optional.of(new BigDecimal("2")));

        assertEquals(0, new BigDecimal("20").compareTo(custom.normalize(BigDecimal.TEN, Currency.USD)));
    }
}
