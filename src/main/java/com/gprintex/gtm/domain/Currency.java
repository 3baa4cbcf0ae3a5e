package com.gprintex.gtm.domain;

import java.util.Optional;

/**
 * Supported agreement and purchase order currencies. SAR is the normalization base.
 */
public enum Currency {
    SAR,
    USD,
    EUR;

    public static final Currency BASE = SAR;

    public static Optional<Currency> fromCode(String code) {
        return Labels.match(values(), code, Enum::name);
    }
}
