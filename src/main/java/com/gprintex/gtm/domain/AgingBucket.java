package com.gprintex.gtm.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Coarse classification of the days elapsed since signature.
 */
public enum AgingBucket {
    UNDER_30("<30d"),
    DAYS_30_60("30-60d"),
    DAYS_61_90("61-90d"),
    OVER_90(">90d");

    private final String label;

    AgingBucket(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public static AgingBucket forDays(long days) {
        if (days < 30) {
            return UNDER_30;
        }
        if (days <= 60) {
            return DAYS_30_60;
        }
        if (days <= 90) {
            return DAYS_61_90;
        }
        return OVER_90;
    }
}
