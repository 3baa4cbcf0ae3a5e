package com.gprintex.gtm.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Traffic-light monetization health of a signed or active agreement.
 */
public enum RiskFlag {
    GREEN("Green"),
    AMBER("Amber"),
    RED("Red");

    private final String label;

    RiskFlag(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
