package com.gprintex.gtm.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

/**
 * Commercial shape of an agreement.
 */
public enum AgreementType {
    FRAMEWORK("Framework"),
    MASTER_SERVICES("MasterServices"),
    BLANKET_PO("BlanketPO"),
    OTHER("Other");

    private final String label;

    AgreementType(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public static Optional<AgreementType> fromLabel(String value) {
        return Labels.match(values(), value, AgreementType::label);
    }

    @JsonCreator
    public static AgreementType fromJson(String value) {
        return fromLabel(value)
            .orElseThrow(() -> new IllegalArgumentException("Unknown agreement type: " + value));
    }
}
