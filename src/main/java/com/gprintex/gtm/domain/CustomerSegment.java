package com.gprintex.gtm.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

/**
 * Agreement customer segment.
 */
public enum CustomerSegment {
    GOVERNMENT("Government"),
    SMART_CITY("SmartCity"),
    ENTERPRISE("Enterprise"),
    SME("SME"),
    OTHER("Other");

    private final String label;

    CustomerSegment(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public static Optional<CustomerSegment> fromLabel(String value) {
        return Labels.match(values(), value, CustomerSegment::label);
    }

    @JsonCreator
    public static CustomerSegment fromJson(String value) {
        return fromLabel(value)
            .orElseThrow(() -> new IllegalArgumentException("Unknown customer segment: " + value));
    }
}
