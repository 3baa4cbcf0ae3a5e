package com.gprintex.gtm.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Agreement lifecycle status. Stored and serialized by label (e.g. {@code LegalReview}).
 */
public enum AgreementStatus {
    PIPELINE("Pipeline"),
    DRAFT("Draft"),
    LEGAL_REVIEW("LegalReview"),
    SIGNATURE_PENDING("SignaturePending"),
    SIGNED("Signed"),
    ACTIVE("Active"),
    EXPIRED("Expired"),
    TERMINATED("Terminated");

    private final String label;

    AgreementStatus(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    /**
     * Check if transition to target status is valid.
     */
    public boolean canTransitionTo(AgreementStatus target) {
        return switch (this) {
            case PIPELINE -> target == DRAFT || target == TERMINATED;
            case DRAFT -> target == LEGAL_REVIEW || target == PIPELINE || target == TERMINATED;
            case LEGAL_REVIEW -> target == SIGNATURE_PENDING || target == DRAFT || target == TERMINATED;
            case SIGNATURE_PENDING -> target == SIGNED || target == LEGAL_REVIEW || target == TERMINATED;
            case SIGNED -> target == ACTIVE || target == TERMINATED;
            case ACTIVE -> target == EXPIRED || target == TERMINATED;
            case EXPIRED, TERMINATED -> false;
        };
    }

    public List<AgreementStatus> allowedTransitions() {
        return Arrays.stream(values())
            .filter(this::canTransitionTo)
            .toList();
    }

    public boolean isTerminal() {
        return this == EXPIRED || this == TERMINATED;
    }

    public boolean isPreSignature() {
        return this == PIPELINE || this == DRAFT || this == LEGAL_REVIEW || this == SIGNATURE_PENDING;
    }

    public boolean isPostSignature() {
        return this == SIGNED || this == ACTIVE;
    }

    public static List<AgreementStatus> preSignature() {
        return List.of(PIPELINE, DRAFT, LEGAL_REVIEW, SIGNATURE_PENDING);
    }

    public static Optional<AgreementStatus> fromLabel(String value) {
        return Labels.match(values(), value, AgreementStatus::label);
    }

    @JsonCreator
    public static AgreementStatus fromJson(String value) {
        return fromLabel(value)
            .orElseThrow(() -> new IllegalArgumentException("Unknown agreement status: " + value));
    }
}
