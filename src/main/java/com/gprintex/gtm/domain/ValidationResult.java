package com.gprintex.gtm.domain;

/**
 * Outcome of a single field check. Error codes are stable identifiers (REQUIRED, NOT_POSITIVE,
 * OUT_OF_RANGE, INVALID_VALUE) that callers may switch on.
 */
public record ValidationResult(
    boolean valid,
    String errorCode,
    String errorMessage,
    String fieldName
) {
    public static ValidationResult success() {
        return new ValidationResult(true, null, null, null);
    }

    public static ValidationResult error(String code, String message, String field) {
        return new ValidationResult(false, code, message, field);
    }

    public static ValidationResult required(String field) {
        return error("REQUIRED", field + " is required", field);
    }

    public static ValidationResult notPositive(String field) {
        return error("NOT_POSITIVE", field + " must be greater than 0", field);
    }

    public static ValidationResult invalidValue(String field, String value) {
        return error("INVALID_VALUE", "Unrecognized " + field + ": " + value, field);
    }
}
