package com.gprintex.gtm.domain;

import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Business rule rejections returned on the left side of ledger results.
 * None of these are transient, so callers never retry them.
 */
public sealed interface LedgerError {

    String code();

    String message();

    /**
     * Missing required fields, non-positive amounts or malformed values.
     */
    record ValidationError(List<ValidationResult> violations) implements LedgerError {
        public ValidationError {
            violations = List.copyOf(violations);
        }

        public static ValidationError of(String code, String message, String field) {
            return new ValidationError(List.of(ValidationResult.error(code, message, field)));
        }

        @Override
        public String code() {
            return "VALIDATION_FAILED";
        }

        @Override
        public String message() {
            return violations.stream()
                .map(ValidationResult::errorMessage)
                .collect(Collectors.joining("; "));
        }
    }

    record NotFound(String entity, String id) implements LedgerError {
        @Override
        public String code() {
            return "NOT_FOUND";
        }

        @Override
        public String message() {
            return entity + " " + id + " not found";
        }
    }

    record InvalidTransition(AgreementStatus from, AgreementStatus to) implements LedgerError {
        @Override
        public String code() {
            return "INVALID_TRANSITION";
        }

        @Override
        public String message() {
            return "Invalid status transition from " + from.label() + " to " + to.label();
        }
    }

    /**
     * All three amounts are normalized to the base currency.
     */
    record CeilingExceeded(BigDecimal currentTotal, BigDecimal newPoValue, BigDecimal ceiling) implements LedgerError {
        @Override
        public String code() {
            return "CEILING_EXCEEDED";
        }

        @Override
        public String message() {
            return String.format(Locale.ROOT,
                "Adding this PO would exceed the agreement ceiling. Current: %,.2f %s, New PO: %,.2f %s, Ceiling: %,.2f %s",
                currentTotal, Currency.BASE, newPoValue, Currency.BASE, ceiling, Currency.BASE);
        }
    }
}
