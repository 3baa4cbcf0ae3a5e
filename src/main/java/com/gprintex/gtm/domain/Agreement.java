package com.gprintex.gtm.domain;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Stored framework agreement - immutable value object matching a row of the agreements table.
 * Derived monetization fields live in {@link DerivedMetrics}, never here.
 */
public record Agreement(
    String agreementId,
    String name,
    String customerName,
    CustomerSegment customerSegment,
    AgreementType agreementType,
    BigDecimal valueCeiling,
    Currency currency,
    AgreementStatus status,
    LocalDate statusDate,
    Optional<BigDecimal> probabilityToSign,
    Optional<LocalDate> expectedSignatureDate,
    Optional<LocalDate> signedDate,
    String accountManager,
    Optional<String> region,
    Optional<String> industry,
    Optional<String> salesOwner,
    Optional<String> partnershipsVendors,
    Optional<LocalDate> startDate,
    Optional<LocalDate> endDate,
    Optional<String> renewalTerms,
    Optional<String> notes,
    Optional<LocalDateTime> createdAt,
    Optional<LocalDateTime> lastUpdated
) {
    public Agreement {
        if (agreementId == null || agreementId.isBlank()) {
            throw new IllegalArgumentException("agreementId is required");
        }
        if (valueCeiling == null || valueCeiling.signum() <= 0) {
            throw new IllegalArgumentException("valueCeiling must be positive");
        }
        if (status == null) {
            throw new IllegalArgumentException("status is required");
        }
        currency = currency != null ? currency : Currency.BASE;
        probabilityToSign = probabilityToSign != null ? probabilityToSign : Optional.empty();
        expectedSignatureDate = expectedSignatureDate != null ? expectedSignatureDate : Optional.empty();
        signedDate = signedDate != null ? signedDate : Optional.empty();
        region = region != null ? region : Optional.empty();
        industry = industry != null ? industry : Optional.empty();
        salesOwner = salesOwner != null ? salesOwner : Optional.empty();
        partnershipsVendors = partnershipsVendors != null ? partnershipsVendors : Optional.empty();
        startDate = startDate != null ? startDate : Optional.empty();
        endDate = endDate != null ? endDate : Optional.empty();
        renewalTerms = renewalTerms != null ? renewalTerms : Optional.empty();
        notes = notes != null ? notes : Optional.empty();
        createdAt = createdAt != null ? createdAt : Optional.empty();
        lastUpdated = lastUpdated != null ? lastUpdated : Optional.empty();
    }

    /**
     * Build the stored form of a validated draft.
     */
    public static Agreement fromDraft(String agreementId, AgreementDraft draft, LocalDate today, LocalDateTime now) {
        return new Agreement(
            agreementId,
            draft.name(),
            draft.customerName(),
            draft.customerSegment(),
            draft.agreementType(),
            draft.valueCeiling(),
            draft.currency(),
            draft.status() != null ? draft.status() : AgreementStatus.PIPELINE,
            draft.statusDate() != null ? draft.statusDate() : today,
            Optional.ofNullable(draft.probabilityToSign()),
            Optional.ofNullable(draft.expectedSignatureDate()),
            Optional.ofNullable(draft.signedDate()),
            draft.accountManager(),
            Optional.ofNullable(draft.region()),
            Optional.ofNullable(draft.industry()),
            Optional.ofNullable(draft.salesOwner()),
            Optional.ofNullable(draft.partnershipsVendors()),
            Optional.ofNullable(draft.startDate()),
            Optional.ofNullable(draft.endDate()),
            Optional.ofNullable(draft.renewalTerms()),
            Optional.ofNullable(draft.notes()),
            Optional.of(now),
            Optional.of(now)
        );
    }

    /**
     * Create a copy with a new status and status date. Does not check the transition.
     */
    public Agreement withStatus(AgreementStatus newStatus, LocalDate changedOn) {
        return new Agreement(
            agreementId, name, customerName, customerSegment, agreementType, valueCeiling, currency,
            newStatus, changedOn, probabilityToSign, expectedSignatureDate, signedDate, accountManager,
            region, industry, salesOwner, partnershipsVendors, startDate, endDate, renewalTerms, notes,
            createdAt, lastUpdated
        );
    }

    /**
     * Create a copy with the signature date set.
     */
    public Agreement withSignedDate(LocalDate date) {
        return new Agreement(
            agreementId, name, customerName, customerSegment, agreementType, valueCeiling, currency,
            status, statusDate, probabilityToSign, expectedSignatureDate, Optional.ofNullable(date), accountManager,
            region, industry, salesOwner, partnershipsVendors, startDate, endDate, renewalTerms, notes,
            createdAt, lastUpdated
        );
    }

    /**
     * Create a copy stamped with a new last-updated time.
     */
    public Agreement touchedAt(LocalDateTime now) {
        return new Agreement(
            agreementId, name, customerName, customerSegment, agreementType, valueCeiling, currency,
            status, statusDate, probabilityToSign, expectedSignatureDate, signedDate, accountManager,
            region, industry, salesOwner, partnershipsVendors, startDate, endDate, renewalTerms, notes,
            createdAt, Optional.ofNullable(now)
        );
    }

    public boolean isPreSignature() {
        return status.isPreSignature();
    }

    public boolean isPostSignature() {
        return status.isPostSignature();
    }

    /**
     * Agreement id without the {@code AGR-} prefix, used to scope purchase order ids.
     */
    public String idSuffix() {
        var dash = agreementId.indexOf('-');
        return dash >= 0 ? agreementId.substring(dash + 1) : agreementId;
    }
}
