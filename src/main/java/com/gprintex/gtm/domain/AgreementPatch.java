package com.gprintex.gtm.domain;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Optional;
import java.util.Set;

/**
 * Partial update of an agreement. Empty components leave the stored value untouched;
 * optional fields named in {@code clear} are removed, and a clear wins over a value for the same field.
 * The status component is applied through the lifecycle state machine, not by {@link #applyTo}.
 */
public record AgreementPatch(
    Optional<String> name,
    Optional<String> customerName,
    Optional<CustomerSegment> customerSegment,
    Optional<AgreementType> agreementType,
    Optional<BigDecimal> valueCeiling,
    Optional<Currency> currency,
    Optional<AgreementStatus> status,
    Optional<BigDecimal> probabilityToSign,
    Optional<LocalDate> expectedSignatureDate,
    Optional<LocalDate> signedDate,
    Optional<String> accountManager,
    Optional<String> region,
    Optional<String> industry,
    Optional<String> salesOwner,
    Optional<String> partnershipsVendors,
    Optional<LocalDate> startDate,
    Optional<LocalDate> endDate,
    Optional<String> renewalTerms,
    Optional<String> notes,
    Set<String> clear
) {
    /**
     * Optional fields a patch may clear.
     */
    public static final Set<String> CLEARABLE = Set.of(
        "probabilityToSign", "expectedSignatureDate", "signedDate", "region", "industry",
        "salesOwner", "partnershipsVendors", "startDate", "endDate", "renewalTerms", "notes"
    );

    public AgreementPatch {
        name = name != null ? name : Optional.empty();
        customerName = customerName != null ? customerName : Optional.empty();
        customerSegment = customerSegment != null ? customerSegment : Optional.empty();
        agreementType = agreementType != null ? agreementType : Optional.empty();
        valueCeiling = valueCeiling != null ? valueCeiling : Optional.empty();
        currency = currency != null ? currency : Optional.empty();
        status = status != null ? status : Optional.empty();
        probabilityToSign = probabilityToSign != null ? probabilityToSign : Optional.empty();
        expectedSignatureDate = expectedSignatureDate != null ? expectedSignatureDate : Optional.empty();
        signedDate = signedDate != null ? signedDate : Optional.empty();
        accountManager = accountManager != null ? accountManager : Optional.empty();
        region = region != null ? region : Optional.empty();
        industry = industry != null ? industry : Optional.empty();
        salesOwner = salesOwner != null ? salesOwner : Optional.empty();
        partnershipsVendors = partnershipsVendors != null ? partnershipsVendors : Optional.empty();
        startDate = startDate != null ? startDate : Optional.empty();
        endDate = endDate != null ? endDate : Optional.empty();
        renewalTerms = renewalTerms != null ? renewalTerms : Optional.empty();
        notes = notes != null ? notes : Optional.empty();
        clear = clear != null ? Set.copyOf(clear) : Set.of();
    }

    public static AgreementPatch empty() {
        return new AgreementPatch(
            null, null, null, null, null, null, null, null, null, null,
            null, null, null, null, null, null, null, null, null, null
        );
    }

    public static AgreementPatch status(AgreementStatus newStatus) {
        return empty().withStatus(newStatus);
    }

    public AgreementPatch withStatus(AgreementStatus newStatus) {
        return new AgreementPatch(
            name, customerName, customerSegment, agreementType, valueCeiling, currency, Optional.ofNullable(newStatus),
            probabilityToSign, expectedSignatureDate, signedDate, accountManager, region, industry, salesOwner,
            partnershipsVendors, startDate, endDate, renewalTerms, notes, clear
        );
    }

    public AgreementPatch withSignedDate(LocalDate date) {
        return new AgreementPatch(
            name, customerName, customerSegment, agreementType, valueCeiling, currency, status,
            probabilityToSign, expectedSignatureDate, Optional.ofNullable(date), accountManager, region, industry,
            salesOwner, partnershipsVendors, startDate, endDate, renewalTerms, notes, clear
        );
    }

    public AgreementPatch withValueCeiling(BigDecimal ceiling) {
        return new AgreementPatch(
            name, customerName, customerSegment, agreementType, Optional.ofNullable(ceiling), currency, status,
            probabilityToSign, expectedSignatureDate, signedDate, accountManager, region, industry, salesOwner,
            partnershipsVendors, startDate, endDate, renewalTerms, notes, clear
        );
    }

    public AgreementPatch withNotes(String text) {
        return new AgreementPatch(
            name, customerName, customerSegment, agreementType, valueCeiling, currency, status,
            probabilityToSign, expectedSignatureDate, signedDate, accountManager, region, industry, salesOwner,
            partnershipsVendors, startDate, endDate, renewalTerms, Optional.ofNullable(text), clear
        );
    }

    public AgreementPatch withCleared(String... fields) {
        return new AgreementPatch(
            name, customerName, customerSegment, agreementType, valueCeiling, currency, status,
            probabilityToSign, expectedSignatureDate, signedDate, accountManager, region, industry, salesOwner,
            partnershipsVendors, startDate, endDate, renewalTerms, notes, Set.of(fields)
        );
    }

    /**
     * Apply every present non-status component to the given agreement.
     */
    public Agreement applyTo(Agreement current) {
        return new Agreement(
            current.agreementId(),
            name.orElse(current.name()),
            customerName.orElse(current.customerName()),
            customerSegment.orElse(current.customerSegment()),
            agreementType.orElse(current.agreementType()),
            valueCeiling.orElse(current.valueCeiling()),
            currency.orElse(current.currency()),
            current.status(),
            current.statusDate(),
            merge("probabilityToSign", probabilityToSign, current.probabilityToSign()),
            merge("expectedSignatureDate", expectedSignatureDate, current.expectedSignatureDate()),
            merge("signedDate", signedDate, current.signedDate()),
            accountManager.orElse(current.accountManager()),
            merge("region", region, current.region()),
            merge("industry", industry, current.industry()),
            merge("salesOwner", salesOwner, current.salesOwner()),
            merge("partnershipsVendors", partnershipsVendors, current.partnershipsVendors()),
            merge("startDate", startDate, current.startDate()),
            merge("endDate", endDate, current.endDate()),
            merge("renewalTerms", renewalTerms, current.renewalTerms()),
            merge("notes", notes, current.notes()),
            current.createdAt(),
            current.lastUpdated()
        );
    }

    private <T> Optional<T> merge(String field, Optional<T> patched, Optional<T> current) {
        if (clear.contains(field)) {
            return Optional.empty();
        }
        return patched.isPresent() ? patched : current;
    }
}
