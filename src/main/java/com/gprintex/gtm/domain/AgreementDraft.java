package com.gprintex.gtm.domain;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Input for creating an agreement. Fields are nullable here and checked by the ledger,
 * so a draft can carry whatever a request body or an import row supplied.
 */
public record AgreementDraft(
    String name,
    String customerName,
    CustomerSegment customerSegment,
    AgreementType agreementType,
    BigDecimal valueCeiling,
    Currency currency,
    AgreementStatus status,
    LocalDate statusDate,
    BigDecimal probabilityToSign,
    LocalDate expectedSignatureDate,
    LocalDate signedDate,
    String accountManager,
    String region,
    String industry,
    String salesOwner,
    String partnershipsVendors,
    LocalDate startDate,
    LocalDate endDate,
    String renewalTerms,
    String notes
) {
    /**
     * Minimal pipeline draft with the required fields.
     */
    public static AgreementDraft of(
        String name,
        String customerName,
        CustomerSegment segment,
        AgreementType type,
        BigDecimal valueCeiling,
        Currency currency,
        String accountManager
    ) {
        return new AgreementDraft(
            name, customerName, segment, type, valueCeiling, currency,
            null, null, null, null, null, accountManager,
            null, null, null, null, null, null, null, null
        );
    }

    public AgreementDraft withStatus(AgreementStatus newStatus) {
        return new AgreementDraft(
            name, customerName, customerSegment, agreementType, valueCeiling, currency,
            newStatus, statusDate, probabilityToSign, expectedSignatureDate, signedDate, accountManager,
            region, industry, salesOwner, partnershipsVendors, startDate, endDate, renewalTerms, notes
        );
    }

    public AgreementDraft withSignedDate(LocalDate date) {
        return new AgreementDraft(
            name, customerName, customerSegment, agreementType, valueCeiling, currency,
            status, statusDate, probabilityToSign, expectedSignatureDate, date, accountManager,
            region, industry, salesOwner, partnershipsVendors, startDate, endDate, renewalTerms, notes
        );
    }

    public AgreementDraft withProbabilityToSign(BigDecimal probability) {
        return new AgreementDraft(
            name, customerName, customerSegment, agreementType, valueCeiling, currency,
            status, statusDate, probability, expectedSignatureDate, signedDate, accountManager,
            region, industry, salesOwner, partnershipsVendors, startDate, endDate, renewalTerms, notes
        );
    }

    public AgreementDraft withRegion(String newRegion) {
        return new AgreementDraft(
            name, customerName, customerSegment, agreementType, valueCeiling, currency,
            status, statusDate, probabilityToSign, expectedSignatureDate, signedDate, accountManager,
            newRegion, industry, salesOwner, partnershipsVendors, startDate, endDate, renewalTerms, notes
        );
    }
}
