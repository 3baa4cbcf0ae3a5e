package com.gprintex.gtm.domain;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Input for creating a purchase order. Customer name and account manager may be omitted.
 */
public record PurchaseOrderDraft(
    String agreementId,
    String poNumber,
    LocalDate poDate,
    BigDecimal value,
    Currency currency,
    String customerName,
    String accountManager,
    String notes
) {
    public static PurchaseOrderDraft of(String agreementId, LocalDate poDate, BigDecimal value, Currency currency) {
        return new PurchaseOrderDraft(agreementId, null, poDate, value, currency, null, null, null);
    }

    public PurchaseOrderDraft forAgreement(String id) {
        return new PurchaseOrderDraft(id, poNumber, poDate, value, currency, customerName, accountManager, notes);
    }
}
