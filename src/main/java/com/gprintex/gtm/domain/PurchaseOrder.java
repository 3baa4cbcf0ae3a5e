package com.gprintex.gtm.domain;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Purchase order drawn against an agreement ceiling.
 */
public record PurchaseOrder(
    String poId,
    String agreementId,
    Optional<String> poNumber,
    LocalDate poDate,
    BigDecimal value,
    Currency currency,
    String customerName,
    Optional<String> accountManager,
    Optional<String> notes,
    Optional<LocalDateTime> createdAt
) {
    public PurchaseOrder {
        if (poId == null || poId.isBlank()) {
            throw new IllegalArgumentException("poId is required");
        }
        if (agreementId == null || agreementId.isBlank()) {
            throw new IllegalArgumentException("agreementId is required");
        }
        if (value == null || value.signum() <= 0) {
            throw new IllegalArgumentException("value must be positive");
        }
        currency = currency != null ? currency : Currency.BASE;
        poNumber = poNumber != null ? poNumber : Optional.empty();
        accountManager = accountManager != null ? accountManager : Optional.empty();
        notes = notes != null ? notes : Optional.empty();
        createdAt = createdAt != null ? createdAt : Optional.empty();
    }

    /**
     * Build the stored form of a draft, filling customer and account manager from the parent agreement.
     */
    public static PurchaseOrder fromDraft(String poId, PurchaseOrderDraft draft, Agreement parent, LocalDateTime now) {
        return new PurchaseOrder(
            poId,
            parent.agreementId(),
            Optional.ofNullable(draft.poNumber()),
            draft.poDate(),
            draft.value(),
            draft.currency(),
            draft.customerName() != null && !draft.customerName().isBlank()
                ? draft.customerName() : parent.customerName(),
            Optional.ofNullable(draft.accountManager())
                .filter(am -> !am.isBlank())
                .or(() -> Optional.of(parent.accountManager())),
            Optional.ofNullable(draft.notes()),
            Optional.of(now)
        );
    }
}
