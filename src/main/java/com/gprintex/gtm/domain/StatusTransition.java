package com.gprintex.gtm.domain;

import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Append-only status history entry. The first entry of an agreement has no old status.
 */
public record StatusTransition(
    Optional<Long> id,
    String agreementId,
    Optional<AgreementStatus> oldStatus,
    AgreementStatus newStatus,
    LocalDateTime changedAt,
    Optional<String> changedBy
) {
    public StatusTransition {
        id = id != null ? id : Optional.empty();
        oldStatus = oldStatus != null ? oldStatus : Optional.empty();
        changedBy = changedBy != null ? changedBy : Optional.empty();
    }

    public static StatusTransition initial(String agreementId, AgreementStatus status, LocalDateTime at, String user) {
        return new StatusTransition(Optional.empty(), agreementId, Optional.empty(), status, at, Optional.ofNullable(user));
    }

    public static StatusTransition change(
        String agreementId, AgreementStatus from, AgreementStatus to, LocalDateTime at, String user
    ) {
        return new StatusTransition(Optional.empty(), agreementId, Optional.of(from), to, at, Optional.ofNullable(user));
    }
}
