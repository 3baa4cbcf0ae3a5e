package com.gprintex.gtm.service;

import com.gprintex.gtm.domain.Agreement;
import com.gprintex.gtm.domain.AgreementStatus;
import com.gprintex.gtm.domain.LedgerError;
import com.gprintex.gtm.domain.StatusTransition;
import io.vavr.control.Either;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Agreement status state machine. Validates an edge and produces the history entry for it;
 * persistence is left to the caller so the status change and its log entry share one transaction.
 */
@Component
public class AgreementLifecycle {

    /**
     * Result of applying a status: the agreement to store and the history entry to append, if any.
     */
    public record StatusChange(Agreement agreement, Optional<StatusTransition> logEntry) {

        public static StatusChange unchanged(Agreement agreement) {
            return new StatusChange(agreement, Optional.empty());
        }

        public boolean changed() {
            return logEntry.isPresent();
        }
    }

    /**
     * Move the agreement to {@code target}. Re-applying the current status is a no-op that never fails.
     * Entering Signed without a signature date stamps {@code today}.
     */
    public Either<LedgerError, StatusChange> transition(
        Agreement agreement, AgreementStatus target, LocalDate today, LocalDateTime now, String user
    ) {
        var current = agreement.status();
        if (current == target) {
            return Either.right(StatusChange.unchanged(agreement));
        }
        if (!current.canTransitionTo(target)) {
            return Either.left(new LedgerError.InvalidTransition(current, target));
        }

        var moved = agreement.withStatus(target, today);
        if (target == AgreementStatus.SIGNED && moved.signedDate().isEmpty()) {
            moved = moved.withSignedDate(today);
        }
        var entry = StatusTransition.change(agreement.agreementId(), current, target, now, user);
        return Either.right(new StatusChange(moved, Optional.of(entry)));
    }

    public boolean isValidTransition(AgreementStatus from, AgreementStatus to) {
        return from == to || from.canTransitionTo(to);
    }

    public List<AgreementStatus> allowedTransitions(AgreementStatus current) {
        return current.allowedTransitions();
    }
}
