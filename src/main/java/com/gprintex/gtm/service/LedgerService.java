package com.gprintex.gtm.service;

import com.gprintex.gtm.config.GtmProperties;
import com.gprintex.gtm.domain.Agreement;
import com.gprintex.gtm.domain.AgreementDraft;
import com.gprintex.gtm.domain.AgreementPatch;
import com.gprintex.gtm.domain.AgreementStatus;
import com.gprintex.gtm.domain.AgreementView;
import com.gprintex.gtm.domain.LedgerError;
import com.gprintex.gtm.domain.LedgerError.CeilingExceeded;
import com.gprintex.gtm.domain.LedgerError.NotFound;
import com.gprintex.gtm.domain.LedgerError.ValidationError;
import com.gprintex.gtm.domain.PurchaseOrder;
import com.gprintex.gtm.domain.PurchaseOrderDraft;
import com.gprintex.gtm.domain.StatusTransition;
import com.gprintex.gtm.domain.ValidationResult;
import com.gprintex.gtm.repository.AgreementRepository;
import com.gprintex.gtm.repository.AgreementRepository.AgreementFilter;
import com.gprintex.gtm.repository.PurchaseOrderRepository;
import com.gprintex.gtm.repository.StatusHistoryRepository;
import io.vavr.control.Either;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Agreement and purchase order ledger.
 * Writes return Either with a {@link LedgerError} on the left; reads always come back with
 * derived metrics recomputed from the stored rows.
 */
@Service
public class LedgerService {

    private static final Logger log = LoggerFactory.getLogger(LedgerService.class);

    private static final BigDecimal MAX_PROBABILITY = BigDecimal.valueOf(100);

    private final AgreementRepository agreements;
    private final PurchaseOrderRepository purchaseOrders;
    private final StatusHistoryRepository history;
    private final DerivedFieldCalculator calculator;
    private final AgreementLifecycle lifecycle;
    private final CurrencyNormalizer normalizer;
    private final GtmProperties properties;
    private final Clock clock;

    public LedgerService(
        AgreementRepository agreements,
        PurchaseOrderRepository purchaseOrders,
        StatusHistoryRepository history,
        DerivedFieldCalculator calculator,
        AgreementLifecycle lifecycle,
        CurrencyNormalizer normalizer,
        GtmProperties properties,
        Clock clock
    ) {
        this.agreements = agreements;
        this.purchaseOrders = purchaseOrders;
        this.history = history;
        this.calculator = calculator;
        this.lifecycle = lifecycle;
        this.normalizer = normalizer;
        this.properties = properties;
        this.clock = clock;
    }

    // ========================================================================
    // AGREEMENTS - WRITE
    // ========================================================================

    /**
     * Create an agreement and its initial history entry.
     * Only field validation can fail; the starting status is whatever the caller chose.
     */
    @Transactional
    public Either<LedgerError, AgreementView> createAgreement(AgreementDraft draft, String user) {
        var violations = validate(draft);
        if (!violations.isEmpty()) {
            log.warn("Rejected agreement '{}': {}", draft.name(), violations);
            return Either.left(new ValidationError(violations));
        }

        var today = LocalDate.now(clock);
        var now = LocalDateTime.now(clock);
        var agreement = Agreement.fromDraft(nextAgreementId(today.getYear()), draft, today, now);

        agreements.insert(agreement);
        history.append(StatusTransition.initial(agreement.agreementId(), agreement.status(), now, user));

        log.info("Created agreement {} '{}' for {} in status {}",
            agreement.agreementId(), agreement.name(), agreement.customerName(), agreement.status().label());
        return Either.right(calculator.view(agreement, List.of()));
    }

    /**
     * Partial update. A differing status goes through the lifecycle state machine; all other
     * present fields are applied as given.
     */
    @Transactional
    public Either<LedgerError, AgreementView> updateAgreement(String agreementId, AgreementPatch patch, String user) {
        var found = agreements.findById(agreementId);
        if (found.isEmpty()) {
            return Either.left(new NotFound("Agreement", agreementId));
        }
        var violations = validate(patch);
        if (!violations.isEmpty()) {
            log.warn("Rejected update of {}: {}", agreementId, violations);
            return Either.left(new ValidationError(violations));
        }

        var today = LocalDate.now(clock);
        var now = LocalDateTime.now(clock);
        var patched = patch.applyTo(found.get());

        var result = patch.status()
            .map(target -> lifecycle.transition(patched, target, today, now, user))
            .orElseGet(() -> Either.right(AgreementLifecycle.StatusChange.unchanged(patched)));
        if (result.isLeft()) {
            log.warn("Rejected update of {}: {}", agreementId, result.getLeft().message());
            return Either.left(result.getLeft());
        }

        var change = result.get();
        var updated = change.agreement().touchedAt(now);
        agreements.update(updated);
        change.logEntry().ifPresent(entry -> {
            history.append(entry);
            log.info("Agreement {} moved {} -> {}", agreementId,
                entry.oldStatus().map(AgreementStatus::label).orElse("-"), entry.newStatus().label());
        });

        return Either.right(calculator.view(updated, purchaseOrders.findByAgreement(agreementId)));
    }

    /**
     * Delete an agreement with its purchase orders and history.
     * @return false if no agreement had this id
     */
    @Transactional
    public boolean deleteAgreement(String agreementId) {
        int pos = purchaseOrders.deleteByAgreement(agreementId);
        int entries = history.deleteByAgreement(agreementId);
        boolean removed = agreements.delete(agreementId);
        if (removed) {
            log.info("Deleted agreement {} with {} purchase orders and {} history entries", agreementId, pos, entries);
        }
        return removed;
    }

    // ========================================================================
    // AGREEMENTS - READ
    // ========================================================================

    @Transactional(readOnly = true)
    public Optional<AgreementView> findAgreement(String agreementId) {
        return agreements.findById(agreementId)
            .map(a -> calculator.view(a, purchaseOrders.findByAgreement(agreementId)));
    }

    /**
     * Agreements matching the filter, most recently updated first.
     */
    @Transactional(readOnly = true)
    public List<AgreementView> findAgreements(AgreementFilter filter) {
        var posByAgreement = purchaseOrders.findAll().stream()
            .collect(Collectors.groupingBy(PurchaseOrder::agreementId));
        return agreements.findByFilter(filter).stream()
            .map(a -> calculator.view(a, posByAgreement.getOrDefault(a.agreementId(), List.of())))
            .toList();
    }

    @Transactional(readOnly = true)
    public List<StatusTransition> statusHistory(String agreementId) {
        return history.findByAgreement(agreementId);
    }

    /**
     * Statuses the agreement may move to next; empty Optional when the agreement does not exist.
     */
    @Transactional(readOnly = true)
    public Optional<List<AgreementStatus>> allowedTransitions(String agreementId) {
        return agreements.findById(agreementId)
            .map(a -> lifecycle.allowedTransitions(a.status()));
    }

    public boolean isValidTransition(AgreementStatus from, AgreementStatus to) {
        return lifecycle.isValidTransition(from, to);
    }

    // ========================================================================
    // PURCHASE ORDERS
    // ========================================================================

    /**
     * Record a purchase order against its agreement's ceiling.
     * The agreement row stays locked until commit, so two purchase orders for the same
     * agreement cannot both pass the ceiling check.
     */
    @Transactional
    public Either<LedgerError, PurchaseOrder> createPurchaseOrder(
        PurchaseOrderDraft draft, boolean overrideCeiling, String user
    ) {
        var violations = validate(draft);
        if (!violations.isEmpty()) {
            log.warn("Rejected purchase order for {}: {}", draft.agreementId(), violations);
            return Either.left(new ValidationError(violations));
        }
        var locked = agreements.lockById(draft.agreementId());
        if (locked.isEmpty()) {
            return Either.left(new NotFound("Agreement", draft.agreementId()));
        }
        var agreement = locked.get();

        var currentTotal = calculator.totalPosValue(purchaseOrders.findByAgreement(agreement.agreementId()));
        var newValue = normalizer.normalize(draft.value(), draft.currency());
        var ceiling = calculator.ceilingNormalized(agreement);
        boolean exceeds = currentTotal.add(newValue).compareTo(ceiling) > 0;

        if (exceeds && !overrideCeiling) {
            var error = new CeilingExceeded(currentTotal, newValue, ceiling);
            log.warn("Rejected purchase order for {}: {}", agreement.agreementId(), error.message());
            return Either.left(error);
        }

        var poId = String.format("%s-%s-%03d",
            properties.purchaseOrder().idPrefix(),
            agreement.idSuffix(),
            purchaseOrders.nextSequence(agreement.agreementId()));
        var po = PurchaseOrder.fromDraft(poId, draft, agreement, LocalDateTime.now(clock));
        purchaseOrders.insert(po);

        if (exceeds) {
            log.warn("Purchase order {} takes {} over its ceiling (override by {})",
                poId, agreement.agreementId(), user != null ? user : "unknown");
        } else {
            log.info("Created purchase order {} for {}", poId, agreement.agreementId());
        }
        return Either.right(po);
    }

    /**
     * Remove a purchase order. Ceilings are never re-checked after the fact.
     */
    @Transactional
    public boolean deletePurchaseOrder(String poId) {
        boolean removed = purchaseOrders.delete(poId);
        if (removed) {
            log.info("Deleted purchase order {}", poId);
        }
        return removed;
    }

    @Transactional(readOnly = true)
    public Optional<PurchaseOrder> findPurchaseOrder(String poId) {
        return purchaseOrders.findById(poId);
    }

    /**
     * Purchase orders of an existing agreement, newest first.
     */
    @Transactional(readOnly = true)
    public Either<LedgerError, List<PurchaseOrder>> findPurchaseOrders(String agreementId) {
        if (agreements.findById(agreementId).isEmpty()) {
            return Either.left(new NotFound("Agreement", agreementId));
        }
        return Either.right(purchaseOrders.findByAgreement(agreementId));
    }

    /**
     * Purchase orders of every agreement, grouped by agreement id.
     */
    @Transactional(readOnly = true)
    public Map<String, List<PurchaseOrder>> purchaseOrdersByAgreement() {
        return purchaseOrders.findAll().stream()
            .collect(Collectors.groupingBy(PurchaseOrder::agreementId));
    }

    @Transactional(readOnly = true)
    public List<PurchaseOrder> findAllPurchaseOrders() {
        return purchaseOrders.findAll();
    }

    // ========================================================================
    // VALIDATION
    // ========================================================================

    /**
     * Field checks for a new agreement; empty when the draft is acceptable.
     */
    public List<ValidationResult> validate(AgreementDraft draft) {
        var results = new ArrayList<ValidationResult>();

        requireText(results, draft.name(), "name");
        requireText(results, draft.customerName(), "customerName");
        requireText(results, draft.accountManager(), "accountManager");
        if (draft.customerSegment() == null) {
            results.add(ValidationResult.required("customerSegment"));
        }
        if (draft.agreementType() == null) {
            results.add(ValidationResult.required("agreementType"));
        }
        if (draft.valueCeiling() == null) {
            results.add(ValidationResult.required("valueCeiling"));
        } else if (draft.valueCeiling().signum() <= 0) {
            results.add(ValidationResult.notPositive("valueCeiling"));
        }
        checkProbability(results, Optional.ofNullable(draft.probabilityToSign()));

        return results;
    }

    /**
     * Field checks for the components a patch supplies.
     */
    public List<ValidationResult> validate(AgreementPatch patch) {
        var results = new ArrayList<ValidationResult>();

        patch.name().ifPresent(v -> requireText(results, v, "name"));
        patch.customerName().ifPresent(v -> requireText(results, v, "customerName"));
        patch.accountManager().ifPresent(v -> requireText(results, v, "accountManager"));
        patch.valueCeiling()
            .filter(v -> v.signum() <= 0)
            .ifPresent(v -> results.add(ValidationResult.notPositive("valueCeiling")));
        checkProbability(results, patch.probabilityToSign());
        patch.clear().stream()
            .filter(field -> !AgreementPatch.CLEARABLE.contains(field))
            .sorted()
            .forEach(field -> results.add(ValidationResult.invalidValue("clear", field)));

        return results;
    }

    public List<ValidationResult> validate(PurchaseOrderDraft draft) {
        var results = new ArrayList<ValidationResult>();

        requireText(results, draft.agreementId(), "agreementId");
        if (draft.poDate() == null) {
            results.add(ValidationResult.required("poDate"));
        }
        if (draft.value() == null) {
            results.add(ValidationResult.required("value"));
        } else if (draft.value().signum() <= 0) {
            results.add(ValidationResult.notPositive("value"));
        }

        return results;
    }

    // ========================================================================
    // PRIVATE HELPERS
    // ========================================================================

    private String nextAgreementId(int year) {
        var prefix = properties.agreement().idPrefix();
        long seq = agreements.nextSequence(prefix.toLowerCase() + "-" + year);
        return String.format("%s-%d-%04d", prefix, year, seq);
    }

    private static void requireText(List<ValidationResult> results, String value, String field) {
        if (value == null || value.isBlank()) {
            results.add(ValidationResult.required(field));
        }
    }

    private static void checkProbability(List<ValidationResult> results, Optional<BigDecimal> probability) {
        probability
            .filter(p -> p.signum() < 0 || p.compareTo(MAX_PROBABILITY) > 0)
            .ifPresent(p -> results.add(ValidationResult.error(
                "OUT_OF_RANGE", "probabilityToSign must be between 0 and 100", "probabilityToSign")));
    }
}
