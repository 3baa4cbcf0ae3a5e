package com.gprintex.gtm.api;

import com.gprintex.gtm.domain.AgreementDraft;
import com.gprintex.gtm.domain.AgreementPatch;
import com.gprintex.gtm.domain.AgreementStatus;
import com.gprintex.gtm.service.LedgerService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * REST API controller for framework agreements and their status lifecycle.
 */
@RestController
@RequestMapping("/api/v1/agreements")
public class AgreementController {

    private final LedgerService ledger;

    public AgreementController(LedgerService ledger) {
        this.ledger = ledger;
    }

    @PostMapping
    public ResponseEntity<?> create(
        @RequestBody AgreementDraft draft,
        @RequestHeader(value = "X-User-Id", required = false) String userId
    ) {
        return ledger.createAgreement(draft, userId).<ResponseEntity<?>>fold(
            LedgerResponses::error,
            view -> ResponseEntity.status(HttpStatus.CREATED).body(view)
        );
    }

    @GetMapping
    public ResponseEntity<?> list(FilterParams params) {
        return params.toFilter().<ResponseEntity<?>>fold(
            LedgerResponses::error,
            filter -> ResponseEntity.ok(ledger.findAgreements(filter))
        );
    }

    @GetMapping("/{id}")
    public ResponseEntity<?> getById(@PathVariable String id) {
        return ledger.findAgreement(id)
            .<ResponseEntity<?>>map(ResponseEntity::ok)
            .orElse(ResponseEntity.notFound().build());
    }

    @PatchMapping("/{id}")
    public ResponseEntity<?> update(
        @PathVariable String id,
        @RequestBody AgreementPatch patch,
        @RequestHeader(value = "X-User-Id", required = false) String userId
    ) {
        return ledger.updateAgreement(id, patch, userId).<ResponseEntity<?>>fold(
            LedgerResponses::error,
            ResponseEntity::ok
        );
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable String id) {
        return ledger.deleteAgreement(id)
            ? ResponseEntity.noContent().build()
            : ResponseEntity.notFound().build();
    }

    @GetMapping("/{id}/history")
    public ResponseEntity<?> history(@PathVariable String id) {
        return ledger.findAgreement(id)
            .<ResponseEntity<?>>map(view -> ResponseEntity.ok(ledger.statusHistory(id)))
            .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping("/{id}/transitions")
    public ResponseEntity<?> allowedTransitions(@PathVariable String id) {
        return ledger.allowedTransitions(id)
            .<ResponseEntity<?>>map(ResponseEntity::ok)
            .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping("/transitions/valid")
    public ResponseEntity<?> isValidTransition(@RequestParam String from, @RequestParam String to) {
        var fromStatus = AgreementStatus.fromLabel(from);
        var toStatus = AgreementStatus.fromLabel(to);
        if (fromStatus.isEmpty() || toStatus.isEmpty()) {
            return LedgerResponses.badRequest("Unknown status: " + (fromStatus.isEmpty() ? from : to));
        }
        return ResponseEntity.ok(Map.of(
            "from", fromStatus.get(),
            "to", toStatus.get(),
            "valid", ledger.isValidTransition(fromStatus.get(), toStatus.get())
        ));
    }
}
