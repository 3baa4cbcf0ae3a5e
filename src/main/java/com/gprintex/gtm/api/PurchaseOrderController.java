package com.gprintex.gtm.api;

import com.gprintex.gtm.domain.PurchaseOrderDraft;
import com.gprintex.gtm.service.LedgerService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST API controller for purchase orders drawn against agreement ceilings.
 */
@RestController
@RequestMapping("/api/v1")
public class PurchaseOrderController {

    private final LedgerService ledger;

    public PurchaseOrderController(LedgerService ledger) {
        this.ledger = ledger;
    }

    @GetMapping("/agreements/{agreementId}/pos")
    public ResponseEntity<?> listForAgreement(@PathVariable String agreementId) {
        return ledger.findPurchaseOrders(agreementId).<ResponseEntity<?>>fold(
            LedgerResponses::error,
            ResponseEntity::ok
        );
    }

    /**
     * The path agreement id wins over any id in the body.
     */
    @PostMapping("/agreements/{agreementId}/pos")
    public ResponseEntity<?> create(
        @PathVariable String agreementId,
        @RequestBody PurchaseOrderDraft draft,
        @RequestParam(defaultValue = "false") boolean overrideCeiling,
        @RequestHeader(value = "X-User-Id", required = false) String userId
    ) {
        return ledger.createPurchaseOrder(draft.forAgreement(agreementId), overrideCeiling, userId)
            .<ResponseEntity<?>>fold(
                LedgerResponses::error,
                po -> ResponseEntity.status(HttpStatus.CREATED).body(po)
            );
    }

    @GetMapping("/pos/{poId}")
    public ResponseEntity<?> getById(@PathVariable String poId) {
        return ledger.findPurchaseOrder(poId)
            .<ResponseEntity<?>>map(ResponseEntity::ok)
            .orElse(ResponseEntity.notFound().build());
    }

    @DeleteMapping("/pos/{poId}")
    public ResponseEntity<Void> delete(@PathVariable String poId) {
        return ledger.deletePurchaseOrder(poId)
            ? ResponseEntity.noContent().build()
            : ResponseEntity.notFound().build();
    }
}
