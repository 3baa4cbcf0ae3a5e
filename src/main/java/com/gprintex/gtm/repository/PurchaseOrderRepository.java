package com.gprintex.gtm.repository;

import com.gprintex.gtm.domain.PurchaseOrder;

import java.util.List;
import java.util.Optional;

/**
 * Storage for purchase orders. Ceiling rules are enforced by the ledger, not here.
 */
public interface PurchaseOrderRepository {

    void insert(PurchaseOrder purchaseOrder);

    Optional<PurchaseOrder> findById(String poId);

    /**
     * Purchase orders of one agreement, newest PO date first.
     */
    List<PurchaseOrder> findByAgreement(String agreementId);

    /**
     * All purchase orders, newest PO date first.
     */
    List<PurchaseOrder> findAll();

    /**
     * Next per-agreement sequence: one past the highest sequence currently stored, so deleting
     * a purchase order never makes the next id collide with a surviving one.
     */
    int nextSequence(String agreementId);

    boolean delete(String poId);

    int deleteByAgreement(String agreementId);
}
