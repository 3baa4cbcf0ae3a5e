package com.gprintex.gtm.repository;

import com.gprintex.gtm.domain.StatusTransition;

import java.util.List;

/**
 * Append-only status history. Entries are only removed together with their agreement.
 */
public interface StatusHistoryRepository {

    void append(StatusTransition transition);

    /**
     * History of one agreement in the order it happened.
     */
    List<StatusTransition> findByAgreement(String agreementId);

    int deleteByAgreement(String agreementId);
}
