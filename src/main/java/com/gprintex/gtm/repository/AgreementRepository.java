package com.gprintex.gtm.repository;

import com.gprintex.gtm.domain.Agreement;
import com.gprintex.gtm.domain.AgreementStatus;
import com.gprintex.gtm.domain.CustomerSegment;

import java.util.List;
import java.util.Optional;

/**
 * Storage for agreements and the per-year agreement id counter.
 */
public interface AgreementRepository {

    // ========================================================================
    // WRITE OPERATIONS
    // ========================================================================

    void insert(Agreement agreement);

    /**
     * Overwrite every stored column of an existing agreement.
     * @return false if no row matched the id
     */
    boolean update(Agreement agreement);

    /**
     * @return true if a row was removed
     */
    boolean delete(String agreementId);

    /**
     * Increment and return the named counter, creating it at 1 on first use.
     */
    long nextSequence(String sequenceName);

    // ========================================================================
    // QUERY OPERATIONS
    // ========================================================================

    Optional<Agreement> findById(String agreementId);

    /**
     * Find and row-lock an agreement until the surrounding transaction ends.
     * Serializes concurrent purchase order inserts against the same ceiling.
     */
    Optional<Agreement> lockById(String agreementId);

    /**
     * Agreements matching the filter, most recently updated first.
     */
    List<Agreement> findByFilter(AgreementFilter filter);

    // ========================================================================
    // FILTER RECORD
    // ========================================================================

    record AgreementFilter(
        Optional<AgreementStatus> status,
        Optional<String> accountManager,
        Optional<String> customerName,
        Optional<String> region,
        Optional<String> industry,
        Optional<CustomerSegment> customerSegment
    ) {
        public AgreementFilter {
            status = status != null ? status : Optional.empty();
            accountManager = accountManager != null ? accountManager : Optional.empty();
            customerName = customerName != null ? customerName : Optional.empty();
            region = region != null ? region : Optional.empty();
            industry = industry != null ? industry : Optional.empty();
            customerSegment = customerSegment != null ? customerSegment : Optional.empty();
        }

        public static AgreementFilter all() {
            return new AgreementFilter(
                Optional.empty(),
                Optional.empty(),
                Optional.empty(),
                Optional.empty(),
                Optional.empty(),
                Optional.empty()
            );
        }

        public AgreementFilter withStatus(AgreementStatus s) {
            return new AgreementFilter(Optional.of(s), accountManager, customerName, region, industry, customerSegment);
        }

        public AgreementFilter withAccountManager(String am) {
            return new AgreementFilter(status, Optional.of(am), customerName, region, industry, customerSegment);
        }

        /**
         * Substring match on customer name.
         */
        public AgreementFilter withCustomerName(String name) {
            return new AgreementFilter(status, accountManager, Optional.of(name), region, industry, customerSegment);
        }

        public AgreementFilter withRegion(String r) {
            return new AgreementFilter(status, accountManager, customerName, Optional.of(r), industry, customerSegment);
        }

        public AgreementFilter withIndustry(String i) {
            return new AgreementFilter(status, accountManager, customerName, region, Optional.of(i), customerSegment);
        }

        public AgreementFilter withCustomerSegment(CustomerSegment segment) {
            return new AgreementFilter(status, accountManager, customerName, region, industry, Optional.of(segment));
        }
    }
}
