package com.gprintex.gtm.service;

import com.gprintex.gtm.config.GtmConfiguration;
import com.gprintex.gtm.domain.AgreementDraft;
import com.gprintex.gtm.domain.AgreementPatch;
import com.gprintex.gtm.domain.AgreementStatus;
import com.gprintex.gtm.domain.AgreementType;
import com.gprintex.gtm.domain.Currency;
import com.gprintex.gtm.domain.CustomerSegment;
import com.gprintex.gtm.domain.LedgerError;
import com.gprintex.gtm.domain.PurchaseOrder;
import com.gprintex.gtm.domain.PurchaseOrderDraft;
import com.gprintex.gtm.repository.JdbcAgreementRepository;
import com.gprintex.gtm.repository.JdbcPurchaseOrderRepository;
import com.gprintex.gtm.repository.StatusHistoryRepository;
import io.vavr.control.Either;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.JdbcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;

/**
 * Transaction boundaries of the ledger as wired by Spring. Tests commit for real,
 * so the tables are cleared after each one.
 */
@JdbcTest
@Import({
    LedgerService.class,
    JdbcAgreementRepository.class,
    JdbcPurchaseOrderRepository.class,
    DerivedFieldCalculator.class,
    AgreementLifecycle.class,
    CurrencyNormalizer.class,
    GtmConfiguration.class
})
@Transactional(propagation = Propagation.NOT_SUPPORTED)
class LedgerTransactionTests {

    @Autowired
    private LedgerService ledger;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @MockBean
    private StatusHistoryRepository history;

    @AfterEach
    void clearTables() {
        jdbcTemplate.update("DELETE FROM pos");
        jdbcTemplate.update("DELETE FROM status_history");
        jdbcTemplate.update("DELETE FROM agreements");
        jdbcTemplate.update("DELETE FROM sequences");
    }

    private static AgreementDraft draft(String ceiling) {
        return AgreementDraft.of("Branch Scanners", "Riyad Bank", CustomerSegment.ENTERPRISE,
            AgreementType.FRAMEWORK, new BigDecimal(ceiling), Currency.SAR, "Noura");
    }

    private int agreementRows() {
        return jdbcTemplate.queryForObject("SELECT COUNT(*) FROM agreements", Integer.class);
    }

    @Test
    void createAgreement_shouldRollBackWhenHistoryAppendFails() {
        doThrow(new DataAccessResourceFailureException("history down")).when(history).append(any());

        assertThrows(DataAccessResourceFailureException.class, () -> ledger.createAgreement(draft("1000"), "noura"));

        assertEquals(0, agreementRows());
    }

    @Test
    void updateAgreement_shouldKeepStatusWhenHistoryAppendFails() {
        var id = ledger.createAgreement(draft("1000"), "noura").get().agreementId();
        doThrow(new DataAccessResourceFailureException("history down")).when(history).append(any());

        assertThrows(DataAccessResourceFailureException.class,
            () -> ledger.updateAgreement(id, AgreementPatch.empty().withStatus(AgreementStatus.DRAFT), "noura"));

        var status = jdbcTemplate.queryForObject(
            "SELECT status FROM agreements WHERE agreement_id = ?", String.class, id);
        assertEquals(AgreementStatus.PIPELINE.label(), status);
    }

    @Test
    void createPurchaseOrder_concurrentDrawsShouldNotBothPassCeiling() throws Exception {
        var id = ledger.createAgreement(
            draft("1000").withStatus(AgreementStatus.SIGNED).withSignedDate(LocalDate.of(2026, 1, 15)),
            "noura").get().agreementId();

        var start = new CountDownLatch(1);
        Callable<Either<LedgerError, PurchaseOrder>> draw = () -> {
            start.await();
            return ledger.createPurchaseOrder(
                PurchaseOrderDraft.of(id, LocalDate.of(2026, 2, 1), new BigDecimal("600"), Currency.SAR), false, "noura");
        };

        var executor = Executors.newFixedThreadPool(2);
        try {
            List<Future<Either<LedgerError, PurchaseOrder>>> futures = new ArrayList<>();
            futures.add(executor.submit(draw));
            futures.add(executor.submit(draw));
            start.countDown();

            long accepted = 0;
            long rejected = 0;
            for (var future : futures) {
                var result = future.get(10, TimeUnit.SECONDS);
                if (result.isRight()) {
                    accepted++;
                } else {
                    assertInstanceOf(LedgerError.CeilingExceeded.class, result.getLeft());
                    rejected++;
                }
            }
            assertEquals(1, accepted);
            assertEquals(1, rejected);
        } finally {
            executor.shutdownNow();
        }

        assertEquals(1, jdbcTemplate.queryForObject("SELECT COUNT(*) FROM pos", Integer.class));
    }
}
