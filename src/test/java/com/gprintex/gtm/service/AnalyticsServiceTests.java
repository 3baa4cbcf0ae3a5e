package com.gprintex.gtm.service;

import com.gprintex.gtm.domain.Agreement;
import com.gprintex.gtm.domain.AgreementDraft;
import com.gprintex.gtm.domain.AgreementStatus;
import com.gprintex.gtm.domain.AgreementType;
import com.gprintex.gtm.domain.AgreementView;
import com.gprintex.gtm.domain.AgingBucket;
import com.gprintex.gtm.domain.Currency;
import com.gprintex.gtm.domain.CustomerSegment;
import com.gprintex.gtm.domain.PurchaseOrder;
import com.gprintex.gtm.domain.PurchaseOrderDraft;
import com.gprintex.gtm.domain.RiskFlag;
import com.gprintex.gtm.repository.AgreementRepository.AgreementFilter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class AnalyticsServiceTests {

    private static final LocalDate TODAY = LocalDate.of(2026, 10, 19);

    private final CurrencyNormalizer normalizer = new CurrencyNormalizer(new FixedRateTable());
    private final DerivedFieldCalculator calculator = new DerivedFieldCalculator(normalizer,
        Clock.fixed(TODAY.atStartOfDay().toInstant(ZoneOffset.UTC), ZoneOffset.UTC));

    private LedgerService ledger;
    private AnalyticsService analytics;

    private final List<AgreementView> views = new ArrayList<>();
    private final List<PurchaseOrder> purchaseOrders = new ArrayList<>();
    private int sequence;

    @BeforeEach
    void setUp() {
        ledger = mock(LedgerService.class);
        analytics = new AnalyticsService(ledger, normalizer);

        // Pipeline: 1,000,000 SAR @ 50%, 100,000 USD with no probability
        add(agreement("Sara", "1000000", Currency.SAR, AgreementStatus.PIPELINE, null, "50"));
        add(agreement("Omar", "100000", Currency.USD, AgreementStatus.LEGAL_REVIEW, null, null));

        // Signed 120 days ago, nothing drawn: Red
        add(agreement("Sara", "200000", Currency.SAR, AgreementStatus.SIGNED, TODAY.minusDays(120), null));

        // Active 45 days, 50,000 SAR drawn on 100,000 SAR ceiling: Green
        var active = agreement("Omar", "100000", Currency.SAR, AgreementStatus.ACTIVE, TODAY.minusDays(45), null);
        add(active, po(active, "2026-09-15", "30000", Currency.SAR), po(active, "2026-10-01", "20000", Currency.SAR));

        // Terminated agreements count for their manager but never as signed
        add(agreement("Lina", "500000", Currency.EUR, AgreementStatus.TERMINATED, null, null));

        when(ledger.findAgreements(any())).thenReturn(views);
        when(ledger.purchaseOrdersByAgreement()).thenReturn(Map.of(
            active.agreementId(), purchaseOrders));
    }

    private Agreement agreement(
        String manager, String ceiling, Currency currency, AgreementStatus status, LocalDate signedOn, String probability
    ) {
        sequence++;
        var draft = AgreementDraft.of("Agreement " + sequence, "Customer " + sequence,
                CustomerSegment.ENTERPRISE, AgreementType.FRAMEWORK, new BigDecimal(ceiling), currency, manager)
            .withStatus(status)
            .withSignedDate(signedOn)
            .withProbabilityToSign(probability != null ? new BigDecimal(probability) : null);
        return Agreement.fromDraft(String.format("AGR-2026-%04d", sequence), draft, TODAY, TODAY.atStartOfDay());
    }

    private PurchaseOrder po(Agreement parent, String date, String value, Currency currency) {
        var draft = PurchaseOrderDraft.of(parent.agreementId(), LocalDate.parse(date), new BigDecimal(value), currency);
        var poId = String.format("PO-%s-%03d", parent.idSuffix(), purchaseOrders.size() + 1);
        var po = PurchaseOrder.fromDraft(poId, draft, parent, TODAY.atStartOfDay());
        purchaseOrders.add(po);
        return po;
    }

    private void add(Agreement agreement, PurchaseOrder... pos) {
        views.add(calculator.view(agreement, List.of(pos)));
    }

    @Test
    void pipeline_shouldSummarizePreSignatureAgreements() {
        var stats = analytics.pipeline(AgreementFilter.all());

        assertEquals(2, stats.totalCount());
        assertEquals(List.of("Pipeline", "Draft", "LegalReview", "SignaturePending"), List.copyOf(stats.byStatus().keySet()));
        assertEquals(1L, stats.byStatus().get("Pipeline"));
        assertEquals(0L, stats.byStatus().get("Draft"));
        assertEquals(1L, stats.byStatus().get("LegalReview"));
        assertEquals(0, new BigDecimal("1375000").compareTo(stats.totalPotentialCeiling()));
        assertEquals(0, new BigDecimal("25").compareTo(stats.averageProbability()));
        assertEquals(0, new BigDecimal("500000").compareTo(stats.weightedValue()));
    }

    @Test
    void pipeline_withNoAgreementsShouldBeZero() {
        when(ledger.findAgreements(any())).thenReturn(List.of());

        var stats = analytics.pipeline(AgreementFilter.all());

        assertEquals(0, stats.totalCount());
        assertEquals(0, BigDecimal.ZERO.compareTo(stats.averageProbability()));
        assertEquals(4, stats.byStatus().size());
    }

    @Test
    void monetization_shouldSummarizeSignedAgreements() {
        var stats = analytics.monetization(AgreementFilter.all());

        assertEquals(2, stats.agreementsCount());
        assertEquals(0, new BigDecimal("300000").compareTo(stats.totalSignedCeiling()));
        assertEquals(0, new BigDecimal("50000").compareTo(stats.totalMonetizedValue()));
        assertEquals(0, new BigDecimal("16.6667").compareTo(stats.overallUtilization()));
        assertEquals(1, stats.agreementsWithoutPos());
        assertEquals(Map.of("Green", 1L, "Amber", 0L, "Red", 1L), stats.byRisk());
    }

    @Test
    void accountManagers_shouldSortByMonetizedValue() {
        var stats = analytics.accountManagers(AgreementFilter.all());

        assertEquals(List.of("Omar", "Sara", "Lina"), stats.stream().map(s -> s.accountManager()).toList());

        var omar = stats.get(0);
        assertEquals(2, omar.totalAgreements());
        assertEquals(1, omar.signedAgreements());
        assertEquals(0, new BigDecimal("50").compareTo(omar.utilization()));

        var lina = stats.get(2);
        assertEquals(1, lina.totalAgreements());
        assertEquals(0, lina.signedAgreements());
        assertEquals(0, BigDecimal.ZERO.compareTo(lina.utilization()));
    }

    @Test
    void agingRiskMatrix_shouldCountSignedAgreements() {
        var matrix = analytics.agingRiskMatrix(AgreementFilter.all());

        assertEquals(4, matrix.cells().size());
        assertEquals(1, matrix.count(AgingBucket.OVER_90, RiskFlag.RED));
        assertEquals(1, matrix.count(AgingBucket.DAYS_30_60, RiskFlag.GREEN));
        assertEquals(0, matrix.count(AgingBucket.UNDER_30, RiskFlag.GREEN));
        long total = matrix.cells().values().stream()
            .flatMap(row -> row.values().stream())
            .mapToLong(Long::longValue)
            .sum();
        assertEquals(2, total);
    }

    @Test
    void forecast_shouldGroupPurchaseOrdersByMonth() {
        var forecast = analytics.forecast(AgreementFilter.all());

        assertEquals(0, new BigDecimal("500000").compareTo(forecast.expectedPipelineValue()));
        assertEquals(List.of("2026-09", "2026-10"), List.copyOf(forecast.monthlyPoValues().keySet()));
        assertEquals(0, new BigDecimal("30000").compareTo(forecast.monthlyPoValues().get("2026-09")));
        assertEquals(0, new BigDecimal("20000").compareTo(forecast.monthlyPoValues().get("2026-10")));
    }

    @Test
    void forecast_shouldIgnorePurchaseOrdersOutsideFilter() {
        when(ledger.findAgreements(any())).thenReturn(views.subList(0, 2));

        var forecast = analytics.forecast(AgreementFilter.all().withAccountManager("Sara"));

        assertTrue(forecast.monthlyPoValues().isEmpty());
    }
}
