package com.gprintex.gtm.api;

import com.gprintex.gtm.domain.Agreement;
import com.gprintex.gtm.domain.AgreementDraft;
import com.gprintex.gtm.domain.AgreementPatch;
import com.gprintex.gtm.domain.AgreementStatus;
import com.gprintex.gtm.domain.AgreementType;
import com.gprintex.gtm.domain.AgreementView;
import com.gprintex.gtm.domain.Currency;
import com.gprintex.gtm.domain.CustomerSegment;
import com.gprintex.gtm.domain.LedgerError;
import com.gprintex.gtm.domain.PurchaseOrderDraft;
import com.gprintex.gtm.domain.ValidationResult;
import com.gprintex.gtm.service.CurrencyNormalizer;
import com.gprintex.gtm.service.DerivedFieldCalculator;
import com.gprintex.gtm.service.FixedRateTable;
import com.gprintex.gtm.service.LedgerService;
import io.vavr.control.Either;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest({AgreementController.class, PurchaseOrderController.class})
class AgreementControllerTests {

    private static final LocalDate TODAY = LocalDate.of(2026, 10, 19);

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private LedgerService ledger;

    private static AgreementView view(AgreementStatus status) {
        var calculator = new DerivedFieldCalculator(new CurrencyNormalizer(new FixedRateTable()),
            Clock.fixed(TODAY.atStartOfDay().toInstant(ZoneOffset.UTC), ZoneOffset.UTC));
        var draft = AgreementDraft.of("Smart Parking", "Jeddah Municipality", CustomerSegment.SMART_CITY,
            AgreementType.FRAMEWORK, new BigDecimal("1000"), Currency.USD, "Sara").withStatus(status);
        return calculator.view(Agreement.fromDraft("AGR-2026-0001", draft, TODAY, TODAY.atStartOfDay()), List.of());
    }

    @Test
    void create_shouldReturnCreatedView() throws Exception {
        when(ledger.createAgreement(any(AgreementDraft.class), eq("sara")))
            .thenReturn(Either.right(view(AgreementStatus.PIPELINE)));

        mockMvc.perform(post("/api/v1/agreements")
                .header("X-User-Id", "sara")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"name": "Smart Parking", "customerName": "Jeddah Municipality",
                     "customerSegment": "Smart City", "agreementType": "Framework",
                     "valueCeiling": 1000, "currency": "USD", "accountManager": "Sara"}
                    """))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.agreement.agreementId").value("AGR-2026-0001"))
            .andExpect(jsonPath("$.agreement.status").value("Pipeline"))
            .andExpect(jsonPath("$.agreement.customerSegment").value("SmartCity"))
            .andExpect(jsonPath("$.metrics.ceilingNormalized").value(3750))
            .andExpect(jsonPath("$.metrics.riskFlag").value("Green"));
    }

    @Test
    void create_withoutUserHeaderShouldPassNullUser() throws Exception {
        when(ledger.createAgreement(any(AgreementDraft.class), isNull()))
            .thenReturn(Either.left(new LedgerError.ValidationError(List.of(ValidationResult.required("name")))));

        mockMvc.perform(post("/api/v1/agreements")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"customerName\": \"Jeddah Municipality\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value("VALIDATION_FAILED"))
            .andExpect(jsonPath("$.violations[0].fieldName").value("name"));
    }

    @Test
    void update_invalidTransitionShouldConflict() throws Exception {
        when(ledger.updateAgreement(eq("AGR-2026-0001"), any(AgreementPatch.class), isNull()))
            .thenReturn(Either.left(new LedgerError.InvalidTransition(AgreementStatus.PIPELINE, AgreementStatus.SIGNED)));

        mockMvc.perform(patch("/api/v1/agreements/AGR-2026-0001")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"status\": \"Signed\"}"))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.error").value("Invalid status transition from Pipeline to Signed"));
    }

    @Test
    void update_unknownAgreementShouldBeNotFound() throws Exception {
        when(ledger.updateAgreement(eq("AGR-2026-0404"), any(AgreementPatch.class), any()))
            .thenReturn(Either.left(new LedgerError.NotFound("Agreement", "AGR-2026-0404")));

        mockMvc.perform(patch("/api/v1/agreements/AGR-2026-0404")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"notes\": \"x\"}"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.code").value("NOT_FOUND"));
    }

    @Test
    void getById_shouldReturnNotFoundForUnknownId() throws Exception {
        when(ledger.findAgreement("AGR-2026-0404")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/v1/agreements/AGR-2026-0404"))
            .andExpect(status().isNotFound());
    }

    @Test
    void list_shouldRejectUnknownStatusFilter() throws Exception {
        mockMvc.perform(get("/api/v1/agreements").param("status", "Negotiation"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.violations[0].errorCode").value("INVALID_VALUE"));

        verify(ledger, never()).findAgreements(any());
    }

    @Test
    void list_shouldReturnMatchingAgreements() throws Exception {
        when(ledger.findAgreements(any())).thenReturn(List.of(view(AgreementStatus.DRAFT)));

        mockMvc.perform(get("/api/v1/agreements").param("status", "draft").param("region", "Western"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0].agreement.status").value("Draft"));
    }

    @Test
    void delete_shouldMapMissingRowToNotFound() throws Exception {
        when(ledger.deleteAgreement("AGR-2026-0001")).thenReturn(true);
        when(ledger.deleteAgreement("AGR-2026-0404")).thenReturn(false);

        mockMvc.perform(delete("/api/v1/agreements/AGR-2026-0001")).andExpect(status().isNoContent());
        mockMvc.perform(delete("/api/v1/agreements/AGR-2026-0404")).andExpect(status().isNotFound());
    }

    @Test
    void transitions_shouldListAllowedTargets() throws Exception {
        when(ledger.allowedTransitions("AGR-2026-0001"))
            .thenReturn(Optional.of(AgreementStatus.SIGNED.allowedTransitions()));

        mockMvc.perform(get("/api/v1/agreements/AGR-2026-0001/transitions"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0]").value("Active"))
            .andExpect(jsonPath("$[1]").value("Terminated"));
    }

    @Test
    void validTransition_shouldCheckPair() throws Exception {
        when(ledger.isValidTransition(AgreementStatus.SIGNATURE_PENDING, AgreementStatus.SIGNED)).thenReturn(true);

        mockMvc.perform(get("/api/v1/agreements/transitions/valid")
                .param("from", "SignaturePending")
                .param("to", "Signed"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.valid").value(true));

        mockMvc.perform(get("/api/v1/agreements/transitions/valid")
                .param("from", "Someday")
                .param("to", "Signed"))
            .andExpect(status().isBadRequest());
    }

    @Test
    void createPurchaseOrder_overCeilingShouldBeUnprocessable() throws Exception {
        when(ledger.createPurchaseOrder(any(PurchaseOrderDraft.class), anyBoolean(), any()))
            .thenReturn(Either.left(new LedgerError.CeilingExceeded(
                new BigDecimal("750"), new BigDecimal("3375"), new BigDecimal("3750"))));

        mockMvc.perform(post("/api/v1/agreements/AGR-2026-0001/pos")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"poDate\": \"2026-10-19\", \"value\": 900, \"currency\": \"USD\"}"))
            .andExpect(status().isUnprocessableEntity())
            .andExpect(jsonPath("$.code").value("CEILING_EXCEEDED"))
            .andExpect(jsonPath("$.ceiling").value(3750));

        verify(ledger).createPurchaseOrder(
            eq(PurchaseOrderDraft.of("AGR-2026-0001", TODAY, new BigDecimal("900"), Currency.USD)), eq(false), isNull());
    }

    @Test
    void createPurchaseOrder_shouldPassOverrideFlag() throws Exception {
        when(ledger.createPurchaseOrder(any(PurchaseOrderDraft.class), eq(true), eq("sara")))
            .thenReturn(Either.left(new LedgerError.NotFound("Agreement", "AGR-2026-0404")));

        mockMvc.perform(post("/api/v1/agreements/AGR-2026-0404/pos")
                .param("overrideCeiling", "true")
                .header("X-User-Id", "sara")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"poDate\": \"2026-10-19\", \"value\": 900}"))
            .andExpect(status().isNotFound());
    }
}
