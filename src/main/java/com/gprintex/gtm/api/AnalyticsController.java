package com.gprintex.gtm.api;

import com.gprintex.gtm.repository.AgreementRepository.AgreementFilter;
import com.gprintex.gtm.service.AnalyticsService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.function.Function;

/**
 * Read-only portfolio statistics, scoped by the same filters as the agreement list.
 */
@RestController
@RequestMapping("/api/v1/analytics")
public class AnalyticsController {

    private final AnalyticsService analytics;

    public AnalyticsController(AnalyticsService analytics) {
        this.analytics = analytics;
    }

    @GetMapping("/pipeline")
    public ResponseEntity<?> pipeline(FilterParams params) {
        return respond(params, analytics::pipeline);
    }

    @GetMapping("/monetization")
    public ResponseEntity<?> monetization(FilterParams params) {
        return respond(params, analytics::monetization);
    }

    @GetMapping("/account-managers")
    public ResponseEntity<?> accountManagers(FilterParams params) {
        return respond(params, analytics::accountManagers);
    }

    @GetMapping("/aging-risk")
    public ResponseEntity<?> agingRisk(FilterParams params) {
        return respond(params, analytics::agingRiskMatrix);
    }

    @GetMapping("/forecast")
    public ResponseEntity<?> forecast(FilterParams params) {
        return respond(params, analytics::forecast);
    }

    private static ResponseEntity<?> respond(FilterParams params, Function<AgreementFilter, ?> query) {
        return params.toFilter().<ResponseEntity<?>>fold(
            LedgerResponses::error,
            filter -> ResponseEntity.ok(query.apply(filter))
        );
    }
}
