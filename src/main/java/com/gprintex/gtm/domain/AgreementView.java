package com.gprintex.gtm.domain;

/**
 * An agreement as returned by every read path: stored fields plus freshly derived metrics.
 */
public record AgreementView(Agreement agreement, DerivedMetrics metrics) {

    public String agreementId() {
        return agreement.agreementId();
    }

    public AgreementStatus status() {
        return agreement.status();
    }

    public RiskFlag riskFlag() {
        return metrics.riskFlag();
    }
}
