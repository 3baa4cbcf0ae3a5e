package com.gprintex.gtm.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Application configuration properties. Business thresholds and FX rates are
 * deliberately not configurable.
 */
@ConfigurationProperties(prefix = "gtm")
public record GtmProperties(
    AgreementProperties agreement,
    PurchaseOrderProperties purchaseOrder,
    TransferProperties transfer
) {
    public GtmProperties {
        agreement = agreement != null ? agreement : new AgreementProperties(null);
        purchaseOrder = purchaseOrder != null ? purchaseOrder : new PurchaseOrderProperties(null);
        transfer = transfer != null ? transfer : new TransferProperties(null);
    }

    public static GtmProperties defaults() {
        return new GtmProperties(null, null, null);
    }

    /**
     * Agreement ids are {@code <idPrefix>-<year>-<4-digit sequence>}.
     */
    public record AgreementProperties(String idPrefix) {
        public AgreementProperties {
            if (idPrefix == null || idPrefix.isBlank()) {
                idPrefix = "AGR";
            }
        }
    }

    /**
     * Purchase order ids are {@code <idPrefix>-<agreement suffix>-<3-digit sequence>}.
     */
    public record PurchaseOrderProperties(String idPrefix) {
        public PurchaseOrderProperties {
            if (idPrefix == null || idPrefix.isBlank()) {
                idPrefix = "PO";
            }
        }
    }

    public record TransferProperties(String sourceSystem) {
        public TransferProperties {
            if (sourceSystem == null || sourceSystem.isBlank()) {
                sourceSystem = "CSV";
            }
        }
    }
}
