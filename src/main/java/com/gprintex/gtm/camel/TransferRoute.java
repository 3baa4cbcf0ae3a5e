package com.gprintex.gtm.camel;

import org.apache.camel.builder.RouteBuilder;
import org.springframework.stereotype.Component;

/**
 * Camel routes for CSV imports. The body is the raw CSV text, the {@code sourceSystem}
 * header names the origin, and the reply body is the {@code ImportResult}.
 */
@Component
public class TransferRoute extends RouteBuilder {

    public static final String AGREEMENT_IMPORT = "direct:agreement-import";
    public static final String PO_IMPORT = "direct:po-import";
    public static final String SOURCE_SYSTEM_HEADER = "sourceSystem";

    @Override
    public void configure() throws Exception {

        // Rejected rows are part of the result; anything thrown goes straight back to the caller
        errorHandler(noErrorHandler());

        // ====================================================================
        // AGREEMENT IMPORT
        // ====================================================================
        from(AGREEMENT_IMPORT)
            .routeId("agreement-import")
            .log("Importing agreements from ${header.sourceSystem}")
            .bean("transferService", "importAgreements(${body}, ${header.sourceSystem})")
            .to("direct:import-complete");

        // ====================================================================
        // PURCHASE ORDER IMPORT
        // ====================================================================
        from(PO_IMPORT)
            .routeId("po-import")
            .log("Importing purchase orders from ${header.sourceSystem}")
            .bean("transferService", "importPurchaseOrders(${body}, ${header.sourceSystem})")
            .to("direct:import-complete");

        // ====================================================================
        // COMPLETION
        // ====================================================================
        from("direct:import-complete")
            .routeId("import-complete")
            .choice()
                .when(simple("${body.hasErrors}"))
                    .log("Import of ${body.entityType} finished with ${body.errorCount} rejected rows of ${body.recordCount}")
                .otherwise()
                    .log("Import of ${body.entityType} finished: ${body.successCount} rows")
            .end();
    }
}
