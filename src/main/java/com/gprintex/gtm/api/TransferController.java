package com.gprintex.gtm.api;

import com.gprintex.gtm.camel.TransferRoute;
import com.gprintex.gtm.domain.ImportResult;
import com.gprintex.gtm.service.TransferService;
import org.apache.camel.ProducerTemplate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * CSV import and export. Imports run through the Camel import routes.
 */
@RestController
@RequestMapping("/api/v1/transfer")
public class TransferController {

    private static final Logger log = LoggerFactory.getLogger(TransferController.class);

    static final String TEXT_CSV = "text/csv";

    private final TransferService transferService;
    private final ProducerTemplate producerTemplate;

    public TransferController(TransferService transferService, ProducerTemplate producerTemplate) {
        this.transferService = transferService;
        this.producerTemplate = producerTemplate;
    }

    @PostMapping(value = "/agreements", consumes = {TEXT_CSV, MediaType.TEXT_PLAIN_VALUE})
    public ResponseEntity<ImportResult> importAgreements(
        @RequestBody String csv,
        @RequestHeader(value = "X-Source-System", required = false) String sourceSystem
    ) {
        return ResponseEntity.ok(runImport(TransferRoute.AGREEMENT_IMPORT, csv, sourceSystem));
    }

    @PostMapping(value = "/pos", consumes = {TEXT_CSV, MediaType.TEXT_PLAIN_VALUE})
    public ResponseEntity<ImportResult> importPurchaseOrders(
        @RequestBody String csv,
        @RequestHeader(value = "X-Source-System", required = false) String sourceSystem
    ) {
        return ResponseEntity.ok(runImport(TransferRoute.PO_IMPORT, csv, sourceSystem));
    }

    @GetMapping(value = "/agreements", produces = TEXT_CSV)
    public ResponseEntity<String> exportAgreements() {
        return ResponseEntity.ok()
            .contentType(MediaType.parseMediaType(TEXT_CSV))
            .body(transferService.exportAgreementsCsv());
    }

    @GetMapping(value = "/pos", produces = TEXT_CSV)
    public ResponseEntity<String> exportPurchaseOrders() {
        return ResponseEntity.ok()
            .contentType(MediaType.parseMediaType(TEXT_CSV))
            .body(transferService.exportPurchaseOrdersCsv());
    }

    private ImportResult runImport(String endpoint, String csv, String sourceSystem) {
        log.info("Starting import via {} from {}", endpoint, sourceSystem != null ? sourceSystem : "default source");
        return producerTemplate.requestBodyAndHeader(
            endpoint, csv, TransferRoute.SOURCE_SYSTEM_HEADER, sourceSystem, ImportResult.class);
    }
}
