package com.gprintex.gtm.service;

import com.gprintex.gtm.config.GtmProperties;
import com.gprintex.gtm.domain.AgreementDraft;
import com.gprintex.gtm.domain.AgreementStatus;
import com.gprintex.gtm.domain.AgreementType;
import com.gprintex.gtm.domain.AgreementView;
import com.gprintex.gtm.domain.Currency;
import com.gprintex.gtm.domain.CustomerSegment;
import com.gprintex.gtm.domain.ImportResult;
import com.gprintex.gtm.domain.LedgerError;
import com.gprintex.gtm.domain.PurchaseOrder;
import com.gprintex.gtm.domain.PurchaseOrderDraft;
import com.gprintex.gtm.domain.ValidationResult;
import com.gprintex.gtm.repository.AgreementRepository.AgreementFilter;
import io.vavr.control.Either;
import io.vavr.control.Try;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Function;

/**
 * CSV import and export of agreements and purchase orders.
 * Each imported row goes through the same ledger operation as an API call and is committed
 * on its own, so a bad row is reported without affecting the others.
 */
@Service
public class TransferService {

    private static final Logger log = LoggerFactory.getLogger(TransferService.class);

    static final String[] AGREEMENT_COLUMNS = {
        "agreement_id", "agreement_name", "customer_name", "customer_segment",
        "region", "industry", "agreement_type", "start_date", "end_date",
        "agreement_value_ceiling", "currency", "status", "status_date",
        "account_manager", "sales_owner", "partnerships_vendors",
        "probability_to_sign", "expected_signature_date", "signed_date",
        "total_pos_value_to_date", "utilization_percent", "risk_flag", "notes"
    };

    static final String[] PURCHASE_ORDER_COLUMNS = {
        "po_id", "agreement_id", "po_number", "po_date", "po_value",
        "currency", "customer_name", "account_manager", "notes"
    };

    private static final CSVFormat INPUT = CSVFormat.DEFAULT.builder()
        .setHeader()
        .setSkipHeaderRecord(true)
        .setIgnoreSurroundingSpaces(true)
        .setIgnoreEmptyLines(true)
        .build();

    private final LedgerService ledger;
    private final GtmProperties properties;
    private final Clock clock;

    public TransferService(LedgerService ledger, GtmProperties properties, Clock clock) {
        this.ledger = ledger;
        this.properties = properties;
        this.clock = clock;
    }

    // ========================================================================
    // IMPORT
    // ========================================================================

    /**
     * Create one agreement per row. Any agreement_id column is ignored; ids are always assigned.
     */
    public ImportResult importAgreements(String csv, String sourceSystem) {
        var source = sourceOrDefault(sourceSystem);
        return importRows(csv, source, "AGREEMENT", record ->
            ledger.createAgreement(toAgreementDraft(record), source).map(AgreementView::agreementId));
    }

    /**
     * Create one purchase order per row. Imported rows are historical facts, so the ceiling
     * check is overridden; unknown agreements and invalid values still fail the row.
     */
    public ImportResult importPurchaseOrders(String csv, String sourceSystem) {
        var source = sourceOrDefault(sourceSystem);
        return importRows(csv, source, "PURCHASE_ORDER", record ->
            ledger.createPurchaseOrder(toPurchaseOrderDraft(record), true, source).map(PurchaseOrder::poId));
    }

    private ImportResult importRows(
        String csv, String source, String entityType, Function<CSVRecord, Either<LedgerError, String>> importer
    ) {
        var result = ImportResult.start(source, entityType, LocalDateTime.now(clock));
        if (csv == null || csv.isBlank()) {
            return result;
        }

        long row = 0;
        for (var record : parse(csv)) {
            row++;
            // Only malformed cells are row errors; storage failures propagate
            var outcome = Try.of(() -> importer.apply(record).mapLeft(LedgerError::message))
                .recover(IllegalArgumentException.class, e -> Either.left(e.getMessage()))
                .get();
            if (outcome.isRight()) {
                result = result.withSuccess();
            } else {
                log.warn("{} import from {} rejected row {}: {}", entityType, source, row, outcome.getLeft());
                result = result.withError(row, outcome.getLeft());
            }
        }

        log.info("{} import from {} finished: {} rows, {} imported ({}%), {} rejected",
            entityType, source, result.recordCount(), result.successCount(),
            String.format(Locale.ROOT, "%.1f", result.successRate()), result.errorCount());
        return result;
    }

    private static List<CSVRecord> parse(String csv) {
        try (var parser = CSVParser.parse(new StringReader(csv), INPUT)) {
            return parser.getRecords();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read CSV input", e);
        }
    }

    static AgreementDraft toAgreementDraft(CSVRecord record) {
        return new AgreementDraft(
            text(record, "agreement_name").orElse(null),
            text(record, "customer_name").orElse(null),
            text(record, "customer_segment")
                .map(v -> CustomerSegment.fromLabel(v).orElseThrow(() -> invalid("customer_segment", v)))
                .orElse(null),
            text(record, "agreement_type")
                .map(v -> AgreementType.fromLabel(v).orElseThrow(() -> invalid("agreement_type", v)))
                .orElse(null),
            decimal(record, "agreement_value_ceiling").orElse(null),
            currency(record).orElse(null),
            text(record, "status")
                .map(v -> AgreementStatus.fromLabel(v).orElseThrow(() -> invalid("status", v)))
                .orElse(null),
            date(record, "status_date").orElse(null),
            decimal(record, "probability_to_sign").orElse(null),
            date(record, "expected_signature_date").orElse(null),
            date(record, "signed_date").orElse(null),
            text(record, "account_manager").orElse(null),
            text(record, "region").orElse(null),
            text(record, "industry").orElse(null),
            text(record, "sales_owner").orElse(null),
            text(record, "partnerships_vendors").orElse(null),
            date(record, "start_date").orElse(null),
            date(record, "end_date").orElse(null),
            text(record, "renewal_terms").orElse(null),
            text(record, "notes").orElse(null)
        );
    }

    static PurchaseOrderDraft toPurchaseOrderDraft(CSVRecord record) {
        return new PurchaseOrderDraft(
            text(record, "agreement_id").orElse(null),
            text(record, "po_number").orElse(null),
            date(record, "po_date").orElse(null),
            decimal(record, "po_value").orElse(null),
            currency(record).orElse(null),
            text(record, "customer_name").orElse(null),
            text(record, "account_manager").orElse(null),
            text(record, "notes").orElse(null)
        );
    }

    // ========================================================================
    // EXPORT
    // ========================================================================

    /**
     * All agreements with their derived metrics; empty string when there are none.
     */
    public String exportAgreementsCsv() {
        var views = ledger.findAgreements(AgreementFilter.all());
        if (views.isEmpty()) {
            return "";
        }
        return write(AGREEMENT_COLUMNS, printer -> {
            for (var view : views) {
                var a = view.agreement();
                var m = view.metrics();
                printer.printRecord(
                    a.agreementId(),
                    a.name(),
                    a.customerName(),
                    a.customerSegment().label(),
                    a.region().orElse(""),
                    a.industry().orElse(""),
                    a.agreementType().label(),
                    a.startDate().map(LocalDate::toString).orElse(""),
                    a.endDate().map(LocalDate::toString).orElse(""),
                    a.valueCeiling().toPlainString(),
                    a.currency().name(),
                    a.status().label(),
                    a.statusDate(),
                    a.accountManager(),
                    a.salesOwner().orElse(""),
                    a.partnershipsVendors().orElse(""),
                    a.probabilityToSign().map(BigDecimal::toPlainString).orElse(""),
                    a.expectedSignatureDate().map(LocalDate::toString).orElse(""),
                    a.signedDate().map(LocalDate::toString).orElse(""),
                    m.totalPosValue().toPlainString(),
                    m.utilizationPercent().toPlainString(),
                    m.riskFlag().label(),
                    a.notes().orElse("")
                );
            }
        });
    }

    /**
     * All purchase orders in their original currency; empty string when there are none.
     */
    public String exportPurchaseOrdersCsv() {
        var pos = ledger.findAllPurchaseOrders();
        if (pos.isEmpty()) {
            return "";
        }
        return write(PURCHASE_ORDER_COLUMNS, printer -> {
            for (var po : pos) {
                printer.printRecord(
                    po.poId(),
                    po.agreementId(),
                    po.poNumber().orElse(""),
                    po.poDate(),
                    po.value().toPlainString(),
                    po.currency().name(),
                    po.customerName(),
                    po.accountManager().orElse(""),
                    po.notes().orElse("")
                );
            }
        });
    }

    @FunctionalInterface
    private interface RowWriter {
        void writeTo(CSVPrinter printer) throws IOException;
    }

    private static String write(String[] columns, RowWriter rows) {
        var out = new StringWriter();
        var format = CSVFormat.DEFAULT.builder().setHeader(columns).build();
        try (var printer = new CSVPrinter(out, format)) {
            rows.writeTo(printer);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write CSV output", e);
        }
        return out.toString();
    }

    // ========================================================================
    // CELL PARSING
    // ========================================================================

    private String sourceOrDefault(String sourceSystem) {
        return sourceSystem != null && !sourceSystem.isBlank()
            ? sourceSystem
            : properties.transfer().sourceSystem();
    }

    private static Optional<String> text(CSVRecord record, String column) {
        if (!record.isMapped(column) || !record.isSet(column)) {
            return Optional.empty();
        }
        var value = record.get(column).trim();
        return value.isEmpty() ? Optional.empty() : Optional.of(value);
    }

    private static Optional<BigDecimal> decimal(CSVRecord record, String column) {
        return text(record, column).map(v -> {
            try {
                return new BigDecimal(v);
            } catch (NumberFormatException e) {
                throw invalid(column, v);
            }
        });
    }

    private static Optional<LocalDate> date(CSVRecord record, String column) {
        return text(record, column).map(v -> {
            try {
                return LocalDate.parse(v);
            } catch (DateTimeParseException e) {
                throw invalid(column, v);
            }
        });
    }

    private static Optional<Currency> currency(CSVRecord record) {
        return text(record, "currency")
            .map(v -> Currency.fromCode(v).orElseThrow(() -> invalid("currency", v)));
    }

    private static IllegalArgumentException invalid(String column, String value) {
        return new IllegalArgumentException(ValidationResult.invalidValue(column, value).errorMessage());
    }
}
