package com.gprintex.gtm.repository;

import com.gprintex.gtm.domain.Agreement;
import com.gprintex.gtm.domain.AgreementStatus;
import com.gprintex.gtm.domain.AgreementType;
import com.gprintex.gtm.domain.Currency;
import com.gprintex.gtm.domain.CustomerSegment;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Date;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * JDBC implementation of AgreementRepository over the agreements and sequences tables.
 * Enum columns hold labels; they are parsed back strictly, except currency which falls
 * back to the base currency like the normalizer does for unknown codes.
 */
@Repository
public class JdbcAgreementRepository implements AgreementRepository {

    private static final String INSERT_SQL = """
        INSERT INTO agreements (
            agreement_id, agreement_name, customer_name, customer_segment,
            region, industry, agreement_type, start_date, end_date,
            agreement_value_ceiling, currency, status, status_date,
            account_manager, sales_owner, partnerships_vendors,
            probability_to_sign, expected_signature_date, signed_date,
            renewal_terms, notes, created_at, last_updated
        ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
        """;

    private static final String UPDATE_SQL = """
        UPDATE agreements SET
            agreement_name = ?, customer_name = ?, customer_segment = ?,
            region = ?, industry = ?, agreement_type = ?, start_date = ?, end_date = ?,
            agreement_value_ceiling = ?, currency = ?, status = ?, status_date = ?,
            account_manager = ?, sales_owner = ?, partnerships_vendors = ?,
            probability_to_sign = ?, expected_signature_date = ?, signed_date = ?,
            renewal_terms = ?, notes = ?, last_updated = ?
        WHERE agreement_id = ?
        """;

    private final JdbcTemplate jdbcTemplate;
    private final NamedParameterJdbcTemplate namedJdbcTemplate;

    public JdbcAgreementRepository(JdbcTemplate jdbcTemplate, NamedParameterJdbcTemplate namedJdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
        this.namedJdbcTemplate = namedJdbcTemplate;
    }

    @Override
    public void insert(Agreement a) {
        jdbcTemplate.update(INSERT_SQL,
            a.agreementId(),
            a.name(),
            a.customerName(),
            a.customerSegment().label(),
            a.region().orElse(null),
            a.industry().orElse(null),
            a.agreementType().label(),
            toSqlDate(a.startDate()),
            toSqlDate(a.endDate()),
            a.valueCeiling(),
            a.currency().name(),
            a.status().label(),
            Date.valueOf(a.statusDate()),
            a.accountManager(),
            a.salesOwner().orElse(null),
            a.partnershipsVendors().orElse(null),
            a.probabilityToSign().orElse(null),
            toSqlDate(a.expectedSignatureDate()),
            toSqlDate(a.signedDate()),
            a.renewalTerms().orElse(null),
            a.notes().orElse(null),
            toTimestamp(a.createdAt()),
            toTimestamp(a.lastUpdated())
        );
    }

    @Override
    public boolean update(Agreement a) {
        int rows = jdbcTemplate.update(UPDATE_SQL,
            a.name(),
            a.customerName(),
            a.customerSegment().label(),
            a.region().orElse(null),
            a.industry().orElse(null),
            a.agreementType().label(),
            toSqlDate(a.startDate()),
            toSqlDate(a.endDate()),
            a.valueCeiling(),
            a.currency().name(),
            a.status().label(),
            Date.valueOf(a.statusDate()),
            a.accountManager(),
            a.salesOwner().orElse(null),
            a.partnershipsVendors().orElse(null),
            a.probabilityToSign().orElse(null),
            toSqlDate(a.expectedSignatureDate()),
            toSqlDate(a.signedDate()),
            a.renewalTerms().orElse(null),
            a.notes().orElse(null),
            toTimestamp(a.lastUpdated()),
            a.agreementId()
        );
        return rows > 0;
    }

    @Override
    public boolean delete(String agreementId) {
        return jdbcTemplate.update("DELETE FROM agreements WHERE agreement_id = ?", agreementId) > 0;
    }

    @Override
    public long nextSequence(String sequenceName) {
        int updated = jdbcTemplate.update(
            "UPDATE sequences SET seq_value = seq_value + 1 WHERE seq_name = ?", sequenceName);
        if (updated == 0) {
            jdbcTemplate.update("INSERT INTO sequences (seq_name, seq_value) VALUES (?, 1)", sequenceName);
            return 1L;
        }
        Long value = jdbcTemplate.queryForObject(
            "SELECT seq_value FROM sequences WHERE seq_name = ?", Long.class, sequenceName);
        if (value == null) {
            throw new IllegalStateException("Sequence " + sequenceName + " has no value");
        }
        return value;
    }

    @Override
    public Optional<Agreement> findById(String agreementId) {
        return jdbcTemplate.query(
                "SELECT * FROM agreements WHERE agreement_id = ?", agreementRowMapper(), agreementId)
            .stream()
            .findFirst();
    }

    @Override
    public Optional<Agreement> lockById(String agreementId) {
        return jdbcTemplate.query(
                "SELECT * FROM agreements WHERE agreement_id = ? FOR UPDATE", agreementRowMapper(), agreementId)
            .stream()
            .findFirst();
    }

    @Override
    public List<Agreement> findByFilter(AgreementFilter filter) {
        var sql = new StringBuilder("SELECT * FROM agreements WHERE 1=1");
        var params = new MapSqlParameterSource();

        filter.status().ifPresent(s -> {
            sql.append(" AND status = :status");
            params.addValue("status", s.label());
        });
        filter.accountManager().ifPresent(am -> {
            sql.append(" AND account_manager = :accountManager");
            params.addValue("accountManager", am);
        });
        filter.customerName().ifPresent(name -> {
            sql.append(" AND LOWER(customer_name) LIKE :customerName");
            params.addValue("customerName", "%" + name.toLowerCase(Locale.ROOT) + "%");
        });
        filter.region().ifPresent(r -> {
            sql.append(" AND region = :region");
            params.addValue("region", r);
        });
        filter.industry().ifPresent(i -> {
            sql.append(" AND industry = :industry");
            params.addValue("industry", i);
        });
        filter.customerSegment().ifPresent(seg -> {
            sql.append(" AND customer_segment = :customerSegment");
            params.addValue("customerSegment", seg.label());
        });
        sql.append(" ORDER BY last_updated DESC, agreement_id DESC");

        return namedJdbcTemplate.query(sql.toString(), params, agreementRowMapper());
    }

    // ========================================================================
    // PRIVATE HELPERS
    // ========================================================================

    private RowMapper<Agreement> agreementRowMapper() {
        return (rs, rowNum) -> mapResultSetToAgreement(rs);
    }

    private Agreement mapResultSetToAgreement(ResultSet rs) throws SQLException {
        var id = rs.getString("AGREEMENT_ID");
        return new Agreement(
            id,
            rs.getString("AGREEMENT_NAME"),
            rs.getString("CUSTOMER_NAME"),
            CustomerSegment.fromLabel(rs.getString("CUSTOMER_SEGMENT"))
                .orElseThrow(() -> corrupt(id, "customer_segment")),
            AgreementType.fromLabel(rs.getString("AGREEMENT_TYPE"))
                .orElseThrow(() -> corrupt(id, "agreement_type")),
            rs.getBigDecimal("AGREEMENT_VALUE_CEILING"),
            Currency.fromCode(rs.getString("CURRENCY")).orElse(Currency.BASE),
            AgreementStatus.fromLabel(rs.getString("STATUS"))
                .orElseThrow(() -> corrupt(id, "status")),
            toLocalDate(rs.getDate("STATUS_DATE")).orElse(null),
            Optional.ofNullable(rs.getBigDecimal("PROBABILITY_TO_SIGN")),
            toLocalDate(rs.getDate("EXPECTED_SIGNATURE_DATE")),
            toLocalDate(rs.getDate("SIGNED_DATE")),
            rs.getString("ACCOUNT_MANAGER"),
            Optional.ofNullable(rs.getString("REGION")),
            Optional.ofNullable(rs.getString("INDUSTRY")),
            Optional.ofNullable(rs.getString("SALES_OWNER")),
            Optional.ofNullable(rs.getString("PARTNERSHIPS_VENDORS")),
            toLocalDate(rs.getDate("START_DATE")),
            toLocalDate(rs.getDate("END_DATE")),
            Optional.ofNullable(rs.getString("RENEWAL_TERMS")),
            Optional.ofNullable(rs.getString("NOTES")),
            Optional.ofNullable(rs.getTimestamp("CREATED_AT")).map(Timestamp::toLocalDateTime),
            Optional.ofNullable(rs.getTimestamp("LAST_UPDATED")).map(Timestamp::toLocalDateTime)
        );
    }

    private static IllegalStateException corrupt(String agreementId, String column) {
        return new IllegalStateException("Unrecognized " + column + " stored for agreement " + agreementId);
    }

    static Optional<LocalDate> toLocalDate(Date date) {
        return Optional.ofNullable(date).map(Date::toLocalDate);
    }

    static Date toSqlDate(Optional<LocalDate> date) {
        return date.map(Date::valueOf).orElse(null);
    }

    static Timestamp toTimestamp(Optional<LocalDateTime> time) {
        return time.map(Timestamp::valueOf).orElse(null);
    }
}
