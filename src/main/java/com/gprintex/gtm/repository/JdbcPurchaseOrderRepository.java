package com.gprintex.gtm.repository;

import com.gprintex.gtm.domain.Currency;
import com.gprintex.gtm.domain.PurchaseOrder;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Date;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.List;
import java.util.Optional;

/**
 * JDBC implementation of PurchaseOrderRepository over the pos table.
 */
@Repository
public class JdbcPurchaseOrderRepository implements PurchaseOrderRepository {

    private final JdbcTemplate jdbcTemplate;

    public JdbcPurchaseOrderRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public void insert(PurchaseOrder po) {
        jdbcTemplate.update("""
            INSERT INTO pos (
                po_id, agreement_id, po_number, po_date, po_value, currency,
                customer_name, account_manager, notes, created_at
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """,
            po.poId(),
            po.agreementId(),
            po.poNumber().orElse(null),
            po.poDate() != null ? Date.valueOf(po.poDate()) : null,
            po.value(),
            po.currency().name(),
            po.customerName(),
            po.accountManager().orElse(null),
            po.notes().orElse(null),
            JdbcAgreementRepository.toTimestamp(po.createdAt())
        );
    }

    @Override
    public Optional<PurchaseOrder> findById(String poId) {
        return jdbcTemplate.query("SELECT * FROM pos WHERE po_id = ?", poRowMapper(), poId)
            .stream()
            .findFirst();
    }

    @Override
    public List<PurchaseOrder> findByAgreement(String agreementId) {
        return jdbcTemplate.query(
            "SELECT * FROM pos WHERE agreement_id = ? ORDER BY po_date DESC, po_id DESC",
            poRowMapper(), agreementId);
    }

    @Override
    public List<PurchaseOrder> findAll() {
        return jdbcTemplate.query("SELECT * FROM pos ORDER BY po_date DESC, po_id DESC", poRowMapper());
    }

    @Override
    public int nextSequence(String agreementId) {
        var ids = jdbcTemplate.queryForList(
            "SELECT po_id FROM pos WHERE agreement_id = ?", String.class, agreementId);
        return ids.stream()
            .mapToInt(JdbcPurchaseOrderRepository::trailingSequence)
            .max()
            .orElse(0) + 1;
    }

    @Override
    public boolean delete(String poId) {
        return jdbcTemplate.update("DELETE FROM pos WHERE po_id = ?", poId) > 0;
    }

    @Override
    public int deleteByAgreement(String agreementId) {
        return jdbcTemplate.update("DELETE FROM pos WHERE agreement_id = ?", agreementId);
    }

    // ========================================================================
    // PRIVATE HELPERS
    // ========================================================================

    /**
     * Numeric part after the last dash; imported ids that do not follow the pattern count as 0.
     */
    static int trailingSequence(String poId) {
        var dash = poId.lastIndexOf('-');
        try {
            return Integer.parseInt(poId.substring(dash + 1));
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    private RowMapper<PurchaseOrder> poRowMapper() {
        return (rs, rowNum) -> mapResultSetToPurchaseOrder(rs);
    }

    private PurchaseOrder mapResultSetToPurchaseOrder(ResultSet rs) throws SQLException {
        return new PurchaseOrder(
            rs.getString("PO_ID"),
            rs.getString("AGREEMENT_ID"),
            Optional.ofNullable(rs.getString("PO_NUMBER")),
            JdbcAgreementRepository.toLocalDate(rs.getDate("PO_DATE")).orElse(null),
            rs.getBigDecimal("PO_VALUE"),
            Currency.fromCode(rs.getString("CURRENCY")).orElse(Currency.BASE),
            rs.getString("CUSTOMER_NAME"),
            Optional.ofNullable(rs.getString("ACCOUNT_MANAGER")),
            Optional.ofNullable(rs.getString("NOTES")),
            Optional.ofNullable(rs.getTimestamp("CREATED_AT")).map(Timestamp::toLocalDateTime)
        );
    }
}
