package com.gprintex.gtm.repository;

import com.gprintex.gtm.domain.AgreementStatus;
import com.gprintex.gtm.domain.StatusTransition;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.util.List;
import java.util.Optional;

@Repository
public class JdbcStatusHistoryRepository implements StatusHistoryRepository {

    private final JdbcTemplate jdbcTemplate;

    public JdbcStatusHistoryRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public void append(StatusTransition t) {
        jdbcTemplate.update("""
            INSERT INTO status_history (agreement_id, old_status, new_status, changed_at, changed_by)
            VALUES (?, ?, ?, ?, ?)
            """,
            t.agreementId(),
            t.oldStatus().map(AgreementStatus::label).orElse(null),
            t.newStatus().label(),
            Timestamp.valueOf(t.changedAt()),
            t.changedBy().orElse(null)
        );
    }

    @Override
    public List<StatusTransition> findByAgreement(String agreementId) {
        return jdbcTemplate.query(
            "SELECT * FROM status_history WHERE agreement_id = ? ORDER BY changed_at, id",
            transitionRowMapper(), agreementId);
    }

    @Override
    public int deleteByAgreement(String agreementId) {
        return jdbcTemplate.update("DELETE FROM status_history WHERE agreement_id = ?", agreementId);
    }

    private RowMapper<StatusTransition> transitionRowMapper() {
        return (rs, rowNum) -> {
            long id = rs.getLong("ID");
            var newStatus = rs.getString("NEW_STATUS");
            return new StatusTransition(
                Optional.of(id),
                rs.getString("AGREEMENT_ID"),
                Optional.ofNullable(rs.getString("OLD_STATUS")).flatMap(AgreementStatus::fromLabel),
                AgreementStatus.fromLabel(newStatus)
                    .orElseThrow(() -> new IllegalStateException(
                        "Unrecognized status '" + newStatus + "' in history row " + id)),
                rs.getTimestamp("CHANGED_AT").toLocalDateTime(),
                Optional.ofNullable(rs.getString("CHANGED_BY"))
            );
        };
    }
}
