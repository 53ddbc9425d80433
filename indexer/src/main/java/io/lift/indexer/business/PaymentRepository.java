package io.lift.indexer.business;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class PaymentRepository {

    public static final String STATUS_CONFIRMED = "CONFIRMED";
    public static final String STATUS_IN_ESCROW = "IN_ESCROW";
    public static final String TYPE_LIFT_UNIT_PURCHASE = "LIFT_UNIT_PURCHASE";
    public static final String EVENT_PROCEEDS_NOTIFIED = "PROCEEDS_NOTIFIED";

    private final NamedParameterJdbcTemplate jdbcTemplate;

    public PaymentRepository(NamedParameterJdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public Optional<PaymentRow> findByConsideration(BigInteger projectId, String considerationRef) {
        List<PaymentRow> rows = jdbcTemplate.query(
            """
                SELECT id, payment_type, project_id, consideration_ref, amount, status, proceeds_notified
                FROM payments
                WHERE project_id = :projectId
                  AND consideration_ref = :considerationRef
                """,
            new MapSqlParameterSource()
                .addValue("projectId", new BigDecimal(projectId))
                .addValue("considerationRef", considerationRef),
            this::toPaymentRow
        );
        return rows.stream().findFirst();
    }

    /**
     * Creates a confirmed LIFT_UNIT_PURCHASE payment unless one already exists for the consideration reference.
     */
    public PaymentRow createPurchaseIfAbsent(
        BigInteger projectId,
        String considerationRef,
        BigInteger proceeds,
        long networkId,
        String beneficiary,
        Instant confirmedAt
    ) {
        Timestamp now = Timestamp.from(Instant.now());
        jdbcTemplate.update(
            """
                INSERT INTO payments(
                  id, payment_type, project_id, consideration_ref, amount, network_id, payer_address,
                  recipient_address, status, proceeds_notified, confirmed_at, created_at, updated_at
                )
                VALUES (
                  :id, :paymentType, :projectId, :considerationRef, :amount, :networkId, :beneficiary,
                  :beneficiary, :status, FALSE, :confirmedAt, :now, :now
                )
                ON CONFLICT DO NOTHING
                """,
            new MapSqlParameterSource()
                .addValue("id", UUID.randomUUID())
                .addValue("paymentType", TYPE_LIFT_UNIT_PURCHASE)
                .addValue("projectId", new BigDecimal(projectId))
                .addValue("considerationRef", considerationRef)
                .addValue("amount", new BigDecimal(proceeds))
                .addValue("networkId", networkId)
                .addValue("beneficiary", beneficiary)
                .addValue("status", STATUS_CONFIRMED)
                .addValue("confirmedAt", Timestamp.from(confirmedAt), Types.TIMESTAMP)
                .addValue("now", now, Types.TIMESTAMP)
        );
        return findByConsideration(projectId, considerationRef)
            .orElseThrow(() -> new IllegalStateException("Payment missing after insert: " + considerationRef));
    }

    public void markInEscrow(UUID paymentId) {
        jdbcTemplate.update(
            """
                UPDATE payments
                SET status = :status,
                    proceeds_notified = TRUE,
                    updated_at = :now
                WHERE id = :id
                """,
            new MapSqlParameterSource()
                .addValue("id", paymentId)
                .addValue("status", STATUS_IN_ESCROW)
                .addValue("now", Timestamp.from(Instant.now()), Types.TIMESTAMP)
        );
    }

    /**
     * Records a payment event at most once per indexed event and type.
     *
     * @return true when a new row was written
     */
    public boolean insertPaymentEventIfAbsent(UUID paymentId, String eventType, BigInteger amount, UUID indexedEventId) {
        int inserted = jdbcTemplate.update(
            """
                INSERT INTO payment_events(id, payment_id, event_type, amount, indexed_event_id, created_at)
                VALUES (:id, :paymentId, :eventType, :amount, :indexedEventId, :now)
                ON CONFLICT DO NOTHING
                """,
            new MapSqlParameterSource()
                .addValue("id", UUID.randomUUID())
                .addValue("paymentId", paymentId)
                .addValue("eventType", eventType)
                .addValue("amount", new BigDecimal(amount))
                .addValue("indexedEventId", indexedEventId)
                .addValue("now", Timestamp.from(Instant.now()), Types.TIMESTAMP)
        );
        return inserted == 1;
    }

    private PaymentRow toPaymentRow(ResultSet rs, int rowNum) throws SQLException {
        return new PaymentRow(
            rs.getObject("id", UUID.class),
            rs.getString("payment_type"),
            rs.getBigDecimal("project_id").toBigIntegerExact(),
            rs.getString("consideration_ref"),
            rs.getBigDecimal("amount").toBigIntegerExact(),
            rs.getString("status"),
            rs.getBoolean("proceeds_notified")
        );
    }
}
