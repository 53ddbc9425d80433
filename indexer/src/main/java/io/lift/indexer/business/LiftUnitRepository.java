package io.lift.indexer.business;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.Map;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class LiftUnitRepository {

    public static final String STATUS_ISSUED = "ISSUED";
    public static final String STATUS_SOLD = "SOLD";
    public static final String STATUS_BURNED = "BURNED";

    private final NamedParameterJdbcTemplate jdbcTemplate;

    public LiftUnitRepository(NamedParameterJdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public void markSold(BigInteger tokenId, BigInteger projectId, BigInteger amount, String soldTo, Instant soldAt) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("tokenId", new BigDecimal(tokenId))
            .addValue("projectId", new BigDecimal(projectId))
            .addValue("amount", new BigDecimal(amount))
            .addValue("soldTo", soldTo)
            .addValue("status", STATUS_SOLD)
            .addValue("soldAt", Timestamp.from(soldAt), Types.TIMESTAMP)
            .addValue("now", Timestamp.from(Instant.now()), Types.TIMESTAMP);
        String updateSql = """
            UPDATE lift_units
            SET status = :status,
                sold_to = :soldTo,
                sold_amount = :amount,
                sold_at = :soldAt,
                updated_at = :now
            WHERE token_id = :tokenId
            """;
        if (jdbcTemplate.update(updateSql, params) > 0) {
            return;
        }
        int inserted = jdbcTemplate.update(
            """
                INSERT INTO lift_units(
                  token_id, project_id, status, quantity, sold_to, sold_amount, sold_at, created_at, updated_at
                )
                VALUES (:tokenId, :projectId, :status, :amount, :soldTo, :amount, :soldAt, :now, :now)
                ON CONFLICT DO NOTHING
                """,
            params
        );
        if (inserted == 0) {
            jdbcTemplate.update(updateSql, params);
        }
    }

    /**
     * Moves the unit to {@code holder} when this transfer is later on chain than the last one applied.
     *
     * @return true when the row was changed or created
     */
    public boolean applyTransfer(
        BigInteger tokenId,
        BigInteger amount,
        String holder,
        boolean burned,
        long blockNumber,
        long logIndex
    ) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("tokenId", new BigDecimal(tokenId))
            .addValue("amount", new BigDecimal(amount))
            .addValue("holder", burned ? null : holder, Types.VARCHAR)
            .addValue("newStatus", burned ? STATUS_BURNED : null, Types.VARCHAR)
            .addValue("issuedStatus", burned ? STATUS_BURNED : STATUS_ISSUED)
            .addValue("blockNumber", blockNumber)
            .addValue("logIndex", logIndex)
            .addValue("now", Timestamp.from(Instant.now()), Types.TIMESTAMP);
        int updated = jdbcTemplate.update(
            """
                UPDATE lift_units
                SET holder_address = :holder,
                    status = COALESCE(:newStatus, status),
                    last_transfer_block = :blockNumber,
                    last_transfer_log_index = :logIndex,
                    updated_at = :now
                WHERE token_id = :tokenId
                  AND (
                    last_transfer_block IS NULL
                    OR last_transfer_block < :blockNumber
                    OR (last_transfer_block = :blockNumber AND last_transfer_log_index < :logIndex)
                  )
                """,
            params
        );
        if (updated > 0) {
            return true;
        }
        if (exists(tokenId)) {
            return false;
        }
        return jdbcTemplate.update(
            """
                INSERT INTO lift_units(
                  token_id, status, quantity, holder_address, last_transfer_block, last_transfer_log_index,
                  created_at, updated_at
                )
                VALUES (:tokenId, :issuedStatus, :amount, :holder, :blockNumber, :logIndex, :now, :now)
                ON CONFLICT DO NOTHING
                """,
            params
        ) == 1;
    }

    private boolean exists(BigInteger tokenId) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM lift_units WHERE token_id = :tokenId",
            Map.of("tokenId", new BigDecimal(tokenId)),
            Integer.class
        );
        return count != null && count > 0;
    }
}
