package io.lift.indexer.store;

import io.lift.indexer.source.SchemaKind;
import io.lift.indexer.source.SourceKey;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class JdbcCursorStore implements CursorStore {

    private static final String SELECT_COLUMNS = """
        SELECT id, network_id, contract_address, schema_kind, last_processed_height, last_sync_at, is_active,
               error_count, last_error, last_error_at, created_at, updated_at
        FROM indexer_cursors
        """;

    private static final String KEY_PREDICATE = """
        network_id = :networkId
          AND contract_address = :contractAddress
          AND schema_kind = :schemaKind
        """;

    private final NamedParameterJdbcTemplate jdbcTemplate;

    public JdbcCursorStore(NamedParameterJdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public Optional<CursorRecord> find(SourceKey key) {
        List<CursorRecord> rows = jdbcTemplate.query(
            SELECT_COLUMNS + " WHERE " + KEY_PREDICATE,
            keyParams(key),
            this::toCursorRecord
        );
        return rows.stream().findFirst();
    }

    @Override
    public List<CursorRecord> findAll() {
        return jdbcTemplate.query(
            SELECT_COLUMNS + " ORDER BY network_id ASC, schema_kind ASC, contract_address ASC",
            new MapSqlParameterSource(),
            this::toCursorRecord
        );
    }

    @Override
    public CursorRecord ensureActive(SourceKey key, Instant now) {
        Optional<CursorRecord> existing = find(key);
        if (existing.isEmpty()) {
            try {
                jdbcTemplate.update(
                    """
                        INSERT INTO indexer_cursors(
                          id, network_id, contract_address, schema_kind, last_processed_height, is_active,
                          error_count, created_at, updated_at
                        )
                        VALUES (:id, :networkId, :contractAddress, :schemaKind, 0, TRUE, 0, :now, :now)
                        """,
                    keyParams(key)
                        .addValue("id", UUID.randomUUID())
                        .addValue("now", Timestamp.from(now), Types.TIMESTAMP)
                );
            } catch (DuplicateKeyException e) {
                // Created concurrently; the existing row wins.
                setActive(key, true, now);
            }
        } else if (!existing.get().active()) {
            setActive(key, true, now);
        }
        return find(key).orElseThrow(() -> new IllegalStateException("Cursor missing after create: " + key));
    }

    @Override
    public void advance(SourceKey key, long lastProcessedHeight, Instant now) {
        jdbcTemplate.update(
            """
                UPDATE indexer_cursors
                SET last_processed_height = :height,
                    last_sync_at = :now,
                    error_count = 0,
                    last_error = NULL,
                    last_error_at = NULL,
                    updated_at = :now
                WHERE %s
                  AND last_processed_height <= :height
                """.formatted(KEY_PREDICATE),
            keyParams(key)
                .addValue("height", lastProcessedHeight)
                .addValue("now", Timestamp.from(now), Types.TIMESTAMP)
        );
    }

    @Override
    public void recordError(SourceKey key, String message, Instant now) {
        jdbcTemplate.update(
            """
                UPDATE indexer_cursors
                SET error_count = error_count + 1,
                    last_error = :lastError,
                    last_error_at = :now,
                    updated_at = :now
                WHERE %s
                """.formatted(KEY_PREDICATE),
            keyParams(key)
                .addValue("lastError", message)
                .addValue("now", Timestamp.from(now), Types.TIMESTAMP)
        );
    }

    @Override
    public void setActive(SourceKey key, boolean active, Instant now) {
        jdbcTemplate.update(
            """
                UPDATE indexer_cursors
                SET is_active = :active,
                    updated_at = :now
                WHERE %s
                """.formatted(KEY_PREDICATE),
            keyParams(key)
                .addValue("active", active)
                .addValue("now", Timestamp.from(now), Types.TIMESTAMP)
        );
    }

    private MapSqlParameterSource keyParams(SourceKey key) {
        return new MapSqlParameterSource()
            .addValue("networkId", key.networkId())
            .addValue("contractAddress", key.contractAddress())
            .addValue("schemaKind", key.schemaKind().name());
    }

    private CursorRecord toCursorRecord(ResultSet rs, int rowNum) throws SQLException {
        return new CursorRecord(
            rs.getObject("id", UUID.class),
            new SourceKey(
                rs.getLong("network_id"),
                rs.getString("contract_address"),
                SchemaKind.valueOf(rs.getString("schema_kind"))
            ),
            rs.getLong("last_processed_height"),
            toInstant(rs.getTimestamp("last_sync_at")),
            rs.getBoolean("is_active"),
            rs.getInt("error_count"),
            rs.getString("last_error"),
            toInstant(rs.getTimestamp("last_error_at")),
            toInstant(rs.getTimestamp("created_at")),
            toInstant(rs.getTimestamp("updated_at"))
        );
    }

    private Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
