package com.baskettecase.sqlgate.store;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.PreparedStatement;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.List;

/**
 * Append-only log of execution attempts
 */
@Slf4j
@Repository
public class ExecutionLogRepository {

    private final JdbcTemplate jdbcTemplate;

    public ExecutionLogRepository(@Qualifier("appJdbcTemplate") JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    private static final RowMapper<ExecutionLogEntry> ROW_MAPPER = (rs, rowNum) -> {
        Timestamp finishedAt = rs.getTimestamp("finished_at");
        return new ExecutionLogEntry(
            rs.getLong("id"),
            rs.getLong("user_id"),
            rs.getString("query_text"),
            rs.getString("server_name"),
            rs.getString("database_name"),
            rs.getTimestamp("started_at").toInstant(),
            finishedAt == null ? null : finishedAt.toInstant(),
            rs.getObject("duration_ms", Long.class),
            rs.getObject("success", Boolean.class),
            rs.getObject("row_count", Integer.class),
            rs.getString("error_message"),
            rs.getBoolean("approved_execution")
        );
    };

    /**
     * Insert an unfinished entry
     *
     * @return generated id
     */
    public long insertStarted(long userId, String queryText, String serverName, String databaseName,
                              Instant startedAt, boolean approvedExecution) {
        String sql = """
            INSERT INTO execution_log (
                user_id, query_text, server_name, database_name, started_at, approved_execution
            ) VALUES (?, ?, ?, ?, ?, ?)
            """;

        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbcTemplate.update(connection -> {
            PreparedStatement ps = connection.prepareStatement(sql, new String[] {"id"});
            ps.setLong(1, userId);
            ps.setString(2, queryText);
            ps.setString(3, serverName);
            ps.setString(4, databaseName);
            ps.setTimestamp(5, Timestamp.from(startedAt));
            ps.setBoolean(6, approvedExecution);
            return ps;
        }, keyHolder);
        return keyHolder.getKey().longValue();
    }

    /**
     * Finalize an entry. Entries already finished are left untouched.
     *
     * @return rows updated, 0 when the entry was already finished or does not exist
     */
    public int finish(long id, Instant finishedAt, long durationMs, boolean success, Integer rowCount,
                      String errorMessage) {
        String sql = """
            UPDATE execution_log
            SET finished_at = ?, duration_ms = ?, success = ?, row_count = ?, error_message = ?
            WHERE id = ? AND finished_at IS NULL
            """;
        return jdbcTemplate.update(sql, ps -> {
            ps.setTimestamp(1, Timestamp.from(finishedAt));
            ps.setLong(2, durationMs);
            ps.setBoolean(3, success);
            if (rowCount == null) {
                ps.setNull(4, Types.INTEGER);
            } else {
                ps.setInt(4, rowCount);
            }
            ps.setString(5, errorMessage);
            ps.setLong(6, id);
        });
    }

    public List<ExecutionLogEntry> findRecent(int limit) {
        return jdbcTemplate.query("SELECT * FROM execution_log ORDER BY started_at DESC LIMIT ?", ROW_MAPPER, limit);
    }

    public List<ExecutionLogEntry> findByUser(long userId, int limit) {
        return jdbcTemplate.query("SELECT * FROM execution_log WHERE user_id = ? ORDER BY started_at DESC LIMIT ?",
            ROW_MAPPER, userId, limit);
    }

    public void initializeTable() {
        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS execution_log (
                id BIGSERIAL PRIMARY KEY,
                user_id BIGINT NOT NULL,
                query_text TEXT NOT NULL,
                server_name VARCHAR(255),
                database_name VARCHAR(255),
                started_at TIMESTAMP NOT NULL,
                finished_at TIMESTAMP,
                duration_ms BIGINT,
                success BOOLEAN,
                row_count INTEGER,
                error_message TEXT,
                approved_execution BOOLEAN NOT NULL DEFAULT false
            )
            """);
    }
}
