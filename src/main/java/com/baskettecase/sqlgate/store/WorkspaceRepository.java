package com.baskettecase.sqlgate.store;

import com.baskettecase.sqlgate.sql.RiskCategory;
import com.baskettecase.sqlgate.workflow.QueryStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository for saved queries and their workspaces.
 *
 * A workspace and its query record are created, changed and deleted together. Status changes are
 * compare-and-set on the current status so two concurrent decisions cannot both win.
 */
@Slf4j
@Repository
public class WorkspaceRepository {

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;

    public WorkspaceRepository(@Qualifier("appJdbcTemplate") JdbcTemplate jdbcTemplate,
                               @Qualifier("appTransactionTemplate") TransactionTemplate transactionTemplate) {
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = transactionTemplate;
    }

    private static final String SELECT_DETAILS = """
        SELECT w.id AS w_id, w.user_id AS w_user_id, w.name AS w_name, w.description AS w_description,
               w.query_id AS w_query_id, w.show_results AS w_show_results, w.created_at AS w_created_at,
               q.id AS q_id, q.user_id AS q_user_id, q.server_name, q.database_name, q.query_text,
               q.correlation_id, q.status, q.risk_category, q.created_at AS q_created_at,
               q.updated_at AS q_updated_at, u.username AS owner_name
        FROM workspaces w
        JOIN query_records q ON q.id = w.query_id
        LEFT JOIN app_users u ON u.id = w.user_id
        """;

    private static final RowMapper<WorkspaceDetails> DETAILS_MAPPER = new RowMapper<WorkspaceDetails>() {
        @Override
        public WorkspaceDetails mapRow(ResultSet rs, int rowNum) throws SQLException {
            Object showResults = rs.getObject("w_show_results");
            WorkspaceRecord workspace = new WorkspaceRecord(
                rs.getLong("w_id"),
                rs.getLong("w_user_id"),
                rs.getString("w_name"),
                rs.getString("w_description"),
                rs.getLong("w_query_id"),
                showResults == null ? null : rs.getBoolean("w_show_results"),
                toInstant(rs.getTimestamp("w_created_at"))
            );

            String risk = rs.getString("risk_category");
            QueryRecord query = new QueryRecord(
                rs.getLong("q_id"),
                rs.getLong("q_user_id"),
                rs.getString("server_name"),
                rs.getString("database_name"),
                rs.getString("query_text"),
                rs.getString("correlation_id"),
                QueryStatus.fromDbValue(rs.getString("status")),
                risk == null ? null : RiskCategory.fromWireValue(risk),
                toInstant(rs.getTimestamp("q_created_at")),
                toInstant(rs.getTimestamp("q_updated_at"))
            );

            return new WorkspaceDetails(workspace, query, rs.getString("owner_name"));
        }
    };

    /**
     * Insert a query record and its workspace in one transaction
     *
     * @return the stored pair with generated ids
     */
    public WorkspaceDetails createWithQuery(QueryRecord query, String name, String description, Boolean showResults) {
        return transactionTemplate.execute(status -> {
            Instant now = Instant.now();
            long queryId = insertQuery(query, now);
            long workspaceId = insertWorkspace(query.userId(), name, description, queryId, showResults, now);

            log.info("✅ Saved workspace {} (query {}, status {})", workspaceId, queryId, query.status().dbValue());
            return findById(workspaceId).orElseThrow(
                () -> new IllegalStateException("Workspace " + workspaceId + " vanished after insert"));
        });
    }

    private long insertQuery(QueryRecord query, Instant now) {
        String sql = """
            INSERT INTO query_records (
                user_id, server_name, database_name, query_text,
                correlation_id, status, risk_category, created_at, updated_at
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;

        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbcTemplate.update(connection -> {
            PreparedStatement ps = connection.prepareStatement(sql, new String[] {"id"});
            ps.setLong(1, query.userId());
            ps.setString(2, query.serverName());
            ps.setString(3, query.databaseName());
            ps.setString(4, query.queryText());
            ps.setString(5, query.correlationId());
            ps.setString(6, query.status().dbValue());
            ps.setString(7, query.riskCategory() == null ? null : query.riskCategory().wireValue());
            ps.setTimestamp(8, Timestamp.from(now));
            ps.setTimestamp(9, Timestamp.from(now));
            return ps;
        }, keyHolder);
        return keyHolder.getKey().longValue();
    }

    private long insertWorkspace(long userId, String name, String description, long queryId, Boolean showResults,
                                 Instant now) {
        String sql = """
            INSERT INTO workspaces (user_id, name, description, query_id, show_results, created_at)
            VALUES (?, ?, ?, ?, ?, ?)
            """;

        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbcTemplate.update(connection -> {
            PreparedStatement ps = connection.prepareStatement(sql, new String[] {"id"});
            ps.setLong(1, userId);
            ps.setString(2, name);
            ps.setString(3, description);
            ps.setLong(4, queryId);
            if (showResults == null) {
                ps.setNull(5, Types.BOOLEAN);
            } else {
                ps.setBoolean(5, showResults);
            }
            ps.setTimestamp(6, Timestamp.from(now));
            return ps;
        }, keyHolder);
        return keyHolder.getKey().longValue();
    }

    public Optional<WorkspaceDetails> findById(long workspaceId) {
        List<WorkspaceDetails> results = jdbcTemplate.query(SELECT_DETAILS + " WHERE w.id = ?",
            DETAILS_MAPPER, workspaceId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    public List<WorkspaceDetails> findByOwner(long userId) {
        return jdbcTemplate.query(SELECT_DETAILS + " WHERE w.user_id = ? ORDER BY w.created_at DESC",
            DETAILS_MAPPER, userId);
    }

    public List<WorkspaceDetails> findByStatus(QueryStatus status) {
        return jdbcTemplate.query(SELECT_DETAILS + " WHERE q.status = ? ORDER BY q.created_at",
            DETAILS_MAPPER, status.dbValue());
    }

    /**
     * Move the workspace's query from {@code expected} to {@code next} and update the workspace in the
     * same transaction. Nothing changes when the query is no longer in {@code expected}.
     *
     * @param showResults new flag value, or null to leave it unchanged
     * @return true when this call made the transition
     */
    public boolean transition(long workspaceId, QueryStatus expected, QueryStatus next, String description,
                              Boolean showResults) {
        if (!expected.canTransitionTo(next)) {
            throw new IllegalArgumentException("Illegal transition " + expected + " -> " + next);
        }

        Boolean applied = transactionTemplate.execute(status -> {
            String casSql = """
                UPDATE query_records SET status = ?, updated_at = ?
                WHERE id = (SELECT query_id FROM workspaces WHERE id = ?) AND status = ?
                """;
            int updated = jdbcTemplate.update(casSql,
                next.dbValue(), Timestamp.from(Instant.now()), workspaceId, expected.dbValue());
            if (updated == 0) {
                return false;
            }

            if (showResults == null) {
                jdbcTemplate.update("UPDATE workspaces SET description = ? WHERE id = ?", description, workspaceId);
            } else {
                jdbcTemplate.update("UPDATE workspaces SET description = ?, show_results = ? WHERE id = ?",
                    description, showResults, workspaceId);
            }
            return true;
        });

        if (Boolean.TRUE.equals(applied)) {
            log.info("🔄 Workspace {}: {} -> {}", workspaceId, expected.dbValue(), next.dbValue());
            return true;
        }
        return false;
    }

    /**
     * Replace the query text and target while the query is still in {@code expected} status
     *
     * @return true when the row was updated
     */
    public boolean updateQuery(long workspaceId, QueryStatus expected, String serverName, String databaseName,
                               String queryText, String name) {
        return Boolean.TRUE.equals(transactionTemplate.execute(status -> {
            String sql = """
                UPDATE query_records SET server_name = ?, database_name = ?, query_text = ?, updated_at = ?
                WHERE id = (SELECT query_id FROM workspaces WHERE id = ?) AND status = ?
                """;
            int updated = jdbcTemplate.update(sql, serverName, databaseName, queryText,
                Timestamp.from(Instant.now()), workspaceId, expected.dbValue());
            if (updated > 0 && name != null) {
                jdbcTemplate.update("UPDATE workspaces SET name = ? WHERE id = ?", name, workspaceId);
            }
            return updated > 0;
        }));
    }

    /**
     * Record the risk category found when a draft is sent for approval
     */
    public void updateRiskCategory(long workspaceId, RiskCategory riskCategory) {
        jdbcTemplate.update("""
            UPDATE query_records SET risk_category = ?
            WHERE id = (SELECT query_id FROM workspaces WHERE id = ?)
            """, riskCategory == null ? null : riskCategory.wireValue(), workspaceId);
    }

    /**
     * Delete a workspace by removing its query record; the workspace row follows by cascade
     */
    public boolean delete(long workspaceId) {
        int deleted = jdbcTemplate.update(
            "DELETE FROM query_records WHERE id = (SELECT query_id FROM workspaces WHERE id = ?)", workspaceId);
        if (deleted > 0) {
            log.info("✅ Deleted workspace {}", workspaceId);
        }
        return deleted > 0;
    }

    public void initializeTables() {
        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS query_records (
                id BIGSERIAL PRIMARY KEY,
                user_id BIGINT NOT NULL REFERENCES app_users(id),
                server_name VARCHAR(255) NOT NULL,
                database_name VARCHAR(255) NOT NULL,
                query_text TEXT NOT NULL,
                correlation_id VARCHAR(36) NOT NULL UNIQUE,
                status VARCHAR(32) NOT NULL,
                risk_category VARCHAR(32),
                created_at TIMESTAMP NOT NULL,
                updated_at TIMESTAMP NOT NULL
            )
            """);
        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS workspaces (
                id BIGSERIAL PRIMARY KEY,
                user_id BIGINT NOT NULL REFERENCES app_users(id),
                name VARCHAR(255) NOT NULL,
                description TEXT,
                query_id BIGINT NOT NULL UNIQUE REFERENCES query_records(id) ON DELETE CASCADE,
                show_results BOOLEAN,
                created_at TIMESTAMP NOT NULL
            )
            """);
        jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS query_records_status_idx ON query_records(status)");
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
