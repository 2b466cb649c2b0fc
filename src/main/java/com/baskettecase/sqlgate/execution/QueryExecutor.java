package com.baskettecase.sqlgate.execution;

import com.baskettecase.sqlgate.config.GatewayProperties;
import com.baskettecase.sqlgate.error.QueryExecutionException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.ColumnMapRowMapper;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.StatementCallback;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;
import org.springframework.jdbc.support.JdbcUtils;
import org.springframework.stereotype.Component;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Runs one statement on a checked-out connection with a query timeout and a row cap.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class QueryExecutor {

    private final GatewayProperties properties;

    private final ColumnMapRowMapper rowMapper = new ColumnMapRowMapper();

    /**
     * @param rowLimit rows to return; scanning stops after the row warning threshold
     * @throws QueryExecutionException when the database rejects or fails the statement
     */
    public QueryResult execute(Connection connection, String sql, int rowLimit) {
        GatewayProperties.Execution limits = properties.getExecution();
        int scanLimit = Math.max(rowLimit, limits.getRowWarningThreshold()) + 1;

        JdbcTemplate jdbcTemplate = new JdbcTemplate(new SingleConnectionDataSource(connection, true));
        jdbcTemplate.setQueryTimeout(limits.getQueryTimeoutSeconds());
        jdbcTemplate.setMaxRows(scanLimit);

        try {
            return jdbcTemplate.execute((StatementCallback<QueryResult>) statement -> {
                if (!statement.execute(sql)) {
                    return QueryResult.updated(statement.getUpdateCount());
                }
                try (ResultSet rs = statement.getResultSet()) {
                    return collect(rs, rowLimit, limits.getRowWarningThreshold());
                }
            });
        } catch (DataAccessException e) {
            String message = e.getMostSpecificCause().getMessage();
            log.warn("❌ Query failed: {}", message);
            throw new QueryExecutionException(message, e);
        }
    }

    private QueryResult collect(ResultSet rs, int rowLimit, int warningThreshold) throws SQLException {
        ResultSetMetaData metaData = rs.getMetaData();
        List<String> columns = new ArrayList<>(metaData.getColumnCount());
        for (int i = 1; i <= metaData.getColumnCount(); i++) {
            columns.add(JdbcUtils.lookupColumnName(metaData, i));
        }

        List<Map<String, Object>> rows = new ArrayList<>();
        int total = 0;
        while (rs.next()) {
            if (total < rowLimit) {
                rows.add(rowMapper.mapRow(rs, total));
            }
            total++;
        }

        boolean truncated = total > rows.size();
        String message;
        if (total > warningThreshold) {
            log.warn("⚠️ Query returned more than {} rows", warningThreshold);
            message = String.format("More than %d rows found, showing first %d", warningThreshold, rows.size());
        } else if (truncated) {
            message = String.format("%d rows found, showing first %d", total, rows.size());
        } else {
            message = String.format("%d rows found", total);
        }

        return new QueryResult(columns, rows, total, truncated, null, message);
    }
}
