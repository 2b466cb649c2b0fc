package com.baskettecase.sqlgate.execution;

import java.util.List;
import java.util.Map;

/**
 * Rows (or an update count) returned by one statement.
 *
 * @param totalRows rows seen while scanning, at most the scan limit
 * @param truncated true when more rows were found than returned
 */
public record QueryResult(
    List<String> columns,
    List<Map<String, Object>> rows,
    int totalRows,
    boolean truncated,
    Integer updateCount,
    String message
) {

    public static QueryResult updated(int updateCount) {
        return new QueryResult(List.of(), List.of(), 0, false, updateCount, updateCount + " rows affected");
    }

    public int rowCount() {
        return updateCount != null ? updateCount : rows.size();
    }
}
