package com.baskettecase.sqlgate.sql;

import java.util.Arrays;

/**
 * Risk categories in precedence order: a query matching several is reported under the first.
 */
public enum RiskCategory {
    SQL_INJECTION("sql_injection_risk", "Possible SQL injection"),
    DDL("ddl_pattern", "Schema-changing statement"),
    UNSCOPED_MUTATION("risky_pattern", "Statement affects or reads a whole table"),
    PERFORMANCE("performance_risk", "Potentially expensive query");

    private final String wireValue;
    private final String label;

    RiskCategory(String wireValue, String label) {
        this.wireValue = wireValue;
        this.label = label;
    }

    public String wireValue() {
        return wireValue;
    }

    public String label() {
        return label;
    }

    public static RiskCategory fromWireValue(String value) {
        return Arrays.stream(values())
            .filter(category -> category.wireValue.equalsIgnoreCase(value) || category.name().equalsIgnoreCase(value))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown risk category: " + value));
    }
}
