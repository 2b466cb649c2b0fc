package com.baskettecase.sqlgate.execution;

/**
 * Why a query runs, which decides its row cap and how it is logged.
 */
public enum ExecutionMode {
    /** Safe query, or any query from an administrator */
    DIRECT,
    /** Administrator inspecting a query waiting for approval */
    PREVIEW,
    /** Owner running a query an administrator approved */
    APPROVED
}
