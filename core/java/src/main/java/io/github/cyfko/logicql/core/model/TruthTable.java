package io.github.cyfko.logicql.core.model;

import io.github.cyfko.logicql.core.api.Statement;

import java.util.List;
import java.util.Objects;

/**
 * Rows of a statement's truth table covering the assignment indices {@code [start, end)}.
 *
 * @param statement the statement the table was generated from
 * @param start     first assignment index (inclusive)
 * @param end       last assignment index (exclusive)
 * @param rows      rows in increasing index order
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record TruthTable(Statement statement, long start, long end, List<TruthTableRow> rows) {

    public TruthTable {
        Objects.requireNonNull(statement, "Statement cannot be null");
        Objects.requireNonNull(rows, "Rows cannot be null");
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid row range [" + start + ", " + end + ")");
        }
        if (rows.size() != end - start) {
            throw new IllegalArgumentException("Expected " + (end - start) + " rows, got " + rows.size());
        }
        rows = List.copyOf(rows);
    }

    /**
     * @return column names of the variable cells, in order
     */
    public List<String> variables() {
        return statement.variables();
    }

    public int size() {
        return rows.size();
    }

    /**
     * Returns the row generated for a given assignment index.
     *
     * @param index an assignment index within {@code [start, end)}
     * @return the matching row
     * @throws IndexOutOfBoundsException if the index is outside the table's range
     */
    public TruthTableRow row(long index) {
        if (index < start || index >= end) {
            throw new IndexOutOfBoundsException("Index " + index + " outside [" + start + ", " + end + ")");
        }
        return rows.get((int) (index - start));
    }
}
