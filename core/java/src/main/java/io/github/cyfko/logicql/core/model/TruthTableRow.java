package io.github.cyfko.logicql.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * One row of a truth table.
 *
 * @param index  the assignment index the row was generated from
 * @param values variable values, in the statement's variable order
 * @param result the value of the statement under this assignment
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record TruthTableRow(long index, List<Boolean> values, boolean result) {

    public TruthTableRow {
        Objects.requireNonNull(values, "Row values cannot be null");
        values = List.copyOf(values);
    }

    /**
     * @return the variable values followed by the result
     */
    public List<Boolean> cells() {
        List<Boolean> cells = new ArrayList<>(values.size() + 1);
        cells.addAll(values);
        cells.add(result);
        return cells;
    }
}
