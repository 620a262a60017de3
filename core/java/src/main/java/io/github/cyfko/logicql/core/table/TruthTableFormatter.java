package io.github.cyfko.logicql.core.table;

import io.github.cyfko.logicql.core.model.TruthTable;
import io.github.cyfko.logicql.core.model.TruthTableRow;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Renders a {@link TruthTable} as a fixed-width text grid.
 *
 * <pre>
 * a     | b     | c     | value |
 * --------------------------------
 * False | False | False | True  |
 * False | False | True  | False |
 * </pre>
 *
 * <p>
 * One column per variable in declaration order, then a {@code value} column. A cell is at least
 * as wide as {@code "False "} and at least one character wider than its column name; every cell
 * is followed by {@code "| "}. The dashed rule is as long as the header line.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class TruthTableFormatter {

    public static final String VALUE_COLUMN = "value";

    private static final String CELL_SEPARATOR = "| ";
    private static final String TRUE_CELL = "True  ";
    private static final String FALSE_CELL = "False ";

    private TruthTableFormatter() {}

    public static String format(TruthTable table) {
        Objects.requireNonNull(table, "Truth table cannot be null");

        List<String> columns = new ArrayList<>(table.variables());
        columns.add(VALUE_COLUMN);

        StringBuilder header = new StringBuilder();
        for (String column : columns) {
            header.append(padRight(column + " ", FALSE_CELL.length())).append(CELL_SEPARATOR);
        }

        StringBuilder out = new StringBuilder();
        out.append(header).append('\n');
        out.append("-".repeat(header.length())).append('\n');

        for (TruthTableRow row : table.rows()) {
            List<Boolean> cells = row.cells();
            for (int i = 0; i < cells.size(); i++) {
                String cell = cells.get(i) ? TRUE_CELL : FALSE_CELL;
                out.append(padRight(cell, columns.get(i).length() + 1)).append(CELL_SEPARATOR);
            }
            out.append('\n');
        }
        return out.toString();
    }

    private static String padRight(String text, int width) {
        if (text.length() >= width) {
            return text;
        }
        return text + " ".repeat(width - text.length());
    }
}
