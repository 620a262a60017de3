package io.github.cyfko.logicql.core.table;

import io.github.cyfko.logicql.core.api.Statement;
import io.github.cyfko.logicql.core.model.TruthTable;
import io.github.cyfko.logicql.core.model.TruthTableRow;
import io.github.cyfko.logicql.core.model.VariableRegistry;
import io.github.cyfko.logicql.core.parsing.StatementEvaluator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.logging.Logger;

/**
 * Enumerates variable assignments of a {@link Statement} and evaluates it for each of them.
 *
 * <h2>Assignment indices</h2>
 * <p>
 * A statement with {@code n} variables has {@code 2^n} assignments, numbered {@code 0 .. 2^n - 1}.
 * Bit {@code j} of an index (bit 0 being the least significant) is the value of the {@code j}-th
 * variable counted from the <em>end</em> of the declaration order. The last declared variable
 * therefore changes fastest and the first declared one slowest:
 * </p>
 * <pre>
 * "a &amp; b"   index  a      b
 *           0      false  false
 *           1      false  true
 *           2      true   false
 *           3      true   true
 * </pre>
 *
 * <p>
 * Row cells are always listed in declaration order. Generation is sequential and mutates a
 * registry copy owned by the call; {@link #generateParallel(Statement, int, Executor)} gives each
 * chunk its own copy.
 * </p>
 *
 * <p>
 * <strong>Cost:</strong> a full table takes {@code O(2^n)} evaluations, each linear in the token
 * count (quadratic in the longest operator run).
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class TruthTableGenerator {

    private static final Logger logger = Logger.getLogger(TruthTableGenerator.class.getName());

    /**
     * Highest variable count whose full assignment space still fits in a {@code long} index.
     * Larger statements can only be enumerated over explicit ranges.
     */
    public static final int MAX_VARIABLES = Long.SIZE - 2;

    private static final int INITIAL_ROW_CAPACITY = 1 << 16;

    private TruthTableGenerator() {}

    /**
     * Generates the full truth table.
     *
     * @param statement the statement to enumerate
     * @return all {@code 2^n} rows
     * @throws IllegalArgumentException if the statement has more than {@link #MAX_VARIABLES} variables
     */
    public static TruthTable generate(Statement statement) {
        Objects.requireNonNull(statement, "Statement cannot be null");
        return generate(statement, 0, rowCount(statement));
    }

    /**
     * Generates the rows from {@code start} to the end of the table.
     *
     * @param statement the statement to enumerate
     * @param start     first assignment index (inclusive)
     * @return rows {@code [start, 2^n)}
     * @throws IllegalArgumentException if {@code start} is out of range or the statement has more than
     *                                  {@link #MAX_VARIABLES} variables
     */
    public static TruthTable generate(Statement statement, long start) {
        Objects.requireNonNull(statement, "Statement cannot be null");
        return generate(statement, start, rowCount(statement));
    }

    /**
     * Generates the rows of a contiguous range of assignment indices.
     *
     * @param statement the statement to enumerate
     * @param start     first assignment index (inclusive)
     * @param end       last assignment index (exclusive)
     * @return rows {@code [start, end)} in increasing index order
     * @throws IllegalArgumentException if the range is outside {@code [0, 2^n]} or reversed
     */
    public static TruthTable generate(Statement statement, long start, long end) {
        Objects.requireNonNull(statement, "Statement cannot be null");
        checkRange(statement, start, end);

        long begin = System.nanoTime();

        VariableRegistry registry = statement.registry();
        List<String> order = statement.variables();
        List<String> assignmentOrder = new ArrayList<>(order);
        Collections.reverse(assignmentOrder);

        List<TruthTableRow> rows = new ArrayList<>((int) Math.min(end - start, INITIAL_ROW_CAPACITY));
        for (long index = start; index < end; index++) {
            for (int bit = 0; bit < assignmentOrder.size(); bit++) {
                registry.set(assignmentOrder.get(bit), isSet(index, bit));
            }

            boolean result = StatementEvaluator.evaluate(statement.tokens(), registry);

            List<Boolean> values = new ArrayList<>(order.size());
            for (String name : order) {
                values.add(registry.get(name));
            }
            rows.add(new TruthTableRow(index, values, result));
        }

        long durationMs = (System.nanoTime() - begin) / 1_000_000;
        logger.fine(() -> String.format(
                "Generated rows [%d, %d) of %s in %d ms", start, end, statement.expression(), durationMs
        ));

        return new TruthTable(statement, start, end, rows);
    }

    /**
     * Generates the full truth table in chunks of at most {@code chunkSize} rows, each chunk
     * evaluated on its own registry copy by the given executor.
     *
     * @param statement the statement to enumerate
     * @param chunkSize maximum number of rows per task
     * @param executor  executor running the chunk tasks
     * @return all {@code 2^n} rows, in index order
     * @throws IllegalArgumentException   if {@code chunkSize} is not positive
     * @throws RejectedExecutionException if the executor refuses a chunk; chunks already submitted are cancelled
     */
    public static TruthTable generateParallel(Statement statement, int chunkSize, Executor executor) {
        Objects.requireNonNull(statement, "Statement cannot be null");
        Objects.requireNonNull(executor, "Executor cannot be null");
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be positive, got: " + chunkSize);
        }

        long total = rowCount(statement);
        long begin = System.nanoTime();

        List<CompletableFuture<TruthTable>> chunks = new ArrayList<>();
        List<TruthTableRow> rows = new ArrayList<>((int) Math.min(total, INITIAL_ROW_CAPACITY));
        try {
            for (long chunkStart = 0; chunkStart < total; chunkStart += chunkSize) {
                final long from = chunkStart;
                final long to = Math.min(total, chunkStart + chunkSize);
                chunks.add(CompletableFuture.supplyAsync(() -> generate(statement, from, to), executor));
            }
            for (CompletableFuture<TruthTable> chunk : chunks) {
                rows.addAll(chunk.join().rows());
            }
        } catch (CompletionException | CancellationException | RejectedExecutionException e) {
            // chunks still queued or running are abandoned
            chunks.forEach(chunk -> chunk.cancel(true));
            logger.warning(() -> "Chunked generation of " + statement.expression() + " failed: " + e.getMessage());
            if (e instanceof CompletionException && e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }

        long durationMs = (System.nanoTime() - begin) / 1_000_000;
        logger.info(() -> String.format(
                "Generated %d rows of %s in %d chunks in %d ms", total, statement.expression(), chunks.size(), durationMs
        ));

        return new TruthTable(statement, 0, total, rows);
    }

    /**
     * @param statement the statement to enumerate
     * @return {@code 2^n} for a statement of {@code n} variables
     * @throws IllegalArgumentException if the statement has more than {@link #MAX_VARIABLES} variables
     */
    public static long rowCount(Statement statement) {
        int variables = statement.variableCount();
        if (variables > MAX_VARIABLES) {
            throw new IllegalArgumentException(String.format(
                    "Cannot enumerate %d variables (max: %d)", variables, MAX_VARIABLES
            ));
        }
        return 1L << variables;
    }

    private static void checkRange(Statement statement, long start, long end) {
        if (start < 0 || start > end) {
            throw new IllegalArgumentException(String.format("Invalid row range [%d, %d)", start, end));
        }
        // beyond MAX_VARIABLES, 2^n exceeds every long
        if (statement.variableCount() <= MAX_VARIABLES && end > rowCount(statement)) {
            throw new IllegalArgumentException(String.format(
                    "Invalid row range [%d, %d) for a table of %d rows", start, end, rowCount(statement)
            ));
        }
    }

    /**
     * Bit {@code bit} of {@code index}. Indices are non-negative longs, so bits 63 and above are clear.
     */
    private static boolean isSet(long index, int bit) {
        return bit < Long.SIZE - 1 && ((index >>> bit) & 1L) == 1L;
    }
}
