package io.github.cyfko.logicql.core.table;

import io.github.cyfko.logicql.core.impl.BasicLogicParser;
import io.github.cyfko.logicql.core.model.TruthTable;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TruthTableFormatter Tests")
class TruthTableFormatterTest {

    private final BasicLogicParser parser = new BasicLogicParser();

    @Test
    @DisplayName("Full table layout")
    void testFullTable() {
        TruthTable table = TruthTableGenerator.generate(parser.parse("a&b|!(c|a)"));

        String expected = ""
                + "a     | b     | c     | value | \n"
                + "--------------------------------\n"
                + "False | False | False | True  | \n"
                + "False | False | True  | False | \n"
                + "False | True  | False | True  | \n"
                + "False | True  | True  | False | \n"
                + "True  | False | False | False | \n"
                + "True  | False | True  | False | \n"
                + "True  | True  | False | True  | \n"
                + "True  | True  | True  | True  | \n";

        assertEquals(expected, TruthTableFormatter.format(table));
    }

    @Test
    @DisplayName("Long variable names widen their column")
    void testLongNames() {
        TruthTable table = TruthTableGenerator.generate(parser.parse("long_name -> b"), 2, 4);

        String expected = ""
                + "long_name | b     | value | \n"
                + "----------------------------\n"
                + "True      | False | False | \n"
                + "True      | True  | True  | \n";

        assertEquals(expected, TruthTableFormatter.format(table));
    }

    @Test
    @DisplayName("Empty range prints only the header")
    void testEmptyRange() {
        TruthTable table = TruthTableGenerator.generate(parser.parse("p"), 0, 0);
        assertEquals("p     | value | \n----------------\n", TruthTableFormatter.format(table));
    }
}
