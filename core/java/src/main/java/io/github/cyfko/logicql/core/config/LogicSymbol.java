package io.github.cyfko.logicql.core.config;

/**
 * Textual spellings of the logical operators recognized by the tokenizer.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class LogicSymbol {

    private LogicSymbol() {}

    public static final char OPEN_PAREN = '(';

    public static final char CLOSE_PAREN = ')';

    public static final char AND = '&';

    public static final char OR = '|';

    public static final char NOT = '!';

    /**
     * Material implication. Two characters.
     */
    public static final String IF_THEN = "->";

    /**
     * Biconditional. Three characters, matched before {@link #IF_THEN}.
     */
    public static final String IFF = "<->";

    /**
     * Characters that terminate a variable name candidate.
     */
    public static final String OPERATOR_CHARS = "()&|!<-";

    /**
     * Checks whether the given character terminates a variable name candidate.
     *
     * @param c the character to test
     * @return {@code true} if {@code c} belongs to an operator spelling
     */
    public static boolean isOperatorChar(char c) {
        return OPERATOR_CHARS.indexOf(c) >= 0;
    }
}
