package io.github.cyfko.sheetlogic.core.value;

import java.util.Arrays;
import java.util.Optional;

/**
 * Kinds of error values a formula can evaluate to.
 * <p>
 * The first six kinds mirror the error literals of spreadsheet applications and may appear in
 * formula text. The remaining kinds are produced by the compiler itself and have no literal form
 * in the formula grammar.
 * </p>
 *
 * @since 1.0.0
 */
public enum ErrorKind {
    VALUE("#VALUE!", true),
    DIV_ZERO("#DIV/0!", true),
    NOT_FOUND("#N/A", true),
    REF("#REF!", true),
    NAME("#NAME?", true),
    NUM("#NUM!", true),
    NULL("#NULL!", true),
    CIRCULAR_REFERENCE("#CIRCULAR!", false),
    DID_NOT_CONVERGE("#DIDNOTCONVERGE!", false),
    UNSUPPORTED("#UNSUPPORTED!", false),
    PARSE("#PARSE!", false);

    private final String code;
    private final boolean literal;

    ErrorKind(String code, boolean literal) {
        this.code = code;
        this.literal = literal;
    }

    /**
     * Returns the display code, e.g. {@code #DIV/0!}.
     *
     * @return the error code
     */
    public String code() {
        return code;
    }

    /**
     * Looks up an error kind by its literal code, case-insensitively.
     * Only kinds that can be written in formula text are matched.
     *
     * @param code the literal code
     * @return the matching kind, or empty
     */
    public static Optional<ErrorKind> fromLiteral(String code) {
        if (code == null) return Optional.empty();
        return Arrays.stream(values())
                .filter(kind -> kind.literal && kind.code.equalsIgnoreCase(code))
                .findFirst();
    }

    /**
     * Returns the literal codes in descending length, so that a lexer can match greedily.
     *
     * @return the literal codes
     */
    public static String[] literalCodes() {
        return Arrays.stream(values())
                .filter(kind -> kind.literal)
                .map(ErrorKind::code)
                .sorted((a, b) -> Integer.compare(b.length(), a.length()))
                .toArray(String[]::new);
    }
}
