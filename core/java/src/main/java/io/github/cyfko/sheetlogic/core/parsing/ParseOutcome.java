package io.github.cyfko.sheetlogic.core.parsing;

import io.github.cyfko.sheetlogic.core.ast.FormulaNode;

import java.util.List;

/**
 * Result of parsing one formula: either an AST with the unsupported constructs it contains, or
 * the error that stopped parsing.
 *
 * @param ast         the tree, null on failure
 * @param unsupported constructs the compiler cannot translate, empty on failure
 * @param error       the failure, null on success
 * @since 1.0.0
 */
public record ParseOutcome(FormulaNode ast, List<UnsupportedConstruct> unsupported, FormulaError error) {

    public ParseOutcome {
        if ((ast == null) == (error == null)) {
            throw new IllegalArgumentException("exactly one of ast and error must be set");
        }
        unsupported = unsupported == null ? List.of() : List.copyOf(unsupported);
    }

    public static ParseOutcome success(FormulaNode ast, List<UnsupportedConstruct> unsupported) {
        return new ParseOutcome(ast, unsupported, null);
    }

    public static ParseOutcome failure(FormulaError error) {
        return new ParseOutcome(null, List.of(), error);
    }

    public boolean isSuccess() {
        return error == null;
    }
}
