package io.github.cyfko.sheetlogic.core.spi;

import java.util.Locale;
import java.util.Objects;

/**
 * A named function with its arity and body.
 *
 * @param name      function name, stored upper-case
 * @param signature declared arity
 * @param body      implementation
 * @since 1.0.0
 */
public record FunctionDefinition(String name, FunctionSignature signature, FormulaFunction body) {

    public FunctionDefinition {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("function name is required");
        }
        name = name.trim().toUpperCase(Locale.ROOT);
        Objects.requireNonNull(signature, "signature");
        Objects.requireNonNull(body, "body");
    }

    public static FunctionDefinition of(String name, FunctionSignature signature, FormulaFunction body) {
        return new FunctionDefinition(name, signature, body);
    }
}
