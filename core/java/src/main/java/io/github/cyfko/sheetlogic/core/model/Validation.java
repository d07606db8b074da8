package io.github.cyfko.sheetlogic.core.model;

import io.github.cyfko.sheetlogic.core.exception.WorkbookDefinitionException;

import java.util.List;

/**
 * Data-validation metadata of an input cell.
 *
 * @param kind    rule kind
 * @param min     declared minimum, or null
 * @param max     declared maximum, or null
 * @param options declared list options (LIST rules only), never null
 * @since 1.0.0
 */
public record Validation(ValidationKind kind, Double min, Double max, List<String> options) {

    public Validation {
        if (kind == null)
            throw new WorkbookDefinitionException("validation kind cannot be null");
        if (min != null && max != null && min > max)
            throw new WorkbookDefinitionException("validation min " + min + " is greater than max " + max);
        options = options == null ? List.of() : List.copyOf(options);
        if (kind == ValidationKind.LIST && options.isEmpty())
            throw new WorkbookDefinitionException("LIST validation requires at least one option");
    }

    public static Validation number(Double min, Double max) {
        return new Validation(ValidationKind.NUMBER, min, max, List.of());
    }

    public static Validation integer(Double min, Double max) {
        return new Validation(ValidationKind.INTEGER, min, max, List.of());
    }

    public static Validation list(List<String> options) {
        return new Validation(ValidationKind.LIST, null, null, options);
    }
}
