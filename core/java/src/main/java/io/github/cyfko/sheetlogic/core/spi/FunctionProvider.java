package io.github.cyfko.sheetlogic.core.spi;

import java.util.Collection;

/**
 * Contributes a family of functions to a {@link FunctionRegistry}.
 * <p>
 * Builtins are grouped by family (math, aggregates, lookups, ...) and applications plug in
 * their own functions the same way:
 * </p>
 * <pre>{@code
 * FunctionProvider tax = () -> List.of(
 *     FunctionDefinition.of("VAT", FunctionSignature.exactly(1),
 *         args -> EvaluatedValue.number(Coercions.toNumber(args.value(0)) * 0.2)));
 *
 * FunctionRegistry registry = FunctionRegistry.withBuiltins();
 * registry.register(tax);
 * }</pre>
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface FunctionProvider {

    /**
     * @return the functions of this provider; names must be unique across a registry
     */
    Collection<FunctionDefinition> functions();
}
