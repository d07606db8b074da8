package io.github.cyfko.sheetlogic.core.spi;

import io.github.cyfko.sheetlogic.core.eval.functions.AggregateFunctions;
import io.github.cyfko.sheetlogic.core.eval.functions.DateFunctions;
import io.github.cyfko.sheetlogic.core.eval.functions.FinancialFunctions;
import io.github.cyfko.sheetlogic.core.eval.functions.LogicalFunctions;
import io.github.cyfko.sheetlogic.core.eval.functions.LookupFunctions;
import io.github.cyfko.sheetlogic.core.eval.functions.MathFunctions;
import io.github.cyfko.sheetlogic.core.eval.functions.TextFunctions;

import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of the functions a compilation can parse and evaluate.
 * <p>
 * Names are case-insensitive and stored upper-case. A name can only be registered once;
 * registering a provider that redefines an existing name fails without registering any of its
 * functions. The registry is thread-safe: parsing and evaluation read it concurrently.
 * </p>
 *
 * <p>
 * Each compiler owns its registry instance, so custom functions registered for one compilation
 * never leak into another.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class FunctionRegistry {

    private final Map<String, FunctionDefinition> functions = new ConcurrentHashMap<>();

    /**
     * Creates an empty registry.
     */
    public FunctionRegistry() {
    }

    /**
     * Creates a registry holding every builtin function family.
     *
     * @return a new registry
     */
    public static FunctionRegistry withBuiltins() {
        FunctionRegistry registry = new FunctionRegistry();
        registry.register(new MathFunctions());
        registry.register(new AggregateFunctions());
        registry.register(new LogicalFunctions());
        registry.register(new LookupFunctions());
        registry.register(new TextFunctions());
        registry.register(new DateFunctions());
        registry.register(new FinancialFunctions());
        return registry;
    }

    /**
     * Registers every function of a provider.
     *
     * @param provider the provider to register
     * @throws IllegalArgumentException if one of its names is already registered
     */
    public synchronized void register(FunctionProvider provider) {
        Objects.requireNonNull(provider, "provider");
        Set<String> seen = new TreeSet<>();
        for (FunctionDefinition definition : provider.functions()) {
            if (functions.containsKey(definition.name()) || !seen.add(definition.name())) {
                throw new IllegalArgumentException("Function [" + definition.name() + "] is already registered.");
            }
        }
        provider.functions().forEach(definition -> functions.put(definition.name(), definition));
    }

    /**
     * Removes the given function names.
     *
     * @param names names to remove, case-insensitively
     */
    public synchronized void unregister(Set<String> names) {
        for (String name : names) {
            functions.remove(name.trim().toUpperCase(Locale.ROOT));
        }
    }

    public Optional<FunctionDefinition> lookup(String name) {
        if (name == null || name.isBlank()) return Optional.empty();
        return Optional.ofNullable(functions.get(name.trim().toUpperCase(Locale.ROOT)));
    }

    public boolean isRegistered(String name) {
        return lookup(name).isPresent();
    }

    /**
     * Snapshot of the registered names.
     *
     * @return sorted, immutable set of upper-case names
     */
    public Set<String> names() {
        return Collections.unmodifiableSet(new TreeSet<>(functions.keySet()));
    }
}
