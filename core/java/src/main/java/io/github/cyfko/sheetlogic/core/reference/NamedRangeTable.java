package io.github.cyfko.sheetlogic.core.reference;

import io.github.cyfko.sheetlogic.core.model.NamedRange;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only, case-insensitive lookup of a workbook's named ranges.
 * <p>
 * The table is built once per snapshot and shared by every parsing thread.
 * </p>
 *
 * @since 1.0.0
 */
public final class NamedRangeTable {

    private static final NamedRangeTable EMPTY = new NamedRangeTable(Map.of());

    private final Map<String, NamedRange> byName;

    private NamedRangeTable(Map<String, NamedRange> byName) {
        this.byName = byName;
    }

    public static NamedRangeTable of(Collection<NamedRange> namedRanges) {
        Map<String, NamedRange> index = new HashMap<>();
        for (NamedRange namedRange : namedRanges) {
            index.put(normalize(namedRange.name()), namedRange);
        }
        return new NamedRangeTable(Collections.unmodifiableMap(index));
    }

    public static NamedRangeTable empty() {
        return EMPTY;
    }

    public Optional<NamedRange> lookup(String name) {
        if (name == null) return Optional.empty();
        return Optional.ofNullable(byName.get(normalize(name)));
    }

    public boolean isDefined(String name) {
        return lookup(name).isPresent();
    }

    public int size() {
        return byName.size();
    }

    private static String normalize(String name) {
        return name.trim().toUpperCase(Locale.ROOT);
    }
}
