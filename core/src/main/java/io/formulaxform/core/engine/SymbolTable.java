package io.formulaxform.core.engine;

import io.formulaxform.core.model.ResolvedSymbol;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Classification result of one formula: every identifier mapped to its {@link ResolvedSymbol},
 * in the order the names were first met. Names that resolved to nothing are kept apart and are
 * emitted verbatim.
 */
public final class SymbolTable {

    private final Map<String, ResolvedSymbol> symbols = new LinkedHashMap<>();
    private final Set<String> unresolved = new LinkedHashSet<>();

    void put(ResolvedSymbol symbol) {
        symbols.putIfAbsent(symbol.name(), symbol);
    }

    void markUnresolved(String name) {
        unresolved.add(name);
    }

    /** {@code true} if {@code name} was already classified, resolved or not. */
    public boolean isKnown(String name) {
        return symbols.containsKey(name) || unresolved.contains(name);
    }

    public Optional<ResolvedSymbol> resolve(String name) {
        return Optional.ofNullable(symbols.get(name));
    }

    /** Resolved symbols in first-occurrence order. */
    public List<ResolvedSymbol> symbols() {
        return List.copyOf(symbols.values());
    }

    /** Names emitted verbatim because nothing resolved them. */
    public Set<String> unresolved() {
        return Collections.unmodifiableSet(unresolved);
    }

    /** {@code true} if any symbol reads the block's coordinate array. */
    public boolean needsCoordinates() {
        for (ResolvedSymbol symbol : symbols.values()) {
            if (symbol.needsCoordinates()) {
                return true;
            }
        }
        return false;
    }

    /** Block-level declarations, one per symbol that needs one, in first-occurrence order. */
    public List<String> declarations() {
        List<String> lines = new ArrayList<>();
        for (ResolvedSymbol symbol : symbols.values()) {
            symbol.declaration().ifPresent(lines::add);
        }
        return lines;
    }

    /** Per-element bindings for the loop indexed by {@code indexVar}, in first-occurrence order. */
    public List<String> elementBindings(String indexVar) {
        List<String> lines = new ArrayList<>();
        for (ResolvedSymbol symbol : symbols.values()) {
            symbol.elementBinding(indexVar).ifPresent(lines::add);
        }
        return lines;
    }
}
