package io.formulaxform.core.engine;

import io.formulaxform.core.error.DefinitionNotFoundException;
import io.formulaxform.core.error.DuplicateDefinitionException;
import io.formulaxform.core.model.FormulaDefinition;
import io.formulaxform.core.model.FormulaKey;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ordered registry of the formulas of one generation pass. Registration order is emission order
 * in the generated unit.
 *
 * <p>
 * Not thread-safe: one writer and one reader per pass, and one instance per pass.
 *
 * @param <D> definition type held by this registry
 */
public final class FormulaRegistry<D extends FormulaDefinition> {

    private static final Logger LOG = LoggerFactory.getLogger(FormulaRegistry.class);

    private final Map<FormulaKey, D> definitions = new LinkedHashMap<>();

    /**
     * Registers a definition under its own key.
     *
     * @throws NullPointerException         if definition is null
     * @throws DuplicateDefinitionException if the key already holds a definition; the registry is
     *                                      left unchanged
     */
    public void register(D definition) {
        if (definition == null) {
            throw new NullPointerException("definition must not be null");
        }
        FormulaKey key = definition.key();
        D prior = definitions.get(key);
        if (prior != null) {
            throw new DuplicateDefinitionException(
                    "Formula for " + describe(definition) + " was already defined:\n " + prior.expression(),
                    key.composite(),
                    prior.expression());
        }
        definitions.put(key, definition);
        LOG.debug("Registered formula '{}'", key);
    }

    /**
     * Replaces the definition held under the key of {@code definition}, keeping its position.
     *
     * @throws DefinitionNotFoundException if nothing is registered under that key
     */
    public void replace(D definition) {
        if (definition == null) {
            throw new NullPointerException("definition must not be null");
        }
        FormulaKey key = definition.key();
        if (!definitions.containsKey(key)) {
            throw notFound(key);
        }
        definitions.put(key, definition);
        LOG.debug("Replaced formula '{}'", key);
    }

    /**
     * Looks up a definition, throwing if not found.
     *
     * @throws DefinitionNotFoundException if nothing is registered under {@code key}
     */
    public D lookup(FormulaKey key) {
        return find(key).orElseThrow(() -> notFound(key));
    }

    /** Looks up a definition by key. */
    public Optional<D> find(FormulaKey key) {
        return Optional.ofNullable(definitions.get(key));
    }

    /** Definitions in registration order. */
    public List<D> all() {
        return List.copyOf(definitions.values());
    }

    public boolean contains(FormulaKey key) {
        return definitions.containsKey(key);
    }

    public int size() {
        return definitions.size();
    }

    public boolean isEmpty() {
        return definitions.isEmpty();
    }

    private static DefinitionNotFoundException notFound(FormulaKey key) {
        return new DefinitionNotFoundException("No formula registered for '" + key + "'", key.composite());
    }

    private static String describe(FormulaDefinition definition) {
        return "variable " + definition.targetName() + " in zone " + definition.zone();
    }
}
