package io.github.cyfko.tgrep.core.api;

import io.github.cyfko.tgrep.core.exception.UndefinedMacroException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable mapping from macro names to the predicates they stand for.
 * <p>
 * One environment is built per query, after every statement has been parsed, and is handed to
 * each predicate evaluation. Lookups of names the query never defined fail with
 * {@link UndefinedMacroException} at the moment evaluation reaches them.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class MacroEnvironment {

    private static final MacroEnvironment EMPTY = new MacroEnvironment(Map.of());

    private final Map<String, NodePredicate> definitions;

    private MacroEnvironment(Map<String, NodePredicate> definitions) {
        this.definitions = definitions;
    }

    /**
     * @return an environment without any macro
     */
    public static MacroEnvironment empty() {
        return EMPTY;
    }

    /**
     * Creates an environment holding a copy of the given definitions.
     *
     * @param definitions macro name to predicate
     * @return the environment
     */
    public static MacroEnvironment of(Map<String, NodePredicate> definitions) {
        Objects.requireNonNull(definitions, "definitions");
        if (definitions.isEmpty()) {
            return EMPTY;
        }
        return new MacroEnvironment(Collections.unmodifiableMap(new LinkedHashMap<>(definitions)));
    }

    /**
     * Looks a macro up.
     *
     * @param name macro name without the leading {@code @}
     * @return the macro's predicate
     * @throws UndefinedMacroException if no macro of that name is defined
     */
    public NodePredicate lookup(String name) {
        NodePredicate predicate = definitions.get(name);
        if (predicate == null) {
            throw new UndefinedMacroException(name);
        }
        return predicate;
    }

    public boolean isDefined(String name) {
        return definitions.containsKey(name);
    }

    public Set<String> names() {
        return definitions.keySet();
    }

    public int size() {
        return definitions.size();
    }

    @Override
    public String toString() {
        return "MacroEnvironment" + definitions.keySet();
    }
}
