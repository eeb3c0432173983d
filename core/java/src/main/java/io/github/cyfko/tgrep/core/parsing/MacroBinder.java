package io.github.cyfko.tgrep.core.parsing;

import io.github.cyfko.tgrep.core.api.MacroEnvironment;
import io.github.cyfko.tgrep.core.api.NodePredicate;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Collects the macro definitions of one query and freezes them into a {@link MacroEnvironment}.
 * <p>
 * Definitions are recorded in statement order; redefining a name replaces the earlier definition.
 * Since macro references are resolved at evaluation time, a statement may use a macro defined by a
 * later statement of the same query.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class MacroBinder {

    private static final Logger log = Logger.getLogger(MacroBinder.class.getName());

    private final Map<String, NodePredicate> definitions = new LinkedHashMap<>();

    /**
     * Records a definition.
     *
     * @param name      the macro name, without {@code @}
     * @param predicate the compiled body
     */
    public void define(String name, NodePredicate predicate) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(predicate, "predicate");
        if (definitions.put(name, predicate) != null) {
            log.fine(() -> String.format("Macro @%s redefined, the later definition wins", name));
        }
    }

    /**
     * @return the number of distinct macro names defined so far
     */
    public int size() {
        return definitions.size();
    }

    /**
     * @return an immutable environment holding the definitions recorded so far
     */
    public MacroEnvironment bind() {
        return MacroEnvironment.of(definitions);
    }
}
