package io.github.cyfko.tgrep.core.exception;

/**
 * Exception thrown when evaluation reaches a macro use ({@code @name}) that the query never
 * defines.
 * <p>
 * Macro uses may appear before their definitions, since all definitions of a query are collected
 * before anything is evaluated. The lookup therefore happens lazily: a query referencing an
 * undefined macro compiles fine and only fails once a candidate node actually reaches the
 * reference. Branches short-circuited away never raise it.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class UndefinedMacroException extends TgrepException {

    private final String macroName;

    /**
     * @param macroName the name that could not be resolved, without the leading {@code @}
     */
    public UndefinedMacroException(String macroName) {
        super("Macro @" + macroName + " is not defined");
        this.macroName = macroName;
    }

    /**
     * @return the unresolved macro name, without the leading {@code @}
     */
    public String getMacroName() {
        return macroName;
    }
}
