package com.github.crusty.parser;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import com.github.crusty.parser.CompilationUnit.MacroDelimiter;

/**
 * Delimiter kinds bound to macro names by their {@code #define}. One registry belongs to one
 * parse and is dropped with it.
 */
public class MacroRegistry {

    private final Map<String, MacroDelimiter> delimiters = new HashMap<>();

    /**
     * Registers a definition. Returns the delimiter of an earlier definition of the same name, if
     * there was one.
     */
    public Optional<MacroDelimiter> define(String name, MacroDelimiter delimiter) {
        return Optional.ofNullable(delimiters.put(name, delimiter));
    }

    public Optional<MacroDelimiter> delimiterOf(String name) {
        return Optional.ofNullable(delimiters.get(name));
    }

    public boolean accepts(String name, MacroDelimiter used) {
        return delimiterOf(name).map(d -> d == used).orElse(true);
    }

    public static boolean isMacroName(String name) {
        return name.length() > 4 && name.startsWith("__") && name.endsWith("__");
    }
}
