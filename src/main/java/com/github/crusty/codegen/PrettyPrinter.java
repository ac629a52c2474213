package com.github.crusty.codegen;

import java.util.ArrayList;
import java.util.List;

import com.github.crusty.parser.CompilationUnit;

/**
 * Canonical source text for a tree. Reading the output back with the parser of the same language
 * yields a tree equal to the input, spans aside.
 */
public class PrettyPrinter {

    public static String format(CompilationUnit unit, TargetLanguage language) {
        return format(unit, language, new CodeGenerator());
    }

    public static String format(CompilationUnit unit, TargetLanguage language, CodeGenerator generator) {
        return normalize(generator.generate(unit, language));
    }

    /**
     * Strips trailing whitespace, collapses runs of blank lines and ends the text with exactly
     * one newline.
     */
    static String normalize(String text) {
        List<String> lines = new ArrayList<>();
        boolean previousBlank = true;
        for (var line : text.split("\n", -1)) {
            var stripped = line.stripTrailing();
            if (stripped.isEmpty()) {
                if (!previousBlank) {
                    lines.add("");
                }
                previousBlank = true;
            } else {
                lines.add(stripped);
                previousBlank = false;
            }
        }
        while (!lines.isEmpty() && lines.get(lines.size() - 1).isEmpty()) {
            lines.remove(lines.size() - 1);
        }
        return lines.isEmpty() ? "" : String.join("\n", lines) + "\n";
    }
}
