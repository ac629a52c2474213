package com.github.crusty.codegen;

import java.util.List;
import java.util.Set;

/**
 * Line-oriented text sink with an indentation level.
 */
class SourceWriter {

    private static final Set<String> NO_SPACE_BEFORE = Set.of(")", "]", ",", ";", ".");
    private static final Set<String> NO_SPACE_AFTER = Set.of("(", "[", ".", "$", "!");

    private final StringBuilder out = new StringBuilder();
    private final String indentUnit;
    private int indent = 0;

    SourceWriter(int indentWidth) {
        this.indentUnit = " ".repeat(indentWidth);
    }

    void indent() {
        indent++;
    }

    void outdent() {
        indent--;
    }

    void emitLineNl(String line, boolean doIndent) {
        emitLine(line, doIndent);
        emit("\n");
    }

    void emitLineNl(String line) {
        emitLineNl(line, true);
    }

    void emitLine(String line, boolean doIndent) {
        for (int i = 0; i < indent && doIndent; i++) {
            emit(indentUnit);
        }
        emit(line);
    }

    void emit(String text) {
        out.append(text);
    }

    void blankLine() {
        out.append('\n');
    }

    @Override
    public String toString() {
        return out.toString();
    }

    /**
     * Joins raw token images with single spaces, leaving out the space inside brackets, before
     * separators and between a name and its argument list.
     */
    static String joinTokens(List<String> images) {
        var sb = new StringBuilder();
        String previous = null;
        for (var image : images) {
            if (previous != null && needsSpace(previous, image)) {
                sb.append(' ');
            }
            sb.append(image);
            previous = image;
        }
        return sb.toString();
    }

    private static boolean needsSpace(String previous, String next) {
        if (NO_SPACE_AFTER.contains(previous) || NO_SPACE_BEFORE.contains(next)) {
            return false;
        }
        if (next.equals("(") || next.equals("[")) {
            return !(isWord(previous) || previous.endsWith(")") || previous.endsWith("]") || previous.endsWith("!"));
        }
        return true;
    }

    private static boolean isWord(String image) {
        return Character.isJavaIdentifierPart(image.charAt(image.length() - 1));
    }
}
