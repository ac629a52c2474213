package com.github.crusty.error;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.github.crusty.parser.Parser;
import com.github.crusty.semantic.SemanticAnalyzer;

public class DiagnosticTest {

    @Test
    public void testSameMessageAtDifferentPlaces() {
        var unit = Parser.parse("void main() {\n    x = 1;\n    x = 2;\n}").unit();
        var errors = new SemanticAnalyzer().analyze(unit).errors();

        assertEquals(2, errors.size());
        assertEquals(errors.get(0).message(), errors.get(1).message());
        assertNotEquals(errors.get(0), errors.get(1));
    }

    @Test
    public void testEqualWhenPositionMatches() {
        var span = new Span(new Position(2, 5), new Position(2, 6));
        var first = new SemanticError(SemanticErrorKind.UNDEFINED_VARIABLE, "undefined variable x", span);
        var second = new SemanticError(SemanticErrorKind.UNDEFINED_VARIABLE, "undefined variable x",
                new Span(new Position(2, 5), new Position(2, 6)));

        assertEquals(first, second);
        assertEquals(first.hashCode(), second.hashCode());
        assertNotEquals(first, new SemanticError(SemanticErrorKind.UNDEFINED_VARIABLE, "undefined variable x",
                Span.of(3, 5)));
    }

    @Test
    public void testParseAndLexErrorsCompareByPosition() {
        var parse = new ParseError("invalid integer literal", List.of("integer"), "'9'", Span.of(1, 1));
        assertEquals(parse, new ParseError("invalid integer literal", List.of("integer"), "'9'", Span.of(1, 1)));
        assertNotEquals(parse, new ParseError("invalid integer literal", List.of("integer"), "'9'", Span.of(1, 2)));

        var lex = new LexError(LexError.Kind.UNEXPECTED_CHARACTER, "unexpected character '$'", Span.of(1, 1));
        assertNotEquals(lex, new LexError(LexError.Kind.UNEXPECTED_CHARACTER, "unexpected character '$'",
                Span.of(4, 1)));
    }

    @Test
    public void testTreeSpansStayStructural() {
        assertEquals(Span.of(1, 1), Span.of(9, 9));
        assertEquals(Parser.parse("int main() { return 0; }").unit(),
                Parser.parse("int main()\n{\n    return 0;\n}").unit());
    }
}
