package com.github.crusty;

import static com.github.crusty.Tokenizer.TokenType.*;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import com.github.crusty.Tokenizer.Dialect;
import com.github.crusty.Tokenizer.Token;
import com.github.crusty.Tokenizer.TokenType;
import com.github.crusty.error.LexError;
import com.github.crusty.error.Position;

public class TokenizerTest {

    @ParameterizedTest
    @MethodSource("crustyTokens")
    public void testCrustyTokens(String code, List<TokenType> expected) {
        assertEquals(expected, types(new Tokenizer().tokenize(code).all()));
    }

    @ParameterizedTest
    @MethodSource("rustTokens")
    public void testRustTokens(String code, List<TokenType> expected) {
        assertEquals(expected, types(new Tokenizer(Dialect.RUST).tokenize(code).all()));
    }

    @ParameterizedTest
    @MethodSource("lexErrors")
    public void testLexErrors(String code, LexError.Kind expected) {
        var tokens = new Tokenizer().tokenize(code);
        tokens.all();
        var errors = tokens.errors();
        assertEquals(1, errors.size());
        assertEquals(expected, errors.get(0).kind());
    }

    private static Object[][] crustyTokens() {
        return new Object[][] {
            { "let x = 5;", List.of(LET, IDENTIFIER, EQUALS, INT_LITERAL, SEMICOLON, EOF) },
            { "a ..= b", List.of(IDENTIFIER, DOT_DOT_EQUALS, IDENTIFIER, EOF) },
            { "1..10", List.of(INT_LITERAL, DOT_DOT, INT_LITERAL, EOF) },
            { "x >>= 1", List.of(IDENTIFIER, SHR_EQUALS, INT_LITERAL, EOF) },
            { "int* p", List.of(PRIMITIVE, STAR, IDENTIFIER, EOF) },
            { "fn main", List.of(IDENTIFIER, IDENTIFIER, EOF) },
            { "p->x", List.of(IDENTIFIER, ARROW, IDENTIFIER, EOF) },
            { "x.0.1", List.of(IDENTIFIER, DOT, FLOAT_LITERAL, EOF) },
            { "a // line\n b /* block */ c", List.of(IDENTIFIER, IDENTIFIER, IDENTIFIER, EOF) },
            { "@Vec(int).new()", List.of(AT, IDENTIFIER, LPAREN, PRIMITIVE, RPAREN, DOT, IDENTIFIER, LPAREN, RPAREN, EOF) },
            { "#define __X__ 1", List.of(HASH, IDENTIFIER, IDENTIFIER, INT_LITERAL, EOF) },
            { "'a' \"s\"", List.of(CHAR_LITERAL, STRING_LITERAL, EOF) },
            { "", List.of(EOF) },
        };
    }

    private static Object[][] rustTokens() {
        return new Object[][] {
            { "fn main", List.of(FN, IDENTIFIER, EOF) },
            { "'outer: loop", List.of(LIFETIME, COLON, LOOP, EOF) },
            { "'a'", List.of(CHAR_LITERAL, EOF) },
            { "10u8 1.5f32", List.of(INT_LITERAL, FLOAT_LITERAL, EOF) },
            { "std::mem", List.of(IDENTIFIER, COLON_COLON, IDENTIFIER, EOF) },
            { "let mut x: i32", List.of(LET, MUT, IDENTIFIER, COLON, IDENTIFIER, EOF) },
            { "|a| a => b", List.of(PIPE, IDENTIFIER, PIPE, IDENTIFIER, FAT_ARROW, IDENTIFIER, EOF) },
        };
    }

    private static Object[][] lexErrors() {
        return new Object[][] {
            { "\"abc", LexError.Kind.UNTERMINATED_STRING },
            { "a /* abc", LexError.Kind.UNTERMINATED_COMMENT },
            { "\"a\\qb\"", LexError.Kind.INVALID_ESCAPE },
            { "a ` b", LexError.Kind.UNEXPECTED_CHARACTER },
        };
    }

    @Test
    public void testScanningContinuesAfterUnexpectedCharacter() {
        var tokens = new Tokenizer().tokenize("a ` b");
        assertEquals(List.of(IDENTIFIER, IDENTIFIER, EOF), types(tokens.all()));
        assertEquals("unexpected character '`'", tokens.errors().get(0).message());
    }

    @Test
    public void testRustKeepsUnknownEscapes() {
        var tokens = new Tokenizer(Dialect.RUST).tokenize("\"a\\qb\"");
        tokens.all();
        assertTrue(tokens.errors().isEmpty());
    }

    @Test
    public void testPositions() {
        var all = new Tokenizer().tokenize("let x\n  = 5").all();
        assertEquals(new Position(1, 5), all.get(1).span().start());
        assertEquals(new Position(2, 3), all.get(2).span().start());
        assertEquals(new Position(2, 5), all.get(3).span().start());
    }

    @Test
    public void testLiteralSuffixStaysInImage() {
        var all = new Tokenizer(Dialect.RUST).tokenize("10u8").all();
        assertEquals("10u8", all.get(0).image());
    }

    @Test
    public void testDocComments() {
        var tokens = new Tokenizer().tokenize("//! module doc\n/// item\nint x;\n/** inner\n * more */");
        assertEquals(List.of("module doc", "item"), tokens.leadingDocComments());
        tokens.all();
        assertEquals(List.of("module doc", "item", "inner", "more"), tokens.docComments());
    }

    @Test
    public void testCloseAngleSplitsShift() {
        var tokens = new Tokenizer().tokenize("Vec<Vec<int>> x");
        for (int i = 0; i < 5; i++) {
            tokens.next();
        }
        assertEquals(SHR, tokens.peek().type());
        tokens.nextCloseAngle();
        assertEquals(GT, tokens.peek().type());
        tokens.nextCloseAngle();
        assertEquals(IDENTIFIER, tokens.peek().type());
    }

    @Test
    public void testDecodeAndEscape() {
        assertEquals("a\nb\"", Tokenizer.decode("\"a\\nb\\\"\""));
        assertEquals("a\\\"b\\n", Tokenizer.escape("a\"b\n", '"'));
        assertEquals("'", Tokenizer.decode("'\\''"));
    }

    private static List<TokenType> types(List<Token> tokens) {
        return tokens.stream().map(Token::type).toList();
    }
}
