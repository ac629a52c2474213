package com.github.crusty.parser;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import com.github.crusty.Tokenizer;
import com.github.crusty.error.ParseError;
import com.github.crusty.error.SemanticError;
import com.github.crusty.error.SemanticErrorKind;
import com.github.crusty.error.Span;
import com.github.crusty.parser.CompilationUnit.ArrayRepeat;
import com.github.crusty.parser.CompilationUnit.ArrayType;
import com.github.crusty.parser.CompilationUnit.Binary;
import com.github.crusty.parser.CompilationUnit.BinaryOperator;
import com.github.crusty.parser.CompilationUnit.Block;
import com.github.crusty.parser.CompilationUnit.BreakStatement;
import com.github.crusty.parser.CompilationUnit.Call;
import com.github.crusty.parser.CompilationUnit.Cast;
import com.github.crusty.parser.CompilationUnit.CharLiteral;
import com.github.crusty.parser.CompilationUnit.ConstDeclaration;
import com.github.crusty.parser.CompilationUnit.EnumDefinition;
import com.github.crusty.parser.CompilationUnit.EnumVariant;
import com.github.crusty.parser.CompilationUnit.ErrorPropagation;
import com.github.crusty.parser.CompilationUnit.ExplicitGenericCall;
import com.github.crusty.parser.CompilationUnit.Expression;
import com.github.crusty.parser.CompilationUnit.ExpressionStatement;
import com.github.crusty.parser.CompilationUnit.FallibleType;
import com.github.crusty.parser.CompilationUnit.Field;
import com.github.crusty.parser.CompilationUnit.FieldAccess;
import com.github.crusty.parser.CompilationUnit.FieldInit;
import com.github.crusty.parser.CompilationUnit.FloatLiteral;
import com.github.crusty.parser.CompilationUnit.ForInStatement;
import com.github.crusty.parser.CompilationUnit.ForStatement;
import com.github.crusty.parser.CompilationUnit.FunctionDeclaration;
import com.github.crusty.parser.CompilationUnit.FunctionType;
import com.github.crusty.parser.CompilationUnit.GotoStatement;
import com.github.crusty.parser.CompilationUnit.Identifier;
import com.github.crusty.parser.CompilationUnit.IfStatement;
import com.github.crusty.parser.CompilationUnit.Import;
import com.github.crusty.parser.CompilationUnit.Include;
import com.github.crusty.parser.CompilationUnit.Index;
import com.github.crusty.parser.CompilationUnit.IntLiteral;
import com.github.crusty.parser.CompilationUnit.Item;
import com.github.crusty.parser.CompilationUnit.LetStatement;
import com.github.crusty.parser.CompilationUnit.LoopStatement;
import com.github.crusty.parser.CompilationUnit.MacroCall;
import com.github.crusty.parser.CompilationUnit.MacroDefinition;
import com.github.crusty.parser.CompilationUnit.MacroDelimiter;
import com.github.crusty.parser.CompilationUnit.Namespace;
import com.github.crusty.parser.CompilationUnit.NamedType;
import com.github.crusty.parser.CompilationUnit.NestedFunction;
import com.github.crusty.parser.CompilationUnit.Parameter;
import com.github.crusty.parser.CompilationUnit.PointerType;
import com.github.crusty.parser.CompilationUnit.PrimitiveType;
import com.github.crusty.parser.CompilationUnit.Range;
import com.github.crusty.parser.CompilationUnit.ReferenceType;
import com.github.crusty.parser.CompilationUnit.ReturnStatement;
import com.github.crusty.parser.CompilationUnit.SliceType;
import com.github.crusty.parser.CompilationUnit.Sizeof;
import com.github.crusty.parser.CompilationUnit.Statement;
import com.github.crusty.parser.CompilationUnit.StaticDeclaration;
import com.github.crusty.parser.CompilationUnit.StringLiteral;
import com.github.crusty.parser.CompilationUnit.StructDefinition;
import com.github.crusty.parser.CompilationUnit.StructInit;
import com.github.crusty.parser.CompilationUnit.SwitchCase;
import com.github.crusty.parser.CompilationUnit.SwitchStatement;
import com.github.crusty.parser.CompilationUnit.Ternary;
import com.github.crusty.parser.CompilationUnit.TupleLiteral;
import com.github.crusty.parser.CompilationUnit.TupleType;
import com.github.crusty.parser.CompilationUnit.Type;
import com.github.crusty.parser.CompilationUnit.TypeAlias;
import com.github.crusty.parser.CompilationUnit.TypeScopedCall;
import com.github.crusty.parser.CompilationUnit.TypeScopedPath;
import com.github.crusty.parser.CompilationUnit.Unary;
import com.github.crusty.parser.CompilationUnit.UnaryOperator;
import com.github.crusty.parser.CompilationUnit.Visibility;

public class ParserTest {

    @ParameterizedTest
    @MethodSource("statements")
    public void testStatementParse(String code, Statement expected) {
        var tokens = new Tokenizer().tokenize(code);
        var parsed = new Parser().parseStatement(tokens);
        assertEquals(expected, parsed);
    }

    @ParameterizedTest
    @MethodSource("expressions")
    public void testExpressionParse(String code, Expression expected) {
        var tokens = new Tokenizer().tokenize(code);
        var parsed = new Parser().parseExpression(tokens);
        assertEquals(expected, parsed);
    }

    @ParameterizedTest
    @MethodSource("types")
    public void testTypeParse(String code, Type expected) {
        var tokens = new Tokenizer().tokenize(code);
        var parsed = new Parser().parseType(tokens);
        assertEquals(expected, parsed);
        assertTrue(tokens.atEnd());
    }

    @ParameterizedTest
    @MethodSource("items")
    public void testItemParse(String code, Item expected) {
        var tokens = new Tokenizer().tokenize(code);
        var parsed = new Parser().parseItem(tokens);
        assertEquals(expected, parsed);
    }

    private static Object[][] statements() {
        return new Object[][] {
            {
                "let x = 5;",
                new LetStatement("x", new IntLiteral(5))
            }, {
                "var int x;",
                new LetStatement("x", Optional.of(PrimitiveType.INT), Optional.empty(), true)
            }, {
                "int x = 1 + 2 * 3;",
                new LetStatement("x", Optional.of(PrimitiveType.INT), Optional.of(
                        new Binary(new IntLiteral(1), BinaryOperator.ADD,
                                new Binary(new IntLiteral(2), BinaryOperator.MUL, new IntLiteral(3)))), true)
            }, {
                "let y: float = 1.5;",
                new LetStatement("y", PrimitiveType.FLOAT, new FloatLiteral(1.5))
            }, {
                "x = y = 3;",
                new ExpressionStatement(new Binary(new Identifier("x"), BinaryOperator.ASSIGN,
                        new Binary(new Identifier("y"), BinaryOperator.ASSIGN, new IntLiteral(3))))
            }, {
                // a declaration wins over a multiplication
                "a * b;",
                new LetStatement("b", Optional.of(new PointerType(new NamedType("a"), true)), Optional.empty(), true)
            }, {
                "x += 2;",
                new ExpressionStatement(new Binary(new Identifier("x"), BinaryOperator.ADD_ASSIGN, new IntLiteral(2)))
            }, {
                "(int)(x);",
                new ExpressionStatement(new Cast(new Identifier("x"), PrimitiveType.INT))
            }, {
                "(Point)(p);",
                new ExpressionStatement(new Cast(new Identifier("p"), new NamedType("Point")))
            }, {
                "p->x = 1;",
                new ExpressionStatement(new Binary(
                        new FieldAccess(new Unary(UnaryOperator.DEREF, new Identifier("p")), "x"),
                        BinaryOperator.ASSIGN, new IntLiteral(1)))
            }, {
                "x++;",
                new ExpressionStatement(new Unary(UnaryOperator.POST_INC, new Identifier("x")))
            }, {
                "return a ? b : c ? d : e;",
                new ReturnStatement(new Ternary(new Identifier("a"), new Identifier("b"),
                        new Ternary(new Identifier("c"), new Identifier("d"), new Identifier("e"))))
            }, {
                "return;",
                new ReturnStatement()
            }, {
                "break outer;",
                new BreakStatement("outer")
            }, {
                ".outer: loop { break outer; }",
                new LoopStatement("outer", new Block(new BreakStatement("outer")))
            }, {
                "for (let i = 0; i < 10; i++) { }",
                new ForStatement(new LetStatement("i", new IntLiteral(0)),
                        new Binary(new Identifier("i"), BinaryOperator.LT, new IntLiteral(10)),
                        new Unary(UnaryOperator.POST_INC, new Identifier("i")), new Block())
            }, {
                "for (x in 0..n) { }",
                new ForInStatement("x", new Range(new IntLiteral(0), new Identifier("n"), false), new Block())
            }, {
                "if (a) { } else if (b) { } else { }",
                new IfStatement(new Identifier("a"), new Block(),
                        new Block(new IfStatement(new Identifier("b"), new Block(), new Block())))
            }, {
                "switch (x) { case 1, 2: f(); break; case 3: case 4: g(); default: h(); }",
                new SwitchStatement(new Identifier("x"), List.of(
                        new SwitchCase(List.of(new IntLiteral(1), new IntLiteral(2)), new Block(call("f"))),
                        new SwitchCase(List.of(new IntLiteral(3), new IntLiteral(4)), new Block(call("g")))),
                        Optional.of(new Block(call("h"))))
            }, {
                "int add(int a, int b) { return a + b; }",
                new NestedFunction("add",
                        List.of(new Parameter("a", PrimitiveType.INT), new Parameter("b", PrimitiveType.INT)),
                        PrimitiveType.INT,
                        new Block(new ReturnStatement(new Binary(new Identifier("a"), BinaryOperator.ADD, new Identifier("b")))))
            }, {
                "static void helper() { }",
                new NestedFunction("helper", List.of(), PrimitiveType.VOID, new Block(), true, List.of(), Span.NONE)
            }, {
                "let p = (Point){ .x = 1, .y = 2 };",
                new LetStatement("p", new StructInit(new NamedType("Point"), List.of(
                        new FieldInit("x", new IntLiteral(1)), new FieldInit("y", new IntLiteral(2)))))
            }, {
                "Point p = { .x = 1 };",
                new LetStatement("p", Optional.of(new NamedType("Point")), Optional.of(
                        new StructInit(new NamedType("Point"), List.of(new FieldInit("x", new IntLiteral(1))))), true)
            }, {
                "let r = read()?;",
                new LetStatement("r", new ErrorPropagation(new Call(new Identifier("read"), List.of())))
            }, {
                "goto end;",
                new GotoStatement("end", Span.NONE)
            }
        };
    }

    private static Object[][] expressions() {
        return new Object[][] {
            {
                "f(a)[0].b",
                new FieldAccess(new Index(new Call(new Identifier("f"), List.of(new Identifier("a"))), new IntLiteral(0)), "b")
            }, {
                "!a && b || c",
                new Binary(new Binary(new Unary(UnaryOperator.NOT, new Identifier("a")), BinaryOperator.AND,
                        new Identifier("b")), BinaryOperator.OR, new Identifier("c"))
            }, {
                "a - b - c",
                new Binary(new Binary(new Identifier("a"), BinaryOperator.SUB, new Identifier("b")),
                        BinaryOperator.SUB, new Identifier("c"))
            }, {
                "-5",
                new Unary(UnaryOperator.NEG, new IntLiteral(5))
            }, {
                "(float)x",
                new Cast(new Identifier("x"), PrimitiveType.FLOAT)
            }, {
                "sizeof(int)",
                new Sizeof(PrimitiveType.INT)
            }, {
                "&var x",
                new Unary(UnaryOperator.REF_MUT, new Identifier("x"))
            }, {
                "[0; 4]",
                new ArrayRepeat(new IntLiteral(0), new IntLiteral(4))
            }, {
                "(1, 2)",
                new TupleLiteral(List.of(new IntLiteral(1), new IntLiteral(2)))
            }, {
                "t.0.1",
                new FieldAccess(new FieldAccess(new Identifier("t"), "0"), "1")
            }, {
                "0..=n",
                new Range(new IntLiteral(0), new Identifier("n"), true)
            }, {
                "@Vec(int).new()",
                new ExplicitGenericCall(new NamedType("Vec"), List.of(PrimitiveType.INT), "new", List.of())
            }, {
                "@HashMap(String, Vec[int]).new()",
                new ExplicitGenericCall(new NamedType("HashMap"),
                        List.of(new NamedType("String"), new NamedType("Vec", List.of(PrimitiveType.INT))),
                        "new", List.of())
            }, {
                "@Color.Red",
                new TypeScopedPath(new NamedType("Color"), "Red")
            }, {
                "@String.from(\"hi\")",
                new TypeScopedCall(new NamedType("String"), "from", List.of(new StringLiteral("hi")))
            }, {
                "__MAX__(1, 2)",
                new MacroCall("__MAX__", MacroDelimiter.PARENTHESIS, List.of("1", ",", "2"))
            }, {
                "a < b >> 1",
                new Binary(new Identifier("a"), BinaryOperator.LT,
                        new Binary(new Identifier("b"), BinaryOperator.SHR, new IntLiteral(1)))
            }, {
                "(a < b >> 1)",
                new Binary(new Identifier("a"), BinaryOperator.LT,
                        new Binary(new Identifier("b"), BinaryOperator.SHR, new IntLiteral(1)))
            }, {
                "g()? - 1",
                new Binary(new ErrorPropagation(new Call(new Identifier("g"), List.of())), BinaryOperator.SUB,
                        new IntLiteral(1))
            }, {
                "c ? -a : b",
                new Ternary(new Identifier("c"), new Unary(UnaryOperator.NEG, new Identifier("a")), new Identifier("b"))
            }, {
                "c ? f(x ? 1 : 2) : b",
                new Ternary(new Identifier("c"),
                        new Call(new Identifier("f"), List.of(new Ternary(new Identifier("x"), new IntLiteral(1),
                                new IntLiteral(2)))),
                        new Identifier("b"))
            }, {
                "18446744073709551615",
                new IntLiteral(Long.parseUnsignedLong("18446744073709551615"))
            }, {
                "0xFFFFFFFFFFFFFFFF",
                new IntLiteral(-1L)
            }, {
                "'\uD83D\uDE00'",
                new CharLiteral(0x1F600)
            }
        };
    }

    private static Object[][] types() {
        return new Object[][] {
            { "int*", new PointerType(PrimitiveType.INT, true) },
            { "const int*", new PointerType(PrimitiveType.INT, false) },
            { "const char**", new PointerType(new PointerType(PrimitiveType.CHAR, false), true) },
            { "int[4]", new ArrayType(PrimitiveType.INT, 4) },
            { "int[]", new SliceType(PrimitiveType.INT) },
            { "&var Point", new ReferenceType(new NamedType("Point"), true) },
            { "Vec<Vec<int>>", new NamedType("Vec", List.of(new NamedType("Vec", List.of(PrimitiveType.INT)))) },
            { "int?", new FallibleType(PrimitiveType.INT) },
            { "(int, bool)", new TupleType(List.of(PrimitiveType.INT, PrimitiveType.BOOL)) },
            { "fn(int) -> bool", new FunctionType(List.of(PrimitiveType.INT), PrimitiveType.BOOL) },
            { "std.io.File", new NamedType(List.of("std", "io", "File"), List.of()) },
        };
    }

    private static Object[][] items() {
        var self = new ReferenceType(new NamedType("Self"), false);
        return new Object[][] {
            {
                "struct Point { int x; int y; int sum(&self) { return self.x + self.y; } }",
                new StructDefinition("Point",
                        List.of(new Field("x", PrimitiveType.INT), new Field("y", PrimitiveType.INT)),
                        List.of(new FunctionDeclaration(Visibility.PUBLIC, "sum", List.of(new Parameter("self", self)),
                                PrimitiveType.INT, new Block(new ReturnStatement(new Binary(
                                        new FieldAccess(new Identifier("self"), "x"), BinaryOperator.ADD,
                                        new FieldAccess(new Identifier("self"), "y")))), Span.NONE)),
                        Span.NONE)
            }, {
                "enum Color { Red, Green = 5, Blue = -1 }",
                new EnumDefinition("Color", List.of(new EnumVariant("Red"), new EnumVariant("Green", 5),
                        new EnumVariant("Blue", -1)))
            }, {
                "typedef int* IntPtr;",
                new TypeAlias("IntPtr", new PointerType(PrimitiveType.INT, true))
            }, {
                "#import std.collections.HashMap as Map;",
                new Import(List.of("std", "collections", "HashMap"), Optional.of("Map"), false, Span.NONE)
            }, {
                "#export a.b;",
                new Import(List.of("a", "b"), Optional.empty(), true, Span.NONE)
            }, {
                "#include <stdio.h>",
                new Include("stdio.h", true, Span.NONE)
            }, {
                "#define __MAX__(a, b) a > b ? a : b",
                new MacroDefinition("__MAX__", List.of("a", "b"), MacroDelimiter.PARENTHESIS,
                        List.of("a", ">", "b", "?", "a", ":", "b"))
            }, {
                "#define __PI__ 3.14",
                new MacroDefinition("__PI__", List.of(), MacroDelimiter.NONE, List.of("3.14"))
            }, {
                "static var int COUNTER = 0;",
                new StaticDeclaration("COUNTER", PrimitiveType.INT, new IntLiteral(0), true)
            }, {
                "const int LIMIT = 10;",
                new ConstDeclaration("LIMIT", PrimitiveType.INT, new IntLiteral(10))
            }, {
                "static int helper(int x) { return x; }",
                new FunctionDeclaration(Visibility.PRIVATE, "helper", List.of(new Parameter("x", PrimitiveType.INT)),
                        PrimitiveType.INT, new Block(new ReturnStatement(new Identifier("x"))), Span.NONE)
            }, {
                "int main(void) { }",
                new FunctionDeclaration("main", List.of(), PrimitiveType.INT, new Block())
            }, {
                "namespace geo { typedef float Meters; }",
                new Namespace("geo", List.of(new TypeAlias("Meters", PrimitiveType.FLOAT)))
            }
        };
    }

    @Test
    public void testRecoversInsideBlock() {
        var result = Parser.parse("int main() { let = 5; x = ; return 0; }");
        assertEquals(2, result.diagnostics().size());
        assertInstanceOf(ParseError.class, result.diagnostics().get(0));
        assertEquals("parse error at 1:18: expected type but got '='", result.diagnostics().get(0).render());

        var main = (FunctionDeclaration) result.unit().items().get(0);
        assertEquals(List.of(new ReturnStatement(new IntLiteral(0))), main.body().statements());
    }

    @Test
    public void testRecoversAtTopLevel() {
        var result = Parser.parse("int x; int main() { return 0; }");
        assertEquals(1, result.diagnostics().size());
        assertEquals(1, result.unit().items().size());
        assertEquals("main", ((FunctionDeclaration) result.unit().items().get(0)).name());
    }

    @Test
    public void testMacroDelimiterMismatch() {
        var result = Parser.parse("#define __SQ__(x) x * x\nint main() { return __SQ__[2]; }");
        assertEquals(1, result.diagnostics().size());
        var error = (SemanticError) result.diagnostics().get(0);
        assertEquals(SemanticErrorKind.MACRO_DELIMITER_MISMATCH, error.kind());
        assertEquals("macro __SQ__ is defined with () but invoked with []", error.message());
    }

    @Test
    public void testMacroNameMustBeDunder() {
        var result = Parser.parse("#define MAX 10");
        assertEquals(1, result.diagnostics().size());
        assertTrue(result.diagnostics().get(0).message().contains("must begin and end with double underscores"));
    }

    @Test
    public void testLexErrorsAreReported() {
        var result = Parser.parse("int main() { let s = \"abc; }");
        assertTrue(result.hasErrors());
        assertEquals("lex error", result.diagnostics().get(0).category());
    }

    @Test
    public void testLeadingDocComments() {
        var result = Parser.parse("//! Geometry helpers.\nint main() { return 0; }");
        assertEquals(List.of("Geometry helpers."), result.unit().docComments());
    }

    @Test
    public void testShiftAfterLessThanInsideParentheses() {
        var result = Parser.parse("void f() { int a = 1; int b = 2; bool c = (a < b >> 1); }");
        assertEquals(List.of(), result.diagnostics());
    }

    @Test
    public void testGenericCloseStillSplitsAfterBacktracking() {
        var result = Parser.parse("void f() { let v = (Vec<Vec<int>>)(x); bool c = (a < b >> 1); }");
        assertEquals(List.of(), result.diagnostics());
    }

    @Test
    public void testIntegerLiteralOutOfRange() {
        var result = Parser.parse("int main() { return 18446744073709551616; }");
        assertEquals(1, result.diagnostics().size());
        assertEquals("invalid integer literal", result.diagnostics().get(0).message());
    }

    private static Statement call(String name) {
        return new ExpressionStatement(new Call(new Identifier(name), List.of()));
    }
}
