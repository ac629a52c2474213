package com.github.crusty.parser;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import com.github.crusty.Tokenizer;
import com.github.crusty.Tokenizer.Dialect;
import com.github.crusty.error.Span;
import com.github.crusty.parser.CompilationUnit.AutoType;
import com.github.crusty.parser.CompilationUnit.Binary;
import com.github.crusty.parser.CompilationUnit.BinaryOperator;
import com.github.crusty.parser.CompilationUnit.Block;
import com.github.crusty.parser.CompilationUnit.BreakStatement;
import com.github.crusty.parser.CompilationUnit.Call;
import com.github.crusty.parser.CompilationUnit.Cast;
import com.github.crusty.parser.CompilationUnit.ConstDeclaration;
import com.github.crusty.parser.CompilationUnit.EnumDefinition;
import com.github.crusty.parser.CompilationUnit.EnumVariant;
import com.github.crusty.parser.CompilationUnit.ErrorPropagation;
import com.github.crusty.parser.CompilationUnit.ExplicitGenericCall;
import com.github.crusty.parser.CompilationUnit.ExpressionStatement;
import com.github.crusty.parser.CompilationUnit.FallibleType;
import com.github.crusty.parser.CompilationUnit.Field;
import com.github.crusty.parser.CompilationUnit.FieldAccess;
import com.github.crusty.parser.CompilationUnit.FieldInit;
import com.github.crusty.parser.CompilationUnit.ForInStatement;
import com.github.crusty.parser.CompilationUnit.FunctionDeclaration;
import com.github.crusty.parser.CompilationUnit.Identifier;
import com.github.crusty.parser.CompilationUnit.IfStatement;
import com.github.crusty.parser.CompilationUnit.Import;
import com.github.crusty.parser.CompilationUnit.IntLiteral;
import com.github.crusty.parser.CompilationUnit.Item;
import com.github.crusty.parser.CompilationUnit.LetStatement;
import com.github.crusty.parser.CompilationUnit.LoopStatement;
import com.github.crusty.parser.CompilationUnit.MacroCall;
import com.github.crusty.parser.CompilationUnit.MacroDefinition;
import com.github.crusty.parser.CompilationUnit.MacroDelimiter;
import com.github.crusty.parser.CompilationUnit.MethodCall;
import com.github.crusty.parser.CompilationUnit.NamedType;
import com.github.crusty.parser.CompilationUnit.Namespace;
import com.github.crusty.parser.CompilationUnit.NestedFunction;
import com.github.crusty.parser.CompilationUnit.NullLiteral;
import com.github.crusty.parser.CompilationUnit.Parameter;
import com.github.crusty.parser.CompilationUnit.PrimitiveType;
import com.github.crusty.parser.CompilationUnit.Range;
import com.github.crusty.parser.CompilationUnit.ReferenceType;
import com.github.crusty.parser.CompilationUnit.ReturnStatement;
import com.github.crusty.parser.CompilationUnit.Sizeof;
import com.github.crusty.parser.CompilationUnit.Statement;
import com.github.crusty.parser.CompilationUnit.StaticDeclaration;
import com.github.crusty.parser.CompilationUnit.StringLiteral;
import com.github.crusty.parser.CompilationUnit.StructDefinition;
import com.github.crusty.parser.CompilationUnit.StructInit;
import com.github.crusty.parser.CompilationUnit.SwitchCase;
import com.github.crusty.parser.CompilationUnit.SwitchStatement;
import com.github.crusty.parser.CompilationUnit.Ternary;
import com.github.crusty.parser.CompilationUnit.TypeAlias;
import com.github.crusty.parser.CompilationUnit.TypeScopedCall;
import com.github.crusty.parser.CompilationUnit.TypeScopedPath;
import com.github.crusty.parser.CompilationUnit.Unary;
import com.github.crusty.parser.CompilationUnit.UnaryOperator;
import com.github.crusty.parser.CompilationUnit.Visibility;

public class RustParserTest {

    @ParameterizedTest
    @MethodSource("statements")
    public void testStatementParse(String code, Statement expected) {
        var result = RustParser.parse("fn f() { " + code + " }");
        assertFalse(result.hasErrors(), () -> result.diagnostics().toString());
        var function = (FunctionDeclaration) result.unit().items().get(0);
        assertEquals(List.of(expected), function.body().statements());
    }

    @ParameterizedTest
    @MethodSource("items")
    public void testItemParse(String code, Item expected) {
        var result = RustParser.parse(code);
        assertFalse(result.hasErrors(), () -> result.diagnostics().toString());
        assertEquals(List.of(expected), result.unit().items());
    }

    private static Object[][] statements() {
        var x = new Identifier("x");
        return new Object[][] {
            {
                "let mut x: i32 = 5;",
                new LetStatement("x", Optional.of(PrimitiveType.INT), Optional.of(new IntLiteral(5)), true)
            }, {
                "let y = x as f64;",
                new LetStatement("y", new Cast(x, PrimitiveType.FLOAT))
            }, {
                "'outer: loop { break 'outer; }",
                new LoopStatement("outer", new Block(new BreakStatement("outer")))
            }, {
                "for i in 0..n { }",
                new ForInStatement("i", new Range(new IntLiteral(0), new Identifier("n"), false), new Block())
            }, {
                "match x { 1 | 2 => f(), 3 => {}, _ => () }",
                new SwitchStatement(x, List.of(
                        new SwitchCase(List.of(new IntLiteral(1), new IntLiteral(2)),
                                new Block(new ExpressionStatement(new Call(new Identifier("f"), List.of())))),
                        new SwitchCase(List.of(new IntLiteral(3)), new Block())),
                        Optional.of(new Block()))
            }, {
                "if x.is_none() { return; }",
                new IfStatement(new Binary(x, BinaryOperator.EQ, new NullLiteral()), new Block(new ReturnStatement()))
            }, {
                "let n = std::mem::size_of::<i32>();",
                new LetStatement("n", new Sizeof(PrimitiveType.INT))
            }, {
                "let v = Vec::<i32>::new();",
                new LetStatement("v", new ExplicitGenericCall(new NamedType("Vec"), List.of(PrimitiveType.INT), "new", List.of()))
            }, {
                "let c = Color::Red;",
                new LetStatement("c", new TypeScopedPath(new NamedType("Color"), "Red"))
            }, {
                "let s = String::from(\"hi\");",
                new LetStatement("s", new TypeScopedCall(new NamedType("String"), "from", List.of(new StringLiteral("hi"))))
            }, {
                "let m = max!(a, b);",
                new LetStatement("m", new MacroCall("__max__", MacroDelimiter.PARENTHESIS, List.of("a", ",", "b")))
            }, {
                "let p = Point { x: 1, y };",
                new LetStatement("p", new StructInit(new NamedType("Point"), List.of(
                        new FieldInit("x", new IntLiteral(1)), new FieldInit("y", new Identifier("y")))))
            }, {
                "let t = if c { 1 } else { 2 };",
                new LetStatement("t", new Ternary(new Identifier("c"), new IntLiteral(1), new IntLiteral(2)))
            }, {
                "let a = { x += 1; x };",
                new LetStatement("a", new Unary(UnaryOperator.PRE_INC, x))
            }, {
                "let b = { let tmp = x; x += 1; tmp };",
                new LetStatement("b", new Unary(UnaryOperator.POST_INC, x))
            }, {
                "let f = |a: i32| { a + 1 };",
                new NestedFunction("f", List.of(new Parameter("a", PrimitiveType.INT)), AutoType.INSTANCE,
                        new Block(new ReturnStatement(new Binary(new Identifier("a"), BinaryOperator.ADD, new IntLiteral(1)))))
            }, {
                "let g = || x;",
                new NestedFunction("g", List.of(), AutoType.INSTANCE, new Block(new ReturnStatement(x)))
            }, {
                "x = y.len();",
                new ExpressionStatement(new Binary(x, BinaryOperator.ASSIGN,
                        new MethodCall(new Identifier("y"), "len", List.of())))
            }, {
                "let r = read()?;",
                new LetStatement("r", new ErrorPropagation(new Call(new Identifier("read"), List.of())))
            }, {
                "let o = None;",
                new LetStatement("o", new NullLiteral())
            }, {
                "let q = &mut x;",
                new LetStatement("q", new Unary(UnaryOperator.REF_MUT, x))
            }, {
                // comparisons bind looser than bitwise operators
                "let z = a | b == c;",
                new LetStatement("z", new Binary(new Binary(new Identifier("a"), BinaryOperator.BIT_OR, new Identifier("b")),
                        BinaryOperator.EQ, new Identifier("c")))
            }
        };
    }

    private static Object[][] items() {
        var self = new ReferenceType(new NamedType("Self"), false);
        return new Object[][] {
            {
                "pub fn add(a: i32, b: i32) -> i32 { a + b }",
                new FunctionDeclaration("add",
                        List.of(new Parameter("a", PrimitiveType.INT), new Parameter("b", PrimitiveType.INT)),
                        PrimitiveType.INT,
                        new Block(new ReturnStatement(new Binary(new Identifier("a"), BinaryOperator.ADD, new Identifier("b")))))
            }, {
                "fn helper() { }",
                new FunctionDeclaration(Visibility.PRIVATE, "helper", List.of(), PrimitiveType.VOID, new Block(), Span.NONE)
            }, {
                "#[derive(Debug, Clone)]\npub struct Point { pub x: i32, pub y: i32 }\n"
                        + "impl Point { pub fn sum(&self) -> i32 { self.x + self.y } }",
                new StructDefinition("Point",
                        List.of(new Field("x", PrimitiveType.INT), new Field("y", PrimitiveType.INT)),
                        List.of(new FunctionDeclaration("sum", List.of(new Parameter("self", self)), PrimitiveType.INT,
                                new Block(new ReturnStatement(new Binary(
                                        new FieldAccess(new Identifier("self"), "x"), BinaryOperator.ADD,
                                        new FieldAccess(new Identifier("self"), "y")))))),
                        Span.NONE)
            }, {
                "pub enum Color { Red, Green = 5 }",
                new EnumDefinition("Color", List.of(new EnumVariant("Red"), new EnumVariant("Green", 5)))
            }, {
                "type Meters = f64;",
                new TypeAlias("Meters", PrimitiveType.FLOAT)
            }, {
                "use std::collections::HashMap;",
                new Import(List.of("std", "collections", "HashMap"))
            }, {
                "pub fn read() -> Result<i32, Box<dyn std::error::Error>> { Ok(1) }",
                new FunctionDeclaration("read", List.of(), new FallibleType(PrimitiveType.INT),
                        new Block(new ReturnStatement(new Call(new Identifier("Ok"), List.of(new IntLiteral(1))))))
            }, {
                "macro_rules! square_macro { ($x:expr) => {{ $x * $x }}; }",
                new MacroDefinition("__square__", List.of("x"), MacroDelimiter.PARENTHESIS, List.of("x", "*", "x"))
            }, {
                "const LIMIT: i32 = 10;",
                new ConstDeclaration("LIMIT", PrimitiveType.INT, new IntLiteral(10))
            }, {
                "static mut COUNTER: i32 = 0;",
                new StaticDeclaration("COUNTER", PrimitiveType.INT, new IntLiteral(0), true)
            }, {
                "mod geo { pub type Meters = f64; }",
                new Namespace("geo", List.of(new TypeAlias("Meters", PrimitiveType.FLOAT)))
            }
        };
    }

    @Test
    public void testImplForUnknownStruct() {
        var result = RustParser.parse("impl Ghost { fn f() {} }");
        assertEquals(1, result.diagnostics().size());
        assertEquals("impl block for unknown struct Ghost", result.diagnostics().get(0).message());
    }

    @Test
    public void testClosureArgumentIsRejected() {
        var result = RustParser.parse("fn main() { let f = foo(|x| x); let y = 1; }");
        assertEquals(1, result.diagnostics().size());
        assertEquals("closures are supported only as let-bound nested functions", result.diagnostics().get(0).message());
        var main = (FunctionDeclaration) result.unit().items().get(0);
        assertEquals(List.of(new LetStatement("y", new IntLiteral(1))), main.body().statements());
    }

    @Test
    public void testUnsupportedAttributeIsReported() {
        var result = RustParser.parse("#[repr(C)]\npub struct P { pub x: i32 }");
        assertEquals(1, result.diagnostics().size());
        assertEquals("attribute #[repr] is not supported", result.diagnostics().get(0).message());
        assertEquals("P", ((StructDefinition) result.unit().items().get(0)).name());
    }

    @Test
    public void testHintAttributesAreDropped() {
        var result = RustParser.parse("#![allow(dead_code)]\n#[inline]\n#[must_use]\nfn f() -> i32 { 1 }");
        assertEquals(List.of(), result.diagnostics());
        assertEquals(1, result.unit().items().size());
    }

    @Test
    public void testExternBlockIsReported() {
        var result = RustParser.parse("extern \"C\" { fn abs(x: i32) -> i32; }\nfn main() { }");
        assertEquals(1, result.diagnostics().size());
        assertEquals("extern items are not supported", result.diagnostics().get(0).message());
        assertEquals(List.of("main"), result.unit().items().stream()
                .map(item -> ((FunctionDeclaration) item).name())
                .toList());
    }

    @Test
    public void testGenericItemsAreRejected() {
        var result = RustParser.parse("fn id<T>(x: T) -> T { x }");
        assertTrue(result.hasErrors());
        assertEquals("generic items are not supported", result.diagnostics().get(0).message());
    }

    @Test
    public void testConfiguredErrorType() {
        var tokens = new Tokenizer(Dialect.RUST).tokenize("fn f() -> Result<i32, String> { Ok(1) }");
        var result = new RustParser("String").parseCompilationUnit(tokens);
        var function = (FunctionDeclaration) result.unit().items().get(0);
        assertEquals(new FallibleType(PrimitiveType.INT), function.returnType());

        var other = RustParser.parse("fn f() -> Result<i32, String> { Ok(1) }");
        var plain = (FunctionDeclaration) other.unit().items().get(0);
        assertEquals(new NamedType("Result", List.of(PrimitiveType.INT, new NamedType("String"))), plain.returnType());
    }
}
