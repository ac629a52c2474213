package com.github.crusty.codegen;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import com.github.crusty.error.CodeGenException;
import com.github.crusty.parser.CompilationUnit;
import com.github.crusty.parser.Parser;
import com.github.crusty.parser.RustParser;
import com.github.crusty.semantic.SemanticAnalyzer;

public class CodeGeneratorTest {

    private static CompilationUnit analyzed(String crusty) {
        var parsed = Parser.parse(crusty);
        assertEquals(List.of(), parsed.diagnostics());
        return new SemanticAnalyzer().analyze(parsed.unit()).unit();
    }

    @ParameterizedTest
    @MethodSource("forward")
    public void testForward(String crusty, String rust) {
        assertEquals(rust, PrettyPrinter.format(analyzed(crusty), TargetLanguage.RUST));
    }

    private static Object[][] forward() {
        return new Object[][] {
            {
                "int add(int a, int b) { return a + b; }",
                """
                pub fn add(a: i32, b: i32) -> i32 {
                    return a + b;
                }
                """
            },
            {
                "static void helper() { }",
                """
                fn helper() {
                }
                """
            },
            {
                "struct Point { int x; float y; }",
                """
                #[derive(Debug, Clone)]
                pub struct Point {
                    pub x: i32,
                    pub y: f64,
                }
                """
            },
            {
                "enum Color { Red, Green = 5 }",
                """
                #[derive(Debug, Clone, Copy, PartialEq, Eq)]
                pub enum Color {
                    Red,
                    Green = 5,
                }
                """
            },
            {
                "void f() { var i = 0; i++; }",
                """
                pub fn f() {
                    let mut i = 0;
                    i += 1;
                }
                """
            },
            {
                "int m(int a, int b) { return a > b ? a : b; }",
                """
                pub fn m(a: i32, b: i32) -> i32 {
                    return if a > b { a } else { b };
                }
                """
            },
            {
                "int s(int x) { if (x < 0) { return -1; } else if (x == 0) { return 0; } else { return 1; } }",
                """
                pub fn s(x: i32) -> i32 {
                    if x < 0 {
                        return -1;
                    } else if x == 0 {
                        return 0;
                    } else {
                        return 1;
                    }
                }
                """
            },
            {
                "void f() { for (let i = 0; i < 10; i++) { g(i); } }",
                """
                pub fn f() {
                    for i in 0..10 {
                        g(i);
                    }
                }
                """
            },
            {
                "void f(int n) { for (var i = 0; i < n; i += 2) { if (i == 3) { continue; } g(i); } }",
                """
                pub fn f(n: i32) {
                    {
                        let mut i = 0;
                        'loop_1: while i < n {
                            'body_1: {
                                if i == 3 {
                                    break 'body_1;
                                }
                                g(i);
                            }
                            i += 2;
                        }
                    }
                }
                """
            },
            {
                "void f(int x) { switch (x) { case 1: g(); break; case 2, 3: h(); break; default: k(); } }",
                """
                pub fn f(x: i32) {
                    match x {
                        1 => {
                            g();
                        }
                        2 | 3 => {
                            h();
                        }
                        _ => {
                            k();
                        }
                    }
                }
                """
            },
            {
                "int? parse(int v) { return v; }",
                """
                pub fn parse(v: i32) -> Result<i32, Box<dyn std::error::Error>> {
                    return v;
                }
                """
            },
            {
                "#define __SQ__(x) x * x\nint main() { return __SQ__(3); }",
                """
                macro_rules! sq {
                    ($x:expr) => {{
                        $x * $x
                    }};
                }

                pub fn main() -> i32 {
                    return sq!(3);
                }
                """
            },
            {
                "void main() { var b = 2; void f() { b = b + 1; } f(); }",
                """
                pub fn main() {
                    let mut b = 2;
                    let mut f = || {
                        b = b + 1;
                    };
                    f();
                }
                """
            },
            {
                "struct S { int v; }\nvoid consume(S s) { }\nvoid main() { S s = (S){ .v = 1 }; void g() { consume(s); } g(); }",
                """
                #[derive(Debug, Clone)]
                pub struct S {
                    pub v: i32,
                }

                pub fn consume(s: S) {
                }

                pub fn main() {
                    let mut s: S = S { v: 1 };
                    let g = move || {
                        consume(s);
                    };
                    g();
                }
                """
            },
        };
    }

    @ParameterizedTest
    @MethodSource("reverse")
    public void testReverse(String rust, String crusty) {
        var parsed = RustParser.parse(rust);
        assertEquals(List.of(), parsed.diagnostics());
        assertEquals(crusty, PrettyPrinter.format(parsed.unit(), TargetLanguage.CRUSTY));
    }

    private static Object[][] reverse() {
        return new Object[][] {
            {
                "pub fn add(a: i32, b: i32) -> i32 { a + b }",
                """
                int add(int a, int b) {
                    return a + b;
                }
                """
            },
            {
                "fn helper() {}",
                """
                static void helper() {
                }
                """
            },
            {
                "pub struct Point { pub x: i32, pub y: f64 }",
                """
                struct Point {
                    int x;
                    float y;
                }
                """
            },
            {
                "pub fn f() { let mut v = 0; v += 1; }",
                """
                void f() {
                    var v = 0;
                    v += 1;
                }
                """
            },
            {
                "pub fn f(x: i32) { match x { 1 | 2 => g(), _ => {} } }",
                """
                void f(int x) {
                    switch (x) {
                        case 1, 2:
                            g();
                            break;
                        default:
                            break;
                    }
                }
                """
            },
            {
                "pub fn f() { 'outer: loop { break 'outer; } }",
                """
                void f() {
                    .outer: loop {
                        break outer;
                    }
                }
                """
            },
            {
                "pub fn f(p: &mut Point) { p.x = 1; }",
                """
                void f(&var Point p) {
                    p.x = 1;
                }
                """
            },
            {
                "pub fn f() -> Color { Color::Red }",
                """
                Color f() {
                    return @Color.Red;
                }
                """
            },
        };
    }

    @Test
    public void testRangeLoopsCanBeDisabled() {
        var generator = new CodeGenerator();
        generator.setRangeLoops(false);
        var unit = analyzed("void f() { for (var i = 0; i < 3; i++) { g(i); } }");
        assertEquals("""
                pub fn f() {
                    {
                        let mut i = 0;
                        while i < 3 {
                            g(i);
                            i += 1;
                        }
                    }
                }
                """, PrettyPrinter.format(unit, TargetLanguage.RUST, generator));
    }

    @Test
    public void testConfiguredErrorType() {
        var generator = new CodeGenerator();
        generator.setFallibleErrorType("String");
        generator.setIndentWidth(2);
        var unit = analyzed("int? parse(int v) { return v; }");
        assertEquals("""
                pub fn parse(v: i32) -> Result<i32, String> {
                  return v;
                }
                """, PrettyPrinter.format(unit, TargetLanguage.RUST, generator));
    }

    @Test
    public void testUnionHasNoRustForm() {
        var unit = Parser.parse("union U { int a; }").unit();
        var e = assertThrows(CodeGenException.class, () -> new CodeGenerator().generate(unit, TargetLanguage.RUST));
        assertEquals("union U has no target-language form", e.getMessage());
    }

    @Test
    public void testGotoHasNoRustForm() {
        var unit = Parser.parse("void f() { goto end; }").unit();
        var e = assertThrows(CodeGenException.class, () -> new CodeGenerator().generate(unit, TargetLanguage.RUST));
        assertEquals("goto end has no target-language form", e.getMessage());
    }

    @Test
    public void testNormalize() {
        assertEquals("a\n\nb\n", PrettyPrinter.normalize("\n\na  \n\n\n\nb\n\n"));
        assertEquals("", PrettyPrinter.normalize("\n \n"));
    }
}
