package com.github.crusty.codegen;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import com.github.crusty.parser.CompilationUnit;
import com.github.crusty.parser.Parser;
import com.github.crusty.parser.RustParser;

public class RoundTripTest {

    private static CompilationUnit crusty(String source) {
        var result = Parser.parse(source);
        assertEquals(List.of(), result.diagnostics());
        return result.unit();
    }

    private static CompilationUnit rust(String source) {
        var result = RustParser.parse(source);
        assertEquals(List.of(), result.diagnostics());
        return result.unit();
    }

    @ParameterizedTest
    @MethodSource("crustyPrograms")
    public void testCrustyRoundTrip(String source) {
        var unit = crusty(source);
        var text = PrettyPrinter.format(unit, TargetLanguage.CRUSTY);
        var reparsed = crusty(text);
        assertEquals(unit, reparsed);
        assertEquals(text, PrettyPrinter.format(reparsed, TargetLanguage.CRUSTY));
    }

    private static Object[][] crustyPrograms() {
        return new Object[][] {
            { "struct Point { int x; int y; }\nint dot(Point a, Point b) { return a.x * b.x + a.y * b.y; }" },
            { "struct Counter { int n; void bump(&var self) { self.n += 1; } }" },
            { "enum Color { Red, Green = 5 }\n"
                + "int code(Color c) { switch (c) { case @Color.Red: return 1; default: return 2; } }" },
            { "void f() { .outer: for (var i = 0; i < 3; i++) { while (true) { break outer; } } }" },
            { "#define __SQ__(x) x * x\nint main() { return __SQ__(3); }" },
            { "float scale(int x) { return (float)(x) * 2.5; }" },
            { "typedef int Meters;\nconst int N = 10;\nstatic var int count = 0;" },
            { "void main() { var b = 2; void f() { b += 1; } f(); }" },
            { "int? parse(int v) { return v; }\nint? twice(int v) { let x = parse(v)?; return x * 2; }" },
            { "int sign(int x) { return x < 0 ? -1 : x == 0 ? 0 : 1; }" },
            { "int? g() { return 1; }\nint? h() { int x = (g()?) - 1; return x; }" },
            { "int? g() { return 1; }\nint? h(bool c) { return c ? g()? : -g()?; }" },
            { "bool below(int a, int b) { bool c = (a < b >> 1); return c; }" },
            { "u64 big() { return 18446744073709551615; }" },
            { "char smile() { return '\uD83D\uDE00'; }" },
        };
    }

    @ParameterizedTest
    @MethodSource("rustPrograms")
    public void testRustRoundTrip(String source) {
        var unit = rust(source);
        var text = PrettyPrinter.format(unit, TargetLanguage.RUST);
        var reparsed = rust(text);
        assertEquals(unit, reparsed);
        assertEquals(text, PrettyPrinter.format(reparsed, TargetLanguage.RUST));
    }

    private static Object[][] rustPrograms() {
        return new Object[][] {
            { "pub fn add(a: i32, b: i32) -> i32 { return a + b; }" },
            { "pub fn f() { 'outer: loop { break 'outer; } }" },
            { "pub fn f(x: i32) -> i32 { match x { 1 | 2 => { return 1; } _ => { return 0; } } }" },
            { "pub struct Point { pub x: i32, pub y: i32 }" },
            { "fn helper(v: &[i32]) -> usize { return v.len(); }" },
        };
    }

    @ParameterizedTest
    @MethodSource("portablePrograms")
    public void testForwardThenReverse(String source) {
        var unit = crusty(source);
        var back = rust(PrettyPrinter.format(unit, TargetLanguage.RUST));
        assertEquals(unit, back);
    }

    private static Object[][] portablePrograms() {
        return new Object[][] {
            { "int add(int a, int b) { return a + b; }" },
            { "void f() { .outer: loop { break outer; } }" },
            { "struct Point { int x; int y; }" },
            { "int count(int n) { var c = 0; while (c < n) { if (c == 2) { break; } else { c += 1; } } return c; }" },
            { "u64 big() { return 18446744073709551615; }" },
            { "char smile() { return '\uD83D\uDE00'; }" },
        };
    }

    @Test
    public void testLabeledLoopSurvivesBothDirections() {
        var crustyText = "void f() {\n    .outer: loop {\n        break outer;\n    }\n}\n";
        var rustText = PrettyPrinter.format(crusty(crustyText), TargetLanguage.RUST);
        assertEquals("pub fn f() {\n    'outer: loop {\n        break 'outer;\n    }\n}\n", rustText);
        assertEquals(crustyText, PrettyPrinter.format(rust(rustText), TargetLanguage.CRUSTY));
    }
}
