package com.github.crusty.semantic;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.LinkedHashMap;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import com.github.crusty.error.SemanticError;
import com.github.crusty.parser.CompilationUnit;
import com.github.crusty.parser.CompilationUnit.Capture;
import com.github.crusty.parser.CompilationUnit.CaptureMode;
import com.github.crusty.parser.CompilationUnit.FunctionDeclaration;
import com.github.crusty.parser.CompilationUnit.NestedFunction;
import com.github.crusty.parser.Parser;

public class SemanticAnalyzerTest {

    private static CompilationUnit parse(String source) {
        var result = Parser.parse(source);
        assertEquals(List.of(), result.diagnostics());
        return result.unit();
    }

    private static List<String> errors(String source) {
        return new SemanticAnalyzer().analyze(parse(source)).errors().stream()
                .map(SemanticError::message)
                .toList();
    }

    @ParameterizedTest
    @MethodSource("invalidPrograms")
    public void testReportsError(String source, String message) {
        assertEquals(List.of(message), errors(source));
    }

    private static Object[][] invalidPrograms() {
        return new Object[][] {
            { "int main() { return x; }", "undefined variable x" },
            { "int main() { let x = 1; let x = 2; return x; }", "x is already defined in this scope" },
            { "struct P { int x; }\nstruct P { int y; }", "type P is already defined" },
            { "int main() { int x = true; return x; }", "cannot initialize x of type int with bool" },
            { "int main() { let x = 1; x = 2; return x; }",
                "cannot assign twice to immutable binding x; declare it with var" },
            { "const int N = 1;\nvoid main() { N = 2; }", "cannot assign to constant N" },
            { "void main() { break; }", "break outside of a loop" },
            { "void main() { while (true) { continue; } continue; }", "continue outside of a loop" },
            { "void main() { loop { break l; } }", "break to unknown loop label l" },
            { "void main() { goto end; }", "goto is not supported; use labeled break or continue" },
            { "union U { int a; }", "union U is not supported; use a struct or enum" },
            { "#include <stdio.h>", "#include is not supported; use #import" },
            { "int read() { return 1; }\nint main() { let v = read()?; return v; }",
                "the ? operator requires the enclosing function to return a fallible type such as int?" },
            { "void main() { return 1; }", "cannot return a value from a void function" },
            { "int main() { return; }", "missing return value in function returning int" },
            { "struct P { int x; }\nint main() { P p = (P){ .x = 1 }; return p.z; }", "struct P has no field z" },
            { "enum E { A, B }\nint main() { let e = @E.Z; return 0; }", "enum E has no variant Z" },
            { "int add(int a, int b) { return a + b; }\nint main() { return add(1); }",
                "add expects 2 arguments but got 1" },
            { "int neg(int a) { return -a; }\nint main() { return neg(true); }",
                "argument 1 of neg expects int but got bool" },
            { "bool f(int a) { return a && true; }", "operator && requires bool operands, found int" },
            { "int main() { let x = 1 + true; return 0; }", "mismatched operand types int and bool for +" },
            { "void main() { let p = { .x = 1 }; }",
                "cannot infer the struct type of this initializer; use a compound literal (T){ ... }" },
            { "void main() { void g() { g(); } }",
                "nested function g cannot refer to itself; declare it as a top-level function" },
            { "int __x__() { return 0; }",
                "function __x__: name pattern reserved for macros; rename it without the surrounding __" },
            { "void main() { let x = 1; let r = &var x; }",
                "cannot borrow immutable binding x as mutable; declare it with var" },
            { "void f(int x) { switch (x) { case 1: if (x > 0) { break; } x = 2; default: x = 3; } }",
                "break outside of a loop" },
            { "void f(int x) { while (true) { switch (x) { case 1: if (x > 0) { break; } x = 2; default: x = 3; } } }",
                "break before the end of a switch case is not supported; use a labeled break" },
            { "void main() { let t = (1, 2); let v = t.99999999999; }", "tuple (int, int) has no field 99999999999" },
            { "void main() { let t = (1, 2); let v = t.2; }", "tuple (int, int) has no field 2" },
        };
    }

    @ParameterizedTest
    @MethodSource("validPrograms")
    public void testAcceptsProgram(String source) {
        assertEquals(List.of(), errors(source));
    }

    private static Object[][] validPrograms() {
        return new Object[][] {
            { "int main() { var total = 0; for (i in 0..10) { total += i; } return total; }" },
            { "struct Point { int x; int y; }\nint main() { Point p = (Point){ .x = 1, .y = 2 }; return p.x + p.y; }" },
            { "int? parse(int v) { return v; }\nint? twice(int v) { let x = parse(v)?; return x * 2; }" },
            { """
                enum Color { Red, Green }
                int code(Color c) {
                    switch (c) {
                        case @Color.Red: return 1;
                        default: return 2;
                    }
                }
                """ },
            { "#define __SQ__(x) x * x\nint main() { return __SQ__(3); }" },
            { "int main() { var total = 0; for (i in ..5) { total += i; } return total; }" },
            { "int main() { var total = 0; for (i in ..=5) { total += i; } return total; }" },
            { "void f(int x) { while (true) { switch (x) { case 1: x = 2; break; default: x = 3; } } }" },
            { "void f(int x) { .outer: while (true) { switch (x) { case 1: if (x > 0) { break outer; } x = 2; default: x = 3; } } }" },
            { "void f(int x) { while (true) { switch (x) { case 1: if (x > 0) { continue; } x = 2; default: x = 3; } } }" },
            { "void main() { let t = (1, 2); let v = t.1; }" },
        };
    }

    private static NestedFunction nested(String source) {
        var result = new SemanticAnalyzer().analyze(parse(source));
        assertEquals(List.of(), result.errors());
        var main = (FunctionDeclaration) result.unit().items().get(result.unit().items().size() - 1);
        return main.body().statements().stream()
                .filter(NestedFunction.class::isInstance)
                .map(NestedFunction.class::cast)
                .findFirst()
                .orElseThrow();
    }

    @ParameterizedTest
    @MethodSource("captures")
    public void testCaptures(String source, List<Capture> expected, CaptureMode closureMode) {
        var function = nested(source);
        assertEquals(expected, function.captures());
        assertEquals(closureMode, function.closureMode());
    }

    private static Object[][] captures() {
        return new Object[][] {
            {
                "void main() { let a = 1; var b = 2; int f() { b = b + a; return b; } f(); }",
                List.of(new Capture("b", CaptureMode.MUTABLE), new Capture("a", CaptureMode.IMMUTABLE)),
                CaptureMode.MUTABLE
            },
            {
                "struct S { int v; }\nvoid consume(S s) { }\n"
                    + "void main() { S s = (S){ .v = 1 }; void g() { consume(s); } g(); }",
                List.of(new Capture("s", CaptureMode.CONSUMING)),
                CaptureMode.CONSUMING
            },
            {
                "void main() { let name = \"x\"; int g() { let n = name; return 0; } g(); }",
                List.of(new Capture("name", CaptureMode.IMMUTABLE)),
                CaptureMode.IMMUTABLE
            },
            {
                "static int counter = 0;\nvoid main() { int g() { return counter; } g(); }",
                List.of(),
                CaptureMode.IMMUTABLE
            },
            {
                "void main() { run(4); }\nvoid run(int n) { int g() { return n; } g(); }",
                List.of(new Capture("n", CaptureMode.IMMUTABLE)),
                CaptureMode.IMMUTABLE
            },
        };
    }

    @Test
    public void testCollisionsAcrossFiles() {
        var files = new LinkedHashMap<String, CompilationUnit>();
        files.put("a.crusty", parse("int helper() { return 1; }"));
        files.put("b.crusty", parse("int helper() { return 2; }"));
        var program = SemanticAnalyzer.registerProgram(files);

        assertEquals(List.of(), program.collisionsIn("a.crusty"));
        assertEquals(List.of("helper is defined in both a.crusty and b.crusty"),
                program.collisionsIn("b.crusty").stream().map(SemanticError::message).toList());
    }

    @Test
    public void testResolvesNamesFromOtherFiles() {
        var files = new LinkedHashMap<String, CompilationUnit>();
        files.put("lib.crusty", parse("struct Point { int x; }\nint helper() { return 1; }"));
        var program = SemanticAnalyzer.registerProgram(files);

        var unit = parse("int main() { Point p = (Point){ .x = helper() }; return p.x; }");
        var result = new SemanticAnalyzer(program).analyze(unit);
        assertTrue(result.errors().isEmpty(), () -> result.errors().toString());
        assertTrue(errors("int main() { return helper(); }").contains("undefined variable helper"));
    }
}
