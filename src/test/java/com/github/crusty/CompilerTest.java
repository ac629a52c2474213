package com.github.crusty;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayInputStream;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;

import org.junit.jupiter.api.DynamicContainer;
import org.junit.jupiter.api.DynamicNode;
import org.junit.jupiter.api.DynamicTest;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestFactory;

import com.github.crusty.Compiler.Direction;
import com.github.crusty.error.Diagnostic;
import com.github.crusty.error.TranslationException;

public class CompilerTest {

    @TestFactory
    public DynamicNode testFactory() {
        String basePathString = "src/test/resources/golden";
        Path basePath = Paths.get(basePathString);

        var testFiles = basePath.toFile().listFiles((dir, name) -> name.endsWith(".crusty") || name.endsWith(".rs"));
        var tests = Arrays.stream(testFiles)
            .sorted()
            .map(this::createTest).toList();

        return DynamicContainer.dynamicContainer("Golden translations", tests);
    }

    private DynamicNode createTest(File testFile) {
        return DynamicTest.dynamicTest("translate " + testFile.getName(), () -> {
            var compiler = new Compiler();
            compiler.setLookupPath(List.of(testFile.getParent()));
            var result = compiler.translateFile(testFile.getName());

            String expectedOutput;
            try (var s = Files.lines(testFile.toPath())) {
                expectedOutput = s.dropWhile(l -> !l.equals("// EXPECTED-OUTPUT")).skip(1)
                    .map(l -> l.length() > 3 ? l.substring(3) : "").reduce("", (a, b) -> a + b + "\n");
            }

            assertEquals(List.of(), result.diagnostics());
            assertEquals(expectedOutput, result.output());
        });
    }

    @Test
    public void testTranslateForward() {
        var result = new Compiler().translate("int add(int a, int b) { return a + b; }", Direction.FORWARD);
        assertTrue(result.isSuccess());
        assertEquals("pub fn add(a: i32, b: i32) -> i32 {\n    return a + b;\n}\n", result.output());
    }

    @Test
    public void testTranslateReverse() {
        var result = new Compiler().translate("fn add(a: i32, b: i32) -> i32 { a + b }", Direction.REVERSE);
        assertTrue(result.isSuccess());
        assertEquals("static int add(int a, int b) {\n    return a + b;\n}\n", result.output());
    }

    @Test
    public void testNoOutputOnSemanticError() {
        var result = new Compiler().translate("int main() { return x; }", Direction.FORWARD);
        assertFalse(result.isSuccess());
        assertEquals("", result.output());
        assertEquals(List.of("undefined variable x"), result.diagnostics().stream().map(Diagnostic::message).toList());
        assertEquals("undefined variable", result.diagnostics().get(0).category());
    }

    @Test
    public void testParseErrorsAndSemanticErrorsTogether() {
        var result = new Compiler().translate("int main() { int = 1; return y; }", Direction.FORWARD);
        assertEquals(List.of("parse error", "undefined variable"),
                result.diagnostics().stream().map(Diagnostic::category).toList());
    }

    @Test
    public void testBreakInsideMatchArmIsReported() {
        var result = new Compiler().translate(
                "fn f(x: i32) { loop { match x { 1 => { break; } _ => { } } } }", Direction.REVERSE);
        assertFalse(result.isSuccess());
        assertEquals(List.of("break before the end of a switch case is not supported; use a labeled break"),
                result.diagnostics().stream().map(Diagnostic::message).toList());
    }

    @Test
    public void testPropagationAsLeftOperand() {
        var result = new Compiler().translate(
                "int? g() { return 1; }\nint? h() { int x = (g()?) - 1; return x; }", Direction.FORWARD);
        assertTrue(result.isSuccess(), () -> result.diagnostics().toString());
        assertTrue(result.output().contains("g()? - 1"), result.output());
    }

    @Test
    public void testTranslateOrThrow() {
        var compiler = new Compiler();
        assertEquals("pub fn f() {\n}\n", compiler.translateOrThrow("void f() { }", Direction.FORWARD));

        var e = assertThrows(TranslationException.class,
                () -> compiler.translateOrThrow("void f() { break; }", Direction.FORWARD));
        assertEquals(1, e.diagnostics().size());
        assertTrue(e.getMessage().endsWith(": break outside of a loop"), e.getMessage());
    }

    @Test
    public void testTranslateProgram() {
        var sources = new LinkedHashMap<String, String>();
        sources.put("lib.crusty", "int helper() { return 1; }");
        sources.put("main.crusty", "int main() { return helper(); }");
        sources.put("other.crusty", "int helper() { return 2; }");

        var results = new Compiler().translateProgram(sources, Direction.FORWARD);

        assertTrue(results.get("lib.crusty").isSuccess());
        assertEquals("pub fn main() -> i32 {\n    return helper();\n}\n", results.get("main.crusty").output());
        assertEquals(List.of("helper is defined in both lib.crusty and other.crusty"),
                results.get("other.crusty").diagnostics().stream().map(Diagnostic::message).toList());
    }

    @Test
    public void testDirectionOfFileName() {
        assertEquals(Direction.REVERSE, Direction.ofFileName("lib.rs"));
        assertEquals(Direction.FORWARD, Direction.ofFileName("main.crusty"));
    }

    @Test
    public void testAppliesConfig() throws IOException {
        var config = ConfigReader.readConfig(
                new ByteArrayInputStream("indentWidth=2\nrangeLoops=false\n".getBytes(StandardCharsets.UTF_8)));
        var compiler = new Compiler();
        config.applyConfig(compiler);

        var output = compiler.translateOrThrow("void f() { for (var i = 0; i < 3; i++) { g(i); } }", Direction.FORWARD);
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
                """, output);
    }
}
