package com.github.crusty.semantic;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

import com.github.crusty.error.Span;
import com.github.crusty.parser.CompilationUnit.PrimitiveType;

public class SymbolTableTest {

    @Test
    public void testLookupWalksOutwards() {
        var table = new SymbolTable();
        var outer = Symbol.variable("x", PrimitiveType.INT, false, Span.NONE);
        table.insert(outer);
        table.enterScope();
        assertEquals(outer, table.lookup("x").orElseThrow());
        assertTrue(table.lookupInCurrentScope("x").isEmpty());
    }

    @Test
    public void testShadowingEndsWithScope() {
        var table = new SymbolTable();
        table.insert(Symbol.variable("x", PrimitiveType.INT, false, Span.NONE));
        table.enterScope();
        table.insert(Symbol.variable("x", PrimitiveType.BOOL, true, Span.NONE));
        assertEquals(PrimitiveType.BOOL, table.lookup("x").orElseThrow().type());
        table.exitScope();
        assertEquals(PrimitiveType.INT, table.lookup("x").orElseThrow().type());
    }

    @Test
    public void testDuplicateInSameScope() {
        var table = new SymbolTable();
        var first = Symbol.variable("x", PrimitiveType.INT, false, Span.NONE);
        assertTrue(table.insert(first).isEmpty());
        var existing = table.insert(Symbol.variable("x", PrimitiveType.BOOL, false, Span.NONE));
        assertSame(first, existing.orElseThrow());
        assertEquals(PrimitiveType.INT, table.lookup("x").orElseThrow().type());
    }

    @Test
    public void testDepthAndResolution() {
        var table = new SymbolTable();
        assertEquals(0, table.depth());
        table.insert(Symbol.variable("g", PrimitiveType.INT, false, Span.NONE));
        table.enterScope();
        table.enterScope();
        assertEquals(2, table.depth());
        var resolution = table.resolve("g").orElseThrow();
        assertEquals(0, resolution.scope().depth());
        assertTrue(resolution.scope().global());
        assertFalse(table.current().global());
    }

    @Test
    public void testCannotExitTopLevel() {
        var table = new SymbolTable();
        assertThrows(IllegalStateException.class, table::exitScope);
    }

    @Test
    public void testProgramScopeFallback() {
        var program = new Scope(0, true);
        program.define(Symbol.variable("shared", PrimitiveType.INT, false, Span.NONE));
        var table = new SymbolTable(program);
        assertEquals(1, table.depth());
        assertTrue(table.lookup("shared").isPresent());
        assertTrue(table.insert(Symbol.variable("shared", PrimitiveType.BOOL, false, Span.NONE)).isEmpty());
        assertEquals(PrimitiveType.BOOL, table.lookup("shared").orElseThrow().type());
        assertThrows(IllegalStateException.class, () -> {
            table.exitScope();
            table.exitScope();
        });
    }
}
