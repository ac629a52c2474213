package com.github.crusty;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.github.crusty.parser.RustParser;

public class ConfigReaderTest {

    private static ConfigReader.Config read(String text) throws IOException {
        return ConfigReader.readConfig(new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    public void testDefaults() throws IOException {
        var config = read("");
        assertEquals(List.of(), config.lookupPath);
        assertEquals(4, config.indentWidth);
        assertEquals(RustParser.DEFAULT_ERROR_TYPE, config.fallibleErrorType);
        assertTrue(config.rangeLoops);
    }

    @Test
    public void testReadsValues() throws IOException {
        var config = read("""
                lookupPath = src, lib ,
                indentWidth = 2
                fallibleErrorType = String
                rangeLoops = false
                """);
        assertEquals(List.of("src", "lib"), config.lookupPath);
        assertEquals(2, config.indentWidth);
        assertEquals("String", config.fallibleErrorType);
        assertFalse(config.rangeLoops);
    }

    @Test
    public void testInvalidIndentWidth() {
        assertThrows(NumberFormatException.class, () -> read("indentWidth=wide"));
    }

    @Test
    public void testBundledDefaults() {
        var config = ConfigReader.readConfig();
        assertEquals(4, config.indentWidth);
        assertTrue(config.rangeLoops);
    }
}
