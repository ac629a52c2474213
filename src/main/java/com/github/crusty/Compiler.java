package com.github.crusty;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.crusty.Tokenizer.Dialect;
import com.github.crusty.codegen.CodeGenerator;
import com.github.crusty.codegen.TargetLanguage;
import com.github.crusty.error.Diagnostic;
import com.github.crusty.error.TranslationException;
import com.github.crusty.parser.CompilationUnit;
import com.github.crusty.parser.ParseResult;
import com.github.crusty.parser.Parser;
import com.github.crusty.parser.RustParser;
import com.github.crusty.semantic.SemanticAnalyzer;

import lombok.Setter;

/**
 * Entry point of the translation pipeline: tokenize, parse, analyze and generate, in either
 * direction. Every stage reports user errors as diagnostics; code is only generated for a unit
 * that has none.
 */
public class Compiler implements ConfigReader.ConfigTarget {

    private static final Logger logger = LoggerFactory.getLogger(Compiler.class);

    @Setter
    private List<String> lookupPath = new ArrayList<>();
    @Setter
    private int indentWidth = 4;
    @Setter
    private String fallibleErrorType = RustParser.DEFAULT_ERROR_TYPE;
    @Setter
    private boolean rangeLoops = true;

    public enum Direction {
        /** C-dialect to target language. */
        FORWARD(Dialect.CRUSTY, TargetLanguage.RUST),
        /** Target language to C-dialect. */
        REVERSE(Dialect.RUST, TargetLanguage.CRUSTY);

        final Dialect source;
        final TargetLanguage target;

        Direction(Dialect source, TargetLanguage target) {
            this.source = source;
            this.target = target;
        }

        public static Direction ofFileName(String fileName) {
            if (fileName.endsWith(".rs")) {
                return REVERSE;
            }
            return FORWARD;
        }
    }

    public record TranslationResult(String output, List<Diagnostic> diagnostics) {

        public boolean isSuccess() {
            return diagnostics.isEmpty();
        }
    }

    public static void main(String[] args) {
        var compiler = new Compiler();
        ConfigReader.readConfig().applyConfig(compiler);

        boolean failed = false;
        for (var file : args) {
            var result = compiler.translateFile(file);
            result.diagnostics().forEach(d -> System.err.println(file + ": " + d.render()));
            System.out.print(result.output());
            failed |= !result.isSuccess();
        }
        if (failed) {
            System.exit(1);
        }
    }

    public TranslationResult translate(String source, Direction direction) {
        return translate("<input>", source, direction);
    }

    /**
     * Like {@link #translate(String, Direction)}, but fails with a {@link TranslationException}
     * carrying the diagnostics instead of returning them.
     */
    public String translateOrThrow(String source, Direction direction) {
        var result = translate(source, direction);
        if (!result.isSuccess()) {
            throw new TranslationException(result.diagnostics());
        }
        return result.output();
    }

    public TranslationResult translateFile(String fileName) {
        var path = resolve(fileName);
        try {
            return translate(fileName, Files.readString(path), Direction.ofFileName(fileName));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Translates several files as one program. Top-level names of all files are registered
     * before any file is analyzed, so files may refer to each other's items.
     */
    public Map<String, TranslationResult> translateProgram(Map<String, String> sources, Direction direction) {
        Map<String, ParseResult> parsed = new LinkedHashMap<>();
        sources.forEach((file, source) -> parsed.put(file, parse(source, direction)));

        Map<String, CompilationUnit> units = new LinkedHashMap<>();
        parsed.forEach((file, result) -> units.put(file, result.unit()));
        var program = SemanticAnalyzer.registerProgram(units);

        Map<String, TranslationResult> results = new LinkedHashMap<>();
        parsed.forEach((file, result) -> {
            List<Diagnostic> diagnostics = new ArrayList<>(result.diagnostics());
            diagnostics.addAll(program.collisionsIn(file));
            results.put(file, finish(file, result.unit(), diagnostics, new SemanticAnalyzer(program), direction));
        });
        return results;
    }

    private TranslationResult translate(String name, String source, Direction direction) {
        var parsed = parse(source, direction);
        return finish(name, parsed.unit(), new ArrayList<>(parsed.diagnostics()), new SemanticAnalyzer(), direction);
    }

    private ParseResult parse(String source, Direction direction) {
        var tokens = new Tokenizer(direction.source).tokenize(source);
        return switch (direction) {
            case FORWARD -> Parser.parse(tokens);
            case REVERSE -> new RustParser(fallibleErrorType).parseCompilationUnit(tokens);
        };
    }

    private TranslationResult finish(String name, CompilationUnit unit, List<Diagnostic> diagnostics,
            SemanticAnalyzer analyzer, Direction direction) {
        var analysis = analyzer.analyze(unit);
        diagnostics.addAll(analysis.errors());
        if (!diagnostics.isEmpty()) {
            logger.warn("{}: translation failed with {} diagnostics", name, diagnostics.size());
            return new TranslationResult("", List.copyOf(diagnostics));
        }
        var output = codeGenerator().generate(analysis.unit(), direction.target);
        logger.info("{}: translated {} items to {}", name, unit.items().size(), direction.target);
        return new TranslationResult(output, List.of());
    }

    CodeGenerator codeGenerator() {
        var generator = new CodeGenerator();
        generator.setIndentWidth(indentWidth);
        generator.setFallibleErrorType(fallibleErrorType);
        generator.setRangeLoops(rangeLoops);
        return generator;
    }

    private Path resolve(String fileName) {
        var path = Path.of(fileName);
        if (path.isAbsolute() || Files.exists(path)) {
            return path;
        }
        for (var directory : lookupPath) {
            var candidate = Path.of(directory, fileName);
            if (Files.exists(candidate)) {
                return candidate;
            }
        }
        return path;
    }
}
