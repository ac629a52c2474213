package com.github.crusty.codegen;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.crusty.parser.CompilationUnit;
import com.github.crusty.parser.RustParser;

import lombok.Getter;
import lombok.Setter;

/**
 * Turns an analyzed tree into source text of either language. The generator holds only its
 * options, so one instance may serve any number of units.
 */
public class CodeGenerator {

    private static final Logger logger = LoggerFactory.getLogger(CodeGenerator.class);

    @Getter
    @Setter
    private int indentWidth = 4;
    @Getter
    @Setter
    private String fallibleErrorType = RustParser.DEFAULT_ERROR_TYPE;
    @Getter
    @Setter
    private boolean rangeLoops = true;

    public String generate(CompilationUnit unit, TargetLanguage target) {
        var out = new SourceWriter(indentWidth);
        var text = switch (target) {
            case RUST -> new RustEmitter(out, new TypeNameMapper(fallibleErrorType), rangeLoops).emit(unit);
            case CRUSTY -> new CrustyEmitter(out).emit(unit);
        };
        logger.debug("generated {} characters of {} for {} items", text.length(), target, unit.items().size());
        return text;
    }
}
