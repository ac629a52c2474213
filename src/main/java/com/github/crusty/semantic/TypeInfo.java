package com.github.crusty.semantic;

import java.util.List;
import java.util.Optional;

import com.github.crusty.parser.CompilationUnit.Field;
import com.github.crusty.parser.CompilationUnit.FunctionDeclaration;
import com.github.crusty.parser.CompilationUnit.Type;

/**
 * What the type environment knows about a named type.
 */
public sealed interface TypeInfo {

    String name();

    record StructInfo(String name, List<Field> fields, List<FunctionDeclaration> methods) implements TypeInfo {
        public Optional<Field> field(String fieldName) {
            return fields.stream().filter(f -> f.name().equals(fieldName)).findFirst();
        }

        public Optional<FunctionDeclaration> method(String methodName) {
            return methods.stream().filter(m -> m.name().equals(methodName)).findFirst();
        }
    }

    record EnumInfo(String name, List<String> variants) implements TypeInfo {}

    record AliasInfo(String name, Type target) implements TypeInfo {}
}
