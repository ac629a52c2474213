package com.github.crusty.codegen;

import java.util.List;
import java.util.stream.Collectors;

import com.github.crusty.parser.CompilationUnit.ArrayType;
import com.github.crusty.parser.CompilationUnit.AutoType;
import com.github.crusty.parser.CompilationUnit.FallibleType;
import com.github.crusty.parser.CompilationUnit.FunctionType;
import com.github.crusty.parser.CompilationUnit.NamedType;
import com.github.crusty.parser.CompilationUnit.PointerType;
import com.github.crusty.parser.CompilationUnit.Primitive;
import com.github.crusty.parser.CompilationUnit.PrimitiveType;
import com.github.crusty.parser.CompilationUnit.ReferenceType;
import com.github.crusty.parser.CompilationUnit.SliceType;
import com.github.crusty.parser.CompilationUnit.TupleType;
import com.github.crusty.parser.CompilationUnit.Type;

import lombok.RequiredArgsConstructor;

/**
 * Renders types in either surface syntax.
 */
@RequiredArgsConstructor
public class TypeNameMapper {

    /** Error type of the {@code Result} generated for a fallible type. */
    private final String fallibleErrorType;

    public String rust(Type type) {
        if (type instanceof PrimitiveType p) {
            return p.primitive().rustName;
        }
        if (type instanceof NamedType named) {
            return named.qualifiedName("::") + rustArguments(named.arguments());
        }
        if (type instanceof PointerType p) {
            return (p.mutable() ? "*mut " : "*const ") + rust(p.target());
        }
        if (type instanceof ReferenceType r) {
            return (r.mutable() ? "&mut " : "&") + rust(r.target());
        }
        if (type instanceof ArrayType a) {
            return "[" + rust(a.element()) + "; " + a.size() + "]";
        }
        if (type instanceof SliceType s) {
            return "[" + rust(s.element()) + "]";
        }
        if (type instanceof TupleType t) {
            return "(" + join(t.elements()) + ")";
        }
        if (type instanceof FunctionType f) {
            return "fn(" + join(f.parameters()) + ")" + rustReturn(f.returnType());
        }
        if (type instanceof FallibleType f) {
            return "Result<" + rust(f.success()) + ", " + fallibleErrorType + ">";
        }
        return "_";
    }

    /**
     * The type of a parameter or return value: function types become {@code impl Fn} so that
     * capturing closures may be passed.
     */
    public String rustSignature(Type type) {
        if (type instanceof FunctionType f) {
            return "impl Fn(" + join(f.parameters()) + ")" + rustReturn(f.returnType());
        }
        return rust(type);
    }

    /**
     * A type in expression position, where generic arguments need the turbofish.
     */
    public String rustPath(Type type) {
        if (type instanceof NamedType named && !named.arguments().isEmpty()) {
            return named.qualifiedName("::") + "::" + rustArguments(named.arguments());
        }
        return rust(type);
    }

    String rustReturn(Type returnType) {
        if (returnType instanceof PrimitiveType p && p.primitive() == Primitive.VOID) {
            return "";
        }
        return " -> " + rust(returnType);
    }

    private String rustArguments(List<Type> arguments) {
        return arguments.isEmpty() ? "" : "<" + join(arguments) + ">";
    }

    private String join(List<Type> types) {
        return types.stream().map(this::rust).collect(Collectors.joining(", "));
    }

    /**
     * The C-dialect spelling. A pointer chain whose innermost pointer is immutable is written
     * with a leading {@code const}.
     */
    public static String crusty(Type type) {
        if (type instanceof PointerType p) {
            var innermost = p;
            while (innermost.target() instanceof PointerType inner) {
                innermost = inner;
            }
            var stars = new StringBuilder();
            for (Type t = p; t instanceof PointerType; t = ((PointerType) t).target()) {
                stars.append('*');
            }
            return (innermost.mutable() ? "" : "const ") + crusty(innermost.target()) + stars;
        }
        if (type instanceof PrimitiveType p) {
            return p.primitive().crustyName;
        }
        if (type instanceof NamedType named) {
            var arguments = named.arguments().isEmpty() ? ""
                    : named.arguments().stream().map(TypeNameMapper::crusty).collect(Collectors.joining(", ", "<", ">"));
            return named.qualifiedName(".") + arguments;
        }
        if (type instanceof ReferenceType r) {
            return (r.mutable() ? "&var " : "&") + crusty(r.target());
        }
        if (type instanceof ArrayType a) {
            return crusty(a.element()) + "[" + a.size() + "]";
        }
        if (type instanceof SliceType s) {
            return crusty(s.element()) + "[]";
        }
        if (type instanceof TupleType t) {
            return t.elements().stream().map(TypeNameMapper::crusty).collect(Collectors.joining(", ", "(", ")"));
        }
        if (type instanceof FunctionType f) {
            var parameters = f.parameters().stream().map(TypeNameMapper::crusty).collect(Collectors.joining(", "));
            var isVoid = f.returnType() instanceof PrimitiveType p && p.primitive() == Primitive.VOID;
            return "fn(" + parameters + ")" + (isVoid ? "" : " -> " + crusty(f.returnType()));
        }
        if (type instanceof FallibleType f) {
            return crusty(f.success()) + "?";
        }
        if (type instanceof AutoType) {
            return "auto";
        }
        return type.toString();
    }
}
