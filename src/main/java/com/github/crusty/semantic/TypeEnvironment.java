package com.github.crusty.semantic;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.github.crusty.parser.CompilationUnit.ArrayType;
import com.github.crusty.parser.CompilationUnit.AutoType;
import com.github.crusty.parser.CompilationUnit.FallibleType;
import com.github.crusty.parser.CompilationUnit.FunctionType;
import com.github.crusty.parser.CompilationUnit.NamedType;
import com.github.crusty.parser.CompilationUnit.PointerType;
import com.github.crusty.parser.CompilationUnit.PrimitiveType;
import com.github.crusty.parser.CompilationUnit.ReferenceType;
import com.github.crusty.parser.CompilationUnit.SliceType;
import com.github.crusty.parser.CompilationUnit.TupleType;
import com.github.crusty.parser.CompilationUnit.Type;
import com.github.crusty.semantic.TypeInfo.AliasInfo;

/**
 * Registry of named types and the structural compatibility relation between types. Types are
 * global once registered; an environment may fall back to a read-only parent holding the types
 * of other files of the same program.
 */
public class TypeEnvironment {

    private final TypeEnvironment parent;
    private final Map<String, TypeInfo> types = new LinkedHashMap<>();

    public TypeEnvironment() {
        this(null);
    }

    public TypeEnvironment(TypeEnvironment parent) {
        this.parent = parent;
    }

    /**
     * Registers a type. Returns the type already registered under that name, if any; the new
     * one is not registered then.
     */
    public Optional<TypeInfo> register(TypeInfo info) {
        return Optional.ofNullable(types.putIfAbsent(info.name(), info));
    }

    public Optional<TypeInfo> lookup(String name) {
        var info = types.get(name);
        if (info == null && parent != null) {
            return parent.lookup(name);
        }
        return Optional.ofNullable(info);
    }

    public Map<String, TypeInfo> types() {
        return Map.copyOf(types);
    }

    /**
     * Follows aliases until a non-alias type is reached. Cyclic aliases resolve to
     * {@link AutoType}.
     */
    public Type resolve(Type type) {
        var seen = new HashSet<String>();
        var current = type;
        while (current instanceof NamedType named && named.arguments().isEmpty()) {
            var info = lookup(named.name());
            if (info.isEmpty() || !(info.get() instanceof AliasInfo alias)) {
                return current;
            }
            if (!seen.add(alias.name())) {
                return AutoType.INSTANCE;
            }
            current = alias.target();
        }
        return current;
    }

    /**
     * Whether a value of type {@code actual} may be used where {@code expected} is required.
     * {@code auto} is compatible with everything, {@code int} with {@code i32} and
     * {@code float} with {@code f64}. A mutable reference may stand in for a shared one, not
     * the other way round.
     */
    public boolean isCompatible(Type expected, Type actual) {
        var e = resolve(expected);
        var a = resolve(actual);

        if (e instanceof AutoType || a instanceof AutoType) {
            return true;
        }
        if (e instanceof PrimitiveType ep && a instanceof PrimitiveType ap) {
            return ep.primitive().rustName.equals(ap.primitive().rustName);
        }
        if (e instanceof NamedType en && a instanceof NamedType an) {
            if (en.name().equals("Self") || an.name().equals("Self")) {
                return true;
            }
            return en.name().equals(an.name()) && allCompatible(en.arguments(), an.arguments());
        }
        if (e instanceof PointerType ep && a instanceof PointerType ap) {
            return ep.mutable() == ap.mutable() && isCompatible(ep.target(), ap.target());
        }
        if (e instanceof ReferenceType er && a instanceof ReferenceType ar) {
            return (ar.mutable() || !er.mutable()) && isCompatible(er.target(), ar.target());
        }
        if (e instanceof ArrayType ea && a instanceof ArrayType aa) {
            return ea.size() == aa.size() && isCompatible(ea.element(), aa.element());
        }
        if (e instanceof SliceType es && a instanceof SliceType sa) {
            return isCompatible(es.element(), sa.element());
        }
        if (e instanceof SliceType es && a instanceof ArrayType aa) {
            return isCompatible(es.element(), aa.element());
        }
        if (e instanceof TupleType et && a instanceof TupleType at) {
            return allCompatible(et.elements(), at.elements());
        }
        if (e instanceof FunctionType ef && a instanceof FunctionType af) {
            return allCompatible(ef.parameters(), af.parameters()) && isCompatible(ef.returnType(), af.returnType());
        }
        if (e instanceof FallibleType ef && a instanceof FallibleType af) {
            return isCompatible(ef.success(), af.success());
        }
        return false;
    }

    private boolean allCompatible(List<Type> expected, List<Type> actual) {
        if (expected.size() != actual.size()) {
            return false;
        }
        for (int i = 0; i < expected.size(); i++) {
            if (!isCompatible(expected.get(i), actual.get(i))) {
                return false;
            }
        }
        return true;
    }

    /**
     * Whether values of the type are copied rather than moved when passed by value. Unknown
     * types count as copyable.
     */
    public boolean isCopy(Type type) {
        var t = resolve(type);
        if (t instanceof NamedType named) {
            var info = lookup(named.name());
            return info.isPresent() && info.get() instanceof TypeInfo.EnumInfo;
        }
        if (t instanceof ArrayType array) {
            return isCopy(array.element());
        }
        if (t instanceof TupleType tuple) {
            return tuple.elements().stream().allMatch(this::isCopy);
        }
        if (t instanceof ReferenceType reference) {
            return !reference.mutable();
        }
        if (t instanceof FallibleType || t instanceof SliceType) {
            return false;
        }
        return true;
    }
}
