package com.github.crusty.semantic;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.crusty.codegen.TypeNameMapper;
import com.github.crusty.error.SemanticError;
import com.github.crusty.error.SemanticErrorKind;
import com.github.crusty.error.Span;
import com.github.crusty.parser.CompilationUnit;
import com.github.crusty.parser.CompilationUnit.ArrayLiteral;
import com.github.crusty.parser.CompilationUnit.ArrayRepeat;
import com.github.crusty.parser.CompilationUnit.ArrayType;
import com.github.crusty.parser.CompilationUnit.AutoType;
import com.github.crusty.parser.CompilationUnit.Binary;
import com.github.crusty.parser.CompilationUnit.BinaryOperator;
import com.github.crusty.parser.CompilationUnit.Block;
import com.github.crusty.parser.CompilationUnit.BoolLiteral;
import com.github.crusty.parser.CompilationUnit.BreakStatement;
import com.github.crusty.parser.CompilationUnit.Call;
import com.github.crusty.parser.CompilationUnit.Capture;
import com.github.crusty.parser.CompilationUnit.CaptureMode;
import com.github.crusty.parser.CompilationUnit.Cast;
import com.github.crusty.parser.CompilationUnit.CharLiteral;
import com.github.crusty.parser.CompilationUnit.ConstDeclaration;
import com.github.crusty.parser.CompilationUnit.ContinueStatement;
import com.github.crusty.parser.CompilationUnit.EnumDefinition;
import com.github.crusty.parser.CompilationUnit.EnumVariant;
import com.github.crusty.parser.CompilationUnit.ErrorPropagation;
import com.github.crusty.parser.CompilationUnit.ExplicitGenericCall;
import com.github.crusty.parser.CompilationUnit.Expression;
import com.github.crusty.parser.CompilationUnit.ExpressionStatement;
import com.github.crusty.parser.CompilationUnit.FallibleType;
import com.github.crusty.parser.CompilationUnit.FieldAccess;
import com.github.crusty.parser.CompilationUnit.FloatLiteral;
import com.github.crusty.parser.CompilationUnit.ForInStatement;
import com.github.crusty.parser.CompilationUnit.ForStatement;
import com.github.crusty.parser.CompilationUnit.FunctionDeclaration;
import com.github.crusty.parser.CompilationUnit.FunctionType;
import com.github.crusty.parser.CompilationUnit.GotoStatement;
import com.github.crusty.parser.CompilationUnit.Identifier;
import com.github.crusty.parser.CompilationUnit.IfStatement;
import com.github.crusty.parser.CompilationUnit.Import;
import com.github.crusty.parser.CompilationUnit.Include;
import com.github.crusty.parser.CompilationUnit.Index;
import com.github.crusty.parser.CompilationUnit.IntLiteral;
import com.github.crusty.parser.CompilationUnit.Item;
import com.github.crusty.parser.CompilationUnit.LetStatement;
import com.github.crusty.parser.CompilationUnit.LoopStatement;
import com.github.crusty.parser.CompilationUnit.MacroCall;
import com.github.crusty.parser.CompilationUnit.MacroDefinition;
import com.github.crusty.parser.CompilationUnit.MethodCall;
import com.github.crusty.parser.CompilationUnit.NamedType;
import com.github.crusty.parser.CompilationUnit.Namespace;
import com.github.crusty.parser.CompilationUnit.NestedFunction;
import com.github.crusty.parser.CompilationUnit.NullLiteral;
import com.github.crusty.parser.CompilationUnit.Parameter;
import com.github.crusty.parser.CompilationUnit.PointerType;
import com.github.crusty.parser.CompilationUnit.PrimitiveType;
import com.github.crusty.parser.CompilationUnit.Range;
import com.github.crusty.parser.CompilationUnit.ReferenceType;
import com.github.crusty.parser.CompilationUnit.ReturnStatement;
import com.github.crusty.parser.CompilationUnit.SliceType;
import com.github.crusty.parser.CompilationUnit.Sizeof;
import com.github.crusty.parser.CompilationUnit.Statement;
import com.github.crusty.parser.CompilationUnit.StaticDeclaration;
import com.github.crusty.parser.CompilationUnit.StringLiteral;
import com.github.crusty.parser.CompilationUnit.StructDefinition;
import com.github.crusty.parser.CompilationUnit.StructInit;
import com.github.crusty.parser.CompilationUnit.SwitchCase;
import com.github.crusty.parser.CompilationUnit.SwitchStatement;
import com.github.crusty.parser.CompilationUnit.Ternary;
import com.github.crusty.parser.CompilationUnit.TupleLiteral;
import com.github.crusty.parser.CompilationUnit.TupleType;
import com.github.crusty.parser.CompilationUnit.Type;
import com.github.crusty.parser.CompilationUnit.TypeAlias;
import com.github.crusty.parser.CompilationUnit.TypeScopedCall;
import com.github.crusty.parser.CompilationUnit.TypeScopedPath;
import com.github.crusty.parser.CompilationUnit.Unary;
import com.github.crusty.parser.CompilationUnit.UnaryOperator;
import com.github.crusty.parser.CompilationUnit.UnionDefinition;
import com.github.crusty.parser.CompilationUnit.WhileStatement;
import com.github.crusty.parser.MacroRegistry;
import com.github.crusty.semantic.TypeInfo.EnumInfo;
import com.github.crusty.semantic.TypeInfo.StructInfo;

/**
 * Validates a parsed unit and returns it annotated: nested functions carry their capture sets,
 * designated initializers their struct type and constants their inferred type.
 * <p>
 * Analysis runs in two passes over the top level. The first registers every item so that
 * functions and types may be used before their declaration; the second walks bodies with a
 * {@link SymbolTable}. Errors never stop the walk. An analyzer is good for one unit.
 */
public class SemanticAnalyzer {
    private static final Logger logger = LoggerFactory.getLogger(SemanticAnalyzer.class);

    /** Names the target's prelude provides without a declaration. */
    private static final Set<String> PRELUDE = Set.of("Ok", "Err", "Some", "None", "drop", "self");

    /**
     * Top-level declarations of all files of a program, read-only once built.
     */
    public record ProgramSymbols(Scope scope, TypeEnvironment types, Map<String, List<SemanticError>> collisions) {
        public List<SemanticError> collisionsIn(String file) {
            return collisions.getOrDefault(file, List.of());
        }
    }

    private enum Access { READ, WRITE, MOVE }

    private record LoopFrame(Optional<String> label, boolean loop) {}

    private static class CaptureContext {
        final Symbol function;
        final int boundary;
        final Map<String, CaptureMode> captures = new LinkedHashMap<>();
        boolean selfReferenceReported;

        CaptureContext(Symbol function, int boundary) {
            this.function = function;
            this.boundary = boundary;
        }
    }

    private final SymbolTable symbols;
    private final TypeEnvironment types;
    private final List<SemanticError> errors = new ArrayList<>();
    private final Map<String, MacroDefinition> macros = new HashMap<>();

    private Deque<LoopFrame> loops = new ArrayDeque<>();
    private final Deque<CaptureContext> captureContexts = new ArrayDeque<>();
    private Type returnType = PrimitiveType.VOID;
    private Optional<String> selfType = Optional.empty();

    public SemanticAnalyzer() {
        this(new SymbolTable(), new TypeEnvironment());
    }

    /**
     * An analyzer for one file of a program whose top-level names were registered with
     * {@link #registerProgram(Map)}.
     */
    public SemanticAnalyzer(ProgramSymbols program) {
        this(new SymbolTable(program.scope()), new TypeEnvironment(program.types()));
    }

    SemanticAnalyzer(SymbolTable symbols, TypeEnvironment types) {
        this.symbols = symbols;
        this.types = types;
    }

    public SymbolTable symbols() {
        return symbols;
    }

    public TypeEnvironment types() {
        return types;
    }

    public AnalysisResult analyze(CompilationUnit unit) {
        for (var item : unit.items()) {
            register(item);
        }
        var annotated = new ArrayList<Item>();
        for (var item : unit.items()) {
            annotated.add(analyzeItem(item));
        }
        logger.debug("analyzed {} items, {} errors", annotated.size(), errors.size());
        return new AnalysisResult(new CompilationUnit(unit.docComments(), annotated, unit.span()), List.copyOf(errors));
    }

    /**
     * Registers the top-level names of every file into one program scope and type environment.
     * A name declared at the top level of two files is reported against the later file, naming
     * both. Duplicates within a single file are left to that file's own analysis.
     */
    public static ProgramSymbols registerProgram(Map<String, CompilationUnit> files) {
        var scope = new Scope(0, true);
        var env = new TypeEnvironment();
        var origins = new HashMap<String, String>();
        var collisions = new LinkedHashMap<String, List<SemanticError>>();

        for (var entry : files.entrySet()) {
            var file = entry.getKey();
            var registrar = new SemanticAnalyzer();
            for (var item : entry.getValue().items()) {
                registrar.register(item);
            }
            for (var symbol : registrar.symbols.current().symbols()) {
                var origin = origins.putIfAbsent(symbol.name(), file);
                if (origin != null && !origin.equals(file)) {
                    collisions.computeIfAbsent(file, f -> new ArrayList<>())
                            .add(new SemanticError(SemanticErrorKind.DUPLICATE_DEFINITION,
                                    symbol.name() + " is defined in both " + origin + " and " + file, symbol.span()));
                    continue;
                }
                scope.define(symbol);
            }
            for (var info : registrar.types.types().values()) {
                env.register(info);
            }
        }
        logger.debug("registered {} program symbols from {} files", scope.symbols().size(), files.size());
        return new ProgramSymbols(scope, env, collisions);
    }

    // ---- registration

    private void register(Item item) {
        if (item instanceof FunctionDeclaration fd) {
            declare(new Symbol(fd.name(), functionType(fd.parameters(), fd.returnType()), SymbolKind.FUNCTION, false, fd.span()));
        } else if (item instanceof StructDefinition sd) {
            registerType(new StructInfo(sd.name(), sd.fields(), sd.methods()), sd.span());
        } else if (item instanceof UnionDefinition ud) {
            registerType(new StructInfo(ud.name(), ud.fields(), List.of()), ud.span());
        } else if (item instanceof EnumDefinition ed) {
            registerType(new EnumInfo(ed.name(), ed.variants().stream().map(EnumVariant::name).toList()), ed.span());
        } else if (item instanceof TypeAlias ta) {
            registerType(new TypeInfo.AliasInfo(ta.name(), ta.target()), ta.span());
        } else if (item instanceof Namespace ns) {
            declare(new Symbol(ns.name(), AutoType.INSTANCE, SymbolKind.MODULE, false, ns.span()));
            for (var inner : ns.items()) {
                registerNamespaceType(inner);
            }
        } else if (item instanceof Import im) {
            var name = im.alias().orElse(im.path().get(im.path().size() - 1));
            declare(new Symbol(name, AutoType.INSTANCE, SymbolKind.MODULE, false, im.span()));
        } else if (item instanceof StaticDeclaration sd) {
            declare(Symbol.variable(sd.name(), sd.type(), sd.mutable(), sd.span()));
        } else if (item instanceof ConstDeclaration cd) {
            declare(new Symbol(cd.name(), cd.type().orElseGet(() -> literalType(cd.value())), SymbolKind.CONST, false, cd.span()));
        } else if (item instanceof MacroDefinition md) {
            var previous = macros.putIfAbsent(md.name(), md);
            if (previous != null) {
                error(SemanticErrorKind.DUPLICATE_DEFINITION, "macro " + md.name() + " is already defined", md.span());
            }
        }
    }

    // types declared in a namespace are reachable through qualified paths; register them by name
    private void registerNamespaceType(Item item) {
        if (item instanceof StructDefinition sd) {
            types.register(new StructInfo(sd.name(), sd.fields(), sd.methods()));
        } else if (item instanceof EnumDefinition ed) {
            types.register(new EnumInfo(ed.name(), ed.variants().stream().map(EnumVariant::name).toList()));
        } else if (item instanceof TypeAlias ta) {
            types.register(new TypeInfo.AliasInfo(ta.name(), ta.target()));
        } else if (item instanceof Namespace ns) {
            ns.items().forEach(this::registerNamespaceType);
        }
    }

    private void registerType(TypeInfo info, Span span) {
        if (types.register(info).isPresent()) {
            error(SemanticErrorKind.DUPLICATE_DEFINITION, "type " + info.name() + " is already defined", span);
            return;
        }
        declare(new Symbol(info.name(), new NamedType(info.name()), SymbolKind.TYPE, false, span));
    }

    private void declare(Symbol symbol) {
        var existing = symbols.insert(symbol);
        if (existing.isPresent()) {
            error(SemanticErrorKind.DUPLICATE_DEFINITION, symbol.name() + " is already defined in this scope", symbol.span());
        }
    }

    // ---- items

    private Item analyzeItem(Item item) {
        if (item instanceof FunctionDeclaration fd) {
            return analyzeFunction(fd);
        }
        if (item instanceof StructDefinition sd) {
            return analyzeStruct(sd);
        }
        if (item instanceof UnionDefinition ud) {
            error(SemanticErrorKind.UNSUPPORTED_FEATURE,
                    "union " + ud.name() + " is not supported; use a struct or enum", ud.span());
            return ud;
        }
        if (item instanceof EnumDefinition ed) {
            var seen = new HashSet<String>();
            for (var variant : ed.variants()) {
                if (!seen.add(variant.name())) {
                    error(SemanticErrorKind.DUPLICATE_DEFINITION,
                            "variant " + variant.name() + " is already defined in enum " + ed.name(), variant.span());
                }
            }
            return ed;
        }
        if (item instanceof Namespace ns) {
            symbols.enterScope(true);
            ns.items().forEach(this::register);
            var inner = ns.items().stream().map(this::analyzeItem).toList();
            symbols.exitScope();
            return new Namespace(ns.name(), inner, ns.span());
        }
        if (item instanceof Include inc) {
            error(SemanticErrorKind.UNSUPPORTED_FEATURE,
                    "#include is not supported; use #import", inc.span());
            return inc;
        }
        if (item instanceof StaticDeclaration sd) {
            var value = withStructType(sd.value(), sd.type());
            checkInitializer(sd.name(), sd.type(), value, typeOf(value, Access.READ), sd.span());
            return new StaticDeclaration(sd.name(), sd.type(), value, sd.mutable(), sd.span());
        }
        if (item instanceof ConstDeclaration cd) {
            return analyzeConst(cd);
        }
        if (item instanceof MacroDefinition md) {
            var seen = new HashSet<String>();
            for (var parameter : md.parameters()) {
                if (!seen.add(parameter)) {
                    error(SemanticErrorKind.DUPLICATE_DEFINITION,
                            "macro parameter " + parameter + " is declared twice", md.span());
                }
            }
            return md;
        }
        return item;
    }

    private StructDefinition analyzeStruct(StructDefinition sd) {
        var fieldNames = new HashSet<String>();
        for (var field : sd.fields()) {
            if (!fieldNames.add(field.name())) {
                error(SemanticErrorKind.DUPLICATE_DEFINITION,
                        "field " + field.name() + " is already defined in struct " + sd.name(), field.span());
            }
        }
        var methodNames = new HashSet<String>();
        var methods = new ArrayList<FunctionDeclaration>();
        var previousSelf = selfType;
        selfType = Optional.of(sd.name());
        for (var method : sd.methods()) {
            if (!methodNames.add(method.name())) {
                error(SemanticErrorKind.DUPLICATE_DEFINITION,
                        "method " + method.name() + " is already defined in struct " + sd.name(), method.span());
            }
            methods.add(analyzeFunction(method));
        }
        selfType = previousSelf;
        return new StructDefinition(sd.name(), sd.fields(), methods, sd.span());
    }

    private FunctionDeclaration analyzeFunction(FunctionDeclaration fd) {
        checkReservedName("function", fd.name(), fd.span());
        var previousReturn = returnType;
        returnType = selfResolved(fd.returnType());

        symbols.enterScope();
        declareParameters(fd.parameters());
        var body = analyzeBlock(fd.body());
        symbols.exitScope();

        returnType = previousReturn;
        return new FunctionDeclaration(fd.visibility(), fd.name(), fd.parameters(), fd.returnType(), body, fd.span());
    }

    private ConstDeclaration analyzeConst(ConstDeclaration cd) {
        var value = cd.type().map(t -> withStructType(cd.value(), t)).orElse(cd.value());
        var valueType = typeOf(value, Access.READ);
        cd.type().ifPresent(t -> checkInitializer(cd.name(), t, value, valueType, cd.span()));
        var type = cd.type().or(() -> valueType instanceof AutoType ? Optional.<Type>empty() : Optional.of(valueType));
        return new ConstDeclaration(cd.name(), type, value, cd.span());
    }

    private void declareParameters(List<Parameter> parameters) {
        for (var parameter : parameters) {
            declare(Symbol.variable(parameter.name(), selfResolved(parameter.type()), true, parameter.span()));
        }
    }

    private void checkReservedName(String what, String name, Span span) {
        if (MacroRegistry.isMacroName(name)) {
            error(SemanticErrorKind.UNSUPPORTED_FEATURE,
                    what + " " + name + ": name pattern reserved for macros; rename it without the surrounding __", span);
        }
    }

    // ---- statements

    private Block analyzeBlock(Block block) {
        symbols.enterScope();
        var statements = new ArrayList<Statement>();
        for (var statement : block.statements()) {
            statements.add(analyzeStatement(statement));
        }
        symbols.exitScope();
        return new Block(statements, block.span());
    }

    private Statement analyzeStatement(Statement statement) {
        if (statement instanceof Block b) {
            return analyzeBlock(b);
        }
        if (statement instanceof LetStatement let) {
            return analyzeLet(let);
        }
        if (statement instanceof ConstDeclaration cd) {
            var annotated = analyzeConst(cd);
            declare(new Symbol(cd.name(), annotated.type().orElse(AutoType.INSTANCE), SymbolKind.CONST, false, cd.span()));
            return annotated;
        }
        if (statement instanceof ExpressionStatement es) {
            var expression = es.expression();
            if (expression instanceof Binary b && b.operator() == BinaryOperator.ASSIGN && b.right() instanceof StructInit) {
                var target = typeOf(b.left(), Access.READ);
                expression = new Binary(b.left(), b.operator(), withStructType(b.right(), target), b.span());
            }
            typeOf(expression, Access.READ);
            return new ExpressionStatement(expression, es.span());
        }
        if (statement instanceof ReturnStatement rs) {
            return analyzeReturn(rs);
        }
        if (statement instanceof IfStatement is) {
            typeOf(is.condition(), Access.READ);
            var thenBlock = analyzeBlock(is.thenBlock());
            var elseBlock = is.elseBlock().map(this::analyzeBlock);
            return new IfStatement(is.condition(), thenBlock, elseBlock, is.span());
        }
        if (statement instanceof WhileStatement ws) {
            typeOf(ws.condition(), Access.READ);
            var body = inLoop(ws.label(), true, ws.body());
            return new WhileStatement(ws.label(), ws.condition(), body, ws.span());
        }
        if (statement instanceof LoopStatement ls) {
            return new LoopStatement(ls.label(), inLoop(ls.label(), true, ls.body()), ls.span());
        }
        if (statement instanceof ForStatement fs) {
            symbols.enterScope();
            var init = fs.init().map(this::analyzeStatement);
            fs.condition().ifPresent(c -> typeOf(c, Access.READ));
            fs.increment().ifPresent(i -> typeOf(i, Access.READ));
            var body = inLoop(fs.label(), true, fs.body());
            symbols.exitScope();
            return new ForStatement(fs.label(), init, fs.condition(), fs.increment(), body, fs.span());
        }
        if (statement instanceof ForInStatement fs) {
            var element = elementType(fs.iterable(), typeOf(fs.iterable(), Access.READ));
            symbols.enterScope();
            declare(Symbol.variable(fs.variable(), element, false, fs.span()));
            var body = inLoop(fs.label(), true, fs.body());
            symbols.exitScope();
            return new ForInStatement(fs.label(), fs.variable(), fs.iterable(), body, fs.span());
        }
        if (statement instanceof SwitchStatement ss) {
            var subject = typeOf(ss.subject(), Access.READ);
            var cases = new ArrayList<SwitchCase>();
            for (var c : ss.cases()) {
                for (var value : c.values()) {
                    var valueType = typeOf(value, Access.READ);
                    if (!accepts(subject, value, valueType) && !(value instanceof Range)) {
                        mismatch("case value of type " + describe(valueType) + " does not match switch subject of type "
                                + describe(subject), value.span());
                    }
                }
                cases.add(new SwitchCase(c.values(), inLoop(Optional.empty(), false, c.body()), c.span()));
            }
            var defaultCase = ss.defaultCase().map(d -> inLoop(Optional.empty(), false, d));
            return new SwitchStatement(ss.subject(), cases, defaultCase, ss.span());
        }
        if (statement instanceof BreakStatement bs) {
            checkJump("break", bs.label(), false, bs.span());
            return bs;
        }
        if (statement instanceof ContinueStatement cs) {
            checkJump("continue", cs.label(), true, cs.span());
            return cs;
        }
        if (statement instanceof GotoStatement gs) {
            error(SemanticErrorKind.UNSUPPORTED_FEATURE,
                    "goto is not supported; use labeled break or continue", gs.span());
            return gs;
        }
        if (statement instanceof NestedFunction nf) {
            return analyzeNestedFunction(nf);
        }
        return statement;
    }

    private Statement analyzeLet(LetStatement let) {
        Optional<Expression> initializer = let.initializer();
        Type symbolType = let.type().orElse(AutoType.INSTANCE);
        if (initializer.isPresent()) {
            var raw = initializer.get();
            var value = let.type().map(t -> withStructType(raw, t)).orElse(raw);
            var valueType = typeOf(value, Access.MOVE);
            if (let.type().isPresent()) {
                checkInitializer(let.name(), let.type().get(), value, valueType, let.span());
            } else {
                symbolType = valueType;
            }
            initializer = Optional.of(value);
        }
        declare(Symbol.variable(let.name(), selfResolved(symbolType), let.mutable(), let.span()));
        return new LetStatement(let.name(), let.type(), initializer, let.mutable(), let.span());
    }

    private Statement analyzeReturn(ReturnStatement rs) {
        if (rs.value().isEmpty()) {
            if (!isVoid(returnType) && !(returnType instanceof AutoType)) {
                mismatch("missing return value in function returning " + describe(returnType), rs.span());
            }
            return rs;
        }
        var value = withStructType(rs.value().get(), returnType);
        var valueType = typeOf(value, Access.MOVE);
        if (isVoid(returnType)) {
            if (!isVoid(valueType)) {
                mismatch("cannot return a value from a void function", rs.span());
            }
        } else if (!acceptsReturn(value, valueType)) {
            mismatch("cannot return " + describe(valueType) + " from a function returning " + describe(returnType),
                    rs.span());
        }
        return new ReturnStatement(Optional.of(value), rs.span());
    }

    private boolean acceptsReturn(Expression value, Type valueType) {
        if (returnType instanceof FallibleType fallible) {
            return accepts(fallible.success(), value, valueType) || valueType instanceof FallibleType;
        }
        return accepts(returnType, value, valueType);
    }

    private Block inLoop(Optional<String> label, boolean loop, Block body) {
        loops.push(new LoopFrame(label, loop));
        try {
            return analyzeBlock(body);
        } finally {
            loops.pop();
        }
    }

    private void checkJump(String keyword, Optional<String> label, boolean loopOnly, Span span) {
        if (label.isPresent()) {
            var known = loops.stream().anyMatch(f -> f.loop() && f.label().equals(label));
            if (!known) {
                error(SemanticErrorKind.INVALID_OPERATION, keyword + " to unknown loop label " + label.get(), span);
            }
            return;
        }
        if (loops.stream().noneMatch(LoopFrame::loop)) {
            error(SemanticErrorKind.INVALID_OPERATION, keyword + " outside of a loop", span);
            return;
        }
        // a trailing break was dropped by the parser, so one still inside a case leaves it early
        if (!loopOnly && !loops.peek().loop()) {
            error(SemanticErrorKind.UNSUPPORTED_FEATURE,
                    "break before the end of a switch case is not supported; use a labeled break", span);
        }
    }

    private Statement analyzeNestedFunction(NestedFunction nf) {
        checkReservedName("nested function", nf.name(), nf.span());
        if (nf.isStatic()) {
            error(SemanticErrorKind.UNSUPPORTED_FEATURE,
                    "nested function " + nf.name() + " cannot be static; declare it as a top-level function", nf.span());
        }
        if (!captureContexts.isEmpty()) {
            error(SemanticErrorKind.UNSUPPORTED_FEATURE, "nested function " + nf.name()
                    + " cannot be declared inside another nested function; declare it at the top level", nf.span());
        }
        var symbol = new Symbol(nf.name(), functionType(nf.parameters(), nf.returnType()), SymbolKind.FUNCTION, false,
                nf.span());
        declare(symbol);

        var context = new CaptureContext(symbol, symbols.depth() + 1);
        captureContexts.push(context);
        var previousReturn = returnType;
        var previousLoops = loops;
        returnType = selfResolved(nf.returnType());
        loops = new ArrayDeque<>();

        symbols.enterScope();
        declareParameters(nf.parameters());
        var body = analyzeBlock(nf.body());
        symbols.exitScope();

        loops = previousLoops;
        returnType = previousReturn;
        captureContexts.pop();

        var captures = context.captures.entrySet().stream()
                .map(e -> new Capture(e.getKey(), e.getValue()))
                .toList();
        logger.debug("nested function {} captures {}", nf.name(), captures);
        return nf.withCaptures(captures, body);
    }

    // ---- expressions

    /**
     * Infers the type of an expression, reporting errors on the way. {@link AutoType} stands for
     * "unknown" and is compatible with everything.
     */
    private Type typeOf(Expression expression, Access access) {
        if (expression instanceof IntLiteral) {
            return PrimitiveType.INT;
        }
        if (expression instanceof FloatLiteral) {
            return PrimitiveType.FLOAT;
        }
        if (expression instanceof BoolLiteral) {
            return PrimitiveType.BOOL;
        }
        if (expression instanceof CharLiteral) {
            return PrimitiveType.CHAR;
        }
        if (expression instanceof StringLiteral) {
            return new ReferenceType(new NamedType("str"), false);
        }
        if (expression instanceof NullLiteral) {
            return AutoType.INSTANCE;
        }
        if (expression instanceof Identifier id) {
            return identifierType(id, access);
        }
        if (expression instanceof Binary b) {
            return binaryType(b);
        }
        if (expression instanceof Unary u) {
            return unaryType(u);
        }
        if (expression instanceof Call c) {
            return callType(c);
        }
        if (expression instanceof MethodCall mc) {
            return methodCallType(mc);
        }
        if (expression instanceof FieldAccess fa) {
            return fieldType(fa, access);
        }
        if (expression instanceof Index ix) {
            var target = typeOf(ix.target(), access == Access.WRITE ? Access.WRITE : Access.READ);
            typeOf(ix.index(), Access.READ);
            var element = elementOf(types.resolve(dereferenced(target)));
            return ix.index() instanceof Range && !(element instanceof AutoType) ? new SliceType(element) : element;
        }
        if (expression instanceof Cast c) {
            typeOf(c.expression(), Access.READ);
            return c.type();
        }
        if (expression instanceof Sizeof) {
            return PrimitiveType.USIZE;
        }
        if (expression instanceof Ternary t) {
            typeOf(t.condition(), Access.READ);
            var thenType = typeOf(t.thenValue(), access);
            var elseType = typeOf(t.elseValue(), access);
            if (!accepts(thenType, t.elseValue(), elseType) && !accepts(elseType, t.thenValue(), thenType)) {
                mismatch("ternary branches have incompatible types " + describe(thenType) + " and " + describe(elseType),
                        t.span());
            }
            return thenType instanceof AutoType ? elseType : thenType;
        }
        if (expression instanceof StructInit si) {
            return structInitType(si);
        }
        if (expression instanceof ArrayLiteral al) {
            return arrayLiteralType(al);
        }
        if (expression instanceof ArrayRepeat ar) {
            var element = typeOf(ar.value(), Access.READ);
            typeOf(ar.count(), Access.READ);
            return ar.count() instanceof IntLiteral n ? new ArrayType(element, n.value()) : AutoType.INSTANCE;
        }
        if (expression instanceof TupleLiteral tl) {
            if (tl.elements().isEmpty()) {
                return PrimitiveType.VOID;
            }
            return new TupleType(tl.elements().stream().map(e -> typeOf(e, Access.MOVE)).toList());
        }
        if (expression instanceof Range r) {
            r.start().ifPresent(s -> typeOf(s, Access.READ));
            r.end().ifPresent(e -> typeOf(e, Access.READ));
            return AutoType.INSTANCE;
        }
        if (expression instanceof MacroCall mc) {
            captureMacroArguments(mc);
            return AutoType.INSTANCE;
        }
        if (expression instanceof ErrorPropagation ep) {
            var inner = typeOf(ep.expression(), Access.READ);
            if (!propagatesErrors(returnType)) {
                error(SemanticErrorKind.INVALID_OPERATION,
                        "the ? operator requires the enclosing function to return a fallible type such as "
                                + describe(returnType) + "?", ep.span());
            }
            return inner instanceof FallibleType f ? f.success() : AutoType.INSTANCE;
        }
        if (expression instanceof TypeScopedCall tc) {
            tc.arguments().forEach(a -> typeOf(a, Access.MOVE));
            return typeScopedReturn(tc.type(), tc.method());
        }
        if (expression instanceof TypeScopedPath tp) {
            return typeScopedPathType(tp);
        }
        if (expression instanceof ExplicitGenericCall gc) {
            gc.arguments().forEach(a -> typeOf(a, Access.MOVE));
            return AutoType.INSTANCE;
        }
        return AutoType.INSTANCE;
    }

    private Type identifierType(Identifier id, Access access) {
        var resolution = symbols.resolve(id.name());
        if (resolution.isEmpty()) {
            if (!PRELUDE.contains(id.name())) {
                error(SemanticErrorKind.UNDEFINED_VARIABLE, "undefined variable " + id.name(), id.span());
            }
            return AutoType.INSTANCE;
        }
        var symbol = resolution.get().symbol();
        recordCapture(resolution.get(), access, id.span());
        return symbol.isValue() ? symbol.type() : AutoType.INSTANCE;
    }

    private void recordCapture(SymbolTable.Resolution resolution, Access access, Span span) {
        var symbol = resolution.symbol();
        for (var context : captureContexts) {
            if (symbol == context.function) {
                if (!context.selfReferenceReported) {
                    context.selfReferenceReported = true;
                    error(SemanticErrorKind.UNSUPPORTED_FEATURE, "nested function " + symbol.name()
                            + " cannot refer to itself; declare it as a top-level function", span);
                }
                continue;
            }
            var scope = resolution.scope();
            if (scope.global() || scope.depth() >= context.boundary || !symbol.isValue()) {
                continue;
            }
            var mode = switch (access) {
                case WRITE -> CaptureMode.MUTABLE;
                case MOVE -> types.isCopy(symbol.type()) ? CaptureMode.IMMUTABLE : CaptureMode.CONSUMING;
                case READ -> CaptureMode.IMMUTABLE;
            };
            context.captures.merge(symbol.name(), mode, CaptureMode::join);
        }
    }

    // macro arguments are raw tokens; identifiers among them still read variables of the caller
    private void captureMacroArguments(MacroCall call) {
        if (captureContexts.isEmpty()) {
            return;
        }
        for (var argument : call.arguments()) {
            if (argument.isEmpty() || !Character.isJavaIdentifierStart(argument.charAt(0))) {
                continue;
            }
            symbols.resolve(argument).ifPresent(r -> recordCapture(r, Access.READ, call.span()));
        }
    }

    private Type binaryType(Binary b) {
        var op = b.operator();
        if (op.isAssignment()) {
            var target = typeOf(b.left(), Access.WRITE);
            checkAssignable(b.left(), b.span());
            var value = typeOf(b.right(), op == BinaryOperator.ASSIGN ? Access.MOVE : Access.READ);
            var pointerArithmetic = (op == BinaryOperator.ADD_ASSIGN || op == BinaryOperator.SUB_ASSIGN)
                    && types.resolve(target) instanceof PointerType;
            if (!pointerArithmetic && !accepts(target, b.right(), value)) {
                mismatch("cannot assign " + describe(value) + " to " + describe(target), b.span());
            }
            return target;
        }

        var left = typeOf(b.left(), Access.READ);
        var right = typeOf(b.right(), Access.READ);
        if (op.isLogical()) {
            requireBool(op, left, b.left().span());
            requireBool(op, right, b.right().span());
            return PrimitiveType.BOOL;
        }
        var pointerArithmetic = (op == BinaryOperator.ADD || op == BinaryOperator.SUB)
                && types.resolve(left) instanceof PointerType;
        if (!pointerArithmetic && !accepts(left, b.right(), right) && !accepts(right, b.left(), left)) {
            mismatch("mismatched operand types " + describe(left) + " and " + describe(right) + " for " + op.symbol,
                    b.span());
        }
        if (op.isComparison()) {
            return PrimitiveType.BOOL;
        }
        return left instanceof AutoType || isLiteral(b.left()) ? right : left;
    }

    private void requireBool(BinaryOperator op, Type type, Span span) {
        var resolved = types.resolve(type);
        if (!(resolved instanceof AutoType) && !resolved.equals(PrimitiveType.BOOL)) {
            mismatch("operator " + op.symbol + " requires bool operands, found " + describe(type), span);
        }
    }

    private Type unaryType(Unary u) {
        var op = u.operator();
        if (op.isIncrement()) {
            var type = typeOf(u.operand(), Access.WRITE);
            checkAssignable(u.operand(), u.span());
            return type;
        }
        switch (op) {
            case REF:
                return new ReferenceType(typeOf(u.operand(), Access.READ), false);
            case REF_MUT: {
                var type = typeOf(u.operand(), Access.WRITE);
                checkMutableBorrow(u.operand(), u.span());
                return new ReferenceType(type, true);
            }
            case DEREF: {
                var type = types.resolve(typeOf(u.operand(), Access.READ));
                if (type instanceof PointerType p) {
                    return p.target();
                }
                if (type instanceof ReferenceType r) {
                    return r.target();
                }
                if (type instanceof PrimitiveType) {
                    error(SemanticErrorKind.INVALID_OPERATION, "cannot dereference a value of type " + describe(type),
                            u.span());
                }
                return AutoType.INSTANCE;
            }
            default:
                return typeOf(u.operand(), Access.READ);
        }
    }

    private Type callType(Call c) {
        var callee = typeOf(c.callee(), Access.READ);
        var argumentTypes = c.arguments().stream().map(a -> typeOf(a, Access.MOVE)).toList();
        if (!(types.resolve(callee) instanceof FunctionType function)) {
            return AutoType.INSTANCE;
        }
        var name = c.callee() instanceof Identifier id ? id.name() : "function";
        checkArguments(name, function.parameters(), c.arguments(), argumentTypes, c.span());
        return function.returnType();
    }

    private void checkArguments(String name, List<Type> parameters, List<Expression> arguments, List<Type> argumentTypes,
            Span span) {
        if (parameters.size() != arguments.size()) {
            mismatch(name + " expects " + parameters.size() + " arguments but got " + arguments.size(), span);
            return;
        }
        for (int i = 0; i < parameters.size(); i++) {
            if (!accepts(parameters.get(i), arguments.get(i), argumentTypes.get(i))) {
                mismatch("argument " + (i + 1) + " of " + name + " expects " + describe(parameters.get(i)) + " but got "
                        + describe(argumentTypes.get(i)), arguments.get(i).span());
            }
        }
    }

    private Type methodCallType(MethodCall mc) {
        var receiver = typeOf(mc.receiver(), Access.READ);
        var argumentTypes = mc.arguments().stream().map(a -> typeOf(a, Access.MOVE)).toList();
        var struct = structOf(receiver);
        if (struct.isEmpty()) {
            return AutoType.INSTANCE;
        }
        var method = struct.get().method(mc.method());
        if (method.isEmpty()) {
            return AutoType.INSTANCE;
        }
        if (takesMutableSelf(method.get()) && mc.receiver() instanceof Identifier id) {
            symbols.resolve(id.name()).ifPresent(r -> recordCapture(r, Access.WRITE, mc.span()));
        }
        var parameters = method.get().parameters().stream()
                .filter(p -> !p.name().equals("self"))
                .map(p -> selfResolvedFor(p.type(), struct.get().name()))
                .toList();
        checkArguments(mc.method(), parameters, mc.arguments(), argumentTypes, mc.span());
        return selfResolvedFor(method.get().returnType(), struct.get().name());
    }

    private static boolean takesMutableSelf(FunctionDeclaration method) {
        return method.parameters().stream()
                .anyMatch(p -> p.name().equals("self") && p.type() instanceof ReferenceType r && r.mutable());
    }

    private Type fieldType(FieldAccess fa, Access access) {
        var target = typeOf(fa.target(), access == Access.WRITE ? Access.WRITE : Access.READ);
        var resolved = types.resolve(selfResolved(dereferenced(target)));
        if (resolved instanceof TupleType tuple) {
            // more digits than an int holds is past any tuple's arity
            if (isNumeric(fa.field()) && fa.field().length() < 10) {
                var index = Integer.parseInt(fa.field());
                if (index < tuple.elements().size()) {
                    return tuple.elements().get(index);
                }
            }
            error(SemanticErrorKind.INVALID_OPERATION, "tuple " + describe(target) + " has no field " + fa.field(),
                    fa.span());
            return AutoType.INSTANCE;
        }
        if (resolved instanceof PrimitiveType || resolved instanceof ArrayType || resolved instanceof SliceType) {
            error(SemanticErrorKind.INVALID_OPERATION,
                    "field access on non-struct type " + describe(resolved), fa.span());
            return AutoType.INSTANCE;
        }
        if (resolved instanceof NamedType named) {
            var info = types.lookup(named.name());
            if (info.isPresent() && info.get() instanceof StructInfo struct) {
                var field = struct.field(fa.field());
                if (field.isPresent()) {
                    return selfResolvedFor(field.get().type(), struct.name());
                }
                error(SemanticErrorKind.INVALID_OPERATION, "struct " + struct.name() + " has no field " + fa.field(),
                        fa.span());
            } else if (info.isPresent() && info.get() instanceof EnumInfo) {
                error(SemanticErrorKind.INVALID_OPERATION,
                        "field access on non-struct type " + named.name(), fa.span());
            }
        }
        return AutoType.INSTANCE;
    }

    private Type structInitType(StructInit si) {
        var type = selfResolved(si.type());
        if (type instanceof AutoType) {
            si.fields().forEach(f -> typeOf(f.value(), Access.MOVE));
            mismatch("cannot infer the struct type of this initializer; use a compound literal (T){ ... }", si.span());
            return AutoType.INSTANCE;
        }
        var struct = structOf(type);
        if (struct.isEmpty()) {
            si.fields().forEach(f -> typeOf(f.value(), Access.MOVE));
            if (type instanceof NamedType named && named.path().size() == 1 && types.lookup(named.name()).isEmpty()) {
                error(SemanticErrorKind.UNDEFINED_VARIABLE, "undefined type " + named.name(), si.span());
            }
            return type;
        }
        var seen = new HashSet<String>();
        for (var init : si.fields()) {
            var valueType = typeOf(init.value(), Access.MOVE);
            if (!seen.add(init.name())) {
                error(SemanticErrorKind.DUPLICATE_DEFINITION, "field " + init.name() + " is initialized twice",
                        init.span());
            }
            var field = struct.get().field(init.name());
            if (field.isEmpty()) {
                error(SemanticErrorKind.INVALID_OPERATION,
                        "struct " + struct.get().name() + " has no field " + init.name(), init.span());
            } else if (!accepts(field.get().type(), init.value(), valueType)) {
                mismatch("field " + init.name() + " expects " + describe(field.get().type()) + " but got "
                        + describe(valueType), init.span());
            }
        }
        return type;
    }

    private Type arrayLiteralType(ArrayLiteral al) {
        if (al.elements().isEmpty()) {
            return new ArrayType(AutoType.INSTANCE, 0);
        }
        var first = typeOf(al.elements().get(0), Access.MOVE);
        for (var element : al.elements().subList(1, al.elements().size())) {
            var elementType = typeOf(element, Access.MOVE);
            if (!accepts(first, element, elementType) && !accepts(elementType, al.elements().get(0), first)) {
                mismatch("array elements have incompatible types " + describe(first) + " and " + describe(elementType),
                        element.span());
            }
        }
        return new ArrayType(first, al.elements().size());
    }

    private Type typeScopedReturn(Type type, String method) {
        var struct = structOf(selfResolved(type));
        if (struct.isPresent()) {
            var declaration = struct.get().method(method);
            if (declaration.isPresent()) {
                return selfResolvedFor(declaration.get().returnType(), struct.get().name());
            }
        }
        return AutoType.INSTANCE;
    }

    private Type typeScopedPathType(TypeScopedPath tp) {
        if (!(selfResolved(tp.type()) instanceof NamedType named)) {
            return AutoType.INSTANCE;
        }
        var info = types.lookup(named.name());
        if (info.isPresent() && info.get() instanceof EnumInfo enumInfo) {
            if (!enumInfo.variants().contains(tp.member())) {
                error(SemanticErrorKind.INVALID_OPERATION, "enum " + enumInfo.name() + " has no variant " + tp.member(),
                        tp.span());
            }
            return new NamedType(enumInfo.name());
        }
        return AutoType.INSTANCE;
    }

    // ---- mutability

    private void checkAssignable(Expression target, Span span) {
        var base = target;
        while (true) {
            if (base instanceof FieldAccess fa) {
                base = fa.target();
            } else if (base instanceof Index ix) {
                base = ix.target();
            } else if (base instanceof Unary u && u.operator() == UnaryOperator.DEREF) {
                return;
            } else {
                break;
            }
        }
        if (!(base instanceof Identifier id)) {
            return;
        }
        var symbol = symbols.lookup(id.name());
        if (symbol.isEmpty()) {
            return;
        }
        var s = symbol.get();
        if (s.kind() == SymbolKind.CONST) {
            error(SemanticErrorKind.INVALID_OPERATION, "cannot assign to constant " + s.name(), span);
        } else if (s.kind() != SymbolKind.VARIABLE) {
            error(SemanticErrorKind.INVALID_OPERATION, "cannot assign to " + s.kind().name().toLowerCase() + " "
                    + s.name(), span);
        } else if (base == target) {
            if (!s.mutable()) {
                error(SemanticErrorKind.INVALID_OPERATION,
                        "cannot assign twice to immutable binding " + s.name() + "; declare it with var", span);
            }
        } else {
            var type = types.resolve(s.type());
            if (type instanceof ReferenceType r) {
                if (!r.mutable()) {
                    error(SemanticErrorKind.INVALID_OPERATION,
                            "cannot assign through shared reference " + s.name() + "; use &var", span);
                }
            } else if (!(type instanceof PointerType) && !s.mutable()) {
                error(SemanticErrorKind.INVALID_OPERATION,
                        "cannot assign to a part of immutable binding " + s.name() + "; declare it with var", span);
            }
        }
    }

    private void checkMutableBorrow(Expression operand, Span span) {
        if (operand instanceof Identifier id) {
            symbols.lookup(id.name())
                    .filter(s -> s.kind() == SymbolKind.VARIABLE && !s.mutable())
                    .ifPresent(s -> error(SemanticErrorKind.INVALID_OPERATION,
                            "cannot borrow immutable binding " + s.name() + " as mutable; declare it with var", span));
        }
    }

    // ---- type helpers

    private boolean accepts(Type expected, Expression value, Type actual) {
        if (types.isCompatible(expected, actual)) {
            return true;
        }
        var resolved = types.resolve(expected);
        if (resolved instanceof PrimitiveType p) {
            if (p.primitive().integer && isIntegerLiteral(value)) {
                return true;
            }
            if (p.primitive().isFloat() && isFloatLiteral(value)) {
                return true;
            }
        }
        if (resolved instanceof PointerType p && value instanceof StringLiteral
                && p.target().equals(PrimitiveType.CHAR)) {
            return true;
        }
        if (resolved instanceof FallibleType f) {
            return accepts(f.success(), value, actual);
        }
        return false;
    }

    private void checkInitializer(String name, Type declared, Expression value, Type valueType, Span span) {
        if (!accepts(selfResolved(declared), value, valueType)) {
            mismatch("cannot initialize " + name + " of type " + describe(declared) + " with " + describe(valueType),
                    span);
        }
    }

    /**
     * Gives a designated initializer without a type the type its context expects.
     */
    private Expression withStructType(Expression value, Type expected) {
        if (value instanceof StructInit si && si.type() instanceof AutoType) {
            var resolved = expected instanceof FallibleType f ? f.success() : expected;
            if (resolved instanceof NamedType || resolved instanceof AutoType) {
                return si.withType(selfResolved(resolved));
            }
        }
        return value;
    }

    private Optional<StructInfo> structOf(Type type) {
        var resolved = types.resolve(selfResolved(dereferenced(type)));
        if (resolved instanceof NamedType named) {
            var info = types.lookup(named.name());
            if (info.isPresent() && info.get() instanceof StructInfo struct) {
                return Optional.of(struct);
            }
        }
        return Optional.empty();
    }

    private Type dereferenced(Type type) {
        var current = types.resolve(type);
        while (true) {
            if (current instanceof ReferenceType r) {
                current = types.resolve(r.target());
            } else if (current instanceof PointerType p) {
                current = types.resolve(p.target());
            } else {
                return current;
            }
        }
    }

    private Type elementOf(Type type) {
        if (type instanceof ArrayType a) {
            return a.element();
        }
        if (type instanceof SliceType s) {
            return s.element();
        }
        if (type instanceof PointerType p) {
            return p.target();
        }
        return AutoType.INSTANCE;
    }

    private Type elementType(Expression iterable, Type iterableType) {
        if (iterable instanceof Range r) {
            var bound = r.start().or(r::end);
            if (bound.isPresent()) {
                var boundType = typeOf(bound.get(), Access.READ);
                return isLiteral(bound.get()) && r.end().isPresent() ? typeOf(r.end().get(), Access.READ) : boundType;
            }
            return AutoType.INSTANCE;
        }
        var resolved = types.resolve(iterableType);
        if (resolved instanceof ReferenceType ref) {
            var element = elementOf(types.resolve(ref.target()));
            return element instanceof AutoType ? element : new ReferenceType(element, ref.mutable());
        }
        return elementOf(resolved);
    }

    private Type selfResolved(Type type) {
        return selfType.map(name -> selfResolvedFor(type, name)).orElse(type);
    }

    private static Type selfResolvedFor(Type type, String structName) {
        if (type instanceof NamedType named && named.path().size() == 1 && named.name().equals("Self")) {
            return new NamedType(structName);
        }
        if (type instanceof ReferenceType r) {
            return new ReferenceType(selfResolvedFor(r.target(), structName), r.mutable());
        }
        if (type instanceof PointerType p) {
            return new PointerType(selfResolvedFor(p.target(), structName), p.mutable());
        }
        if (type instanceof FallibleType f) {
            return new FallibleType(selfResolvedFor(f.success(), structName));
        }
        return type;
    }

    private boolean propagatesErrors(Type type) {
        var resolved = types.resolve(type);
        if (resolved instanceof FallibleType || resolved instanceof AutoType) {
            return true;
        }
        return resolved instanceof NamedType named && (named.name().equals("Result") || named.name().equals("Option"));
    }

    private boolean isVoid(Type type) {
        return types.resolve(type).equals(PrimitiveType.VOID);
    }

    private static FunctionType functionType(List<Parameter> parameters, Type returnType) {
        return new FunctionType(parameters.stream().map(Parameter::type).toList(), returnType);
    }

    private static Type literalType(Expression value) {
        if (value instanceof IntLiteral || value instanceof Unary u && u.operand() instanceof IntLiteral) {
            return PrimitiveType.INT;
        }
        if (value instanceof FloatLiteral) {
            return PrimitiveType.FLOAT;
        }
        if (value instanceof BoolLiteral) {
            return PrimitiveType.BOOL;
        }
        if (value instanceof CharLiteral) {
            return PrimitiveType.CHAR;
        }
        if (value instanceof StringLiteral) {
            return new ReferenceType(new NamedType("str"), false);
        }
        return AutoType.INSTANCE;
    }

    private static boolean isIntegerLiteral(Expression value) {
        return value instanceof IntLiteral
                || value instanceof Unary u && u.operator() == UnaryOperator.NEG && u.operand() instanceof IntLiteral;
    }

    private static boolean isFloatLiteral(Expression value) {
        return value instanceof FloatLiteral
                || value instanceof Unary u && u.operator() == UnaryOperator.NEG && u.operand() instanceof FloatLiteral;
    }

    private static boolean isLiteral(Expression value) {
        return isIntegerLiteral(value) || isFloatLiteral(value);
    }

    private static boolean isNumeric(String s) {
        return !s.isEmpty() && s.chars().allMatch(Character::isDigit);
    }

    private static String describe(Type type) {
        return TypeNameMapper.crusty(type);
    }

    private void mismatch(String message, Span span) {
        error(SemanticErrorKind.TYPE_MISMATCH, message, span);
    }

    private void error(SemanticErrorKind kind, String message, Span span) {
        errors.add(new SemanticError(kind, message, span));
    }
}
