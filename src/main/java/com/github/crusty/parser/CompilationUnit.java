package com.github.crusty.parser;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import com.github.crusty.error.Span;

/**
 * Root of the syntax tree shared by both translation directions. Node shapes carry no trace of
 * the surface syntax they were parsed from; every item, statement and expression carries its
 * {@link Span}. Types are plain values without spans.
 */
public record CompilationUnit(List<String> docComments, List<Item> items, Span span) {

    public CompilationUnit(List<Item> items) {
        this(List.of(), items, Span.NONE);
    }

    public sealed interface Node {
        Span span();
    }

    // ---- items

    public sealed interface Item extends Node {}

    public enum Visibility { PUBLIC, PRIVATE }

    public record Parameter(String name, Type type, Span span) {
        public Parameter(String name, Type type) {
            this(name, type, Span.NONE);
        }
    }

    public record FunctionDeclaration(Visibility visibility, String name, List<Parameter> parameters, Type returnType,
            Block body, Span span) implements Item {
        public FunctionDeclaration(String name, List<Parameter> parameters, Type returnType, Block body) {
            this(Visibility.PUBLIC, name, parameters, returnType, body, Span.NONE);
        }
    }

    public record Field(String name, Type type, Span span) {
        public Field(String name, Type type) {
            this(name, type, Span.NONE);
        }
    }

    public record StructDefinition(String name, List<Field> fields, List<FunctionDeclaration> methods, Span span) implements Item {
        public StructDefinition(String name, List<Field> fields) {
            this(name, fields, List.of(), Span.NONE);
        }
    }

    public record UnionDefinition(String name, List<Field> fields, Span span) implements Item {}

    public record EnumVariant(String name, Optional<Long> value, Span span) {
        public EnumVariant(String name) {
            this(name, Optional.empty(), Span.NONE);
        }
        public EnumVariant(String name, long value) {
            this(name, Optional.of(value), Span.NONE);
        }
    }

    public record EnumDefinition(String name, List<EnumVariant> variants, Span span) implements Item {
        public EnumDefinition(String name, List<EnumVariant> variants) {
            this(name, variants, Span.NONE);
        }
    }

    public record TypeAlias(String name, Type target, Span span) implements Item {
        public TypeAlias(String name, Type target) {
            this(name, target, Span.NONE);
        }
    }

    public record Namespace(String name, List<Item> items, Span span) implements Item {
        public Namespace(String name, List<Item> items) {
            this(name, items, Span.NONE);
        }
    }

    /**
     * {@code #import} and {@code #export}; an exported import is re-exported from the module.
     */
    public record Import(List<String> path, Optional<String> alias, boolean exported, Span span) implements Item {
        public Import(List<String> path) {
            this(path, Optional.empty(), false, Span.NONE);
        }
    }

    public record Include(String header, boolean system, Span span) implements Item {}

    public record StaticDeclaration(String name, Type type, Expression value, boolean mutable, Span span) implements Item {
        public StaticDeclaration(String name, Type type, Expression value, boolean mutable) {
            this(name, type, value, mutable, Span.NONE);
        }
    }

    public enum MacroDelimiter {
        NONE("", ""),
        PARENTHESIS("(", ")"),
        BRACKET("[", "]"),
        BRACE("{", "}");

        public final String open;
        public final String close;

        MacroDelimiter(String open, String close) {
            this.open = open;
            this.close = close;
        }
    }

    /**
     * A {@code #define}. The body is kept as raw token images; it is validated structurally but
     * never analyzed.
     */
    public record MacroDefinition(String name, List<String> parameters, MacroDelimiter delimiter, List<String> body,
            Span span) implements Item {
        public MacroDefinition(String name, List<String> parameters, MacroDelimiter delimiter, List<String> body) {
            this(name, parameters, delimiter, body, Span.NONE);
        }
    }

    // ---- statements

    public sealed interface Statement extends Node {}

    public record Block(List<Statement> statements, Span span) implements Statement {
        public Block(List<Statement> statements) {
            this(statements, Span.NONE);
        }
        public Block(Statement... statements) {
            this(List.of(statements), Span.NONE);
        }
    }

    public record LetStatement(String name, Optional<Type> type, Optional<Expression> initializer, boolean mutable,
            Span span) implements Statement {
        public LetStatement(String name, Optional<Type> type, Optional<Expression> initializer, boolean mutable) {
            this(name, type, initializer, mutable, Span.NONE);
        }
        public LetStatement(String name, Type type, Expression initializer) {
            this(name, Optional.of(type), Optional.of(initializer), false, Span.NONE);
        }
        public LetStatement(String name, Expression initializer) {
            this(name, Optional.empty(), Optional.of(initializer), false, Span.NONE);
        }
    }

    /**
     * A constant, either global or local to a block.
     */
    public record ConstDeclaration(String name, Optional<Type> type, Expression value, Span span) implements Item, Statement {
        public ConstDeclaration(String name, Type type, Expression value) {
            this(name, Optional.of(type), value, Span.NONE);
        }
    }

    public record ExpressionStatement(Expression expression, Span span) implements Statement {
        public ExpressionStatement(Expression expression) {
            this(expression, Span.NONE);
        }
    }

    public record ReturnStatement(Optional<Expression> value, Span span) implements Statement {
        public ReturnStatement(Expression value) {
            this(Optional.of(value), Span.NONE);
        }
        public ReturnStatement() {
            this(Optional.empty(), Span.NONE);
        }
    }

    /**
     * An {@code else if} chain is an else block holding exactly one {@code IfStatement}.
     */
    public record IfStatement(Expression condition, Block thenBlock, Optional<Block> elseBlock, Span span) implements Statement {
        public IfStatement(Expression condition, Block thenBlock) {
            this(condition, thenBlock, Optional.empty(), Span.NONE);
        }
        public IfStatement(Expression condition, Block thenBlock, Block elseBlock) {
            this(condition, thenBlock, Optional.of(elseBlock), Span.NONE);
        }
    }

    public record WhileStatement(Optional<String> label, Expression condition, Block body, Span span) implements Statement {
        public WhileStatement(Expression condition, Block body) {
            this(Optional.empty(), condition, body, Span.NONE);
        }
    }

    public record LoopStatement(Optional<String> label, Block body, Span span) implements Statement {
        public LoopStatement(String label, Block body) {
            this(Optional.of(label), body, Span.NONE);
        }
        public LoopStatement(Block body) {
            this(Optional.empty(), body, Span.NONE);
        }
    }

    public record ForStatement(Optional<String> label, Optional<Statement> init, Optional<Expression> condition,
            Optional<Expression> increment, Block body, Span span) implements Statement {
        public ForStatement(Statement init, Expression condition, Expression increment, Block body) {
            this(Optional.empty(), Optional.of(init), Optional.of(condition), Optional.of(increment), body, Span.NONE);
        }
    }

    public record ForInStatement(Optional<String> label, String variable, Expression iterable, Block body, Span span) implements Statement {
        public ForInStatement(String variable, Expression iterable, Block body) {
            this(Optional.empty(), variable, iterable, body, Span.NONE);
        }
    }

    public record SwitchCase(List<Expression> values, Block body, Span span) {
        public SwitchCase(List<Expression> values, Block body) {
            this(values, body, Span.NONE);
        }
    }

    public record SwitchStatement(Expression subject, List<SwitchCase> cases, Optional<Block> defaultCase, Span span) implements Statement {
        public SwitchStatement(Expression subject, List<SwitchCase> cases, Optional<Block> defaultCase) {
            this(subject, cases, defaultCase, Span.NONE);
        }
    }

    public record BreakStatement(Optional<String> label, Span span) implements Statement {
        public BreakStatement(String label) {
            this(Optional.of(label), Span.NONE);
        }
        public BreakStatement() {
            this(Optional.empty(), Span.NONE);
        }
    }

    public record ContinueStatement(Optional<String> label, Span span) implements Statement {
        public ContinueStatement(String label) {
            this(Optional.of(label), Span.NONE);
        }
        public ContinueStatement() {
            this(Optional.empty(), Span.NONE);
        }
    }

    public record GotoStatement(String label, Span span) implements Statement {}

    public enum CaptureMode {
        IMMUTABLE("Fn"),
        MUTABLE("FnMut"),
        CONSUMING("FnOnce");

        public final String closureTrait;

        CaptureMode(String closureTrait) {
            this.closureTrait = closureTrait;
        }

        public CaptureMode join(CaptureMode other) {
            return compareTo(other) >= 0 ? this : other;
        }
    }

    public record Capture(String name, CaptureMode mode) {}

    /**
     * A function declared inside another function's body. {@code captures} is empty as parsed
     * and filled in by the semantic analyzer.
     */
    public record NestedFunction(String name, List<Parameter> parameters, Type returnType, Block body, boolean isStatic,
            List<Capture> captures, Span span) implements Statement {
        public NestedFunction(String name, List<Parameter> parameters, Type returnType, Block body) {
            this(name, parameters, returnType, body, false, List.of(), Span.NONE);
        }

        public CaptureMode closureMode() {
            return captures.stream().map(Capture::mode).reduce(CaptureMode.IMMUTABLE, CaptureMode::join);
        }

        public NestedFunction withCaptures(List<Capture> captures, Block body) {
            return new NestedFunction(name, parameters, returnType, body, isStatic, List.copyOf(captures), span);
        }
    }

    // ---- expressions

    public sealed interface Expression extends Node {}

    /** An integer literal. {@code value} holds its 64 bits and reads as unsigned. */
    public record IntLiteral(long value, Span span) implements Expression {
        public IntLiteral(long value) {
            this(value, Span.NONE);
        }
    }
    public record FloatLiteral(double value, Span span) implements Expression {
        public FloatLiteral(double value) {
            this(value, Span.NONE);
        }
    }
    public record StringLiteral(String value, Span span) implements Expression {
        public StringLiteral(String value) {
            this(value, Span.NONE);
        }
    }
    /** A character literal holding one Unicode code point. */
    public record CharLiteral(int value, Span span) implements Expression {
        public CharLiteral(int value) {
            this(value, Span.NONE);
        }
    }
    public record BoolLiteral(boolean value, Span span) implements Expression {
        public BoolLiteral(boolean value) {
            this(value, Span.NONE);
        }
    }
    public record NullLiteral(Span span) implements Expression {
        public NullLiteral() {
            this(Span.NONE);
        }
    }

    public record Identifier(String name, Span span) implements Expression {
        public Identifier(String name) {
            this(name, Span.NONE);
        }
    }

    public enum BinaryOperator {
        ASSIGN("=", 1, 1), ADD_ASSIGN("+=", 1, 1), SUB_ASSIGN("-=", 1, 1), MUL_ASSIGN("*=", 1, 1),
        DIV_ASSIGN("/=", 1, 1), MOD_ASSIGN("%=", 1, 1), AND_ASSIGN("&=", 1, 1), OR_ASSIGN("|=", 1, 1),
        XOR_ASSIGN("^=", 1, 1), SHL_ASSIGN("<<=", 1, 1), SHR_ASSIGN(">>=", 1, 1),
        OR("||", 4, 4), AND("&&", 5, 5),
        BIT_OR("|", 6, 7), BIT_XOR("^", 7, 8), BIT_AND("&", 8, 9),
        EQ("==", 9, 6), NE("!=", 9, 6),
        LT("<", 10, 6), GT(">", 10, 6), LE("<=", 10, 6), GE(">=", 10, 6),
        SHL("<<", 11, 10), SHR(">>", 11, 10),
        ADD("+", 12, 11), SUB("-", 12, 11),
        MUL("*", 13, 12), DIV("/", 13, 12), MOD("%", 13, 12);

        public final String symbol;
        /** Binding strength in the C-dialect; higher binds tighter. */
        public final int precedence;
        /** Binding strength in Rust, where comparisons bind looser than the bitwise operators. */
        public final int rustPrecedence;

        BinaryOperator(String symbol, int precedence, int rustPrecedence) {
            this.symbol = symbol;
            this.precedence = precedence;
            this.rustPrecedence = rustPrecedence;
        }

        public boolean isAssignment() {
            return precedence == 1;
        }

        public boolean isComparison() {
            return rustPrecedence == 6;
        }

        public boolean isLogical() {
            return this == OR || this == AND;
        }

        public static Optional<BinaryOperator> ofSymbol(String symbol) {
            return Arrays.stream(values()).filter(op -> op.symbol.equals(symbol)).findFirst();
        }
    }

    public record Binary(Expression left, BinaryOperator operator, Expression right, Span span) implements Expression {
        public Binary(Expression left, BinaryOperator operator, Expression right) {
            this(left, operator, right, Span.NONE);
        }
    }

    public enum UnaryOperator {
        NOT("!"), NEG("-"), REF("&"), REF_MUT("&var "), DEREF("*"),
        PRE_INC("++"), PRE_DEC("--"), POST_INC("++"), POST_DEC("--");

        public final String symbol;

        UnaryOperator(String symbol) {
            this.symbol = symbol;
        }

        public boolean isIncrement() {
            return this == PRE_INC || this == PRE_DEC || this == POST_INC || this == POST_DEC;
        }

        public boolean isPostfix() {
            return this == POST_INC || this == POST_DEC;
        }
    }

    public record Unary(UnaryOperator operator, Expression operand, Span span) implements Expression {
        public Unary(UnaryOperator operator, Expression operand) {
            this(operator, operand, Span.NONE);
        }
    }

    public record Call(Expression callee, List<Expression> arguments, Span span) implements Expression {
        public Call(Expression callee, List<Expression> arguments) {
            this(callee, arguments, Span.NONE);
        }
    }

    public record MethodCall(Expression receiver, String method, List<Expression> arguments, Span span) implements Expression {
        public MethodCall(Expression receiver, String method, List<Expression> arguments) {
            this(receiver, method, arguments, Span.NONE);
        }
    }

    /**
     * Field access; tuple fields use their index as name. {@code p->f} is field access on
     * {@code *p}.
     */
    public record FieldAccess(Expression target, String field, Span span) implements Expression {
        public FieldAccess(Expression target, String field) {
            this(target, field, Span.NONE);
        }
    }

    public record Index(Expression target, Expression index, Span span) implements Expression {
        public Index(Expression target, Expression index) {
            this(target, index, Span.NONE);
        }
    }

    public record Cast(Expression expression, Type type, Span span) implements Expression {
        public Cast(Expression expression, Type type) {
            this(expression, type, Span.NONE);
        }
    }

    public record Sizeof(Type type, Span span) implements Expression {
        public Sizeof(Type type) {
            this(type, Span.NONE);
        }
    }

    public record Ternary(Expression condition, Expression thenValue, Expression elseValue, Span span) implements Expression {
        public Ternary(Expression condition, Expression thenValue, Expression elseValue) {
            this(condition, thenValue, elseValue, Span.NONE);
        }
    }

    public record FieldInit(String name, Expression value, Span span) {
        public FieldInit(String name, Expression value) {
            this(name, value, Span.NONE);
        }
    }

    /**
     * Designated initializer. The type is {@link AutoType} until it is known from context.
     */
    public record StructInit(Type type, List<FieldInit> fields, Span span) implements Expression {
        public StructInit(Type type, List<FieldInit> fields) {
            this(type, fields, Span.NONE);
        }
        public StructInit withType(Type type) {
            return new StructInit(type, fields, span);
        }
    }

    public record ArrayLiteral(List<Expression> elements, Span span) implements Expression {
        public ArrayLiteral(List<Expression> elements) {
            this(elements, Span.NONE);
        }
    }

    public record ArrayRepeat(Expression value, Expression count, Span span) implements Expression {
        public ArrayRepeat(Expression value, Expression count) {
            this(value, count, Span.NONE);
        }
    }

    public record TupleLiteral(List<Expression> elements, Span span) implements Expression {
        public TupleLiteral(List<Expression> elements) {
            this(elements, Span.NONE);
        }
    }

    public record Range(Optional<Expression> start, Optional<Expression> end, boolean inclusive, Span span) implements Expression {
        public Range(Expression start, Expression end, boolean inclusive) {
            this(Optional.of(start), Optional.of(end), inclusive, Span.NONE);
        }
    }

    /**
     * A macro invocation. The name keeps its double underscores; arguments are raw token images.
     */
    public record MacroCall(String name, MacroDelimiter delimiter, List<String> arguments, Span span) implements Expression {
        public MacroCall(String name, MacroDelimiter delimiter, List<String> arguments) {
            this(name, delimiter, arguments, Span.NONE);
        }
    }

    public record ErrorPropagation(Expression expression, Span span) implements Expression {
        public ErrorPropagation(Expression expression) {
            this(expression, Span.NONE);
        }
    }

    public record TypeScopedCall(Type type, String method, List<Expression> arguments, Span span) implements Expression {
        public TypeScopedCall(Type type, String method, List<Expression> arguments) {
            this(type, method, arguments, Span.NONE);
        }
    }

    /**
     * An associated item named through a type without being called, such as an enum variant.
     */
    public record TypeScopedPath(Type type, String member, Span span) implements Expression {
        public TypeScopedPath(Type type, String member) {
            this(type, member, Span.NONE);
        }
    }

    public record ExplicitGenericCall(Type type, List<Type> generics, String method, List<Expression> arguments,
            Span span) implements Expression {
        public ExplicitGenericCall(Type type, List<Type> generics, String method, List<Expression> arguments) {
            this(type, generics, method, arguments, Span.NONE);
        }
    }

    // ---- types

    public sealed interface Type {}

    public enum Primitive {
        INT("int", "i32", true), I8("i8", "i8", true), I16("i16", "i16", true), I32("i32", "i32", true),
        I64("i64", "i64", true), U8("u8", "u8", true), U16("u16", "u16", true), U32("u32", "u32", true),
        U64("u64", "u64", true), USIZE("usize", "usize", true), ISIZE("isize", "isize", true),
        FLOAT("float", "f64", false), F32("f32", "f32", false), F64("f64", "f64", false),
        BOOL("bool", "bool", false), CHAR("char", "char", false), VOID("void", "()", false);

        public final String crustyName;
        public final String rustName;
        public final boolean integer;

        Primitive(String crustyName, String rustName, boolean integer) {
            this.crustyName = crustyName;
            this.rustName = rustName;
            this.integer = integer;
        }

        public boolean isFloat() {
            return this == FLOAT || this == F32 || this == F64;
        }

        public static Optional<Primitive> ofCrustyName(String name) {
            return Arrays.stream(values()).filter(p -> p.crustyName.equals(name)).findFirst();
        }

        /**
         * Maps a target-language primitive name. {@code i32} and {@code f64} map to the
         * C-dialect's {@code int} and {@code float}.
         */
        public static Optional<Primitive> ofRustName(String name) {
            return switch (name) {
                case "i32" -> Optional.of(INT);
                case "f64" -> Optional.of(FLOAT);
                case "()" -> Optional.of(VOID);
                default -> Arrays.stream(values())
                        .filter(p -> p.rustName.equals(name) && p != INT && p != FLOAT)
                        .findFirst();
            };
        }
    }

    public record PrimitiveType(Primitive primitive) implements Type {
        public static final PrimitiveType INT = new PrimitiveType(Primitive.INT);
        public static final PrimitiveType FLOAT = new PrimitiveType(Primitive.FLOAT);
        public static final PrimitiveType BOOL = new PrimitiveType(Primitive.BOOL);
        public static final PrimitiveType CHAR = new PrimitiveType(Primitive.CHAR);
        public static final PrimitiveType USIZE = new PrimitiveType(Primitive.USIZE);
        public static final PrimitiveType VOID = new PrimitiveType(Primitive.VOID);
    }

    /**
     * A named type, possibly qualified ({@code a.b.C} / {@code a::b::C}) and possibly generic.
     */
    public record NamedType(List<String> path, List<Type> arguments) implements Type {
        public NamedType(String name) {
            this(List.of(name), List.of());
        }
        public NamedType(String name, List<Type> arguments) {
            this(List.of(name), arguments);
        }

        public String name() {
            return path.get(path.size() - 1);
        }

        public String qualifiedName(String separator) {
            return String.join(separator, path);
        }
    }

    public record PointerType(Type target, boolean mutable) implements Type {}
    public record ReferenceType(Type target, boolean mutable) implements Type {}
    public record ArrayType(Type element, long size) implements Type {}
    public record SliceType(Type element) implements Type {}
    public record TupleType(List<Type> elements) implements Type {}
    public record FunctionType(List<Type> parameters, Type returnType) implements Type {}
    public record FallibleType(Type success) implements Type {}
    public record AutoType() implements Type {
        public static final AutoType INSTANCE = new AutoType();
    }

}
