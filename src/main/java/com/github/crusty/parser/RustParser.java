package com.github.crusty.parser;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.crusty.Tokenizer;
import com.github.crusty.Tokenizer.Dialect;
import com.github.crusty.Tokenizer.Token;
import com.github.crusty.Tokenizer.TokenType;
import com.github.crusty.Tokenizer.Tokens;
import com.github.crusty.error.Diagnostic;
import com.github.crusty.error.ParseError;
import com.github.crusty.error.ParseException;
import com.github.crusty.error.Span;
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
import com.github.crusty.parser.CompilationUnit.Field;
import com.github.crusty.parser.CompilationUnit.FieldAccess;
import com.github.crusty.parser.CompilationUnit.FieldInit;
import com.github.crusty.parser.CompilationUnit.FloatLiteral;
import com.github.crusty.parser.CompilationUnit.ForInStatement;
import com.github.crusty.parser.CompilationUnit.FunctionDeclaration;
import com.github.crusty.parser.CompilationUnit.FunctionType;
import com.github.crusty.parser.CompilationUnit.Identifier;
import com.github.crusty.parser.CompilationUnit.IfStatement;
import com.github.crusty.parser.CompilationUnit.Import;
import com.github.crusty.parser.CompilationUnit.Index;
import com.github.crusty.parser.CompilationUnit.IntLiteral;
import com.github.crusty.parser.CompilationUnit.Item;
import com.github.crusty.parser.CompilationUnit.LetStatement;
import com.github.crusty.parser.CompilationUnit.LoopStatement;
import com.github.crusty.parser.CompilationUnit.MacroCall;
import com.github.crusty.parser.CompilationUnit.MacroDefinition;
import com.github.crusty.parser.CompilationUnit.MacroDelimiter;
import com.github.crusty.parser.CompilationUnit.MethodCall;
import com.github.crusty.parser.CompilationUnit.NamedType;
import com.github.crusty.parser.CompilationUnit.Namespace;
import com.github.crusty.parser.CompilationUnit.NestedFunction;
import com.github.crusty.parser.CompilationUnit.NullLiteral;
import com.github.crusty.parser.CompilationUnit.Parameter;
import com.github.crusty.parser.CompilationUnit.PointerType;
import com.github.crusty.parser.CompilationUnit.Primitive;
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
import com.github.crusty.parser.CompilationUnit.Visibility;
import com.github.crusty.parser.CompilationUnit.WhileStatement;

/**
 * Parser for the Rust subset the translator emits, producing the same tree as {@link Parser}.
 * Target-language idioms are folded back into their C-dialect forms: {@code is_none()} becomes
 * a comparison with {@code NULL}, {@code Result<T, E>} with the configured error type becomes a
 * fallible type and {@code size_of::<T>()} becomes {@code sizeof}.
 */
public class RustParser {

    private static final Logger logger = LoggerFactory.getLogger(RustParser.class);

    public static final String DEFAULT_ERROR_TYPE = "Box<dyn std::error::Error>";

    // derives are regenerated from copy semantics, the rest carry no meaning for translation
    private static final Set<String> DROPPED_ATTRIBUTES = Set.of("derive", "allow", "warn", "deny", "inline",
            "must_use", "doc");

    private static final Pattern LITERAL_SUFFIX = Pattern.compile("(?:[iu](?:8|16|32|64|size)|f32|f64)$");

    private final String fallibleErrorType;
    private final List<Diagnostic> diagnostics = new ArrayList<>();
    private boolean noStructLiteral;

    public RustParser() {
        this(DEFAULT_ERROR_TYPE);
    }

    public RustParser(String fallibleErrorType) {
        this.fallibleErrorType = fallibleErrorType;
    }

    public static ParseResult parse(String source) {
        return new RustParser().parseCompilationUnit(new Tokenizer(Dialect.RUST).tokenize(source));
    }

    public ParseResult parseCompilationUnit(Tokens tokens) {
        var start = tokens.peek().span();
        var docComments = tokens.leadingDocComments();
        var items = parseItems(tokens, TokenType.EOF);
        var unit = new CompilationUnit(docComments, items, start.to(tokens.previous().span()));

        List<Diagnostic> all = new ArrayList<>(tokens.errors());
        all.addAll(diagnostics);
        logger.debug("parsed {} Rust items, {} diagnostics", items.size(), all.size());
        return new ParseResult(unit, all);
    }

    private List<Item> parseItems(Tokens tokens, TokenType terminator) {
        List<Item> items = new ArrayList<>();
        Map<String, List<FunctionDeclaration>> impls = new LinkedHashMap<>();
        Map<String, Span> implSpans = new LinkedHashMap<>();
        while (!tokens.matches(terminator, TokenType.EOF)) {
            try {
                skipAttributes(tokens);
                if (tokens.matches(TokenType.IMPL)) {
                    var implStart = tokens.peek().span();
                    var name = tokens.peek(1).image();
                    impls.computeIfAbsent(name, n -> new ArrayList<>()).addAll(parseImpl(tokens));
                    implSpans.putIfAbsent(name, implStart);
                } else if (!tokens.matches(terminator, TokenType.EOF)) {
                    items.add(parseItem(tokens));
                }
            } catch (ParseException e) {
                diagnostics.add(e.error());
                synchronize(tokens, terminator == TokenType.EOF);
            }
        }

        // methods of an impl block move into the struct they belong to
        for (var entry : impls.entrySet()) {
            boolean found = false;
            for (int i = 0; i < items.size(); i++) {
                if (items.get(i) instanceof StructDefinition s && s.name().equals(entry.getKey())) {
                    List<FunctionDeclaration> methods = new ArrayList<>(s.methods());
                    methods.addAll(entry.getValue());
                    items.set(i, new StructDefinition(s.name(), s.fields(), methods, s.span()));
                    found = true;
                    break;
                }
            }
            if (!found) {
                diagnostics.add(new ParseError("impl block for unknown struct " + entry.getKey(),
                        List.of("struct " + entry.getKey()), "impl " + entry.getKey(), implSpans.get(entry.getKey())));
            }
        }
        return items;
    }

    private void synchronize(Tokens tokens, boolean topLevel) {
        int depth = 0;
        boolean progressed = false;
        while (!tokens.atEnd()) {
            var token = tokens.peek();
            if (token.is(TokenType.LBRACE)) {
                depth++;
            } else if (token.is(TokenType.RBRACE)) {
                if (depth == 0) {
                    if (topLevel && !progressed) {
                        tokens.next();
                    }
                    return;
                }
                depth--;
                if (depth == 0) {
                    tokens.next();
                    tokens.accept(TokenType.SEMICOLON);
                    return;
                }
            } else if (token.is(TokenType.SEMICOLON) && depth == 0) {
                tokens.next();
                return;
            }
            tokens.next();
            progressed = true;
        }
    }

    // <> #[...] | #![...]
    private void skipAttributes(Tokens tokens) {
        while (tokens.matches(TokenType.HASH)) {
            var hash = tokens.next();
            tokens.accept(TokenType.BANG);
            tokens.peek(TokenType.LBRACKET);
            var body = Parser.collectDelimited(tokens);
            var name = body.isEmpty() ? "" : body.get(0);
            if (!DROPPED_ATTRIBUTES.contains(name)) {
                diagnostics.add(new ParseError("attribute #[" + name + "] is not supported",
                        List.of("item"), "#[" + name + "]", hash.span().to(tokens.previous().span())));
            }
        }
    }

    private Item parseItem(Tokens tokens) {
        var start = tokens.peek().span();
        boolean pub = tokens.accept(TokenType.PUB);
        var token = tokens.peek();

        return switch (token.type()) {
            case FN -> parseFunction(tokens, pub ? Visibility.PUBLIC : Visibility.PRIVATE, start);
            case STRUCT -> parseStruct(tokens, start);
            case ENUM -> parseEnum(tokens, start);
            case TYPE -> parseTypeAlias(tokens, start);
            case MOD -> parseModule(tokens, start);
            case USE -> parseUse(tokens, pub, start);
            case CONST -> parseConst(tokens, start);
            case STATIC -> parseStatic(tokens, start);
            case IDENTIFIER -> {
                if (token.image().equals("macro_rules") && tokens.matchesAhead(1, TokenType.BANG)) {
                    yield parseMacroRules(tokens, start);
                }
                if (token.image().equals("extern")) {
                    throw new ParseException(new ParseError("extern items are not supported",
                            List.of("item"), token.describe(), token.span()));
                }
                throw tokens.unexpected("fn", "struct", "enum", "type", "mod", "use", "const", "static", "macro_rules!");
            }
            default -> throw tokens.unexpected("fn", "struct", "enum", "type", "mod", "use", "const", "static", "macro_rules!");
        };
    }

    // <> fn name(params) [-> Type] block
    private FunctionDeclaration parseFunction(Tokens tokens, Visibility visibility, Span start) {
        tokens.next(TokenType.FN);
        var name = tokens.next(TokenType.IDENTIFIER).image();
        rejectGenerics(tokens);
        var parameters = parseParameters(tokens);
        Type returnType = PrimitiveType.VOID;
        if (tokens.accept(TokenType.ARROW)) {
            returnType = parseType(tokens);
        }
        var body = parseBlock(tokens, !returnType.equals(PrimitiveType.VOID));
        return new FunctionDeclaration(visibility, name, parameters, returnType, body, start.to(body.span()));
    }

    private void rejectGenerics(Tokens tokens) {
        if (tokens.matches(TokenType.LT)) {
            var token = tokens.peek();
            throw new ParseException(new ParseError("generic items are not supported",
                    List.of("'('"), token.describe(), token.span()));
        }
    }

    private List<Parameter> parseParameters(Tokens tokens) {
        tokens.next(TokenType.LPAREN);
        List<Parameter> parameters = new ArrayList<>();
        while (!tokens.matches(TokenType.RPAREN)) {
            parameters.add(parseParameter(tokens));
            if (!tokens.matches(TokenType.RPAREN)) {
                tokens.next(TokenType.COMMA);
            }
        }
        tokens.next(TokenType.RPAREN);
        return parameters;
    }

    // <> self | &self | &mut self | [mut] name: Type
    private Parameter parseParameter(Tokens tokens) {
        var start = tokens.peek();
        var self = new NamedType("Self");
        if (start.type() == TokenType.AMP) {
            tokens.next();
            skipLifetime(tokens);
            boolean mutable = tokens.accept(TokenType.MUT);
            var end = tokens.next(TokenType.IDENTIFIER);
            if (!end.image().equals("self")) {
                throw new ParseException(new ParseError("expected self", List.of("self"), end.describe(), end.span()));
            }
            return new Parameter("self", new ReferenceType(self, mutable), start.span().to(end.span()));
        }
        tokens.accept(TokenType.MUT);
        var name = tokens.next(TokenType.IDENTIFIER);
        if (name.image().equals("self") && !tokens.matches(TokenType.COLON)) {
            return new Parameter("self", self, start.span().to(name.span()));
        }
        tokens.next(TokenType.COLON);
        var type = parseType(tokens);
        return new Parameter(name.image(), type, start.span().to(tokens.previous().span()));
    }

    private void skipLifetime(Tokens tokens) {
        tokens.accept(TokenType.LIFETIME);
    }

    // <> struct Name { [pub] field: Type, ... }
    private StructDefinition parseStruct(Tokens tokens, Span start) {
        tokens.next(TokenType.STRUCT);
        var name = tokens.next(TokenType.IDENTIFIER).image();
        rejectGenerics(tokens);
        List<Field> fields = new ArrayList<>();
        if (tokens.accept(TokenType.SEMICOLON)) {
            return new StructDefinition(name, fields, List.of(), start.to(tokens.previous().span()));
        }
        tokens.next(TokenType.LBRACE);
        while (!tokens.matches(TokenType.RBRACE)) {
            skipAttributes(tokens);
            var fieldStart = tokens.peek().span();
            tokens.accept(TokenType.PUB);
            var fieldName = tokens.next(TokenType.IDENTIFIER).image();
            tokens.next(TokenType.COLON);
            var type = parseType(tokens);
            fields.add(new Field(fieldName, type, fieldStart.to(tokens.previous().span())));
            if (!tokens.matches(TokenType.RBRACE)) {
                tokens.next(TokenType.COMMA);
            }
        }
        var end = tokens.next(TokenType.RBRACE);
        return new StructDefinition(name, fields, List.of(), start.to(end.span()));
    }

    // <> impl Name { [pub] fn ... }
    private List<FunctionDeclaration> parseImpl(Tokens tokens) {
        tokens.next(TokenType.IMPL);
        rejectGenerics(tokens);
        tokens.next(TokenType.IDENTIFIER);
        if (tokens.matches(TokenType.FOR) || tokens.matches(TokenType.LT)) {
            var token = tokens.peek();
            throw new ParseException(new ParseError("trait implementations are not supported",
                    List.of("'{'"), token.describe(), token.span()));
        }
        tokens.next(TokenType.LBRACE);
        List<FunctionDeclaration> methods = new ArrayList<>();
        while (!tokens.matches(TokenType.RBRACE, TokenType.EOF)) {
            skipAttributes(tokens);
            var start = tokens.peek().span();
            boolean pub = tokens.accept(TokenType.PUB);
            methods.add(parseFunction(tokens, pub ? Visibility.PUBLIC : Visibility.PRIVATE, start));
        }
        tokens.next(TokenType.RBRACE);
        return methods;
    }

    private EnumDefinition parseEnum(Tokens tokens, Span start) {
        tokens.next(TokenType.ENUM);
        var name = tokens.next(TokenType.IDENTIFIER).image();
        rejectGenerics(tokens);
        tokens.next(TokenType.LBRACE);
        List<EnumVariant> variants = new ArrayList<>();
        while (!tokens.matches(TokenType.RBRACE)) {
            skipAttributes(tokens);
            var variant = tokens.next(TokenType.IDENTIFIER);
            Optional<Long> value = Optional.empty();
            if (tokens.accept(TokenType.EQUALS)) {
                boolean negative = tokens.accept(TokenType.MINUS);
                long parsed = parseInteger(tokens.next(TokenType.INT_LITERAL));
                value = Optional.of(negative ? -parsed : parsed);
            }
            variants.add(new EnumVariant(variant.image(), value, variant.span().to(tokens.previous().span())));
            if (!tokens.matches(TokenType.RBRACE)) {
                tokens.next(TokenType.COMMA);
            }
        }
        var end = tokens.next(TokenType.RBRACE);
        return new EnumDefinition(name, variants, start.to(end.span()));
    }

    private TypeAlias parseTypeAlias(Tokens tokens, Span start) {
        tokens.next(TokenType.TYPE);
        var name = tokens.next(TokenType.IDENTIFIER).image();
        tokens.next(TokenType.EQUALS);
        var target = parseType(tokens);
        var end = tokens.next(TokenType.SEMICOLON);
        return new TypeAlias(name, target, start.to(end.span()));
    }

    private Namespace parseModule(Tokens tokens, Span start) {
        tokens.next(TokenType.MOD);
        var name = tokens.next(TokenType.IDENTIFIER).image();
        tokens.next(TokenType.LBRACE);
        var items = parseItems(tokens, TokenType.RBRACE);
        var end = tokens.next(TokenType.RBRACE);
        return new Namespace(name, items, start.to(end.span()));
    }

    // <> [pub] use a::b::c [as alias];
    private Import parseUse(Tokens tokens, boolean exported, Span start) {
        tokens.next(TokenType.USE);
        List<String> path = new ArrayList<>();
        path.add(tokens.next(TokenType.IDENTIFIER).image());
        while (tokens.accept(TokenType.COLON_COLON)) {
            path.add(tokens.next(TokenType.IDENTIFIER).image());
        }
        Optional<String> alias = Optional.empty();
        if (tokens.accept(TokenType.AS)) {
            alias = Optional.of(tokens.next(TokenType.IDENTIFIER).image());
        }
        var end = tokens.next(TokenType.SEMICOLON);
        return new Import(path, alias, exported, start.to(end.span()));
    }

    private ConstDeclaration parseConst(Tokens tokens, Span start) {
        tokens.next(TokenType.CONST);
        var name = tokens.next(TokenType.IDENTIFIER).image();
        Optional<Type> type = Optional.empty();
        if (tokens.accept(TokenType.COLON)) {
            type = Optional.of(parseType(tokens));
        }
        tokens.next(TokenType.EQUALS);
        var value = parseExpression(tokens);
        var end = tokens.next(TokenType.SEMICOLON);
        return new ConstDeclaration(name, type, value, start.to(end.span()));
    }

    private StaticDeclaration parseStatic(Tokens tokens, Span start) {
        tokens.next(TokenType.STATIC);
        boolean mutable = tokens.accept(TokenType.MUT);
        var name = tokens.next(TokenType.IDENTIFIER).image();
        tokens.next(TokenType.COLON);
        var type = parseType(tokens);
        tokens.next(TokenType.EQUALS);
        var value = parseExpression(tokens);
        var end = tokens.next(TokenType.SEMICOLON);
        return new StaticDeclaration(name, type, value, mutable, start.to(end.span()));
    }

    /**
     * {@code macro_rules! name { ($a:expr, ...) => {{ body }}; }}. Only the first rule is kept.
     * The delimiter of the matcher becomes the delimiter of the macro; an empty {@code ()}
     * matcher is a macro invoked without arguments.
     */
    private MacroDefinition parseMacroRules(Tokens tokens, Span start) {
        tokens.next(TokenType.IDENTIFIER);
        tokens.next(TokenType.BANG);
        var name = crustyMacroName(tokens.next(TokenType.IDENTIFIER).image());
        tokens.next(TokenType.LBRACE);

        var open = tokens.peek();
        if (!open.is(TokenType.LPAREN, TokenType.LBRACKET, TokenType.LBRACE)) {
            throw tokens.unexpected("'('", "'['", "'{'");
        }
        var matcher = Parser.collectDelimited(tokens);
        List<String> parameters = new ArrayList<>();
        for (int i = 0; i + 1 < matcher.size(); i++) {
            if (matcher.get(i).equals("$")) {
                parameters.add(matcher.get(i + 1));
            }
        }
        var delimiter = switch (open.type()) {
            case LBRACKET -> MacroDelimiter.BRACKET;
            case LBRACE -> MacroDelimiter.BRACE;
            default -> parameters.isEmpty() ? MacroDelimiter.NONE : MacroDelimiter.PARENTHESIS;
        };

        tokens.next(TokenType.FAT_ARROW);
        tokens.peek(TokenType.LBRACE);
        var body = Parser.collectDelimited(tokens);
        if (body.size() >= 2 && body.get(0).equals("{") && body.get(body.size() - 1).equals("}")) {
            body = body.subList(1, body.size() - 1);
        }
        // further rules are dropped
        while (!tokens.matches(TokenType.RBRACE, TokenType.EOF)) {
            tokens.next();
        }
        var end = tokens.next(TokenType.RBRACE);
        return new MacroDefinition(name, parameters, delimiter, crustyMacroBody(body), start.to(end.span()));
    }

    static String crustyMacroName(String rustName) {
        var base = rustName.endsWith("_macro") ? rustName.substring(0, rustName.length() - "_macro".length()) : rustName;
        return "__" + base + "__";
    }

    private static List<String> crustyMacroBody(List<String> body) {
        List<String> result = new ArrayList<>();
        for (int i = 0; i < body.size(); i++) {
            var image = body.get(i);
            if (image.equals("$")) {
                continue;
            }
            if (i + 1 < body.size() && body.get(i + 1).equals("!") && Character.isJavaIdentifierStart(image.charAt(0))
                    && i + 2 < body.size() && "([{".contains(body.get(i + 2))) {
                result.add(crustyMacroName(image));
                i++;
                continue;
            }
            result.add(image);
        }
        return result;
    }

    // ---- statements

    /**
     * Parses a block. With {@code tailIsReturn}, a final expression without semicolon is the
     * function's value and becomes a {@code return}.
     */
    private Block parseBlock(Tokens tokens, boolean tailIsReturn) {
        var start = tokens.next(TokenType.LBRACE);
        boolean savedNoStruct = noStructLiteral;
        noStructLiteral = false;
        List<Statement> statements = new ArrayList<>();
        try {
            while (!tokens.matches(TokenType.RBRACE, TokenType.EOF)) {
                try {
                    if (tokens.accept(TokenType.SEMICOLON)) {
                        continue;
                    }
                    statements.add(parseStatement(tokens, tailIsReturn));
                } catch (ParseException e) {
                    diagnostics.add(e.error());
                    synchronize(tokens, false);
                }
            }
        } finally {
            noStructLiteral = savedNoStruct;
        }
        var end = tokens.next(TokenType.RBRACE);
        return new Block(statements, start.span().to(end.span()));
    }

    private Statement parseStatement(Tokens tokens, boolean tailIsReturn) {
        var token = tokens.peek();

        return switch (token.type()) {
            case LET -> parseLet(tokens);
            case CONST -> parseConst(tokens, token.span());
            case IF -> parseIf(tokens);
            case WHILE -> parseWhile(tokens, Optional.empty(), token.span());
            case LOOP -> parseLoop(tokens, Optional.empty(), token.span());
            case FOR -> parseFor(tokens, Optional.empty(), token.span());
            case MATCH -> parseMatch(tokens);
            case LIFETIME -> parseLabeledLoop(tokens);
            case LBRACE -> parseBlock(tokens, false);
            case FN -> parseNestedFn(tokens);
            case RETURN, BREAK, CONTINUE -> {
                var statement = parseJump(tokens);
                if (!tokens.matches(TokenType.RBRACE)) {
                    tokens.next(TokenType.SEMICOLON);
                }
                yield statement;
            }
            case IDENTIFIER -> {
                if (token.image().equals("unsafe") && tokens.matchesAhead(1, TokenType.LBRACE)) {
                    tokens.next();
                    yield parseBlock(tokens, false);
                }
                yield parseExpressionStatement(tokens, tailIsReturn);
            }
            default -> parseExpressionStatement(tokens, tailIsReturn);
        };
    }

    private Statement parseExpressionStatement(Tokens tokens, boolean tailIsReturn) {
        var expression = parseExpression(tokens);
        if (tokens.matches(TokenType.RBRACE)) {
            if (tailIsReturn) {
                return new ReturnStatement(Optional.of(expression), expression.span());
            }
            return new ExpressionStatement(expression, expression.span());
        }
        var end = tokens.next(TokenType.SEMICOLON);
        return new ExpressionStatement(expression, expression.span().to(end.span()));
    }

    private Statement parseJump(Tokens tokens) {
        var token = tokens.next();
        switch (token.type()) {
            case RETURN -> {
                Optional<Expression> value = Optional.empty();
                if (!tokens.matches(TokenType.SEMICOLON, TokenType.RBRACE, TokenType.COMMA)) {
                    value = Optional.of(parseExpression(tokens));
                }
                return new ReturnStatement(value, token.span().to(tokens.previous().span()));
            }
            case BREAK -> {
                var label = parseLabelReference(tokens);
                return new BreakStatement(label, token.span().to(tokens.previous().span()));
            }
            default -> {
                var label = parseLabelReference(tokens);
                return new ContinueStatement(label, token.span().to(tokens.previous().span()));
            }
        }
    }

    private static Optional<String> parseLabelReference(Tokens tokens) {
        if (tokens.matches(TokenType.LIFETIME)) {
            return Optional.of(tokens.next().image().substring(1));
        }
        return Optional.empty();
    }

    // <> let [mut] name [: Type] [= value]; | let [mut] name = [move] |params| body;
    private Statement parseLet(Tokens tokens) {
        var start = tokens.next(TokenType.LET);
        boolean mutable = tokens.accept(TokenType.MUT);
        var name = tokens.next(TokenType.IDENTIFIER).image();
        Optional<Type> type = Optional.empty();
        if (tokens.accept(TokenType.COLON)) {
            type = Optional.of(parseType(tokens));
        }
        Optional<Expression> initializer = Optional.empty();
        if (tokens.accept(TokenType.EQUALS)) {
            if (tokens.matches(TokenType.MOVE, TokenType.PIPE, TokenType.OR_OR)) {
                var closure = parseClosure(tokens, name, start.span());
                tokens.next(TokenType.SEMICOLON);
                return closure;
            }
            var value = parseExpression(tokens);
            if (value instanceof StructInit si && type.isPresent() && si.type() instanceof AutoType) {
                value = si.withType(type.get());
            }
            initializer = Optional.of(value);
        }
        var end = tokens.next(TokenType.SEMICOLON);
        return new LetStatement(name, type, initializer, mutable, start.span().to(end.span()));
    }

    // <> [move] |p [: Type], ...| [-> Type] (block | expression)
    private NestedFunction parseClosure(Tokens tokens, String name, Span start) {
        tokens.accept(TokenType.MOVE);
        List<Parameter> parameters = new ArrayList<>();
        if (!tokens.accept(TokenType.OR_OR)) {
            tokens.next(TokenType.PIPE);
            while (!tokens.matches(TokenType.PIPE)) {
                var parameter = tokens.next(TokenType.IDENTIFIER);
                Type type = AutoType.INSTANCE;
                if (tokens.accept(TokenType.COLON)) {
                    type = parseType(tokens);
                }
                parameters.add(new Parameter(parameter.image(), type, parameter.span()));
                if (!tokens.matches(TokenType.PIPE)) {
                    tokens.next(TokenType.COMMA);
                }
            }
            tokens.next(TokenType.PIPE);
        }
        if (tokens.accept(TokenType.ARROW)) {
            var returnType = parseType(tokens);
            var body = parseBlock(tokens, !returnType.equals(PrimitiveType.VOID));
            return new NestedFunction(name, parameters, returnType, body, false, List.of(), start.to(body.span()));
        }
        if (tokens.matches(TokenType.LBRACE)) {
            var body = parseBlock(tokens, true);
            boolean returnsValue = !body.statements().isEmpty()
                    && body.statements().get(body.statements().size() - 1) instanceof ReturnStatement r
                    && r.value().isPresent();
            Type returnType = returnsValue ? AutoType.INSTANCE : PrimitiveType.VOID;
            return new NestedFunction(name, parameters, returnType, body, false, List.of(), start.to(body.span()));
        }
        var value = parseExpression(tokens);
        var body = new Block(List.of(new ReturnStatement(Optional.of(value), value.span())), value.span());
        return new NestedFunction(name, parameters, AutoType.INSTANCE, body, false, List.of(), start.to(value.span()));
    }

    private NestedFunction parseNestedFn(Tokens tokens) {
        var function = parseFunction(tokens, Visibility.PRIVATE, tokens.peek().span());
        return new NestedFunction(function.name(), function.parameters(), function.returnType(), function.body(),
                false, List.of(), function.span());
    }

    private Expression parseCondition(Tokens tokens) {
        boolean saved = noStructLiteral;
        noStructLiteral = true;
        try {
            return parseExpression(tokens);
        } finally {
            noStructLiteral = saved;
        }
    }

    private IfStatement parseIf(Tokens tokens) {
        var start = tokens.next(TokenType.IF);
        rejectLetPattern(tokens);
        var condition = parseCondition(tokens);
        var thenBlock = parseBlock(tokens, false);
        Optional<Block> elseBlock = Optional.empty();
        if (tokens.accept(TokenType.ELSE)) {
            if (tokens.matches(TokenType.IF)) {
                var elseIf = parseIf(tokens);
                elseBlock = Optional.of(new Block(List.of(elseIf), elseIf.span()));
            } else {
                elseBlock = Optional.of(parseBlock(tokens, false));
            }
        }
        return new IfStatement(condition, thenBlock, elseBlock,
                start.span().to(elseBlock.map(Block::span).orElse(thenBlock.span())));
    }

    private void rejectLetPattern(Tokens tokens) {
        if (tokens.matches(TokenType.LET)) {
            var token = tokens.peek();
            throw new ParseException(new ParseError("pattern bindings in conditions are not supported",
                    List.of("expression"), token.describe(), token.span()));
        }
    }

    private WhileStatement parseWhile(Tokens tokens, Optional<String> label, Span start) {
        tokens.next(TokenType.WHILE);
        rejectLetPattern(tokens);
        var condition = parseCondition(tokens);
        var body = parseBlock(tokens, false);
        return new WhileStatement(label, condition, body, start.to(body.span()));
    }

    private LoopStatement parseLoop(Tokens tokens, Optional<String> label, Span start) {
        tokens.next(TokenType.LOOP);
        var body = parseBlock(tokens, false);
        return new LoopStatement(label, body, start.to(body.span()));
    }

    private ForInStatement parseFor(Tokens tokens, Optional<String> label, Span start) {
        tokens.next(TokenType.FOR);
        var variable = tokens.next(TokenType.IDENTIFIER).image();
        tokens.next(TokenType.IN);
        var iterable = parseCondition(tokens);
        var body = parseBlock(tokens, false);
        return new ForInStatement(label, variable, iterable, body, start.to(body.span()));
    }

    // <> 'label: (while | loop | for)
    private Statement parseLabeledLoop(Tokens tokens) {
        var start = tokens.next(TokenType.LIFETIME);
        var label = Optional.of(start.image().substring(1));
        tokens.next(TokenType.COLON);
        return switch (tokens.peek().type()) {
            case WHILE -> parseWhile(tokens, label, start.span());
            case LOOP -> parseLoop(tokens, label, start.span());
            case FOR -> parseFor(tokens, label, start.span());
            default -> throw tokens.unexpected("while", "loop", "for");
        };
    }

    // <> match subject { pattern [| pattern] => body, ... _ => body }
    private SwitchStatement parseMatch(Tokens tokens) {
        var start = tokens.next(TokenType.MATCH);
        var subject = parseCondition(tokens);
        tokens.next(TokenType.LBRACE);
        List<SwitchCase> cases = new ArrayList<>();
        Optional<Block> defaultCase = Optional.empty();
        while (!tokens.matches(TokenType.RBRACE)) {
            var armStart = tokens.peek();
            if (armStart.type() == TokenType.IDENTIFIER && armStart.image().equals("_")) {
                tokens.next();
                tokens.next(TokenType.FAT_ARROW);
                defaultCase = Optional.of(parseArmBody(tokens));
            } else {
                List<Expression> values = new ArrayList<>();
                values.add(parsePattern(tokens));
                while (tokens.accept(TokenType.PIPE)) {
                    values.add(parsePattern(tokens));
                }
                tokens.next(TokenType.FAT_ARROW);
                var body = parseArmBody(tokens);
                cases.add(new SwitchCase(values, body, armStart.span().to(body.span())));
            }
            tokens.accept(TokenType.COMMA);
        }
        var end = tokens.next(TokenType.RBRACE);
        return new SwitchStatement(subject, cases, defaultCase, start.span().to(end.span()));
    }

    // <> literal | path | start..=end -- parsed above '|', which separates alternatives
    private Expression parsePattern(Tokens tokens) {
        int level = BinaryOperator.BIT_XOR.rustPrecedence;
        var start = parseBinary(tokens, level);
        if (tokens.matches(TokenType.DOT_DOT, TokenType.DOT_DOT_EQUALS)) {
            boolean inclusive = tokens.next().type() == TokenType.DOT_DOT_EQUALS;
            var end = parseBinary(tokens, level);
            return new Range(Optional.of(start), Optional.of(end), inclusive, start.span().to(end.span()));
        }
        return start;
    }

    private Block parseArmBody(Tokens tokens) {
        if (tokens.matches(TokenType.LBRACE)) {
            return parseBlock(tokens, false);
        }
        if (tokens.matches(TokenType.RETURN, TokenType.BREAK, TokenType.CONTINUE)) {
            var jump = parseJump(tokens);
            return new Block(List.of(jump), jump.span());
        }
        var expression = parseExpression(tokens);
        if (expression instanceof TupleLiteral t && t.elements().isEmpty()) {
            return new Block(List.of(), expression.span());
        }
        return new Block(List.of(new ExpressionStatement(expression, expression.span())), expression.span());
    }

    // ---- expressions

    public Expression parseExpression(Tokens tokens) {
        var left = parseRange(tokens);
        var operator = assignmentOperator(tokens.peek().type());
        if (operator.isPresent()) {
            var token = tokens.next();
            if (!Parser.isAssignable(left)) {
                throw new ParseException(new ParseError("invalid assignment target",
                        List.of("variable", "field", "index", "dereference"), token.describe(), left.span()));
            }
            var right = parseExpression(tokens);
            return new Binary(left, operator.get(), right, left.span().to(right.span()));
        }
        return left;
    }

    private static Optional<BinaryOperator> assignmentOperator(TokenType type) {
        return Optional.ofNullable(switch (type) {
            case EQUALS -> BinaryOperator.ASSIGN;
            case PLUS_EQUALS -> BinaryOperator.ADD_ASSIGN;
            case MINUS_EQUALS -> BinaryOperator.SUB_ASSIGN;
            case STAR_EQUALS -> BinaryOperator.MUL_ASSIGN;
            case SLASH_EQUALS -> BinaryOperator.DIV_ASSIGN;
            case PERCENT_EQUALS -> BinaryOperator.MOD_ASSIGN;
            case AMP_EQUALS -> BinaryOperator.AND_ASSIGN;
            case PIPE_EQUALS -> BinaryOperator.OR_ASSIGN;
            case CARET_EQUALS -> BinaryOperator.XOR_ASSIGN;
            case SHL_EQUALS -> BinaryOperator.SHL_ASSIGN;
            case SHR_EQUALS -> BinaryOperator.SHR_ASSIGN;
            default -> null;
        });
    }

    private Expression parseRange(Tokens tokens) {
        var start = tokens.peek();
        if (start.is(TokenType.DOT_DOT, TokenType.DOT_DOT_EQUALS)) {
            tokens.next();
            Optional<Expression> end = startsRangeEnd(tokens.peek())
                    ? Optional.of(parseBinary(tokens, BinaryOperator.OR.rustPrecedence))
                    : Optional.empty();
            return new Range(Optional.empty(), end, start.type() == TokenType.DOT_DOT_EQUALS,
                    start.span().to(tokens.previous().span()));
        }
        var expr = parseBinary(tokens, BinaryOperator.OR.rustPrecedence);
        if (tokens.matches(TokenType.DOT_DOT, TokenType.DOT_DOT_EQUALS)) {
            boolean inclusive = tokens.next().type() == TokenType.DOT_DOT_EQUALS;
            Optional<Expression> end = startsRangeEnd(tokens.peek())
                    ? Optional.of(parseBinary(tokens, BinaryOperator.OR.rustPrecedence))
                    : Optional.empty();
            return new Range(Optional.of(expr), end, inclusive, expr.span().to(tokens.previous().span()));
        }
        return expr;
    }

    private boolean startsRangeEnd(Token token) {
        if (token.type() == TokenType.LBRACE) {
            return !noStructLiteral;
        }
        return token.is(TokenType.INT_LITERAL, TokenType.FLOAT_LITERAL, TokenType.STRING_LITERAL,
                TokenType.CHAR_LITERAL, TokenType.TRUE, TokenType.FALSE, TokenType.IDENTIFIER, TokenType.LPAREN,
                TokenType.LBRACKET, TokenType.BANG, TokenType.MINUS, TokenType.STAR, TokenType.AMP, TokenType.IF);
    }

    private static Optional<BinaryOperator> binaryOperator(TokenType type) {
        return Optional.ofNullable(switch (type) {
            case OR_OR -> BinaryOperator.OR;
            case AND_AND -> BinaryOperator.AND;
            case PIPE -> BinaryOperator.BIT_OR;
            case CARET -> BinaryOperator.BIT_XOR;
            case AMP -> BinaryOperator.BIT_AND;
            case EQUALS_EQUALS -> BinaryOperator.EQ;
            case NOT_EQUALS -> BinaryOperator.NE;
            case LT -> BinaryOperator.LT;
            case GT -> BinaryOperator.GT;
            case LE -> BinaryOperator.LE;
            case GE -> BinaryOperator.GE;
            case SHL -> BinaryOperator.SHL;
            case SHR -> BinaryOperator.SHR;
            case PLUS -> BinaryOperator.ADD;
            case MINUS -> BinaryOperator.SUB;
            case STAR -> BinaryOperator.MUL;
            case SLASH -> BinaryOperator.DIV;
            case PERCENT -> BinaryOperator.MOD;
            default -> null;
        });
    }

    private Expression parseBinary(Tokens tokens, int minPrecedence) {
        var left = parseCast(tokens);

        while (true) {
            var operator = binaryOperator(tokens.peek().type());
            if (operator.isEmpty() || operator.get().rustPrecedence < minPrecedence) {
                return left;
            }
            tokens.next();
            var right = parseBinary(tokens, operator.get().rustPrecedence + 1);
            left = new Binary(left, operator.get(), right, left.span().to(right.span()));
        }
    }

    // <> unary (as Type)*
    private Expression parseCast(Tokens tokens) {
        var expr = parseUnary(tokens);
        while (tokens.matches(TokenType.AS)) {
            tokens.next();
            var type = parseType(tokens);
            expr = new Cast(expr, type, expr.span().to(tokens.previous().span()));
        }
        return expr;
    }

    private Expression parseUnary(Tokens tokens) {
        var token = tokens.peek();
        UnaryOperator operator = switch (token.type()) {
            case BANG -> UnaryOperator.NOT;
            case MINUS -> UnaryOperator.NEG;
            case STAR -> UnaryOperator.DEREF;
            case AMP -> tokens.matchesAhead(1, TokenType.MUT) ? UnaryOperator.REF_MUT : UnaryOperator.REF;
            default -> null;
        };
        if (operator == null) {
            return parsePostfix(tokens, parsePrimary(tokens));
        }
        tokens.next();
        if (operator == UnaryOperator.REF_MUT) {
            tokens.next(TokenType.MUT);
        }
        var operand = parseUnary(tokens);
        return new Unary(operator, operand, token.span().to(operand.span()));
    }

    private Expression parsePostfix(Tokens tokens, Expression expression) {
        while (true) {
            var token = tokens.peek();
            switch (token.type()) {
                case LPAREN -> {
                    var arguments = parseArguments(tokens);
                    expression = new Call(expression, arguments, expression.span().to(tokens.previous().span()));
                }
                case LBRACKET -> {
                    tokens.next();
                    var index = parseNested(tokens);
                    var end = tokens.next(TokenType.RBRACKET);
                    expression = new Index(expression, index, expression.span().to(end.span()));
                }
                case DOT -> {
                    tokens.next();
                    expression = parseMember(tokens, expression);
                }
                case QUESTION -> {
                    tokens.next();
                    expression = new ErrorPropagation(expression, expression.span().to(token.span()));
                }
                default -> {
                    return expression;
                }
            }
        }
    }

    private Expression parseMember(Tokens tokens, Expression target) {
        var member = tokens.peek();
        switch (member.type()) {
            case IDENTIFIER -> {
                tokens.next();
                if (tokens.matches(TokenType.LPAREN)) {
                    var arguments = parseArguments(tokens);
                    var span = target.span().to(tokens.previous().span());
                    if (arguments.isEmpty() && member.image().equals("is_none")) {
                        return new Binary(target, BinaryOperator.EQ, new NullLiteral(member.span()), span);
                    }
                    if (arguments.isEmpty() && member.image().equals("is_some")) {
                        return new Binary(target, BinaryOperator.NE, new NullLiteral(member.span()), span);
                    }
                    return new MethodCall(target, member.image(), arguments, span);
                }
                return new FieldAccess(target, member.image(), target.span().to(member.span()));
            }
            case INT_LITERAL -> {
                tokens.next();
                return new FieldAccess(target, member.image(), target.span().to(member.span()));
            }
            case FLOAT_LITERAL -> {
                tokens.next();
                Expression access = target;
                for (var part : member.image().split("\\.")) {
                    access = new FieldAccess(access, part, target.span().to(member.span()));
                }
                return access;
            }
            default -> throw tokens.unexpected("field name", "method name", "tuple index");
        }
    }

    /**
     * Parses an expression inside brackets, where struct literals are allowed again.
     */
    private Expression parseNested(Tokens tokens) {
        boolean saved = noStructLiteral;
        noStructLiteral = false;
        try {
            return parseExpression(tokens);
        } finally {
            noStructLiteral = saved;
        }
    }

    private List<Expression> parseArguments(Tokens tokens) {
        tokens.next(TokenType.LPAREN);
        List<Expression> arguments = new ArrayList<>();
        while (!tokens.matches(TokenType.RPAREN)) {
            arguments.add(parseNested(tokens));
            if (!tokens.matches(TokenType.RPAREN)) {
                tokens.next(TokenType.COMMA);
            }
        }
        tokens.next(TokenType.RPAREN);
        return arguments;
    }

    private Expression parsePrimary(Tokens tokens) {
        var token = tokens.peek();

        return switch (token.type()) {
            case INT_LITERAL -> {
                tokens.next();
                yield new IntLiteral(parseInteger(token), token.span());
            }
            case FLOAT_LITERAL -> {
                tokens.next();
                var image = LITERAL_SUFFIX.matcher(token.image().replace("_", "")).replaceFirst("");
                yield new FloatLiteral(Double.parseDouble(image), token.span());
            }
            case STRING_LITERAL -> {
                tokens.next();
                yield new StringLiteral(Tokenizer.decode(token.image()), token.span());
            }
            case CHAR_LITERAL -> {
                tokens.next();
                var decoded = Tokenizer.decode(token.image());
                yield new CharLiteral(decoded.isEmpty() ? ' ' : decoded.codePointAt(0), token.span());
            }
            case TRUE, FALSE -> {
                tokens.next();
                yield new BoolLiteral(token.type() == TokenType.TRUE, token.span());
            }
            case IDENTIFIER -> parsePathExpression(tokens);
            case LPAREN -> parseParenthesized(tokens);
            case LBRACKET -> parseArrayLiteral(tokens);
            case IF -> parseIfExpression(tokens);
            case LBRACE -> parseBlockExpression(tokens);
            case PIPE, OR_OR, MOVE -> throw new ParseException(new ParseError(
                    "closures are supported only as let-bound nested functions",
                    List.of("expression"), token.describe(), token.span()));
            default -> throw tokens.unexpected("expression");
        };
    }

    static long parseInteger(Token token) {
        var image = LITERAL_SUFFIX.matcher(token.image().replace("_", "")).replaceFirst("");
        try {
            if (image.startsWith("0x") || image.startsWith("0X")) {
                return Long.parseUnsignedLong(image.substring(2), 16);
            }
            return Long.parseUnsignedLong(image);
        } catch (NumberFormatException e) {
            throw new ParseException(new ParseError("invalid integer literal", List.of("integer"),
                    token.describe(), token.span()));
        }
    }

    /**
     * Paths: plain identifiers, macro invocations, struct literals and everything reached
     * through {@code ::}.
     */
    private Expression parsePathExpression(Tokens tokens) {
        var first = tokens.next(TokenType.IDENTIFIER);

        if (tokens.matches(TokenType.BANG) && tokens.matchesAhead(1, TokenType.LPAREN, TokenType.LBRACKET, TokenType.LBRACE)) {
            tokens.next();
            var delimiter = switch (tokens.peek().type()) {
                case LPAREN -> MacroDelimiter.PARENTHESIS;
                case LBRACKET -> MacroDelimiter.BRACKET;
                default -> MacroDelimiter.BRACE;
            };
            var arguments = Parser.collectDelimited(tokens);
            var name = crustyMacroName(first.image());
            if (delimiter == MacroDelimiter.PARENTHESIS && arguments.isEmpty()) {
                return new MacroCall(name, MacroDelimiter.NONE, List.of(), first.span().to(tokens.previous().span()));
            }
            return new MacroCall(name, delimiter, arguments, first.span().to(tokens.previous().span()));
        }

        List<String> segments = new ArrayList<>();
        segments.add(first.image());
        List<Type> generics = List.of();
        int genericsAt = -1;
        while (tokens.matches(TokenType.COLON_COLON)) {
            tokens.next();
            if (tokens.matches(TokenType.LT)) {
                tokens.next();
                generics = parseTypeArguments(tokens);
                genericsAt = segments.size();
            } else {
                segments.add(tokens.next(TokenType.IDENTIFIER).image());
            }
        }
        var span = first.span().to(tokens.previous().span());

        if (segments.size() == 1 && genericsAt < 0) {
            var name = first.image();
            if (name.equals("None")) {
                return new NullLiteral(span);
            }
            if (tokens.matches(TokenType.LBRACE) && !noStructLiteral && looksLikeStructLiteral(tokens)) {
                return parseStructLiteral(tokens, new NamedType(name), span);
            }
            return new Identifier(name, span);
        }

        var last = segments.get(segments.size() - 1);
        if (genericsAt == segments.size() && last.equals("size_of") && generics.size() == 1) {
            tokens.next(TokenType.LPAREN);
            var end = tokens.next(TokenType.RPAREN);
            return new Sizeof(generics.get(0), first.span().to(end.span()));
        }
        if (genericsAt >= segments.size()) {
            throw new ParseException(new ParseError("explicit generic arguments on a function are not supported",
                    List.of("type::<...>::function"), last, span));
        }
        if (segments.size() == 2 && segments.get(0).equals("Option") && last.equals("None")) {
            return new NullLiteral(span);
        }

        var type = pathType(segments.subList(0, segments.size() - 1));
        if (genericsAt > 0) {
            if (genericsAt != segments.size() - 1) {
                throw new ParseException(new ParseError("explicit generic arguments must follow the type",
                        List.of("type::<...>::function"), last, span));
            }
            List<Expression> arguments = tokens.matches(TokenType.LPAREN) ? parseArguments(tokens) : List.of();
            return new ExplicitGenericCall(type, generics, last, arguments, first.span().to(tokens.previous().span()));
        }
        if (tokens.matches(TokenType.LPAREN)) {
            var arguments = parseArguments(tokens);
            return new TypeScopedCall(type, last, arguments, first.span().to(tokens.previous().span()));
        }
        if (tokens.matches(TokenType.LBRACE) && !noStructLiteral && looksLikeStructLiteral(tokens)) {
            return parseStructLiteral(tokens, new NamedType(List.copyOf(segments), List.of()), span);
        }
        return new TypeScopedPath(type, last, span);
    }

    private static Type pathType(List<String> path) {
        if (path.size() == 1) {
            var primitive = Primitive.ofRustName(path.get(0));
            if (primitive.isPresent()) {
                return new PrimitiveType(primitive.get());
            }
        }
        return new NamedType(List.copyOf(path), List.of());
    }

    private static boolean looksLikeStructLiteral(Tokens tokens) {
        var afterBrace = tokens.peek(1);
        if (afterBrace.type() == TokenType.RBRACE) {
            return true;
        }
        return afterBrace.type() == TokenType.IDENTIFIER
                && tokens.matchesAhead(2, TokenType.COLON, TokenType.COMMA, TokenType.RBRACE);
    }

    // <> Name { field: value, field, ... }
    private StructInit parseStructLiteral(Tokens tokens, Type type, Span start) {
        tokens.next(TokenType.LBRACE);
        List<FieldInit> fields = new ArrayList<>();
        while (!tokens.matches(TokenType.RBRACE)) {
            var name = tokens.next(TokenType.IDENTIFIER);
            Expression value = new Identifier(name.image(), name.span());
            if (tokens.accept(TokenType.COLON)) {
                value = parseNested(tokens);
            }
            fields.add(new FieldInit(name.image(), value, name.span().to(value.span())));
            if (!tokens.matches(TokenType.RBRACE)) {
                tokens.next(TokenType.COMMA);
            }
        }
        var end = tokens.next(TokenType.RBRACE);
        return new StructInit(type, fields, start.to(end.span()));
    }

    private Expression parseParenthesized(Tokens tokens) {
        var start = tokens.next(TokenType.LPAREN);
        if (tokens.matches(TokenType.RPAREN)) {
            var end = tokens.next();
            return new TupleLiteral(List.of(), start.span().to(end.span()));
        }
        var first = parseNested(tokens);
        if (tokens.matches(TokenType.COMMA)) {
            List<Expression> elements = new ArrayList<>();
            elements.add(first);
            while (tokens.accept(TokenType.COMMA)) {
                if (tokens.matches(TokenType.RPAREN)) {
                    break;
                }
                elements.add(parseNested(tokens));
            }
            var end = tokens.next(TokenType.RPAREN);
            return new TupleLiteral(elements, start.span().to(end.span()));
        }
        tokens.next(TokenType.RPAREN);
        return first;
    }

    private Expression parseArrayLiteral(Tokens tokens) {
        var start = tokens.next(TokenType.LBRACKET);
        if (tokens.matches(TokenType.RBRACKET)) {
            var end = tokens.next();
            return new ArrayLiteral(List.of(), start.span().to(end.span()));
        }
        var first = parseNested(tokens);
        if (tokens.accept(TokenType.SEMICOLON)) {
            var count = parseNested(tokens);
            var end = tokens.next(TokenType.RBRACKET);
            return new ArrayRepeat(first, count, start.span().to(end.span()));
        }
        List<Expression> elements = new ArrayList<>();
        elements.add(first);
        while (tokens.accept(TokenType.COMMA)) {
            if (tokens.matches(TokenType.RBRACKET)) {
                break;
            }
            elements.add(parseNested(tokens));
        }
        var end = tokens.next(TokenType.RBRACKET);
        return new ArrayLiteral(elements, start.span().to(end.span()));
    }

    // <> if c { a } else { b } as a value is a ternary
    private Expression parseIfExpression(Tokens tokens) {
        var start = tokens.next(TokenType.IF);
        var condition = parseCondition(tokens);
        var thenValue = parseValueBlock(tokens);
        tokens.next(TokenType.ELSE);
        var elseValue = tokens.matches(TokenType.IF) ? parseIfExpression(tokens) : parseValueBlock(tokens);
        return new Ternary(condition, thenValue, elseValue, start.span().to(elseValue.span()));
    }

    private Expression parseValueBlock(Tokens tokens) {
        tokens.next(TokenType.LBRACE);
        var value = parseNested(tokens);
        tokens.next(TokenType.RBRACE);
        return value;
    }

    /**
     * Block expressions are accepted in the two shapes increments are emitted in:
     * {@code { x += 1; x }} and {@code { let tmp = x; x += 1; tmp }}.
     */
    private Expression parseBlockExpression(Tokens tokens) {
        var start = tokens.peek();
        var block = parseBlock(tokens, true);
        var statements = block.statements();
        if (statements.size() == 2 && statements.get(0) instanceof ExpressionStatement es
                && statements.get(1) instanceof ReturnStatement rs && rs.value().isPresent()) {
            var step = stepOf(es.expression());
            if (step.isPresent() && rs.value().get().equals(step.get().target())) {
                var operator = step.get().increment() ? UnaryOperator.PRE_INC : UnaryOperator.PRE_DEC;
                return new Unary(operator, step.get().target(), block.span());
            }
        }
        if (statements.size() == 3 && statements.get(0) instanceof LetStatement let
                && let.initializer().isPresent() && statements.get(1) instanceof ExpressionStatement es
                && statements.get(2) instanceof ReturnStatement rs && rs.value().isPresent()
                && rs.value().get().equals(new Identifier(let.name()))) {
            var step = stepOf(es.expression());
            if (step.isPresent() && let.initializer().get().equals(step.get().target())) {
                var operator = step.get().increment() ? UnaryOperator.POST_INC : UnaryOperator.POST_DEC;
                return new Unary(operator, step.get().target(), block.span());
            }
        }
        throw new ParseException(new ParseError("block expressions are not supported", List.of("expression"),
                start.describe(), block.span()));
    }

    private record Step(Expression target, boolean increment) {}

    private static Optional<Step> stepOf(Expression expression) {
        if (expression instanceof Binary b && b.right().equals(new IntLiteral(1))
                && (b.operator() == BinaryOperator.ADD_ASSIGN || b.operator() == BinaryOperator.SUB_ASSIGN)) {
            return Optional.of(new Step(b.left(), b.operator() == BinaryOperator.ADD_ASSIGN));
        }
        return Optional.empty();
    }

    // ---- types

    public Type parseType(Tokens tokens) {
        var token = tokens.peek();

        switch (token.type()) {
            case AMP -> {
                tokens.next();
                skipLifetime(tokens);
                boolean mutable = tokens.accept(TokenType.MUT);
                return new ReferenceType(parseType(tokens), mutable);
            }
            case AND_AND -> {
                // && in type position is two references
                tokens.next();
                skipLifetime(tokens);
                boolean mutable = tokens.accept(TokenType.MUT);
                return new ReferenceType(new ReferenceType(parseType(tokens), mutable), false);
            }
            case STAR -> {
                tokens.next();
                boolean mutable;
                if (tokens.accept(TokenType.MUT)) {
                    mutable = true;
                } else {
                    tokens.next(TokenType.CONST);
                    mutable = false;
                }
                return new PointerType(parseType(tokens), mutable);
            }
            case LBRACKET -> {
                tokens.next();
                var element = parseType(tokens);
                if (tokens.accept(TokenType.SEMICOLON)) {
                    long size = parseInteger(tokens.next(TokenType.INT_LITERAL));
                    tokens.next(TokenType.RBRACKET);
                    return new ArrayType(element, size);
                }
                tokens.next(TokenType.RBRACKET);
                return new SliceType(element);
            }
            case LPAREN -> {
                tokens.next();
                if (tokens.accept(TokenType.RPAREN)) {
                    return PrimitiveType.VOID;
                }
                List<Type> elements = new ArrayList<>();
                elements.add(parseType(tokens));
                while (tokens.accept(TokenType.COMMA)) {
                    if (tokens.matches(TokenType.RPAREN)) {
                        break;
                    }
                    elements.add(parseType(tokens));
                }
                tokens.next(TokenType.RPAREN);
                return elements.size() == 1 ? elements.get(0) : new TupleType(elements);
            }
            case FN -> {
                tokens.next();
                return parseFunctionSignature(tokens);
            }
            case IMPL, DYN -> {
                tokens.next();
                var trait = tokens.peek();
                if (trait.type() == TokenType.IDENTIFIER && trait.image().startsWith("Fn")) {
                    tokens.next();
                    return parseFunctionSignature(tokens);
                }
                return parseType(tokens);
            }
            case IDENTIFIER -> {
                return parseNamedType(tokens);
            }
            default -> throw tokens.unexpected("type");
        }
    }

    // <> (Type, ...) [-> Type]
    private FunctionType parseFunctionSignature(Tokens tokens) {
        tokens.next(TokenType.LPAREN);
        List<Type> parameters = new ArrayList<>();
        while (!tokens.matches(TokenType.RPAREN)) {
            parameters.add(parseType(tokens));
            if (!tokens.matches(TokenType.RPAREN)) {
                tokens.next(TokenType.COMMA);
            }
        }
        tokens.next(TokenType.RPAREN);
        Type returnType = PrimitiveType.VOID;
        if (tokens.accept(TokenType.ARROW)) {
            returnType = parseType(tokens);
        }
        return new FunctionType(parameters, returnType);
    }

    private Type parseNamedType(Tokens tokens) {
        var first = tokens.next(TokenType.IDENTIFIER);
        if (first.image().equals("_")) {
            return AutoType.INSTANCE;
        }
        List<String> path = new ArrayList<>();
        path.add(first.image());
        while (tokens.matches(TokenType.COLON_COLON) && tokens.matchesAhead(1, TokenType.IDENTIFIER)) {
            tokens.next();
            path.add(tokens.next().image());
        }
        if (path.size() == 1 && !tokens.matches(TokenType.LT)) {
            var primitive = Primitive.ofRustName(first.image());
            if (primitive.isPresent()) {
                return new PrimitiveType(primitive.get());
            }
        }
        if (path.size() == 1 && first.image().equals("Result") && tokens.matches(TokenType.LT)) {
            tokens.next();
            var success = parseType(tokens);
            tokens.next(TokenType.COMMA);
            int errorStart = tokens.mark();
            var error = parseType(tokens);
            var errorText = imagesBetween(tokens, errorStart, tokens.mark());
            tokens.nextCloseAngle();
            if (errorText.equals(fallibleErrorType.replaceAll("\\s+", ""))) {
                return new FallibleType(success);
            }
            return new NamedType("Result", List.of(success, error));
        }
        List<Type> arguments = List.of();
        if (tokens.accept(TokenType.LT)) {
            arguments = parseTypeArguments(tokens);
        }
        return new NamedType(List.copyOf(path), arguments);
    }

    private List<Type> parseTypeArguments(Tokens tokens) {
        List<Type> arguments = new ArrayList<>();
        while (!tokens.matches(TokenType.GT, TokenType.SHR, TokenType.GE, TokenType.SHR_EQUALS)) {
            skipLifetime(tokens);
            arguments.add(parseType(tokens));
            if (!tokens.matches(TokenType.GT, TokenType.SHR, TokenType.GE, TokenType.SHR_EQUALS)) {
                tokens.next(TokenType.COMMA);
            }
        }
        tokens.nextCloseAngle();
        return List.copyOf(arguments);
    }

    /**
     * Source text of the tokens in {@code [from, to)}, without whitespace.
     */
    private static String imagesBetween(Tokens tokens, int from, int to) {
        int saved = tokens.mark();
        tokens.reset(from);
        var sb = new StringBuilder();
        while (tokens.mark() < to) {
            sb.append(tokens.next().image());
        }
        tokens.reset(saved);
        return sb.toString();
    }

}
