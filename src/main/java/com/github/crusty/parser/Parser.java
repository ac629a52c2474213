package com.github.crusty.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.crusty.Tokenizer;
import com.github.crusty.Tokenizer.Token;
import com.github.crusty.Tokenizer.TokenType;
import com.github.crusty.Tokenizer.Tokens;
import com.github.crusty.error.Diagnostic;
import com.github.crusty.error.ParseError;
import com.github.crusty.error.ParseException;
import com.github.crusty.error.SemanticError;
import com.github.crusty.error.SemanticErrorKind;
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
import com.github.crusty.parser.CompilationUnit.UnionDefinition;
import com.github.crusty.parser.CompilationUnit.Visibility;
import com.github.crusty.parser.CompilationUnit.WhileStatement;

/**
 * Parser for the C-dialect. One instance holds the state of one parse: the macro delimiter
 * registry and the diagnostics collected so far.
 */
public class Parser {

    private static final Logger logger = LoggerFactory.getLogger(Parser.class);

    private final MacroRegistry macros = new MacroRegistry();
    private final List<Diagnostic> diagnostics = new ArrayList<>();

    public static ParseResult parse(String source) {
        return parse(new Tokenizer().tokenize(source));
    }

    public static ParseResult parse(Tokens tokens) {
        return new Parser().parseCompilationUnit(tokens);
    }

    public ParseResult parseCompilationUnit(Tokens tokens) {
        var start = tokens.peek().span();
        var docComments = tokens.leadingDocComments();
        var items = parseItems(tokens, TokenType.EOF);
        var unit = new CompilationUnit(docComments, items, start.to(tokens.previous().span()));

        List<Diagnostic> all = new ArrayList<>(tokens.errors());
        all.addAll(diagnostics);
        logger.debug("parsed {} items, {} diagnostics", items.size(), all.size());
        return new ParseResult(unit, all);
    }

    public List<Diagnostic> diagnostics() {
        return List.copyOf(diagnostics);
    }

    public MacroRegistry macros() {
        return macros;
    }

    private List<Item> parseItems(Tokens tokens, TokenType terminator) {
        List<Item> items = new ArrayList<>();
        while (!tokens.matches(terminator, TokenType.EOF)) {
            try {
                items.add(parseItem(tokens));
            } catch (ParseException e) {
                diagnostics.add(e.error());
                synchronize(tokens, terminator == TokenType.EOF);
            }
        }
        return items;
    }

    /**
     * Skips to the next statement or item boundary: past a {@code ;} or a balanced
     * {@code { }} group, or up to the {@code }} closing the enclosing block.
     */
    private void synchronize(Tokens tokens, boolean topLevel) {
        int depth = 0;
        boolean progressed = false;
        while (!tokens.atEnd()) {
            var token = tokens.peek();
            switch (token.type()) {
                case LBRACE -> depth++;
                case RBRACE -> {
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
                }
                case SEMICOLON -> {
                    if (depth == 0) {
                        tokens.next();
                        return;
                    }
                }
                default -> { }
            }
            tokens.next();
            progressed = true;
        }
    }

    // ---- items

    Item parseItem(Tokens tokens) {
        var token = tokens.peek();

        return switch (token.type()) {
            case HASH -> parseDirective(tokens);
            case STRUCT -> parseStruct(tokens);
            case UNION -> parseUnion(tokens);
            case ENUM -> parseEnum(tokens);
            case TYPEDEF -> parseTypedef(tokens);
            case NAMESPACE -> parseNamespace(tokens);
            case CONST -> parseConst(tokens);
            case STATIC -> parseStaticItem(tokens);
            default -> {
                if (!startsType(tokens)) {
                    throw tokens.unexpected("function", "struct", "enum", "typedef", "namespace", "#define");
                }
                yield parseFunction(tokens, Visibility.PUBLIC, token.span());
            }
        };
    }

    private boolean startsType(Tokens tokens) {
        return tokens.matches(TokenType.PRIMITIVE, TokenType.IDENTIFIER, TokenType.AUTO, TokenType.AMP,
                TokenType.LPAREN, TokenType.CONST);
    }

    // <> "#" ( define | import | export | include )
    private Item parseDirective(Tokens tokens) {
        var hash = tokens.next(TokenType.HASH);
        var directive = tokens.peek();
        if (directive.type() != TokenType.IDENTIFIER) {
            throw tokens.unexpected("define", "import", "export", "include");
        }
        return switch (directive.image()) {
            case "define" -> parseDefine(tokens, hash);
            case "import" -> parseImport(tokens, hash, false);
            case "export" -> parseImport(tokens, hash, true);
            case "include" -> parseInclude(tokens, hash);
            default -> throw tokens.unexpected("define", "import", "export", "include");
        };
    }

    // <> #define __NAME__ [ (params) | [params] | {params} ] body-to-end-of-line
    private MacroDefinition parseDefine(Tokens tokens, Token hash) {
        tokens.next();
        var nameToken = tokens.peek(TokenType.IDENTIFIER);
        if (!MacroRegistry.isMacroName(nameToken.image())) {
            throw new ParseException(new ParseError(
                    "macro name '" + nameToken.image() + "' must begin and end with double underscores",
                    List.of("__NAME__"), nameToken.describe(), nameToken.span()));
        }
        tokens.next();
        int line = hash.span().start().line();

        var delimiter = MacroDelimiter.NONE;
        List<String> parameters = new ArrayList<>();
        var open = tokens.peek();
        boolean adjacent = open.span().start().line() == line
                && open.span().start().column() == nameToken.span().end().column();
        if (adjacent && open.is(TokenType.LPAREN, TokenType.LBRACKET, TokenType.LBRACE)) {
            delimiter = switch (open.type()) {
                case LPAREN -> MacroDelimiter.PARENTHESIS;
                case LBRACKET -> MacroDelimiter.BRACKET;
                default -> MacroDelimiter.BRACE;
            };
            var close = closing(open.type());
            tokens.next();
            while (!tokens.matches(close)) {
                parameters.add(tokens.next(TokenType.IDENTIFIER).image());
                if (!tokens.matches(close)) {
                    tokens.next(TokenType.COMMA);
                }
            }
            tokens.next(close);
        }

        List<String> body = new ArrayList<>();
        Token last = tokens.previous();
        while (!tokens.atEnd() && tokens.peek().span().start().line() == line) {
            last = tokens.next();
            body.add(last.image());
        }
        if (!body.isEmpty() && body.get(body.size() - 1).equals(";")) {
            body.remove(body.size() - 1);
        }

        macros.define(nameToken.image(), delimiter);
        return new MacroDefinition(nameToken.image(), parameters, delimiter, body, hash.span().to(last.span()));
    }

    private static TokenType closing(TokenType open) {
        return switch (open) {
            case LPAREN -> TokenType.RPAREN;
            case LBRACKET -> TokenType.RBRACKET;
            case LBRACE -> TokenType.RBRACE;
            default -> throw new IllegalArgumentException("not an opening delimiter: " + open);
        };
    }

    // <> #import a.b.c [as alias] [;]
    private Import parseImport(Tokens tokens, Token hash, boolean exported) {
        tokens.next();
        List<String> path = new ArrayList<>();
        path.add(tokens.next(TokenType.IDENTIFIER).image());
        while (tokens.accept(TokenType.DOT)) {
            path.add(tokens.next(TokenType.IDENTIFIER).image());
        }
        Optional<String> alias = Optional.empty();
        if (tokens.matches(TokenType.IDENTIFIER) && tokens.peek().image().equals("as")) {
            tokens.next();
            alias = Optional.of(tokens.next(TokenType.IDENTIFIER).image());
        }
        tokens.accept(TokenType.SEMICOLON);
        return new Import(path, alias, exported, hash.span().to(tokens.previous().span()));
    }

    // <> #include <header> | #include "header"
    private Include parseInclude(Tokens tokens, Token hash) {
        tokens.next();
        if (tokens.matches(TokenType.STRING_LITERAL)) {
            var header = tokens.next();
            return new Include(Tokenizer.decode(header.image()), false, hash.span().to(header.span()));
        }
        tokens.next(TokenType.LT);
        var sb = new StringBuilder();
        while (!tokens.matches(TokenType.GT) && !tokens.atEnd()) {
            sb.append(tokens.next().image());
        }
        var close = tokens.next(TokenType.GT);
        return new Include(sb.toString(), true, hash.span().to(close.span()));
    }

    // <> struct Name { (Type field; | [static] Type method(params) block)* } [;]
    private StructDefinition parseStruct(Tokens tokens) {
        var start = tokens.next(TokenType.STRUCT);
        var name = tokens.next(TokenType.IDENTIFIER).image();
        tokens.next(TokenType.LBRACE);

        List<Field> fields = new ArrayList<>();
        List<FunctionDeclaration> methods = new ArrayList<>();
        while (!tokens.matches(TokenType.RBRACE)) {
            var memberStart = tokens.peek().span();
            if (tokens.accept(TokenType.STATIC)) {
                methods.add(parseFunction(tokens, Visibility.PRIVATE, memberStart));
                continue;
            }
            int mark = tokens.mark();
            var type = parseType(tokens);
            var fieldName = tokens.next(TokenType.IDENTIFIER);
            if (tokens.matches(TokenType.LPAREN)) {
                tokens.reset(mark);
                methods.add(parseFunction(tokens, Visibility.PUBLIC, memberStart));
            } else {
                tokens.next(TokenType.SEMICOLON);
                fields.add(new Field(fieldName.image(), type, memberStart.to(fieldName.span())));
            }
        }
        var end = tokens.next(TokenType.RBRACE);
        tokens.accept(TokenType.SEMICOLON);
        return new StructDefinition(name, fields, methods, start.span().to(end.span()));
    }

    private UnionDefinition parseUnion(Tokens tokens) {
        var start = tokens.next(TokenType.UNION);
        var name = tokens.next(TokenType.IDENTIFIER).image();
        tokens.next(TokenType.LBRACE);
        List<Field> fields = new ArrayList<>();
        while (!tokens.matches(TokenType.RBRACE)) {
            var fieldStart = tokens.peek().span();
            var type = parseType(tokens);
            var fieldName = tokens.next(TokenType.IDENTIFIER);
            tokens.next(TokenType.SEMICOLON);
            fields.add(new Field(fieldName.image(), type, fieldStart.to(fieldName.span())));
        }
        var end = tokens.next(TokenType.RBRACE);
        tokens.accept(TokenType.SEMICOLON);
        return new UnionDefinition(name, fields, start.span().to(end.span()));
    }

    // <> enum Name { Variant [= value], ... } [;]
    private EnumDefinition parseEnum(Tokens tokens) {
        var start = tokens.next(TokenType.ENUM);
        var name = tokens.next(TokenType.IDENTIFIER).image();
        tokens.next(TokenType.LBRACE);
        List<EnumVariant> variants = new ArrayList<>();
        while (!tokens.matches(TokenType.RBRACE)) {
            var variant = tokens.next(TokenType.IDENTIFIER);
            Optional<Long> value = Optional.empty();
            if (tokens.accept(TokenType.EQUALS)) {
                boolean negative = tokens.accept(TokenType.MINUS);
                var literal = tokens.next(TokenType.INT_LITERAL);
                long parsed = parseInteger(literal);
                value = Optional.of(negative ? -parsed : parsed);
            }
            variants.add(new EnumVariant(variant.image(), value, variant.span().to(tokens.previous().span())));
            if (!tokens.matches(TokenType.RBRACE)) {
                tokens.next(TokenType.COMMA);
            }
        }
        var end = tokens.next(TokenType.RBRACE);
        tokens.accept(TokenType.SEMICOLON);
        return new EnumDefinition(name, variants, start.span().to(end.span()));
    }

    private TypeAlias parseTypedef(Tokens tokens) {
        var start = tokens.next(TokenType.TYPEDEF);
        var target = parseType(tokens);
        var name = tokens.next(TokenType.IDENTIFIER).image();
        var end = tokens.next(TokenType.SEMICOLON);
        return new TypeAlias(name, target, start.span().to(end.span()));
    }

    private Namespace parseNamespace(Tokens tokens) {
        var start = tokens.next(TokenType.NAMESPACE);
        var name = tokens.next(TokenType.IDENTIFIER).image();
        tokens.next(TokenType.LBRACE);
        var items = parseItems(tokens, TokenType.RBRACE);
        var end = tokens.next(TokenType.RBRACE);
        return new Namespace(name, items, start.span().to(end.span()));
    }

    // <> static [var] Type NAME = value; | static Type name(params) block
    private Item parseStaticItem(Tokens tokens) {
        var start = tokens.next(TokenType.STATIC);
        boolean mutable = tokens.accept(TokenType.VAR);
        int mark = tokens.mark();
        var type = parseType(tokens);
        var name = tokens.next(TokenType.IDENTIFIER);
        if (!mutable && tokens.matches(TokenType.LPAREN)) {
            tokens.reset(mark);
            return parseFunction(tokens, Visibility.PRIVATE, start.span());
        }
        tokens.next(TokenType.EQUALS);
        var value = parseExpression(tokens);
        var end = tokens.next(TokenType.SEMICOLON);
        return new StaticDeclaration(name.image(), type, value, mutable, start.span().to(end.span()));
    }

    // <> Type name "(" parameters ")" block
    private FunctionDeclaration parseFunction(Tokens tokens, Visibility visibility, Span start) {
        var returnType = parseType(tokens);
        var name = tokens.next(TokenType.IDENTIFIER).image();
        var parameters = parseParameters(tokens);
        var body = parseBlock(tokens);
        return new FunctionDeclaration(visibility, name, parameters, returnType, body, start.to(body.span()));
    }

    private List<Parameter> parseParameters(Tokens tokens) {
        tokens.next(TokenType.LPAREN);
        List<Parameter> parameters = new ArrayList<>();
        if (tokens.matches(TokenType.PRIMITIVE) && tokens.peek().image().equals("void")
                && tokens.matchesAhead(1, TokenType.RPAREN)) {
            tokens.next();
        }
        while (!tokens.matches(TokenType.RPAREN)) {
            parameters.add(parseParameter(tokens));
            if (!tokens.matches(TokenType.RPAREN)) {
                tokens.next(TokenType.COMMA);
            }
        }
        tokens.next(TokenType.RPAREN);
        return parameters;
    }

    private Parameter parseParameter(Tokens tokens) {
        var start = tokens.peek();
        var self = new NamedType("Self");
        if (isSelf(start)) {
            tokens.next();
            return new Parameter("self", self, start.span());
        }
        if (start.type() == TokenType.AMP && isSelf(tokens.peek(1))) {
            tokens.next();
            var end = tokens.next();
            return new Parameter("self", new ReferenceType(self, false), start.span().to(end.span()));
        }
        if (start.type() == TokenType.AMP && tokens.matchesAhead(1, TokenType.VAR) && isSelf(tokens.peek(2))) {
            tokens.next();
            tokens.next();
            var end = tokens.next();
            return new Parameter("self", new ReferenceType(self, true), start.span().to(end.span()));
        }
        var type = parseType(tokens);
        var name = tokens.next(TokenType.IDENTIFIER);
        return new Parameter(name.image(), type, start.span().to(name.span()));
    }

    private static boolean isSelf(Token token) {
        return token.type() == TokenType.IDENTIFIER && token.image().equals("self");
    }

    // ---- statements

    Block parseBlock(Tokens tokens) {
        var start = tokens.next(TokenType.LBRACE);
        List<Statement> statements = new ArrayList<>();
        while (!tokens.matches(TokenType.RBRACE, TokenType.EOF)) {
            try {
                statements.add(parseStatement(tokens));
            } catch (ParseException e) {
                diagnostics.add(e.error());
                synchronize(tokens, false);
            }
        }
        var end = tokens.next(TokenType.RBRACE);
        return new Block(statements, start.span().to(end.span()));
    }

    Statement parseStatement(Tokens tokens) {
        var token = tokens.peek();

        return switch (token.type()) {
            case LET -> parseLet(tokens, false);
            case VAR -> parseLet(tokens, true);
            case CONST -> parseConst(tokens);
            case IF -> parseIf(tokens);
            case WHILE -> parseWhile(tokens, Optional.empty(), token.span());
            case LOOP -> parseLoop(tokens, Optional.empty(), token.span());
            case FOR -> parseFor(tokens, Optional.empty(), token.span());
            case SWITCH -> parseSwitch(tokens);
            case RETURN -> parseReturn(tokens);
            case BREAK -> {
                tokens.next();
                var label = parseLabelReference(tokens);
                var end = tokens.next(TokenType.SEMICOLON);
                yield new BreakStatement(label, token.span().to(end.span()));
            }
            case CONTINUE -> {
                tokens.next();
                var label = parseLabelReference(tokens);
                var end = tokens.next(TokenType.SEMICOLON);
                yield new ContinueStatement(label, token.span().to(end.span()));
            }
            case GOTO -> {
                tokens.next();
                var label = tokens.next(TokenType.IDENTIFIER).image();
                var end = tokens.next(TokenType.SEMICOLON);
                yield new GotoStatement(label, token.span().to(end.span()));
            }
            case LBRACE -> parseBlock(tokens);
            case DOT -> parseLabeledLoop(tokens);
            case STATIC -> {
                tokens.next();
                yield parseNestedFunction(tokens, true, token.span());
            }
            default -> parseDeclarationOrExpression(tokens);
        };
    }

    // <> break label; -- the label is referenced without its declaring dot
    private Optional<String> parseLabelReference(Tokens tokens) {
        if (tokens.matches(TokenType.IDENTIFIER)) {
            return Optional.of(tokens.next().image());
        }
        return Optional.empty();
    }

    // <> let [Type] name [= init]; | let name: Type [= init]; | var ...
    private LetStatement parseLet(Tokens tokens, boolean mutable) {
        var start = tokens.next();
        var binding = parseBinding(tokens);
        Optional<Expression> initializer = Optional.empty();
        if (tokens.accept(TokenType.EQUALS)) {
            initializer = Optional.of(inferStructType(parseExpression(tokens), binding.type()));
        }
        var end = tokens.next(TokenType.SEMICOLON);
        return new LetStatement(binding.name(), binding.type(), initializer, mutable, start.span().to(end.span()));
    }

    private record Binding(String name, Optional<Type> type) {}

    private Binding parseBinding(Tokens tokens) {
        if (tokens.matches(TokenType.IDENTIFIER) && tokens.matchesAhead(1, TokenType.COLON)) {
            var name = tokens.next().image();
            tokens.next(TokenType.COLON);
            return new Binding(name, Optional.of(parseType(tokens)));
        }
        if (tokens.matches(TokenType.IDENTIFIER) && tokens.matchesAhead(1, TokenType.EQUALS, TokenType.SEMICOLON)) {
            return new Binding(tokens.next().image(), Optional.empty());
        }
        var type = parseType(tokens);
        return new Binding(tokens.next(TokenType.IDENTIFIER).image(), Optional.of(type));
    }

    private static Expression inferStructType(Expression initializer, Optional<Type> type) {
        if (initializer instanceof StructInit si && si.type() instanceof AutoType && type.isPresent()) {
            return si.withType(type.get());
        }
        return initializer;
    }

    // <> const [Type] NAME = value; | const NAME: Type = value;
    private ConstDeclaration parseConst(Tokens tokens) {
        var start = tokens.next(TokenType.CONST);
        var binding = parseBinding(tokens);
        tokens.next(TokenType.EQUALS);
        var value = inferStructType(parseExpression(tokens), binding.type());
        var end = tokens.next(TokenType.SEMICOLON);
        return new ConstDeclaration(binding.name(), binding.type(), value, start.span().to(end.span()));
    }

    private IfStatement parseIf(Tokens tokens) {
        var start = tokens.next(TokenType.IF);
        tokens.next(TokenType.LPAREN);
        var condition = parseExpression(tokens);
        tokens.next(TokenType.RPAREN);
        var thenBlock = parseBlock(tokens);
        Optional<Block> elseBlock = Optional.empty();
        if (tokens.accept(TokenType.ELSE)) {
            if (tokens.matches(TokenType.IF)) {
                var elseIf = parseIf(tokens);
                elseBlock = Optional.of(new Block(List.of(elseIf), elseIf.span()));
            } else {
                elseBlock = Optional.of(parseBlock(tokens));
            }
        }
        var end = elseBlock.map(Block::span).orElse(thenBlock.span());
        return new IfStatement(condition, thenBlock, elseBlock, start.span().to(end));
    }

    private WhileStatement parseWhile(Tokens tokens, Optional<String> label, Span start) {
        tokens.next(TokenType.WHILE);
        tokens.next(TokenType.LPAREN);
        var condition = parseExpression(tokens);
        tokens.next(TokenType.RPAREN);
        var body = parseBlock(tokens);
        return new WhileStatement(label, condition, body, start.to(body.span()));
    }

    private LoopStatement parseLoop(Tokens tokens, Optional<String> label, Span start) {
        tokens.next(TokenType.LOOP);
        var body = parseBlock(tokens);
        return new LoopStatement(label, body, start.to(body.span()));
    }

    // <> for (x in iterable) block | for (init; condition; increment) block
    private Statement parseFor(Tokens tokens, Optional<String> label, Span start) {
        tokens.next(TokenType.FOR);
        tokens.next(TokenType.LPAREN);
        if (tokens.matches(TokenType.IDENTIFIER) && tokens.matchesAhead(1, TokenType.IN)) {
            var variable = tokens.next().image();
            tokens.next(TokenType.IN);
            var iterable = parseExpression(tokens);
            tokens.next(TokenType.RPAREN);
            var body = parseBlock(tokens);
            return new ForInStatement(label, variable, iterable, body, start.to(body.span()));
        }

        Optional<Statement> init = Optional.empty();
        if (!tokens.accept(TokenType.SEMICOLON)) {
            init = Optional.of(switch (tokens.peek().type()) {
                case LET -> parseLet(tokens, false);
                case VAR -> parseLet(tokens, true);
                default -> parseDeclarationOrExpression(tokens);
            });
        }
        Optional<Expression> condition = Optional.empty();
        if (!tokens.matches(TokenType.SEMICOLON)) {
            condition = Optional.of(parseExpression(tokens));
        }
        tokens.next(TokenType.SEMICOLON);
        Optional<Expression> increment = Optional.empty();
        if (!tokens.matches(TokenType.RPAREN)) {
            increment = Optional.of(parseExpression(tokens));
        }
        tokens.next(TokenType.RPAREN);
        var body = parseBlock(tokens);
        return new ForStatement(label, init, condition, increment, body, start.to(body.span()));
    }

    // <> .label: (while | loop | for)
    private Statement parseLabeledLoop(Tokens tokens) {
        var start = tokens.next(TokenType.DOT);
        var label = Optional.of(tokens.next(TokenType.IDENTIFIER).image());
        tokens.next(TokenType.COLON);
        return switch (tokens.peek().type()) {
            case WHILE -> parseWhile(tokens, label, start.span());
            case LOOP -> parseLoop(tokens, label, start.span());
            case FOR -> parseFor(tokens, label, start.span());
            default -> throw tokens.unexpected("while", "loop", "for");
        };
    }

    // <> switch (subject) { (case v, ...: statements)* [default: statements] }
    private SwitchStatement parseSwitch(Tokens tokens) {
        var start = tokens.next(TokenType.SWITCH);
        tokens.next(TokenType.LPAREN);
        var subject = parseExpression(tokens);
        tokens.next(TokenType.RPAREN);
        tokens.next(TokenType.LBRACE);

        List<SwitchCase> cases = new ArrayList<>();
        Optional<Block> defaultCase = Optional.empty();
        List<Expression> pending = new ArrayList<>();
        Span caseStart = Span.NONE;
        while (!tokens.matches(TokenType.RBRACE)) {
            var label = tokens.peek();
            if (tokens.accept(TokenType.CASE)) {
                if (pending.isEmpty()) {
                    caseStart = label.span();
                }
                pending.add(parseExpression(tokens));
                while (tokens.accept(TokenType.COMMA)) {
                    pending.add(parseExpression(tokens));
                }
                tokens.next(TokenType.COLON);
                if (tokens.matches(TokenType.CASE)) {
                    // empty case falls through into the next one
                    continue;
                }
                var body = parseCaseBody(tokens, label.span());
                cases.add(new SwitchCase(List.copyOf(pending), body, caseStart.to(body.span())));
                pending.clear();
            } else if (tokens.accept(TokenType.DEFAULT)) {
                tokens.next(TokenType.COLON);
                defaultCase = Optional.of(parseCaseBody(tokens, label.span()));
            } else {
                throw tokens.unexpected("case", "default");
            }
        }
        if (!pending.isEmpty()) {
            cases.add(new SwitchCase(List.copyOf(pending), new Block(List.of(), caseStart), caseStart));
        }
        var end = tokens.next(TokenType.RBRACE);
        return new SwitchStatement(subject, cases, defaultCase, start.span().to(end.span()));
    }

    private Block parseCaseBody(Tokens tokens, Span start) {
        List<Statement> statements = new ArrayList<>();
        while (!tokens.matches(TokenType.CASE, TokenType.DEFAULT, TokenType.RBRACE, TokenType.EOF)) {
            try {
                statements.add(parseStatement(tokens));
            } catch (ParseException e) {
                diagnostics.add(e.error());
                synchronize(tokens, false);
            }
        }
        if (!statements.isEmpty() && statements.get(statements.size() - 1) instanceof BreakStatement b
                && b.label().isEmpty()) {
            statements.remove(statements.size() - 1);
        }
        if (statements.size() == 1 && statements.get(0) instanceof Block block) {
            return block;
        }
        return new Block(statements, start.to(tokens.previous().span()));
    }

    private ReturnStatement parseReturn(Tokens tokens) {
        var start = tokens.next(TokenType.RETURN);
        Optional<Expression> value = Optional.empty();
        if (!tokens.matches(TokenType.SEMICOLON)) {
            value = Optional.of(parseExpression(tokens));
        }
        var end = tokens.next(TokenType.SEMICOLON);
        return new ReturnStatement(value, start.span().to(end.span()));
    }

    /**
     * A statement starting with something that may be a type is tried as a declaration first:
     * {@code Type name = ...;} or a nested function {@code Type name(...) { }}. When that does
     * not match, it is re-read as an expression statement.
     */
    private Statement parseDeclarationOrExpression(Tokens tokens) {
        var start = tokens.peek();
        boolean certain = start.is(TokenType.PRIMITIVE, TokenType.AUTO);
        if (certain || start.is(TokenType.IDENTIFIER, TokenType.LPAREN, TokenType.AMP)) {
            int mark = tokens.mark();
            try {
                parseType(tokens);
                tokens.peek(TokenType.IDENTIFIER);
                if (tokens.matchesAhead(1, TokenType.EQUALS, TokenType.SEMICOLON, TokenType.LPAREN) || certain) {
                    tokens.reset(mark);
                    return parseDeclaration(tokens, start.span());
                }
            } catch (ParseException e) {
                if (certain) {
                    throw e;
                }
            }
            tokens.reset(mark);
        }
        var expression = parseExpression(tokens);
        var end = tokens.next(TokenType.SEMICOLON);
        return new ExpressionStatement(expression, start.span().to(end.span()));
    }

    private Statement parseDeclaration(Tokens tokens, Span start) {
        int mark = tokens.mark();
        var type = parseType(tokens);
        var name = tokens.next(TokenType.IDENTIFIER);
        if (tokens.matches(TokenType.LPAREN)) {
            tokens.reset(mark);
            return parseNestedFunction(tokens, false, start);
        }
        Optional<Expression> initializer = Optional.empty();
        if (tokens.accept(TokenType.EQUALS)) {
            initializer = Optional.of(inferStructType(parseExpression(tokens), Optional.of(type)));
        }
        var end = tokens.next(TokenType.SEMICOLON);
        return new LetStatement(name.image(), Optional.of(type), initializer, true, start.to(end.span()));
    }

    private NestedFunction parseNestedFunction(Tokens tokens, boolean isStatic, Span start) {
        var returnType = parseType(tokens);
        var name = tokens.next(TokenType.IDENTIFIER).image();
        var parameters = parseParameters(tokens);
        var body = parseBlock(tokens);
        return new NestedFunction(name, parameters, returnType, body, isStatic, List.of(), start.to(body.span()));
    }

    // ---- expressions

    public Expression parseExpression(Tokens tokens) {
        return parseAssignment(tokens);
    }

    private Expression parseAssignment(Tokens tokens) {
        var expr = parseTernary(tokens);

        var operator = assignmentOperator(tokens.peek().type());
        if (operator.isPresent()) {
            var token = tokens.next();
            if (!isAssignable(expr)) {
                throw new ParseException(new ParseError("invalid assignment target",
                        List.of("variable", "field", "index", "dereference"), token.describe(), expr.span()));
            }
            var right = parseAssignment(tokens);
            expr = new Binary(expr, operator.get(), right, expr.span().to(right.span()));
        }
        return expr;
    }

    static boolean isAssignable(Expression expression) {
        return expression instanceof Identifier || expression instanceof FieldAccess || expression instanceof Index
                || (expression instanceof Unary u && u.operator() == UnaryOperator.DEREF);
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

    private Expression parseTernary(Tokens tokens) {
        var condition = parseRange(tokens);
        if (tokens.matches(TokenType.QUESTION)) {
            tokens.next();
            var thenValue = parseExpression(tokens);
            tokens.next(TokenType.COLON);
            var elseValue = parseTernary(tokens);
            return new Ternary(condition, thenValue, elseValue, condition.span().to(elseValue.span()));
        }
        return condition;
    }

    private Expression parseRange(Tokens tokens) {
        var start = tokens.peek();
        if (start.is(TokenType.DOT_DOT, TokenType.DOT_DOT_EQUALS)) {
            tokens.next();
            Optional<Expression> end = startsExpression(tokens.peek())
                    ? Optional.of(parseBinary(tokens, BinaryOperator.OR.precedence))
                    : Optional.empty();
            return new Range(Optional.empty(), end, start.type() == TokenType.DOT_DOT_EQUALS,
                    start.span().to(tokens.previous().span()));
        }
        var expr = parseBinary(tokens, BinaryOperator.OR.precedence);
        if (tokens.matches(TokenType.DOT_DOT, TokenType.DOT_DOT_EQUALS)) {
            boolean inclusive = tokens.next().type() == TokenType.DOT_DOT_EQUALS;
            Optional<Expression> end = startsExpression(tokens.peek())
                    ? Optional.of(parseBinary(tokens, BinaryOperator.OR.precedence))
                    : Optional.empty();
            return new Range(Optional.of(expr), end, inclusive, expr.span().to(tokens.previous().span()));
        }
        return expr;
    }

    static boolean startsExpression(Token token) {
        return token.is(TokenType.INT_LITERAL, TokenType.FLOAT_LITERAL, TokenType.STRING_LITERAL,
                TokenType.CHAR_LITERAL, TokenType.TRUE, TokenType.FALSE, TokenType.NULL, TokenType.IDENTIFIER,
                TokenType.LPAREN, TokenType.LBRACKET, TokenType.LBRACE, TokenType.AT, TokenType.BANG,
                TokenType.MINUS, TokenType.STAR, TokenType.AMP, TokenType.PLUS_PLUS, TokenType.MINUS_MINUS,
                TokenType.SIZEOF, TokenType.DOT_DOT, TokenType.DOT_DOT_EQUALS);
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

    // precedence climbing over the left-associative binary operators
    private Expression parseBinary(Tokens tokens, int minPrecedence) {
        var left = parseUnary(tokens);

        while (true) {
            var operator = binaryOperator(tokens.peek().type());
            if (operator.isEmpty() || operator.get().precedence < minPrecedence) {
                return left;
            }
            tokens.next();
            var right = parseBinary(tokens, operator.get().precedence + 1);
            left = new Binary(left, operator.get(), right, left.span().to(right.span()));
        }
    }

    private Expression parseUnary(Tokens tokens) {
        var token = tokens.peek();

        var operator = switch (token.type()) {
            case BANG -> UnaryOperator.NOT;
            case MINUS -> UnaryOperator.NEG;
            case STAR -> UnaryOperator.DEREF;
            case PLUS_PLUS -> UnaryOperator.PRE_INC;
            case MINUS_MINUS -> UnaryOperator.PRE_DEC;
            case AMP -> tokens.matchesAhead(1, TokenType.VAR) ? UnaryOperator.REF_MUT : UnaryOperator.REF;
            default -> null;
        };
        if (operator != null) {
            tokens.next();
            if (operator == UnaryOperator.REF_MUT) {
                tokens.next(TokenType.VAR);
            }
            var operand = parseUnary(tokens);
            return new Unary(operator, operand, token.span().to(operand.span()));
        }
        if (token.type() == TokenType.SIZEOF) {
            tokens.next();
            tokens.next(TokenType.LPAREN);
            var type = parseType(tokens);
            var end = tokens.next(TokenType.RPAREN);
            return new Sizeof(type, token.span().to(end.span()));
        }
        if (token.type() == TokenType.LPAREN) {
            var cast = tryCast(tokens);
            if (cast.isPresent()) {
                return cast.get();
            }
        }
        return parsePostfix(tokens, parsePrimary(tokens));
    }

    /**
     * Ordered trial for {@code (Type)(expr)} and compound literals {@code (Type){ .f = v }}. A
     * parenthesized type that can only be a type also casts a plain unary operand, as in
     * {@code (int)x}. On any mismatch the cursor is restored and nothing is consumed.
     */
    private Optional<Expression> tryCast(Tokens tokens) {
        int mark = tokens.mark();
        var start = tokens.next(TokenType.LPAREN);
        try {
            var type = parseType(tokens);
            tokens.next(TokenType.RPAREN);
            boolean certainlyType = !(type instanceof NamedType named && named.arguments().isEmpty());
            if (tokens.matches(TokenType.LPAREN)) {
                var operand = parsePostfix(tokens, parsePrimary(tokens));
                return Optional.of(new Cast(operand, type, start.span().to(operand.span())));
            }
            if (tokens.matches(TokenType.LBRACE)) {
                var init = parseStructInit(tokens, type);
                return Optional.of(parsePostfix(tokens, init));
            }
            if (certainlyType && startsExpression(tokens.peek())) {
                var operand = parseUnary(tokens);
                return Optional.of(new Cast(operand, type, start.span().to(operand.span())));
            }
        } catch (ParseException e) {
            logger.trace("not a cast at {}: {}", start.span(), e.getMessage());
        }
        tokens.reset(mark);
        return Optional.empty();
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
                    var index = parseExpression(tokens);
                    var end = tokens.next(TokenType.RBRACKET);
                    expression = new Index(expression, index, expression.span().to(end.span()));
                }
                case DOT -> {
                    tokens.next();
                    expression = parseMember(tokens, expression);
                }
                case ARROW -> {
                    tokens.next();
                    var deref = new Unary(UnaryOperator.DEREF, expression, expression.span());
                    expression = parseMember(tokens, deref);
                }
                case PLUS_PLUS, MINUS_MINUS -> {
                    tokens.next();
                    var operator = token.type() == TokenType.PLUS_PLUS ? UnaryOperator.POST_INC : UnaryOperator.POST_DEC;
                    expression = new Unary(operator, expression, expression.span().to(token.span()));
                }
                case QUESTION -> {
                    if (startsExpression(tokens.peek(1)) && ternaryColonFollows(tokens)) {
                        return expression;
                    }
                    tokens.next();
                    expression = new ErrorPropagation(expression, expression.span().to(token.span()));
                }
                default -> {
                    return expression;
                }
            }
        }
    }

    private static boolean ternaryColonFollows(Tokens tokens) {
        return ternaryColon(tokens, 1) >= 0;
    }

    /**
     * Finds the {@code :} that pairs with a {@code ?} just before {@code ahead}, at the same
     * nesting depth and before the expression ends. A nested {@code ?} followed by an expression
     * is a conditional when it finds its own colon; otherwise it is error propagation.
     *
     * @return the lookahead offset of the colon, or -1
     */
    private static int ternaryColon(Tokens tokens, int ahead) {
        int depth = 0;
        for (int i = ahead; ; i++) {
            var token = tokens.peek(i);
            switch (token.type()) {
                case LPAREN, LBRACKET, LBRACE -> depth++;
                case RPAREN, RBRACKET, RBRACE -> {
                    if (depth == 0) {
                        return -1;
                    }
                    depth--;
                }
                case QUESTION -> {
                    if (depth == 0 && startsExpression(tokens.peek(i + 1))) {
                        int nested = ternaryColon(tokens, i + 1);
                        if (nested >= 0) {
                            i = nested;
                        }
                    }
                }
                case COLON -> {
                    if (depth == 0) {
                        return i;
                    }
                }
                case EOF -> {
                    return -1;
                }
                case SEMICOLON, COMMA -> {
                    if (depth == 0) {
                        return -1;
                    }
                }
                default -> {
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
                    return new MethodCall(target, member.image(), arguments, target.span().to(tokens.previous().span()));
                }
                return new FieldAccess(target, member.image(), target.span().to(member.span()));
            }
            case INT_LITERAL -> {
                tokens.next();
                return new FieldAccess(target, member.image(), target.span().to(member.span()));
            }
            case FLOAT_LITERAL -> {
                // t.0.1 lexes its indices as one float literal
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

    private List<Expression> parseArguments(Tokens tokens) {
        tokens.next(TokenType.LPAREN);
        List<Expression> arguments = new ArrayList<>();
        while (!tokens.matches(TokenType.RPAREN)) {
            arguments.add(parseExpression(tokens));
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
                yield new FloatLiteral(Double.parseDouble(token.image().replace("_", "")), token.span());
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
            case NULL -> {
                tokens.next();
                yield new NullLiteral(token.span());
            }
            case IDENTIFIER -> {
                tokens.next();
                if (MacroRegistry.isMacroName(token.image())) {
                    yield parseMacroCall(tokens, token);
                }
                yield new Identifier(token.image(), token.span());
            }
            case LPAREN -> parseParenthesized(tokens);
            case LBRACKET -> parseArrayLiteral(tokens);
            case LBRACE -> parseStructInit(tokens, AutoType.INSTANCE);
            case AT -> parseTypeScoped(tokens);
            default -> throw tokens.unexpected("expression");
        };
    }

    static long parseInteger(Token token) {
        var image = token.image().replace("_", "");
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

    private Expression parseParenthesized(Tokens tokens) {
        var start = tokens.next(TokenType.LPAREN);
        if (tokens.matches(TokenType.RPAREN)) {
            var end = tokens.next();
            return new TupleLiteral(List.of(), start.span().to(end.span()));
        }
        var first = parseExpression(tokens);
        if (tokens.matches(TokenType.COMMA)) {
            List<Expression> elements = new ArrayList<>();
            elements.add(first);
            while (tokens.accept(TokenType.COMMA)) {
                if (tokens.matches(TokenType.RPAREN)) {
                    break;
                }
                elements.add(parseExpression(tokens));
            }
            var end = tokens.next(TokenType.RPAREN);
            return new TupleLiteral(elements, start.span().to(end.span()));
        }
        tokens.next(TokenType.RPAREN);
        return first;
    }

    // <> [a, b, c] | [value; count]
    private Expression parseArrayLiteral(Tokens tokens) {
        var start = tokens.next(TokenType.LBRACKET);
        if (tokens.matches(TokenType.RBRACKET)) {
            var end = tokens.next();
            return new ArrayLiteral(List.of(), start.span().to(end.span()));
        }
        var first = parseExpression(tokens);
        if (tokens.accept(TokenType.SEMICOLON)) {
            var count = parseExpression(tokens);
            var end = tokens.next(TokenType.RBRACKET);
            return new ArrayRepeat(first, count, start.span().to(end.span()));
        }
        List<Expression> elements = new ArrayList<>();
        elements.add(first);
        while (tokens.accept(TokenType.COMMA)) {
            if (tokens.matches(TokenType.RBRACKET)) {
                break;
            }
            elements.add(parseExpression(tokens));
        }
        var end = tokens.next(TokenType.RBRACKET);
        return new ArrayLiteral(elements, start.span().to(end.span()));
    }

    // <> { .field = value, ... [,] }
    private StructInit parseStructInit(Tokens tokens, Type type) {
        var start = tokens.next(TokenType.LBRACE);
        List<FieldInit> fields = new ArrayList<>();
        while (!tokens.matches(TokenType.RBRACE)) {
            var dot = tokens.next(TokenType.DOT);
            var name = tokens.next(TokenType.IDENTIFIER).image();
            tokens.next(TokenType.EQUALS);
            var value = parseExpression(tokens);
            fields.add(new FieldInit(name, value, dot.span().to(value.span())));
            if (!tokens.matches(TokenType.RBRACE)) {
                tokens.next(TokenType.COMMA);
            }
        }
        var end = tokens.next(TokenType.RBRACE);
        return new StructInit(type, fields, start.span().to(end.span()));
    }

    private Expression parseMacroCall(Tokens tokens, Token name) {
        var used = switch (tokens.peek().type()) {
            case LPAREN -> MacroDelimiter.PARENTHESIS;
            case LBRACKET -> MacroDelimiter.BRACKET;
            case LBRACE -> MacroDelimiter.BRACE;
            default -> MacroDelimiter.NONE;
        };
        var defined = macros.delimiterOf(name.image());
        if (defined.isPresent() && defined.get() == MacroDelimiter.NONE) {
            used = MacroDelimiter.NONE;
        }
        if (defined.isPresent() && defined.get() != used) {
            diagnostics.add(new SemanticError(SemanticErrorKind.MACRO_DELIMITER_MISMATCH,
                    "macro " + name.image() + " is defined with " + describe(defined.get())
                            + " but invoked with " + describe(used),
                    name.span()));
        }
        if (used == MacroDelimiter.NONE) {
            return new MacroCall(name.image(), used, List.of(), name.span());
        }
        var arguments = collectDelimited(tokens);
        return new MacroCall(name.image(), used, arguments, name.span().to(tokens.previous().span()));
    }

    private static String describe(MacroDelimiter delimiter) {
        return delimiter == MacroDelimiter.NONE ? "no delimiter" : delimiter.open + delimiter.close;
    }

    /**
     * Consumes a balanced delimited group and returns the images of the tokens inside it.
     */
    static List<String> collectDelimited(Tokens tokens) {
        var open = tokens.next();
        List<String> images = new ArrayList<>();
        int depth = 1;
        while (true) {
            var token = tokens.peek();
            if (token.type() == TokenType.EOF) {
                throw tokens.unexpected(closing(open.type()).describe());
            }
            if (token.is(TokenType.LPAREN, TokenType.LBRACKET, TokenType.LBRACE)) {
                depth++;
            } else if (token.is(TokenType.RPAREN, TokenType.RBRACKET, TokenType.RBRACE)) {
                depth--;
                if (depth == 0) {
                    tokens.next(closing(open.type()));
                    return images;
                }
            }
            images.add(tokens.next().image());
        }
    }

    // <> @ path [ "(" generics ")" ] . member [ "(" arguments ")" ]
    private Expression parseTypeScoped(Tokens tokens) {
        var start = tokens.next(TokenType.AT);
        List<String> segments = new ArrayList<>();
        Type primitiveBase = null;
        if (tokens.matches(TokenType.PRIMITIVE)) {
            var primitive = tokens.next();
            primitiveBase = new PrimitiveType(Primitive.ofCrustyName(primitive.image()).orElseThrow());
        } else {
            segments.add(tokens.next(TokenType.IDENTIFIER).image());
        }
        while (tokens.matches(TokenType.DOT) && tokens.matchesAhead(1, TokenType.IDENTIFIER)) {
            tokens.next();
            segments.add(tokens.next().image());
        }

        // only a bare type name takes explicit generics, so @Vec.with_capacity(n) stays a call
        Optional<List<Type>> generics = Optional.empty();
        if (primitiveBase == null && segments.size() == 1 && tokens.matches(TokenType.LPAREN)) {
            generics = Optional.of(parseGenericList(tokens, TokenType.LPAREN));
            tokens.next(TokenType.DOT);
            segments.add(tokens.next(TokenType.IDENTIFIER).image());
        }

        int required = primitiveBase == null ? 2 : 1;
        if (segments.size() < required) {
            throw tokens.unexpected("'.' member");
        }
        var member = segments.remove(segments.size() - 1);
        var type = primitiveBase != null ? primitiveBase : new NamedType(List.copyOf(segments), List.of());

        if (generics.isPresent()) {
            List<Expression> arguments = tokens.matches(TokenType.LPAREN) ? parseArguments(tokens) : List.of();
            return new ExplicitGenericCall(type, generics.get(), member, arguments, start.span().to(tokens.previous().span()));
        }
        if (tokens.matches(TokenType.LPAREN)) {
            var arguments = parseArguments(tokens);
            return new TypeScopedCall(type, member, arguments, start.span().to(tokens.previous().span()));
        }
        return new TypeScopedPath(type, member, start.span().to(tokens.previous().span()));
    }

    /**
     * Explicit generic parameters: parentheses at the outermost level, brackets and parentheses
     * alternating with each level of nesting, as in {@code (T, Inner[U(V)])}.
     */
    private List<Type> parseGenericList(Tokens tokens, TokenType open) {
        var close = closing(open);
        var nested = open == TokenType.LPAREN ? TokenType.LBRACKET : TokenType.LPAREN;
        tokens.next(open);
        List<Type> types = new ArrayList<>();
        while (!tokens.matches(close)) {
            types.add(parseGenericParameter(tokens, nested));
            if (!tokens.matches(close)) {
                tokens.next(TokenType.COMMA);
            }
        }
        tokens.next(close);
        return types;
    }

    private Type parseGenericParameter(Tokens tokens, TokenType nested) {
        if (tokens.matches(TokenType.PRIMITIVE)) {
            return new PrimitiveType(Primitive.ofCrustyName(tokens.next().image()).orElseThrow());
        }
        List<String> path = new ArrayList<>();
        path.add(tokens.next(TokenType.IDENTIFIER).image());
        while (tokens.matches(TokenType.DOT) && tokens.matchesAhead(1, TokenType.IDENTIFIER)) {
            tokens.next();
            path.add(tokens.next().image());
        }
        List<Type> arguments = tokens.matches(nested) ? parseGenericList(tokens, nested) : List.of();
        return new NamedType(List.copyOf(path), arguments);
    }

    // ---- types

    // <> [const] base ( * | [N] | [] | ? )*
    public Type parseType(Tokens tokens) {
        boolean constPointer = tokens.accept(TokenType.CONST);
        var token = tokens.peek();

        Type type = switch (token.type()) {
            case PRIMITIVE -> {
                tokens.next();
                yield new PrimitiveType(Primitive.ofCrustyName(token.image()).orElseThrow());
            }
            case AUTO -> {
                tokens.next();
                yield AutoType.INSTANCE;
            }
            case AMP -> {
                tokens.next();
                boolean mutable = tokens.accept(TokenType.VAR);
                yield new ReferenceType(parseType(tokens), mutable);
            }
            case LPAREN -> {
                tokens.next();
                List<Type> elements = new ArrayList<>();
                elements.add(parseType(tokens));
                while (tokens.accept(TokenType.COMMA)) {
                    elements.add(parseType(tokens));
                }
                tokens.next(TokenType.RPAREN);
                if (elements.size() < 2) {
                    throw tokens.unexpected("','");
                }
                yield new TupleType(elements);
            }
            case IDENTIFIER -> {
                if (token.image().equals("fn") && tokens.matchesAhead(1, TokenType.LPAREN)) {
                    yield parseFunctionType(tokens);
                }
                yield parseNamedType(tokens);
            }
            default -> throw tokens.unexpected("type");
        };

        boolean first = true;
        while (true) {
            if (tokens.matches(TokenType.STAR)) {
                tokens.next();
                type = new PointerType(type, !(first && constPointer));
                first = false;
            } else if (tokens.matches(TokenType.LBRACKET) && tokens.matchesAhead(1, TokenType.RBRACKET)) {
                tokens.next();
                tokens.next();
                type = new SliceType(type);
            } else if (tokens.matches(TokenType.LBRACKET) && tokens.matchesAhead(1, TokenType.INT_LITERAL)
                    && tokens.matchesAhead(2, TokenType.RBRACKET)) {
                tokens.next();
                long size = parseInteger(tokens.next());
                tokens.next();
                type = new ArrayType(type, size);
            } else if (tokens.matches(TokenType.QUESTION)) {
                tokens.next();
                return new FallibleType(type);
            } else {
                return type;
            }
        }
    }

    private NamedType parseNamedType(Tokens tokens) {
        List<String> path = new ArrayList<>();
        path.add(tokens.next(TokenType.IDENTIFIER).image());
        while (tokens.matches(TokenType.DOT) && tokens.matchesAhead(1, TokenType.IDENTIFIER)) {
            tokens.next();
            path.add(tokens.next().image());
        }
        List<Type> arguments = new ArrayList<>();
        if (tokens.accept(TokenType.LT)) {
            arguments.add(parseType(tokens));
            while (tokens.accept(TokenType.COMMA)) {
                arguments.add(parseType(tokens));
            }
            tokens.nextCloseAngle();
        }
        return new NamedType(List.copyOf(path), List.copyOf(arguments));
    }

    // <> fn(Type, ...) [-> Type]
    private FunctionType parseFunctionType(Tokens tokens) {
        tokens.next(TokenType.IDENTIFIER);
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

}
