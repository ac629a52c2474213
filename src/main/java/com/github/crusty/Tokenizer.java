package com.github.crusty;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.crusty.error.LexError;
import com.github.crusty.error.ParseError;
import com.github.crusty.error.ParseException;
import com.github.crusty.error.Position;
import com.github.crusty.error.Span;

public class Tokenizer {

    private static final Logger logger = LoggerFactory.getLogger(Tokenizer.class);

    static final Set<String> PRIMITIVE_NAMES = Set.of(
            "int", "i8", "i16", "i32", "i64", "u8", "u16", "u32", "u64", "usize", "isize",
            "float", "f32", "f64", "bool", "char", "void");

    private final Dialect dialect;
    private final List<Pattern> patterns = new ArrayList<>();

    public Tokenizer() {
        this(Dialect.CRUSTY);
    }

    public Tokenizer(Dialect dialect) {
        this.dialect = dialect;

        List<StaticPattern> operators = new ArrayList<>();
        for (var tokenType : TokenType.values()) {
            if (tokenType.constantPattern != null && tokenType.kind == Kind.OPERATOR) {
                operators.add(new StaticPattern(tokenType.constantPattern, tokenType));
            }
        }
        // longest operator first so that "..=" wins over ".." and "."
        operators.sort(Comparator.comparingInt((StaticPattern p) -> p.pattern.length()).reversed());

        patterns.add(new CommentPattern());
        if (dialect == Dialect.RUST) {
            patterns.add(new LifetimePattern());
        }
        patterns.add(new CharPattern());
        patterns.add(new StringPattern());
        patterns.add(new NumberPattern());
        patterns.add(new IdentifierPattern());
        patterns.addAll(operators);
    }

    public Tokens tokenize(String source) {
        logger.debug("tokenizing {} characters as {}", source.length(), dialect);
        return new Tokens(new Scanner(source, dialect, patterns));
    }

    /**
     * Decodes the raw image of a string or character literal, quotes included.
     */
    public static String decode(String image) {
        var body = image.length() >= 2 ? image.substring(1, image.length() - 1) : "";
        var sb = new StringBuilder();
        for (int i = 0; i < body.length(); i++) {
            char c = body.charAt(i);
            if (c == '\\' && i + 1 < body.length()) {
                i++;
                sb.append(switch (body.charAt(i)) {
                    case 'n' -> '\n';
                    case 't' -> '\t';
                    case 'r' -> '\r';
                    case '0' -> '\0';
                    default -> body.charAt(i);
                });
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    public static String escape(String value, char quote) {
        var sb = new StringBuilder();
        for (char c : value.toCharArray()) {
            switch (c) {
                case '\n' -> sb.append("\\n");
                case '\t' -> sb.append("\\t");
                case '\r' -> sb.append("\\r");
                case '\0' -> sb.append("\\0");
                case '\\' -> sb.append("\\\\");
                default -> {
                    if (c == quote) {
                        sb.append('\\');
                    }
                    sb.append(c);
                }
            }
        }
        return sb.toString();
    }

    public enum Dialect {
        CRUSTY(Kind.KEYWORD_CRUSTY),
        RUST(Kind.KEYWORD_RUST);

        private final Map<String, TokenType> keywords = new HashMap<>();

        Dialect(Kind ownKeywords) {
            for (var type : TokenType.values()) {
                if (type.kind == Kind.KEYWORD_BOTH || type.kind == ownKeywords) {
                    keywords.put(type.constantPattern, type);
                }
            }
        }

        Optional<TokenType> keyword(String image) {
            if (this == CRUSTY && PRIMITIVE_NAMES.contains(image)) {
                return Optional.of(TokenType.PRIMITIVE);
            }
            return Optional.ofNullable(keywords.get(image));
        }
    }

    enum Kind {
        KEYWORD_BOTH,
        KEYWORD_CRUSTY,
        KEYWORD_RUST,
        OPERATOR,
        OTHER
    }

    public record Token(TokenType type, String image, Span span) {

        public boolean is(TokenType... types) {
            for (var t : types) {
                if (type == t) {
                    return true;
                }
            }
            return false;
        }

        public String describe() {
            return type == TokenType.EOF ? "end of input" : "'" + image + "'";
        }
    }

    public enum TokenType {
        LET("let", Kind.KEYWORD_BOTH),
        CONST("const", Kind.KEYWORD_BOTH),
        STATIC("static", Kind.KEYWORD_BOTH),
        IF("if", Kind.KEYWORD_BOTH),
        ELSE("else", Kind.KEYWORD_BOTH),
        WHILE("while", Kind.KEYWORD_BOTH),
        FOR("for", Kind.KEYWORD_BOTH),
        IN("in", Kind.KEYWORD_BOTH),
        LOOP("loop", Kind.KEYWORD_BOTH),
        RETURN("return", Kind.KEYWORD_BOTH),
        BREAK("break", Kind.KEYWORD_BOTH),
        CONTINUE("continue", Kind.KEYWORD_BOTH),
        STRUCT("struct", Kind.KEYWORD_BOTH),
        ENUM("enum", Kind.KEYWORD_BOTH),
        TRUE("true", Kind.KEYWORD_BOTH),
        FALSE("false", Kind.KEYWORD_BOTH),

        VAR("var", Kind.KEYWORD_CRUSTY),
        UNION("union", Kind.KEYWORD_CRUSTY),
        TYPEDEF("typedef", Kind.KEYWORD_CRUSTY),
        NAMESPACE("namespace", Kind.KEYWORD_CRUSTY),
        SWITCH("switch", Kind.KEYWORD_CRUSTY),
        CASE("case", Kind.KEYWORD_CRUSTY),
        DEFAULT("default", Kind.KEYWORD_CRUSTY),
        GOTO("goto", Kind.KEYWORD_CRUSTY),
        SIZEOF("sizeof", Kind.KEYWORD_CRUSTY),
        AUTO("auto", Kind.KEYWORD_CRUSTY),
        NULL("NULL", Kind.KEYWORD_CRUSTY),

        FN("fn", Kind.KEYWORD_RUST),
        PUB("pub", Kind.KEYWORD_RUST),
        MUT("mut", Kind.KEYWORD_RUST),
        IMPL("impl", Kind.KEYWORD_RUST),
        MATCH("match", Kind.KEYWORD_RUST),
        MOVE("move", Kind.KEYWORD_RUST),
        MOD("mod", Kind.KEYWORD_RUST),
        USE("use", Kind.KEYWORD_RUST),
        AS("as", Kind.KEYWORD_RUST),
        TYPE("type", Kind.KEYWORD_RUST),
        DYN("dyn", Kind.KEYWORD_RUST),

        PRIMITIVE,
        IDENTIFIER,
        LIFETIME,
        INT_LITERAL,
        FLOAT_LITERAL,
        STRING_LITERAL,
        CHAR_LITERAL,

        LPAREN("("), RPAREN(")"),
        LBRACE("{"), RBRACE("}"),
        LBRACKET("["), RBRACKET("]"),
        SEMICOLON(";"), COMMA(","),
        DOT("."), DOT_DOT(".."), DOT_DOT_EQUALS("..="),
        COLON(":"), COLON_COLON("::"),
        ARROW("->"), FAT_ARROW("=>"),
        HASH("#"), AT("@"), QUESTION("?"), TILDE("~"), DOLLAR("$"),

        PLUS("+"), MINUS("-"), STAR("*"), SLASH("/"), PERCENT("%"),
        PLUS_PLUS("++"), MINUS_MINUS("--"),
        EQUALS("="), EQUALS_EQUALS("=="), NOT_EQUALS("!="),
        LT("<"), GT(">"), LE("<="), GE(">="),
        AND_AND("&&"), OR_OR("||"), BANG("!"),
        AMP("&"), PIPE("|"), CARET("^"), SHL("<<"), SHR(">>"),
        PLUS_EQUALS("+="), MINUS_EQUALS("-="), STAR_EQUALS("*="), SLASH_EQUALS("/="), PERCENT_EQUALS("%="),
        AMP_EQUALS("&="), PIPE_EQUALS("|="), CARET_EQUALS("^="), SHL_EQUALS("<<="), SHR_EQUALS(">>="),

        EOF;

        final String constantPattern;
        final Kind kind;

        private TokenType() {
            this.constantPattern = null;
            this.kind = Kind.OTHER;
        }
        private TokenType(String constantPattern) {
            this(constantPattern, Kind.OPERATOR);
        }
        private TokenType(String constantPattern, Kind kind) {
            this.constantPattern = constantPattern;
            this.kind = kind;
        }

        public String describe() {
            return constantPattern != null ? "'" + constantPattern + "'" : name().toLowerCase().replace('_', ' ');
        }
    }

    record DocComment(String text, Position position) {}

    /**
     * Character-level state of one tokenization: the source, the read offset, and the errors
     * and doc comments found so far.
     */
    static class Scanner {
        final String source;
        final Dialect dialect;
        final List<Pattern> patterns;
        final List<LexError> errors = new ArrayList<>();
        final List<DocComment> docComments = new ArrayList<>();
        private final int[] lineStarts;
        int index;

        Scanner(String source, Dialect dialect, List<Pattern> patterns) {
            this.source = source;
            this.dialect = dialect;
            this.patterns = patterns;
            List<Integer> starts = new ArrayList<>();
            starts.add(0);
            for (int i = 0; i < source.length(); i++) {
                if (source.charAt(i) == '\n') {
                    starts.add(i + 1);
                }
            }
            lineStarts = starts.stream().mapToInt(Integer::intValue).toArray();
        }

        Position position(int offset) {
            int line = Arrays.binarySearch(lineStarts, offset);
            if (line < 0) {
                line = -line - 2;
            }
            return new Position(line + 1, offset - lineStarts[line] + 1);
        }

        Span span(int start, int end) {
            return new Span(position(start), position(end));
        }

        Token token(TokenType type, int start, int end) {
            return new Token(type, source.substring(start, end), span(start, end));
        }

        boolean atEnd() {
            return index >= source.length();
        }

        char charAt(int offset) {
            return offset < source.length() ? source.charAt(offset) : '\0';
        }

        void error(LexError.Kind kind, String message, int start, int end) {
            errors.add(new LexError(kind, message, span(start, end)));
        }

        Token scan() {
            while (true) {
                while (!atEnd() && Character.isWhitespace(source.charAt(index))) {
                    index++;
                }
                if (atEnd()) {
                    return token(TokenType.EOF, index, index);
                }

                Token matched = null;
                boolean consumed = false;
                for (var pattern : patterns) {
                    int before = index;
                    var result = pattern.match(this);
                    if (result.isPresent()) {
                        matched = result.get();
                        break;
                    }
                    if (index != before) {
                        // a comment: consumed but produced nothing
                        consumed = true;
                        break;
                    }
                }
                if (matched != null) {
                    return matched;
                }
                if (!consumed) {
                    error(LexError.Kind.UNEXPECTED_CHARACTER,
                            "unexpected character '" + source.charAt(index) + "'", index, index + 1);
                    index++;
                }
            }
        }
    }

    interface Pattern {
        Optional<Token> match(Scanner scanner);
    }

    static class StaticPattern implements Pattern {
        final String pattern;
        final TokenType tokenType;

        StaticPattern(String pattern, TokenType tokenType) {
            this.pattern = pattern;
            this.tokenType = tokenType;
        }

        @Override
        public Optional<Token> match(Scanner scanner) {
            if (scanner.source.startsWith(pattern, scanner.index)) {
                int start = scanner.index;
                scanner.index += pattern.length();
                return Optional.of(scanner.token(tokenType, start, scanner.index));
            } else {
                return Optional.empty();
            }
        }
    }

    static class NumberPattern implements Pattern {
        @Override
        public Optional<Token> match(Scanner scanner) {
            int index = scanner.index;
            if (!Character.isDigit(scanner.charAt(index))) {
                return Optional.empty();
            }
            int start = index;
            var type = TokenType.INT_LITERAL;
            if (scanner.charAt(index) == '0' && (scanner.charAt(index + 1) == 'x' || scanner.charAt(index + 1) == 'X')) {
                index += 2;
                while (Character.digit(scanner.charAt(index), 16) >= 0 || scanner.charAt(index) == '_') {
                    index++;
                }
            } else {
                while (Character.isDigit(scanner.charAt(index)) || scanner.charAt(index) == '_') {
                    index++;
                }
                if (scanner.charAt(index) == '.' && Character.isDigit(scanner.charAt(index + 1))) {
                    type = TokenType.FLOAT_LITERAL;
                    index++;
                    while (Character.isDigit(scanner.charAt(index)) || scanner.charAt(index) == '_') {
                        index++;
                    }
                }
                char e = scanner.charAt(index);
                if (e == 'e' || e == 'E') {
                    int exponent = index + 1;
                    if (scanner.charAt(exponent) == '+' || scanner.charAt(exponent) == '-') {
                        exponent++;
                    }
                    if (Character.isDigit(scanner.charAt(exponent))) {
                        type = TokenType.FLOAT_LITERAL;
                        index = exponent;
                        while (Character.isDigit(scanner.charAt(index))) {
                            index++;
                        }
                    }
                }
            }
            if (scanner.dialect == Dialect.RUST) {
                // literal suffixes such as 10u8 or 1.5f32 stay part of the image
                int suffix = index;
                while (Character.isLetterOrDigit(scanner.charAt(suffix))) {
                    suffix++;
                }
                var suffixText = scanner.source.substring(index, suffix);
                if (PRIMITIVE_NAMES.contains(suffixText)) {
                    if (suffixText.startsWith("f")) {
                        type = TokenType.FLOAT_LITERAL;
                    }
                    index = suffix;
                }
            }
            scanner.index = index;
            return Optional.of(scanner.token(type, start, index));
        }
    }

    static class IdentifierPattern implements Pattern {
        @Override
        public Optional<Token> match(Scanner scanner) {
            int index = scanner.index;
            char c = scanner.charAt(index);
            if (!(Character.isLetter(c) || c == '_')) {
                return Optional.empty();
            }
            int start = index;
            while (Character.isLetterOrDigit(scanner.charAt(index)) || scanner.charAt(index) == '_') {
                index++;
            }
            scanner.index = index;
            var image = scanner.source.substring(start, index);
            var type = scanner.dialect.keyword(image).orElse(TokenType.IDENTIFIER);
            return Optional.of(scanner.token(type, start, index));
        }
    }

    /**
     * Shared body scanning for quoted literals. Returns the offset after the closing quote, or
     * -1 when the literal is not terminated.
     */
    static int scanQuoted(Scanner scanner, int start, char quote, boolean singleLine) {
        int index = start + 1;
        while (index < scanner.source.length()) {
            char cur = scanner.source.charAt(index);
            if (cur == quote) {
                return index + 1;
            }
            if (singleLine && cur == '\n') {
                return -1;
            }
            if (cur == '\\') {
                char escaped = scanner.charAt(index + 1);
                if (scanner.dialect == Dialect.CRUSTY && "ntr0\\'\"".indexOf(escaped) < 0) {
                    scanner.error(LexError.Kind.INVALID_ESCAPE,
                            "invalid escape sequence '\\" + escaped + "'", index, index + 2);
                }
                index += 2;
                continue;
            }
            index++;
        }
        return -1;
    }

    static class StringPattern implements Pattern {
        @Override
        public Optional<Token> match(Scanner scanner) {
            int start = scanner.index;
            if (scanner.charAt(start) != '"') {
                return Optional.empty();
            }
            int end = scanQuoted(scanner, start, '"', false);
            if (end < 0) {
                scanner.error(LexError.Kind.UNTERMINATED_STRING, "unterminated string literal",
                        start, scanner.source.length());
                scanner.index = scanner.source.length();
                return Optional.of(new Token(TokenType.STRING_LITERAL,
                        scanner.source.substring(start) + "\"", scanner.span(start, scanner.index)));
            }
            scanner.index = end;
            return Optional.of(scanner.token(TokenType.STRING_LITERAL, start, end));
        }
    }

    static class CharPattern implements Pattern {
        @Override
        public Optional<Token> match(Scanner scanner) {
            int start = scanner.index;
            if (scanner.charAt(start) != '\'') {
                return Optional.empty();
            }
            int end = scanQuoted(scanner, start, '\'', true);
            if (end < 0) {
                int lineEnd = scanner.source.indexOf('\n', start);
                lineEnd = lineEnd < 0 ? scanner.source.length() : lineEnd;
                scanner.error(LexError.Kind.UNTERMINATED_STRING, "unterminated character literal", start, lineEnd);
                scanner.index = lineEnd;
                return Optional.of(new Token(TokenType.CHAR_LITERAL, "' '", scanner.span(start, lineEnd)));
            }
            scanner.index = end;
            return Optional.of(scanner.token(TokenType.CHAR_LITERAL, start, end));
        }
    }

    static class LifetimePattern implements Pattern {
        @Override
        public Optional<Token> match(Scanner scanner) {
            int start = scanner.index;
            char first = scanner.charAt(start + 1);
            if (scanner.charAt(start) != '\'' || !(Character.isLetter(first) || first == '_')
                    || scanner.charAt(start + 2) == '\'') {
                return Optional.empty();
            }
            int index = start + 1;
            while (Character.isLetterOrDigit(scanner.charAt(index)) || scanner.charAt(index) == '_') {
                index++;
            }
            scanner.index = index;
            return Optional.of(scanner.token(TokenType.LIFETIME, start, index));
        }
    }

    static class CommentPattern implements Pattern {
        @Override
        public Optional<Token> match(Scanner scanner) {
            int start = scanner.index;
            var source = scanner.source;
            if (source.startsWith("//", start)) {
                int end = source.indexOf('\n', start);
                end = end < 0 ? source.length() : end;
                var text = source.substring(start, end);
                if ((text.startsWith("///") && !text.startsWith("////")) || text.startsWith("//!")) {
                    scanner.docComments.add(new DocComment(text.substring(3).strip(), scanner.position(start)));
                }
                scanner.index = end;
            } else if (source.startsWith("/*", start)) {
                int end = source.indexOf("*/", start + 2);
                if (end < 0) {
                    scanner.error(LexError.Kind.UNTERMINATED_COMMENT, "unterminated block comment", start, source.length());
                    scanner.index = source.length();
                    return Optional.empty();
                }
                if (source.startsWith("/**", start) && end > start + 2) {
                    var body = source.substring(start + 3, end);
                    body.lines()
                            .map(l -> l.strip().startsWith("*") ? l.strip().substring(1) : l)
                            .map(String::strip)
                            .filter(l -> !l.isEmpty())
                            .forEach(l -> scanner.docComments.add(new DocComment(l, scanner.position(start))));
                }
                scanner.index = end + 2;
            }
            return Optional.empty();
        }
    }

    /**
     * Lazily scanned token stream. Tokens are pulled from the source on demand and buffered, so
     * lookahead, {@link #mark()}/{@link #reset(int)} and {@link #restart()} are cheap.
     */
    public static class Tokens {
        private final Scanner scanner;
        private final List<Token> buffer = new ArrayList<>();
        // tokens split by nextCloseAngle, in order, so that reset can join them again
        private final List<Split> splits = new ArrayList<>();
        private int index;

        private record Split(int position, Token original) {}

        Tokens(Scanner scanner) {
            this.scanner = scanner;
        }

        private Token at(int position) {
            while (buffer.size() <= position) {
                if (!buffer.isEmpty() && buffer.get(buffer.size() - 1).type() == TokenType.EOF) {
                    return buffer.get(buffer.size() - 1);
                }
                buffer.add(scanner.scan());
            }
            return buffer.get(position);
        }

        public Token next() {
            var token = at(index);
            if (token.type() != TokenType.EOF) {
                index++;
            }
            return token;
        }

        public Token peek() {
            return at(index);
        }

        public Token peek(int ahead) {
            return at(index + ahead);
        }

        public Token previous() {
            return index == 0 ? at(0) : buffer.get(index - 1);
        }

        public boolean matches(TokenType... types) {
            return peek().is(types);
        }

        public boolean matchesAhead(int ahead, TokenType... types) {
            return peek(ahead).is(types);
        }

        public Token peek(TokenType type) {
            var token = peek();
            if (token.type() != type) {
                throw unexpected(type.describe());
            }
            return token;
        }

        public Token next(TokenType type) {
            var token = peek(type);
            next();
            return token;
        }

        public boolean accept(TokenType type) {
            if (matches(type)) {
                next();
                return true;
            }
            return false;
        }

        public ParseException unexpected(String... expected) {
            var token = peek();
            var message = "expected " + String.join(" or ", expected) + " but got " + token.describe();
            return new ParseException(new ParseError(message, List.of(expected), token.describe(), token.span()));
        }

        /**
         * Splits a leading {@code >} off a {@code >>}, {@code >=} or {@code >>=} token so that
         * nested generic argument lists can be closed one at a time.
         */
        public void nextCloseAngle() {
            var token = peek();
            if (token.type() == TokenType.GT) {
                next();
                return;
            }
            TokenType rest = switch (token.type()) {
                case SHR -> TokenType.GT;
                case GE -> TokenType.EQUALS;
                case SHR_EQUALS -> TokenType.GE;
                default -> throw unexpected(TokenType.GT.describe());
            };
            var start = token.span().start();
            var restStart = new Position(start.line(), start.column() + 1);
            splits.add(new Split(index, token));
            buffer.set(index, new Token(TokenType.GT, ">", new Span(start, restStart)));
            buffer.add(index + 1, new Token(rest, token.image().substring(1), new Span(restStart, token.span().end())));
            index++;
        }

        public int mark() {
            return index;
        }

        /**
         * Moves the cursor back to {@code mark}. Splits made by {@link #nextCloseAngle()} at or
         * after the mark are undone.
         */
        public void reset(int mark) {
            while (!splits.isEmpty() && splits.get(splits.size() - 1).position() >= mark) {
                var split = splits.remove(splits.size() - 1);
                buffer.remove(split.position() + 1);
                buffer.set(split.position(), split.original());
            }
            this.index = mark;
        }

        public void restart() {
            reset(0);
        }

        public boolean atEnd() {
            return peek().type() == TokenType.EOF;
        }

        /**
         * Scans to the end of input without moving the cursor and returns every token, EOF
         * included.
         */
        public List<Token> all() {
            int i = 0;
            while (at(i).type() != TokenType.EOF) {
                i++;
            }
            return List.copyOf(buffer.subList(0, i + 1));
        }

        public List<LexError> errors() {
            return List.copyOf(scanner.errors);
        }

        public List<String> docComments() {
            return scanner.docComments.stream().map(DocComment::text).toList();
        }

        /**
         * Doc comments that appear before the first token of the input.
         */
        public List<String> leadingDocComments() {
            var first = at(0).span().start();
            return scanner.docComments.stream()
                    .filter(d -> d.position().compareTo(first) < 0 || at(0).type() == TokenType.EOF)
                    .map(DocComment::text)
                    .toList();
        }

        public Dialect dialect() {
            return scanner.dialect;
        }
    }

}
