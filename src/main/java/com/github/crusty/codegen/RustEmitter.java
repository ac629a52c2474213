package com.github.crusty.codegen;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.crusty.Tokenizer;
import com.github.crusty.error.CodeGenException;
import com.github.crusty.error.ParseException;
import com.github.crusty.parser.CompilationUnit;
import com.github.crusty.parser.CompilationUnit.ArrayLiteral;
import com.github.crusty.parser.CompilationUnit.ArrayRepeat;
import com.github.crusty.parser.CompilationUnit.AutoType;
import com.github.crusty.parser.CompilationUnit.Binary;
import com.github.crusty.parser.CompilationUnit.BinaryOperator;
import com.github.crusty.parser.CompilationUnit.Block;
import com.github.crusty.parser.CompilationUnit.BoolLiteral;
import com.github.crusty.parser.CompilationUnit.BreakStatement;
import com.github.crusty.parser.CompilationUnit.Call;
import com.github.crusty.parser.CompilationUnit.CaptureMode;
import com.github.crusty.parser.CompilationUnit.Cast;
import com.github.crusty.parser.CompilationUnit.CharLiteral;
import com.github.crusty.parser.CompilationUnit.ConstDeclaration;
import com.github.crusty.parser.CompilationUnit.ContinueStatement;
import com.github.crusty.parser.CompilationUnit.EnumDefinition;
import com.github.crusty.parser.CompilationUnit.ErrorPropagation;
import com.github.crusty.parser.CompilationUnit.ExplicitGenericCall;
import com.github.crusty.parser.CompilationUnit.Expression;
import com.github.crusty.parser.CompilationUnit.ExpressionStatement;
import com.github.crusty.parser.CompilationUnit.FieldAccess;
import com.github.crusty.parser.CompilationUnit.FloatLiteral;
import com.github.crusty.parser.CompilationUnit.ForInStatement;
import com.github.crusty.parser.CompilationUnit.ForStatement;
import com.github.crusty.parser.CompilationUnit.FunctionDeclaration;
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
import com.github.crusty.parser.CompilationUnit.Primitive;
import com.github.crusty.parser.CompilationUnit.PrimitiveType;
import com.github.crusty.parser.CompilationUnit.Range;
import com.github.crusty.parser.CompilationUnit.ReferenceType;
import com.github.crusty.parser.CompilationUnit.ReturnStatement;
import com.github.crusty.parser.CompilationUnit.Sizeof;
import com.github.crusty.parser.CompilationUnit.Statement;
import com.github.crusty.parser.CompilationUnit.StaticDeclaration;
import com.github.crusty.parser.CompilationUnit.StringLiteral;
import com.github.crusty.parser.CompilationUnit.StructDefinition;
import com.github.crusty.parser.CompilationUnit.StructInit;
import com.github.crusty.parser.CompilationUnit.SwitchStatement;
import com.github.crusty.parser.CompilationUnit.Ternary;
import com.github.crusty.parser.CompilationUnit.TupleLiteral;
import com.github.crusty.parser.CompilationUnit.Type;
import com.github.crusty.parser.CompilationUnit.TypeAlias;
import com.github.crusty.parser.CompilationUnit.TypeScopedCall;
import com.github.crusty.parser.CompilationUnit.TypeScopedPath;
import com.github.crusty.parser.CompilationUnit.Unary;
import com.github.crusty.parser.CompilationUnit.UnaryOperator;
import com.github.crusty.parser.CompilationUnit.UnionDefinition;
import com.github.crusty.parser.CompilationUnit.Visibility;
import com.github.crusty.parser.CompilationUnit.WhileStatement;
import com.github.crusty.parser.MacroRegistry;
import com.github.crusty.parser.Parser;

/**
 * Renders a tree as target-language source.
 */
class RustEmitter {
    private static final Logger logger = LoggerFactory.getLogger(RustEmitter.class);

    private static final Set<String> KEYWORDS = Set.of("as", "break", "const", "continue", "crate", "else", "enum",
            "extern", "false", "fn", "for", "if", "impl", "in", "let", "loop", "match", "mod", "move", "mut", "pub",
            "ref", "return", "self", "static", "struct", "super", "trait", "true", "type", "unsafe", "use", "where",
            "while", "async", "await", "dyn");

    // binding strength of the non-binary forms
    private static final int TERNARY = 0;
    private static final int RANGE = 2;
    private static final int PREFIX = 14;
    private static final int POSTFIX = 15;
    private static final int PRIMARY = 16;

    /**
     * A loop being emitted. {@code name} is the label the loop is emitted with, {@code
     * continueBlock} the labeled block a {@code continue} breaks out of when the loop is an
     * emulated three-clause loop.
     */
    private record LoopTarget(Optional<String> label, Optional<String> name, Optional<String> continueBlock) {}

    private final SourceWriter out;
    private final TypeNameMapper typeNames;
    private final boolean rangeLoops;

    private Deque<LoopTarget> loops = new ArrayDeque<>();
    private int emulatedLoops = 0;
    private Set<String> macroParameters = Set.of();

    RustEmitter(SourceWriter out, TypeNameMapper typeNames, boolean rangeLoops) {
        this.out = out;
        this.typeNames = typeNames;
        this.rangeLoops = rangeLoops;
    }

    String emit(CompilationUnit unit) {
        for (var doc : unit.docComments()) {
            out.emitLineNl(doc.isEmpty() ? "//!" : "//! " + doc);
        }
        if (!unit.docComments().isEmpty() && !unit.items().isEmpty()) {
            out.blankLine();
        }
        emitItems(unit.items());
        return out.toString();
    }

    private void emitItems(List<Item> items) {
        for (int i = 0; i < items.size(); i++) {
            if (i > 0) {
                out.blankLine();
            }
            emitItem(items.get(i));
        }
    }

    private void emitItem(Item item) {
        if (item instanceof FunctionDeclaration fd) {
            emitFunction(fd);
        } else if (item instanceof StructDefinition sd) {
            emitStruct(sd);
        } else if (item instanceof EnumDefinition ed) {
            out.emitLineNl("#[derive(Debug, Clone, Copy, PartialEq, Eq)]");
            out.emitLineNl("pub enum " + ed.name() + " {");
            out.indent();
            for (var variant : ed.variants()) {
                out.emitLineNl(variant.name() + variant.value().map(v -> " = " + v).orElse("") + ",");
            }
            out.outdent();
            out.emitLineNl("}");
        } else if (item instanceof TypeAlias ta) {
            out.emitLineNl("pub type " + ta.name() + " = " + typeNames.rust(ta.target()) + ";");
        } else if (item instanceof Namespace ns) {
            out.emitLineNl("pub mod " + ns.name() + " {");
            out.indent();
            emitItems(ns.items());
            out.outdent();
            out.emitLineNl("}");
        } else if (item instanceof Import im) {
            out.emitLineNl((im.exported() ? "pub use " : "use ") + String.join("::", im.path())
                    + im.alias().map(a -> " as " + a).orElse("") + ";");
        } else if (item instanceof StaticDeclaration sd) {
            out.emitLineNl("static " + (sd.mutable() ? "mut " : "") + sd.name() + ": " + typeNames.rust(sd.type())
                    + " = " + expr(sd.value()) + ";");
        } else if (item instanceof ConstDeclaration cd) {
            out.emitLineNl("pub " + constText(cd));
        } else if (item instanceof MacroDefinition md) {
            emitMacro(md);
        } else if (item instanceof UnionDefinition ud) {
            throw new CodeGenException("union " + ud.name() + " has no target-language form");
        } else if (item instanceof Include inc) {
            throw new CodeGenException("#include " + inc.header() + " has no target-language form");
        }
    }

    private void emitFunction(FunctionDeclaration fd) {
        var signature = (fd.visibility() == Visibility.PUBLIC ? "pub " : "") + "fn " + fd.name()
                + "(" + parameters(fd.parameters(), fd.body()) + ")" + returnSignature(fd.returnType());
        out.emitLineNl(signature + " {");
        emitBody(fd.body());
        out.emitLineNl("}");
    }

    private String parameters(List<Parameter> parameters, Block body) {
        return parameters.stream().map(p -> parameter(p, body)).collect(Collectors.joining(", "));
    }

    private String parameter(Parameter p, Block body) {
        var mut = AstScanner.assigns(body, p.name()) ? "mut " : "";
        if (p.name().equals("self")) {
            if (p.type() instanceof ReferenceType r) {
                return r.mutable() ? "&mut self" : "&self";
            }
            return mut + "self";
        }
        return mut + p.name() + ": " + typeNames.rustSignature(p.type());
    }

    private String returnSignature(Type returnType) {
        if (isVoid(returnType)) {
            return "";
        }
        return " -> " + typeNames.rustSignature(returnType);
    }

    private void emitStruct(StructDefinition sd) {
        out.emitLineNl("#[derive(Debug, Clone)]");
        if (sd.fields().isEmpty()) {
            out.emitLineNl("pub struct " + sd.name() + " {}");
        } else {
            out.emitLineNl("pub struct " + sd.name() + " {");
            out.indent();
            for (var field : sd.fields()) {
                out.emitLineNl("pub " + field.name() + ": " + typeNames.rust(field.type()) + ",");
            }
            out.outdent();
            out.emitLineNl("}");
        }
        if (sd.methods().isEmpty()) {
            return;
        }
        out.blankLine();
        out.emitLineNl("impl " + sd.name() + " {");
        out.indent();
        for (int i = 0; i < sd.methods().size(); i++) {
            if (i > 0) {
                out.blankLine();
            }
            emitFunction(sd.methods().get(i));
        }
        out.outdent();
        out.emitLineNl("}");
    }

    // ---- macros

    static String macroName(String crustyName) {
        var name = MacroRegistry.isMacroName(crustyName)
                ? crustyName.substring(2, crustyName.length() - 2).toLowerCase()
                : crustyName;
        return KEYWORDS.contains(name) ? name + "_macro" : name;
    }

    private void emitMacro(MacroDefinition md) {
        out.emitLineNl("macro_rules! " + macroName(md.name()) + " {");
        out.indent();
        var matcher = md.parameters().stream().map(p -> "$" + p + ":expr").collect(Collectors.joining(", "));
        var delimiter = md.delimiter() == MacroDelimiter.NONE ? MacroDelimiter.PARENTHESIS : md.delimiter();
        out.emitLineNl(delimiter.open + matcher + delimiter.close + " => {{");
        if (!md.body().isEmpty()) {
            out.indent();
            out.emitLineNl(macroBody(md));
            out.outdent();
        }
        out.emitLineNl("}};");
        out.outdent();
        out.emitLineNl("}");
    }

    private String macroBody(MacroDefinition md) {
        try {
            var tokens = new Tokenizer().tokenize(String.join(" ", md.body()));
            var parser = new Parser();
            var expression = parser.parseExpression(tokens);
            if (tokens.atEnd() && tokens.errors().isEmpty() && parser.diagnostics().isEmpty()) {
                macroParameters = Set.copyOf(md.parameters());
                try {
                    return expr(expression);
                } finally {
                    macroParameters = Set.of();
                }
            }
        } catch (ParseException e) {
            logger.debug("body of macro {} is not an expression: {}", md.name(), e.getMessage());
        }
        return SourceWriter.joinTokens(md.body().stream()
                .map(image -> md.parameters().contains(image) ? "$" + image : macroToken(image))
                .toList());
    }

    private static String macroToken(String image) {
        return MacroRegistry.isMacroName(image) ? macroName(image) + "!" : image;
    }

    // ---- statements

    private void emitBody(Block block) {
        out.indent();
        block.statements().forEach(this::emitStatement);
        out.outdent();
    }

    private void emitStatement(Statement statement) {
        if (statement instanceof Block b) {
            out.emitLineNl("{");
            emitBody(b);
            out.emitLineNl("}");
        } else if (statement instanceof LetStatement let) {
            out.emitLineNl(letText(let));
        } else if (statement instanceof ConstDeclaration cd) {
            out.emitLineNl(constText(cd));
        } else if (statement instanceof ExpressionStatement es) {
            out.emitLineNl(expressionStatement(es.expression()));
        } else if (statement instanceof ReturnStatement rs) {
            out.emitLineNl("return" + rs.value().map(v -> " " + expr(v)).orElse("") + ";");
        } else if (statement instanceof IfStatement is) {
            emitIf(is);
        } else if (statement instanceof WhileStatement ws) {
            emitLoop(ws.label(), "while " + expr(ws.condition()), ws.body());
        } else if (statement instanceof LoopStatement ls) {
            emitLoop(ls.label(), "loop", ls.body());
        } else if (statement instanceof ForInStatement fs) {
            emitLoop(fs.label(), "for " + fs.variable() + " in " + expr(fs.iterable()), fs.body());
        } else if (statement instanceof ForStatement fs) {
            emitFor(fs);
        } else if (statement instanceof SwitchStatement ss) {
            emitMatch(ss);
        } else if (statement instanceof BreakStatement bs) {
            out.emitLineNl(breakText(bs));
        } else if (statement instanceof ContinueStatement cs) {
            out.emitLineNl(continueText(cs));
        } else if (statement instanceof NestedFunction nf) {
            emitClosure(nf);
        } else if (statement instanceof GotoStatement gs) {
            throw new CodeGenException("goto " + gs.label() + " has no target-language form");
        }
    }

    private String letText(LetStatement let) {
        var type = let.type().filter(t -> !(t instanceof AutoType)).map(t -> ": " + typeNames.rust(t)).orElse("");
        return "let " + (let.mutable() ? "mut " : "") + let.name() + type
                + let.initializer().map(v -> " = " + expr(v)).orElse("") + ";";
    }

    private String constText(ConstDeclaration cd) {
        return "const " + cd.name() + ": " + typeNames.rust(cd.type().orElse(AutoType.INSTANCE)) + " = "
                + expr(cd.value()) + ";";
    }

    private String expressionStatement(Expression e) {
        if (e instanceof Unary u && u.operator().isIncrement()) {
            var step = u.operator() == UnaryOperator.PRE_INC || u.operator() == UnaryOperator.POST_INC ? " += 1;" : " -= 1;";
            return expr(u.operand()) + step;
        }
        return expr(e) + ";";
    }

    private void emitIf(IfStatement is) {
        out.emitLineNl("if " + expr(is.condition()) + " {");
        emitBody(is.thenBlock());
        var elseBlock = is.elseBlock();
        while (elseBlock.isPresent()) {
            var block = elseBlock.get();
            if (block.statements().size() == 1 && block.statements().get(0) instanceof IfStatement elseIf) {
                out.emitLineNl("} else if " + expr(elseIf.condition()) + " {");
                emitBody(elseIf.thenBlock());
                elseBlock = elseIf.elseBlock();
            } else {
                out.emitLineNl("} else {");
                emitBody(block);
                elseBlock = Optional.empty();
            }
        }
        out.emitLineNl("}");
    }

    private void emitLoop(Optional<String> label, String header, Block body) {
        loops.push(new LoopTarget(label, label, Optional.empty()));
        out.emitLineNl(labelPrefix(label) + header + " {");
        emitBody(body);
        out.emitLineNl("}");
        loops.pop();
    }

    private void emitFor(ForStatement fs) {
        var range = rangeHeader(fs);
        if (range.isPresent()) {
            emitLoop(fs.label(), range.get(), fs.body());
            return;
        }

        out.emitLineNl("{");
        out.indent();
        fs.init().ifPresent(this::emitStatement);
        var header = fs.condition().map(c -> "while " + expr(c)).orElse("loop");
        if (AstScanner.continuesTo(fs.body(), fs.label())) {
            int n = ++emulatedLoops;
            var name = Optional.of(fs.label().orElse("loop_" + n));
            var block = "body_" + n;
            loops.push(new LoopTarget(fs.label(), name, Optional.of(block)));
            out.emitLineNl(labelPrefix(name) + header + " {");
            out.indent();
            out.emitLineNl("'" + block + ": {");
            emitBody(fs.body());
            out.emitLineNl("}");
        } else {
            loops.push(new LoopTarget(fs.label(), fs.label(), Optional.empty()));
            out.emitLineNl(labelPrefix(fs.label()) + header + " {");
            out.indent();
            fs.body().statements().forEach(this::emitStatement);
        }
        loops.pop();
        fs.increment().ifPresent(i -> out.emitLineNl(expressionStatement(i)));
        out.outdent();
        out.emitLineNl("}");
        out.outdent();
        out.emitLineNl("}");
    }

    /**
     * {@code for (let i = a; i < b; i++)} with a body that leaves {@code i} alone is a range loop.
     */
    private Optional<String> rangeHeader(ForStatement fs) {
        if (!rangeLoops || fs.init().isEmpty() || fs.condition().isEmpty() || fs.increment().isEmpty()) {
            return Optional.empty();
        }
        if (!(fs.init().get() instanceof LetStatement let) || let.initializer().isEmpty()) {
            return Optional.empty();
        }
        var variable = new Identifier(let.name());
        if (!(fs.condition().get() instanceof Binary condition) || !condition.left().equals(variable)
                || (condition.operator() != BinaryOperator.LT && condition.operator() != BinaryOperator.LE)) {
            return Optional.empty();
        }
        var increment = fs.increment().get();
        var steps = increment instanceof Unary u
                && (u.operator() == UnaryOperator.POST_INC || u.operator() == UnaryOperator.PRE_INC)
                && u.operand().equals(variable)
                || increment instanceof Binary b && b.operator() == BinaryOperator.ADD_ASSIGN
                && b.left().equals(variable) && b.right().equals(new IntLiteral(1));
        if (!steps || AstScanner.assigns(fs.body(), let.name())) {
            return Optional.empty();
        }
        var operator = condition.operator() == BinaryOperator.LE ? "..=" : "..";
        return Optional.of("for " + let.name() + " in " + operand(let.initializer().get(), BinaryOperator.OR.rustPrecedence)
                + operator + operand(condition.right(), BinaryOperator.OR.rustPrecedence));
    }

    private void emitMatch(SwitchStatement ss) {
        out.emitLineNl("match " + expr(ss.subject()) + " {");
        out.indent();
        for (var c : ss.cases()) {
            emitArm(c.values().stream().map(this::expr).collect(Collectors.joining(" | ")), c.body());
        }
        emitArm("_", ss.defaultCase().orElse(new Block(List.of())));
        out.outdent();
        out.emitLineNl("}");
    }

    private void emitArm(String pattern, Block body) {
        if (body.statements().isEmpty()) {
            out.emitLineNl(pattern + " => {}");
            return;
        }
        out.emitLineNl(pattern + " => {");
        emitBody(body);
        out.emitLineNl("}");
    }

    private String breakText(BreakStatement bs) {
        if (bs.label().isPresent()) {
            return "break '" + bs.label().get() + ";";
        }
        var target = loops.peek();
        if (target != null && target.continueBlock().isPresent()) {
            return "break '" + target.name().orElseThrow() + ";";
        }
        return "break;";
    }

    private String continueText(ContinueStatement cs) {
        var target = cs.label().isPresent()
                ? loops.stream().filter(l -> l.label().equals(cs.label())).findFirst()
                : Optional.ofNullable(loops.peek());
        if (target.isPresent() && target.get().continueBlock().isPresent()) {
            return "break '" + target.get().continueBlock().get() + ";";
        }
        return "continue" + cs.label().map(l -> " '" + l).orElse("") + ";";
    }

    private void emitClosure(NestedFunction nf) {
        var mode = nf.closureMode();
        var parameters = nf.parameters().stream()
                .map(p -> (AstScanner.assigns(nf.body(), p.name()) ? "mut " : "") + p.name()
                        + (p.type() instanceof AutoType ? "" : ": " + typeNames.rust(p.type())))
                .collect(Collectors.joining(", "));
        var returnType = isVoid(nf.returnType()) || nf.returnType() instanceof AutoType
                ? "" : " -> " + typeNames.rust(nf.returnType());
        out.emitLineNl("let " + (mode == CaptureMode.MUTABLE ? "mut " : "") + nf.name() + " = "
                + (mode == CaptureMode.CONSUMING ? "move " : "") + "|" + parameters + "|" + returnType + " {");
        var enclosingLoops = loops;
        loops = new ArrayDeque<>();
        emitBody(nf.body());
        loops = enclosingLoops;
        out.emitLineNl("};");
    }

    private static String labelPrefix(Optional<String> label) {
        return label.map(l -> "'" + l + ": ").orElse("");
    }

    // ---- expressions

    String expr(Expression e) {
        if (e instanceof IntLiteral i) {
            return Long.toUnsignedString(i.value());
        }
        if (e instanceof FloatLiteral f) {
            return Double.toString(f.value());
        }
        if (e instanceof StringLiteral s) {
            return "\"" + Tokenizer.escape(s.value(), '"') + "\"";
        }
        if (e instanceof CharLiteral c) {
            return "'" + Tokenizer.escape(Character.toString(c.value()), '\'') + "'";
        }
        if (e instanceof BoolLiteral b) {
            return Boolean.toString(b.value());
        }
        if (e instanceof NullLiteral) {
            return "Option::None";
        }
        if (e instanceof Identifier id) {
            return macroParameters.contains(id.name()) ? "$" + id.name() : id.name();
        }
        if (e instanceof Binary b) {
            return binary(b);
        }
        if (e instanceof Unary u) {
            return unary(u);
        }
        if (e instanceof Call c) {
            return operand(c.callee(), POSTFIX) + "(" + list(c.arguments()) + ")";
        }
        if (e instanceof MethodCall mc) {
            return operand(mc.receiver(), POSTFIX) + "." + mc.method() + "(" + list(mc.arguments()) + ")";
        }
        if (e instanceof FieldAccess fa) {
            return operand(fa.target(), POSTFIX) + "." + fa.field();
        }
        if (e instanceof Index ix) {
            return operand(ix.target(), POSTFIX) + "[" + expr(ix.index()) + "]";
        }
        if (e instanceof Cast c) {
            return "(" + operand(c.expression(), PREFIX) + " as " + typeNames.rust(c.type()) + ")";
        }
        if (e instanceof Sizeof s) {
            return "std::mem::size_of::<" + typeNames.rust(s.type()) + ">()";
        }
        if (e instanceof Ternary t) {
            var elseValue = t.elseValue() instanceof Ternary ? expr(t.elseValue()) : "{ " + expr(t.elseValue()) + " }";
            return "if " + expr(t.condition()) + " { " + expr(t.thenValue()) + " } else " + elseValue;
        }
        if (e instanceof StructInit si) {
            return structLiteral(si);
        }
        if (e instanceof ArrayLiteral al) {
            return "[" + list(al.elements()) + "]";
        }
        if (e instanceof ArrayRepeat ar) {
            return "[" + expr(ar.value()) + "; " + expr(ar.count()) + "]";
        }
        if (e instanceof TupleLiteral tl) {
            return tl.elements().size() == 1 ? "(" + expr(tl.elements().get(0)) + ",)" : "(" + list(tl.elements()) + ")";
        }
        if (e instanceof Range r) {
            return r.start().map(s -> operand(s, BinaryOperator.OR.rustPrecedence)).orElse("")
                    + (r.inclusive() ? "..=" : "..")
                    + r.end().map(s -> operand(s, BinaryOperator.OR.rustPrecedence)).orElse("");
        }
        if (e instanceof MacroCall mc) {
            var delimiter = mc.delimiter() == MacroDelimiter.NONE ? MacroDelimiter.PARENTHESIS : mc.delimiter();
            var arguments = SourceWriter.joinTokens(mc.arguments().stream().map(RustEmitter::macroToken).toList());
            return macroName(mc.name()) + "!" + delimiter.open + arguments + delimiter.close;
        }
        if (e instanceof ErrorPropagation ep) {
            return operand(ep.expression(), POSTFIX) + "?";
        }
        if (e instanceof TypeScopedCall tc) {
            return typeNames.rustPath(tc.type()) + "::" + tc.method() + "(" + list(tc.arguments()) + ")";
        }
        if (e instanceof TypeScopedPath tp) {
            return typeNames.rustPath(tp.type()) + "::" + tp.member();
        }
        if (e instanceof ExplicitGenericCall gc) {
            var generics = gc.generics().stream().map(typeNames::rust).collect(Collectors.joining(", "));
            return typeNames.rust(gc.type()) + "::<" + generics + ">::" + gc.method() + "(" + list(gc.arguments()) + ")";
        }
        throw new CodeGenException("cannot render " + e);
    }

    private String binary(Binary b) {
        var op = b.operator();
        if ((op == BinaryOperator.EQ || op == BinaryOperator.NE)
                && (b.right() instanceof NullLiteral || b.left() instanceof NullLiteral)) {
            var target = b.right() instanceof NullLiteral ? b.left() : b.right();
            return operand(target, POSTFIX) + (op == BinaryOperator.EQ ? ".is_none()" : ".is_some()");
        }
        int precedence = op.rustPrecedence;
        if (op.isAssignment()) {
            return operand(b.left(), PREFIX) + " " + op.symbol + " " + operand(b.right(), precedence);
        }
        // comparisons do not chain
        var left = operand(b.left(), op.isComparison() ? precedence + 1 : precedence);
        return left + " " + op.symbol + " " + operand(b.right(), precedence + 1);
    }

    private String unary(Unary u) {
        var operand = u.operand();
        return switch (u.operator()) {
            case NOT -> "!" + operand(operand, PREFIX);
            case NEG -> "-" + operand(operand, PREFIX);
            case REF -> "&" + operand(operand, PREFIX);
            case REF_MUT -> "&mut " + operand(operand, PREFIX);
            case DEREF -> "*" + operand(operand, PREFIX);
            case PRE_INC -> "{ " + expr(operand) + " += 1; " + expr(operand) + " }";
            case PRE_DEC -> "{ " + expr(operand) + " -= 1; " + expr(operand) + " }";
            case POST_INC -> "{ let tmp = " + expr(operand) + "; " + expr(operand) + " += 1; tmp }";
            case POST_DEC -> "{ let tmp = " + expr(operand) + "; " + expr(operand) + " -= 1; tmp }";
        };
    }

    private String structLiteral(StructInit si) {
        if (si.type() instanceof AutoType) {
            throw new CodeGenException("designated initializer without a struct type");
        }
        var type = si.type() instanceof NamedType named ? named.qualifiedName("::") : typeNames.rust(si.type());
        if (si.fields().isEmpty()) {
            return type + " {}";
        }
        return type + " { " + si.fields().stream()
                .map(f -> f.name() + ": " + expr(f.value()))
                .collect(Collectors.joining(", ")) + " }";
    }

    private String list(List<Expression> expressions) {
        return expressions.stream().map(this::expr).collect(Collectors.joining(", "));
    }

    private String operand(Expression e, int minimum) {
        return precedence(e) < minimum ? "(" + expr(e) + ")" : expr(e);
    }

    private static int precedence(Expression e) {
        if (e instanceof Binary b) {
            var nullCheck = (b.operator() == BinaryOperator.EQ || b.operator() == BinaryOperator.NE)
                    && (b.left() instanceof NullLiteral || b.right() instanceof NullLiteral);
            return nullCheck ? POSTFIX : b.operator().rustPrecedence;
        }
        if (e instanceof Ternary) {
            return TERNARY;
        }
        if (e instanceof Range) {
            return RANGE;
        }
        if (e instanceof Unary u) {
            return u.operator().isIncrement() ? PRIMARY : PREFIX;
        }
        if (e instanceof FloatLiteral f && f.value() < 0) {
            return PREFIX;
        }
        if (e instanceof Call || e instanceof MethodCall || e instanceof FieldAccess || e instanceof Index
                || e instanceof ErrorPropagation) {
            return POSTFIX;
        }
        return PRIMARY;
    }

    private static boolean isVoid(Type type) {
        return type instanceof PrimitiveType p && p.primitive() == Primitive.VOID;
    }
}
