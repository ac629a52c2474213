package com.github.crusty.codegen;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import com.github.crusty.Tokenizer;
import com.github.crusty.error.CodeGenException;
import com.github.crusty.parser.CompilationUnit;
import com.github.crusty.parser.CompilationUnit.ArrayLiteral;
import com.github.crusty.parser.CompilationUnit.ArrayRepeat;
import com.github.crusty.parser.CompilationUnit.AutoType;
import com.github.crusty.parser.CompilationUnit.Binary;
import com.github.crusty.parser.CompilationUnit.Block;
import com.github.crusty.parser.CompilationUnit.BoolLiteral;
import com.github.crusty.parser.CompilationUnit.BreakStatement;
import com.github.crusty.parser.CompilationUnit.Call;
import com.github.crusty.parser.CompilationUnit.Cast;
import com.github.crusty.parser.CompilationUnit.CharLiteral;
import com.github.crusty.parser.CompilationUnit.ConstDeclaration;
import com.github.crusty.parser.CompilationUnit.ContinueStatement;
import com.github.crusty.parser.CompilationUnit.EnumDefinition;
import com.github.crusty.parser.CompilationUnit.ErrorPropagation;
import com.github.crusty.parser.CompilationUnit.ExplicitGenericCall;
import com.github.crusty.parser.CompilationUnit.Expression;
import com.github.crusty.parser.CompilationUnit.ExpressionStatement;
import com.github.crusty.parser.CompilationUnit.Field;
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

/**
 * Renders a tree as C-dialect source in the form the forward parser reads back to the same tree.
 */
class CrustyEmitter {

    // binding strength of the non-binary forms, in the order the parser climbs them
    private static final int ASSIGNMENT = 1;
    private static final int TERNARY = 2;
    private static final int RANGE = 3;
    private static final int BINARY = 4;
    private static final int PREFIX = 14;
    private static final int POSTFIX = 15;
    private static final int PRIMARY = 16;

    private final SourceWriter out;

    CrustyEmitter(SourceWriter out) {
        this.out = out;
    }

    String emit(CompilationUnit unit) {
        for (var doc : unit.docComments()) {
            out.emitLineNl(doc.isEmpty() ? "///" : "/// " + doc);
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
            out.emitLineNl("struct " + sd.name() + " {");
            out.indent();
            emitFields(sd.fields());
            for (int i = 0; i < sd.methods().size(); i++) {
                if (i > 0 || !sd.fields().isEmpty()) {
                    out.blankLine();
                }
                emitFunction(sd.methods().get(i));
            }
            out.outdent();
            out.emitLineNl("}");
        } else if (item instanceof UnionDefinition ud) {
            out.emitLineNl("union " + ud.name() + " {");
            out.indent();
            emitFields(ud.fields());
            out.outdent();
            out.emitLineNl("}");
        } else if (item instanceof EnumDefinition ed) {
            out.emitLineNl("enum " + ed.name() + " {");
            out.indent();
            var variants = ed.variants();
            for (int i = 0; i < variants.size(); i++) {
                var variant = variants.get(i);
                out.emitLineNl(variant.name() + variant.value().map(v -> " = " + v).orElse("")
                        + (i < variants.size() - 1 ? "," : ""));
            }
            out.outdent();
            out.emitLineNl("}");
        } else if (item instanceof TypeAlias ta) {
            out.emitLineNl("typedef " + TypeNameMapper.crusty(ta.target()) + " " + ta.name() + ";");
        } else if (item instanceof Namespace ns) {
            out.emitLineNl("namespace " + ns.name() + " {");
            out.indent();
            emitItems(ns.items());
            out.outdent();
            out.emitLineNl("}");
        } else if (item instanceof Import im) {
            out.emitLineNl((im.exported() ? "#export " : "#import ") + String.join(".", im.path())
                    + im.alias().map(a -> " as " + a).orElse("") + ";");
        } else if (item instanceof Include inc) {
            out.emitLineNl(inc.system()
                    ? "#include <" + inc.header() + ">"
                    : "#include \"" + Tokenizer.escape(inc.header(), '"') + "\"");
        } else if (item instanceof StaticDeclaration sd) {
            out.emitLineNl("static " + (sd.mutable() ? "var " : "") + TypeNameMapper.crusty(sd.type()) + " "
                    + sd.name() + " = " + expr(sd.value()) + ";");
        } else if (item instanceof ConstDeclaration cd) {
            out.emitLineNl(constText(cd));
        } else if (item instanceof MacroDefinition md) {
            out.emitLineNl(defineText(md));
        }
    }

    private void emitFields(List<Field> fields) {
        for (var field : fields) {
            out.emitLineNl(TypeNameMapper.crusty(field.type()) + " " + field.name() + ";");
        }
    }

    private void emitFunction(FunctionDeclaration fd) {
        out.emitLineNl((fd.visibility() == Visibility.PRIVATE ? "static " : "")
                + signature(fd.returnType(), fd.name(), fd.parameters()) + " {");
        emitBody(fd.body());
        out.emitLineNl("}");
    }

    private static String signature(Type returnType, String name, List<Parameter> parameters) {
        return TypeNameMapper.crusty(returnType) + " " + name + "("
                + parameters.stream().map(CrustyEmitter::parameter).collect(Collectors.joining(", ")) + ")";
    }

    private static String parameter(Parameter p) {
        if (p.name().equals("self")) {
            if (p.type() instanceof ReferenceType r) {
                return r.mutable() ? "&var self" : "&self";
            }
            return "self";
        }
        return TypeNameMapper.crusty(p.type()) + " " + p.name();
    }

    private String defineText(MacroDefinition md) {
        var sb = new StringBuilder("#define ").append(md.name());
        if (md.delimiter() != MacroDelimiter.NONE) {
            sb.append(md.delimiter().open).append(String.join(", ", md.parameters())).append(md.delimiter().close);
        }
        if (!md.body().isEmpty()) {
            sb.append(' ').append(SourceWriter.joinTokens(md.body()));
        }
        return sb.toString();
    }

    private String constText(ConstDeclaration cd) {
        return "const " + cd.type().map(t -> TypeNameMapper.crusty(t) + " ").orElse("") + cd.name() + " = "
                + expr(cd.value()) + ";";
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
            out.emitLineNl(expr(es.expression()) + ";");
        } else if (statement instanceof ReturnStatement rs) {
            out.emitLineNl("return" + rs.value().map(v -> " " + expr(v)).orElse("") + ";");
        } else if (statement instanceof IfStatement is) {
            emitIf(is);
        } else if (statement instanceof WhileStatement ws) {
            emitLoop(labelPrefix(ws.label()) + "while (" + expr(ws.condition()) + ")", ws.body());
        } else if (statement instanceof LoopStatement ls) {
            emitLoop(labelPrefix(ls.label()) + "loop", ls.body());
        } else if (statement instanceof ForInStatement fs) {
            emitLoop(labelPrefix(fs.label()) + "for (" + fs.variable() + " in " + expr(fs.iterable()) + ")", fs.body());
        } else if (statement instanceof ForStatement fs) {
            var init = fs.init().map(this::forInit).orElse(";");
            var condition = fs.condition().map(c -> " " + expr(c)).orElse(" ");
            var increment = fs.increment().map(i -> " " + expr(i)).orElse("");
            emitLoop(labelPrefix(fs.label()) + "for (" + init + condition + ";" + increment + ")", fs.body());
        } else if (statement instanceof SwitchStatement ss) {
            emitSwitch(ss);
        } else if (statement instanceof BreakStatement bs) {
            out.emitLineNl("break" + bs.label().map(l -> " " + l).orElse("") + ";");
        } else if (statement instanceof ContinueStatement cs) {
            out.emitLineNl("continue" + cs.label().map(l -> " " + l).orElse("") + ";");
        } else if (statement instanceof GotoStatement gs) {
            out.emitLineNl("goto " + gs.label() + ";");
        } else if (statement instanceof NestedFunction nf) {
            out.emitLineNl((nf.isStatic() ? "static " : "") + signature(nf.returnType(), nf.name(), nf.parameters()) + " {");
            emitBody(nf.body());
            out.emitLineNl("}");
        }
    }

    private String letText(LetStatement let) {
        return (let.mutable() ? "var " : "let ") + let.type().map(t -> TypeNameMapper.crusty(t) + " ").orElse("")
                + let.name() + let.initializer().map(v -> " = " + expr(v)).orElse("") + ";";
    }

    private String forInit(Statement init) {
        if (init instanceof LetStatement let) {
            return letText(let);
        }
        if (init instanceof ExpressionStatement es) {
            return expr(es.expression()) + ";";
        }
        throw new CodeGenException("unsupported for-loop initializer " + init);
    }

    private void emitIf(IfStatement is) {
        out.emitLineNl("if (" + expr(is.condition()) + ") {");
        emitBody(is.thenBlock());
        var elseBlock = is.elseBlock();
        while (elseBlock.isPresent()) {
            var block = elseBlock.get();
            if (block.statements().size() == 1 && block.statements().get(0) instanceof IfStatement elseIf) {
                out.emitLineNl("} else if (" + expr(elseIf.condition()) + ") {");
                emitBody(elseIf.thenBlock());
                elseBlock = elseIf.elseBlock();
            } else {
                out.emitLineNl("} else {");
                emitBody(block);
                break;
            }
        }
        out.emitLineNl("}");
    }

    private void emitLoop(String header, Block body) {
        out.emitLineNl(header + " {");
        emitBody(body);
        out.emitLineNl("}");
    }

    private void emitSwitch(SwitchStatement ss) {
        out.emitLineNl("switch (" + expr(ss.subject()) + ") {");
        out.indent();
        for (var c : ss.cases()) {
            out.emitLineNl("case " + c.values().stream().map(this::expr).collect(Collectors.joining(", ")) + ":");
            emitCaseBody(c.body());
        }
        ss.defaultCase().ifPresent(d -> {
            out.emitLineNl("default:");
            emitCaseBody(d);
        });
        out.outdent();
        out.emitLineNl("}");
    }

    // every case ends with a break so that no body is read as falling through
    private void emitCaseBody(Block body) {
        out.indent();
        body.statements().forEach(this::emitStatement);
        out.emitLineNl("break;");
        out.outdent();
    }

    private static String labelPrefix(Optional<String> label) {
        return label.map(l -> "." + l + ": ").orElse("");
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
            return "NULL";
        }
        if (e instanceof Identifier id) {
            return id.name();
        }
        if (e instanceof Binary b) {
            var op = b.operator();
            if (op.isAssignment()) {
                return operand(b.left(), TERNARY) + " " + op.symbol + " " + operand(b.right(), ASSIGNMENT);
            }
            // g()? - 1 would read as a conditional
            var left = b.left() instanceof ErrorPropagation ? "(" + expr(b.left()) + ")" : operand(b.left(), op.precedence);
            return left + " " + op.symbol + " " + operand(b.right(), op.precedence + 1);
        }
        if (e instanceof Unary u) {
            return unary(u);
        }
        if (e instanceof Call c) {
            return operand(c.callee(), POSTFIX) + "(" + list(c.arguments()) + ")";
        }
        if (e instanceof MethodCall mc) {
            return member(mc.receiver()) + mc.method() + "(" + list(mc.arguments()) + ")";
        }
        if (e instanceof FieldAccess fa) {
            return member(fa.target()) + fa.field();
        }
        if (e instanceof Index ix) {
            return operand(ix.target(), POSTFIX) + "[" + expr(ix.index()) + "]";
        }
        if (e instanceof Cast c) {
            return "(" + TypeNameMapper.crusty(c.type()) + ")(" + expr(c.expression()) + ")";
        }
        if (e instanceof Sizeof s) {
            return "sizeof(" + TypeNameMapper.crusty(s.type()) + ")";
        }
        if (e instanceof Ternary t) {
            return operand(t.condition(), RANGE) + " ? " + expr(t.thenValue()) + " : " + operand(t.elseValue(), TERNARY);
        }
        if (e instanceof StructInit si) {
            var fields = si.fields().isEmpty() ? "{}" : si.fields().stream()
                    .map(f -> "." + f.name() + " = " + expr(f.value()))
                    .collect(Collectors.joining(", ", "{ ", " }"));
            return si.type() instanceof AutoType ? fields : "(" + TypeNameMapper.crusty(si.type()) + ")" + fields;
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
            return r.start().map(s -> operand(s, BINARY)).orElse("") + (r.inclusive() ? "..=" : "..")
                    + r.end().map(s -> operand(s, BINARY)).orElse("");
        }
        if (e instanceof MacroCall mc) {
            if (mc.delimiter() == MacroDelimiter.NONE) {
                return mc.name();
            }
            return mc.name() + mc.delimiter().open + SourceWriter.joinTokens(mc.arguments()) + mc.delimiter().close;
        }
        if (e instanceof ErrorPropagation ep) {
            return operand(ep.expression(), POSTFIX) + "?";
        }
        if (e instanceof TypeScopedCall tc) {
            return "@" + scopedType(tc.type()) + "." + tc.method() + "(" + list(tc.arguments()) + ")";
        }
        if (e instanceof TypeScopedPath tp) {
            return "@" + scopedType(tp.type()) + "." + tp.member();
        }
        if (e instanceof ExplicitGenericCall gc) {
            return "@" + scopedType(gc.type()) + genericList(gc.generics(), true) + "." + gc.method()
                    + "(" + list(gc.arguments()) + ")";
        }
        throw new CodeGenException("cannot render " + e);
    }

    private String unary(Unary u) {
        var op = u.operator();
        if (op.isPostfix()) {
            return operand(u.operand(), POSTFIX) + op.symbol;
        }
        var operand = operand(u.operand(), PREFIX);
        // keep "- -x" and "& &x" from lexing as one operator
        char last = op.symbol.charAt(op.symbol.length() - 1);
        if ("-&".indexOf(last) >= 0 && operand.charAt(0) == last) {
            operand = "(" + expr(u.operand()) + ")";
        }
        return op.symbol + operand;
    }

    /**
     * The receiver of a field access or method call followed by its separator; a dereferenced
     * receiver uses the arrow.
     */
    private String member(Expression target) {
        if (target instanceof Unary u && u.operator() == UnaryOperator.DEREF) {
            return operand(u.operand(), POSTFIX) + "->";
        }
        return operand(target, POSTFIX) + ".";
    }

    private static String scopedType(Type type) {
        if (type instanceof NamedType named) {
            return named.qualifiedName(".");
        }
        if (type instanceof PrimitiveType p) {
            return p.primitive().crustyName;
        }
        throw new CodeGenException("type " + TypeNameMapper.crusty(type) + " cannot qualify a call");
    }

    // parentheses at the outer level, brackets and parentheses alternating inside
    private static String genericList(List<Type> generics, boolean parentheses) {
        return generics.stream()
                .map(t -> genericParameter(t, !parentheses))
                .collect(Collectors.joining(", ", parentheses ? "(" : "[", parentheses ? ")" : "]"));
    }

    private static String genericParameter(Type type, boolean parentheses) {
        if (type instanceof NamedType named && !named.arguments().isEmpty()) {
            return named.qualifiedName(".") + genericList(named.arguments(), parentheses);
        }
        return scopedType(type);
    }

    private String list(List<Expression> expressions) {
        return expressions.stream().map(this::expr).collect(Collectors.joining(", "));
    }

    private String operand(Expression e, int minimum) {
        return precedence(e) < minimum ? "(" + expr(e) + ")" : expr(e);
    }

    private static int precedence(Expression e) {
        if (e instanceof Binary b) {
            return b.operator().isAssignment() ? ASSIGNMENT : b.operator().precedence;
        }
        if (e instanceof Ternary) {
            return TERNARY;
        }
        if (e instanceof Range) {
            return RANGE;
        }
        if (e instanceof Unary u) {
            return u.operator().isPostfix() ? POSTFIX : PREFIX;
        }
        if (e instanceof Cast) {
            return PREFIX;
        }
        if (e instanceof FloatLiteral f && f.value() < 0) {
            return PREFIX;
        }
        if (e instanceof Call || e instanceof MethodCall || e instanceof FieldAccess || e instanceof Index
                || e instanceof ErrorPropagation) {
            return POSTFIX;
        }
        if (e instanceof StructInit si && !(si.type() instanceof AutoType)) {
            return POSTFIX;
        }
        return PRIMARY;
    }
}
