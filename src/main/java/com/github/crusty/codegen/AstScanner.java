package com.github.crusty.codegen;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.github.crusty.parser.CompilationUnit.ArrayLiteral;
import com.github.crusty.parser.CompilationUnit.ArrayRepeat;
import com.github.crusty.parser.CompilationUnit.Binary;
import com.github.crusty.parser.CompilationUnit.Block;
import com.github.crusty.parser.CompilationUnit.Call;
import com.github.crusty.parser.CompilationUnit.Cast;
import com.github.crusty.parser.CompilationUnit.ConstDeclaration;
import com.github.crusty.parser.CompilationUnit.ContinueStatement;
import com.github.crusty.parser.CompilationUnit.ErrorPropagation;
import com.github.crusty.parser.CompilationUnit.ExplicitGenericCall;
import com.github.crusty.parser.CompilationUnit.Expression;
import com.github.crusty.parser.CompilationUnit.ExpressionStatement;
import com.github.crusty.parser.CompilationUnit.FieldAccess;
import com.github.crusty.parser.CompilationUnit.FieldInit;
import com.github.crusty.parser.CompilationUnit.ForInStatement;
import com.github.crusty.parser.CompilationUnit.ForStatement;
import com.github.crusty.parser.CompilationUnit.Identifier;
import com.github.crusty.parser.CompilationUnit.IfStatement;
import com.github.crusty.parser.CompilationUnit.Index;
import com.github.crusty.parser.CompilationUnit.LetStatement;
import com.github.crusty.parser.CompilationUnit.LoopStatement;
import com.github.crusty.parser.CompilationUnit.MethodCall;
import com.github.crusty.parser.CompilationUnit.NestedFunction;
import com.github.crusty.parser.CompilationUnit.Range;
import com.github.crusty.parser.CompilationUnit.ReturnStatement;
import com.github.crusty.parser.CompilationUnit.Statement;
import com.github.crusty.parser.CompilationUnit.StructInit;
import com.github.crusty.parser.CompilationUnit.SwitchCase;
import com.github.crusty.parser.CompilationUnit.SwitchStatement;
import com.github.crusty.parser.CompilationUnit.Ternary;
import com.github.crusty.parser.CompilationUnit.TupleLiteral;
import com.github.crusty.parser.CompilationUnit.TypeScopedCall;
import com.github.crusty.parser.CompilationUnit.Unary;
import com.github.crusty.parser.CompilationUnit.UnaryOperator;
import com.github.crusty.parser.CompilationUnit.WhileStatement;

/**
 * Read-only queries over function bodies used to pick an output form.
 */
final class AstScanner {

    private AstScanner() {
    }

    /**
     * Whether {@code name} is assigned, incremented or mutably borrowed anywhere in the block,
     * nested function bodies included. Shadowing is not taken into account.
     */
    static boolean assigns(Block body, String name) {
        var expressions = new ArrayList<Expression>();
        collect(body, expressions, true);
        for (int i = 0; i < expressions.size(); i++) {
            var e = expressions.get(i);
            if (mutates(e, name)) {
                return true;
            }
            expressions.addAll(children(e));
        }
        return false;
    }

    /**
     * Whether the block contains a {@code continue} that targets the loop owning it: an
     * unlabeled one outside of inner loops, or one naming {@code label}.
     */
    static boolean continuesTo(Block body, Optional<String> label) {
        return continuesTo(body, label, false);
    }

    private static boolean continuesTo(Statement statement, Optional<String> label, boolean inInnerLoop) {
        if (statement instanceof ContinueStatement cs) {
            return cs.label().isEmpty() ? !inInnerLoop : cs.label().equals(label);
        }
        if (statement instanceof Block b) {
            return b.statements().stream().anyMatch(s -> continuesTo(s, label, inInnerLoop));
        }
        if (statement instanceof IfStatement is) {
            return continuesTo(is.thenBlock(), label, inInnerLoop)
                    || is.elseBlock().map(e -> continuesTo(e, label, inInnerLoop)).orElse(false);
        }
        if (statement instanceof WhileStatement ws) {
            return continuesTo(ws.body(), label, true);
        }
        if (statement instanceof LoopStatement ls) {
            return continuesTo(ls.body(), label, true);
        }
        if (statement instanceof ForStatement fs) {
            return continuesTo(fs.body(), label, true);
        }
        if (statement instanceof ForInStatement fs) {
            return continuesTo(fs.body(), label, true);
        }
        if (statement instanceof SwitchStatement ss) {
            return ss.cases().stream().anyMatch(c -> continuesTo(c.body(), label, inInnerLoop))
                    || ss.defaultCase().map(d -> continuesTo(d, label, inInnerLoop)).orElse(false);
        }
        return false;
    }

    private static boolean mutates(Expression e, String name) {
        if (e instanceof Binary b && b.operator().isAssignment()) {
            return isBase(b.left(), name);
        }
        if (e instanceof Unary u && (u.operator().isIncrement() || u.operator() == UnaryOperator.REF_MUT)) {
            return isBase(u.operand(), name);
        }
        return false;
    }

    private static boolean isBase(Expression target, String name) {
        var base = target;
        while (true) {
            if (base instanceof FieldAccess fa) {
                base = fa.target();
            } else if (base instanceof Index ix) {
                base = ix.target();
            } else {
                break;
            }
        }
        return base instanceof Identifier id && id.name().equals(name);
    }

    private static void collect(Statement statement, List<Expression> out, boolean nestedFunctions) {
        if (statement instanceof Block b) {
            b.statements().forEach(s -> collect(s, out, nestedFunctions));
        } else if (statement instanceof LetStatement let) {
            let.initializer().ifPresent(out::add);
        } else if (statement instanceof ConstDeclaration cd) {
            out.add(cd.value());
        } else if (statement instanceof ExpressionStatement es) {
            out.add(es.expression());
        } else if (statement instanceof ReturnStatement rs) {
            rs.value().ifPresent(out::add);
        } else if (statement instanceof IfStatement is) {
            out.add(is.condition());
            collect(is.thenBlock(), out, nestedFunctions);
            is.elseBlock().ifPresent(e -> collect(e, out, nestedFunctions));
        } else if (statement instanceof WhileStatement ws) {
            out.add(ws.condition());
            collect(ws.body(), out, nestedFunctions);
        } else if (statement instanceof LoopStatement ls) {
            collect(ls.body(), out, nestedFunctions);
        } else if (statement instanceof ForStatement fs) {
            fs.init().ifPresent(s -> collect(s, out, nestedFunctions));
            fs.condition().ifPresent(out::add);
            fs.increment().ifPresent(out::add);
            collect(fs.body(), out, nestedFunctions);
        } else if (statement instanceof ForInStatement fs) {
            out.add(fs.iterable());
            collect(fs.body(), out, nestedFunctions);
        } else if (statement instanceof SwitchStatement ss) {
            out.add(ss.subject());
            for (SwitchCase c : ss.cases()) {
                out.addAll(c.values());
                collect(c.body(), out, nestedFunctions);
            }
            ss.defaultCase().ifPresent(d -> collect(d, out, nestedFunctions));
        } else if (statement instanceof NestedFunction nf && nestedFunctions) {
            collect(nf.body(), out, true);
        }
    }

    private static List<Expression> children(Expression e) {
        List<Expression> result = new ArrayList<>();
        if (e instanceof Binary b) {
            result.add(b.left());
            result.add(b.right());
        } else if (e instanceof Unary u) {
            result.add(u.operand());
        } else if (e instanceof Call c) {
            result.add(c.callee());
            result.addAll(c.arguments());
        } else if (e instanceof MethodCall mc) {
            result.add(mc.receiver());
            result.addAll(mc.arguments());
        } else if (e instanceof FieldAccess fa) {
            result.add(fa.target());
        } else if (e instanceof Index ix) {
            result.add(ix.target());
            result.add(ix.index());
        } else if (e instanceof Cast c) {
            result.add(c.expression());
        } else if (e instanceof Ternary t) {
            result.add(t.condition());
            result.add(t.thenValue());
            result.add(t.elseValue());
        } else if (e instanceof StructInit si) {
            si.fields().stream().map(FieldInit::value).forEach(result::add);
        } else if (e instanceof ArrayLiteral al) {
            result.addAll(al.elements());
        } else if (e instanceof ArrayRepeat ar) {
            result.add(ar.value());
            result.add(ar.count());
        } else if (e instanceof TupleLiteral tl) {
            result.addAll(tl.elements());
        } else if (e instanceof Range r) {
            r.start().ifPresent(result::add);
            r.end().ifPresent(result::add);
        } else if (e instanceof ErrorPropagation ep) {
            result.add(ep.expression());
        } else if (e instanceof TypeScopedCall tc) {
            result.addAll(tc.arguments());
        } else if (e instanceof ExplicitGenericCall gc) {
            result.addAll(gc.arguments());
        }
        return result;
    }
}
