package work.contracts.renderer.syntax;

import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Names bound inside a function, lambda, comprehension or class body. A name assigned anywhere in
 * a function body is local to the whole body unless declared {@code global}.
 */
final class LocalBindings {

    private LocalBindings() {
    }

    static Set<String> ofFunction(Stmt.FunctionDef def) {
        var bound = new LinkedHashSet<String>();
        def.args().all().forEach(arg -> bound.add(arg.name()));
        var globals = new HashSet<String>();
        collectBlock(def.body(), bound, globals);
        bound.removeAll(globals);
        return bound;
    }

    static Set<String> ofLambda(Expr.Lambda lambda) {
        var bound = new LinkedHashSet<String>();
        lambda.args().all().forEach(arg -> bound.add(arg.name()));
        collectExpression(lambda.body(), bound);
        return bound;
    }

    static Set<String> ofComprehension(List<Expr.Comprehension> generators) {
        var bound = new LinkedHashSet<String>();
        generators.forEach(generator -> collectTarget(generator.target(), bound));
        return bound;
    }

    static Set<String> ofClass(Stmt.ClassDef cls) {
        var bound = new LinkedHashSet<String>();
        var globals = new HashSet<String>();
        collectBlock(cls.body(), bound, globals);
        bound.removeAll(globals);
        return bound;
    }

    static void collectTarget(Expr target, Set<String> bound) {
        if (target instanceof Expr.Name name) {
            bound.add(name.id());
        } else if (target instanceof Expr.TupleExpr tuple) {
            tuple.elts().forEach(elt -> collectTarget(elt, bound));
        } else if (target instanceof Expr.ListExpr list) {
            list.elts().forEach(elt -> collectTarget(elt, bound));
        } else if (target instanceof Expr.Starred starred) {
            collectTarget(starred.value(), bound);
        }
    }

    private static void collectBlock(List<Stmt> body, Set<String> bound, Set<String> globals) {
        for (var statement : body) {
            collectStatement(statement, bound, globals);
        }
    }

    private static void collectStatement(Stmt statement, Set<String> bound, Set<String> globals) {
        if (statement instanceof Stmt.FunctionDef def) {
            bound.add(def.name());
            def.decorators().forEach(decorator -> collectExpression(decorator, bound));
        } else if (statement instanceof Stmt.ClassDef cls) {
            bound.add(cls.name());
        } else if (statement instanceof Stmt.Assign assign) {
            assign.targets().forEach(target -> collectTarget(target, bound));
            collectExpression(assign.value(), bound);
        } else if (statement instanceof Stmt.AnnAssign assign) {
            collectTarget(assign.target(), bound);
            if (assign.value() != null) {
                collectExpression(assign.value(), bound);
            }
        } else if (statement instanceof Stmt.AugAssign assign) {
            collectTarget(assign.target(), bound);
            collectExpression(assign.value(), bound);
        } else if (statement instanceof Stmt.ExprStmt expression) {
            collectExpression(expression.value(), bound);
        } else if (statement instanceof Stmt.Return ret && ret.value() != null) {
            collectExpression(ret.value(), bound);
        } else if (statement instanceof Stmt.Delete delete) {
            delete.targets().forEach(target -> collectTarget(target, bound));
        } else if (statement instanceof Stmt.Global global) {
            globals.addAll(global.names());
        } else if (statement instanceof Stmt.Import imp) {
            imp.names().forEach(alias -> bound.add(alias.boundName()));
        } else if (statement instanceof Stmt.ImportFrom imp) {
            imp.names().forEach(alias -> bound.add(alias.boundName()));
        } else if (statement instanceof Stmt.If branch) {
            collectExpression(branch.test(), bound);
            collectBlock(branch.body(), bound, globals);
            collectBlock(branch.orElse(), bound, globals);
        } else if (statement instanceof Stmt.For loop) {
            collectTarget(loop.target(), bound);
            collectExpression(loop.iter(), bound);
            collectBlock(loop.body(), bound, globals);
            collectBlock(loop.orElse(), bound, globals);
        } else if (statement instanceof Stmt.While loop) {
            collectExpression(loop.test(), bound);
            collectBlock(loop.body(), bound, globals);
            collectBlock(loop.orElse(), bound, globals);
        } else if (statement instanceof Stmt.Try attempt) {
            collectBlock(attempt.body(), bound, globals);
            for (var handler : attempt.handlers()) {
                if (handler.name() != null) {
                    bound.add(handler.name());
                }
                collectBlock(handler.body(), bound, globals);
            }
            collectBlock(attempt.orElse(), bound, globals);
            collectBlock(attempt.finalBody(), bound, globals);
        } else if (statement instanceof Stmt.With with) {
            for (var item : with.items()) {
                collectExpression(item.context(), bound);
                if (item.optionalVars() != null) {
                    collectTarget(item.optionalVars(), bound);
                }
            }
            collectBlock(with.body(), bound, globals);
        }
    }

    /** Assignment expressions bind in the enclosing function, even from inside a comprehension. */
    private static void collectExpression(Expr expression, Set<String> bound) {
        new AstRewriter() {
            @Override
            public Expr rewrite(Expr e) {
                if (e instanceof Expr.NamedExpr named) {
                    bound.add(named.target().id());
                }
                if (e instanceof Expr.Lambda) {
                    return e;
                }
                return super.rewrite(e);
            }
        }.rewrite(expression);
    }
}
