package work.contracts.renderer.syntax;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Bottom-up tree transformer. A node is rebuilt only when one of its children changed, so a
 * rewriter that changes nothing returns the very same instances and can double as a scanner.
 * Subclasses override {@link #rewrite(Stmt)} or {@link #rewrite(Expr)} and delegate to
 * {@code super} for the default traversal.
 *
 * <p>While descending, the rewriter tracks the names bound by enclosing functions, lambdas,
 * comprehensions and class bodies; see {@link #isLocallyBound(String)}.
 */
public abstract class AstRewriter {

    private record Scope(Set<String> names, boolean classBody) {}

    private final Deque<Scope> scopes = new ArrayDeque<>();

    /** True when {@code name} refers to a binding of an enclosing function, lambda or comprehension. */
    protected boolean isLocallyBound(String name) {
        var innermost = true;
        for (var scope : scopes) {
            if (scope.names().contains(name) && (!scope.classBody() || innermost)) {
                return true;
            }
            innermost = false;
        }
        return false;
    }

    protected boolean atModuleLevel() {
        return scopes.isEmpty();
    }

    public List<Stmt> rewriteBody(List<Stmt> body) {
        List<Stmt> result = null;
        for (var i = 0; i < body.size(); i++) {
            var original = body.get(i);
            var rewritten = rewrite(original);
            if (rewritten != original && result == null) {
                result = new ArrayList<>(body.subList(0, i));
            }
            if (result != null) {
                result.add(rewritten);
            }
        }
        return result == null ? body : List.copyOf(result);
    }

    public Stmt rewrite(Stmt s) {
        if (s instanceof Stmt.FunctionDef def) {
            var decorators = rewriteAll(def.decorators());
            var args = rewriteArguments(def.args());
            var returns = rewriteNullable(def.returns());
            var body = inScope(LocalBindings.ofFunction(def), false, () -> rewriteBody(def.body()));
            if (decorators == def.decorators() && args == def.args() && returns == def.returns() && body == def.body()) {
                return def;
            }
            return new Stmt.FunctionDef(decorators, def.name(), args, returns, body, def.isAsync(), def.source());
        }
        if (s instanceof Stmt.ClassDef cls) {
            var decorators = rewriteAll(cls.decorators());
            var bases = rewriteAll(cls.bases());
            var keywords = rewriteKeywords(cls.keywords());
            var body = inScope(LocalBindings.ofClass(cls), true, () -> rewriteBody(cls.body()));
            if (decorators == cls.decorators() && bases == cls.bases() && keywords == cls.keywords() && body == cls.body()) {
                return cls;
            }
            return new Stmt.ClassDef(decorators, cls.name(), bases, keywords, body, cls.source());
        }
        if (s instanceof Stmt.Assign assign) {
            var targets = rewriteAll(assign.targets());
            var value = rewrite(assign.value());
            return targets == assign.targets() && value == assign.value()
                ? assign
                : new Stmt.Assign(targets, value, assign.source());
        }
        if (s instanceof Stmt.AnnAssign assign) {
            var target = rewrite(assign.target());
            var annotation = rewrite(assign.annotation());
            var value = rewriteNullable(assign.value());
            return target == assign.target() && annotation == assign.annotation() && value == assign.value()
                ? assign
                : new Stmt.AnnAssign(target, annotation, value, assign.source());
        }
        if (s instanceof Stmt.AugAssign assign) {
            var target = rewrite(assign.target());
            var value = rewrite(assign.value());
            return target == assign.target() && value == assign.value()
                ? assign
                : new Stmt.AugAssign(target, assign.op(), value, assign.source());
        }
        if (s instanceof Stmt.ExprStmt expression) {
            var value = rewrite(expression.value());
            return value == expression.value() ? expression : new Stmt.ExprStmt(value, expression.source());
        }
        if (s instanceof Stmt.Return ret) {
            var value = rewriteNullable(ret.value());
            return value == ret.value() ? ret : new Stmt.Return(value, ret.source());
        }
        if (s instanceof Stmt.Raise raise) {
            var exc = rewriteNullable(raise.exc());
            var cause = rewriteNullable(raise.cause());
            return exc == raise.exc() && cause == raise.cause() ? raise : new Stmt.Raise(exc, cause, raise.source());
        }
        if (s instanceof Stmt.Delete delete) {
            var targets = rewriteAll(delete.targets());
            return targets == delete.targets() ? delete : new Stmt.Delete(targets, delete.source());
        }
        if (s instanceof Stmt.Assert check) {
            var test = rewrite(check.test());
            var msg = rewriteNullable(check.msg());
            return test == check.test() && msg == check.msg() ? check : new Stmt.Assert(test, msg, check.source());
        }
        if (s instanceof Stmt.If branch) {
            var test = rewrite(branch.test());
            var body = rewriteBody(branch.body());
            var orElse = rewriteBody(branch.orElse());
            return test == branch.test() && body == branch.body() && orElse == branch.orElse()
                ? branch
                : new Stmt.If(test, body, orElse, branch.source());
        }
        if (s instanceof Stmt.For loop) {
            var target = rewrite(loop.target());
            var iter = rewrite(loop.iter());
            var body = rewriteBody(loop.body());
            var orElse = rewriteBody(loop.orElse());
            return target == loop.target() && iter == loop.iter() && body == loop.body() && orElse == loop.orElse()
                ? loop
                : new Stmt.For(target, iter, body, orElse, loop.isAsync(), loop.source());
        }
        if (s instanceof Stmt.While loop) {
            var test = rewrite(loop.test());
            var body = rewriteBody(loop.body());
            var orElse = rewriteBody(loop.orElse());
            return test == loop.test() && body == loop.body() && orElse == loop.orElse()
                ? loop
                : new Stmt.While(test, body, orElse, loop.source());
        }
        if (s instanceof Stmt.Try attempt) {
            var body = rewriteBody(attempt.body());
            var handlers = rewriteHandlers(attempt.handlers());
            var orElse = rewriteBody(attempt.orElse());
            var finalBody = rewriteBody(attempt.finalBody());
            if (body == attempt.body() && handlers == attempt.handlers() && orElse == attempt.orElse()
                && finalBody == attempt.finalBody()) {
                return attempt;
            }
            return new Stmt.Try(body, handlers, orElse, finalBody, attempt.source());
        }
        if (s instanceof Stmt.With with) {
            var items = rewriteWithItems(with.items());
            var body = rewriteBody(with.body());
            return items == with.items() && body == with.body()
                ? with
                : new Stmt.With(items, body, with.isAsync(), with.source());
        }
        // pass, break, continue, global, nonlocal and imports have no expression children
        return s;
    }

    public Expr rewrite(Expr e) {
        if (e instanceof Expr.Name || e instanceof Expr.Constant) {
            return e;
        }
        if (e instanceof Expr.Attribute attribute) {
            var value = rewrite(attribute.value());
            return value == attribute.value() ? attribute : new Expr.Attribute(value, attribute.attr(), attribute.source());
        }
        if (e instanceof Expr.JoinedStr joined) {
            var values = rewriteAll(joined.values());
            return values == joined.values() ? joined : new Expr.JoinedStr(values, joined.source());
        }
        if (e instanceof Expr.FormattedValue formatted) {
            var value = rewrite(formatted.value());
            var spec = formatted.formatSpec() == null ? null : (Expr.JoinedStr) rewrite(formatted.formatSpec());
            return value == formatted.value() && spec == formatted.formatSpec()
                ? formatted
                : new Expr.FormattedValue(value, formatted.conversion(), spec, formatted.source());
        }
        if (e instanceof Expr.Call call) {
            var func = rewrite(call.func());
            var args = rewriteAll(call.args());
            var keywords = rewriteKeywords(call.keywords());
            return func == call.func() && args == call.args() && keywords == call.keywords()
                ? call
                : new Expr.Call(func, args, keywords, call.source());
        }
        if (e instanceof Expr.Subscript subscript) {
            var value = rewrite(subscript.value());
            var slice = rewrite(subscript.slice());
            return value == subscript.value() && slice == subscript.slice()
                ? subscript
                : new Expr.Subscript(value, slice, subscript.source());
        }
        if (e instanceof Expr.Slice slice) {
            var lower = rewriteNullable(slice.lower());
            var upper = rewriteNullable(slice.upper());
            var step = rewriteNullable(slice.step());
            return lower == slice.lower() && upper == slice.upper() && step == slice.step()
                ? slice
                : new Expr.Slice(lower, upper, step, slice.source());
        }
        if (e instanceof Expr.ListExpr list) {
            var elts = rewriteAll(list.elts());
            return elts == list.elts() ? list : new Expr.ListExpr(elts, list.source());
        }
        if (e instanceof Expr.TupleExpr tuple) {
            var elts = rewriteAll(tuple.elts());
            return elts == tuple.elts() ? tuple : new Expr.TupleExpr(elts, tuple.source());
        }
        if (e instanceof Expr.SetExpr set) {
            var elts = rewriteAll(set.elts());
            return elts == set.elts() ? set : new Expr.SetExpr(elts, set.source());
        }
        if (e instanceof Expr.DictExpr dict) {
            var items = rewriteDictItems(dict.items());
            return items == dict.items() ? dict : new Expr.DictExpr(items, dict.source());
        }
        if (e instanceof Expr.Starred starred) {
            var value = rewrite(starred.value());
            return value == starred.value() ? starred : new Expr.Starred(value, starred.source());
        }
        if (e instanceof Expr.BinOp binary) {
            var left = rewrite(binary.left());
            var right = rewrite(binary.right());
            return left == binary.left() && right == binary.right()
                ? binary
                : new Expr.BinOp(left, binary.op(), right, binary.source());
        }
        if (e instanceof Expr.UnaryOp unary) {
            var operand = rewrite(unary.operand());
            return operand == unary.operand() ? unary : new Expr.UnaryOp(unary.op(), operand, unary.source());
        }
        if (e instanceof Expr.BoolOp bool) {
            var values = rewriteAll(bool.values());
            return values == bool.values() ? bool : new Expr.BoolOp(bool.op(), values, bool.source());
        }
        if (e instanceof Expr.Compare compare) {
            var left = rewrite(compare.left());
            var comparators = rewriteAll(compare.comparators());
            return left == compare.left() && comparators == compare.comparators()
                ? compare
                : new Expr.Compare(left, compare.ops(), comparators, compare.source());
        }
        if (e instanceof Expr.IfExp conditional) {
            var test = rewrite(conditional.test());
            var body = rewrite(conditional.body());
            var orElse = rewrite(conditional.orElse());
            return test == conditional.test() && body == conditional.body() && orElse == conditional.orElse()
                ? conditional
                : new Expr.IfExp(test, body, orElse, conditional.source());
        }
        if (e instanceof Expr.Lambda lambda) {
            var args = rewriteArguments(lambda.args());
            var body = inScope(LocalBindings.ofLambda(lambda), false, () -> rewrite(lambda.body()));
            return args == lambda.args() && body == lambda.body() ? lambda : new Expr.Lambda(args, body, lambda.source());
        }
        if (e instanceof Expr.ListComp comp) {
            var generators = comp.generators();
            var firstIter = rewrite(generators.get(0).iter());
            return inScope(LocalBindings.ofComprehension(generators), false, () -> {
                var elt = rewrite(comp.elt());
                var rewritten = rewriteGenerators(generators, firstIter);
                return elt == comp.elt() && rewritten == generators ? comp : new Expr.ListComp(elt, rewritten, comp.source());
            });
        }
        if (e instanceof Expr.SetComp comp) {
            var generators = comp.generators();
            var firstIter = rewrite(generators.get(0).iter());
            return inScope(LocalBindings.ofComprehension(generators), false, () -> {
                var elt = rewrite(comp.elt());
                var rewritten = rewriteGenerators(generators, firstIter);
                return elt == comp.elt() && rewritten == generators ? comp : new Expr.SetComp(elt, rewritten, comp.source());
            });
        }
        if (e instanceof Expr.GeneratorExp comp) {
            var generators = comp.generators();
            var firstIter = rewrite(generators.get(0).iter());
            return inScope(LocalBindings.ofComprehension(generators), false, () -> {
                var elt = rewrite(comp.elt());
                var rewritten = rewriteGenerators(generators, firstIter);
                return elt == comp.elt() && rewritten == generators
                    ? comp
                    : new Expr.GeneratorExp(elt, rewritten, comp.source());
            });
        }
        if (e instanceof Expr.DictComp comp) {
            var generators = comp.generators();
            var firstIter = rewrite(generators.get(0).iter());
            return inScope(LocalBindings.ofComprehension(generators), false, () -> {
                var key = rewrite(comp.key());
                var value = rewrite(comp.value());
                var rewritten = rewriteGenerators(generators, firstIter);
                return key == comp.key() && value == comp.value() && rewritten == generators
                    ? comp
                    : new Expr.DictComp(key, value, rewritten, comp.source());
            });
        }
        if (e instanceof Expr.NamedExpr named) {
            var value = rewrite(named.value());
            return value == named.value() ? named : new Expr.NamedExpr(named.target(), value, named.source());
        }
        if (e instanceof Expr.Await await) {
            var value = rewrite(await.value());
            return value == await.value() ? await : new Expr.Await(value, await.source());
        }
        if (e instanceof Expr.Yield yielded) {
            var value = rewriteNullable(yielded.value());
            return value == yielded.value() ? yielded : new Expr.Yield(value, yielded.source());
        }
        if (e instanceof Expr.YieldFrom yielded) {
            var value = rewrite(yielded.value());
            return value == yielded.value() ? yielded : new Expr.YieldFrom(value, yielded.source());
        }
        throw new IllegalStateException("Unhandled expression " + e.getClass().getSimpleName());
    }

    protected final Expr rewriteNullable(Expr e) {
        return e == null ? null : rewrite(e);
    }

    protected final List<Expr> rewriteAll(List<Expr> expressions) {
        List<Expr> result = null;
        for (var i = 0; i < expressions.size(); i++) {
            var original = expressions.get(i);
            var rewritten = rewriteNullable(original);
            if (rewritten != original && result == null) {
                result = new ArrayList<>(expressions.subList(0, i));
            }
            if (result != null) {
                result.add(rewritten);
            }
        }
        return result == null ? expressions : Collections.unmodifiableList(result);
    }

    private <T> T inScope(Set<String> names, boolean classBody, Supplier<T> action) {
        scopes.push(new Scope(names, classBody));
        try {
            return action.get();
        } finally {
            scopes.pop();
        }
    }

    private Expr.Arguments rewriteArguments(Expr.Arguments args) {
        var posOnly = rewriteArgs(args.posOnly());
        var regular = rewriteArgs(args.args());
        var varArg = rewriteArg(args.varArg());
        var kwOnly = rewriteArgs(args.kwOnly());
        var kwDefaults = rewriteAll(args.kwDefaults());
        var kwArg = rewriteArg(args.kwArg());
        var defaults = rewriteAll(args.defaults());
        if (posOnly == args.posOnly() && regular == args.args() && varArg == args.varArg() && kwOnly == args.kwOnly()
            && kwDefaults == args.kwDefaults() && kwArg == args.kwArg() && defaults == args.defaults()) {
            return args;
        }
        return new Expr.Arguments(posOnly, regular, varArg, kwOnly, kwDefaults, kwArg, defaults);
    }

    private List<Expr.Arg> rewriteArgs(List<Expr.Arg> args) {
        List<Expr.Arg> result = null;
        for (var i = 0; i < args.size(); i++) {
            var original = args.get(i);
            var rewritten = rewriteArg(original);
            if (rewritten != original && result == null) {
                result = new ArrayList<>(args.subList(0, i));
            }
            if (result != null) {
                result.add(rewritten);
            }
        }
        return result == null ? args : List.copyOf(result);
    }

    private Expr.Arg rewriteArg(Expr.Arg arg) {
        if (arg == null || arg.annotation() == null) {
            return arg;
        }
        var annotation = rewrite(arg.annotation());
        return annotation == arg.annotation() ? arg : new Expr.Arg(arg.name(), annotation, arg.source());
    }

    private List<Expr.Keyword> rewriteKeywords(List<Expr.Keyword> keywords) {
        List<Expr.Keyword> result = null;
        for (var i = 0; i < keywords.size(); i++) {
            var original = keywords.get(i);
            var value = rewrite(original.value());
            if (value != original.value() && result == null) {
                result = new ArrayList<>(keywords.subList(0, i));
            }
            if (result != null) {
                result.add(value == original.value() ? original : new Expr.Keyword(original.arg(), value));
            }
        }
        return result == null ? keywords : List.copyOf(result);
    }

    private List<Expr.DictItem> rewriteDictItems(List<Expr.DictItem> items) {
        List<Expr.DictItem> result = null;
        for (var i = 0; i < items.size(); i++) {
            var original = items.get(i);
            var key = rewriteNullable(original.key());
            var value = rewrite(original.value());
            var changed = key != original.key() || value != original.value();
            if (changed && result == null) {
                result = new ArrayList<>(items.subList(0, i));
            }
            if (result != null) {
                result.add(changed ? new Expr.DictItem(key, value) : original);
            }
        }
        return result == null ? items : Collections.unmodifiableList(result);
    }

    private List<Expr.Comprehension> rewriteGenerators(List<Expr.Comprehension> generators, Expr firstIter) {
        List<Expr.Comprehension> result = null;
        for (var i = 0; i < generators.size(); i++) {
            var original = generators.get(i);
            var target = rewrite(original.target());
            var iter = i == 0 ? firstIter : rewrite(original.iter());
            var ifs = rewriteAll(original.ifs());
            var changed = target != original.target() || iter != original.iter() || ifs != original.ifs();
            if (changed && result == null) {
                result = new ArrayList<>(generators.subList(0, i));
            }
            if (result != null) {
                result.add(changed ? new Expr.Comprehension(target, iter, ifs, original.isAsync()) : original);
            }
        }
        return result == null ? generators : List.copyOf(result);
    }

    private List<Stmt.ExceptHandler> rewriteHandlers(List<Stmt.ExceptHandler> handlers) {
        List<Stmt.ExceptHandler> result = null;
        for (var i = 0; i < handlers.size(); i++) {
            var original = handlers.get(i);
            var type = rewriteNullable(original.type());
            var body = rewriteBody(original.body());
            var changed = type != original.type() || body != original.body();
            if (changed && result == null) {
                result = new ArrayList<>(handlers.subList(0, i));
            }
            if (result != null) {
                result.add(changed ? new Stmt.ExceptHandler(type, original.name(), body, original.source()) : original);
            }
        }
        return result == null ? handlers : List.copyOf(result);
    }

    private List<Stmt.WithItem> rewriteWithItems(List<Stmt.WithItem> items) {
        List<Stmt.WithItem> result = null;
        for (var i = 0; i < items.size(); i++) {
            var original = items.get(i);
            var context = rewrite(original.context());
            var vars = rewriteNullable(original.optionalVars());
            var changed = context != original.context() || vars != original.optionalVars();
            if (changed && result == null) {
                result = new ArrayList<>(items.subList(0, i));
            }
            if (result != null) {
                result.add(changed ? new Stmt.WithItem(context, vars) : original);
            }
        }
        return result == null ? items : List.copyOf(result);
    }
}
