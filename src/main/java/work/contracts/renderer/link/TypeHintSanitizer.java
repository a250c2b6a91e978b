package work.contracts.renderer.link;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import work.contracts.renderer.syntax.AstRewriter;
import work.contracts.renderer.syntax.Expr;
import work.contracts.renderer.syntax.Stmt;

/**
 * Replaces development-only vault types in parameter and return annotations with {@code Any},
 * looking through subscripts, {@code |} unions and tuple/list/set displays.
 */
final class TypeHintSanitizer extends AstRewriter {
    static final String PLACEHOLDER = "Any";

    private final Set<String> vaultTypeNames;
    private boolean replaced;

    TypeHintSanitizer(Set<String> vaultTypeNames) {
        this.vaultTypeNames = vaultTypeNames;
    }

    boolean replaced() {
        return replaced;
    }

    @Override
    public Stmt rewrite(Stmt s) {
        var rewritten = super.rewrite(s);
        if (!(rewritten instanceof Stmt.FunctionDef def)) {
            return rewritten;
        }
        var args = def.args();
        var posOnly = sanitizeArgs(args.posOnly());
        var regular = sanitizeArgs(args.args());
        var kwOnly = sanitizeArgs(args.kwOnly());
        var returns = def.returns() == null ? null : sanitize(def.returns());
        if (posOnly == args.posOnly() && regular == args.args() && kwOnly == args.kwOnly() && returns == def.returns()) {
            return def;
        }
        var sanitizedArgs = new Expr.Arguments(
            posOnly, regular, args.varArg(), kwOnly, args.kwDefaults(), args.kwArg(), args.defaults());
        return new Stmt.FunctionDef(
            def.decorators(), def.name(), sanitizedArgs, returns, def.body(), def.isAsync(), def.source());
    }

    private List<Expr.Arg> sanitizeArgs(List<Expr.Arg> args) {
        List<Expr.Arg> result = null;
        for (var i = 0; i < args.size(); i++) {
            var arg = args.get(i);
            var annotation = arg.annotation() == null ? null : sanitize(arg.annotation());
            if (annotation != arg.annotation() && result == null) {
                result = new ArrayList<>(args.subList(0, i));
            }
            if (result != null) {
                result.add(annotation == arg.annotation() ? arg : new Expr.Arg(arg.name(), annotation, arg.source()));
            }
        }
        return result == null ? args : List.copyOf(result);
    }

    private Expr sanitize(Expr annotation) {
        if (annotation instanceof Expr.Name name) {
            if (vaultTypeNames.contains(name.id())) {
                replaced = true;
                return new Expr.Name(PLACEHOLDER, name.source());
            }
            return name;
        }
        if (annotation instanceof Expr.Subscript subscript) {
            var slice = sanitize(subscript.slice());
            return slice == subscript.slice() ? subscript : new Expr.Subscript(subscript.value(), slice, subscript.source());
        }
        if (annotation instanceof Expr.BinOp union) {
            var left = sanitize(union.left());
            var right = sanitize(union.right());
            return left == union.left() && right == union.right()
                ? union
                : new Expr.BinOp(left, union.op(), right, union.source());
        }
        if (annotation instanceof Expr.TupleExpr tuple) {
            var elts = sanitizeAll(tuple.elts());
            return elts == tuple.elts() ? tuple : new Expr.TupleExpr(elts, tuple.source());
        }
        if (annotation instanceof Expr.ListExpr list) {
            var elts = sanitizeAll(list.elts());
            return elts == list.elts() ? list : new Expr.ListExpr(elts, list.source());
        }
        if (annotation instanceof Expr.SetExpr set) {
            var elts = sanitizeAll(set.elts());
            return elts == set.elts() ? set : new Expr.SetExpr(elts, set.source());
        }
        return annotation;
    }

    private List<Expr> sanitizeAll(List<Expr> elts) {
        var changed = false;
        var result = new ArrayList<Expr>(elts.size());
        for (var elt : elts) {
            var sanitized = sanitize(elt);
            changed |= sanitized != elt;
            result.add(sanitized);
        }
        return changed ? List.copyOf(result) : elts;
    }
}
