package work.contracts.renderer.syntax;

import java.util.List;

/**
 * Statement nodes. Nodes are immutable; optional children are {@code null}, absent bodies are
 * empty lists.
 */
public sealed interface Stmt {

    Source source();

    record FunctionDef(
        List<Expr> decorators,
        String name,
        Expr.Arguments args,
        Expr returns,
        List<Stmt> body,
        boolean isAsync,
        Source source
    ) implements Stmt {}

    record ClassDef(
        List<Expr> decorators,
        String name,
        List<Expr> bases,
        List<Expr.Keyword> keywords,
        List<Stmt> body,
        Source source
    ) implements Stmt {}

    record Assign(List<Expr> targets, Expr value, Source source) implements Stmt {}

    record AnnAssign(Expr target, Expr annotation, Expr value, Source source) implements Stmt {}

    /** {@code op} is the binary operator without the trailing '='. */
    record AugAssign(Expr target, String op, Expr value, Source source) implements Stmt {}

    record ExprStmt(Expr value, Source source) implements Stmt {}

    record Return(Expr value, Source source) implements Stmt {}

    record Pass(Source source) implements Stmt {}

    record Break(Source source) implements Stmt {}

    record Continue(Source source) implements Stmt {}

    record Raise(Expr exc, Expr cause, Source source) implements Stmt {}

    record Delete(List<Expr> targets, Source source) implements Stmt {}

    record Assert(Expr test, Expr msg, Source source) implements Stmt {}

    record Global(List<String> names, Source source) implements Stmt {}

    record Nonlocal(List<String> names, Source source) implements Stmt {}

    record Import(List<Alias> names, Source source) implements Stmt {}

    /** {@code module} is null for {@code from . import x}; {@code level} counts leading dots. */
    record ImportFrom(String module, List<Alias> names, int level, Source source) implements Stmt {}

    record If(Expr test, List<Stmt> body, List<Stmt> orElse, Source source) implements Stmt {}

    record For(Expr target, Expr iter, List<Stmt> body, List<Stmt> orElse, boolean isAsync, Source source)
        implements Stmt {}

    record While(Expr test, List<Stmt> body, List<Stmt> orElse, Source source) implements Stmt {}

    record Try(
        List<Stmt> body,
        List<ExceptHandler> handlers,
        List<Stmt> orElse,
        List<Stmt> finalBody,
        Source source
    ) implements Stmt {}

    record With(List<WithItem> items, List<Stmt> body, boolean isAsync, Source source) implements Stmt {}

    record Alias(String name, String asName) {
        public String boundName() {
            if (asName != null) {
                return asName;
            }
            var dot = name.indexOf('.');
            return dot < 0 ? name : name.substring(0, dot);
        }
    }

    record ExceptHandler(Expr type, String name, List<Stmt> body, Source source) {}

    record WithItem(Expr context, Expr optionalVars) {}
}
