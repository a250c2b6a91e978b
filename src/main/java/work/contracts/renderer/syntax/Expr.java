package work.contracts.renderer.syntax;

import java.util.ArrayList;
import java.util.List;

/**
 * Expression nodes. Nodes are immutable; optional children are {@code null}.
 */
public sealed interface Expr {

    Source source();

    enum ConstantKind {
        STRING,
        BYTES,
        NUMBER,
        TRUE,
        FALSE,
        NONE,
        ELLIPSIS
    }

    record Name(String id, Source source) implements Expr {}

    record Attribute(Expr value, String attr, Source source) implements Expr {}

    /**
     * Literal value. Strings and bytes hold their decoded text (bytes as ISO-8859-1 chars), numbers
     * hold the literal as written.
     */
    record Constant(ConstantKind kind, String value, Source source) implements Expr {
        public static Constant string(String value) {
            return new Constant(ConstantKind.STRING, value, Source.NONE);
        }

        public boolean isString() {
            return kind == ConstantKind.STRING;
        }
    }

    /** f-string; values are string constants and {@link FormattedValue}s. */
    record JoinedStr(List<Expr> values, Source source) implements Expr {}

    /** Replacement field of an f-string. {@code conversion} is 's', 'r', 'a' or 0 for none. */
    record FormattedValue(Expr value, char conversion, JoinedStr formatSpec, Source source) implements Expr {}

    record Call(Expr func, List<Expr> args, List<Keyword> keywords, Source source) implements Expr {}

    record Subscript(Expr value, Expr slice, Source source) implements Expr {}

    record Slice(Expr lower, Expr upper, Expr step, Source source) implements Expr {}

    record ListExpr(List<Expr> elts, Source source) implements Expr {}

    record TupleExpr(List<Expr> elts, Source source) implements Expr {}

    record SetExpr(List<Expr> elts, Source source) implements Expr {}

    record DictExpr(List<DictItem> items, Source source) implements Expr {}

    record Starred(Expr value, Source source) implements Expr {}

    record BinOp(Expr left, String op, Expr right, Source source) implements Expr {}

    record UnaryOp(String op, Expr operand, Source source) implements Expr {}

    record BoolOp(String op, List<Expr> values, Source source) implements Expr {}

    record Compare(Expr left, List<String> ops, List<Expr> comparators, Source source) implements Expr {}

    record IfExp(Expr test, Expr body, Expr orElse, Source source) implements Expr {}

    record Lambda(Arguments args, Expr body, Source source) implements Expr {}

    record ListComp(Expr elt, List<Comprehension> generators, Source source) implements Expr {}

    record SetComp(Expr elt, List<Comprehension> generators, Source source) implements Expr {}

    record GeneratorExp(Expr elt, List<Comprehension> generators, Source source) implements Expr {}

    record DictComp(Expr key, Expr value, List<Comprehension> generators, Source source) implements Expr {}

    record NamedExpr(Name target, Expr value, Source source) implements Expr {}

    record Await(Expr value, Source source) implements Expr {}

    record Yield(Expr value, Source source) implements Expr {}

    record YieldFrom(Expr value, Source source) implements Expr {}

    /** Keyword argument; {@code arg} is null for {@code **mapping}. */
    record Keyword(String arg, Expr value) {}

    /** Dict display entry; {@code key} is null for {@code **mapping}. */
    record DictItem(Expr key, Expr value) {}

    record Comprehension(Expr target, Expr iter, List<Expr> ifs, boolean isAsync) {}

    record Arg(String name, Expr annotation, Source source) {}

    /**
     * Parameter list. {@code defaults} align with the tail of {@code posOnly + args};
     * {@code kwDefaults} align one to one with {@code kwOnly} and may hold nulls.
     */
    record Arguments(
        List<Arg> posOnly,
        List<Arg> args,
        Arg varArg,
        List<Arg> kwOnly,
        List<Expr> kwDefaults,
        Arg kwArg,
        List<Expr> defaults
    ) {
        public static final Arguments EMPTY = new Arguments(List.of(), List.of(), null, List.of(), List.of(), null, List.of());

        public List<Arg> all() {
            var all = new ArrayList<Arg>(posOnly);
            all.addAll(args);
            if (varArg != null) {
                all.add(varArg);
            }
            all.addAll(kwOnly);
            if (kwArg != null) {
                all.add(kwArg);
            }
            return all;
        }
    }
}
