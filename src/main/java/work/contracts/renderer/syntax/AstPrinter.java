package work.contracts.renderer.syntax;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Serializes syntax trees back into source text. Parentheses are emitted only where operator
 * precedence requires them; strings use double quotes.
 */
public final class AstPrinter {
    private static final String INDENT = "    ";
    private static final int MAX_LINE_LENGTH = 100;

    private static final Map<String, Precedence> BINARY_PRECEDENCE = Map.ofEntries(
        Map.entry("|", Precedence.BOR),
        Map.entry("^", Precedence.BXOR),
        Map.entry("&", Precedence.BAND),
        Map.entry("<<", Precedence.SHIFT),
        Map.entry(">>", Precedence.SHIFT),
        Map.entry("+", Precedence.ARITH),
        Map.entry("-", Precedence.ARITH),
        Map.entry("*", Precedence.TERM),
        Map.entry("@", Precedence.TERM),
        Map.entry("/", Precedence.TERM),
        Map.entry("%", Precedence.TERM),
        Map.entry("//", Precedence.TERM),
        Map.entry("**", Precedence.POWER)
    );

    private enum Precedence {
        NAMED_EXPR,
        TUPLE,
        YIELD,
        TEST,
        OR,
        AND,
        NOT,
        CMP,
        BOR,
        BXOR,
        BAND,
        SHIFT,
        ARITH,
        TERM,
        FACTOR,
        POWER,
        AWAIT,
        ATOM;

        Precedence next() {
            return values()[Math.min(ordinal() + 1, ATOM.ordinal())];
        }
    }

    private final StringBuilder out = new StringBuilder();
    private int indent = 0;
    private char quote = '"';

    private AstPrinter() {
    }

    /** Prints a whole module. The result ends with a newline unless the module is empty. */
    public static String print(List<Stmt> module) {
        var printer = new AstPrinter();
        printer.statements(module);
        return printer.out.toString();
    }

    /** Prints one statement (including nested blocks) without a trailing newline. */
    public static String print(Stmt statement) {
        var printer = new AstPrinter();
        printer.statement(statement);
        return printer.out.toString().stripTrailing();
    }

    public static String print(Expr expression) {
        return new AstPrinter().expr(expression, Precedence.NAMED_EXPR);
    }

    /** Structural equality: equal except for source positions. */
    public static boolean sameStructure(Stmt left, Stmt right) {
        return print(left).equals(print(right));
    }

    // ---- statements ----

    private void statements(List<Stmt> body) {
        var previousWasDefinition = false;
        for (var i = 0; i < body.size(); i++) {
            var statement = body.get(i);
            var isDefinition = statement instanceof Stmt.FunctionDef || statement instanceof Stmt.ClassDef;
            if (i > 0 && (isDefinition || previousWasDefinition)) {
                out.append('\n');
            }
            statement(statement);
            previousWasDefinition = isDefinition;
        }
    }

    private void block(List<Stmt> body) {
        indent++;
        if (body.isEmpty()) {
            line("pass");
        } else {
            statements(body);
        }
        indent--;
    }

    private void line(String text) {
        out.append(INDENT.repeat(indent)).append(text).append('\n');
    }

    private void statement(Stmt statement) {
        if (statement instanceof Stmt.FunctionDef def) {
            def.decorators().forEach(decorator -> line("@" + expr(decorator, Precedence.TEST)));
            var header = new StringBuilder(def.isAsync() ? "async def " : "def ")
                .append(def.name()).append('(').append(arguments(def.args(), true)).append(')');
            if (def.returns() != null) {
                header.append(" -> ").append(expr(def.returns(), Precedence.TEST));
            }
            line(header.append(':').toString());
            block(def.body());
        } else if (statement instanceof Stmt.ClassDef cls) {
            cls.decorators().forEach(decorator -> line("@" + expr(decorator, Precedence.TEST)));
            var header = new StringBuilder("class ").append(cls.name());
            if (!cls.bases().isEmpty() || !cls.keywords().isEmpty()) {
                header.append('(').append(callArguments(cls.bases(), cls.keywords())).append(')');
            }
            line(header.append(':').toString());
            block(cls.body());
        } else if (statement instanceof Stmt.Assign assign) {
            var text = new StringBuilder();
            for (var target : assign.targets()) {
                text.append(expr(target, Precedence.TUPLE)).append(" = ");
            }
            line(text.append(expr(assign.value(), Precedence.YIELD)).toString());
        } else if (statement instanceof Stmt.AnnAssign assign) {
            var text = new StringBuilder(expr(assign.target(), Precedence.TEST))
                .append(": ").append(expr(assign.annotation(), Precedence.TEST));
            if (assign.value() != null) {
                text.append(" = ").append(expr(assign.value(), Precedence.YIELD));
            }
            line(text.toString());
        } else if (statement instanceof Stmt.AugAssign assign) {
            line(expr(assign.target(), Precedence.TEST) + " " + assign.op() + "= "
                + expr(assign.value(), Precedence.YIELD));
        } else if (statement instanceof Stmt.ExprStmt expression) {
            if (expression.value() instanceof Expr.Constant constant && constant.isString()
                && constant.value().indexOf('\n') >= 0) {
                docstring(constant.value());
            } else {
                line(expr(expression.value(), Precedence.YIELD));
            }
        } else if (statement instanceof Stmt.Return ret) {
            line(ret.value() == null ? "return" : "return " + expr(ret.value(), Precedence.TEST));
        } else if (statement instanceof Stmt.Pass) {
            line("pass");
        } else if (statement instanceof Stmt.Break) {
            line("break");
        } else if (statement instanceof Stmt.Continue) {
            line("continue");
        } else if (statement instanceof Stmt.Raise raise) {
            var text = new StringBuilder("raise");
            if (raise.exc() != null) {
                text.append(' ').append(expr(raise.exc(), Precedence.TEST));
                if (raise.cause() != null) {
                    text.append(" from ").append(expr(raise.cause(), Precedence.TEST));
                }
            }
            line(text.toString());
        } else if (statement instanceof Stmt.Delete delete) {
            line("del " + join(delete.targets(), Precedence.TEST));
        } else if (statement instanceof Stmt.Assert check) {
            var text = "assert " + expr(check.test(), Precedence.TEST);
            if (check.msg() != null) {
                text += ", " + expr(check.msg(), Precedence.TEST);
            }
            line(text);
        } else if (statement instanceof Stmt.Global global) {
            line("global " + String.join(", ", global.names()));
        } else if (statement instanceof Stmt.Nonlocal nonlocal) {
            line("nonlocal " + String.join(", ", nonlocal.names()));
        } else if (statement instanceof Stmt.Import imp) {
            var names = new ArrayList<String>();
            imp.names().forEach(alias -> names.add(alias(alias)));
            line("import " + String.join(", ", names));
        } else if (statement instanceof Stmt.ImportFrom imp) {
            importFrom(imp);
        } else if (statement instanceof Stmt.If branch) {
            line("if " + expr(branch.test(), Precedence.TEST) + ":");
            block(branch.body());
            var orElse = branch.orElse();
            while (orElse.size() == 1 && orElse.get(0) instanceof Stmt.If elif) {
                line("elif " + expr(elif.test(), Precedence.TEST) + ":");
                block(elif.body());
                orElse = elif.orElse();
            }
            if (!orElse.isEmpty()) {
                line("else:");
                block(orElse);
            }
        } else if (statement instanceof Stmt.For loop) {
            line((loop.isAsync() ? "async for " : "for ") + expr(loop.target(), Precedence.TUPLE)
                + " in " + expr(loop.iter(), Precedence.TEST) + ":");
            block(loop.body());
            if (!loop.orElse().isEmpty()) {
                line("else:");
                block(loop.orElse());
            }
        } else if (statement instanceof Stmt.While loop) {
            line("while " + expr(loop.test(), Precedence.TEST) + ":");
            block(loop.body());
            if (!loop.orElse().isEmpty()) {
                line("else:");
                block(loop.orElse());
            }
        } else if (statement instanceof Stmt.Try attempt) {
            line("try:");
            block(attempt.body());
            for (var handler : attempt.handlers()) {
                var text = new StringBuilder("except");
                if (handler.type() != null) {
                    text.append(' ').append(expr(handler.type(), Precedence.TEST));
                    if (handler.name() != null) {
                        text.append(" as ").append(handler.name());
                    }
                }
                line(text.append(':').toString());
                block(handler.body());
            }
            if (!attempt.orElse().isEmpty()) {
                line("else:");
                block(attempt.orElse());
            }
            if (!attempt.finalBody().isEmpty()) {
                line("finally:");
                block(attempt.finalBody());
            }
        } else if (statement instanceof Stmt.With with) {
            var items = new ArrayList<String>();
            for (var item : with.items()) {
                var text = expr(item.context(), Precedence.TEST);
                if (item.optionalVars() != null) {
                    text += " as " + expr(item.optionalVars(), Precedence.TEST);
                }
                items.add(text);
            }
            line((with.isAsync() ? "async with " : "with ") + String.join(", ", items) + ":");
            block(with.body());
        } else {
            throw new IllegalStateException("Unhandled statement " + statement.getClass().getSimpleName());
        }
    }

    private void importFrom(Stmt.ImportFrom imp) {
        var prefix = "from " + ".".repeat(imp.level()) + (imp.module() == null ? "" : imp.module()) + " import ";
        var names = new ArrayList<String>();
        imp.names().forEach(alias -> names.add(alias(alias)));
        var single = prefix + String.join(", ", names);
        if (INDENT.length() * indent + single.length() <= MAX_LINE_LENGTH || names.contains("*")) {
            line(single);
            return;
        }
        line(prefix + "(");
        indent++;
        names.forEach(name -> line(name + ","));
        indent--;
        line(")");
    }

    private static String alias(Stmt.Alias alias) {
        return alias.asName() == null ? alias.name() : alias.name() + " as " + alias.asName();
    }

    private void docstring(String value) {
        var body = new StringBuilder();
        for (var i = 0; i < value.length(); i++) {
            var c = value.charAt(i);
            if (c == '\\') {
                body.append("\\\\");
            } else if (c == '"' && (i == value.length() - 1 || value.startsWith("\"\"", i + 1))) {
                body.append("\\\"");
            } else if (c == '\n' || c == '\t') {
                body.append(c);
            } else {
                body.append(escape(c, '\0'));
            }
        }
        var lines = body.toString().split("\n", -1);
        var text = new StringBuilder(INDENT.repeat(indent)).append("\"\"\"");
        for (var i = 0; i < lines.length; i++) {
            if (i > 0) {
                text.append('\n');
            }
            text.append(lines[i]);
        }
        out.append(text).append("\"\"\"\n");
    }

    // ---- expressions ----

    private String join(List<Expr> expressions, Precedence context) {
        var parts = new ArrayList<String>();
        expressions.forEach(expression -> parts.add(expr(expression, context)));
        return String.join(", ", parts);
    }

    private String wrap(String text, Precedence own, Precedence context) {
        return own.ordinal() < context.ordinal() ? "(" + text + ")" : text;
    }

    private String expr(Expr e, Precedence context) {
        if (e instanceof Expr.Name name) {
            return name.id();
        }
        if (e instanceof Expr.Constant constant) {
            return constant(constant);
        }
        if (e instanceof Expr.Attribute attribute) {
            var value = expr(attribute.value(), Precedence.ATOM);
            if (attribute.value() instanceof Expr.Constant constant
                && constant.kind() == Expr.ConstantKind.NUMBER && constant.value().chars().allMatch(Character::isDigit)) {
                value = "(" + value + ")";
            }
            return value + "." + attribute.attr();
        }
        if (e instanceof Expr.Call call) {
            String args;
            if (call.args().size() == 1 && call.keywords().isEmpty() && call.args().get(0) instanceof Expr.GeneratorExp generator) {
                args = comprehension(generator.elt(), null, generator.generators());
            } else {
                args = callArguments(call.args(), call.keywords());
            }
            return expr(call.func(), Precedence.ATOM) + "(" + args + ")";
        }
        if (e instanceof Expr.Subscript subscript) {
            String slice;
            if (subscript.slice() instanceof Expr.TupleExpr tuple && !tuple.elts().isEmpty()) {
                slice = tuple.elts().size() == 1
                    ? expr(tuple.elts().get(0), Precedence.TEST) + ","
                    : join(tuple.elts(), Precedence.TEST);
            } else {
                slice = expr(subscript.slice(), Precedence.TUPLE);
            }
            return expr(subscript.value(), Precedence.ATOM) + "[" + slice + "]";
        }
        if (e instanceof Expr.Slice slice) {
            var text = new StringBuilder();
            if (slice.lower() != null) {
                text.append(expr(slice.lower(), Precedence.TEST));
            }
            text.append(':');
            if (slice.upper() != null) {
                text.append(expr(slice.upper(), Precedence.TEST));
            }
            if (slice.step() != null) {
                text.append(':').append(expr(slice.step(), Precedence.TEST));
            }
            return text.toString();
        }
        if (e instanceof Expr.ListExpr list) {
            return "[" + join(list.elts(), Precedence.TEST) + "]";
        }
        if (e instanceof Expr.TupleExpr tuple) {
            if (tuple.elts().isEmpty()) {
                return "()";
            }
            var text = tuple.elts().size() == 1
                ? expr(tuple.elts().get(0), Precedence.TEST) + ","
                : join(tuple.elts(), Precedence.TEST);
            return wrap(text, Precedence.TUPLE, context);
        }
        if (e instanceof Expr.SetExpr set) {
            return set.elts().isEmpty() ? "{*()}" : "{" + join(set.elts(), Precedence.TEST) + "}";
        }
        if (e instanceof Expr.DictExpr dict) {
            var items = new ArrayList<String>();
            for (var item : dict.items()) {
                if (item.key() == null) {
                    items.add("**" + expr(item.value(), Precedence.BOR));
                } else {
                    items.add(expr(item.key(), Precedence.TEST) + ": " + expr(item.value(), Precedence.TEST));
                }
            }
            return "{" + String.join(", ", items) + "}";
        }
        if (e instanceof Expr.Starred starred) {
            return "*" + expr(starred.value(), Precedence.BOR);
        }
        if (e instanceof Expr.BinOp binary) {
            var own = BINARY_PRECEDENCE.get(binary.op());
            var rightAssociative = binary.op().equals("**");
            var left = expr(binary.left(), rightAssociative ? own.next() : own);
            var right = expr(binary.right(), rightAssociative ? own : own.next());
            return wrap(left + " " + binary.op() + " " + right, own, context);
        }
        if (e instanceof Expr.UnaryOp unary) {
            if (unary.op().equals("not")) {
                return wrap("not " + expr(unary.operand(), Precedence.NOT), Precedence.NOT, context);
            }
            return wrap(unary.op() + expr(unary.operand(), Precedence.FACTOR), Precedence.FACTOR, context);
        }
        if (e instanceof Expr.BoolOp bool) {
            var own = bool.op().equals("and") ? Precedence.AND : Precedence.OR;
            var parts = new ArrayList<String>();
            bool.values().forEach(value -> parts.add(expr(value, own.next())));
            return wrap(String.join(" " + bool.op() + " ", parts), own, context);
        }
        if (e instanceof Expr.Compare compare) {
            var text = new StringBuilder(expr(compare.left(), Precedence.BOR));
            for (var i = 0; i < compare.ops().size(); i++) {
                text.append(' ').append(compare.ops().get(i)).append(' ')
                    .append(expr(compare.comparators().get(i), Precedence.BOR));
            }
            return wrap(text.toString(), Precedence.CMP, context);
        }
        if (e instanceof Expr.IfExp conditional) {
            var text = expr(conditional.body(), Precedence.OR) + " if " + expr(conditional.test(), Precedence.OR)
                + " else " + expr(conditional.orElse(), Precedence.TEST);
            return wrap(text, Precedence.TEST, context);
        }
        if (e instanceof Expr.Lambda lambda) {
            var params = arguments(lambda.args(), false);
            var text = "lambda" + (params.isEmpty() ? "" : " " + params) + ": " + expr(lambda.body(), Precedence.TEST);
            return wrap(text, Precedence.TEST, context);
        }
        if (e instanceof Expr.ListComp comp) {
            return "[" + comprehension(comp.elt(), null, comp.generators()) + "]";
        }
        if (e instanceof Expr.SetComp comp) {
            return "{" + comprehension(comp.elt(), null, comp.generators()) + "}";
        }
        if (e instanceof Expr.GeneratorExp comp) {
            return "(" + comprehension(comp.elt(), null, comp.generators()) + ")";
        }
        if (e instanceof Expr.DictComp comp) {
            return "{" + comprehension(comp.key(), comp.value(), comp.generators()) + "}";
        }
        if (e instanceof Expr.NamedExpr named) {
            return wrap(named.target().id() + " := " + expr(named.value(), Precedence.TEST), Precedence.NAMED_EXPR, context);
        }
        if (e instanceof Expr.Await await) {
            return wrap("await " + expr(await.value(), Precedence.ATOM), Precedence.AWAIT, context);
        }
        if (e instanceof Expr.Yield yielded) {
            var text = yielded.value() == null ? "yield" : "yield " + expr(yielded.value(), Precedence.TUPLE);
            return wrap(text, Precedence.YIELD, context);
        }
        if (e instanceof Expr.YieldFrom yielded) {
            return wrap("yield from " + expr(yielded.value(), Precedence.TEST), Precedence.YIELD, context);
        }
        if (e instanceof Expr.JoinedStr joined) {
            return "f" + quote + fstringBody(joined) + quote;
        }
        if (e instanceof Expr.FormattedValue formatted) {
            return "f" + quote + field(formatted) + quote;
        }
        throw new IllegalStateException("Unhandled expression " + e.getClass().getSimpleName());
    }

    private String comprehension(Expr elt, Expr value, List<Expr.Comprehension> generators) {
        var text = new StringBuilder(expr(elt, Precedence.TEST));
        if (value != null) {
            text.append(": ").append(expr(value, Precedence.TEST));
        }
        for (var generator : generators) {
            text.append(generator.isAsync() ? " async for " : " for ")
                .append(expr(generator.target(), Precedence.TUPLE))
                .append(" in ")
                .append(expr(generator.iter(), Precedence.OR));
            for (var condition : generator.ifs()) {
                text.append(" if ").append(expr(condition, Precedence.OR));
            }
        }
        return text.toString();
    }

    private String callArguments(List<Expr> args, List<Expr.Keyword> keywords) {
        var parts = new ArrayList<String>();
        args.forEach(arg -> parts.add(expr(arg, Precedence.TEST)));
        for (var keyword : keywords) {
            parts.add(keyword.arg() == null
                ? "**" + expr(keyword.value(), Precedence.TEST)
                : keyword.arg() + "=" + expr(keyword.value(), Precedence.TEST));
        }
        return String.join(", ", parts);
    }

    private String arguments(Expr.Arguments args, boolean annotations) {
        var parts = new ArrayList<String>();
        var positional = new ArrayList<Expr.Arg>(args.posOnly());
        positional.addAll(args.args());
        var firstDefault = positional.size() - args.defaults().size();
        for (var i = 0; i < positional.size(); i++) {
            var arg = positional.get(i);
            var text = arg(arg, annotations);
            if (i >= firstDefault) {
                text += defaultSeparator(arg, annotations) + expr(args.defaults().get(i - firstDefault), Precedence.TEST);
            }
            parts.add(text);
            if (i == args.posOnly().size() - 1) {
                parts.add("/");
            }
        }
        if (args.varArg() != null) {
            parts.add("*" + arg(args.varArg(), annotations));
        } else if (!args.kwOnly().isEmpty()) {
            parts.add("*");
        }
        for (var i = 0; i < args.kwOnly().size(); i++) {
            var arg = args.kwOnly().get(i);
            var text = arg(arg, annotations);
            var defaultValue = i < args.kwDefaults().size() ? args.kwDefaults().get(i) : null;
            if (defaultValue != null) {
                text += defaultSeparator(arg, annotations) + expr(defaultValue, Precedence.TEST);
            }
            parts.add(text);
        }
        if (args.kwArg() != null) {
            parts.add("**" + arg(args.kwArg(), annotations));
        }
        return String.join(", ", parts);
    }

    private String arg(Expr.Arg arg, boolean annotations) {
        if (annotations && arg.annotation() != null) {
            return arg.name() + ": " + expr(arg.annotation(), Precedence.TEST);
        }
        return arg.name();
    }

    private static String defaultSeparator(Expr.Arg arg, boolean annotations) {
        return annotations && arg.annotation() != null ? " = " : "=";
    }

    // ---- literals ----

    private String constant(Expr.Constant constant) {
        return switch (constant.kind()) {
            case STRING -> quoted(constant.value(), false);
            case BYTES -> "b" + quoted(constant.value(), true);
            case NUMBER, TRUE, FALSE, NONE, ELLIPSIS -> constant.value();
        };
    }

    private String quoted(String value, boolean bytes) {
        var q = quote;
        var other = q == '"' ? '\'' : '"';
        if (value.indexOf(q) >= 0 && value.indexOf(other) < 0) {
            q = other;
        }
        var text = new StringBuilder().append(q);
        for (var i = 0; i < value.length(); i++) {
            var c = value.charAt(i);
            if (bytes && c >= 0x7f) {
                text.append(String.format("\\x%02x", (int) c));
            } else {
                text.append(escape(c, q));
            }
        }
        return text.append(q).toString();
    }

    private static String escape(char c, char quoteChar) {
        switch (c) {
            case '\\':
                return "\\\\";
            case '\n':
                return "\\n";
            case '\r':
                return "\\r";
            case '\t':
                return "\\t";
            default:
                if (c < 0x20 || c == 0x7f) {
                    return String.format("\\x%02x", (int) c);
                }
                if (c == quoteChar) {
                    return "\\" + c;
                }
                return String.valueOf(c);
        }
    }

    private String fstringBody(Expr.JoinedStr joined) {
        var text = new StringBuilder();
        for (var value : joined.values()) {
            if (value instanceof Expr.Constant constant) {
                for (var i = 0; i < constant.value().length(); i++) {
                    var c = constant.value().charAt(i);
                    if (c == '{' || c == '}') {
                        text.append(c).append(c);
                    } else {
                        text.append(escape(c, quote));
                    }
                }
            } else if (value instanceof Expr.FormattedValue formatted) {
                text.append(field(formatted));
            }
        }
        return text.toString();
    }

    private String field(Expr.FormattedValue formatted) {
        var outer = quote;
        quote = outer == '"' ? '\'' : '"';
        String inner;
        try {
            inner = expr(formatted.value(), Precedence.TEST.next());
        } finally {
            quote = outer;
        }
        var text = new StringBuilder("{");
        if (inner.startsWith("{")) {
            text.append(' ');
        }
        text.append(inner);
        if (formatted.conversion() != 0) {
            text.append('!').append(formatted.conversion());
        }
        if (formatted.formatSpec() != null) {
            text.append(':').append(fstringBody(formatted.formatSpec()));
        }
        return text.append('}').toString();
    }
}
