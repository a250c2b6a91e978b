package work.contracts.renderer.syntax;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * Recursive descent parser for contract modules.
 */
public final class SourceParser extends Parser {
    private static final Set<String> AUGMENTED_OPS = Set.of(
        "+=", "-=", "*=", "/=", "//=", "%=", "**=", ">>=", "<<=", "&=", "|=", "^=", "@="
    );
    private static final Set<String> COMPARISON_OPS = Set.of("<", ">", "==", ">=", "<=", "!=");
    private static final Set<String> EXPRESSION_KEYWORDS = Set.of(
        "not", "lambda", "await", "None", "True", "False"
    );
    private static final Set<String> EXPRESSION_OPS = Set.of("(", "[", "{", "-", "+", "~", "*", "...");

    public SourceParser(List<Token> tokens) {
        super(tokens);
    }

    public static List<Stmt> parseModule(String fileName, String content) {
        return new SourceParser(new Lexer(fileName, content).tokenize()).parseModule();
    }

    static Expr parseFieldExpression(String fileName, String text, Source at) {
        var parser = new SourceParser(new Lexer(fileName, "(" + text + ")").tokenize());
        var expression = parser.parseAtom();
        parser.expect(Token.Type.NEWLINE);
        if (parser.current.type != Token.Type.ENDMARKER) {
            throw syntaxError("f-string: invalid expression", at);
        }
        return expression;
    }

    public List<Stmt> parseModule() {
        var body = new ArrayList<Stmt>();
        while (current.type != Token.Type.ENDMARKER) {
            if (current.type == Token.Type.NEWLINE) {
                next();
                continue;
            }
            body.addAll(parseStatement());
        }
        return body;
    }

    // ---- statements ----

    private List<Stmt> parseStatement() {
        if (current.type == Token.Type.INDENT) {
            throw syntaxError("unexpected indent", current.source);
        }
        if (atOp("@")) {
            return List.of(parseDecorated());
        }
        var start = current.source;
        if (current.type == Token.Type.NAME) {
            switch (current.content) {
                case "def" -> {
                    next();
                    return List.of(parseFunctionDef(List.of(), false, start));
                }
                case "class" -> {
                    next();
                    return List.of(parseClassDef(List.of(), start));
                }
                case "if" -> {
                    next();
                    return List.of(parseIf(start));
                }
                case "for" -> {
                    next();
                    return List.of(parseFor(false, start));
                }
                case "while" -> {
                    next();
                    return List.of(parseWhile(start));
                }
                case "try" -> {
                    next();
                    return List.of(parseTry(start));
                }
                case "with" -> {
                    next();
                    return List.of(parseWith(false, start));
                }
                case "async" -> {
                    next();
                    if (acceptKeyword("def")) {
                        return List.of(parseFunctionDef(List.of(), true, start));
                    }
                    if (acceptKeyword("for")) {
                        return List.of(parseFor(true, start));
                    }
                    if (acceptKeyword("with")) {
                        return List.of(parseWith(true, start));
                    }
                    throw unexpected("'def', 'for' or 'with'");
                }
                default -> {
                }
            }
        }
        return parseSimpleStatements();
    }

    private Stmt parseDecorated() {
        var start = current.source;
        var decorators = new ArrayList<Expr>();
        while (acceptOp("@")) {
            decorators.add(parseNamedExprTest());
            expect(Token.Type.NEWLINE);
        }
        if (acceptKeyword("def")) {
            return parseFunctionDef(decorators, false, start);
        }
        if (acceptKeyword("async")) {
            expectKeyword("def");
            return parseFunctionDef(decorators, true, start);
        }
        if (acceptKeyword("class")) {
            return parseClassDef(decorators, start);
        }
        throw unexpected("'def' or 'class'");
    }

    private Stmt parseFunctionDef(List<Expr> decorators, boolean isAsync, Source start) {
        var name = expectName();
        expectOp("(");
        var args = parseParameters(")", true);
        expectOp(")");
        Expr returns = null;
        if (acceptOp("->")) {
            returns = parseTest();
        }
        var body = parseBlock();
        return new Stmt.FunctionDef(List.copyOf(decorators), name, args, returns, body, isAsync, span(start));
    }

    private Stmt parseClassDef(List<Expr> decorators, Source start) {
        var name = expectName();
        var bases = new ArrayList<Expr>();
        var keywords = new ArrayList<Expr.Keyword>();
        if (acceptOp("(")) {
            parseArguments(bases, keywords);
        }
        var body = parseBlock();
        return new Stmt.ClassDef(List.copyOf(decorators), name, List.copyOf(bases), List.copyOf(keywords), body, span(start));
    }

    private Stmt.If parseIf(Source start) {
        var test = parseNamedExprTest();
        var body = parseBlock();
        List<Stmt> orElse = List.of();
        if (atKeyword("elif")) {
            var elifStart = current.source;
            next();
            orElse = List.of(parseIf(elifStart));
        } else if (acceptKeyword("else")) {
            orElse = parseBlock();
        }
        return new Stmt.If(test, body, orElse, span(start));
    }

    private Stmt parseFor(boolean isAsync, Source start) {
        var target = parseTargetList();
        expectKeyword("in");
        var iter = parseStarExpressions();
        var body = parseBlock();
        List<Stmt> orElse = acceptKeyword("else") ? parseBlock() : List.of();
        return new Stmt.For(target, iter, body, orElse, isAsync, span(start));
    }

    private Stmt parseWhile(Source start) {
        var test = parseNamedExprTest();
        var body = parseBlock();
        List<Stmt> orElse = acceptKeyword("else") ? parseBlock() : List.of();
        return new Stmt.While(test, body, orElse, span(start));
    }

    private Stmt parseTry(Source start) {
        var body = parseBlock();
        var handlers = new ArrayList<Stmt.ExceptHandler>();
        while (atKeyword("except")) {
            var handlerStart = current.source;
            next();
            Expr type = null;
            String name = null;
            if (!atOp(":")) {
                type = parseTest();
                if (acceptOp(",")) {
                    var elts = new ArrayList<Expr>(List.of(type));
                    do {
                        elts.add(parseTest());
                    } while (acceptOp(","));
                    type = new Expr.TupleExpr(List.copyOf(elts), span(type.source()));
                }
                if (acceptKeyword("as")) {
                    name = expectName();
                }
            }
            var handlerBody = parseBlock();
            handlers.add(new Stmt.ExceptHandler(type, name, handlerBody, span(handlerStart)));
        }
        List<Stmt> orElse = List.of();
        if (!handlers.isEmpty() && acceptKeyword("else")) {
            orElse = parseBlock();
        }
        List<Stmt> finalBody = List.of();
        if (acceptKeyword("finally")) {
            finalBody = parseBlock();
        }
        if (handlers.isEmpty() && finalBody.isEmpty()) {
            throw unexpected("'except' or 'finally'");
        }
        return new Stmt.Try(body, List.copyOf(handlers), orElse, finalBody, span(start));
    }

    private Stmt parseWith(boolean isAsync, Source start) {
        var items = new ArrayList<Stmt.WithItem>();
        do {
            var context = parseTest();
            Expr vars = null;
            if (acceptKeyword("as")) {
                vars = parseTarget();
            }
            items.add(new Stmt.WithItem(context, vars));
        } while (acceptOp(","));
        var body = parseBlock();
        return new Stmt.With(List.copyOf(items), body, isAsync, span(start));
    }

    private List<Stmt> parseBlock() {
        expectOp(":");
        if (current.type != Token.Type.NEWLINE) {
            return parseSimpleStatements();
        }
        next();
        if (current.type != Token.Type.INDENT) {
            throw syntaxError("expected an indented block", current.source);
        }
        next();
        var body = new ArrayList<Stmt>();
        while (current.type != Token.Type.DEDENT && current.type != Token.Type.ENDMARKER) {
            body.addAll(parseStatement());
        }
        expect(Token.Type.DEDENT);
        return List.copyOf(body);
    }

    private List<Stmt> parseSimpleStatements() {
        var statements = new ArrayList<Stmt>();
        statements.add(parseSmallStatement());
        while (acceptOp(";")) {
            if (current.type == Token.Type.NEWLINE) {
                break;
            }
            statements.add(parseSmallStatement());
        }
        expect(Token.Type.NEWLINE);
        return List.copyOf(statements);
    }

    private Stmt parseSmallStatement() {
        var start = current.source;
        if (current.type == Token.Type.NAME) {
            switch (current.content) {
                case "pass" -> {
                    next();
                    return new Stmt.Pass(span(start));
                }
                case "break" -> {
                    next();
                    return new Stmt.Break(span(start));
                }
                case "continue" -> {
                    next();
                    return new Stmt.Continue(span(start));
                }
                case "return" -> {
                    next();
                    var value = startsExpression() ? parseStarExpressions() : null;
                    return new Stmt.Return(value, span(start));
                }
                case "raise" -> {
                    next();
                    Expr exc = null;
                    Expr cause = null;
                    if (startsExpression()) {
                        exc = parseTest();
                        if (acceptKeyword("from")) {
                            cause = parseTest();
                        }
                    }
                    return new Stmt.Raise(exc, cause, span(start));
                }
                case "global", "nonlocal" -> {
                    var global = current.content.equals("global");
                    next();
                    var names = new ArrayList<String>();
                    do {
                        names.add(expectName());
                    } while (acceptOp(","));
                    return global
                        ? new Stmt.Global(List.copyOf(names), span(start))
                        : new Stmt.Nonlocal(List.copyOf(names), span(start));
                }
                case "del" -> {
                    next();
                    var targets = new ArrayList<Expr>();
                    do {
                        if (!startsExpression()) {
                            break;
                        }
                        targets.add(checkAssignable(parseBitOr()));
                    } while (acceptOp(","));
                    return new Stmt.Delete(List.copyOf(targets), span(start));
                }
                case "assert" -> {
                    next();
                    var test = parseTest();
                    var message = acceptOp(",") ? parseTest() : null;
                    return new Stmt.Assert(test, message, span(start));
                }
                case "import" -> {
                    next();
                    return parseImport(start);
                }
                case "from" -> {
                    next();
                    return parseImportFrom(start);
                }
                default -> {
                }
            }
        }
        return parseExpressionStatement(start);
    }

    private Stmt parseImport(Source start) {
        var names = new ArrayList<Stmt.Alias>();
        do {
            var name = parseDottedName();
            var asName = acceptKeyword("as") ? expectName() : null;
            names.add(new Stmt.Alias(name, asName));
        } while (acceptOp(","));
        return new Stmt.Import(List.copyOf(names), span(start));
    }

    private Stmt parseImportFrom(Source start) {
        var level = 0;
        while (atOp(".") || atOp("...")) {
            level += current.content.length();
            next();
        }
        String module = null;
        if (!atKeyword("import")) {
            module = parseDottedName();
        } else if (level == 0) {
            throw unexpected("a module name");
        }
        expectKeyword("import");
        var names = new ArrayList<Stmt.Alias>();
        if (atOp("*")) {
            next();
            names.add(new Stmt.Alias("*", null));
            return new Stmt.ImportFrom(module, List.copyOf(names), level, span(start));
        }
        var parenthesized = acceptOp("(");
        do {
            if (parenthesized && atOp(")")) {
                break;
            }
            var name = expectName();
            var asName = acceptKeyword("as") ? expectName() : null;
            names.add(new Stmt.Alias(name, asName));
        } while (acceptOp(","));
        if (parenthesized) {
            expectOp(")");
        }
        return new Stmt.ImportFrom(module, List.copyOf(names), level, span(start));
    }

    private String parseDottedName() {
        var name = new StringBuilder(expectName());
        while (acceptOp(".")) {
            name.append('.').append(expectName());
        }
        return name.toString();
    }

    private Stmt parseExpressionStatement(Source start) {
        var first = atKeyword("yield") ? parseYield() : parseStarExpressions();
        if (acceptOp(":")) {
            if (!(first instanceof Expr.Name || first instanceof Expr.Attribute || first instanceof Expr.Subscript)) {
                throw syntaxError("only single target (not tuple) can be annotated", first.source());
            }
            var annotation = parseTest();
            Expr value = null;
            if (acceptOp("=")) {
                value = atKeyword("yield") ? parseYield() : parseStarExpressions();
            }
            return new Stmt.AnnAssign(first, annotation, value, span(start));
        }
        if (current.type == Token.Type.OP && AUGMENTED_OPS.contains(current.content)) {
            if (!(first instanceof Expr.Name || first instanceof Expr.Attribute || first instanceof Expr.Subscript)) {
                throw syntaxError("illegal expression for augmented assignment", first.source());
            }
            var op = current.content.substring(0, current.content.length() - 1);
            next();
            var value = atKeyword("yield") ? parseYield() : parseStarExpressions();
            return new Stmt.AugAssign(first, op, value, span(start));
        }
        if (atOp("=")) {
            var chain = new ArrayList<Expr>(List.of(first));
            while (acceptOp("=")) {
                chain.add(atKeyword("yield") ? parseYield() : parseStarExpressions());
            }
            var value = chain.remove(chain.size() - 1);
            chain.forEach(this::checkAssignable);
            return new Stmt.Assign(List.copyOf(chain), value, span(start));
        }
        return new Stmt.ExprStmt(first, span(start));
    }

    private Expr checkAssignable(Expr target) {
        if (target instanceof Expr.Name name) {
            if (KEYWORDS.contains(name.id())) {
                throw syntaxError("cannot assign to " + name.id(), target.source());
            }
        } else if (target instanceof Expr.Starred starred) {
            checkAssignable(starred.value());
        } else if (target instanceof Expr.TupleExpr tuple) {
            tuple.elts().forEach(this::checkAssignable);
        } else if (target instanceof Expr.ListExpr list) {
            list.elts().forEach(this::checkAssignable);
        } else if (!(target instanceof Expr.Attribute) && !(target instanceof Expr.Subscript)) {
            throw syntaxError("cannot assign to expression", target.source());
        }
        return target;
    }

    // ---- parameters and arguments ----

    private Expr.Arguments parseParameters(String closing, boolean annotations) {
        var posOnly = new ArrayList<Expr.Arg>();
        var args = new ArrayList<Expr.Arg>();
        var defaults = new ArrayList<Expr>();
        var kwOnly = new ArrayList<Expr.Arg>();
        var kwDefaults = new ArrayList<Expr>();
        Expr.Arg varArg = null;
        Expr.Arg kwArg = null;
        var seenStar = false;
        while (!atOp(closing)) {
            if (acceptOp("/")) {
                posOnly.addAll(args);
                args.clear();
            } else if (acceptOp("**")) {
                kwArg = parseArg(annotations);
            } else if (acceptOp("*")) {
                seenStar = true;
                if (!atOp(",") && !atOp(closing)) {
                    varArg = parseArg(annotations);
                }
            } else {
                var arg = parseArg(annotations);
                var defaultValue = acceptOp("=") ? parseTest() : null;
                if (seenStar) {
                    kwOnly.add(arg);
                    kwDefaults.add(defaultValue);
                } else {
                    if (defaultValue == null && !defaults.isEmpty()) {
                        throw syntaxError("non-default argument follows default argument", arg.source());
                    }
                    args.add(arg);
                    if (defaultValue != null) {
                        defaults.add(defaultValue);
                    }
                }
            }
            if (!acceptOp(",")) {
                break;
            }
        }
        return new Expr.Arguments(
            List.copyOf(posOnly),
            List.copyOf(args),
            varArg,
            List.copyOf(kwOnly),
            Collections.unmodifiableList(kwDefaults),
            kwArg,
            List.copyOf(defaults)
        );
    }

    private Expr.Arg parseArg(boolean annotations) {
        var start = current.source;
        var name = expectName();
        Expr annotation = null;
        if (annotations && acceptOp(":")) {
            annotation = parseTest();
        }
        return new Expr.Arg(name, annotation, span(start));
    }

    /** Parses call arguments after the opening parenthesis, consuming the closing one. */
    private void parseArguments(List<Expr> args, List<Expr.Keyword> keywords) {
        while (!atOp(")")) {
            if (acceptOp("**")) {
                keywords.add(new Expr.Keyword(null, parseTest()));
            } else if (atOp("*")) {
                var start = current.source;
                next();
                args.add(new Expr.Starred(parseTest(), span(start)));
            } else if (atName() && peekToken().isOp("=")) {
                var name = expectName();
                expectOp("=");
                keywords.add(new Expr.Keyword(name, parseTest()));
            } else {
                var arg = parseNamedExprTest();
                if (atComprehension()) {
                    arg = new Expr.GeneratorExp(arg, parseComprehensions(), span(arg.source()));
                }
                args.add(arg);
            }
            if (!acceptOp(",")) {
                break;
            }
        }
        expectOp(")");
    }

    // ---- expressions ----

    private boolean startsExpression() {
        return switch (current.type) {
            case NAME -> !KEYWORDS.contains(current.content) || EXPRESSION_KEYWORDS.contains(current.content)
                || current.content.equals("yield");
            case NUMBER, STRING -> true;
            case OP -> EXPRESSION_OPS.contains(current.content);
            default -> false;
        };
    }

    private boolean atComprehension() {
        return atKeyword("for") || (atKeyword("async") && peekToken().isKeyword("for"));
    }

    /** Comma-separated expressions that may contain starred items; more than one becomes a tuple. */
    private Expr parseStarExpressions() {
        var start = current.source;
        var first = parseStarOrTest();
        if (!atOp(",")) {
            return first;
        }
        var elts = new ArrayList<Expr>(List.of(first));
        while (acceptOp(",")) {
            if (!startsExpression() || atKeyword("yield")) {
                break;
            }
            elts.add(parseStarOrTest());
        }
        return new Expr.TupleExpr(List.copyOf(elts), span(start));
    }

    private Expr parseStarOrTest() {
        if (atOp("*")) {
            var start = current.source;
            next();
            return new Expr.Starred(parseBitOr(), span(start));
        }
        return parseTest();
    }

    private Expr parseStarOrNamedExpr() {
        if (atOp("*")) {
            var start = current.source;
            next();
            return new Expr.Starred(parseBitOr(), span(start));
        }
        return parseNamedExprTest();
    }

    /** Assignment target list of a for loop or comprehension. */
    private Expr parseTargetList() {
        var start = current.source;
        var first = parseTarget();
        if (!atOp(",")) {
            return first;
        }
        var elts = new ArrayList<Expr>(List.of(first));
        while (acceptOp(",")) {
            if (atKeyword("in") || !startsExpression()) {
                break;
            }
            elts.add(parseTarget());
        }
        return checkAssignable(new Expr.TupleExpr(List.copyOf(elts), span(start)));
    }

    private Expr parseTarget() {
        if (atOp("*")) {
            var start = current.source;
            next();
            return checkAssignable(new Expr.Starred(parseBitOr(), span(start)));
        }
        return checkAssignable(parseBitOr());
    }

    private Expr parseYield() {
        var start = current.source;
        expectKeyword("yield");
        if (acceptKeyword("from")) {
            return new Expr.YieldFrom(parseTest(), span(start));
        }
        var value = startsExpression() ? parseStarExpressions() : null;
        return new Expr.Yield(value, span(start));
    }

    private Expr parseNamedExprTest() {
        if (atName() && peekToken().isOp(":=")) {
            var start = current.source;
            var target = new Expr.Name(expectName(), span(start));
            expectOp(":=");
            var value = parseTest();
            return new Expr.NamedExpr(target, value, span(start));
        }
        return parseTest();
    }

    private Expr parseTest() {
        if (atKeyword("lambda")) {
            return parseLambda();
        }
        var start = current.source;
        var body = parseOrTest();
        if (acceptKeyword("if")) {
            var test = parseOrTest();
            expectKeyword("else");
            var orElse = parseTest();
            return new Expr.IfExp(test, body, orElse, span(start));
        }
        return body;
    }

    private Expr parseLambda() {
        var start = current.source;
        expectKeyword("lambda");
        var args = parseParameters(":", false);
        expectOp(":");
        var body = parseTest();
        return new Expr.Lambda(args, body, span(start));
    }

    private Expr parseOrTest() {
        var start = current.source;
        var first = parseAndTest();
        if (!atKeyword("or")) {
            return first;
        }
        var values = new ArrayList<Expr>(List.of(first));
        while (acceptKeyword("or")) {
            values.add(parseAndTest());
        }
        return new Expr.BoolOp("or", List.copyOf(values), span(start));
    }

    private Expr parseAndTest() {
        var start = current.source;
        var first = parseNotTest();
        if (!atKeyword("and")) {
            return first;
        }
        var values = new ArrayList<Expr>(List.of(first));
        while (acceptKeyword("and")) {
            values.add(parseNotTest());
        }
        return new Expr.BoolOp("and", List.copyOf(values), span(start));
    }

    private Expr parseNotTest() {
        if (atKeyword("not")) {
            var start = current.source;
            next();
            return new Expr.UnaryOp("not", parseNotTest(), span(start));
        }
        return parseComparison();
    }

    private Expr parseComparison() {
        var start = current.source;
        var left = parseBitOr();
        var ops = new ArrayList<String>();
        var comparators = new ArrayList<Expr>();
        while (true) {
            String op;
            if (current.type == Token.Type.OP && COMPARISON_OPS.contains(current.content)) {
                op = current.content;
                next();
            } else if (atKeyword("in")) {
                op = "in";
                next();
            } else if (atKeyword("not") && peekToken().isKeyword("in")) {
                op = "not in";
                next();
                next();
            } else if (atKeyword("is")) {
                next();
                op = acceptKeyword("not") ? "is not" : "is";
            } else {
                break;
            }
            ops.add(op);
            comparators.add(parseBitOr());
        }
        if (ops.isEmpty()) {
            return left;
        }
        return new Expr.Compare(left, List.copyOf(ops), List.copyOf(comparators), span(start));
    }

    private Expr parseBitOr() {
        return parseBinary(0);
    }

    private static final List<Set<String>> BINARY_LEVELS = List.of(
        Set.of("|"),
        Set.of("^"),
        Set.of("&"),
        Set.of("<<", ">>"),
        Set.of("+", "-"),
        Set.of("*", "@", "/", "%", "//")
    );

    private Expr parseBinary(int level) {
        if (level == BINARY_LEVELS.size()) {
            return parseFactor();
        }
        var start = current.source;
        var left = parseBinary(level + 1);
        while (current.type == Token.Type.OP && BINARY_LEVELS.get(level).contains(current.content)) {
            var op = current.content;
            next();
            var right = parseBinary(level + 1);
            left = new Expr.BinOp(left, op, right, span(start));
        }
        return left;
    }

    private Expr parseFactor() {
        if (atOp("+") || atOp("-") || atOp("~")) {
            var start = current.source;
            var op = current.content;
            next();
            return new Expr.UnaryOp(op, parseFactor(), span(start));
        }
        return parsePower();
    }

    private Expr parsePower() {
        var start = current.source;
        var base = parseAwaitPrimary();
        if (acceptOp("**")) {
            return new Expr.BinOp(base, "**", parseFactor(), span(start));
        }
        return base;
    }

    private Expr parseAwaitPrimary() {
        if (atKeyword("await")) {
            var start = current.source;
            next();
            return new Expr.Await(parsePrimary(), span(start));
        }
        return parsePrimary();
    }

    private Expr parsePrimary() {
        var start = current.source;
        var expression = parseAtom();
        while (true) {
            if (acceptOp("(")) {
                var args = new ArrayList<Expr>();
                var keywords = new ArrayList<Expr.Keyword>();
                parseArguments(args, keywords);
                expression = new Expr.Call(expression, List.copyOf(args), List.copyOf(keywords), span(start));
            } else if (acceptOp("[")) {
                var slice = parseSubscriptList();
                expectOp("]");
                expression = new Expr.Subscript(expression, slice, span(start));
            } else if (acceptOp(".")) {
                expression = new Expr.Attribute(expression, expectName(), span(start));
            } else {
                return expression;
            }
        }
    }

    private Expr parseSubscriptList() {
        var start = current.source;
        var first = parseSliceItem();
        if (!atOp(",")) {
            return first;
        }
        var elts = new ArrayList<Expr>(List.of(first));
        while (acceptOp(",")) {
            if (atOp("]")) {
                break;
            }
            elts.add(parseSliceItem());
        }
        return new Expr.TupleExpr(List.copyOf(elts), span(start));
    }

    private Expr parseSliceItem() {
        var start = current.source;
        Expr lower = null;
        if (!atOp(":")) {
            lower = parseStarOrNamedExpr();
            if (!atOp(":")) {
                return lower;
            }
        }
        expectOp(":");
        Expr upper = null;
        Expr step = null;
        if (!atOp(":") && !atOp("]") && !atOp(",")) {
            upper = parseTest();
        }
        if (acceptOp(":") && !atOp("]") && !atOp(",")) {
            step = parseTest();
        }
        return new Expr.Slice(lower, upper, step, span(start));
    }

    private List<Expr.Comprehension> parseComprehensions() {
        var generators = new ArrayList<Expr.Comprehension>();
        while (atComprehension()) {
            var isAsync = acceptKeyword("async");
            expectKeyword("for");
            var target = parseTargetList();
            expectKeyword("in");
            var iter = parseOrTest();
            var ifs = new ArrayList<Expr>();
            while (acceptKeyword("if")) {
                ifs.add(parseOrTest());
            }
            generators.add(new Expr.Comprehension(target, iter, List.copyOf(ifs), isAsync));
        }
        return List.copyOf(generators);
    }

    private Expr parseAtom() {
        var start = current.source;
        if (acceptOp("(")) {
            if (acceptOp(")")) {
                return new Expr.TupleExpr(List.of(), span(start));
            }
            if (atKeyword("yield")) {
                var value = parseYield();
                expectOp(")");
                return value;
            }
            var first = parseStarOrNamedExpr();
            if (atComprehension()) {
                var generators = parseComprehensions();
                expectOp(")");
                return new Expr.GeneratorExp(first, generators, span(start));
            }
            if (!atOp(",")) {
                expectOp(")");
                return first;
            }
            var elts = parseSequenceTail(first, ")");
            return new Expr.TupleExpr(elts, span(start));
        }
        if (acceptOp("[")) {
            if (acceptOp("]")) {
                return new Expr.ListExpr(List.of(), span(start));
            }
            var first = parseStarOrNamedExpr();
            if (atComprehension()) {
                var generators = parseComprehensions();
                expectOp("]");
                return new Expr.ListComp(first, generators, span(start));
            }
            var elts = parseSequenceTail(first, "]");
            return new Expr.ListExpr(elts, span(start));
        }
        if (acceptOp("{")) {
            return parseBraces(start);
        }
        if (acceptOp("...")) {
            return new Expr.Constant(Expr.ConstantKind.ELLIPSIS, "...", span(start));
        }
        switch (current.type) {
            case NUMBER -> {
                var text = current.content;
                next();
                return new Expr.Constant(Expr.ConstantKind.NUMBER, text, span(start));
            }
            case STRING -> {
                var parts = new ArrayList<Token>();
                while (current.type == Token.Type.STRING) {
                    parts.add(current);
                    next();
                }
                return StringLiterals.concatenate(parts, span(start));
            }
            case NAME -> {
                switch (current.content) {
                    case "None" -> {
                        next();
                        return new Expr.Constant(Expr.ConstantKind.NONE, "None", span(start));
                    }
                    case "True" -> {
                        next();
                        return new Expr.Constant(Expr.ConstantKind.TRUE, "True", span(start));
                    }
                    case "False" -> {
                        next();
                        return new Expr.Constant(Expr.ConstantKind.FALSE, "False", span(start));
                    }
                    default -> {
                        if (atName()) {
                            return new Expr.Name(expectName(), span(start));
                        }
                    }
                }
            }
            default -> {
            }
        }
        throw unexpected("an expression");
    }

    /** Remaining items of a list or tuple display after its first item, consuming the closing bracket. */
    private List<Expr> parseSequenceTail(Expr first, String closing) {
        var elts = new ArrayList<Expr>(List.of(first));
        while (acceptOp(",")) {
            if (atOp(closing)) {
                break;
            }
            elts.add(parseStarOrNamedExpr());
        }
        expectOp(closing);
        return List.copyOf(elts);
    }

    private Expr parseBraces(Source start) {
        if (acceptOp("}")) {
            return new Expr.DictExpr(List.of(), span(start));
        }
        if (atOp("**") || !atOp("*")) {
            Expr.DictItem first;
            Expr firstElement = null;
            if (acceptOp("**")) {
                first = new Expr.DictItem(null, parseBitOr());
            } else {
                firstElement = parseNamedExprTest();
                if (!acceptOp(":")) {
                    return parseSetTail(firstElement, start);
                }
                first = new Expr.DictItem(firstElement, parseTest());
                if (atComprehension()) {
                    var generators = parseComprehensions();
                    expectOp("}");
                    return new Expr.DictComp(first.key(), first.value(), generators, span(start));
                }
            }
            var items = new ArrayList<Expr.DictItem>(List.of(first));
            while (acceptOp(",")) {
                if (atOp("}")) {
                    break;
                }
                if (acceptOp("**")) {
                    items.add(new Expr.DictItem(null, parseBitOr()));
                } else {
                    var key = parseTest();
                    expectOp(":");
                    items.add(new Expr.DictItem(key, parseTest()));
                }
            }
            expectOp("}");
            return new Expr.DictExpr(List.copyOf(items), span(start));
        }
        return parseSetTail(parseStarOrNamedExpr(), start);
    }

    private Expr parseSetTail(Expr first, Source start) {
        if (atComprehension()) {
            var generators = parseComprehensions();
            expectOp("}");
            return new Expr.SetComp(first, generators, span(start));
        }
        return new Expr.SetExpr(parseSequenceTail(first, "}"), span(start));
    }
}
