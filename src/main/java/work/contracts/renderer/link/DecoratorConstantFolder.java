package work.contracts.renderer.link;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import work.contracts.renderer.api.ErrorKind;
import work.contracts.renderer.api.RenderException;
import work.contracts.renderer.syntax.AstPrinter;
import work.contracts.renderer.syntax.AstRewriter;
import work.contracts.renderer.syntax.Expr;
import work.contracts.renderer.syntax.Stmt;

/**
 * Inlines module-level constants into the keyword arguments of directive decorators such as
 * {@code @requires(event_type=ACCRUAL_EVENT)}, whose arguments must be literals.
 *
 * <p>Constants are collected in one forward pass over top-level assignments: literal values,
 * name-to-name aliases of already known constants, and list displays usable as {@code *spreads}.
 */
public final class DecoratorConstantFolder extends AstRewriter {
    private final Set<String> decorators;
    private final Set<String> protectedNames;
    private final Map<String, Expr.Constant> constants = new HashMap<>();
    private final Map<String, Expr.ListExpr> lists = new HashMap<>();

    public DecoratorConstantFolder(Set<String> decorators, Set<String> protectedNames) {
        this.decorators = decorators;
        this.protectedNames = protectedNames;
    }

    public List<Stmt> fold(List<Stmt> module) {
        collectConstants(module);
        return rewriteBody(module);
    }

    private void collectConstants(List<Stmt> module) {
        for (var statement : module) {
            if (!(statement instanceof Stmt.Assign assign)) {
                continue;
            }
            for (var target : assign.targets()) {
                if (!(target instanceof Expr.Name name) || protectedNames.contains(name.id())) {
                    continue;
                }
                var value = assign.value();
                if (value instanceof Expr.Constant constant) {
                    constants.put(name.id(), constant);
                } else if (value instanceof Expr.Name alias) {
                    if (constants.containsKey(alias.id())) {
                        constants.put(name.id(), constants.get(alias.id()));
                    } else if (lists.containsKey(alias.id())) {
                        lists.put(name.id(), lists.get(alias.id()));
                    }
                } else if (value instanceof Expr.ListExpr list) {
                    lists.put(name.id(), list);
                }
            }
        }
    }

    @Override
    public Stmt rewrite(Stmt s) {
        if (!(s instanceof Stmt.FunctionDef def)) {
            return super.rewrite(s);
        }
        var folded = new ArrayList<Expr>(def.decorators().size());
        var changed = false;
        for (var decorator : def.decorators()) {
            var replacement = isDirective(decorator) ? foldDirective(def.name(), (Expr.Call) decorator) : decorator;
            changed |= replacement != decorator;
            folded.add(replacement);
        }
        var rewritten = (Stmt.FunctionDef) super.rewrite(def);
        if (!changed) {
            return rewritten;
        }
        return new Stmt.FunctionDef(
            List.copyOf(folded),
            rewritten.name(),
            rewritten.args(),
            rewritten.returns(),
            rewritten.body(),
            rewritten.isAsync(),
            rewritten.source()
        );
    }

    private boolean isDirective(Expr decorator) {
        return decorator instanceof Expr.Call call
            && call.func() instanceof Expr.Name name
            && decorators.contains(name.id())
            && !call.keywords().isEmpty();
    }

    private Expr foldDirective(String function, Expr.Call call) {
        var directive = ((Expr.Name) call.func()).id();
        var keywords = new ArrayList<Expr.Keyword>(call.keywords().size());
        for (var keyword : call.keywords()) {
            var value = foldValue(keyword.value());
            if (!isLiteral(value)) {
                throw new RenderException(
                    ErrorKind.NON_LITERAL_ARGUMENT,
                    function + " @" + directive + " must have a \"" + keyword.arg() + "\" keyword with a literal value; "
                        + AstPrinter.print(value) + " could not be resolved to one",
                    null,
                    call.source()
                );
            }
            keywords.add(value == keyword.value() ? keyword : new Expr.Keyword(keyword.arg(), value));
        }
        return new Expr.Call(call.func(), call.args(), List.copyOf(keywords), call.source());
    }

    private Expr foldValue(Expr value) {
        if (value instanceof Expr.Name name) {
            return resolveName(name);
        }
        if (value instanceof Expr.ListExpr list) {
            return foldList(list);
        }
        if (value instanceof Expr.DictExpr dict) {
            var items = new ArrayList<Expr.DictItem>(dict.items().size());
            for (var item : dict.items()) {
                var key = item.key() instanceof Expr.Name name ? resolveName(name) : item.key();
                var itemValue = item.value();
                if (itemValue instanceof Expr.ListExpr list) {
                    itemValue = foldList(list);
                } else if (itemValue instanceof Expr.Name name) {
                    itemValue = resolveName(name);
                }
                items.add(new Expr.DictItem(key, itemValue));
            }
            return new Expr.DictExpr(List.copyOf(items), dict.source());
        }
        return value;
    }

    private Expr.ListExpr foldList(Expr.ListExpr list) {
        var elements = new ArrayList<Expr>(list.elts().size());
        for (var element : list.elts()) {
            if (element instanceof Expr.Name name) {
                elements.add(resolveName(name));
            } else if (element instanceof Expr.Starred starred
                && starred.value() instanceof Expr.Name spread
                && lists.containsKey(spread.id())) {
                for (var spreadElement : lists.get(spread.id()).elts()) {
                    elements.add(spreadElement instanceof Expr.Name name ? resolveName(name) : spreadElement);
                }
            } else {
                elements.add(element);
            }
        }
        return new Expr.ListExpr(List.copyOf(elements), list.source());
    }

    private Expr resolveName(Expr.Name name) {
        var constant = constants.get(name.id());
        return constant != null ? constant : name;
    }

    static boolean isLiteral(Expr value) {
        if (value instanceof Expr.Constant constant) {
            return constant.kind() == Expr.ConstantKind.STRING
                || constant.kind() == Expr.ConstantKind.TRUE
                || constant.kind() == Expr.ConstantKind.FALSE;
        }
        if (value instanceof Expr.ListExpr list) {
            return list.elts().stream().allMatch(DecoratorConstantFolder::isLiteral);
        }
        if (value instanceof Expr.DictExpr dict) {
            return dict.items().stream().allMatch(item -> item.key() != null && isLiteral(item.key()) && isLiteral(item.value()));
        }
        return false;
    }
}
