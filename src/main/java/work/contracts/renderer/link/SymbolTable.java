package work.contracts.renderer.link;

import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import work.contracts.renderer.syntax.AstRewriter;
import work.contracts.renderer.syntax.Expr;
import work.contracts.renderer.syntax.Stmt;

/**
 * Side table from rewritten name nodes to the definition they denote. Keys are node instances,
 * so two textually equal names in different modules stay distinct.
 */
public final class SymbolTable {
    private final Map<Expr.Name, Definition> references = new IdentityHashMap<>();

    public void bind(Expr.Name name, Definition definition) {
        references.put(name, definition);
    }

    public boolean isBound(Expr.Name name) {
        return references.containsKey(name);
    }

    public int size() {
        return references.size();
    }

    /** Definitions referenced anywhere inside {@code statement}, in encounter order. */
    public Set<Definition> referencesIn(Stmt statement) {
        var found = new LinkedHashSet<Definition>();
        new AstRewriter() {
            @Override
            public Expr rewrite(Expr e) {
                if (e instanceof Expr.Name name) {
                    var definition = references.get(name);
                    if (definition != null) {
                        found.add(definition);
                    }
                    return e;
                }
                return super.rewrite(e);
            }
        }.rewrite(statement);
        return found;
    }
}
