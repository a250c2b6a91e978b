package work.contracts.renderer.link;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.contracts.renderer.syntax.Stmt;

/**
 * Keeps the definitions reachable from the template's statements, directly or through other
 * kept definitions. Clusters that only reference each other are dropped together.
 */
public final class DeadCodeEliminator {
    private static final Logger LOG = LoggerFactory.getLogger(DeadCodeEliminator.class);

    public record Result(List<Definition> kept, List<Definition> removed) {}

    private DeadCodeEliminator() {
    }

    public static Result eliminate(List<Definition> candidates, List<Stmt> rootBody, SymbolTable symbols) {
        Set<Definition> live = Collections.newSetFromMap(new IdentityHashMap<>());
        var pending = new ArrayDeque<Definition>();
        for (var statement : rootBody) {
            for (var referenced : symbols.referencesIn(statement)) {
                if (live.add(referenced)) {
                    pending.add(referenced);
                }
            }
        }
        while (!pending.isEmpty()) {
            var current = pending.poll();
            for (var referenced : symbols.referencesIn(current.statement())) {
                if (referenced != current && live.add(referenced)) {
                    pending.add(referenced);
                }
            }
        }
        var kept = new ArrayList<Definition>();
        var removed = new ArrayList<Definition>();
        for (var candidate : candidates) {
            if (live.contains(candidate)) {
                kept.add(candidate);
            } else {
                LOG.debug("Removing unreferenced definition {}", candidate);
                removed.add(candidate);
            }
        }
        return new Result(List.copyOf(kept), List.copyOf(removed));
    }
}
