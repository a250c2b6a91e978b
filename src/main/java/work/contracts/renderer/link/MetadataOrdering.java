package work.contracts.renderer.link;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import work.contracts.renderer.syntax.Expr;
import work.contracts.renderer.syntax.Stmt;

/**
 * Moves named top-level statements (capability imports, metadata fields, hooks) to the front of
 * the file in a configured order. An assignment of a literal keeps the bare string statements
 * that follow it, so implicitly continued strings are never split.
 */
public final class MetadataOrdering {

    /** Reordered statements, and whether any statement matched the order at all. */
    public record Result(List<Stmt> statements, boolean changed) {}

    private MetadataOrdering() {
    }

    public static Result reorder(List<Stmt> statements, List<String> order) {
        var rank = new HashMap<String, Integer>();
        for (var i = 0; i < order.size(); i++) {
            rank.putIfAbsent(order.get(i), i);
        }
        var groups = group(statements);
        var changed = false;
        for (var group : groups) {
            changed |= rankOf(group, rank) != Integer.MAX_VALUE;
        }
        var sorted = new ArrayList<>(groups);
        sorted.sort(Comparator.comparingInt(group -> rankOf(group, rank)));
        var result = new ArrayList<Stmt>(statements.size());
        sorted.forEach(result::addAll);
        return new Result(List.copyOf(result), changed);
    }

    static List<List<Stmt>> group(List<Stmt> statements) {
        var groups = new ArrayList<List<Stmt>>();
        List<Stmt> open = null;
        for (var statement : statements) {
            if (open != null && isBareConstant(statement)) {
                open.add(statement);
                continue;
            }
            open = null;
            var group = new ArrayList<Stmt>();
            group.add(statement);
            groups.add(group);
            if (statement instanceof Stmt.Assign assign && assign.value() instanceof Expr.Constant) {
                open = group;
            }
        }
        return groups;
    }

    private static int rankOf(List<Stmt> group, HashMap<String, Integer> rank) {
        var key = StatementNames.orderingKey(group.get(0));
        return key == null ? Integer.MAX_VALUE : rank.getOrDefault(key, Integer.MAX_VALUE);
    }

    private static boolean isBareConstant(Stmt statement) {
        return statement instanceof Stmt.ExprStmt expression && expression.value() instanceof Expr.Constant;
    }
}
