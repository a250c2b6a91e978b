package work.contracts.renderer.link;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import work.contracts.renderer.syntax.AstPrinter;
import work.contracts.renderer.syntax.Source;
import work.contracts.renderer.syntax.Stmt;

/**
 * Whitelisted imports collected from every module, merged per capability in first-seen order.
 * {@code from} imports of one module collapse into a single statement whose names are the union
 * of everything requested.
 */
public final class CapabilityImports {
    private final Map<String, Entry> entries = new LinkedHashMap<>();

    private static final class Entry {
        private final String module;
        private final boolean from;
        private final List<Stmt.Alias> names = new ArrayList<>();

        private Entry(String module, boolean from) {
            this.module = module;
            this.from = from;
        }

        private Stmt toStatement() {
            return from
                ? new Stmt.ImportFrom(module, List.copyOf(names), 0, Source.NONE)
                : new Stmt.Import(List.copyOf(names), Source.NONE);
        }
    }

    public void addFrom(String module, List<Stmt.Alias> aliases) {
        var entry = entries.computeIfAbsent("from:" + module, key -> new Entry(module, true));
        for (var alias : aliases) {
            var known = entry.names.stream().anyMatch(existing -> existing.name().equals(alias.name()));
            if (!known) {
                entry.names.add(alias);
            }
        }
    }

    public void addImport(Stmt.Alias alias) {
        var key = "import:" + alias.name() + (alias.asName() == null ? "" : " as " + alias.asName());
        entries.computeIfAbsent(key, k -> {
            var entry = new Entry(alias.name(), false);
            entry.names.add(alias);
            return entry;
        });
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public List<Stmt> statements() {
        var statements = new ArrayList<Stmt>();
        entries.values().forEach(entry -> statements.add(entry.toStatement()));
        return statements;
    }

    @Override
    public String toString() {
        var printed = new ArrayList<String>();
        statements().forEach(statement -> printed.add(AstPrinter.print(statement)));
        return String.join("\n", printed);
    }
}
