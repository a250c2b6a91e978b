package work.contracts.renderer.api;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Capability modules that contract code may import, each with its allowed symbols. Iteration
 * order is the configured order.
 */
public final class Whitelist {
    public static final String ALL_SYMBOLS = "*";

    private final Map<String, Set<String>> capabilities;
    private final String allRequiredMarker;

    public Whitelist(Map<String, ? extends Iterable<String>> capabilities, String allRequiredMarker) {
        var copy = new LinkedHashMap<String, Set<String>>();
        capabilities.forEach((module, symbols) -> {
            var set = new LinkedHashSet<String>();
            symbols.forEach(set::add);
            copy.put(module, Collections.unmodifiableSet(set));
        });
        this.capabilities = Collections.unmodifiableMap(copy);
        this.allRequiredMarker = allRequiredMarker;
    }

    public boolean contains(String module) {
        return capabilities.containsKey(module);
    }

    public List<String> modules() {
        return List.copyOf(capabilities.keySet());
    }

    public Set<String> symbols(String module) {
        return capabilities.getOrDefault(module, Set.of());
    }

    /** Modules such as {@code math} that may only be used through a plain, unaliased {@code import}. */
    public boolean requiresDirectImport(String module) {
        return symbols(module).contains(allRequiredMarker);
    }

    public boolean allowsSymbol(String module, String symbol) {
        var symbols = symbols(module);
        return symbols.contains(ALL_SYMBOLS) || symbols.contains(symbol);
    }

    public Map<String, Set<String>> asMap() {
        return capabilities;
    }

    public String allRequiredMarker() {
        return allRequiredMarker;
    }

    @Override
    public String toString() {
        return "Whitelist" + capabilities;
    }
}
