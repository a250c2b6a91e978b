package work.contracts.renderer.link;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Namespace prefixes of feature modules. A module is normally known by the last segment of its
 * dotted name; modules sharing that segment get the shortest dotted suffix that tells them apart,
 * joined with underscores ({@code a.addresses} and {@code b.addresses} become
 * {@code a_addresses} and {@code b_addresses}).
 */
public final class Namespaces {
    private final Map<ModuleKey, String> prefixes;

    private Namespaces(Map<ModuleKey, String> prefixes) {
        this.prefixes = prefixes;
    }

    public static Namespaces assign(Collection<ModuleKey> modules) {
        Map<String, List<ModuleKey>> byLastSegment = new LinkedHashMap<>();
        modules.stream().sorted().forEach(key -> byLastSegment.computeIfAbsent(key.lastSegment(), k -> new ArrayList<>()).add(key));
        var prefixes = new HashMap<ModuleKey, String>();
        for (var group : byLastSegment.values()) {
            if (group.size() == 1) {
                prefixes.put(group.get(0), group.get(0).lastSegment());
                continue;
            }
            var depth = 2;
            while (true) {
                var candidates = new HashMap<ModuleKey, String>();
                for (var key : group) {
                    candidates.put(key, suffix(key.name(), depth));
                }
                var longest = group.stream().mapToInt(key -> key.name().split("\\.").length).max().orElse(1);
                if (new HashSet<>(candidates.values()).size() == group.size() || depth >= longest) {
                    prefixes.putAll(candidates);
                    break;
                }
                depth++;
            }
        }
        return new Namespaces(prefixes);
    }

    public String prefix(ModuleKey module) {
        var prefix = prefixes.get(module);
        if (prefix == null) {
            throw new IllegalArgumentException("No namespace assigned to module " + module.name());
        }
        return prefix;
    }

    public String namespaced(ModuleKey module, String member) {
        return combine(prefix(module), member);
    }

    /** {@code utils.dates} + {@code parse} gives {@code dates_parse}; an empty or "." module gives {@code _parse}. */
    public static String combine(String module, String member) {
        if (module.isEmpty() || module.equals(".")) {
            return "_" + member;
        }
        var dot = module.lastIndexOf('.');
        return (dot < 0 ? module : module.substring(dot + 1)) + "_" + member;
    }

    private static String suffix(String dottedName, int depth) {
        var parts = dottedName.split("\\.");
        var from = Math.max(0, parts.length - depth);
        return String.join("_", Arrays.asList(parts).subList(from, parts.length));
    }
}
