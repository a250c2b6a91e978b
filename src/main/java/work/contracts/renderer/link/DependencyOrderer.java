package work.contracts.renderer.link;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import work.contracts.renderer.api.ErrorKind;
import work.contracts.renderer.api.RenderException;

/**
 * Depth-first post-order over the module graph: every module follows the modules it imports.
 * Dependencies are visited in name order so the result does not depend on the order in which
 * imports were written.
 */
public final class DependencyOrderer {

    private DependencyOrderer() {
    }

    /** Feature modules in emission order; the root itself is excluded. */
    public static List<ModuleKey> order(ModuleKey root, Map<ModuleKey, List<ModuleImport>> graph) {
        var result = new ArrayList<ModuleKey>();
        visit(root, graph, new HashSet<>(), new LinkedHashSet<>(), result);
        result.remove(root);
        return result;
    }

    private static void visit(
        ModuleKey module,
        Map<ModuleKey, List<ModuleImport>> graph,
        Set<ModuleKey> done,
        LinkedHashSet<ModuleKey> visiting,
        List<ModuleKey> result
    ) {
        visiting.add(module);
        var dependencies = graph.getOrDefault(module, List.of()).stream()
            .map(ModuleImport::target)
            .distinct()
            .sorted(Comparator.naturalOrder())
            .toList();
        for (var dependency : dependencies) {
            if (visiting.contains(dependency)) {
                throw new RenderException(ErrorKind.CYCLIC_IMPORT, "Cyclic import between modules: " + cycle(visiting, dependency), module.name(), null);
            }
            if (!done.contains(dependency)) {
                visit(dependency, graph, done, visiting, result);
            }
        }
        visiting.remove(module);
        done.add(module);
        result.add(module);
    }

    private static String cycle(LinkedHashSet<ModuleKey> visiting, ModuleKey repeated) {
        var path = new ArrayList<ModuleKey>();
        var inCycle = false;
        for (var module : visiting) {
            inCycle |= module.equals(repeated);
            if (inCycle) {
                path.add(module);
            }
        }
        path.add(repeated);
        return path.stream().map(ModuleKey::name).collect(Collectors.joining(" -> "));
    }
}
