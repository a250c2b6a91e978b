package work.contracts.renderer.link;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import work.contracts.renderer.api.ErrorKind;
import work.contracts.renderer.api.RenderException;

class DependencyOrdererTest {
    private final ModuleKey root = key("contract");
    private final Map<ModuleKey, List<ModuleImport>> graph = new HashMap<>();

    @Test
    void placesDependenciesBeforeTheirImporters() {
        edge(root, "lib.a");
        edge(key("lib.a"), "lib.b");
        edge(key("lib.b"), "lib.c");

        assertEquals(List.of(key("lib.c"), key("lib.b"), key("lib.a")), DependencyOrderer.order(root, graph));
    }

    @Test
    void visitsImportsInNameOrder() {
        edge(root, "lib.zeta");
        edge(root, "lib.alpha");
        edge(key("lib.zeta"), "lib.common");
        edge(key("lib.alpha"), "lib.common");

        assertEquals(
            List.of(key("lib.common"), key("lib.alpha"), key("lib.zeta")),
            DependencyOrderer.order(root, graph)
        );
    }

    @Test
    void emitsSharedModulesOnce() {
        edge(root, "lib.a");
        edge(root, "lib.common");
        edge(key("lib.a"), "lib.common");

        assertEquals(List.of(key("lib.common"), key("lib.a")), DependencyOrderer.order(root, graph));
    }

    @Test
    void rejectsCycles() {
        edge(root, "lib.a");
        edge(key("lib.a"), "lib.b");
        edge(key("lib.b"), "lib.a");

        var error = assertThrows(RenderException.class, () -> DependencyOrderer.order(root, graph));
        assertEquals(ErrorKind.CYCLIC_IMPORT, error.kind());
        assertEquals("Cyclic import between modules: lib.a -> lib.b -> lib.a", error.getMessage());
    }

    private void edge(ModuleKey from, String to) {
        var target = key(to);
        graph.computeIfAbsent(from, k -> new ArrayList<>()).add(new ModuleImport(to, target.lastSegment(), target));
    }

    private static ModuleKey key(String name) {
        return new ModuleKey(name, Path.of("/src", name.replace('.', '/') + ".py"));
    }
}
