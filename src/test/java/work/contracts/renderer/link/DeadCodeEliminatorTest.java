package work.contracts.renderer.link;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static work.contracts.renderer.support.RenderFixtures.configuration;
import static work.contracts.renderer.support.RenderFixtures.lines;
import static work.contracts.renderer.support.RenderFixtures.write;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class DeadCodeEliminatorTest {
    private static final String API = "api = \"4.0.0\"";

    @TempDir
    Path dir;

    @Test
    void keepsTransitivelyReferencedDefinitions() {
        write(dir, "library/fees.py", lines(
            "RATE = 5",
            "def charge(vault):",
            "    return _helper(vault) * RATE",
            "def _helper(vault):",
            "    return 1",
            "def unused():",
            "    return charge(None)"
        ));
        var result = eliminate(lines(API, "import library.fees as fees", "def pre_posting_hook(vault, hook_arguments):", "    return fees.charge(vault)"));

        assertEquals(List.of("fees_RATE", "fees_charge", "fees__helper"), names(result.kept()));
        assertEquals(List.of("fees_unused"), names(result.removed()));
    }

    @Test
    void dropsClustersThatOnlyReferenceEachOther() {
        write(dir, "library/loop.py", lines(
            "def ping(n):",
            "    return pong(n - 1)",
            "def pong(n):",
            "    return ping(n - 1)",
            "def used():",
            "    return 1"
        ));
        var result = eliminate(lines(API, "import library.loop as loop", "x = loop.used()"));

        assertEquals(List.of("loop_used"), names(result.kept()));
        assertEquals(List.of("loop_ping", "loop_pong"), names(result.removed()));
    }

    @Test
    void keepsMutuallyReferencingDefinitionsReachedFromTheTemplate() {
        write(dir, "library/loop.py", lines(
            "def ping(n):",
            "    return pong(n - 1)",
            "def pong(n):",
            "    return ping(n - 1)",
            "def idle():",
            "    return 0"
        ));
        var result = eliminate(lines(API, "import library.loop as loop", "x = loop.pong(3)"));

        assertEquals(List.of("loop_ping", "loop_pong"), names(result.kept()));
        assertEquals(List.of("loop_idle"), names(result.removed()));
    }

    @Test
    void treatsTemplateControlFlowAsLive() {
        write(dir, "library/flags.py", lines("ENABLED = True", "OTHER = False"));
        var result = eliminate(lines(API, "import library.flags as flags", "if flags.ENABLED:", "    pass"));

        assertEquals(List.of("flags_ENABLED"), names(result.kept()));
    }

    @Test
    void followsReferencesAcrossModules() {
        write(dir, "lib/c.py", lines("C = 1", "D = 2"));
        write(dir, "lib/b.py", lines("import lib.c as c", "B = c.C"));
        write(dir, "lib/a.py", lines("import lib.b as b", "A = b.B"));
        var result = eliminate(lines(API, "import lib.a as a", "x = a.A"));

        assertEquals(List.of("c_C", "b_B", "a_A"), names(result.kept()));
        assertEquals(List.of("c_D"), names(result.removed()));
    }

    private DeadCodeEliminator.Result eliminate(String template) {
        var file = write(dir, "contract.py", template);
        var context = new LinkContext(configuration(file, dir).build());
        var root = new ImportGraphDiscovery(context, new ModuleResolver(List.of(dir))).discover(file);
        new SymbolNamespacer(context).run();
        var candidates = new ArrayList<Definition>();
        DependencyOrderer.order(root.key(), context.importGraph()).forEach(key -> candidates.addAll(context.definitionsOf(key)));
        return DeadCodeEliminator.eliminate(candidates, root.body(), context.symbols());
    }

    private static List<String> names(List<Definition> definitions) {
        return definitions.stream().map(Definition::namespacedName).toList();
    }
}
