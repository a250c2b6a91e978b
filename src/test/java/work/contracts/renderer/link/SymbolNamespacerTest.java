package work.contracts.renderer.link;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.contracts.renderer.support.RenderFixtures.configuration;
import static work.contracts.renderer.support.RenderFixtures.lines;
import static work.contracts.renderer.support.RenderFixtures.write;

import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.contracts.renderer.api.ErrorKind;
import work.contracts.renderer.api.RenderException;
import work.contracts.renderer.syntax.AstPrinter;

class SymbolNamespacerTest {
    private static final String API = "api = \"4.0.0\"";

    @TempDir
    Path dir;

    @Test
    void flattensAliasAccessAndRenamesDefinitions() {
        write(dir, "library/fees.py", lines(
            "RATE = 5",
            "def charge(vault):",
            "    return _helper(vault) * RATE",
            "def _helper(vault):",
            "    return vault.RATE"
        ));
        var context = link(lines(API, "import library.fees as fees", "x = fees.charge(None)"));

        assertEquals(API + "\nx = fees_charge(None)\n", AstPrinter.print(context.root().body()));
        assertEquals(
            "def fees_charge(vault):\n    return fees__helper(vault) * fees_RATE",
            printed(context, "charge")
        );
        assertEquals("def fees__helper(vault):\n    return vault.RATE", printed(context, "_helper"));
        assertEquals("fees_RATE = 5", printed(context, "RATE"));
    }

    @Test
    void leavesParametersKeywordsAndLocalsAlone() {
        write(dir, "library/fees.py", lines(
            "RATE = 5",
            "def charge(RATE):",
            "    return RATE",
            "def apply(vault):",
            "    total = [RATE for RATE in vault]",
            "    return compute(RATE=RATE, total=total)"
        ));
        var context = link(lines(API, "import library.fees as fees"));

        assertEquals("def fees_charge(RATE):\n    return RATE", printed(context, "charge"));
        assertEquals(
            "def fees_apply(vault):\n    total = [RATE for RATE in vault]\n    return compute(RATE=fees_RATE, total=total)",
            printed(context, "apply")
        );
    }

    @Test
    void renamesGlobalDeclarations() {
        write(dir, "library/counter.py", lines(
            "COUNT = 0",
            "def bump():",
            "    global COUNT",
            "    COUNT += 1"
        ));
        var context = link(lines(API, "import library.counter as counter"));

        assertEquals("def counter_bump():\n    global counter_COUNT\n    counter_COUNT += 1", printed(context, "bump"));
    }

    @Test
    void rewritesReferencesBetweenFeatureModules() {
        write(dir, "library/rates.py", lines("BASE = 1"));
        write(dir, "library/fees.py", lines("import library.rates as rates", "def charge():", "    return rates.BASE.real"));
        var context = link(lines(API, "import library.fees as fees"));

        assertEquals("def fees_charge():\n    return rates_BASE.real", printed(context, "charge"));
        var charge = context.definition(feature(context, "library.fees"), "charge").orElseThrow();
        var references = context.symbols().referencesIn(charge.statement());
        assertEquals(List.of("rates_BASE"), references.stream().map(Definition::namespacedName).toList());
    }

    @Test
    void respectsShadowedAliases() {
        write(dir, "library/fees.py", lines("def charge():", "    return 1"));
        var context = link(lines(API, "import library.fees as fees", "def hook(fees):", "    return fees.charge()"));

        assertTrue(AstPrinter.print(context.root().body()).contains("return fees.charge()"));
    }

    @Test
    void rejectsMembersThatAreNotDefinitions() {
        write(dir, "library/fees.py", lines("def charge():", "    return 1"));
        var error = assertThrows(RenderException.class, () -> link(lines(API, "import library.fees as fees", "x = fees.missing")));
        assertEquals(ErrorKind.UNRESOLVED_SYMBOL, error.kind());
    }

    @Test
    void rejectsBareUseOfAModuleAlias() {
        write(dir, "library/fees.py", lines("def charge():", "    return 1"));
        var error = assertThrows(RenderException.class, () -> link(lines(API, "import library.fees as fees", "x = fees")));
        assertEquals(ErrorKind.UNRESOLVED_SYMBOL, error.kind());
    }

    @Test
    void rejectsAliasesBoundToSeveralModules() {
        write(dir, "lib/a.py", lines("X = 1"));
        write(dir, "lib/b.py", lines("X = 2"));
        var error = assertThrows(
            RenderException.class,
            () -> link(lines(API, "import lib.a as util", "import lib.b as util", "y = util.X"))
        );
        assertEquals(ErrorKind.AMBIGUOUS_ALIAS, error.kind());
    }

    @Test
    void detectsCollisionsWithTemplateNames() {
        write(dir, "library/fees.py", lines("RATE = 5"));
        var context = link(lines(API, "import library.fees as fees", "fees_RATE = fees.RATE"));
        var definitions = context.definitionsOf(feature(context, "library.fees"));

        var error = assertThrows(RenderException.class, () -> SymbolNamespacer.checkCollisions(definitions, context.root()));
        assertEquals(ErrorKind.NAME_COLLISION, error.kind());
    }

    private LinkContext link(String template) {
        var file = write(dir, "contract.py", template);
        var context = new LinkContext(configuration(file, dir).build());
        new ImportGraphDiscovery(context, new ModuleResolver(List.of(dir))).discover(file);
        new SymbolNamespacer(context).run();
        return context;
    }

    private static ModuleKey feature(LinkContext context, String name) {
        return context.featureModules().stream()
            .filter(module -> module.name().equals(name))
            .findFirst()
            .orElseThrow()
            .key();
    }

    private static String printed(LinkContext context, String localName) {
        for (var module : context.featureModules()) {
            var definition = context.definition(module.key(), localName);
            if (definition.isPresent()) {
                return AstPrinter.print(definition.get().statement());
            }
        }
        throw new AssertionError("No definition named " + localName);
    }
}
