package work.contracts.renderer.link;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
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
import work.contracts.renderer.syntax.Stmt;

class ImportGraphDiscoveryTest {
    private static final String API = "api = \"4.0.0\"";

    @TempDir
    Path dir;

    @Test
    void recordsFeatureModulesAndTheirDefinitions() {
        write(dir, "library/fees.py", lines(
            "from contracts_api import Posting",
            "\"\"\"Fee helpers.\"\"\"",
            "RATE = 5",
            "LIMIT: int = 10",
            "def charge(vault):",
            "    return RATE"
        ));
        var template = write(dir, "contract.py", lines(API, "import library.fees as fees", "x = fees.charge(None)"));

        var context = discover(template);

        assertEquals(2, context.modules().size());
        var fees = context.featureModules().get(0);
        assertEquals("library.fees", fees.name());
        var names = context.definitionsOf(fees.key()).stream().map(Definition::localName).toList();
        assertEquals(List.of("RATE", "LIMIT", "charge"), names);
        assertEquals("from contracts_api import Posting", context.capabilityImports().toString());
        var edges = context.importsOf(context.root().key());
        assertEquals(1, edges.size());
        assertEquals("fees", edges.get(0).alias());
        assertTrue(context.root().body().stream().noneMatch(statement -> statement instanceof Stmt.Import));
    }

    @Test
    void visitsSharedModulesOnce() {
        write(dir, "lib/common.py", lines("def one():", "    return 1"));
        write(dir, "lib/a.py", lines("import lib.common as common", "def a():", "    return common.one()"));
        write(dir, "lib/b.py", lines("import lib.common as common", "def b():", "    return common.one()"));
        var template = write(dir, "contract.py", lines(API, "import lib.a as a", "import lib.b as b"));

        var context = discover(template);

        assertEquals(4, context.modules().size());
        assertEquals(1, context.featureModules().stream().filter(module -> module.name().equals("lib.common")).count());
    }

    @Test
    void rejectsDirectImportOfTheReservedCapability() {
        var error = failure(lines(API, "import contracts_api"));
        assertEquals(ErrorKind.DISALLOWED_IMPORT, error.kind());
        assertTrue(error.getMessage().startsWith("contracts_api cannot be imported directly:"), error.getMessage());
        assertTrue(error.getMessage().contains("line 2:"), error.getMessage());
    }

    @Test
    void rejectsWildcardImportFromTheReservedCapability() {
        var error = failure(lines(API, "from contracts_api import *"));
        assertEquals(ErrorKind.DISALLOWED_IMPORT, error.kind());
        assertTrue(error.getMessage().contains("is against best practices"), error.getMessage());
    }

    @Test
    void rejectsWildcardImportFromOtherCapabilities() {
        var error = failure(lines(API, "from decimal import *"));
        assertTrue(error.getMessage().contains("Importing * from module 'decimal' is not allowed."), error.getMessage());
    }

    @Test
    void rejectsSymbolsOutsideTheWhitelist() {
        var error = failure(lines(API, "from json import dump"));
        assertEquals(ErrorKind.DISALLOWED_IMPORT, error.kind());
    }

    @Test
    void rejectsFromImportsOfFeatureModules() {
        write(dir, "library/fees.py", lines("RATE = 5"));
        var error = failure(lines(API, "from library.fees import RATE"));
        assertEquals(ErrorKind.DISALLOWED_IMPORT, error.kind());
        assertTrue(error.getMessage().contains("`library.fees` is not such a module"), error.getMessage());
    }

    @Test
    void rejectsAliasingModulesThatMustBeImportedDirectly() {
        assertEquals(ErrorKind.DISALLOWED_IMPORT, failure(lines(API, "import math as m")).kind());
        assertEquals(ErrorKind.DISALLOWED_IMPORT, failure(lines(API, "from math import floor")).kind());
    }

    @Test
    void requiresAnAliasForFeatureModules() {
        write(dir, "library/fees.py", lines("RATE = 5"));
        assertEquals(ErrorKind.MISSING_ALIAS, failure(lines(API, "import library.fees")).kind());
    }

    @Test
    void reportsModulesThatCannotBeFound() {
        var error = failure(lines(API, "import library.missing as missing"));
        assertEquals(ErrorKind.UNRESOLVABLE_MODULE, error.kind());
        assertTrue(error.getMessage().contains("library.missing is not a whitelisted module."), error.getMessage());
    }

    @Test
    void rejectsThirdPartyModules() {
        write(dir, "third_party/vendor.py", lines("X = 1"));
        var template = write(dir, "contract.py", lines(API, "import vendor as vendor"));
        var error = assertThrows(RenderException.class, () -> discover(template, dir, dir.resolve("third_party")));
        assertEquals(ErrorKind.DISALLOWED_IMPORT, error.kind());
        assertTrue(error.getMessage().contains("third-party module"), error.getMessage());
    }

    @Test
    void rejectsRelativeImports() {
        assertEquals(ErrorKind.DISALLOWED_IMPORT, failure(lines(API, "from . import fees")).kind());
    }

    @Test
    void dropsDevelopmentOnlyImports() {
        var template = write(dir, "contract.py", lines(
            API,
            "from inception_sdk.vault.contracts.extensions.contracts_api_extensions import SmartContractVault"
        ));
        var context = discover(template);
        assertTrue(context.capabilityImports().isEmpty());
    }

    @Test
    void mergesCapabilityImportsAcrossModules() {
        write(dir, "library/dates.py", lines("from json import loads, dumps", "import math", "X = 1"));
        var template = write(dir, "contract.py", lines(API, "from json import dumps", "import math", "import library.dates as dates"));

        var context = discover(template);

        assertEquals("from json import dumps, loads\nimport math", context.capabilityImports().toString());
    }

    @Test
    void replacesVaultTypeHintsAndImportsAny() {
        write(dir, "library/fees.py", lines(
            "from typing import Optional",
            "def charge(vault: SmartContractVault, other: Optional[SuperviseeContractVault] = None) -> None:",
            "    return None"
        ));
        var template = write(dir, "contract.py", lines(API, "import library.fees as fees"));

        var context = discover(template);

        var fees = context.featureModules().get(0);
        var charge = (Stmt.FunctionDef) context.definitionsOf(fees.key()).get(0).statement();
        assertEquals("Any", AstPrinter.print(charge.args().args().get(0).annotation()));
        assertEquals("Optional[Any]", AstPrinter.print(charge.args().args().get(1).annotation()));
        assertEquals("from typing import Optional, Any", context.capabilityImports().toString());
    }

    @Test
    void rejectsUnpackingAssignmentsInFeatureModules() {
        write(dir, "library/fees.py", lines("A, B = 1, 2"));
        var error = failure(lines(API, "import library.fees as fees"));
        assertEquals(ErrorKind.UNSUPPORTED_TARGET, error.kind());
        assertTrue(error.getMessage().startsWith("Unable to assign to target of type Tuple in library.fees"), error.getMessage());
    }

    @Test
    void keepsTheFirstOfDuplicateDefinitions() {
        write(dir, "library/fees.py", lines("RATE = 1", "RATE = 2"));
        var template = write(dir, "contract.py", lines(API, "import library.fees as fees"));

        var context = discover(template);

        var definitions = context.definitionsOf(context.featureModules().get(0).key());
        assertEquals(1, definitions.size());
        assertEquals(1, definitions.get(0).statement().source().line());
    }

    @Test
    void givesChainedAssignmentsOneDefinitionPerName() {
        write(dir, "library/fees.py", lines("A = B = 1"));
        var template = write(dir, "contract.py", lines(API, "import library.fees as fees"));

        var context = discover(template);

        assertTrue(context.definitionsOf(context.root().key()).isEmpty());
        var feature = context.definitionsOf(context.featureModules().get(0).key());
        assertEquals(List.of("A", "B"), feature.stream().map(Definition::localName).toList());
        assertSame(feature.get(0).statement(), feature.get(1).statement());
    }

    @Test
    void requiresSupportedApiMetadata() {
        var missing = failure(lines("version = \"1.0.0\""));
        assertEquals(ErrorKind.VERSION_UNSUPPORTED, missing.kind());
        assertTrue(missing.getMessage().contains("missing api metadata"), missing.getMessage());

        var old = failure(lines("api = \"3.12.0\""));
        assertEquals(ErrorKind.VERSION_UNSUPPORTED, old.kind());
        assertFalse(old.getMessage().contains("missing"));
    }

    private RenderException failure(String template) {
        var file = write(dir, "contract.py", template);
        return assertThrows(RenderException.class, () -> discover(file));
    }

    private LinkContext discover(Path template) {
        return discover(template, dir);
    }

    private LinkContext discover(Path template, Path... roots) {
        var context = new LinkContext(configuration(template, roots).build());
        new ImportGraphDiscovery(context, new ModuleResolver(List.of(roots))).discover(template);
        return context;
    }
}
