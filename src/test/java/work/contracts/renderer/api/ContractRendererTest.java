package work.contracts.renderer.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.contracts.renderer.support.RenderFixtures.configuration;
import static work.contracts.renderer.support.RenderFixtures.copyFixture;
import static work.contracts.renderer.support.RenderFixtures.lines;
import static work.contracts.renderer.support.RenderFixtures.read;
import static work.contracts.renderer.support.RenderFixtures.write;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.contracts.renderer.config.RenderDefaults;
import work.contracts.renderer.syntax.SourceParser;
import work.contracts.renderer.vcs.Checksums;

class ContractRendererTest {
    private static final String FEES = lines(
        "from contracts_api import Posting",
        "RATE = 5",
        "def _helper(vault):",
        "    return RATE",
        "def charge(vault):",
        "    return _helper(vault) * RATE",
        "def unused():",
        "    return charge(None)"
    );

    private static final String TEMPLATE = lines(
        "import library.fees as fees",
        "def pre_posting_hook(vault, hook_arguments):",
        "    return fees.charge(vault)",
        "version = \"1.0.0\"",
        "api = \"4.0.0\""
    );

    @TempDir
    Path dir;

    private final ContractRenderer renderer = new ContractRenderer();

    @Test
    void linksFeatureModulesIntoOneFile() {
        var fees = write(dir, "library/fees.py", FEES);
        var template = write(dir, "contract.py", TEMPLATE);

        var result = renderer.render(configuration(template, dir).build());

        assertEquals(RenderResult.Status.SUCCESS, result.status());
        var expected = lines(
            RenderDefaults.load().autogenWarning(),
            "# Objects below have been imported from:",
            "#    contract.py",
            "# md5:" + Checksums.hexDigest("md5", TEMPLATE),
            "",
            "from contracts_api import Posting",
            "",
            "api = \"4.0.0\"",
            "version = \"1.0.0\"",
            "",
            "",
            "def pre_posting_hook(vault, hook_arguments):",
            "    return fees_charge(vault)",
            "",
            "",
            "# Objects below have been imported from:",
            "#    fees.py",
            "# md5:" + Checksums.hexDigest("md5", read(fees)),
            "",
            "fees_RATE = 5",
            "",
            "",
            "def fees__helper(vault):",
            "    return fees_RATE",
            "",
            "",
            "def fees_charge(vault):",
            "    return fees__helper(vault) * fees_RATE"
        );
        assertEquals(expected, result.requireOutput());
        assertEquals(Map.of("library.fees", "fees"), result.metadata().get("modules"));
        assertEquals(List.of("fees_unused"), result.metadata().get("definitionsRemoved"));
        assertEquals(3, result.metadata().get("definitionsKept"));
    }

    @Test
    void rendersTheSameOutputEveryTime() {
        write(dir, "library/fees.py", FEES);
        var template = write(dir, "contract.py", TEMPLATE);
        var config = configuration(template, dir).build();

        assertEquals(renderer.render(config).requireOutput(), renderer.render(config).requireOutput());
    }

    @Test
    void keepsTemplateOrderWhenMetadataStaysInPlace() {
        write(dir, "library/fees.py", FEES);
        var template = write(dir, "contract.py", TEMPLATE);

        var output = renderer.render(configuration(template, dir)
            .renderMetadataAtTopOfFile(false)
            .includeAutogenWarning(false)
            .build()).requireOutput();

        assertTrue(output.startsWith("# Objects below have been imported from:\n#    fees.py\n"), output);
        assertTrue(output.indexOf("def fees_charge") < output.indexOf("#    contract.py"), output);
        assertTrue(output.indexOf("def pre_posting_hook") < output.indexOf("version = "), output);
    }

    @Test
    void emitsDependenciesBeforeTheirDependents() {
        write(dir, "lib/c.py", lines("C = 1"));
        write(dir, "lib/b.py", lines("import lib.c as c", "B = c.C"));
        write(dir, "lib/a.py", lines("import lib.b as b", "A = b.B"));
        var template = write(dir, "contract.py", lines("api = \"4.0.0\"", "import lib.a as a", "x = a.A"));

        var output = renderer.render(configuration(template, dir).build()).requireOutput();

        var c = output.indexOf("#    c.py");
        var b = output.indexOf("#    b.py");
        var a = output.indexOf("#    a.py");
        assertTrue(c >= 0 && c < b && b < a, output);
        assertTrue(output.contains("b_B = c_C\n"), output);
        assertTrue(output.contains("x = a_A\n"), output);
    }

    @Test
    void emitsSharedDependenciesOnce() {
        write(dir, "lib/common.py", lines("BASE = 1"));
        write(dir, "lib/a.py", lines("import lib.common as common", "A = common.BASE + 1"));
        write(dir, "lib/b.py", lines("import lib.common as common", "B = common.BASE + 2"));
        var template = write(dir, "contract.py", lines("api = \"4.0.0\"", "import lib.a as a", "import lib.b as b", "x = a.A + b.B"));

        var output = renderer.render(configuration(template, dir).build()).requireOutput();

        var common = output.indexOf("#    common.py\n");
        assertTrue(common >= 0, output);
        assertEquals(-1, output.indexOf("#    common.py\n", common + 1), output);
        assertEquals(1, output.split("common_BASE = 1\n", -1).length - 1, output);
        assertTrue(common < output.indexOf("#    a.py") && common < output.indexOf("#    b.py"), output);
    }

    @Test
    void abortsWithoutWritingOnRuleViolations() {
        var template = write(dir, "contract.py", lines("api = \"4.0.0\"", "from contracts_api import *"));

        var error = assertThrows(RenderException.class, () -> renderer.renderToFile(configuration(template, dir).build()));

        assertEquals(ErrorKind.DISALLOWED_IMPORT, error.kind());
        assertFalse(Files.exists(ContractRenderer.defaultOutputPath(template)));
    }

    @Test
    void rejectsTemplatesForOtherApiVersions() {
        var template = write(dir, "contract.py", lines("api = \"3.12.0\"", "x = 1"));

        var error = assertThrows(RenderException.class, () -> renderer.render(configuration(template, dir).build()));

        assertEquals(ErrorKind.VERSION_UNSUPPORTED, error.kind());
    }

    @Test
    void reportsMissingTemplates() {
        var config = configuration(dir.resolve("missing.py"), dir).build();

        assertThrows(IllegalArgumentException.class, () -> renderer.render(config));
    }

    @Test
    void rendersTheLoanFixtureNextToTheTemplate() {
        var template = copyFixture(dir, "loan/contract.py");
        copyFixture(dir, "loan/library/features/interest.py");
        copyFixture(dir, "loan/library/features/utils.py");

        var result = renderer.renderToFile(RenderConfiguration.builder().templatePath(template).build());

        var written = dir.resolve("loan/contract_rendered.py");
        assertEquals(written.toString(), result.metadata().get("outputPath"));
        var output = read(written);
        assertEquals(result.requireOutput(), output);
        assertFalse(SourceParser.parseModule("contract_rendered.py", output).isEmpty());

        assertTrue(output.contains("@requires(event_type=\"ACCRUE_INTEREST\", parameters=True)"), output);
        assertTrue(output.contains("parameters = [interest_rate_parameter]"), output);
        assertTrue(output.contains("def pre_posting_hook(vault: Any, hook_arguments: PrePostingHookArguments):"), output);
        assertTrue(output.contains("from typing import Any\n"), output);
        assertTrue(output.contains("def utils_round_to(amount: Decimal, places: int = 2) -> Decimal:"), output);
        assertTrue(output.contains("    return utils_str_to_bool(utils_get_parameter(vault, name))"), output);
        assertFalse(output.contains("unused"), output);
        assertFalse(output.contains("import library"), output);

        var api = output.indexOf("api = \"4.0.0\"");
        var version = output.indexOf("version = \"1.2.0\"");
        var displayName = output.indexOf("display_name = ");
        var hook = output.indexOf("def pre_posting_hook");
        assertTrue(output.indexOf("from contracts_api import") < api, output);
        assertTrue(api < version && version < displayName && displayName < hook, output);
        assertTrue(output.indexOf("#    utils.py") < output.indexOf("#    interest.py"), output);

        assertEquals(List.of("utils_unused_rounding", "interest_unused_helper"), result.metadata().get("definitionsRemoved"));
    }
}
