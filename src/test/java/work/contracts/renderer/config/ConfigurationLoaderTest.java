package work.contracts.renderer.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.contracts.renderer.support.RenderFixtures.lines;
import static work.contracts.renderer.support.RenderFixtures.write;

import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.contracts.renderer.api.LogLevel;
import work.contracts.renderer.api.RenderConfiguration;

class ConfigurationLoaderTest {
    @TempDir
    Path dir;

    @Test
    void appliesTomlOverrides() {
        var file = write(dir, "renderer.toml", lines(
            "source-roots = [\"libs\", \"shared\"]",
            "use_full_filepath_in_headers = true",
            "hooks = [\"pre_posting_hook\"]",
            "autogen-warning = \"# generated by {version}\"",
            "",
            "[[whitelist]]",
            "module = \"contracts_api\"",
            "symbols = [\"*\"]",
            "",
            "[[whitelist]]",
            "module = \"math\"",
            "symbols = [\"all_required\"]"
        ));

        var config = load(file);

        assertEquals(List.of(dir.resolve("libs"), dir.resolve("shared")), config.sourceRoots());
        assertTrue(config.useFullFilepathInHeaders());
        assertEquals(List.of("pre_posting_hook"), config.hookNames());
        assertEquals("# generated by " + RenderDefaults.load().rendererVersion(), config.autogenWarning());
        assertEquals(List.of("contracts_api", "math"), config.whitelist().modules());
        assertTrue(config.whitelist().requiresDirectImport("math"));
        var order = config.metadataOrder();
        assertEquals(List.of("contracts_api", "math", "api"), order.subList(0, 3));
        assertEquals("pre_posting_hook", order.get(order.size() - 1));
    }

    @Test
    void appliesYamlOverrides() {
        var file = write(dir, "renderer.yaml", lines(
            "whitelist:",
            "  contracts_api: [\"*\"]",
            "  json: [dumps]",
            "hashing_algorithm: sha256",
            "use-git: false",
            "supported-api-major-version: 5",
            "log-level: debug"
        ));

        var config = load(file);

        assertEquals("sha256", config.hashingAlgorithm());
        assertTrue(config.whitelist().allowsSymbol("json", "dumps"));
        assertFalse(config.whitelist().allowsSymbol("json", "loads"));
        assertFalse(config.whitelist().contains("decimal"));
        assertEquals(5, config.supportedApiMajorVersion());
        assertEquals(LogLevel.DEBUG, config.logLevel());
    }

    @Test
    void keepsDefaultsForKeysNotGiven() {
        var config = load(write(dir, "renderer.json", "{\"render-metadata-at-top-of-file\": false}"));

        assertFalse(config.renderMetadataAtTopOfFile());
        assertEquals(RenderDefaults.load().headerMarker(), config.headerMarker());
        assertTrue(config.whitelist().contains("decimal"));
    }

    @Test
    void rejectsInvalidFiles() {
        var unknown = assertThrows(IllegalArgumentException.class, () -> load(write(dir, "a.toml", "colour = \"red\"\n")));
        assertTrue(unknown.getMessage().startsWith("Unknown configuration key 'colour'"), unknown.getMessage());

        var wrongType = assertThrows(IllegalArgumentException.class, () -> load(write(dir, "b.json", "{\"apply-formatting\": \"yes\"}")));
        assertTrue(wrongType.getMessage().contains("must be true or false"), wrongType.getMessage());

        var format = assertThrows(IllegalArgumentException.class, () -> load(write(dir, "c.ini", "x=1\n")));
        assertTrue(format.getMessage().startsWith("Unsupported configuration format"), format.getMessage());

        var missing = assertThrows(IllegalArgumentException.class, () -> load(dir.resolve("absent.toml")));
        assertTrue(missing.getMessage().startsWith("Configuration file not found"), missing.getMessage());

        assertThrows(IllegalArgumentException.class, () -> load(write(dir, "d.toml", "hooks = [\n")));
    }

    private RenderConfiguration load(Path file) {
        var builder = RenderConfiguration.builder().templatePath(dir.resolve("contract.py"));
        return ConfigurationLoader.apply(file, builder).build();
    }
}
