package work.contracts.renderer.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.tomlj.Toml;
import org.tomlj.TomlArray;
import org.tomlj.TomlTable;
import work.contracts.renderer.api.LogLevel;
import work.contracts.renderer.api.RenderConfiguration;
import work.contracts.renderer.api.Whitelist;

/**
 * Applies a user configuration file on top of a {@link RenderConfiguration.Builder}. TOML files
 * use the same keys as the bundled defaults; YAML and JSON files use the same keys, with the
 * whitelist given either as a list of {@code {module, symbols}} entries or as a
 * module-to-symbols map. Relative paths are resolved against the file's directory.
 */
public final class ConfigurationLoader {
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private ConfigurationLoader() {}

    public static RenderConfiguration.Builder apply(Path file, RenderConfiguration.Builder builder) {
        var settings = read(file);
        var baseDir = file.toAbsolutePath().getParent();
        var marker = string(settings, "all-required-marker", file);
        if (marker == null) {
            marker = RenderDefaults.load().whitelist().allRequiredMarker();
        }
        for (var entry : settings.entrySet()) {
            applySetting(entry.getKey(), entry.getValue(), builder, baseDir, marker, file);
        }
        return builder;
    }

    static Map<String, Object> read(Path file) {
        if (!Files.isRegularFile(file)) {
            throw new IllegalArgumentException("Configuration file not found: " + file);
        }
        var name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        try {
            Map<String, Object> raw;
            if (name.endsWith(".toml")) {
                var toml = Toml.parse(file);
                if (toml.hasErrors()) {
                    throw new IllegalArgumentException("Invalid TOML in " + file + ": " + toml.errors().get(0));
                }
                raw = plainTable(toml);
            } else if (name.endsWith(".yaml") || name.endsWith(".yml")) {
                raw = YAML_MAPPER.readValue(file.toFile(), MAP_TYPE);
            } else if (name.endsWith(".json")) {
                raw = JSON_MAPPER.readValue(file.toFile(), MAP_TYPE);
            } else {
                throw new IllegalArgumentException("Unsupported configuration format: " + file + " (expected .toml, .yaml, .yml or .json)");
            }
            var normalized = new LinkedHashMap<String, Object>();
            if (raw != null) {
                raw.forEach((key, value) -> normalized.put(key.replace('_', '-'), value));
            }
            return normalized;
        } catch (IOException ex) {
            throw new IllegalArgumentException("Failed to read configuration " + file + ": " + ex.getMessage(), ex);
        }
    }

    private static void applySetting(
        String key,
        Object value,
        RenderConfiguration.Builder builder,
        Path baseDir,
        String marker,
        Path file
    ) {
        switch (key) {
            case "all-required-marker":
                break;
            case "source-roots":
                builder.sourceRoots(strings(key, value, file).stream().map(root -> baseDir.resolve(root)).toList());
                break;
            case "whitelist":
                builder.whitelist(whitelist(value, marker, file));
                break;
            case "reserved-capability":
                builder.reservedCapability(text(key, value, file));
                break;
            case "ignored-import-prefixes":
                builder.ignoredImportPrefixes(strings(key, value, file));
                break;
            case "vault-type-names":
                builder.vaultTypeNames(new LinkedHashSet<>(strings(key, value, file)));
                break;
            case "top-level-metadata-fields":
                builder.metadataFields(strings(key, value, file));
                break;
            case "protected-metadata-fields":
                builder.protectedMetadataFields(new LinkedHashSet<>(strings(key, value, file)));
                break;
            case "hooks":
                builder.hookNames(strings(key, value, file));
                break;
            case "metadata-order":
                builder.metadataOrder(strings(key, value, file));
                break;
            case "folded-decorators":
                builder.foldedDecorators(new LinkedHashSet<>(strings(key, value, file)));
                break;
            case "header-prefix":
                builder.headerPrefix(text(key, value, file));
                break;
            case "header-marker":
                builder.headerMarker(text(key, value, file));
                break;
            case "hashing-algorithm":
                builder.hashingAlgorithm(text(key, value, file));
                break;
            case "use-git":
                builder.useGit(bool(key, value, file));
                break;
            case "git-repo-root":
                builder.gitRepoRoot(baseDir.resolve(text(key, value, file)));
                break;
            case "use-full-filepath-in-headers":
                builder.useFullFilepathInHeaders(bool(key, value, file));
                break;
            case "render-metadata-at-top-of-file":
                builder.renderMetadataAtTopOfFile(bool(key, value, file));
                break;
            case "include-autogen-warning":
                builder.includeAutogenWarning(bool(key, value, file));
                break;
            case "autogen-warning":
                builder.autogenWarning(text(key, value, file).replace("{version}", RenderDefaults.load().rendererVersion()));
                break;
            case "apply-formatting":
                builder.applyFormatting(bool(key, value, file));
                break;
            case "supported-api-major-version":
                builder.supportedApiMajorVersion(integer(key, value, file));
                break;
            case "third-party-path-markers":
                builder.thirdPartyPathMarkers(strings(key, value, file));
                break;
            case "log-level":
                builder.logLevel(LogLevel.from(text(key, value, file)));
                break;
            default:
                throw new IllegalArgumentException("Unknown configuration key '" + key + "' in " + file);
        }
    }

    private static Whitelist whitelist(Object value, String marker, Path file) {
        Map<String, List<String>> capabilities = new LinkedHashMap<>();
        if (value instanceof Map<?, ?> map) {
            map.forEach((module, symbols) -> capabilities.put(String.valueOf(module), strings("whitelist." + module, symbols, file)));
        } else if (value instanceof List<?> entries) {
            for (var i = 0; i < entries.size(); i++) {
                if (!(entries.get(i) instanceof Map<?, ?> entry) || !(entry.get("module") instanceof String module) || module.isBlank()) {
                    throw new IllegalArgumentException("Whitelist entry " + i + " in " + file + " has no module");
                }
                var symbols = entry.get("symbols");
                capabilities.put(module, strings("whitelist." + module, symbols == null ? List.of() : symbols, file));
            }
        } else {
            throw new IllegalArgumentException("'whitelist' in " + file + " must be a list of entries or a map");
        }
        return new Whitelist(capabilities, marker);
    }

    private static String string(Map<String, Object> settings, String key, Path file) {
        var value = settings.get(key);
        return value == null ? null : text(key, value, file);
    }

    private static String text(String key, Object value, Path file) {
        if (!(value instanceof String text)) {
            throw new IllegalArgumentException("'" + key + "' in " + file + " must be a string");
        }
        return text;
    }

    private static boolean bool(String key, Object value, Path file) {
        if (!(value instanceof Boolean flag)) {
            throw new IllegalArgumentException("'" + key + "' in " + file + " must be true or false");
        }
        return flag;
    }

    private static int integer(String key, Object value, Path file) {
        if (value instanceof Number number) {
            return number.intValue();
        }
        if (value instanceof String text && text.matches("\\d+")) {
            return Integer.parseInt(text);
        }
        throw new IllegalArgumentException("'" + key + "' in " + file + " must be an integer");
    }

    private static List<String> strings(String key, Object value, Path file) {
        if (!(value instanceof List<?> list)) {
            throw new IllegalArgumentException("'" + key + "' in " + file + " must be a list of strings");
        }
        var result = new ArrayList<String>();
        for (var item : list) {
            if (!(item instanceof String text)) {
                throw new IllegalArgumentException("'" + key + "' in " + file + " must only contain strings");
            }
            result.add(text);
        }
        return result;
    }

    private static Map<String, Object> plainTable(TomlTable table) {
        var map = new LinkedHashMap<String, Object>();
        for (var key : table.keySet()) {
            map.put(key, plain(table.get(List.of(key))));
        }
        return map;
    }

    private static Object plain(Object value) {
        if (value instanceof TomlTable table) {
            return plainTable(table);
        }
        if (value instanceof TomlArray array) {
            var list = new ArrayList<Object>();
            for (var i = 0; i < array.size(); i++) {
                list.add(plain(array.get(i)));
            }
            return list;
        }
        return value;
    }
}
