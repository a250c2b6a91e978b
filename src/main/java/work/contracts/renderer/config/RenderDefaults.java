package work.contracts.renderer.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.tomlj.Toml;
import org.tomlj.TomlArray;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;
import work.contracts.renderer.api.Whitelist;

/**
 * Renderer defaults bundled as {@code renderer-defaults.toml} on the classpath.
 */
public record RenderDefaults(
    String rendererVersion,
    Whitelist whitelist,
    String reservedCapability,
    List<String> ignoredImportPrefixes,
    Set<String> vaultTypeNames,
    List<String> metadataFields,
    Set<String> protectedMetadataFields,
    List<String> hookNames,
    Set<String> foldedDecorators,
    String headerPrefix,
    String headerMarker,
    String hashingAlgorithm,
    boolean useFullFilepathInHeaders,
    boolean renderMetadataAtTopOfFile,
    boolean includeAutogenWarning,
    String autogenWarning,
    boolean applyFormatting,
    int supportedApiMajorVersion,
    List<String> thirdPartyPathMarkers
) {
    public static final String RESOURCE = "renderer-defaults.toml";

    private static volatile RenderDefaults cached;

    public static RenderDefaults load() {
        var defaults = cached;
        if (defaults == null) {
            try (InputStream in = RenderDefaults.class.getClassLoader().getResourceAsStream(RESOURCE)) {
                if (in == null) {
                    throw new IllegalStateException("Missing classpath resource " + RESOURCE);
                }
                defaults = fromToml(Toml.parse(in), RESOURCE);
            } catch (IOException ex) {
                throw new UncheckedIOException("Failed to read " + RESOURCE, ex);
            }
            cached = defaults;
        }
        return defaults;
    }

    static RenderDefaults fromToml(TomlParseResult toml, String origin) {
        if (toml.hasErrors()) {
            throw new IllegalArgumentException("Invalid TOML in " + origin + ": " + toml.errors().get(0));
        }
        var version = requireString(toml, "renderer-version", origin);
        return new RenderDefaults(
            version,
            readWhitelist(toml.getArray("whitelist"), requireString(toml, "all-required-marker", origin), origin),
            requireString(toml, "reserved-capability", origin),
            strings(toml, "ignored-import-prefixes"),
            new LinkedHashSet<>(strings(toml, "vault-type-names")),
            strings(toml, "top-level-metadata-fields"),
            new LinkedHashSet<>(strings(toml, "protected-metadata-fields")),
            strings(toml, "hooks"),
            new LinkedHashSet<>(strings(toml, "folded-decorators")),
            requireString(toml, "header-prefix", origin),
            requireString(toml, "header-marker", origin),
            requireString(toml, "hashing-algorithm", origin),
            toml.getBoolean("use-full-filepath-in-headers", () -> false),
            toml.getBoolean("render-metadata-at-top-of-file", () -> true),
            toml.getBoolean("include-autogen-warning", () -> true),
            requireString(toml, "autogen-warning", origin).replace("{version}", version),
            toml.getBoolean("apply-formatting", () -> true),
            Math.toIntExact(toml.getLong("supported-api-major-version", () -> 4L)),
            strings(toml, "third-party-path-markers")
        );
    }

    static Whitelist readWhitelist(TomlArray entries, String allRequiredMarker, String origin) {
        if (entries == null) {
            throw new IllegalArgumentException("Missing [[whitelist]] entries in " + origin);
        }
        Map<String, List<String>> capabilities = new LinkedHashMap<>();
        for (var i = 0; i < entries.size(); i++) {
            TomlTable entry = entries.getTable(i);
            var module = entry.getString("module");
            if (module == null || module.isBlank()) {
                throw new IllegalArgumentException("Whitelist entry " + i + " in " + origin + " has no module");
            }
            capabilities.put(module, toStrings(entry.getArray("symbols")));
        }
        return new Whitelist(capabilities, allRequiredMarker);
    }

    private static String requireString(TomlTable table, String key, String origin) {
        var value = table.getString(key);
        if (value == null) {
            throw new IllegalArgumentException("Missing '" + key + "' in " + origin);
        }
        return value;
    }

    private static List<String> strings(TomlTable table, String key) {
        return toStrings(table.getArray(key));
    }

    static List<String> toStrings(TomlArray array) {
        var values = new ArrayList<String>();
        if (array == null) {
            return values;
        }
        for (var i = 0; i < array.size(); i++) {
            values.add(array.getString(i));
        }
        return values;
    }
}
