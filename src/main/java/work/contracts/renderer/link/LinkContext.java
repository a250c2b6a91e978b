package work.contracts.renderer.link;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import work.contracts.renderer.api.RenderConfiguration;

/**
 * State of one render invocation, threaded through every link stage and discarded afterwards.
 */
public final class LinkContext {
    private final RenderConfiguration configuration;
    private final Map<ModuleKey, SourceModule> modules = new LinkedHashMap<>();
    private final Map<ModuleKey, List<ModuleImport>> imports = new LinkedHashMap<>();
    private final Map<ModuleKey, List<Definition>> definitions = new LinkedHashMap<>();
    private final CapabilityImports capabilityImports = new CapabilityImports();
    private final SymbolTable symbols = new SymbolTable();
    private SourceModule root;
    private boolean typeHintReplaced;

    public LinkContext(RenderConfiguration configuration) {
        this.configuration = Objects.requireNonNull(configuration, "configuration");
    }

    public RenderConfiguration configuration() {
        return configuration;
    }

    public SourceModule root() {
        if (root == null) {
            throw new IllegalStateException("Root module has not been discovered yet");
        }
        return root;
    }

    void register(SourceModule module) {
        modules.put(module.key(), module);
        if (module.isRoot()) {
            root = module;
        }
    }

    public boolean isVisited(ModuleKey key) {
        return modules.containsKey(key);
    }

    public Optional<SourceModule> module(ModuleKey key) {
        return Optional.ofNullable(modules.get(key));
    }

    public Collection<SourceModule> modules() {
        return modules.values();
    }

    /** Every discovered module except the root, in discovery order. */
    public List<SourceModule> featureModules() {
        var features = new ArrayList<SourceModule>();
        modules.values().stream().filter(module -> !module.isRoot()).forEach(features::add);
        return features;
    }

    boolean addImport(ModuleKey from, ModuleImport edge) {
        var edges = imports.computeIfAbsent(from, key -> new ArrayList<>());
        if (edges.contains(edge)) {
            return false;
        }
        edges.add(edge);
        return true;
    }

    public List<ModuleImport> importsOf(ModuleKey module) {
        return imports.getOrDefault(module, List.of());
    }

    public Map<ModuleKey, List<ModuleImport>> importGraph() {
        return imports;
    }

    void addDefinition(Definition definition) {
        definitions.computeIfAbsent(definition.module(), key -> new ArrayList<>()).add(definition);
    }

    public List<Definition> definitionsOf(ModuleKey module) {
        return definitions.getOrDefault(module, List.of());
    }

    public Optional<Definition> definition(ModuleKey module, String localName) {
        return definitionsOf(module).stream().filter(definition -> definition.localName().equals(localName)).findFirst();
    }

    public CapabilityImports capabilityImports() {
        return capabilityImports;
    }

    public SymbolTable symbols() {
        return symbols;
    }

    public boolean typeHintReplaced() {
        return typeHintReplaced;
    }

    void markTypeHintReplaced() {
        typeHintReplaced = true;
    }
}
