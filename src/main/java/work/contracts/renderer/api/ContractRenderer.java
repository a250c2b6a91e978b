package work.contracts.renderer.api;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.contracts.renderer.link.DeadCodeEliminator;
import work.contracts.renderer.link.DecoratorConstantFolder;
import work.contracts.renderer.link.Definition;
import work.contracts.renderer.link.DependencyOrderer;
import work.contracts.renderer.link.ImportGraphDiscovery;
import work.contracts.renderer.link.LinkContext;
import work.contracts.renderer.link.ModuleResolver;
import work.contracts.renderer.link.ProvenanceHeaders;
import work.contracts.renderer.link.SymbolNamespacer;
import work.contracts.renderer.link.TreeAssembler;
import work.contracts.renderer.postprocess.OutputFormatter;
import work.contracts.renderer.postprocess.TokenPostProcessor;
import work.contracts.renderer.syntax.AstPrinter;
import work.contracts.renderer.vcs.GitProvenance;

/**
 * Public entry point for embedding the renderer: links a template and the feature modules it
 * imports into a single self-contained module.
 */
public final class ContractRenderer {
    private static final Logger LOG = LoggerFactory.getLogger(ContractRenderer.class);
    static final String OUTPUT_SUFFIX = "_rendered.py";

    /**
     * Renders the template in memory.
     *
     * @throws RenderException when the module graph breaks a linking rule
     * @throws IllegalArgumentException when the template does not exist
     */
    public RenderResult render(RenderConfiguration configuration) {
        var started = Instant.now();
        var template = configuration.templatePath().toAbsolutePath().normalize();
        if (!Files.isRegularFile(template)) {
            throw new IllegalArgumentException("Template file not found: " + template);
        }
        var context = new LinkContext(configuration);
        var resolver = new ModuleResolver(sourceRoots(configuration, template));
        var root = new ImportGraphDiscovery(context, resolver).discover(template);
        var namespaces = new SymbolNamespacer(context).run();

        var order = DependencyOrderer.order(root.key(), context.importGraph());
        var candidates = new ArrayList<Definition>();
        order.forEach(key -> candidates.addAll(context.definitionsOf(key)));
        var elimination = DeadCodeEliminator.eliminate(candidates, root.body(), context.symbols());
        SymbolNamespacer.checkCollisions(elimination.kept(), root);

        var git = openGit(configuration, template);
        String printed;
        try {
            var headers = new ProvenanceHeaders(configuration, git);
            var assembled = new TreeAssembler(context, headers).assemble(elimination.kept());
            var folded = new DecoratorConstantFolder(configuration.foldedDecorators(), configuration.protectedMetadataFields())
                .fold(assembled);
            printed = AstPrinter.print(folded);
        } finally {
            git.ifPresent(GitProvenance::close);
        }

        var output = new TokenPostProcessor(configuration.headerMarker()).process(printed);
        if (configuration.includeAutogenWarning()) {
            output = configuration.autogenWarning() + "\n" + output;
        }
        if (configuration.applyFormatting()) {
            output = OutputFormatter.format(output);
        }

        var prefixes = new LinkedHashMap<String, String>();
        order.forEach(key -> prefixes.put(key.name(), namespaces.prefix(key)));
        var metadata = new LinkedHashMap<String, Object>();
        metadata.put("template", template.toString());
        metadata.put("modules", prefixes);
        metadata.put("definitionsKept", elimination.kept().size());
        metadata.put("definitionsRemoved", elimination.removed().stream().map(Definition::namespacedName).toList());
        metadata.put("capabilityImports", context.capabilityImports().statements().stream().map(AstPrinter::print).toList());
        metadata.put("git", git.isPresent());
        LOG.debug("Linked {} feature module(s) into {}", order.size(), template.getFileName());
        return RenderResult.success(output, metadata, started);
    }

    /**
     * Renders the template and writes the result, by default next to the template as
     * {@code <stem>_rendered.py}. Nothing is written when rendering fails.
     */
    public RenderResult renderToFile(RenderConfiguration configuration) {
        var result = render(configuration);
        var target = configuration.outputPath().orElseGet(() -> defaultOutputPath(configuration.templatePath()));
        LOG.info("Writing rendered output to '{}'", target);
        try {
            var parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(target, result.requireOutput(), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to write rendered output to " + target, ex);
        }
        return result.withMetadata("outputPath", target.toString());
    }

    public static Path defaultOutputPath(Path template) {
        var fileName = template.getFileName().toString();
        var dot = fileName.lastIndexOf('.');
        var stem = dot > 0 ? fileName.substring(0, dot) : fileName;
        return template.resolveSibling(stem + OUTPUT_SUFFIX);
    }

    private static List<Path> sourceRoots(RenderConfiguration configuration, Path template) {
        if (!configuration.sourceRoots().isEmpty()) {
            return configuration.sourceRoots();
        }
        return List.of(template.getParent());
    }

    private static Optional<GitProvenance> openGit(RenderConfiguration configuration, Path template) {
        if (!configuration.useGit()) {
            return Optional.empty();
        }
        LOG.info("Using git to find commit hashes of rendered modules");
        return Optional.of(GitProvenance.open(configuration.gitRepoRoot().orElse(template.getParent())));
    }
}
