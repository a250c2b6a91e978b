package work.contracts.renderer.link;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.contracts.renderer.api.ErrorKind;
import work.contracts.renderer.api.RenderException;
import work.contracts.renderer.syntax.AstPrinter;
import work.contracts.renderer.syntax.AstRewriter;
import work.contracts.renderer.syntax.Expr;
import work.contracts.renderer.syntax.Stmt;

/**
 * Flattens feature-module symbols into module-qualified identifiers.
 *
 * <p>The first pass replaces {@code alias.member[.more]} with the member's namespaced name in
 * every module that imported {@code alias}. The second pass renames each feature definition and
 * the module-level references to it inside its own module. Every name produced by either pass is
 * bound in the {@link SymbolTable} to the definition it denotes.
 */
public final class SymbolNamespacer {
    private static final Logger LOG = LoggerFactory.getLogger(SymbolNamespacer.class);

    private final LinkContext context;
    private final SymbolTable symbols;

    public SymbolNamespacer(LinkContext context) {
        this.context = context;
        this.symbols = context.symbols();
    }

    public Namespaces run() {
        var features = context.featureModules();
        var namespaces = Namespaces.assign(features.stream().map(SourceModule::key).toList());
        for (var module : features) {
            for (var definition : context.definitionsOf(module.key())) {
                definition.namespacedName(namespaces.namespaced(module.key(), definition.localName()));
            }
        }
        var root = context.root();
        root.replaceBody(new ReferenceRewriter(root).rewriteBody(root.body()));
        for (var module : features) {
            rewriteDefinitions(module, new ReferenceRewriter(module));
        }
        for (var module : features) {
            rewriteDefinitions(module, new DefinitionRenamer(module));
        }
        LOG.debug("Bound {} reference(s) across {} feature module(s)", symbols.size(), features.size());
        return namespaces;
    }

    /** Rewrites each distinct definition statement once; chained assignments share a statement. */
    private void rewriteDefinitions(SourceModule module, AstRewriter rewriter) {
        var rewritten = new IdentityHashMap<Stmt, Stmt>();
        for (var definition : context.definitionsOf(module.key())) {
            var statement = rewritten.computeIfAbsent(definition.statement(), original -> rewriter.rewrite(original));
            definition.statement(statement);
        }
        var body = new ArrayList<Stmt>();
        module.body().forEach(statement -> body.add(rewritten.getOrDefault(statement, statement)));
        module.replaceBody(body);
    }

    /**
     * Fails when two emitted definitions, or an emitted definition and a template-level name, end
     * up with the same identifier.
     */
    public static void checkCollisions(List<Definition> emitted, SourceModule root) {
        Map<String, Definition> owners = new HashMap<>();
        for (var definition : emitted) {
            var previous = owners.putIfAbsent(definition.namespacedName(), definition);
            if (previous != null && previous != definition && previous.statement() != definition.statement()) {
                throw new RenderException(
                    ErrorKind.NAME_COLLISION,
                    "Namespaced name " + definition.namespacedName() + " is defined by both " + previous.module().name()
                        + "." + previous.localName() + " and " + definition.module().name() + "." + definition.localName(),
                    definition.module().name(),
                    definition.statement().source()
                );
            }
        }
        for (var statement : root.body()) {
            var name = StatementNames.definedName(statement);
            if (name != null && owners.containsKey(name)) {
                var clash = owners.get(name);
                throw RenderException.atStatement(
                    ErrorKind.NAME_COLLISION,
                    "Template definition " + name + " collides with the namespaced name of " + clash.module().name()
                        + "." + clash.localName() + ":",
                    root.name(),
                    statement.source(),
                    AstPrinter.print(statement).lines().findFirst().orElse("")
                );
            }
        }
    }

    private final class ReferenceRewriter extends AstRewriter {
        private final SourceModule module;
        private final Map<String, List<ModuleImport>> aliases = new LinkedHashMap<>();

        private ReferenceRewriter(SourceModule module) {
            this.module = module;
            for (var edge : context.importsOf(module.key())) {
                aliases.computeIfAbsent(edge.alias(), alias -> new ArrayList<>()).add(edge);
            }
        }

        @Override
        public Expr rewrite(Expr e) {
            if (e instanceof Expr.Attribute attribute) {
                var flattened = flatten(attribute);
                return flattened != null ? flattened : super.rewrite(e);
            }
            if (e instanceof Expr.Name name && isModuleAlias(name.id())) {
                throw new RenderException(
                    ErrorKind.UNRESOLVED_SYMBOL,
                    "Module alias '" + name.id() + "' can only be used to access its members (" + name.id()
                        + ".<name>) in " + module.name() + " (Line: " + name.source().line() + ")",
                    module.name(),
                    name.source()
                );
            }
            return super.rewrite(e);
        }

        private Expr flatten(Expr.Attribute attribute) {
            if (attribute.value() instanceof Expr.Name base && isModuleAlias(base.id())) {
                var definition = resolve(base, attribute);
                var flat = new Expr.Name(definition.namespacedName(), attribute.source());
                symbols.bind(flat, definition);
                return flat;
            }
            if (attribute.value() instanceof Expr.Attribute inner) {
                var flattened = flatten(inner);
                return flattened == null ? null : new Expr.Attribute(flattened, attribute.attr(), attribute.source());
            }
            return null;
        }

        private boolean isModuleAlias(String id) {
            return aliases.containsKey(id) && !isLocallyBound(id);
        }

        private Definition resolve(Expr.Name base, Expr.Attribute attribute) {
            var candidates = aliases.get(base.id()).stream().map(ModuleImport::target).distinct().toList();
            if (candidates.size() > 1) {
                throw new RenderException(
                    ErrorKind.AMBIGUOUS_ALIAS,
                    "Found ambiguous reference to an imported module. Multiple matches of " + base.id() + " found in "
                        + module.name() + ": " + candidates,
                    module.name(),
                    base.source()
                );
            }
            var target = candidates.get(0);
            return context.definition(target, attribute.attr()).orElseThrow(() -> new RenderException(
                ErrorKind.UNRESOLVED_SYMBOL,
                base.id() + "." + attribute.attr() + " in " + module.name() + " (Line: " + base.source().line()
                    + ") does not name a top-level definition of " + target.name(),
                module.name(),
                base.source()
            ));
        }
    }

    private final class DefinitionRenamer extends AstRewriter {
        private final Map<String, Definition> local = new HashMap<>();

        private DefinitionRenamer(SourceModule module) {
            context.definitionsOf(module.key()).forEach(definition -> local.putIfAbsent(definition.localName(), definition));
        }

        @Override
        public Stmt rewrite(Stmt s) {
            var moduleLevel = atModuleLevel();
            var rewritten = super.rewrite(s);
            if (moduleLevel && rewritten instanceof Stmt.FunctionDef def && local.containsKey(def.name())) {
                return new Stmt.FunctionDef(
                    def.decorators(),
                    local.get(def.name()).namespacedName(),
                    def.args(),
                    def.returns(),
                    def.body(),
                    def.isAsync(),
                    def.source()
                );
            }
            if (rewritten instanceof Stmt.Global global && global.names().stream().anyMatch(local::containsKey)) {
                var names = global.names().stream()
                    .map(name -> local.containsKey(name) ? local.get(name).namespacedName() : name)
                    .toList();
                return new Stmt.Global(names, global.source());
            }
            return rewritten;
        }

        @Override
        public Expr rewrite(Expr e) {
            if (e instanceof Expr.Name name && !symbols.isBound(name) && local.containsKey(name.id()) && !isLocallyBound(name.id())) {
                var definition = local.get(name.id());
                var renamed = new Expr.Name(definition.namespacedName(), name.source());
                symbols.bind(renamed, definition);
                return renamed;
            }
            return super.rewrite(e);
        }
    }
}
