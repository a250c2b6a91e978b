package work.contracts.renderer.link;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.contracts.renderer.api.ErrorKind;
import work.contracts.renderer.api.RenderException;
import work.contracts.renderer.api.Whitelist;
import work.contracts.renderer.syntax.AstPrinter;
import work.contracts.renderer.syntax.AstRewriter;
import work.contracts.renderer.syntax.Expr;
import work.contracts.renderer.syntax.SourceParser;
import work.contracts.renderer.syntax.Stmt;

/**
 * Depth-first walk of the import graph starting at the template. Whitelisted imports are
 * collected into {@link CapabilityImports}, feature modules are parsed once each and their
 * top-level definitions recorded. Import statements are removed from every module body.
 */
public final class ImportGraphDiscovery {
    private static final Logger LOG = LoggerFactory.getLogger(ImportGraphDiscovery.class);

    private final LinkContext context;
    private final ModuleResolver resolver;
    private final Whitelist whitelist;
    private final String reservedCapability;

    public ImportGraphDiscovery(LinkContext context, ModuleResolver resolver) {
        this.context = context;
        this.resolver = resolver;
        this.whitelist = context.configuration().whitelist();
        this.reservedCapability = context.configuration().reservedCapability();
    }

    public SourceModule discover(Path template) {
        var root = load(ModuleResolver.rootKey(template), true);
        if (context.typeHintReplaced()) {
            context.capabilityImports().addFrom("typing", List.of(new Stmt.Alias(TypeHintSanitizer.PLACEHOLDER, null)));
        }
        LOG.debug("Discovered {} module(s) from {}", context.modules().size(), root.key().fileName());
        return root;
    }

    private SourceModule load(ModuleKey key, boolean isRoot) {
        LOG.debug("Visiting module {} ({})", key.name(), key.path());
        var content = read(key.path());
        var parsed = SourceParser.parseModule(key.path().toString(), content);
        var sanitizer = new TypeHintSanitizer(context.configuration().vaultTypeNames());
        var sanitized = sanitizer.rewriteBody(parsed);
        if (sanitizer.replaced()) {
            context.markTypeHintReplaced();
        }
        var module = new SourceModule(key, content, new ImportStripper().rewriteBody(sanitized), isRoot);
        context.register(module);
        if (isRoot) {
            ApiVersionCheck.verify(module, context.configuration().supportedApiMajorVersion());
        }
        for (var statement : importsIn(sanitized)) {
            if (statement instanceof Stmt.Import imp) {
                handleImport(module, imp);
            } else if (statement instanceof Stmt.ImportFrom imp) {
                handleImportFrom(module, imp);
            }
        }
        if (!isRoot) {
            recordDefinitions(module);
        }
        return module;
    }

    private void handleImport(SourceModule module, Stmt.Import statement) {
        for (var alias : statement.names()) {
            var name = alias.name();
            if (name.equals(reservedCapability)) {
                throw violation(ErrorKind.DISALLOWED_IMPORT, name + " cannot be imported directly:", module, statement);
            }
            if (whitelist.contains(name)) {
                if (whitelist.requiresDirectImport(name) && alias.asName() != null) {
                    throw violation(
                        ErrorKind.DISALLOWED_IMPORT,
                        "module '" + name + "' must be imported directly and must not be aliased:",
                        module,
                        statement
                    );
                }
                context.capabilityImports().addImport(alias);
                continue;
            }
            if (alias.asName() == null) {
                throw violation(
                    ErrorKind.MISSING_ALIAS,
                    "Import statements must include an 'as' alias (e.g. \"import library.utils as utils\"):",
                    module,
                    statement
                );
            }
            var target = resolver.resolve(name).orElseThrow(() -> violation(
                ErrorKind.UNRESOLVABLE_MODULE,
                "import '" + name + "' (Line: " + statement.source().line() + " Col: " + statement.source().column()
                    + ") : " + name + " is not a whitelisted module.",
                module,
                statement
            ));
            if (isThirdParty(target.path())) {
                throw violation(
                    ErrorKind.DISALLOWED_IMPORT,
                    module.key().path() + " is attempting to import a third-party module: " + target.path(),
                    module,
                    statement
                );
            }
            context.addImport(module.key(), new ModuleImport(name, alias.asName(), target));
            if (!context.isVisited(target)) {
                load(target, false);
            }
        }
    }

    private void handleImportFrom(SourceModule module, Stmt.ImportFrom statement) {
        var name = statement.module();
        if (statement.level() > 0) {
            throw violation(
                ErrorKind.DISALLOWED_IMPORT,
                "Relative imports are not supported. Use `import <x.y> as y` syntax instead.",
                module,
                statement
            );
        }
        var ignored = context.configuration().ignoredImportPrefixes().stream().anyMatch(name::startsWith);
        if (ignored) {
            LOG.debug("Dropping development-only import from {} in {}", name, module.name());
            return;
        }
        if (!whitelist.contains(name)) {
            throw violation(
                ErrorKind.DISALLOWED_IMPORT,
                "`from <x> import <y>` syntax is only available for native python modules exposed by the "
                    + "Contracts API. `" + name + "` is not such a module. Use `import <x.y> as y` syntax instead.",
                module,
                statement
            );
        }
        var wildcard = statement.names().stream().anyMatch(alias -> alias.name().equals(Whitelist.ALL_SYMBOLS));
        if (name.equals(reservedCapability)) {
            if (wildcard) {
                throw violation(
                    ErrorKind.DISALLOWED_IMPORT,
                    "Importing '*' from module '" + name + "' is against best practices.",
                    module,
                    statement
                );
            }
        } else {
            if (whitelist.requiresDirectImport(name)) {
                throw violation(
                    ErrorKind.DISALLOWED_IMPORT,
                    "module '" + name + "' must be imported directly and must not be aliased:",
                    module,
                    statement
                );
            }
            for (var alias : statement.names()) {
                if (alias.name().equals(Whitelist.ALL_SYMBOLS)) {
                    throw violation(
                        ErrorKind.DISALLOWED_IMPORT,
                        "Importing * from module '" + name + "' is not allowed.",
                        module,
                        statement
                    );
                }
                if (!whitelist.allowsSymbol(name, alias.name())) {
                    throw violation(
                        ErrorKind.DISALLOWED_IMPORT,
                        "Importing " + alias.name() + " from module '" + name + "' is not allowed.",
                        module,
                        statement
                    );
                }
            }
        }
        context.capabilityImports().addFrom(name, statement.names());
    }

    private void recordDefinitions(SourceModule module) {
        var seen = new HashSet<String>();
        for (var statement : module.body()) {
            if (statement instanceof Stmt.FunctionDef def) {
                define(module, def.name(), statement, seen);
            } else if (statement instanceof Stmt.Assign assign) {
                for (var target : assign.targets()) {
                    define(module, targetName(module, target, statement), statement, seen);
                }
            } else if (statement instanceof Stmt.AnnAssign assign) {
                define(module, targetName(module, assign.target(), statement), statement, seen);
            } else {
                LOG.debug(
                    "Dropping top-level {} at line {} of {}",
                    statement.getClass().getSimpleName(),
                    statement.source().line(),
                    module.name()
                );
            }
        }
    }

    private void define(SourceModule module, String name, Stmt statement, HashSet<String> seen) {
        if (!seen.add(name)) {
            LOG.warn("Duplicate definition of {} in {} (line {}); keeping the first one", name, module.name(), statement.source().line());
            return;
        }
        context.addDefinition(new Definition(name, module.key(), statement));
    }

    private static String targetName(SourceModule module, Expr target, Stmt statement) {
        if (target instanceof Expr.Name name) {
            return name.id();
        }
        var kind = target.getClass().getSimpleName().replace("Expr", "");
        throw new RenderException(
            ErrorKind.UNSUPPORTED_TARGET,
            "Unable to assign to target of type " + kind + " in " + module.name() + " (Line: "
                + statement.source().line() + " Col: " + statement.source().column() + ")",
            module.name(),
            statement.source()
        );
    }

    private boolean isThirdParty(Path file) {
        var directory = file.getParent() == null ? "" : file.getParent().toString();
        return context.configuration().thirdPartyPathMarkers().stream().anyMatch(directory::contains);
    }

    private static RenderException violation(ErrorKind kind, String rule, SourceModule module, Stmt statement) {
        return RenderException.atStatement(kind, rule, module.name(), statement.source(), AstPrinter.print(statement));
    }

    private static String read(Path file) {
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read module " + file, ex);
        }
    }

    /** Import statements at any depth, in source order. */
    private static List<Stmt> importsIn(List<Stmt> body) {
        var found = new ArrayList<Stmt>();
        new AstRewriter() {
            @Override
            public Stmt rewrite(Stmt s) {
                if (s instanceof Stmt.Import || s instanceof Stmt.ImportFrom) {
                    found.add(s);
                    return s;
                }
                return super.rewrite(s);
            }
        }.rewriteBody(body);
        return found;
    }

    private static final class ImportStripper extends AstRewriter {
        @Override
        public List<Stmt> rewriteBody(List<Stmt> body) {
            var kept = body.stream().filter(s -> !(s instanceof Stmt.Import || s instanceof Stmt.ImportFrom)).toList();
            var rewritten = super.rewriteBody(kept);
            return kept.size() == body.size() && rewritten == kept ? body : rewritten;
        }
    }
}
