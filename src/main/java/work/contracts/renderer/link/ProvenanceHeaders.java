package work.contracts.renderer.link;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import work.contracts.renderer.api.RenderConfiguration;
import work.contracts.renderer.syntax.Expr;
import work.contracts.renderer.syntax.Source;
import work.contracts.renderer.syntax.Stmt;
import work.contracts.renderer.vcs.Checksums;
import work.contracts.renderer.vcs.GitProvenance;

/**
 * Builds the per-module header block: a title line, the module path and its checksum (plus the
 * git revision when enabled). Each line travels through the tree as a marker-prefixed string
 * statement until the post-processor turns it into a comment.
 */
public final class ProvenanceHeaders {
    private final RenderConfiguration configuration;
    private final Optional<GitProvenance> git;
    private final Map<ModuleKey, List<String>> cache = new HashMap<>();

    public ProvenanceHeaders(RenderConfiguration configuration, Optional<GitProvenance> git) {
        this.configuration = configuration;
        this.git = git;
    }

    public List<String> lines(SourceModule module) {
        return cache.computeIfAbsent(module.key(), key -> {
            var lines = new ArrayList<String>();
            lines.add("# " + configuration.headerPrefix() + ":");
            lines.add("#    " + displayPath(key.path()));
            var algorithm = configuration.hashingAlgorithm();
            var checksum = Checksums.hexDigest(algorithm, module.content());
            var hashes = "# " + algorithm + ":" + checksum;
            if (git.isPresent()) {
                hashes += " git:" + git.get().validatedCommit(key.path(), checksum, algorithm);
            }
            lines.add(hashes);
            return List.copyOf(lines);
        });
    }

    public List<Stmt> statements(SourceModule module) {
        var statements = new ArrayList<Stmt>();
        lines(module).forEach(line -> statements.add(header(line)));
        return statements;
    }

    public boolean isHeader(Stmt statement) {
        return statement instanceof Stmt.ExprStmt expression
            && expression.value() instanceof Expr.Constant constant
            && constant.isString()
            && constant.value().startsWith(configuration.headerMarker());
    }

    private Stmt header(String line) {
        return new Stmt.ExprStmt(Expr.Constant.string(configuration.headerMarker() + line), Source.NONE);
    }

    private String displayPath(Path file) {
        if (!configuration.useFullFilepathInHeaders()) {
            return file.getFileName().toString();
        }
        if (git.isPresent()) {
            return git.get().relativePath(file);
        }
        var cwd = Path.of("").toAbsolutePath().normalize();
        var absolute = file.toAbsolutePath().normalize();
        return absolute.startsWith(cwd) ? cwd.relativize(absolute).toString().replace('\\', '/') : absolute.toString();
    }
}
