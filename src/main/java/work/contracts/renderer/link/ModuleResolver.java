package work.contracts.renderer.link;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Maps dotted module names onto files below the configured source roots, trying
 * {@code a/b/c.py} before {@code a/b/c/__init__.py} in each root.
 */
public final class ModuleResolver {
    private final List<Path> sourceRoots;

    public ModuleResolver(List<Path> sourceRoots) {
        this.sourceRoots = List.copyOf(sourceRoots);
    }

    public List<Path> sourceRoots() {
        return sourceRoots;
    }

    public Optional<ModuleKey> resolve(String moduleName) {
        if (moduleName.isBlank() || moduleName.startsWith(".") || moduleName.endsWith(".")) {
            return Optional.empty();
        }
        var relative = moduleName.replace('.', '/');
        for (var root : sourceRoots) {
            var file = root.resolve(relative + ".py");
            if (Files.isRegularFile(file)) {
                return Optional.of(new ModuleKey(moduleName, canonical(file)));
            }
            var pkg = root.resolve(relative).resolve("__init__.py");
            if (Files.isRegularFile(pkg)) {
                return Optional.of(new ModuleKey(moduleName, canonical(pkg)));
            }
        }
        return Optional.empty();
    }

    /** Key of the template itself, named after its file stem. */
    public static ModuleKey rootKey(Path template) {
        var fileName = template.getFileName().toString();
        var dot = fileName.lastIndexOf('.');
        var stem = dot > 0 ? fileName.substring(0, dot) : fileName;
        return new ModuleKey(stem, canonical(template));
    }

    static Path canonical(Path file) {
        try {
            return file.toRealPath();
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to resolve " + file, ex);
        }
    }
}
