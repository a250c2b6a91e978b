package work.contracts.renderer.link;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Identity of a module in the import graph: its dotted name and the canonical path of its file.
 * Two imports that reach the same file under the same name denote the same module.
 */
public record ModuleKey(String name, Path path) implements Comparable<ModuleKey> {
    public ModuleKey {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(path, "path");
    }

    public String lastSegment() {
        var dot = name.lastIndexOf('.');
        return dot < 0 ? name : name.substring(dot + 1);
    }

    public String fileName() {
        return path.getFileName().toString();
    }

    @Override
    public int compareTo(ModuleKey other) {
        var byName = name.compareTo(other.name);
        return byName != 0 ? byName : path.compareTo(other.path);
    }

    @Override
    public String toString() {
        return name;
    }
}
