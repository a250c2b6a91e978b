package work.contracts.renderer.link;

import java.util.Objects;

/**
 * Edge of the module graph: {@code import <name> as <alias>} resolved to {@code target}.
 */
public record ModuleImport(String name, String alias, ModuleKey target) {
    public ModuleImport {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(alias, "alias");
        Objects.requireNonNull(target, "target");
    }
}
