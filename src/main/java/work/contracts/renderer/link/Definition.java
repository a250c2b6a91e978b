package work.contracts.renderer.link;

import java.util.Objects;
import work.contracts.renderer.syntax.Stmt;

/**
 * Top-level function or variable of a feature module. Equality is identity: two modules may
 * define the same local name, and after namespacing two definitions may even print alike.
 */
public final class Definition {
    private final String localName;
    private final ModuleKey module;
    private Stmt statement;
    private String namespacedName;

    public Definition(String localName, ModuleKey module, Stmt statement) {
        this.localName = Objects.requireNonNull(localName, "localName");
        this.module = Objects.requireNonNull(module, "module");
        this.statement = Objects.requireNonNull(statement, "statement");
        this.namespacedName = localName;
    }

    public String localName() {
        return localName;
    }

    public ModuleKey module() {
        return module;
    }

    public Stmt statement() {
        return statement;
    }

    void statement(Stmt statement) {
        this.statement = Objects.requireNonNull(statement, "statement");
    }

    public String namespacedName() {
        return namespacedName;
    }

    void namespacedName(String namespacedName) {
        this.namespacedName = Objects.requireNonNull(namespacedName, "namespacedName");
    }

    @Override
    public String toString() {
        return module.name() + "." + localName + " -> " + namespacedName;
    }
}
