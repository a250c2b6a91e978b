package work.contracts.renderer.link;

import java.util.List;
import java.util.Objects;
import work.contracts.renderer.syntax.Stmt;

/**
 * A parsed module. The body is replaced as the link stages rewrite it.
 */
public final class SourceModule {
    private final ModuleKey key;
    private final String content;
    private final boolean root;
    private List<Stmt> body;

    public SourceModule(ModuleKey key, String content, List<Stmt> body, boolean root) {
        this.key = Objects.requireNonNull(key, "key");
        this.content = Objects.requireNonNull(content, "content");
        this.body = List.copyOf(body);
        this.root = root;
    }

    public ModuleKey key() {
        return key;
    }

    public String name() {
        return key.name();
    }

    public String content() {
        return content;
    }

    public boolean isRoot() {
        return root;
    }

    public List<Stmt> body() {
        return body;
    }

    public void replaceBody(List<Stmt> body) {
        this.body = List.copyOf(body);
    }

    @Override
    public String toString() {
        return "SourceModule[" + key.name() + " @ " + key.path() + "]";
    }
}
