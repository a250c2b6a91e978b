package work.contracts.renderer.link;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import work.contracts.renderer.syntax.AstPrinter;
import work.contracts.renderer.syntax.Stmt;

/**
 * Produces the single output module: surviving feature definitions grouped per module under a
 * provenance header, then the capability imports, then the template's own header and body.
 * Optionally moves metadata statements to the top afterwards.
 */
public final class TreeAssembler {
    private final LinkContext context;
    private final ProvenanceHeaders headers;
    private final List<Stmt> appended = new ArrayList<>();
    private final Set<String> printed = new HashSet<>();

    public TreeAssembler(LinkContext context, ProvenanceHeaders headers) {
        this.context = context;
        this.headers = headers;
    }

    public List<Stmt> assemble(List<Definition> kept) {
        ModuleKey current = null;
        for (var definition : kept) {
            if (!definition.module().equals(current)) {
                current = definition.module();
                var module = context.module(current).orElseThrow();
                appended.addAll(headers.statements(module));
            }
            appendUnique(definition.statement());
        }
        context.capabilityImports().statements().forEach(this::appendUnique);

        var root = context.root();
        var body = new ArrayList<>(appended);
        body.addAll(headers.statements(root));
        body.addAll(root.body());

        var configuration = context.configuration();
        if (!configuration.renderMetadataAtTopOfFile()) {
            return body;
        }
        var reordered = MetadataOrdering.reorder(body, configuration.metadataOrder());
        if (!reordered.changed()) {
            return body;
        }
        var result = new ArrayList<>(headers.statements(root));
        result.addAll(reordered.statements());
        while (!result.isEmpty() && headers.isHeader(result.get(result.size() - 1))) {
            result.remove(result.size() - 1);
        }
        return result;
    }

    /** Structurally equal statements are emitted once; header lines are not deduplicated. */
    private void appendUnique(Stmt statement) {
        if (printed.add(AstPrinter.print(statement))) {
            appended.add(statement);
        }
    }
}
