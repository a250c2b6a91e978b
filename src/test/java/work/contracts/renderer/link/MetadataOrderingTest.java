package work.contracts.renderer.link;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.contracts.renderer.support.RenderFixtures.lines;

import java.util.List;
import org.junit.jupiter.api.Test;
import work.contracts.renderer.syntax.AstPrinter;
import work.contracts.renderer.syntax.SourceParser;
import work.contracts.renderer.syntax.Stmt;

class MetadataOrderingTest {
    private static final List<String> ORDER = List.of("contracts_api", "api", "version", "display_name", "pre_posting_hook");

    @Test
    void movesNamedStatementsToTheFrontInOrder() {
        var statements = SourceParser.parseModule("c.py", lines(
            "X = compute()",
            "def pre_posting_hook(vault, hook_arguments):",
            "    return None",
            "version = \"1.0.0\"",
            "api = \"4.0.0\"",
            "display_name = \"Loan\"",
            "\"continued\"",
            "from contracts_api import Rejection"
        ));

        var result = MetadataOrdering.reorder(statements, ORDER);

        assertTrue(result.changed());
        assertEquals(
            List.of(
                "from contracts_api import Rejection",
                "api = \"4.0.0\"",
                "version = \"1.0.0\"",
                "display_name = \"Loan\"",
                "\"continued\"",
                "def pre_posting_hook(vault, hook_arguments):",
                "X = compute()"
            ),
            firstLines(result.statements())
        );
    }

    @Test
    void keepsUnknownStatementsInTheirOriginalOrder() {
        var statements = SourceParser.parseModule("c.py", lines("b = 2", "a = 1", "c = 3"));

        var result = MetadataOrdering.reorder(statements, ORDER);

        assertFalse(result.changed());
        assertEquals(List.of("b = 2", "a = 1", "c = 3"), firstLines(result.statements()));
    }

    @Test
    void groupsLiteralAssignmentsWithFollowingStrings() {
        var statements = SourceParser.parseModule("c.py", lines("summary = \"a\"", "\"b\"", "\"c\"", "x = f()", "\"d\""));

        var groups = MetadataOrdering.group(statements);

        assertEquals(3, groups.size());
        assertEquals(3, groups.get(0).size());
        assertEquals(1, groups.get(1).size());
    }

    private static List<String> firstLines(List<Stmt> statements) {
        return statements.stream().map(statement -> AstPrinter.print(statement).lines().findFirst().orElse("")).toList();
    }
}
