package work.contracts.renderer.link;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static work.contracts.renderer.support.RenderFixtures.lines;

import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;
import work.contracts.renderer.api.ErrorKind;
import work.contracts.renderer.api.RenderException;
import work.contracts.renderer.syntax.AstPrinter;
import work.contracts.renderer.syntax.SourceParser;
import work.contracts.renderer.syntax.Stmt;

class DecoratorConstantFolderTest {
    private static final String CONSTANTS = lines(
        "ACCRUAL = \"ACCRUAL_EVENT\"",
        "EVENT = ACCRUAL",
        "ALIAS = EVENT",
        "WINDOW = \"live\"",
        "BASE_FLAGS = [\"A\", \"B\"]",
        "MORE_FLAGS = BASE_FLAGS",
        "LIMIT = 5",
        "event_types = \"protected\""
    );

    @Test
    void foldsNameChainsAndListSpreads() {
        var folded = fold(CONSTANTS + lines(
            "@requires(event_type=ALIAS, flags=[*MORE_FLAGS, \"C\", EVENT], parameters=True)",
            "def scheduled_event_hook(vault, hook_arguments):",
            "    return None"
        ));

        assertEquals(
            "@requires(event_type=\"ACCRUAL_EVENT\", flags=[\"A\", \"B\", \"C\", \"ACCRUAL_EVENT\"], parameters=True)",
            decoratorOf(folded)
        );
    }

    @Test
    void foldsDictionaryKeysAndValues() {
        var folded = fold(CONSTANTS + lines(
            "@fetch_account_data(balances={WINDOW: [ACCRUAL]}, event_type=WINDOW)",
            "def scheduled_event_hook(vault, hook_arguments):",
            "    return None"
        ));

        assertEquals("@fetch_account_data(balances={\"live\": [\"ACCRUAL_EVENT\"]}, event_type=\"live\")", decoratorOf(folded));
    }

    @Test
    void leavesOtherDecoratorsAlone() {
        var folded = fold(CONSTANTS + lines(
            "@cache(key=ALIAS)",
            "def helper():",
            "    return None"
        ));

        assertEquals("@cache(key=ALIAS)", decoratorOf(folded));
    }

    @Test
    void rejectsValuesThatDoNotFoldToLiterals() {
        assertEquals(ErrorKind.NON_LITERAL_ARGUMENT, failure("@requires(event_type=compute())").kind());
        assertEquals(ErrorKind.NON_LITERAL_ARGUMENT, failure("@requires(event_type=LIMIT)").kind());
        assertEquals(ErrorKind.NON_LITERAL_ARGUMENT, failure("@requires(event_type=UNKNOWN)").kind());
    }

    @Test
    void neverFoldsProtectedMetadata() {
        assertEquals(ErrorKind.NON_LITERAL_ARGUMENT, failure("@requires(event_type=event_types)").kind());
    }

    private static RenderException failure(String decorator) {
        return assertThrows(RenderException.class, () -> fold(CONSTANTS + lines(
            decorator,
            "def scheduled_event_hook(vault, hook_arguments):",
            "    return None"
        )));
    }

    private static List<Stmt> fold(String source) {
        var folder = new DecoratorConstantFolder(Set.of("requires", "fetch_account_data"), Set.of("event_types"));
        return folder.fold(SourceParser.parseModule("c.py", source));
    }

    private static String decoratorOf(List<Stmt> module) {
        var def = module.get(module.size() - 1);
        return AstPrinter.print(def).lines().findFirst().orElseThrow();
    }
}
