package work.contracts.renderer.syntax;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;
import work.contracts.renderer.api.ErrorKind;
import work.contracts.renderer.api.RenderException;
import work.contracts.renderer.support.RenderFixtures;

class AstPrinterTest {
    private static final String CONTRACT = RenderFixtures.lines(
        "api = \"4.0.0\"",
        "display_name = 'Loan'",
        "",
        "",
        "@requires(parameters=True, flags=[*BASE_FLAGS, \"C\"])",
        "def pre_posting_hook(vault, hook_arguments: PrePostingHookArguments) -> Optional[Rejection]:",
        "    \"\"\"",
        "    Rejects postings above the limit.",
        "    \"\"\"",
        "    limit = vault.get_parameter_timeseries(name=\"limit\").latest()",
        "    total = sum(p.amount for p in hook_arguments.postings if p.amount > 0)",
        "    if total > limit and not hook_arguments.force:",
        "        return Rejection(message=f\"Limit {limit:.2f} exceeded by {total - limit!r}\")",
        "    elif total == 0:",
        "        pass",
        "    else:",
        "        values = {k: v for k, v in zip(KEYS, [1, 2]) if v}",
        "    try:",
        "        result = (lambda x, *, y=2: x ** -y)(total)",
        "    except (ValueError, KeyError) as error:",
        "        raise RuntimeError(\"bad\") from error",
        "    finally:",
        "        del values",
        "    return None",
        "",
        "",
        "class Holder:",
        "    value: int = 0",
        "",
        "    def get(self, /, default=None, **kwargs):",
        "        while self.value:",
        "            self.value -= 1",
        "        return self.value[1:-1:2], default"
    );

    @Test
    void roundTripsContractCode() {
        var first = AstPrinter.print(SourceParser.parseModule("c.py", CONTRACT));
        var second = AstPrinter.print(SourceParser.parseModule("c.py", first));
        assertEquals(first, second);
    }

    @Test
    void normalisesQuotesAndParentheses() {
        var printed = AstPrinter.print(SourceParser.parseModule("c.py", "x = 'hi'\ny = a + (b * c)\nz = (a + b) * c\n"));
        assertEquals("x = \"hi\"\ny = a + b * c\nz = (a + b) * c\n", printed);
    }

    @Test
    void separatesDefinitionsWithABlankLine() {
        var printed = AstPrinter.print(SourceParser.parseModule("c.py", "x = 1\ndef f():\n    return x\ny = 2\n"));
        assertEquals("x = 1\n\ndef f():\n    return x\n\ny = 2\n", printed);
    }

    @Test
    void printsDocstringsAsTripleQuotedStrings() {
        var printed = AstPrinter.print(SourceParser.parseModule("c.py", "def f():\n    \"\"\"\n    Doc.\n    \"\"\"\n    return 1\n"));
        assertTrue(printed.contains("    \"\"\"\n    Doc.\n    \"\"\"\n"), printed);
    }

    @Test
    void comparesStatementsIgnoringPositions() {
        var left = SourceParser.parseModule("a.py", "x = [1, 2]\n").get(0);
        var right = SourceParser.parseModule("b.py", "\n\nx = [1,\n     2]\n").get(0);
        assertTrue(AstPrinter.sameStructure(left, right));
    }

    @Test
    void reportsSyntaxErrorsWithPosition() {
        var error = assertThrows(RenderException.class, () -> SourceParser.parseModule("bad.py", "x = 1\ndef f(:\n    pass\n"));
        assertEquals(ErrorKind.SYNTAX, error.kind());
        assertEquals(2, error.source().line());
    }
}
