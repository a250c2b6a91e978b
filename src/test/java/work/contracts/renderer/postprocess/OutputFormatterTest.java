package work.contracts.renderer.postprocess;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static work.contracts.renderer.support.RenderFixtures.lines;

import org.junit.jupiter.api.Test;

class OutputFormatterTest {

    @Test
    void separatesModuleLevelDefinitionsAndCapsBlankRuns() {
        var input = lines(
            "import a",
            "x = 1",
            "def f():",
            "    a = 1",
            "",
            "",
            "",
            "    return a",
            "y = 2",
            "",
            "",
            "",
            "",
            "z = 3   "
        );

        assertEquals(
            lines("import a", "", "x = 1", "", "", "def f():", "    a = 1", "", "    return a", "", "", "y = 2", "", "", "z = 3"),
            OutputFormatter.format(input)
        );
    }

    @Test
    void keepsDecoratorsAndLeadingCommentsAttached() {
        var input = lines("# note", "def f():", "    pass", "@dec", "", "def g():", "    pass");

        assertEquals(
            lines("# note", "def f():", "    pass", "", "", "@dec", "def g():", "    pass"),
            OutputFormatter.format(input)
        );
    }

    @Test
    void separatesImportBlocksFromModuleCode() {
        var input = lines("# header", "", "from contracts_api import Posting", "import math", "api = \"4.0.0\"", "version = \"1.0.0\"");

        assertEquals(
            lines("# header", "", "from contracts_api import Posting", "import math", "", "api = \"4.0.0\"", "version = \"1.0.0\""),
            OutputFormatter.format(input)
        );
    }

    @Test
    void neverTouchesMultiLineStrings() {
        var input = lines("x = \"\"\"", "  a   ", "", "", "", "  b", "\"\"\"");

        assertEquals(input, OutputFormatter.format(input));
    }

    @Test
    void endsWithExactlyOneNewline() {
        assertEquals("x = 1\n", OutputFormatter.format("x = 1\n\n\n"));
        assertEquals("x = 1\n", OutputFormatter.format("x = 1"));
        assertEquals("", OutputFormatter.format("\n\n"));
    }
}
