package work.contracts.renderer.postprocess;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static work.contracts.renderer.support.RenderFixtures.lines;

import org.junit.jupiter.api.Test;

class TokenPostProcessorTest {
    private final TokenPostProcessor processor = new TokenPostProcessor("<M>");

    @Test
    void turnsHeaderStringsIntoCommentBlocks() {
        var rendered = lines(
            "x = 1",
            "",
            "\"<M># Objects below have been imported from:\"",
            "\"<M>#    fees.py\"",
            "y = 2"
        );

        assertEquals(
            lines("x = 1", "", "# Objects below have been imported from:", "#    fees.py", "", "y = 2"),
            processor.process(rendered)
        );
    }

    @Test
    void startsTheFileWithoutALeadingBlankLine() {
        var rendered = lines("\"<M># header\"", "", "", "api = \"4.0.0\"");

        assertEquals(lines("# header", "", "api = \"4.0.0\""), processor.process(rendered));
    }

    @Test
    void keepsTheIndentationOfNestedHeaders() {
        var rendered = lines("def f():", "    \"<M># inner\"", "    return 1");

        assertEquals(lines("def f():", "", "    # inner", "", "    return 1"), processor.process(rendered));
    }

    @Test
    void unescapesQuotesInHeaderText() {
        assertEquals(lines("# it\"s"), processor.process(lines("\"<M># it\\\"s\"")));
    }

    @Test
    void leavesStringsThatAreNotHeaderStatementsAlone() {
        var rendered = lines(
            "x = \"<M>value\"",
            "call(\"<M>argument\")",
            "doc = \"\"\"<M>",
            "",
            "text\"\"\""
        );

        assertEquals(rendered, processor.process(rendered));
    }
}
