package work.contracts.renderer.syntax;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;
import work.contracts.renderer.api.ErrorKind;
import work.contracts.renderer.api.RenderException;

class LexerTest {
    @Test
    void separatesLogicalAndBlankLines() {
        var tokens = new Lexer("t.py", "x = 1\n\ny = 2\n").tokenize();
        assertEquals(
            List.of("NAME", "OP", "NUMBER", "NEWLINE", "NL", "NAME", "OP", "NUMBER", "NEWLINE", "ENDMARKER"),
            types(tokens)
        );
    }

    @Test
    void emitsIndentAndDedentAroundBlocks() {
        var tokens = new Lexer("t.py", "def f():\n    return 1\nx = f()\n").tokenize();
        var types = types(tokens);
        assertEquals("INDENT", types.get(types.indexOf("NEWLINE") + 1));
        assertEquals(1, types.stream().filter("DEDENT"::equals).count());
    }

    @Test
    void keepsIndentationAcrossBlankAndCommentLines() {
        var tokens = new Lexer("t.py", "def f():\n    x = 1\n\n    # note\n\n    y = 2\nz = 3\n").tokenize();
        var types = types(tokens);
        assertEquals(1, types.stream().filter("INDENT"::equals).count());
        assertEquals(1, types.stream().filter("DEDENT"::equals).count());
        var y = tokens.stream().filter(token -> token.is(Token.Type.NAME, "y")).findFirst().orElseThrow();
        assertEquals(6, y.source.line());
        assertEquals(4, y.source.column());
        assertEquals("DEDENT", types.get(indexOfName(tokens, "z") - 1));
    }

    @Test
    void reportsUnclosedBracketsWhereTheyOpen() {
        var error = assertThrows(RenderException.class, () -> new Lexer("t.py", "x = 1\ny = foo(1,\n    2\n").tokenize());
        assertEquals(ErrorKind.SYNTAX, error.kind());
        assertEquals(2, error.source().line());
        assertEquals(7, error.source().column());
    }

    @Test
    void joinsLinesInsideBrackets() {
        var tokens = new Lexer("t.py", "x = [\n    1,\n    2,\n]\n").tokenize();
        assertEquals(1, types(tokens).stream().filter("NEWLINE"::equals).count());
    }

    @Test
    void keepsCommentsAndStringPrefixes() {
        var tokens = new Lexer("t.py", "x = rb'\\d' # note\n").tokenize();
        var strings = tokens.stream().filter(token -> token.type == Token.Type.STRING).toList();
        assertEquals(1, strings.size());
        assertEquals("rb'\\d'", strings.get(0).content);
        var comment = tokens.stream().filter(token -> token.type == Token.Type.COMMENT).findFirst().orElseThrow();
        assertEquals("# note", comment.content);
    }

    @Test
    void tracksPositions() {
        var tokens = new Lexer("t.py", "a = 1\nbb = 2\n").tokenize();
        var bb = tokens.stream().filter(token -> token.is(Token.Type.NAME, "bb")).findFirst().orElseThrow();
        assertEquals(2, bb.source.line());
        assertEquals(0, bb.source.column());
    }

    @Test
    void rejectsUnterminatedStrings() {
        var error = assertThrows(RenderException.class, () -> new Lexer("t.py", "x = 'open\n").tokenize());
        assertEquals(ErrorKind.SYNTAX, error.kind());
    }

    private static int indexOfName(List<Token> tokens, String name) {
        for (var i = 0; i < tokens.size(); i++) {
            if (tokens.get(i).is(Token.Type.NAME, name)) {
                return i;
            }
        }
        return -1;
    }

    private static List<String> types(List<Token> tokens) {
        return tokens.stream().map(token -> token.type.name()).collect(Collectors.toList());
    }
}
