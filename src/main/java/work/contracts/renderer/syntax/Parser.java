package work.contracts.renderer.syntax;

import java.util.List;
import java.util.Set;
import work.contracts.renderer.api.ErrorKind;
import work.contracts.renderer.api.RenderException;

/**
 * Token cursor shared by the parsers. Comments and non-logical newlines are skipped.
 */
public abstract class Parser {
    protected static final Set<String> KEYWORDS = Set.of(
        "False", "None", "True", "and", "as", "assert", "async", "await", "break", "class",
        "continue", "def", "del", "elif", "else", "except", "finally", "for", "from", "global",
        "if", "import", "in", "is", "lambda", "nonlocal", "not", "or", "pass", "raise", "return",
        "try", "while", "with", "yield"
    );

    private static final Set<Token.Type> FILTERED = Set.of(Token.Type.COMMENT, Token.Type.NL);
    private static final Set<Token.Type> LAYOUT = Set.of(Token.Type.NEWLINE, Token.Type.INDENT, Token.Type.DEDENT);

    private final List<Token> tokens;
    private int index = -1;
    protected Token current;
    /** Last consumed token that carries text; layout tokens are not tracked. */
    protected Token previous;

    protected Parser(List<Token> tokens) {
        this.tokens = tokens;
        next();
    }

    protected void next() {
        if (current != null && !LAYOUT.contains(current.type)) {
            previous = current;
        }
        do {
            index++;
        } while (index < tokens.size() - 1 && FILTERED.contains(tokens.get(index).type));
        current = tokens.get(Math.min(index, tokens.size() - 1));
    }

    protected Token peekToken() {
        var i = index + 1;
        while (i < tokens.size() - 1 && FILTERED.contains(tokens.get(i).type)) {
            i++;
        }
        return tokens.get(Math.min(i, tokens.size() - 1));
    }

    protected boolean atOp(String op) {
        return current.isOp(op);
    }

    protected boolean atKeyword(String keyword) {
        return current.isKeyword(keyword);
    }

    protected boolean atName() {
        return current.type == Token.Type.NAME && !KEYWORDS.contains(current.content);
    }

    protected boolean acceptOp(String op) {
        if (atOp(op)) {
            next();
            return true;
        }
        return false;
    }

    protected boolean acceptKeyword(String keyword) {
        if (atKeyword(keyword)) {
            next();
            return true;
        }
        return false;
    }

    protected Token expect(Token.Type type) {
        if (current.type != type) {
            throw unexpected(type.description);
        }
        var token = current;
        next();
        return token;
    }

    protected Token expectOp(String op) {
        if (!atOp(op)) {
            throw unexpected("'" + op + "'");
        }
        var token = current;
        next();
        return token;
    }

    protected Token expectKeyword(String keyword) {
        if (!atKeyword(keyword)) {
            throw unexpected("'" + keyword + "'");
        }
        var token = current;
        next();
        return token;
    }

    protected String expectName() {
        if (!atName()) {
            throw unexpected(Token.Type.NAME.description);
        }
        var name = current.content;
        next();
        return name;
    }

    /** Source spanning from {@code start} to the last consumed token. */
    protected Source span(Source start) {
        var end = previous == null ? start : previous.source;
        return new Source(start.file(), start.startOffset(), Math.max(start.endOffset(), end.endOffset()), start.line(), start.column());
    }

    protected RenderException unexpected(String expected) {
        var got = current.type == Token.Type.ENDMARKER
            ? "reached the end of the file"
            : "got '" + current.content.strip() + "' instead";
        return syntaxError("invalid syntax: expected " + expected + ", but " + got, current.source);
    }

    protected static RenderException syntaxError(String message, Source source) {
        return new RenderException(ErrorKind.SYNTAX, message + " (" + source.display() + ")", null, source);
    }
}
