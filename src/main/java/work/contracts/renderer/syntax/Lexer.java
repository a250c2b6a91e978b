package work.contracts.renderer.syntax;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import work.contracts.renderer.api.ErrorKind;
import work.contracts.renderer.api.RenderException;

/**
 * Tokenizer for contract modules. Produces the same token stream shape as Python's own tokenizer
 * (logical NEWLINE vs. non-logical NL, INDENT/DEDENT, COMMENT) so that both the parser and the
 * output post-processor can work from it.
 */
public final class Lexer {
    private static final Set<String> STRING_PREFIXES = Set.of(
        "r", "u", "b", "f", "br", "rb", "fr", "rf"
    );

    private static final List<String> OPERATORS = List.of(
        "**=", "//=", ">>=", "<<=", "...",
        "**", "//", ">>", "<<", "<=", ">=", "==", "!=", "->", ":=",
        "+=", "-=", "*=", "/=", "%=", "&=", "|=", "^=", "@=",
        "(", ")", "[", "]", "{", "}", ",", ":", ".", ";", "@", "=",
        "+", "-", "*", "/", "%", "&", "|", "^", "~", "<", ">"
    );

    private static final int TAB_SIZE = 8;

    private final String fileName;
    private final String content;
    private final int[] lineStarts;

    private int currentPos = 0;
    private final Deque<Integer> openBrackets = new ArrayDeque<>();
    private boolean atLineStart = true;
    private final Deque<Integer> indents = new ArrayDeque<>();
    private final List<Token> tokens = new ArrayList<>();

    public Lexer(String fileName, String content) {
        this.fileName = fileName;
        this.content = content;
        this.lineStarts = computeLineStarts(content);
        indents.push(0);
    }

    public static boolean isIdentifierStart(char c) {
        return c == '_' || Character.isLetter(c);
    }

    public static boolean isIdentifierPart(char c) {
        return c == '_' || Character.isLetterOrDigit(c);
    }

    /**
     * Tokenizes the whole file. The last token is always {@link Token.Type#ENDMARKER}.
     */
    public List<Token> tokenize() {
        if (!tokens.isEmpty()) {
            return tokens;
        }
        while (!atEnd()) {
            if (atLineStart && openBrackets.isEmpty()) {
                readIndentation();
                if (atEnd()) {
                    break;
                }
                if (atLineStart) {
                    continue;
                }
            }
            var c = current();
            if (c == ' ' || c == '\t' || c == '\f') {
                currentPos++;
                continue;
            }
            if (c == '\\' && isNewlineAt(currentPos + 1)) {
                currentPos++;
                skipNewline();
                continue;
            }
            if (c == '#') {
                var end = findLineEnd(currentPos);
                add(Token.Type.COMMENT, currentPos, end);
                currentPos = end;
                continue;
            }
            if (c == '\n' || c == '\r') {
                var start = currentPos;
                skipNewline();
                var logical = openBrackets.isEmpty() && hasLogicalContent();
                add(logical ? Token.Type.NEWLINE : Token.Type.NL, start, currentPos);
                if (openBrackets.isEmpty()) {
                    atLineStart = true;
                }
                continue;
            }
            if (isIdentifierStart(c)) {
                readNameOrString();
                continue;
            }
            if (isDigit(c) || (c == '.' && isDigit(peek()))) {
                readNumber();
                continue;
            }
            if (c == '"' || c == '\'') {
                readString(currentPos);
                continue;
            }
            readOperator();
        }
        finish();
        return tokens;
    }

    /**
     * 1-based line number of a character offset.
     */
    public int lineOf(int offset) {
        var low = 0;
        var high = lineStarts.length - 1;
        while (low < high) {
            var mid = (low + high + 1) >>> 1;
            if (lineStarts[mid] <= offset) {
                low = mid;
            } else {
                high = mid - 1;
            }
        }
        return low + 1;
    }

    private void readIndentation() {
        var width = 0;
        var pos = currentPos;
        while (pos < content.length()) {
            var c = content.charAt(pos);
            if (c == ' ') {
                width++;
            } else if (c == '\t') {
                width = (width / TAB_SIZE + 1) * TAB_SIZE;
            } else if (c == '\f') {
                width = 0;
            } else {
                break;
            }
            pos++;
        }
        currentPos = pos;
        atLineStart = false;
        if (atEnd() || current() == '#' || current() == '\n' || current() == '\r') {
            // blank and comment-only lines never change the indentation level
            if (!atEnd() && current() == '#') {
                var end = findLineEnd(currentPos);
                add(Token.Type.COMMENT, currentPos, end);
                currentPos = end;
            }
            if (!atEnd()) {
                var start = currentPos;
                skipNewline();
                add(Token.Type.NL, start, currentPos);
                atLineStart = true;
            }
            return;
        }
        if (width > indents.peek()) {
            indents.push(width);
            add(Token.Type.INDENT, lineStartOf(currentPos), currentPos);
            return;
        }
        while (width < indents.peek()) {
            indents.pop();
            add(Token.Type.DEDENT, currentPos, currentPos);
        }
        if (width != indents.peek()) {
            throw error("unindent does not match any outer indentation level", currentPos);
        }
    }

    private void readNameOrString() {
        var start = currentPos;
        var end = currentPos;
        while (end < content.length() && isIdentifierPart(content.charAt(end))) {
            end++;
        }
        var word = content.substring(start, end);
        if (end < content.length()
            && (content.charAt(end) == '"' || content.charAt(end) == '\'')
            && STRING_PREFIXES.contains(word.toLowerCase(Locale.ROOT))) {
            currentPos = end;
            readString(start);
            return;
        }
        currentPos = end;
        add(Token.Type.NAME, start, end);
    }

    private void readString(int start) {
        var quote = current();
        var triple = currentPos + 2 < content.length()
            && content.charAt(currentPos + 1) == quote
            && content.charAt(currentPos + 2) == quote;
        currentPos += triple ? 3 : 1;
        while (true) {
            if (atEnd()) {
                throw error(triple ? "unterminated triple-quoted string literal" : "unterminated string literal", start);
            }
            var c = current();
            if (c == '\\') {
                currentPos += 2;
                continue;
            }
            if (!triple && (c == '\n' || c == '\r')) {
                throw error("unterminated string literal", start);
            }
            if (c == quote) {
                if (!triple) {
                    currentPos++;
                    break;
                }
                if (currentPos + 2 < content.length()
                    && content.charAt(currentPos + 1) == quote
                    && content.charAt(currentPos + 2) == quote) {
                    currentPos += 3;
                    break;
                }
            }
            currentPos++;
        }
        add(Token.Type.STRING, start, currentPos);
    }

    private void readNumber() {
        var start = currentPos;
        if (current() == '0' && "xXoObB".indexOf(peek()) >= 0) {
            currentPos += 2;
            while (!atEnd() && (Character.isLetterOrDigit(current()) || current() == '_')) {
                currentPos++;
            }
            add(Token.Type.NUMBER, start, currentPos);
            return;
        }
        readDigits();
        if (!atEnd() && current() == '.') {
            currentPos++;
            readDigits();
        }
        if (!atEnd() && (current() == 'e' || current() == 'E')) {
            var next = peek();
            if (isDigit(next) || ((next == '+' || next == '-') && currentPos + 2 < content.length()
                && isDigit(content.charAt(currentPos + 2)))) {
                currentPos += (next == '+' || next == '-') ? 2 : 1;
                readDigits();
            }
        }
        if (!atEnd() && (current() == 'j' || current() == 'J')) {
            currentPos++;
        }
        if (!atEnd() && isIdentifierStart(current())) {
            throw error("invalid decimal literal", start);
        }
        add(Token.Type.NUMBER, start, currentPos);
    }

    private void readDigits() {
        while (!atEnd() && (isDigit(current()) || current() == '_')) {
            currentPos++;
        }
    }

    private void readOperator() {
        for (var op : OPERATORS) {
            if (content.startsWith(op, currentPos)) {
                var start = currentPos;
                currentPos += op.length();
                switch (op) {
                    case "(", "[", "{" -> openBrackets.push(start);
                    case ")", "]", "}" -> {
                        if (openBrackets.isEmpty()) {
                            throw error("unmatched '" + op + "'", start);
                        }
                        openBrackets.pop();
                    }
                    default -> {
                    }
                }
                add(Token.Type.OP, start, currentPos);
                return;
            }
        }
        throw error("invalid character '" + current() + "'", currentPos);
    }

    private void finish() {
        if (!openBrackets.isEmpty()) {
            var open = openBrackets.peekLast();
            throw error("'" + content.charAt(open) + "' was never closed", open);
        }
        if (hasLogicalContent()) {
            add(Token.Type.NEWLINE, content.length(), content.length());
        }
        while (indents.peek() > 0) {
            indents.pop();
            add(Token.Type.DEDENT, content.length(), content.length());
        }
        add(Token.Type.ENDMARKER, content.length(), content.length());
    }

    private boolean hasLogicalContent() {
        for (var i = tokens.size() - 1; i >= 0; i--) {
            var type = tokens.get(i).type;
            if (type == Token.Type.NEWLINE || type == Token.Type.INDENT || type == Token.Type.DEDENT) {
                return false;
            }
            if (type == Token.Type.NL) {
                return false;
            }
            if (type != Token.Type.COMMENT) {
                return true;
            }
        }
        return false;
    }

    private void add(Token.Type type, int start, int end) {
        var line = lineOf(start);
        var column = start - lineStarts[line - 1];
        tokens.add(new Token(type, content.substring(start, end), new Source(fileName, start, end, line, column)));
    }

    private RenderException error(String message, int offset) {
        var line = lineOf(Math.min(offset, content.length()));
        var column = Math.min(offset, content.length()) - lineStarts[line - 1];
        var source = new Source(fileName, offset, offset, line, column);
        return new RenderException(
            ErrorKind.SYNTAX,
            message + " (" + source.display() + ")",
            null,
            source
        );
    }

    private int lineStartOf(int offset) {
        return lineStarts[lineOf(offset) - 1];
    }

    private int findLineEnd(int from) {
        var pos = from;
        while (pos < content.length() && content.charAt(pos) != '\n' && content.charAt(pos) != '\r') {
            pos++;
        }
        return pos;
    }

    private boolean isNewlineAt(int pos) {
        return pos < content.length() && (content.charAt(pos) == '\n' || content.charAt(pos) == '\r');
    }

    private void skipNewline() {
        if (current() == '\r' && peek() == '\n') {
            currentPos += 2;
        } else {
            currentPos++;
        }
    }

    private char current() {
        return atEnd() ? '\0' : content.charAt(currentPos);
    }

    private char peek() {
        return currentPos + 1 >= content.length() ? '\0' : content.charAt(currentPos + 1);
    }

    private boolean atEnd() {
        return currentPos >= content.length();
    }

    private static boolean isDigit(char c) {
        return '0' <= c && c <= '9';
    }

    private static int[] computeLineStarts(String content) {
        var starts = new ArrayList<Integer>();
        starts.add(0);
        for (var i = 0; i < content.length(); i++) {
            var c = content.charAt(i);
            if (c == '\n') {
                starts.add(i + 1);
            } else if (c == '\r' && (i + 1 >= content.length() || content.charAt(i + 1) != '\n')) {
                starts.add(i + 1);
            }
        }
        return starts.stream().mapToInt(Integer::intValue).toArray();
    }
}
