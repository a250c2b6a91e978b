package work.contracts.renderer.postprocess;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import work.contracts.renderer.syntax.Lexer;
import work.contracts.renderer.syntax.Token;

/**
 * Turns header string statements back into comment lines. The printed module is re-tokenized;
 * a string statement that carries the header marker is replaced by its text, and each run of
 * header lines is separated from the surrounding code by exactly one blank line.
 */
public final class TokenPostProcessor {
    private final String marker;

    public TokenPostProcessor(String marker) {
        this.marker = marker;
    }

    public String process(String rendered) {
        var lexer = new Lexer("<rendered>", rendered);
        var tokens = lexer.tokenize();
        var lines = rendered.split("\n", -1);
        var headers = new HashMap<Integer, String>();
        var stringInterior = new HashSet<Integer>();
        scan(tokens, lexer, lines, headers, stringInterior);
        if (headers.isEmpty()) {
            return rendered;
        }

        var out = new ArrayList<String>();
        var inHeader = false;
        var lineCount = rendered.endsWith("\n") ? lines.length - 1 : lines.length;
        for (var i = 0; i < lineCount; i++) {
            var number = i + 1;
            var text = lines[i];
            if (headers.containsKey(number)) {
                if (!inHeader) {
                    dropTrailingBlanks(out);
                    if (!out.isEmpty()) {
                        out.add("");
                    }
                }
                out.add(headers.get(number));
                inHeader = true;
                continue;
            }
            if (text.isBlank() && !stringInterior.contains(number)) {
                if (!inHeader) {
                    out.add(text);
                }
                continue;
            }
            if (inHeader) {
                out.add("");
                inHeader = false;
            }
            out.add(text);
        }
        var result = String.join("\n", out);
        return rendered.endsWith("\n") ? result + "\n" : result;
    }

    private void scan(
        List<Token> tokens,
        Lexer lexer,
        String[] lines,
        Map<Integer, String> headers,
        Set<Integer> stringInterior
    ) {
        var statementStart = true;
        for (var i = 0; i < tokens.size(); i++) {
            var token = tokens.get(i);
            switch (token.type) {
                case NEWLINE, INDENT, DEDENT -> {
                    statementStart = true;
                    continue;
                }
                case NL, COMMENT -> {
                    continue;
                }
                default -> {
                }
            }
            if (token.type == Token.Type.STRING) {
                var first = token.source.line();
                var last = lexer.lineOf(Math.max(token.source.startOffset(), token.source.endOffset() - 1));
                for (var line = first + 1; line <= last; line++) {
                    stringInterior.add(line);
                }
                if (statementStart && first == last && token.content.contains(marker) && endsStatement(tokens, i)) {
                    var indent = lines[first - 1].substring(0, token.source.column());
                    headers.put(first, indent + stripHeader(token.content));
                }
            }
            statementStart = false;
        }
    }

    private static boolean endsStatement(List<Token> tokens, int index) {
        for (var i = index + 1; i < tokens.size(); i++) {
            var type = tokens.get(i).type;
            if (type == Token.Type.COMMENT) {
                continue;
            }
            return type == Token.Type.NEWLINE || type == Token.Type.ENDMARKER;
        }
        return true;
    }

    /** Removes the prefix, quotes and marker of a header literal. */
    String stripHeader(String literal) {
        var open = 0;
        while (open < literal.length() && literal.charAt(open) != '"' && literal.charAt(open) != '\'') {
            open++;
        }
        var body = literal.substring(Math.min(open + 1, literal.length()), Math.max(open + 1, literal.length() - 1));
        return body.replace(marker, "").replace("\\\"", "\"").replace("\\'", "'").replace("\\\\", "\\");
    }

    private static void dropTrailingBlanks(List<String> out) {
        while (!out.isEmpty() && out.get(out.size() - 1).isBlank()) {
            out.remove(out.size() - 1);
        }
    }
}
