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
 * Final layout pass over the rendered module. Module-level definitions are surrounded by two
 * blank lines and module-level code after an import block gets at least one. Other runs of blank
 * lines are capped at two at module level and one inside blocks. Trailing whitespace is removed
 * and the file ends with a single newline. The contents of multi-line strings are never touched.
 */
public final class OutputFormatter {
    private enum Kind { DEFINITION, DECORATOR, IMPORT, CODE, COMMENT, NESTED }

    private OutputFormatter() {
    }

    public static String format(String text) {
        var lexer = new Lexer("<rendered>", text);
        var tokens = lexer.tokenize();
        var topLevel = new HashMap<Integer, Kind>();
        var stringInterior = new HashSet<Integer>();
        scan(tokens, lexer, topLevel, stringInterior);

        var lines = text.split("\n", -1);
        var out = new ArrayList<String>();
        var pending = 0;
        var afterDefinition = false;
        var previous = Kind.CODE;
        for (var i = 0; i < lines.length; i++) {
            var number = i + 1;
            if (stringInterior.contains(number)) {
                out.add(lines[i]);
                continue;
            }
            var line = lines[i].stripTrailing();
            if (line.isEmpty()) {
                pending++;
                continue;
            }
            var kind = classify(number, line, topLevel);
            if (!out.isEmpty()) {
                var blanks = blankLinesBefore(kind, previous, pending, afterDefinition);
                for (var b = 0; b < blanks; b++) {
                    out.add("");
                }
            }
            out.add(line);
            pending = 0;
            if (kind == Kind.DEFINITION || kind == Kind.DECORATOR) {
                afterDefinition = true;
            } else if (kind != Kind.NESTED) {
                afterDefinition = false;
            }
            previous = kind;
        }
        if (out.isEmpty()) {
            return "";
        }
        return String.join("\n", out) + "\n";
    }

    private static int blankLinesBefore(Kind kind, Kind previous, int pending, boolean afterDefinition) {
        if (previous == Kind.DECORATOR) {
            return 0;
        }
        switch (kind) {
            case DEFINITION:
            case DECORATOR:
                if (previous == Kind.COMMENT && pending == 0) {
                    return 0;
                }
                return 2;
            case CODE:
                if (afterDefinition) {
                    return 2;
                }
                return previous == Kind.IMPORT ? Math.max(1, Math.min(pending, 2)) : Math.min(pending, 2);
            case IMPORT:
            case COMMENT:
                return afterDefinition ? 2 : Math.min(pending, 2);
            default:
                return Math.min(pending, 1);
        }
    }

    private static Kind classify(int number, String line, Map<Integer, Kind> topLevel) {
        var kind = topLevel.get(number);
        if (kind != null) {
            return kind;
        }
        return line.startsWith("#") ? Kind.COMMENT : Kind.NESTED;
    }

    private static void scan(
        List<Token> tokens,
        Lexer lexer,
        Map<Integer, Kind> topLevel,
        Set<Integer> stringInterior
    ) {
        var depth = 0;
        var statementStart = true;
        for (var token : tokens) {
            switch (token.type) {
                case INDENT:
                    depth++;
                    statementStart = true;
                    continue;
                case DEDENT:
                    depth--;
                    statementStart = true;
                    continue;
                case NEWLINE:
                    statementStart = true;
                    continue;
                case NL:
                case COMMENT:
                case ENDMARKER:
                    continue;
                default:
                    break;
            }
            if (token.type == Token.Type.STRING) {
                var last = lexer.lineOf(Math.max(token.source.startOffset(), token.source.endOffset() - 1));
                for (var line = token.source.line() + 1; line <= last; line++) {
                    stringInterior.add(line);
                }
            }
            if (statementStart && depth == 0) {
                topLevel.put(token.source.line(), kindOf(token));
            }
            statementStart = false;
        }
    }

    private static Kind kindOf(Token token) {
        if (token.isOp("@")) {
            return Kind.DECORATOR;
        }
        if (token.isKeyword("def") || token.isKeyword("class") || token.isKeyword("async")) {
            return Kind.DEFINITION;
        }
        if (token.isKeyword("import") || token.isKeyword("from")) {
            return Kind.IMPORT;
        }
        return Kind.CODE;
    }
}
