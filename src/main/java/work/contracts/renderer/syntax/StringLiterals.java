package work.contracts.renderer.syntax;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Decodes string tokens into {@link Expr.Constant} or {@link Expr.JoinedStr} nodes, handling
 * prefixes, escapes, implicit concatenation and f-string replacement fields.
 */
final class StringLiterals {

    private StringLiterals() {
    }

    private record Literal(String prefix, String body, Source source) {
        boolean raw() {
            return prefix.indexOf('r') >= 0;
        }

        boolean bytes() {
            return prefix.indexOf('b') >= 0;
        }

        boolean formatted() {
            return prefix.indexOf('f') >= 0;
        }
    }

    static Expr concatenate(List<Token> tokens, Source source) {
        var literals = new ArrayList<Literal>();
        for (var token : tokens) {
            literals.add(split(token));
        }
        var bytes = literals.get(0).bytes();
        var formatted = false;
        for (var literal : literals) {
            if (literal.bytes() != bytes) {
                throw Parser.syntaxError("cannot mix bytes and nonbytes literals", literal.source());
            }
            formatted |= literal.formatted();
        }
        var parts = new Parts();
        for (var literal : literals) {
            if (literal.formatted()) {
                parseFormatted(literal.body(), literal.raw(), literal.source(), parts);
            } else {
                parts.literal.append(decode(literal.body(), literal.raw(), bytes, literal.source()));
            }
        }
        if (!formatted) {
            return new Expr.Constant(
                bytes ? Expr.ConstantKind.BYTES : Expr.ConstantKind.STRING,
                parts.literal.toString(),
                source
            );
        }
        return parts.toJoinedStr(source);
    }

    private static Literal split(Token token) {
        var text = token.content;
        var quoteIndex = 0;
        while (text.charAt(quoteIndex) != '"' && text.charAt(quoteIndex) != '\'') {
            quoteIndex++;
        }
        var prefix = text.substring(0, quoteIndex).toLowerCase(Locale.ROOT);
        var quote = text.charAt(quoteIndex);
        var rest = text.substring(quoteIndex);
        var quoteLength = rest.length() >= 6 && rest.charAt(1) == quote && rest.charAt(2) == quote ? 3 : 1;
        var body = rest.substring(quoteLength, rest.length() - quoteLength);
        return new Literal(prefix, body, token.source);
    }

    private static final class Parts {
        final StringBuilder literal = new StringBuilder();
        final List<Expr> values = new ArrayList<>();

        void flush() {
            if (literal.length() > 0) {
                values.add(Expr.Constant.string(literal.toString()));
                literal.setLength(0);
            }
        }

        Expr.JoinedStr toJoinedStr(Source source) {
            flush();
            return new Expr.JoinedStr(List.copyOf(values), source);
        }
    }

    private static void parseFormatted(String body, boolean raw, Source source, Parts parts) {
        var i = 0;
        while (i < body.length()) {
            var c = body.charAt(i);
            if (c == '{') {
                if (i + 1 < body.length() && body.charAt(i + 1) == '{') {
                    parts.literal.append('{');
                    i += 2;
                    continue;
                }
                i = parseField(body, i + 1, raw, source, parts);
                continue;
            }
            if (c == '}') {
                if (i + 1 < body.length() && body.charAt(i + 1) == '}') {
                    parts.literal.append('}');
                    i += 2;
                    continue;
                }
                throw Parser.syntaxError("f-string: single '}' is not allowed", source);
            }
            var end = i;
            while (end < body.length() && body.charAt(end) != '{' && body.charAt(end) != '}') {
                if (!raw && body.charAt(end) == '\\' && end + 2 < body.length()
                    && body.charAt(end + 1) == 'N' && body.charAt(end + 2) == '{') {
                    var close = body.indexOf('}', end);
                    end = close < 0 ? body.length() : close + 1;
                    continue;
                }
                end++;
            }
            parts.literal.append(decode(body.substring(i, end), raw, false, source));
            i = end;
        }
    }

    /** Parses one replacement field starting after its '{'; returns the index after its '}'. */
    private static int parseField(String body, int start, boolean raw, Source source, Parts parts) {
        var depth = 0;
        var i = start;
        char quote = 0;
        while (i < body.length()) {
            var c = body.charAt(i);
            if (quote != 0) {
                if (c == quote) {
                    quote = 0;
                }
            } else if (c == '\'' || c == '"') {
                quote = c;
            } else if (c == '(' || c == '[' || c == '{') {
                depth++;
            } else if (c == ')' || c == ']' || (c == '}' && depth > 0)) {
                depth--;
            } else if (depth == 0 && (c == '}' || c == ':'
                || (c == '!' && (i + 1 >= body.length() || body.charAt(i + 1) != '=')))) {
                break;
            }
            i++;
        }
        if (i >= body.length()) {
            throw Parser.syntaxError("f-string: expecting '}'", source);
        }
        var expressionText = body.substring(start, i);
        char conversion = 0;
        var trimmed = expressionText.stripTrailing();
        if (trimmed.endsWith("=") && !trimmed.endsWith("==") && !trimmed.endsWith("!=")
            && !trimmed.endsWith("<=") && !trimmed.endsWith(">=")) {
            parts.literal.append(expressionText);
            expressionText = trimmed.substring(0, trimmed.length() - 1);
            conversion = 'r';
        }
        if (expressionText.isBlank()) {
            throw Parser.syntaxError("f-string: empty expression not allowed", source);
        }
        var value = SourceParser.parseFieldExpression(source.file(), expressionText, source);
        if (body.charAt(i) == '!') {
            if (i + 1 >= body.length() || "sra".indexOf(body.charAt(i + 1)) < 0) {
                throw Parser.syntaxError("f-string: invalid conversion character", source);
            }
            conversion = body.charAt(i + 1);
            i += 2;
        }
        Expr.JoinedStr formatSpec = null;
        if (i < body.length() && body.charAt(i) == ':') {
            var specStart = i + 1;
            var nested = 0;
            i = specStart;
            while (i < body.length() && (body.charAt(i) != '}' || nested > 0)) {
                if (body.charAt(i) == '{') {
                    nested++;
                } else if (body.charAt(i) == '}') {
                    nested--;
                }
                i++;
            }
            var specParts = new Parts();
            parseFormatted(body.substring(specStart, i), raw, source, specParts);
            formatSpec = specParts.toJoinedStr(source);
        }
        if (i >= body.length() || body.charAt(i) != '}') {
            throw Parser.syntaxError("f-string: expecting '}'", source);
        }
        parts.flush();
        parts.values.add(new Expr.FormattedValue(value, conversion, formatSpec, source));
        return i + 1;
    }

    static String decode(String body, boolean raw, boolean bytes, Source source) {
        if (raw || body.indexOf('\\') < 0) {
            return body;
        }
        var out = new StringBuilder(body.length());
        var i = 0;
        while (i < body.length()) {
            var c = body.charAt(i);
            if (c != '\\' || i + 1 >= body.length()) {
                out.append(c);
                i++;
                continue;
            }
            var next = body.charAt(i + 1);
            i += 2;
            switch (next) {
                case '\n' -> {
                }
                case '\r' -> {
                    if (i < body.length() && body.charAt(i) == '\n') {
                        i++;
                    }
                }
                case '\\', '\'', '"' -> out.append(next);
                case 'a' -> out.append('\u0007');
                case 'b' -> out.append('\b');
                case 'f' -> out.append('\f');
                case 'n' -> out.append('\n');
                case 'r' -> out.append('\r');
                case 't' -> out.append('\t');
                case 'v' -> out.append('\u000b');
                case '0', '1', '2', '3', '4', '5', '6', '7' -> {
                    var end = i - 1;
                    while (end < body.length() && end < i + 2 && body.charAt(end) >= '0' && body.charAt(end) <= '7') {
                        end++;
                    }
                    out.append((char) Integer.parseInt(body.substring(i - 1, end), 8));
                    i = end;
                }
                case 'x' -> {
                    out.append((char) hex(body, i, 2, source));
                    i += 2;
                }
                case 'u' -> {
                    if (bytes) {
                        out.append('\\').append(next);
                    } else {
                        out.appendCodePoint(hex(body, i, 4, source));
                        i += 4;
                    }
                }
                case 'U' -> {
                    if (bytes) {
                        out.append('\\').append(next);
                    } else {
                        out.appendCodePoint(hex(body, i, 8, source));
                        i += 8;
                    }
                }
                case 'N' -> {
                    var close = body.indexOf('}', i);
                    if (bytes || i >= body.length() || body.charAt(i) != '{' || close < 0) {
                        if (bytes) {
                            out.append('\\').append(next);
                            break;
                        }
                        throw Parser.syntaxError("malformed \\N character escape", source);
                    }
                    try {
                        out.appendCodePoint(Character.codePointOf(body.substring(i + 1, close)));
                    } catch (IllegalArgumentException e) {
                        throw Parser.syntaxError("unknown Unicode character name", source);
                    }
                    i = close + 1;
                }
                default -> out.append('\\').append(next);
            }
        }
        return out.toString();
    }

    private static int hex(String body, int start, int digits, Source source) {
        if (start + digits > body.length()) {
            throw Parser.syntaxError("truncated \\x, \\u or \\U escape", source);
        }
        try {
            return Integer.parseInt(body.substring(start, start + digits), 16);
        } catch (NumberFormatException e) {
            throw Parser.syntaxError("invalid hexadecimal escape", source);
        }
    }
}
