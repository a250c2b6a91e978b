package work.contracts.renderer.api;

import work.contracts.renderer.syntax.Source;

/**
 * Raised when the template graph cannot be rendered. Carries the violated rule, the offending
 * module and the position of the statement that triggered it.
 */
public final class RenderException extends RuntimeException {
    private final ErrorKind kind;
    private final String module;
    private final Source source;

    public RenderException(ErrorKind kind, String message) {
        this(kind, message, null, null, null);
    }

    public RenderException(ErrorKind kind, String message, String module, Source source) {
        this(kind, message, module, source, null);
    }

    public RenderException(ErrorKind kind, String message, String module, Source source, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.module = module;
        this.source = source;
    }

    /**
     * Builds the standard "rule / file / line / statement" message used for import violations.
     */
    public static RenderException atStatement(
        ErrorKind kind,
        String rule,
        String module,
        Source source,
        String statement
    ) {
        var message = new StringBuilder(rule);
        if (source != null && !source.isGenerated()) {
            message.append("\n   File \"").append(source.file()).append("\" line ").append(source.line()).append(':');
        }
        if (statement != null && !statement.isBlank()) {
            message.append("\n\t").append(statement.strip());
        }
        return new RenderException(kind, message.toString(), module, source);
    }

    public ErrorKind kind() {
        return kind;
    }

    public String module() {
        return module;
    }

    public Source source() {
        return source;
    }
}
