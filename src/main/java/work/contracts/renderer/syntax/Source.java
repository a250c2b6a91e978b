package work.contracts.renderer.syntax;

/**
 * Location of a token or node inside a module file. Lines and columns are 1-based and 0-based
 * respectively, matching what Python tooling reports.
 */
public record Source(String file, int startOffset, int endOffset, int line, int column) {
    public static final Source NONE = new Source("<generated>", 0, 0, 0, 0);

    public boolean isGenerated() {
        return this == NONE || line == 0;
    }

    public String display() {
        if (isGenerated()) {
            return file;
        }
        return file + ":" + line + ":" + column;
    }
}
