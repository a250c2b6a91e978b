package work.contracts.renderer.syntax;

/**
 * Single lexical token. Keywords are reported as {@link Type#NAME} and told apart by the parser.
 */
public final class Token {

    public enum Type {
        NAME("an identifier"),
        NUMBER("a number"),
        STRING("a string"),
        OP("an operator"),
        NEWLINE("the end of the line"),
        NL("a blank line"),
        INDENT("an indented block"),
        DEDENT("the end of the block"),
        COMMENT("a comment"),
        ENDMARKER("the end of the file");

        public final String description;

        Type(String description) {
            this.description = description;
        }
    }

    public final Type type;
    public final String content;
    public final Source source;

    Token(Type type, String content, Source source) {
        this.type = type;
        this.content = content;
        this.source = source;
    }

    public boolean is(Type type, String content) {
        return this.type == type && this.content.equals(content);
    }

    public boolean isOp(String op) {
        return is(Type.OP, op);
    }

    public boolean isKeyword(String keyword) {
        return is(Type.NAME, keyword);
    }

    @Override
    public String toString() {
        return "[" + type + " - '" + content + "']";
    }
}
