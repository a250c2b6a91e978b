package work.contracts.renderer.api;

/**
 * Rule families a render can violate. Every kind aborts the render; the category only groups
 * them for reporting.
 */
public enum ErrorKind {
    DISALLOWED_IMPORT(Category.CONFIGURATION),
    MISSING_ALIAS(Category.STRUCTURAL),
    AMBIGUOUS_ALIAS(Category.STRUCTURAL),
    UNSUPPORTED_TARGET(Category.STRUCTURAL),
    UNRESOLVED_SYMBOL(Category.STRUCTURAL),
    NAME_COLLISION(Category.STRUCTURAL),
    CYCLIC_IMPORT(Category.STRUCTURAL),
    NON_LITERAL_ARGUMENT(Category.STRUCTURAL),
    SYNTAX(Category.STRUCTURAL),
    UNRESOLVABLE_MODULE(Category.CONFIGURATION),
    VERSION_UNSUPPORTED(Category.VERSION),
    PROVENANCE_MISMATCH(Category.PROVENANCE);

    public enum Category {
        CONFIGURATION,
        STRUCTURAL,
        VERSION,
        PROVENANCE
    }

    private final Category category;

    ErrorKind(Category category) {
        this.category = category;
    }

    public Category category() {
        return category;
    }

    public String code() {
        return name().toLowerCase().replace('_', '-');
    }
}
