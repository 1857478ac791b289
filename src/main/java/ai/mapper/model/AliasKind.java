package ai.mapper.model;

/**
 * How a local name got bound by an import statement.
 */
public enum AliasKind {
    IMPORT("import"),
    IMPORT_AS("import-as"),
    RELATIVE_IMPORT("relative-import"),
    STAR_IMPORT("star-import");

    private final String label;

    AliasKind(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
