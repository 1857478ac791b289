package ai.mapper.model;

/**
 * Kind of a node in the codebase hierarchy.
 */
public enum ComponentKind {
    PACKAGE("package"),
    MODULE("module"),
    CLASS("class"),
    FUNCTION("function"),
    METHOD("method"),
    ATTRIBUTE("attribute");

    private final String label;

    ComponentKind(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
