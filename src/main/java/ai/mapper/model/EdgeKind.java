package ai.mapper.model;

/**
 * Kind of an integration edge.
 */
public enum EdgeKind {
    IMPORT("import"),
    CALL("call"),
    ATTR_READ("attr_read"),
    ATTR_WRITE("attr_write"),
    INHERIT("inherit");

    private final String label;

    EdgeKind(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static EdgeKind fromLabel(String label) {
        for (EdgeKind kind : values()) {
            if (kind.label.equals(label)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("unknown edge kind: " + label);
    }
}
