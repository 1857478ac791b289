package ai.mapper.model;

/**
 * How the target of an edge was settled.
 * <p>
 * Only {@link #RESOLVED} edges point at a real component; every other value goes with the
 * unresolved sentinel id.
 */
public enum Resolution {
    RESOLVED("resolved"),
    EXTERNAL("external"),
    BUILTIN("builtin"),
    DYNAMIC("dynamic"),
    UNKNOWN("unknown");

    private final String label;

    Resolution(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
