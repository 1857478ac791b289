package ai.mapper.model;

/**
 * Three-level rating used for crossroad criticality and critical-path complexity.
 */
public enum Criticality {
    HIGH("high"),
    MEDIUM("medium"),
    LOW("low");

    private final String label;

    Criticality(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
