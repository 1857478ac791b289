package ai.mapper.model;

/**
 * Inclusive 1-based line range.
 */
public record SourceSpan(int startLine, int endLine) {

    private static final SourceSpan SYNTHETIC = new SourceSpan(1, 1);

    public SourceSpan {
        if (startLine < 1 || endLine < startLine) {
            throw new IllegalArgumentException("bad span: " + startLine + "-" + endLine);
        }
    }

    /** Span for nodes without one of their own (packages, file roots). */
    public static SourceSpan synthetic() {
        return SYNTHETIC;
    }

    public static SourceSpan line(int line) {
        return new SourceSpan(line, line);
    }

    @Override
    public String toString() {
        return startLine + "-" + endLine;
    }
}
