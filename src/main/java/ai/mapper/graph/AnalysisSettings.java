package ai.mapper.graph;

/**
 * Tunables of one analysis run.
 *
 * @param boundaryDepth number of leading FQN segments that make a crossroad boundary
 * @param topK          number of critical paths reported when no percentile is set
 * @param percentile    when set (0-100), report every callee whose caller count reaches this
 *                      percentile of all caller counts instead of the top K
 * @param threads       size of the per-file worker pool
 */
public record AnalysisSettings(int boundaryDepth, int topK, Double percentile, int threads) {

    public static final int DEFAULT_BOUNDARY_DEPTH = 2;
    public static final int DEFAULT_TOP_K = 5;

    public AnalysisSettings {
        if (boundaryDepth < 1) {
            throw new IllegalArgumentException("boundaryDepth must be >= 1: " + boundaryDepth);
        }
        if (topK < 0) {
            throw new IllegalArgumentException("topK must be >= 0: " + topK);
        }
        if (percentile != null && (percentile.isNaN() || percentile < 0 || percentile > 100)) {
            throw new IllegalArgumentException("percentile must be within 0-100: " + percentile);
        }
        if (threads < 1) {
            throw new IllegalArgumentException("threads must be >= 1: " + threads);
        }
    }

    public static AnalysisSettings defaults() {
        return new AnalysisSettings(DEFAULT_BOUNDARY_DEPTH, DEFAULT_TOP_K, null,
                Runtime.getRuntime().availableProcessors());
    }
}
