package ai.mapper.graph;

import ai.mapper.model.CriticalPath;
import ai.mapper.model.Crossroad;
import ai.mapper.model.FileError;
import ai.mapper.model.IntegrationEdge;

import java.util.List;
import java.util.Objects;

/**
 * Fully analysed codebase, ready for formatting.
 * - frozen registry with every component
 * - edges sorted by (source fqn, line, emission order)
 * - derived crossroads and critical paths
 * - per-file errors, sorted by path
 */
public record AnalysisResult(
        SymbolRegistry registry,
        List<IntegrationEdge> edges,
        List<Crossroad> crossroads,
        List<CriticalPath> criticalPaths,
        List<FileError> errors,
        int filesTotal,
        int filesAnalyzed,
        AnalysisSettings settings
) {
    public AnalysisResult {
        Objects.requireNonNull(registry, "registry");
        Objects.requireNonNull(settings, "settings");
        edges = List.copyOf(edges);
        crossroads = List.copyOf(crossroads);
        criticalPaths = List.copyOf(criticalPaths);
        errors = List.copyOf(errors);
    }

    public int filesFailed() {
        return filesTotal - filesAnalyzed;
    }
}
