package ai.mapper.graph;

import ai.mapper.model.FileError;
import ai.mapper.model.IntegrationEdge;
import ai.mapper.scan.SourceFile;
import ai.mapper.syntax.ParseException;
import ai.mapper.syntax.ParserAdapter;
import ai.mapper.syntax.PyAst;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Runs the analysis phases over a set of source files:
 * 1) parse + hierarchy per file (parallel), merged into the registry by a single writer
 * 2) freeze, then edge extraction per file (parallel)
 * 3) flow synthesis over the sorted edge set
 * A file that fails in any phase is reported and left out; the run continues.
 */
public final class IntegrationMapper {

    private static final Logger LOG = LoggerFactory.getLogger(IntegrationMapper.class);

    private final ParserAdapter parser;
    private final AnalysisSettings settings;

    public IntegrationMapper(ParserAdapter parser, AnalysisSettings settings) {
        this.parser = Objects.requireNonNull(parser, "parser");
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    public AnalysisResult analyze(List<SourceFile> files) throws InterruptedException {
        return analyze(files, List.of());
    }

    /**
     * @param readErrors files that could not even be read; reported alongside the others
     */
    public AnalysisResult analyze(List<SourceFile> files, List<FileError> readErrors) throws InterruptedException {
        Objects.requireNonNull(files, "files");
        Objects.requireNonNull(readErrors, "readErrors");
        final List<SourceFile> sorted = new ArrayList<>(files);
        sorted.sort(Comparator.comparing(SourceFile::path));
        final List<FileError> errors = new ArrayList<>(readErrors);

        final ExecutorService pool = Executors.newFixedThreadPool(settings.threads());
        try {
            // Step 1: parse and build per-file hierarchies
            final HierarchyBuilder hierarchyBuilder = new HierarchyBuilder();
            final List<Callable<Outcome<FileHierarchy>>> pass1 = new ArrayList<>(sorted.size());
            for (SourceFile f : sorted) {
                pass1.add(() -> buildHierarchy(f, hierarchyBuilder));
            }
            final List<FileHierarchy> hierarchies = collect(pool.invokeAll(pass1), errors);

            // Step 2: single-writer merge in path order, then freeze
            final SymbolRegistry registry = new SymbolRegistry();
            final List<FileHierarchy> registered = new ArrayList<>(hierarchies.size());
            for (FileHierarchy h : hierarchies) {
                try {
                    HierarchyBuilder.register(h, registry);
                    registered.add(h);
                } catch (IllegalArgumentException | IllegalStateException e) {
                    LOG.warn("Cannot register {}: {}", h.path(), e.getMessage());
                    errors.add(new FileError(h.path(), 0, e.getMessage()));
                }
            }
            registry.freeze();
            LOG.info("Pass 1 done: {} components from {} files", registry.size(), registered.size());

            // Step 3: extract edges against the frozen registry
            final IntegrationExtractor extractor = new IntegrationExtractor(registry);
            final List<Callable<Outcome<FileIntegrations>>> pass2 = new ArrayList<>(registered.size());
            for (FileHierarchy h : registered) {
                pass2.add(() -> extractEdges(h, extractor));
            }
            final List<FileIntegrations> integrations = collect(pool.invokeAll(pass2), errors);

            final List<IntegrationEdge> edges = new ArrayList<>();
            for (FileIntegrations fi : integrations) {
                edges.addAll(fi.edges());
            }
            // List.sort is stable: emission order survives within (source, line)
            edges.sort(Comparator.comparing((IntegrationEdge e) -> registry.fqnOf(e.sourceId()))
                    .thenComparingInt(IntegrationEdge::line));
            LOG.info("Pass 2 done: {} integration points", edges.size());

            // Step 4: flows
            final FlowAnalyzer flows = new FlowAnalyzer(registry, settings);
            final var crossroads = flows.crossroads(edges);
            final var criticalPaths = flows.criticalPaths(CallGraph.of(edges));

            errors.sort(Comparator.comparing(FileError::path).thenComparingInt(FileError::line));
            return new AnalysisResult(registry, edges, crossroads, criticalPaths, errors,
                    sorted.size() + readErrors.size(), integrations.size(), settings);
        } finally {
            pool.shutdownNow();
        }
    }

    private Outcome<FileHierarchy> buildHierarchy(SourceFile f, HierarchyBuilder builder) {
        try {
            final PyAst.Module syntax = parser.parse(f.text());
            return Outcome.ok(builder.build(f.path(), syntax));
        } catch (ParseException e) {
            LOG.warn("Parse failed in {}: {}", f.path(), e.getMessage());
            return Outcome.failed(new FileError(f.path(), e.line(), e.getMessage()));
        } catch (RuntimeException e) {
            LOG.warn("Hierarchy failed in {}: {}", f.path(), e.toString());
            return Outcome.failed(new FileError(f.path(), 0, e.getMessage() != null ? e.getMessage() : e.toString()));
        }
    }

    private Outcome<FileIntegrations> extractEdges(FileHierarchy h, IntegrationExtractor extractor) {
        try {
            return Outcome.ok(extractor.extract(h));
        } catch (RuntimeException e) {
            LOG.warn("Extraction failed in {}", h.path(), e);
            return Outcome.failed(new FileError(h.path(), 0, "extraction failed: " + e));
        }
    }

    private static <T> List<T> collect(List<Future<Outcome<T>>> futures, List<FileError> errors)
            throws InterruptedException {
        final List<T> out = new ArrayList<>(futures.size());
        for (Future<Outcome<T>> f : futures) {
            final Outcome<T> outcome;
            try {
                outcome = f.get();
            } catch (ExecutionException e) {
                throw new IllegalStateException("worker failed", e.getCause());
            }
            if (outcome.error() != null) {
                errors.add(outcome.error());
            } else {
                out.add(outcome.value());
            }
        }
        return out;
    }

    private record Outcome<T>(T value, FileError error) {
        static <T> Outcome<T> ok(T value) {
            return new Outcome<>(value, null);
        }

        static <T> Outcome<T> failed(FileError error) {
            return new Outcome<>(null, error);
        }
    }
}
