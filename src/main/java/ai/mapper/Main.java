package ai.mapper;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import ai.mapper.graph.AnalysisResult;
import ai.mapper.graph.AnalysisSettings;
import ai.mapper.graph.IntegrationMapper;
import ai.mapper.io.CompactDecoder;
import ai.mapper.io.CompactFormatter;
import ai.mapper.io.DecodeException;
import ai.mapper.io.InvalidMapException;
import ai.mapper.io.MapSize;
import ai.mapper.io.MapValidator;
import ai.mapper.io.MapWriter;
import ai.mapper.io.VerboseFormatter;
import ai.mapper.scan.SourceFinder;
import ai.mapper.syntax.PythonParser;

public final class Main {

    static final String DEFAULT_OUTPUT = "integration_map.json";

    public static void main(String[] args) {
        final int code = run(args);
        if (code != 0) {
            System.exit(code);
        }
    }

    static int run(String[] args) {
        Path root = null;
        Path output = null;
        Path excludeFile = null;
        Path decode = null;
        String format = "verbose";
        int boundaryDepth = AnalysisSettings.DEFAULT_BOUNDARY_DEPTH;
        int topK = AnalysisSettings.DEFAULT_TOP_K;
        Double percentile = null;
        int threads = Runtime.getRuntime().availableProcessors();
        final List<String> excludes = new ArrayList<>();

        try {
            for (String arg : args) {
                if ("--help".equals(arg) || "-h".equals(arg)) {
                    printUsage();
                    return 0;
                }
                if (arg.startsWith("--output=")) {
                    output = Paths.get(arg.substring("--output=".length()));
                    continue;
                }
                if (arg.startsWith("--format=")) {
                    format = arg.substring("--format=".length()).trim();
                    if (!"verbose".equals(format) && !"compact".equals(format)) {
                        System.err.println("ERROR: unknown format: " + format);
                        printUsage();
                        return 2;
                    }
                    continue;
                }
                if (arg.startsWith("--exclude=")) {
                    final String glob = arg.substring("--exclude=".length()).trim();
                    if (!glob.isEmpty()) {
                        excludes.add(glob);
                    }
                    continue;
                }
                if (arg.startsWith("--excludeFile=")) {
                    excludeFile = Paths.get(arg.substring("--excludeFile=".length()));
                    continue;
                }
                if (arg.startsWith("--boundaryDepth=")) {
                    boundaryDepth = Integer.parseInt(arg.substring("--boundaryDepth=".length()).trim());
                    continue;
                }
                if (arg.startsWith("--topK=")) {
                    topK = Integer.parseInt(arg.substring("--topK=".length()).trim());
                    continue;
                }
                if (arg.startsWith("--percentile=")) {
                    percentile = Double.valueOf(arg.substring("--percentile=".length()).trim());
                    continue;
                }
                if (arg.startsWith("--threads=")) {
                    threads = Integer.parseInt(arg.substring("--threads=".length()).trim());
                    continue;
                }
                if (arg.startsWith("--decode=")) {
                    decode = Paths.get(arg.substring("--decode=".length()));
                    continue;
                }
                if (arg.startsWith("--")) {
                    System.err.println("ERROR: unknown argument: " + arg);
                    printUsage();
                    return 2;
                }
                if (root == null) {
                    root = Paths.get(arg);
                    continue;
                }
                System.err.println("ERROR: unexpected argument: " + arg);
                printUsage();
                return 2;
            }

            if (root == null) {
                root = Paths.get(".");
            }
            root = root.toAbsolutePath().normalize();

            if (output == null) {
                output = root.resolve(DEFAULT_OUTPUT);
            } else if (!output.isAbsolute()) {
                output = root.resolve(output).normalize();
            }

            final MapWriter writer = new MapWriter();
            final MapValidator validator = new MapValidator();

            if (decode != null) {
                final JsonNode compact = writer.readTree(decode.toAbsolutePath().normalize());
                final ObjectNode verbose = new CompactDecoder().decode(compact);
                validator.requireValid(verbose, false);
                writer.writeVerbose(output, verbose);
                System.out.println("Decoded map written to: " + output);
                System.out.println("Size: " + MapSize.of(output).describe());
                return 0;
            }

            if (excludeFile != null) {
                final Path excludePath = excludeFile.isAbsolute()
                        ? excludeFile
                        : root.resolve(excludeFile).normalize();
                loadExcludesFromFile(excludePath, excludes);
            }

            final AnalysisSettings settings;
            try {
                settings = new AnalysisSettings(boundaryDepth, topK, percentile, threads);
            } catch (IllegalArgumentException ex) {
                System.err.println("ERROR: " + safeMsg(ex.getMessage()));
                return 2;
            }

            final SourceFinder finder = new SourceFinder(root, excludes);
            final SourceFinder.Loaded loaded = finder.loadAll();
            final IntegrationMapper mapper = new IntegrationMapper(new PythonParser(), settings);
            final AnalysisResult result = mapper.analyze(loaded.files(), loaded.errors());

            final String generatedAt = Instant.now().toString();
            if ("compact".equals(format)) {
                final ObjectNode compact = new CompactFormatter().format(result, generatedAt);
                validator.requireValid(compact, true);
                writer.writeCompact(output, compact);
            } else {
                final ObjectNode verbose = new VerboseFormatter().format(result, generatedAt);
                validator.requireValid(verbose, false);
                writer.writeVerbose(output, verbose);
            }

            System.out.println("Integration map written to: " + output);
            System.out.println(result.filesAnalyzed() + " analyzed, " + result.filesFailed() + " failed to parse");
            System.out.println("Components: " + result.registry().size()
                    + ", integration points: " + result.edges().size()
                    + ", crossroads: " + result.crossroads().size());
            System.out.println("Size: " + MapSize.of(output).describe());
            return 0;
        } catch (NumberFormatException ex) {
            System.err.println("ERROR: not a number: " + safeMsg(ex.getMessage()));
            printUsage();
            return 2;
        } catch (java.io.IOException ex) {
            System.err.println("ERROR: IO failure: " + safeMsg(ex.getMessage()));
            return 2;
        } catch (DecodeException ex) {
            System.err.println("ERROR: failed to decode map: " + safeMsg(ex.getMessage()));
            return 1;
        } catch (InvalidMapException ex) {
            System.err.println("ERROR: generated map failed validation: " + safeMsg(ex.getMessage()));
            return 1;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            System.err.println("ERROR: analysis interrupted");
            return 1;
        } catch (Exception ex) {
            System.err.println("ERROR: failed to build integration map: "
                    + ex.getClass().getSimpleName() + ": " + safeMsg(ex.getMessage()));
            return 1;
        }
    }

    static void loadExcludesFromFile(Path excludeFile, List<String> excludes) throws java.io.IOException {
        if (!Files.isRegularFile(excludeFile)) {
            throw new java.io.IOException("Exclude file not found: " + excludeFile);
        }
        try (var br = Files.newBufferedReader(excludeFile, StandardCharsets.UTF_8)) {
            String line;
            while ((line = br.readLine()) != null) {
                String trimmed = line.trim();
                if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                    continue;
                }
                final int hash = trimmed.indexOf('#');
                if (hash >= 0) {
                    trimmed = trimmed.substring(0, hash).trim();
                }
                if (trimmed.isEmpty()) {
                    continue;
                }
                for (String token : trimmed.split("[,\\s]+")) {
                    final String t = token.trim();
                    if (!t.isEmpty()) {
                        excludes.add(t);
                    }
                }
            }
        }
    }

    private static void printUsage() {
        System.out.println("Usage: integration-mapper [root] [options]");
        System.out.println("Options:");
        System.out.println("  --output=<file>         Output file (default: <root>/" + DEFAULT_OUTPUT + ")");
        System.out.println("  --format=<fmt>          verbose (default) or compact");
        System.out.println("  --exclude=<glob>        Glob of files to skip; repeatable");
        System.out.println("  --excludeFile=<path>    File containing globs (one per line or comma-separated)");
        System.out.println("  --boundaryDepth=<n>     FQN segments forming a crossroad boundary (default: "
                + AnalysisSettings.DEFAULT_BOUNDARY_DEPTH + ")");
        System.out.println("  --topK=<n>              Critical paths to report (default: " + AnalysisSettings.DEFAULT_TOP_K + ")");
        System.out.println("  --percentile=<p>        Report callees at or above this caller-count percentile instead");
        System.out.println("  --threads=<n>           Worker threads (default: available processors)");
        System.out.println("  --decode=<file>         Expand a compact map back into the verbose form");
        System.out.println("  --help, -h              Show this help");
    }

    private static String safeMsg(String msg) {
        if (msg == null) {
            return "";
        }
        return msg.length() > 200 ? msg.substring(0, 200) + "..." : msg;
    }
}
