package ai.mapper.scan;

import ai.mapper.model.FileError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystem;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Finds all Python sources under an analysis root:
 * - every *.py file, walked recursively
 * - skipping VCS, cache, virtualenv and build directories
 * - skipping anything matched by an exclusion glob (relative path or file name)
 */
public final class SourceFinder {

    private static final Logger LOG = LoggerFactory.getLogger(SourceFinder.class);

    private static final Set<String> SKIPPED_DIRS = Set.of(
            ".git", "__pycache__", ".venv", "venv", "node_modules", "build", "dist",
            ".tox", ".mypy_cache", ".pytest_cache");

    private final Path root;
    private final List<PathMatcher> excludes;

    public SourceFinder(Path root, List<String> excludeGlobs) {
        this.root = Objects.requireNonNull(root, "root").toAbsolutePath().normalize();
        Objects.requireNonNull(excludeGlobs, "excludeGlobs");
        final FileSystem fs = this.root.getFileSystem();
        final List<PathMatcher> matchers = new ArrayList<>();
        for (String glob : excludeGlobs) {
            matchers.add(fs.getPathMatcher("glob:" + glob));
        }
        this.excludes = List.copyOf(matchers);
    }

    /** Root-relative paths of every analysable file, "/" separated and sorted. */
    public List<String> find() throws IOException {
        final List<String> out = new ArrayList<>();
        Files.walkFileTree(root, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                if (dir.equals(root)) {
                    return FileVisitResult.CONTINUE;
                }
                final String name = dir.getFileName() != null ? dir.getFileName().toString() : "";
                if (SKIPPED_DIRS.contains(name) || excluded(root.relativize(dir))) {
                    return FileVisitResult.SKIP_SUBTREE;
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                if (attrs.isRegularFile() && file.getFileName().toString().endsWith(".py")) {
                    final Path rel = root.relativize(file);
                    if (!excluded(rel)) {
                        out.add(toSlashPath(rel));
                    }
                }
                return FileVisitResult.CONTINUE;
            }
        });
        Collections.sort(out);
        LOG.debug("Found {} Python files under {}", out.size(), root);
        return out;
    }

    public SourceFile read(String relativePath) throws IOException {
        final Path file = root.resolve(relativePath);
        return new SourceFile(relativePath, Files.readString(file, StandardCharsets.UTF_8));
    }

    /** Reads every file {@link #find()} returns; unreadable files become errors. */
    public Loaded loadAll() throws IOException {
        final List<SourceFile> files = new ArrayList<>();
        final List<FileError> errors = new ArrayList<>();
        for (String path : find()) {
            try {
                files.add(read(path));
            } catch (IOException e) {
                LOG.warn("Cannot read {}: {}", path, e.toString());
                errors.add(new FileError(path, 0, "unreadable: " + e.getMessage()));
            }
        }
        return new Loaded(files, errors);
    }

    public record Loaded(List<SourceFile> files, List<FileError> errors) {
        public Loaded {
            files = List.copyOf(files);
            errors = List.copyOf(errors);
        }
    }

    private boolean excluded(Path rel) {
        final Path name = rel.getFileName();
        for (PathMatcher m : excludes) {
            if (m.matches(rel) || (name != null && m.matches(name))) {
                return true;
            }
        }
        return false;
    }

    private static String toSlashPath(Path rel) {
        final StringBuilder sb = new StringBuilder();
        for (int i = 0; i < rel.getNameCount(); i++) {
            if (i > 0) {
                sb.append('/');
            }
            sb.append(rel.getName(i));
        }
        return sb.toString();
    }
}
