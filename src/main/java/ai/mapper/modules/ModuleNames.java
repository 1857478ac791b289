package ai.mapper.modules;

import ai.mapper.model.Fqns;
import ai.mapper.model.InvalidIdentifierException;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Resolves a root-relative file path to a module FQN.
 * Strategy:
 * 1) strip ".py" and turn every "/" into "."
 * 2) "__init__.py" takes the FQN of its directory
 * 3) every directory prefix is a package
 */
public final class ModuleNames {

    private static final String SUFFIX = ".py";
    private static final String INIT = "__init__";

    private ModuleNames() {
    }

    /**
     * @param fqn         module FQN
     * @param packageInit true for an {@code __init__.py}, whose module is the package itself
     * @param packages    FQNs of the enclosing directory packages, outermost first
     */
    public record ModuleName(String fqn, boolean packageInit, List<String> packages) {
        public ModuleName {
            Objects.requireNonNull(fqn, "fqn");
            packages = List.copyOf(packages);
        }
    }

    public static ModuleName of(String relativePath) {
        Objects.requireNonNull(relativePath, "relativePath");
        final String normalized = relativePath.replace('\\', '/');
        if (!normalized.endsWith(SUFFIX)) {
            throw new InvalidIdentifierException(relativePath, "not a Python source file");
        }
        final String[] segments = normalized.substring(0, normalized.length() - SUFFIX.length()).split("/", -1);
        final boolean packageInit = INIT.equals(segments[segments.length - 1]);
        if (packageInit && segments.length == 1) {
            throw new InvalidIdentifierException(relativePath, "package init at the analysis root has no package name");
        }
        final int moduleSegments = packageInit ? segments.length - 1 : segments.length;

        for (int i = 0; i < moduleSegments; i++) {
            if (!Fqns.isIdentifier(segments[i])) {
                throw new InvalidIdentifierException(segments[i], "path segment of " + relativePath
                        + " is not a Python identifier");
            }
        }

        final List<String> packages = new ArrayList<>();
        String prefix = null;
        for (int i = 0; i < segments.length - 1; i++) {
            prefix = Fqns.child(prefix, segments[i]);
            packages.add(prefix);
        }
        final String fqn = String.join(".", List.of(segments).subList(0, moduleSegments));
        return new ModuleName(fqn, packageInit, packages);
    }

    /**
     * Absolute target of a relative import, or null when the dots climb past the top level.
     *
     * @param level  number of leading dots (at least 1)
     * @param module dotted remainder after the dots, may be null
     */
    public static String resolveRelative(ModuleName from, int level, String module) {
        if (level < 1) {
            throw new IllegalArgumentException("level must be >= 1: " + level);
        }
        String base = from.packageInit() ? from.fqn() : Fqns.parent(from.fqn());
        for (int i = 1; i < level && base != null; i++) {
            base = Fqns.parent(base);
        }
        if (base == null) {
            return null;
        }
        return module == null || module.isEmpty() ? base : base + "." + module;
    }
}
