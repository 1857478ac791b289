package ai.mapper.model;

import java.util.Objects;

public final class Fqns {

    private Fqns() {
    }

    public static String child(String parentFqn, String name) {
        Objects.requireNonNull(name, "name");
        if (parentFqn == null || parentFqn.isEmpty()) {
            return name;
        }
        return parentFqn + "." + name;
    }

    public static String simpleName(String fqn) {
        final int i = fqn.lastIndexOf('.');
        return i >= 0 ? fqn.substring(i + 1) : fqn;
    }

    /** Parent FQN, or null for a top-level name. */
    public static String parent(String fqn) {
        final int i = fqn.lastIndexOf('.');
        return i >= 0 ? fqn.substring(0, i) : null;
    }

    /** First {@code depth} dotted segments of the name (the whole name when it is shorter). */
    public static String boundary(String fqn, int depth) {
        if (depth < 1) {
            throw new IllegalArgumentException("depth must be >= 1: " + depth);
        }
        int idx = -1;
        for (int i = 0; i < depth; i++) {
            idx = fqn.indexOf('.', idx + 1);
            if (idx < 0) {
                return fqn;
            }
        }
        return fqn.substring(0, idx);
    }

    /**
     * Returns the reason a dotted name is not a valid FQN, or null when it is valid.
     */
    public static String problem(String fqn) {
        if (fqn == null) {
            return "null";
        }
        if (fqn.isBlank()) {
            return "blank";
        }
        if (fqn.startsWith(".") || fqn.endsWith(".")) {
            return "leading or trailing dot";
        }
        if (fqn.contains("..")) {
            return "empty segment";
        }
        for (int i = 0; i < fqn.length(); i++) {
            if (Character.isWhitespace(fqn.charAt(i))) {
                return "whitespace at " + i;
            }
        }
        return null;
    }

    public static boolean isIdentifier(String s) {
        if (s == null || s.isEmpty()) {
            return false;
        }
        final char first = s.charAt(0);
        if (first != '_' && !Character.isLetter(first)) {
            return false;
        }
        for (int i = 1; i < s.length(); i++) {
            final char c = s.charAt(i);
            if (c != '_' && !Character.isLetterOrDigit(c)) {
                return false;
            }
        }
        return true;
    }
}
