package ai.mapper.graph;

import ai.mapper.model.Component;
import ai.mapper.model.ComponentKind;
import ai.mapper.model.Fqns;
import ai.mapper.model.IntegrationEdge;
import ai.mapper.model.InvalidIdentifierException;
import ai.mapper.model.SourceSpan;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Run-wide symbol registry:
 * - fqn &lt;-&gt; id, both directions, ids from 1 in registration order
 * - id -&gt; component
 * - after {@link #freeze()}: parent -&gt; children, class -&gt; declared method names
 * <p>
 * Writes are synchronized and only allowed before the freeze; the frozen registry is read-only
 * and safe to share between extraction workers.
 */
public final class SymbolRegistry {

    public static final String UNRESOLVED_FQN = "<unresolved>";

    private final Map<String, Integer> idsByFqn = new HashMap<>();
    private final List<String> fqnsById = new ArrayList<>();
    private final Map<Integer, Component> components = new HashMap<>();
    private final Map<Integer, List<Integer>> childrenByParent = new HashMap<>();
    private final Map<Integer, Set<String>> methodNamesByClass = new HashMap<>();
    private volatile boolean frozen;

    public SymbolRegistry() {
        fqnsById.add(UNRESOLVED_FQN);
    }

    /** Returns the id of {@code fqn}, allocating the next one on first sight. */
    public synchronized int internId(String fqn) {
        checkWritable();
        final String problem = Fqns.problem(fqn);
        if (problem != null) {
            throw new InvalidIdentifierException(String.valueOf(fqn), problem);
        }
        final Integer known = idsByFqn.get(fqn);
        if (known != null) {
            return known;
        }
        final int id = fqnsById.size();
        fqnsById.add(fqn);
        idsByFqn.put(fqn, id);
        return id;
    }

    /** Id of a registered name, or {@link IntegrationEdge#UNRESOLVED} when unknown. */
    public int idOf(String fqn) {
        final Integer id = idsByFqn.get(fqn);
        return id != null ? id : IntegrationEdge.UNRESOLVED;
    }

    public boolean contains(String fqn) {
        return components.containsKey(idOf(fqn));
    }

    public String fqnOf(int id) {
        if (id < 0 || id >= fqnsById.size()) {
            throw new IllegalArgumentException("unknown id: " + id);
        }
        return fqnsById.get(id);
    }

    /** The component with this id, or null (the sentinel and interned-only names have none). */
    public Component component(int id) {
        return components.get(id);
    }

    public Component component(String fqn) {
        return components.get(idOf(fqn));
    }

    /**
     * Creates the component for a declaration, or replaces it when the name is already defined.
     * A replaced definition keeps its id and its history, plus a note about the earlier span.
     */
    public synchronized Component define(Declaration d) {
        checkWritable();
        Objects.requireNonNull(d, "declaration");
        Integer parentId = null;
        if (d.parentFqn() != null) {
            if (!d.fqn().startsWith(d.parentFqn() + ".")) {
                throw new IllegalArgumentException(d.parentFqn() + " is not a prefix of " + d.fqn());
            }
            final int pid = idOf(d.parentFqn());
            if (!components.containsKey(pid)) {
                throw new IllegalStateException("parent of " + d.fqn() + " is not registered: " + d.parentFqn());
            }
            parentId = pid;
        }
        final int id = internId(d.fqn());
        final Component previous = components.get(id);

        List<String> history = List.of();
        if (previous != null) {
            history = new ArrayList<>(previous.history());
            if (!(previous.kind() == ComponentKind.PACKAGE && d.kind() == ComponentKind.PACKAGE)) {
                history.add(redefinitionNote(previous, d));
            }
        }
        final Component c = new Component(id, d.fqn(), d.name(), d.kind(), parentId, d.path(), d.span(),
                d.bases(), d.parameters(), d.docstring(), history);
        components.put(id, c);
        return c;
    }

    /** Registers a directory package unless the name is already defined. */
    public synchronized Component ensurePackage(String fqn, String directory) {
        final Component known = component(fqn);
        if (known != null) {
            return known;
        }
        final String parent = Fqns.parent(fqn);
        if (parent != null) {
            ensurePackage(parent, directory.contains("/") ? directory.substring(0, directory.lastIndexOf('/')) : parent);
        }
        return define(new Declaration(fqn, Fqns.simpleName(fqn), ComponentKind.PACKAGE, parent, directory,
                SourceSpan.synthetic(), List.of(), List.of(), null));
    }

    private static String redefinitionNote(Component previous, Declaration next) {
        final SourceSpan was = previous.span();
        if (Objects.equals(previous.path(), next.path())) {
            return "redefined at line " + next.span().startLine()
                    + " (previous lines " + was.startLine() + "-" + was.endLine() + ")";
        }
        return "redefined in " + next.path() + " at line " + next.span().startLine()
                + " (previous " + previous.path() + " lines " + was.startLine() + "-" + was.endLine() + ")";
    }

    /** Ends registration and builds the lookup indices. */
    public synchronized void freeze() {
        if (frozen) {
            return;
        }
        final List<Component> all = new ArrayList<>(components.values());
        all.sort(Comparator.comparing(Component::name).thenComparingInt(Component::id));
        for (Component c : all) {
            if (c.parentId() != null) {
                childrenByParent.computeIfAbsent(c.parentId(), k -> new ArrayList<>()).add(c.id());
                if (c.kind() == ComponentKind.METHOD) {
                    methodNamesByClass.computeIfAbsent(c.parentId(), k -> new TreeSet<>()).add(c.name());
                }
            }
        }
        frozen = true;
    }

    public boolean isFrozen() {
        return frozen;
    }

    /** Children of a component, ordered by name. Only available once frozen. */
    public List<Integer> childrenOf(int id) {
        checkFrozen();
        return Collections.unmodifiableList(childrenByParent.getOrDefault(id, List.of()));
    }

    /** Names of the methods declared directly in a class, sorted. Only available once frozen. */
    public Set<String> methodNames(int classId) {
        checkFrozen();
        return Collections.unmodifiableSet(methodNamesByClass.getOrDefault(classId, Set.of()));
    }

    /** Components without a parent, ordered by name. */
    public List<Component> roots() {
        final List<Component> out = new ArrayList<>();
        for (Component c : components.values()) {
            if (c.parentId() == null) {
                out.add(c);
            }
        }
        out.sort(Comparator.comparing(Component::name));
        return out;
    }

    public int size() {
        return components.size();
    }

    private void checkWritable() {
        if (frozen) {
            throw new IllegalStateException("registry is frozen");
        }
    }

    private void checkFrozen() {
        if (!frozen) {
            throw new IllegalStateException("registry is not frozen yet");
        }
    }
}
