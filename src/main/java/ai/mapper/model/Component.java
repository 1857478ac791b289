package ai.mapper.model;

import java.util.List;
import java.util.Objects;

/**
 * Node of the codebase hierarchy, owned by the symbol registry and referenced by id elsewhere.
 */
public record Component(
        int id,
        String fqn,
        String name,
        ComponentKind kind,
        Integer parentId,            // null for roots
        String path,                 // root-relative file (or directory for plain packages)
        SourceSpan span,
        List<String> declaredBases,  // as written; classes only
        List<String> parameters,     // functions and methods only
        String docstring,
        List<String> history         // re-definition notes
) {
    public Component {
        Objects.requireNonNull(fqn, "fqn");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(span, "span");
        declaredBases = List.copyOf(declaredBases);
        parameters = List.copyOf(parameters);
        history = List.copyOf(history);
    }
}
