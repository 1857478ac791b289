package ai.mapper.graph;

import ai.mapper.model.ComponentKind;
import ai.mapper.model.SourceSpan;

import java.util.List;
import java.util.Objects;

/**
 * A component as declared by one file, before it is given an id.
 */
public record Declaration(
        String fqn,
        String name,
        ComponentKind kind,
        String parentFqn,        // null for top-level packages and modules
        String path,
        SourceSpan span,
        List<String> bases,
        List<String> parameters,
        String docstring
) {
    public Declaration {
        Objects.requireNonNull(fqn, "fqn");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(span, "span");
        bases = List.copyOf(bases);
        parameters = List.copyOf(parameters);
    }
}
