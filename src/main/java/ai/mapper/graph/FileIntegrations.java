package ai.mapper.graph;

import ai.mapper.model.AliasBinding;
import ai.mapper.model.IntegrationEdge;

import java.util.List;
import java.util.Objects;

/**
 * Pass-2 output for one file: its edges in emission order and the import bindings it made.
 */
public record FileIntegrations(String path, List<IntegrationEdge> edges, List<AliasBinding> aliases) {
    public FileIntegrations {
        Objects.requireNonNull(path, "path");
        edges = List.copyOf(edges);
        aliases = List.copyOf(aliases);
    }
}
