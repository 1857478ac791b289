package ai.mapper.model;

import java.util.List;

/**
 * Payload of an import edge.
 * <p>
 * For star imports {@code star} is true and {@code items} is empty: the imported members are
 * never enumerated.
 */
public record ImportPayload(
        String module,       // module part as resolved (absolute)
        List<String> items,  // imported names, e.g. ["foo"]
        boolean star,
        String alias,        // "as" name or null
        AliasKind binding,   // null for dynamic imports
        int level,           // leading dots of a relative import
        String note,
        String expression    // unresolved expression of a dynamic import
) implements EdgePayload {
    public ImportPayload {
        items = List.copyOf(items);
    }
}
