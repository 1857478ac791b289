package ai.mapper.model;

/**
 * Local name bound by an import, valid for one file only.
 */
public record AliasBinding(
        String localName,   // "*" for star imports
        String resolvedFqn,
        String scope,       // file path
        AliasKind kind
) {
}
