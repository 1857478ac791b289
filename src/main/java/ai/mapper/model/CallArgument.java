package ai.mapper.model;

/**
 * One argument captured at a call site.
 */
public record CallArgument(
        String name,     // resolved dotted name for name/attribute arguments, else null
        String value,    // source text summary
        String type,     // best-effort tag: str, int, call, name, ...
        String keyword   // keyword name, null for positional
) {
}
