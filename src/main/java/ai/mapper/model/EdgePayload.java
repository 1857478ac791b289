package ai.mapper.model;

/**
 * Kind-specific data carried by an {@link IntegrationEdge}. Each edge kind has exactly one
 * payload type, see {@link #expectedFor(EdgeKind)}.
 */
public interface EdgePayload {

    static Class<? extends EdgePayload> expectedFor(EdgeKind kind) {
        return switch (kind) {
            case IMPORT -> ImportPayload.class;
            case CALL -> CallPayload.class;
            case ATTR_READ, ATTR_WRITE -> AttributePayload.class;
            case INHERIT -> InheritPayload.class;
        };
    }
}
