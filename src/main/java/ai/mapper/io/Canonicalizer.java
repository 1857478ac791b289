package ai.mapper.io;

import ai.mapper.graph.SymbolRegistry;
import ai.mapper.io.AbbreviationTable.Field;
import ai.mapper.model.EdgeKind;
import ai.mapper.model.Fqns;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Normal form of a verbose payload: every optional field present (absent ones get their empty
 * value) and object keys sorted at every level. Two payloads that carry the same information
 * have equal normal forms.
 */
public final class Canonicalizer {

    private static final JsonNodeFactory JSON = JsonNodeFactory.instance;

    public ObjectNode canonicalize(ObjectNode verbose) {
        Objects.requireNonNull(verbose, "verbose");
        final ObjectNode copy = verbose.deepCopy();

        final ObjectNode meta = object(copy, "metadata");
        fill(meta, AbbreviationTable.META_FIELDS);
        for (JsonNode error : array(meta, "errors")) {
            fill((ObjectNode) error, AbbreviationTable.ERROR_FIELDS);
        }

        final Iterator<Map.Entry<String, JsonNode>> roots = object(copy, "codebase_tree").fields();
        while (roots.hasNext()) {
            fillNode((ObjectNode) roots.next().getValue());
        }

        final ObjectNode map = object(copy, "global_integration_map");
        array(map, "crossroads");
        array(map, "critical_paths");
        final ObjectNode stats = object(map, "statistics");
        fill(stats, AbbreviationTable.STATISTICS_FIELDS);
        object(stats, "edges_by_kind");

        return (ObjectNode) sorted(copy);
    }

    static void fillNode(ObjectNode node) {
        if (!node.has("name") && node.hasNonNull("fqn")) {
            node.put("name", Fqns.simpleName(node.get("fqn").asText()));
        }
        fill(node, AbbreviationTable.NODE_FIELDS);
        for (JsonNode edge : array(node, "integrations")) {
            fillEdge((ObjectNode) edge, node.path("fqn").asText(null));
        }
        final Iterator<Map.Entry<String, JsonNode>> children = object(node, "children").fields();
        while (children.hasNext()) {
            fillNode((ObjectNode) children.next().getValue());
        }
    }

    static void fillEdge(ObjectNode edge, String sourceFqn) {
        if (!edge.has("source")) {
            edge.put("source", sourceFqn);
        }
        if (!edge.has("line")) {
            edge.put("line", 0);
        }
        fill(edge, List.of(AbbreviationTable.RESOLUTION));
        if (!edge.has("target_name")) {
            edge.set("target_name", impliedTargetName(edge.path("target").asText(null)));
        }
        final EdgeKind kind = EdgeKind.fromLabel(edge.path("kind").asText());
        final ObjectNode payload = object(edge, "payload");
        fill(payload, AbbreviationTable.payloadFields(kind));
        final JsonNode args = payload.get(AbbreviationTable.ARGUMENTS);
        if (args != null && args.isArray()) {
            for (JsonNode arg : args) {
                fill((ObjectNode) arg, AbbreviationTable.ARGUMENT_FIELDS);
            }
        }
    }

    /** A resolved target names itself; the sentinel implies no name. */
    static JsonNode impliedTargetName(String target) {
        if (target == null || SymbolRegistry.UNRESOLVED_FQN.equals(target)) {
            return JSON.nullNode();
        }
        return JSON.textNode(target);
    }

    private static void fill(ObjectNode node, List<Field> fields) {
        for (Field f : fields) {
            if (!node.has(f.verbose())) {
                node.set(f.verbose(), f.emptyCopy());
            }
        }
    }

    private static ObjectNode object(ObjectNode parent, String key) {
        final JsonNode n = parent.get(key);
        if (n instanceof ObjectNode o) {
            return o;
        }
        return parent.putObject(key);
    }

    private static ArrayNode array(ObjectNode parent, String key) {
        final JsonNode n = parent.get(key);
        if (n instanceof ArrayNode a) {
            return a;
        }
        return parent.putArray(key);
    }

    /** Deep copy with the keys of every object in ascending order. */
    public static JsonNode sorted(JsonNode node) {
        if (node.isObject()) {
            final List<String> keys = new ArrayList<>();
            node.fieldNames().forEachRemaining(keys::add);
            Collections.sort(keys);
            final ObjectNode out = JSON.objectNode();
            for (String k : keys) {
                out.set(k, sorted(node.get(k)));
            }
            return out;
        }
        if (node.isArray()) {
            final ArrayNode out = JSON.arrayNode();
            for (JsonNode child : node) {
                out.add(sorted(child));
            }
            return out;
        }
        return node.deepCopy();
    }
}
