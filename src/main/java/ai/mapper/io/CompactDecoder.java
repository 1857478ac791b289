package ai.mapper.io;

import ai.mapper.io.AbbreviationTable.Field;
import ai.mapper.model.EdgeKind;
import ai.mapper.model.Fqns;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

import static ai.mapper.io.AbbreviationTable.K_COMPONENTS;
import static ai.mapper.io.AbbreviationTable.K_CRITICAL_PATHS;
import static ai.mapper.io.AbbreviationTable.K_CROSSROADS;
import static ai.mapper.io.AbbreviationTable.K_EDGES;
import static ai.mapper.io.AbbreviationTable.K_EDGES_BY_KIND;
import static ai.mapper.io.AbbreviationTable.K_ERRORS;
import static ai.mapper.io.AbbreviationTable.K_ID;
import static ai.mapper.io.AbbreviationTable.K_INDEX;
import static ai.mapper.io.AbbreviationTable.K_KIND;
import static ai.mapper.io.AbbreviationTable.K_META;
import static ai.mapper.io.AbbreviationTable.K_NAME;
import static ai.mapper.io.AbbreviationTable.K_PARENT;
import static ai.mapper.io.AbbreviationTable.K_STATISTICS;
import static ai.mapper.io.AbbreviationTable.K_TARGET_NAME;
import static ai.mapper.io.AbbreviationTable.K_VERSION;

/**
 * Expands a compact payload back into the verbose tree, in the normal form produced by
 * {@link Canonicalizer}. The version is checked before anything else is read.
 */
public final class CompactDecoder {

    private static final JsonNodeFactory JSON = JsonNodeFactory.instance;

    private final Canonicalizer canonicalizer = new Canonicalizer();

    public ObjectNode decode(JsonNode compact) throws DecodeException {
        if (compact == null || !compact.isObject()) {
            throw new DecodeException("compact payload must be a JSON object");
        }
        final JsonNode version = compact.get(K_VERSION);
        if (version == null || !version.isTextual() || !AbbreviationTable.VERSION.equals(version.asText())) {
            throw new UnsupportedFormatVersionException(version == null || version.isNull() ? null : version.asText());
        }

        final Map<Integer, String> index = index(compact.get(K_INDEX));

        final ObjectNode out = JSON.objectNode();
        final ObjectNode meta = out.putObject("metadata");
        final ObjectNode tree = out.putObject("codebase_tree");
        final ObjectNode map = out.putObject("global_integration_map");

        // Step 1: components, parents before children
        final Map<Integer, ObjectNode> nodes = new HashMap<>();
        for (JsonNode c : array(compact, K_COMPONENTS)) {
            component(object(c, "component"), index, nodes, tree);
        }

        // Step 2: metadata and statistics
        final JsonNode compactMeta = compact.get(K_META);
        if (compactMeta != null && !compactMeta.isNull()) {
            meta(object(compactMeta, K_META), meta, map);
        }

        // Step 3: global map
        final ArrayNode crossroads = map.putArray("crossroads");
        for (JsonNode row : array(compact, K_CROSSROADS)) {
            final ArrayNode r = row(row, 5, "crossroad");
            final ObjectNode n = crossroads.addObject();
            n.put("id", integer(r.get(0), "crossroad id"));
            final ArrayNode components = n.putArray("components");
            for (JsonNode id : row(r.get(1), -1, "crossroad components")) {
                components.add(fqn(index, id));
            }
            n.put("edge_count", integer(r.get(2), "edge count"));
            n.put("criticality", AbbreviationTable.CRITICALITIES.decode(text(r.get(3), "criticality")));
            final ArrayNode kinds = n.putArray("interaction_kinds");
            for (JsonNode k : row(r.get(4), -1, "interaction kinds")) {
                kinds.add(AbbreviationTable.EDGE_KINDS.decode(text(k, "interaction kind")));
            }
        }
        final ArrayNode paths = map.putArray("critical_paths");
        for (JsonNode row : array(compact, K_CRITICAL_PATHS)) {
            final ArrayNode r = row(row, 5, "critical path");
            final ObjectNode n = paths.addObject();
            n.put("id", integer(r.get(0), "critical path id"));
            n.put("entry_point", fqn(index, r.get(1)));
            n.put("caller_count", integer(r.get(2), "caller count"));
            n.put("call_count", integer(r.get(3), "call count"));
            n.put("complexity", AbbreviationTable.CRITICALITIES.decode(text(r.get(4), "complexity")));
        }

        // Step 4: defaults and key order
        return canonicalizer.canonicalize(out);
    }

    private static Map<Integer, String> index(JsonNode idx) throws DecodeException {
        final Map<Integer, String> index = new HashMap<>();
        if (idx == null || idx.isNull()) {
            return index;
        }
        final Iterator<Map.Entry<String, JsonNode>> it = object(idx, K_INDEX).fields();
        while (it.hasNext()) {
            final Map.Entry<String, JsonNode> e = it.next();
            final int id;
            try {
                id = Integer.parseInt(e.getKey());
            } catch (NumberFormatException ex) {
                throw new DecodeException("index key is not an id: " + e.getKey());
            }
            if (id < 0) {
                throw new DecodeException("negative id in index: " + id);
            }
            index.put(id, text(e.getValue(), "index entry " + id));
        }
        return index;
    }

    private static void component(ObjectNode c, Map<Integer, String> index, Map<Integer, ObjectNode> nodes,
                                  ObjectNode tree) throws DecodeException {
        final int id = integer(c.get(K_ID), "component id");
        final String fqn = fqn(index, c.get(K_ID));
        if (nodes.containsKey(id)) {
            throw new DecodeException("component " + id + " listed twice");
        }

        final ObjectNode n = JSON.objectNode();
        n.put("id", id);
        n.put("fqn", fqn);
        final JsonNode name = c.get(K_NAME);
        if (name != null) {
            n.set("name", name.deepCopy());
        } else {
            n.put("name", Fqns.simpleName(fqn));
        }
        n.put("kind", AbbreviationTable.COMPONENT_KINDS.decode(text(c.get(K_KIND), "component kind")));
        putFields(c, AbbreviationTable.NODE_FIELDS, n);

        final ArrayNode integrations = n.putArray("integrations");
        final JsonNode edges = c.get(K_EDGES);
        if (edges != null && !edges.isNull()) {
            for (JsonNode e : row(edges, -1, "edges")) {
                integrations.add(edge(e, index));
            }
        }
        n.putObject("children");

        final JsonNode parent = c.get(K_PARENT);
        final ObjectNode siblings;
        if (parent == null || parent.isNull()) {
            siblings = tree;
        } else {
            final ObjectNode p = nodes.get(integer(parent, "parent id"));
            if (p == null) {
                throw new DecodeException("component " + id + " refers to parent " + parent
                        + " before it is listed");
            }
            siblings = (ObjectNode) p.get("children");
        }
        final String key = n.get("name").asText();
        if (siblings.has(key)) {
            throw new DecodeException("duplicate child name '" + key + "' under component " + parent);
        }
        siblings.set(key, n);
        nodes.put(id, n);
    }

    private static ObjectNode edge(JsonNode row, Map<Integer, String> index) throws DecodeException {
        final ArrayNode r = row(row, -1, "edge");
        if (r.size() < 4 || r.size() > 5) {
            throw new DecodeException("edge must have 4 or 5 elements, got " + r.size());
        }
        final String kindLabel = AbbreviationTable.EDGE_KINDS.decode(text(r.get(2), "edge kind"));
        final String target = fqn(index, r.get(1));

        final ObjectNode e = JSON.objectNode();
        e.put("kind", kindLabel);
        e.put("line", integer(r.get(3), "edge line"));
        e.put("source", fqn(index, r.get(0)));
        e.put("target", target);

        final ObjectNode p = r.size() == 5 ? object(r.get(4), "edge payload") : JSON.objectNode();
        putFields(p, List.of(AbbreviationTable.RESOLUTION), e);
        e.set("target_name", p.has(K_TARGET_NAME)
                ? p.get(K_TARGET_NAME).deepCopy()
                : Canonicalizer.impliedTargetName(target));

        final ObjectNode payload = e.putObject("payload");
        for (Field f : AbbreviationTable.payloadFields(EdgeKind.fromLabel(kindLabel))) {
            final JsonNode v = p.get(f.compact());
            if (v == null) {
                continue;
            }
            if (f.verbose().equals(AbbreviationTable.ARGUMENTS) && v.isArray()) {
                final ArrayNode args = payload.putArray(f.verbose());
                for (JsonNode arg : v) {
                    final ObjectNode argument = args.addObject();
                    putFields(object(arg, "argument"), AbbreviationTable.ARGUMENT_FIELDS, argument);
                }
            } else {
                payload.set(f.verbose(), decodeValue(f, v));
            }
        }
        return e;
    }

    private static void meta(ObjectNode compact, ObjectNode meta, ObjectNode map) throws DecodeException {
        putFields(compact, AbbreviationTable.META_FIELDS, meta);
        final ArrayNode errors = meta.putArray("errors");
        final JsonNode er = compact.get(K_ERRORS);
        if (er != null && !er.isNull()) {
            for (JsonNode e : row(er, -1, "errors")) {
                putFields(object(e, "error"), AbbreviationTable.ERROR_FIELDS, errors.addObject());
            }
        }

        final JsonNode st = compact.get(K_STATISTICS);
        if (st == null || st.isNull()) {
            return;
        }
        final ObjectNode stats = map.putObject("statistics");
        putFields(object(st, K_STATISTICS), AbbreviationTable.STATISTICS_FIELDS, stats);
        final JsonNode ek = st.get(K_EDGES_BY_KIND);
        if (ek != null && !ek.isNull()) {
            final ObjectNode byKind = stats.putObject("edges_by_kind");
            final Iterator<Map.Entry<String, JsonNode>> it = object(ek, K_EDGES_BY_KIND).fields();
            while (it.hasNext()) {
                final Map.Entry<String, JsonNode> e = it.next();
                byKind.set(AbbreviationTable.EDGE_KINDS.decode(e.getKey()), e.getValue().deepCopy());
            }
        }
    }

    private static void putFields(ObjectNode from, List<Field> fields, ObjectNode to) throws DecodeException {
        for (Field f : fields) {
            final JsonNode v = from.get(f.compact());
            if (v != null) {
                to.set(f.verbose(), decodeValue(f, v));
            }
        }
    }

    private static JsonNode decodeValue(Field f, JsonNode v) throws DecodeException {
        if (f.codes() != null && v.isTextual()) {
            return JSON.textNode(f.codes().decode(v.asText()));
        }
        return v.deepCopy();
    }

    // --- shape checks ---

    private static String fqn(Map<Integer, String> index, JsonNode id) throws DecodeException {
        final int key = integer(id, "id");
        final String fqn = index.get(key);
        if (fqn == null) {
            throw new DecodeException("id " + key + " is not in the index");
        }
        return fqn;
    }

    private static ObjectNode object(JsonNode n, String what) throws DecodeException {
        if (!(n instanceof ObjectNode o)) {
            throw new DecodeException(what + " must be an object");
        }
        return o;
    }

    private static ArrayNode array(JsonNode parent, String key) throws DecodeException {
        final JsonNode n = parent.get(key);
        if (n == null || n.isNull()) {
            return JSON.arrayNode();
        }
        return row(n, -1, key);
    }

    /** The node as an array, of exactly {@code size} elements unless size is negative. */
    private static ArrayNode row(JsonNode n, int size, String what) throws DecodeException {
        if (!(n instanceof ArrayNode a)) {
            throw new DecodeException(what + " must be an array");
        }
        if (size >= 0 && a.size() != size) {
            throw new DecodeException(what + " must have " + size + " elements, got " + a.size());
        }
        return a;
    }

    private static int integer(JsonNode n, String what) throws DecodeException {
        if (n == null || !n.isInt()) {
            throw new DecodeException(what + " must be an integer");
        }
        return n.intValue();
    }

    private static String text(JsonNode n, String what) throws DecodeException {
        if (n == null || !n.isTextual()) {
            throw new DecodeException(what + " must be a string");
        }
        return n.asText();
    }
}
