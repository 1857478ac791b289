package ai.mapper.io;

import ai.mapper.graph.AnalysisResult;
import ai.mapper.graph.SymbolRegistry;
import ai.mapper.io.AbbreviationTable.Field;
import ai.mapper.model.EdgeKind;
import ai.mapper.model.Fqns;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

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
 * Token-minimised form of the verbose payload:
 * - every FQN interned once in {@code idx}, referenced by id everywhere else
 * - components flattened in pre-order with parent pointers
 * - edges as fixed-position arrays, payloads holding only non-empty fields
 * - keys and enumerated values abbreviated through {@link AbbreviationTable}
 * Works on the verbose tree alone, so {@link CompactDecoder} can invert it exactly.
 */
public final class CompactFormatter {

    private static final JsonNodeFactory JSON = JsonNodeFactory.instance;

    private static final Set<String> TOP_KEYS = Set.of("metadata", "codebase_tree", "global_integration_map");
    private static final Set<String> NODE_KEYS = Set.of("id", "fqn", "name", "kind", "path", "line_range",
            "docstring", "bases", "parameters", "history", "integrations", "children");
    private static final Set<String> MAP_KEYS = Set.of("crossroads", "critical_paths", "statistics");
    private static final Set<String> EDGE_KEYS = Set.of("kind", "line", "source", "target", "resolution",
            "target_name", "payload");

    private final VerboseFormatter verbose = new VerboseFormatter();

    public ObjectNode format(AnalysisResult result, String generatedAt) {
        return encode(verbose.format(result, generatedAt));
    }

    public ObjectNode encode(ObjectNode verbose) {
        Objects.requireNonNull(verbose, "verbose");
        checkKeys(verbose, TOP_KEYS, "payload");
        final ObjectNode tree = requireObject(verbose, "codebase_tree");
        final ObjectNode meta = optionalObject(verbose, "metadata");
        final ObjectNode map = optionalObject(verbose, "global_integration_map");
        if (map != null) {
            checkKeys(map, MAP_KEYS, "global_integration_map");
        }

        final Index index = new Index();
        collectIds(tree, index);

        final ObjectNode out = JSON.objectNode();
        out.put(K_VERSION, AbbreviationTable.VERSION);
        final ObjectNode compactMeta = out.putObject(K_META);
        final ObjectNode idx = out.putObject(K_INDEX);
        final ArrayNode cmp = out.putArray(K_COMPONENTS);

        final Iterator<Map.Entry<String, JsonNode>> roots = tree.fields();
        while (roots.hasNext()) {
            component(asObject(roots.next().getValue(), "component"), null, cmp, index);
        }

        meta(meta, optionalObject(map, "statistics"), compactMeta);
        crossroads(optionalArray(map, "crossroads"), out.putArray(K_CROSSROADS), index);
        criticalPaths(optionalArray(map, "critical_paths"), out.putArray(K_CRITICAL_PATHS), index);

        for (Map.Entry<Integer, String> e : index.byId.entrySet()) {
            idx.put(String.valueOf(e.getKey()), e.getValue());
        }
        return out;
    }

    // --- ids ---

    /** FQN interning: node ids come from the tree, anything else gets a fresh id above them. */
    private static final class Index {
        final Map<String, Integer> byFqn = new HashMap<>();
        final Map<Integer, String> byId = new TreeMap<>();
        int max;

        void register(int id, String fqn) {
            if (id <= 0) {
                throw new IllegalArgumentException("component id must be positive: " + id + " (" + fqn + ")");
            }
            final String known = byId.get(id);
            if (known != null && !known.equals(fqn)) {
                throw new IllegalArgumentException("id " + id + " used by both " + known + " and " + fqn);
            }
            if (byFqn.containsKey(fqn) && byFqn.get(fqn) != id) {
                throw new IllegalArgumentException(fqn + " has two ids: " + byFqn.get(fqn) + " and " + id);
            }
            byFqn.put(fqn, id);
            byId.put(id, fqn);
            max = Math.max(max, id);
        }

        int idOf(String fqn) {
            if (SymbolRegistry.UNRESOLVED_FQN.equals(fqn)) {
                byId.put(0, fqn);
                return 0;
            }
            final Integer id = byFqn.get(fqn);
            if (id != null) {
                return id;
            }
            final int fresh = ++max;
            byFqn.put(fqn, fresh);
            byId.put(fresh, fqn);
            return fresh;
        }
    }

    private static void collectIds(ObjectNode children, Index index) {
        final Iterator<Map.Entry<String, JsonNode>> it = children.fields();
        while (it.hasNext()) {
            final ObjectNode node = asObject(it.next().getValue(), "component");
            index.register(requireInt(node, "id"), requireText(node, "fqn"));
            final JsonNode grandChildren = node.get("children");
            if (grandChildren != null && !grandChildren.isNull()) {
                collectIds(asObject(grandChildren, "children"), index);
            }
        }
    }

    // --- components and edges ---

    private static void component(ObjectNode node, Integer parentId, ArrayNode cmp, Index index) {
        checkKeys(node, NODE_KEYS, "component");
        final String fqn = requireText(node, "fqn");
        final int id = requireInt(node, "id");

        final ObjectNode c = cmp.addObject();
        c.put(K_ID, id);
        c.put(K_KIND, AbbreviationTable.COMPONENT_KINDS.encode(requireText(node, "kind")));
        if (parentId != null) {
            c.put(K_PARENT, parentId);
        }
        final JsonNode name = node.get("name");
        if (name != null && !name.asText().equals(Fqns.simpleName(fqn))) {
            c.set(K_NAME, name.deepCopy());
        }
        putFields(node, AbbreviationTable.NODE_FIELDS, c);

        final ArrayNode integrations = optionalArray(node, "integrations");
        if (integrations != null && !integrations.isEmpty()) {
            final ArrayNode edges = c.putArray(K_EDGES);
            for (JsonNode e : integrations) {
                edges.add(edge(asObject(e, "edge"), fqn, index));
            }
        }

        final ObjectNode children = optionalObject(node, "children");
        if (children != null) {
            final Iterator<Map.Entry<String, JsonNode>> it = children.fields();
            while (it.hasNext()) {
                component(asObject(it.next().getValue(), "component"), id, cmp, index);
            }
        }
    }

    private static ArrayNode edge(ObjectNode edge, String ownerFqn, Index index) {
        checkKeys(edge, EDGE_KEYS, "edge");
        final String kindLabel = requireText(edge, "kind");
        final EdgeKind kind = EdgeKind.fromLabel(kindLabel);
        final String source = edge.hasNonNull("source") ? edge.get("source").asText() : ownerFqn;
        final String target = requireText(edge, "target");

        final ArrayNode a = JSON.arrayNode();
        a.add(index.idOf(source));
        a.add(index.idOf(target));
        a.add(AbbreviationTable.EDGE_KINDS.encode(kindLabel));
        a.add(edge.path("line").asInt(0));

        final ObjectNode p = JSON.objectNode();
        putFields(edge, List.of(AbbreviationTable.RESOLUTION), p);
        final JsonNode targetName = edge.has("target_name") ? edge.get("target_name")
                : Canonicalizer.impliedTargetName(target);
        if (!targetName.equals(Canonicalizer.impliedTargetName(target))) {
            p.set(K_TARGET_NAME, targetName.deepCopy());
        }
        final ObjectNode payload = optionalObject(edge, "payload");
        if (payload != null) {
            final List<Field> fields = AbbreviationTable.payloadFields(kind);
            checkKeys(payload, fieldNames(fields), kindLabel + " payload");
            for (Field f : fields) {
                final JsonNode v = payload.get(f.verbose());
                if (v == null || v.equals(f.empty())) {
                    continue;
                }
                if (f.verbose().equals(AbbreviationTable.ARGUMENTS) && v.isArray()) {
                    final ArrayNode args = p.putArray(f.compact());
                    for (JsonNode arg : v) {
                        final ObjectNode argument = asObject(arg, "argument");
                        checkKeys(argument, fieldNames(AbbreviationTable.ARGUMENT_FIELDS), "argument");
                        final ObjectNode compactArg = args.addObject();
                        putFields(argument, AbbreviationTable.ARGUMENT_FIELDS, compactArg);
                    }
                } else {
                    p.set(f.compact(), encodeValue(f, v));
                }
            }
        }
        if (!p.isEmpty()) {
            a.add(p);
        }
        return a;
    }

    private static void putFields(ObjectNode from, List<Field> fields, ObjectNode to) {
        for (Field f : fields) {
            final JsonNode v = from.get(f.verbose());
            if (v != null && !v.equals(f.empty())) {
                to.set(f.compact(), encodeValue(f, v));
            }
        }
    }

    private static JsonNode encodeValue(Field f, JsonNode v) {
        if (f.codes() != null && v.isTextual()) {
            return JSON.textNode(f.codes().encode(v.asText()));
        }
        return v.deepCopy();
    }

    // --- meta, crossroads, critical paths ---

    private static void meta(ObjectNode meta, ObjectNode stats, ObjectNode out) {
        if (meta != null) {
            final Set<String> allowed = fieldNames(AbbreviationTable.META_FIELDS);
            allowed.add("errors");
            checkKeys(meta, allowed, "metadata");
            putFields(meta, AbbreviationTable.META_FIELDS, out);
            final ArrayNode errors = optionalArray(meta, "errors");
            if (errors != null && !errors.isEmpty()) {
                final ArrayNode er = out.putArray(K_ERRORS);
                for (JsonNode e : errors) {
                    final ObjectNode error = asObject(e, "error");
                    checkKeys(error, fieldNames(AbbreviationTable.ERROR_FIELDS), "error");
                    putFields(error, AbbreviationTable.ERROR_FIELDS, er.addObject());
                }
            }
        }
        if (stats != null) {
            final Set<String> allowed = fieldNames(AbbreviationTable.STATISTICS_FIELDS);
            allowed.add("edges_by_kind");
            checkKeys(stats, allowed, "statistics");
            final ObjectNode st = out.putObject(K_STATISTICS);
            putFields(stats, AbbreviationTable.STATISTICS_FIELDS, st);
            final ObjectNode byKind = optionalObject(stats, "edges_by_kind");
            if (byKind != null) {
                final ObjectNode ek = st.putObject(K_EDGES_BY_KIND);
                final Iterator<Map.Entry<String, JsonNode>> it = byKind.fields();
                while (it.hasNext()) {
                    final Map.Entry<String, JsonNode> e = it.next();
                    ek.set(AbbreviationTable.EDGE_KINDS.encode(e.getKey()), e.getValue().deepCopy());
                }
            }
        }
    }

    private static void crossroads(ArrayNode crossroads, ArrayNode out, Index index) {
        if (crossroads == null) {
            return;
        }
        for (JsonNode n : crossroads) {
            final ObjectNode c = asObject(n, "crossroad");
            final ArrayNode row = out.addArray();
            row.add(requireInt(c, "id"));
            final ArrayNode ids = row.addArray();
            for (JsonNode fqn : c.path("components")) {
                ids.add(index.idOf(fqn.asText()));
            }
            row.add(requireInt(c, "edge_count"));
            row.add(AbbreviationTable.CRITICALITIES.encode(requireText(c, "criticality")));
            final ArrayNode kinds = row.addArray();
            for (JsonNode k : c.path("interaction_kinds")) {
                kinds.add(AbbreviationTable.EDGE_KINDS.encode(k.asText()));
            }
        }
    }

    private static void criticalPaths(ArrayNode paths, ArrayNode out, Index index) {
        if (paths == null) {
            return;
        }
        for (JsonNode n : paths) {
            final ObjectNode p = asObject(n, "critical path");
            out.addArray()
                    .add(requireInt(p, "id"))
                    .add(index.idOf(requireText(p, "entry_point")))
                    .add(requireInt(p, "caller_count"))
                    .add(requireInt(p, "call_count"))
                    .add(AbbreviationTable.CRITICALITIES.encode(requireText(p, "complexity")));
        }
    }

    // --- shape checks ---

    private static Set<String> fieldNames(List<Field> fields) {
        final Set<String> names = new HashSet<>();
        for (Field f : fields) {
            names.add(f.verbose());
        }
        return names;
    }

    private static void checkKeys(ObjectNode node, Set<String> allowed, String what) {
        final Iterator<String> it = node.fieldNames();
        while (it.hasNext()) {
            final String key = it.next();
            if (!allowed.contains(key)) {
                throw new IllegalArgumentException("unexpected key '" + key + "' in " + what);
            }
        }
    }

    private static ObjectNode asObject(JsonNode n, String what) {
        if (!(n instanceof ObjectNode o)) {
            throw new IllegalArgumentException(what + " must be an object");
        }
        return o;
    }

    private static ObjectNode requireObject(ObjectNode parent, String key) {
        return asObject(parent.get(key), key);
    }

    private static ObjectNode optionalObject(ObjectNode parent, String key) {
        if (parent == null) {
            return null;
        }
        final JsonNode n = parent.get(key);
        return n == null || n.isNull() ? null : asObject(n, key);
    }

    private static ArrayNode optionalArray(ObjectNode parent, String key) {
        if (parent == null) {
            return null;
        }
        final JsonNode n = parent.get(key);
        if (n == null || n.isNull()) {
            return null;
        }
        if (!(n instanceof ArrayNode a)) {
            throw new IllegalArgumentException(key + " must be an array");
        }
        return a;
    }

    private static int requireInt(ObjectNode node, String key) {
        final JsonNode n = node.get(key);
        if (n == null || !n.isInt()) {
            throw new IllegalArgumentException("'" + key + "' must be an integer");
        }
        return n.intValue();
    }

    private static String requireText(ObjectNode node, String key) {
        final JsonNode n = node.get(key);
        if (n == null || !n.isTextual()) {
            throw new IllegalArgumentException("'" + key + "' must be a string");
        }
        return n.asText();
    }
}
