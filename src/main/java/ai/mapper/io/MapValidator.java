package ai.mapper.io;

import static ai.mapper.io.AbbreviationTable.K_COMPONENTS;
import static ai.mapper.io.AbbreviationTable.K_CRITICAL_PATHS;
import static ai.mapper.io.AbbreviationTable.K_CROSSROADS;
import static ai.mapper.io.AbbreviationTable.K_EDGES;
import static ai.mapper.io.AbbreviationTable.K_ID;
import static ai.mapper.io.AbbreviationTable.K_INDEX;
import static ai.mapper.io.AbbreviationTable.K_PARENT;
import static ai.mapper.io.AbbreviationTable.K_VERSION;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import com.fasterxml.jackson.databind.JsonNode;

import ai.mapper.graph.SymbolRegistry;

/**
 * Structural checks on a finished map before it is written:
 * - every required section is present
 * - no FQN or id is referenced without being declared
 * Problems are collected rather than thrown one at a time.
 */
public final class MapValidator {

    private static final List<String> VERBOSE_SECTIONS = List.of("metadata", "codebase_tree", "global_integration_map");
    private static final List<String> COMPACT_SECTIONS = List.of(K_VERSION, K_INDEX, K_COMPONENTS);

    public List<String> validateVerbose(JsonNode map) {
        Objects.requireNonNull(map, "map");
        final List<String> problems = new ArrayList<>();
        if (!sections(map, VERBOSE_SECTIONS, problems)) {
            return problems;
        }

        // Step 1: declared components
        final Set<String> declared = new HashSet<>();
        final List<JsonNode> edges = new ArrayList<>();
        collect(map.get("codebase_tree"), declared, edges, problems);

        // Step 2: edge endpoints
        for (JsonNode e : edges) {
            final String source = e.path("source").asText(null);
            final String target = e.path("target").asText(null);
            if (source == null || !declared.contains(source)) {
                problems.add("integration at line " + e.path("line").asInt() + " has undeclared source: " + source);
            }
            if (target == null || (!declared.contains(target) && !SymbolRegistry.UNRESOLVED_FQN.equals(target))) {
                problems.add("integration from " + source + " has undeclared target: " + target);
            }
        }

        // Step 3: global map references
        final JsonNode global = map.get("global_integration_map");
        for (JsonNode c : global.path("crossroads")) {
            for (JsonNode fqn : c.path("components")) {
                if (!declared.contains(fqn.asText())) {
                    problems.add("crossroad " + c.path("id").asInt() + " names undeclared component: " + fqn.asText());
                }
            }
        }
        for (JsonNode p : global.path("critical_paths")) {
            final String entry = p.path("entry_point").asText(null);
            if (entry == null || !declared.contains(entry)) {
                problems.add("critical path " + p.path("id").asInt() + " has undeclared entry point: " + entry);
            }
        }
        return problems;
    }

    public List<String> validateCompact(JsonNode map) {
        Objects.requireNonNull(map, "map");
        final List<String> problems = new ArrayList<>();
        if (!sections(map, COMPACT_SECTIONS, problems)) {
            return problems;
        }
        if (!AbbreviationTable.VERSION.equals(map.get(K_VERSION).asText())) {
            problems.add("unsupported format version: " + map.get(K_VERSION).asText());
        }

        final Set<Integer> indexed = new HashSet<>();
        final Iterator<Map.Entry<String, JsonNode>> fields = map.get(K_INDEX).fields();
        while (fields.hasNext()) {
            final String key = fields.next().getKey();
            try {
                indexed.add(Integer.parseInt(key));
            } catch (NumberFormatException ex) {
                problems.add("index key is not an id: " + key);
            }
        }

        for (JsonNode c : map.get(K_COMPONENTS)) {
            referenced(c.get(K_ID), "component", indexed, problems);
            if (c.has(K_PARENT)) {
                referenced(c.get(K_PARENT), "parent", indexed, problems);
            }
            for (JsonNode e : c.path(K_EDGES)) {
                if (!e.isArray() || e.size() < 4) {
                    problems.add("edge is not a positional row: " + e);
                    continue;
                }
                referenced(e.get(0), "edge source", indexed, problems);
                referenced(e.get(1), "edge target", indexed, problems);
            }
        }
        for (JsonNode row : map.path(K_CROSSROADS)) {
            for (JsonNode id : row.path(1)) {
                referenced(id, "crossroad component", indexed, problems);
            }
        }
        for (JsonNode row : map.path(K_CRITICAL_PATHS)) {
            referenced(row.get(1), "critical path entry", indexed, problems);
        }
        return problems;
    }

    /** Throws when the map has any problem; the message lists the first few. */
    public void requireValid(JsonNode map, boolean compact) throws InvalidMapException {
        final List<String> problems = compact ? validateCompact(map) : validateVerbose(map);
        if (!problems.isEmpty()) {
            throw new InvalidMapException(problems);
        }
    }

    private static boolean sections(JsonNode map, List<String> required, List<String> problems) {
        if (!map.isObject()) {
            problems.add("map is not a JSON object");
            return false;
        }
        for (String section : required) {
            if (!map.has(section)) {
                problems.add("missing section: " + section);
            }
        }
        return problems.isEmpty();
    }

    private static void collect(JsonNode children, Set<String> declared, List<JsonNode> edges, List<String> problems) {
        for (JsonNode node : children) {
            final JsonNode fqn = node.get("fqn");
            if (fqn == null || !fqn.isTextual()) {
                problems.add("component without fqn: " + node.path("name").asText("?"));
            } else if (!declared.add(fqn.asText())) {
                problems.add("component declared twice: " + fqn.asText());
            }
            node.path("integrations").forEach(edges::add);
            collect(node.path("children"), declared, edges, problems);
        }
    }

    private static void referenced(JsonNode id, String role, Set<Integer> indexed, List<String> problems) {
        if (id == null || !id.canConvertToInt() || !indexed.contains(id.asInt())) {
            problems.add(role + " id is not indexed: " + id);
        }
    }
}
