package ai.mapper.io;

import ai.mapper.graph.AnalysisResult;
import ai.mapper.graph.SymbolRegistry;
import ai.mapper.model.AttributePayload;
import ai.mapper.model.CallArgument;
import ai.mapper.model.CallPayload;
import ai.mapper.model.Component;
import ai.mapper.model.CriticalPath;
import ai.mapper.model.Crossroad;
import ai.mapper.model.EdgeKind;
import ai.mapper.model.FileError;
import ai.mapper.model.ImportPayload;
import ai.mapper.model.InheritPayload;
import ai.mapper.model.IntegrationEdge;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Renders an analysis as the full nested JSON tree: metadata, the codebase hierarchy with each
 * component's outgoing edges, and the global integration map. Nothing is abbreviated or omitted.
 */
public final class VerboseFormatter {

    public static final String STAR_ITEMS = "*";

    private static final JsonNodeFactory JSON = JsonNodeFactory.instance;

    public ObjectNode format(AnalysisResult result, String generatedAt) {
        Objects.requireNonNull(result, "result");
        Objects.requireNonNull(generatedAt, "generatedAt");
        final SymbolRegistry registry = result.registry();

        final Map<Integer, List<IntegrationEdge>> bySource = new HashMap<>();
        for (IntegrationEdge e : result.edges()) {
            bySource.computeIfAbsent(e.sourceId(), k -> new ArrayList<>()).add(e);
        }

        final ObjectNode root = JSON.objectNode();
        root.set("metadata", metadata(result, generatedAt));

        final ObjectNode tree = root.putObject("codebase_tree");
        for (Component c : registry.roots()) {
            tree.set(c.name(), node(c, registry, bySource));
        }

        final ObjectNode map = root.putObject("global_integration_map");
        final ArrayNode crossroads = map.putArray("crossroads");
        for (Crossroad c : result.crossroads()) {
            final ObjectNode n = crossroads.addObject();
            n.put("id", c.id());
            final ArrayNode components = n.putArray("components");
            for (Integer id : c.componentIds()) {
                components.add(registry.fqnOf(id));
            }
            n.put("edge_count", c.edgeCount());
            n.put("criticality", c.criticality().label());
            final ArrayNode kinds = n.putArray("interaction_kinds");
            for (EdgeKind k : c.interactionKinds()) {
                kinds.add(k.label());
            }
        }
        final ArrayNode paths = map.putArray("critical_paths");
        for (CriticalPath p : result.criticalPaths()) {
            final ObjectNode n = paths.addObject();
            n.put("id", p.id());
            n.put("entry_point", registry.fqnOf(p.entryComponentId()));
            n.put("caller_count", p.callerCount());
            n.put("call_count", p.callCount());
            n.put("complexity", p.complexity().label());
        }
        map.set("statistics", statistics(result));
        return root;
    }

    private static ObjectNode metadata(AnalysisResult result, String generatedAt) {
        final ObjectNode meta = JSON.objectNode();
        meta.put("generated_at", generatedAt);
        meta.put("files_total", result.filesTotal());
        meta.put("files_analyzed", result.filesAnalyzed());
        meta.put("files_failed", result.filesFailed());
        meta.put("components_found", result.registry().size());
        meta.put("total_integration_points", result.edges().size());
        meta.put("total_crossroads", result.crossroads().size());
        meta.put("boundary_depth", result.settings().boundaryDepth());
        final ArrayNode errors = meta.putArray("errors");
        for (FileError e : result.errors()) {
            final ObjectNode n = errors.addObject();
            n.put("path", e.path());
            n.put("line", e.line());
            n.put("message", e.message());
        }
        return meta;
    }

    private static ObjectNode statistics(AnalysisResult result) {
        final Map<EdgeKind, Integer> byKind = new EnumMap<>(EdgeKind.class);
        int unresolved = 0;
        for (IntegrationEdge e : result.edges()) {
            byKind.merge(e.kind(), 1, Integer::sum);
            if (!e.isResolved()) {
                unresolved++;
            }
        }
        final ObjectNode stats = JSON.objectNode();
        stats.put("total_components", result.registry().size());
        stats.put("total_integration_points", result.edges().size());
        stats.put("unresolved_integration_points", unresolved);
        final ObjectNode kinds = stats.putObject("edges_by_kind");
        for (EdgeKind k : EdgeKind.values()) {
            kinds.put(k.label(), byKind.getOrDefault(k, 0));
        }
        return stats;
    }

    private static ObjectNode node(Component c, SymbolRegistry registry, Map<Integer, List<IntegrationEdge>> bySource) {
        final ObjectNode n = JSON.objectNode();
        n.put("id", c.id());
        n.put("fqn", c.fqn());
        n.put("name", c.name());
        n.put("kind", c.kind().label());
        n.put("path", c.path());
        n.putArray("line_range").add(c.span().startLine()).add(c.span().endLine());
        n.put("docstring", c.docstring());
        strings(n.putArray("bases"), c.declaredBases());
        strings(n.putArray("parameters"), c.parameters());
        strings(n.putArray("history"), c.history());

        final ArrayNode integrations = n.putArray("integrations");
        for (IntegrationEdge e : bySource.getOrDefault(c.id(), List.of())) {
            integrations.add(edge(e, registry));
        }

        final ObjectNode children = n.putObject("children");
        for (Integer childId : registry.childrenOf(c.id())) {
            final Component child = registry.component(childId);
            children.set(child.name(), node(child, registry, bySource));
        }
        return n;
    }

    static ObjectNode edge(IntegrationEdge e, SymbolRegistry registry) {
        final ObjectNode n = JSON.objectNode();
        n.put("kind", e.kind().label());
        n.put("line", e.line());
        n.put("source", registry.fqnOf(e.sourceId()));
        n.put("target", registry.fqnOf(e.targetId()));
        n.put("resolution", e.resolution().label());
        n.put("target_name", e.targetName());

        final ObjectNode p = n.putObject("payload");
        switch (e.kind()) {
            case IMPORT -> {
                final ImportPayload imp = (ImportPayload) e.payload();
                p.put("module", imp.module());
                if (imp.star()) {
                    p.put("items", STAR_ITEMS);
                } else {
                    strings(p.putArray("items"), imp.items());
                }
                p.put("star", imp.star());
                p.put("alias", imp.alias());
                p.put("binding", imp.binding() != null ? imp.binding().label() : null);
                p.put("level", imp.level());
                p.put("note", imp.note());
                p.put("expression", imp.expression());
            }
            case CALL -> {
                final CallPayload call = (CallPayload) e.payload();
                p.put("callee", call.callee());
                final ArrayNode args = p.putArray("arguments");
                for (CallArgument a : call.arguments()) {
                    final ObjectNode arg = args.addObject();
                    arg.put("name", a.name());
                    arg.put("value", a.value());
                    arg.put("type", a.type());
                    arg.put("keyword", a.keyword());
                }
                p.put("return_captured", call.returnCaptured());
                p.put("return_var", call.returnVar());
                p.put("data_flow", call.dataFlow());
                p.put("hop", call.hop());
            }
            case ATTR_READ, ATTR_WRITE -> {
                final AttributePayload attr = (AttributePayload) e.payload();
                p.put("attribute", attr.attribute());
                p.put("expression", attr.expression());
                p.put("owner", attr.owner());
                p.put("hop", attr.hop());
            }
            case INHERIT -> {
                final InheritPayload inherit = (InheritPayload) e.payload();
                p.put("base", inherit.base());
                strings(p.putArray("overridden_methods"), inherit.overriddenMethods());
            }
        }
        return n;
    }

    private static void strings(ArrayNode array, List<String> values) {
        for (String v : values) {
            array.add(v);
        }
    }
}
