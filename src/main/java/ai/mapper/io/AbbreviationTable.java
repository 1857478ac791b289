package ai.mapper.io;

import ai.mapper.model.AliasKind;
import ai.mapper.model.ComponentKind;
import ai.mapper.model.Criticality;
import ai.mapper.model.EdgeKind;
import ai.mapper.model.Resolution;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.TextNode;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Fixed key and value abbreviations of the compact format. Any change here must bump
 * {@link #VERSION}: decoders reject payloads written with another table.
 */
public final class AbbreviationTable {

    public static final String VERSION = "2.0";

    // top level
    static final String K_VERSION = "v";
    static final String K_META = "meta";
    static final String K_INDEX = "idx";
    static final String K_COMPONENTS = "cmp";
    static final String K_CROSSROADS = "crd";
    static final String K_CRITICAL_PATHS = "cp";

    // meta
    static final String K_ERRORS = "er";
    static final String K_STATISTICS = "st";
    static final String K_EDGES_BY_KIND = "ek";

    // component
    static final String K_ID = "i";
    static final String K_KIND = "k";
    static final String K_PARENT = "p";
    static final String K_NAME = "n";
    static final String K_EDGES = "e";

    // edge extras, stored inside the edge payload object
    static final String K_RESOLUTION = "rs";
    static final String K_TARGET_NAME = "tn";

    /**
     * One optional field: its verbose key, its compact key, the value it takes when absent and,
     * for enumerated values, their codes.
     */
    public record Field(String verbose, String compact, JsonNode empty, Codes codes) {

        /** A fresh copy of the empty value, safe to attach to a tree. */
        JsonNode emptyCopy() {
            return empty.deepCopy();
        }
    }

    /** Two-way label to code map for one enumerated value set. */
    public static final class Codes {
        private final String what;
        private final Map<String, String> codes = new HashMap<>();
        private final Map<String, String> labels = new HashMap<>();

        Codes(String what, String... labelCodePairs) {
            this.what = what;
            for (int i = 0; i < labelCodePairs.length; i += 2) {
                codes.put(labelCodePairs[i], labelCodePairs[i + 1]);
                labels.put(labelCodePairs[i + 1], labelCodePairs[i]);
            }
        }

        public String encode(String label) {
            final String code = codes.get(label);
            if (code == null) {
                throw new IllegalArgumentException("unknown " + what + ": " + label);
            }
            return code;
        }

        public String decode(String code) throws DecodeException {
            final String label = labels.get(code);
            if (label == null) {
                throw new DecodeException("unknown " + what + " code: " + code);
            }
            return label;
        }
    }

    public static final Codes COMPONENT_KINDS = new Codes("component kind",
            ComponentKind.PACKAGE.label(), "pk",
            ComponentKind.MODULE.label(), "mo",
            ComponentKind.CLASS.label(), "c",
            ComponentKind.FUNCTION.label(), "f",
            ComponentKind.METHOD.label(), "m",
            ComponentKind.ATTRIBUTE.label(), "a");

    public static final Codes EDGE_KINDS = new Codes("edge kind",
            EdgeKind.IMPORT.label(), "im",
            EdgeKind.CALL.label(), "c",
            EdgeKind.ATTR_READ.label(), "ar",
            EdgeKind.ATTR_WRITE.label(), "aw",
            EdgeKind.INHERIT.label(), "in");

    public static final Codes RESOLUTIONS = new Codes("resolution",
            Resolution.RESOLVED.label(), "r",
            Resolution.EXTERNAL.label(), "ex",
            Resolution.BUILTIN.label(), "bi",
            Resolution.DYNAMIC.label(), "dy",
            Resolution.UNKNOWN.label(), "un");

    public static final Codes CRITICALITIES = new Codes("criticality",
            Criticality.HIGH.label(), "h",
            Criticality.MEDIUM.label(), "m",
            Criticality.LOW.label(), "l");

    public static final Codes BINDINGS = new Codes("import binding",
            AliasKind.IMPORT.label(), "i",
            AliasKind.IMPORT_AS.label(), "ia",
            AliasKind.RELATIVE_IMPORT.label(), "ri",
            AliasKind.STAR_IMPORT.label(), "si");

    private static final JsonNode NULL = NullNode.getInstance();
    private static final JsonNode FALSE = BooleanNode.FALSE;
    private static final JsonNode ZERO = IntNode.valueOf(0);
    private static final JsonNode NONE = JsonNodeFactory.instance.arrayNode();
    private static final JsonNode SYNTHETIC_SPAN = JsonNodeFactory.instance.arrayNode().add(1).add(1);

    public static final List<Field> META_FIELDS = List.of(
            new Field("generated_at", "g", NULL, null),
            new Field("files_total", "ft", ZERO, null),
            new Field("files_analyzed", "fa", ZERO, null),
            new Field("files_failed", "ff", ZERO, null),
            new Field("components_found", "cf", ZERO, null),
            new Field("total_integration_points", "ti", ZERO, null),
            new Field("total_crossroads", "tc", ZERO, null),
            new Field("boundary_depth", "bd", ZERO, null));

    public static final List<Field> ERROR_FIELDS = List.of(
            new Field("path", "p", NULL, null),
            new Field("line", "l", ZERO, null),
            new Field("message", "m", NULL, null));

    public static final List<Field> STATISTICS_FIELDS = List.of(
            new Field("total_components", "tc", ZERO, null),
            new Field("total_integration_points", "ti", ZERO, null),
            new Field("unresolved_integration_points", "ui", ZERO, null));

    public static final List<Field> NODE_FIELDS = List.of(
            new Field("path", "f", NULL, null),
            new Field("line_range", "r", SYNTHETIC_SPAN, null),
            new Field("docstring", "d", NULL, null),
            new Field("bases", "b", NONE, null),
            new Field("parameters", "a", NONE, null),
            new Field("history", "h", NONE, null));

    public static final Field RESOLUTION = new Field("resolution", K_RESOLUTION,
            TextNode.valueOf(Resolution.RESOLVED.label()), RESOLUTIONS);

    public static final List<Field> ARGUMENT_FIELDS = List.of(
            new Field("name", "n", NULL, null),
            new Field("value", "v", NULL, null),
            new Field("type", "t", NULL, null),
            new Field("keyword", "k", NULL, null));

    /** Field that holds the call arguments; its elements use {@link #ARGUMENT_FIELDS}. */
    public static final String ARGUMENTS = "arguments";

    private static final Map<EdgeKind, List<Field>> PAYLOAD_FIELDS = new EnumMap<>(EdgeKind.class);

    static {
        final List<Field> attribute = List.of(
                new Field("attribute", "at", NULL, null),
                new Field("expression", "x", NULL, null),
                new Field("owner", "ow", NULL, null),
                new Field("hop", "hp", ZERO, null));
        PAYLOAD_FIELDS.put(EdgeKind.IMPORT, List.of(
                new Field("module", "mo", NULL, null),
                new Field("items", "it", NONE, null),
                new Field("star", "s", FALSE, null),
                new Field("alias", "al", NULL, null),
                new Field("binding", "bi", NULL, BINDINGS),
                new Field("level", "lv", ZERO, null),
                new Field("note", "nt", NULL, null),
                new Field("expression", "x", NULL, null)));
        PAYLOAD_FIELDS.put(EdgeKind.CALL, List.of(
                new Field("callee", "ce", NULL, null),
                new Field(ARGUMENTS, "ar", NONE, null),
                new Field("return_captured", "rc", FALSE, null),
                new Field("return_var", "rv", NULL, null),
                new Field("data_flow", "df", NULL, null),
                new Field("hop", "hp", ZERO, null)));
        PAYLOAD_FIELDS.put(EdgeKind.ATTR_READ, attribute);
        PAYLOAD_FIELDS.put(EdgeKind.ATTR_WRITE, attribute);
        PAYLOAD_FIELDS.put(EdgeKind.INHERIT, List.of(
                new Field("base", "ba", NULL, null),
                new Field("overridden_methods", "om", NONE, null)));
    }

    private AbbreviationTable() {
    }

    public static List<Field> payloadFields(EdgeKind kind) {
        return PAYLOAD_FIELDS.get(kind);
    }
}
