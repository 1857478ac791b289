package ai.mapper.syntax;

import ai.mapper.syntax.PyAst.Assign;
import ai.mapper.syntax.PyAst.Attribute;
import ai.mapper.syntax.PyAst.Block;
import ai.mapper.syntax.PyAst.Call;
import ai.mapper.syntax.PyAst.ClassDef;
import ai.mapper.syntax.PyAst.Composite;
import ai.mapper.syntax.PyAst.Comprehension;
import ai.mapper.syntax.PyAst.ComprehensionFor;
import ai.mapper.syntax.PyAst.Constant;
import ai.mapper.syntax.PyAst.Delete;
import ai.mapper.syntax.PyAst.Expr;
import ai.mapper.syntax.PyAst.ExprStmt;
import ai.mapper.syntax.PyAst.FunctionDef;
import ai.mapper.syntax.PyAst.Import;
import ai.mapper.syntax.PyAst.ImportFrom;
import ai.mapper.syntax.PyAst.ImportName;
import ai.mapper.syntax.PyAst.Keyword;
import ai.mapper.syntax.PyAst.Lambda;
import ai.mapper.syntax.PyAst.Name;
import ai.mapper.syntax.PyAst.Param;
import ai.mapper.syntax.PyAst.Return;
import ai.mapper.syntax.PyAst.Simple;
import ai.mapper.syntax.PyAst.Starred;
import ai.mapper.syntax.PyAst.Stmt;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.treesitter.TSNode;
import org.treesitter.TSParser;
import org.treesitter.TSTree;
import org.treesitter.TreeSitterPython;

/**
 * Parses Python 3 source with the tree-sitter Python grammar and maps the concrete syntax tree
 * onto the reduced {@link PyAst} shapes.
 *
 * <p>Notes:
 * <ul>
 *   <li>tree-sitter recovers from errors; any ERROR or missing node is reported as a
 *   {@link ParseException} carrying the line where it starts.</li>
 *   <li>{@link TSParser} is not thread-safe, so each thread keeps its own.</li>
 * </ul>
 */
public final class PythonParser implements ParserAdapter {

    private static final Logger log = LoggerFactory.getLogger(PythonParser.class);

    /** Node types that end a compound statement and hold its last lines. */
    private static final Set<String> NESTED = Set.of(
            "block", "else_clause", "elif_clause", "except_clause", "except_group_clause", "finally_clause",
            "case_clause", "function_definition", "class_definition", "decorated_definition");

    private static final ThreadLocal<TSParser> PARSER = ThreadLocal.withInitial(() -> {
        final TSParser parser = new TSParser();
        if (!parser.setLanguage(new TreeSitterPython())) {
            log.error("Failed to set the Python language on the tree-sitter parser");
        }
        return parser;
    });

    @Override
    public PyAst.Module parse(String source) throws ParseException {
        Objects.requireNonNull(source, "source");
        final TSTree tree = PARSER.get().parseString(null, source);
        final TSNode root = tree.getRootNode();
        if (root.isNull()) {
            throw new ParseException(1, "no syntax tree produced");
        }
        if (root.hasError()) {
            final TSNode bad = firstError(root);
            throw new ParseException(line(bad), bad.isMissing()
                    ? "missing '" + bad.getType() + "'"
                    : "invalid syntax");
        }
        return new Mapper(source.getBytes(StandardCharsets.UTF_8)).module(root);
    }

    /** The earliest ERROR or missing node below {@code node}, or {@code node} itself. */
    private static TSNode firstError(TSNode node) {
        if (node.isMissing() || "ERROR".equals(node.getType())) {
            return node;
        }
        for (int i = 0; i < node.getChildCount(); i++) {
            final TSNode child = node.getChild(i);
            if (child.hasError() || child.isMissing()) {
                return firstError(child);
            }
        }
        return node;
    }

    private static int line(TSNode node) {
        return node.getStartPoint().getRow() + 1;
    }

    /** Last line of the last statement inside {@code node}; trailing blank lines and dedents do not count. */
    private static int lastLine(TSNode node) {
        final List<TSNode> children = named(node);
        if (children.isEmpty()) {
            return endLine(node);
        }
        final TSNode last = children.get(children.size() - 1);
        if (node.getType().equals("block") || NESTED.contains(last.getType())) {
            return lastLine(last);
        }
        return endLine(node);
    }

    /** Last line covered by {@code node}, not counting a trailing newline. */
    private static int endLine(TSNode node) {
        final int row = node.getEndPoint().getRow();
        if (node.getEndPoint().getColumn() == 0 && row > node.getStartPoint().getRow()) {
            return row;
        }
        return row + 1;
    }

    private static TSNode field(TSNode node, String name) {
        final TSNode child = node.getChildByFieldName(name);
        return child == null || child.isNull() ? null : child;
    }

    /** Named children, comments excluded. */
    private static List<TSNode> named(TSNode node) {
        final List<TSNode> out = new ArrayList<>();
        for (int i = 0; i < node.getNamedChildCount(); i++) {
            final TSNode child = node.getNamedChild(i);
            if (!"comment".equals(child.getType())) {
                out.add(child);
            }
        }
        return out;
    }

    private static boolean hasToken(TSNode node, String token) {
        for (int i = 0; i < node.getChildCount(); i++) {
            final TSNode child = node.getChild(i);
            if (!child.isNamed() && token.equals(child.getType())) {
                return true;
            }
        }
        return false;
    }

    private static String numberKind(String literal) {
        final String lower = literal.toLowerCase();
        if (lower.endsWith("j")) {
            return "complex";
        }
        if (lower.startsWith("0x") || lower.startsWith("0o") || lower.startsWith("0b")) {
            return "int";
        }
        return lower.contains(".") || lower.contains("e") ? "float" : "int";
    }

    private static String docstring(List<Stmt> body) {
        if (!body.isEmpty() && body.get(0) instanceof ExprStmt stmt
                && stmt.value() instanceof Constant constant && constant.kind().equals("str")) {
            return constant.value();
        }
        return null;
    }

    /** Maps one tree onto {@link PyAst}; node offsets are UTF-8 byte offsets. */
    private static final class Mapper {

        private final byte[] utf8;

        Mapper(byte[] utf8) {
            this.utf8 = utf8;
        }

        private String raw(TSNode node) {
            return raw(node.getStartByte(), node.getEndByte());
        }

        private String raw(int start, int end) {
            return new String(utf8, start, Math.max(0, end - start), StandardCharsets.UTF_8);
        }

        private String text(TSNode node) {
            return raw(node).replaceAll("\\s+", " ");
        }

        // --- statements ---

        PyAst.Module module(TSNode root) {
            final List<Stmt> body = statements(root);
            return new PyAst.Module(body, docstring(body));
        }

        private List<Stmt> statements(TSNode container) {
            final List<Stmt> out = new ArrayList<>();
            if (container == null) {
                return out;
            }
            for (TSNode child : named(container)) {
                statement(child, out);
            }
            return out;
        }

        private void statement(TSNode node, List<Stmt> out) {
            final int line = line(node);
            switch (node.getType()) {
                case "function_definition" -> out.add(functionDef(node, List.of()));
                case "class_definition" -> out.add(classDef(node, List.of()));
                case "decorated_definition" -> out.add(decorated(node));
                case "import_statement" -> out.add(new Import(importNames(node, null), line));
                case "import_from_statement" -> out.add(fromImport(node));
                case "future_import_statement" -> out.add(new ImportFrom("__future__", 0,
                        importNames(node, null), line));
                case "expression_statement" -> out.add(expressionStatement(node));
                case "return_statement" -> {
                    final List<TSNode> values = named(node);
                    out.add(new Return(values.isEmpty() ? null : expr(values.get(0)), line));
                }
                case "delete_statement" -> {
                    final List<Expr> targets = new ArrayList<>();
                    for (TSNode child : named(node)) {
                        if (child.getType().equals("expression_list")) {
                            targets.addAll(exprs(named(child)));
                        } else {
                            targets.add(expr(child));
                        }
                    }
                    out.add(new Delete(targets, line));
                }
                case "pass_statement" -> out.add(new Simple("pass", List.of(), line));
                case "break_statement" -> out.add(new Simple("break", List.of(), line));
                case "continue_statement" -> out.add(new Simple("continue", List.of(), line));
                case "raise_statement" -> out.add(new Simple("raise", exprs(named(node)), line));
                case "assert_statement" -> out.add(new Simple("assert", exprs(named(node)), line));
                case "global_statement" -> out.add(new Simple("global", exprs(named(node)), line));
                case "nonlocal_statement" -> out.add(new Simple("nonlocal", exprs(named(node)), line));
                case "type_alias_statement" -> {
                    final TSNode value = field(node, "right");
                    out.add(new Simple("type", value == null ? List.of() : List.of(expr(value)), line));
                }
                case "if_statement" -> ifStatement(node, out);
                case "for_statement" -> {
                    out.add(new Block("for", List.of(expr(field(node, "right"))),
                            List.of(expr(field(node, "left"))), statements(field(node, "body")), line));
                    elseClause(field(node, "alternative"), out);
                }
                case "while_statement" -> {
                    out.add(new Block("while", List.of(expr(field(node, "condition"))), List.of(),
                            statements(field(node, "body")), line));
                    elseClause(field(node, "alternative"), out);
                }
                case "try_statement" -> tryStatement(node, out);
                case "with_statement" -> out.add(withStatement(node));
                case "match_statement" -> matchStatement(node, out);
                default -> out.add(new Simple(node.getType(), exprs(named(node)), line));
            }
        }

        private Stmt decorated(TSNode node) {
            final List<Expr> decorators = new ArrayList<>();
            for (TSNode child : named(node)) {
                if (child.getType().equals("decorator")) {
                    decorators.add(expr(named(child).get(0)));
                }
            }
            final TSNode definition = field(node, "definition");
            if (definition.getType().equals("class_definition")) {
                return classDef(definition, decorators);
            }
            return functionDef(definition, decorators);
        }

        private FunctionDef functionDef(TSNode node, List<Expr> decorators) {
            final TSNode bodyNode = field(node, "body");
            final List<Stmt> body = statements(bodyNode);
            final TSNode returns = field(node, "return_type");
            return new FunctionDef(raw(field(node, "name")), params(field(node, "parameters")), decorators,
                    returns == null ? null : expr(returns), body, docstring(body), hasToken(node, "async"),
                    line(node), lastLine(bodyNode == null ? node : bodyNode));
        }

        private ClassDef classDef(TSNode node, List<Expr> decorators) {
            final TSNode bodyNode = field(node, "body");
            final List<Stmt> body = statements(bodyNode);
            final List<Expr> bases = new ArrayList<>();
            final List<Keyword> keywords = new ArrayList<>();
            final TSNode superclasses = field(node, "superclasses");
            if (superclasses != null) {
                arguments(superclasses, bases, keywords);
            }
            return new ClassDef(raw(field(node, "name")), bases, keywords, decorators, body, docstring(body),
                    line(node), lastLine(bodyNode == null ? node : bodyNode));
        }

        private List<Param> params(TSNode node) {
            final List<Param> out = new ArrayList<>();
            if (node == null) {
                return out;
            }
            for (TSNode p : named(node)) {
                switch (p.getType()) {
                    case "identifier" -> out.add(new Param(raw(p), "", null, null));
                    case "list_splat_pattern" -> out.add(new Param(raw(named(p).get(0)), "*", null, null));
                    case "dictionary_splat_pattern" -> out.add(new Param(raw(named(p).get(0)), "**", null, null));
                    case "default_parameter" -> out.add(new Param(raw(field(p, "name")), "", null,
                            expr(field(p, "value"))));
                    case "typed_parameter" -> {
                        final TSNode target = named(p).get(0);
                        final String prefix = switch (target.getType()) {
                            case "list_splat_pattern" -> "*";
                            case "dictionary_splat_pattern" -> "**";
                            default -> "";
                        };
                        final String name = prefix.isEmpty() ? raw(target) : raw(named(target).get(0));
                        out.add(new Param(name, prefix, expr(field(p, "type")), null));
                    }
                    case "typed_default_parameter" -> out.add(new Param(raw(field(p, "name")), "",
                            expr(field(p, "type")), expr(field(p, "value"))));
                    default -> {
                        // separators and legacy tuple parameters bind nothing
                    }
                }
            }
            return out;
        }

        private List<ImportName> importNames(TSNode node, TSNode skip) {
            final List<ImportName> names = new ArrayList<>();
            for (TSNode child : named(node)) {
                if (skip != null && child.getStartByte() == skip.getStartByte()) {
                    continue;
                }
                switch (child.getType()) {
                    case "dotted_name" -> names.add(new ImportName(raw(child), null));
                    case "aliased_import" -> names.add(new ImportName(raw(field(child, "name")),
                            raw(field(child, "alias"))));
                    case "wildcard_import" -> names.add(new ImportName("*", null));
                    default -> {
                    }
                }
            }
            return names;
        }

        private Stmt fromImport(TSNode node) {
            final TSNode moduleNode = field(node, "module_name");
            String module = null;
            int level = 0;
            if (moduleNode.getType().equals("relative_import")) {
                for (TSNode part : named(moduleNode)) {
                    if (part.getType().equals("import_prefix")) {
                        level = raw(part).length();
                    } else {
                        module = raw(part);
                    }
                }
            } else {
                module = raw(moduleNode);
            }
            return new ImportFrom(module, level, importNames(node, moduleNode), line(node));
        }

        private Stmt expressionStatement(TSNode node) {
            final List<TSNode> children = named(node);
            final int line = line(node);
            if (children.size() == 1) {
                final TSNode only = children.get(0);
                if (only.getType().equals("assignment")) {
                    return assignment(only, line);
                }
                if (only.getType().equals("augmented_assignment")) {
                    return new Assign(List.of(expr(field(only, "left"))), expr(field(only, "right")), true, null,
                            line);
                }
                return new ExprStmt(expr(only), line);
            }
            return new ExprStmt(new Composite("tuple", exprs(children), text(node), line), line);
        }

        private Stmt assignment(TSNode node, int line) {
            final List<Expr> targets = new ArrayList<>();
            final TSNode type = field(node, "type");
            TSNode current = node;
            TSNode value = null;
            while (current != null) {
                targets.add(expr(field(current, "left")));
                value = field(current, "right");
                current = value != null && value.getType().equals("assignment") ? value : null;
            }
            return new Assign(targets, value == null ? null : expr(value), false,
                    type == null ? null : expr(type), line);
        }

        private void ifStatement(TSNode node, List<Stmt> out) {
            out.add(new Block("if", List.of(expr(field(node, "condition"))), List.of(),
                    statements(field(node, "consequence")), line(node)));
            for (TSNode clause : named(node)) {
                switch (clause.getType()) {
                    case "elif_clause" -> out.add(new Block("elif", List.of(expr(field(clause, "condition"))),
                            List.of(), statements(field(clause, "consequence")), line(clause)));
                    case "else_clause" -> elseClause(clause, out);
                    default -> {
                    }
                }
            }
        }

        private void elseClause(TSNode clause, List<Stmt> out) {
            if (clause != null) {
                out.add(new Block("else", List.of(), List.of(), statements(field(clause, "body")), line(clause)));
            }
        }

        private void tryStatement(TSNode node, List<Stmt> out) {
            out.add(new Block("try", List.of(), List.of(), statements(field(node, "body")), line(node)));
            for (TSNode clause : named(node)) {
                switch (clause.getType()) {
                    case "except_clause", "except_group_clause" -> exceptClause(clause, out);
                    case "else_clause" -> elseClause(clause, out);
                    case "finally_clause" -> out.add(new Block("finally", List.of(), List.of(),
                            statements(lastBlock(clause)), line(clause)));
                    default -> {
                    }
                }
            }
        }

        private void exceptClause(TSNode clause, List<Stmt> out) {
            final List<Expr> tests = new ArrayList<>();
            final List<Expr> targets = new ArrayList<>();
            for (TSNode child : named(clause)) {
                if (child.getType().equals("block")) {
                    continue;
                }
                if (child.getType().equals("as_pattern")) {
                    tests.add(expr(named(child).get(0)));
                    targets.add(expr(field(child, "alias")));
                } else if (tests.isEmpty()) {
                    tests.add(expr(child));
                } else {
                    targets.add(expr(child));
                }
            }
            out.add(new Block("except", tests, targets, statements(lastBlock(clause)), line(clause)));
        }

        private TSNode lastBlock(TSNode clause) {
            TSNode block = null;
            for (TSNode child : named(clause)) {
                if (child.getType().equals("block")) {
                    block = child;
                }
            }
            return block;
        }

        private Stmt withStatement(TSNode node) {
            final List<Expr> items = new ArrayList<>();
            final List<Expr> targets = new ArrayList<>();
            for (TSNode clause : named(node)) {
                if (!clause.getType().equals("with_clause")) {
                    continue;
                }
                for (TSNode item : named(clause)) {
                    final TSNode value = field(item, "value");
                    if (value != null && value.getType().equals("as_pattern")) {
                        items.add(expr(named(value).get(0)));
                        targets.add(expr(field(value, "alias")));
                    } else if (value != null) {
                        items.add(expr(value));
                    }
                }
            }
            return new Block("with", items, targets, statements(field(node, "body")), line(node));
        }

        private void matchStatement(TSNode node, List<Stmt> out) {
            final List<Expr> subjects = new ArrayList<>();
            final List<TSNode> cases = new ArrayList<>();
            for (TSNode child : named(node)) {
                switch (child.getType()) {
                    case "case_clause" -> cases.add(child);
                    case "block" -> {
                        for (TSNode inner : named(child)) {
                            if (inner.getType().equals("case_clause")) {
                                cases.add(inner);
                            }
                        }
                    }
                    default -> subjects.add(expr(child));
                }
            }
            final Expr subject = subjects.size() == 1 ? subjects.get(0)
                    : new Composite("tuple", subjects, text(node), line(node));
            out.add(new Block("match", List.of(subject), List.of(), List.of(), line(node)));
            for (TSNode c : cases) {
                final TSNode guard = field(c, "guard");
                out.add(new Block("case", guard == null ? List.of() : List.of(expr(named(guard).get(0))),
                        List.of(), statements(field(c, "consequence")), line(c)));
            }
        }

        // --- expressions ---

        private List<Expr> exprs(List<TSNode> nodes) {
            final List<Expr> out = new ArrayList<>();
            for (TSNode node : nodes) {
                out.add(expr(node));
            }
            return out;
        }

        private Expr expr(TSNode node) {
            final int line = line(node);
            return switch (node.getType()) {
                case "identifier" -> new Name(raw(node), line);
                case "attribute" -> new Attribute(expr(field(node, "object")), raw(field(node, "attribute")), line);
                case "call" -> call(node);
                case "string" -> strings(List.of(node), node);
                case "concatenated_string" -> strings(named(node), node);
                case "integer", "float" -> new Constant(numberKind(raw(node)), raw(node), raw(node), line);
                case "true", "false" -> new Constant("bool", raw(node), raw(node), line);
                case "none" -> new Constant("None", null, "None", line);
                case "ellipsis" -> new Constant("Ellipsis", "...", "...", line);
                case "lambda" -> {
                    final TSNode body = field(node, "body");
                    yield new Lambda(params(field(node, "parameters")), expr(body), text(node), line);
                }
                case "list_comprehension" -> comprehension("listcomp", node);
                case "set_comprehension" -> comprehension("setcomp", node);
                case "generator_expression" -> comprehension("genexp", node);
                case "dictionary_comprehension" -> comprehension("dictcomp", node);
                case "list_splat", "list_splat_pattern" ->
                        new Starred(expr(named(node).get(0)), false, text(node), line);
                case "dictionary_splat", "dictionary_splat_pattern" ->
                        new Starred(expr(named(node).get(0)), true, text(node), line);
                case "type", "as_pattern_target" -> expr(named(node).get(0));
                case "tuple", "pattern_list", "expression_list", "tuple_pattern" ->
                        new Composite("tuple", exprs(named(node)), text(node), line);
                case "list", "list_pattern" -> new Composite("list", exprs(named(node)), text(node), line);
                case "set" -> new Composite("set", exprs(named(node)), text(node), line);
                case "dictionary" -> new Composite("dict", dictItems(node), text(node), line);
                case "parenthesized_expression" -> {
                    final Expr inner = expr(named(node).get(0));
                    yield inner instanceof Composite c && c.kind().equals("yield")
                            ? inner
                            : new Composite("paren", List.of(inner), text(node), line);
                }
                case "subscript" -> subscript(node);
                case "slice" -> new Composite("slice", exprs(named(node)), text(node), line);
                case "binary_operator" -> new Composite("binop", exprs(named(node)), text(node), line);
                case "unary_operator", "not_operator" ->
                        new Composite("unaryop", exprs(named(node)), text(node), line);
                case "boolean_operator" -> new Composite("boolop", exprs(named(node)), text(node), line);
                case "comparison_operator" -> new Composite("compare", exprs(named(node)), text(node), line);
                case "conditional_expression" -> new Composite("ifexp", exprs(named(node)), text(node), line);
                case "named_expression" -> new Composite("namedexpr",
                        List.of(new Name(raw(field(node, "name")), line), expr(field(node, "value"))),
                        text(node), line);
                case "await" -> new Composite("await", exprs(named(node)), text(node), line);
                case "yield" -> new Composite("yield", exprs(named(node)), text(node), line);
                case "keyword_argument" -> expr(field(node, "value"));
                default -> new Composite(node.getType(), exprs(named(node)), text(node), line);
            };
        }

        private Expr call(TSNode node) {
            final List<Expr> args = new ArrayList<>();
            final List<Keyword> keywords = new ArrayList<>();
            final TSNode arguments = field(node, "arguments");
            if (arguments != null && arguments.getType().equals("generator_expression")) {
                args.add(expr(arguments));
            } else if (arguments != null) {
                arguments(arguments, args, keywords);
            }
            return new Call(expr(field(node, "function")), args, keywords, text(node), line(node));
        }

        private void arguments(TSNode argumentList, List<Expr> positional, List<Keyword> keywords) {
            for (TSNode arg : named(argumentList)) {
                switch (arg.getType()) {
                    case "keyword_argument" -> keywords.add(new Keyword(raw(field(arg, "name")),
                            expr(field(arg, "value"))));
                    case "dictionary_splat" -> keywords.add(new Keyword(null, expr(named(arg).get(0))));
                    default -> positional.add(expr(arg));
                }
            }
        }

        private List<Expr> dictItems(TSNode node) {
            final List<Expr> items = new ArrayList<>();
            for (TSNode item : named(node)) {
                if (item.getType().equals("pair")) {
                    items.add(expr(field(item, "key")));
                    items.add(expr(field(item, "value")));
                } else {
                    items.add(expr(item));
                }
            }
            return items;
        }

        private Expr subscript(TSNode node) {
            final TSNode value = field(node, "value");
            final List<Expr> indexes = new ArrayList<>();
            for (TSNode child : named(node)) {
                if (child.getStartByte() != value.getStartByte() || child.getEndByte() != value.getEndByte()) {
                    indexes.add(expr(child));
                }
            }
            final Expr index = indexes.size() == 1 ? indexes.get(0)
                    : new Composite("tuple", indexes, text(node), line(node));
            return new Composite("subscript", List.of(expr(value), index), text(node), line(node));
        }

        private Expr comprehension(String kind, TSNode node) {
            final List<Expr> elements = new ArrayList<>();
            final List<ComprehensionFor> generators = new ArrayList<>();
            final TSNode body = field(node, "body");
            if (body != null && body.getType().equals("pair")) {
                elements.add(expr(field(body, "key")));
                elements.add(expr(field(body, "value")));
            } else if (body != null) {
                elements.add(expr(body));
            }
            for (TSNode clause : named(node)) {
                if (clause.getType().equals("for_in_clause")) {
                    generators.add(new ComprehensionFor(expr(field(clause, "left")),
                            expr(field(clause, "right")), new ArrayList<>()));
                } else if (clause.getType().equals("if_clause") && !generators.isEmpty()) {
                    generators.get(generators.size() - 1).conditions().add(expr(named(clause).get(0)));
                }
            }
            return new Comprehension(kind, elements, generators, text(node), line(node));
        }

        /** One string literal or an implicitly concatenated run of them. */
        private Expr strings(List<TSNode> parts, TSNode whole) {
            final StringBuilder value = new StringBuilder();
            final List<Expr> interpolated = new ArrayList<>();
            boolean bytes = false;
            boolean formatted = false;
            for (TSNode part : parts) {
                TSNode start = null;
                TSNode end = null;
                for (int i = 0; i < part.getChildCount(); i++) {
                    final TSNode child = part.getChild(i);
                    switch (child.getType()) {
                        case "string_start" -> start = child;
                        case "string_end" -> end = child;
                        case "interpolation" -> interpolated.add(expr(named(child).get(0)));
                        default -> {
                        }
                    }
                }
                if (start == null || end == null) {
                    continue;
                }
                final String opener = raw(start).toLowerCase();
                value.append(raw(start.getEndByte(), end.getStartByte()));
                bytes |= opener.contains("b");
                formatted |= opener.contains("f");
            }
            if (formatted) {
                return new Composite("fstring", interpolated, text(whole), line(whole));
            }
            return new Constant(bytes ? "bytes" : "str", value.toString(), text(whole), line(whole));
        }
    }
}
