package ai.mapper.graph;

import ai.mapper.model.AliasBinding;
import ai.mapper.model.AliasKind;
import ai.mapper.model.AttributePayload;
import ai.mapper.model.CallArgument;
import ai.mapper.model.CallPayload;
import ai.mapper.model.Component;
import ai.mapper.model.ComponentKind;
import ai.mapper.model.EdgeKind;
import ai.mapper.model.EdgePayload;
import ai.mapper.model.Fqns;
import ai.mapper.model.ImportPayload;
import ai.mapper.model.InheritPayload;
import ai.mapper.model.IntegrationEdge;
import ai.mapper.model.Resolution;
import ai.mapper.modules.ModuleNames;
import ai.mapper.modules.ModuleNames.ModuleName;
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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Pass 2: resolves the imports, calls, attribute accesses and base classes of one file into
 * integration edges, against the frozen registry.
 * <p>
 * Lookup order for a bare name: local bindings (function scopes outward, the class body when it
 * is the current scope, typed module-level bindings), the file's import aliases, registered
 * components (current scope outward, then the module), members of star-imported modules,
 * builtins. Whatever is left is an {@link Resolution#UNKNOWN} edge to the sentinel.
 */
public final class IntegrationExtractor {

    private static final Logger LOG = LoggerFactory.getLogger(IntegrationExtractor.class);

    static final int VALUE_LIMIT = 80;

    private static final Set<String> DYNAMIC_IMPORTERS = Set.of(
            "importlib.import_module", PythonBuiltins.MODULE + ".__import__");

    private final SymbolRegistry registry;

    public IntegrationExtractor(SymbolRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
        if (!registry.isFrozen()) {
            throw new IllegalStateException("extraction needs a frozen registry");
        }
    }

    public FileIntegrations extract(FileHierarchy file) {
        Objects.requireNonNull(file, "file");
        final FileWalk walk = new FileWalk(file);
        walk.run();
        LOG.debug("{}: {} edges, {} import bindings", file.path(), walk.edges.size(), walk.aliases.size());
        return new FileIntegrations(file.path(), walk.edges, walk.aliases);
    }

    private enum ScopeKind {
        MODULE, CLASS, FUNCTION
    }

    /** What a local name is known to refer to; {@code fqn} is null for an untyped local. */
    private record Binding(String fqn, boolean imported) {
        static final Binding UNTYPED = new Binding(null, false);
    }

    private record Resolved(String fqn, Resolution resolution) {
        static final Resolved DYNAMIC = new Resolved(null, Resolution.DYNAMIC);
    }

    private static final class Scope {
        final Scope parent;
        final ScopeKind kind;
        final String fqn;
        final int componentId;
        final Map<String, Binding> locals = new HashMap<>();

        Scope(Scope parent, ScopeKind kind, String fqn, int componentId) {
            this.parent = parent;
            this.kind = kind;
            this.fqn = fqn;
            this.componentId = componentId;
        }

        /** Lambda and comprehension scopes: new locals, same source component. */
        Scope nested() {
            return new Scope(this, ScopeKind.FUNCTION, fqn, componentId);
        }
    }

    private final class FileWalk {

        private final FileHierarchy file;
        private final ModuleName module;
        private final List<IntegrationEdge> edges = new ArrayList<>();
        private final List<AliasBinding> aliases = new ArrayList<>();
        private final Map<String, AliasBinding> moduleAliases = new HashMap<>();
        private final List<String> starModules = new ArrayList<>();
        private final Deque<Runnable> deferred = new ArrayDeque<>();

        FileWalk(FileHierarchy file) {
            this.file = file;
            this.module = file.module();
        }

        void run() {
            final int moduleId = registry.idOf(module.fqn());
            if (registry.component(moduleId) == null) {
                throw new IllegalStateException("module not registered: " + module.fqn());
            }
            final Scope top = new Scope(null, ScopeKind.MODULE, module.fqn(), moduleId);
            statements(file.syntax().body(), top);
            while (!deferred.isEmpty()) {
                deferred.poll().run();
            }
        }

        // --- statements ---

        private void statements(List<Stmt> body, Scope scope) {
            for (Stmt s : body) {
                statement(s, scope);
            }
        }

        private void statement(Stmt s, Scope scope) {
            if (s instanceof FunctionDef fn) {
                functionDef(fn, scope);
            } else if (s instanceof ClassDef cls) {
                classDef(cls, scope);
            } else if (s instanceof Import imp) {
                importStatement(imp, scope);
            } else if (s instanceof ImportFrom from) {
                fromImport(from, scope);
            } else if (s instanceof Assign a) {
                assignment(a, scope);
            } else if (s instanceof ExprStmt e) {
                load(e.value(), scope);
            } else if (s instanceof Return r) {
                if (r.value() != null) {
                    load(r.value(), scope);
                }
            } else if (s instanceof Delete d) {
                for (Expr t : d.targets()) {
                    load(t, scope);
                }
            } else if (s instanceof Block b) {
                for (Expr test : b.tests()) {
                    load(test, scope);
                }
                for (Expr target : b.targets()) {
                    store(target, scope, Binding.UNTYPED);
                }
                statements(b.body(), scope);
            } else if (s instanceof Simple simple) {
                if (!simple.keyword().equals("global") && !simple.keyword().equals("nonlocal")) {
                    for (Expr v : simple.values()) {
                        load(v, scope);
                    }
                }
            }
        }

        private void functionDef(FunctionDef fn, Scope scope) {
            for (Expr d : fn.decorators()) {
                load(d, scope);
            }
            for (Param p : fn.params()) {
                if (p.annotation() != null) {
                    load(p.annotation(), scope);
                }
                if (p.defaultValue() != null) {
                    load(p.defaultValue(), scope);
                }
            }
            if (fn.returns() != null) {
                load(fn.returns(), scope);
            }
            final String fqn = Fqns.child(scope.fqn, fn.name());
            bindName(scope, fn.name(), new Binding(fqn, false));
            deferred.add(() -> functionBody(fn, fqn, scope));
        }

        private void functionBody(FunctionDef fn, String fqn, Scope enclosing) {
            final Scope scope = new Scope(enclosing, ScopeKind.FUNCTION, fqn, registry.idOf(fqn));
            for (Param p : fn.params()) {
                scope.locals.put(p.name(), typedBy(p.annotation(), enclosing));
            }
            if (enclosing.kind == ScopeKind.CLASS) {
                final String receiver = HierarchyBuilder.receiverName(fn);
                if (receiver != null) {
                    scope.locals.put(receiver, new Binding(enclosing.fqn, false));
                }
            }
            statements(fn.body(), scope);
        }

        private void classDef(ClassDef cls, Scope scope) {
            for (Expr d : cls.decorators()) {
                load(d, scope);
            }
            final String fqn = Fqns.child(scope.fqn, cls.name());
            final int classId = registry.idOf(fqn);
            for (Expr base : cls.bases()) {
                inherit(classId, base, scope);
            }
            for (Keyword k : cls.keywords()) {
                load(k.value(), scope);
            }
            bindName(scope, cls.name(), new Binding(fqn, false));
            statements(cls.body(), new Scope(scope, ScopeKind.CLASS, fqn, classId));
        }

        private void inherit(int classId, Expr base, Scope scope) {
            Resolved target = resolveChain(base, scope);
            if (target == null) {
                load(base, scope);
                target = Resolved.DYNAMIC;
            }
            List<String> overridden = List.of();
            if (target.resolution() == Resolution.RESOLVED) {
                final Component baseClass = registry.component(target.fqn());
                if (baseClass != null && baseClass.kind() == ComponentKind.CLASS) {
                    final Set<String> common = new TreeSet<>(registry.methodNames(classId));
                    common.retainAll(registry.methodNames(baseClass.id()));
                    overridden = new ArrayList<>(common);
                }
            }
            emit(classId, EdgeKind.INHERIT, base.line(), target, new InheritPayload(base.text(), overridden));
        }

        private void importStatement(Import imp, Scope scope) {
            for (ImportName n : imp.names()) {
                final String local;
                final String bound;
                final AliasKind kind;
                if (n.asName() != null) {
                    local = n.asName();
                    bound = n.name();
                    kind = AliasKind.IMPORT_AS;
                } else {
                    local = n.name().contains(".") ? n.name().substring(0, n.name().indexOf('.')) : n.name();
                    bound = local;
                    kind = AliasKind.IMPORT;
                }
                bindImport(scope, local, bound, kind);
                emit(scope.componentId, EdgeKind.IMPORT, imp.line(), classify(n.name(), true),
                        new ImportPayload(n.name(), List.of(), false, n.asName(), kind, 0, null, null));
            }
        }

        private void fromImport(ImportFrom from, Scope scope) {
            final String base;
            if (from.level() > 0) {
                base = ModuleNames.resolveRelative(module, from.level(), from.module());
            } else {
                base = from.module();
            }
            final AliasKind kind = from.level() > 0 ? AliasKind.RELATIVE_IMPORT : null;

            if (base == null) {
                final String written = ".".repeat(from.level()) + (from.module() != null ? from.module() : "");
                for (ImportName n : from.names()) {
                    final String star = n.name().equals("*") ? "" : "." + n.name();
                    emit(scope.componentId, EdgeKind.IMPORT, from.line(),
                            new Resolved(written + star, Resolution.UNKNOWN),
                            new ImportPayload(written, n.name().equals("*") ? List.of() : List.of(n.name()),
                                    n.name().equals("*"), n.asName(), kind, from.level(),
                                    "relative import beyond top-level package", null));
                }
                return;
            }

            for (ImportName n : from.names()) {
                if (n.name().equals("*")) {
                    starModules.add(base);
                    final AliasBinding star = new AliasBinding("*", base, file.path(), AliasKind.STAR_IMPORT);
                    aliases.add(star);
                    emit(scope.componentId, EdgeKind.IMPORT, from.line(), classify(base, true),
                            new ImportPayload(base, List.of(), true, null, AliasKind.STAR_IMPORT, from.level(),
                                    "members not enumerated", null));
                    continue;
                }
                final String target = base + "." + n.name();
                final AliasKind bindingKind = kind != null ? kind
                        : n.asName() != null ? AliasKind.IMPORT_AS : AliasKind.IMPORT;
                bindImport(scope, n.asName() != null ? n.asName() : n.name(), target, bindingKind);
                emit(scope.componentId, EdgeKind.IMPORT, from.line(), classify(target, true),
                        new ImportPayload(base, List.of(n.name()), false, n.asName(), bindingKind, from.level(),
                                null, null));
            }
        }

        private void bindImport(Scope scope, String local, String fqn, AliasKind kind) {
            final AliasBinding binding = new AliasBinding(local, fqn, file.path(), kind);
            aliases.add(binding);
            if (scope.kind == ScopeKind.MODULE) {
                moduleAliases.put(local, binding);
                scope.locals.remove(local);
            } else {
                scope.locals.put(local, new Binding(fqn, true));
            }
        }

        private void assignment(Assign a, Scope scope) {
            if (a.annotation() != null) {
                load(a.annotation(), scope);
            }
            Binding binding = Binding.UNTYPED;
            if (a.value() != null) {
                if (a.value() instanceof Call call && !a.augmented()) {
                    final Resolved callee = call(call, scope, a.targets().get(0).text());
                    if (callee != null && callee.resolution() == Resolution.RESOLVED && isClass(callee.fqn())) {
                        binding = new Binding(callee.fqn(), false);
                    }
                } else {
                    load(a.value(), scope);
                }
            }
            if (a.annotation() != null && binding.fqn() == null) {
                binding = typedBy(a.annotation(), scope);
            }
            for (Expr target : a.targets()) {
                if (a.augmented() && target instanceof Name) {
                    continue;
                }
                store(target, scope, binding);
            }
        }

        // --- expressions ---

        private void load(Expr e, Scope scope) {
            if (e instanceof Name || e instanceof Constant) {
                return;
            }
            if (e instanceof Attribute attr) {
                chain(attr, scope, EdgeKind.ATTR_READ, null);
            } else if (e instanceof Call call) {
                call(call, scope, null);
            } else if (e instanceof Starred s) {
                load(s.value(), scope);
            } else if (e instanceof Lambda lambda) {
                final Scope inner = scope.nested();
                for (Param p : lambda.params()) {
                    if (p.defaultValue() != null) {
                        load(p.defaultValue(), scope);
                    }
                    inner.locals.put(p.name(), Binding.UNTYPED);
                }
                load(lambda.body(), inner);
            } else if (e instanceof Comprehension comp) {
                comprehension(comp, scope);
            } else if (e instanceof Composite c) {
                if (c.kind().equals("namedexpr")) {
                    load(c.children().get(1), scope);
                    store(c.children().get(0), scope, Binding.UNTYPED);
                } else {
                    for (Expr child : c.children()) {
                        load(child, scope);
                    }
                }
            }
        }

        private void comprehension(Comprehension comp, Scope scope) {
            final Scope inner = scope.nested();
            boolean first = true;
            for (ComprehensionFor gen : comp.generators()) {
                load(gen.iter(), first ? scope : inner);
                first = false;
                store(gen.target(), inner, Binding.UNTYPED);
                for (Expr condition : gen.conditions()) {
                    load(condition, inner);
                }
            }
            for (Expr element : comp.elements()) {
                load(element, inner);
            }
        }

        private void store(Expr target, Scope scope, Binding binding) {
            if (target instanceof Name n) {
                bindName(scope, n.id(), binding);
            } else if (target instanceof Attribute attr) {
                chain(attr, scope, EdgeKind.ATTR_WRITE, null);
            } else if (target instanceof Starred s) {
                store(s.value(), scope, Binding.UNTYPED);
            } else if (target instanceof Composite c && (c.kind().equals("tuple") || c.kind().equals("list")
                    || c.kind().equals("paren"))) {
                for (Expr child : c.children()) {
                    store(child, scope, c.kind().equals("paren") ? binding : Binding.UNTYPED);
                }
            } else {
                load(target, scope);
            }
        }

        private void bindName(Scope scope, String name, Binding binding) {
            switch (scope.kind) {
                case MODULE -> {
                    // a rebinding shadows any earlier import; untyped names resolve through the registry
                    moduleAliases.remove(name);
                    if (binding.fqn() != null) {
                        scope.locals.put(name, binding);
                    } else {
                        scope.locals.remove(name);
                    }
                }
                case CLASS, FUNCTION -> scope.locals.put(name, binding);
            }
        }

        /**
         * Emits the call edge (after the callee chain and argument edges) and returns how the
         * callee resolved, or null for a dynamic callee.
         *
         * @param returnVar assignment target when the call is the direct value of an assignment
         */
        private Resolved call(Call call, Scope scope, String returnVar) {
            final Expr func = call.func();
            if (func instanceof Attribute attr) {
                return chain(attr, scope, EdgeKind.CALL, new CallSite(call, returnVar));
            }
            if (func instanceof Name name) {
                final Resolved callee = resolveName(name.id(), scope);
                emitCall(call, scope, callee, 0, returnVar);
                return callee;
            }
            load(func, scope);
            emitCall(call, scope, Resolved.DYNAMIC, 0, returnVar);
            return null;
        }

        private record CallSite(Call call, String returnVar) {
        }

        private void emitCall(Call call, Scope scope, Resolved callee, int hop, String returnVar) {
            final List<CallArgument> arguments = new ArrayList<>();
            for (Expr arg : call.args()) {
                load(arg, scope);
                arguments.add(argument(arg, null, scope));
            }
            for (Keyword k : call.keywords()) {
                load(k.value(), scope);
                arguments.add(argument(k.value(), k.name() != null ? k.name() : "**", scope));
            }

            if (callee.fqn() != null && DYNAMIC_IMPORTERS.contains(callee.fqn())) {
                dynamicImport(call, scope);
            }

            CallPayload payload = new CallPayload(call.func().text(), arguments, false, null, null, hop);
            if (returnVar != null) {
                String flow = null;
                if (callee.resolution() == Resolution.RESOLVED) {
                    final List<String> values = new ArrayList<>();
                    for (CallArgument a : arguments) {
                        values.add(a.keyword() == null ? a.value()
                                : a.keyword().equals("**") ? "**" + a.value() : a.keyword() + "=" + a.value());
                    }
                    flow = call.func().text() + "(" + String.join(", ", values) + ") -> " + returnVar;
                }
                payload = payload.withReturn(returnVar, flow);
            }
            emit(scope.componentId, EdgeKind.CALL, call.line(), callee, payload);
        }

        private void dynamicImport(Call call, Scope scope) {
            final Expr arg = !call.args().isEmpty() ? call.args().get(0) : firstKeyword(call, "name");
            if (arg instanceof Constant c && c.kind().equals("str") && !c.value().isEmpty()
                    && !c.value().startsWith(".")) {
                emit(scope.componentId, EdgeKind.IMPORT, call.line(), classify(c.value(), true),
                        new ImportPayload(c.value(), List.of(), false, null, AliasKind.IMPORT, 0, null, null));
                return;
            }
            emit(scope.componentId, EdgeKind.IMPORT, call.line(), Resolved.DYNAMIC,
                    new ImportPayload(null, List.of(), false, null, null, 0,
                            "dynamic import: module name is not a literal",
                            arg != null ? arg.text() : call.text()));
        }

        private Expr firstKeyword(Call call, String name) {
            for (Keyword k : call.keywords()) {
                if (name.equals(k.name())) {
                    return k.value();
                }
            }
            return null;
        }

        private CallArgument argument(Expr arg, String keyword, Scope scope) {
            String name = null;
            if (arg instanceof Name || arg instanceof Attribute) {
                final Resolved r = resolveChain(arg, scope);
                name = r != null ? r.fqn() : null;
            }
            return new CallArgument(name, summarize(arg.text()), typeTag(arg), keyword);
        }

        /**
         * Emits one edge per hop of an attribute chain. Intermediate hops are reads, the last hop
         * has {@code last}. A chain whose head is not a plain name is dynamic at every hop.
         */
        private Resolved chain(Attribute node, Scope scope, EdgeKind last, CallSite site) {
            final List<Attribute> hops = new ArrayList<>();
            Expr head = node;
            while (head instanceof Attribute a) {
                hops.add(0, a);
                head = a.value();
            }

            Resolved current;
            if (head instanceof Name n) {
                current = resolveName(n.id(), scope);
            } else {
                load(head, scope);
                current = Resolved.DYNAMIC;
            }

            for (int i = 0; i < hops.size(); i++) {
                final Attribute hop = hops.get(i);
                final Resolved owner = current;
                current = member(owner, hop.attr());
                final int position = i + 1;
                if (i < hops.size() - 1 || last != EdgeKind.CALL) {
                    final EdgeKind kind = i < hops.size() - 1 ? EdgeKind.ATTR_READ : last;
                    emit(scope.componentId, kind, hop.line(), current,
                            new AttributePayload(hop.attr(), hop.text(), owner.fqn(), position));
                } else {
                    emitCall(site.call(), scope, current, position, site.returnVar());
                }
            }
            return current.resolution() == Resolution.DYNAMIC ? null : current;
        }

        // --- resolution ---

        private Resolved member(Resolved owner, String attr) {
            return switch (owner.resolution()) {
                case DYNAMIC -> Resolved.DYNAMIC;
                case UNKNOWN -> new Resolved(owner.fqn() + "." + attr, Resolution.UNKNOWN);
                case BUILTIN -> new Resolved(owner.fqn() + "." + attr, Resolution.BUILTIN);
                case RESOLVED -> classify(owner.fqn() + "." + attr, false);
                case EXTERNAL -> classify(owner.fqn() + "." + attr, true);
            };
        }

        /** Resolves a plain name or attribute chain without emitting edges; null for anything else. */
        private Resolved resolveChain(Expr e, Scope scope) {
            if (e instanceof Name n) {
                return resolveName(n.id(), scope);
            }
            if (e instanceof Attribute a) {
                final Resolved owner = resolveChain(a.value(), scope);
                return owner != null ? member(owner, a.attr()) : null;
            }
            return null;
        }

        private Resolved resolveName(String name, Scope scope) {
            for (Scope s = scope; s != null; s = s.parent) {
                if (s.kind == ScopeKind.CLASS && s != scope) {
                    continue;
                }
                final Binding b = s.locals.get(name);
                if (b != null) {
                    return b.fqn() == null ? new Resolved(name, Resolution.UNKNOWN) : classify(b.fqn(), b.imported());
                }
            }

            final AliasBinding alias = moduleAliases.get(name);
            if (alias != null) {
                return classify(alias.resolvedFqn(), true);
            }

            for (Scope s = scope; s != null; s = s.parent) {
                if (s.kind == ScopeKind.CLASS && s != scope) {
                    continue;
                }
                final String candidate = Fqns.child(s.fqn, name);
                if (registry.contains(candidate)) {
                    return new Resolved(candidate, Resolution.RESOLVED);
                }
            }

            for (String star : starModules) {
                final String candidate = star + "." + name;
                if (registry.contains(candidate)) {
                    return new Resolved(candidate, Resolution.RESOLVED);
                }
            }

            if (PythonBuiltins.contains(name)) {
                return new Resolved(PythonBuiltins.MODULE + "." + name, Resolution.BUILTIN);
            }
            LOG.debug("{}: unresolved name '{}' in {}", file.path(), name, scope.fqn);
            return new Resolved(name, Resolution.UNKNOWN);
        }

        /**
         * Settles a dotted name: registered, missing from the analysed tree, or (when it came
         * through an import) outside it.
         */
        private Resolved classify(String fqn, boolean imported) {
            if (registry.contains(fqn)) {
                return new Resolved(fqn, Resolution.RESOLVED);
            }
            final int dot = fqn.indexOf('.');
            final String top = dot >= 0 ? fqn.substring(0, dot) : fqn;
            if (imported && !registry.contains(top)) {
                return new Resolved(fqn, Resolution.EXTERNAL);
            }
            return new Resolved(fqn, Resolution.UNKNOWN);
        }

        private boolean isClass(String fqn) {
            final Component c = registry.component(fqn);
            return c != null && c.kind() == ComponentKind.CLASS;
        }

        /** Binding implied by an annotation naming a registered class. */
        private Binding typedBy(Expr annotation, Scope scope) {
            if (annotation == null) {
                return Binding.UNTYPED;
            }
            final Resolved r = resolveChain(annotation, scope);
            if (r != null && r.resolution() == Resolution.RESOLVED && isClass(r.fqn())) {
                return new Binding(r.fqn(), false);
            }
            return Binding.UNTYPED;
        }

        private void emit(int sourceId, EdgeKind kind, int line, Resolved target, EdgePayload payload) {
            final int targetId = target.resolution() == Resolution.RESOLVED
                    ? registry.idOf(target.fqn()) : IntegrationEdge.UNRESOLVED;
            edges.add(new IntegrationEdge(sourceId, targetId, kind, line, target.fqn(), target.resolution(), payload));
        }
    }

    static String summarize(String text) {
        if (text.length() <= VALUE_LIMIT) {
            return text;
        }
        return text.substring(0, VALUE_LIMIT - 3) + "...";
    }

    static String typeTag(Expr e) {
        if (e instanceof Constant c) {
            return c.kind();
        }
        if (e instanceof Name) {
            return "name";
        }
        if (e instanceof Attribute) {
            return "attribute";
        }
        if (e instanceof Call) {
            return "call";
        }
        if (e instanceof Lambda) {
            return "lambda";
        }
        if (e instanceof Starred s) {
            return s.doubleStar() ? "double_starred" : "starred";
        }
        if (e instanceof Comprehension comp) {
            return comp.kind();
        }
        if (e instanceof Composite c) {
            return c.kind();
        }
        return "expression";
    }
}
