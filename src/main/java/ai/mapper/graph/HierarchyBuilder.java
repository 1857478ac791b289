package ai.mapper.graph;

import ai.mapper.model.ComponentKind;
import ai.mapper.model.Fqns;
import ai.mapper.model.SourceSpan;
import ai.mapper.modules.ModuleNames;
import ai.mapper.modules.ModuleNames.ModuleName;
import ai.mapper.syntax.PyAst;
import ai.mapper.syntax.PyAst.Assign;
import ai.mapper.syntax.PyAst.Attribute;
import ai.mapper.syntax.PyAst.Block;
import ai.mapper.syntax.PyAst.ClassDef;
import ai.mapper.syntax.PyAst.Composite;
import ai.mapper.syntax.PyAst.Expr;
import ai.mapper.syntax.PyAst.FunctionDef;
import ai.mapper.syntax.PyAst.Name;
import ai.mapper.syntax.PyAst.Param;
import ai.mapper.syntax.PyAst.Starred;
import ai.mapper.syntax.PyAst.Stmt;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Pass 1: turns one parsed file into component declarations.
 * <p>
 * {@link #build} is pure and may run on any thread. {@link #register} merges the result into
 * the registry and must be called from a single writer, in sorted path order.
 */
public final class HierarchyBuilder {

    public FileHierarchy build(String path, PyAst.Module syntax) {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(syntax, "syntax");
        final ModuleName module = ModuleNames.of(path);
        final Walk walk = new Walk(path);

        walk.out.add(new Declaration(module.fqn(), Fqns.simpleName(module.fqn()),
                module.packageInit() ? ComponentKind.PACKAGE : ComponentKind.MODULE,
                Fqns.parent(module.fqn()), path, SourceSpan.synthetic(), List.of(), List.of(), syntax.docstring()));
        walk.body(syntax.body(), module.fqn(), ComponentKind.MODULE, null);
        return new FileHierarchy(path, module, walk.out, syntax);
    }

    public static void register(FileHierarchy file, SymbolRegistry registry) {
        for (String pkg : file.module().packages()) {
            registry.ensurePackage(pkg, pkg.replace('.', '/'));
        }
        for (Declaration d : file.declarations()) {
            registry.define(d);
        }
    }

    /** Name of the first parameter when {@code fn} is a method bound to an instance or class. */
    static String receiverName(FunctionDef fn) {
        for (Expr d : fn.decorators()) {
            if (d instanceof Name n && n.id().equals("staticmethod")) {
                return null;
            }
        }
        if (fn.params().isEmpty() || !fn.params().get(0).prefix().isEmpty()) {
            return null;
        }
        return fn.params().get(0).name();
    }

    private static final class Walk {

        private final String path;
        private final List<Declaration> out = new ArrayList<>();
        /** scope fqn -> names declared directly in it */
        private final Map<String, Set<String>> declared = new HashMap<>();

        Walk(String path) {
            this.path = path;
        }

        /**
         * @param receiver for a method body: the name bound to the instance, whose attribute
         *                 assignments declare attributes of {@code classFqn}
         */
        void body(List<Stmt> stmts, String scope, ComponentKind scopeKind, Receiver receiver) {
            for (Stmt s : stmts) {
                if (s instanceof FunctionDef fn) {
                    function(fn, scope, scopeKind);
                } else if (s instanceof ClassDef cls) {
                    type(cls, scope);
                } else if (s instanceof Assign a) {
                    assignment(a, scope, scopeKind, receiver);
                } else if (s instanceof Block b) {
                    body(b.body(), scope, scopeKind, receiver);
                }
            }
        }

        private void function(FunctionDef fn, String scope, ComponentKind scopeKind) {
            final boolean method = scopeKind == ComponentKind.CLASS;
            final String fqn = Fqns.child(scope, fn.name());
            final List<String> params = new ArrayList<>();
            for (Param p : fn.params()) {
                params.add(p.prefix() + p.name());
            }
            declare(scope, fn.name());
            out.add(new Declaration(fqn, fn.name(), method ? ComponentKind.METHOD : ComponentKind.FUNCTION, scope,
                    path, new SourceSpan(fn.line(), fn.endLine()), List.of(), params, fn.docstring()));

            final String self = method ? receiverName(fn) : null;
            body(fn.body(), fqn, ComponentKind.FUNCTION, self != null ? new Receiver(self, scope) : null);
        }

        private void type(ClassDef cls, String scope) {
            final String fqn = Fqns.child(scope, cls.name());
            final List<String> bases = new ArrayList<>();
            for (Expr b : cls.bases()) {
                bases.add(b.text());
            }
            declare(scope, cls.name());
            out.add(new Declaration(fqn, cls.name(), ComponentKind.CLASS, scope, path,
                    new SourceSpan(cls.line(), cls.endLine()), bases, List.of(), cls.docstring()));
            body(cls.body(), fqn, ComponentKind.CLASS, null);
        }

        private void assignment(Assign a, String scope, ComponentKind scopeKind, Receiver receiver) {
            if (a.augmented()) {
                return;
            }
            for (Expr target : a.targets()) {
                for (Expr t : unpack(target)) {
                    if (t instanceof Name n && scopeKind != ComponentKind.FUNCTION) {
                        attribute(scope, n.id(), a.line());
                    } else if (t instanceof Attribute attr && receiver != null
                            && attr.value() instanceof Name owner && owner.id().equals(receiver.name())) {
                        attribute(receiver.classFqn(), attr.attr(), a.line());
                    }
                }
            }
        }

        private void attribute(String scope, String name, int line) {
            if (!declare(scope, name)) {
                return;
            }
            out.add(new Declaration(Fqns.child(scope, name), name, ComponentKind.ATTRIBUTE, scope, path,
                    SourceSpan.line(line), List.of(), List.of(), null));
        }

        /** Returns false when the name was already declared in that scope. */
        private boolean declare(String scope, String name) {
            return declared.computeIfAbsent(scope, k -> new HashSet<>()).add(name);
        }

        private static List<Expr> unpack(Expr target) {
            if (target instanceof Composite c && (c.kind().equals("tuple") || c.kind().equals("list")
                    || c.kind().equals("paren"))) {
                final List<Expr> out = new ArrayList<>();
                for (Expr child : c.children()) {
                    out.addAll(unpack(child));
                }
                return out;
            }
            if (target instanceof Starred s) {
                return unpack(s.value());
            }
            return List.of(target);
        }
    }

    private record Receiver(String name, String classFqn) {
    }
}
