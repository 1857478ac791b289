package ai.mapper.syntax;

import java.util.List;

/**
 * Syntax-tree shapes produced by the parser adapter. Only what the analysis consumes is
 * modelled: definitions, imports, assignments, calls, attribute chains and the blocks that
 * contain them. Every other expression is a {@link Composite} carrying its sub-expressions.
 */
public final class PyAst {

    private PyAst() {
    }

    public interface Node {
        int line();
    }

    public interface Stmt extends Node {
    }

    public interface Expr extends Node {
        /** Source text, whitespace collapsed. */
        String text();
    }

    public record Module(List<Stmt> body, String docstring) {
    }

    // --- statements ---

    public record ClassDef(
            String name,
            List<Expr> bases,
            List<Keyword> keywords,
            List<Expr> decorators,
            List<Stmt> body,
            String docstring,
            int line,
            int endLine
    ) implements Stmt {
    }

    public record FunctionDef(
            String name,
            List<Param> params,
            List<Expr> decorators,
            Expr returns,
            List<Stmt> body,
            String docstring,
            boolean async,
            int line,
            int endLine
    ) implements Stmt {
    }

    public record Param(
            String name,
            String prefix,        // "", "*" or "**"
            Expr annotation,
            Expr defaultValue
    ) {
    }

    public record Import(List<ImportName> names, int line) implements Stmt {
    }

    /** {@code module} is null for "from . import x"; a star import has the single name "*". */
    public record ImportFrom(String module, int level, List<ImportName> names, int line) implements Stmt {
    }

    public record ImportName(String name, String asName) {
    }

    /**
     * Plain, chained ({@code a = b = v}), augmented ({@code a += v}) or annotated assignment.
     * {@code value} is null for a bare annotation.
     */
    public record Assign(List<Expr> targets, Expr value, boolean augmented, Expr annotation, int line)
            implements Stmt {
    }

    public record ExprStmt(Expr value, int line) implements Stmt {
    }

    public record Return(Expr value, int line) implements Stmt {
    }

    public record Delete(List<Expr> targets, int line) implements Stmt {
    }

    /**
     * One clause of a compound statement: if/elif/else, for, while, with, try/except/finally,
     * match/case. {@code tests} are evaluated, {@code targets} are bound.
     */
    public record Block(String keyword, List<Expr> tests, List<Expr> targets, List<Stmt> body, int line)
            implements Stmt {
    }

    /** pass, break, continue, raise, assert, global, nonlocal and similar. */
    public record Simple(String keyword, List<Expr> values, int line) implements Stmt {
    }

    // --- expressions ---

    public record Name(String id, int line) implements Expr {
        @Override
        public String text() {
            return id;
        }
    }

    public record Attribute(Expr value, String attr, int line) implements Expr {
        @Override
        public String text() {
            return value.text() + "." + attr;
        }
    }

    public record Call(Expr func, List<Expr> args, List<Keyword> keywords, String text, int line) implements Expr {
    }

    /** {@code name} is null for {@code **mapping}. */
    public record Keyword(String name, Expr value) {
    }

    /** kind: str, bytes, int, float, complex, bool, None, Ellipsis. */
    public record Constant(String kind, String value, String text, int line) implements Expr {
    }

    public record Starred(Expr value, boolean doubleStar, String text, int line) implements Expr {
    }

    public record Lambda(List<Param> params, Expr body, String text, int line) implements Expr {
    }

    /** kind: listcomp, setcomp, dictcomp, genexp. Dict comprehensions carry key and value as elements. */
    public record Comprehension(String kind, List<Expr> elements, List<ComprehensionFor> generators, String text,
                                int line) implements Expr {
    }

    public record ComprehensionFor(Expr target, Expr iter, List<Expr> conditions) {
    }

    /**
     * kind: tuple, list, set, dict, subscript, slice, binop, unaryop, boolop, compare, ifexp,
     * paren, namedexpr, await, yield, fstring.
     */
    public record Composite(String kind, List<Expr> children, String text, int line) implements Expr {
    }
}
