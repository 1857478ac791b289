package ai.mapper.graph;

import ai.mapper.modules.ModuleNames.ModuleName;
import ai.mapper.syntax.PyAst;

import java.util.List;
import java.util.Objects;

/**
 * Pass-1 output for one file: its module name, its declarations in source order and the parsed
 * tree, kept for the extraction pass.
 */
public record FileHierarchy(
        String path,
        ModuleName module,
        List<Declaration> declarations,
        PyAst.Module syntax
) {
    public FileHierarchy {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(module, "module");
        Objects.requireNonNull(syntax, "syntax");
        declarations = List.copyOf(declarations);
    }
}
