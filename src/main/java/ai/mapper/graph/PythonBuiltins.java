package ai.mapper.graph;

import java.util.Set;

/**
 * Names bound in Python's builtins module.
 */
final class PythonBuiltins {

    static final String MODULE = "builtins";

    private static final Set<String> NAMES = Set.of(
            "abs", "aiter", "all", "anext", "any", "ascii", "bin", "bool", "breakpoint", "bytearray",
            "bytes", "callable", "chr", "classmethod", "compile", "complex", "copyright", "credits",
            "delattr", "dict", "dir", "divmod", "enumerate", "eval", "exec", "exit", "filter", "float",
            "format", "frozenset", "getattr", "globals", "hasattr", "hash", "help", "hex", "id", "input",
            "int", "isinstance", "issubclass", "iter", "len", "license", "list", "locals", "map", "max",
            "memoryview", "min", "next", "object", "oct", "open", "ord", "pow", "print", "property",
            "quit", "range", "repr", "reversed", "round", "set", "setattr", "slice", "sorted",
            "staticmethod", "str", "sum", "super", "tuple", "type", "vars", "zip", "__import__",
            "__build_class__", "__debug__", "__doc__", "__name__", "__file__", "__package__", "__spec__",
            "__loader__", "NotImplemented", "Ellipsis",
            "BaseException", "BaseExceptionGroup", "Exception", "ExceptionGroup", "ArithmeticError",
            "AssertionError", "AttributeError", "BlockingIOError", "BrokenPipeError", "BufferError",
            "ChildProcessError", "ConnectionAbortedError", "ConnectionError", "ConnectionRefusedError",
            "ConnectionResetError", "EOFError", "EnvironmentError", "FileExistsError", "FileNotFoundError",
            "FloatingPointError", "GeneratorExit", "IOError", "ImportError", "IndentationError", "IndexError",
            "InterruptedError", "IsADirectoryError", "KeyError", "KeyboardInterrupt", "LookupError",
            "MemoryError", "ModuleNotFoundError", "NameError", "NotADirectoryError", "NotImplementedError",
            "OSError", "OverflowError", "PermissionError", "ProcessLookupError", "RecursionError",
            "ReferenceError", "RuntimeError", "StopAsyncIteration", "StopIteration", "SyntaxError",
            "SystemError", "SystemExit", "TabError", "TimeoutError", "TypeError", "UnboundLocalError",
            "UnicodeDecodeError", "UnicodeEncodeError", "UnicodeError", "UnicodeTranslateError",
            "ValueError", "ZeroDivisionError",
            "BytesWarning", "DeprecationWarning", "EncodingWarning", "FutureWarning", "ImportWarning",
            "PendingDeprecationWarning", "ResourceWarning", "RuntimeWarning", "SyntaxWarning",
            "UnicodeWarning", "UserWarning", "Warning");

    private PythonBuiltins() {
    }

    static boolean contains(String name) {
        return NAMES.contains(name);
    }
}
