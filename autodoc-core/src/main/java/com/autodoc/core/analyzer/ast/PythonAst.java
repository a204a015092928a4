package com.autodoc.core.analyzer.ast;

import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Language-neutral syntax tree for Python source code.
 *
 * <p>The tree keeps only what structural analysis needs: scopes (module, class, function),
 * imports, decision points and call sites. Everything else collapses into the children of
 * the nearest kept node, so a call inside an {@code if} condition is a child of the
 * {@link Branch}, and statements inside a {@code try} body are children of a {@link Block}.
 *
 * <p>Nodes are immutable records. {@link Node#kind()} gives a closed tag that passes such as
 * complexity counting switch over exhaustively.
 *
 * @see com.autodoc.core.analyzer.impl.python.util.PythonAstParser
 */
public final class PythonAst {

    private PythonAst() {
        // Utility class - no instantiation
    }

    /**
     * Closed set of node tags.
     */
    public enum NodeKind {
        MODULE,
        CLASS_DEF,
        FUNCTION_DEF,
        IMPORT,
        IMPORT_FROM,
        IF,
        ELIF,
        WHILE,
        FOR,
        EXCEPT_HANDLER,
        BOOL_OP,
        COMPREHENSION_FILTER,
        TERNARY,
        CALL,
        BLOCK
    }

    /**
     * Common shape of every tree node.
     */
    public sealed interface Node permits ModuleDef, ClassDef, FunctionDef, Import, ImportFrom, Branch, BoolOp, Call, Block {

        NodeKind kind();

        /**
         * Returns the 1-based line where the node starts.
         */
        int line();

        List<Node> children();
    }

    /**
     * Root of a parsed file.
     *
     * @param docstring cleaned module docstring, or null
     * @param lineCount number of source lines
     * @param mainGuard whether a top-level {@code if __name__ == "__main__":} block is present
     * @param children top-level nodes
     */
    public record ModuleDef(String docstring, int lineCount, boolean mainGuard, List<Node> children) implements Node {
        public ModuleDef {
            children = children != null ? List.copyOf(children) : List.of();
        }

        @Override
        public NodeKind kind() {
            return NodeKind.MODULE;
        }

        @Override
        public int line() {
            return 1;
        }
    }

    /**
     * A class definition.
     *
     * <p>Example:
     * <pre>{@code
     * @dataclass
     * class User(BaseModel):
     *     """A registered user."""
     * }</pre>
     *
     * @param name class name (e.g., "User")
     * @param bases base class expressions (e.g., ["BaseModel"])
     * @param decorators decorator names without arguments (e.g., ["dataclass"])
     * @param docstring cleaned docstring, or null
     * @param line line of the {@code class} keyword
     * @param endLine last line of the body
     * @param children nodes of the class body
     */
    public record ClassDef(
        String name,
        List<String> bases,
        List<String> decorators,
        String docstring,
        int line,
        int endLine,
        List<Node> children
    ) implements Node {
        public ClassDef {
            Objects.requireNonNull(name, "name must not be null");
            bases = bases != null ? List.copyOf(bases) : List.of();
            decorators = decorators != null ? List.copyOf(decorators) : List.of();
            children = children != null ? List.copyOf(children) : List.of();
        }

        @Override
        public NodeKind kind() {
            return NodeKind.CLASS_DEF;
        }
    }

    /**
     * A function definition ({@code def} or {@code async def}).
     *
     * @param name function name
     * @param parameters parameters in declaration order
     * @param returnType return annotation text, or null
     * @param decorators decorator names without arguments (e.g., ["app.route"])
     * @param docstring cleaned docstring, or null
     * @param async whether declared with {@code async def}
     * @param line line of the {@code def} keyword
     * @param endLine last line of the body
     * @param children nodes of the function body
     */
    public record FunctionDef(
        String name,
        List<Parameter> parameters,
        String returnType,
        List<String> decorators,
        String docstring,
        boolean async,
        int line,
        int endLine,
        List<Node> children
    ) implements Node {
        public FunctionDef {
            Objects.requireNonNull(name, "name must not be null");
            parameters = parameters != null ? List.copyOf(parameters) : List.of();
            decorators = decorators != null ? List.copyOf(decorators) : List.of();
            children = children != null ? List.copyOf(children) : List.of();
        }

        @Override
        public NodeKind kind() {
            return NodeKind.FUNCTION_DEF;
        }
    }

    /**
     * A function parameter.
     *
     * @param name parameter name, with {@code *} or {@code **} for variadic parameters
     * @param type annotation text, or null
     * @param defaultValue default expression text, or null
     */
    public record Parameter(String name, String type, String defaultValue) {
        public Parameter {
            Objects.requireNonNull(name, "name must not be null");
        }
    }

    /**
     * One imported name with its optional alias.
     *
     * @param name dotted module path or member name
     * @param alias {@code as} name, or null
     */
    public record ImportAlias(String name, String alias) {
        public ImportAlias {
            Objects.requireNonNull(name, "name must not be null");
        }
    }

    /**
     * {@code import a.b as c, d}.
     *
     * @param names imported modules
     * @param line statement line
     */
    public record Import(List<ImportAlias> names, int line) implements Node {
        public Import {
            names = names != null ? List.copyOf(names) : List.of();
        }

        @Override
        public NodeKind kind() {
            return NodeKind.IMPORT;
        }

        @Override
        public List<Node> children() {
            return List.of();
        }
    }

    /**
     * {@code from ..pkg.mod import a, b as c}.
     *
     * @param module dotted module path, empty for {@code from . import x}
     * @param level number of leading dots
     * @param names imported members ({@code *} for a star import)
     * @param line statement line
     */
    public record ImportFrom(String module, int level, List<ImportAlias> names, int line) implements Node {
        public ImportFrom {
            module = module != null ? module : "";
            names = names != null ? List.copyOf(names) : List.of();
        }

        @Override
        public NodeKind kind() {
            return NodeKind.IMPORT_FROM;
        }

        @Override
        public List<Node> children() {
            return List.of();
        }
    }

    /**
     * A single decision point: {@code if}, {@code elif}, loop, {@code except} handler,
     * comprehension filter or conditional expression.
     *
     * @param kind one of the decision kinds
     * @param line line of the keyword
     * @param children nodes of the condition and body
     */
    public record Branch(NodeKind kind, int line, List<Node> children) implements Node {

        private static final Set<NodeKind> DECISIONS = EnumSet.of(
            NodeKind.IF, NodeKind.ELIF, NodeKind.WHILE, NodeKind.FOR,
            NodeKind.EXCEPT_HANDLER, NodeKind.COMPREHENSION_FILTER, NodeKind.TERNARY);

        public Branch {
            Objects.requireNonNull(kind, "kind must not be null");
            if (!DECISIONS.contains(kind)) {
                throw new IllegalArgumentException("not a branch kind: " + kind);
            }
            children = children != null ? List.copyOf(children) : List.of();
        }
    }

    /**
     * A chain of {@code and} or {@code or} operators over several operands.
     *
     * @param operator "and" or "or"
     * @param operands number of operands, at least 2
     * @param line line of the first operand
     * @param children nodes inside the operands
     */
    public record BoolOp(String operator, int operands, int line, List<Node> children) implements Node {
        public BoolOp {
            Objects.requireNonNull(operator, "operator must not be null");
            if (operands < 2) {
                throw new IllegalArgumentException("boolean operation needs at least 2 operands: " + operands);
            }
            children = children != null ? List.copyOf(children) : List.of();
        }

        @Override
        public NodeKind kind() {
            return NodeKind.BOOL_OP;
        }
    }

    /**
     * A call site.
     *
     * <p>The callee is the dotted target text when the call is made on a plain name or
     * attribute chain ({@code save}, {@code self.repo.save}), the last attribute when the
     * receiver is another expression ({@code "x".join} gives {@code join}), and null when
     * the target has no name at all ({@code handlers[0]()}).
     *
     * @param callee callee name, or null
     * @param line call line
     * @param children receiver and argument nodes
     */
    public record Call(String callee, int line, List<Node> children) implements Node {
        public Call {
            children = children != null ? List.copyOf(children) : List.of();
        }

        @Override
        public NodeKind kind() {
            return NodeKind.CALL;
        }
    }

    /**
     * A compound statement without its own decision point ({@code try}, {@code with}).
     *
     * @param line statement line
     * @param children nodes of all clauses
     */
    public record Block(int line, List<Node> children) implements Node {
        public Block {
            children = children != null ? List.copyOf(children) : List.of();
        }

        @Override
        public NodeKind kind() {
            return NodeKind.BLOCK;
        }
    }
}
