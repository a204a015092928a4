package com.autodoc.core.analyzer.impl.python.util;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.misc.Interval;
import org.antlr.v4.runtime.tree.TerminalNode;

import com.autodoc.core.analyzer.ast.PythonAst;
import com.autodoc.core.analyzer.ast.PythonAst.Node;
import com.autodoc.core.analyzer.ast.PythonAst.NodeKind;
import com.autodoc.parser.Python3Lexer;
import com.autodoc.parser.Python3Parser;
import com.autodoc.parser.Python3ParserBaseVisitor;

/**
 * Reduces an ANTLR parse tree to the neutral {@link PythonAst} tree.
 *
 * <p>Each visit returns the kept nodes found below a parse-tree node; rules without a
 * counterpart in {@link PythonAst} simply pass their children's nodes up. One builder
 * handles one file.
 */
final class PythonTreeBuilder extends Python3ParserBaseVisitor<List<Node>> {

    private static final Set<Integer> LAYOUT_TOKENS = Set.of(
        Python3Lexer.NEWLINE, Python3Lexer.INDENT, Python3Lexer.DEDENT, Token.EOF);

    private static final Set<String> MAIN_GUARDS = Set.of(
        "__name__==\"__main__\"", "__name__=='__main__'",
        "\"__main__\"==__name__", "'__main__'==__name__");

    private final CommonTokenStream tokens;

    PythonTreeBuilder(CommonTokenStream tokens) {
        this.tokens = tokens;
    }

    /**
     * Builds the module node for a parsed file.
     *
     * @param fileInput root of the parse tree
     * @param lineCount number of source lines
     * @return module node
     */
    PythonAst.ModuleDef build(Python3Parser.File_inputContext fileInput, int lineCount) {
        List<Python3Parser.StmtContext> statements = fileInput.stmt();
        String docstring = statements.isEmpty() ? null : docstringOf(statements.get(0).simple_stmts());
        boolean mainGuard = statements.stream()
            .map(Python3Parser.StmtContext::compound_stmt)
            .filter(compound -> compound != null && compound.if_stmt() != null)
            .anyMatch(compound -> MAIN_GUARDS.contains(compound.if_stmt().namedexpr_test().getText()));
        return new PythonAst.ModuleDef(docstring, lineCount, mainGuard, visitChildren(fileInput));
    }

    @Override
    protected List<Node> defaultResult() {
        return List.of();
    }

    @Override
    protected List<Node> aggregateResult(List<Node> aggregate, List<Node> nextResult) {
        if (nextResult.isEmpty()) {
            return aggregate;
        }
        List<Node> merged = aggregate instanceof ArrayList ? aggregate : new ArrayList<>(aggregate);
        merged.addAll(nextResult);
        return merged;
    }

    // --- scopes ---

    @Override
    public List<Node> visitDecorated(Python3Parser.DecoratedContext ctx) {
        List<String> decorators = ctx.decorators().decorator().stream()
            .map(this::decoratorName)
            .toList();
        if (ctx.classdef() != null) {
            return List.of(classDef(ctx.classdef(), decorators));
        }
        if (ctx.funcdef() != null) {
            return List.of(functionDef(ctx.funcdef(), decorators, false));
        }
        return List.of(functionDef(ctx.async_funcdef().funcdef(), decorators, true));
    }

    @Override
    public List<Node> visitClassdef(Python3Parser.ClassdefContext ctx) {
        return List.of(classDef(ctx, List.of()));
    }

    @Override
    public List<Node> visitFuncdef(Python3Parser.FuncdefContext ctx) {
        return List.of(functionDef(ctx, List.of(), false));
    }

    @Override
    public List<Node> visitAsync_funcdef(Python3Parser.Async_funcdefContext ctx) {
        return List.of(functionDef(ctx.funcdef(), List.of(), true));
    }

    @Override
    public List<Node> visitAsync_stmt(Python3Parser.Async_stmtContext ctx) {
        if (ctx.funcdef() != null) {
            return List.of(functionDef(ctx.funcdef(), List.of(), true));
        }
        return visitChildren(ctx);
    }

    private PythonAst.ClassDef classDef(Python3Parser.ClassdefContext ctx, List<String> decorators) {
        List<String> bases = new ArrayList<>();
        if (ctx.arglist() != null) {
            for (Python3Parser.ArgumentContext argument : ctx.arglist().argument()) {
                boolean positional = argument.ASSIGN() == null && argument.WALRUS() == null
                    && argument.STAR() == null && argument.POWER() == null && argument.comp_for() == null;
                if (positional) {
                    bases.add(text(argument.test(0)));
                }
            }
        }
        return new PythonAst.ClassDef(
            ctx.NAME().getText(),
            bases,
            decorators,
            docstringOf(ctx.block()),
            ctx.getStart().getLine(),
            endLine(ctx),
            visit(ctx.block())
        );
    }

    private PythonAst.FunctionDef functionDef(Python3Parser.FuncdefContext ctx, List<String> decorators, boolean async) {
        return new PythonAst.FunctionDef(
            ctx.NAME().getText(),
            parameters(ctx.parameters().typedargslist()),
            ctx.test() != null ? text(ctx.test()) : null,
            decorators,
            docstringOf(ctx.block()),
            async,
            ctx.getStart().getLine(),
            endLine(ctx),
            visit(ctx.block())
        );
    }

    private List<PythonAst.Parameter> parameters(Python3Parser.TypedargslistContext ctx) {
        if (ctx == null) {
            return List.of();
        }
        List<PythonAst.Parameter> parameters = new ArrayList<>();
        for (Python3Parser.TypedargContext arg : ctx.typedarg()) {
            Python3Parser.TfpdefContext def = arg.tfpdef();
            if (def == null) {
                // bare '*' or '/' separator
                continue;
            }
            String prefix = arg.STAR() != null ? "*" : arg.POWER() != null ? "**" : "";
            parameters.add(new PythonAst.Parameter(
                prefix + def.NAME().getText(),
                def.test() != null ? text(def.test()) : null,
                arg.test() != null ? text(arg.test()) : null
            ));
        }
        return parameters;
    }

    private String decoratorName(Python3Parser.DecoratorContext ctx) {
        String expression = ctx.namedexpr_test().getText();
        int call = expression.indexOf('(');
        return call >= 0 ? expression.substring(0, call) : expression;
    }

    // --- imports ---

    @Override
    public List<Node> visitImport_name(Python3Parser.Import_nameContext ctx) {
        List<PythonAst.ImportAlias> names = ctx.dotted_as_names().dotted_as_name().stream()
            .map(name -> new PythonAst.ImportAlias(
                name.dotted_name().getText(),
                name.NAME() != null ? name.NAME().getText() : null))
            .toList();
        return List.of(new PythonAst.Import(names, ctx.getStart().getLine()));
    }

    @Override
    public List<Node> visitImport_from(Python3Parser.Import_fromContext ctx) {
        int level = 0;
        if (ctx.relative_prefix() != null) {
            level = ctx.relative_prefix().DOT().size() + 3 * ctx.relative_prefix().ELLIPSIS().size();
        }
        String module = ctx.dotted_name() != null ? ctx.dotted_name().getText() : "";

        List<PythonAst.ImportAlias> names = new ArrayList<>();
        Python3Parser.Import_targetsContext targets = ctx.import_targets();
        if (targets.STAR() != null) {
            names.add(new PythonAst.ImportAlias("*", null));
        } else {
            for (Python3Parser.Import_as_nameContext name : targets.import_as_names().import_as_name()) {
                List<TerminalNode> parts = name.NAME();
                names.add(new PythonAst.ImportAlias(
                    parts.get(0).getText(),
                    parts.size() > 1 ? parts.get(1).getText() : null));
            }
        }
        return List.of(new PythonAst.ImportFrom(module, level, names, ctx.getStart().getLine()));
    }

    // --- decision points ---

    @Override
    public List<Node> visitIf_stmt(Python3Parser.If_stmtContext ctx) {
        List<Node> nodes = new ArrayList<>();
        nodes.add(new PythonAst.Branch(NodeKind.IF, ctx.getStart().getLine(),
            concat(visit(ctx.namedexpr_test()), visit(ctx.block()))));
        for (Python3Parser.Elif_clauseContext elif : ctx.elif_clause()) {
            nodes.add(new PythonAst.Branch(NodeKind.ELIF, elif.getStart().getLine(),
                concat(visit(elif.namedexpr_test()), visit(elif.block()))));
        }
        if (ctx.else_clause() != null) {
            nodes.addAll(visit(ctx.else_clause()));
        }
        return nodes;
    }

    @Override
    public List<Node> visitWhile_stmt(Python3Parser.While_stmtContext ctx) {
        return List.of(new PythonAst.Branch(NodeKind.WHILE, ctx.getStart().getLine(), visitChildren(ctx)));
    }

    @Override
    public List<Node> visitFor_stmt(Python3Parser.For_stmtContext ctx) {
        return List.of(new PythonAst.Branch(NodeKind.FOR, ctx.getStart().getLine(), visitChildren(ctx)));
    }

    @Override
    public List<Node> visitExcept_clause(Python3Parser.Except_clauseContext ctx) {
        return List.of(new PythonAst.Branch(NodeKind.EXCEPT_HANDLER, ctx.getStart().getLine(), visitChildren(ctx)));
    }

    @Override
    public List<Node> visitComp_if(Python3Parser.Comp_ifContext ctx) {
        return List.of(new PythonAst.Branch(NodeKind.COMPREHENSION_FILTER, ctx.getStart().getLine(), visitChildren(ctx)));
    }

    @Override
    public List<Node> visitTest(Python3Parser.TestContext ctx) {
        if (ctx.IF() == null) {
            return visitChildren(ctx);
        }
        return List.of(new PythonAst.Branch(NodeKind.TERNARY, ctx.getStart().getLine(), visitChildren(ctx)));
    }

    @Override
    public List<Node> visitOr_test(Python3Parser.Or_testContext ctx) {
        if (ctx.OR().isEmpty()) {
            return visitChildren(ctx);
        }
        return List.of(new PythonAst.BoolOp("or", ctx.and_test().size(), ctx.getStart().getLine(), visitChildren(ctx)));
    }

    @Override
    public List<Node> visitAnd_test(Python3Parser.And_testContext ctx) {
        if (ctx.AND().isEmpty()) {
            return visitChildren(ctx);
        }
        return List.of(new PythonAst.BoolOp("and", ctx.not_test().size(), ctx.getStart().getLine(), visitChildren(ctx)));
    }

    // --- compound statements without decisions ---

    @Override
    public List<Node> visitTry_stmt(Python3Parser.Try_stmtContext ctx) {
        return List.of(new PythonAst.Block(ctx.getStart().getLine(), visitChildren(ctx)));
    }

    @Override
    public List<Node> visitWith_stmt(Python3Parser.With_stmtContext ctx) {
        return List.of(new PythonAst.Block(ctx.getStart().getLine(), visitChildren(ctx)));
    }

    // --- calls ---

    @Override
    public List<Node> visitAtom_expr(Python3Parser.Atom_exprContext ctx) {
        List<Node> result = visit(ctx.atom());
        String target = ctx.atom().NAME() != null ? ctx.atom().NAME().getText() : null;
        String lastAttribute = null;

        for (Python3Parser.TrailerContext trailer : ctx.trailer()) {
            if (trailer.DOT() != null) {
                String attribute = trailer.NAME().getText();
                target = target != null ? target + "." + attribute : null;
                lastAttribute = attribute;
            } else if (trailer.OPEN_PAREN() != null) {
                List<Node> arguments = trailer.arglist() != null ? visit(trailer.arglist()) : List.of();
                String callee = target != null ? target : lastAttribute;
                result = List.of(new PythonAst.Call(callee, trailer.getStart().getLine(), concat(result, arguments)));
                // further trailers apply to the call's return value
                target = null;
                lastAttribute = null;
            } else {
                result = concat(result, visit(trailer.subscriptlist()));
                target = null;
                lastAttribute = null;
            }
        }
        return result;
    }

    // --- helpers ---

    private String docstringOf(Python3Parser.BlockContext block) {
        if (block.simple_stmts() != null) {
            return docstringOf(block.simple_stmts());
        }
        return docstringOf(block.stmt(0).simple_stmts());
    }

    /**
     * Returns the docstring when the statement line starts with a bare string literal
     * expression (implicit concatenation allowed).
     */
    private String docstringOf(Python3Parser.Simple_stmtsContext statements) {
        if (statements == null) {
            return null;
        }
        Python3Parser.Expr_stmtContext expression = statements.simple_stmt(0).expr_stmt();
        if (expression == null) {
            return null;
        }
        StringBuilder value = new StringBuilder();
        for (int i = expression.getStart().getTokenIndex(); i <= expression.getStop().getTokenIndex(); i++) {
            Token token = tokens.get(i);
            if (token.getType() != Python3Lexer.STRING) {
                return null;
            }
            value.append(Docstrings.literalValue(token.getText()));
        }
        return Docstrings.clean(value.toString());
    }

    /**
     * Returns the line of the last source token of a definition, skipping the synthetic
     * layout tokens that close its block.
     */
    private int endLine(ParserRuleContext ctx) {
        int index = ctx.getStop().getTokenIndex();
        int first = ctx.getStart().getTokenIndex();
        while (index > first && LAYOUT_TOKENS.contains(tokens.get(index).getType())) {
            index--;
        }
        Token last = tokens.get(index);
        return last.getLine() + (int) last.getText().chars().filter(ch -> ch == '\n').count();
    }

    private static String text(ParserRuleContext ctx) {
        Token start = ctx.getStart();
        Token stop = ctx.getStop();
        if (stop == null || stop.getStopIndex() < start.getStartIndex()) {
            return ctx.getText();
        }
        String source = start.getInputStream().getText(Interval.of(start.getStartIndex(), stop.getStopIndex()));
        return source.replaceAll("\\s+", " ").strip();
    }

    private static List<Node> concat(List<Node> first, List<Node> second) {
        if (first.isEmpty()) {
            return second;
        }
        if (second.isEmpty()) {
            return first;
        }
        List<Node> merged = new ArrayList<>(first.size() + second.size());
        merged.addAll(first);
        merged.addAll(second);
        return merged;
    }
}
