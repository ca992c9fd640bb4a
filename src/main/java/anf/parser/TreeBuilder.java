package anf.parser;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.tree.ParseTree;
import org.antlr.v4.runtime.tree.TerminalNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import anf.ast.Assign;
import anf.ast.Expr;
import anf.ast.FunctionUnit;
import anf.ast.Other;
import anf.ast.Program;
import anf.ast.ProgramItem;
import anf.ast.Return;
import anf.ast.Stmt;
import anf.parser.UnnestParser.AssertStatementContext;
import anf.parser.UnnestParser.AssignStatementContext;
import anf.parser.UnnestParser.ExprContext;
import anf.parser.UnnestParser.ExprStatementContext;
import anf.parser.UnnestParser.FunctionDefContext;
import anf.parser.UnnestParser.PassStatementContext;
import anf.parser.UnnestParser.ProgramContext;
import anf.parser.UnnestParser.ReturnStatementContext;
import anf.parser.UnnestParser.SimpleStatementContext;
import anf.parser.UnnestParser.StatementContext;
import anf.parser.UnnestParser.SuiteContext;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

/**
 * Parses source text into a {@link Program}.
 */
public class TreeBuilder {
	private static final Logger LOG = LoggerFactory.getLogger(TreeBuilder.class);

	public static final int MAX_EXPR_DEPTH = 200;

	private final List<String> errors = Lists.newArrayList();
	private final ExprBuilder exprBuilder = new ExprBuilder(errors);

	private TreeBuilder() {
	}

	public static Program parse(String source) throws UnnestSyntaxException {
		return parse(source, "<string>");
	}

	public static Program parse(String source, String sourceName) throws UnnestSyntaxException {
		UnnestLexer lexer = new UnnestLexer(CharStreams.fromString(source, sourceName));
		ErrorListener errListener = new ErrorListener();
		lexer.removeErrorListeners();
		lexer.addErrorListener(errListener);

		IndentationTokenSource tokenSource = new IndentationTokenSource(lexer);
		CommonTokenStream tokens = new CommonTokenStream(tokenSource);
		UnnestParser parser = new UnnestParser(tokens);
		parser.removeErrorListeners();
		parser.addErrorListener(errListener);

		TreeBuilder builder = new TreeBuilder();
		Program prog;
		try {
			ProgramContext tree = parser.program();

			builder.errors.addAll(tokenSource.getErrors());
			builder.errors.addAll(errListener.getErrors());
			if (builder.errors.isEmpty()) {
				builder.checkNesting(tree);
			}
			if (!builder.errors.isEmpty()) {
				throw new UnnestSyntaxException(builder.errors);
			}
			prog = builder.program(tree);
		} catch (StackOverflowError e) {
			// nesting the limits above do not cover, e.g. thousands of prefix operators
			List<String> errors = Lists.newArrayList(tokenSource.getErrors());
			if (errors.isEmpty()) {
				errors.add("line 1:0 input is nested too deeply");
			}
			throw new UnnestSyntaxException(errors);
		}
		if (!builder.errors.isEmpty()) {
			throw new UnnestSyntaxException(builder.errors);
		}
		LOG.debug("parsed {}: {} items", sourceName, prog.getItems().size());
		return prog;
	}

	/**
	 * Rejects expressions nested deeper than {@link #MAX_EXPR_DEPTH}. The
	 * parser builds long operator chains in a loop, but building and printing
	 * the tree recurse once per level.
	 */
	private void checkNesting(ProgramContext tree) {
		Deque<ParseTree> todo = new ArrayDeque<>();
		Deque<Integer> depths = new ArrayDeque<>();
		todo.push(tree);
		depths.push(0);
		while (!todo.isEmpty()) {
			ParseTree node = todo.pop();
			int depth = depths.pop();
			if (node instanceof ExprContext) {
				depth++;
				if (depth > MAX_EXPR_DEPTH) {
					Token start = ((ExprContext) node).getStart();
					errors.add("line " + start.getLine() + ":" + start.getCharPositionInLine()
							+ " expression nested too deeply");
					return;
				}
			}
			for (int i = 0; i < node.getChildCount(); i++) {
				todo.push(node.getChild(i));
				depths.push(depth);
			}
		}
	}

	private Program program(ProgramContext ctx) {
		List<ProgramItem> items = Lists.newArrayList();
		for (ParseTree child : ctx.children) {
			if (child instanceof FunctionDefContext) {
				items.add(function((FunctionDefContext) child));
			} else if (child instanceof StatementContext) {
				items.add(statement(((StatementContext) child).simpleStatement()));
			}
		}
		return new Program(items);
	}

	private FunctionUnit function(FunctionDefContext ctx) {
		List<String> params = Lists.newArrayList();
		if (ctx.parameters() != null) {
			for (TerminalNode p : ctx.parameters().NAME()) {
				params.add(p.getText());
			}
		}
		return new FunctionUnit(ctx.NAME().getText(), params, suite(ctx.suite()));
	}

	private List<Stmt> suite(SuiteContext ctx) {
		if (ctx.simpleStatement() != null) {
			return ImmutableList.of(statement(ctx.simpleStatement()));
		}
		List<Stmt> body = Lists.newArrayList();
		for (StatementContext s : ctx.statement()) {
			body.add(statement(s.simpleStatement()));
		}
		return body;
	}

	private Stmt statement(SimpleStatementContext ctx) {
		if (ctx instanceof ReturnStatementContext) {
			ReturnStatementContext r = (ReturnStatementContext) ctx;
			return new Return(r.exprList() == null ? null : exprBuilder.build(r.exprList()));
		} else if (ctx instanceof AssignStatementContext) {
			AssignStatementContext a = (AssignStatementContext) ctx;
			return new Assign(a.NAME().getText(), exprBuilder.build(a.exprList()));
		} else if (ctx instanceof PassStatementContext) {
			return new Other("pass", ImmutableList.of());
		} else if (ctx instanceof AssertStatementContext) {
			List<Expr> operands = Lists.newArrayList();
			for (ExprContext e : ((AssertStatementContext) ctx).expr()) {
				operands.add(exprBuilder.build(e));
			}
			return new Other("assert", operands);
		} else if (ctx instanceof ExprStatementContext) {
			Expr e = exprBuilder.build(((ExprStatementContext) ctx).exprList());
			return new Other("", ImmutableList.of(e));
		}
		throw new Error("unhandled statement " + ctx.getClass().getSimpleName());
	}
}
