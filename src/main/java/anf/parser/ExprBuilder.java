package anf.parser;

import java.util.List;

import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;

import anf.ast.BinaryOp;
import anf.ast.BinaryOperator;
import anf.ast.Call;
import anf.ast.Constant;
import anf.ast.Expr;
import anf.ast.Keyword;
import anf.ast.Name;
import anf.ast.Tuple;
import anf.ast.UnaryOp;
import anf.ast.UnaryOperator;
import anf.parser.UnnestParser.ArgumentContext;
import anf.parser.UnnestParser.BinaryContext;
import anf.parser.UnnestParser.BoolContext;
import anf.parser.UnnestParser.CallContext;
import anf.parser.UnnestParser.ExprContext;
import anf.parser.UnnestParser.ExprListContext;
import anf.parser.UnnestParser.KeywordArgumentContext;
import anf.parser.UnnestParser.NameContext;
import anf.parser.UnnestParser.NoneContext;
import anf.parser.UnnestParser.NumberContext;
import anf.parser.UnnestParser.ParensContext;
import anf.parser.UnnestParser.PositionalArgumentContext;
import anf.parser.UnnestParser.StringContext;
import anf.parser.UnnestParser.TupleContext;
import anf.parser.UnnestParser.UnaryContext;

import com.google.common.collect.Lists;

/**
 * Turns {@code expr} parse trees into {@link Expr} nodes. Constructs the
 * grammar accepts but the tree cannot express are recorded as errors.
 */
class ExprBuilder extends UnnestBaseVisitor<Expr> {

	private final List<String> errors;

	ExprBuilder(List<String> errors) {
		this.errors = errors;
	}

	Expr build(ExprContext ctx) {
		return visit(ctx);
	}

	/** A comma separated list is a tuple; a single expression is itself. */
	Expr build(ExprListContext ctx) {
		List<ExprContext> exprs = ctx.expr();
		if (exprs.size() == 1 && ctx.trailingComma == null) {
			return build(exprs.get(0));
		}
		return new Tuple(buildAll(exprs));
	}

	private List<Expr> buildAll(List<ExprContext> exprs) {
		List<Expr> result = Lists.newArrayList();
		for (ExprContext e : exprs) {
			result.add(build(e));
		}
		return result;
	}

	@Override
	public Expr visitCall(CallContext ctx) {
		Expr callee = build(ctx.expr());
		List<Expr> args = Lists.newArrayList();
		List<Keyword> keywords = Lists.newArrayList();
		if (ctx.arguments() != null) {
			for (ArgumentContext a : ctx.arguments().argument()) {
				if (a instanceof KeywordArgumentContext) {
					KeywordArgumentContext kw = (KeywordArgumentContext) a;
					keywords.add(new Keyword(kw.NAME().getText(), build(kw.expr())));
				} else {
					if (!keywords.isEmpty()) {
						error(a, "positional argument follows keyword argument");
					}
					args.add(build(((PositionalArgumentContext) a).expr()));
				}
			}
		}
		return new Call(callee, args, keywords);
	}

	@Override
	public Expr visitBinary(BinaryContext ctx) {
		BinaryOperator op = BinaryOperator.fromSymbol(ctx.op.getText());
		if (op.isComparison() && isComparison(ctx.expr(0))) {
			error(ctx, "chained comparisons are not supported");
		}
		return new BinaryOp(op, build(ctx.expr(0)), build(ctx.expr(1)));
	}

	private static boolean isComparison(ExprContext ctx) {
		return ctx instanceof BinaryContext
				&& BinaryOperator.fromSymbol(((BinaryContext) ctx).op.getText()).isComparison();
	}

	@Override
	public Expr visitUnary(UnaryContext ctx) {
		return new UnaryOp(UnaryOperator.fromSymbol(ctx.op.getText()), build(ctx.expr()));
	}

	@Override
	public Expr visitParens(ParensContext ctx) {
		return build(ctx.expr());
	}

	@Override
	public Expr visitTuple(TupleContext ctx) {
		return new Tuple(buildAll(ctx.expr()));
	}

	@Override
	public Expr visitName(NameContext ctx) {
		return new Name(ctx.NAME().getText());
	}

	@Override
	public Expr visitNumber(NumberContext ctx) {
		return new Constant(Constant.Kind.NUMBER, ctx.NUMBER().getText());
	}

	@Override
	public Expr visitString(StringContext ctx) {
		return new Constant(Constant.Kind.STRING, ctx.STRING().getText());
	}

	@Override
	public Expr visitBool(BoolContext ctx) {
		return new Constant(Constant.Kind.BOOLEAN, ctx.value.getText());
	}

	@Override
	public Expr visitNone(NoneContext ctx) {
		return new Constant(Constant.Kind.NONE, "None");
	}

	private void error(ParserRuleContext ctx, String msg) {
		Token start = ctx.getStart();
		errors.add("line " + start.getLine() + ":" + start.getCharPositionInLine() + " " + msg);
	}
}
