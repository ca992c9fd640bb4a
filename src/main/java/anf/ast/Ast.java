package anf.ast;

import java.util.Arrays;
import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * Static factory for building trees by hand, mainly from tests:
 * {@code Return(Call("f", UnaryOp(NEG, Name("a"))))}.
 */
public final class Ast {

	private Ast() {
	}

	public static Name Name(String id) {
		return new Name(id);
	}

	public static Constant Num(long value) {
		return new Constant(Constant.Kind.NUMBER, Long.toString(value));
	}

	public static Constant Num(String literal) {
		return new Constant(Constant.Kind.NUMBER, literal);
	}

	/** A string constant; the value is quoted with single quotes. */
	public static Constant Str(String value) {
		String escaped = value.replace("\\", "\\\\").replace("'", "\\'");
		return new Constant(Constant.Kind.STRING, "'" + escaped + "'");
	}

	public static Constant Bool(boolean value) {
		return new Constant(Constant.Kind.BOOLEAN, value ? "True" : "False");
	}

	public static Constant None() {
		return new Constant(Constant.Kind.NONE, "None");
	}

	public static BinaryOp BinaryOp(Expr left, BinaryOperator op, Expr right) {
		return new BinaryOp(op, left, right);
	}

	public static UnaryOp UnaryOp(UnaryOperator op, Expr operand) {
		return new UnaryOp(op, operand);
	}

	public static Call Call(String callee, Expr... args) {
		return new Call(new Name(callee), Arrays.asList(args), ImmutableList.of());
	}

	public static Call Call(Expr callee, List<? extends Expr> args, List<Keyword> keywords) {
		return new Call(callee, args, keywords);
	}

	public static Keyword Keyword(String name, Expr value) {
		return new Keyword(name, value);
	}

	public static Tuple Tuple(Expr... elements) {
		return new Tuple(Arrays.asList(elements));
	}

	public static Assign Assign(String target, Expr value) {
		return new Assign(target, value);
	}

	public static Return Return(Expr value) {
		return new Return(value);
	}

	public static Return Return() {
		return new Return(null);
	}

	public static Other Pass() {
		return new Other("pass", ImmutableList.of());
	}

	public static Other ExprStatement(Expr expr) {
		return new Other("", ImmutableList.of(expr));
	}

	public static Other Other(String keyword, Expr... operands) {
		return new Other(keyword, Arrays.asList(operands));
	}

	public static List<String> Params(String... names) {
		return ImmutableList.copyOf(names);
	}

	public static FunctionUnit FunctionUnit(String name, List<String> params, Stmt... body) {
		return new FunctionUnit(name, params, Arrays.asList(body));
	}

	public static Program Program(ProgramItem... items) {
		return new Program(Arrays.asList(items));
	}
}
