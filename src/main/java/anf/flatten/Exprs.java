package anf.flatten;

import anf.ast.BinaryOp;
import anf.ast.Call;
import anf.ast.Constant;
import anf.ast.Expr;
import anf.ast.Name;
import anf.ast.Tuple;
import anf.ast.UnaryOp;

/**
 * Classification of expressions used by the flattener.
 */
public final class Exprs {

	private Exprs() {
	}

	/** Names and constants are simple; they never need a temporary. */
	public static boolean isSimple(Expr e) {
		return e.match(new Expr.Matcher<Boolean>() {
			@Override
			public Boolean case_Name(Name name) {
				return true;
			}

			@Override
			public Boolean case_Constant(Constant constant) {
				return true;
			}

			@Override
			public Boolean case_BinaryOp(BinaryOp binaryOp) {
				return false;
			}

			@Override
			public Boolean case_UnaryOp(UnaryOp unaryOp) {
				return false;
			}

			@Override
			public Boolean case_Call(Call call) {
				return false;
			}

			@Override
			public Boolean case_Tuple(Tuple tuple) {
				return false;
			}
		});
	}

	/**
	 * Binary and unary operations. Calls and tuples are containers: they are
	 * simplified argument by argument but stay at their use site.
	 */
	public static boolean isOperation(Expr e) {
		return e.match(new Expr.Matcher<Boolean>() {
			@Override
			public Boolean case_Name(Name name) {
				return false;
			}

			@Override
			public Boolean case_Constant(Constant constant) {
				return false;
			}

			@Override
			public Boolean case_BinaryOp(BinaryOp binaryOp) {
				return true;
			}

			@Override
			public Boolean case_UnaryOp(UnaryOp unaryOp) {
				return true;
			}

			@Override
			public Boolean case_Call(Call call) {
				return false;
			}

			@Override
			public Boolean case_Tuple(Tuple tuple) {
				return false;
			}
		});
	}
}
