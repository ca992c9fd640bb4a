package anf.ast;

import java.util.Objects;

import com.google.common.base.Preconditions;

public final class BinaryOp implements Expr {

	private final BinaryOperator operator;
	private final Expr left;
	private final Expr right;

	public BinaryOp(BinaryOperator operator, Expr left, Expr right) {
		this.operator = Preconditions.checkNotNull(operator);
		this.left = Preconditions.checkNotNull(left);
		this.right = Preconditions.checkNotNull(right);
	}

	public BinaryOperator getOperator() {
		return operator;
	}

	public Expr getLeft() {
		return left;
	}

	public Expr getRight() {
		return right;
	}

	@Override
	public <T> T match(Matcher<T> matcher) {
		return matcher.case_BinaryOp(this);
	}

	@Override
	public void match(MatcherVoid matcher) {
		matcher.case_BinaryOp(this);
	}

	@Override
	public boolean equals(Object obj) {
		if (obj instanceof BinaryOp) {
			BinaryOp other = (BinaryOp) obj;
			return operator == other.operator
					&& left.equals(other.left)
					&& right.equals(other.right);
		}
		return false;
	}

	@Override
	public int hashCode() {
		return Objects.hash(operator, left, right);
	}

	@Override
	public String toString() {
		return "BinaryOp(" + left + " " + operator.getSymbol() + " " + right + ")";
	}
}
