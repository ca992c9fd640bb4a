package anf.ast;

import java.util.Objects;

import com.google.common.base.Preconditions;

public final class UnaryOp implements Expr {

	private final UnaryOperator operator;
	private final Expr operand;

	public UnaryOp(UnaryOperator operator, Expr operand) {
		this.operator = Preconditions.checkNotNull(operator);
		this.operand = Preconditions.checkNotNull(operand);
	}

	public UnaryOperator getOperator() {
		return operator;
	}

	public Expr getOperand() {
		return operand;
	}

	@Override
	public <T> T match(Matcher<T> matcher) {
		return matcher.case_UnaryOp(this);
	}

	@Override
	public void match(MatcherVoid matcher) {
		matcher.case_UnaryOp(this);
	}

	@Override
	public boolean equals(Object obj) {
		if (obj instanceof UnaryOp) {
			UnaryOp other = (UnaryOp) obj;
			return operator == other.operator && operand.equals(other.operand);
		}
		return false;
	}

	@Override
	public int hashCode() {
		return Objects.hash(operator, operand);
	}

	@Override
	public String toString() {
		return "UnaryOp(" + operator.getSymbol() + " " + operand + ")";
	}
}
