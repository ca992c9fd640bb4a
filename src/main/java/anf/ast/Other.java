package anf.ast;

import java.util.List;
import java.util.Objects;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * Any statement that the flattener does not inspect as a whole, for example
 * {@code pass}, {@code assert cond, msg} or an expression statement (which
 * has an empty keyword and a single operand). Operands are still rewritten.
 */
public final class Other implements Stmt {

	private final String keyword;
	private final ImmutableList<Expr> operands;

	public Other(String keyword, List<? extends Expr> operands) {
		this.keyword = Preconditions.checkNotNull(keyword);
		this.operands = ImmutableList.copyOf(operands);
	}

	public String getKeyword() {
		return keyword;
	}

	public ImmutableList<Expr> getOperands() {
		return operands;
	}

	public boolean isExpressionStatement() {
		return keyword.isEmpty();
	}

	public Other withOperands(List<? extends Expr> newOperands) {
		return new Other(keyword, newOperands);
	}

	@Override
	public <T> T match(Stmt.Matcher<T> matcher) {
		return matcher.case_Other(this);
	}

	@Override
	public boolean equals(Object obj) {
		if (obj instanceof Other) {
			Other other = (Other) obj;
			return keyword.equals(other.keyword) && operands.equals(other.operands);
		}
		return false;
	}

	@Override
	public int hashCode() {
		return Objects.hash(keyword, operands);
	}

	@Override
	public String toString() {
		return "Other(" + keyword + " " + operands + ")";
	}
}
