package anf.ast;

import java.util.Objects;

/**
 * {@code return value}. The value is null for a bare {@code return}.
 */
public final class Return implements Stmt {

	private final Expr value;

	public Return(Expr value) {
		this.value = value;
	}

	public Expr getValue() {
		return value;
	}

	@Override
	public <T> T match(Stmt.Matcher<T> matcher) {
		return matcher.case_Return(this);
	}

	@Override
	public boolean equals(Object obj) {
		if (obj instanceof Return) {
			return Objects.equals(value, ((Return) obj).value);
		}
		return false;
	}

	@Override
	public int hashCode() {
		return Objects.hashCode(value);
	}

	@Override
	public String toString() {
		return "Return(" + value + ")";
	}
}
