package anf.ast;

import java.util.Objects;

import com.google.common.base.Preconditions;

/**
 * {@code target = value}. Temporaries introduced by the flattener are plain
 * assignments as well.
 */
public final class Assign implements Stmt {

	private final String target;
	private final Expr value;

	public Assign(String target, Expr value) {
		this.target = Preconditions.checkNotNull(target);
		this.value = Preconditions.checkNotNull(value);
	}

	public String getTarget() {
		return target;
	}

	public Expr getValue() {
		return value;
	}

	@Override
	public <T> T match(Stmt.Matcher<T> matcher) {
		return matcher.case_Assign(this);
	}

	@Override
	public boolean equals(Object obj) {
		if (obj instanceof Assign) {
			Assign other = (Assign) obj;
			return target.equals(other.target) && value.equals(other.value);
		}
		return false;
	}

	@Override
	public int hashCode() {
		return Objects.hash(target, value);
	}

	@Override
	public String toString() {
		return "Assign(" + target + " = " + value + ")";
	}
}
