package anf.ast;

import java.util.Objects;

import com.google.common.base.Preconditions;

/**
 * A keyword argument {@code name=value} of a {@link Call}.
 */
public final class Keyword {

	private final String name;
	private final Expr value;

	public Keyword(String name, Expr value) {
		this.name = Preconditions.checkNotNull(name);
		this.value = Preconditions.checkNotNull(value);
	}

	public String getName() {
		return name;
	}

	public Expr getValue() {
		return value;
	}

	public Keyword withValue(Expr newValue) {
		return new Keyword(name, newValue);
	}

	@Override
	public boolean equals(Object obj) {
		if (obj instanceof Keyword) {
			Keyword other = (Keyword) obj;
			return name.equals(other.name) && value.equals(other.value);
		}
		return false;
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, value);
	}

	@Override
	public String toString() {
		return name + "=" + value;
	}
}
