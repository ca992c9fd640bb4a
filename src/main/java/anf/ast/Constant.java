package anf.ast;

import java.util.Objects;

import com.google.common.base.Preconditions;

/**
 * A literal. The literal is kept in its source spelling so that printing
 * reproduces exactly what was parsed.
 */
public final class Constant implements Expr {

	public enum Kind {
		NUMBER, STRING, BOOLEAN, NONE
	}

	private final Kind kind;
	private final String literal;

	public Constant(Kind kind, String literal) {
		this.kind = Preconditions.checkNotNull(kind);
		this.literal = Preconditions.checkNotNull(literal);
	}

	public Kind getKind() {
		return kind;
	}

	public String getLiteral() {
		return literal;
	}

	@Override
	public <T> T match(Matcher<T> matcher) {
		return matcher.case_Constant(this);
	}

	@Override
	public void match(MatcherVoid matcher) {
		matcher.case_Constant(this);
	}

	@Override
	public boolean equals(Object obj) {
		if (obj instanceof Constant) {
			Constant other = (Constant) obj;
			return kind == other.kind && literal.equals(other.literal);
		}
		return false;
	}

	@Override
	public int hashCode() {
		return Objects.hash(kind, literal);
	}

	@Override
	public String toString() {
		return "Constant(" + literal + ")";
	}
}
