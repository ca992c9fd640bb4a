package anf.ast;

import java.util.List;

import com.google.common.collect.ImmutableList;

public final class Tuple implements Expr {

	private final ImmutableList<Expr> elements;

	public Tuple(List<? extends Expr> elements) {
		this.elements = ImmutableList.copyOf(elements);
	}

	public ImmutableList<Expr> getElements() {
		return elements;
	}

	@Override
	public <T> T match(Matcher<T> matcher) {
		return matcher.case_Tuple(this);
	}

	@Override
	public void match(MatcherVoid matcher) {
		matcher.case_Tuple(this);
	}

	@Override
	public boolean equals(Object obj) {
		if (obj instanceof Tuple) {
			return elements.equals(((Tuple) obj).elements);
		}
		return false;
	}

	@Override
	public int hashCode() {
		return elements.hashCode();
	}

	@Override
	public String toString() {
		return "Tuple" + elements;
	}
}
