package anf.ast;

import com.google.common.base.Preconditions;

public final class Name implements Expr {

	private final String id;

	public Name(String id) {
		Preconditions.checkArgument(id != null && !id.isEmpty(), "empty identifier");
		this.id = id;
	}

	public String getId() {
		return id;
	}

	@Override
	public <T> T match(Matcher<T> matcher) {
		return matcher.case_Name(this);
	}

	@Override
	public void match(MatcherVoid matcher) {
		matcher.case_Name(this);
	}

	@Override
	public boolean equals(Object obj) {
		if (obj instanceof Name) {
			return id.equals(((Name) obj).id);
		}
		return false;
	}

	@Override
	public int hashCode() {
		return id.hashCode();
	}

	@Override
	public String toString() {
		return "Name(" + id + ")";
	}
}
