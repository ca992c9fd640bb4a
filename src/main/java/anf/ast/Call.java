package anf.ast;

import java.util.List;
import java.util.Objects;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

public final class Call implements Expr {

	private final Expr callee;
	private final ImmutableList<Expr> args;
	private final ImmutableList<Keyword> keywords;

	public Call(Expr callee, List<? extends Expr> args, List<Keyword> keywords) {
		this.callee = Preconditions.checkNotNull(callee);
		this.args = ImmutableList.copyOf(args);
		this.keywords = ImmutableList.copyOf(keywords);
	}

	public Expr getCallee() {
		return callee;
	}

	public ImmutableList<Expr> getArgs() {
		return args;
	}

	public ImmutableList<Keyword> getKeywords() {
		return keywords;
	}

	@Override
	public <T> T match(Matcher<T> matcher) {
		return matcher.case_Call(this);
	}

	@Override
	public void match(MatcherVoid matcher) {
		matcher.case_Call(this);
	}

	@Override
	public boolean equals(Object obj) {
		if (obj instanceof Call) {
			Call other = (Call) obj;
			return callee.equals(other.callee)
					&& args.equals(other.args)
					&& keywords.equals(other.keywords);
		}
		return false;
	}

	@Override
	public int hashCode() {
		return Objects.hash(callee, args, keywords);
	}

	@Override
	public String toString() {
		return "Call(" + callee + ", " + args + ", " + keywords + ")";
	}
}
