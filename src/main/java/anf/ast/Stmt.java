package anf.ast;

public interface Stmt extends ProgramItem {

	<T> T match(Matcher<T> matcher);

	@Override
	default <T> T match(ProgramItem.Matcher<T> matcher) {
		return matcher.case_Stmt(this);
	}

	public interface Matcher<T> {
		T case_Assign(Assign assign);

		T case_Return(Return ret);

		T case_Other(Other other);
	}
}
