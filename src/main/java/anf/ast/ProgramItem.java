package anf.ast;

/**
 * A top level entry of a {@link Program}: either a function definition or a
 * statement outside of any function.
 */
public interface ProgramItem {

	<T> T match(Matcher<T> matcher);

	public interface Matcher<T> {
		T case_FunctionUnit(FunctionUnit functionUnit);

		T case_Stmt(Stmt stmt);
	}
}
