package anf.ast;

/**
 * An expression node. The set of variants is closed: every traversal goes
 * through {@link Matcher} or {@link MatcherVoid}, so a new variant has to be
 * handled by every existing traversal before the code compiles again.
 */
public interface Expr {

	<T> T match(Matcher<T> matcher);

	void match(MatcherVoid matcher);

	public interface Matcher<T> {
		T case_Name(Name name);

		T case_Constant(Constant constant);

		T case_BinaryOp(BinaryOp binaryOp);

		T case_UnaryOp(UnaryOp unaryOp);

		T case_Call(Call call);

		T case_Tuple(Tuple tuple);
	}

	public interface MatcherVoid {
		void case_Name(Name name);

		void case_Constant(Constant constant);

		void case_BinaryOp(BinaryOp binaryOp);

		void case_UnaryOp(UnaryOp unaryOp);

		void case_Call(Call call);

		void case_Tuple(Tuple tuple);
	}
}
