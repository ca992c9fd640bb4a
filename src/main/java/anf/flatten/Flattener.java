package anf.flatten;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

import anf.ast.Assign;
import anf.ast.BinaryOp;
import anf.ast.Call;
import anf.ast.Constant;
import anf.ast.Expr;
import anf.ast.FunctionUnit;
import anf.ast.Keyword;
import anf.ast.Name;
import anf.ast.Other;
import anf.ast.Return;
import anf.ast.Stmt;
import anf.ast.Tuple;
import anf.ast.UnaryOp;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

/**
 * Rewrites a function into A-normal form.
 *
 * <p>Expressions are rewritten depth first, children before parents and left
 * to right. Every compound expression that has to be taken out of its
 * position is assigned to a fresh temporary {@code v0, v1, ...}; the
 * assignments are inserted as one block at the start of the body, in the
 * order they were created.
 *
 * <ul>
 * <li>An operand of a binary or unary operation that is itself an operation
 * is replaced by a temporary. If an operand is still not simple after that
 * (it is a call or a tuple), the whole operation is replaced.</li>
 * <li>Call arguments (positional, then keyword) and tuple elements that are
 * not simple are replaced one by one. The call or tuple itself stays.</li>
 * <li>A returned value that is neither simple nor a call is replaced by a
 * temporary.</li>
 * </ul>
 *
 * <p>The traversal keeps its own stack of pending nodes, so arbitrarily deep
 * trees do not exhaust the thread's stack.
 *
 * <p>Hoisting everything to the top of the body is only correct when no
 * extracted expression depends on a statement that precedes it in the
 * original body other than through the parameters.
 */
public final class Flattener implements Stmt.Matcher<Stmt> {

	private final Scope scope;

	private Flattener(Scope scope) {
		this.scope = scope;
	}

	/**
	 * Flattens the body of the given function in place and returns the same
	 * function.
	 */
	public static FunctionUnit flatten(FunctionUnit unit) {
		Flattener flattener = new Flattener(new Scope(NameCollector.namesIn(unit)));
		List<Stmt> rewritten = Lists.newArrayList();
		for (Stmt s : unit.getBody()) {
			rewritten.add(s.match(flattener));
		}
		List<Stmt> body = Lists.newArrayList(flattener.scope.getPending());
		body.addAll(rewritten);
		unit.setBody(body);
		return unit;
	}

	/**
	 * Rewrites an expression bottom up. A node is rebuilt once all of its
	 * children are done; each finished child is lifted according to the kind
	 * of its parent before the next sibling is visited.
	 */
	private Expr rewrite(Expr root) {
		Deque<Frame> stack = new ArrayDeque<>();
		stack.push(new Frame(root));
		while (true) {
			Frame top = stack.peek();
			if (top.hasNext()) {
				stack.push(new Frame(top.nextChild()));
				continue;
			}
			stack.pop();
			Expr result = top.node.match(top);
			Frame parent = stack.peek();
			if (parent == null) {
				return result;
			}
			parent.results.add(parent.operation ? operand(result) : argument(result));
		}
	}

	/** Lifts a rewritten operand of an operation if it is an operation too. */
	private Expr operand(Expr r) {
		if (Exprs.isOperation(r)) {
			return scope.lift(r);
		}
		return r;
	}

	/** Lifts a rewritten call argument or tuple element unless simple. */
	private Expr argument(Expr r) {
		if (!Exprs.isSimple(r)) {
			return scope.lift(r);
		}
		return r;
	}

	/** Children of a node in visiting order: call arguments before keyword values. */
	private static final Expr.Matcher<List<Expr>> CHILDREN = new Expr.Matcher<List<Expr>>() {
		@Override
		public List<Expr> case_Name(Name name) {
			return ImmutableList.of();
		}

		@Override
		public List<Expr> case_Constant(Constant constant) {
			return ImmutableList.of();
		}

		@Override
		public List<Expr> case_BinaryOp(BinaryOp binaryOp) {
			return ImmutableList.of(binaryOp.getLeft(), binaryOp.getRight());
		}

		@Override
		public List<Expr> case_UnaryOp(UnaryOp unaryOp) {
			return ImmutableList.of(unaryOp.getOperand());
		}

		@Override
		public List<Expr> case_Call(Call call) {
			List<Expr> children = Lists.newArrayList(call.getArgs());
			for (Keyword kw : call.getKeywords()) {
				children.add(kw.getValue());
			}
			return children;
		}

		@Override
		public List<Expr> case_Tuple(Tuple tuple) {
			return tuple.getElements();
		}
	};

	/**
	 * A node whose children are being rewritten. Matching the node against its
	 * frame rebuilds it from the rewritten children.
	 */
	private final class Frame implements Expr.Matcher<Expr> {
		final Expr node;
		final boolean operation;
		final List<Expr> children;
		final List<Expr> results = Lists.newArrayList();
		int next = 0;

		Frame(Expr node) {
			this.node = node;
			this.operation = Exprs.isOperation(node);
			this.children = node.match(CHILDREN);
		}

		boolean hasNext() {
			return next < children.size();
		}

		Expr nextChild() {
			return children.get(next++);
		}

		@Override
		public Expr case_Name(Name name) {
			return name;
		}

		@Override
		public Expr case_Constant(Constant constant) {
			return constant;
		}

		@Override
		public Expr case_BinaryOp(BinaryOp binaryOp) {
			Expr left = results.get(0);
			Expr right = results.get(1);
			BinaryOp result = new BinaryOp(binaryOp.getOperator(), left, right);
			if (!Exprs.isSimple(left) || !Exprs.isSimple(right)) {
				return scope.lift(result);
			}
			return result;
		}

		@Override
		public Expr case_UnaryOp(UnaryOp unaryOp) {
			Expr operand = results.get(0);
			UnaryOp result = new UnaryOp(unaryOp.getOperator(), operand);
			if (!Exprs.isSimple(operand)) {
				return scope.lift(result);
			}
			return result;
		}

		@Override
		public Expr case_Call(Call call) {
			int positional = call.getArgs().size();
			List<Keyword> keywords = Lists.newArrayList();
			for (int i = 0; i < call.getKeywords().size(); i++) {
				keywords.add(call.getKeywords().get(i).withValue(results.get(positional + i)));
			}
			return new Call(call.getCallee(), results.subList(0, positional), keywords);
		}

		@Override
		public Expr case_Tuple(Tuple tuple) {
			return new Tuple(results);
		}
	}

	@Override
	public Stmt case_Assign(Assign assign) {
		return new Assign(assign.getTarget(), rewrite(assign.getValue()));
	}

	@Override
	public Stmt case_Return(Return ret) {
		if (ret.getValue() == null) {
			return ret;
		}
		Expr value = rewrite(ret.getValue());
		if (!Exprs.isSimple(value) && !(value instanceof Call)) {
			value = scope.lift(value);
		}
		return new Return(value);
	}

	@Override
	public Stmt case_Other(Other other) {
		List<Expr> operands = Lists.newArrayList();
		for (Expr e : other.getOperands()) {
			operands.add(rewrite(e));
		}
		return other.withOperands(operands);
	}
}
