package anf.flatten;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Set;

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

import com.google.common.collect.Sets;

/**
 * Collects every identifier a function already uses: its name, parameters,
 * assignment targets and referenced names. Keyword argument names belong to
 * the callee and are not collected. Expressions are walked with a work list
 * instead of recursion.
 */
class NameCollector implements Expr.MatcherVoid, Stmt.Matcher<Void> {

	private final Set<String> names = Sets.newHashSet();
	private final Deque<Expr> todo = new ArrayDeque<>();

	static Set<String> namesIn(FunctionUnit unit) {
		NameCollector collector = new NameCollector();
		collector.names.add(unit.getName());
		collector.names.addAll(unit.getParameters());
		for (Stmt s : unit.getBody()) {
			s.match(collector);
		}
		while (!collector.todo.isEmpty()) {
			collector.todo.pop().match(collector);
		}
		return collector.names;
	}

	@Override
	public Void case_Assign(Assign assign) {
		names.add(assign.getTarget());
		todo.push(assign.getValue());
		return null;
	}

	@Override
	public Void case_Return(Return ret) {
		if (ret.getValue() != null) {
			todo.push(ret.getValue());
		}
		return null;
	}

	@Override
	public Void case_Other(Other other) {
		for (Expr e : other.getOperands()) {
			todo.push(e);
		}
		return null;
	}

	@Override
	public void case_Name(Name name) {
		names.add(name.getId());
	}

	@Override
	public void case_Constant(Constant constant) {
	}

	@Override
	public void case_BinaryOp(BinaryOp binaryOp) {
		todo.push(binaryOp.getLeft());
		todo.push(binaryOp.getRight());
	}

	@Override
	public void case_UnaryOp(UnaryOp unaryOp) {
		todo.push(unaryOp.getOperand());
	}

	@Override
	public void case_Call(Call call) {
		todo.push(call.getCallee());
		for (Expr arg : call.getArgs()) {
			todo.push(arg);
		}
		for (Keyword kw : call.getKeywords()) {
			todo.push(kw.getValue());
		}
	}

	@Override
	public void case_Tuple(Tuple tuple) {
		for (Expr e : tuple.getElements()) {
			todo.push(e);
		}
	}
}
