package anf.flatten;

import java.util.List;
import java.util.Set;

import anf.ast.Assign;
import anf.ast.Expr;
import anf.ast.Name;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

/**
 * Extraction state of one function: the temporary counter and the
 * assignments waiting to be inserted at the top of the body. A new scope is
 * created for every function and never shared.
 */
class Scope {

	static final String TEMP_PREFIX = "v";

	private final Set<String> reserved;
	private final List<Assign> pending = Lists.newArrayList();
	private int counter = 0;

	Scope(Set<String> reserved) {
		this.reserved = reserved;
	}

	/**
	 * Assigns the expression to a fresh temporary and returns a reference to
	 * it.
	 */
	Name lift(Expr e) {
		String temp = freshName();
		pending.add(new Assign(temp, e));
		return new Name(temp);
	}

	private String freshName() {
		String name;
		do {
			name = TEMP_PREFIX + counter;
			counter++;
		} while (reserved.contains(name));
		return name;
	}

	List<Assign> getPending() {
		return ImmutableList.copyOf(pending);
	}
}
