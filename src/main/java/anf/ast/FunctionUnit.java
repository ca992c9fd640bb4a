package anf.ast;

import java.util.List;
import java.util.Objects;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * One function definition. Name and parameters are never rewritten; the body
 * is replaced as a whole by the flattener through {@link #setBody}.
 */
public final class FunctionUnit implements ProgramItem {

	private final String name;
	private final ImmutableList<String> parameters;
	private ImmutableList<Stmt> body;

	public FunctionUnit(String name, List<String> parameters, List<? extends Stmt> body) {
		this.name = Preconditions.checkNotNull(name);
		this.parameters = ImmutableList.copyOf(parameters);
		this.body = ImmutableList.copyOf(body);
	}

	public String getName() {
		return name;
	}

	public ImmutableList<String> getParameters() {
		return parameters;
	}

	public ImmutableList<Stmt> getBody() {
		return body;
	}

	public void setBody(List<? extends Stmt> body) {
		this.body = ImmutableList.copyOf(body);
	}

	@Override
	public <T> T match(Matcher<T> matcher) {
		return matcher.case_FunctionUnit(this);
	}

	@Override
	public boolean equals(Object obj) {
		if (obj instanceof FunctionUnit) {
			FunctionUnit other = (FunctionUnit) obj;
			return name.equals(other.name)
					&& parameters.equals(other.parameters)
					&& body.equals(other.body);
		}
		return false;
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, parameters, body);
	}

	@Override
	public String toString() {
		return "FunctionUnit(" + name + parameters + ", " + body + ")";
	}
}
