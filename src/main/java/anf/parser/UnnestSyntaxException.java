package anf.parser;

import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * The source text could not be turned into a tree. Carries every error that
 * was found, each formatted as {@code line L:C message}.
 */
public class UnnestSyntaxException extends Exception {

	private static final long serialVersionUID = 1L;

	private final ImmutableList<String> errors;

	public UnnestSyntaxException(List<String> errors) {
		super(String.join("\n", errors));
		this.errors = ImmutableList.copyOf(errors);
	}

	public ImmutableList<String> getErrors() {
		return errors;
	}
}
