package anf;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import anf.ast.FunctionUnit;
import anf.ast.Program;
import anf.flatten.Flattener;
import anf.parser.TreeBuilder;
import anf.parser.UnnestSyntaxException;
import anf.printer.TreePrinter;

/**
 * Parses source text, flattens every function definition and prints the
 * result. Statements outside of functions are printed unchanged.
 */
public class Unnester {
	private static final Logger LOG = LoggerFactory.getLogger(Unnester.class);

	private Unnester() {
	}

	/**
	 * Like {@link #transform(String, String)}, but any failure is logged and
	 * yields an empty string.
	 */
	public static String unnest(String source) {
		try {
			return transform(source, "<string>");
		} catch (UnnestSyntaxException e) {
			LOG.error("could not unnest source: {}", e.getMessage());
			return "";
		} catch (RuntimeException e) {
			LOG.error("could not unnest source", e);
			return "";
		}
	}

	public static String transform(String source, String sourceName) throws UnnestSyntaxException {
		Program prog = TreeBuilder.parse(source, sourceName);
		for (FunctionUnit f : prog.getFunctions()) {
			int before = f.getBody().size();
			Flattener.flatten(f);
			LOG.debug("{}: {} temporaries introduced", f.getName(), f.getBody().size() - before);
		}
		return TreePrinter.print(prog);
	}
}
