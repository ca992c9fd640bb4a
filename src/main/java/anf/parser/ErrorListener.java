package anf.parser;

import java.util.List;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.Lists;

public class ErrorListener extends BaseErrorListener {
	private static final Logger LOG = LoggerFactory.getLogger(ErrorListener.class);

	private final List<String> errors = Lists.newArrayList();

	@Override
	public void syntaxError(Recognizer<?, ?> recognizer,
			Object offendingSymbol, int line, int charPositionInLine,
			String msg, RecognitionException e) {
		String error = "line " + line + ":" + charPositionInLine + " " + msg;
		LOG.warn("{}: {}", recognizer.getInputStream().getSourceName(), error);
		errors.add(error);
	}

	public int getErrCount() {
		return errors.size();
	}

	public List<String> getErrors() {
		return errors;
	}

}
