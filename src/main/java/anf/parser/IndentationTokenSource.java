package anf.parser;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CommonToken;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.TokenFactory;
import org.antlr.v4.runtime.TokenSource;

import com.google.common.collect.Lists;

/**
 * Wraps the generated lexer and turns line structure into tokens the parser
 * can match: runs of NEWLINE tokens collapse into one, line breaks inside
 * parentheses disappear, and a change of indentation after a NEWLINE emits
 * INDENT or DEDENT tokens. Before EOF a final NEWLINE and the DEDENTs of all
 * open blocks are emitted.
 *
 * <p>More than {@link #MAX_PAREN_NESTING} open parentheses end the input
 * early with an error, which keeps the recursive descent of the parser
 * shallow.
 */
public class IndentationTokenSource implements TokenSource {

	public static final int MAX_PAREN_NESTING = 200;

	private static final int TAB_WIDTH = 8;

	private final UnnestLexer lexer;
	private final Deque<Token> queue = new ArrayDeque<>();
	private final Deque<Integer> indents = new ArrayDeque<>();
	private final List<String> errors = Lists.newArrayList();
	private int parenDepth = 0;
	private Token lastEmitted = null;
	private Token lookahead = null;
	private Token truncatedAt = null;

	public IndentationTokenSource(UnnestLexer lexer) {
		this.lexer = lexer;
		indents.push(0);
	}

	/** Indentation and nesting errors, formatted like the parser's syntax errors. */
	public List<String> getErrors() {
		return errors;
	}

	@Override
	public Token nextToken() {
		while (queue.isEmpty()) {
			fill();
		}
		lastEmitted = queue.poll();
		return lastEmitted;
	}

	private Token next() {
		if (lookahead != null) {
			Token t = lookahead;
			lookahead = null;
			return t;
		}
		return lexer.nextToken();
	}

	private void fill() {
		if (truncatedAt != null) {
			queue.add(synthetic(Token.EOF, "<EOF>", truncatedAt));
			return;
		}
		Token t = next();
		switch (t.getType()) {
			case UnnestLexer.OPEN_PAREN:
				if (parenDepth == MAX_PAREN_NESTING) {
					errors.add("line " + t.getLine() + ":" + t.getCharPositionInLine()
							+ " too many nested parentheses");
					truncatedAt = t;
					endOfFile(synthetic(Token.EOF, "<EOF>", t));
					break;
				}
				parenDepth++;
				queue.add(t);
				break;
			case UnnestLexer.CLOSE_PAREN:
				if (parenDepth > 0) {
					parenDepth--;
				}
				queue.add(t);
				break;
			case UnnestLexer.NEWLINE:
				newline(t);
				break;
			case Token.EOF:
				endOfFile(t);
				break;
			default:
				queue.add(t);
		}
	}

	private void newline(Token t) {
		if (parenDepth > 0) {
			fill();
			return;
		}
		Token last = t;
		Token following = next();
		while (following.getType() == UnnestLexer.NEWLINE) {
			last = following;
			following = next();
		}
		lookahead = following;
		if (following.getType() == Token.EOF) {
			// endOfFile emits the closing NEWLINE
			if (lastEmitted != null && lastEmitted.getType() != UnnestLexer.NEWLINE) {
				queue.add(last);
			}
			return;
		}
		queue.add(last);
		int indent = indentationOf(last.getText());
		if (indent > indents.peek()) {
			indents.push(indent);
			queue.add(synthetic(UnnestParser.INDENT, "<INDENT>", following));
			return;
		}
		while (indent < indents.peek()) {
			indents.pop();
			queue.add(synthetic(UnnestParser.DEDENT, "<DEDENT>", following));
		}
		if (indent != indents.peek()) {
			errors.add("line " + following.getLine() + ":" + following.getCharPositionInLine()
					+ " unindent does not match any outer indentation level");
		}
	}

	private void endOfFile(Token eof) {
		if (lastEmitted != null && lastEmitted.getType() != UnnestLexer.NEWLINE
				&& lastEmitted.getType() != UnnestParser.DEDENT
				&& queueTailType() != UnnestLexer.NEWLINE) {
			queue.add(synthetic(UnnestLexer.NEWLINE, "\n", eof));
		}
		while (indents.peek() > 0) {
			indents.pop();
			queue.add(synthetic(UnnestParser.DEDENT, "<DEDENT>", eof));
		}
		queue.add(eof);
	}

	private int queueTailType() {
		Token tail = queue.peekLast();
		return tail == null ? Token.INVALID_TYPE : tail.getType();
	}

	private static int indentationOf(String newlineText) {
		int start = Math.max(newlineText.lastIndexOf('\n'), newlineText.lastIndexOf('\r')) + 1;
		int width = 0;
		for (int i = start; i < newlineText.length(); i++) {
			if (newlineText.charAt(i) == '\t') {
				width = (width / TAB_WIDTH + 1) * TAB_WIDTH;
			} else {
				width++;
			}
		}
		return width;
	}

	private static Token synthetic(int type, String text, Token position) {
		CommonToken token = new CommonToken(position);
		token.setType(type);
		token.setText(text);
		token.setChannel(Token.DEFAULT_CHANNEL);
		return token;
	}

	@Override
	public int getLine() {
		return lexer.getLine();
	}

	@Override
	public int getCharPositionInLine() {
		return lexer.getCharPositionInLine();
	}

	@Override
	public CharStream getInputStream() {
		return lexer.getInputStream();
	}

	@Override
	public String getSourceName() {
		return lexer.getSourceName();
	}

	@Override
	public void setTokenFactory(TokenFactory<?> factory) {
		lexer.setTokenFactory(factory);
	}

	@Override
	public TokenFactory<?> getTokenFactory() {
		return lexer.getTokenFactory();
	}
}
