package anf.ast;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Binary operators with the binding strength used by the printer. A higher
 * precedence binds tighter.
 */
public enum BinaryOperator {
	POW("**", 10, true),
	MUL("*", 8),
	DIV("/", 8),
	FLOOR_DIV("//", 8),
	MOD("%", 8),
	MAT_MUL("@", 8),
	ADD("+", 7),
	SUB("-", 7),
	LSHIFT("<<", 6),
	RSHIFT(">>", 6),
	BIT_AND("&", 5),
	BIT_XOR("^", 4),
	BIT_OR("|", 3),
	LT("<", 2),
	GT(">", 2),
	EQ("==", 2),
	NOT_EQ("!=", 2),
	LT_E("<=", 2),
	GT_E(">=", 2);

	private static final Map<String, BinaryOperator> BY_SYMBOL = Arrays.stream(values())
			.collect(Collectors.toMap(BinaryOperator::getSymbol, Function.identity()));

	private final String symbol;
	private final int precedence;
	private final boolean rightAssociative;

	BinaryOperator(String symbol, int precedence) {
		this(symbol, precedence, false);
	}

	BinaryOperator(String symbol, int precedence, boolean rightAssociative) {
		this.symbol = symbol;
		this.precedence = precedence;
		this.rightAssociative = rightAssociative;
	}

	public String getSymbol() {
		return symbol;
	}

	public int getPrecedence() {
		return precedence;
	}

	public boolean isRightAssociative() {
		return rightAssociative;
	}

	/** Comparisons do not chain: {@code a < b < c} is rejected by the parser. */
	public boolean isComparison() {
		return precedence == LT.precedence;
	}

	public static BinaryOperator fromSymbol(String symbol) {
		BinaryOperator op = BY_SYMBOL.get(symbol);
		if (op == null) {
			throw new IllegalArgumentException("unknown binary operator " + symbol);
		}
		return op;
	}
}
