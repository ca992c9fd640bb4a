package anf.ast;

public enum UnaryOperator {
	NEG("-", 9),
	POS("+", 9),
	INVERT("~", 9),
	NOT("not", 1);

	private final String symbol;
	private final int precedence;

	UnaryOperator(String symbol, int precedence) {
		this.symbol = symbol;
		this.precedence = precedence;
	}

	public String getSymbol() {
		return symbol;
	}

	public int getPrecedence() {
		return precedence;
	}

	public static UnaryOperator fromSymbol(String symbol) {
		for (UnaryOperator op : values()) {
			if (op.symbol.equals(symbol)) {
				return op;
			}
		}
		throw new IllegalArgumentException("unknown unary operator " + symbol);
	}
}
