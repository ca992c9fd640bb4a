package anf.printer;

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
import anf.ast.Program;
import anf.ast.ProgramItem;
import anf.ast.Return;
import anf.ast.Stmt;
import anf.ast.Tuple;
import anf.ast.UnaryOp;
import anf.ast.UnaryOperator;

/**
 * Renders trees as source text that {@link anf.parser.TreeBuilder} reads back.
 * Parentheses are only written where precedence or associativity needs them.
 */
public class TreePrinter {

	private static final String INDENT = "    ";
	private static final int ATOM = 100;

	private TreePrinter() {
	}

	public static String print(Program prog) {
		StringBuilder sb = new StringBuilder();
		ProgramItem previous = null;
		for (ProgramItem item : prog.getItems()) {
			if (previous != null && (isFunction(previous) || isFunction(item))) {
				sb.append("\n");
			}
			item.match(new ProgramItem.Matcher<Void>() {
				@Override
				public Void case_FunctionUnit(FunctionUnit functionUnit) {
					printFunction(functionUnit, sb);
					return null;
				}

				@Override
				public Void case_Stmt(Stmt stmt) {
					printStatement(stmt, "", sb);
					return null;
				}
			});
			previous = item;
		}
		return sb.toString();
	}

	private static boolean isFunction(ProgramItem item) {
		return item instanceof FunctionUnit;
	}

	public static String print(FunctionUnit f) {
		StringBuilder sb = new StringBuilder();
		printFunction(f, sb);
		return sb.toString();
	}

	public static String print(Stmt s) {
		StringBuilder sb = new StringBuilder();
		printStatement(s, "", sb);
		return sb.toString();
	}

	public static String print(Expr e) {
		StringBuilder sb = new StringBuilder();
		printExpr(e, sb);
		return sb.toString();
	}

	private static void printFunction(FunctionUnit f, StringBuilder sb) {
		sb.append("def ").append(f.getName()).append("(");
		sb.append(String.join(", ", f.getParameters()));
		sb.append("):\n");
		if (f.getBody().isEmpty()) {
			sb.append(INDENT).append("pass\n");
		}
		for (Stmt s : f.getBody()) {
			printStatement(s, INDENT, sb);
		}
	}

	private static void printStatement(Stmt s, String indent, StringBuilder sb) {
		sb.append(indent);
		s.match(new Stmt.Matcher<Void>() {
			@Override
			public Void case_Assign(Assign assign) {
				sb.append(assign.getTarget()).append(" = ");
				printTopLevel(assign.getValue(), sb);
				return null;
			}

			@Override
			public Void case_Return(Return ret) {
				sb.append("return");
				if (ret.getValue() != null) {
					sb.append(" ");
					printTopLevel(ret.getValue(), sb);
				}
				return null;
			}

			@Override
			public Void case_Other(Other other) {
				sb.append(other.getKeyword());
				if (other.isExpressionStatement()) {
					printList(other.getOperands(), sb);
					return null;
				}
				if (!other.getOperands().isEmpty()) {
					sb.append(" ");
					printList(other.getOperands(), sb);
				}
				return null;
			}
		});
		sb.append("\n");
	}

	/** Statement level tuples are written without parentheses. */
	private static void printTopLevel(Expr e, StringBuilder sb) {
		if (e instanceof Tuple) {
			List<Expr> elements = ((Tuple) e).getElements();
			if (elements.isEmpty()) {
				sb.append("()");
				return;
			}
			printList(elements, sb);
			if (elements.size() == 1) {
				sb.append(",");
			}
			return;
		}
		printExpr(e, sb);
	}

	private static void printList(List<Expr> exprs, StringBuilder sb) {
		boolean first = true;
		for (Expr e : exprs) {
			if (!first) {
				sb.append(", ");
			}
			printExpr(e, sb);
			first = false;
		}
	}

	private static void printExpr(Expr e, StringBuilder sb) {
		e.match(new Expr.MatcherVoid() {
			@Override
			public void case_Name(Name name) {
				sb.append(name.getId());
			}

			@Override
			public void case_Constant(Constant constant) {
				sb.append(constant.getLiteral());
			}

			@Override
			public void case_BinaryOp(BinaryOp binaryOp) {
				int prec = binaryOp.getOperator().getPrecedence();
				boolean rightAssoc = binaryOp.getOperator().isRightAssociative();
				boolean tightLeft = rightAssoc || binaryOp.getOperator().isComparison();
				printOperand(binaryOp.getLeft(), tightLeft ? prec + 1 : prec, sb);
				sb.append(" ").append(binaryOp.getOperator().getSymbol()).append(" ");
				// a right operand may be any unary expression: a ** -b
				if (rightAssoc && binaryOp.getRight() instanceof UnaryOp
						&& ((UnaryOp) binaryOp.getRight()).getOperator() != UnaryOperator.NOT) {
					printExpr(binaryOp.getRight(), sb);
				} else {
					printOperand(binaryOp.getRight(), rightAssoc ? prec : prec + 1, sb);
				}
			}

			@Override
			public void case_UnaryOp(UnaryOp unaryOp) {
				UnaryOperator op = unaryOp.getOperator();
				sb.append(op.getSymbol());
				if (op == UnaryOperator.NOT) {
					sb.append(" ");
				}
				printOperand(unaryOp.getOperand(), op.getPrecedence(), sb);
			}

			@Override
			public void case_Call(Call call) {
				printOperand(call.getCallee(), ATOM, sb);
				sb.append("(");
				printList(call.getArgs(), sb);
				boolean first = call.getArgs().isEmpty();
				for (Keyword kw : call.getKeywords()) {
					if (!first) {
						sb.append(", ");
					}
					sb.append(kw.getName()).append("=");
					printExpr(kw.getValue(), sb);
					first = false;
				}
				sb.append(")");
			}

			@Override
			public void case_Tuple(Tuple tuple) {
				sb.append("(");
				printList(tuple.getElements(), sb);
				if (tuple.getElements().size() == 1) {
					sb.append(",");
				}
				sb.append(")");
			}
		});
	}

	/** Prints e, parenthesized when it binds less tightly than required. */
	private static void printOperand(Expr e, int required, StringBuilder sb) {
		if (precedence(e) < required) {
			sb.append("(");
			printExpr(e, sb);
			sb.append(")");
		} else {
			printExpr(e, sb);
		}
	}

	private static int precedence(Expr e) {
		if (e instanceof BinaryOp) {
			return ((BinaryOp) e).getOperator().getPrecedence();
		} else if (e instanceof UnaryOp) {
			return ((UnaryOp) e).getOperator().getPrecedence();
		}
		return ATOM;
	}
}
