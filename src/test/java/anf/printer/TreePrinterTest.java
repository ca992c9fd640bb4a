package anf.printer;

import anf.ast.Expr;
import anf.parser.TreeBuilder;
import anf.parser.UnnestSyntaxException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static anf.ast.Ast.*;
import static anf.ast.BinaryOperator.*;
import static anf.ast.UnaryOperator.*;
import static org.junit.jupiter.api.Assertions.*;

public class TreePrinterTest {

    private static String print(Expr e) {
        return TreePrinter.print(e);
    }

    @Test
    public void testParenthesesFollowPrecedence() {
        assertEquals("(a + b) * c", print(BinaryOp(BinaryOp(Name("a"), ADD, Name("b")), MUL, Name("c"))));
        assertEquals("a + b * c", print(BinaryOp(Name("a"), ADD, BinaryOp(Name("b"), MUL, Name("c")))));
        assertEquals("a - b - c", print(BinaryOp(BinaryOp(Name("a"), SUB, Name("b")), SUB, Name("c"))));
        assertEquals("a - (b - c)", print(BinaryOp(Name("a"), SUB, BinaryOp(Name("b"), SUB, Name("c")))));
    }

    @Test
    public void testPowerIsRightAssociative() {
        assertEquals("a ** b ** c", print(BinaryOp(Name("a"), POW, BinaryOp(Name("b"), POW, Name("c")))));
        assertEquals("(a ** b) ** c", print(BinaryOp(BinaryOp(Name("a"), POW, Name("b")), POW, Name("c"))));
        assertEquals("-a ** b", print(UnaryOp(NEG, BinaryOp(Name("a"), POW, Name("b")))));
        assertEquals("(-a) ** b", print(BinaryOp(UnaryOp(NEG, Name("a")), POW, Name("b"))));
        assertEquals("a ** -b", print(BinaryOp(Name("a"), POW, UnaryOp(NEG, Name("b")))));
    }

    @Test
    public void testUnaryOperators() {
        assertEquals("-(a + b)", print(UnaryOp(NEG, BinaryOp(Name("a"), ADD, Name("b")))));
        assertEquals("~x", print(UnaryOp(INVERT, Name("x"))));
        assertEquals("not a == b", print(UnaryOp(NOT, BinaryOp(Name("a"), EQ, Name("b")))));
        assertEquals("a * -b", print(BinaryOp(Name("a"), MUL, UnaryOp(NEG, Name("b")))));
        assertEquals("a + (not b)", print(BinaryOp(Name("a"), ADD, UnaryOp(NOT, Name("b")))));
    }

    @Test
    public void testComparisonsDoNotChain() {
        assertEquals("(a < b) < c", print(BinaryOp(BinaryOp(Name("a"), LT, Name("b")), LT, Name("c"))));
        assertEquals("a < (b < c)", print(BinaryOp(Name("a"), LT, BinaryOp(Name("b"), LT, Name("c")))));
    }

    @Test
    public void testCallsAndTuples() {
        assertEquals("f(a, k=1)", print(Call(Name("f"), List.of(Name("a")), List.of(Keyword("k", Num(1))))));
        assertEquals("f(k=1, j=x)", print(Call(Name("f"), List.of(),
                List.of(Keyword("k", Num(1)), Keyword("j", Name("x"))))));
        assertEquals("g()", print(Call("g")));
        assertEquals("(a + b)(x)", print(Call(BinaryOp(Name("a"), ADD, Name("b")), List.of(Name("x")), List.of())));
        assertEquals("(a,)", print(Tuple(Name("a"))));
        assertEquals("f((a, b))", print(Call("f", Tuple(Name("a"), Name("b")))));
    }

    @Test
    public void testStatements() {
        assertEquals("return a, b\n", TreePrinter.print(Return(Tuple(Name("a"), Name("b")))));
        assertEquals("return a,\n", TreePrinter.print(Return(Tuple(Name("a")))));
        assertEquals("return\n", TreePrinter.print(Return()));
        assertEquals("pass\n", TreePrinter.print(Pass()));
        assertEquals("assert x, 'm'\n", TreePrinter.print(Other("assert", Name("x"), Str("m"))));
        assertEquals("print(x)\n", TreePrinter.print(ExprStatement(Call("print", Name("x")))));
        assertEquals("v0 = -a\n", TreePrinter.print(Assign("v0", UnaryOp(NEG, Name("a")))));
    }

    @Test
    public void testProgramLayout() {
        var program = Program(
                Assign("x", Num(1)),
                FunctionUnit("f", Params(), Return(None())),
                FunctionUnit("g", Params("a", "b")),
                Assign("y", Num(2)),
                Assign("z", Num(3)));

        assertEquals("x = 1\n"
                + "\n"
                + "def f():\n"
                + "    return None\n"
                + "\n"
                + "def g(a, b):\n"
                + "    pass\n"
                + "\n"
                + "y = 2\n"
                + "z = 3\n", TreePrinter.print(program));
    }

    @Test
    public void testParsePrintRoundTrip() throws UnnestSyntaxException {
        String source = "def f(a, b, c):\n"
                + "    x = (a + b) * -c ** 2\n"
                + "    y = g(x, (a, b), k=not c)\n"
                + "    assert x != y, 'differ'\n"
                + "    return x // y % 3, y\n"
                + "\n"
                + "r = f(1, 2.0, 'three')\n";

        var program = TreeBuilder.parse(source);

        assertEquals(source, TreePrinter.print(program));
        assertEquals(program, TreeBuilder.parse(TreePrinter.print(program)));
    }
}
