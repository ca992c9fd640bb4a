package anf;

import anf.parser.UnnestSyntaxException;
import org.junit.jupiter.api.Test;

import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

public class UnnesterTest {

    private static final String EXAMPLE = "\n"
            + "def foo(a, b, c, d):\n"
            + "    return baz(-a, c**(a - b) + d, k=A + 123)\n"
            + "\n"
            + "def bar(x):\n"
            + "    a = x * 2 + sin(x)\n"
            + "    b = a\n"
            + "    return a, b, x + 1\n";

    @Test
    public void testUnnestExample() {
        assertEquals("def foo(a, b, c, d):\n"
                + "    v0 = -a\n"
                + "    v1 = a - b\n"
                + "    v2 = c ** v1\n"
                + "    v3 = v2 + d\n"
                + "    v4 = A + 123\n"
                + "    return baz(v0, v3, k=v4)\n"
                + "\n"
                + "def bar(x):\n"
                + "    v0 = x * 2\n"
                + "    v1 = v0 + sin(x)\n"
                + "    v2 = x + 1\n"
                + "    v3 = a, b, v2\n"
                + "    a = v1\n"
                + "    b = a\n"
                + "    return v3\n", Unnester.unnest(EXAMPLE));
    }

    @Test
    public void testSingleCall() {
        assertEquals("def foo(a, b, c):\n"
                + "    v0 = -a\n"
                + "    v1 = b + c\n"
                + "    return f(v0, v1)\n",
                Unnester.unnest("def foo(a, b, c):\n    return f(-a, b + c)\n"));
    }

    @Test
    public void testSimpleFunctionIsUnchanged() {
        String source = "def id(x):\n    return x\n";

        assertEquals(source, Unnester.unnest(source));
    }

    @Test
    public void testTopLevelStatementsAreNotFlattened() {
        String source = "x = f(a + b)\n";

        assertEquals(source, Unnester.unnest(source));
    }

    @Test
    public void testSyntaxErrorGivesEmptyResult() {
        assertEquals("", Unnester.unnest("def broken(:\n    return\n"));
    }

    @Test
    public void testTransformReportsSyntaxError() {
        var e = assertThrows(UnnestSyntaxException.class,
                () -> Unnester.transform("x = = 1\n", "bad.py"));

        assertTrue(e.getErrors().get(0).startsWith("line 1:"), e.getErrors().get(0));
    }

    @Test
    public void testDeeplyNestedParenthesesGiveEmptyResult() {
        String source = "def f(x):\n    return " + "(".repeat(3000) + "x" + ")".repeat(3000) + "\n";

        assertEquals("", Unnester.unnest(source));
    }

    @Test
    public void testLongOperatorChainGivesEmptyResult() {
        String source = "def f(x):\n    return " + String.join(" + ", Collections.nCopies(3000, "x")) + "\n";

        assertEquals("", Unnester.unnest(source));
    }

    @Test
    public void testEmptySource() {
        assertEquals("", Unnester.unnest(""));
    }
}
