package dumb.quizterm;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EvaluatorTest extends AbstractTermTest {

    private static final double EPS = 1e-9;

    private static Complex eval(String src) {
        return parse(src).eval(Map.of());
    }

    private static void assertNear(double re, double im, Complex actual, double eps) {
        assertTrue(actual.near(re, im, eps), () -> "expected " + new Complex(re, im) + " but was " + actual);
    }

    @ParameterizedTest
    @CsvSource({
            "asin(0.5),  0.5235987755982989",
            "acos(0.5),  1.0471975511965979",
            "atan(1),    0.7853981633974483",
            "asinh(1),   0.881373587019543",
            "acosh(2),   1.3169578969248166",
            "atanh(0.5), 0.5493061443340548",
            "sinh(1),    1.1752011936438014",
            "cosh(1),    1.5430806348152437",
            "tanh(1),    0.7615941559557649",
            "log10(1000), 3",
            "log2(8),    3",
            "ln(e),      1",
            "exp(0),     1",
            "floor(2.7), 2",
            "ceil(2.2),  3",
            "round(2.5), 3",
            "round(-2.5), -2",
            "abs(3+4i),  5",
            "2^10,       1024",
            "cot(pi/4),  1",
            "tan(pi/4),  1",
            "true,       1",
            "false,      0",
    })
    void realValues(String src, double expected) {
        assertNear(expected, 0, eval(src), EPS);
    }

    @Test
    void complexValues() {
        assertNear(-1, 0, eval("exp(i*pi)"), EPS);
        assertNear(0, 2, eval("sqrt(-4)"), EPS);
        assertNear(0, 1, eval("i"), 0);
        assertNear(-2, 0, eval("(1+i)*(-1+i)"), EPS);
        assertNear(-1, 1, eval("i*(1+i)"), EPS);
        assertNear(3.165778513216168, 1.9596010414216063, eval("sin(1+2i)"), EPS);
        assertNear(0.2717525853195118, 1.0839233273386946, eval("tan(1+i)"), EPS);
        assertNear(0.21762156185440273, -0.8680141428959249, eval("cot(1+i)"), EPS);
        // large magnitude, so a looser absolute tolerance
        assertNear(688.0991411542753, 1685.4224989378267, eval("cos(5.1+8.2i)"), 1e-7);
    }

    @Test
    void bindings() {
        var t = parse("x^2 + 3*x*y - 2/y");
        assertNear(1 + 3 * 5 - 0.4, 0, t.eval(Map.of("x", Complex.ONE, "y", Complex.of(5))), EPS);
        assertNear(-1, 0, parse("x*x").eval(Map.of("x", Complex.I)), EPS);
    }

    @Test
    void longerExpressions() {
        assertNear(17.518690570636714, 0,
                parse("(8*x + 5)*cos(4*x^2 + 5*x + 6)").eval(Map.of("x", Complex.of(2))), 1e-9);
        assertNear(77.69013814243468, 0,
                parse("- x^2 + y^2 + xy + x(y+1) + sin(2) + sin 3*x + e^0 + e^3 + 2pi").eval(
                        Map.of("x", Complex.of(3), "y", Complex.of(5))), 1e-9);
    }

    @Test
    void singularitiesAreNaN() {
        var z = eval("1/0");
        assertTrue(Double.isNaN(z.re()) || Double.isInfinite(z.re()), z::toString);
        assertTrue(Double.isNaN(eval("sinc(0)").re()));
        assertNear(1, 0, eval("sinc(0.000001)"), 1e-9);
    }

    @Test
    void unknownVariable() {
        var e = assertThrows(EvalException.class, () -> parse("x + y").eval(Map.of("x", Complex.ONE)));
        assertEquals(EvalException.Kind.UNKNOWN_VARIABLE, e.kind());
        assertEquals("y", e.name());
    }

    @Test
    void reservedNamesIgnoreBindings() {
        assertNear(Math.PI, 0, parse("pi").eval(Map.of("pi", Complex.ZERO)), 0);
    }
}
