package dumb.quizterm;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Map;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class EquivalenceTest extends AbstractTermTest {

    @ParameterizedTest
    @ValueSource(strings = {
            "sin(x)^2 + cos(x)^2 == 1",
            "(x+1)^2 == x^2 + 2x + 1",
            "exp(x+y) == exp(x)*exp(y)",
            "2^3 == 8",
            "x/x == 1",
            "sinh(x) == (exp(x)-exp(-x))/2",
            "tan x == sin x / cos x",
            "x + y == y + x",
            "x != y",
            "x^2 != x^3",
            "x + 1 != x",
            "sin(x) != cos(x)",
    })
    void identities(String relation) {
        assertRelation(relation);
    }

    @Test
    void reflexiveAndSymmetric() {
        var u = parse("sin(xy) + ln(x) - |y|");
        var v = parse("ln(x) + sin(y*x) - abs(y)");
        assertTrue(equivalence.compare(u, u));
        assertTrue(equivalence.compare(u, v));
        assertTrue(equivalence.compare(v, u));
    }

    @Test
    void disjointVariablesDiffer() {
        assertFalse(equivalence.compare(parse("x"), parse("y")));
        assertFalse(equivalence.compare(parse("x + 0*y"), parse("y")));
    }

    @Test
    void fixedBindings() {
        var u = parse("x*y");
        var v = parse("2*y");
        assertFalse(equivalence.compare(u, v));
        assertTrue(equivalence.compare(u, v, Map.of("x", Complex.of(2))));
        assertFalse(equivalence.compare(u, v, Map.of("x", Complex.of(3))));
    }

    @Test
    void nanNeverMatches() {
        assertFalse(equivalence.compare(parse("1/0"), parse("1/0")));
        assertFalse(equivalence.compare(parse("sinc(0)"), parse("sinc(0)")));
    }

    @Test
    void toleranceComesFromConfiguration() {
        var loose = new Equivalence(new Configuration(5, 1e-3, 1000, 1e-11, 6, 720), new Random(1));
        assertTrue(loose.compare(parse("x"), parse("x + 0.0001")));
        assertFalse(equivalence.compare(parse("x"), parse("x + 0.0001")));
        assertEquals(5, loose.config().trials());
    }

    @Test
    void standardInstance() {
        assertTrue(Term.compare(parse("2x"), parse("x + x")));
        assertFalse(Term.compare(parse("2x"), parse("x + x + 1")));
        // src/test/resources/quizterm.json
        assertEquals(12, Equivalence.standard().config().trials());
        assertSame(Configuration.loaded(), Equivalence.standard().config());
    }
}
