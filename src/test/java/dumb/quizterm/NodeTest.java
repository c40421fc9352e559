package dumb.quizterm;

import dumb.quizterm.Node.Apply;
import dumb.quizterm.Node.Const;
import dumb.quizterm.Node.Var;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class NodeTest extends AbstractTermTest {

    @Test
    void displayIsFullyParenthesized() {
        assertEquals("((2*x)+1)", parse("2x+1").toDisplayString());
        assertEquals("(-(sin((3*x)))+cos(((x^5)+1)))", parse("-sin 3x + cos(x^5+1)").toDisplayString());
        assertEquals("(sin(2)*pi)", parse("sin 2 pi").toDisplayString());
        assertEquals("abs((x-3))", parse("|x-3|").toDisplayString());
        assertEquals("((2*x)+1)", parse("2x+1").toString());
    }

    @Test
    void constantDisplay() {
        assertEquals("(-2)", new Const(-2).toDisplayString());
        assertEquals("(1+2i)", new Const(1, 2).toDisplayString());
        assertEquals("(1-2i)", new Const(1, -2).toDisplayString());
        assertEquals("(2i)", new Const(0, 2).toDisplayString());
        assertEquals("0", new Const(0, 0).toDisplayString());
        assertEquals("2.5", new Const(2.5).toDisplayString());
        assertEquals("100", new Const(100).toDisplayString());
        assertEquals("0.000001", new Const(1e-6).toDisplayString());
        assertEquals("0.000000000000001", new Const(1e-15).toDisplayString());
        assertEquals("(1+0.00000000000000001i)", new Const(1, 1e-17).toDisplayString());
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "2x+1", "sin 2 pi", "sin 2pi", "-x^2", "|x-3|", "C1*exp(2x)+C2*exp(-4x)",
            "x^-2", "sqrt(2/3)*sqrt(C-2*x^3)", "lnx 2", "xyz t", "log10(x)+log2 y",
            "1/0.000000000000001", "x + 0.00000000000000002",
    })
    void displayParsesBack(String src) {
        var display = parse(src).toDisplayString();
        assertEquals(display, parse(display).toDisplayString());
        assertTrue(equivalence.compare(parse(src), parse(display)), display);
    }

    @Test
    void complexConstantDisplayParsesBack() {
        var c = new Const(1, -2);
        assertTrue(parse(c.toDisplayString()).eval(Map.of()).near(c.value(), 1e-12));
    }

    @Test
    void tex() {
        assertEquals("{\\ln\\left( x \\right)}\\cdot {\\left({{2}+{4}}\\right)}", parse("ln(x) * (2+4)").toTexString());
        assertEquals("\\left|\\frac{1}{{ x }+{ x }}\\right|", parse("|1/(x+x)|").toTexString());
        assertEquals("\\sqrt{{ x }^{2}}", parse("sqrt x^2").toTexString());
        assertEquals("{2}\\cdot { \\pi }", parse("2pi").toTexString());
        assertEquals("- x ", parse("-x").toTexString());
        assertEquals("\\arcsin\\left( x \\right)", parse("asin x").toTexString());
        assertEquals("\\operatorname{sinc}\\left( x \\right)", parse("sinc x").toTexString());
        assertEquals("\\log_{10}\\left( x \\right)", parse("log10(x)").toTexString());
        assertTrue(parse("floor(x)").toTexString().startsWith("\\left\\lfloor"));
        assertTrue(parse("ceil(x)").toTexString().endsWith("\\right\\rceil "));
    }

    @Test
    void constantTex() {
        assertEquals("1-i", new Const(1, -1).toTexString());
        assertEquals("i", new Const(0, 1).toTexString());
        assertEquals("2.5+3i", new Const(2.5, 3).toTexString());
        assertEquals("0", new Const(0, 0).toTexString());
        assertEquals("\\left({2}\\right)", new Const(2, 0, true).toTexString());
        assertEquals("2", new Const(2, 0, true).toTexString(true));
    }

    @Test
    void varsInFirstSeenOrder() {
        var t = parse("y + x*sin(y) + C1 + pi");
        assertEquals(List.of("y", "x", "C1", "pi"), List.copyOf(t.vars()));
        assertEquals(List.of("C1"), List.copyOf(t.vars("C")));
    }

    @Test
    void renameAndSubstitute() {
        assertEquals("(z+y)", parse("x+y").rename("x", "z").toDisplayString());
        assertEquals("((2+z)*y)", parse("x*y").substitute(Map.of("x", tree("2+z"))).toDisplayString());

        var t = tree("sin(x)+y");
        var s = (Apply) t.substitute(Map.of("y", new Const(3)));
        assertSame(((Apply) t).arg(0), s.arg(0));
        assertSame(t, t.substitute(Map.of("z", new Const(3))));
    }

    @Test
    void structuralValidation() {
        assertThrows(IllegalArgumentException.class, () -> new Var(""));
        assertThrows(IllegalArgumentException.class, () -> new Apply(Operator.ADD, new Var("x")));
        assertThrows(IllegalArgumentException.class, () -> new Apply(Operator.SIN, new Var("x"), new Var("y")));
    }

    @Test
    void termEquality() {
        assertEquals(parse("x+1"), parse("x + 1"));
        assertEquals(parse("x+1").hashCode(), parse("x + 1").hashCode());
        assertNotEquals(parse("x+1"), parse("1+x"));
    }
}
