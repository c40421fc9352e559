package dumb.quizterm;

import dumb.quizterm.Node.Apply;
import dumb.quizterm.Node.Const;
import dumb.quizterm.Node.Var;

import java.util.Map;

import static dumb.quizterm.Operator.*;

/**
 * Reduces a tree to a complex number. Derived functions (sqrt, the hyperbolic and inverse
 * functions, ...) are expanded into small trees over the primitives and evaluated
 * recursively, so they share the primitives' branch cuts.
 */
enum Evaluator {
    ;

    /** Below this an imaginary part counts as zero in ln, so -0 does not flip the branch. */
    private static final double LN_EPS = 1e-9;

    static Complex eval(Node node, Map<String, Complex> bindings) {
        if (node instanceof Const c) return c.value();
        if (node instanceof Var v) return variable(v.name(), bindings);
        var a = (Apply) node;
        var u = eval(a.arg(0), bindings);
        if (a.op().isBinary()) return arithmetic(a.op(), u, eval(a.arg(1), bindings));
        return unary(a.op(), u);
    }

    private static Complex variable(String name, Map<String, Complex> bindings) {
        return switch (name) {
            case "pi" -> Complex.of(Math.PI);
            case "e" -> Complex.of(Math.E);
            case "i" -> Complex.I;
            case "true" -> Complex.ONE;
            case "false" -> Complex.ZERO;
            default -> {
                var value = bindings.get(name);
                if (value == null) throw new EvalException(EvalException.Kind.UNKNOWN_VARIABLE, name);
                yield value;
            }
        };
    }

    private static Complex arithmetic(Operator op, Complex u, Complex v) {
        return switch (op) {
            case ADD -> u.add(v);
            case SUB -> u.sub(v);
            case MUL -> u.mul(v);
            case DIV -> u.div(v);
            // u^v = exp(v*ln(u))
            case POW -> expand(fn(EXP, ap(MUL, c(v), fn(LN, c(u)))));
            default -> throw new EvalException(EvalException.Kind.UNIMPLEMENTED_OPERATOR, op.symbol);
        };
    }

    private static Complex unary(Operator op, Complex u) {
        var x = u.re();
        var y = u.im();
        var cu = c(u);
        return switch (op) {
            case NEG -> u.negate();
            case ABS -> Complex.of(u.abs());
            // acos(u) = -i*ln(u + i*sqrt(1-u^2))
            case ACOS -> expand(ap(MUL, c(0, -1),
                    fn(LN, ap(ADD, cu, ap(MUL, c(0, 1), fn(SQRT, ap(SUB, c(1, 0), ap(MUL, cu, cu))))))));
            // acosh(u) = ln(u + sqrt(u^2-1))
            case ACOSH -> expand(fn(LN, ap(ADD, cu, fn(SQRT, ap(SUB, ap(MUL, cu, cu), c(1, 0))))));
            // asin(u) = -i*ln(i*u + sqrt(1-u^2))
            case ASIN -> expand(ap(MUL, c(0, -1),
                    fn(LN, ap(ADD, ap(MUL, c(0, 1), cu), fn(SQRT, ap(SUB, c(1, 0), ap(MUL, cu, cu)))))));
            // asinh(u) = ln(u + sqrt(u^2+1))
            case ASINH -> expand(fn(LN, ap(ADD, cu, fn(SQRT, ap(ADD, ap(MUL, cu, cu), c(1, 0))))));
            // atan(u) = i/2*ln((1-i*u)/(1+i*u))
            case ATAN -> expand(ap(MUL, c(0, 0.5), fn(LN, ap(DIV,
                    ap(SUB, c(1, 0), ap(MUL, c(0, 1), cu)),
                    ap(ADD, c(1, 0), ap(MUL, c(0, 1), cu))))));
            // atanh(u) = 1/2*ln((1+u)/(1-u))
            case ATANH -> expand(ap(MUL, c(0.5, 0), fn(LN, ap(DIV, ap(ADD, c(1, 0), cu), ap(SUB, c(1, 0), cu)))));
            case CEIL -> new Complex(Math.ceil(x), Math.ceil(y));
            case COS -> new Complex(Math.cos(x) * Math.cosh(y), -Math.sin(x) * Math.sinh(y));
            case COSH -> expand(ap(MUL, c(0.5, 0), ap(ADD, fn(EXP, cu), fn(EXP, fn(NEG, cu)))));
            case COT -> {
                var t = Math.sin(x) * Math.sin(x) + Math.sinh(y) * Math.sinh(y);
                yield new Complex(Math.sin(x) * Math.cos(x) / t, -(Math.sinh(y) * Math.cosh(y)) / t);
            }
            case EXP -> new Complex(Math.exp(x) * Math.cos(y), Math.exp(x) * Math.sin(y));
            case FLOOR -> new Complex(Math.floor(x), Math.floor(y));
            case LN, LOG -> new Complex(Math.log(u.abs()), Math.atan2(Math.abs(y) < LN_EPS ? 0.0 : y, x));
            case LOG10 -> expand(ap(DIV, fn(LN, cu), fn(LN, c(10, 0))));
            case LOG2 -> expand(ap(DIV, fn(LN, cu), fn(LN, c(2, 0))));
            // half up, NaN stays NaN
            case ROUND -> new Complex(Math.floor(x + 0.5), Math.floor(y + 0.5));
            case SIN -> new Complex(Math.sin(x) * Math.cosh(y), Math.cos(x) * Math.sinh(y));
            // not defined at 0
            case SINC -> expand(ap(DIV, fn(SIN, cu), cu));
            case SINH -> expand(ap(MUL, c(0.5, 0), ap(SUB, fn(EXP, cu), fn(EXP, fn(NEG, cu)))));
            case SQRT -> expand(ap(POW, cu, c(0.5, 0)));
            case TAN -> {
                var t = Math.cos(x) * Math.cos(x) + Math.sinh(y) * Math.sinh(y);
                yield new Complex(Math.sin(x) * Math.cos(x) / t, Math.sinh(y) * Math.cosh(y) / t);
            }
            case TANH -> expand(ap(DIV,
                    ap(SUB, fn(EXP, cu), fn(EXP, fn(NEG, cu))),
                    ap(ADD, fn(EXP, cu), fn(EXP, fn(NEG, cu)))));
            default -> throw new EvalException(EvalException.Kind.UNIMPLEMENTED_OPERATOR, op.symbol);
        };
    }

    private static Complex expand(Node identity) {
        return eval(identity, Map.of());
    }

    private static Node c(Complex v) {
        return new Const(v);
    }

    private static Node c(double re, double im) {
        return new Const(re, im);
    }

    private static Node ap(Operator op, Node u, Node v) {
        return new Apply(op, u, v);
    }

    private static Node fn(Operator op, Node u) {
        return new Apply(op, u);
    }
}
