package dumb.quizterm;

import java.math.BigDecimal;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;

/**
 * Immutable expression tree node. {@code parenthesized} records literal parentheses in the
 * source and only matters for TeX output.
 */
sealed public interface Node permits Node.Const, Node.Var, Node.Apply {

    boolean parenthesized();

    Node withParentheses(boolean parenthesized);

    /** Fully parenthesized text that parses back to an equivalent tree. */
    String toDisplayString();

    String toTexString(boolean suppressParentheses);

    default String toTexString() {
        return toTexString(false);
    }

    /** Free variable names in first-seen (pre-order) order, reserved names included. */
    default Set<String> vars() {
        var s = new LinkedHashSet<String>();
        collectVars(s);
        return s;
    }

    void collectVars(Set<String> into);

    /** Replaces every variable named in {@code bindings}; untouched subtrees are shared. */
    Node substitute(Map<String, ? extends Node> bindings);

    default Node rename(String from, String to) {
        return substitute(Map.of(from, new Var(to)));
    }

    static String number(double d) {
        if (Double.isNaN(d) || Double.isInfinite(d)) return Double.toString(d);
        return BigDecimal.valueOf(d).stripTrailingZeros().toPlainString();
    }

    record Const(double re, double im, boolean parenthesized) implements Node {
        /** Parts below this are left out of TeX output. */
        private static final double TEX_EPS = 1e-9;

        public Const(double re, double im) {
            this(re, im, false);
        }

        public Const(double re) {
            this(re, 0, false);
        }

        public Const(Complex c) {
            this(c.re(), c.im(), false);
        }

        public Complex value() {
            return new Complex(re, im);
        }

        @Override
        public Node withParentheses(boolean parenthesized) {
            return new Const(re, im, parenthesized);
        }

        @Override
        public String toDisplayString() {
            var hasRe = re != 0;
            var hasIm = im != 0;
            if (hasRe && hasIm)
                return "(" + number(re) + (im >= 0 ? "+" + number(im) : "-" + number(-im)) + "i)";
            if (hasRe) return re > 0 ? number(re) : "(" + number(re) + ")";
            if (hasIm) return "(" + number(im) + "i)";
            return "0";
        }

        @Override
        public String toTexString(boolean suppressParentheses) {
            var hasRe = Math.abs(re) > TEX_EPS;
            var hasIm = Math.abs(im) > TEX_EPS;
            String s;
            if (!hasRe && !hasIm) {
                s = "0";
            } else {
                var imag = hasIm ? number(im) + "i" : "";
                if (imag.equals("1i")) imag = "i";
                else if (imag.equals("-1i")) imag = "-i";
                if (hasIm && hasRe && im >= 0) imag = "+" + imag;
                s = (hasRe ? number(re) : "") + imag;
            }
            return !suppressParentheses && parenthesized ? "\\left({" + s + "}\\right)" : s;
        }

        @Override
        public void collectVars(Set<String> into) {
        }

        @Override
        public Node substitute(Map<String, ? extends Node> bindings) {
            return this;
        }
    }

    record Var(String name, boolean parenthesized) implements Node {

        public Var {
            requireNonNull(name);
            if (name.isEmpty()) throw new IllegalArgumentException("Variable name must not be empty");
        }

        public Var(String name) {
            this(name, false);
        }

        @Override
        public Node withParentheses(boolean parenthesized) {
            return new Var(name, parenthesized);
        }

        @Override
        public String toDisplayString() {
            return name;
        }

        @Override
        public String toTexString(boolean suppressParentheses) {
            var s = " " + (name.equals("pi") ? "\\pi" : name) + " ";
            return !suppressParentheses && parenthesized ? "\\left({" + s + "}\\right)" : s;
        }

        @Override
        public void collectVars(Set<String> into) {
            into.add(name);
        }

        @Override
        public Node substitute(Map<String, ? extends Node> bindings) {
            var b = bindings.get(name);
            return b != null ? b : this;
        }
    }

    record Apply(Operator op, List<Node> args, boolean parenthesized) implements Node {

        public Apply {
            requireNonNull(op);
            args = List.copyOf(args);
            if (args.size() != op.arity)
                throw new IllegalArgumentException(op + " takes " + op.arity + " operand(s), got " + args.size());
        }

        public Apply(Operator op, Node... args) {
            this(op, List.of(args), false);
        }

        public Node arg(int i) {
            return args.get(i);
        }

        @Override
        public Node withParentheses(boolean parenthesized) {
            return new Apply(op, args, parenthesized);
        }

        @Override
        public String toDisplayString() {
            if (op.isBinary())
                return args.stream().map(Node::toDisplayString).collect(Collectors.joining(op.symbol, "(", ")"));
            return op.symbol + "(" + arg(0).toDisplayString() + ")";
        }

        @Override
        public String toTexString(boolean suppressParentheses) {
            var s = switch (op) {
                case NEG -> "-" + arg(0).toTexString();
                case ADD, SUB, POW -> "{" + arg(0).toTexString() + "}" + op.symbol + "{" + arg(1).toTexString() + "}";
                case MUL -> "{" + arg(0).toTexString() + "}\\cdot {" + arg(1).toTexString() + "}";
                case DIV -> "\\frac{" + arg(0).toTexString(true) + "}{" + arg(1).toTexString(true) + "}";
                case FLOOR -> "\\left\\lfloor " + arg(0).toTexString(true) + "\\right\\rfloor ";
                case CEIL -> "\\left\\lceil " + arg(0).toTexString(true) + "\\right\\rceil ";
                case ROUND -> "\\left\\lfloor " + arg(0).toTexString(true) + "\\right\\rceil ";
                case SQRT -> "\\sqrt{" + arg(0).toTexString(true) + "}";
                case ABS -> "\\left|" + arg(0).toTexString(true) + "\\right|";
                default -> texName(op) + "\\left(" + arg(0).toTexString(true) + "\\right)";
            };
            return !suppressParentheses && parenthesized ? "\\left({" + s + "}\\right)" : s;
        }

        private static String texName(Operator op) {
            return switch (op) {
                case ASIN -> "\\arcsin";
                case ACOS -> "\\arccos";
                case ATAN -> "\\arctan";
                case LOG10 -> "\\log_{10}";
                case LOG2 -> "\\log_{2}";
                case SINC, ASINH, ACOSH, ATANH -> "\\operatorname{" + op.symbol + "}";
                default -> "\\" + op.symbol;
            };
        }

        @Override
        public void collectVars(Set<String> into) {
            args.forEach(a -> a.collectVars(into));
        }

        @Override
        public Node substitute(Map<String, ? extends Node> bindings) {
            var changed = new boolean[]{false};
            var newArgs = args.stream().map(a -> {
                var s = a.substitute(bindings);
                if (s != a) changed[0] = true;
                return s;
            }).toList();
            return changed[0] ? new Apply(op, newArgs, parenthesized) : this;
        }
    }
}
