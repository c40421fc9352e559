package dumb.quizterm;

import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

public enum Operator {
    ADD("+", 2, false),
    SUB("-", 2, false),
    MUL("*", 2, false),
    DIV("/", 2, false),
    POW("^", 2, false),
    NEG("-", 1, false),

    ABS("abs"),
    ACOS("acos"),
    ACOSH("acosh"),
    ASIN("asin"),
    ASINH("asinh"),
    ATAN("atan"),
    ATANH("atanh"),
    CEIL("ceil"),
    COS("cos"),
    COSH("cosh"),
    COT("cot"),
    EXP("exp"),
    FLOOR("floor"),
    LN("ln"),
    LOG("log"),
    LOG10("log10"),
    LOG2("log2"),
    ROUND("round"),
    SIN("sin"),
    SINC("sinc"),
    SINH("sinh"),
    SQRT("sqrt"),
    TAN("tan"),
    TANH("tanh");

    /** Named functions, longest name first so prefix lookup is greedy. */
    private static final List<Operator> FUNCTIONS = Arrays.stream(values())
            .filter(Operator::isFunction)
            .sorted(Comparator.comparingInt((Operator op) -> op.symbol.length()).reversed())
            .toList();

    public final String symbol;
    public final int arity;
    private final boolean function;

    Operator(String symbol, int arity, boolean function) {
        this.symbol = symbol;
        this.arity = arity;
        this.function = function;
    }

    Operator(String name) {
        this(name, 1, true);
    }

    public boolean isFunction() {
        return function;
    }

    public boolean isBinary() {
        return arity == 2;
    }

    /**
     * The longest function name the token starts with, ignoring case.
     * "sinh2x" yields SINH, "sinx" yields SIN.
     */
    public static Optional<Operator> functionPrefixOf(String token) {
        var lower = token.toLowerCase(Locale.ROOT);
        return FUNCTIONS.stream().filter(f -> lower.startsWith(f.symbol)).findFirst();
    }

    public static Optional<Operator> binary(String token) {
        return switch (token) {
            case "+" -> Optional.of(ADD);
            case "-" -> Optional.of(SUB);
            case "*" -> Optional.of(MUL);
            case "/" -> Optional.of(DIV);
            case "^" -> Optional.of(POW);
            default -> Optional.empty();
        };
    }
}
