package dumb.quizterm;

/**
 * Evaluation failure. Numeric trouble such as division by zero is not an error; it
 * surfaces as NaN or infinite parts in the result.
 */
public class EvalException extends RuntimeException {
    private final Kind kind;
    private final String name;

    public EvalException(Kind kind, String name) {
        super(switch (kind) {
            case UNKNOWN_VARIABLE -> "Unknown variable '" + name + "'";
            case UNIMPLEMENTED_OPERATOR -> "Unimplemented operator '" + name + "'";
        });
        this.kind = kind;
        this.name = name;
    }

    public Kind kind() {
        return kind;
    }

    /** The unbound variable or the operator lacking an implementation. */
    public String name() {
        return name;
    }

    public enum Kind {UNKNOWN_VARIABLE, UNIMPLEMENTED_OPERATOR}
}
