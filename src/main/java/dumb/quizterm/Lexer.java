package dumb.quizterm;

/**
 * Splits term source into tokens. Whether whitespace preceded the current token is kept,
 * because the parser uses it to scope unparenthesized function arguments.
 * The empty token marks the end of input.
 */
public class Lexer {
    private static final String DELIMITERS = "^%#*$()[]{},.:;+-/_!<>=?|";
    private static final String WHITESPACE = " \t\n";
    private static final int CONTEXT_SIZE = 20;

    private final String src;
    private int pos = 0;
    private String token = "";
    private boolean skippedWhitespace = false;

    public Lexer(String src) {
        this.src = src;
        next();
    }

    public static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    public static boolean isLetter(char c) {
        return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || c == '_';
    }

    private static boolean isDelimiter(char c) {
        return DELIMITERS.indexOf(c) >= 0 || WHITESPACE.indexOf(c) >= 0;
    }

    public String token() {
        return token;
    }

    public boolean skippedWhitespace() {
        return skippedWhitespace;
    }

    public boolean atEnd() {
        return token.isEmpty();
    }

    public boolean is(String s) {
        return token.equals(s);
    }

    /** Position just past the current token. */
    public int pos() {
        return pos;
    }

    /** Up to {@code CONTEXT_SIZE} characters of source ending at the current position. */
    public String context() {
        return src.substring(Math.max(0, pos - CONTEXT_SIZE), pos);
    }

    /**
     * Consumes only the first {@code n} characters of the current token when it is longer,
     * e.g. "sin" of "sinx". Otherwise advances to the next token.
     */
    public void next(int n) {
        if (n > 0 && token.length() > n) {
            token = token.substring(n);
            skippedWhitespace = false;
            return;
        }
        next();
    }

    public void next() {
        var sb = new StringBuilder();
        var n = src.length();
        skippedWhitespace = false;
        while (pos < n && WHITESPACE.indexOf(src.charAt(pos)) >= 0) {
            skippedWhitespace = true;
            pos++;
        }
        while (pos < n) {
            var c = src.charAt(pos);
            if (!sb.isEmpty()) {
                var first = sb.charAt(0);
                // "2pi" splits into "2" and "pi", but "C1" stays whole
                if (((isDigit(first) && isLetter(c)) || (isLetter(first) && isDigit(c))) && !sb.toString().equals("C"))
                    break;
                if (isDelimiter(c))
                    break;
            }
            sb.append(c);
            pos++;
            if (isDelimiter(c)) break;
        }
        token = sb.toString();
    }
}
