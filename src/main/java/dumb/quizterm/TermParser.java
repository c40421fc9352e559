package dumb.quizterm;

import dumb.quizterm.Node.Apply;
import dumb.quizterm.Node.Const;
import dumb.quizterm.Node.Var;

/**
 * Recursive descent parser for permissive math input. Roughly:
 * <pre>
 *   expr  = add;
 *   add   = mul { ("+"|"-") mul };
 *   mul   = pow { ("*"|"/"|epsilon) pow };     epsilon: implicit multiplication
 *   pow   = unary { "^" unary };
 *   unary = "-" mul | infix;
 *   infix = NUM | fn mul | fn "(" expr ")" | "(" expr ")" | "|" expr "|" | ID;
 * </pre>
 * Spacing matters for unparenthesized function arguments: the argument only extends to the
 * next whitespace, so {@code sin 2pi} is {@code sin(2*pi)} but {@code sin 2 pi} is
 * {@code sin(2)*pi}.
 */
public class TermParser {
    private static final String[] GREEDY_IDS = {"pi", "true", "false", "C1", "C2"};

    private final Lexer lex;

    private TermParser(String src) {
        this.lex = new Lexer(src);
    }

    public static Node parse(String src) throws ParseException {
        var parser = new TermParser(src);
        var root = parser.expr(false);
        if (!parser.lex.atEnd())
            throw parser.error(ParseException.Kind.UNEXPECTED_TRAILING_INPUT, "Remaining input '" + parser.lex.token() + "'");
        return root;
    }

    private Node expr(boolean stopAtSpace) throws ParseException {
        return add(stopAtSpace);
    }

    private Node add(boolean stopAtSpace) throws ParseException {
        var node = mul(stopAtSpace);
        while (lex.is("+") || lex.is("-")) {
            if (stopAtSpace && lex.skippedWhitespace()) break;
            var op = Operator.binary(lex.token()).orElseThrow();
            lex.next();
            node = new Apply(op, node, mul(stopAtSpace));
        }
        return node;
    }

    private Node mul(boolean stopAtSpace) throws ParseException {
        var node = pow(stopAtSpace);
        while (true) {
            if (stopAtSpace && lex.skippedWhitespace()) break;
            var op = Operator.MUL;
            if (lex.is("*") || lex.is("/")) {
                op = Operator.binary(lex.token()).orElseThrow();
                lex.next();
            } else if (lex.is("(")) {
                // x(x+1)
                if (stopAtSpace) break;
            } else if (!startsFactor(lex.token())) {
                break;
            }
            node = new Apply(op, node, pow(stopAtSpace));
        }
        return node;
    }

    private static boolean startsFactor(String token) {
        return !token.isEmpty() && (Lexer.isLetter(token.charAt(0)) || Lexer.isDigit(token.charAt(0)));
    }

    private Node pow(boolean stopAtSpace) throws ParseException {
        var node = unary(stopAtSpace);
        while (lex.is("^")) {
            if (stopAtSpace && lex.skippedWhitespace()) break;
            lex.next();
            node = new Apply(Operator.POW, node, unary(stopAtSpace));
        }
        return node;
    }

    private Node unary(boolean stopAtSpace) throws ParseException {
        if (lex.is("-")) {
            lex.next();
            return new Apply(Operator.NEG, mul(stopAtSpace));
        }
        return infix(stopAtSpace);
    }

    private Node infix(boolean stopAtSpace) throws ParseException {
        var token = lex.token();
        if (token.isEmpty())
            throw error(ParseException.Kind.UNEXPECTED_TOKEN, "Expected a factor but input ended");
        var c = token.charAt(0);
        if (Lexer.isDigit(c)) return number();
        var fn = Operator.functionPrefixOf(token);
        if (fn.isPresent()) {
            var op = fn.get();
            lex.next(op.symbol.length());
            if (op == Operator.LOG && !lex.skippedWhitespace() && (lex.is("10") || lex.is("2"))) {
                // the lexer splits "log10" at the digit boundary
                op = lex.is("10") ? Operator.LOG10 : Operator.LOG2;
                lex.next();
            }
            Node arg;
            if (lex.is("(")) {
                lex.next();
                arg = expr(false);
                close(")");
            } else {
                arg = mul(true);
            }
            return new Apply(op, arg);
        }
        if (lex.is("(")) {
            lex.next();
            var inner = expr(false);
            close(")");
            return inner.withParentheses(true);
        }
        if (lex.is("|")) {
            lex.next();
            var inner = expr(false);
            close("|");
            return new Apply(Operator.ABS, inner);
        }
        if (Lexer.isLetter(c)) return identifier(token);
        throw error(ParseException.Kind.UNEXPECTED_TOKEN, "Expected a factor, found '" + token + "'");
    }

    private Node number() {
        var digits = new StringBuilder(lex.token());
        lex.next();
        if (lex.is(".")) {
            digits.append('.');
            lex.next();
            if (!lex.atEnd() && Lexer.isDigit(lex.token().charAt(0))) {
                digits.append(lex.token());
                lex.next();
            }
        }
        return new Const(Double.parseDouble(digits.toString()));
    }

    private Node identifier(String token) {
        var id = String.valueOf(token.charAt(0));
        for (var g : GREEDY_IDS) {
            if (token.startsWith(g)) {
                id = g;
                break;
            }
        }
        lex.next(id.length());
        return new Var(id.equals("I") ? "i" : id);
    }

    private void close(String delimiter) throws ParseException {
        if (!lex.is(delimiter))
            throw error(ParseException.Kind.UNTERMINATED_GROUP, "Expected '" + delimiter + "'" +
                    (lex.atEnd() ? " but input ended" : " found '" + lex.token() + "'"));
        lex.next();
    }

    private ParseException error(ParseException.Kind kind, String message) {
        return new ParseException(kind, message, lex.pos(), lex.context());
    }

    public static class ParseException extends Exception {
        private final Kind kind;
        private final int pos;
        private final String context;

        public ParseException(Kind kind, String message, int pos, String context) {
            super(message);
            this.kind = kind;
            this.pos = pos;
            this.context = context;
        }

        public Kind kind() {
            return kind;
        }

        public int pos() {
            return pos;
        }

        @Override
        public String getMessage() {
            var location = pos >= 0 ? " at position " + pos : "";
            var contextSnippet = context != null && !context.isEmpty() ? " near '" + context + "'" : "";
            return super.getMessage() + location + contextSnippet;
        }

        public enum Kind {UNEXPECTED_TOKEN, UNTERMINATED_GROUP, UNEXPECTED_TRAILING_INPUT}
    }
}
