package dumb.quizterm;

import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;

/**
 * A parsed mathematical term. Holds one immutable tree, so copies are free and every
 * rewrite returns a new term.
 */
public final class Term {
    private final Node root;

    public Term(Node root) {
        this.root = requireNonNull(root);
    }

    /**
     * Parses student input or a sample solution, e.g. {@code "sin xy ^2"} or {@code "2pi"}.
     */
    public static Term parse(String src) throws TermParser.ParseException {
        return new Term(TermParser.parse(requireNonNull(src)));
    }

    /** Randomized numerical equivalence with the classpath configuration. */
    public static boolean compare(Term u, Term v) {
        return Equivalence.standard().compare(u, v);
    }

    public Node root() {
        return root;
    }

    public Complex eval(Map<String, Complex> bindings) {
        return Evaluator.eval(root, bindings);
    }

    public Set<String> vars() {
        return root.vars();
    }

    public Set<String> vars(String prefix) {
        return vars().stream().filter(v -> v.startsWith(prefix)).collect(Collectors.toCollection(LinkedHashSet::new));
    }

    public Term rename(String from, String to) {
        return new Term(root.rename(from, to));
    }

    public Term substitute(Map<String, ? extends Node> bindings) {
        return new Term(root.substitute(bindings));
    }

    public String toDisplayString() {
        return root.toDisplayString();
    }

    public String toTexString() {
        return root.toTexString();
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof Term that && root.equals(that.root));
    }

    @Override
    public int hashCode() {
        return root.hashCode();
    }

    @Override
    public String toString() {
        return toDisplayString();
    }
}
