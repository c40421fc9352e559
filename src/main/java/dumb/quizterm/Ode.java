package dumb.quizterm;

import dumb.quizterm.Node.Apply;
import dumb.quizterm.Node.Const;
import dumb.quizterm.Node.Var;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;
import java.util.random.RandomGenerator;

import static java.util.Objects.requireNonNull;

/**
 * Equivalence of ODE solutions that contain integration constants (variables named
 * {@code C...}). Constants may be renamed, swapped or individually rescaled:
 * {@code C1*exp(2x)+C2*exp(-4x)} equals {@code C2*exp(2x)+C1*exp(-4x)}, and
 * {@code sqrt(C-12*x^3)/3} equals {@code sqrt(2/3)*sqrt(C-2*x^3)} with C scaled by 1/6.
 * <p>
 * For every assignment of the second term's constants to the first's, each constant's scale
 * factor K is found by minimizing |u - v| over K with the other constants zeroed. The search
 * costs O(N! * N * minimizerIterations) evaluations for N constants; N is 1 to 3 for the
 * first and second order equations seen in exercises.
 */
public class Ode {
    public static final String CONSTANT_PREFIX = "C";
    /** Names the parser can never produce, so they cannot clash with user variables. */
    static final String RENAME_PREFIX = "$C", PERMUTE_PREFIX = "#C", SCALE_VAR = "$K";

    private static final Logger logger = LoggerFactory.getLogger(Ode.class);

    private final Configuration config;
    private final RandomGenerator random;
    private final Minimizer minimizer;
    private final Equivalence equivalence;

    public Ode(Configuration config, RandomGenerator random, Minimizer minimizer) {
        this.config = requireNonNull(config);
        this.random = requireNonNull(random);
        this.minimizer = requireNonNull(minimizer);
        this.equivalence = new Equivalence(config, random);
    }

    public Ode(Configuration config, RandomGenerator random) {
        this(config, random, new Minimizer.LineSearch(config));
    }

    /** Classpath configuration, drawing from the calling thread's random source. */
    public static Ode standard() {
        return new Ode(Configuration.loaded(), ThreadLocalRandom.current());
    }

    public static boolean compareOde(Term u, Term v) {
        return standard().compare(u, v);
    }

    public Configuration config() {
        return config;
    }

    public static boolean isConstant(String name) {
        return name.startsWith(CONSTANT_PREFIX);
    }

    private static boolean isConstantVar(Node n) {
        return n instanceof Var v && isConstant(v.name());
    }

    /**
     * Absorbs numeric decoration around a lone integration constant, bottom-up:
     * <pre>
     *   unary(C)        -> C     e.g. -C, exp(C), sin(C)
     *   binary(C, num)  -> C     e.g. C+3, 2*C
     *   binary(num, C)  -> C
     *   binary(C, C)    -> C
     * </pre>
     * so {@code sin(exp(cos(C+3))) + 3*C1} becomes {@code C + C1}.
     */
    public static Node collapseConstants(Node node) {
        if (!(node instanceof Apply a)) return node;
        var args = a.args().stream().map(Ode::collapseConstants).toList();
        if (a.op().isBinary()) {
            var x = args.get(0);
            var y = args.get(1);
            if (isConstantVar(x) && y instanceof Const) return x;
            if (isConstantVar(y) && x instanceof Const) return y;
            if (isConstantVar(x) && isConstantVar(y) && ((Var) x).name().equals(((Var) y).name())) return x;
        } else if (isConstantVar(args.get(0))) {
            return args.get(0);
        }
        return new Apply(a.op(), args, a.parenthesized());
    }

    /** Up to {@code limit} permutations of 0..n-1, generated with Heap's algorithm. */
    public static List<int[]> permutations(int n, int limit) {
        var result = new ArrayList<int[]>();
        var list = new int[n];
        Arrays.setAll(list, i -> i);
        if (n > 0) heap(list, n, result, limit);
        return result;
    }

    private static void heap(int[] list, int k, List<int[]> result, int limit) {
        if (result.size() >= limit) return;
        if (k == 1) {
            result.add(list.clone());
            return;
        }
        for (var i = 0; i < k; i++) {
            heap(list, k - 1, result, limit);
            var j = k % 2 == 0 ? i : 0;
            var t = list[j];
            list[j] = list[k - 1];
            list[k - 1] = t;
        }
    }

    public boolean compare(Term tu, Term tv) {
        if (equivalence.compare(tu, tv)) return true;

        var u = collapseConstants(tu.root());
        var v = collapseConstants(tv.root());

        var all = new LinkedHashSet<>(u.vars());
        all.addAll(v.vars());
        var constants = all.stream().filter(Ode::isConstant).toList();
        var ordinary = all.stream().filter(name -> !isConstant(name)).toList();
        var n = constants.size();
        if (n == 0) return false;
        if (n > config.maxConstants()) {
            logger.warn("Skipping constant search: {} integration constants exceed the limit of {}", n, config.maxConstants());
            return false;
        }

        // canonical names C0..C(n-1), via a disjoint prefix so no rename hits an earlier one
        for (var i = 0; i < n; i++) {
            u = u.rename(constants.get(i), RENAME_PREFIX + i);
            v = v.rename(constants.get(i), RENAME_PREFIX + i);
        }
        for (var i = 0; i < n; i++) {
            u = u.rename(RENAME_PREFIX + i, CONSTANT_PREFIX + i);
            v = v.rename(RENAME_PREFIX + i, CONSTANT_PREFIX + i);
        }

        var perms = permutations(n, config.maxPermutations());
        if (perms.size() < factorial(n))
            logger.warn("Constant search limited to {} of {}! permutations", perms.size(), n);
        for (var p : perms) {
            if (matches(u, permute(v, p), n, ordinary)) {
                logger.debug("Constants matched under permutation {}", Arrays.toString(p));
                return true;
            }
        }
        return false;
    }

    private static Node permute(Node v, int[] p) {
        for (var i = 0; i < p.length; i++) v = v.rename(CONSTANT_PREFIX + i, PERMUTE_PREFIX + p[i]);
        for (var i = 0; i < p.length; i++) v = v.rename(PERMUTE_PREFIX + i, CONSTANT_PREFIX + i);
        return v;
    }

    private boolean matches(Node u, Node v, int n, List<String> ordinary) {
        var tu = new Term(u);
        for (var k = 0; k < n; k++) {
            var ck = CONSTANT_PREFIX + k;
            v = v.substitute(Map.of(ck, new Apply(Operator.MUL, new Var(ck), new Var(SCALE_VAR))));

            var zeroed = new HashMap<String, Complex>();
            for (var j = 0; j < n; j++)
                if (j != k) zeroed.put(CONSTANT_PREFIX + j, Complex.ZERO);

            var context = new HashMap<>(zeroed);
            context.put(ck, Complex.random(random));
            for (var name : ordinary) context.put(name, Complex.random(random));

            var distance = new Apply(Operator.ABS, new Apply(Operator.SUB, u, v));
            var best = minimizer.minimize(scale -> {
                context.put(SCALE_VAR, Complex.of(scale));
                return Evaluator.eval(distance, context).re();
            });
            logger.debug("Scale for {}: K={} (residual {})", ck, best.x(), best.fx());
            v = v.substitute(Map.of(SCALE_VAR, new Const(best.x())));

            if (!equivalence.compare(tu, new Term(v), zeroed)) return false;
        }
        return equivalence.compare(tu, new Term(v));
    }

    private static long factorial(int n) {
        var f = 1L;
        for (var i = 2; i <= n; i++) f *= i;
        return f;
    }
}
