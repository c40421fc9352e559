package dumb.quizterm;

import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;
import java.util.random.RandomGenerator;

import static java.util.Objects.requireNonNull;

/**
 * Randomized numerical identity test: two terms are taken as equal when they agree on
 * {@link Configuration#trials()} random complex points. This is one-sided; non-identical terms
 * that happen to agree on every sampled point are reported equal. For terms built from the
 * supported operators that is accepted as practically impossible.
 */
public class Equivalence {
    private final Configuration config;
    private final RandomGenerator random;

    public Equivalence(Configuration config, RandomGenerator random) {
        this.config = requireNonNull(config);
        this.random = requireNonNull(random);
    }

    /** Classpath configuration, drawing from the calling thread's random source. */
    public static Equivalence standard() {
        return new Equivalence(Configuration.loaded(), ThreadLocalRandom.current());
    }

    public Configuration config() {
        return config;
    }

    public boolean compare(Term u, Term v) {
        return compare(u, v, Map.of());
    }

    /**
     * @param fixed values for variables that must not be sampled
     */
    public boolean compare(Term u, Term v, Map<String, Complex> fixed) {
        var vars = new LinkedHashSet<>(u.vars());
        vars.addAll(v.vars());
        for (var trial = 0; trial < config.trials(); trial++) {
            var context = new HashMap<String, Complex>();
            for (var name : vars)
                context.put(name, fixed.containsKey(name) ? fixed.get(name) : Complex.random(random));
            var d = u.eval(context).sub(v.eval(context)).abs();
            // NaN fails as well
            if (!(d <= config.epsilon())) return false;
        }
        return true;
    }
}
