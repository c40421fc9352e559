package dumb.quizterm;

import org.apache.commons.text.similarity.LevenshteinDistance;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.random.RandomGenerator;

import static java.util.Objects.requireNonNull;

/**
 * Grades answer fields against the sample solution. Input that does not parse simply counts
 * as incorrect; it is never an error at this level.
 */
public class Answers {
    private static final Logger logger = LoggerFactory.getLogger(Answers.class);
    private static final double INTEGER_EPS = 1e-9;
    /** Typos a gap answer may contain and still count. */
    private static final int GAP_TOLERANCE = 1;

    private final Equivalence equivalence;
    private final Ode ode;

    public Answers(Equivalence equivalence, Ode ode) {
        this.equivalence = requireNonNull(equivalence);
        this.ode = requireNonNull(ode);
    }

    public Answers(Configuration config, RandomGenerator random) {
        this(new Equivalence(config, random), new Ode(config, random));
    }

    public record Score(int checked, int correct) {
        public static final Score NONE = new Score(0, 0);

        public Score add(Score s) {
            return new Score(checked + s.checked, correct + s.correct);
        }

        public boolean passed() {
            return checked == correct;
        }
    }

    /** [0, 1, ..., n-1], shuffled by n random swaps when {@code shuffled} holds. */
    public static int[] range(int n, boolean shuffled, RandomGenerator random) {
        var arr = new int[n];
        Arrays.setAll(arr, i -> i);
        if (shuffled) {
            for (var i = 0; i < n; i++) {
                var u = random.nextInt(n);
                var v = random.nextInt(n);
                var t = arr[u];
                arr[u] = arr[v];
                arr[v] = t;
            }
        }
        return arr;
    }

    public Score term(String expected, @Nullable String student, boolean isOde) {
        return new Score(1, equal(expected, student, isOde) ? 1 : 0);
    }

    public Score integer(String expected, @Nullable String student) {
        if (student == null) return new Score(1, 0);
        try {
            var ok = Math.abs(Double.parseDouble(student.trim()) - Double.parseDouble(expected.trim())) < INTEGER_EPS;
            return new Score(1, ok ? 1 : 0);
        } catch (NumberFormatException e) {
            logger.debug("Not a number: '{}' vs '{}'", student, expected);
            return new Score(1, 0);
        }
    }

    /** Choice answers, stringified as "true" / "false"; exact match. */
    public Score bool(String expected, @Nullable String student) {
        return new Score(1, expected.equals(student) ? 1 : 0);
    }

    /**
     * Gap (free text) answers. {@code expected} lists {@code |}-separated alternatives;
     * case is ignored and one edit is forgiven, so "Berlin|Bonn" accepts "berln".
     */
    public Score gap(String expected, @Nullable String student) {
        return new Score(1, acceptedGap(expected, student).isPresent() ? 1 : 0);
    }

    /** The alternative a gap answer was accepted as, for echoing back into the field. */
    public static Optional<String> acceptedGap(String expected, @Nullable String student) {
        if (student == null) return Optional.empty();
        var s = student.trim().toUpperCase(Locale.ROOT);
        var distance = LevenshteinDistance.getDefaultInstance();
        for (var alternative : expected.split("\\|")) {
            var e = alternative.trim();
            if (distance.apply(s, e.toUpperCase(Locale.ROOT)) <= GAP_TOLERANCE) {
                logger.debug("Gap answer '{}' accepted as '{}'", student, e);
                return Optional.of(e);
            }
        }
        return Optional.empty();
    }

    /**
     * Ordered, element-wise: {@code "1,2,3"} against three student fields. Also used for
     * complex answers given as {@code "re,im"}.
     */
    public Score vector(String expected, List<String> students) {
        var expectedList = expected.split(",");
        var correct = 0;
        for (var i = 0; i < expectedList.length; i++)
            if (i < students.size() && equal(expectedList[i], students.get(i), false)) correct++;
        return new Score(expectedList.length, correct);
    }

    /** Unordered: each expected element counts when any student element matches it. */
    public Score set(String expected, List<String> students) {
        var expectedList = expected.split(",");
        var correct = 0;
        for (var e : expectedList)
            if (students.stream().anyMatch(s -> equal(e, s, false))) correct++;
        return new Score(expectedList.length, correct);
    }

    /** @param students row-major student elements */
    public Score matrix(String expected, List<String> students) {
        var mat = TermMatrix.parse(expected);
        var correct = 0;
        for (var i = 0; i < mat.rows(); i++) {
            for (var j = 0; j < mat.cols(); j++) {
                var idx = i * mat.cols() + j;
                if (idx < students.size() && equal(mat.get(i, j), students.get(idx), false)) correct++;
            }
        }
        return new Score(mat.rows() * mat.cols(), correct);
    }

    private boolean equal(String expected, @Nullable String student, boolean isOde) {
        if (student == null) return false;
        try {
            var u = Term.parse(expected);
            var v = Term.parse(student);
            return isOde ? ode.compare(u, v) : equivalence.compare(u, v);
        } catch (TermParser.ParseException e) {
            logger.debug("Term invalid, '{}' vs '{}': {}", student, expected, e.getMessage());
            return false;
        }
    }
}
