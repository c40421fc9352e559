package dumb.quizterm;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import dumb.quizterm.util.Json;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Tunables of the equivalence oracles. Missing JSON properties fall back to the defaults.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Configuration(
        @JsonProperty("trials") int trials,
        @JsonProperty("epsilon") double epsilon,
        @JsonProperty("minimizerIterations") int minimizerIterations,
        @JsonProperty("minimizerEpsilon") double minimizerEpsilon,
        @JsonProperty("maxConstants") int maxConstants,
        @JsonProperty("maxPermutations") int maxPermutations
) {
    public static final String RESOURCE = "quizterm.json";
    static final int DEFAULT_TRIALS = 10;
    static final double DEFAULT_EPSILON = 1e-9;
    static final int DEFAULT_MINIMIZER_ITERATIONS = 1000;
    static final double DEFAULT_MINIMIZER_EPSILON = 1e-11;
    static final int DEFAULT_MAX_CONSTANTS = 6;
    static final int DEFAULT_MAX_PERMUTATIONS = 720;
    public static final Configuration DEFAULT = new Configuration();

    private static final Logger logger = LoggerFactory.getLogger(Configuration.class);

    public Configuration {
        if (trials < 1 || minimizerIterations < 1 || maxConstants < 1 || maxPermutations < 1)
            throw new IllegalArgumentException("Counts must be positive");
        if (!(epsilon > 0) || !(minimizerEpsilon > 0))
            throw new IllegalArgumentException("Tolerances must be positive");
    }

    @JsonCreator
    public Configuration(
            @JsonProperty("trials") @Nullable Integer trials,
            @JsonProperty("epsilon") @Nullable Double epsilon,
            @JsonProperty("minimizerIterations") @Nullable Integer minimizerIterations,
            @JsonProperty("minimizerEpsilon") @Nullable Double minimizerEpsilon,
            @JsonProperty("maxConstants") @Nullable Integer maxConstants,
            @JsonProperty("maxPermutations") @Nullable Integer maxPermutations
    ) {
        this(
                trials != null ? trials : DEFAULT_TRIALS,
                epsilon != null ? epsilon : DEFAULT_EPSILON,
                minimizerIterations != null ? minimizerIterations : DEFAULT_MINIMIZER_ITERATIONS,
                minimizerEpsilon != null ? minimizerEpsilon : DEFAULT_MINIMIZER_EPSILON,
                maxConstants != null ? maxConstants : DEFAULT_MAX_CONSTANTS,
                maxPermutations != null ? maxPermutations : DEFAULT_MAX_PERMUTATIONS
        );
    }

    public Configuration() {
        this(DEFAULT_TRIALS, DEFAULT_EPSILON, DEFAULT_MINIMIZER_ITERATIONS, DEFAULT_MINIMIZER_EPSILON,
                DEFAULT_MAX_CONSTANTS, DEFAULT_MAX_PERMUTATIONS);
    }

    public static Configuration parse(String json) {
        try {
            return Json.obj(json, Configuration.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid configuration JSON: " + e.getOriginalMessage(), e);
        }
    }

    /** {@link #load()} once per class loader; backs the static comparison entry points. */
    public static Configuration loaded() {
        return Loaded.INSTANCE;
    }

    private static final class Loaded {
        static final Configuration INSTANCE = load();
    }

    /** Reads {@value #RESOURCE} from the classpath, or returns the defaults when absent. */
    public static Configuration load() {
        try (var in = Configuration.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in == null) {
                logger.debug("No {} on classpath, using defaults", RESOURCE);
                return DEFAULT;
            }
            var config = Json.obj(in, Configuration.class);
            logger.info("Configuration loaded: trials={}, epsilon={}, minimizerIterations={}, maxConstants={}, maxPermutations={}",
                    config.trials, config.epsilon, config.minimizerIterations, config.maxConstants, config.maxPermutations);
            return config;
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid " + RESOURCE + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public String toJson() {
        return Json.str(this);
    }
}
