package dumb.quizterm;

import java.util.function.DoubleUnaryOperator;

/**
 * One-dimensional derivative-free minimization over the reals.
 */
@FunctionalInterface
public interface Minimizer {

    Result minimize(DoubleUnaryOperator f);

    record Result(double x, double fx) {
    }

    /**
     * Naive pattern search: compares f(x-s), f(x), f(x+s), moves to the smallest and halves s
     * whenever the direction changes or the search stalls. Only reliable for unimodal f, which
     * holds for the constant scalings arising in ODE exercises.
     */
    final class LineSearch implements Minimizer {
        private final int maxIterations;
        private final double epsilon;

        public LineSearch(int maxIterations, double epsilon) {
            if (maxIterations < 1) throw new IllegalArgumentException("maxIterations must be positive");
            this.maxIterations = maxIterations;
            this.epsilon = epsilon;
        }

        public LineSearch(Configuration config) {
            this(config.minimizerIterations(), config.minimizerEpsilon());
        }

        @Override
        public Result minimize(DoubleUnaryOperator f) {
            var x = 0.0;
            var step = 1.0;
            var lastDirection = Integer.MIN_VALUE;
            for (var i = 0; i < maxIterations; i++) {
                var y = f.applyAsDouble(x);
                var yRight = f.applyAsDouble(x + step);
                var yLeft = f.applyAsDouble(x - step);
                var direction = 0;
                if (yRight < y) {
                    y = yRight;
                    direction = 1;
                }
                if (yLeft < y) {
                    y = yLeft;
                    direction = -1;
                }
                x += direction * step;
                if (y < epsilon) break;
                if (direction == 0 || direction != lastDirection) step /= 2;
                lastDirection = direction;
            }
            return new Result(x, f.applyAsDouble(x));
        }
    }
}
