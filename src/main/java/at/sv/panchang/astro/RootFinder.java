package at.sv.panchang.astro;

import java.time.Duration;
import java.time.ZonedDateTime;
import java.util.Optional;
import java.util.function.ToDoubleFunction;

/**
 * Bracketing bisection for angular functions wrapped into (-180, 180]. Any sign change brackets; a converged point
 * whose residual stays large is a jump across the ±180 wrap, not a root.
 */
public final class RootFinder {

    static final int MAX_ITERATIONS = 50;
    static final double TOLERANCE_DEGREES = 1e-4;
    static final double MAX_RESIDUAL_DEGREES = 90.0;

    private final Duration initialHalfWindow;
    private final Duration expansionStep;
    private final int maxExpansions;

    public RootFinder(Duration initialHalfWindow, Duration expansionStep, int maxExpansions) {
        this.initialHalfWindow = initialHalfWindow;
        this.expansionStep = expansionStep;
        this.maxExpansions = maxExpansions;
    }

    /**
     * @return the root closest to convergence, or empty if no bracket was found around the guess or the sign change
     * is a wrap jump
     */
    public Optional<ZonedDateTime> find(ToDoubleFunction<ZonedDateTime> function, ZonedDateTime guess) {
        ZonedDateTime left = guess.minus(initialHalfWindow);
        ZonedDateTime right = guess.plus(initialHalfWindow);
        double fl = function.applyAsDouble(left);
        double fr = function.applyAsDouble(right);
        int expansions = 0;
        while (!isBracket(fl, fr) && expansions < maxExpansions) {
            left = left.minus(expansionStep);
            right = right.plus(expansionStep);
            fl = function.applyAsDouble(left);
            fr = function.applyAsDouble(right);
            expansions++;
        }
        if (!isBracket(fl, fr)) {
            return Optional.empty();
        }
        for (int i = 0; i < MAX_ITERATIONS; i++) {
            ZonedDateTime mid = midpoint(left, right);
            double fm = function.applyAsDouble(mid);
            if (Math.abs(fm) < TOLERANCE_DEGREES) {
                return Optional.of(mid);
            }
            if (Duration.between(left, right).toMillis() <= 1) {
                break;
            }
            if (fl * fm <= 0) {
                right = mid;
            } else {
                left = mid;
                fl = fm;
            }
        }
        ZonedDateTime root = midpoint(left, right);
        if (Math.abs(function.applyAsDouble(root)) > MAX_RESIDUAL_DEGREES) {
            return Optional.empty();
        }
        return Optional.of(root);
    }

    static boolean isBracket(double fl, double fr) {
        return fl * fr <= 0;
    }

    private static ZonedDateTime midpoint(ZonedDateTime left, ZonedDateTime right) {
        return left.plus(Duration.between(left, right).dividedBy(2));
    }
}
