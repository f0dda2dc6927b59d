package edge.trend;

/**
 * Shape of the path from a start value to a long-run target. Every law gives the fraction of the
 * initial gap still remaining: 1 at the start year, 0 from the convergence year on, non-increasing
 * in between. A non-positive or vanishingly small rate degenerates to a straight line.
 */
public enum ConvergenceLaw {

    /** S-shaped path centred half way between start and convergence year. */
    LOGISTIC {
        @Override
        double shape(double elapsed, double span, double rate) {
            double start = logistic(0.0, span, rate);
            double end = logistic(span, span, rate);
            if (end - start < FLAT) {
                return linear(elapsed, span);
            }
            return 1.0 - (logistic(elapsed, span, rate) - start) / (end - start);
        }
    },

    /** Fast early convergence, slowing down towards the convergence year. */
    EXPONENTIAL {
        @Override
        double shape(double elapsed, double span, double rate) {
            double end = Math.exp(-rate * span);
            if (1.0 - end < FLAT) {
                return linear(elapsed, span);
            }
            return (Math.exp(-rate * elapsed) - end) / (1.0 - end);
        }
    };

    /** Below this total change a rate is too small to bend the path and the law falls back to a line. */
    private static final double FLAT = 1e-12;

    abstract double shape(double elapsed, double span, double rate);

    private static double linear(double elapsed, double span) {
        return 1.0 - elapsed / span;
    }

    private static double logistic(double elapsed, double span, double rate) {
        return 1.0 / (1.0 + Math.exp(-rate * (elapsed - span / 2.0)));
    }

    public double remainingFraction(int startYear, int convergenceYear, double rate, int year) {
        if (year <= startYear) {
            return 1.0;
        }
        if (year >= convergenceYear) {
            return 0.0;
        }
        double span = convergenceYear - startYear;
        double elapsed = year - startYear;
        if (rate <= 0.0) {
            return linear(elapsed, span);
        }
        double fraction = shape(elapsed, span, rate);
        return Math.max(0.0, Math.min(1.0, fraction));
    }

    /**
     * Value on the path from {@code startValue} to {@code target}.
     */
    public double converge(double startValue, double target, int startYear, int convergenceYear, double rate, int year) {
        return target + (startValue - target) * remainingFraction(startYear, convergenceYear, rate, year);
    }
}
