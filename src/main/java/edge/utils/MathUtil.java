package edge.utils;

public class MathUtil {

    /**
     * Numerically stable log(sum(exp(x_i))). Entries equal to negative infinity contribute nothing;
     * an empty or all-negative-infinity input yields negative infinity.
     */
    public static double logSumExp(double[] values) {
        double max = Double.NEGATIVE_INFINITY;
        for (double value : values) {
            if (value > max) max = value;
        }
        if (max == Double.NEGATIVE_INFINITY) {
            return Double.NEGATIVE_INFINITY;
        }
        double sum = 0.0;
        for (double value : values) {
            sum += Math.exp(value - max);
        }
        return max + Math.log(sum);
    }

    public static double interpolate(int x0, double y0, int x1, double y1, int x) {
        if (x1 == x0) {
            return y1;
        }
        double weight = (double) (x - x0) / (x1 - x0);
        return y0 + (y1 - y0) * weight;
    }
}
