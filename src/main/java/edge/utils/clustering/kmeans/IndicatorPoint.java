package edge.utils.clustering.kmeans;

import java.util.List;

/**
 * A region placed on the (log-scaled) axis of its structural indicator.
 */
public class IndicatorPoint {

    private final String region;
    private final double value;

    public IndicatorPoint(String region, double value) {
        this.region = region;
        this.value = value;
    }

    public String getRegion() {
        return region;
    }

    public double getValue() {
        return value;
    }

    public double getDistance(double center) {
        return Math.abs(value - center);
    }

    /**
     * Index of the closest center; ties go to the lower index.
     */
    public int getNearestCenterIndex(double[] centers) {
        int index = -1;
        double minDist = Double.MAX_VALUE;
        for (int i = 0; i < centers.length; i++) {
            double dist = getDistance(centers[i]);
            if (dist < minDist) {
                minDist = dist;
                index = i;
            }
        }
        return index;
    }

    public static double getMean(List<IndicatorPoint> points, double fallback) {
        if (points.isEmpty()) return fallback;
        double accum = 0;
        for (IndicatorPoint point : points) {
            accum += point.value;
        }
        return accum / points.size();
    }

    @Override
    public String toString() {
        return region + "[" + value + "]";
    }
}
