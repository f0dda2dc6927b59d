package edge.utils.clustering.kmeans;

import org.apache.commons.math3.stat.descriptive.rank.Percentile;

import java.util.ArrayList;
import java.util.List;

/**
 * One-dimensional k-means. Centers are seeded at evenly spaced quantiles of the data instead of at
 * random, so the same data always yields the same partition.
 */
public class KMeans {

    private static final double CONVERGENCE_TOLERANCE = 1e-12;

    public static double[] initializeQuantileCenters(List<IndicatorPoint> dataset, int k) {
        double[] values = new double[dataset.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = dataset.get(i).getValue();
        }
        Percentile percentile = new Percentile();
        percentile.setData(values);
        double[] centers = new double[k];
        for (int i = 0; i < k; i++) {
            double quantile = 100.0 * (i + 0.5) / k;
            centers[i] = percentile.evaluate(quantile);
        }
        return centers;
    }

    public static List<List<IndicatorPoint>> assign(List<IndicatorPoint> dataset, double[] centers) {
        List<List<IndicatorPoint>> clusters = new ArrayList<>(centers.length);
        for (int i = 0; i < centers.length; i++) {
            clusters.add(new ArrayList<>());
        }
        for (IndicatorPoint data : dataset) {
            clusters.get(data.getNearestCenterIndex(centers)).add(data);
        }
        return clusters;
    }

    public static double[] getNewCenters(List<IndicatorPoint> dataset, double[] centers) {
        List<List<IndicatorPoint>> clusters = assign(dataset, centers);
        double[] newCenters = new double[centers.length];
        for (int i = 0; i < centers.length; i++) {
            // an emptied cluster keeps its center
            newCenters[i] = IndicatorPoint.getMean(clusters.get(i), centers[i]);
        }
        return newCenters;
    }

    public static double getDistance(double[] oldCenters, double[] newCenters) {
        double accumDist = 0;
        for (int i = 0; i < oldCenters.length; i++) {
            accumDist += Math.abs(oldCenters[i] - newCenters[i]);
        }
        return accumDist;
    }

    public static double[] kmeans(double[] centers, List<IndicatorPoint> dataset, int maxIterations) {
        boolean converged;
        int iteration = 0;
        do {
            double[] newCenters = getNewCenters(dataset, centers);
            double dist = getDistance(centers, newCenters);
            centers = newCenters;
            converged = dist <= CONVERGENCE_TOLERANCE;
            iteration++;
        } while (!converged && iteration < maxIterations);
        return centers;
    }
}
