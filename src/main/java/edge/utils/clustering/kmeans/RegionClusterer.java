package edge.utils.clustering.kmeans;

import com.google.common.base.Preconditions;
import edge.utils.exception.ClusteringIndicatorMissingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.OptionalDouble;
import java.util.TreeSet;

/**
 * Groups regions into a small number of clusters by k-means on log(1 + indicator). The result only
 * depends on the indicator values, never on the order regions are passed in.
 */
public class RegionClusterer {
    private static final Logger log = LoggerFactory.getLogger(RegionClusterer.class);

    private final ClusterIndicatorLookup indicators;
    private final int clusterCount;
    private final int maxIterations;

    public RegionClusterer(ClusterIndicatorLookup indicators, int clusterCount, int maxIterations) {
        Preconditions.checkArgument(clusterCount > 0, "Cluster count must be positive: %s", clusterCount);
        Preconditions.checkArgument(maxIterations > 0, "Iteration limit must be positive: %s", maxIterations);
        this.indicators = indicators;
        this.clusterCount = clusterCount;
        this.maxIterations = maxIterations;
    }

    /**
     * @throws ClusteringIndicatorMissingException if a region has no indicator value
     */
    public RegionClusters cluster(Collection<String> regions) {
        Preconditions.checkArgument(!regions.isEmpty(), "No regions to cluster");
        List<IndicatorPoint> dataset = new ArrayList<>();
        TreeSet<Double> distinct = new TreeSet<>();
        for (String region : new TreeSet<>(regions)) {
            OptionalDouble indicator = indicators.getIndicator(region);
            if (!indicator.isPresent() || Double.isNaN(indicator.getAsDouble()) || indicator.getAsDouble() < 0.0) {
                throw new ClusteringIndicatorMissingException("Region has no usable structural indicator", region, null, null);
            }
            double value = Math.log1p(indicator.getAsDouble());
            dataset.add(new IndicatorPoint(region, value));
            distinct.add(value);
        }

        int k = Math.min(clusterCount, distinct.size());
        if (k < clusterCount) {
            log.warn("Only {} distinct indicator values, using {} clusters instead of {}", distinct.size(), k, clusterCount);
        }
        double[] centers = KMeans.kmeans(KMeans.initializeQuantileCenters(dataset, k), dataset, maxIterations);
        List<List<IndicatorPoint>> members = KMeans.assign(dataset, centers);

        List<Integer> order = new ArrayList<>();
        for (int i = 0; i < centers.length; i++) {
            if (!members.get(i).isEmpty()) order.add(i);
        }
        final double[] finalCenters = centers;
        order.sort((a, b) -> Double.compare(finalCenters[a], finalCenters[b]));

        List<RegionCluster> clusters = new ArrayList<>();
        for (int index : order) {
            List<String> names = new ArrayList<>();
            for (IndicatorPoint point : members.get(index)) {
                names.add(point.getRegion());
            }
            RegionCluster cluster = new RegionCluster(clusters.size(), centers[index], names);
            log.info("Assigned {} (center {})", cluster, String.format("%.4f", centers[index]));
            clusters.add(cluster);
        }
        return new RegionClusters(clusters);
    }
}
