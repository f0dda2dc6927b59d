package edge.sim;

import com.google.common.collect.ImmutableSortedMap;
import edge.utils.clustering.kmeans.RegionClusters;

import java.util.SortedMap;

/**
 * Output of a full run, ordered by region.
 */
public final class ProjectionResult {

    private final RegionClusters clusters;
    private final ImmutableSortedMap<String, RegionResult> regions;

    ProjectionResult(RegionClusters clusters, SortedMap<String, RegionResult> regions) {
        this.clusters = clusters;
        this.regions = ImmutableSortedMap.copyOfSorted(regions);
    }

    public RegionClusters getClusters() {
        return clusters;
    }

    public ImmutableSortedMap<String, RegionResult> getRegions() {
        return regions;
    }

    public RegionResult getRegion(String region) {
        return regions.get(region);
    }
}
