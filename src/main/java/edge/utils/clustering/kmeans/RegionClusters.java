package edge.utils.clustering.kmeans;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import java.util.List;

/**
 * Fixed assignment of every region to one cluster; computed once per run.
 */
public final class RegionClusters {

    private final ImmutableList<RegionCluster> clusters;
    private final ImmutableMap<String, Integer> clusterByRegion;

    public RegionClusters(List<RegionCluster> clusters) {
        this.clusters = ImmutableList.copyOf(clusters);
        ImmutableMap.Builder<String, Integer> byRegion = ImmutableMap.builder();
        for (RegionCluster cluster : clusters) {
            for (String region : cluster.getRegions()) {
                byRegion.put(region, cluster.getId());
            }
        }
        this.clusterByRegion = byRegion.buildOrThrow();
    }

    public int getClusterId(String region) {
        Integer id = clusterByRegion.get(region);
        Preconditions.checkArgument(id != null, "Region %s has not been clustered", region);
        return id;
    }

    public ImmutableList<RegionCluster> getClusters() {
        return clusters;
    }

    public int size() {
        return clusters.size();
    }
}
