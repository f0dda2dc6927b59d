package edge.utils.clustering.kmeans;

import com.google.common.collect.ImmutableSortedSet;

import java.util.Collection;

/**
 * Regions sharing one preference-trend archetype. Ids count up from the lowest indicator center.
 */
public final class RegionCluster {

    private final int id;
    private final double center;
    private final ImmutableSortedSet<String> regions;

    public RegionCluster(int id, double center, Collection<String> regions) {
        this.id = id;
        this.center = center;
        this.regions = ImmutableSortedSet.copyOf(regions);
    }

    public int getId() {
        return id;
    }

    /**
     * Center on the log1p scale of the indicator.
     */
    public double getCenter() {
        return center;
    }

    public ImmutableSortedSet<String> getRegions() {
        return regions;
    }

    @Override
    public String toString() {
        return "cluster " + id + " " + regions;
    }
}
