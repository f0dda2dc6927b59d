package edge.data;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedSet;

import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Historical shares of (vehicle type, technology) alternatives per region and reference year. Values
 * are non-negative weights (demand or share); only their ratios within a sibling group matter.
 */
public final class ObservedShareTable {

    private final ImmutableMap<String, Double> shares;
    private final ImmutableSortedSet<String> regions;

    private ObservedShareTable(Map<String, Double> shares, SortedSet<String> regions) {
        this.shares = ImmutableMap.copyOf(shares);
        this.regions = ImmutableSortedSet.copyOf(regions);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns the observed value, zero when the alternative was not observed.
     */
    public double getShare(String region, String vehicleType, String technology, int referenceYear) {
        return shares.getOrDefault(TableKey.of(region, vehicleType, technology, referenceYear), 0.0);
    }

    public ImmutableSortedSet<String> getRegions() {
        return regions;
    }

    public static final class Builder {
        private final ImmutableMap.Builder<String, Double> entries = ImmutableMap.builder();
        private final SortedSet<String> regions = new TreeSet<>();

        public Builder put(String region, String vehicleType, String technology, int referenceYear, double observedShare) {
            Preconditions.checkArgument(observedShare >= 0.0 && !Double.isNaN(observedShare),
                    "Observed share must be non-negative: %s for %s/%s/%s/%s", observedShare, region, vehicleType, technology, referenceYear);
            entries.put(TableKey.of(region, vehicleType, technology, referenceYear), observedShare);
            regions.add(region);
            return this;
        }

        public ObservedShareTable build() {
            return new ObservedShareTable(entries.buildOrThrow(), regions);
        }
    }
}
