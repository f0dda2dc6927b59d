package edge.data;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;

import java.util.Map;
import java.util.OptionalDouble;

/**
 * Aggregate transport demand per region and year, projected outside this engine.
 */
public final class DemandSeries {

    private final ImmutableMap<String, Double> demand;

    private DemandSeries(Map<String, Double> demand) {
        this.demand = ImmutableMap.copyOf(demand);
    }

    public static Builder builder() {
        return new Builder();
    }

    public OptionalDouble getDemand(String region, int year) {
        Double value = demand.get(TableKey.of(region, year));
        return value == null ? OptionalDouble.empty() : OptionalDouble.of(value);
    }

    public static final class Builder {
        private final ImmutableMap.Builder<String, Double> entries = ImmutableMap.builder();

        public Builder put(String region, int year, double value) {
            Preconditions.checkArgument(value >= 0.0, "Demand must be non-negative: %s for %s/%s", value, region, year);
            entries.put(TableKey.of(region, year), value);
            return this;
        }

        public DemandSeries build() {
            return new DemandSeries(entries.buildOrThrow());
        }
    }
}
