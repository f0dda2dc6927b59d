package edge.data;

import com.google.common.collect.ImmutableMap;

import java.util.Map;

/**
 * Time cost per distance for passenger vehicle types, keyed by (region, vehicle type, year).
 * Absent entries contribute no time cost.
 */
public final class ValueOfTimeTable {

    private static final ValueOfTimeTable EMPTY = new ValueOfTimeTable(ImmutableMap.of());

    private final ImmutableMap<String, Double> timeCosts;

    private ValueOfTimeTable(Map<String, Double> timeCosts) {
        this.timeCosts = ImmutableMap.copyOf(timeCosts);
    }

    public static ValueOfTimeTable empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public double getTimeCost(String region, String vehicleType, int year) {
        return timeCosts.getOrDefault(TableKey.of(region, vehicleType, year), 0.0);
    }

    public static final class Builder {
        private final ImmutableMap.Builder<String, Double> entries = ImmutableMap.builder();

        public Builder put(String region, String vehicleType, int year, double timeCostPerDistance) {
            entries.put(TableKey.of(region, vehicleType, year), timeCostPerDistance);
            return this;
        }

        public ValueOfTimeTable build() {
            return new ValueOfTimeTable(entries.buildOrThrow());
        }
    }
}
