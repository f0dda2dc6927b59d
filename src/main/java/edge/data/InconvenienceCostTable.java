package edge.data;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedMap;
import edge.utils.MathUtil;

import java.util.HashMap;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Non-monetary adoption barrier per distance, keyed by (region, vehicle type, technology) and
 * tabulated over years. A row without technology applies to every technology of its vehicle type;
 * a technology-specific series takes precedence.
 * <p>
 * Years between two rows of a series are interpolated linearly, years outside the tabulated range
 * take the nearest row. A key without any row has no adjustment.
 */
public final class InconvenienceCostTable implements InconvenienceCosts {

    private static final InconvenienceCostTable EMPTY = new InconvenienceCostTable(ImmutableMap.of());

    private final ImmutableMap<String, ImmutableSortedMap<Integer, Double>> series;

    private InconvenienceCostTable(Map<String, ImmutableSortedMap<Integer, Double>> series) {
        this.series = ImmutableMap.copyOf(series);
    }

    public static InconvenienceCostTable empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public double getAdjustment(String region, String vehicleType, String technology, int year) {
        ImmutableSortedMap<Integer, Double> values = series.get(TableKey.of(region, vehicleType, technology));
        if (values == null) {
            values = series.get(TableKey.of(region, vehicleType, null));
        }
        return values == null ? 0.0 : valueAt(values, year);
    }

    private static double valueAt(ImmutableSortedMap<Integer, Double> values, int year) {
        Map.Entry<Integer, Double> lower = values.floorEntry(year);
        Map.Entry<Integer, Double> upper = values.ceilingEntry(year);
        if (lower == null) {
            return upper.getValue();
        }
        if (upper == null) {
            return lower.getValue();
        }
        return MathUtil.interpolate(lower.getKey(), lower.getValue(), upper.getKey(), upper.getValue(), year);
    }

    public boolean isEmpty() {
        return series.isEmpty();
    }

    public static final class Builder {
        private final Map<String, SortedMap<Integer, Double>> entries = new HashMap<>();

        /**
         * @param technology the technology, or null for a vehicle-type-wide adjustment
         */
        public Builder put(String region, String vehicleType, String technology, int year, double costAdjustment) {
            SortedMap<Integer, Double> values = entries.computeIfAbsent(TableKey.of(region, vehicleType, technology),
                    key -> new TreeMap<>());
            Double previous = values.put(year, costAdjustment);
            Preconditions.checkArgument(previous == null, "Duplicate inconvenience cost for %s/%s/%s in %s",
                    region, vehicleType, technology, year);
            return this;
        }

        public InconvenienceCostTable build() {
            Map<String, ImmutableSortedMap<Integer, Double>> series = new HashMap<>();
            for (Map.Entry<String, SortedMap<Integer, Double>> entry : entries.entrySet()) {
                series.put(entry.getKey(), ImmutableSortedMap.copyOfSorted(entry.getValue()));
            }
            return new InconvenienceCostTable(series);
        }
    }
}
