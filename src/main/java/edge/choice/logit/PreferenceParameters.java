package edge.choice.logit;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableTable;
import com.google.common.collect.Table;

import java.util.Map;

/**
 * Preference (share weight) of every node under its parent, per region, for one year.
 * Nodes without an entry are neutral (weight 1).
 */
public final class PreferenceParameters {

    public static final double NEUTRAL = 1.0;

    private final int year;
    private final ImmutableTable<String, String, Double> values;

    private PreferenceParameters(int year, Table<String, String, Double> values) {
        this.year = year;
        this.values = ImmutableTable.copyOf(values);
    }

    public static Builder builder(int year) {
        return new Builder(year);
    }

    public int getYear() {
        return year;
    }

    public double get(String region, String node) {
        Double value = values.get(region, node);
        return value == null ? NEUTRAL : value;
    }

    public boolean contains(String region, String node) {
        return values.contains(region, node);
    }

    public ImmutableMap<String, Double> forRegion(String region) {
        return values.row(region);
    }

    public ImmutableSet<String> getRegions() {
        return values.rowKeySet();
    }

    public static final class Builder {
        private final int year;
        private final ImmutableTable.Builder<String, String, Double> values = ImmutableTable.builder();

        private Builder(int year) {
            this.year = year;
        }

        public Builder put(String region, String node, double preference) {
            Preconditions.checkArgument(preference > 0.0 && !Double.isInfinite(preference),
                    "Preference of %s in %s (%s) must be strictly positive and finite, got %s", node, region, year, preference);
            values.put(region, node, preference);
            return this;
        }

        public Builder putAll(String region, Map<String, Double> preferences) {
            for (Map.Entry<String, Double> entry : preferences.entrySet()) {
                put(region, entry.getKey(), entry.getValue());
            }
            return this;
        }

        public PreferenceParameters build() {
            return new PreferenceParameters(year, values.build());
        }
    }
}
