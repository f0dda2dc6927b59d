package edge.data;

import com.google.common.collect.ImmutableMap;
import edge.utils.clustering.kmeans.ClusterIndicatorLookup;

import java.util.Map;
import java.util.OptionalDouble;

/**
 * Structural indicator per region read from a table.
 */
public final class StructuralIndicatorTable implements ClusterIndicatorLookup {

    private final ImmutableMap<String, Double> values;

    public StructuralIndicatorTable(Map<String, Double> values) {
        this.values = ImmutableMap.copyOf(values);
    }

    @Override
    public OptionalDouble getIndicator(String region) {
        Double value = values.get(region);
        return value == null ? OptionalDouble.empty() : OptionalDouble.of(value);
    }
}
