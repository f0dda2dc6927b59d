package edge.utils.clustering.kmeans;

import java.util.OptionalDouble;

/**
 * Source of the structural indicator (e.g. population per land area) regions are clustered by.
 */
public interface ClusterIndicatorLookup {

    OptionalDouble getIndicator(String region);
}
