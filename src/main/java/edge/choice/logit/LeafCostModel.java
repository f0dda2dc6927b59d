package edge.choice.logit;

import java.util.OptionalDouble;

/**
 * Effective per-distance cost of an alternative as perceived in the choice.
 */
public interface LeafCostModel {

    /**
     * @return the strictly positive effective cost, or empty when the alternative is not available
     * in that region and year
     */
    OptionalDouble cost(String region, NestNode alternative, int year);
}
