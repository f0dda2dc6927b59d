package edge.choice.logit;

import edge.data.InconvenienceCosts;

import java.util.OptionalDouble;

/**
 * Adds the inconvenience cost of an alternative to the cost of a wrapped model. An adjusted cost
 * that is not strictly positive makes the alternative unavailable.
 */
public class InconvenienceCostModel implements LeafCostModel {

    private final LeafCostModel delegate;
    private final InconvenienceCosts inconvenienceCosts;

    public InconvenienceCostModel(LeafCostModel delegate, InconvenienceCosts inconvenienceCosts) {
        this.delegate = delegate;
        this.inconvenienceCosts = inconvenienceCosts;
    }

    @Override
    public OptionalDouble cost(String region, NestNode alternative, int year) {
        OptionalDouble base = delegate.cost(region, alternative, year);
        if (!base.isPresent()) {
            return base;
        }
        double adjusted = base.getAsDouble()
                + inconvenienceCosts.getAdjustment(region, alternative.getVehicleType(), alternative.getTechnology(), year);
        return adjusted > 0.0 ? OptionalDouble.of(adjusted) : OptionalDouble.empty();
    }
}
