package edge.choice.logit;

import edge.data.PriceRecord;
import edge.data.PriceTable;
import edge.data.ValueOfTimeTable;

import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Non-fuel cost plus fuel cost times intensity, plus the value-of-time surcharge of passenger
 * vehicle types. Alternatives without a usable price are unavailable.
 */
public class PriceCostModel implements LeafCostModel {

    private final PriceTable prices;
    private final ValueOfTimeTable valueOfTime;

    public PriceCostModel(PriceTable prices, ValueOfTimeTable valueOfTime) {
        this.prices = prices;
        this.valueOfTime = valueOfTime;
    }

    @Override
    public OptionalDouble cost(String region, NestNode alternative, int year) {
        Optional<PriceRecord> record = prices.find(region, alternative.getVehicleType(), alternative.getTechnology(), year);
        if (!record.isPresent() || !record.get().isUsable()) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(record.get().getTotalPrice()
                + valueOfTime.getTimeCost(region, alternative.getVehicleType(), year));
    }

    public PriceTable getPrices() {
        return prices;
    }

    public ValueOfTimeTable getValueOfTime() {
        return valueOfTime;
    }
}
