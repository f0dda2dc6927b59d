package edge.calibration;

import edge.choice.logit.NestNode;
import edge.choice.logit.NestTopology;
import edge.data.InconvenienceCosts;
import edge.data.PriceTable;
import edge.data.ValueOfTimeTable;

/**
 * Solves preferences against monetary cost plus the inconvenience cost of the reference year, so the
 * preferences only hold the taste the inconvenience costs do not explain.
 */
public class InconvenienceCalibrator extends PreferenceCalibrator {

    private final InconvenienceCosts inconvenienceCosts;

    public InconvenienceCalibrator(NestTopology topology, PriceTable prices, ValueOfTimeTable valueOfTime,
                                   InconvenienceCosts inconvenienceCosts, double preferenceFloor) {
        super(topology, prices, valueOfTime, preferenceFloor);
        this.inconvenienceCosts = inconvenienceCosts;
    }

    @Override
    public CalibrationMode getMode() {
        return CalibrationMode.INCONVENIENCE;
    }

    @Override
    protected double adjustCost(String region, NestNode alternative, int year, double baseCost) {
        return baseCost + inconvenienceCosts.getAdjustment(region, alternative.getVehicleType(), alternative.getTechnology(), year);
    }
}
