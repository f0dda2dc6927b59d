package edge.calibration;

import edge.choice.logit.NestNode;
import edge.choice.logit.NestTopology;
import edge.data.PriceTable;
import edge.data.ValueOfTimeTable;

public class PreferenceOnlyCalibrator extends PreferenceCalibrator {

    public PreferenceOnlyCalibrator(NestTopology topology, PriceTable prices, ValueOfTimeTable valueOfTime,
                                    double preferenceFloor) {
        super(topology, prices, valueOfTime, preferenceFloor);
    }

    @Override
    public CalibrationMode getMode() {
        return CalibrationMode.PREFERENCE_ONLY;
    }

    @Override
    protected double adjustCost(String region, NestNode alternative, int year, double baseCost) {
        return baseCost;
    }
}
