package edge.calibration;

import edge.EdgeTestUtilities;
import edge.choice.logit.InconvenienceCostModel;
import edge.choice.logit.NestEvaluation;
import edge.choice.logit.NestTopology;
import edge.choice.logit.NestedShareEvaluator;
import edge.choice.logit.PreferenceParameters;
import edge.choice.logit.PriceCostModel;
import edge.data.InconvenienceCostTable;
import edge.data.ObservedShareTable;
import edge.data.PriceRecord;
import edge.data.PriceTable;
import edge.data.ValueOfTimeTable;
import edge.utils.exception.CalibrationDataGapException;
import edge.utils.exception.MissingPriceException;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static edge.EdgeTestUtilities.CAR;
import static edge.EdgeTestUtilities.REFERENCE_YEAR;
import static edge.EdgeTestUtilities.REGION;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class PreferenceCalibratorTest {
    private static final double DELTA = 1e-6;
    private static final double FLOOR = 1e-6;

    private final NestTopology topology = EdgeTestUtilities.passengerTopology();

    private PreferenceCalibrator preferenceOnly(PriceTable prices) {
        return PreferenceCalibrator.forMode(CalibrationMode.PREFERENCE_ONLY, topology, prices, ValueOfTimeTable.empty(),
                InconvenienceCostTable.empty(), FLOOR);
    }

    @Test
    public void testCalibratedPreferencesReproduceObservedShares() {
        PriceTable prices = EdgeTestUtilities.passengerPriceTable(REFERENCE_YEAR);
        ObservedShareTable observed = EdgeTestUtilities.passengerShares(ObservedShareTable.builder(), REGION, 0.6, 0.1, 0.3).build();

        PreferenceParameters preferences = preferenceOnly(prices).calibrate(Arrays.asList(REGION), observed, REFERENCE_YEAR);
        NestEvaluation evaluation = new NestedShareEvaluator(topology)
                .evaluate(REGION, REFERENCE_YEAR, preferences, new PriceCostModel(prices, ValueOfTimeTable.empty()));

        assertEquals(0.6, evaluation.getAlternativeShare("car_ICE"), DELTA);
        assertEquals(0.1, evaluation.getAlternativeShare("car_BEV"), DELTA);
        assertEquals(0.3, evaluation.getAlternativeShare("Walk"), DELTA);
    }

    @Test
    public void testClosedFormAgainstLargestSibling() {
        NestTopology pair = NestTopology.builder()
                .addNest(0, "4W", null, 0.5)
                .addAlternative(1, "car_ICE", "4W", CAR, "Liquids", null)
                .addAlternative(1, "car_BEV", "4W", CAR, "BEV", null)
                .build();
        PriceTable prices = new PriceTable(Arrays.asList(
                new PriceRecord(REGION, CAR, "Liquids", REFERENCE_YEAR, 10.0, 0.0, 0.0),
                new PriceRecord(REGION, CAR, "BEV", REFERENCE_YEAR, 12.0, 0.0, 0.0)));
        ObservedShareTable observed = ObservedShareTable.builder()
                .put(REGION, CAR, "Liquids", REFERENCE_YEAR, 0.7)
                .put(REGION, CAR, "BEV", REFERENCE_YEAR, 0.3)
                .build();

        CalibrationResult result = new PreferenceOnlyCalibrator(pair, prices, ValueOfTimeTable.empty(), FLOOR)
                .calibrate(REGION, observed, REFERENCE_YEAR);

        assertEquals(1.0, result.getPreference("car_ICE"), DELTA);
        assertEquals(0.3 / 0.7 * 1.44, result.getPreference("car_BEV"), DELTA);
        assertEquals(CalibrationMode.PREFERENCE_ONLY, result.getMode());
    }

    @Test
    public void testZeroObservedShareIsFloored() {
        PriceTable prices = EdgeTestUtilities.passengerPriceTable(REFERENCE_YEAR);
        ObservedShareTable observed = EdgeTestUtilities.passengerShares(ObservedShareTable.builder(), REGION, 0.7, 0.0, 0.3).build();

        CalibrationResult result = preferenceOnly(prices).calibrate(REGION, observed, REFERENCE_YEAR);

        double costRatio = result.getCompositeCosts().get("car_BEV") / result.getCompositeCosts().get("car_ICE");
        assertEquals(FLOOR * Math.pow(costRatio, 4.0), result.getPreference("car_BEV"), 1e-15);
        assertTrue(result.getFloored().contains("car_BEV"));
        assertEquals(1.0, result.getPreference("car_ICE"), 0.0);
    }

    @Test
    public void testUnobservedNestGetsNeutralChildren() {
        PriceTable prices = EdgeTestUtilities.passengerPriceTable(REFERENCE_YEAR);
        ObservedShareTable observed = EdgeTestUtilities.passengerShares(ObservedShareTable.builder(), REGION, 0.0, 0.0, 1.0).build();

        CalibrationResult result = preferenceOnly(prices).calibrate(REGION, observed, REFERENCE_YEAR);

        assertEquals(PreferenceParameters.NEUTRAL, result.getPreference("car_ICE"), 0.0);
        assertEquals(PreferenceParameters.NEUTRAL, result.getPreference("car_BEV"), 0.0);
        double costRatio = result.getCompositeCosts().get("4W") / result.getCompositeCosts().get("Walk");
        assertEquals(FLOOR * Math.pow(costRatio, 2.0), result.getPreference("4W"), 1e-15);
        assertTrue(result.getFloored().contains("4W"));
    }

    @Test
    public void testCheapUnobservedSiblingStaysAtZeroShare() {
        NestTopology pair = NestTopology.builder()
                .addNest(0, "4W", null, 0.25)
                .addAlternative(1, "car_ICE", "4W", CAR, "Liquids", null)
                .addAlternative(1, "car_BEV", "4W", CAR, "BEV", null)
                .build();
        PriceTable prices = new PriceTable(Arrays.asList(
                new PriceRecord(REGION, CAR, "Liquids", REFERENCE_YEAR, 0.4, 0.0, 0.0),
                new PriceRecord(REGION, CAR, "BEV", REFERENCE_YEAR, 0.1, 0.0, 0.0)));
        ObservedShareTable observed = ObservedShareTable.builder()
                .put(REGION, CAR, "Liquids", REFERENCE_YEAR, 1.0)
                .put(REGION, CAR, "BEV", REFERENCE_YEAR, 0.0)
                .build();

        PreferenceParameters preferences = new PreferenceOnlyCalibrator(pair, prices, ValueOfTimeTable.empty(), FLOOR)
                .calibrate(Arrays.asList(REGION), observed, REFERENCE_YEAR);
        NestEvaluation evaluation = new NestedShareEvaluator(pair)
                .evaluate(REGION, REFERENCE_YEAR, preferences, new PriceCostModel(prices, ValueOfTimeTable.empty()));

        assertEquals(0.0, evaluation.getAlternativeShare("car_BEV"), DELTA);
        assertEquals(1.0, evaluation.getAlternativeShare("car_ICE"), DELTA);
        assertEquals(FLOOR * Math.pow(0.25, 4.0), preferences.get(REGION, "car_BEV"), 1e-18);
    }

    @Test
    public void testMissingPriceOfObservedAlternativeIsADataGap() {
        List<PriceRecord> records = new ArrayList<>(EdgeTestUtilities.passengerPrices(REGION, REFERENCE_YEAR));
        records.removeIf(record -> record.getTechnology().equals("BEV"));
        ObservedShareTable observed = EdgeTestUtilities.passengerShares(ObservedShareTable.builder(), REGION, 0.6, 0.1, 0.3).build();

        try {
            preferenceOnly(new PriceTable(records)).calibrate(REGION, observed, REFERENCE_YEAR);
            fail("Expected CalibrationDataGapException");
        } catch (CalibrationDataGapException e) {
            assertEquals("car_BEV", e.getNode());
            assertEquals(Integer.valueOf(REFERENCE_YEAR), e.getYear());
            assertTrue(e.getCause() instanceof MissingPriceException);
        }
    }

    @Test
    public void testMissingPriceOfUnobservedAlternativeIsExcluded() {
        List<PriceRecord> records = new ArrayList<>(EdgeTestUtilities.passengerPrices(REGION, REFERENCE_YEAR));
        records.removeIf(record -> record.getTechnology().equals("BEV"));
        ObservedShareTable observed = EdgeTestUtilities.passengerShares(ObservedShareTable.builder(), REGION, 0.7, 0.0, 0.3).build();

        CalibrationResult result = preferenceOnly(new PriceTable(records)).calibrate(REGION, observed, REFERENCE_YEAR);

        assertTrue(result.getUnavailable().contains("car_BEV"));
        assertEquals(FLOOR, result.getPreference("car_BEV"), 0.0);
        assertEquals(PreferenceParameters.NEUTRAL, result.getPreference("car_ICE"), 0.0);
    }

    @Test
    public void testInconvenienceModeReproducesSharesWithAdjustedCosts() {
        PriceTable prices = EdgeTestUtilities.passengerPriceTable(REFERENCE_YEAR);
        InconvenienceCostTable inconvenience = InconvenienceCostTable.builder()
                .put(REGION, CAR, "BEV", REFERENCE_YEAR, 0.2)
                .put(REGION, CAR, null, REFERENCE_YEAR, 0.05)
                .build();
        ObservedShareTable observed = EdgeTestUtilities.passengerShares(ObservedShareTable.builder(), REGION, 0.6, 0.1, 0.3).build();

        PreferenceCalibrator calibrator = PreferenceCalibrator.forMode(CalibrationMode.INCONVENIENCE, topology, prices,
                ValueOfTimeTable.empty(), inconvenience, FLOOR);
        CalibrationResult result = calibrator.calibrate(REGION, observed, REFERENCE_YEAR);
        CalibrationResult plain = preferenceOnly(prices).calibrate(REGION, observed, REFERENCE_YEAR);

        assertEquals(CalibrationMode.INCONVENIENCE, result.getMode());
        // the BEV penalty now explains part of its low share
        assertTrue(result.getPreference("car_BEV") > plain.getPreference("car_BEV"));

        PreferenceParameters preferences = PreferenceParameters.builder(REFERENCE_YEAR)
                .putAll(REGION, result.getPreferences()).build();
        NestEvaluation evaluation = new NestedShareEvaluator(topology).evaluate(REGION, REFERENCE_YEAR, preferences,
                new InconvenienceCostModel(new PriceCostModel(prices, ValueOfTimeTable.empty()), inconvenience));
        assertEquals(0.6, evaluation.getAlternativeShare("car_ICE"), DELTA);
        assertEquals(0.1, evaluation.getAlternativeShare("car_BEV"), DELTA);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNonPositiveFloorIsRejected() {
        new PreferenceOnlyCalibrator(topology, EdgeTestUtilities.passengerPriceTable(REFERENCE_YEAR),
                ValueOfTimeTable.empty(), 0.0);
    }
}
