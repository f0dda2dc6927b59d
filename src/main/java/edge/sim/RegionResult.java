package edge.sim;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;
import edge.calibration.CalibrationResult;
import edge.choice.logit.NestEvaluation;
import edge.vintage.StockSnapshot;

import java.util.List;
import java.util.Map;
import java.util.SortedMap;

/**
 * Everything produced for one region, or the reason the region was halted.
 */
public final class RegionResult {

    private final String region;
    private final int clusterId;
    private final String failure;
    private final ImmutableList<CalibrationResult> calibrations;
    private final ImmutableSortedMap<Integer, Map<String, Double>> preferences;
    private final ImmutableSortedMap<Integer, NestEvaluation> newSales;
    private final ImmutableList<StockSnapshot> stock;
    private final ImmutableSortedMap<Integer, ImmutableSortedMap<String, Double>> finalEnergy;

    private RegionResult(String region, int clusterId, String failure, List<CalibrationResult> calibrations,
                         SortedMap<Integer, Map<String, Double>> preferences, SortedMap<Integer, NestEvaluation> newSales,
                         List<StockSnapshot> stock, SortedMap<Integer, ImmutableSortedMap<String, Double>> finalEnergy) {
        this.region = region;
        this.clusterId = clusterId;
        this.failure = failure;
        this.calibrations = ImmutableList.copyOf(calibrations);
        this.preferences = ImmutableSortedMap.copyOfSorted(preferences);
        this.newSales = ImmutableSortedMap.copyOfSorted(newSales);
        this.stock = ImmutableList.copyOf(stock);
        this.finalEnergy = ImmutableSortedMap.copyOfSorted(finalEnergy);
    }

    static RegionResult completed(String region, int clusterId, List<CalibrationResult> calibrations,
                                  SortedMap<Integer, Map<String, Double>> preferences,
                                  SortedMap<Integer, NestEvaluation> newSales, List<StockSnapshot> stock,
                                  SortedMap<Integer, ImmutableSortedMap<String, Double>> finalEnergy) {
        return new RegionResult(region, clusterId, null, calibrations, preferences, newSales, stock, finalEnergy);
    }

    static RegionResult failed(String region, int clusterId, String failure) {
        return new RegionResult(region, clusterId, failure, ImmutableList.of(), ImmutableSortedMap.of(),
                ImmutableSortedMap.of(), ImmutableList.of(), ImmutableSortedMap.of());
    }

    public String getRegion() {
        return region;
    }

    public int getClusterId() {
        return clusterId;
    }

    public boolean isFailed() {
        return failure != null;
    }

    public String getFailure() {
        return failure;
    }

    public ImmutableList<CalibrationResult> getCalibrations() {
        return calibrations;
    }

    public ImmutableSortedMap<Integer, Map<String, Double>> getPreferences() {
        return preferences;
    }

    /**
     * New-vehicle shares, composite costs and availability per simulated year.
     */
    public ImmutableSortedMap<Integer, NestEvaluation> getNewSales() {
        return newSales;
    }

    public ImmutableList<StockSnapshot> getStock() {
        return stock;
    }

    public ImmutableSortedMap<Integer, ImmutableSortedMap<String, Double>> getFinalEnergy() {
        return finalEnergy;
    }
}
