package edge.vintage;

import com.google.common.collect.ImmutableMap;

import java.util.Map;

/**
 * Stock-level view of one region and year after the year's new sales were added.
 */
public final class StockSnapshot {

    private final FleetState fleet;
    private final double newSales;
    private final double retirements;
    private final ImmutableMap<String, Double> stockShares;
    private final ImmutableMap<String, Double> stockPrices;
    private final ImmutableMap<String, Double> stockIntensities;
    private final double averagePrice;
    private final double averageIntensity;

    StockSnapshot(FleetState fleet, double newSales, double retirements, Map<String, Double> stockShares,
                  Map<String, Double> stockPrices, Map<String, Double> stockIntensities, double averagePrice,
                  double averageIntensity) {
        this.fleet = fleet;
        this.newSales = newSales;
        this.retirements = retirements;
        this.stockShares = ImmutableMap.copyOf(stockShares);
        this.stockPrices = ImmutableMap.copyOf(stockPrices);
        this.stockIntensities = ImmutableMap.copyOf(stockIntensities);
        this.averagePrice = averagePrice;
        this.averageIntensity = averageIntensity;
    }

    public FleetState getFleet() {
        return fleet;
    }

    public String getRegion() {
        return fleet.getRegion();
    }

    public int getYear() {
        return fleet.getYear();
    }

    public double getTotalQuantity() {
        return fleet.getTotalQuantity();
    }

    public double getNewSales() {
        return newSales;
    }

    /**
     * Quantity that left the fleet since the previous snapshot.
     */
    public double getRetirements() {
        return retirements;
    }

    public ImmutableMap<String, Double> getStockShares() {
        return stockShares;
    }

    public double getStockShare(String alternative) {
        return stockShares.getOrDefault(alternative, 0.0);
    }

    /**
     * Quantity-weighted price of the alternative's cohorts, NaN if none is in service.
     */
    public double getStockPrice(String alternative) {
        return stockPrices.getOrDefault(alternative, Double.NaN);
    }

    public double getStockIntensity(String alternative) {
        return stockIntensities.getOrDefault(alternative, Double.NaN);
    }

    public ImmutableMap<String, Double> getStockPrices() {
        return stockPrices;
    }

    public ImmutableMap<String, Double> getStockIntensities() {
        return stockIntensities;
    }

    public double getAveragePrice() {
        return averagePrice;
    }

    public double getAverageIntensity() {
        return averageIntensity;
    }
}
