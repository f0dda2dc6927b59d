package edge.vintage;

import com.google.common.collect.ImmutableMap;

import java.util.Map;

/**
 * New-vehicle outcome of one year: total demand to be served by the fleet, and the new-sales share,
 * price and intensity of every alternative.
 */
public final class VintageInput {

    private final int year;
    private final double totalDemand;
    private final ImmutableMap<String, Double> shares;
    private final ImmutableMap<String, Double> prices;
    private final ImmutableMap<String, Double> intensities;

    public VintageInput(int year, double totalDemand, Map<String, Double> shares, Map<String, Double> prices,
                        Map<String, Double> intensities) {
        this.year = year;
        this.totalDemand = totalDemand;
        this.shares = ImmutableMap.copyOf(shares);
        this.prices = ImmutableMap.copyOf(prices);
        this.intensities = ImmutableMap.copyOf(intensities);
    }

    public int getYear() {
        return year;
    }

    public double getTotalDemand() {
        return totalDemand;
    }

    public ImmutableMap<String, Double> getShares() {
        return shares;
    }

    public ImmutableMap<String, Double> getPrices() {
        return prices;
    }

    public ImmutableMap<String, Double> getIntensities() {
        return intensities;
    }
}
