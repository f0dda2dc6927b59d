package edge.choice.logit;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

import java.util.Map;
import java.util.Set;

/**
 * Outcome of evaluating the nest for one region and year: conditional shares of every available
 * node under its parent, composite costs of every available node, and absolute alternative shares.
 */
public final class NestEvaluation {

    private final String region;
    private final int year;
    private final ImmutableMap<String, Double> shares;
    private final ImmutableMap<String, Double> compositeCosts;
    private final ImmutableMap<String, Double> alternativeShares;
    private final ImmutableSet<String> unavailable;

    NestEvaluation(String region, int year, Map<String, Double> shares, Map<String, Double> compositeCosts,
                   Map<String, Double> alternativeShares, Set<String> unavailable) {
        this.region = region;
        this.year = year;
        this.shares = ImmutableMap.copyOf(shares);
        this.compositeCosts = ImmutableMap.copyOf(compositeCosts);
        this.alternativeShares = ImmutableMap.copyOf(alternativeShares);
        this.unavailable = ImmutableSet.copyOf(unavailable);
    }

    public String getRegion() {
        return region;
    }

    public int getYear() {
        return year;
    }

    /**
     * Share of a node among its siblings; 0 for unavailable nodes, 1 for the root.
     */
    public double getShare(String node) {
        return shares.getOrDefault(node, 0.0);
    }

    public double getCompositeCost(String node) {
        Double cost = compositeCosts.get(node);
        return cost == null ? Double.NaN : cost;
    }

    /**
     * Product of conditional shares along the path from the root.
     */
    public double getAlternativeShare(String alternative) {
        return alternativeShares.getOrDefault(alternative, 0.0);
    }

    public ImmutableMap<String, Double> getShares() {
        return shares;
    }

    public ImmutableMap<String, Double> getCompositeCosts() {
        return compositeCosts;
    }

    public ImmutableMap<String, Double> getAlternativeShares() {
        return alternativeShares;
    }

    public boolean isAvailable(String node) {
        return !unavailable.contains(node);
    }

    public ImmutableSet<String> getUnavailable() {
        return unavailable;
    }
}
