package edge.trend;

import com.google.common.base.Preconditions;

/**
 * Long-run preference a node converges to in one cluster.
 */
public final class TrendTarget {

    public static final String ANY = "*";

    private final String cluster;
    private final String node;
    private final double target;
    private final int convergenceYear;
    private final double rate;

    public TrendTarget(String cluster, String node, double target, int convergenceYear, double rate) {
        Preconditions.checkArgument(target > 0.0, "Trend target of %s in cluster %s must be positive: %s", node, cluster, target);
        this.cluster = cluster;
        this.node = node;
        this.target = target;
        this.convergenceYear = convergenceYear;
        this.rate = rate;
    }

    public String getCluster() {
        return cluster;
    }

    public String getNode() {
        return node;
    }

    public double getTarget() {
        return target;
    }

    public int getConvergenceYear() {
        return convergenceYear;
    }

    public double getRate() {
        return rate;
    }
}
