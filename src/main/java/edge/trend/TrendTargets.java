package edge.trend;

import com.google.common.collect.ImmutableMap;

import java.util.Collection;
import java.util.Optional;

/**
 * Trend targets by cluster and node. Lookups fall back from the exact (cluster, node) pair to a
 * wildcard node, then to a wildcard cluster.
 */
public final class TrendTargets {

    private static final TrendTargets NONE = new TrendTargets(ImmutableMap.of());

    private final ImmutableMap<String, TrendTarget> targets;

    private TrendTargets(ImmutableMap<String, TrendTarget> targets) {
        this.targets = targets;
    }

    public static TrendTargets none() {
        return NONE;
    }

    public static TrendTargets of(Collection<TrendTarget> targets) {
        ImmutableMap.Builder<String, TrendTarget> builder = ImmutableMap.builder();
        for (TrendTarget target : targets) {
            builder.put(key(target.getCluster(), target.getNode()), target);
        }
        return new TrendTargets(builder.buildOrThrow());
    }

    private static String key(String cluster, String node) {
        return cluster + "|" + node;
    }

    public Optional<TrendTarget> find(int clusterId, String node) {
        String cluster = String.valueOf(clusterId);
        TrendTarget target = targets.get(key(cluster, node));
        if (target == null) target = targets.get(key(TrendTarget.ANY, node));
        if (target == null) target = targets.get(key(cluster, TrendTarget.ANY));
        if (target == null) target = targets.get(key(TrendTarget.ANY, TrendTarget.ANY));
        return Optional.ofNullable(target);
    }

    public int size() {
        return targets.size();
    }
}
