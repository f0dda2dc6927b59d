package edge.trend;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSortedMap;
import edge.choice.logit.NestNode;
import edge.choice.logit.NestTopology;
import edge.choice.logit.PreferenceParameters;
import edge.sim.EdgeConfig;
import edge.utils.MathUtil;
import edge.utils.clustering.kmeans.RegionClusters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Extends calibrated preferences over the whole year grid. Before the first reference year the
 * first calibration holds; between reference years values are interpolated linearly; after the last
 * one every node converges to the long-run target of its region's cluster.
 * <p>
 * The target is scaled up for the scenario's favoured technology and, with the lifestyle shift on,
 * for the lifestyle nodes. Nodes without a target converge to their own calibrated value, scaled by
 * the same factors. No projected value drops below the preference floor, or below the
 * node's own calibrated value where calibration put it under that floor.
 */
public class PreferenceTrendProjector {
    private static final Logger log = LoggerFactory.getLogger(PreferenceTrendProjector.class);

    private final NestTopology topology;
    private final TrendTargets targets;
    private final EdgeConfig config;

    public PreferenceTrendProjector(NestTopology topology, TrendTargets targets, EdgeConfig config) {
        this.topology = topology;
        this.targets = targets;
        this.config = config;
    }

    public SortedMap<Integer, PreferenceParameters> project(SortedMap<Integer, PreferenceParameters> calibrated,
                                                            RegionClusters clusters, Collection<Integer> years) {
        Preconditions.checkArgument(!calibrated.isEmpty(), "No calibrated preferences to project");
        TreeSet<String> regions = new TreeSet<>();
        for (PreferenceParameters parameters : calibrated.values()) {
            regions.addAll(parameters.getRegions());
        }
        Map<Integer, PreferenceParameters.Builder> builders = new LinkedHashMap<>();
        for (int year : new TreeSet<>(years)) {
            builders.put(year, PreferenceParameters.builder(year));
        }
        for (String region : regions) {
            SortedMap<Integer, Map<String, Double>> byYear = new TreeMap<>();
            for (Map.Entry<Integer, PreferenceParameters> entry : calibrated.entrySet()) {
                byYear.put(entry.getKey(), entry.getValue().forRegion(region));
            }
            SortedMap<Integer, Map<String, Double>> projected = project(region, byYear, clusters.getClusterId(region), years);
            for (Map.Entry<Integer, Map<String, Double>> entry : projected.entrySet()) {
                builders.get(entry.getKey()).putAll(region, entry.getValue());
            }
        }
        ImmutableSortedMap.Builder<Integer, PreferenceParameters> result = ImmutableSortedMap.naturalOrder();
        for (Map.Entry<Integer, PreferenceParameters.Builder> entry : builders.entrySet()) {
            result.put(entry.getKey(), entry.getValue().build());
        }
        return result.build();
    }

    /**
     * Projects the preferences of one region.
     *
     * @param calibrated node preferences by reference year
     */
    public SortedMap<Integer, Map<String, Double>> project(String region, SortedMap<Integer, Map<String, Double>> calibrated,
                                                           int clusterId, Collection<Integer> years) {
        List<Integer> referenceYears = new ArrayList<>(calibrated.keySet());
        int lastReferenceYear = calibrated.lastKey();
        double floor = config.getPreferenceFloor();

        SortedMap<Integer, Map<String, Double>> projected = new TreeMap<>();
        for (int year : new TreeSet<>(years)) {
            projected.put(year, new LinkedHashMap<>());
        }
        for (NestNode node : topology.getNodes()) {
            if (node.isRoot()) continue;
            String name = node.getName();
            double lastCalibrated = valueAt(calibrated, lastReferenceYear, name);
            Optional<TrendTarget> target = targets.find(clusterId, name);
            double asymptote = target.map(TrendTarget::getTarget).orElse(lastCalibrated) * scenarioFactor(node);
            int convergenceYear = target.map(TrendTarget::getConvergenceYear).orElse(config.getTrendConvergenceYear());
            double rate = target.map(TrendTarget::getRate).orElse(config.getTrendRate());
            // a node calibrated below the floor (an unobserved, cheap alternative) keeps its calibrated level as floor
            double nodeFloor = floor;
            for (int referenceYear : referenceYears) {
                nodeFloor = Math.min(nodeFloor, valueAt(calibrated, referenceYear, name));
            }

            for (Map.Entry<Integer, Map<String, Double>> entry : projected.entrySet()) {
                int year = entry.getKey();
                double value;
                if (year > lastReferenceYear) {
                    value = config.getTrendLaw().converge(lastCalibrated, asymptote, lastReferenceYear, convergenceYear, rate, year);
                } else {
                    value = interpolate(calibrated, referenceYears, name, year);
                }
                entry.getValue().put(name, Math.max(nodeFloor, value));
            }
        }
        log.debug("Projected preferences of {} (cluster {}) over {} years", region, clusterId, projected.size());
        return projected;
    }

    private double scenarioFactor(NestNode node) {
        double factor = 1.0;
        if (node.isAlternative() && config.getScenario().getTechSwitch().equals(node.getTechnology())) {
            factor *= config.getTechSwitchFactor();
        }
        if (config.isSmartLifestyle() && config.getLifestyleNodes().contains(node.getName())) {
            factor *= config.getLifestyleFactor();
        }
        return factor;
    }

    private static double interpolate(SortedMap<Integer, Map<String, Double>> calibrated, List<Integer> referenceYears,
                                      String node, int year) {
        int first = referenceYears.get(0);
        if (year <= first) {
            return valueAt(calibrated, first, node);
        }
        for (int i = 1; i < referenceYears.size(); i++) {
            int upper = referenceYears.get(i);
            if (year <= upper) {
                int lower = referenceYears.get(i - 1);
                return MathUtil.interpolate(lower, valueAt(calibrated, lower, node), upper, valueAt(calibrated, upper, node), year);
            }
        }
        return valueAt(calibrated, referenceYears.get(referenceYears.size() - 1), node);
    }

    private static double valueAt(SortedMap<Integer, Map<String, Double>> calibrated, int year, String node) {
        Double value = calibrated.get(year).get(node);
        return value == null ? PreferenceParameters.NEUTRAL : value;
    }
}
