package edge.calibration;

import com.google.common.base.Preconditions;
import edge.choice.logit.NestNode;
import edge.choice.logit.NestTopology;
import edge.choice.logit.PreferenceParameters;
import edge.data.InconvenienceCosts;
import edge.data.ObservedShareTable;
import edge.data.PriceRecord;
import edge.data.PriceTable;
import edge.data.ValueOfTimeTable;
import edge.utils.MathUtil;
import edge.utils.exception.CalibrationDataGapException;
import edge.utils.exception.EdgeException;
import edge.utils.exception.MissingPriceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Inverts the nested logit at a reference year: finds the preference of every node such that
 * re-evaluating the nest with the observed costs reproduces the observed shares.
 * <p>
 * Within a sibling group the largest observed share is the reference and gets preference 1; every
 * other sibling follows in closed form,
 * <pre>
 *   pref_i = (s_i / s_ref) * (cost_i / cost_ref)^(1/exponent)
 * </pre>
 * Nests are solved bottom-up so each level sees the composite costs of the calibrated level below.
 * Subclasses only decide which cost an alternative is solved against.
 */
public abstract class PreferenceCalibrator {
    private static final Logger log = LoggerFactory.getLogger(PreferenceCalibrator.class);

    protected final NestTopology topology;
    protected final PriceTable prices;
    protected final ValueOfTimeTable valueOfTime;
    private final double preferenceFloor;

    protected PreferenceCalibrator(NestTopology topology, PriceTable prices, ValueOfTimeTable valueOfTime,
                                   double preferenceFloor) {
        Preconditions.checkArgument(preferenceFloor > 0.0, "Preference floor must be strictly positive: %s", preferenceFloor);
        this.topology = topology;
        this.prices = prices;
        this.valueOfTime = valueOfTime;
        this.preferenceFloor = preferenceFloor;
    }

    public static PreferenceCalibrator forMode(CalibrationMode mode, NestTopology topology, PriceTable prices,
                                               ValueOfTimeTable valueOfTime, InconvenienceCosts inconvenienceCosts,
                                               double preferenceFloor) {
        switch (mode) {
            case PREFERENCE_ONLY:
                return new PreferenceOnlyCalibrator(topology, prices, valueOfTime, preferenceFloor);
            case INCONVENIENCE:
                return new InconvenienceCalibrator(topology, prices, valueOfTime, inconvenienceCosts, preferenceFloor);
            default:
                throw new IllegalArgumentException("Unknown calibration mode " + mode);
        }
    }

    public abstract CalibrationMode getMode();

    /**
     * Cost the alternative is solved against, given its monetary cost including value of time.
     */
    protected abstract double adjustCost(String region, NestNode alternative, int year, double baseCost);

    public double getPreferenceFloor() {
        return preferenceFloor;
    }

    /**
     * Calibrates every region at one reference year.
     */
    public PreferenceParameters calibrate(Collection<String> regions, ObservedShareTable observed, int referenceYear) {
        PreferenceParameters.Builder builder = PreferenceParameters.builder(referenceYear);
        for (String region : regions) {
            builder.putAll(region, calibrate(region, observed, referenceYear).getPreferences());
        }
        return builder.build();
    }

    /**
     * @throws CalibrationDataGapException if an alternative with a positive observed share has no usable price
     */
    public CalibrationResult calibrate(String region, ObservedShareTable observed, int referenceYear) {
        Map<String, Double> observedWeights = new HashMap<>();
        Map<String, Double> costs = new LinkedHashMap<>();
        Map<String, Double> preferences = new LinkedHashMap<>();
        Set<String> floored = new LinkedHashSet<>();
        Set<String> unavailable = new LinkedHashSet<>();

        for (NestNode alternative : topology.getAlternatives()) {
            double weight = observed.getShare(region, alternative.getVehicleType(), alternative.getTechnology(), referenceYear);
            observedWeights.put(alternative.getName(), weight);
            try {
                PriceRecord price = prices.require(region, alternative.getVehicleType(), alternative.getTechnology(), referenceYear);
                double baseCost = price.getTotalPrice() + valueOfTime.getTimeCost(region, alternative.getVehicleType(), referenceYear);
                double cost = adjustCost(region, alternative, referenceYear, baseCost);
                if (!(cost > 0.0) || Double.isInfinite(cost)) {
                    throw new CalibrationDataGapException("Effective cost is not strictly positive (" + cost + ")",
                            region, alternative.getName(), referenceYear);
                }
                costs.put(alternative.getName(), cost);
            } catch (MissingPriceException e) {
                if (weight > 0.0) {
                    throw new CalibrationDataGapException("Observed alternative has no usable price",
                            region, alternative.getName(), referenceYear, e);
                }
                log.warn("Excluding {} from calibration of {} ({}): {}", alternative, region, referenceYear, e.getMessage());
                unavailable.add(alternative.getName());
                preferences.put(alternative.getName(), preferenceFloor);
                floored.add(alternative.getName());
            }
        }

        for (NestNode nest : topology.getNestsBottomUp()) {
            List<NestNode> available = new ArrayList<>();
            double observedTotal = 0.0;
            for (NestNode child : nest.getChildren()) {
                if (!unavailable.contains(child.getName())) {
                    available.add(child);
                    observedTotal += observedWeights.get(child.getName());
                }
            }
            observedWeights.put(nest.getName(), observedTotal);
            if (available.isEmpty()) {
                if (nest.isRoot()) {
                    throw new CalibrationDataGapException("No alternative has a usable price", region, nest.getName(), referenceYear);
                }
                log.warn("Excluding nest {} from calibration of {} ({}): no priced children", nest, region, referenceYear);
                unavailable.add(nest.getName());
                preferences.put(nest.getName(), preferenceFloor);
                floored.add(nest.getName());
                continue;
            }
            solveSiblings(region, referenceYear, nest, available, observedWeights, costs, preferences, floored);
            costs.put(nest.getName(), compositeCost(nest, available, preferences, costs));
        }

        log.debug("Calibrated {} nodes of {} in {} ({} floored, {} unavailable)",
                preferences.size(), region, referenceYear, floored.size(), unavailable.size());
        return new CalibrationResult(region, referenceYear, getMode(), preferences, costs, floored, unavailable);
    }

    private void solveSiblings(String region, int referenceYear, NestNode nest, List<NestNode> siblings,
                               Map<String, Double> observedWeights, Map<String, Double> costs,
                               Map<String, Double> preferences, Set<String> floored) {
        if (siblings.size() == 1) {
            preferences.put(siblings.get(0).getName(), PreferenceParameters.NEUTRAL);
            return;
        }
        NestNode reference = null;
        for (NestNode sibling : siblings) {
            if (reference == null || observedWeights.get(sibling.getName()) > observedWeights.get(reference.getName())) {
                reference = sibling;
            }
        }
        double referenceWeight = observedWeights.get(reference.getName());
        if (referenceWeight <= 0.0) {
            // nothing observed in this nest, only its relative costs are known
            log.warn("Nest {} has no observed share in {} ({}), children set to neutral preference", nest, region, referenceYear);
            for (NestNode sibling : siblings) {
                preferences.put(sibling.getName(), PreferenceParameters.NEUTRAL);
            }
            return;
        }
        double logReferenceCost = Math.log(costs.get(reference.getName()));
        for (NestNode sibling : siblings) {
            double weight = observedWeights.get(sibling.getName());
            // an unobserved sibling is pinned at floor weight relative to the reference, whatever its cost
            double relativeWeight = weight / referenceWeight;
            if (weight <= 0.0) {
                relativeWeight = preferenceFloor;
                floored.add(sibling.getName());
            }
            double logPreference = Math.log(relativeWeight)
                    + (Math.log(costs.get(sibling.getName())) - logReferenceCost) / nest.getExponent();
            double preference = Math.exp(logPreference);
            if (Double.isInfinite(preference)) {
                throw new EdgeException("Calibrated preference overflows", region, sibling.getName(), referenceYear);
            }
            preferences.put(sibling.getName(), preference > 0.0 ? preference : Double.MIN_NORMAL);
        }
    }

    private static double compositeCost(NestNode nest, List<NestNode> children, Map<String, Double> preferences,
                                        Map<String, Double> costs) {
        double[] logWeights = new double[children.size()];
        for (int i = 0; i < children.size(); i++) {
            String child = children.get(i).getName();
            logWeights[i] = Math.log(preferences.get(child)) - Math.log(costs.get(child)) / nest.getExponent();
        }
        return Math.exp(-nest.getExponent() * MathUtil.logSumExp(logWeights));
    }
}
