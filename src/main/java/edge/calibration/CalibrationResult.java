package edge.calibration;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

import java.util.Map;
import java.util.Set;

/**
 * Preferences of one region solved at one reference year, together with the composite costs they
 * were solved against.
 */
public final class CalibrationResult {

    private final String region;
    private final int referenceYear;
    private final CalibrationMode mode;
    private final ImmutableMap<String, Double> preferences;
    private final ImmutableMap<String, Double> compositeCosts;
    private final ImmutableSet<String> floored;
    private final ImmutableSet<String> unavailable;

    CalibrationResult(String region, int referenceYear, CalibrationMode mode, Map<String, Double> preferences,
                      Map<String, Double> compositeCosts, Set<String> floored, Set<String> unavailable) {
        this.region = region;
        this.referenceYear = referenceYear;
        this.mode = mode;
        this.preferences = ImmutableMap.copyOf(preferences);
        this.compositeCosts = ImmutableMap.copyOf(compositeCosts);
        this.floored = ImmutableSet.copyOf(floored);
        this.unavailable = ImmutableSet.copyOf(unavailable);
    }

    public String getRegion() {
        return region;
    }

    public int getReferenceYear() {
        return referenceYear;
    }

    public CalibrationMode getMode() {
        return mode;
    }

    public ImmutableMap<String, Double> getPreferences() {
        return preferences;
    }

    public double getPreference(String node) {
        return preferences.get(node);
    }

    public ImmutableMap<String, Double> getCompositeCosts() {
        return compositeCosts;
    }

    /**
     * Nodes whose observed share was zero and whose preference was pinned at floor weight.
     */
    public ImmutableSet<String> getFloored() {
        return floored;
    }

    public ImmutableSet<String> getUnavailable() {
        return unavailable;
    }
}
