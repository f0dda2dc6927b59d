package edge.vintage;

import com.google.common.base.Preconditions;

import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Fraction of a cohort still on the road at a given age in years. Non-increasing, starts at most at
 * 1 and is 0 from the maximum service life on.
 */
public final class SurvivalSchedule {

    private final double[] fractions;

    private SurvivalSchedule(double[] fractions) {
        this.fractions = fractions;
    }

    /**
     * Quadratic decline from 1 at age 0 to 0 at {@code maxServiceLife}.
     */
    public static SurvivalSchedule defaultSchedule(int maxServiceLife) {
        Preconditions.checkArgument(maxServiceLife > 0, "Maximum service life must be positive: %s", maxServiceLife);
        double[] fractions = new double[maxServiceLife + 1];
        for (int age = 0; age <= maxServiceLife; age++) {
            double relativeAge = (double) age / maxServiceLife;
            fractions[age] = 1.0 - relativeAge * relativeAge;
        }
        fractions[maxServiceLife] = 0.0;
        return new SurvivalSchedule(fractions);
    }

    /**
     * Builds a schedule from tabulated (age, fraction) points, interpolating linearly between them.
     * Ages before the first point survive fully; the last point must be 0 and marks the maximum
     * service life.
     */
    public static SurvivalSchedule fromPoints(Map<Integer, Double> points) {
        Preconditions.checkArgument(!points.isEmpty(), "Survival schedule without points");
        SortedMap<Integer, Double> sorted = new TreeMap<>(points);
        int maxServiceLife = sorted.lastKey();
        Preconditions.checkArgument(sorted.firstKey() >= 0, "Survival schedule has a negative age %s", sorted.firstKey());
        Preconditions.checkArgument(sorted.get(maxServiceLife) == 0.0,
                "Survival schedule must reach 0 at its last age %s, got %s", maxServiceLife, sorted.get(maxServiceLife));
        double previous = 1.0;
        for (Map.Entry<Integer, Double> point : sorted.entrySet()) {
            double fraction = point.getValue();
            Preconditions.checkArgument(fraction >= 0.0 && fraction <= 1.0,
                    "Surviving fraction %s at age %s is outside [0, 1]", Double.valueOf(fraction), point.getKey());
            Preconditions.checkArgument(fraction <= previous,
                    "Surviving fraction increases at age %s (%s > %s)", point.getKey(), fraction, previous);
            previous = fraction;
        }

        double[] fractions = new double[maxServiceLife + 1];
        Integer lowerAge = null;
        for (int age = 0; age <= maxServiceLife; age++) {
            if (sorted.containsKey(age)) {
                fractions[age] = sorted.get(age);
                lowerAge = age;
            } else if (lowerAge == null) {
                fractions[age] = 1.0;
            } else {
                int upperAge = sorted.tailMap(age).firstKey();
                double lower = sorted.get(lowerAge);
                double upper = sorted.get(upperAge);
                fractions[age] = lower + (upper - lower) * (age - lowerAge) / (double) (upperAge - lowerAge);
            }
        }
        return new SurvivalSchedule(fractions);
    }

    public double getSurvival(int age) {
        Preconditions.checkArgument(age >= 0, "Negative vehicle age %s", age);
        return age < fractions.length ? fractions[age] : 0.0;
    }

    public int getMaxServiceLife() {
        return fractions.length - 1;
    }
}
