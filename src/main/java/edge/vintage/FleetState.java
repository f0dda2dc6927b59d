package edge.vintage;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Complete, immutable age structure of a region's fleet at one year: every cohort still in service.
 */
public final class FleetState {

    private final String region;
    private final int year;
    private final ImmutableList<VintageCohort> cohorts;

    public FleetState(String region, int year, List<VintageCohort> cohorts) {
        this.region = region;
        this.year = year;
        this.cohorts = ImmutableList.copyOf(cohorts);
    }

    public String getRegion() {
        return region;
    }

    public int getYear() {
        return year;
    }

    public ImmutableList<VintageCohort> getCohorts() {
        return cohorts;
    }

    public double getTotalQuantity() {
        double total = 0.0;
        for (VintageCohort cohort : cohorts) {
            total += cohort.getQuantity();
        }
        return total;
    }

    public boolean isEmpty() {
        return cohorts.isEmpty();
    }
}
