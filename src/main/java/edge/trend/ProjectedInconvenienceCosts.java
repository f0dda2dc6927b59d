package edge.trend;

import edge.data.InconvenienceCosts;

/**
 * Inconvenience costs after the reference year, shrinking from their reference-year level towards
 * {@code finalFraction} of it as the technologies mature. Up to the reference year the historical
 * values are returned as tabulated, interpolated between the tabulated years.
 */
public class ProjectedInconvenienceCosts implements InconvenienceCosts {

    private final InconvenienceCosts historical;
    private final int referenceYear;
    private final ConvergenceLaw law;
    private final double finalFraction;
    private final int convergenceYear;
    private final double rate;

    public ProjectedInconvenienceCosts(InconvenienceCosts historical, int referenceYear, ConvergenceLaw law,
                                       double finalFraction, int convergenceYear, double rate) {
        this.historical = historical;
        this.referenceYear = referenceYear;
        this.law = law;
        this.finalFraction = finalFraction;
        this.convergenceYear = convergenceYear;
        this.rate = rate;
    }

    @Override
    public double getAdjustment(String region, String vehicleType, String technology, int year) {
        if (year <= referenceYear) {
            return historical.getAdjustment(region, vehicleType, technology, year);
        }
        double start = historical.getAdjustment(region, vehicleType, technology, referenceYear);
        return start * law.converge(1.0, finalFraction, referenceYear, convergenceYear, rate, year);
    }
}
