package edge.data;

import java.util.Objects;

/**
 * Cost and energy intensity of one (vehicle type, technology) alternative in one region and year.
 */
public final class PriceRecord {

    private final String region;
    private final String vehicleType;
    private final String technology;
    private final int year;
    private final double nonFuelCost;
    private final double fuelCost;
    private final double energyIntensity;

    public PriceRecord(String region, String vehicleType, String technology, int year,
                       double nonFuelCost, double fuelCost, double energyIntensity) {
        this.region = Objects.requireNonNull(region);
        this.vehicleType = Objects.requireNonNull(vehicleType);
        this.technology = Objects.requireNonNull(technology);
        this.year = year;
        this.nonFuelCost = nonFuelCost;
        this.fuelCost = fuelCost;
        this.energyIntensity = energyIntensity;
    }

    public String getRegion() {
        return region;
    }

    public String getVehicleType() {
        return vehicleType;
    }

    public String getTechnology() {
        return technology;
    }

    public int getYear() {
        return year;
    }

    public double getNonFuelCost() {
        return nonFuelCost;
    }

    public double getFuelCost() {
        return fuelCost;
    }

    public double getEnergyIntensity() {
        return energyIntensity;
    }

    /**
     * Monetary cost per distance: non-fuel cost plus fuel cost times energy intensity.
     */
    public double getTotalPrice() {
        return nonFuelCost + fuelCost * energyIntensity;
    }

    /**
     * A record with zero, negative or non-finite total price marks the alternative unavailable.
     */
    public boolean isUsable() {
        double total = getTotalPrice();
        return !Double.isNaN(total) && !Double.isInfinite(total) && total > 0.0;
    }

    @Override
    public String toString() {
        return region + "/" + vehicleType + "/" + technology + "/" + year + ": " + getTotalPrice();
    }
}
