package edge.vintage;

/**
 * Vehicles of one alternative bought in one year. Price and intensity are frozen at purchase; the
 * quantity shrinks with the survival schedule.
 */
public final class VintageCohort {

    private final String region;
    private final String alternative;
    private final String vehicleType;
    private final String technology;
    private final int purchaseYear;
    private final double initialQuantity;
    private final double quantity;
    private final double price;
    private final double intensity;

    public VintageCohort(String region, String alternative, String vehicleType, String technology, int purchaseYear,
                         double initialQuantity, double quantity, double price, double intensity) {
        this.region = region;
        this.alternative = alternative;
        this.vehicleType = vehicleType;
        this.technology = technology;
        this.purchaseYear = purchaseYear;
        this.initialQuantity = initialQuantity;
        this.quantity = quantity;
        this.price = price;
        this.intensity = intensity;
    }

    /**
     * Same cohort at a later age.
     */
    VintageCohort withQuantity(double agedQuantity) {
        return new VintageCohort(region, alternative, vehicleType, technology, purchaseYear, initialQuantity, agedQuantity,
                price, intensity);
    }

    public String getRegion() {
        return region;
    }

    public String getAlternative() {
        return alternative;
    }

    public String getVehicleType() {
        return vehicleType;
    }

    public String getTechnology() {
        return technology;
    }

    public int getPurchaseYear() {
        return purchaseYear;
    }

    public double getInitialQuantity() {
        return initialQuantity;
    }

    public double getQuantity() {
        return quantity;
    }

    public double getPrice() {
        return price;
    }

    public double getIntensity() {
        return intensity;
    }

    public int getAge(int year) {
        return year - purchaseYear;
    }

    @Override
    public String toString() {
        return region + "/" + alternative + "@" + purchaseYear + ": " + quantity;
    }
}
