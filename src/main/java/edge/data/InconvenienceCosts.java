package edge.data;

/**
 * Inconvenience cost lookup, either historical or projected.
 */
public interface InconvenienceCosts {

    double getAdjustment(String region, String vehicleType, String technology, int year);
}
