package edge.utils.exception;

/**
 * A vintage cohort ended up with a negative or NaN quantity. Always fatal; the quantity is never clamped.
 */
public class FleetIntegrityException extends EdgeException {

    public FleetIntegrityException(String message, String region, String node, Integer year) {
        super(message, region, node, year);
    }

    public FleetIntegrityException(String message, String region, String node, Integer year, Throwable cause) {
        super(message, region, node, year, cause);
    }
}
