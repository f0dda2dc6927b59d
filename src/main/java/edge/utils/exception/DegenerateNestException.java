package edge.utils.exception;

/**
 * Every alternative below the root of a nest is unavailable. Halts processing of the affected region only.
 */
public class DegenerateNestException extends EdgeException {

    public DegenerateNestException(String message, String region, String node, Integer year) {
        super(message, region, node, year);
    }

    public DegenerateNestException(String message, String region, String node, Integer year, Throwable cause) {
        super(message, region, node, year, cause);
    }
}
