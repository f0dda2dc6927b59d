package edge.utils.exception;

/**
 * A leaf has no usable price record for a region/year that requires one.
 */
public class MissingPriceException extends EdgeException {

    public MissingPriceException(String message, String region, String node, Integer year) {
        super(message, region, node, year);
    }

    public MissingPriceException(String message, String region, String node, Integer year, Throwable cause) {
        super(message, region, node, year, cause);
    }
}
