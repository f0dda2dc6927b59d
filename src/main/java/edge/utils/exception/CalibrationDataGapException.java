package edge.utils.exception;

/**
 * Price data needed to invert the share equations is missing at a reference year. Always fatal.
 */
public class CalibrationDataGapException extends EdgeException {

    public CalibrationDataGapException(String message, String region, String node, Integer year) {
        super(message, region, node, year);
    }

    public CalibrationDataGapException(String message, String region, String node, Integer year, Throwable cause) {
        super(message, region, node, year, cause);
    }
}
