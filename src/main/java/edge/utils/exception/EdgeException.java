package edge.utils.exception;

/**
 * Root of all errors raised by the projection engine. Carries the (region, node, year) key of the
 * record that failed; parts that do not apply are left null.
 */
public class EdgeException extends RuntimeException {

    private final String region;
    private final String node;
    private final Integer year;

    public EdgeException(String message) {
        this(message, null, null, null, null);
    }

    public EdgeException(String message, Throwable throwable) {
        this(message, null, null, null, throwable);
    }

    public EdgeException(String message, String region, String node, Integer year) {
        this(message, region, node, year, null);
    }

    public EdgeException(String message, String region, String node, Integer year, Throwable throwable) {
        super(describe(message, region, node, year), throwable);
        this.region = region;
        this.node = node;
        this.year = year;
    }

    private static String describe(String message, String region, String node, Integer year) {
        if (region == null && node == null && year == null) {
            return message;
        }
        return String.format("%s [region=%s, node=%s, year=%s]", message, region, node, year);
    }

    public String getRegion() {
        return region;
    }

    public String getNode() {
        return node;
    }

    public Integer getYear() {
        return year;
    }
}
