package edge.utils.exception;

/**
 * A region has no structural indicator value, so it cannot be assigned to a cluster.
 */
public class ClusteringIndicatorMissingException extends EdgeException {

    public ClusteringIndicatorMissingException(String message, String region, String node, Integer year) {
        super(message, region, node, year);
    }

    public ClusteringIndicatorMissingException(String message, String region, String node, Integer year, Throwable cause) {
        super(message, region, node, year, cause);
    }
}
