package edge.runners;

import edge.sim.EdgeConfig;
import edge.sim.EdgeInputs;
import edge.sim.EdgeTransportPipeline;
import edge.sim.ProjectionResult;
import edge.sim.RegionResult;
import edge.utils.LoggingUtil;
import edge.utils.clustering.kmeans.RegionCluster;
import edge.vintage.StockSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Paths;

/**
 * Command line entry point: {@code RunEdgeTransport <config-file>}.
 */
public class RunEdgeTransport {
    private static final Logger log = LoggerFactory.getLogger(RunEdgeTransport.class);

    public static void main(String[] args) throws Exception {
        if (args.length != 1) {
            System.err.println("Usage: RunEdgeTransport <config-file>");
            System.exit(2);
        }
        File configFile = new File(args[0]);
        if (!configFile.isFile()) {
            System.err.println("Config file not found: " + configFile.getAbsolutePath());
            System.exit(2);
        }
        EdgeConfig config = EdgeConfig.load(configFile);
        Files.createDirectories(Paths.get(config.getOutputDirectory()));
        LoggingUtil.initLogger(config.getOutputDirectory(), true);

        log.info("Loading inputs from {}", configFile);
        EdgeInputs inputs = EdgeInputs.load(config);
        ProjectionResult result = new EdgeTransportPipeline(config, inputs).run();
        logSummary(result);
    }

    static void logSummary(ProjectionResult result) {
        for (RegionCluster cluster : result.getClusters().getClusters()) {
            log.info("Cluster {} (center {}): {}", cluster.getId(), cluster.getCenter(), cluster.getRegions());
        }
        for (RegionResult region : result.getRegions().values()) {
            if (region.isFailed()) {
                log.warn("{}: halted, {}", region.getRegion(), region.getFailure());
                continue;
            }
            StockSnapshot last = region.getStock().get(region.getStock().size() - 1);
            log.info("{}: {} stock {} avg price {} avg intensity {} final energy {}", region.getRegion(), last.getYear(),
                    last.getTotalQuantity(), last.getAveragePrice(), last.getAverageIntensity(),
                    region.getFinalEnergy().get(last.getYear()));
        }
    }
}
