package edge.sim;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;
import edge.analysis.EnergyDemandAggregator;
import edge.calibration.CalibrationMode;
import edge.calibration.CalibrationResult;
import edge.calibration.PreferenceCalibrator;
import edge.choice.logit.InconvenienceCostModel;
import edge.choice.logit.LeafCostModel;
import edge.choice.logit.NestEvaluation;
import edge.choice.logit.NestNode;
import edge.choice.logit.NestTopology;
import edge.choice.logit.NestedShareEvaluator;
import edge.choice.logit.PreferenceParameters;
import edge.choice.logit.PriceCostModel;
import edge.data.InconvenienceCosts;
import edge.data.PriceRecord;
import edge.trend.PreferenceTrendProjector;
import edge.trend.ProjectedInconvenienceCosts;
import edge.utils.clustering.kmeans.RegionClusterer;
import edge.utils.clustering.kmeans.RegionClusters;
import edge.utils.exception.DegenerateNestException;
import edge.utils.exception.EdgeException;
import edge.vintage.StockSnapshot;
import edge.vintage.VintageInput;
import edge.vintage.VintageStockTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Runs the whole chain: cluster regions, then per region calibrate at every reference year, project
 * preferences over the simulation years, evaluate new-vehicle shares, fold them into the vintage stock
 * and aggregate final energy. Regions are independent and run on a fixed thread pool; results are
 * collected in region order so a run does not depend on scheduling.
 */
public class EdgeTransportPipeline {
    private static final Logger log = LoggerFactory.getLogger(EdgeTransportPipeline.class);

    private final EdgeConfig config;
    private final EdgeInputs inputs;
    private final NestTopology topology;
    private final InconvenienceCosts inconvenienceCosts;
    private final PreferenceCalibrator calibrator;
    private final NestedShareEvaluator evaluator;
    private final LeafCostModel costModel;
    private final VintageStockTracker tracker;
    private final EnergyDemandAggregator aggregator;
    private final List<Integer> simulationYears;

    public EdgeTransportPipeline(EdgeConfig config, EdgeInputs inputs) {
        this.config = config;
        this.inputs = inputs;
        this.topology = inputs.getTopology();
        this.inconvenienceCosts = new ProjectedInconvenienceCosts(inputs.getInconvenienceCosts(),
                config.getLastReferenceYear(), config.getTrendLaw(), config.getInconvenienceFinalFraction(),
                config.getInconvenienceConvergenceYear(), config.getInconvenienceRate());
        this.calibrator = PreferenceCalibrator.forMode(config.getCalibrationMode(), topology, inputs.getPrices(),
                inputs.getValueOfTime(), inconvenienceCosts, config.getPreferenceFloor());
        this.evaluator = new NestedShareEvaluator(topology);
        LeafCostModel prices = new PriceCostModel(inputs.getPrices(), inputs.getValueOfTime());
        this.costModel = config.getCalibrationMode() == CalibrationMode.INCONVENIENCE
                ? new InconvenienceCostModel(prices, inconvenienceCosts)
                : prices;
        this.tracker = new VintageStockTracker(topology, inputs.getSurvival());
        this.aggregator = new EnergyDemandAggregator(topology);

        int firstReferenceYear = config.getReferenceYears().get(0);
        List<Integer> years = new ArrayList<>();
        for (int year : config.getYears()) {
            if (year >= firstReferenceYear) years.add(year);
        }
        this.simulationYears = ImmutableList.copyOf(years);
    }

    public List<Integer> getSimulationYears() {
        return simulationYears;
    }

    public ProjectionResult run() {
        List<String> regions = new ArrayList<>(inputs.getObservedShares().getRegions());
        log.info("Running scenario {} ({} calibration) for {} regions over {} years", config.getScenario().getScenarioName(),
                config.getCalibrationMode(), regions.size(), simulationYears.size());

        RegionClusters clusters = new RegionClusterer(inputs.getClusterIndicators(), config.getClusterCount(),
                config.getClusterMaxIterations()).cluster(regions);
        PreferenceTrendProjector projector = new PreferenceTrendProjector(topology, inputs.getTrendTargets(), config);

        ExecutorService executor = Executors.newFixedThreadPool(config.getThreads());
        try {
            Map<String, Future<RegionResult>> futures = new LinkedHashMap<>();
            for (String region : regions) {
                int clusterId = clusters.getClusterId(region);
                futures.put(region, executor.submit(regionTask(region, clusterId, projector)));
            }
            SortedMap<String, RegionResult> results = new TreeMap<>();
            for (Map.Entry<String, Future<RegionResult>> entry : futures.entrySet()) {
                results.put(entry.getKey(), await(entry.getKey(), entry.getValue()));
            }
            long failed = results.values().stream().filter(RegionResult::isFailed).count();
            log.info("Finished {} regions, {} halted", results.size(), failed);
            return new ProjectionResult(clusters, results);
        } finally {
            executor.shutdownNow();
        }
    }

    private Callable<RegionResult> regionTask(String region, int clusterId, PreferenceTrendProjector projector) {
        return () -> {
            try {
                return runRegion(region, clusterId, projector);
            } catch (DegenerateNestException e) {
                log.error("Halting region {}: {}", region, e.getMessage());
                return RegionResult.failed(region, clusterId, e.getMessage());
            }
        };
    }

    private static RegionResult await(String region, Future<RegionResult> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EdgeException("Interrupted while waiting for region " + region, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new EdgeException("Region " + region + " failed", cause);
        }
    }

    RegionResult runRegion(String region, int clusterId, PreferenceTrendProjector projector) {
        List<CalibrationResult> calibrations = new ArrayList<>();
        SortedMap<Integer, Map<String, Double>> calibrated = new TreeMap<>();
        for (int referenceYear : config.getReferenceYears()) {
            CalibrationResult calibration = calibrator.calibrate(region, inputs.getObservedShares(), referenceYear);
            calibrations.add(calibration);
            calibrated.put(referenceYear, calibration.getPreferences());
        }
        SortedMap<Integer, Map<String, Double>> preferences = projector.project(region, calibrated, clusterId, simulationYears);

        SortedMap<Integer, NestEvaluation> newSales = new TreeMap<>();
        List<VintageInput> vintageInputs = new ArrayList<>();
        for (Map.Entry<Integer, Map<String, Double>> entry : preferences.entrySet()) {
            int year = entry.getKey();
            PreferenceParameters parameters = PreferenceParameters.builder(year).putAll(region, entry.getValue()).build();
            NestEvaluation evaluation = evaluator.evaluate(region, year, parameters, costModel);
            newSales.put(year, evaluation);
            vintageInputs.add(vintageInput(region, year, evaluation));
        }

        List<StockSnapshot> stock = tracker.run(region, vintageInputs);
        SortedMap<Integer, ImmutableSortedMap<String, Double>> finalEnergy = new TreeMap<>();
        for (int i = 0; i < stock.size(); i++) {
            StockSnapshot snapshot = stock.get(i);
            finalEnergy.put(snapshot.getYear(), aggregator.finalEnergyByCarrier(snapshot, vintageInputs.get(i).getTotalDemand()));
        }
        log.debug("Region {} done: {} calibrations, {} simulated years", region, calibrations.size(), stock.size());
        return RegionResult.completed(region, clusterId, calibrations, preferences, newSales, stock, finalEnergy);
    }

    private VintageInput vintageInput(String region, int year, NestEvaluation evaluation) {
        OptionalDouble demand = inputs.getDemand().getDemand(region, year);
        if (!demand.isPresent()) {
            throw new EdgeException("No transport demand", region, null, year);
        }
        Map<String, Double> shares = new LinkedHashMap<>();
        Map<String, Double> prices = new LinkedHashMap<>();
        Map<String, Double> intensities = new LinkedHashMap<>();
        for (NestNode alternative : topology.getAlternatives()) {
            double share = evaluation.getAlternativeShare(alternative.getName());
            if (share <= 0.0) continue;
            PriceRecord record = inputs.getPrices()
                    .require(region, alternative.getVehicleType(), alternative.getTechnology(), year);
            shares.put(alternative.getName(), share);
            prices.put(alternative.getName(), record.getTotalPrice());
            intensities.put(alternative.getName(), record.getEnergyIntensity());
        }
        return new VintageInput(year, demand.getAsDouble(), shares, prices, intensities);
    }
}
