package edge.sim;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Ordering;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import edge.calibration.CalibrationMode;
import edge.trend.ConvergenceLaw;

import java.io.File;
import java.util.List;

/**
 * Immutable run settings, read once from the {@code edge} block of a HOCON file with the bundled
 * reference.conf as fallback. Every component receives what it needs from here; there are no
 * global switches.
 */
public final class EdgeConfig {

    private final EdgeScenario scenario;
    private final boolean inconvenience;
    private final boolean smartLifestyle;
    private final ImmutableList<Integer> years;
    private final ImmutableList<Integer> referenceYears;
    private final double preferenceFloor;
    private final int clusterCount;
    private final int clusterMaxIterations;
    private final ConvergenceLaw trendLaw;
    private final int trendConvergenceYear;
    private final double trendRate;
    private final double techSwitchFactor;
    private final double lifestyleFactor;
    private final ImmutableSet<String> lifestyleNodes;
    private final double inconvenienceFinalFraction;
    private final int inconvenienceConvergenceYear;
    private final double inconvenienceRate;
    private final int maxServiceLife;
    private final int threads;
    private final String outputDirectory;
    private final InputFiles inputFiles;

    private EdgeConfig(Config config) {
        Config edge = config.getConfig("edge");
        this.scenario = EdgeScenario.fromName(edge.getString("scenario"));
        this.inconvenience = edge.getBoolean("inconvenience");
        this.smartLifestyle = edge.hasPath("smartLifestyle")
                ? edge.getBoolean("smartLifestyle")
                : scenario.isSmartLifestyleByDefault();
        this.years = sortedYears(edge.getIntList("years"), "years");
        this.referenceYears = sortedYears(edge.getIntList("referenceYears"), "referenceYears");
        this.preferenceFloor = edge.getDouble("calibration.preferenceFloor");
        this.clusterCount = edge.getInt("clustering.clusterCount");
        this.clusterMaxIterations = edge.getInt("clustering.maxIterations");
        this.trendLaw = edge.getEnum(ConvergenceLaw.class, "trend.law");
        this.trendConvergenceYear = edge.getInt("trend.convergenceYear");
        this.trendRate = edge.getDouble("trend.rate");
        this.techSwitchFactor = edge.getDouble("trend.techSwitchFactor");
        this.lifestyleFactor = edge.getDouble("trend.lifestyleFactor");
        this.lifestyleNodes = ImmutableSet.copyOf(edge.getStringList("trend.lifestyleNodes"));
        this.inconvenienceFinalFraction = edge.getDouble("inconvenienceTrend.finalFraction");
        this.inconvenienceConvergenceYear = edge.getInt("inconvenienceTrend.convergenceYear");
        this.inconvenienceRate = edge.getDouble("inconvenienceTrend.rate");
        this.maxServiceLife = edge.getInt("vintage.maxServiceLife");
        this.threads = edge.getInt("threads");
        this.outputDirectory = edge.getString("outputDirectory");
        this.inputFiles = new InputFiles(edge.getConfig("input"));

        Preconditions.checkArgument(preferenceFloor > 0.0, "edge.calibration.preferenceFloor must be > 0: %s", preferenceFloor);
        Preconditions.checkArgument(techSwitchFactor > 0.0, "edge.trend.techSwitchFactor must be > 0: %s", techSwitchFactor);
        Preconditions.checkArgument(lifestyleFactor > 0.0, "edge.trend.lifestyleFactor must be > 0: %s", lifestyleFactor);
        Preconditions.checkArgument(inconvenienceFinalFraction >= 0.0,
                "edge.inconvenienceTrend.finalFraction must be >= 0: %s", inconvenienceFinalFraction);
        Preconditions.checkArgument(maxServiceLife > 0, "edge.vintage.maxServiceLife must be > 0: %s", maxServiceLife);
        Preconditions.checkArgument(threads > 0, "edge.threads must be > 0: %s", threads);
        Preconditions.checkArgument(!referenceYears.isEmpty(), "edge.referenceYears must not be empty");
        Preconditions.checkArgument(years.containsAll(referenceYears),
                "edge.referenceYears %s must be part of edge.years %s", referenceYears, years);
    }

    private static ImmutableList<Integer> sortedYears(List<Integer> values, String key) {
        Preconditions.checkArgument(Ordering.natural().isStrictlyOrdered(values),
                "edge.%s must be strictly increasing: %s", key, values);
        return ImmutableList.copyOf(values);
    }

    public static EdgeConfig fromConfig(Config config) {
        return new EdgeConfig(config.withFallback(ConfigFactory.defaultReference()).resolve());
    }

    public static EdgeConfig load(File file) {
        Preconditions.checkArgument(file.isFile(), "Config file %s does not exist", file);
        return fromConfig(ConfigFactory.parseFile(file));
    }

    public static EdgeConfig defaults() {
        return fromConfig(ConfigFactory.empty());
    }

    public EdgeScenario getScenario() {
        return scenario;
    }

    public boolean isInconvenience() {
        return inconvenience;
    }

    public CalibrationMode getCalibrationMode() {
        return inconvenience ? CalibrationMode.INCONVENIENCE : CalibrationMode.PREFERENCE_ONLY;
    }

    public boolean isSmartLifestyle() {
        return smartLifestyle;
    }

    public ImmutableList<Integer> getYears() {
        return years;
    }

    public ImmutableList<Integer> getReferenceYears() {
        return referenceYears;
    }

    public int getLastReferenceYear() {
        return referenceYears.get(referenceYears.size() - 1);
    }

    public double getPreferenceFloor() {
        return preferenceFloor;
    }

    public int getClusterCount() {
        return clusterCount;
    }

    public int getClusterMaxIterations() {
        return clusterMaxIterations;
    }

    public ConvergenceLaw getTrendLaw() {
        return trendLaw;
    }

    public int getTrendConvergenceYear() {
        return trendConvergenceYear;
    }

    public double getTrendRate() {
        return trendRate;
    }

    public double getTechSwitchFactor() {
        return techSwitchFactor;
    }

    public double getLifestyleFactor() {
        return lifestyleFactor;
    }

    public ImmutableSet<String> getLifestyleNodes() {
        return lifestyleNodes;
    }

    public double getInconvenienceFinalFraction() {
        return inconvenienceFinalFraction;
    }

    public int getInconvenienceConvergenceYear() {
        return inconvenienceConvergenceYear;
    }

    public double getInconvenienceRate() {
        return inconvenienceRate;
    }

    public int getMaxServiceLife() {
        return maxServiceLife;
    }

    public int getThreads() {
        return threads;
    }

    public String getOutputDirectory() {
        return outputDirectory;
    }

    public InputFiles getInputFiles() {
        return inputFiles;
    }

    /**
     * Paths of the input tables; optional tables have an empty path when not supplied.
     */
    public static final class InputFiles {
        private final String topology;
        private final String prices;
        private final String observedShares;
        private final String valueOfTime;
        private final String inconvenienceCosts;
        private final String clusterIndicators;
        private final String survival;
        private final String demand;
        private final String trendTargets;

        private InputFiles(Config input) {
            this.topology = input.getString("topology");
            this.prices = input.getString("prices");
            this.observedShares = input.getString("observedShares");
            this.valueOfTime = input.getString("valueOfTime");
            this.inconvenienceCosts = input.getString("inconvenienceCosts");
            this.clusterIndicators = input.getString("clusterIndicators");
            this.survival = input.getString("survival");
            this.demand = input.getString("demand");
            this.trendTargets = input.getString("trendTargets");
        }

        public String getTopology() {
            return topology;
        }

        public String getPrices() {
            return prices;
        }

        public String getObservedShares() {
            return observedShares;
        }

        public String getValueOfTime() {
            return valueOfTime;
        }

        public String getInconvenienceCosts() {
            return inconvenienceCosts;
        }

        public String getClusterIndicators() {
            return clusterIndicators;
        }

        public String getSurvival() {
            return survival;
        }

        public String getDemand() {
            return demand;
        }

        public String getTrendTargets() {
            return trendTargets;
        }
    }
}
