package edge.sim;

import com.google.common.base.Preconditions;
import edge.choice.logit.NestTopology;
import edge.data.DemandSeries;
import edge.data.InconvenienceCostTable;
import edge.data.ObservedShareTable;
import edge.data.PriceTable;
import edge.data.ValueOfTimeTable;
import edge.data.readers.EdgeInputReader;
import edge.trend.TrendTargets;
import edge.utils.clustering.kmeans.ClusterIndicatorLookup;
import edge.vintage.SurvivalSchedule;
import edge.vintage.SurvivalSchedules;
import org.apache.commons.lang3.StringUtils;

import java.io.IOException;

/**
 * All tables a run consumes. Optional tables default to empty.
 */
public final class EdgeInputs {

    private final NestTopology topology;
    private final PriceTable prices;
    private final ObservedShareTable observedShares;
    private final ValueOfTimeTable valueOfTime;
    private final InconvenienceCostTable inconvenienceCosts;
    private final ClusterIndicatorLookup clusterIndicators;
    private final SurvivalSchedules survival;
    private final DemandSeries demand;
    private final TrendTargets trendTargets;

    private EdgeInputs(Builder builder) {
        this.topology = Preconditions.checkNotNull(builder.topology, "nest topology");
        this.prices = Preconditions.checkNotNull(builder.prices, "price table");
        this.observedShares = Preconditions.checkNotNull(builder.observedShares, "observed shares");
        this.clusterIndicators = Preconditions.checkNotNull(builder.clusterIndicators, "cluster indicators");
        this.demand = Preconditions.checkNotNull(builder.demand, "demand series");
        this.survival = Preconditions.checkNotNull(builder.survival, "survival schedules");
        this.valueOfTime = builder.valueOfTime;
        this.inconvenienceCosts = builder.inconvenienceCosts;
        this.trendTargets = builder.trendTargets;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Reads every table named in the config's input block.
     */
    public static EdgeInputs load(EdgeConfig config) throws IOException {
        EdgeConfig.InputFiles files = config.getInputFiles();
        EdgeInputReader reader = new EdgeInputReader();
        Builder builder = builder()
                .topology(reader.readTopology(files.getTopology()))
                .prices(EdgeInputReader.prices(reader.readRows(files.getPrices())))
                .observedShares(EdgeInputReader.observedShares(reader.readRows(files.getObservedShares())))
                .clusterIndicators(EdgeInputReader.clusterIndicators(reader.readRows(files.getClusterIndicators())))
                .demand(EdgeInputReader.demand(reader.readRows(files.getDemand())));
        if (StringUtils.isNotBlank(files.getSurvival())) {
            builder.survival(EdgeInputReader.survival(reader.readRows(files.getSurvival()), config.getMaxServiceLife()));
        } else {
            builder.survival(SurvivalSchedules.uniform(SurvivalSchedule.defaultSchedule(config.getMaxServiceLife())));
        }
        if (StringUtils.isNotBlank(files.getValueOfTime())) {
            builder.valueOfTime(EdgeInputReader.valueOfTime(reader.readRows(files.getValueOfTime())));
        }
        if (StringUtils.isNotBlank(files.getInconvenienceCosts())) {
            builder.inconvenienceCosts(EdgeInputReader.inconvenienceCosts(reader.readRows(files.getInconvenienceCosts())));
        }
        if (StringUtils.isNotBlank(files.getTrendTargets())) {
            builder.trendTargets(EdgeInputReader.trendTargets(reader.readRows(files.getTrendTargets())));
        }
        return builder.build();
    }

    public NestTopology getTopology() {
        return topology;
    }

    public PriceTable getPrices() {
        return prices;
    }

    public ObservedShareTable getObservedShares() {
        return observedShares;
    }

    public ValueOfTimeTable getValueOfTime() {
        return valueOfTime;
    }

    public InconvenienceCostTable getInconvenienceCosts() {
        return inconvenienceCosts;
    }

    public ClusterIndicatorLookup getClusterIndicators() {
        return clusterIndicators;
    }

    public SurvivalSchedules getSurvival() {
        return survival;
    }

    public DemandSeries getDemand() {
        return demand;
    }

    public TrendTargets getTrendTargets() {
        return trendTargets;
    }

    public static final class Builder {
        private NestTopology topology;
        private PriceTable prices;
        private ObservedShareTable observedShares;
        private ValueOfTimeTable valueOfTime = ValueOfTimeTable.empty();
        private InconvenienceCostTable inconvenienceCosts = InconvenienceCostTable.empty();
        private ClusterIndicatorLookup clusterIndicators;
        private SurvivalSchedules survival;
        private DemandSeries demand;
        private TrendTargets trendTargets = TrendTargets.none();

        public Builder topology(NestTopology topology) {
            this.topology = topology;
            return this;
        }

        public Builder prices(PriceTable prices) {
            this.prices = prices;
            return this;
        }

        public Builder observedShares(ObservedShareTable observedShares) {
            this.observedShares = observedShares;
            return this;
        }

        public Builder valueOfTime(ValueOfTimeTable valueOfTime) {
            this.valueOfTime = valueOfTime;
            return this;
        }

        public Builder inconvenienceCosts(InconvenienceCostTable inconvenienceCosts) {
            this.inconvenienceCosts = inconvenienceCosts;
            return this;
        }

        public Builder clusterIndicators(ClusterIndicatorLookup clusterIndicators) {
            this.clusterIndicators = clusterIndicators;
            return this;
        }

        public Builder survival(SurvivalSchedules survival) {
            this.survival = survival;
            return this;
        }

        public Builder demand(DemandSeries demand) {
            this.demand = demand;
            return this;
        }

        public Builder trendTargets(TrendTargets trendTargets) {
            this.trendTargets = trendTargets;
            return this;
        }

        public EdgeInputs build() {
            return new EdgeInputs(this);
        }
    }
}
