package edge.analysis;

import com.google.common.collect.ImmutableSortedMap;
import edge.choice.logit.NestNode;
import edge.choice.logit.NestTopology;
import edge.vintage.StockSnapshot;

import java.util.Map;
import java.util.TreeMap;

/**
 * Turns stock composition into service and final-energy demand: each alternative serves its stock
 * share of total demand at its stock intensity.
 */
public class EnergyDemandAggregator {

    private final NestTopology topology;

    public EnergyDemandAggregator(NestTopology topology) {
        this.topology = topology;
    }

    public ImmutableSortedMap<String, Double> serviceDemandByAlternative(StockSnapshot snapshot, double totalDemand) {
        Map<String, Double> demand = new TreeMap<>();
        for (Map.Entry<String, Double> share : snapshot.getStockShares().entrySet()) {
            demand.put(share.getKey(), share.getValue() * totalDemand);
        }
        return ImmutableSortedMap.copyOf(demand);
    }

    /**
     * Final energy per energy carrier, in demand units times intensity units.
     */
    public ImmutableSortedMap<String, Double> finalEnergyByCarrier(StockSnapshot snapshot, double totalDemand) {
        Map<String, Double> energy = new TreeMap<>();
        for (NestNode alternative : topology.getAlternatives()) {
            double share = snapshot.getStockShare(alternative.getName());
            if (share <= 0.0) continue;
            double intensity = snapshot.getStockIntensity(alternative.getName());
            energy.merge(alternative.getEnergyCarrier(), share * totalDemand * intensity, Double::sum);
        }
        return ImmutableSortedMap.copyOf(energy);
    }
}
