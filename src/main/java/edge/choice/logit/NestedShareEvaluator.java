package edge.choice.logit;

import edge.utils.MathUtil;
import edge.utils.exception.DegenerateNestException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * Evaluates the nested logit of one region and year. Composite costs are aggregated bottom-up,
 * <pre>
 *   composite = (sum_i pref_i * cost_i^(-1/exponent))^(-exponent)
 * </pre>
 * and shares follow top-down as each child's weight over the sum of its siblings' weights. Weights
 * are handled in log space so sharp exponents do not overflow.
 * <p>
 * Stateless; one instance can be shared across threads.
 */
public class NestedShareEvaluator {
    private static final Logger log = LoggerFactory.getLogger(NestedShareEvaluator.class);

    private final NestTopology topology;

    public NestedShareEvaluator(NestTopology topology) {
        this.topology = topology;
    }

    public NestTopology getTopology() {
        return topology;
    }

    /**
     * @throws DegenerateNestException if no alternative of the whole tree is available
     */
    public NestEvaluation evaluate(String region, int year, PreferenceParameters preferences, LeafCostModel costModel) {
        Map<String, Double> compositeCosts = new LinkedHashMap<>();
        Map<String, Double> shares = new HashMap<>();
        Set<String> unavailable = new LinkedHashSet<>();

        for (NestNode alternative : topology.getAlternatives()) {
            OptionalDouble cost = costModel.cost(region, alternative, year);
            if (cost.isPresent() && cost.getAsDouble() > 0.0) {
                compositeCosts.put(alternative.getName(), cost.getAsDouble());
            } else {
                log.warn("{} unavailable in {} ({}): no usable cost", alternative, region, year);
                unavailable.add(alternative.getName());
            }
        }

        for (NestNode nest : topology.getNestsBottomUp()) {
            List<NestNode> available = availableChildren(nest, unavailable);
            if (available.isEmpty()) {
                if (nest.isRoot()) {
                    throw new DegenerateNestException("No available alternative in the nest", region, nest.getName(), year);
                }
                log.warn("Dropping nest {} in {} ({}): all of its children are unavailable", nest, region, year);
                unavailable.add(nest.getName());
                continue;
            }
            double[] logWeights = logWeights(region, nest, available, preferences, compositeCosts);
            double logSum = MathUtil.logSumExp(logWeights);
            compositeCosts.put(nest.getName(), Math.exp(-nest.getExponent() * logSum));
            for (int i = 0; i < available.size(); i++) {
                shares.put(available.get(i).getName(), Math.exp(logWeights[i] - logSum));
            }
        }
        shares.put(topology.getRoot().getName(), 1.0);

        Map<String, Double> alternativeShares = new LinkedHashMap<>();
        for (NestNode alternative : topology.getAlternatives()) {
            alternativeShares.put(alternative.getName(), absoluteShare(alternative, shares));
        }
        return new NestEvaluation(region, year, shares, compositeCosts, alternativeShares, unavailable);
    }

    static List<NestNode> availableChildren(NestNode nest, Set<String> unavailable) {
        List<NestNode> available = new ArrayList<>(nest.getChildren().size());
        for (NestNode child : nest.getChildren()) {
            if (!unavailable.contains(child.getName())) {
                available.add(child);
            }
        }
        return available;
    }

    static double[] logWeights(String region, NestNode nest, List<NestNode> children, PreferenceParameters preferences,
                               Map<String, Double> compositeCosts) {
        double[] logWeights = new double[children.size()];
        for (int i = 0; i < children.size(); i++) {
            NestNode child = children.get(i);
            double preference = preferences.get(region, child.getName());
            logWeights[i] = Math.log(preference) - Math.log(compositeCosts.get(child.getName())) / nest.getExponent();
        }
        return logWeights;
    }

    private static double absoluteShare(NestNode node, Map<String, Double> shares) {
        if (node.isRoot()) {
            return 1.0;
        }
        Double share = shares.get(node.getName());
        if (share == null) {
            return 0.0;
        }
        return share * absoluteShare(node.getParent(), shares);
    }
}
