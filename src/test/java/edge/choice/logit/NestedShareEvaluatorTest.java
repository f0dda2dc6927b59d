package edge.choice.logit;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import edge.EdgeTestUtilities;
import edge.utils.exception.DegenerateNestException;
import org.junit.Test;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.OptionalDouble;

import static edge.EdgeTestUtilities.REGION;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

public class NestedShareEvaluatorTest {
    private static final double DELTA = 1e-9;
    private static final int YEAR = 2020;

    private final NestTopology topology = EdgeTestUtilities.passengerTopology();
    private final NestedShareEvaluator evaluator = new NestedShareEvaluator(topology);

    private static LeafCostModel costs(final Map<String, Double> byAlternative) {
        return (region, alternative, year) -> byAlternative.containsKey(alternative.getName())
                ? OptionalDouble.of(byAlternative.get(alternative.getName()))
                : OptionalDouble.empty();
    }

    private static Map<String, Double> allCosts() {
        Map<String, Double> costs = new HashMap<>();
        costs.put("car_ICE", 0.4);
        costs.put("car_BEV", 0.5);
        costs.put("Walk", 0.2);
        return costs;
    }

    private static PreferenceParameters neutral() {
        return PreferenceParameters.builder(YEAR).build();
    }

    @Test
    public void testSiblingSharesSumToOne() {
        PreferenceParameters preferences = PreferenceParameters.builder(YEAR)
                .put(REGION, "car_BEV", 0.3)
                .put(REGION, "Walk", 2.0)
                .build();
        NestEvaluation evaluation = evaluator.evaluate(REGION, YEAR, preferences, costs(allCosts()));

        assertEquals(1.0, evaluation.getShare("car_ICE") + evaluation.getShare("car_BEV"), DELTA);
        assertEquals(1.0, evaluation.getShare("4W") + evaluation.getShare("Walk"), DELTA);
        double total = 0.0;
        for (double share : evaluation.getAlternativeShares().values()) {
            total += share;
        }
        assertEquals(1.0, total, DELTA);
    }

    @Test
    public void testConditionalShareFollowsCostRatio() {
        NestEvaluation evaluation = evaluator.evaluate(REGION, YEAR, neutral(), costs(allCosts()));

        double iceWeight = Math.pow(0.4, -1.0 / 0.25);
        double bevWeight = Math.pow(0.5, -1.0 / 0.25);
        assertEquals(iceWeight / (iceWeight + bevWeight), evaluation.getShare("car_ICE"), DELTA);

        double composite = Math.pow(iceWeight + bevWeight, -0.25);
        assertEquals(composite, evaluation.getCompositeCost("4W"), DELTA);
    }

    @Test
    public void testUnavailableLeafGetsZeroShare() {
        Map<String, Double> costs = allCosts();
        costs.remove("car_BEV");
        NestEvaluation evaluation = evaluator.evaluate(REGION, YEAR, neutral(), costs(costs));

        assertFalse(evaluation.isAvailable("car_BEV"));
        assertTrue(evaluation.getUnavailable().contains("car_BEV"));
        assertEquals(0.0, evaluation.getAlternativeShare("car_BEV"), 0.0);
        assertEquals(1.0, evaluation.getShare("car_ICE"), DELTA);
    }

    @Test
    public void testUnavailableLeafIsReportedAsWarning() {
        Logger logger = (Logger) LoggerFactory.getLogger(NestedShareEvaluator.class);
        Level level = logger.getLevel();
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        logger.setLevel(Level.WARN);
        logger.addAppender(appender);
        try {
            Map<String, Double> costs = allCosts();
            costs.remove("car_BEV");
            evaluator.evaluate(REGION, YEAR, neutral(), costs(costs));
        } finally {
            logger.detachAppender(appender);
            logger.setLevel(level);
        }

        assertEquals(1, appender.list.size());
        ILoggingEvent event = appender.list.get(0);
        assertEquals(Level.WARN, event.getLevel());
        assertTrue(event.getFormattedMessage().contains("car_BEV"));
        assertTrue(event.getFormattedMessage().contains(REGION));
        assertTrue(event.getFormattedMessage().contains(String.valueOf(YEAR)));
    }

    @Test
    public void testNestWithoutAvailableChildrenIsDropped() {
        Map<String, Double> costs = allCosts();
        costs.remove("car_BEV");
        costs.remove("car_ICE");
        NestEvaluation evaluation = evaluator.evaluate(REGION, YEAR, neutral(), costs(costs));

        assertTrue(evaluation.getUnavailable().contains("4W"));
        assertEquals(1.0, evaluation.getAlternativeShare("Walk"), DELTA);
        assertEquals(0.0, evaluation.getAlternativeShare("car_ICE"), 0.0);
    }

    @Test
    public void testRootWithoutAlternativesIsDegenerate() {
        LeafCostModel nothing = mock(LeafCostModel.class);
        when(nothing.cost(anyString(), any(NestNode.class), anyInt())).thenReturn(OptionalDouble.empty());
        try {
            evaluator.evaluate(REGION, YEAR, neutral(), nothing);
            fail("Expected DegenerateNestException");
        } catch (DegenerateNestException e) {
            assertEquals(REGION, e.getRegion());
            assertEquals("passenger", e.getNode());
        }
    }

    @Test
    public void testNonPositiveCostMakesLeafUnavailable() {
        Map<String, Double> costs = allCosts();
        costs.put("Walk", 0.0);
        NestEvaluation evaluation = evaluator.evaluate(REGION, YEAR, neutral(), costs(costs));

        assertFalse(evaluation.isAvailable("Walk"));
        assertEquals(1.0, evaluation.getShare("4W"), DELTA);
    }

    @Test
    public void testSharpExponentDoesNotOverflow() {
        NestTopology sharp = NestTopology.builder()
                .addNest(0, "4W", null, 0.001)
                .addAlternative(1, "car_ICE", "4W", EdgeTestUtilities.CAR, "Liquids", null)
                .addAlternative(1, "car_BEV", "4W", EdgeTestUtilities.CAR, "BEV", null)
                .build();
        NestEvaluation evaluation = new NestedShareEvaluator(sharp).evaluate(REGION, YEAR, neutral(), costs(allCosts()));

        double ice = evaluation.getShare("car_ICE");
        assertFalse(Double.isNaN(ice));
        assertEquals(1.0, ice, 1e-6);
        assertEquals(1.0, ice + evaluation.getShare("car_BEV"), DELTA);
        assertFalse(Double.isNaN(evaluation.getCompositeCost("4W")));
    }
}
