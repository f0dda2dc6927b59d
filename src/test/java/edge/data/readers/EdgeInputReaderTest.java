package edge.data.readers;

import edge.choice.logit.NestTopology;
import edge.data.InconvenienceCostTable;
import edge.data.ObservedShareTable;
import edge.data.PriceTable;
import edge.data.StructuralIndicatorTable;
import edge.trend.TrendTargets;
import edge.vintage.SurvivalSchedules;
import org.junit.Test;

import java.io.File;
import java.io.IOException;
import java.net.URISyntaxException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class EdgeInputReaderTest {
    private static final double DELTA = 1e-12;

    private final EdgeInputReader reader = new EdgeInputReader();

    static String resource(String name) {
        try {
            return new File(EdgeInputReaderTest.class.getResource("/edge/" + name).toURI()).getPath();
        } catch (URISyntaxException e) {
            throw new IllegalStateException(e);
        }
    }

    @Test
    public void testCsvAndXmlTopologiesAgree() throws IOException {
        NestTopology fromCsv = reader.readTopology(resource("topology.csv"));
        NestTopology fromXml = reader.readTopology(resource("topology.xml"));

        assertEquals(fromXml.getNodes().size(), fromCsv.getNodes().size());
        assertEquals("Electricity", fromCsv.getNode("car_BEV").getEnergyCarrier());
        assertEquals("Walk", fromCsv.getNode("Walk").getEnergyCarrier());
        assertEquals(0.25, fromCsv.getNode("4W").getExponent(), DELTA);
        assertEquals(fromXml.getRoot().getName(), fromCsv.getRoot().getName());
    }

    @Test
    public void testPricesAndShares() throws IOException {
        PriceTable prices = EdgeInputReader.prices(reader.readRows(resource("prices.csv")));
        ObservedShareTable shares = EdgeInputReader.observedShares(reader.readRows(resource("observed_shares.csv")));

        assertEquals(12, prices.size());
        assertEquals(0.30 + 0.05 * 2.0, prices.require("EUR", "Midsize Car", "Liquids", 2010).getTotalPrice(), DELTA);
        assertFalse(prices.find("EUR", "Midsize Car", "FCEV", 2010).isPresent());
        assertEquals(0.05, shares.getShare("EUR", "Midsize Car", "BEV", 2010), DELTA);
        assertEquals(2, shares.getRegions().size());
    }

    @Test
    public void testBlankTechnologyAppliesToTheWholeVehicleType() throws IOException {
        InconvenienceCostTable costs = EdgeInputReader.inconvenienceCosts(reader.readRows(resource("inconvenience_costs.csv")));

        assertEquals(0.10, costs.getAdjustment("EUR", "Midsize Car", "BEV", 2010), DELTA);
        assertEquals(0.02, costs.getAdjustment("EUR", "Midsize Car", "Liquids", 2010), DELTA);
        assertEquals(0.0, costs.getAdjustment("USA", "Midsize Car", "Liquids", 2010), DELTA);
    }

    @Test
    public void testSurvivalOverridesKeepTheDefault() throws IOException {
        SurvivalSchedules schedules = EdgeInputReader.survival(reader.readRows(resource("survival.csv")), 15);

        assertEquals(12, schedules.forTechnology("BEV").getMaxServiceLife());
        assertEquals(0.8, schedules.forTechnology("BEV").getSurvival(4), DELTA);
        assertEquals(15, schedules.forTechnology("Liquids").getMaxServiceLife());
    }

    @Test
    public void testIndicatorsAndTargets() throws IOException {
        StructuralIndicatorTable indicators = EdgeInputReader.clusterIndicators(reader.readRows(resource("cluster_indicators.csv")));
        TrendTargets targets = EdgeInputReader.trendTargets(reader.readRows(resource("trend_targets.csv")));

        assertEquals(55000.0, indicators.getIndicator("USA").getAsDouble(), DELTA);
        assertFalse(indicators.getIndicator("JPN").isPresent());
        assertTrue(targets.find(3, "car_BEV").isPresent());
        assertFalse(targets.find(3, "car_ICE").isPresent());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNonNumericValueIsRejected() {
        Map<String, String> row = new LinkedHashMap<>();
        row.put("region", "EUR");
        row.put("year", "twenty-ten");
        row.put("demand", "1000");
        List<Map<String, String>> rows = Collections.singletonList(row);
        EdgeInputReader.demand(rows);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testMissingFileIsRejected() throws IOException {
        reader.readRows("does/not/exist.csv");
    }
}
