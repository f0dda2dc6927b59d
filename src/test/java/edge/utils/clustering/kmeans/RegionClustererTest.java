package edge.utils.clustering.kmeans;

import com.google.common.collect.ImmutableMap;
import edge.data.StructuralIndicatorTable;
import edge.utils.exception.ClusteringIndicatorMissingException;
import org.junit.Test;

import java.util.Arrays;
import java.util.List;
import java.util.OptionalDouble;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

public class RegionClustererTest {

    private static final List<String> REGIONS = Arrays.asList("USA", "EUR", "JPN", "IND", "SSA", "CHN", "LAM");

    private static StructuralIndicatorTable gdpPerCapita() {
        return new StructuralIndicatorTable(ImmutableMap.<String, Double>builder()
                .put("USA", 55000.0)
                .put("EUR", 38000.0)
                .put("JPN", 40000.0)
                .put("IND", 1800.0)
                .put("SSA", 1500.0)
                .put("CHN", 9000.0)
                .put("LAM", 8500.0)
                .build());
    }

    @Test
    public void testSimilarRegionsShareACluster() {
        RegionClusters clusters = new RegionClusterer(gdpPerCapita(), 3, 100).cluster(REGIONS);

        assertEquals(3, clusters.size());
        assertEquals(clusters.getClusterId("USA"), clusters.getClusterId("EUR"));
        assertEquals(clusters.getClusterId("IND"), clusters.getClusterId("SSA"));
        assertEquals(clusters.getClusterId("CHN"), clusters.getClusterId("LAM"));
        assertNotEquals(clusters.getClusterId("USA"), clusters.getClusterId("IND"));
    }

    @Test
    public void testClustersAreOrderedByCenter() {
        RegionClusters clusters = new RegionClusterer(gdpPerCapita(), 3, 100).cluster(REGIONS);

        assertEquals(0, clusters.getClusterId("SSA"));
        assertEquals(2, clusters.getClusterId("USA"));
        double previous = Double.NEGATIVE_INFINITY;
        for (RegionCluster cluster : clusters.getClusters()) {
            assertTrue(cluster.getCenter() > previous);
            previous = cluster.getCenter();
        }
    }

    @Test
    public void testAssignmentIsIndependentOfInputOrder() {
        RegionClusterer clusterer = new RegionClusterer(gdpPerCapita(), 3, 100);
        RegionClusters first = clusterer.cluster(REGIONS);
        RegionClusters second = clusterer.cluster(Arrays.asList("LAM", "CHN", "SSA", "IND", "JPN", "EUR", "USA"));

        for (String region : REGIONS) {
            assertEquals(first.getClusterId(region), second.getClusterId(region));
        }
    }

    @Test
    public void testClusterCountShrinksToDistinctValues() {
        ClusterIndicatorLookup lookup = mock(ClusterIndicatorLookup.class);
        when(lookup.getIndicator("A")).thenReturn(OptionalDouble.of(100.0));
        when(lookup.getIndicator("B")).thenReturn(OptionalDouble.of(100.0));
        when(lookup.getIndicator("C")).thenReturn(OptionalDouble.of(5000.0));

        RegionClusters clusters = new RegionClusterer(lookup, 3, 100).cluster(Arrays.asList("A", "B", "C"));

        assertEquals(2, clusters.size());
        assertEquals(clusters.getClusterId("A"), clusters.getClusterId("B"));
    }

    @Test
    public void testMissingIndicatorIsFatal() {
        ClusterIndicatorLookup lookup = mock(ClusterIndicatorLookup.class);
        when(lookup.getIndicator("A")).thenReturn(OptionalDouble.of(100.0));
        when(lookup.getIndicator("B")).thenReturn(OptionalDouble.empty());

        try {
            new RegionClusterer(lookup, 2, 100).cluster(Arrays.asList("A", "B"));
            fail("Expected ClusteringIndicatorMissingException");
        } catch (ClusteringIndicatorMissingException e) {
            assertEquals("B", e.getRegion());
        }
    }
}
