package edge.trend;

import edge.data.InconvenienceCostTable;
import edge.data.InconvenienceCosts;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

public class ProjectedInconvenienceCostsTest {
    private static final double DELTA = 1e-9;

    @Test
    public void testCostsShrinkTowardsFinalFraction() {
        InconvenienceCosts historical = mock(InconvenienceCosts.class);
        when(historical.getAdjustment("EUR", "Midsize Car", "BEV", 2005)).thenReturn(0.3);
        when(historical.getAdjustment("EUR", "Midsize Car", "BEV", 2010)).thenReturn(0.2);

        ProjectedInconvenienceCosts projected = new ProjectedInconvenienceCosts(historical, 2010,
                ConvergenceLaw.EXPONENTIAL, 0.25, 2050, 0.1);

        assertEquals(0.3, projected.getAdjustment("EUR", "Midsize Car", "BEV", 2005), DELTA);
        assertEquals(0.2, projected.getAdjustment("EUR", "Midsize Car", "BEV", 2010), DELTA);
        assertEquals(0.05, projected.getAdjustment("EUR", "Midsize Car", "BEV", 2050), DELTA);
        assertEquals(0.05, projected.getAdjustment("EUR", "Midsize Car", "BEV", 2100), DELTA);
        double midway = projected.getAdjustment("EUR", "Midsize Car", "BEV", 2030);
        assertEquals(true, midway < 0.2 && midway > 0.05);
    }

    @Test
    public void testAdjustmentBetweenReferenceYearsIsInterpolated() {
        InconvenienceCostTable table = InconvenienceCostTable.builder()
                .put("EUR", "Midsize Car", "BEV", 2010, 0.4)
                .put("EUR", "Midsize Car", "BEV", 2020, 0.2)
                .build();

        ProjectedInconvenienceCosts projected = new ProjectedInconvenienceCosts(table, 2020,
                ConvergenceLaw.LOGISTIC, 0.5, 2060, 0.1);

        assertEquals(0.3, projected.getAdjustment("EUR", "Midsize Car", "BEV", 2015), DELTA);
        assertEquals(0.2, projected.getAdjustment("EUR", "Midsize Car", "BEV", 2020), DELTA);
        assertEquals(0.15, projected.getAdjustment("EUR", "Midsize Car", "BEV", 2040), DELTA);
        assertEquals(0.1, projected.getAdjustment("EUR", "Midsize Car", "BEV", 2060), DELTA);
    }
}
