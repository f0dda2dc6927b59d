package edge.utils;

import org.junit.Test;

import static org.junit.Assert.assertEquals;

public class MathUtilTest {
    private static final double DELTA = 1e-12;

    @Test
    public void testLogSumExpMatchesDirectSum() {
        double expected = Math.log(Math.exp(1.0) + Math.exp(2.0) + Math.exp(-3.0));
        assertEquals(expected, MathUtil.logSumExp(new double[]{1.0, 2.0, -3.0}), DELTA);
    }

    @Test
    public void testLogSumExpHandlesLargeAndInfiniteEntries() {
        assertEquals(1000.0 + Math.log(2.0), MathUtil.logSumExp(new double[]{1000.0, 1000.0}), DELTA);
        assertEquals(5.0, MathUtil.logSumExp(new double[]{5.0, Double.NEGATIVE_INFINITY}), DELTA);
        assertEquals(Double.NEGATIVE_INFINITY, MathUtil.logSumExp(new double[0]), 0.0);
    }

    @Test
    public void testInterpolate() {
        assertEquals(0.3, MathUtil.interpolate(2010, 0.2, 2020, 0.4, 2015), DELTA);
        assertEquals(0.4, MathUtil.interpolate(2020, 0.2, 2020, 0.4, 2020), DELTA);
    }
}
