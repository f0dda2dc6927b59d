package edge.vintage;

import com.google.common.collect.ImmutableMap;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class SurvivalScheduleTest {
    private static final double DELTA = 1e-12;

    @Test
    public void testDefaultScheduleDeclinesToZero() {
        SurvivalSchedule schedule = SurvivalSchedule.defaultSchedule(15);

        assertEquals(15, schedule.getMaxServiceLife());
        assertEquals(1.0, schedule.getSurvival(0), DELTA);
        assertEquals(0.0, schedule.getSurvival(15), DELTA);
        assertEquals(0.0, schedule.getSurvival(40), DELTA);
        double previous = 1.0;
        for (int age = 1; age <= 15; age++) {
            assertTrue(schedule.getSurvival(age) <= previous);
            previous = schedule.getSurvival(age);
        }
        assertEquals(1.0 - 0.25, SurvivalSchedule.defaultSchedule(10).getSurvival(5), DELTA);
    }

    @Test
    public void testTabulatedPointsAreInterpolated() {
        SurvivalSchedule schedule = SurvivalSchedule.fromPoints(ImmutableMap.of(2, 1.0, 12, 0.5, 20, 0.0));

        assertEquals(20, schedule.getMaxServiceLife());
        assertEquals(1.0, schedule.getSurvival(0), DELTA);
        assertEquals(0.75, schedule.getSurvival(7), DELTA);
        assertEquals(0.25, schedule.getSurvival(16), DELTA);
        assertEquals(0.0, schedule.getSurvival(20), DELTA);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testIncreasingSurvivalIsRejected() {
        SurvivalSchedule.fromPoints(ImmutableMap.of(0, 0.5, 5, 0.8, 10, 0.0));
    }

    @Test
    public void testFractionOutsideUnitIntervalNamesItsAge() {
        try {
            SurvivalSchedule.fromPoints(ImmutableMap.of(0, 1.0, 5, 1.5, 10, 0.0));
            fail("Expected IllegalArgumentException");
        } catch (IllegalArgumentException e) {
            assertEquals("Surviving fraction 1.5 at age 5 is outside [0, 1]", e.getMessage());
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testScheduleMustEndAtZero() {
        SurvivalSchedule.fromPoints(ImmutableMap.of(0, 1.0, 10, 0.1));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNegativeAgeIsRejected() {
        SurvivalSchedule.defaultSchedule(10).getSurvival(-1);
    }
}
