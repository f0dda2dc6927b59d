package edge.vintage;

import com.google.common.collect.ImmutableMap;

import java.util.Map;

/**
 * Default survival schedule with optional per-technology overrides.
 */
public final class SurvivalSchedules {

    private final SurvivalSchedule defaultSchedule;
    private final ImmutableMap<String, SurvivalSchedule> overrides;

    public SurvivalSchedules(SurvivalSchedule defaultSchedule, Map<String, SurvivalSchedule> overrides) {
        this.defaultSchedule = defaultSchedule;
        this.overrides = ImmutableMap.copyOf(overrides);
    }

    public static SurvivalSchedules uniform(SurvivalSchedule schedule) {
        return new SurvivalSchedules(schedule, ImmutableMap.of());
    }

    public SurvivalSchedule forTechnology(String technology) {
        return overrides.getOrDefault(technology, defaultSchedule);
    }

    public SurvivalSchedule getDefault() {
        return defaultSchedule;
    }
}
