package edge.sim;

/**
 * Named transport scenarios. Each favours one technology; the "Wise" variants add the lifestyle shift.
 */
public enum EdgeScenario {
    CONV_CASE("ConvCase", "Liquids", false),
    CONV_CASE_WISE("ConvCaseWise", "Liquids", true),
    ELEC_ERA("ElecEra", "BEV", false),
    ELEC_ERA_WISE("ElecEraWise", "BEV", true),
    HYDR_HYPE("HydrHype", "FCEV", false),
    HYDR_HYPE_WISE("HydrHypeWise", "FCEV", true);

    private final String scenarioName;
    private final String techSwitch;
    private final boolean smartLifestyle;

    EdgeScenario(String scenarioName, String techSwitch, boolean smartLifestyle) {
        this.scenarioName = scenarioName;
        this.techSwitch = techSwitch;
        this.smartLifestyle = smartLifestyle;
    }

    public static EdgeScenario fromName(String name) {
        for (EdgeScenario scenario : values()) {
            if (scenario.scenarioName.equalsIgnoreCase(name)) {
                return scenario;
            }
        }
        throw new IllegalArgumentException("Unknown transport scenario '" + name
                + "'. Allowed: ConvCase, ConvCaseWise, ElecEra, ElecEraWise, HydrHype, HydrHypeWise");
    }

    public String getScenarioName() {
        return scenarioName;
    }

    /**
     * Technology whose long-run preference is boosted in this scenario.
     */
    public String getTechSwitch() {
        return techSwitch;
    }

    public boolean isSmartLifestyleByDefault() {
        return smartLifestyle;
    }
}
