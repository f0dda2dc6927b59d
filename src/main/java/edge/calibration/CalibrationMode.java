package edge.calibration;

public enum CalibrationMode {
    /** All taste not explained by price is carried by the preference weights. */
    PREFERENCE_ONLY,
    /** Leaf costs include an exogenous inconvenience cost; preferences carry only the residual taste. */
    INCONVENIENCE
}
