package civilzones.physics.geology;

/**
 * Sentido en que se mueve el nivel del mar respecto al objetivo del periodo.
 */
public enum SeaLevelTrend {
    RISING,
    FALLING,
    STABLE;

    public static SeaLevelTrend of(double currentLevel, double targetLevel) {
        if (currentLevel < targetLevel) {
            return RISING;
        }
        if (currentLevel > targetLevel) {
            return FALLING;
        }
        return STABLE;
    }
}
