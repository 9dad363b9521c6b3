package civilzones.domain.flood;

/**
 * Niveles narrativos de una inundación según la población perdida.
 */
public enum FloodSeverity {
    CATASTROPHE,
    SEVERE,
    MINOR;

    private static final int CATASTROPHE_THRESHOLD = 100;
    private static final int SEVERE_THRESHOLD = 20;

    public static FloodSeverity fromPopulationLost(long populationLost) {
        if (populationLost > CATASTROPHE_THRESHOLD) {
            return CATASTROPHE;
        }
        if (populationLost > SEVERE_THRESHOLD) {
            return SEVERE;
        }
        return MINOR;
    }
}
