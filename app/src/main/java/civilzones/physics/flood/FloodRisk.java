package civilzones.physics.flood;

/**
 * Estado de riesgo de una casilla respecto al nivel del mar.
 */
public enum FloodRisk {
    UNDERWATER("Bajo el agua"),
    DANGER("¡Riesgo de inundación! Construye más alto."),
    WARNING("Elevación baja, vigila el nivel del agua"),
    SAFE("Elevación segura");

    private final String description;

    FloodRisk(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    public boolean isAtRisk() {
        return this == DANGER || this == WARNING;
    }
}
