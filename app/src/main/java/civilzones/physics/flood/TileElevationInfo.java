package civilzones.physics.flood;

/**
 * Información de elevación de una casilla tal y como se muestra al jugador.
 *
 * @param elevation Elevación de la casilla.
 * @param seaLevel  Nivel del mar con el que se ha evaluado.
 * @param risk      Estado de riesgo.
 */
public record TileElevationInfo(double elevation, double seaLevel, FloodRisk risk) {

    public String description() {
        return risk.getDescription();
    }

    public boolean floodRisk() {
        return risk.isAtRisk();
    }
}
