package civilzones.domain.terrain;

/**
 * Zonificación asignada por el jugador a una casilla.
 */
public enum ZoneType {
    RESIDENTIAL,
    COMMERCIAL,
    INDUSTRIAL
}
