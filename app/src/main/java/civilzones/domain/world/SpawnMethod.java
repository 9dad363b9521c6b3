package civilzones.domain.world;

/**
 * Fase de búsqueda que produjo el punto de aparición del jugador.
 */
public enum SpawnMethod {
    CENTER,
    WIDE,
    EMERGENCY,
    FORCED
}
