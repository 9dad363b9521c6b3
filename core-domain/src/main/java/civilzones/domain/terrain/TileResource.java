package civilzones.domain.terrain;

/**
 * Yacimiento de piedra de una casilla de montaña.
 *
 * @param amount     Unidades de piedra extraíbles.
 * @param metalYield Fracción de metal obtenida al extraer piedra.
 */
public record TileResource(int amount, double metalYield) {

    public TileResource {
        if (amount < 0) {
            throw new IllegalArgumentException("La cantidad de un yacimiento no puede ser negativa.");
        }
    }
}
