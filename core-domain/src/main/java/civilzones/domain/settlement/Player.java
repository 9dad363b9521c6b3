package civilzones.domain.settlement;

/**
 * Posición actual del jugador en la rejilla.
 */
public record Player(int x, int y) {

    public boolean isAt(int px, int py) {
        return x == px && y == py;
    }
}
