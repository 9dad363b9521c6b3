package civilzones.domain.world;

import civilzones.domain.settlement.Player;

/**
 * Punto de aparición elegido para el jugador.
 *
 * @param x         Coordenada X.
 * @param y         Coordenada Y.
 * @param method    Fase de búsqueda que lo encontró.
 * @param reachable Casillas de tierra alcanzables desde el punto (acotado por la búsqueda).
 */
public record SpawnResult(int x, int y, SpawnMethod method, int reachable) {

    public Player toPlayer() {
        return new Player(x, y);
    }
}
