package civilzones.domain.terrain;

/**
 * Parcela cuadrada alineada con los ejes cuyas casillas se fuerzan a una
 * elevación segura frente a cualquier subida futura del mar.
 *
 * @param x    Coordenada X del origen (esquina superior izquierda).
 * @param y    Coordenada Y del origen.
 * @param size Lado de la parcela en casillas.
 */
public record HighGroundPatch(int x, int y, int size) {

    public HighGroundPatch {
        if (size <= 0) {
            throw new IllegalArgumentException("El lado de una parcela elevada debe ser positivo.");
        }
    }

    public boolean contains(int px, int py) {
        return px >= x && px < x + size && py >= y && py < y + size;
    }
}
