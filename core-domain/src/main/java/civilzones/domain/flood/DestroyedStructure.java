package civilzones.domain.flood;

/**
 * Estructura perdida en una inundación.
 *
 * @param x          Coordenada X (ancla del edificio o casilla zonificada).
 * @param y          Coordenada Y.
 * @param type       Etiqueta del tipo de estructura (tipo de edificio o de zona).
 * @param population Población que albergaba en el momento de la inundación.
 */
public record DestroyedStructure(int x, int y, String type, int population) {
}
