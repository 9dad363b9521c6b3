package civilzones.domain.world;

import civilzones.domain.terrain.TerrainType;

/**
 * Par (tipo de terreno, elevación final) producido por la cascada de clasificación.
 */
public record Classification(TerrainType type, double elevation) {
}
