package civilzones.domain.world;

import civilzones.domain.terrain.HighGroundPatch;
import civilzones.domain.terrain.TileGrid;

import java.util.List;

/**
 * Contenedor del resultado de una generación completa: la rejilla, las parcelas
 * elevadas usadas y el punto de aparición del jugador.
 */
public record GeneratedWorld(long seed, TileGrid grid, List<HighGroundPatch> patches, SpawnResult spawn) {

    public GeneratedWorld {
        patches = List.copyOf(patches);
    }
}
