package civilzones.physics.flood;

import civilzones.domain.flood.FloodResult;
import civilzones.domain.settlement.Building;

import java.util.List;

/**
 * Descripción inmutable de lo que una pasada de inundación va a cambiar.
 * <p>
 * Se calcula sin tocar la rejilla ni la lista de edificios, lo que permite
 * evaluar "qué pasaría" con un nivel del mar dado y aplicar después los cambios
 * de una sola vez.
 *
 * @param floodedTiles              Casillas que pasan a ser agua.
 * @param drainedTiles              Casillas de agua que vuelven a ser tierra.
 * @param buildingIndicesDescending Índices de la lista de edificios a retirar, sin repetidos y en orden descendente.
 * @param destroyedBuildings        Edificios destruidos (de la lista o solo incrustados en casillas), cada uno una vez.
 * @param result                    Resumen agregado de la pasada.
 */
public record FloodPlan(
        List<GridCoordinate> floodedTiles,
        List<GridCoordinate> drainedTiles,
        List<Integer> buildingIndicesDescending,
        List<Building> destroyedBuildings,
        FloodResult result
) {

    public FloodPlan {
        floodedTiles = List.copyOf(floodedTiles);
        drainedTiles = List.copyOf(drainedTiles);
        buildingIndicesDescending = List.copyOf(buildingIndicesDescending);
        destroyedBuildings = List.copyOf(destroyedBuildings);
    }

    public record GridCoordinate(int x, int y) {
    }
}
