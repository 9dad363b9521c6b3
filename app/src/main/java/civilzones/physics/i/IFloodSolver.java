package civilzones.physics.i;

import civilzones.domain.flood.FloodResult;
import civilzones.domain.settlement.Settlement;
import civilzones.domain.terrain.TileGrid;

/**
 * Contrato de una pasada de inundación/drenaje sobre la rejilla completa.
 * <p>
 * Las implementaciones mutan la rejilla y la lista de edificios del
 * asentamiento, pero no la población: eso corresponde a quien aplique el
 * {@link FloodResult}.
 */
@FunctionalInterface
public interface IFloodSolver {

    /**
     * @param grid       La rejilla a evaluar (se modifica en sitio).
     * @param settlement El asentamiento cuyos edificios pueden perderse.
     * @param seaLevel   El nivel del mar actual.
     * @return el resumen de la pasada.
     */
    FloodResult apply(TileGrid grid, Settlement settlement, double seaLevel);
}
