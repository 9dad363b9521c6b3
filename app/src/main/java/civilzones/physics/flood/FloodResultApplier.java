package civilzones.physics.flood;

import civilzones.domain.flood.FloodResult;
import civilzones.domain.geology.GeologyState;
import civilzones.domain.settlement.Settlement;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;

/**
 * Traslada un {@link FloodResult} al asentamiento y a las estadísticas geológicas.
 * <p>
 * La pasada de inundación solo informa; este es el único punto en el que la
 * población total se reduce por ahogamiento.
 */
@Slf4j
public final class FloodResultApplier {

    private FloodResultApplier() {
    }

    public static void apply(FloodResult result, GeologyState state, Settlement settlement) {
        Objects.requireNonNull(result, "El resultado de la inundación no puede ser nulo.");
        Objects.requireNonNull(state, "El estado geológico no puede ser nulo.");
        Objects.requireNonNull(settlement, "El asentamiento no puede ser nulo.");

        if (result.populationDrowned() > 0) {
            long remaining = Math.max(0L, settlement.getPopulation() - result.populationDrowned());
            settlement.setPopulation((int) remaining);
            log.debug("Población tras la inundación: {}", remaining);
        }

        state.setTilesFlooded(state.getTilesFlooded() + result.tilesFlooded());
        state.setTilesDrained(state.getTilesDrained() + result.tilesDrained());
        state.setPopulationDrowned(state.getPopulationDrowned() + result.populationDrowned());
    }
}
