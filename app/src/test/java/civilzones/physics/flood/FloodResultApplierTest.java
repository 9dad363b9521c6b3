package civilzones.physics.flood;

import civilzones.domain.flood.DestroyedStructure;
import civilzones.domain.flood.FloodResult;
import civilzones.domain.geology.GeologicalPeriod;
import civilzones.domain.geology.GeologyState;
import civilzones.domain.settlement.Settlement;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FloodResultApplierTest {

    private GeologyState state;

    @BeforeEach
    void setUp() {
        state = GeologyState.initial(new GeologicalPeriod("Interglaciar Cálido", 100, 3.0));
    }

    private static FloodResult result(int flooded, int drained, long drowned) {
        return FloodResult.builder()
                .tilesFlooded(flooded)
                .tilesDrained(drained)
                .destroyedStructures(List.of(new DestroyedStructure(0, 0, "RESIDENTIAL", (int) drowned)))
                .populationDrowned(drowned)
                .seaLevel(3.0)
                .build();
    }

    @Test
    @DisplayName("Población: se resta lo ahogado y nunca queda por debajo de cero")
    void apply_shouldClampPopulationAtZero() {
        Settlement settlement = new Settlement(List.of(), 30, null);

        FloodResultApplier.apply(result(4, 0, 45), state, settlement);

        assertEquals(0, settlement.getPopulation());
    }

    @Test
    @DisplayName("Población: una pérdida parcial se descuenta exactamente")
    void apply_shouldSubtractDrowned() {
        Settlement settlement = new Settlement(List.of(), 100, null);

        FloodResultApplier.apply(result(4, 0, 12), state, settlement);

        assertEquals(88, settlement.getPopulation());
    }

    @Test
    @DisplayName("Estadísticas: los contadores geológicos se acumulan entre pasadas")
    void apply_shouldAccumulateCounters() {
        Settlement settlement = new Settlement(List.of(), 100, null);

        FloodResultApplier.apply(result(10, 2, 5), state, settlement);
        FloodResultApplier.apply(result(3, 7, 1), state, settlement);

        assertEquals(13, state.getTilesFlooded());
        assertEquals(9, state.getTilesDrained());
        assertEquals(6, state.getPopulationDrowned());
        assertEquals(3.0, state.getCurrentSeaLevel(), 0.0, "El nivel del mar no es cosa del aplicador.");
    }
}
