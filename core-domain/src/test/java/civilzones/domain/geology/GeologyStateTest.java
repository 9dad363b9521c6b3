package civilzones.domain.geology;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@Slf4j
class GeologyStateTest {

    @Test
    @DisplayName("Estado inicial: primer periodo, nivel del mar en su objetivo y contadores a cero")
    void initial_shouldStartAtFirstPeriodTarget() {
        GeologicalPeriod first = new GeologicalPeriod("Interglaciar Cálido", 100, 3.0);

        GeologyState state = GeologyState.initial(first);

        assertEquals(3.0, state.getCurrentSeaLevel(), 0.0);
        assertEquals(PeriodCursor.START, state.cursor());
        assertEquals("Interglaciar Cálido", state.getCurrentPeriodName());
        assertEquals(0, state.getTilesFlooded());
        assertEquals(0, state.getPopulationDrowned());
    }

    @Test
    @DisplayName("Cursor: moveTo actualiza índice y siglos a la vez")
    void moveTo_shouldUpdateCursorFields() {
        GeologyState state = GeologyState.initial(new GeologicalPeriod("A", 3, 2.0));

        state.moveTo(new PeriodCursor(4, 17));

        assertEquals(4, state.getPeriodIndex());
        assertEquals(17, state.getCenturiesInPeriod());
    }

    @Test
    @DisplayName("JSON: el estado sobrevive a un guardado/carga sin pérdidas")
    void jsonRoundTrip_shouldBeExact() throws Exception {
        // ARRANGE
        GeologyState state = GeologyState.builder()
                .currentSeaLevel(2.7)
                .periodIndex(3)
                .centuriesInPeriod(12)
                .lastUpdateYear(4300)
                .currentPeriodName("Deshielo")
                .tilesFlooded(421)
                .tilesDrained(37)
                .populationDrowned(88)
                .build();
        ObjectMapper mapper = new ObjectMapper();

        // ACT
        String json = mapper.writeValueAsString(state);
        log.debug("Estado serializado: {}", json);
        GeologyState restored = mapper.readValue(json, GeologyState.class);

        // ASSERT
        assertEquals(state, restored);
        assertEquals(Double.doubleToLongBits(2.7), Double.doubleToLongBits(restored.getCurrentSeaLevel()));
    }
}
