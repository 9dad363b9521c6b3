package civilzones.physics.simulator;

import civilzones.config.GeologyConfig;
import civilzones.domain.flood.DestroyedStructure;
import civilzones.domain.flood.FloodResult;
import civilzones.domain.geology.GeologicalPeriod;
import civilzones.domain.settlement.Building;
import civilzones.domain.settlement.BuildingType;
import civilzones.domain.settlement.Settlement;
import civilzones.domain.terrain.TerrainType;
import civilzones.domain.terrain.Tile;
import civilzones.domain.terrain.TileGrid;
import civilzones.physics.flood.NarrativeMessage;
import civilzones.physics.geology.GeologyClock;
import civilzones.physics.i.IFloodSolver;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Test unitario para GeologySimulator.
 * <p>
 * El solver de inundaciones y el receptor de eventos se simulan para comprobar
 * solo la orquestación del turno geológico.
 */
@Slf4j
@ExtendWith(MockitoExtension.class)
class GeologySimulatorTest {

    @Mock
    private IFloodSolver mockSolver;
    @Mock
    private GeologyEventListener mockListener;
    @Captor
    private ArgumentCaptor<List<NarrativeMessage>> messagesCaptor;

    private TileGrid grid;
    private Settlement settlement;

    @BeforeEach
    void setUp() {
        grid = new TileGrid(4, 4);
        grid.forEach((x, y, tile) -> grid.setTile(x, y, new Tile(TerrainType.GRASS, 5.0)));
        settlement = new Settlement(new ArrayList<>(), 100, null);
    }

    private GeologySimulator simulatorWith(GeologyConfig config) {
        return new GeologySimulator(new GeologyClock(config), grid, settlement, mockSolver, mockListener);
    }

    // --------------------------------------------------------------------------
    // TEST 1: Intervalo de actualización
    // --------------------------------------------------------------------------

    @Test
    @DisplayName("advanceToYear no hace nada hasta que pasa el intervalo geológico")
    void advanceToYear_beforeInterval_shouldDoNothing() {
        GeologySimulator simulator = simulatorWith(GeologyConfig.getDefaultGeology());

        Optional<FloodResult> result = simulator.advanceToYear(99);

        assertTrue(result.isEmpty());
        verifyNoInteractions(mockSolver, mockListener);
        assertEquals(0, simulator.getClock().getState().getCenturiesInPeriod());
    }

    // --------------------------------------------------------------------------
    // TEST 2: Delegación al solver y aplicación del resultado
    // --------------------------------------------------------------------------

    @Test
    @DisplayName("advanceToYear debe delegar en el solver y aplicar pérdidas y mensajes")
    void advanceToYear_shouldApplySolverResult() {
        // ARRANGE
        FloodResult losses = FloodResult.builder()
                .tilesFlooded(6)
                .destroyedStructures(List.of(
                        new DestroyedStructure(1, 1, "RESIDENTIAL", 30),
                        new DestroyedStructure(2, 2, "WELL", 0)))
                .populationDrowned(30)
                .wellsLost(1)
                .seaLevel(3.0)
                .build();
        when(mockSolver.apply(same(grid), same(settlement), anyDouble())).thenReturn(losses);
        GeologySimulator simulator = simulatorWith(GeologyConfig.getDefaultGeology());

        // ACT
        Optional<FloodResult> result = simulator.advanceToYear(100);

        // ASSERT
        assertTrue(result.isPresent());
        verify(mockSolver, times(1)).apply(grid, settlement, 3.0);
        assertEquals(70, settlement.getPopulation());
        assertEquals(100, simulator.getClock().getState().getLastUpdateYear());
        assertEquals(6, simulator.getClock().getState().getTilesFlooded());
        assertEquals(30, simulator.getClock().getState().getPopulationDrowned());

        verify(mockListener).onFlood(eq(losses), messagesCaptor.capture());
        List<NarrativeMessage> messages = messagesCaptor.getValue();
        assertEquals(2, messages.size());
        assertThat(messages.get(0).text()).contains("30 ahogados");
        assertThat(messages.get(1).text()).contains("pozo");
        verify(mockListener, never()).onPeriodChanged(any(), any());
    }

    @Test
    @DisplayName("Un resultado sin pérdidas ni cambios no se notifica")
    void advanceToYear_quietPass_shouldNotNotifyFlood() {
        when(mockSolver.apply(any(), any(), anyDouble())).thenReturn(FloodResult.empty(3.0));
        GeologySimulator simulator = simulatorWith(GeologyConfig.getDefaultGeology());

        simulator.advanceToYear(100);

        verify(mockListener, never()).onFlood(any(), any());
        assertEquals(100, settlement.getPopulation());
    }

    // --------------------------------------------------------------------------
    // TEST 3: Cambio de periodo y subida del mar
    // --------------------------------------------------------------------------

    @Test
    @DisplayName("Un cambio de periodo se anuncia antes de mover el nivel del mar")
    void advanceToYear_periodBoundary_shouldNotifyListener() {
        // ARRANGE
        GeologyConfig config = GeologyConfig.getDefaultGeology().withPeriods(List.of(
                new GeologicalPeriod("Estabilización", 1, 3.0),
                new GeologicalPeriod("Periodo de Inundaciones", 20, 4.0)));
        when(mockSolver.apply(any(), any(), anyDouble())).thenAnswer(inv -> FloodResult.empty(inv.<Double>getArgument(2)));
        GeologySimulator simulator = simulatorWith(config);

        // ACT
        Optional<FloodResult> result = simulator.advanceToYear(100);

        // ASSERT
        ArgumentCaptor<NarrativeMessage> periodMessage = ArgumentCaptor.forClass(NarrativeMessage.class);
        verify(mockListener).onPeriodChanged(eq(config.periodAt(1)), periodMessage.capture());
        assertThat(periodMessage.getValue().text()).contains("Periodo de Inundaciones").contains("suben");

        verify(mockListener).onSeaLevelCreep(eq(3.1), any(NarrativeMessage.class));
        verify(mockSolver).apply(grid, settlement, 3.1);
        assertEquals(3.1, result.orElseThrow().seaLevel(), 0.0);
    }

    @Test
    @DisplayName("Las bajadas del mar no producen aviso de subida")
    void advanceToYear_recedingSea_shouldNotCreep() {
        GeologyConfig config = GeologyConfig.getDefaultGeology().withPeriods(List.of(
                new GeologicalPeriod("Máximo Glacial", 80, 1.5)));
        when(mockSolver.apply(any(), any(), anyDouble())).thenAnswer(inv -> FloodResult.empty(inv.<Double>getArgument(2)));
        GeologySimulator simulator = simulatorWith(config);
        simulator.getClock().getState().setCurrentSeaLevel(3.0);

        simulator.advanceToYear(100);

        verify(mockListener, never()).onSeaLevelCreep(anyDouble(), any());
        assertEquals(2.9, simulator.getClock().getCurrentSeaLevel(), 0.0);
    }

    // --------------------------------------------------------------------------
    // TEST 4: Pasada sin avanzar el reloj
    // --------------------------------------------------------------------------

    @Test
    @DisplayName("applyCurrentSeaLevel ejecuta una pasada sin avanzar el ciclo")
    void applyCurrentSeaLevel_shouldNotTickClock() {
        when(mockSolver.apply(any(), any(), anyDouble())).thenReturn(FloodResult.empty(3.0));
        GeologySimulator simulator = simulatorWith(GeologyConfig.getDefaultGeology());

        simulator.applyCurrentSeaLevel();

        verify(mockSolver).apply(grid, settlement, 3.0);
        assertEquals(0, simulator.getClock().getState().getCenturiesInPeriod());
        assertEquals(0, simulator.getClock().getState().getLastUpdateYear());
    }

    // --------------------------------------------------------------------------
    // TEST 5: Integración con el motor real
    // --------------------------------------------------------------------------

    @Test
    @DisplayName("Con el motor real, un mar creciente acaba ahogando la costa habitada")
    void realEngine_risingSea_shouldDrownCoastalHouse() {
        // ARRANGE
        for (int x = 0; x < 2; x++) {
            for (int y = 0; y < 2; y++) {
                grid.setTile(x, y, new Tile(TerrainType.SAND, 3.05));
            }
        }
        settlement.addBuilding(new Building(BuildingType.RESIDENTIAL, 0, 0, 25));
        GeologyConfig config = GeologyConfig.getDefaultGeology().withPeriods(List.of(
                new GeologicalPeriod("Interglaciar Cálido", 2, 3.0),
                new GeologicalPeriod("Deshielo", 30, 3.5)));
        GeologySimulator simulator = new GeologySimulator(config, grid, settlement);

        // ACT
        List<FloodResult> results = new ArrayList<>();
        for (int year = 100; year <= 500; year += 100) {
            simulator.advanceToYear(year).ifPresent(results::add);
        }

        // ASSERT
        assertEquals(5, results.size());
        assertEquals(0, results.get(0).populationDrowned(), "A 3.0 la casa sigue seca.");
        assertEquals(25, results.get(1).populationDrowned(), "A 3.1 el mar supera 3.05.");
        assertEquals(75, settlement.getPopulation());
        assertTrue(settlement.getBuildings().isEmpty());
        assertEquals(4, simulator.getClock().getState().getTilesFlooded());
        assertEquals(3.4, simulator.getClock().getCurrentSeaLevel(), 0.0);
        assertEquals("Deshielo", simulator.getClock().getState().getCurrentPeriodName());
    }
}
