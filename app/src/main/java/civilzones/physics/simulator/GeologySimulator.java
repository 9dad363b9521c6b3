package civilzones.physics.simulator;

import civilzones.config.GeologyConfig;
import civilzones.domain.flood.FloodResult;
import civilzones.domain.geology.GeologicalPeriod;
import civilzones.domain.geology.GeologyState;
import civilzones.domain.settlement.Settlement;
import civilzones.domain.terrain.TileGrid;
import civilzones.physics.flood.FloodEngine;
import civilzones.physics.flood.FloodMessages;
import civilzones.physics.flood.FloodResultApplier;
import civilzones.physics.flood.NarrativeMessage;
import civilzones.physics.geology.GeologyClock;
import civilzones.physics.i.IFloodSolver;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Orquesta el ciclo geológico dentro del bucle de turnos.
 * Facade de alto nivel sobre {@link GeologyClock} y el {@link IFloodSolver}.
 * <p>
 * Cada actualización (una por intervalo de años de juego) avanza un siglo,
 * mueve el nivel del mar un paso, ejecuta la pasada de inundación y aplica su
 * resultado a la población y a las estadísticas.
 */
@Slf4j
public class GeologySimulator {

    @Getter
    private final GeologyClock clock;
    @Getter
    private final TileGrid grid;
    @Getter
    private final Settlement settlement;

    private final IFloodSolver floodSolver;
    private final GeologyEventListener listener;

    public GeologySimulator(GeologyConfig config, TileGrid grid, Settlement settlement) {
        this(new GeologyClock(config), grid, settlement, new FloodEngine(), new LoggingGeologyEventListener());
    }

    public GeologySimulator(GeologyClock clock, TileGrid grid, Settlement settlement,
                            IFloodSolver floodSolver, GeologyEventListener listener) {
        this.clock = Objects.requireNonNull(clock, "El reloj geológico no puede ser nulo.");
        this.grid = Objects.requireNonNull(grid, "La rejilla no puede ser nula.");
        this.settlement = Objects.requireNonNull(settlement, "El asentamiento no puede ser nulo.");
        this.floodSolver = Objects.requireNonNull(floodSolver, "El solver de inundaciones no puede ser nulo.");
        this.listener = Objects.requireNonNull(listener, "El receptor de eventos no puede ser nulo.");

        log.info("GeologySimulator inicializado en '{}' con el mar a {}.",
                clock.getState().getCurrentPeriodName(), clock.getCurrentSeaLevel());
    }

    /**
     * Lleva el ciclo geológico hasta el año de juego indicado.
     *
     * @param currentYear Año de juego actual.
     * @return el resultado de la pasada si ha tocado actualizar, vacío en caso contrario.
     */
    public Optional<FloodResult> advanceToYear(int currentYear) {
        if (!clock.shouldUpdate(currentYear)) {
            return Optional.empty();
        }
        GeologyState state = clock.getState();
        state.setLastUpdateYear(currentYear);

        double previousLevel = clock.getCurrentSeaLevel();

        Optional<GeologicalPeriod> newPeriod = clock.tick();
        newPeriod.ifPresent(period ->
                listener.onPeriodChanged(period, FloodMessages.periodTransition(previousLevel, period)));

        double seaLevel = clock.stepSeaLevel();
        if (FloodMessages.crossesTenth(previousLevel, seaLevel)) {
            listener.onSeaLevelCreep(seaLevel, FloodMessages.watersCreepHigher());
        }

        return Optional.of(runFloodPass(seaLevel));
    }

    /**
     * Ejecuta una pasada con el nivel del mar actual sin avanzar el reloj
     * (por ejemplo, justo después de cargar una partida).
     */
    public FloodResult applyCurrentSeaLevel() {
        return runFloodPass(clock.getCurrentSeaLevel());
    }

    private FloodResult runFloodPass(double seaLevel) {
        FloodResult result = floodSolver.apply(grid, settlement, seaLevel);
        FloodResultApplier.apply(result, clock.getState(), settlement);

        if (result.hasLosses() || result.hasTileChanges()) {
            listener.onFlood(result, messagesFor(result));
        }
        return result;
    }

    private List<NarrativeMessage> messagesFor(FloodResult result) {
        List<NarrativeMessage> messages = new ArrayList<>();
        if (result.populationDrowned() > 0) {
            messages.add(FloodMessages.floodWarning(result, clock.getState().getCurrentPeriodName()));
        }
        if (result.wellsLost() > 0) {
            messages.add(FloodMessages.wellsLost(result.wellsLost()));
        }
        return messages;
    }
}
