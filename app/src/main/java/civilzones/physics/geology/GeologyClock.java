package civilzones.physics.geology;

import civilzones.config.GeologyConfig;
import civilzones.domain.geology.GeologicalPeriod;
import civilzones.domain.geology.GeologyState;
import civilzones.domain.geology.PeriodAdvance;
import civilzones.domain.geology.PeriodCursor;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;
import java.util.Optional;

/**
 * Máquina de estados cíclica sobre la lista de periodos geológicos.
 * <p>
 * Cada tick equivale a un siglo. Cuando los siglos del periodo alcanzan su
 * duración se pasa al siguiente (índice + 1 módulo longitud); no hay estado
 * terminal. Por separado, el nivel del mar se acerca al objetivo del periodo
 * activo a velocidad acotada, lo que reparte las transiciones en varios ticks y
 * permite inundaciones graduales.
 */
@Slf4j
public class GeologyClock {

    /** Precisión a la que se redondea el nivel del mar tras cada paso. */
    private static final double SEA_LEVEL_PRECISION = 10_000.0;

    private final GeologyConfig config;
    @Getter
    private final GeologyState state;

    public GeologyClock(GeologyConfig config) {
        this(config, initialState(config));
    }

    /**
     * Reanuda un reloj a partir de un estado existente (por ejemplo, tras cargar una partida).
     */
    public GeologyClock(GeologyConfig config, GeologyState state) {
        this.config = Objects.requireNonNull(config, "La configuración geológica no puede ser nula.");
        this.state = Objects.requireNonNull(state, "El estado geológico no puede ser nulo.");
        if (state.getPeriodIndex() < 0 || state.getPeriodIndex() >= config.periodCount()) {
            throw new IllegalArgumentException(String.format(
                    "Índice de periodo %d fuera del ciclo de %d periodos.", state.getPeriodIndex(), config.periodCount()));
        }
    }

    private static GeologyState initialState(GeologyConfig config) {
        Objects.requireNonNull(config, "La configuración geológica no puede ser nula.");
        GeologyState initial = GeologyState.initial(config.periodAt(0));
        initial.setCurrentSeaLevel(Math.max(config.seaLevelMin(), Math.min(config.seaLevelMax(), initial.getCurrentSeaLevel())));
        return initial;
    }

    /**
     * Transición pura: avanza un siglo a partir del cursor dado sin tocar el estado.
     */
    public PeriodAdvance advance(PeriodCursor cursor) {
        GeologicalPeriod period = config.periodAt(cursor.periodIndex());
        int centuries = cursor.centuriesInPeriod() + 1;

        if (centuries >= period.duration()) {
            int nextIndex = (cursor.periodIndex() + 1) % config.periodCount();
            return new PeriodAdvance(new PeriodCursor(nextIndex, 0), true);
        }
        return new PeriodAdvance(new PeriodCursor(cursor.periodIndex(), centuries), false);
    }

    /**
     * Avanza un siglo el estado.
     *
     * @return el periodo recién iniciado, o vacío si no ha habido cambio de periodo.
     */
    public Optional<GeologicalPeriod> tick() {
        PeriodAdvance advance = advance(state.cursor());
        state.moveTo(advance.cursor());

        if (!advance.crossed()) {
            return Optional.empty();
        }
        GeologicalPeriod newPeriod = getCurrentPeriod();
        state.setCurrentPeriodName(newPeriod.name());
        log.info("Comienza el periodo geológico '{}' (objetivo del mar {}).", newPeriod.name(), newPeriod.targetSeaLevel());
        return Optional.of(newPeriod);
    }

    /**
     * Acerca el nivel del mar al objetivo del periodo activo un paso.
     *
     * @return el nuevo nivel del mar.
     */
    public double stepSeaLevel() {
        double current = state.getCurrentSeaLevel();
        double next = nextSeaLevel(current, getCurrentPeriod().targetSeaLevel(),
                config.changeRate(), config.seaLevelMin(), config.seaLevelMax());
        state.setCurrentSeaLevel(next);
        if (next != current) {
            log.debug("Nivel del mar {} -> {} ({}).", current, next, state.getCurrentPeriodName());
        }
        return next;
    }

    /**
     * Paso acotado hacia el objetivo: nunca lo sobrepasa y nunca sale de [min, max].
     */
    public static double nextSeaLevel(double current, double target, double rate, double min, double max) {
        double next;
        if (current < target) {
            next = Math.min(target, current + rate);
        } else if (current > target) {
            next = Math.max(target, current - rate);
        } else {
            next = current;
        }
        next = Math.max(min, Math.min(max, next));
        return Math.round(next * SEA_LEVEL_PRECISION) / SEA_LEVEL_PRECISION;
    }

    public GeologicalPeriod getCurrentPeriod() {
        return config.periodAt(state.getPeriodIndex());
    }

    public double getCurrentSeaLevel() {
        return state.getCurrentSeaLevel();
    }

    public SeaLevelTrend getTrend() {
        return SeaLevelTrend.of(state.getCurrentSeaLevel(), getCurrentPeriod().targetSeaLevel());
    }

    /**
     * Indica si desde la última actualización han pasado suficientes años de juego.
     */
    public boolean shouldUpdate(int currentYear) {
        return currentYear - state.getLastUpdateYear() >= config.updateIntervalYears();
    }
}
