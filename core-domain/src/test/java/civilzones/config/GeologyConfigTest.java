package civilzones.config;

import civilzones.domain.geology.GeologicalPeriod;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GeologyConfigTest {

    @Test
    @DisplayName("Por defecto: seis periodos en el orden del ciclo glacial")
    void defaultGeology_shouldContainSixPeriods() {
        GeologyConfig config = GeologyConfig.getDefaultGeology();

        assertEquals(6, config.periodCount());
        assertEquals(100, config.periodAt(0).duration());
        assertEquals(1.5, config.periodAt(2).targetSeaLevel(), 0.0);
        assertEquals(4.0, config.periodAt(4).targetSeaLevel(), 0.0);
        assertEquals(100, config.updateIntervalYears());
    }

    @Test
    @DisplayName("Validación: una lista de periodos vacía falla en la construcción")
    void emptyPeriods_shouldFailFast() {
        GeologyConfig base = GeologyConfig.getDefaultGeology();

        assertThrows(IllegalArgumentException.class, () -> base.withPeriods(List.of()));
        assertThrows(NullPointerException.class, () -> base.withPeriods(null));
    }

    @Test
    @DisplayName("Validación: cotas invertidas o velocidad no positiva se rechazan")
    void invalidBounds_shouldBeRejected() {
        GeologyConfig base = GeologyConfig.getDefaultGeology();

        assertThrows(IllegalArgumentException.class, () -> base.withSeaLevelMin(7.0));
        assertThrows(IllegalArgumentException.class, () -> base.withChangeRate(0.0));
        assertThrows(IllegalArgumentException.class, () -> base.withUpdateIntervalYears(0));
    }

    @Test
    @DisplayName("Inmutabilidad: la configuración copia la lista de periodos")
    void periods_shouldBeDefensivelyCopied() {
        List<GeologicalPeriod> periods = new ArrayList<>();
        periods.add(new GeologicalPeriod("Único", 10, 3.0));
        GeologyConfig config = GeologyConfig.getDefaultGeology().withPeriods(periods);

        periods.add(new GeologicalPeriod("Intruso", 10, 5.0));

        assertEquals(1, config.periodCount());
        assertThrows(UnsupportedOperationException.class,
                () -> config.periods().add(new GeologicalPeriod("Otro", 1, 1.0)));
    }

    @Test
    @DisplayName("Periodos: la duración debe ser positiva")
    void period_shouldRejectNonPositiveDuration() {
        assertThrows(IllegalArgumentException.class, () -> new GeologicalPeriod("Roto", 0, 3.0));
    }
}
