package civilzones.config;

import civilzones.domain.geology.GeologicalPeriod;
import lombok.Builder;
import lombok.With;

import java.util.List;
import java.util.Objects;

/**
 * Configuración inmutable del ciclo geológico y del sistema de elevación.
 * <p>
 * La lista de periodos es cíclica: tras el último se vuelve al índice 0.
 * Una lista vacía es un error de programación y se rechaza en construcción.
 *
 * @param periods              Periodos geológicos en orden de aparición.
 * @param updateIntervalYears  Años de juego entre dos ticks geológicos (un tick = un siglo).
 * @param seaLevelMin          Cota inferior del nivel del mar.
 * @param seaLevelMax          Cota superior del nivel del mar.
 * @param changeRate           Variación máxima del nivel del mar por tick.
 * @param floodWarningMargin   Margen sobre el nivel del mar considerado zona de riesgo.
 * @param costThreshold        Elevación a partir de la cual construir encarece.
 * @param costIncreasePerLevel Incremento relativo del coste por cada nivel sobre el umbral.
 */
@Builder
@With
public record GeologyConfig(
        List<GeologicalPeriod> periods,
        int updateIntervalYears,
        double seaLevelMin,
        double seaLevelMax,
        double changeRate,
        double floodWarningMargin,
        double costThreshold,
        double costIncreasePerLevel
) {

    public GeologyConfig {
        Objects.requireNonNull(periods, "La lista de periodos geológicos no puede ser nula.");
        if (periods.isEmpty()) {
            throw new IllegalArgumentException("Se necesita al menos un periodo geológico.");
        }
        if (seaLevelMin > seaLevelMax) {
            throw new IllegalArgumentException(
                    String.format("Cotas del nivel del mar inválidas: min %.2f > max %.2f.", seaLevelMin, seaLevelMax));
        }
        if (changeRate <= 0) {
            throw new IllegalArgumentException("La velocidad de cambio del nivel del mar debe ser positiva.");
        }
        if (updateIntervalYears <= 0) {
            throw new IllegalArgumentException("El intervalo de actualización geológica debe ser positivo.");
        }
        periods = List.copyOf(periods);
    }

    /**
     * Ciclo glacial por defecto, inspirado en los ciclos reales de glaciaciones.
     */
    public static GeologyConfig getDefaultGeology() {
        return GeologyConfig.builder()
                .periods(List.of(
                        new GeologicalPeriod("Interglaciar Cálido", 100, 3.0),   // 10.000 años templados
                        new GeologicalPeriod("Glaciación Temprana", 50, 2.5),    // 5.000 años de enfriamiento
                        new GeologicalPeriod("Máximo Glacial", 80, 1.5),         // 8.000 años de hielo
                        new GeologicalPeriod("Deshielo", 30, 3.5),               // 3.000 años de fusión
                        new GeologicalPeriod("Periodo de Inundaciones", 20, 4.0),
                        new GeologicalPeriod("Estabilización", 50, 3.0)))
                .updateIntervalYears(100)
                .seaLevelMin(1.0)
                .seaLevelMax(6.0)
                .changeRate(0.1)
                .floodWarningMargin(1.0)
                .costThreshold(4.0)
                .costIncreasePerLevel(0.10)
                .build();
    }

    public GeologicalPeriod periodAt(int index) {
        return periods.get(index);
    }

    public int periodCount() {
        return periods.size();
    }
}
