package civilzones.domain.geology;

import java.util.Objects;

/**
 * Fase geológica con nombre, duración en siglos y nivel del mar objetivo.
 *
 * @param name           Nombre narrativo del periodo (ej: "Máximo Glacial").
 * @param duration       Siglos que dura el periodo antes de avanzar al siguiente (> 0).
 * @param targetSeaLevel Nivel del mar hacia el que tiende el océano durante el periodo.
 */
public record GeologicalPeriod(String name, int duration, double targetSeaLevel) {

    public GeologicalPeriod {
        Objects.requireNonNull(name, "El nombre del periodo no puede ser nulo.");
        if (duration <= 0) {
            throw new IllegalArgumentException("La duración del periodo '" + name + "' debe ser positiva.");
        }
    }
}
