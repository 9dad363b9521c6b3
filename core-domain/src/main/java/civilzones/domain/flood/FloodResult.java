package civilzones.domain.flood;

import lombok.Builder;

import java.util.List;
import java.util.Objects;

/**
 * Resumen inmutable de una pasada de inundación.
 * <p>
 * Se produce nuevo en cada tick geológico y se entrega a los colaboradores
 * externos (población, interfaz). No se persiste.
 *
 * @param tilesFlooded        Casillas que han pasado a ser agua.
 * @param tilesDrained        Casillas de agua que han vuelto a ser tierra.
 * @param destroyedStructures Estructuras perdidas, cada una registrada una sola vez.
 * @param populationDrowned   Población total ahogada en la pasada.
 * @param wellsLost           Pozos tragados por el mar.
 * @param playerDrowned       {@code true} si la casilla del jugador se ha inundado.
 * @param seaLevel            Nivel del mar con el que se evaluó la pasada.
 */
@Builder
public record FloodResult(
        int tilesFlooded,
        int tilesDrained,
        List<DestroyedStructure> destroyedStructures,
        long populationDrowned,
        int wellsLost,
        boolean playerDrowned,
        double seaLevel
) {

    public FloodResult {
        Objects.requireNonNull(destroyedStructures, "La lista de estructuras destruidas no puede ser nula.");
        if (populationDrowned < 0) {
            throw new IllegalArgumentException("La población ahogada no puede ser negativa.");
        }
        destroyedStructures = List.copyOf(destroyedStructures);
    }

    public static FloodResult empty(double seaLevel) {
        return new FloodResult(0, 0, List.of(), 0, 0, false, seaLevel);
    }

    public boolean hasLosses() {
        return populationDrowned > 0 || !destroyedStructures.isEmpty() || playerDrowned;
    }

    public boolean hasTileChanges() {
        return tilesFlooded > 0 || tilesDrained > 0;
    }

    public FloodSeverity severity() {
        return FloodSeverity.fromPopulationLost(populationDrowned);
    }
}
