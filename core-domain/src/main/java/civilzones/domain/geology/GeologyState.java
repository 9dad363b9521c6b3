package civilzones.domain.geology;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Estado geológico mutable del mundo.
 * <p>
 * Se crea una única vez al empezar la partida con el objetivo del primer periodo
 * como nivel inicial y solo lo modifican el reloj geológico y la aplicación de
 * resultados de inundación. Debe sobrevivir a un guardado/carga sin pérdidas
 * para reproducir exactamente las inundaciones futuras.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GeologyState {

    private double currentSeaLevel;
    private int periodIndex;
    private int centuriesInPeriod;
    private int lastUpdateYear;
    private String currentPeriodName;

    // --- Contadores acumulados ---
    private long tilesFlooded;
    private long tilesDrained;
    private long populationDrowned;

    /**
     * Estado inicial: primer periodo, sin retardo de transición.
     */
    public static GeologyState initial(GeologicalPeriod firstPeriod) {
        return GeologyState.builder()
                .currentSeaLevel(firstPeriod.targetSeaLevel())
                .periodIndex(0)
                .centuriesInPeriod(0)
                .lastUpdateYear(0)
                .currentPeriodName(firstPeriod.name())
                .build();
    }

    public PeriodCursor cursor() {
        return new PeriodCursor(periodIndex, centuriesInPeriod);
    }

    public void moveTo(PeriodCursor cursor) {
        this.periodIndex = cursor.periodIndex();
        this.centuriesInPeriod = cursor.centuriesInPeriod();
    }
}
