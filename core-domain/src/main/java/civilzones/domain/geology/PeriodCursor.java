package civilzones.domain.geology;

/**
 * Posición inmutable dentro del ciclo de periodos geológicos.
 *
 * @param periodIndex       Índice del periodo activo.
 * @param centuriesInPeriod Siglos transcurridos dentro del periodo activo.
 */
public record PeriodCursor(int periodIndex, int centuriesInPeriod) {

    public static final PeriodCursor START = new PeriodCursor(0, 0);

    public PeriodCursor {
        if (periodIndex < 0 || centuriesInPeriod < 0) {
            throw new IllegalArgumentException("El cursor geológico no admite valores negativos.");
        }
    }
}
