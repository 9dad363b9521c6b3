package civilzones.domain.geology;

/**
 * Resultado de avanzar un siglo el ciclo geológico.
 *
 * @param cursor  Nueva posición en el ciclo.
 * @param crossed {@code true} si en este avance se ha entrado en un periodo nuevo.
 */
public record PeriodAdvance(PeriodCursor cursor, boolean crossed) {
}
