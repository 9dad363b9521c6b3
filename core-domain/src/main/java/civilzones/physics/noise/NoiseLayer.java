package civilzones.physics.noise;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Campos de ruido derivados del mismo primitivo.
 * <p>
 * Cada capa aplica su propia frecuencia y un desplazamiento constante grande a
 * las coordenadas. El desplazamiento solo sirve para descorrelacionar capas que,
 * con la misma frecuencia, serían espacialmente idénticas.
 */
@Getter
@RequiredArgsConstructor
public enum NoiseLayer {
    TERRAIN(0.02, 0.0),
    OCEAN(0.008, 0.0),
    LAKE(0.08, 500.0),
    MOUNTAIN(0.015, 1000.0),
    RIVER(0.05, 100.0);

    private final double frequency;
    private final double offset;
}
