package civilzones.physics.noise;

import lombok.Getter;

/**
 * Ruido de valor 2D determinista con combinación fractal (FBM).
 * <p>
 * La semilla vive en la instancia en lugar de en un estado global: cada
 * generación construye su propio campo y lo pasa explícitamente a quien lo
 * necesite. Todas las operaciones son funciones puras de (semilla, x, y).
 * Se usa {@link StrictMath} para que los valores sean idénticos entre
 * ejecuciones y plataformas.
 */
public final class NoiseField {

    /**
     * Techo empírico con el que se normaliza el FBM.
     */
    public static final double FBM_AMPLITUDE_CEILING = 1.8;
    public static final int DEFAULT_OCTAVES = 5;
    public static final double DEFAULT_RIVER_WIDTH = 0.015;

    /**
     * Módulo primo con el que la semilla se reduce a un desplazamiento pequeño.
     * Un {@code long} grande sumado tal cual al argumento del seno pierde los
     * bits bajos y semillas vecinas darían el mismo campo.
     */
    static final long SEED_MODULUS = 1_000_003L;

    @Getter
    private final long seed;
    private final double seedOffset;
    private final int octaves;

    public NoiseField(long seed) {
        this(seed, DEFAULT_OCTAVES);
    }

    public NoiseField(long seed, int octaves) {
        if (octaves <= 0) {
            throw new IllegalArgumentException("El ruido necesita al menos una octava.");
        }
        this.seed = seed;
        this.seedOffset = seedOffset(seed);
        this.octaves = octaves;
    }

    /**
     * Reduce la semilla a [0, {@link #SEED_MODULUS}). Semillas consecutivas dan
     * siempre desplazamientos distintos y las semillas en [0, módulo) se
     * conservan tal cual.
     */
    static double seedOffset(long seed) {
        return Math.floorMod(seed, SEED_MODULUS);
    }

    // --- PRIMITIVAS ---

    /**
     * Hash pseudoaleatorio de un vértice de la red entera.
     *
     * @return un valor en [0, 1).
     */
    public double hash(double x, double y) {
        double h = StrictMath.sin(x * 12.98 + y * 78.23 + seedOffset) * 43758.54;
        double fract = h - Math.floor(h);
        // fract puede redondear a 1.0 cuando h es un negativo diminuto
        return fract >= 1.0 ? 0.0 : fract;
    }

    public static double mix(double a, double b, double t) {
        return a * (1 - t) + b * t;
    }

    /**
     * Interpolación bilineal de los cuatro vértices con suavizado smoothstep.
     */
    public double valueNoise(double x, double y) {
        double i = Math.floor(x);
        double j = Math.floor(y);
        double fx = x - i;
        double fy = y - j;

        double ux = fx * fx * (3 - 2 * fx);
        double uy = fy * fy * (3 - 2 * fy);

        double a = hash(i, j);
        double b = hash(i + 1, j);
        double c = hash(i, j + 1);
        double d = hash(i + 1, j + 1);

        return mix(mix(a, b, ux), mix(c, d, ux), uy);
    }

    /**
     * Movimiento browniano fraccional: suma de octavas a frecuencia doble y amplitud mitad.
     */
    public double fbm(double x, double y, int octaves) {
        double total = 0;
        double amplitude = 0.5;
        double px = x;
        double py = y;

        for (int i = 0; i < octaves; i++) {
            total += valueNoise(px, py) * amplitude;
            px *= 2;
            py *= 2;
            amplitude *= 0.5;
        }
        return total;
    }

    /**
     * FBM reescalado aproximadamente a [0, 1].
     */
    public double fbmNormalized(double x, double y, int octaves) {
        return fbm(x, y, octaves) / FBM_AMPLITUDE_CEILING;
    }

    public double fbmNormalized(double x, double y) {
        return fbmNormalized(x, y, octaves);
    }

    // --- CAMPOS DERIVADOS ---

    public double sample(NoiseLayer layer, double x, double y) {
        return fbmNormalized(x * layer.getFrequency() + layer.getOffset(),
                y * layer.getFrequency() + layer.getOffset());
    }

    public double terrain(double x, double y) {
        return sample(NoiseLayer.TERRAIN, x, y);
    }

    public double ocean(double x, double y) {
        return sample(NoiseLayer.OCEAN, x, y);
    }

    public double lake(double x, double y) {
        return sample(NoiseLayer.LAKE, x, y);
    }

    public double mountain(double x, double y) {
        return sample(NoiseLayer.MOUNTAIN, x, y);
    }

    public double river(double x, double y) {
        return sample(NoiseLayer.RIVER, x, y);
    }

    /**
     * Un punto es río si el ruido de ríos cae dentro de la banda iso alrededor de 0.5.
     */
    public boolean isRiverAt(double x, double y, double width) {
        return Math.abs(river(x, y) - 0.5) < width;
    }

    public boolean isRiverAt(double x, double y) {
        return isRiverAt(x, y, DEFAULT_RIVER_WIDTH);
    }

    /**
     * Ruido con parámetros arbitrarios; el desplazamiento se aplica antes de escalar.
     */
    public double customNoise(double x, double y, double frequency, int octaves, double offsetX, double offsetY) {
        return fbmNormalized((x + offsetX) * frequency, (y + offsetY) * frequency, octaves);
    }
}
