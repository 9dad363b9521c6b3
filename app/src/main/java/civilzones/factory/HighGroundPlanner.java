package civilzones.factory;

import civilzones.domain.terrain.HighGroundPatch;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * Reparte por el mapa una cuota de parcelas cuadradas de terreno elevado.
 * <p>
 * Sus casillas se fuerzan a una elevación en [7.0, 8.5], por encima de cualquier
 * objetivo realista del nivel del mar, de forma que siempre exista suelo
 * edificable a salvo de inundaciones sea cual sea el resultado del ruido.
 * No se comprueba el solapamiento entre parcelas; es raro y está permitido.
 */
public class HighGroundPlanner {

    public static final double MIN_SAFE_ELEVATION = 7.0;
    public static final double MAX_SAFE_ELEVATION = 8.5;

    /** Margen respecto al borde del mapa para los orígenes de parcela. */
    private static final int EDGE_MARGIN = 5;

    private final int patchSize;
    private final int patchesPerArea;
    private final Random random;

    public HighGroundPlanner(int patchSize, int patchesPerArea, Random random) {
        if (patchSize <= 0 || patchesPerArea <= 0) {
            throw new IllegalArgumentException("El tamaño y la densidad de las parcelas deben ser positivos.");
        }
        this.patchSize = patchSize;
        this.patchesPerArea = patchesPerArea;
        this.random = Objects.requireNonNull(random, "El generador aleatorio no puede ser nulo.");
    }

    /**
     * Genera floor(W·H / patchesPerArea) parcelas con origen lejos de los bordes.
     */
    public List<HighGroundPatch> plan(int width, int height) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Las dimensiones del mapa deben ser positivas.");
        }
        int count = (int) (((long) width * height) / patchesPerArea);
        List<HighGroundPatch> patches = new ArrayList<>(count);

        for (int i = 0; i < count; i++) {
            int px = randomOrigin(width);
            int py = randomOrigin(height);
            patches.add(new HighGroundPatch(px, py, patchSize));
        }
        return patches;
    }

    private int randomOrigin(int dimension) {
        int span = dimension - patchSize - 2 * EDGE_MARGIN;
        if (span <= 0) {
            // Mapa demasiado pequeño para el margen: se centra la parcela.
            return Math.max(0, (dimension - patchSize) / 2);
        }
        return random.nextInt(span) + EDGE_MARGIN;
    }

    /**
     * Pertenencia por recorrido lineal; solo se usa una vez por casilla durante la generación.
     */
    public static boolean isInHighGroundPatch(int x, int y, List<HighGroundPatch> patches) {
        for (HighGroundPatch patch : patches) {
            if (patch.contains(x, y)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Elevación uniforme en [7.0, 8.5] para una casilla de parcela elevada.
     */
    public double highGroundElevation() {
        return MIN_SAFE_ELEVATION + random.nextDouble() * (MAX_SAFE_ELEVATION - MIN_SAFE_ELEVATION);
    }
}
