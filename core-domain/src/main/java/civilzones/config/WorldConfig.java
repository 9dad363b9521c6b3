package civilzones.config;

import lombok.Builder;
import lombok.With;

/**
 * Objeto de valor inmutable con todos los parámetros necesarios para la
 * generación procedural de un mundo.
 * <p>
 * Agrupa dimensiones, semilla, nivel del mar de generación y los umbrales de la
 * cascada de clasificación del terreno. Los valores por defecto reproducen el
 * mundo del juego original.
 *
 * @param width              Ancho del mapa en casillas (> 0).
 * @param height             Alto del mapa en casillas (> 0).
 * @param seed               Semilla del ruido y del generador aleatorio, para mundos reproducibles.
 * @param seaLevel           Nivel del mar usado durante la clasificación inicial.
 * @param patchSize          Lado (en casillas) de cada parcela de terreno elevado.
 * @param patchesPerArea     Superficie (en casillas) por cada parcela elevada garantizada.
 * @param elevationBias      Sesgo ascendente de la elevación (2.5 implica más tierra alta).
 * @param riverWidth         Semiancho de la banda iso del ruido de ríos alrededor de 0.5.
 * @param mountainThreshold  Umbral del ruido de montaña a partir del cual se fuerza STONE.
 * @param mountainHeightMin  Ruido de altura mínimo para que una montaña pueda aparecer.
 * @param lakeThreshold      Umbral del ruido de lagos (valores bajos = lagos muy raros).
 * @param treeChance         Probabilidad de árbol en GRASS, FOREST y SNOW.
 * @param noiseOctaves       Número de octavas del FBM.
 * @param stoneDepositBase   Cantidad mínima de piedra de un yacimiento de montaña.
 * @param stoneDepositRange  Rango aleatorio añadido a la cantidad mínima.
 * @param stoneMetalYield    Fracción de metal que rinde la piedra extraída.
 */
@Builder
@With
public record WorldConfig(
        // --- Dimensiones y Semilla ---
        int width,
        int height,
        long seed,
        double seaLevel,

        // --- Parcelas de Terreno Elevado ---
        int patchSize,
        int patchesPerArea,

        // --- Cascada de Clasificación ---
        double elevationBias,
        double riverWidth,
        double mountainThreshold,
        double mountainHeightMin,
        double lakeThreshold,
        double treeChance,
        int noiseOctaves,

        // --- Recursos ---
        int stoneDepositBase,
        int stoneDepositRange,
        double stoneMetalYield
) {

    public WorldConfig {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException(
                    String.format("Las dimensiones del mapa deben ser positivas (recibido %dx%d).", width, height));
        }
        if (patchSize <= 0 || patchesPerArea <= 0) {
            throw new IllegalArgumentException("El tamaño y la densidad de las parcelas elevadas deben ser positivos.");
        }
        if (noiseOctaves <= 0) {
            throw new IllegalArgumentException("El ruido necesita al menos una octava.");
        }
    }

    /**
     * Mundo estándar de partida (128x128) con los umbrales del juego original.
     */
    public static WorldConfig getDefaultWorld() {
        return WorldConfig.builder()
                .width(128)
                .height(128)
                .seed(1L)
                .seaLevel(3.0)
                .patchSize(8)
                .patchesPerArea(2500)
                .elevationBias(2.5)
                .riverWidth(0.015)
                .mountainThreshold(0.68)
                .mountainHeightMin(0.55)
                .lakeThreshold(0.03)
                .treeChance(0.2)
                .noiseOctaves(5)
                .stoneDepositBase(1_000_000)
                .stoneDepositRange(500_000)
                .stoneMetalYield(0.2)
                .build();
    }

    /**
     * Mundo reducido (64x64, semilla 42) pensado para pruebas.
     */
    public static WorldConfig getTestingWorld() {
        return getDefaultWorld()
                .withWidth(64)
                .withHeight(64)
                .withSeed(42L);
    }
}
