package civilzones.factory;

import civilzones.config.WorldConfig;
import civilzones.domain.terrain.HighGroundPatch;
import civilzones.domain.terrain.TerrainType;
import civilzones.domain.terrain.Tile;
import civilzones.domain.terrain.TileResource;
import civilzones.domain.world.Classification;
import civilzones.physics.noise.NoiseField;

import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * Asigna a cada casilla un tipo de terreno y una elevación final mediante una
 * cascada ordenada de umbrales.
 * <p>
 * El orden de las comprobaciones forma parte del contrato:
 * <ol>
 * <li>Montaña (STONE), independiente del nivel del mar: las montañas no se sumergen.</li>
 * <li>Océano profundo: más de 1.5 por debajo del mar.</li>
 * <li>Agua somera: entre 0.5 y 1.5 por debajo del mar.</li>
 * <li>Lago interior: ruido de lagos raro, elevación junto al mar, fuera de parcelas elevadas.</li>
 * <li>Bandas de elevación: SAND, GRASS, FOREST, ROCK, SNOW.</li>
 * <li>Ríos sobre la banda iso del ruido de ríos, salvo agua y parcelas elevadas.</li>
 * </ol>
 */
public class TerrainClassifier {

    // --- Bandas de elevación ---
    private static final double LOWLAND_LIMIT = 7.0;   // GRASS por debajo
    private static final double FOREST_LIMIT = 8.0;    // colinas boscosas
    private static final double ROCK_LIMIT = 9.5;      // laderas de montaña; SNOW por encima

    // --- Márgenes respecto al nivel del mar ---
    private static final double DEEP_OCEAN_DEPTH = 1.5;
    private static final double SHALLOW_WATER_DEPTH = 0.5;
    private static final double LAKE_SHORE_BAND = 0.5;

    private static final int MOUNTAIN_BASE_ELEVATION = 9;
    private static final double MAX_ELEVATION = 10.0;

    private final NoiseField noise;
    private final WorldConfig config;
    private final Random random;

    public TerrainClassifier(NoiseField noise, WorldConfig config, Random random) {
        this.noise = Objects.requireNonNull(noise, "El campo de ruido no puede ser nulo.");
        this.config = Objects.requireNonNull(config, "La configuración del mundo no puede ser nula.");
        this.random = Objects.requireNonNull(random, "El generador aleatorio no puede ser nulo.");
    }

    /**
     * Convierte el ruido de altura (~[0, 1]) en elevación [0, 10] con sesgo ascendente,
     * redondeada a una décima.
     */
    public double calculateElevation(double heightNoise) {
        double elevation = Math.round(heightNoise * 100 + config.elevationBias() * 10) / 10.0;
        return Math.min(MAX_ELEVATION, Math.max(0, elevation));
    }

    public Classification classify(int x, int y, double elevation, double seaLevel,
                                   double heightNoise, boolean isHighGround) {
        double mountainNoise = noise.mountain(x, y);
        double lakeNoise = noise.lake(x, y);
        boolean isRiver = noise.isRiverAt(x, y, config.riverWidth());

        TerrainType type;
        double finalElevation = elevation;

        if (mountainNoise > config.mountainThreshold() && heightNoise > config.mountainHeightMin()) {
            type = TerrainType.STONE;
            // Se sortea en [9, 11) con paso entero y se acota al máximo del dominio
            finalElevation = Math.min(MAX_ELEVATION, MOUNTAIN_BASE_ELEVATION + random.nextInt(2));
        } else if (elevation < seaLevel - DEEP_OCEAN_DEPTH) {
            type = TerrainType.DEEP_OCEAN;
            finalElevation = Math.max(0, elevation);
        } else if (elevation < seaLevel - SHALLOW_WATER_DEPTH) {
            type = TerrainType.WATER;
        } else if (lakeNoise < config.lakeThreshold()
                && elevation >= seaLevel
                && elevation < seaLevel + LAKE_SHORE_BAND
                && !isHighGround) {
            type = TerrainType.WATER;
            finalElevation = seaLevel - SHALLOW_WATER_DEPTH;
        } else {
            type = elevationBand(elevation, seaLevel);
        }

        if (isRiver && type != TerrainType.DEEP_OCEAN && type != TerrainType.WATER
                && type != TerrainType.STONE && !isHighGround) {
            type = TerrainType.RIVER;
            finalElevation = seaLevel;
        }

        return new Classification(type, clampElevation(finalElevation));
    }

    private TerrainType elevationBand(double elevation, double seaLevel) {
        if (elevation <= seaLevel) {
            return TerrainType.SAND;
        } else if (elevation < LOWLAND_LIMIT) {
            return TerrainType.GRASS;
        } else if (elevation < FOREST_LIMIT) {
            return TerrainType.FOREST;
        } else if (elevation < ROCK_LIMIT) {
            return TerrainType.ROCK;
        }
        return TerrainType.SNOW;
    }

    private static double clampElevation(double elevation) {
        return Math.min(MAX_ELEVATION, Math.max(0, elevation));
    }

    /**
     * Crea una casilla completa: elevación, clasificación, árbol y yacimiento de piedra.
     */
    public Tile createTile(int x, int y, double seaLevel, List<HighGroundPatch> patches, HighGroundPlanner planner) {
        double heightNoise = noise.terrain(x, y);
        boolean isHighGround = HighGroundPlanner.isInHighGroundPatch(x, y, patches);

        double elevation = isHighGround
                ? planner.highGroundElevation()
                : calculateElevation(heightNoise);

        Classification terrain = classify(x, y, elevation, seaLevel, heightNoise, isHighGround);
        Tile tile = new Tile(terrain.type(), terrain.elevation());

        tile.setTree(terrain.type().canHaveTree() && random.nextDouble() < config.treeChance());

        if (terrain.type() == TerrainType.STONE) {
            int amount = config.stoneDepositBase() + random.nextInt(Math.max(1, config.stoneDepositRange()));
            tile.setResource(new TileResource(amount, config.stoneMetalYield()));
        }
        return tile;
    }
}
