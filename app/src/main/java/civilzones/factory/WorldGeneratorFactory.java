package civilzones.factory;

import civilzones.config.WorldConfig;
import civilzones.domain.terrain.HighGroundPatch;
import civilzones.domain.terrain.TileGrid;
import civilzones.domain.world.GeneratedWorld;
import civilzones.domain.world.SpawnResult;
import civilzones.physics.noise.NoiseField;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * Fábrica responsable de la creación procedural de un mundo completo.
 * <p>
 * Orquesta la generación en cascada:
 * <ol>
 * <li>Campo de ruido sembrado (sin estado global).</li>
 * <li>Parcelas de terreno elevado garantizado.</li>
 * <li>Clasificación de cada casilla con el nivel del mar de generación.</li>
 * <li>Búsqueda del punto de aparición del jugador.</li>
 * </ol>
 * Toda la aleatoriedad sale de un único {@link Random} sembrado con la semilla del
 * mundo, así que la misma semilla produce exactamente el mismo mundo, incluidas
 * parcelas, árboles, yacimientos y spawn.
 */
@Slf4j
public class WorldGeneratorFactory {

    public GeneratedWorld createWorld(WorldConfig config) {
        Objects.requireNonNull(config, "La configuración del mundo no puede ser nula.");
        Random random = new Random(config.seed());
        HighGroundPlanner planner = new HighGroundPlanner(config.patchSize(), config.patchesPerArea(), random);
        List<HighGroundPatch> patches = planner.plan(config.width(), config.height());
        return generate(config, patches, planner, random);
    }

    /**
     * Genera un mundo con parcelas elevadas ya decididas (por ejemplo, al regenerar
     * un mapa guardado).
     */
    public GeneratedWorld createWorld(WorldConfig config, List<HighGroundPatch> patches) {
        Objects.requireNonNull(config, "La configuración del mundo no puede ser nula.");
        Objects.requireNonNull(patches, "La lista de parcelas no puede ser nula.");
        Random random = new Random(config.seed());
        HighGroundPlanner planner = new HighGroundPlanner(config.patchSize(), config.patchesPerArea(), random);
        return generate(config, patches, planner, random);
    }

    private GeneratedWorld generate(WorldConfig config, List<HighGroundPatch> patches,
                                    HighGroundPlanner planner, Random random) {
        long startTime = System.currentTimeMillis();

        NoiseField noise = new NoiseField(config.seed(), config.noiseOctaves());
        TerrainClassifier classifier = new TerrainClassifier(noise, config, random);
        TileGrid grid = new TileGrid(config.width(), config.height());

        for (int x = 0; x < config.width(); x++) {
            for (int y = 0; y < config.height(); y++) {
                grid.setTile(x, y, classifier.createTile(x, y, config.seaLevel(), patches, planner));
            }
        }

        SpawnResult spawn = new SpawnPointFinder(random).findSpawnLocation(grid);
        long duration = System.currentTimeMillis() - startTime;

        TerrainStats.LandWaterRatio ratio = TerrainStats.landWaterRatio(grid);
        log.info("Mundo {}x{} generado en {} ms (semilla {}). Tierra {}% / Agua {}%. Parcelas elevadas: {}. Spawn ({}, {}) [{}].",
                config.width(), config.height(), duration, config.seed(),
                ratio.landPercent(), ratio.waterPercent(), patches.size(),
                spawn.x(), spawn.y(), spawn.method());

        return new GeneratedWorld(config.seed(), grid, patches, spawn);
    }
}
