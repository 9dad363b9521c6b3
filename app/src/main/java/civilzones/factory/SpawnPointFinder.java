package civilzones.factory;

import civilzones.domain.terrain.Tile;
import civilzones.domain.terrain.TileGrid;
import civilzones.domain.world.SpawnMethod;
import civilzones.domain.world.SpawnResult;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.Random;

/**
 * Busca un punto de aparición seguro para el jugador.
 * <p>
 * La búsqueda se degrada por fases: zona central, mapa completo, barrido de
 * emergencia y, como último recurso, el centro del mapa sin comprobar nada.
 * Usa el mismo generador aleatorio sembrado que el resto de la generación.
 */
@Slf4j
public class SpawnPointFinder {

    private static final int CENTER_RADIUS = 40;
    private static final int CENTER_MIN_REACHABLE = 60;
    private static final int CENTER_ATTEMPTS = 100;
    private static final int WIDE_MIN_REACHABLE = 30;
    private static final int WIDE_ATTEMPTS = 500;
    private static final int REACHABLE_SEARCH_LIMIT = 200;

    private final Random random;

    public SpawnPointFinder(Random random) {
        this.random = Objects.requireNonNull(random, "El generador aleatorio no puede ser nulo.");
    }

    public SpawnResult findSpawnLocation(TileGrid grid) {
        int centerX = grid.getWidth() / 2;
        int centerY = grid.getHeight() / 2;

        SpawnResult spawn = findCenterSpawn(grid, centerX, centerY);
        if (spawn != null) {
            log.debug("Spawn del jugador en ({}, {}) mediante búsqueda central.", spawn.x(), spawn.y());
            return spawn;
        }

        spawn = findWideSpawn(grid);
        if (spawn != null) {
            log.debug("Spawn del jugador en ({}, {}) mediante búsqueda amplia.", spawn.x(), spawn.y());
            return spawn;
        }

        log.warn("Sin spawn en las búsquedas aleatorias; se recorre el mapa completo.");
        spawn = findEmergencySpawn(grid);
        if (spawn != null) {
            return spawn;
        }

        log.warn("No existe ninguna casilla válida para el spawn. Se fuerza el centro ({}, {}).", centerX, centerY);
        return new SpawnResult(centerX, centerY, SpawnMethod.FORCED, 0);
    }

    private SpawnResult findCenterSpawn(TileGrid grid, int centerX, int centerY) {
        for (int attempt = 0; attempt < CENTER_ATTEMPTS; attempt++) {
            int x = (int) Math.floor(centerX + (random.nextDouble() - 0.5) * CENTER_RADIUS);
            int y = (int) Math.floor(centerY + (random.nextDouble() - 0.5) * CENTER_RADIUS);
            if (isValidSpawnPosition(grid, x, y)) {
                int reachable = countReachableTiles(grid, x, y, REACHABLE_SEARCH_LIMIT);
                if (reachable >= CENTER_MIN_REACHABLE) {
                    return new SpawnResult(x, y, SpawnMethod.CENTER, reachable);
                }
            }
        }
        return null;
    }

    private SpawnResult findWideSpawn(TileGrid grid) {
        for (int attempt = 0; attempt < WIDE_ATTEMPTS; attempt++) {
            int x = random.nextInt(grid.getWidth());
            int y = random.nextInt(grid.getHeight());
            if (isValidSpawnPosition(grid, x, y)) {
                int reachable = countReachableTiles(grid, x, y, REACHABLE_SEARCH_LIMIT);
                if (reachable >= WIDE_MIN_REACHABLE) {
                    return new SpawnResult(x, y, SpawnMethod.WIDE, reachable);
                }
            }
        }
        return null;
    }

    private SpawnResult findEmergencySpawn(TileGrid grid) {
        for (int x = 0; x < grid.getWidth(); x++) {
            for (int y = 0; y < grid.getHeight(); y++) {
                if (isValidSpawnPosition(grid, x, y)) {
                    return new SpawnResult(x, y, SpawnMethod.EMERGENCY, 1);
                }
            }
        }
        return null;
    }

    public static boolean isValidSpawnPosition(TileGrid grid, int x, int y) {
        Tile tile = grid.getTile(x, y);
        return tile != null && tile.getTerrainType().isSpawnable();
    }

    /**
     * Cuenta, con un relleno en anchura, las casillas de tierra alcanzables desde
     * (startX, startY), deteniéndose al llegar a {@code maxTiles}.
     */
    public static int countReachableTiles(TileGrid grid, int startX, int startY, int maxTiles) {
        boolean[][] seen = new boolean[grid.getWidth()][grid.getHeight()];
        Deque<int[]> queue = new ArrayDeque<>();
        queue.add(new int[]{startX, startY});
        int count = 0;

        while (!queue.isEmpty() && count < maxTiles) {
            int[] current = queue.poll();
            int cx = current[0];
            int cy = current[1];

            Tile tile = grid.getTile(cx, cy);
            if (tile == null || seen[cx][cy] || !tile.getTerrainType().isReachable()) {
                continue;
            }
            seen[cx][cy] = true;
            count++;

            queue.add(new int[]{cx + 1, cy});
            queue.add(new int[]{cx - 1, cy});
            queue.add(new int[]{cx, cy + 1});
            queue.add(new int[]{cx, cy - 1});
        }
        return count;
    }

    /**
     * Marca como exploradas las casillas de un cuadrado de radio dado.
     *
     * @return número de casillas que no estaban exploradas.
     */
    public static int exploreArea(TileGrid grid, int centerX, int centerY, int radius) {
        int explored = 0;
        for (int dx = -radius; dx <= radius; dx++) {
            for (int dy = -radius; dy <= radius; dy++) {
                Tile tile = grid.getTile(centerX + dx, centerY + dy);
                if (tile != null && !tile.isExplored()) {
                    tile.setExplored(true);
                    explored++;
                }
            }
        }
        return explored;
    }
}
