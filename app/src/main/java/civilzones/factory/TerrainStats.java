package civilzones.factory;

import civilzones.domain.terrain.TerrainType;
import civilzones.domain.terrain.TileGrid;

import java.util.EnumMap;
import java.util.Map;

/**
 * Estadísticas de composición de una rejilla generada.
 */
public final class TerrainStats {

    private TerrainStats() {
    }

    public static Map<TerrainType, Integer> countByType(TileGrid grid) {
        Map<TerrainType, Integer> counts = new EnumMap<>(TerrainType.class);
        grid.forEach((x, y, tile) -> counts.merge(tile.getTerrainType(), 1, Integer::sum));
        return counts;
    }

    /**
     * Porcentajes redondeados de tierra y agua; los ríos cuentan como agua.
     */
    public static LandWaterRatio landWaterRatio(TileGrid grid) {
        int[] water = new int[1];
        grid.forEach((x, y, tile) -> {
            if (tile.getTerrainType().isWaterBody()) {
                water[0]++;
            }
        });
        int total = grid.getWidth() * grid.getHeight();
        int land = total - water[0];
        return new LandWaterRatio(
                (int) Math.round(land * 100.0 / total),
                (int) Math.round(water[0] * 100.0 / total));
    }

    public static long countExplored(TileGrid grid) {
        long[] explored = new long[1];
        grid.forEach((x, y, tile) -> {
            if (tile.isExplored()) {
                explored[0]++;
            }
        });
        return explored[0];
    }

    public record LandWaterRatio(int landPercent, int waterPercent) {
    }
}
