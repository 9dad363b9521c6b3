package civilzones.physics.flood;

import civilzones.domain.flood.DestroyedStructure;
import civilzones.domain.flood.FloodResult;
import civilzones.domain.settlement.Building;
import civilzones.domain.settlement.BuildingType;
import civilzones.domain.settlement.Settlement;
import civilzones.domain.terrain.TerrainType;
import civilzones.domain.terrain.Tile;
import civilzones.domain.terrain.TileGrid;
import civilzones.physics.flood.FloodPlan.GridCoordinate;
import civilzones.physics.i.IFloodSolver;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Pasada completa de inundación y drenaje sobre la rejilla.
 * <p>
 * Compara la elevación fija de cada casilla con el nivel del mar actual:
 * <ul>
 * <li><b>Inundación:</b> elevación &lt; mar y la casilla no es ya agua estancada.
 * Se destruye toda estructura (la incrustada en la casilla y cualquier edificio
 * de la lista cuya huella la cubra), se suma su población a los ahogados y la
 * casilla pasa a WATER.</li>
 * <li><b>Drenaje:</b> agua estancada con elevación &ge; mar y &gt; 1. Se restaura el
 * tipo original (SAND si no lo hay).</li>
 * </ul>
 * Las casillas con elevación &le; 0 o &ge; 8 son mar o tierra permanentes y no
 * participan. Los edificios se deduplican por identidad: un edificio 2x2 que
 * cubre varias casillas inundadas en la misma pasada cuenta una sola vez, y los
 * índices de la lista se retiran en orden descendente para que ninguna retirada
 * desplace a otra pendiente.
 * <p>
 * La pasada no decide si la partida termina; solo informa.
 */
@Slf4j
public class FloodEngine implements IFloodSolver {

    public static final double PERMANENT_SEA_FLOOR = 0.0;
    public static final double PERMANENT_LAND = 8.0;
    public static final double DRAIN_MIN_ELEVATION = 1.0;

    @Override
    public FloodResult apply(TileGrid grid, Settlement settlement, double seaLevel) {
        return run(grid, settlement, seaLevel);
    }

    /**
     * Planifica y aplica la pasada en un solo paso.
     */
    public FloodResult run(TileGrid grid, Settlement settlement, double seaLevel) {
        FloodPlan plan = plan(grid, settlement, seaLevel);
        commit(plan, grid, settlement);
        return plan.result();
    }

    /**
     * Calcula los cambios de la pasada sin modificar nada.
     */
    public FloodPlan plan(TileGrid grid, Settlement settlement, double seaLevel) {
        List<Building> buildings = settlement.getBuildings();

        List<GridCoordinate> flooded = new ArrayList<>();
        List<GridCoordinate> drained = new ArrayList<>();
        Set<Integer> indicesToRemove = new TreeSet<>(Collections.reverseOrder());
        Set<Building> destroyed = Collections.newSetFromMap(new IdentityHashMap<>());
        List<Building> destroyedInOrder = new ArrayList<>();
        List<DestroyedStructure> structures = new ArrayList<>();

        long populationDrowned = 0;
        int wellsLost = 0;
        boolean playerDrowned = false;

        for (int x = 0; x < grid.getWidth(); x++) {
            for (int y = 0; y < grid.getHeight(); y++) {
                Tile tile = grid.getTile(x, y);
                double elevation = tile.getElevation();

                if (elevation <= PERMANENT_SEA_FLOOR || elevation >= PERMANENT_LAND) {
                    continue;
                }

                TerrainType type = tile.getTerrainType();
                if (elevation < seaLevel && !type.isStandingWater()) {
                    flooded.add(new GridCoordinate(x, y));

                    // 1. Estructura incrustada en la casilla
                    Building embedded = tile.getBuilding();
                    if (embedded != null) {
                        if (destroyed.add(embedded)) {
                            destroyedInOrder.add(embedded);
                            int index = indexOfIdentity(buildings, embedded);
                            if (index >= 0) {
                                indicesToRemove.add(index);
                            }
                            structures.add(toStructure(embedded));
                            populationDrowned += embedded.getPopulation();
                            if (embedded.getType() == BuildingType.WELL) {
                                wellsLost++;
                            }
                        }
                    } else if (tile.getZone() != null) {
                        structures.add(new DestroyedStructure(x, y, tile.getZone().name(), 0));
                    }

                    // 2. Edificios de la lista cuya huella cubre la casilla
                    for (int i = 0; i < buildings.size(); i++) {
                        Building building = buildings.get(i);
                        if (building.covers(x, y) && destroyed.add(building)) {
                            destroyedInOrder.add(building);
                            indicesToRemove.add(i);
                            structures.add(toStructure(building));
                            populationDrowned += building.getPopulation();
                            if (building.getType() == BuildingType.WELL) {
                                wellsLost++;
                            }
                        }
                    }

                    // 3. El jugador se ahoga con todo su pueblo
                    if (!playerDrowned && isPlayerAt(settlement, x, y)) {
                        populationDrowned += settlement.getPopulation();
                        playerDrowned = true;
                    }
                } else if (type.isStandingWater() && elevation >= seaLevel && elevation > DRAIN_MIN_ELEVATION) {
                    drained.add(new GridCoordinate(x, y));
                }
            }
        }

        FloodResult result = FloodResult.builder()
                .tilesFlooded(flooded.size())
                .tilesDrained(drained.size())
                .destroyedStructures(structures)
                .populationDrowned(populationDrowned)
                .wellsLost(wellsLost)
                .playerDrowned(playerDrowned)
                .seaLevel(seaLevel)
                .build();

        return new FloodPlan(flooded, drained, new ArrayList<>(indicesToRemove), destroyedInOrder, result);
    }

    /**
     * Aplica un plan sobre la rejilla y la lista de edificios.
     * <p>
     * Un plan solo es válido para la lista de edificios sobre la que se calculó.
     * Si la lista ha cambiado desde {@link #plan} (o el plan ya se aplicó), se
     * lanza {@link IllegalStateException} sin modificar nada.
     */
    public void commit(FloodPlan plan, TileGrid grid, Settlement settlement) {
        List<Building> buildings = settlement.getBuildings();
        checkIndicesStillMatch(plan, buildings);

        for (GridCoordinate c : plan.floodedTiles()) {
            Tile tile = grid.getTile(c.x(), c.y());
            tile.clearStructures();
            tile.setTerrainType(TerrainType.WATER);
        }

        for (GridCoordinate c : plan.drainedTiles()) {
            Tile tile = grid.getTile(c.x(), c.y());
            TerrainType restored = tile.getOriginalType() != null ? tile.getOriginalType() : TerrainType.SAND;
            tile.setTerrainType(restored);
        }

        // Un edificio destruido no puede seguir referenciado desde las casillas secas de su huella
        for (Building building : plan.destroyedBuildings()) {
            unlinkFootprint(grid, building);
        }

        for (int index : plan.buildingIndicesDescending()) {
            buildings.remove(index);
        }

        FloodResult result = plan.result();
        if (result.hasLosses()) {
            log.info("Inundación con el mar a {}: {} casillas anegadas, {} estructuras perdidas, {} ahogados.",
                    result.seaLevel(), result.tilesFlooded(), result.destroyedStructures().size(), result.populationDrowned());
        } else {
            log.debug("Pasada de inundación con el mar a {}: {} anegadas, {} drenadas.",
                    result.seaLevel(), result.tilesFlooded(), result.tilesDrained());
        }
    }

    private static void checkIndicesStillMatch(FloodPlan plan, List<Building> buildings) {
        Set<Building> planned = Collections.newSetFromMap(new IdentityHashMap<>());
        planned.addAll(plan.destroyedBuildings());
        for (int index : plan.buildingIndicesDescending()) {
            if (index >= buildings.size() || !planned.contains(buildings.get(index))) {
                throw new IllegalStateException(String.format(
                        "Plan de inundación obsoleto: el índice %d ya no apunta a un edificio destruido (%d edificios en la lista).",
                        index, buildings.size()));
            }
        }
    }

    private static void unlinkFootprint(TileGrid grid, Building building) {
        int size = building.getType().getFootprintSize();
        for (int x = building.getX(); x < building.getX() + size; x++) {
            for (int y = building.getY(); y < building.getY() + size; y++) {
                Tile tile = grid.getTile(x, y);
                if (tile != null && tile.getBuilding() == building) {
                    tile.setBuilding(null);
                }
            }
        }
    }

    private static boolean isPlayerAt(Settlement settlement, int x, int y) {
        return settlement.getPlayer().map(player -> player.isAt(x, y)).orElse(false);
    }

    private static int indexOfIdentity(List<Building> buildings, Building target) {
        for (int i = 0; i < buildings.size(); i++) {
            if (buildings.get(i) == target) {
                return i;
            }
        }
        return -1;
    }

    private static DestroyedStructure toStructure(Building building) {
        return new DestroyedStructure(building.getX(), building.getY(), building.getType().name(), building.getPopulation());
    }
}
