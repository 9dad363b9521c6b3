package civilzones.io;

import civilzones.domain.geology.GeologyState;
import civilzones.domain.settlement.Building;
import civilzones.domain.settlement.Settlement;
import civilzones.domain.terrain.Tile;
import civilzones.domain.terrain.TileGrid;

import java.util.List;
import java.util.Objects;

/**
 * Partida guardada: rejilla, estado geológico y edificios del asentamiento.
 * <p>
 * Las casillas no guardan la referencia a su edificio; tras cargar hay que
 * llamar a {@link #restoreBuildingLinks()} para volver a enlazarlas.
 *
 * @param seed      Semilla con la que se generó el mundo.
 * @param grid      Rejilla de casillas.
 * @param geology   Estado geológico en el momento del guardado.
 * @param buildings Edificios del asentamiento.
 */
public record WorldSnapshot(long seed, TileGrid grid, GeologyState geology, List<Building> buildings) {

    public WorldSnapshot {
        Objects.requireNonNull(grid, "La rejilla no puede ser nula.");
        Objects.requireNonNull(geology, "El estado geológico no puede ser nulo.");
        buildings = buildings == null ? List.of() : List.copyOf(buildings);
    }

    public static WorldSnapshot capture(long seed, TileGrid grid, GeologyState geology, Settlement settlement) {
        return new WorldSnapshot(seed, grid, geology, settlement.getBuildings());
    }

    /**
     * Enlaza cada casilla de la huella de un edificio con dicho edificio.
     */
    public void restoreBuildingLinks() {
        for (Building building : buildings) {
            int size = building.getType().getFootprintSize();
            for (int x = building.getX(); x < building.getX() + size; x++) {
                for (int y = building.getY(); y < building.getY() + size; y++) {
                    Tile tile = grid.getTile(x, y);
                    if (tile != null) {
                        tile.setBuilding(building);
                    }
                }
            }
        }
    }
}
