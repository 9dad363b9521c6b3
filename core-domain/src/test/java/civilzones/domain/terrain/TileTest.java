package civilzones.domain.terrain;

import civilzones.domain.settlement.Building;
import civilzones.domain.settlement.BuildingType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TileTest {

    @Test
    @DisplayName("Validación: la elevación debe estar en [0, 10]")
    void constructor_shouldRejectElevationOutOfRange() {
        assertThrows(IllegalArgumentException.class, () -> new Tile(TerrainType.GRASS, -0.1));
        assertThrows(IllegalArgumentException.class, () -> new Tile(TerrainType.SNOW, 10.1));
        assertDoesNotThrow(() -> new Tile(TerrainType.STONE, 10.0));
    }

    @Test
    @DisplayName("Tipo original: el agua estancada no guarda tipo original")
    void originalType_shouldBeNullForStandingWater() {
        assertNull(new Tile(TerrainType.WATER, 2.0).getOriginalType());
        assertNull(new Tile(TerrainType.DEEP_OCEAN, 0.5).getOriginalType());
        assertEquals(TerrainType.GRASS, new Tile(TerrainType.GRASS, 5.0).getOriginalType());
    }

    @Test
    @DisplayName("Tipo original: asignar un tipo de agua lo descarta")
    void setOriginalType_shouldDropStandingWater() {
        Tile tile = new Tile(TerrainType.SAND, 3.0);

        tile.setOriginalType(TerrainType.WATER);

        assertNull(tile.getOriginalType());
    }

    @Test
    @DisplayName("Inundación: clearStructures elimina zona, edificio, carretera, árbol y recursos")
    void clearStructures_shouldRemoveEverything() {
        // ARRANGE
        Tile tile = new Tile(TerrainType.FOREST, 7.5);
        tile.setZone(ZoneType.RESIDENTIAL);
        tile.setBuilding(Building.of(BuildingType.WELL, 0, 0));
        tile.setRoad(true);
        tile.setTree(true);
        tile.setBerry(true);
        tile.setResource(new TileResource(100, 0.2));
        tile.setStoneDeposit(100);

        // ACT
        tile.clearStructures();

        // ASSERT
        assertFalse(tile.isOccupied());
        assertFalse(tile.isRoad());
        assertFalse(tile.isTree());
        assertFalse(tile.isBerry());
        assertNull(tile.getResource());
        assertNull(tile.getStoneDeposit());
        assertEquals(7.5, tile.getElevation(), 0.0, "La elevación no cambia nunca.");
    }
}
