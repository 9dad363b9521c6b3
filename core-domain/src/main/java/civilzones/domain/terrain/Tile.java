package civilzones.domain.terrain;

import civilzones.domain.settlement.Building;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import java.util.Objects;

/**
 * Una casilla de la rejilla del mundo.
 * <p>
 * La elevación se fija en la generación y no vuelve a cambiar; lo único que
 * evoluciona con el tiempo es el tipo de terreno (inundación/drenaje) y la
 * ocupación por estructuras. El tipo original solo guarda terrenos que no sean
 * agua estancada, de modo que un drenaje nunca devuelve una casilla a WATER.
 */
@Getter
@Setter
@ToString
public class Tile {

    private TerrainType terrainType;
    private TerrainType originalType;
    private final double elevation;

    private boolean explored;
    private boolean tree;
    private boolean road;
    private boolean berry;

    private ZoneType zone;
    @JsonIgnore
    @ToString.Exclude
    private Building building;
    private TileResource resource;
    private Integer stoneDeposit;

    @JsonCreator
    public Tile(@JsonProperty("terrainType") TerrainType terrainType,
                @JsonProperty("elevation") double elevation) {
        Objects.requireNonNull(terrainType, "El tipo de terreno no puede ser nulo.");
        if (elevation < 0 || elevation > 10) {
            throw new IllegalArgumentException(String.format("La elevación %.2f está fuera del rango [0, 10].", elevation));
        }
        this.terrainType = terrainType;
        this.elevation = elevation;
        this.originalType = terrainType.isStandingWater() ? null : terrainType;
    }

    /**
     * Sustituye el tipo original de la casilla. Los tipos de agua estancada se
     * descartan para conservar el invariante de drenaje.
     */
    public void setOriginalType(TerrainType originalType) {
        this.originalType = (originalType == null || originalType.isStandingWater()) ? null : originalType;
    }

    /**
     * Elimina toda estructura o elemento que una inundación destruye.
     */
    public void clearStructures() {
        this.zone = null;
        this.building = null;
        this.road = false;
        this.tree = false;
        this.resource = null;
        this.stoneDeposit = null;
        this.berry = false;
    }

    @JsonIgnore
    public boolean isOccupied() {
        return building != null || zone != null;
    }
}
