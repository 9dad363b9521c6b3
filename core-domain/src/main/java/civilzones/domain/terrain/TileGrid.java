package civilzones.domain.terrain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;

import java.util.Objects;

/**
 * Rejilla rectangular de casillas indexada como {@code [x][y]}.
 * <p>
 * Las consultas fuera de rango devuelven un centinela ({@code null} o
 * {@code false}) en lugar de lanzar excepción; los bucles internos solo visitan
 * coordenadas válidas.
 */
@JsonIgnoreProperties(value = {"width", "height"}, allowGetters = true)
public final class TileGrid {

    @Getter
    private final int width;
    @Getter
    private final int height;
    private final Tile[][] tiles;

    public TileGrid(int width, int height) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException(
                    String.format("Las dimensiones de la rejilla deben ser positivas (recibido %dx%d).", width, height));
        }
        this.width = width;
        this.height = height;
        this.tiles = new Tile[width][height];
    }

    @JsonCreator
    public static TileGrid of(@JsonProperty("tiles") Tile[][] tiles) {
        Objects.requireNonNull(tiles, "La matriz de casillas no puede ser nula.");
        if (tiles.length == 0) {
            throw new IllegalArgumentException("La matriz de casillas no puede estar vacía.");
        }
        TileGrid grid = new TileGrid(tiles.length, tiles[0].length);
        for (int x = 0; x < grid.width; x++) {
            if (tiles[x].length != grid.height) {
                throw new IllegalArgumentException("Todas las columnas deben tener la misma altura.");
            }
            for (int y = 0; y < grid.height; y++) {
                grid.setTile(x, y, Objects.requireNonNull(tiles[x][y], "Casilla nula en la matriz."));
            }
        }
        return grid;
    }

    public boolean inBounds(int x, int y) {
        return x >= 0 && x < width && y >= 0 && y < height;
    }

    /**
     * @return la casilla en (x, y) o {@code null} si la coordenada está fuera de la rejilla.
     */
    public Tile getTile(int x, int y) {
        if (!inBounds(x, y)) {
            return null;
        }
        return tiles[x][y];
    }

    public void setTile(int x, int y, Tile tile) {
        if (!inBounds(x, y)) {
            throw new IndexOutOfBoundsException("La coordenada (" + x + ", " + y + ") está fuera de la rejilla " + width + "x" + height + ".");
        }
        tiles[x][y] = tile;
    }

    /**
     * Vista de solo lectura para serialización. Devuelve las columnas internas.
     */
    @JsonProperty("tiles")
    public Tile[][] getTiles() {
        return tiles;
    }

    public void forEach(TileVisitor visitor) {
        for (int x = 0; x < width; x++) {
            for (int y = 0; y < height; y++) {
                visitor.visit(x, y, tiles[x][y]);
            }
        }
    }

    @FunctionalInterface
    public interface TileVisitor {
        void visit(int x, int y, Tile tile);
    }
}
