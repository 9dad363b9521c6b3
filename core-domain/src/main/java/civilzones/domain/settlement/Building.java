package civilzones.domain.settlement;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import java.util.Objects;

/**
 * Vista de huella de un edificio del asentamiento.
 * <p>
 * La economía es la dueña de estos objetos; el motor de inundaciones solo los
 * lee y los retira de la lista. La igualdad es de identidad: dos edificios con
 * los mismos datos siguen siendo estructuras distintas.
 */
@Getter
@ToString
public final class Building {

    private final BuildingType type;
    private final int x;
    private final int y;
    @Setter
    private int population;

    @JsonCreator
    public Building(@JsonProperty("type") BuildingType type,
                    @JsonProperty("x") int x,
                    @JsonProperty("y") int y,
                    @JsonProperty("population") int population) {
        this.type = Objects.requireNonNull(type, "El tipo de edificio no puede ser nulo.");
        if (population < 0) {
            throw new IllegalArgumentException("La población de un edificio no puede ser negativa.");
        }
        this.x = x;
        this.y = y;
        this.population = population;
    }

    public static Building of(BuildingType type, int x, int y) {
        return new Building(type, x, y, 0);
    }

    /**
     * Comprueba si la coordenada cae dentro de la huella (1x1 o 2x2) anclada en (x, y).
     */
    public boolean covers(int px, int py) {
        int size = type.getFootprintSize();
        return px >= x && px < x + size && py >= y && py < y + size;
    }
}
