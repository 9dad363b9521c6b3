package civilzones.domain.settlement;

import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Vista del asentamiento que consume el sistema geológico: la lista de
 * edificios, la población total y el jugador.
 * <p>
 * La lista es densa y se modifica en sitio; las retiradas por índice deben
 * hacerse en orden descendente.
 */
public class Settlement {

    @Getter
    private final List<Building> buildings;
    @Getter
    private int population;
    @Setter
    private Player player;

    public Settlement() {
        this(new ArrayList<>(), 0, null);
    }

    public Settlement(List<Building> buildings, int population, Player player) {
        this.buildings = new ArrayList<>(buildings);
        this.player = player;
        setPopulation(population);
    }

    /**
     * Fija la población total; los valores negativos se recortan a cero.
     */
    public void setPopulation(int population) {
        this.population = Math.max(0, population);
    }

    public Optional<Player> getPlayer() {
        return Optional.ofNullable(player);
    }

    public void addBuilding(Building building) {
        buildings.add(building);
    }
}
