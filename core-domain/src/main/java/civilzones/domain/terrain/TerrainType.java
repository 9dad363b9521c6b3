package civilzones.domain.terrain;

/**
 * Tipos de terreno que puede tener una casilla del mundo.
 * <p>
 * Las distintas familias (agua estancada, transitable, apto para árboles) se
 * exponen como predicados para que la cascada de clasificación y el motor de
 * inundaciones no repitan listas de tipos.
 */
public enum TerrainType {
    DEEP_OCEAN,
    WATER,
    RIVER,
    SAND,
    GRASS,
    FOREST,
    ROCK,
    STONE,
    SNOW;

    /**
     * Agua estancada (mar o lago). Son los únicos tipos que una inundación produce
     * y los únicos que un drenaje puede revertir.
     */
    public boolean isStandingWater() {
        return this == WATER || this == DEEP_OCEAN;
    }

    /**
     * Cualquier masa de agua, incluidos los ríos.
     */
    public boolean isWaterBody() {
        return isStandingWater() || this == RIVER;
    }

    public boolean canHaveTree() {
        return this == GRASS || this == FOREST || this == SNOW;
    }

    /**
     * Terreno sobre el que puede aparecer el jugador.
     */
    public boolean isSpawnable() {
        return this == GRASS || this == FOREST || this == SAND || this == ROCK || this == SNOW;
    }

    /**
     * Terreno que cuenta como alcanzable en el relleno por inundación del spawn.
     */
    public boolean isReachable() {
        return this == GRASS || this == FOREST || this == SAND;
    }
}
