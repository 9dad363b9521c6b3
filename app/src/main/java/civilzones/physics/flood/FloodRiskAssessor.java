package civilzones.physics.flood;

import civilzones.config.GeologyConfig;
import civilzones.domain.terrain.Tile;
import civilzones.domain.terrain.TileGrid;

import java.util.Objects;
import java.util.Optional;

/**
 * Evalúa el riesgo de inundación y el sobrecoste de construir en altura.
 */
public class FloodRiskAssessor {

    private final GeologyConfig config;

    public FloodRiskAssessor(GeologyConfig config) {
        this.config = Objects.requireNonNull(config, "La configuración geológica no puede ser nula.");
    }

    /**
     * Clasifica una elevación en bandas de ancho {@code floodWarningMargin} sobre el mar.
     */
    public TileElevationInfo assess(double elevation, double seaLevel) {
        double margin = config.floodWarningMargin();
        FloodRisk risk;
        if (elevation < seaLevel) {
            risk = FloodRisk.UNDERWATER;
        } else if (elevation < seaLevel + margin) {
            risk = FloodRisk.DANGER;
        } else if (elevation < seaLevel + margin * 2) {
            risk = FloodRisk.WARNING;
        } else {
            risk = FloodRisk.SAFE;
        }
        return new TileElevationInfo(elevation, seaLevel, risk);
    }

    public Optional<TileElevationInfo> assess(TileGrid grid, int x, int y, double seaLevel) {
        Tile tile = grid.getTile(x, y);
        if (tile == null) {
            return Optional.empty();
        }
        return Optional.of(assess(tile.getElevation(), seaLevel));
    }

    /**
     * Una casilla está en riesgo si sigue seca pero queda a menos de un margen del mar.
     */
    public boolean isFloodRisk(double elevation, double seaLevel) {
        return elevation > seaLevel && elevation <= seaLevel + config.floodWarningMargin();
    }

    /**
     * Multiplicador de coste de construcción: 1.0 por debajo del umbral y un
     * incremento fijo por cada nivel entero por encima.
     */
    public double elevationCostMultiplier(double elevation) {
        int level = (int) Math.floor(elevation);
        if (level < config.costThreshold()) {
            return 1.0;
        }
        return 1.0 + (level - config.costThreshold()) * config.costIncreasePerLevel();
    }
}
