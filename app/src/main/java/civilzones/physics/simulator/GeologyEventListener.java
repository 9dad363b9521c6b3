package civilzones.physics.simulator;

import civilzones.domain.flood.FloodResult;
import civilzones.domain.geology.GeologicalPeriod;
import civilzones.physics.flood.NarrativeMessage;

import java.util.List;

/**
 * Receptor de los eventos geológicos que la interfaz presenta al jugador.
 */
public interface GeologyEventListener {

    void onPeriodChanged(GeologicalPeriod newPeriod, NarrativeMessage message);

    void onSeaLevelCreep(double seaLevel, NarrativeMessage message);

    /**
     * Se invoca tras aplicar una pasada con cambios de terreno o pérdidas.
     */
    void onFlood(FloodResult result, List<NarrativeMessage> messages);
}
