package civilzones.physics.simulator;

import civilzones.domain.flood.FloodResult;
import civilzones.domain.geology.GeologicalPeriod;
import civilzones.physics.flood.NarrativeMessage;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Receptor por defecto: vuelca los mensajes narrativos al log.
 */
@Slf4j
public class LoggingGeologyEventListener implements GeologyEventListener {

    @Override
    public void onPeriodChanged(GeologicalPeriod newPeriod, NarrativeMessage message) {
        log.info("{}", message.text());
    }

    @Override
    public void onSeaLevelCreep(double seaLevel, NarrativeMessage message) {
        log.info("{} (nivel {})", message.text(), seaLevel);
    }

    @Override
    public void onFlood(FloodResult result, List<NarrativeMessage> messages) {
        if (messages.isEmpty()) {
            log.debug("Pasada sin pérdidas: {} anegadas, {} drenadas.", result.tilesFlooded(), result.tilesDrained());
            return;
        }
        for (NarrativeMessage message : messages) {
            log.warn("{}", message.text());
        }
    }
}
