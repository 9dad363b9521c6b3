package civilzones.physics.flood;

import civilzones.domain.flood.FloodResult;
import civilzones.domain.geology.GeologicalPeriod;

/**
 * Textos que acompañan a los eventos geológicos.
 */
public final class FloodMessages {

    public static final long CATASTROPHE_DURATION = 8000;
    public static final long SEVERE_DURATION = 6000;
    public static final long MINOR_DURATION = 5000;
    public static final long MAJOR_SHIFT_DURATION = 5000;
    public static final long NEUTRAL_SHIFT_DURATION = 3000;
    public static final long CREEP_DURATION = 4000;
    public static final long WELLS_LOST_DURATION = 4000;

    private FloodMessages() {
    }

    /**
     * Anuncio de cambio de periodo. La dirección se decide comparando el nivel
     * objetivo del nuevo periodo con el nivel del mar en el momento del cambio.
     */
    public static NarrativeMessage periodTransition(double previousSeaLevel, GeologicalPeriod newPeriod) {
        double target = newPeriod.targetSeaLevel();
        if (target > previousSeaLevel) {
            return new NarrativeMessage(
                    String.format("¡Comienza %s! Las aguas suben mientras el hielo se funde...", newPeriod.name()),
                    MAJOR_SHIFT_DURATION);
        }
        if (target < previousSeaLevel) {
            return new NarrativeMessage(
                    String.format("¡Comienza %s! Las aguas retroceden mientras crecen los glaciares...", newPeriod.name()),
                    MAJOR_SHIFT_DURATION);
        }
        return new NarrativeMessage(String.format("Comienza %s.", newPeriod.name()), NEUTRAL_SHIFT_DURATION);
    }

    public static NarrativeMessage floodWarning(FloodResult result, String periodName) {
        long drowned = result.populationDrowned();
        switch (result.severity()) {
            case CATASTROPHE:
                return new NarrativeMessage(String.format(
                        "¡CATÁSTROFE! %d personas perecieron en la gran inundación. %s trajo la destrucción. Importa dónde construyes...",
                        drowned, periodName), CATASTROPHE_DURATION);
            case SEVERE:
                return new NarrativeMessage(String.format(
                        "¡%d ahogados por la subida de las aguas! Algunas zonas pueden ser más seguras que otras...",
                        drowned), SEVERE_DURATION);
            default:
                return new NarrativeMessage(String.format(
                        "%d perdidos por la subida de las aguas. Quizá sería más sensato buscar terreno alto...",
                        drowned), MINOR_DURATION);
        }
    }

    public static NarrativeMessage wellsLost(int wellsLost) {
        String text = wellsLost == 1
                ? "¡1 pozo tragado por el mar!"
                : String.format("¡%d pozos tragados por el mar!", wellsLost);
        return new NarrativeMessage(text, WELLS_LOST_DURATION);
    }

    public static NarrativeMessage watersCreepHigher() {
        return new NarrativeMessage("Las aguas siguen subiendo. Las zonas costeras están en peligro.", CREEP_DURATION);
    }

    /**
     * {@code true} si una subida del nivel del mar cruza una décima.
     */
    public static boolean crossesTenth(double previousLevel, double newLevel) {
        return newLevel > previousLevel
                && Math.floor(previousLevel * 10) != Math.floor(newLevel * 10);
    }
}
