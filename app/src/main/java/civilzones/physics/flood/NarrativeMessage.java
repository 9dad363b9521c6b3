package civilzones.physics.flood;

/**
 * Mensaje narrativo para la interfaz con su duración de presentación.
 */
public record NarrativeMessage(String text, long durationMillis) {
}
