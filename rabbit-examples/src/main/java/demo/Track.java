package demo;

/**
 * Payload used by the examples.
 */
public record Track(String artist, String title) {
}
