package io.github.deckfilter.exception;

/**
 * An index or subset artifact is missing or unreadable. The resolver turns this into a fallback.
 */
public class ArtifactNotFoundException extends DeckFilterException {

  /**
   * Instantiates a new ArtifactNotFoundException.
   *
   * @param message the message
   */
  public ArtifactNotFoundException(final String message) {
    super(message);
  }

  /**
   * Instantiates a new ArtifactNotFoundException.
   *
   * @param message the message
   * @param cause   the cause
   */
  public ArtifactNotFoundException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
