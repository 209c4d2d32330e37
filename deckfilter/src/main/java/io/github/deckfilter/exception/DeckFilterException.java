package io.github.deckfilter.exception;

/**
 * Base exception of the deckfilter library.
 */
public class DeckFilterException extends RuntimeException {

  /**
   * Instantiates a new DeckFilterException.
   *
   * @param message the message
   */
  public DeckFilterException(final String message) {
    super(message);
  }

  /**
   * Instantiates a new DeckFilterException.
   *
   * @param message the message
   * @param cause   the cause
   */
  public DeckFilterException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
