package io.github.deckfilter.exception;

/**
 * The raw deck corpus could not be fetched within the configured timeout.
 */
public class CorpusTimeoutException extends DeckFilterException {

  /**
   * Instantiates a new CorpusTimeoutException.
   *
   * @param message the message
   */
  public CorpusTimeoutException(final String message) {
    super(message);
  }

  /**
   * Instantiates a new CorpusTimeoutException.
   *
   * @param message the message
   * @param cause   the cause
   */
  public CorpusTimeoutException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
