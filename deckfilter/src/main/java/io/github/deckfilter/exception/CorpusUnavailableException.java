package io.github.deckfilter.exception;

/**
 * The raw deck corpus is missing or unreadable, so no report can be computed.
 */
public class CorpusUnavailableException extends DeckFilterException {

  /**
   * Instantiates a new CorpusUnavailableException.
   *
   * @param message the message
   */
  public CorpusUnavailableException(final String message) {
    super(message);
  }

  /**
   * Instantiates a new CorpusUnavailableException.
   *
   * @param message the message
   * @param cause   the cause
   */
  public CorpusUnavailableException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
