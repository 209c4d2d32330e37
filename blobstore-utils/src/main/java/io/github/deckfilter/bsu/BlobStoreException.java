package io.github.deckfilter.bsu;

/**
 * Raised when a blob store cannot be read from or written to.
 */
public class BlobStoreException extends RuntimeException {

  /**
   * Instantiates a new Blob store exception.
   *
   * @param message the message
   */
  public BlobStoreException(final String message) {
    super(message);
  }

  /**
   * Instantiates a new Blob store exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public BlobStoreException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
