package dev.bookshelf.embedding;

/**
 * The embedding backend could not produce a vector: not configured, failed (transport, auth,
 * quota) or did not answer within the timeout. Callers degrade to lexical recall instead of
 * failing.
 */
public class EmbeddingUnavailableException extends RuntimeException {

  /** Why no vector was produced. */
  public enum Reason {
    NOT_CONFIGURED,
    TIMEOUT,
    BACKEND_ERROR,
    INTERRUPTED
  }

  private final Reason reason;

  public EmbeddingUnavailableException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public EmbeddingUnavailableException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }
}
