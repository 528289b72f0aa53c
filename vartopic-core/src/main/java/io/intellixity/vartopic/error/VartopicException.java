package io.intellixity.vartopic.error;

/**
 * Base of the vartopic failure vocabulary.
 * <p>
 * Every failure kind is its own subclass so callers can branch on cause; the message carries
 * the offending identifier, package, file or line.
 */
public abstract class VartopicException extends RuntimeException {
  protected VartopicException(String message) {
    super(message);
  }

  protected VartopicException(String message, Throwable cause) {
    super(message, cause);
  }
}
