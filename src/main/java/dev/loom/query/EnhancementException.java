package dev.loom.query;

/** A query enhancement step failed and the caller asked not to fall back. */
public class EnhancementException extends RuntimeException {

  public EnhancementException(String message, Throwable cause) {
    super(message, cause);
  }
}
