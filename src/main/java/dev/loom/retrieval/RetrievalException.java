package dev.loom.retrieval;

/** A single source search failed. The retriever degrades that source to an empty list. */
public class RetrievalException extends RuntimeException {

  public RetrievalException(String message, Throwable cause) {
    super(message, cause);
  }
}
