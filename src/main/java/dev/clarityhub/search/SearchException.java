package dev.clarityhub.search;

/**
 * A search branch could not complete because the store or the provider failed. In hybrid mode
 * this only reaches the caller when both branches fail.
 */
public class SearchException extends RuntimeException {

  public SearchException(String message, Throwable cause) {
    super(message, cause);
  }
}
