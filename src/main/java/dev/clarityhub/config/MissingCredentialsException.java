package dev.clarityhub.config;

/**
 * Thrown while building provider beans when a required credential is absent. Raised before any
 * provider request is attempted, so the application fails to start instead of failing per call.
 */
public class MissingCredentialsException extends IllegalStateException {

  public MissingCredentialsException(String message) {
    super(message);
  }
}
