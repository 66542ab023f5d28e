package io.intellixity.resref.error;

/** Base type for every failure raised while registering or parsing resources. */
public class ResourceException extends RuntimeException {
  public ResourceException(String message) {
    super(message);
  }

  public ResourceException(String message, Throwable cause) {
    super(message, cause);
  }
}
