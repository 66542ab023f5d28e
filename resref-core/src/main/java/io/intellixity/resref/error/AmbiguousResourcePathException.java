package io.intellixity.resref.error;

/** Two collections map to the same URL shape. */
public final class AmbiguousResourcePathException extends ResourceConfigurationException {
  public AmbiguousResourcePathException(String existing, String candidate) {
    super("There already exists parser " + existing + " for same path, can not register another one " + candidate);
  }
}
