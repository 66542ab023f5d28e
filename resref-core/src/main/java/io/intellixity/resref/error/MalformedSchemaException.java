package io.intellixity.resref.error;

public final class MalformedSchemaException extends ResourceConfigurationException {
  public MalformedSchemaException(String message) {
    super(message);
  }
}
