package io.intellixity.resref.error;

/** A collection-path or URL could not be parsed. */
public final class InvalidResourceException extends ResourceUserException {
  public InvalidResourceException(String line) {
    super("could not parse resource: [" + line + "]");
  }
}
