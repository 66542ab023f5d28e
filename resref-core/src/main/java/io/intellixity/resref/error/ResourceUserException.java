package io.intellixity.resref.error;

/**
 * Raised for bad input: the text, URL or parameters supplied by a caller could not be turned into a reference.\n
 *
 * Messages are meant to be shown to the user as-is.\n
 */
public class ResourceUserException extends ResourceException {
  public ResourceUserException(String message) {
    super(message);
  }
}
