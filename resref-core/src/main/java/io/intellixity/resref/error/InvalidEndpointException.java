package io.intellixity.resref.error;

public final class InvalidEndpointException extends ResourceUserException {
  public InvalidEndpointException(String url) {
    super("URL does not start with http:// or https://: [" + url + "]");
  }
}
