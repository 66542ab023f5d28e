package io.intellixity.resref.error;

/** The catalog has no such API, or no such version of it. */
public final class UnknownApiException extends ResourceUserException {
  private UnknownApiException(String message) {
    super(message);
  }

  public static UnknownApiException api(String api) {
    return new UnknownApiException("API named [" + api + "] does not exist in the catalog");
  }

  public static UnknownApiException version(String api, String version) {
    return new UnknownApiException("The [" + api + "] API does not have version [" + version + "] in the catalog");
  }
}
