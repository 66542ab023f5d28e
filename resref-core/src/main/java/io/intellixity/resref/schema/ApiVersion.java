package io.intellixity.resref.schema;

/**
 * One version of one API, e.g. {@code compute/v1}.
 */
public record ApiVersion(String api, String version) {
  public ApiVersion {
    if (api == null || api.isBlank()) throw new IllegalArgumentException("api is required");
    if (version == null || version.isBlank()) throw new IllegalArgumentException("version is required");
  }

  @Override
  public String toString() { return api + "/" + version; }
}
