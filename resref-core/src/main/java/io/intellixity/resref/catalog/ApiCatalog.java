package io.intellixity.resref.catalog;

import io.intellixity.resref.error.UnknownApiException;
import io.intellixity.resref.schema.ApiDefinition;

import java.util.Optional;
import java.util.Set;

/**
 * Source of API definitions the registry materializes on first use.
 */
public interface ApiCatalog {

  /** Known versions of {@code api}; empty if the API is unknown. */
  Set<String> versions(String api);

  Optional<String> defaultVersion(String api);

  /**
   * @throws UnknownApiException if the API or the version is unknown
   */
  ApiDefinition definition(String api, String version);
}
