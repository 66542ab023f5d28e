package io.intellixity.resref.catalog;

import io.intellixity.resref.error.ResourceConfigurationException;

/** A catalog file could not be read or does not describe a valid API. */
public final class CatalogLoadException extends ResourceConfigurationException {
  public CatalogLoadException(String message) {
    super(message);
  }

  public CatalogLoadException(String message, Throwable cause) {
    super(message, cause);
  }
}
