package io.intellixity.resref.error;

import java.util.List;

/** Two different APIs tried to define the same collection. */
public final class AmbiguousAPIException extends ResourceConfigurationException {
  public AmbiguousAPIException(String collection, List<String> baseUrls) {
    super("collection [" + collection + "] defined in multiple APIs: " + baseUrls);
  }
}
