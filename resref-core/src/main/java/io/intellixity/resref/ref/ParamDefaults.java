package io.intellixity.resref.ref;

import java.util.Optional;

/** Default lookup bound to one collection: param name to value, if any. */
@FunctionalInterface
public interface ParamDefaults {
  ParamDefaults NONE = param -> Optional.empty();

  Optional<String> lookup(String param);
}
