package io.intellixity.resref.catalog;

import io.intellixity.resref.error.UnknownApiException;
import io.intellixity.resref.schema.ApiDefinition;

import java.util.*;

/**
 * Simple in-memory {@link ApiCatalog}.\n
 *
 * If no version of an API is flagged default, a lone version is used as the default.\n
 */
public final class InMemoryApiCatalog implements ApiCatalog {
  private final Map<String, Map<String, ApiDefinition>> byApi = new LinkedHashMap<>();

  public InMemoryApiCatalog(List<ApiDefinition> defs) {
    for (ApiDefinition d : defs) {
      Map<String, ApiDefinition> versions = byApi.computeIfAbsent(d.api(), k -> new LinkedHashMap<>());
      // first definition of a version wins
      versions.putIfAbsent(d.version(), d);
    }
    for (Map.Entry<String, Map<String, ApiDefinition>> e : byApi.entrySet()) {
      long defaults = e.getValue().values().stream().filter(ApiDefinition::defaultVersion).count();
      if (defaults > 1) throw new IllegalArgumentException("API " + e.getKey() + " has more than one default version");
    }
  }

  public static InMemoryApiCatalog of(ApiDefinition... defs) {
    return new InMemoryApiCatalog(List.of(defs));
  }

  @Override
  public Set<String> versions(String api) {
    Map<String, ApiDefinition> v = byApi.get(api);
    return v == null ? Set.of() : Collections.unmodifiableSet(v.keySet());
  }

  @Override
  public Optional<String> defaultVersion(String api) {
    Map<String, ApiDefinition> v = byApi.get(api);
    if (v == null) return Optional.empty();
    for (ApiDefinition d : v.values()) if (d.defaultVersion()) return Optional.of(d.version());
    return v.size() == 1 ? Optional.of(v.keySet().iterator().next()) : Optional.empty();
  }

  @Override
  public ApiDefinition definition(String api, String version) {
    Map<String, ApiDefinition> v = byApi.get(api);
    if (v == null) throw UnknownApiException.api(api);
    ApiDefinition d = v.get(version);
    if (d == null) throw UnknownApiException.version(api, version);
    return d;
  }

  public Collection<ApiDefinition> all() {
    List<ApiDefinition> out = new ArrayList<>();
    byApi.values().forEach(m -> out.addAll(m.values()));
    return out;
  }
}
