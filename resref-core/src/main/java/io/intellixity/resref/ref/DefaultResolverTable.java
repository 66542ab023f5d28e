package io.intellixity.resref.ref;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Parameter fallbacks keyed by (param, api, collection).\n
 *
 * Lookup order:\n
 * - entry for the exact collection\n
 * - wildcard entry for the api (collection "*" or null)\n
 * - nothing\n
 */
public final class DefaultResolverTable {
  public static final String WILDCARD = "*";

  private final Map<String, Map<String, Map<String, Resolver>>> byParam;

  public DefaultResolverTable() {
    this.byParam = new HashMap<>();
  }

  private DefaultResolverTable(Map<String, Map<String, Map<String, Resolver>>> byParam) {
    this.byParam = byParam;
  }

  /**
   * Register or overwrite a default.
   *
   * @param collection collection name ({@code instances}) or id ({@code compute.instances}); null or "*" for all
   */
  public void setDefault(String api, String collection, String param, Resolver resolver) {
    requireKey(api, "api");
    requireKey(param, "param");
    if (resolver == null) throw new IllegalArgumentException("resolver is required");
    byParam.computeIfAbsent(param, k -> new HashMap<>())
        .computeIfAbsent(api, k -> new HashMap<>())
        .put(normalize(api, collection), resolver);
  }

  public Optional<Resolver> getDefault(String api, String collection, String param) {
    requireKey(api, "api");
    requireKey(param, "param");
    Map<String, Map<String, Resolver>> byApi = byParam.get(param);
    if (byApi == null) return Optional.empty();
    Map<String, Resolver> byCollection = byApi.get(api);
    if (byCollection == null) return Optional.empty();
    Resolver r = byCollection.get(normalize(api, collection));
    if (r == null) r = byCollection.get(WILDCARD);
    return Optional.ofNullable(r);
  }

  /** Evaluate the default, if there is one and it produces a value. */
  public Optional<String> lookup(String api, String collection, String param) {
    return getDefault(api, collection, param).flatMap(Resolver::resolve);
  }

  /** Independent copy; resolvers are shared. */
  public DefaultResolverTable copy() {
    Map<String, Map<String, Map<String, Resolver>>> out = new HashMap<>();
    byParam.forEach((param, byApi) -> {
      Map<String, Map<String, Resolver>> apis = new HashMap<>();
      byApi.forEach((api, byCollection) -> apis.put(api, new HashMap<>(byCollection)));
      out.put(param, apis);
    });
    return new DefaultResolverTable(out);
  }

  private static String normalize(String api, String collection) {
    if (collection == null || collection.isBlank() || WILDCARD.equals(collection)) return WILDCARD;
    String prefix = api + ".";
    return collection.startsWith(prefix) ? collection.substring(prefix.length()) : collection;
  }

  private static void requireKey(String v, String what) {
    if (v == null || v.isBlank()) throw new IllegalArgumentException("provided " + what + " cannot be blank");
  }
}
