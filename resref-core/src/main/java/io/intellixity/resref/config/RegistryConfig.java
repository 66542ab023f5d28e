package io.intellixity.resref.config;

import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.util.*;

/**
 * Registry settings.\n
 *
 * Loaded from every {@code resref.properties} resource on the classpath, then JVM system properties
 * (later sources win). Keys:\n
 * <pre>
 * resref.endpoint.override.&lt;api&gt;=https://localhost:8080/svc/v1/
 * resref.version.override.&lt;api&gt;=v1beta1
 * resref.domain.canonical=googleapis.com
 * resref.links.unquoted-apis=compute,clouduseraccounts,storage
 * resref.storage.scheme=gs
 * resref.storage.bucket-collection=storage.buckets
 * resref.storage.object-collection=storage.objects
 * resref.storage.json-api-url=https://www.googleapis.com/storage/v1/
 * resref.storage.xml-api-url=https://storage.googleapis.com/
 * </pre>
 */
public record RegistryConfig(Map<String, String> endpointOverrides,
                             Map<String, String> versionOverrides,
                             String canonicalDomain,
                             Set<String> unquotedApis,
                             Storage storage) {
  public static final String RESOURCE = "resref.properties";

  public static final String ENDPOINT_OVERRIDE_PREFIX = "resref.endpoint.override.";
  public static final String VERSION_OVERRIDE_PREFIX = "resref.version.override.";
  public static final String CANONICAL_DOMAIN = "resref.domain.canonical";
  public static final String UNQUOTED_APIS = "resref.links.unquoted-apis";

  /**
   * Storage shorthand ({@code gs://bucket/object}) settings.
   */
  public record Storage(String scheme, String bucketCollection, String objectCollection,
                        String jsonApiUrl, String xmlApiUrl) {
    public Storage {
      if (scheme == null || scheme.isBlank()) throw new IllegalArgumentException("storage scheme is required");
      if (bucketCollection == null || objectCollection == null) {
        throw new IllegalArgumentException("storage collections are required");
      }
    }

    public String shorthandPrefix() { return scheme + "://"; }

    static Storage from(PropertySource p) {
      return new Storage(
          p.get("resref.storage.scheme").orElse("gs"),
          p.get("resref.storage.bucket-collection").orElse("storage.buckets"),
          p.get("resref.storage.object-collection").orElse("storage.objects"),
          p.get("resref.storage.json-api-url").orElse("https://www.googleapis.com/storage/v1/"),
          p.get("resref.storage.xml-api-url").orElse("https://storage.googleapis.com/"));
    }
  }

  public RegistryConfig {
    endpointOverrides = Map.copyOf(endpointOverrides == null ? Map.of() : endpointOverrides);
    versionOverrides = Map.copyOf(versionOverrides == null ? Map.of() : versionOverrides);
    if (canonicalDomain == null || canonicalDomain.isBlank()) canonicalDomain = "googleapis.com";
    unquotedApis = Set.copyOf(unquotedApis == null ? Set.of() : unquotedApis);
    Objects.requireNonNull(storage, "storage");
  }

  public static RegistryConfig defaults() {
    return from(PropertySource.of(Map.of()));
  }

  public static RegistryConfig from(PropertySource p) {
    Map<String, String> endpoints = new LinkedHashMap<>();
    for (String k : p.keys(ENDPOINT_OVERRIDE_PREFIX)) {
      String api = k.substring(ENDPOINT_OVERRIDE_PREFIX.length());
      p.get(k).ifPresent(v -> endpoints.put(api, v));
    }
    Map<String, String> versions = new LinkedHashMap<>();
    for (String k : p.keys(VERSION_OVERRIDE_PREFIX)) {
      String api = k.substring(VERSION_OVERRIDE_PREFIX.length());
      p.get(k).ifPresent(v -> versions.put(api, v));
    }
    Set<String> unquoted = new LinkedHashSet<>();
    for (String part : p.get(UNQUOTED_APIS).orElse("compute,clouduseraccounts,storage").split(",")) {
      String s = part.trim();
      if (!s.isEmpty()) unquoted.add(s);
    }
    return new RegistryConfig(endpoints, versions,
        p.get(CANONICAL_DOMAIN).orElse("googleapis.com"), unquoted, Storage.from(p));
  }

  public static RegistryConfig load() {
    return load(Thread.currentThread().getContextClassLoader());
  }

  public static RegistryConfig load(ClassLoader cl) {
    if (cl == null) cl = RegistryConfig.class.getClassLoader();
    Properties merged = new Properties();

    Enumeration<URL> resources;
    try {
      resources = cl.getResources(RESOURCE);
    } catch (IOException e) {
      throw new IllegalStateException("Failed to enumerate " + RESOURCE, e);
    }
    while (resources.hasMoreElements()) {
      URL url = resources.nextElement();
      Properties p = new Properties();
      try (InputStream in = url.openStream()) {
        p.load(in);
      } catch (IOException e) {
        throw new IllegalStateException("Failed to load " + RESOURCE + " from " + url, e);
      }
      merged.putAll(p);
    }

    for (String k : System.getProperties().stringPropertyNames()) {
      if (k.startsWith("resref.")) merged.setProperty(k, System.getProperty(k));
    }
    return from(PropertySource.of(merged));
  }

  public Optional<String> endpointOverride(String api) {
    return Optional.ofNullable(endpointOverrides.get(api));
  }

  public Optional<String> versionOverride(String api) {
    return Optional.ofNullable(versionOverrides.get(api));
  }

  public boolean unquotesLinks(String api) {
    return unquotedApis.contains(api);
  }

  public RegistryConfig withEndpointOverride(String api, String url) {
    Map<String, String> m = new LinkedHashMap<>(endpointOverrides);
    m.put(api, url);
    return new RegistryConfig(m, versionOverrides, canonicalDomain, unquotedApis, storage);
  }

  public RegistryConfig withVersionOverride(String api, String version) {
    Map<String, String> m = new LinkedHashMap<>(versionOverrides);
    m.put(api, version);
    return new RegistryConfig(endpointOverrides, m, canonicalDomain, unquotedApis, storage);
  }
}
