package io.intellixity.resref.registry;

import io.intellixity.resref.config.RegistryConfig;
import io.intellixity.resref.error.InvalidEndpointException;
import io.intellixity.resref.error.InvalidResourceException;

import java.util.Arrays;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Splits a resource URL into api, version and resource path.\n
 *
 * Order:\n
 * - configured endpoint overrides (the URL starts with an override for an api)\n
 * - non-canonical hosts ({@code www.googleapis.com}, {@code localhost:8080}): {@code /api/version/path}\n
 * - canonical hosts ({@code svc.googleapis.com}): api is the first host label, {@code /[version/]path}\n
 */
final class ApiEndpoints {
  private static final Pattern VERSION = Pattern.compile("v\\d+[a-z0-9]*|alpha|beta");

  private final RegistryConfig config;

  ApiEndpoints(RegistryConfig config) {
    this.config = config;
  }

  /**
   * @param version null when the URL does not name one; the registry picks the API's version
   * @param endpoint URL prefix that precedes {@code resourcePath}
   */
  record Split(String api, String version, String resourcePath, String endpoint) {}

  Split split(String url) {
    if (url == null || !(url.startsWith("http://") || url.startsWith("https://"))) {
      throw new InvalidEndpointException(url);
    }

    for (Map.Entry<String, String> e : config.endpointOverrides().entrySet()) {
      String override = e.getValue().endsWith("/") ? e.getValue() : e.getValue() + "/";
      if (url.startsWith(override)) return splitOverride(url, e.getKey(), override);
    }

    String[] tokens = url.substring(url.indexOf("://") + 3).split("/", -1);
    String host = tokens[0];
    if (!isCanonical(host)) {
      if (tokens.length < 4) throw new InvalidResourceException(url);
      return split(url, tokens[1], tokens[2], tokens, 3);
    }

    String api = host.substring(0, host.indexOf('.'));
    if (tokens.length > 2 && isVersion(tokens[1])) return split(url, api, tokens[1], tokens, 2);
    return split(url, api, null, tokens, 1);
  }

  private Split splitOverride(String url, String api, String override) {
    String[] tokens = url.substring(override.length()).split("/", -1);
    // the override may already carry the version (https://host/svc/v1/), or leave it to the url
    String[] overrideTokens = override.substring(override.indexOf("://") + 3).split("/");
    String version = null;
    for (int i = overrideTokens.length - 1; i > 0 && version == null; i--) {
      if (isVersion(overrideTokens[i])) version = overrideTokens[i];
    }
    int start = 0;
    if (version == null && tokens.length > 1 && isVersion(tokens[0])) {
      version = tokens[0];
      start = 1;
    }
    String path = String.join("/", Arrays.copyOfRange(tokens, start, tokens.length));
    if (path.isEmpty()) throw new InvalidResourceException(url);
    return new Split(api, version, path, url.substring(0, url.length() - path.length()));
  }

  private static Split split(String url, String api, String version, String[] tokens, int pathStart) {
    if (api.isEmpty() || (version != null && version.isEmpty())) throw new InvalidResourceException(url);
    String path = String.join("/", Arrays.copyOfRange(tokens, pathStart, tokens.length));
    if (path.isEmpty()) throw new InvalidResourceException(url);
    return new Split(api, version, path, url.substring(0, url.length() - path.length()));
  }

  private boolean isCanonical(String host) {
    int colon = host.indexOf(':');
    String h = colon < 0 ? host : host.substring(0, colon);
    if (h.startsWith("www.") || h.startsWith("www-")) return false;
    return h.endsWith("." + config.canonicalDomain());
  }

  static boolean isVersion(String token) {
    return VERSION.matcher(token).matches();
  }
}
