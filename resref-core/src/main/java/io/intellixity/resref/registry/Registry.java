package io.intellixity.resref.registry;

import io.intellixity.resref.catalog.ApiCatalog;
import io.intellixity.resref.config.RegistryConfig;
import io.intellixity.resref.error.InvalidResourceException;
import io.intellixity.resref.error.UnknownApiException;
import io.intellixity.resref.error.UnknownCollectionException;
import io.intellixity.resref.error.WrongResourceCollectionException;
import io.intellixity.resref.ref.DefaultResolverTable;
import io.intellixity.resref.ref.Reference;
import io.intellixity.resref.ref.Resolver;
import io.intellixity.resref.schema.ApiDefinition;
import io.intellixity.resref.schema.ApiVersion;
import io.intellixity.resref.schema.CollectionSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resolves resource text (collection-paths, URLs, storage shorthand) into {@link Reference}s.\n
 *
 * APIs are materialized from the {@link ApiCatalog} the first time one of their collections or URLs
 * is seen. Not thread-safe: use {@link #cloneAndSwitchApis} to get an isolated copy.\n
 */
public final class Registry {
  private static final Logger log = LoggerFactory.getLogger(Registry.class);

  static final String BUCKET = "bucket";
  static final String OBJECT = "object";

  private final ApiCatalog catalog;
  private final RegistryConfig config;
  private final ApiEndpoints endpoints;
  private final DefaultResolverTable defaults;
  private final Map<String, Set<String>> registeredVersions;
  private final ParserIndex parsers;
  private final UrlTrie urlTrie;
  private final Pattern storageUrl;

  public Registry(ApiCatalog catalog) {
    this(catalog, RegistryConfig.load());
  }

  public Registry(ApiCatalog catalog, RegistryConfig config) {
    this.catalog = Objects.requireNonNull(catalog, "catalog");
    this.config = Objects.requireNonNull(config, "config");
    this.endpoints = new ApiEndpoints(config);
    this.defaults = new DefaultResolverTable();
    this.registeredVersions = new LinkedHashMap<>();
    this.parsers = new ParserIndex();
    this.urlTrie = new UrlTrie();
    this.storageUrl = storagePattern(config);
  }

  /** Deep copy of {@code source}; every parser is re-pointed at the new registry. */
  private Registry(Registry source) {
    this.catalog = source.catalog;
    this.config = source.config;
    this.endpoints = source.endpoints;
    this.defaults = source.defaults.copy();
    this.registeredVersions = new LinkedHashMap<>();
    source.registeredVersions.forEach((api, versions) -> registeredVersions.put(api, new LinkedHashSet<>(versions)));

    Map<CollectionPathParser, CollectionPathParser> rebound = new IdentityHashMap<>();
    this.parsers = source.parsers.copy(p -> rebound.computeIfAbsent(p, x -> x.rebind(this)));
    this.urlTrie = source.urlTrie.copy(p -> rebound.computeIfAbsent(p, x -> x.rebind(this)));
    this.storageUrl = source.storageUrl;
  }

  public RegistryConfig config() { return config; }
  public DefaultResolverTable defaults() { return defaults; }

  /** Snapshot of every api/version materialized so far. */
  public Set<ApiVersion> knownApis() {
    Set<ApiVersion> out = new LinkedHashSet<>();
    registeredVersions.forEach((api, versions) -> versions.forEach(v -> out.add(new ApiVersion(api, v))));
    return Collections.unmodifiableSet(out);
  }

  // ---- registration ----

  /**
   * Add one collection: grows the URL trie and makes its parser the active one for its id.
   *
   * @throws io.intellixity.resref.error.AmbiguousAPIException if a different API already owns the id
   */
  public void registerSchema(CollectionSchema schema) {
    CollectionPathParser parser = new CollectionPathParser(this, schema);
    parsers.checkClaim(parser);
    urlTrie.insert(trieTokens(schema), parser);
    parsers.claim(parser);
    markRegistered(schema.api(), schema.version());
  }

  /**
   * Materialize {@code api} if needed and return the version in use.\n
   *
   * Without a version: the only registered version, else the configured override, else the catalog default.
   *
   * @throws UnknownApiException if the catalog does not know the api or version
   */
  public String registerApi(String api, String version) {
    if (version == null) version = activeVersion(api);
    if (registeredVersions.getOrDefault(api, Set.of()).contains(version)) return version;

    register(catalog.definition(api, version));
    return version;
  }

  private String activeVersion(String api) {
    // a registered (or switched-in) version outranks the configured override
    Set<String> registered = registeredVersions.getOrDefault(api, Set.of());
    if (registered.size() == 1) return registered.iterator().next();
    Optional<String> override = config.versionOverride(api);
    if (override.isPresent()) return override.get();
    return catalog.defaultVersion(api).orElseThrow(() -> UnknownApiException.api(api));
  }

  /** Checks every collection of {@code def} against the current state before changing anything. */
  private void register(ApiDefinition def) {
    List<CollectionPathParser> fresh = new ArrayList<>(def.collections().size());
    for (CollectionSchema c : def.collections()) {
      CollectionPathParser p = new CollectionPathParser(this, c);
      parsers.checkClaim(p);
      urlTrie.checkInsert(trieTokens(c), p);
      fresh.add(p);
    }
    for (CollectionPathParser p : fresh) {
      urlTrie.insert(trieTokens(p.schema()), p);
      parsers.claim(p);
    }
    markRegistered(def.api(), def.version());
    log.debug("resref.register api={} version={} collections={}", def.api(), def.version(), def.collections().size());
  }

  private void markRegistered(String api, String version) {
    registeredVersions.computeIfAbsent(api, k -> new LinkedHashSet<>()).add(version);
  }

  /**
   * Replace the active version of an API. Collection-path parsing switches to {@code def};
   * URLs of previously registered versions still parse.
   */
  public void switchApi(ApiDefinition def) {
    List<CollectionPathParser> fresh = new ArrayList<>(def.collections().size());
    for (CollectionSchema c : def.collections()) {
      CollectionPathParser p = new CollectionPathParser(this, c);
      urlTrie.insert(trieTokens(c), p);
      fresh.add(p);
    }
    parsers.supersede(def.api(), fresh);

    Set<String> versions = registeredVersions.computeIfAbsent(def.api(), k -> new LinkedHashSet<>());
    versions.clear();
    versions.add(def.version());
    log.info("resref.switch_api api={} version={} collections={}", def.api(), def.version(), fresh.size());
  }

  /** Independent copy of this registry with the given API versions switched in; this registry is untouched. */
  public Registry cloneAndSwitchApis(ApiDefinition... defs) {
    Registry clone = new Registry(this);
    for (ApiDefinition d : defs) clone.switchApi(d);
    return clone;
  }

  // ---- defaults ----

  public void setDefault(String api, String collection, String param, Resolver resolver) {
    defaults.setDefault(api, collection, param, resolver);
  }

  public Optional<Resolver> getDefault(String api, String collection, String param) {
    return defaults.getDefault(api, collection, param);
  }

  // ---- parsing ----

  /**
   * Parse a collection-path for a known collection.
   *
   * @throws UnknownCollectionException if no registered or catalogued API has the collection
   */
  public Reference parseCollectionPath(String collection, String collectionPath, Map<String, Resolver> context,
                                       boolean resolve) {
    String api = apiOf(collection);
    try {
      registerApi(api, null);
    } catch (UnknownApiException e) {
      throw UnknownCollectionException.forCollection(collection);
    }
    CollectionPathParser parser = parsers.get(collection)
        .orElseThrow(() -> UnknownCollectionException.forCollection(collection));
    String baseUrl = config.endpointOverride(api).orElse(null);
    return parser.parse(collectionPath, context, resolve, baseUrl);
  }

  /**
   * Parse a full resource URL. A matched URL names every field, so the result is always resolved.
   *
   * @throws io.intellixity.resref.error.InvalidEndpointException if the URL has no http(s) scheme
   * @throws InvalidResourceException if no registered collection matches
   */
  public Reference parseUrl(String url) {
    ApiEndpoints.Split split = endpoints.split(url);
    String version;
    try {
      version = split.version() != null ? split.version() : activeVersion(split.api());
      // versions switched out earlier stay in the trie and need no re-registration
      if (!urlTrie.hasBranch(split.api(), version)) registerApi(split.api(), version);
    } catch (UnknownApiException e) {
      throw new InvalidResourceException(url);
    }

    List<String> tokens = new ArrayList<>();
    tokens.add(split.api());
    tokens.add(version);
    tokens.addAll(Arrays.asList(split.resourcePath().split("/", -1)));

    UrlTrie.Match m = urlTrie.match(tokens, url);
    if (log.isTraceEnabled()) {
      log.trace("resref.url_match url={} collection={} params={}", url, m.parser().schema().id(), m.params());
    }
    return m.parser().parse(null, Resolver.literals(m.params()), true, split.endpoint());
  }

  /** {@code gs://bucket} or {@code gs://bucket/object/path}. */
  public Reference parseStorageUrl(String url) {
    Matcher m = url == null ? null : storageUrl.matcher(url);
    if (m == null || !m.matches()) throw new InvalidResourceException(url);
    if (m.group(2) != null && !m.group(2).isEmpty()) {
      return storageObject(m.group(1), m.group(2), true);
    }
    return storageBucket(m.group(1), true);
  }

  public Reference parse(String text) {
    return parse(text, Map.of(), null, true, true);
  }

  public Reference parse(String text, Map<String, Resolver> context, String collection) {
    return parse(text, context, collection, true, true);
  }

  /**
   * Front door: URLs, storage shorthand and collection-paths.
   *
   * @param context resolvers for params the text leaves out
   * @param collection expected collection; required for collection-paths without a {@code collection::} prefix
   * @param enforceCollection for URLs, fail when the URL points into a collection other than {@code collection}
   * @param resolve for collection-paths, fail now on params that stay empty
   */
  public Reference parse(String text, Map<String, Resolver> context, String collection,
                         boolean enforceCollection, boolean resolve) {
    Map<String, Resolver> ctx = context == null ? Map.of() : context;

    if (text != null && !text.isEmpty()) {
      if (text.startsWith("https://") || text.startsWith("http://")) {
        Reference ref = parseHttpUrl(text);
        if (enforceCollection && collection != null && !ref.collection().equals(collection)) {
          throw new WrongResourceCollectionException(collection, ref.collection(), ref.selfLink());
        }
        return ref;
      }
      if (text.startsWith(config.storage().shorthandPrefix())) {
        return parseStorageUrl(text);
      }
    }

    if (collection == null) {
      if (text == null) throw UnknownCollectionException.forLine(null);
      Matcher m = CollectionPathParser.COLLECTION_PATH.matcher(text);
      if (!m.matches()) throw new InvalidResourceException(text);
      collection = m.group("collection");
      if (collection == null) throw UnknownCollectionException.forLine(text);
    }

    if (collection.equals(config.storage().objectCollection())) {
      Map<String, Resolver> p = new LinkedHashMap<>(ctx);
      if (!p.containsKey(BUCKET) || !p.containsKey(OBJECT)) {
        String path = stripCollection(text, collection);
        int slash = path == null ? -1 : path.indexOf('/');
        if (slash <= 0 || slash == path.length() - 1) throw new InvalidResourceException(text);
        p.put(BUCKET, Resolver.literal(path.substring(0, slash)));
        p.put(OBJECT, Resolver.literal(path.substring(slash + 1)));
      }
      return parseCollectionPath(collection, null, p, resolve);
    }

    return parseCollectionPath(collection, text, ctx, resolve);
  }

  /** Shortcut for {@code parse(null, params, collection)}. */
  public Reference create(String collection, Map<String, String> params) {
    return parse(null, Resolver.literals(params), collection, true, true);
  }

  private Reference parseHttpUrl(String url) {
    try {
      return parseUrl(url);
    } catch (InvalidResourceException e) {
      Reference storage = parseStorageHttpUrl(url);
      if (storage == null) throw e;
      return storage;
    }
  }

  /** Storage JSON/XML API URLs that the catalog does not describe as templates. */
  private Reference parseStorageHttpUrl(String url) {
    RegistryConfig.Storage s = config.storage();
    if (s.jsonApiUrl() != null && url.startsWith(s.jsonApiUrl())) {
      String[] parts = url.substring(s.jsonApiUrl().length()).split("/", 4);
      if (parts.length != 4 || !"b".equals(parts[0]) || !"o".equals(parts[2])) return null;
      return storageObject(parts[1], parts[3], true);
    }
    if (s.xmlApiUrl() != null && url.startsWith(s.xmlApiUrl())) {
      String rest = url.substring(s.xmlApiUrl().length());
      if (rest.isEmpty()) return null;
      int slash = rest.indexOf('/');
      if (slash < 0) return storageBucket(rest, true);
      return storageObject(rest.substring(0, slash), rest.substring(slash + 1), true);
    }
    return null;
  }

  private Reference storageBucket(String bucket, boolean resolve) {
    return parseCollectionPath(config.storage().bucketCollection(), null,
        Map.of(BUCKET, Resolver.literal(bucket)), resolve);
  }

  private Reference storageObject(String bucket, String object, boolean resolve) {
    return parseCollectionPath(config.storage().objectCollection(), null,
        Map.of(BUCKET, Resolver.literal(bucket), OBJECT, Resolver.literal(object)), resolve);
  }

  private static String stripCollection(String text, String collection) {
    if (text == null) return null;
    Matcher m = CollectionPathParser.COLLECTION_PATH.matcher(text);
    if (!m.matches() || m.group("collection") == null) return text;
    if (!m.group("collection").equals(collection)) {
      throw new WrongResourceCollectionException(collection, m.group("collection"), text);
    }
    return m.group("path");
  }

  private static List<String> trieTokens(CollectionSchema schema) {
    List<String> tokens = new ArrayList<>();
    tokens.add(schema.api());
    tokens.add(schema.version());
    tokens.addAll(schema.template().tokens());
    return tokens;
  }

  private static String apiOf(String collection) {
    int dot = collection.indexOf('.');
    return dot < 0 ? collection : collection.substring(0, dot);
  }

  private static Pattern storagePattern(RegistryConfig config) {
    return Pattern.compile("^" + Pattern.quote(config.storage().shorthandPrefix()) + "([^/]+)(?:/(.*))?$", Pattern.DOTALL);
  }
}
