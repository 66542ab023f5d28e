package io.intellixity.resref.ref;

import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import io.intellixity.resref.error.UnknownFieldException;
import io.intellixity.resref.schema.CollectionSchema;
import io.intellixity.resref.util.PercentCodec;

import java.util.*;

/**
 * A possibly partially resolved pointer to one resource of a collection.\n
 *
 * Fields come from the parsed text, then from the parse-time context, then from registry defaults.
 * Filled fields are never overwritten.\n
 */
@JsonSerialize(using = ReferenceJsonSerializer.class)
public final class Reference {
  private static final String WILDCARD = "*";

  private final CollectionSchema schema;
  private final Map<String, String> values = new LinkedHashMap<>();
  private final Map<String, Resolver> context;
  private final String collectionPath;
  private final String endpointUrl;
  private final ParamDefaults defaults;
  private final boolean unquoteLinks;
  private String selfLink;

  /**
   * @param fields one entry per ordered param of {@code schema}; null for unsupplied
   * @param collectionPath the text this reference was parsed from, used in error messages
   */
  public Reference(CollectionSchema schema, List<String> fields, Map<String, Resolver> context,
                   String collectionPath, String endpointUrl, ParamDefaults defaults, boolean unquoteLinks) {
    this.schema = Objects.requireNonNull(schema, "schema");
    List<String> params = schema.orderedParams();
    if (fields == null || fields.size() != params.size()) {
      throw new IllegalArgumentException("expected " + params.size() + " fields for " + schema.id() + ", got " + fields);
    }
    for (int i = 0; i < params.size(); i++) values.put(params.get(i), fields.get(i));
    this.context = context == null ? Map.of() : new LinkedHashMap<>(context);
    this.collectionPath = collectionPath;
    String base = endpointUrl == null ? schema.baseUrl() : endpointUrl;
    this.endpointUrl = base.endsWith("/") ? base : base + "/";
    this.defaults = defaults == null ? ParamDefaults.NONE : defaults;
    this.unquoteLinks = unquoteLinks;
  }

  public String collection() { return schema.id(); }
  public String api() { return schema.api(); }
  public String version() { return schema.version(); }
  public CollectionSchema schema() { return schema; }
  public String collectionPath() { return collectionPath; }
  public String endpointUrl() { return endpointUrl; }

  /** Current value of {@code param}, or null when not (yet) resolved. */
  public String get(String param) {
    if (!values.containsKey(param)) {
      throw new IllegalArgumentException("collection " + schema.id() + " has no param " + param);
    }
    return values.get(param);
  }

  /** Ordered snapshot of the fields; unresolved ones map to null. */
  public Map<String, String> params() {
    return Collections.unmodifiableMap(new LinkedHashMap<>(values));
  }

  public String name() {
    resolve();
    return values.get(schema.terminalParam());
  }

  public String selfLink() {
    resolve();
    return selfLink;
  }

  /** Self link with {@code *} standing in for fields that could not be resolved. */
  public String weakSelfLink() {
    weakResolve();
    return selfLink;
  }

  /** The expanded relative path, without the endpoint. */
  public String relativeName() {
    resolve();
    return compose(schema.template().expand(values, WILDCARD));
  }

  /**
   * Fill empty fields on a best-effort basis. Never throws for fields that stay empty.
   */
  public void weakResolve() {
    for (Map.Entry<String, String> e : values.entrySet()) {
      if (isSet(e.getValue())) continue;
      String param = e.getKey();

      Optional<String> v = Optional.empty();
      Resolver r = context.get(param);
      if (r != null) v = r.resolve();
      if (v.isEmpty()) v = defaults.lookup(param);
      v.ifPresent(e::setValue);
    }
    selfLink = link();
  }

  /**
   * @throws UnknownFieldException naming the first param that is still empty
   */
  public void resolve() {
    weakResolve();
    for (Map.Entry<String, String> e : values.entrySet()) {
      if (!isSet(e.getValue())) throw new UnknownFieldException(collectionPath, e.getKey());
    }
  }

  private String compose(String link) {
    return unquoteLinks ? PercentCodec.decode(link) : link;
  }

  private static boolean isSet(String v) {
    return v != null && !v.isEmpty();
  }

  /**
   * Compares collection, endpoint and the fields filled so far. Neither this nor {@link #hashCode}
   * resolves anything; the hash changes when {@link #weakResolve} fills a field.
   */
  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Reference other)) return false;
    return schema.id().equals(other.schema.id())
        && endpointUrl.equals(other.endpointUrl)
        && values.equals(other.values);
  }

  @Override
  public int hashCode() {
    return Objects.hash(schema.id(), endpointUrl, values);
  }

  /** The link as currently filled, {@code *} for empty fields; does not resolve. */
  @Override
  public String toString() {
    return link();
  }

  private String link() {
    return compose(endpointUrl + schema.template().expand(values, WILDCARD));
  }
}
