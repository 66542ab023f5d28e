package io.intellixity.resref.schema;

import io.intellixity.resref.error.MalformedSchemaException;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Static description of one resource collection.\n
 *
 * The last ordered param is the terminal one: it names the instance and never comes from a resolver.\n
 */
public final class CollectionSchema {
  private final ApiVersion owner;
  private final String id;
  private final List<String> orderedParams;
  private final UriTemplate template;
  private final String baseUrl;

  public CollectionSchema(ApiVersion owner, String id, List<String> orderedParams, String relativePath, String baseUrl) {
    this.owner = Objects.requireNonNull(owner, "owner");
    if (id == null || id.isBlank()) throw new MalformedSchemaException("collection id is blank");
    if (id.indexOf('.') <= 0) throw new MalformedSchemaException("collection id must be dotted: " + id);
    if (orderedParams == null || orderedParams.isEmpty()) {
      throw new MalformedSchemaException("collection [" + id + "] has no params");
    }
    if (baseUrl == null || baseUrl.isBlank()) throw new MalformedSchemaException("collection [" + id + "] has no base url");

    this.id = id;
    this.orderedParams = List.copyOf(orderedParams);
    this.template = UriTemplate.parse(relativePath);
    this.baseUrl = baseUrl;

    List<String> placeholders = template.params();
    Set<String> unique = new HashSet<>(this.orderedParams);
    if (unique.size() != this.orderedParams.size()) {
      throw new MalformedSchemaException("collection [" + id + "] repeats a param: " + this.orderedParams);
    }
    if (placeholders.size() != this.orderedParams.size() || !unique.equals(new HashSet<>(placeholders))) {
      throw new MalformedSchemaException("collection [" + id + "] template " + relativePath
          + " does not match params " + this.orderedParams);
    }
  }

  public ApiVersion owner() { return owner; }
  public String api() { return owner.api(); }
  public String version() { return owner.version(); }
  public String id() { return id; }
  public List<String> orderedParams() { return orderedParams; }
  public String terminalParam() { return orderedParams.get(orderedParams.size() - 1); }
  public UriTemplate template() { return template; }
  public String relativePath() { return template.source(); }
  public String baseUrl() { return baseUrl; }

  /** The id without its leading API segment, e.g. {@code projects.widgets}. */
  public String collectionName() {
    return id.substring(id.indexOf('.') + 1);
  }

  @Override
  public String toString() {
    return id + "@" + owner + " " + template;
  }
}
