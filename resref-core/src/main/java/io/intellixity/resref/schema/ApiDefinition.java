package io.intellixity.resref.schema;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Everything the catalog knows about one API version: its endpoint and its collections.
 *
 * @param owner api name and version
 * @param defaultVersion whether this is the version used when none is asked for
 * @param baseUrl endpoint root, e.g. {@code https://svc.googleapis.com/v1/}
 * @param collections the collection schemas of this version
 */
public record ApiDefinition(ApiVersion owner, boolean defaultVersion, String baseUrl, List<CollectionSchema> collections) {
  public ApiDefinition {
    Objects.requireNonNull(owner, "owner");
    if (baseUrl == null || baseUrl.isBlank()) throw new IllegalArgumentException("baseUrl is required");
    collections = collections == null ? List.of() : List.copyOf(collections);
    for (CollectionSchema c : collections) {
      if (!owner.equals(c.owner())) {
        throw new IllegalArgumentException("collection " + c.id() + " belongs to " + c.owner() + ", not " + owner);
      }
    }
  }

  public String api() { return owner.api(); }
  public String version() { return owner.version(); }

  /** Collection ids added through the builder are {@code api + "." + name}, base url is this definition's. */
  public static Builder builder(String api, String version) {
    return new Builder(new ApiVersion(api, version));
  }

  public static final class Builder {
    private final ApiVersion owner;
    private final List<CollectionSchema> collections = new ArrayList<>();
    private boolean defaultVersion;
    private String baseUrl;

    private Builder(ApiVersion owner) { this.owner = owner; }

    public Builder defaultVersion(boolean v) { this.defaultVersion = v; return this; }
    public Builder baseUrl(String v) { this.baseUrl = v; return this; }

    public Builder collection(String name, String relativePath, String... params) {
      return collection(name, relativePath, List.of(params));
    }

    public Builder collection(String name, String relativePath, List<String> params) {
      if (baseUrl == null) throw new IllegalStateException("baseUrl must be set before collections");
      collections.add(new CollectionSchema(owner, owner.api() + "." + name, params, relativePath, baseUrl));
      return this;
    }

    /** Add a schema whose id does not follow the {@code api.name} convention. */
    public Builder schema(String id, String relativePath, List<String> params) {
      if (baseUrl == null) throw new IllegalStateException("baseUrl must be set before collections");
      collections.add(new CollectionSchema(owner, id, params, relativePath, baseUrl));
      return this;
    }

    public ApiDefinition build() {
      return new ApiDefinition(owner, defaultVersion, baseUrl, collections);
    }
  }
}
