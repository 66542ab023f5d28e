package io.intellixity.resref.registry;

import io.intellixity.resref.error.InvalidResourceException;
import io.intellixity.resref.error.WrongFieldNumberException;
import io.intellixity.resref.error.WrongResourceCollectionException;
import io.intellixity.resref.ref.ParamDefaults;
import io.intellixity.resref.ref.Reference;
import io.intellixity.resref.ref.Resolver;
import io.intellixity.resref.schema.CollectionSchema;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns a collection-path ({@code [collection::]path}) into a {@link Reference} of one collection.\n
 *
 * Accepted shapes for params [p1..pN]:\n
 * - {@code /p1/.../pN} (leading slash, all N)\n
 * - {@code p1/.../pN} (all N)\n
 * - {@code p2/.../pN} (all but the first)\n
 * - {@code pN} (terminal only)\n
 */
public final class CollectionPathParser {
  static final Pattern COLLECTION_PATH =
      Pattern.compile("(?:(?<collection>[a-zA-Z_]+(?:\\.[a-zA-Z0-9_]+)+)::)?(?<path>.+)", Pattern.DOTALL);

  private final Registry registry;
  private final CollectionSchema schema;

  CollectionPathParser(Registry registry, CollectionSchema schema) {
    this.registry = Objects.requireNonNull(registry, "registry");
    this.schema = Objects.requireNonNull(schema, "schema");
  }

  public CollectionSchema schema() { return schema; }

  /** Same schema, bound to another registry (used when cloning). */
  CollectionPathParser rebind(Registry other) {
    return new CollectionPathParser(other, schema);
  }

  /**
   * @param collectionPath text to parse; null takes every field from context and defaults
   * @param context resolvers for fields the text does not carry
   * @param resolve whether to fail now on fields that remain empty
   * @param baseUrl endpoint for the reference; null for the schema's own
   */
  public Reference parse(String collectionPath, Map<String, Resolver> context, boolean resolve, String baseUrl) {
    List<String> fields = collectionPath == null
        ? Collections.nCopies(schema.orderedParams().size(), null)
        : fieldsFor(collectionPath);

    ParamDefaults defaults = param -> registry.defaults().lookup(schema.api(), schema.collectionName(), param);
    Reference ref = new Reference(schema, fields, context, collectionPath, baseUrl, defaults,
        registry.config().unquotesLinks(schema.api()));
    if (resolve) ref.resolve();
    return ref;
  }

  List<String> fieldsFor(String collectionPath) {
    Matcher m = COLLECTION_PATH.matcher(collectionPath);
    if (!m.matches()) throw new InvalidResourceException(collectionPath);

    String collection = m.group("collection");
    String path = m.group("path");
    if (collection != null && !collection.equals(schema.id())) {
      throw new WrongResourceCollectionException(schema.id(), collection, collectionPath);
    }

    List<String> params = schema.orderedParams();
    int total = params.size();
    boolean hasAll = path.startsWith("/");

    List<String> fields = new ArrayList<>(Arrays.asList(path.split("/", -1)));
    if (hasAll) fields.remove(0);

    if (hasAll && fields.size() != total) throw new WrongFieldNumberException(path, params);
    if (fields.size() > total) throw new WrongFieldNumberException(path, params);
    if (!hasAll && fields.size() != 1 && fields.size() != total - 1 && fields.size() != total) {
      throw new WrongFieldNumberException(path, params);
    }
    if (fields.contains("")) throw new WrongFieldNumberException(path, params);

    List<String> out = new ArrayList<>(total);
    for (int i = fields.size(); i < total; i++) out.add(null);
    out.addAll(fields);
    return out;
  }

  @Override
  public String toString() {
    StringBuilder path = new StringBuilder();
    for (String p : schema.orderedParams()) {
      path.insert(0, '[').append("]/").append(p);
    }
    return "[" + schema.id() + "::]" + path;
  }
}
