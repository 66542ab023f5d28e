package io.intellixity.resref.catalog.yaml;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.intellixity.resref.catalog.CatalogLoadException;
import io.intellixity.resref.error.ResourceConfigurationException;
import io.intellixity.resref.schema.ApiDefinition;
import io.intellixity.resref.schema.ApiVersion;
import io.intellixity.resref.schema.CollectionSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;

/**
 * Loads API definitions from YAML or JSON documents.\n
 *
 * <pre>
 * api: compute
 * version: v1
 * default: true
 * baseUrl: https://compute.googleapis.com/compute/v1/
 * collections:
 *   - name: instances
 *     path: projects/{project}/zones/{zone}/instances/{instance}
 *     params: [project, zone, instance]
 * </pre>
 *
 * A YAML file may hold several documents; a JSON file holds one object or an array of them.
 * A collection may give a full {@code id} instead of a {@code name}.\n
 */
public final class YamlApiCatalogLoader {
  private static final Logger log = LoggerFactory.getLogger(YamlApiCatalogLoader.class);

  private final ObjectMapper yaml;
  private final ObjectMapper json;

  public YamlApiCatalogLoader() {
    this.yaml = new ObjectMapper(new YAMLFactory()).configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    this.json = new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
  }

  /** Every *.yaml, *.yml and *.json file directly under {@code dir}, in file name order. */
  public List<ApiDefinition> loadDir(Path dir) {
    if (!Files.isDirectory(dir)) throw new CatalogLoadException("Not a directory: " + dir);
    List<Path> files;
    try (Stream<Path> s = Files.list(dir)) {
      files = s.filter(YamlApiCatalogLoader::isCatalogFile).sorted().toList();
    } catch (IOException e) {
      throw new CatalogLoadException("Failed to list " + dir, e);
    }
    List<ApiDefinition> out = new ArrayList<>();
    for (Path f : files) out.addAll(loadFile(f));
    log.info("resref.catalog_loaded dir={} files={} apis={}", dir, files.size(), out.size());
    return out;
  }

  public List<ApiDefinition> loadFile(Path file) {
    try (InputStream in = Files.newInputStream(file)) {
      return load(in, isJson(file.getFileName().toString()), file.toString());
    } catch (IOException e) {
      throw new CatalogLoadException("Failed to read " + file, e);
    }
  }

  /** Load a catalog document from the classpath. */
  public List<ApiDefinition> loadResource(String resource) {
    ClassLoader cl = Thread.currentThread().getContextClassLoader();
    if (cl == null) cl = YamlApiCatalogLoader.class.getClassLoader();
    try (InputStream in = cl.getResourceAsStream(resource)) {
      if (in == null) throw new CatalogLoadException("No such resource: " + resource);
      return load(in, isJson(resource), resource);
    } catch (IOException e) {
      throw new CatalogLoadException("Failed to read " + resource, e);
    }
  }

  private List<ApiDefinition> load(InputStream in, boolean isJson, String source) throws IOException {
    List<ApiDoc> docs = new ArrayList<>();
    if (isJson) {
      JsonNode root = json.readTree(in);
      if (root == null || root.isMissingNode()) return List.of();
      if (root.isArray()) {
        for (JsonNode n : root) docs.add(json.treeToValue(n, ApiDoc.class));
      } else {
        docs.add(json.treeToValue(root, ApiDoc.class));
      }
    } else {
      try (MappingIterator<ApiDoc> it = yaml.readerFor(ApiDoc.class).readValues(in)) {
        while (it.hasNext()) {
          ApiDoc d = it.next();
          if (d != null) docs.add(d);
        }
      }
    }

    List<ApiDefinition> out = new ArrayList<>(docs.size());
    for (ApiDoc d : docs) out.add(toDefinition(d, source));
    return out;
  }

  private static ApiDefinition toDefinition(ApiDoc d, String source) {
    if (d.api() == null || d.version() == null || d.baseUrl() == null) {
      throw new CatalogLoadException("api, version and baseUrl are required in " + source);
    }
    ApiVersion owner = new ApiVersion(d.api(), d.version());
    List<CollectionSchema> collections = new ArrayList<>();
    if (d.collections() != null) {
      for (CollectionDoc c : d.collections()) {
        String id = c.id() != null ? c.id() : d.api() + "." + c.name();
        try {
          collections.add(new CollectionSchema(owner, id, c.params(), c.path(), d.baseUrl()));
        } catch (ResourceConfigurationException e) {
          throw new CatalogLoadException("Invalid collection " + id + " in " + source + ": " + e.getMessage(), e);
        }
      }
    }
    return new ApiDefinition(owner, d.defaultVersion(), d.baseUrl(), collections);
  }

  private static boolean isCatalogFile(Path p) {
    String n = p.getFileName().toString().toLowerCase(Locale.ROOT);
    return Files.isRegularFile(p) && (n.endsWith(".yaml") || n.endsWith(".yml") || n.endsWith(".json"));
  }

  private static boolean isJson(String name) {
    return name.toLowerCase(Locale.ROOT).endsWith(".json");
  }

  record ApiDoc(String api,
                String version,
                @JsonProperty("default") boolean defaultVersion,
                String baseUrl,
                List<CollectionDoc> collections) {}

  record CollectionDoc(String name, String id, String path, List<String> params) {}
}
