package io.intellixity.resref.tools;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.intellixity.resref.catalog.InMemoryApiCatalog;
import io.intellixity.resref.catalog.yaml.YamlApiCatalogLoader;
import io.intellixity.resref.config.RegistryConfig;
import io.intellixity.resref.error.ResourceConfigurationException;
import io.intellixity.resref.error.ResourceUserException;
import io.intellixity.resref.ref.Reference;
import io.intellixity.resref.ref.Resolver;
import io.intellixity.resref.registry.Registry;
import io.intellixity.resref.schema.ApiDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * CLI:
 *   ResolveMain <catalogDir> <text> [--collection=c] [--param=k=v]... [--weak]
 *
 * Prints the parsed reference as JSON. Exit codes: 0 ok, 1 unresolvable input or bad catalog, 2 usage.
 */
public final class ResolveMain {
  private static final Logger log = LoggerFactory.getLogger(ResolveMain.class);

  static final String USAGE = "Usage: ResolveMain <catalogDir> <text> [--collection=c] [--param=k=v]... [--weak]";

  private ResolveMain() {}

  public static void main(String[] args) {
    int code = run(args, System.out, System.err);
    if (code != 0) System.exit(code);
  }

  static int run(String[] args, PrintStream out, PrintStream err) {
    Options opts;
    try {
      opts = Options.parse(args);
    } catch (IllegalArgumentException e) {
      err.println(e.getMessage());
      err.println(USAGE);
      return 2;
    }

    try {
      List<ApiDefinition> apis = new YamlApiCatalogLoader().loadDir(opts.catalogDir());
      Registry registry = new Registry(new InMemoryApiCatalog(apis), RegistryConfig.load());

      Reference ref = registry.parse(opts.text(), Resolver.literals(opts.params()), opts.collection(),
          true, !opts.weak());
      out.println(json().writeValueAsString(ref));
      return 0;
    } catch (ResourceUserException | ResourceConfigurationException e) {
      log.debug("resref.cli_failed text={}", opts.text(), e);
      err.println("ERROR: " + e.getMessage());
      return 1;
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to write reference", e);
    }
  }

  private static ObjectMapper json() {
    return new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
  }

  record Options(Path catalogDir, String text, String collection, Map<String, String> params, boolean weak) {
    static Options parse(String[] args) {
      String collection = null;
      boolean weak = false;
      Map<String, String> params = new LinkedHashMap<>();
      List<String> positional = new ArrayList<>();

      for (String a : args) {
        if (a.startsWith("--collection=")) {
          collection = a.substring("--collection=".length());
        } else if (a.startsWith("--param=")) {
          String kv = a.substring("--param=".length());
          int eq = kv.indexOf('=');
          if (eq <= 0) throw new IllegalArgumentException("Expected --param=name=value, got: " + a);
          params.put(kv.substring(0, eq), kv.substring(eq + 1));
        } else if (a.equals("--weak")) {
          weak = true;
        } else if (a.startsWith("--")) {
          throw new IllegalArgumentException("Unknown option: " + a);
        } else {
          positional.add(a);
        }
      }
      if (positional.size() != 2) throw new IllegalArgumentException("Expected <catalogDir> <text>");
      if (collection != null && collection.isBlank()) collection = null;
      return new Options(Paths.get(positional.get(0)), positional.get(1), collection, params, weak);
    }
  }
}
