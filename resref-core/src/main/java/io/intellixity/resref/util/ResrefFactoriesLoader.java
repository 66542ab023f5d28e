package io.intellixity.resref.util;

import io.intellixity.resref.catalog.ApiCatalogProvider;
import io.intellixity.resref.catalog.CatalogLoadException;

import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.util.*;

/**
 * Finds the {@link ApiCatalogProvider}s a classpath ships.\n
 *
 * A jar that bundles API definitions adds a {@code META-INF/resref.factories} properties file naming its
 * provider classes under the provider interface:\n
 *
 * <pre>
 * io.intellixity.resref.catalog.ApiCatalogProvider=com.acme.ComputeApis,com.acme.StorageApis
 * </pre>
 *
 * Every such file is read in classpath order. A class listed twice is instantiated once, at its first
 * position, so provider order (and with it which definition of an api/version wins) follows the classpath.
 */
public final class ResrefFactoriesLoader {
  public static final String RESOURCE = "META-INF/resref.factories";
  static final String PROVIDER_KEY = ApiCatalogProvider.class.getName();

  private ResrefFactoriesLoader() {}

  public static List<ApiCatalogProvider> catalogProviders() {
    return catalogProviders(Thread.currentThread().getContextClassLoader());
  }

  public static List<ApiCatalogProvider> catalogProviders(ClassLoader cl) {
    ClassLoader loader = cl != null ? cl : ResrefFactoriesLoader.class.getClassLoader();
    Map<String, URL> listed = listedClasses(PROVIDER_KEY, loader);
    List<ApiCatalogProvider> out = new ArrayList<>(listed.size());
    listed.forEach((name, source) -> out.add(newProvider(name, source, loader)));
    return out;
  }

  /** Class names listed under {@code key}, each mapped to the factories file that first named it. */
  static Map<String, URL> listedClasses(String key, ClassLoader cl) {
    Enumeration<URL> resources;
    try {
      resources = cl.getResources(RESOURCE);
    } catch (IOException e) {
      throw new CatalogLoadException("cannot enumerate " + RESOURCE, e);
    }

    Map<String, URL> listed = new LinkedHashMap<>();
    while (resources.hasMoreElements()) {
      URL url = resources.nextElement();
      Properties p = new Properties();
      try (InputStream in = url.openStream()) {
        p.load(in);
      } catch (IOException e) {
        throw new CatalogLoadException("cannot read " + url, e);
      }
      String value = p.getProperty(key);
      if (value == null) continue;
      for (String part : value.split(",")) {
        String name = part.trim();
        if (!name.isEmpty()) listed.putIfAbsent(name, url);
      }
    }
    return listed;
  }

  private static ApiCatalogProvider newProvider(String name, URL source, ClassLoader cl) {
    Class<?> raw;
    try {
      raw = Class.forName(name, true, cl);
    } catch (ClassNotFoundException e) {
      throw new CatalogLoadException("catalog provider " + name + " listed in " + source + " not found", e);
    }
    if (!ApiCatalogProvider.class.isAssignableFrom(raw)) {
      throw new CatalogLoadException(name + " listed in " + source + " is not an " + PROVIDER_KEY);
    }
    try {
      return (ApiCatalogProvider) raw.getDeclaredConstructor().newInstance();
    } catch (ReflectiveOperationException e) {
      throw new CatalogLoadException("cannot instantiate catalog provider " + name + " (needs a public no-arg constructor)", e);
    }
  }
}
