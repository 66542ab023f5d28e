package io.intellixity.resref.catalog;

import io.intellixity.resref.schema.ApiDefinition;
import io.intellixity.resref.util.ResrefFactoriesLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * ApiCatalog built from every {@link ApiCatalogProvider} listed in META-INF/resref.factories.\n
 *
 * Providers are consulted in discovery order; the first definition of an api/version wins.\n
 */
public final class DiscoveredApiCatalog implements ApiCatalog {
  private static final Logger log = LoggerFactory.getLogger(DiscoveredApiCatalog.class);

  private final InMemoryApiCatalog delegate;

  public DiscoveredApiCatalog() {
    this(ResrefFactoriesLoader.catalogProviders());
  }

  DiscoveredApiCatalog(List<ApiCatalogProvider> providers) {
    List<ApiDefinition> defs = new ArrayList<>();
    for (ApiCatalogProvider p : providers) {
      if (p == null) continue;
      List<ApiDefinition> apis = p.apis();
      if (apis == null) continue;
      log.debug("resref.catalog provider={} apis={}", p.getClass().getName(), apis.size());
      defs.addAll(apis);
    }
    this.delegate = new InMemoryApiCatalog(defs);
  }

  @Override
  public Set<String> versions(String api) { return delegate.versions(api); }

  @Override
  public Optional<String> defaultVersion(String api) { return delegate.defaultVersion(api); }

  @Override
  public ApiDefinition definition(String api, String version) { return delegate.definition(api, version); }
}
