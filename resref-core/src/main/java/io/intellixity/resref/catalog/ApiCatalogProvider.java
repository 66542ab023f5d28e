package io.intellixity.resref.catalog;

import io.intellixity.resref.schema.ApiDefinition;

import java.util.List;

/**
 * SPI for contributing API definitions, discovered via META-INF/resref.factories.
 */
public interface ApiCatalogProvider {
  List<ApiDefinition> apis();
}
