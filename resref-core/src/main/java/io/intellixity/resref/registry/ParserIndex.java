package io.intellixity.resref.registry;

import io.intellixity.resref.error.AmbiguousAPIException;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Active collection-path parser per collection id.\n
 *
 * Two mutations:\n
 * - {@link #claim}: add or refresh an entry; fails if another API owns the id\n
 * - {@link #supersede}: replace everything an API owns, unconditionally\n
 */
final class ParserIndex {
  private final Map<String, CollectionPathParser> byId;

  ParserIndex() {
    this.byId = new LinkedHashMap<>();
  }

  private ParserIndex(Map<String, CollectionPathParser> byId) {
    this.byId = byId;
  }

  void claim(CollectionPathParser parser) {
    checkClaim(parser);
    byId.put(parser.schema().id(), parser);
  }

  /** Fails the same way {@link #claim} would, without changing anything. */
  void checkClaim(CollectionPathParser parser) {
    String id = parser.schema().id();
    CollectionPathParser existing = byId.get(id);
    if (existing != null && !existing.schema().api().equals(parser.schema().api())) {
      throw new AmbiguousAPIException(id, List.of(parser.schema().baseUrl(), existing.schema().baseUrl()));
    }
  }

  void supersede(String api, Collection<CollectionPathParser> parsers) {
    byId.values().removeIf(p -> p.schema().api().equals(api));
    for (CollectionPathParser p : parsers) byId.put(p.schema().id(), p);
  }

  Optional<CollectionPathParser> get(String id) {
    return Optional.ofNullable(byId.get(id));
  }

  int size() { return byId.size(); }

  ParserIndex copy(UnaryOperator<CollectionPathParser> rebind) {
    Map<String, CollectionPathParser> out = new LinkedHashMap<>();
    byId.forEach((id, p) -> out.put(id, rebind.apply(p)));
    return new ParserIndex(out);
  }
}
