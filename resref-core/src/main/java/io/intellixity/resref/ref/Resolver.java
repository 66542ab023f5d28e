package io.intellixity.resref.ref;

import io.intellixity.resref.config.PropertySource;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Source of a value for a parameter that the caller did not spell out.\n
 *
 * Either a fixed {@link Literal} or a {@link Function} evaluated when a reference resolves.
 * An empty result means "no value available" and is never an error.\n
 */
public sealed interface Resolver permits Resolver.Literal, Resolver.Function {

  Optional<String> resolve();

  static Resolver literal(String value) {
    return new Literal(value);
  }

  static Resolver function(Supplier<Optional<String>> fn) {
    return new Function(fn);
  }

  /** Function resolver for suppliers that signal "no value" with null. */
  static Resolver ofNullable(Supplier<String> fn) {
    Objects.requireNonNull(fn, "fn");
    return new Function(() -> Optional.ofNullable(fn.get()));
  }

  /** Reads {@code key} from configuration every time it is evaluated. */
  static Resolver property(PropertySource source, String key) {
    Objects.requireNonNull(source, "source");
    Objects.requireNonNull(key, "key");
    return new Function(() -> source.get(key));
  }

  /** Wrap plain values as literal resolvers, keeping iteration order. */
  static Map<String, Resolver> literals(Map<String, String> values) {
    Map<String, Resolver> out = new LinkedHashMap<>();
    if (values != null) values.forEach((k, v) -> out.put(k, new Literal(v)));
    return out;
  }

  record Literal(String value) implements Resolver {
    @Override
    public Optional<String> resolve() {
      return value == null || value.isEmpty() ? Optional.empty() : Optional.of(value);
    }
  }

  final class Function implements Resolver {
    private final Supplier<Optional<String>> fn;

    Function(Supplier<Optional<String>> fn) {
      this.fn = Objects.requireNonNull(fn, "fn");
    }

    @Override
    public Optional<String> resolve() {
      Optional<String> v = fn.get();
      if (v == null) return Optional.empty();
      return v.filter(s -> !s.isEmpty());
    }
  }
}
