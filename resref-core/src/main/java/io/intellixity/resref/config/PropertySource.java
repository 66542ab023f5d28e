package io.intellixity.resref.config;

import java.util.Map;
import java.util.Optional;
import java.util.Properties;
import java.util.TreeSet;
import java.util.Set;

/** Read-only view over flat configuration properties. */
public interface PropertySource {

  /** Value for {@code key}; empty if absent or blank. */
  Optional<String> get(String key);

  /** All keys starting with {@code prefix}. */
  Set<String> keys(String prefix);

  static PropertySource of(Properties props) {
    Properties p = new Properties();
    if (props != null) p.putAll(props);
    return new PropertySource() {
      @Override
      public Optional<String> get(String key) {
        String v = p.getProperty(key);
        return v == null || v.isBlank() ? Optional.empty() : Optional.of(v.trim());
      }

      @Override
      public Set<String> keys(String prefix) {
        Set<String> out = new TreeSet<>();
        for (String k : p.stringPropertyNames()) if (k.startsWith(prefix)) out.add(k);
        return out;
      }
    };
  }

  static PropertySource of(Map<String, String> values) {
    Properties p = new Properties();
    if (values != null) p.putAll(values);
    return of(p);
  }
}
