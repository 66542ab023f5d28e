package io.intellixity.resref.schema;

import io.intellixity.resref.error.MalformedSchemaException;
import io.intellixity.resref.util.PercentCodec;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Relative path template such as {@code projects/{project}/widgets/{widget}}.\n
 *
 * Each placeholder must fill a whole path segment. {@code {name}} expands percent-encoded;
 * {@code {+name}} keeps reserved characters (so a value may contain {@code /}).\n
 */
public final class UriTemplate {
  private final String source;
  private final List<Segment> segments;

  private UriTemplate(String source, List<Segment> segments) {
    this.source = source;
    this.segments = segments;
  }

  public static UriTemplate parse(String template) {
    if (template == null || template.isBlank()) throw new MalformedSchemaException("relative path template is blank");
    List<Segment> out = new ArrayList<>();
    for (String token : template.split("/", -1)) {
      int open = token.indexOf('{');
      int close = token.indexOf('}');
      if (open < 0 && close < 0) {
        out.add(new Segment(token, null, false));
        continue;
      }
      if (open != 0 || close != token.length() - 1 || token.indexOf('{', 1) >= 0) {
        throw new MalformedSchemaException("placeholder must span a whole segment: [" + token + "] in [" + template + "]");
      }
      String inner = token.substring(1, token.length() - 1);
      boolean reserved = inner.startsWith("+");
      String name = reserved ? inner.substring(1) : inner;
      if (name.isBlank()) throw new MalformedSchemaException("empty placeholder in [" + template + "]");
      out.add(new Segment(token, name, reserved));
    }
    return new UriTemplate(template, Collections.unmodifiableList(out));
  }

  public String source() { return source; }

  /** Placeholder names in template order. */
  public List<String> params() {
    List<String> out = new ArrayList<>();
    for (Segment s : segments) if (s.param() != null) out.add(s.param());
    return out;
  }

  /**
   * Trie tokens: literal segments as-is, placeholders normalized to {@code {name}}.
   */
  public List<String> tokens() {
    List<String> out = new ArrayList<>(segments.size());
    for (Segment s : segments) out.add(s.param() == null ? s.literal() : "{" + s.param() + "}");
    return out;
  }

  /**
   * Expand with the given values; a missing (null) value is written as {@code wildcard} without encoding.
   */
  public String expand(Map<String, String> values, String wildcard) {
    StringBuilder sb = new StringBuilder(source.length() + 32);
    for (int i = 0; i < segments.size(); i++) {
      if (i > 0) sb.append('/');
      Segment s = segments.get(i);
      if (s.param() == null) {
        sb.append(s.literal());
        continue;
      }
      String v = values.get(s.param());
      sb.append(v == null ? wildcard : PercentCodec.encode(v, s.reserved()));
    }
    return sb.toString();
  }

  @Override
  public String toString() { return source; }

  private record Segment(String literal, String param, boolean reserved) {}
}
