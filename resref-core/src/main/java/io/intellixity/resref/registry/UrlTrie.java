package io.intellixity.resref.registry;

import io.intellixity.resref.error.AmbiguousResourcePathException;
import io.intellixity.resref.error.InvalidResourceException;
import io.intellixity.resref.error.MalformedSchemaException;
import io.intellixity.resref.util.PercentCodec;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * Prefix tree matching URL tokens ({@code api, version, segment...}) against registered templates.\n
 *
 * Every level holds either literal children or a single named parameter child, never both.
 * The leaf of a path holds the parser for that collection. Entries are never removed.\n
 */
final class UrlTrie {
  private final Node root;

  UrlTrie() {
    this.root = new Node();
  }

  private UrlTrie(Node root) {
    this.root = root;
  }

  record Match(CollectionPathParser parser, Map<String, String> params) {}

  /**
   * Add the path for {@code parser}; existing branches are reused.
   *
   * @throws MalformedSchemaException if a level would mix literals and parameters, or two parameter names
   * @throws AmbiguousResourcePathException if another collection already ends at this path
   */
  void insert(List<String> tokens, CollectionPathParser parser) {
    checkInsert(tokens, parser);

    Node n = root;
    for (String token : tokens) {
      String param = paramName(token);
      if (param != null) {
        if (n.param == null) {
          n.param = param;
          n.paramChild = new Node();
        }
        n = n.paramChild;
      } else {
        n = n.literals.computeIfAbsent(token, k -> new Node());
      }
    }
    n.leaf = parser;
  }

  /** Fails the way {@link #insert} would, without changing the tree. */
  void checkInsert(List<String> tokens, CollectionPathParser parser) {
    Node n = root;
    for (String token : tokens) {
      if (n == null) break;
      String param = paramName(token);
      if (param != null) {
        if (!n.literals.isEmpty()) throw mixed(tokens, token);
        if (n.param != null && !n.param.equals(param)) {
          throw new MalformedSchemaException("parameter {" + param + "} conflicts with {" + n.param
              + "} at the same position of " + String.join("/", tokens));
        }
        n = n.paramChild;
      } else {
        if (n.param != null) throw mixed(tokens, token);
        n = n.literals.get(token);
      }
    }
    if (n != null && n.leaf != null && !n.leaf.schema().id().equals(parser.schema().id())) {
      throw new AmbiguousResourcePathException(n.leaf.toString(), parser.toString());
    }
  }

  /**
   * Walk the tree. A parameter whose subtree is only a leaf takes all remaining tokens joined by '/'.
   *
   * @throws InvalidResourceException if no registered shape matches
   */
  Match match(List<String> tokens, String url) {
    Map<String, String> params = new LinkedHashMap<>();
    Node n = root;
    for (int i = 0; i < tokens.size(); i++) {
      String token = tokens.get(i);
      Node literal = n.literals.get(token);
      if (literal != null) {
        n = literal;
        continue;
      }
      if (n.param == null || !n.literals.isEmpty()) throw new InvalidResourceException(url);

      Node next = n.paramChild;
      if (next.isLeafOnly()) {
        params.put(n.param, PercentCodec.decode(String.join("/", tokens.subList(i, tokens.size()))));
        n = next;
        break;
      }
      if (token.isEmpty()) throw new InvalidResourceException(url);
      params.put(n.param, PercentCodec.decode(token));
      n = next;
    }
    if (n.leaf == null) throw new InvalidResourceException(url);
    return new Match(n.leaf, params);
  }

  /** Whether anything was registered under {@code api/version}. */
  boolean hasBranch(String api, String version) {
    Node a = root.literals.get(api);
    return a != null && a.literals.containsKey(version);
  }

  /** Structural copy with every leaf parser passed through {@code rebind}. */
  UrlTrie copy(UnaryOperator<CollectionPathParser> rebind) {
    return new UrlTrie(copy(root, rebind));
  }

  private static Node copy(Node n, UnaryOperator<CollectionPathParser> rebind) {
    Node out = new Node();
    n.literals.forEach((k, child) -> out.literals.put(k, copy(child, rebind)));
    out.param = n.param;
    if (n.paramChild != null) out.paramChild = copy(n.paramChild, rebind);
    if (n.leaf != null) out.leaf = rebind.apply(n.leaf);
    return out;
  }

  private static String paramName(String token) {
    if (token.length() > 2 && token.startsWith("{") && token.endsWith("}")) {
      return token.substring(1, token.length() - 1);
    }
    return null;
  }

  private static MalformedSchemaException mixed(List<String> tokens, String token) {
    return new MalformedSchemaException("literal and parameter segments mixed at [" + token + "] in "
        + String.join("/", tokens));
  }

  private static final class Node {
    final Map<String, Node> literals = new LinkedHashMap<>();
    String param;
    Node paramChild;
    CollectionPathParser leaf;

    boolean isLeafOnly() {
      return leaf != null && literals.isEmpty() && param == null;
    }
  }
}
