package io.intellixity.resref.error;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * A collection-path carried the wrong number of fields, or an empty one.\n
 *
 * The message lists the accepted shapes, e.g. for [project, zone, instance]:\n
 * {@code INSTANCE, ZONE/INSTANCE, /PROJECT/ZONE/INSTANCE}.\n
 */
public final class WrongFieldNumberException extends ResourceUserException {
  public WrongFieldNumberException(String path, List<String> orderedParams) {
    super("wrong number of fields: [" + path + "] does not match any of " + shapes(orderedParams));
  }

  private static String shapes(List<String> params) {
    List<String> upper = new ArrayList<>(params.size());
    for (String p : params) upper.add(p.toUpperCase(Locale.ROOT));

    List<String> out = new ArrayList<>();
    if (upper.size() > 2) out.add(upper.get(upper.size() - 1));
    out.add(String.join("/", upper.subList(1, upper.size())));
    out.add("/" + String.join("/", upper));
    return String.join(", ", out);
  }
}
