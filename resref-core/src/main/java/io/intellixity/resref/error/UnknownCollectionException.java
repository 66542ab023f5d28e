package io.intellixity.resref.error;

/** No collection was given and none could be inferred, or the named collection is not in any registered API. */
public final class UnknownCollectionException extends ResourceUserException {
  private UnknownCollectionException(String message) {
    super(message);
  }

  public static UnknownCollectionException forLine(String line) {
    return new UnknownCollectionException("unknown collection for [" + line + "]");
  }

  public static UnknownCollectionException forCollection(String collection) {
    return new UnknownCollectionException("unknown collection [" + collection + "]");
  }
}
