package io.intellixity.resref.error;

/** A reference still has an empty field after every resolver and default was tried. */
public final class UnknownFieldException extends ResourceUserException {
  private final String field;

  public UnknownFieldException(String collectionPath, String field) {
    super("unknown field [" + field + "] in [" + collectionPath + "]");
    this.field = field;
  }

  /** The first parameter that could not be resolved. */
  public String field() { return field; }
}
