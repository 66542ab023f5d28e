package io.intellixity.resref.error;

public final class WrongResourceCollectionException extends ResourceUserException {
  private final String expected;
  private final String got;

  public WrongResourceCollectionException(String expected, String got, String path) {
    super("wrong collection: expected [" + expected + "], got [" + got + "], for path [" + path + "]");
    this.expected = expected;
    this.got = got;
  }

  public String expected() { return expected; }
  public String got() { return got; }
}
