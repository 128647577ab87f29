package io.cronwindow;

/** The type of error raised while parsing or iterating a schedule. */
public enum ErrorKind {
  /** Parse error - malformed schedule text. */
  PARSE("parse"),
  /** Ambiguity error - several entries active in the same minute in single-label mode. */
  AMBIGUITY("ambiguity"),
  /** Empty schedule error - a lookup that needs at least one entry. */
  EMPTY_SCHEDULE("empty_schedule");

  private final String value;

  ErrorKind(String value) {
    this.value = value;
  }

  /**
   * Returns the lowercase string representation.
   *
   * @return the kind as a lowercase string
   */
  public String value() {
    return value;
  }

  @Override
  public String toString() {
    return value;
  }
}
