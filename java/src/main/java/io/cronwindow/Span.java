package io.cronwindow;

/**
 * A range of character positions within one schedule line.
 *
 * @param start the start position (inclusive)
 * @param end the end position (exclusive)
 */
public record Span(int start, int end) {
  /**
   * Returns the number of characters to underline, at least one.
   *
   * @return the underline width
   */
  public int length() {
    return Math.max(1, end - start);
  }

  /**
   * Returns a span covering this one and {@code other}.
   *
   * @param other the span to merge with
   * @return the covering span
   */
  public Span to(Span other) {
    return new Span(Math.min(start, other.start), Math.max(end, other.end));
  }
}
