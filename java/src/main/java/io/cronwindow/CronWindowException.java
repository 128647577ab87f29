package io.cronwindow;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/** Exception thrown for errors in schedule parsing or window generation. */
public final class CronWindowException extends Exception {
  /** The error kind. */
  private final ErrorKind kind;

  /** The source span where a parse error occurred. */
  private final Span span;

  /** The offending schedule line. */
  private final String input;

  /** The 1-based line number, or 0 when the input is not part of a schedule. */
  private final int lineNumber;

  /** An optional suggestion for fixing the error. */
  private final String suggestion;

  /** The minute at which an ambiguity was detected. */
  private final LocalDateTime minute;

  /** The labels simultaneously active at {@link #minute}. */
  private final List<String> labels;

  private CronWindowException(
      ErrorKind kind,
      String message,
      Span span,
      String input,
      int lineNumber,
      String suggestion,
      LocalDateTime minute,
      List<String> labels) {
    super(message);
    this.kind = kind;
    this.span = span;
    this.input = input;
    this.lineNumber = lineNumber;
    this.suggestion = suggestion;
    this.minute = minute;
    this.labels = labels == null ? List.of() : List.copyOf(labels);
  }

  /**
   * Creates a new parse error.
   *
   * @param message the error message
   * @param span the location of the error in the line
   * @param input the offending line
   * @param lineNumber the 1-based line number, or 0 for a standalone pattern
   * @param suggestion an optional suggestion for fixing the error
   * @return a new CronWindowException for a parse error
   */
  public static CronWindowException parse(
      String message, Span span, String input, int lineNumber, String suggestion) {
    String located = lineNumber > 0 ? "line " + lineNumber + ": " + message : message;
    return new CronWindowException(
        ErrorKind.PARSE, located, span, input, lineNumber, suggestion, null, null);
  }

  /**
   * Creates a new ambiguity error.
   *
   * @param minute the first minute with more than one active entry
   * @param labels the labels active in that minute, in entry order
   * @return a new CronWindowException for an ambiguity error
   */
  public static CronWindowException ambiguity(LocalDateTime minute, List<String> labels) {
    return new CronWindowException(
        ErrorKind.AMBIGUITY,
        "multiple entries active at " + minute + ": " + String.join(", ", labels),
        null,
        null,
        0,
        null,
        minute,
        labels);
  }

  /**
   * Creates a new empty schedule error.
   *
   * @param message the error message
   * @return a new CronWindowException for an empty schedule
   */
  public static CronWindowException emptySchedule(String message) {
    return new CronWindowException(
        ErrorKind.EMPTY_SCHEDULE, message, null, null, 0, null, null, null);
  }

  /**
   * Returns the kind of error.
   *
   * @return the error kind
   */
  public ErrorKind kind() {
    return kind;
  }

  /**
   * Returns the span where the error occurred, if available.
   *
   * @return the span, or empty if not available
   */
  public Optional<Span> span() {
    return Optional.ofNullable(span);
  }

  /**
   * Returns the offending line, if available.
   *
   * @return the input, or empty if not available
   */
  public Optional<String> input() {
    return Optional.ofNullable(input);
  }

  /**
   * Returns the 1-based line number of a parse error, or 0 when unknown.
   *
   * @return the line number
   */
  public int lineNumber() {
    return lineNumber;
  }

  /**
   * Returns a suggestion for fixing the error, if available.
   *
   * @return the suggestion, or empty if not available
   */
  public Optional<String> suggestion() {
    return Optional.ofNullable(suggestion);
  }

  /**
   * Returns the minute at which an ambiguity was detected.
   *
   * @return the minute, or empty for other kinds
   */
  public Optional<LocalDateTime> minute() {
    return Optional.ofNullable(minute);
  }

  /**
   * Returns the labels active at the ambiguous minute.
   *
   * @return the labels, empty for other kinds
   */
  public List<String> labels() {
    return labels;
  }

  /**
   * Formats a rich error message with underline and optional suggestion.
   *
   * <p>For parse errors with span and input, produces output like:
   *
   * <pre>
   * error: line 3: value 61 out of range for minute (0-59)
   *   61 * * * * backup
   *   ^^
   * </pre>
   *
   * @return a formatted error message
   */
  public String displayRich() {
    if (kind == ErrorKind.PARSE && span != null && input != null) {
      StringBuilder sb = new StringBuilder();
      sb.append("error: ").append(getMessage()).append("\n");
      sb.append("  ").append(input).append("\n");

      sb.append(" ".repeat(span.start() + 2));
      sb.append("^".repeat(span.length()));

      if (suggestion != null && !suggestion.isEmpty()) {
        sb.append(" try: \"").append(suggestion).append("\"");
      }

      return sb.toString();
    }

    return "error: " + getMessage();
  }
}
