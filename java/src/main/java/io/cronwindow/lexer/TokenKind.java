package io.cronwindow.lexer;

/** The kinds of token found inside a single cron field. */
public enum TokenKind {
  /** A run of digits. */
  NUMBER,
  /** A run of letters, e.g. {@code Mon} or {@code jan}. */
  NAME,
  /** The list separator {@code ,}. */
  COMMA,
  /** The range separator {@code -}. */
  DASH,
  /** The wildcard {@code *}. */
  STAR
}
