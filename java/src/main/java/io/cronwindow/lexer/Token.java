package io.cronwindow.lexer;

import io.cronwindow.Span;

/**
 * Represents a lexed token.
 *
 * @param kind the type of token
 * @param span the location in the schedule line
 * @param text the source characters
 * @param numberVal the number value (for NUMBER tokens)
 */
public record Token(TokenKind kind, Span span, String text, int numberVal) {

  /**
   * Creates a number token.
   *
   * @param text the digits
   * @param value the parsed value
   * @param span the location
   * @return a new NUMBER token
   */
  public static Token number(String text, int value, Span span) {
    return new Token(TokenKind.NUMBER, span, text, value);
  }

  /**
   * Creates a name token.
   *
   * @param text the letters as written
   * @param span the location
   * @return a new NAME token
   */
  public static Token name(String text, Span span) {
    return new Token(TokenKind.NAME, span, text, 0);
  }

  /**
   * Creates a punctuation token.
   *
   * @param kind COMMA, DASH or STAR
   * @param text the character as written
   * @param span the location
   * @return a new token
   */
  public static Token symbol(TokenKind kind, String text, Span span) {
    return new Token(kind, span, text, 0);
  }
}
