package io.cronwindow.lexer;

import io.cronwindow.CronWindowException;
import io.cronwindow.Span;
import java.util.ArrayList;
import java.util.List;

/** Tokenizes the characters of one cron field into a list of tokens. */
public final class Lexer {
  /** Longest digit run accepted before the value is reported as out of range. */
  private static final int MAX_DIGITS = 9;

  private final String line;
  private final int end;
  private final int lineNumber;
  private int pos;

  private Lexer(String line, int from, int to, int lineNumber) {
    this.line = line;
    this.pos = from;
    this.end = to;
    this.lineNumber = lineNumber;
  }

  /**
   * Tokenizes {@code line[from, to)}, one whitespace-free cron field.
   *
   * @param line the whole schedule line, used for spans and error messages
   * @param from the first character of the field
   * @param to the end of the field (exclusive)
   * @param lineNumber the 1-based line number, or 0 for a standalone pattern
   * @return a list of tokens with spans in line coordinates
   * @throws CronWindowException if the field contains a character outside the grammar
   */
  public static List<Token> tokenize(String line, int from, int to, int lineNumber)
      throws CronWindowException {
    return new Lexer(line, from, to, lineNumber).doTokenize();
  }

  private List<Token> doTokenize() throws CronWindowException {
    List<Token> tokens = new ArrayList<>();
    while (pos < end) {
      int start = pos;
      char ch = line.charAt(pos);

      if (ch == ',') {
        pos++;
        tokens.add(Token.symbol(TokenKind.COMMA, ",", new Span(start, pos)));
        continue;
      }

      if (ch == '-') {
        pos++;
        tokens.add(Token.symbol(TokenKind.DASH, "-", new Span(start, pos)));
        continue;
      }

      if (ch == '*') {
        pos++;
        tokens.add(Token.symbol(TokenKind.STAR, "*", new Span(start, pos)));
        continue;
      }

      if (isDigit(ch)) {
        tokens.add(lexNumber());
        continue;
      }

      if (isAlpha(ch)) {
        tokens.add(lexName());
        continue;
      }

      if (ch == '/') {
        throw CronWindowException.parse(
            "step values are not supported",
            new Span(start, end),
            line,
            lineNumber,
            "a comma-separated list of values");
      }

      throw CronWindowException.parse(
          "unexpected character '" + ch + "'", new Span(start, start + 1), line, lineNumber, null);
    }

    return tokens;
  }

  private Token lexNumber() throws CronWindowException {
    int start = pos;
    while (pos < end && isDigit(line.charAt(pos))) {
      pos++;
    }
    String digits = line.substring(start, pos);
    Span span = new Span(start, pos);
    if (digits.length() > MAX_DIGITS) {
      throw CronWindowException.parse(
          "value " + digits + " is out of range", span, line, lineNumber, null);
    }
    return Token.number(digits, Integer.parseInt(digits), span);
  }

  private Token lexName() {
    int start = pos;
    while (pos < end && isAlpha(line.charAt(pos))) {
      pos++;
    }
    return Token.name(line.substring(start, pos), new Span(start, pos));
  }

  private static boolean isDigit(char c) {
    return c >= '0' && c <= '9';
  }

  private static boolean isAlpha(char c) {
    return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
  }
}
