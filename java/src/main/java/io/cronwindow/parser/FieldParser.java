package io.cronwindow.parser;

import io.cronwindow.CronWindowException;
import io.cronwindow.Span;
import io.cronwindow.ast.CronField;
import io.cronwindow.ast.FieldMatcher;
import io.cronwindow.ast.MonthName;
import io.cronwindow.ast.Weekday;
import io.cronwindow.lexer.Lexer;
import io.cronwindow.lexer.Token;
import io.cronwindow.lexer.TokenKind;
import java.util.BitSet;
import java.util.List;

/**
 * Recursive descent parser for one cron field.
 *
 * <p>Grammar:
 *
 * <pre>
 * field := '*' | item (',' item)*
 * item  := value ('-' value)?
 * value := NUMBER | NAME
 * </pre>
 *
 * <p>Names are three-letter abbreviations and are only accepted in the month and weekday fields.
 */
public final class FieldParser {
  private final String line;
  private final List<Token> tokens;
  private final CronField field;
  private final int lineNumber;
  private int pos;

  private FieldParser(String line, List<Token> tokens, CronField field, int lineNumber) {
    this.line = line;
    this.tokens = tokens;
    this.field = field;
    this.lineNumber = lineNumber;
    this.pos = 0;
  }

  /**
   * Parses {@code line[from, to)} as a value of {@code field}.
   *
   * @param line the whole schedule line
   * @param from the first character of the field
   * @param to the end of the field (exclusive)
   * @param field the field being parsed
   * @param lineNumber the 1-based line number, or 0 for a standalone pattern
   * @return the parsed matcher
   * @throws CronWindowException if the field is malformed or a value is out of range
   */
  public static FieldMatcher parse(String line, int from, int to, CronField field, int lineNumber)
      throws CronWindowException {
    List<Token> tokens = Lexer.tokenize(line, from, to, lineNumber);
    if (tokens.isEmpty()) {
      throw CronWindowException.parse(
          "empty " + field + " field", new Span(from, from), line, lineNumber, null);
    }
    return new FieldParser(line, tokens, field, lineNumber).parseField();
  }

  private FieldMatcher parseField() throws CronWindowException {
    if (tokens.size() == 1 && tokens.get(0).kind() == TokenKind.STAR) {
      return FieldMatcher.wildcard(field);
    }

    BitSet values = new BitSet(field.max() + 1);
    parseItem(values);
    while (pos < tokens.size()) {
      Token tok = tokens.get(pos);
      if (tok.kind() != TokenKind.COMMA) {
        throw parseError("expected ',' but found '" + tok.text() + "'", tok.span());
      }
      pos++;
      parseItem(values);
    }

    return FieldMatcher.of(field, values);
  }

  private void parseItem(BitSet values) throws CronWindowException {
    Token first = peek();
    if (first == null) {
      throw parseError("trailing ',' in " + field + " field", tokens.get(pos - 1).span());
    }
    if (first.kind() == TokenKind.STAR) {
      throw parseError("'*' cannot be combined with other values", first.span(), "*");
    }

    int startValue = parseValue();
    Token dash = peek();
    if (dash == null || dash.kind() != TokenKind.DASH) {
      values.set(startValue);
      return;
    }

    pos++;
    Token last = peek();
    if (last == null || last.kind() == TokenKind.COMMA) {
      throw parseError("dangling range in " + field + " field", first.span().to(dash.span()));
    }
    int endValue = parseValue();
    if (startValue > endValue) {
      throw parseError(
          "range start must be <= end: " + first.text() + "-" + last.text(),
          first.span().to(last.span()),
          wrapToSunday(first, last, endValue));
    }
    values.set(startValue, endValue + 1);
  }

  private int parseValue() throws CronWindowException {
    Token tok = peek();
    if (tok == null) {
      throw parseError("expected a value", tokens.get(pos - 1).span());
    }

    switch (tok.kind()) {
      case NUMBER -> {
        pos++;
        int n = tok.numberVal();
        if (!field.contains(n)) {
          throw parseError(
              "value "
                  + n
                  + " out of range for "
                  + field
                  + " ("
                  + field.min()
                  + "-"
                  + field.max()
                  + ")",
              tok.span());
        }
        return n;
      }
      case NAME -> {
        pos++;
        return resolveName(tok);
      }
      default -> throw parseError("expected a value but found '" + tok.text() + "'", tok.span());
    }
  }

  private int resolveName(Token tok) throws CronWindowException {
    return switch (field) {
      case MONTH -> MonthName.parse(tok.text())
          .map(MonthName::number)
          .orElseThrow(
              () -> parseError("unrecognized month abbreviation '" + tok.text() + "'", tok.span()));
      case DAY_OF_WEEK -> Weekday.parse(tok.text())
          .map(Weekday::cronDOW)
          .orElseThrow(
              () ->
                  parseError("unrecognized weekday abbreviation '" + tok.text() + "'", tok.span()));
      default -> throw parseError(
          "names are not allowed in the " + field + " field", tok.span());
    };
  }

  private Token peek() {
    return pos < tokens.size() ? tokens.get(pos) : null;
  }

  /** Sunday is 0, so {@code Fri-Sun} is reversed; suggest splitting it. */
  private String wrapToSunday(Token first, Token last, int endValue) {
    if (field != CronField.DAY_OF_WEEK || endValue != 0) {
      return null;
    }
    boolean named = last.kind() == TokenKind.NAME;
    return (named ? "Sun," : "0,") + first.text() + "-" + (named ? "Sat" : "6");
  }

  private CronWindowException parseError(String message, Span span) {
    return parseError(message, span, null);
  }

  private CronWindowException parseError(String message, Span span, String suggestion) {
    return CronWindowException.parse(message, span, line, lineNumber, suggestion);
  }
}
