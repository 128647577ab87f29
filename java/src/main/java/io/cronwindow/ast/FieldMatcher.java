package io.cronwindow.ast;

import io.cronwindow.display.Display;
import java.util.BitSet;
import java.util.Objects;

/**
 * The set of values one cron field accepts.
 *
 * <p>Instances are immutable. Two matchers are equal when they belong to the same field and
 * accept the same values, so {@code *} and {@code 0-59} compare equal for minutes.
 */
public final class FieldMatcher {
  private final CronField field;
  private final BitSet values;
  private final boolean wildcard;

  private FieldMatcher(CronField field, BitSet values, boolean wildcard) {
    this.field = field;
    this.values = values;
    this.wildcard = wildcard;
  }

  /**
   * Creates a matcher accepting the whole domain of a field.
   *
   * @param field the field
   * @return a wildcard matcher
   */
  public static FieldMatcher wildcard(CronField field) {
    BitSet all = new BitSet(field.max() + 1);
    all.set(field.min(), field.max() + 1);
    return new FieldMatcher(field, all, true);
  }

  /**
   * Creates a matcher from an explicit value set.
   *
   * @param field the field
   * @param values the accepted values, all within the field's domain
   * @return a new matcher
   * @throws IllegalArgumentException if a value is outside the domain or the set is empty
   */
  public static FieldMatcher of(CronField field, BitSet values) {
    Objects.requireNonNull(field, "field");
    if (values.isEmpty()) {
      throw new IllegalArgumentException("empty value set for " + field);
    }
    if (values.nextSetBit(0) < field.min() || values.length() - 1 > field.max()) {
      throw new IllegalArgumentException("value out of range for " + field + ": " + values);
    }
    return new FieldMatcher(field, (BitSet) values.clone(), false);
  }

  /**
   * Returns the field this matcher belongs to.
   *
   * @return the field
   */
  public CronField field() {
    return field;
  }

  /**
   * Returns whether this matcher was written as {@code *}.
   *
   * @return true for a wildcard
   */
  public boolean isWildcard() {
    return wildcard;
  }

  /**
   * Checks whether a value is accepted.
   *
   * @param value the field value
   * @return true if the value matches
   */
  public boolean matches(int value) {
    return value >= 0 && values.get(value);
  }

  /**
   * Returns the smallest accepted value that is {@code >= from}.
   *
   * @param from the lower bound (inclusive)
   * @return the next accepted value, or -1 if there is none up to the end of the domain
   */
  public int nextFrom(int from) {
    if (from > field.max()) {
      return -1;
    }
    return values.nextSetBit(Math.max(from, 0));
  }

  /**
   * Returns the smallest rejected value that is {@code >= from}.
   *
   * @param from the lower bound (inclusive)
   * @return the next rejected value, or -1 if every value up to the end of the domain matches
   */
  public int nextMissFrom(int from) {
    int miss = values.nextClearBit(Math.max(from, field.min()));
    return miss > field.max() ? -1 : miss;
  }

  /**
   * Returns whether every value of the domain is accepted.
   *
   * @return true if the matcher never rejects a value
   */
  public boolean isFull() {
    return nextMissFrom(field.min()) < 0;
  }

  /**
   * Returns the smallest accepted value.
   *
   * @return the first accepted value
   */
  public int first() {
    return values.nextSetBit(field.min());
  }

  /**
   * Returns a copy of the accepted value set.
   *
   * @return the accepted values
   */
  public BitSet values() {
    return (BitSet) values.clone();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    return o instanceof FieldMatcher other
        && field == other.field
        && values.equals(other.values);
  }

  @Override
  public int hashCode() {
    return Objects.hash(field, values);
  }

  @Override
  public String toString() {
    return Display.renderField(this);
  }
}
