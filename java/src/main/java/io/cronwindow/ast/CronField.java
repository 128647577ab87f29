package io.cronwindow.ast;

/** The five fields of a crontab pattern, with their value domains. */
public enum CronField {
  MINUTE("minute", 0, 59),
  HOUR("hour", 0, 23),
  DAY_OF_MONTH("day-of-month", 1, 31),
  MONTH("month", 1, 12),
  DAY_OF_WEEK("weekday", 0, 6);

  private final String displayName;
  private final int min;
  private final int max;

  CronField(String displayName, int min, int max) {
    this.displayName = displayName;
    this.min = min;
    this.max = max;
  }

  /**
   * Returns the smallest value of the domain.
   *
   * @return the inclusive lower bound
   */
  public int min() {
    return min;
  }

  /**
   * Returns the largest value of the domain.
   *
   * @return the inclusive upper bound
   */
  public int max() {
    return max;
  }

  /**
   * Checks whether a value lies in the domain.
   *
   * @param value the value to check
   * @return true if {@code min() <= value <= max()}
   */
  public boolean contains(int value) {
    return value >= min && value <= max;
  }

  /**
   * Returns whether three-letter names are accepted in this field.
   *
   * @return true for month and weekday
   */
  public boolean acceptsNames() {
    return this == MONTH || this == DAY_OF_WEEK;
  }

  @Override
  public String toString() {
    return displayName;
  }
}
