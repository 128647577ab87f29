package io.cronwindow;

import java.util.Objects;

/**
 * Wraps a {@link CronWindowException} raised while a window stream is being consumed.
 *
 * <p>Streams cannot throw checked exceptions, so errors detected lazily during iteration (such as
 * an ambiguity in single-label mode) reach the caller through this exception.
 */
public final class UncheckedCronWindowException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  /**
   * Creates a new unchecked wrapper.
   *
   * @param cause the underlying error
   */
  public UncheckedCronWindowException(CronWindowException cause) {
    super(Objects.requireNonNull(cause).getMessage(), cause);
  }

  /**
   * Returns the underlying error.
   *
   * @return the wrapped CronWindowException
   */
  @Override
  public CronWindowException getCause() {
    return (CronWindowException) super.getCause();
  }
}
