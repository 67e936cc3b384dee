package dev.papersearch.index;

import java.util.function.Function;

/**
 * Outcome of one call through {@link SearchTransport}: a value or a {@link TransportFault}.
 *
 * @param <T> the type of a successful value
 */
public sealed interface TransportResult<T>
    permits TransportResult.Success, TransportResult.Failure {

  static <T> TransportResult<T> success(T value) {
    return new Success<>(value);
  }

  static <T> TransportResult<T> failure(TransportFault fault) {
    return new Failure<>(fault);
  }

  boolean isSuccess();

  /**
   * Returns the value, or throws the exception {@code translator} builds from the fault.
   *
   * @param translator maps a fault to the exception to raise
   */
  <X extends RuntimeException> T orElseThrow(Function<TransportFault, X> translator);

  record Success<T>(T value) implements TransportResult<T> {

    @Override
    public boolean isSuccess() {
      return true;
    }

    @Override
    public <X extends RuntimeException> T orElseThrow(Function<TransportFault, X> translator) {
      return value;
    }
  }

  record Failure<T>(TransportFault fault) implements TransportResult<T> {

    @Override
    public boolean isSuccess() {
      return false;
    }

    @Override
    public <X extends RuntimeException> T orElseThrow(Function<TransportFault, X> translator) {
      throw translator.apply(fault);
    }
  }
}
