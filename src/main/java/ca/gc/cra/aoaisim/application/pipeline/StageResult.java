package ca.gc.cra.aoaisim.application.pipeline;

import java.util.Objects;

/**
 * Outcome of a pipeline stage that can fail: either a value or a {@link PipelineFault}.
 *
 * @param <T> value type produced on success
 * @since 0.1.0
 */
public sealed interface StageResult<T> permits StageResult.Ok, StageResult.Failed {

  /**
   * Wraps a successful value.
   *
   * @param value stage output
   * @param <T> value type
   * @return ok result
   */
  static <T> StageResult<T> ok(T value) {
    return new Ok<>(value);
  }

  /**
   * Wraps a fault.
   *
   * @param fault failure outcome
   * @param <T> value type the stage would have produced
   * @return failed result
   */
  static <T> StageResult<T> failed(PipelineFault fault) {
    return new Failed<>(fault);
  }

  /**
   * Successful stage output.
   *
   * @param value produced value
   * @param <T> value type
   */
  record Ok<T>(T value) implements StageResult<T> {
    public Ok {
      Objects.requireNonNull(value, "value");
    }
  }

  /**
   * Failed stage output.
   *
   * @param fault failure outcome
   * @param <T> value type the stage would have produced
   */
  record Failed<T>(PipelineFault fault) implements StageResult<T> {
    public Failed {
      Objects.requireNonNull(fault, "fault");
    }
  }
}
