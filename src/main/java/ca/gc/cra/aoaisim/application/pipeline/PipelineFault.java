package ca.gc.cra.aoaisim.application.pipeline;

import ca.gc.cra.aoaisim.domain.http.SimulatorResponse;
import java.util.Objects;

/**
 * <strong>What:</strong> Typed failure outcome of a pipeline stage.
 * <p><strong>Why:</strong> Stages report failures as values so the orchestrator can translate each kind into its
 * HTTP response in one exhaustive place.</p>
 * <p><strong>Thread-safety:</strong> Implementations are immutable records.</p>
 *
 * @since 0.1.0
 */
public sealed interface PipelineFault
    permits PipelineFault.AuthenticationFailure,
        PipelineFault.DispatchFault,
        PipelineFault.UnhandledInternalFault {

  /** Body returned with every authentication failure. */
  String AUTH_FAILURE_BODY = "{\"detail\":\"Missing or incorrect API Key\"}";

  /** Returns the fault category. */
  FaultKind kind();

  /**
   * Converts the fault to the response returned to the client.
   *
   * @return 401 for authentication failures, 500 otherwise
   */
  default SimulatorResponse toResponse() {
    return switch (kind()) {
      case AUTHENTICATION -> SimulatorResponse.json(401, AUTH_FAILURE_BODY);
      case DISPATCH, INTERNAL -> SimulatorResponse.empty(500);
    };
  }

  /** No credential carrier matched. */
  record AuthenticationFailure() implements PipelineFault {
    @Override
    public FaultKind kind() {
      return FaultKind.AUTHENTICATION;
    }
  }

  /**
   * The producer for the active mode returned nothing.
   *
   * @param path request path
   */
  record DispatchFault(String path) implements PipelineFault {
    public DispatchFault {
      Objects.requireNonNull(path, "path");
    }

    @Override
    public FaultKind kind() {
      return FaultKind.DISPATCH;
    }
  }

  /**
   * A stage threw or completed exceptionally.
   *
   * @param stage stage that was running
   * @param cause underlying failure
   */
  record UnhandledInternalFault(String stage, Throwable cause) implements PipelineFault {
    public UnhandledInternalFault {
      Objects.requireNonNull(stage, "stage");
      Objects.requireNonNull(cause, "cause");
    }

    @Override
    public FaultKind kind() {
      return FaultKind.INTERNAL;
    }
  }
}
