package ca.gc.cra.aoaisim.infrastructure.telemetry;

import ca.gc.cra.aoaisim.application.port.RequestTrace;
import ca.gc.cra.aoaisim.application.port.TracePort;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link TracePort} that opens one SERVER span named {@value #SPAN_NAME} per simulated request.
 */
public final class OpenTelemetryTraceAdapter implements TracePort {
  public static final String SPAN_NAME = "simulator.request";

  private final Tracer tracer;

  public OpenTelemetryTraceAdapter(OpenTelemetryBootstrap.BootstrapResult bootstrap) {
    this.tracer = Objects.requireNonNull(bootstrap, "bootstrap").tracer();
  }

  @Override
  public RequestTrace start(String method, String path) {
    Span span = tracer.spanBuilder(SPAN_NAME)
        .setSpanKind(SpanKind.SERVER)
        .setAttribute("http.request.method", method)
        .setAttribute("url.path", path)
        .startSpan();
    return new SpanTrace(span);
  }

  private static final class SpanTrace implements RequestTrace {
    private final Span span;
    private final AtomicBoolean ended = new AtomicBoolean();

    private SpanTrace(Span span) {
      this.span = span;
    }

    @Override
    public void setAttribute(String key, double value) {
      span.setAttribute(key, value);
    }

    @Override
    public void setAttribute(String key, String value) {
      span.setAttribute(key, value);
    }

    @Override
    public void end(int statusCode) {
      if (!ended.compareAndSet(false, true)) {
        return;
      }
      span.setAttribute("http.response.status_code", (long) statusCode);
      if (statusCode >= 500) {
        span.setStatus(StatusCode.ERROR);
      }
      span.end();
    }
  }
}
