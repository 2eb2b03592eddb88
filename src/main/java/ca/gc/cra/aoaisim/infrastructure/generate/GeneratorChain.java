package ca.gc.cra.aoaisim.infrastructure.generate;

import ca.gc.cra.aoaisim.application.port.ResponseGenerator;
import ca.gc.cra.aoaisim.application.port.context.RequestContext;
import ca.gc.cra.aoaisim.domain.http.SimulatorResponse;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * Tries generators in order; the first non-empty response wins.
 *
 * @since 0.1.0
 */
public final class GeneratorChain implements ResponseGenerator {
  private final List<ResponseGenerator> generators;

  public GeneratorChain(List<ResponseGenerator> generators) {
    this.generators = List.copyOf(generators);
  }

  @Override
  public CompletionStage<Optional<SimulatorResponse>> generate(RequestContext context) {
    CompletionStage<Optional<SimulatorResponse>> result = CompletableFuture.completedFuture(Optional.empty());
    for (ResponseGenerator generator : generators) {
      result = result.thenCompose(previous -> previous.isPresent()
          ? CompletableFuture.completedFuture(previous)
          : generator.generate(context));
    }
    return result;
  }

  /** @return generators in evaluation order */
  public List<ResponseGenerator> generators() {
    return generators;
  }
}
