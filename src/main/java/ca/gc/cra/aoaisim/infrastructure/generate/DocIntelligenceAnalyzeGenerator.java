package ca.gc.cra.aoaisim.infrastructure.generate;

import ca.gc.cra.aoaisim.application.json.JsonSupport;
import ca.gc.cra.aoaisim.application.port.LimiterKeys;
import ca.gc.cra.aoaisim.application.port.ResponseGenerator;
import ca.gc.cra.aoaisim.application.port.context.RequestContext;
import ca.gc.cra.aoaisim.domain.http.SimulatorRequest;
import ca.gc.cra.aoaisim.domain.http.SimulatorResponse;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Simulates the asynchronous Document Intelligence analyze flow.
 * <p><strong>How:</strong> {@code POST .../documentModels/{model}:analyze} answers 202 with an
 * {@code Operation-Location} header pointing at {@code GET .../documentModels/{model}/analyzeResults/{id}}, which
 * answers 200 with a succeeded result. Both the {@code formrecognizer} and {@code documentintelligence} path roots
 * are accepted. Only the analyze submission is rate limited.</p>
 * <p><strong>Thread-safety:</strong> Job state lives in a bounded, synchronized map; the oldest jobs are evicted
 * first.</p>
 *
 * @since 0.1.0
 */
public final class DocIntelligenceAnalyzeGenerator implements ResponseGenerator {
  static final int MAX_TRACKED_JOBS = 1_000;
  static final String DEFAULT_API_VERSION = "2023-07-31";

  private static final Logger log = LoggerFactory.getLogger(DocIntelligenceAnalyzeGenerator.class);
  private static final Pattern ANALYZE =
      Pattern.compile("^/(formrecognizer|documentintelligence)/documentModels/([^/:]+):analyze$");
  private static final Pattern RESULT =
      Pattern.compile("^/(formrecognizer|documentintelligence)/documentModels/([^/:]+)/analyzeResults/([^/]+)$");
  private static final long RESULT_CONTENT_TOKENS = 64;

  private final JsonSupport json;
  private final Random random;
  private final Clock clock;
  private final Map<String, AnalyzeJob> jobs;

  public DocIntelligenceAnalyzeGenerator(JsonSupport json, Random random, Clock clock) {
    this.json = Objects.requireNonNull(json, "json");
    this.random = Objects.requireNonNull(random, "random");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.jobs = new LinkedHashMap<>(64, 0.75f, false) {
      @Override
      protected boolean removeEldestEntry(Map.Entry<String, AnalyzeJob> eldest) {
        return size() > MAX_TRACKED_JOBS;
      }
    };
  }

  @Override
  public CompletionStage<Optional<SimulatorResponse>> generate(RequestContext context) {
    SimulatorRequest request = context.request();
    Optional<SimulatorResponse> response = Optional.empty();
    if ("POST".equals(request.method())) {
      Matcher matcher = ANALYZE.matcher(request.path());
      if (matcher.matches()) {
        context.setLimiterKey(LimiterKeys.DOC_INTELLIGENCE);
        response = Optional.of(submit(request, matcher.group(1), matcher.group(2)));
      }
    } else if ("GET".equals(request.method())) {
      Matcher matcher = RESULT.matcher(request.path());
      if (matcher.matches()) {
        response = Optional.of(result(matcher.group(3)));
      }
    }
    return CompletableFuture.completedFuture(response);
  }

  private SimulatorResponse submit(SimulatorRequest request, String root, String modelId) {
    String id = new UUID(random.nextLong(), random.nextLong()).toString();
    String apiVersion = apiVersion(request.query());
    AnalyzeJob job = new AnalyzeJob(id, modelId, apiVersion, clock.instant());
    synchronized (jobs) {
      jobs.put(id, job);
    }
    String host = request.header("host").orElse("localhost");
    String location = "http://" + host + "/" + root + "/documentModels/" + modelId
        + "/analyzeResults/" + id + "?api-version=" + apiVersion;
    log.debug("Accepted analyze job {} for model {}", id, modelId);
    return new SimulatorResponse(202, Map.of("Operation-Location", location, "apim-request-id", id), new byte[0]);
  }

  private SimulatorResponse result(String id) {
    AnalyzeJob job;
    synchronized (jobs) {
      job = jobs.get(id);
    }
    if (job == null) {
      Map<String, Object> error = new LinkedHashMap<>();
      error.put("code", "NotFound");
      error.put("message", "Resource not found");
      return SimulatorResponse.json(404, json.toJson(Map.of("error", error)));
    }
    Map<String, Object> page = new LinkedHashMap<>();
    page.put("pageNumber", 1);
    page.put("angle", 0);
    page.put("width", 8.5);
    page.put("height", 11);
    page.put("unit", "inch");
    page.put("words", List.of());
    page.put("lines", List.of());

    String content = LoremText.generate(random, RESULT_CONTENT_TOKENS);
    Map<String, Object> analyzeResult = new LinkedHashMap<>();
    analyzeResult.put("apiVersion", job.apiVersion());
    analyzeResult.put("modelId", job.modelId());
    analyzeResult.put("stringIndexType", "textElements");
    analyzeResult.put("content", content);
    analyzeResult.put("pages", List.of(page));

    Map<String, Object> body = new LinkedHashMap<>();
    body.put("status", "succeeded");
    body.put("createdDateTime", job.created().toString());
    body.put("lastUpdatedDateTime", clock.instant().toString());
    body.put("analyzeResult", analyzeResult);
    return SimulatorResponse.json(200, json.toJson(body));
  }

  private static String apiVersion(String query) {
    for (String pair : query.split("&")) {
      if (pair.startsWith("api-version=") && pair.length() > "api-version=".length()) {
        return pair.substring("api-version=".length());
      }
    }
    return DEFAULT_API_VERSION;
  }

  private record AnalyzeJob(String id, String modelId, String apiVersion, Instant created) {}
}
