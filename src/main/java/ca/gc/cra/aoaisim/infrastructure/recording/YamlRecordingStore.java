package ca.gc.cra.aoaisim.infrastructure.recording;

import ca.gc.cra.aoaisim.application.port.RecordingStore;
import ca.gc.cra.aoaisim.domain.http.SimulatorResponse;
import ca.gc.cra.aoaisim.domain.recording.ExchangeFacts;
import ca.gc.cra.aoaisim.domain.recording.RecordedExchange;
import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Base64;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;
import org.yaml.snakeyaml.representer.Representer;

/**
 * <strong>What:</strong> Stores recorded exchanges as one YAML document per request path.
 * <p><strong>How:</strong> The file name is the path with every non-alphanumeric character replaced by
 * {@code _}, followed by the first eight hex digits of the path's SHA-256 and {@code .yaml}; the hash keeps paths
 * that differ only in punctuation apart. Bodies that decode as UTF-8 are stored as text; anything else is stored
 * as base64. Files are written to a temporary sibling and moved into place.</p>
 * <p><strong>Thread-safety:</strong> {@link #write} is synchronized; {@link #loadAll} is intended for startup.</p>
 *
 * @since 0.1.0
 */
public final class YamlRecordingStore implements RecordingStore {
  static final String FILE_SUFFIX = ".yaml";
  static final int FORMAT_VERSION = 1;
  static final int PATH_HASH_BYTES = 4;

  private static final Logger log = LoggerFactory.getLogger(YamlRecordingStore.class);
  private static final String UTF8 = "utf-8";
  private static final String BASE64 = "base64";

  private final Path directory;

  public YamlRecordingStore(Path directory) {
    this.directory = Objects.requireNonNull(directory, "directory");
  }

  /**
   * Maps a request path to its recording file name.
   *
   * @param path request path without query
   * @return file name inside the recording directory
   */
  public static String fileNameFor(String path) {
    return path.replaceAll("[^A-Za-z0-9]", "_") + '-' + pathHash(path) + FILE_SUFFIX;
  }

  private static String pathHash(String path) {
    try {
      byte[] digest = MessageDigest.getInstance("SHA-256").digest(path.getBytes(StandardCharsets.UTF_8));
      return HexFormat.of().formatHex(digest, 0, PATH_HASH_BYTES);
    } catch (NoSuchAlgorithmException ex) {
      throw new IllegalStateException("SHA-256 not available", ex);
    }
  }

  @Override
  public List<RecordedExchange> loadAll() throws IOException {
    if (!Files.isDirectory(directory)) {
      log.info("Recording directory {} does not exist; nothing to replay", directory);
      return List.of();
    }
    List<Path> files = new ArrayList<>();
    try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, "*" + FILE_SUFFIX)) {
      stream.forEach(files::add);
    }
    files.sort(null);
    List<RecordedExchange> exchanges = new ArrayList<>();
    for (Path file : files) {
      List<RecordedExchange> loaded = read(file);
      log.debug("Loaded {} recordings from {}", loaded.size(), file.getFileName());
      exchanges.addAll(loaded);
    }
    return exchanges;
  }

  @Override
  public synchronized void write(String path, List<RecordedExchange> exchanges) throws IOException {
    Objects.requireNonNull(path, "path");
    Files.createDirectories(directory);
    Path target = directory.resolve(fileNameFor(path));
    Path tmp = target.resolveSibling(target.getFileName().toString() + ".tmp");

    List<Object> entries = new ArrayList<>(exchanges.size());
    for (RecordedExchange exchange : exchanges) {
      entries.add(toNode(exchange));
    }
    Map<String, Object> document = new LinkedHashMap<>();
    document.put("version", FORMAT_VERSION);
    document.put("path", path);
    document.put("exchanges", entries);

    try (Writer writer = Files.newBufferedWriter(tmp, StandardCharsets.UTF_8)) {
      dumper().dump(document, writer);
    }
    try {
      Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    } catch (AtomicMoveNotSupportedException ex) {
      Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
    }
    log.debug("Wrote {} recordings to {}", exchanges.size(), target);
  }

  private List<RecordedExchange> read(Path file) throws IOException {
    Object document;
    try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
      document = new Yaml(new SafeConstructor(new LoaderOptions())).load(reader);
    } catch (YAMLException ex) {
      throw new IOException("Recording file " + file + " is not valid YAML", ex);
    }
    if (document == null) {
      return List.of();
    }
    try {
      Map<?, ?> root = map(document, "document");
      Object rawExchanges = root.get("exchanges");
      if (rawExchanges == null) {
        return List.of();
      }
      if (!(rawExchanges instanceof List<?> items)) {
        throw new IllegalArgumentException("exchanges must be a list");
      }
      List<RecordedExchange> exchanges = new ArrayList<>(items.size());
      for (Object item : items) {
        exchanges.add(fromNode(map(item, "exchange")));
      }
      return exchanges;
    } catch (IllegalArgumentException ex) {
      throw new IOException("Recording file " + file + " is malformed: " + ex.getMessage(), ex);
    }
  }

  private static Map<String, Object> toNode(RecordedExchange exchange) {
    Map<String, Object> request = new LinkedHashMap<>();
    request.put("method", exchange.method());
    request.put("pathAndQuery", exchange.pathAndQuery());
    request.put("headers", new LinkedHashMap<>(exchange.requestHeaders()));
    request.put("body", bodyNode(exchange.requestBody()));

    SimulatorResponse response = exchange.response();
    Map<String, Object> responseNode = new LinkedHashMap<>();
    responseNode.put("status", response.status());
    responseNode.put("headers", new LinkedHashMap<>(response.headers()));
    responseNode.put("body", bodyNode(response.body()));

    Map<String, Object> facts = new LinkedHashMap<>();
    exchange.facts().limiter().ifPresent(limiter -> facts.put("limiter", limiter));
    exchange.facts().deployment().ifPresent(deployment -> facts.put("deployment", deployment));
    exchange.facts().tokens().ifPresent(tokens -> facts.put("tokens", tokens));

    Map<String, Object> node = new LinkedHashMap<>();
    node.put("request", request);
    node.put("response", responseNode);
    node.put("durationMs", exchange.durationMs());
    node.put("facts", facts);
    return node;
  }

  private static RecordedExchange fromNode(Map<?, ?> node) {
    Map<?, ?> request = map(node.get("request"), "request");
    Map<?, ?> response = map(node.get("response"), "response");
    Map<?, ?> facts = node.get("facts") == null ? Map.of() : map(node.get("facts"), "facts");

    SimulatorResponse simulatorResponse = new SimulatorResponse(
        (int) number(response.get("status"), "response.status"),
        stringMap(response.get("headers"), "response.headers"),
        bodyBytes(response.get("body")));
    Object tokens = facts.get("tokens");
    ExchangeFacts exchangeFacts = new ExchangeFacts(
        text(facts.get("limiter")),
        text(facts.get("deployment")),
        tokens == null ? null : number(tokens, "facts.tokens"));

    return new RecordedExchange(
        required(request.get("method"), "request.method"),
        required(request.get("pathAndQuery"), "request.pathAndQuery"),
        stringMap(request.get("headers"), "request.headers"),
        bodyBytes(request.get("body")),
        simulatorResponse,
        node.get("durationMs") == null ? 0 : number(node.get("durationMs"), "durationMs"),
        exchangeFacts);
  }

  private static Map<String, Object> bodyNode(byte[] body) {
    Map<String, Object> node = new LinkedHashMap<>();
    try {
      String text = StandardCharsets.UTF_8.newDecoder()
          .onMalformedInput(CodingErrorAction.REPORT)
          .onUnmappableCharacter(CodingErrorAction.REPORT)
          .decode(ByteBuffer.wrap(body))
          .toString();
      node.put("encoding", UTF8);
      node.put("data", text);
    } catch (CharacterCodingException ex) {
      node.put("encoding", BASE64);
      node.put("data", Base64.getEncoder().encodeToString(body));
    }
    return node;
  }

  private static byte[] bodyBytes(Object raw) {
    if (raw == null) {
      return new byte[0];
    }
    Map<?, ?> node = map(raw, "body");
    String data = text(node.get("data"));
    if (data == null) {
      return new byte[0];
    }
    String encoding = text(node.get("encoding"));
    if (encoding == null || UTF8.equalsIgnoreCase(encoding)) {
      return data.getBytes(StandardCharsets.UTF_8);
    }
    if (BASE64.equalsIgnoreCase(encoding)) {
      return Base64.getDecoder().decode(data);
    }
    throw new IllegalArgumentException("unsupported body encoding: " + encoding);
  }

  private static Map<?, ?> map(Object node, String name) {
    if (!(node instanceof Map<?, ?> map)) {
      throw new IllegalArgumentException(name + " must be a mapping");
    }
    return map;
  }

  private static Map<String, String> stringMap(Object node, String name) {
    if (node == null) {
      return Map.of();
    }
    Map<String, String> values = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : map(node, name).entrySet()) {
      values.put(String.valueOf(entry.getKey()), String.valueOf(entry.getValue()));
    }
    return values;
  }

  private static long number(Object value, String name) {
    if (value instanceof Number n) {
      return n.longValue();
    }
    throw new IllegalArgumentException(name + " must be a number");
  }

  private static String text(Object value) {
    return value == null ? null : String.valueOf(value);
  }

  private static String required(Object value, String name) {
    if (value == null) {
      throw new IllegalArgumentException(name + " is required");
    }
    return String.valueOf(value);
  }

  private static Yaml dumper() {
    DumperOptions options = new DumperOptions();
    options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
    options.setIndent(2);
    options.setSplitLines(false);
    return new Yaml(new SafeConstructor(new LoaderOptions()), new Representer(options), options);
  }
}
