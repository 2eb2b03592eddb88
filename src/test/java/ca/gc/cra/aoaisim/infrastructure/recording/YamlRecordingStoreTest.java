package ca.gc.cra.aoaisim.infrastructure.recording;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.aoaisim.domain.http.SimulatorResponse;
import ca.gc.cra.aoaisim.domain.recording.ExchangeFacts;
import ca.gc.cra.aoaisim.domain.recording.RecordedExchange;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class YamlRecordingStoreTest {
  private static final String CHAT_PATH = "/openai/deployments/gpt-4o/chat/completions";

  @TempDir
  Path tempDir;

  @Test
  void fileNameReplacesEveryNonAlphanumericAndAppendsPathHash() {
    String name = YamlRecordingStore.fileNameFor(CHAT_PATH);

    assertTrue(name.matches("_openai_deployments_gpt_4o_chat_completions-[0-9a-f]{8}\\.yaml"), name);
    assertEquals(name, YamlRecordingStore.fileNameFor(CHAT_PATH));
  }

  @Test
  void pathsDifferingOnlyInPunctuationGetDistinctFiles() throws IOException {
    String dashed = "/openai/deployments/gpt-4/embeddings";
    String dotted = "/openai/deployments/gpt.4/embeddings";
    YamlRecordingStore store = new YamlRecordingStore(tempDir);

    store.write(dashed, List.of(exchange("{\"input\":\"a\"}", 1)));
    store.write(dotted, List.of(exchange("{\"input\":\"b\"}", 2)));

    assertNotEquals(YamlRecordingStore.fileNameFor(dashed), YamlRecordingStore.fileNameFor(dotted));
    assertEquals(2, store.loadAll().size());
  }

  @Test
  void writtenExchangesLoadBackWithFacts() throws IOException {
    YamlRecordingStore store = new YamlRecordingStore(tempDir);
    RecordedExchange exchange = exchange("{\"messages\":[]}", 250);

    store.write(CHAT_PATH, List.of(exchange));
    List<RecordedExchange> loaded = store.loadAll();

    assertEquals(1, loaded.size());
    RecordedExchange read = loaded.get(0);
    assertEquals("POST", read.method());
    assertEquals(CHAT_PATH + "?api-version=2024-02-01", read.pathAndQuery());
    assertEquals(Map.of("content-type", "application/json"), read.requestHeaders());
    assertEquals(exchange.fingerprint(), read.fingerprint());
    assertEquals(200, read.response().status());
    assertEquals("{\"ok\":true}", read.response().bodyText());
    assertEquals("application/json", read.response().header("content-type"));
    assertEquals(250, read.durationMs());
    assertEquals(new ExchangeFacts("openai", "gpt-4o", 42L), read.facts());
    assertEquals(OptionalLong.of(42), read.facts().tokens());
  }

  @Test
  void binaryBodiesAreStoredAsBase64() throws IOException {
    YamlRecordingStore store = new YamlRecordingStore(tempDir);
    byte[] binary = {(byte) 0xff, (byte) 0xfe, 0x00, 0x41};
    RecordedExchange exchange = new RecordedExchange(
        "POST", "/upload", Map.of(), binary, new SimulatorResponse(200, Map.of(), binary), 0, null);

    store.write("/upload", List.of(exchange));

    String yaml = Files.readString(tempDir.resolve(YamlRecordingStore.fileNameFor("/upload")), StandardCharsets.UTF_8);
    assertTrue(yaml.contains("base64"), yaml);
    RecordedExchange read = store.loadAll().get(0);
    assertArrayEquals(binary, read.requestBody());
    assertArrayEquals(binary, read.response().body());
  }

  @Test
  void rewriteReplacesFileWithoutLeavingTemporaries() throws IOException {
    YamlRecordingStore store = new YamlRecordingStore(tempDir);
    store.write(CHAT_PATH, List.of(exchange("{\"n\":1}", 1)));

    store.write(CHAT_PATH, List.of(exchange("{\"n\":1}", 1), exchange("{\"n\":2}", 2)));

    assertEquals(2, store.loadAll().size());
    try (Stream<Path> files = Files.list(tempDir)) {
      assertEquals(List.of(YamlRecordingStore.fileNameFor(CHAT_PATH)),
          files.map(p -> p.getFileName().toString()).toList());
    }
  }

  @Test
  void missingDirectoryLoadsNothing() throws IOException {
    assertEquals(List.of(), new YamlRecordingStore(tempDir.resolve("absent")).loadAll());
  }

  @Test
  void writeCreatesDirectory() throws IOException {
    Path nested = tempDir.resolve("a").resolve("b");

    new YamlRecordingStore(nested).write(CHAT_PATH, List.of(exchange("{}", 0)));

    assertTrue(Files.isRegularFile(nested.resolve(YamlRecordingStore.fileNameFor(CHAT_PATH))));
  }

  @Test
  void malformedFileFailsLoad() throws IOException {
    Files.writeString(tempDir.resolve("broken.yaml"), "exchanges: [ {request: 1", StandardCharsets.UTF_8);

    assertThrows(IOException.class, () -> new YamlRecordingStore(tempDir).loadAll());
  }

  @Test
  void structurallyWrongFileFailsLoad() throws IOException {
    Files.writeString(tempDir.resolve("wrong.yaml"), "exchanges: not-a-list\n", StandardCharsets.UTF_8);

    IOException ex = assertThrows(IOException.class, () -> new YamlRecordingStore(tempDir).loadAll());
    assertTrue(ex.getMessage().contains("malformed"));
  }

  @Test
  void otherFilesAreIgnored() throws IOException {
    Files.writeString(tempDir.resolve("notes.txt"), "not a recording", StandardCharsets.UTF_8);

    assertEquals(List.of(), new YamlRecordingStore(tempDir).loadAll());
  }

  private static RecordedExchange exchange(String requestBody, long durationMs) {
    return new RecordedExchange(
        "POST",
        CHAT_PATH + "?api-version=2024-02-01",
        Map.of("content-type", "application/json"),
        requestBody.getBytes(StandardCharsets.UTF_8),
        SimulatorResponse.json(200, "{\"ok\":true}"),
        durationMs,
        new ExchangeFacts("openai", "gpt-4o", 42L));
  }
}
