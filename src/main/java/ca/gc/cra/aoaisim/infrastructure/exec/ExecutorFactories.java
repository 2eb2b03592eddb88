package ca.gc.cra.aoaisim.infrastructure.exec;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Factory helpers for the simulator's threads: Netty event loops and the recording writer.
 */
public final class ExecutorFactories {

  private ExecutorFactories() {}

  /**
   * Builds a thread factory producing named threads.
   *
   * @param prefix thread-name prefix; threads are named {@code prefix-N}
   * @param daemon whether threads are daemon threads
   * @param handler uncaught exception handler installed on each thread; may be {@code null}
   * @return thread factory
   */
  public static ThreadFactory namedThreads(String prefix, boolean daemon, UncaughtExceptionHandler handler) {
    String threadPrefix = (prefix == null || prefix.isBlank()) ? "aoai-sim" : prefix;
    UncaughtExceptionHandler effectiveHandler = Objects.requireNonNullElse(handler, (t, ex) -> {});
    AtomicInteger index = new AtomicInteger();
    return runnable -> {
      Thread thread = new Thread(runnable);
      thread.setName(threadPrefix + "-" + index.getAndIncrement());
      thread.setDaemon(daemon);
      thread.setUncaughtExceptionHandler(effectiveHandler);
      return thread;
    };
  }

  /**
   * Builds the single-threaded executor that serializes recording writes.
   *
   * <p>Saves queue up behind one another so two saves never write the same file concurrently.</p>
   *
   * @param prefix thread-name prefix
   * @param handler uncaught exception handler; may be {@code null}
   * @return configured executor service
   */
  public static ExecutorService newRecordingWriter(String prefix, UncaughtExceptionHandler handler) {
    return new ThreadPoolExecutor(
        1,
        1,
        0L,
        TimeUnit.MILLISECONDS,
        new LinkedBlockingQueue<>(),
        namedThreads(prefix == null ? "recording-writer" : prefix, true, handler),
        new ThreadPoolExecutor.AbortPolicy());
  }
}
