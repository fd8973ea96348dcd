package io.pandaproxy.infrastructure.exec;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Factory helpers for the proxy's named platform threads.
 */
public final class ExecutorFactories {
  private static final Logger log = LoggerFactory.getLogger(ExecutorFactories.class);
  private static final UncaughtExceptionHandler LOGGING_HANDLER =
      (thread, ex) -> log.error("Uncaught failure on thread {}", thread.getName(), ex);

  private ExecutorFactories() {}

  /**
   * Builds a pool that runs one blocking connection handler per thread.
   * <p>Threads are created on demand up to {@code maxThreads} and retired after a minute idle.
   * Submissions beyond the limit are rejected so the caller can close the surplus connection.</p>
   *
   * @param maxThreads maximum concurrent connections served
   * @param prefix thread-name prefix; threads are named {@code prefix-N}
   * @param handler uncaught exception handler installed on each worker thread; {@code null} logs
   * @return configured executor service
   */
  public static ExecutorService newConnectionPool(
      int maxThreads, String prefix, UncaughtExceptionHandler handler) {
    if (maxThreads <= 0) {
      throw new IllegalArgumentException("maxThreads must be positive");
    }
    ThreadFactory factory = namedThreadFactory(prefix, handler);
    return new ThreadPoolExecutor(
        0,
        maxThreads,
        60L,
        TimeUnit.SECONDS,
        new SynchronousQueue<>(),
        factory,
        new ThreadPoolExecutor.AbortPolicy());
  }

  /**
   * Builds a pool that grows with the number of open connections and never rejects while running.
   * <p>Idle threads are retired after a minute.</p>
   *
   * @param prefix thread-name prefix; threads are named {@code prefix-N}
   * @param handler uncaught exception handler installed on each worker thread; {@code null} logs
   * @return configured executor service
   */
  public static ExecutorService newUnboundedConnectionPool(
      String prefix, UncaughtExceptionHandler handler) {
    return newConnectionPool(Integer.MAX_VALUE, prefix, handler);
  }

  /**
   * Creates an unstarted, non-daemon platform thread with a fixed name.
   *
   * @param name thread name
   * @param task body
   * @return new thread
   */
  public static Thread newPlatformThread(String name, Runnable task) {
    Objects.requireNonNull(task, "task");
    Thread thread = new Thread(task);
    thread.setName(name == null || name.isBlank() ? "pandaproxy" : name);
    thread.setDaemon(false);
    thread.setUncaughtExceptionHandler(LOGGING_HANDLER);
    return thread;
  }

  static ThreadFactory namedThreadFactory(String prefix, UncaughtExceptionHandler handler) {
    String threadPrefix = (prefix == null || prefix.isBlank()) ? "pandaproxy-worker" : prefix;
    UncaughtExceptionHandler effectiveHandler = Objects.requireNonNullElse(handler, LOGGING_HANDLER);
    AtomicInteger index = new AtomicInteger();
    return runnable -> {
      Thread thread = new Thread(runnable);
      thread.setName(threadPrefix + "-" + index.getAndIncrement());
      thread.setDaemon(false);
      thread.setUncaughtExceptionHandler(effectiveHandler);
      return thread;
    };
  }
}
