package com.gentoro.tangle.engine;

import com.gentoro.tangle.logging.LoggingService;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runs document parses off the caller's thread with last-request-wins semantics per document.
 *
 * <p>Every submission bumps the document's generation. Extraction runs on the worker pool; once it
 * finishes, the result is applied only if no newer submission for the same document has arrived in
 * the meantime. Stale results are discarded and reported as {@link ParseOutcome.Status#SUPERSEDED}.
 * Applications are serialized, so the engine keeps a single writer. Removing a document or clearing
 * the engine through the scheduler also invalidates parses still in flight, so a result prepared
 * before the removal is never applied after it.
 */
public class DocumentParseScheduler implements AutoCloseable {
  private static final org.slf4j.Logger log =
      LoggingService.getLogger(DocumentParseScheduler.class);

  private final LiterateEngine engine;
  private final ExecutorService workers;
  private final boolean ownsWorkers;
  private final Map<String, AtomicLong> generations = new ConcurrentHashMap<>();
  private final Object applyMonitor = new Object();

  /** Scheduler with its own pool of {@code threads} daemon workers. */
  public DocumentParseScheduler(LiterateEngine engine, int threads) {
    this(engine, Executors.newFixedThreadPool(threads, workerThreadFactory()), true);
  }

  /** Scheduler on a caller-managed executor, which {@link #close()} leaves running. */
  public DocumentParseScheduler(LiterateEngine engine, ExecutorService workers) {
    this(engine, workers, false);
  }

  private DocumentParseScheduler(
      LiterateEngine engine, ExecutorService workers, boolean ownsWorkers) {
    this.engine = Objects.requireNonNull(engine, "engine");
    this.workers = Objects.requireNonNull(workers, "workers");
    this.ownsWorkers = ownsWorkers;
  }

  /**
   * Schedule a parse of {@code text} for {@code documentId}.
   *
   * <p>The future completes exceptionally with the extraction failure when the document cannot be
   * parsed; the failure has already been reported to the engine's diagnostics sink.
   */
  public CompletableFuture<ParseOutcome> submit(String documentId, String text) {
    Objects.requireNonNull(documentId, "documentId");
    AtomicLong counter = generations.computeIfAbsent(documentId, k -> new AtomicLong());
    long generation = counter.incrementAndGet();
    log.debug("Scheduling parse of {} (generation {})", documentId, generation);

    return CompletableFuture.supplyAsync(() -> engine.prepare(documentId, text), workers)
        .thenApply(
            prepared -> {
              synchronized (applyMonitor) {
                if (counter.get() != generation) {
                  log.debug(
                      "Discarding parse of {} (generation {}, latest {})",
                      documentId,
                      generation,
                      counter.get());
                  return ParseOutcome.superseded(documentId, generation);
                }
                return ParseOutcome.applied(generation, engine.apply(prepared));
              }
            });
  }

  /** Remove {@code documentId} from the engine and discard any parse of it still in flight. */
  public boolean removeDocument(String documentId) {
    Objects.requireNonNull(documentId, "documentId");
    synchronized (applyMonitor) {
      generations.computeIfAbsent(documentId, k -> new AtomicLong()).incrementAndGet();
      return engine.removeDocument(documentId);
    }
  }

  /** Clear the engine and discard every parse still in flight. */
  public void clearCache() {
    synchronized (applyMonitor) {
      generations.values().forEach(AtomicLong::incrementAndGet);
      engine.clearCache();
    }
    log.debug("Invalidated {} document generation(s)", generations.size());
  }

  /** Latest generation submitted for {@code documentId}; 0 when none. */
  public long currentGeneration(String documentId) {
    AtomicLong counter = generations.get(documentId);
    return counter == null ? 0 : counter.get();
  }

  @Override
  public void close() {
    if (!ownsWorkers) return;
    workers.shutdown();
    try {
      if (!workers.awaitTermination(10, TimeUnit.SECONDS)) {
        log.warn("Parse workers did not stop within 10s; forcing shutdown");
        workers.shutdownNow();
      }
    } catch (InterruptedException e) {
      workers.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  private static ThreadFactory workerThreadFactory() {
    AtomicInteger sequence = new AtomicInteger();
    return runnable -> {
      Thread thread = new Thread(runnable, "tangle-parse-" + sequence.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    };
  }
}
