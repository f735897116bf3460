package org.example.urlshortener.service;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.example.urlshortener.storage.UrlStorage;

/**
 * Bounded fan-out of soft deletions.
 *
 * <p>The caller queues one deletion per identifier on a fixed pool of workers; queueing never
 * blocks, so {@link #submit(List, String)} returns as soon as every identifier is dispatched. A
 * supervisor task then drains the per-item outcomes of that request and logs failures. Supervisors
 * run on their own fixed pool of the same size, so the pipeline never holds more than twice
 * {@code workerCount} threads however many requests are in flight.
 *
 * <p>Deletions belong to the pipeline, not to the request: a caller that stops waiting does not
 * cancel them.
 */
final class DeletePipeline implements AutoCloseable {

  private static final long CLOSE_TIMEOUT_SEC = 30;

  private final UrlStorage storage;
  private final ExecutorService workers;
  private final ExecutorService supervisors;

  DeletePipeline(UrlStorage storage, int workerCount) {
    if (workerCount <= 0) {
      throw new IllegalArgumentException("Delete worker count must be positive: " + workerCount);
    }
    this.storage = storage;
    this.workers = Executors.newFixedThreadPool(workerCount, daemonThreads("delete-worker"));
    this.supervisors =
        Executors.newFixedThreadPool(workerCount, daemonThreads("delete-supervisor"));
  }

  /**
   * Dispatches one deletion per identifier.
   *
   * <p>Dispatch happens on the calling thread and does not wait for any deletion, so the call
   * returns at once; an interrupt flag set on the caller is left untouched.
   *
   * @param shortIds identifiers to delete
   * @param userId owner on whose behalf the deletions run
   * @return completes once every deletion has been attempted; never completes exceptionally
   *     because of a single failed item
   * @throws IllegalStateException if the pipeline has been closed
   */
  CompletableFuture<Void> submit(List<String> shortIds, String userId) {
    List<String> ids = List.copyOf(shortIds);
    CompletionService<Outcome> results = new ExecutorCompletionService<>(workers);
    int submitted = 0;
    for (String id : ids) {
      try {
        results.submit(() -> deleteOne(id, userId));
        submitted++;
      } catch (RejectedExecutionException e) {
        if (submitted == 0) throw new IllegalStateException("Delete pipeline is closed", e);
        System.err.println("[delete] not dispatched " + id + " (pipeline closed)");
      }
    }

    CompletableFuture<Void> done = new CompletableFuture<>();
    int dispatched = submitted;
    try {
      supervisors.execute(() -> drain(results, dispatched, ids.size(), userId, done));
    } catch (RejectedExecutionException e) {
      // closed after dispatch: the queued deletions still run, only their outcomes go unlogged
      done.complete(null);
    }
    return done;
  }

  private void drain(
      CompletionService<Outcome> results,
      int dispatched,
      int requested,
      String userId,
      CompletableFuture<Void> done) {
    int failed = requested - dispatched;
    try {
      for (int i = 0; i < dispatched; i++) {
        Outcome o = results.take().get();
        if (o.error != null) {
          failed++;
          System.err.println(
              "[delete] failed to delete " + o.shortId + " for " + userId + ": " + o.error);
        }
      }
      if (failed > 0) {
        System.err.println("[delete] " + failed + " of " + requested + " deletions failed");
      }
      done.complete(null);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      done.completeExceptionally(e);
    } catch (Exception e) {
      // deleteOne never throws, so this is a pool failure
      done.completeExceptionally(e);
    }
  }

  private Outcome deleteOne(String shortId, String userId) {
    try {
      storage.deleteUrls(List.of(shortId), userId);
      return new Outcome(shortId, null);
    } catch (Exception e) {
      return new Outcome(shortId, e.getMessage());
    }
  }

  /** Stops accepting work and waits for dispatched deletions to finish. */
  @Override
  public void close() {
    workers.shutdown();
    supervisors.shutdown();
    try {
      long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(CLOSE_TIMEOUT_SEC);
      boolean finished =
          workers.awaitTermination(CLOSE_TIMEOUT_SEC, TimeUnit.SECONDS)
              && supervisors.awaitTermination(
                  Math.max(0, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
      if (!finished) {
        System.err.println("[delete] pending deletions did not finish in " + CLOSE_TIMEOUT_SEC + "s");
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  private static ThreadFactory daemonThreads(String prefix) {
    AtomicInteger n = new AtomicInteger();
    return r -> {
      Thread t = new Thread(r, prefix + "-" + n.incrementAndGet());
      t.setDaemon(true);
      return t;
    };
  }

  private static final class Outcome {
    final String shortId;
    final String error;

    Outcome(String shortId, String error) {
      this.shortId = shortId;
      this.error = error;
    }
  }
}
