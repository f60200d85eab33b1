package cal.biglist.impls;

import cal.biglist.types.BatchWriter;
import cal.biglist.types.WriteFailure;
import com.google.common.annotations.VisibleForTesting;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;

/**
 * Writes batches to storage in the background with bounded concurrency.
 *
 * <p>At most <code>min(writeThreads, pool.maxWorkers())</code> writes run at once; callers
 * of {@link #dumpFile} block while that many are in flight.  Successful jobs are forgotten
 * as soon as they finish.  Failed jobs are kept until {@link #waitForAll(boolean)} reports
 * them.
 *
 * <p>A dumper is driven by one thread.  The jobs themselves run on the pool.
 */
public class Dumper {

  private static final Logger log = LoggerFactory.getLogger(Dumper.class);

  private static class Job {
    final String destination;
    final CompletableFuture<Void> done = new CompletableFuture<>();

    Job(String destination) {
      this.destination = destination;
    }
  }

  private final WorkerPool pool;
  private final int writeThreads;
  private Semaphore semaphore;

  // insertion order, so failures are reported in submission order
  private final Set<Job> jobs = new LinkedHashSet<>();

  public Dumper(WorkerPool pool, int writeThreads) {
    if (writeThreads < 1) {
      throw new IllegalArgumentException("writeThreads must be positive: " + writeThreads);
    }
    this.pool = pool;
    this.writeThreads = writeThreads;
  }

  @VisibleForTesting
  int permits() {
    return Math.min(writeThreads, pool.maxWorkers());
  }

  private Semaphore semaphore() {
    if (semaphore == null) {
      semaphore = new Semaphore(permits());
    }
    return semaphore;
  }

  /**
   * Schedule a write.  Blocks while the maximum number of writes is already running.
   *
   * @param writer performs the write
   * @param batch the elements to write; the caller must not modify the list afterward
   * @param destination the name to write to
   * @throws RejectedExecutionException if the pool has been closed
   */
  public <T> void dumpFile(BatchWriter<T> writer, List<T> batch, String destination) {
    Semaphore sem = semaphore();
    sem.acquireUninterruptibly();

    Job job = new Job(destination);
    synchronized (jobs) {
      jobs.add(job);
    }

    try {
      pool.execute(() -> {
        try {
          writer.write(batch, destination);
          job.done.complete(null);
        } catch (Throwable t) {
          job.done.completeExceptionally(t);
        }
      });
    } catch (RejectedExecutionException e) {
      sem.release();
      synchronized (jobs) {
        jobs.remove(job);
      }
      throw e;
    }

    job.done.whenComplete((ignored, error) -> {
      sem.release();
      if (error == null) {
        synchronized (jobs) {
          jobs.remove(job);
        }
      } else {
        log.debug("Write to {} failed", destination, error);
      }
    });
  }

  /**
   * @return the number of jobs that are running or that failed and have not been
   *   reported yet
   */
  public int numTrackedJobs() {
    synchronized (jobs) {
      return jobs.size();
    }
  }

  /**
   * Wait for every scheduled write to finish.
   *
   * @param raiseOnError whether to throw the first failure instead of returning it
   * @return the failures since the last call, in submission order; empty if
   *   <code>raiseOnError</code> is set, since failures are thrown instead
   * @throws IOException if <code>raiseOnError</code> is set and a write failed with an
   *   <code>IOException</code> or a checked exception (which is wrapped)
   * @throws RuntimeException if <code>raiseOnError</code> is set and a write failed with one
   * @throws InterruptedIOException if the waiting thread was interrupted
   */
  public List<WriteFailure> waitForAll(boolean raiseOnError) throws IOException {
    List<Job> snapshot;
    synchronized (jobs) {
      snapshot = new ArrayList<>(jobs);
    }

    List<WriteFailure> failures = new ArrayList<>();
    for (Job job : snapshot) {
      try {
        job.done.get();
      } catch (ExecutionException e) {
        failures.add(new WriteFailure(job.destination, e.getCause()));
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        InterruptedIOException ex = new InterruptedIOException("interrupted while waiting for " + job.destination);
        ex.initCause(e);
        throw ex;
      }
    }

    // Completed-and-successful jobs already removed themselves.  Failed jobs are
    // reported exactly once.
    synchronized (jobs) {
      jobs.removeAll(snapshot);
    }

    if (raiseOnError && !failures.isEmpty()) {
      rethrow(failures.get(0).error());
    }
    return failures;
  }

  /**
   * Throw <code>error</code>: {@link IOException}s, runtime exceptions and errors as they
   * are, anything else wrapped in an {@link IOException}.
   */
  public static void rethrow(Throwable error) throws IOException {
    if (error instanceof CompletionException && error.getCause() != null) {
      error = error.getCause();
    }
    if (error instanceof IOException e) {
      throw e;
    }
    if (error instanceof RuntimeException e) {
      throw e;
    }
    if (error instanceof Error e) {
      throw e;
    }
    throw new IOException(error);
  }

}
