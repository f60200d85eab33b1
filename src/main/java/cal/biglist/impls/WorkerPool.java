package cal.biglist.impls;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.util.concurrent.ThreadFactoryBuilder;

import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * A fixed-size pool of daemon threads for background file I/O.
 *
 * <p>Pools can be shared by any number of biglists.  Whoever creates a pool shuts it down
 * with {@link #close()}; a pool cannot be restarted, and a pool created before the process
 * was duplicated must not be used afterward.
 */
public class WorkerPool implements Executor, AutoCloseable {

  private final String name;
  private final int maxWorkers;
  private final ExecutorService executor;

  public WorkerPool(String name, int maxWorkers) {
    if (maxWorkers < 1) {
      throw new IllegalArgumentException("a pool needs at least one worker: " + maxWorkers);
    }
    this.name = name;
    this.maxWorkers = maxWorkers;
    ThreadPoolExecutor executor = new ThreadPoolExecutor(
        maxWorkers, maxWorkers,
        30, TimeUnit.SECONDS,
        new LinkedBlockingQueue<>(),
        new ThreadFactoryBuilder()
            .setNameFormat(name + "-%d")
            .setDaemon(true)
            .build());
    executor.allowCoreThreadTimeOut(true);
    this.executor = executor;
  }

  public WorkerPool(String name) {
    this(name, defaultMaxWorkers());
  }

  @VisibleForTesting
  static int defaultMaxWorkers() {
    return Math.min(32, Runtime.getRuntime().availableProcessors() + 4);
  }

  public int maxWorkers() {
    return maxWorkers;
  }

  /**
   * @throws java.util.concurrent.RejectedExecutionException if the pool has been closed
   */
  @Override
  public void execute(Runnable command) {
    executor.execute(command);
  }

  public <T> CompletableFuture<T> submit(Callable<T> job) {
    CompletableFuture<T> result = new CompletableFuture<>();
    execute(() -> {
      try {
        result.complete(job.call());
      } catch (Throwable t) {
        result.completeExceptionally(t);
      }
    });
    return result;
  }

  public boolean isClosed() {
    return executor.isShutdown();
  }

  /**
   * Stop accepting work.  Jobs already submitted still run.
   */
  @Override
  public void close() {
    executor.shutdown();
  }

  @Override
  public String toString() {
    return "WorkerPool(" + name + ", " + maxWorkers + " workers)";
  }

}
