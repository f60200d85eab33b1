package cal.biglist.types;

import cal.biglist.impls.CodecRegistry;
import cal.biglist.impls.WorkerPool;
import cal.prim.time.UnreliableWallClock;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.time.Duration;

/**
 * Settings for opening or creating a biglist.
 *
 * <p><code>batchSize</code> and <code>storageFormat</code> only matter when a biglist is
 * created; afterward they are read from the stored index.
 */
@Value
@Builder(toBuilder = true)
public class BiglistConfig {

  public static final int DEFAULT_BATCH_SIZE = 1000;

  /** Elements per data file.  Null means {@value #DEFAULT_BATCH_SIZE}, with a warning. */
  @Nullable Integer batchSize;

  @Builder.Default
  @NonNull String storageFormat = "java-xz";

  @Builder.Default
  @NonNull CodecRegistry codecs = CodecRegistry.defaults();

  /** Maximum concurrent data file writes per biglist. */
  @Builder.Default
  int writeThreads = 4;

  /** Maximum data files prefetched during iteration. */
  @Builder.Default
  int readThreads = 3;

  /** How long a non-eager flush waits for the index lock. */
  @Builder.Default
  @NonNull Duration lockTimeout = Duration.ofSeconds(300);

  /** How long a crashed lock holder blocks others. */
  @Builder.Default
  @NonNull Duration lockLease = Duration.ofMinutes(10);

  /** Optional label in data file names identifying the writer. */
  @Nullable String fileNameTag;

  /** Pool for data file writes.  Null means the biglist creates and closes its own. */
  @Nullable WorkerPool writePool;

  /** Pool for prefetching during iteration.  Null means the biglist creates and closes its own. */
  @Nullable WorkerPool readPool;

  @Builder.Default
  @NonNull UnreliableWallClock wallClock = UnreliableWallClock.SYSTEM_CLOCK;

  public static BiglistConfig defaults() {
    return builder().build();
  }

  /**
   * @throws IllegalArgumentException if <code>writeThreads</code> or <code>readThreads</code>
   *   is less than one
   */
  public void checkThreadCounts() {
    if (writeThreads < 1) {
      throw new IllegalArgumentException("writeThreads must be positive: " + writeThreads);
    }
    if (readThreads < 1) {
      throw new IllegalArgumentException("readThreads must be positive: " + readThreads);
    }
  }

}
