package cal.prim.concurrency;

/**
 * Thrown by {@link Lock#acquire(java.time.Duration)} when the lock could not be obtained
 * before the timeout.
 */
public class LockAcquireFailed extends Exception {
  public LockAcquireFailed(String message) {
    super(message);
  }
}
