package cal.prim.concurrency;

import java.io.Closeable;
import java.io.IOException;
import java.time.Duration;

/**
 * A mutual-exclusion lock that may be shared between processes or machines.
 *
 * <p>Distributed locks cannot be perfectly reliable: a holder may stall long enough for
 * its lease to expire and for someone else to take over.  Clients must therefore protect
 * the state they modify under the lock with their own compare-and-swap (see
 * {@link cal.prim.storage.ConsistentBlob}) so that a stale holder's writes are rejected.
 */
public interface Lock {

  interface Guard extends Closeable {
    /**
     * @return a value unique to this acquisition
     */
    String token();

    /**
     * Release the lock.  Releasing more than once has no effect.
     */
    @Override
    void close() throws IOException;
  }

  /**
   * Acquire the lock, waiting up to <code>timeout</code>.
   *
   * @param timeout how long to wait
   * @return a guard that releases the lock when closed
   * @throws LockAcquireFailed if the lock is still held by someone else when time runs out
   * @throws IOException if the underlying storage fails
   */
  Guard acquire(Duration timeout) throws IOException, LockAcquireFailed;

}
