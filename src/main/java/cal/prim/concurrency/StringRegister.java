package cal.prim.concurrency;

import cal.prim.PreconditionFailed;

import java.io.IOException;

/**
 * A mutable, shared String value with compare-and-swap.  The value is initially empty and is
 * never null.  All implementations of this interface are thread-safe, and most are backed by
 * a resource that several processes or machines can reach at once (a SQLite file, a DynamoDB
 * table).
 *
 * <p>Registers are the fencing primitive of this project: {@link RegisterLock} stores its
 * lease in one, and {@link cal.prim.storage.ConsistentBlobOnDirectory} stores the name of its
 * current version in one.  A writer that acts on a stale view of the register has its
 * {@link #write(String, String)} rejected instead of silently overwriting newer state.
 *
 * <p>Memory consistency effects: the methods on this class do not necessarily have any effect on
 * memory consistency.  Because instances of this class may be backed by an external resource,
 * concurrent calls to this class's methods might not interact via any kind of memory
 * synchronization.
 */
public interface StringRegister {

  /**
   * Read the register.
   *
   * <p>The value might already have changed by the time this method returns.  This method only
   * promises to return some value that the register had between invocation and return.
   *
   * @return the current value
   * @throws IOException if the value could not be read
   */
  String read() throws IOException;

  /**
   * Atomically set the value to <code>newValue</code> if its value is currently
   * <code>expectedValue</code> (compare-and-swap).  Writing the empty string resets the
   * register to its initial state.
   *
   * @param expectedValue the expected value
   * @param newValue the new value
   * @throws NullPointerException if <code>expectedValue</code> is null or
   *    <code>newValue</code> is null
   * @throws IOException if the operation failed.  Clients should treat this outcome as
   *    <em>ambiguous</em>: the write may or may not have succeeded.
   * @throws PreconditionFailed if the current value does not equal <code>expectedValue</code>
   */
  void write(String expectedValue, String newValue) throws IOException, PreconditionFailed;

}
