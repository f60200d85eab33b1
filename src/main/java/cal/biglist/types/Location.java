package cal.biglist.types;

import cal.prim.concurrency.Lock;
import cal.prim.concurrency.RegisterLock;
import cal.prim.concurrency.StringRegister;
import cal.prim.storage.Directory;
import cal.prim.time.UnreliableWallClock;

import java.io.Closeable;
import java.io.IOException;
import java.time.Duration;

/**
 * Where a biglist lives: a {@link Directory} for its files plus named
 * {@link StringRegister}s for the little state that needs compare-and-swap.
 *
 * <p>Two <code>Location</code> objects that describe the same place (the same folder, the
 * same bucket and prefix) must hand out registers that share state, so that independent
 * writers agree on the index and the lock.
 */
public interface Location extends Closeable {

  Directory directory();

  /**
   * Get a register by name.  Asking twice for the same name returns the same register.
   *
   * @param name a short name made of letters, digits, and "-"
   * @return the register
   * @throws IOException if the backing store cannot be reached
   */
  StringRegister register(String name) throws IOException;

  default Lock lock(String name, Duration lease, UnreliableWallClock clock) throws IOException {
    return new RegisterLock(register(name), lease, clock);
  }

  /**
   * Delete every file in the directory and reset every register handed out so far.
   *
   * @throws IOException if something could not be deleted
   */
  void destroy() throws IOException;

  /**
   * Release connections held by registers.  The stored data is untouched.
   */
  @Override
  void close() throws IOException;

}
