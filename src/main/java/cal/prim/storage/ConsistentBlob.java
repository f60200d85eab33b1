package cal.prim.storage;

import cal.prim.NoValue;
import cal.prim.PreconditionFailed;

import java.io.IOException;
import java.io.InputStream;

/**
 * A versioned blob with compare-and-swap writes.
 *
 * <p>Where a {@link cal.prim.concurrency.StringRegister} compares whole values, a
 * <code>ConsistentBlob</code> compares <em>tags</em>: each version of the contents has
 * one, and a write names the tag it means to replace.  That keeps the expected value
 * small no matter how large the contents grow.
 */
public interface ConsistentBlob {

  interface Tag {
  }

  /**
   * Thrown by {@link #read(Tag)} when the requested version has been superseded and
   * garbage-collected.  Callers should re-read {@link #head()} and try again.
   */
  class TagExpired extends Exception {
    public TagExpired(Tag tag) {
      super("version " + tag + " no longer exists");
    }
  }

  /**
   * @return the tag of the current version; valid even if nothing was ever written
   */
  Tag head() throws IOException;

  /**
   * Open one version for reading.  A concurrent write plus {@link #cleanup()} can delete
   * the version between {@link #head()} and this call.
   *
   * @param entry a tag from {@link #head()} or {@link #write(Tag, InputStream)}
   * @return an unbuffered stream over that version
   * @throws NoValue if the blob is still empty
   * @throws TagExpired if that version is gone
   */
  InputStream read(Tag entry) throws IOException, NoValue, TagExpired;

  /**
   * Replace the current version.
   *
   * @param expected the tag the caller believes is current
   * @param data the new contents
   * @return the tag of the new version
   * @throws PreconditionFailed if <code>expected</code> is no longer current
   * @throws IOException if storage fails; the write may or may not have taken effect,
   *   and retrying with the same <code>expected</code> tag is safe
   */
  Tag write(Tag expected, InputStream data) throws IOException, PreconditionFailed;

  /**
   * Delete versions older than the current one.  Readers holding an old tag get
   * {@link TagExpired} afterward.
   */
  default void cleanup() throws IOException {
  }

}
