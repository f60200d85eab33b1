package cal.prim;

/**
 * Thrown when a compare-and-swap style write finds that the stored value is not the one
 * the caller expected.  The write did not happen.
 *
 * @see cal.prim.concurrency.StringRegister#write(String, String)
 * @see cal.prim.storage.ConsistentBlob#write(cal.prim.storage.ConsistentBlob.Tag, java.io.InputStream)
 */
public class PreconditionFailed extends Exception {
  public PreconditionFailed() {
  }

  public PreconditionFailed(String message) {
    super(message);
  }

  public PreconditionFailed(Throwable cause) {
    super(cause);
  }
}
