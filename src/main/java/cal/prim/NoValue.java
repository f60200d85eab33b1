package cal.prim;

/**
 * An exception indicating that nothing has ever been written.  Like
 * {@link java.util.NoSuchElementException}, but checked, so that callers reading
 * shared storage have to decide what "not created yet" means for them.
 */
public class NoValue extends Exception {
  public NoValue() {
  }

  public NoValue(String message) {
    super(message);
  }
}
