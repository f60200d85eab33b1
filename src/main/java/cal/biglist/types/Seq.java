package cal.biglist.types;

/**
 * A read-only sequence with a known length and random access.  Lengths and indices are
 * <code>long</code> because a sequence may be much larger than memory.
 *
 * <p>Implementations may read from external storage, so every method may throw
 * {@link java.io.UncheckedIOException}.
 */
public interface Seq<T> extends Iterable<T> {

  long size();

  /**
   * @param index a position in <code>[0, size())</code>
   * @return the element at that position
   * @throws IndexOutOfBoundsException if <code>index</code> is out of range
   */
  T get(long index);

}
