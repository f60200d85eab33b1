package cal.biglist.impls;

import cal.biglist.types.Seq;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * A window into a {@link Seq}.  Slicing a slicer makes another slicer over the same
 * underlying sequence without touching any elements; elements are fetched only by
 * {@link #get(long)} and iteration.
 *
 * <p>The underlying sequence must not change while a slicer over it is in use.
 */
public class Slicer<T> implements Seq<T> {

  /**
   * Positions in the underlying sequence, in window order.
   */
  private interface Selection {
    long size();

    long get(long i);
  }

  private record Stride(long start, long step, long size) implements Selection {
    @Override
    public long get(long i) {
      return start + i * step;
    }
  }

  private record Picks(long[] positions) implements Selection {
    @Override
    public long size() {
      return positions.length;
    }

    @Override
    public long get(long i) {
      return positions[(int)i];
    }
  }

  private final Seq<T> list;
  private final @Nullable Selection selection;

  /**
   * @param list the sequence to look into; the window starts out covering all of it
   */
  public Slicer(Seq<T> list) {
    this(list, null);
  }

  private Slicer(Seq<T> list, @Nullable Selection selection) {
    this.list = list;
    this.selection = selection;
  }

  /**
   * @return the underlying sequence
   */
  public Seq<T> raw() {
    return list;
  }

  @Override
  public long size() {
    return selection == null ? list.size() : selection.size();
  }

  private long position(long index) {
    long n = size();
    long i = index < 0 ? index + n : index;
    if (i < 0 || i >= n) {
      throw new IndexOutOfBoundsException("index " + index + " out of range for slicer of size " + n);
    }
    return selection == null ? i : selection.get(i);
  }

  /**
   * @param index a position in the window; negative positions count from the end
   */
  @Override
  public T get(long index) {
    return list.get(position(index));
  }

  public Slicer<T> slice(long start, long stop) {
    return slice(start, stop, 1);
  }

  /**
   * Narrow the window.  Bounds work like list slicing in most scripting languages: negative
   * bounds count from the end, out-of-range bounds are clamped, and a null bound means "from
   * the start" or "to the end" in the direction of <code>step</code>.
   *
   * @param start the first position, inclusive
   * @param stop the last position, exclusive
   * @param step the distance between positions; negative steps walk backward
   * @return a new slicer over the same underlying sequence
   * @throws IllegalArgumentException if <code>step</code> is zero
   */
  public Slicer<T> slice(@Nullable Long start, @Nullable Long stop, long step) {
    if (step == 0) {
      throw new IllegalArgumentException("slice step cannot be zero");
    }
    long n = size();
    long lo;
    long hi;
    if (step > 0) {
      lo = start == null ? 0 : clamp(start, n, 0, n);
      hi = stop == null ? n : clamp(stop, n, 0, n);
    } else {
      lo = start == null ? n - 1 : clamp(start, n, -1, n - 1);
      hi = stop == null ? -1 : clamp(stop, n, -1, n - 1);
    }
    long count;
    if (step > 0) {
      count = lo < hi ? (hi - lo + step - 1) / step : 0;
    } else {
      count = hi < lo ? (lo - hi - step - 1) / -step : 0;
    }

    Selection window = new Stride(lo, step, count);
    if (selection != null) {
      long[] positions = new long[Math.toIntExact(count)];
      for (int i = 0; i < positions.length; ++i) {
        positions[i] = selection.get(window.get(i));
      }
      window = new Picks(positions);
    }
    return new Slicer<>(list, window);
  }

  private static long clamp(long bound, long n, long min, long max) {
    long b = bound < 0 ? bound + n : bound;
    return Math.max(min, Math.min(max, b));
  }

  /**
   * Pick positions out of the window, in any order, repeats allowed.
   *
   * @param indices positions in the window; negative positions count from the end
   * @return a new slicer over the same underlying sequence
   * @throws IndexOutOfBoundsException if an index is out of range
   */
  public Slicer<T> select(long... indices) {
    long[] positions = new long[indices.length];
    for (int i = 0; i < indices.length; ++i) {
      positions[i] = position(indices[i]);
    }
    return new Slicer<>(list, new Picks(positions));
  }

  @Override
  public Iterator<T> iterator() {
    Selection s = selection;
    if (s == null) {
      return list.iterator();
    }
    return new Iterator<>() {
      long next = 0;

      @Override
      public boolean hasNext() {
        return next < s.size();
      }

      @Override
      public T next() {
        if (!hasNext()) {
          throw new NoSuchElementException();
        }
        return list.get(s.get(next++));
      }
    };
  }

  /**
   * Copy the window into memory.  Only for small windows.
   */
  public List<T> collect() {
    List<T> result = new ArrayList<>();
    for (T element : this) {
      result.add(element);
    }
    return result;
  }

  @Override
  public String toString() {
    return "<" + getClass().getSimpleName() + " into " + size() + "/" + list.size() + " of " + list + ">";
  }

}
