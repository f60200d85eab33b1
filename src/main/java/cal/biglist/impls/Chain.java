package cal.biglist.impls;

import cal.biglist.types.Seq;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterators;

import java.util.Iterator;
import java.util.List;

/**
 * Several {@link Seq}s read as one, without copying.  Random access remembers the member
 * it last landed in, so runs of nearby indices skip the search.
 *
 * <p>The members must not change size while a chain over them is in use.
 */
public class Chain<T> implements Seq<T> {

  private final ImmutableList<Seq<T>> lists;
  private long[] cumulativeSizes = null;

  // member index, then the range of chain positions it covers
  private int lastMember = -1;
  private long lastLo = 0;
  private long lastHi = 0;

  @SafeVarargs
  public Chain(Seq<T> first, Seq<T>... rest) {
    this.lists = ImmutableList.<Seq<T>>builder().add(first).add(rest).build();
  }

  public Chain(List<? extends Seq<T>> lists) {
    if (lists.isEmpty()) {
      throw new IllegalArgumentException("a chain needs at least one sequence");
    }
    this.lists = ImmutableList.copyOf(lists);
  }

  /**
   * @return the member sequences
   */
  public List<Seq<T>> raw() {
    return lists;
  }

  private long[] cumulativeSizes() {
    long[] result = cumulativeSizes;
    if (result == null) {
      result = new long[lists.size()];
      long total = 0;
      for (int i = 0; i < result.length; ++i) {
        total += lists.get(i).size();
        result[i] = total;
      }
      cumulativeSizes = result;
    }
    return result;
  }

  @Override
  public long size() {
    long[] sizes = cumulativeSizes();
    return sizes[sizes.length - 1];
  }

  /**
   * @param index a position in <code>[-size(), size())</code>; negative positions count
   *   from the end
   */
  @Override
  public T get(long index) {
    long[] sizes = cumulativeSizes();
    long n = sizes[sizes.length - 1];
    long i = index < 0 ? index + n : index;
    if (i < 0 || i >= n) {
      throw new IndexOutOfBoundsException("index " + index + " out of range for chain of size " + n);
    }

    if (lastMember < 0 || i < lastLo || i >= lastHi) {
      int from = 0;
      int to = sizes.length;
      if (lastMember >= 0) {
        if (i < lastLo) {
          to = lastMember;
        } else {
          from = lastMember + 1;
        }
      }
      while (from < to) {
        int mid = (from + to) >>> 1;
        if (i < sizes[mid]) {
          to = mid;
        } else {
          from = mid + 1;
        }
      }
      lastMember = from;
      lastLo = from == 0 ? 0 : sizes[from - 1];
      lastHi = sizes[from];
    }
    return lists.get(lastMember).get(i - lastLo);
  }

  @Override
  public Iterator<T> iterator() {
    return Iterators.concat(Iterators.transform(lists.iterator(), Seq::iterator));
  }

  @Override
  public String toString() {
    return "<" + getClass().getSimpleName() + " of " + lists.size() + " sequences>";
  }

}
