package cal.biglist.impls;

import cal.biglist.types.Seq;

import java.util.Iterator;
import java.util.List;

/**
 * A {@link Seq} over a list in memory that counts element reads.
 */
final class ListSeq<T> implements Seq<T> {

  private final List<T> elements;
  int gets = 0;

  ListSeq(List<T> elements) {
    this.elements = elements;
  }

  @Override
  public long size() {
    return elements.size();
  }

  @Override
  public T get(long index) {
    ++gets;
    return elements.get(Math.toIntExact(index));
  }

  @Override
  public Iterator<T> iterator() {
    return elements.iterator();
  }

  @Override
  public String toString() {
    return elements.toString();
  }

}
