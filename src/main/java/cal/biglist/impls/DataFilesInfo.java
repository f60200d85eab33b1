package cal.biglist.impls;

import cal.biglist.types.DataFileEntry;
import cal.biglist.types.DataFileInfo;
import com.google.common.collect.ImmutableList;

import java.util.Collection;
import java.util.List;
import java.util.TreeSet;

/**
 * Operations on the ordered list of data files that makes up an index.
 */
public abstract class DataFilesInfo {

  /**
   * Combine an index with new entries.  The result holds every distinct
   * <code>(file name, count)</code> pair from either input, sorted by
   * {@link DataFileEntry#ORDER}, with cumulative counts recomputed.  Merging entries that
   * are already present changes nothing, so the same additions may be merged any number
   * of times.
   *
   * @param existing the current index
   * @param additions entries to add
   * @return the merged index
   */
  public static ImmutableList<DataFileInfo> merge(List<DataFileInfo> existing, Collection<DataFileEntry> additions) {
    TreeSet<DataFileEntry> all = new TreeSet<>(DataFileEntry.ORDER);
    for (DataFileInfo info : existing) {
      all.add(info.entry());
    }
    all.addAll(additions);

    ImmutableList.Builder<DataFileInfo> result = ImmutableList.builderWithExpectedSize(all.size());
    long cumulative = 0;
    for (DataFileEntry entry : all) {
      cumulative += entry.count();
      result.add(new DataFileInfo(entry.fileName(), entry.count(), cumulative));
    }
    return result.build();
  }

  /**
   * Find the file holding an element, searching only files <code>[from, to)</code>.
   *
   * @param info an index
   * @param itemIndex an element position in <code>[0, numDataItems)</code>
   * @return the position of the first file in range whose cumulative count exceeds
   *   <code>itemIndex</code>
   */
  public static int fileIndexOf(List<DataFileInfo> info, long itemIndex, int from, int to) {
    int lo = from;
    int hi = to;
    while (lo < hi) {
      int mid = (lo + hi) >>> 1;
      if (itemIndex < info.get(mid).cumulativeCount()) {
        hi = mid;
      } else {
        lo = mid + 1;
      }
    }
    return lo;
  }

}
