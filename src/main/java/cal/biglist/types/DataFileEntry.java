package cal.biglist.types;

import java.util.Comparator;

/**
 * A data file and the number of elements it holds.  Entries are the unit of the index
 * merge: two entries are the same entry exactly when both fields match.
 */
public record DataFileEntry(String fileName, int count) {

  /**
   * Sorts by file name, then by count.  File names start with a timestamp, so this is
   * roughly creation order.
   */
  public static final Comparator<DataFileEntry> ORDER =
      Comparator.comparing(DataFileEntry::fileName).thenComparingInt(DataFileEntry::count);

  public DataFileEntry {
    if (fileName == null || fileName.isEmpty()) {
      throw new IllegalArgumentException("file name may not be empty");
    }
    if (count < 0) {
      throw new IllegalArgumentException("negative count " + count + " for " + fileName);
    }
  }

}
