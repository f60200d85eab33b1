package cal.biglist.types;

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * A table of contents: a sequence of {@link FileReader}s, one per data file, together
 * with the element counts from the index.
 */
public abstract class FileSeq<T> implements Iterable<FileReader<T>> {

  /**
   * @return one entry per data file, in order; cheap to call repeatedly
   */
  public abstract List<DataFileInfo> dataFilesInfo();

  /**
   * @param index a file position in <code>[0, size())</code>
   * @return a fresh, unloaded reader for that file
   */
  public abstract FileReader<T> get(int index);

  /**
   * @return the number of data files
   */
  public int size() {
    return dataFilesInfo().size();
  }

  public long numDataItems() {
    List<DataFileInfo> info = dataFilesInfo();
    return info.isEmpty() ? 0L : info.get(info.size() - 1).cumulativeCount();
  }

  @Override
  public Iterator<FileReader<T>> iterator() {
    return new Iterator<>() {
      int next = 0;

      @Override
      public boolean hasNext() {
        return next < size();
      }

      @Override
      public FileReader<T> next() {
        if (!hasNext()) {
          throw new NoSuchElementException();
        }
        return get(next++);
      }
    };
  }

}
