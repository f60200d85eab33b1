package cal.biglist.impls;

import cal.biglist.types.DataFileInfo;
import cal.biglist.types.FileReader;
import cal.biglist.types.FileSeq;
import cal.biglist.types.Seq;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.io.UncheckedIOException;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * The read side of a list stored as a sequence of data files.
 *
 * <p>Random access keeps the most recently used file in memory, so runs of nearby
 * indices cost one file read.  Iteration reads files ahead on a {@link WorkerPool}.
 */
public abstract class BiglistBase<T> implements Seq<T> {

  private static final class CachedFile<T> {
    final List<DataFileInfo> info;
    final int fileIndex;
    final long lo;
    final long hi;
    final FileReader<T> reader;

    CachedFile(List<DataFileInfo> info, int fileIndex, long lo, long hi, FileReader<T> reader) {
      this.info = info;
      this.fileIndex = fileIndex;
      this.lo = lo;
      this.hi = hi;
      this.reader = reader;
    }
  }

  private CachedFile<T> cache = null;

  /**
   * @return the data files as of the current in-memory index.  Implementations should
   *   return the same {@link FileSeq#dataFilesInfo()} instance for as long as the index is
   *   unchanged; the random-access cache relies on it.
   */
  protected abstract FileSeq<T> fileSeq();

  protected abstract WorkerPool readPool();

  protected abstract int readThreads();

  public FileSeq<T> files() {
    return fileSeq();
  }

  public int numDataFiles() {
    return fileSeq().size();
  }

  public long numDataItems() {
    return fileSeq().numDataItems();
  }

  @Override
  public long size() {
    return numDataItems();
  }

  protected void invalidateCache() {
    cache = null;
  }

  /**
   * @param index a position in <code>[-size(), size())</code>; negative positions count
   *   from the end
   */
  @Override
  public T get(long index) {
    FileSeq<T> files = fileSeq();
    List<DataFileInfo> info = files.dataFilesInfo();
    long n = files.numDataItems();
    long i = index < 0 ? index + n : index;
    if (i < 0 || i >= n) {
      throw new IndexOutOfBoundsException("index " + index + " out of range for biglist of size " + n);
    }

    CachedFile<T> c = cache;
    int from = 0;
    int to = info.size();
    if (c != null && c.info == info) {
      if (c.lo <= i && i < c.hi) {
        return c.reader.get(i - c.lo);
      }
      if (i < c.lo) {
        to = c.fileIndex;
      } else {
        from = c.fileIndex + 1;
      }
    }

    int fileIndex = DataFilesInfo.fileIndexOf(info, i, from, to);
    long lo = fileIndex == 0 ? 0L : info.get(fileIndex - 1).cumulativeCount();
    long hi = info.get(fileIndex).cumulativeCount();
    FileReader<T> reader = files.get(fileIndex);
    T result = reader.get(i - lo);
    cache = new CachedFile<>(info, fileIndex, lo, hi, reader);
    return result;
  }

  /**
   * Iterate over every element in order.  Files are read ahead in the background, up to
   * {@link #readThreads()} at a time.  An abandoned iterator leaves its in-flight reads to
   * finish; their results are dropped.
   */
  @Override
  public Iterator<T> iterator() {
    FileSeq<T> files = fileSeq();
    int n = files.size();
    if (n == 0) {
      return Collections.emptyIterator();
    }
    if (n == 1) {
      FileReader<T> reader = files.get(0);
      try {
        reader.load();
      } catch (IOException e) {
        throw new UncheckedIOException("failed to load " + reader.name(), e);
      }
      return reader.iterator();
    }
    return new PrefetchingIterator<>(files, readPool(), Math.min(readThreads(), n));
  }

  private static final class PrefetchingIterator<T> implements Iterator<T> {
    private final FileSeq<T> files;
    private final WorkerPool pool;
    private final ArrayBlockingQueue<CompletableFuture<FileReader<T>>> queue;
    private int nextToSubmit = 0;
    private Iterator<T> current = Collections.emptyIterator();

    PrefetchingIterator(FileSeq<T> files, WorkerPool pool, int depth) {
      this.files = files;
      this.pool = pool;
      this.queue = new ArrayBlockingQueue<>(Math.max(depth, 1));
      for (int i = 0; i < depth; ++i) {
        submitNext();
      }
    }

    private void submitNext() {
      if (nextToSubmit < files.size()) {
        FileReader<T> reader = files.get(nextToSubmit++);
        queue.add(pool.submit(() -> {
          reader.load();
          return reader;
        }));
      }
    }

    private FileReader<T> takeNext() {
      CompletableFuture<FileReader<T>> head = queue.remove();
      submitNext();
      try {
        return head.get();
      } catch (ExecutionException e) {
        Throwable cause = e.getCause();
        if (cause instanceof IOException io) {
          throw new UncheckedIOException(io);
        }
        if (cause instanceof RuntimeException r) {
          throw r;
        }
        if (cause instanceof Error err) {
          throw err;
        }
        throw new UncheckedIOException(new IOException(cause));
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        InterruptedIOException ex = new InterruptedIOException("interrupted while waiting for a data file");
        ex.initCause(e);
        throw new UncheckedIOException(ex);
      }
    }

    @Override
    public boolean hasNext() {
      while (!current.hasNext()) {
        if (queue.isEmpty()) {
          return false;
        }
        current = takeNext().iterator();
      }
      return true;
    }

    @Override
    public T next() {
      if (!hasNext()) {
        throw new NoSuchElementException();
      }
      return current.next();
    }
  }

}
