package cal.biglist.impls;

import cal.biglist.types.BiglistConfig;
import cal.biglist.types.Codec;
import cal.biglist.types.DataFileInfo;
import cal.biglist.types.FileSeq;
import cal.prim.storage.Directory;
import com.google.common.collect.ImmutableList;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.file.NoSuchFileException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * A read-only biglist over data files that something else wrote, in any format in the
 * config's codecs.  The files must not change while the list is in use.
 *
 * <p>The order of the list is the order of the paths given to
 * {@link #create(Directory, List, String, BiglistConfig)}; the files under a folder are
 * taken in name order.
 */
public class ExternalBiglist<T> extends BiglistBase<T> implements Closeable {

  private static final Logger log = LoggerFactory.getLogger(ExternalBiglist.class);

  private static final int PROGRESS_INTERVAL = 1000;

  private final Directory directory;
  private final ImmutableList<String> dataPaths;
  private final String storageFormat;
  private final BiglistConfig config;
  private final BiglistFileSeq<T> fileSeq;

  private @Nullable WorkerPool readPool;
  private final boolean ownsReadPool;
  private boolean closed = false;

  private ExternalBiglist(Directory directory, List<String> dataPaths, String storageFormat, BiglistConfig config,
                          List<DataFileInfo> info, Codec<T> codec, @Nullable WorkerPool readPool, boolean ownsReadPool) {
    this.directory = directory;
    this.dataPaths = ImmutableList.copyOf(dataPaths);
    this.storageFormat = storageFormat;
    this.config = config;
    this.fileSeq = new BiglistFileSeq<>("", info, new BiglistFileReader.DirectoryLoader<>(directory, codec));
    this.readPool = readPool;
    this.ownsReadPool = ownsReadPool;
  }

  /**
   * Gather the element count of every data file, reading the files in parallel on the
   * config's read pool.
   *
   * @param directory where the data files are
   * @param dataPaths files, or folders to search recursively, in the order the list
   *   should follow
   * @param fileSuffix only names ending in this are used; null means every name
   * @param config supplies the storage format, the codecs, and the read pool
   * @return the list
   * @throws NoSuchFileException if the paths hold no matching files
   * @throws IllegalArgumentException if the storage format is not in the config's codecs,
   *   or if a thread count in the config is not positive
   * @throws IOException if a file could not be listed, read, or decoded
   */
  public static <T> ExternalBiglist<T> create(Directory directory, List<String> dataPaths, @Nullable String fileSuffix,
                                              BiglistConfig config) throws IOException {
    config.checkThreadCounts();
    String storageFormat = CodecRegistry.normalize(config.getStorageFormat());
    Codec<T> codec = config.getCodecs().get(storageFormat);

    List<String> files = resolve(directory, dataPaths, fileSuffix);
    if (files.isEmpty()) {
      throw new NoSuchFileException("no data files under " + dataPaths + " in " + directory);
    }

    WorkerPool pool = config.getReadPool();
    boolean ownsPool = pool == null;
    if (ownsPool) {
      pool = new WorkerPool("biglist-reader");
    }
    try {
      List<DataFileInfo> info = countElements(directory, files, codec, pool);
      log.debug("Indexed {} external data files under {}", files.size(), dataPaths);
      return new ExternalBiglist<>(directory, dataPaths, storageFormat, config, info, codec, pool, ownsPool);
    } catch (IOException | RuntimeException e) {
      if (ownsPool) {
        pool.close();
      }
      throw e;
    }
  }

  private static List<String> resolve(Directory directory, List<String> dataPaths, @Nullable String fileSuffix) throws IOException {
    Set<String> result = new LinkedHashSet<>();
    for (String path : dataPaths) {
      if (directory.exists(path)) {
        if (fileSuffix == null || path.endsWith(fileSuffix)) {
          result.add(path);
        }
        continue;
      }
      String folder = path.isEmpty() || path.endsWith("/") ? path : path + '/';
      try (Stream<String> entries = directory.list(folder)) {
        result.addAll(entries
            .filter(name -> fileSuffix == null || name.endsWith(fileSuffix))
            .sorted()
            .collect(Collectors.toList()));
      }
    }
    return new ArrayList<>(result);
  }

  private static <T> List<DataFileInfo> countElements(Directory directory, List<String> files, Codec<T> codec, WorkerPool pool) throws IOException {
    List<CompletableFuture<Integer>> counts = new ArrayList<>(files.size());
    for (String file : files) {
      counts.add(pool.submit(() -> codec.deserialize(directory.readBytes(file)).size()));
    }

    ImmutableList.Builder<DataFileInfo> info = ImmutableList.builderWithExpectedSize(files.size());
    long cumulative = 0;
    for (int i = 0; i < files.size(); ++i) {
      int count;
      try {
        count = counts.get(i).get();
      } catch (ExecutionException e) {
        Dumper.rethrow(e.getCause());
        throw new AssertionError("unreachable");
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        InterruptedIOException ex = new InterruptedIOException("interrupted while reading " + files.get(i));
        ex.initCause(e);
        throw ex;
      }
      cumulative += count;
      info.add(new DataFileInfo(files.get(i), count, cumulative));
      if ((i + 1) % PROGRESS_INTERVAL == 0) {
        log.info("Processed {} of {} data files", i + 1, files.size());
      }
    }
    return info.build();
  }

  public Directory directory() {
    return directory;
  }

  public List<String> dataPaths() {
    return dataPaths;
  }

  public String storageFormat() {
    return storageFormat;
  }

  @Override
  protected FileSeq<T> fileSeq() {
    return fileSeq;
  }

  @Override
  protected WorkerPool readPool() {
    if (closed || readPool == null) {
      throw new IllegalStateException("external biglist over " + dataPaths + " is closed");
    }
    return readPool;
  }

  @Override
  protected int readThreads() {
    return config.getReadThreads();
  }

  /**
   * Shut down the read pool if this list created it.
   */
  @Override
  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    if (ownsReadPool && readPool != null) {
      readPool.close();
    }
    readPool = null;
  }

  @Override
  public String toString() {
    return "<" + getClass().getSimpleName() + " at '" + directory + "' with " + fileSeq.numDataItems()
        + " elements in " + fileSeq.size() + " data file(s) stored at " + dataPaths + ">";
  }

}
