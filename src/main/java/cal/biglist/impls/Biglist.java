package cal.biglist.impls;

import cal.biglist.types.BiglistConfig;
import cal.biglist.types.BiglistInfo;
import cal.biglist.types.Codec;
import cal.biglist.types.DataFileEntry;
import cal.biglist.types.FileSeq;
import cal.biglist.types.Location;
import cal.biglist.types.PendingFile;
import cal.biglist.types.WriteFailure;
import cal.prim.NoValue;
import cal.prim.PreconditionFailed;
import cal.prim.Util;
import cal.prim.concurrency.Lock;
import cal.prim.concurrency.LockAcquireFailed;
import cal.prim.storage.ConsistentBlob;
import cal.prim.storage.ConsistentBlobOnDirectory;
import cal.prim.storage.Directory;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.InvalidObjectException;
import java.io.ObjectInputStream;
import java.io.ObjectStreamException;
import java.io.Serializable;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.NoSuchFileException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * A persisted, append-only list that can be much larger than memory.
 *
 * <p>Elements are appended to an in-memory buffer.  Whenever the buffer holds
 * {@link #batchSize()} elements it is written to a new data file in the background.
 * {@link #flush()} writes out the partial buffer, waits for the background writes, and
 * merges the new data files into the durable index.  Only elements in indexed data files
 * are visible to readers, this instance included.
 *
 * <p>Any number of <code>Biglist</code> objects, in any number of processes or machines,
 * may append to the same location at once.  Each one writes its own data files; the merge
 * runs under a lock and is checked against the index version it read, so concurrent
 * flushes compose.  The elements of one writer keep their order; the files of different
 * writers interleave by creation time.
 *
 * <p>Layout of a location:
 * <pre>
 *   store/{data files}
 *   _info/info-{N}-{uuid}.json     versions of the index; the "info" register names the current one
 *   _flush_eager/{interim records} left by {@link #flush(boolean, Duration, boolean)} with eager=true
 * </pre>
 *
 * <p>Instances are not thread-safe.  Serializing a biglist records only where it lives and
 * how it was configured (its worker pools and wall clock excepted); deserializing opens it
 * again.  This only works for locations that are themselves serializable, such as
 * {@link LocalLocation}.
 */
public class Biglist<T> extends BiglistBase<T> implements Closeable, Serializable {

  private static final long serialVersionUID = 1L;

  private static final Logger log = LoggerFactory.getLogger(Biglist.class);

  static final String DATA_FOLDER = "store/";
  static final String INFO_PREFIX = "_info/info-";
  static final String INFO_SUFFIX = ".json";
  static final String EAGER_FOLDER = "_flush_eager/";
  static final String INFO_REGISTER = "info";
  static final String LOCK_REGISTER = "lock";

  private static final JsonInfoFormat FORMAT = new JsonInfoFormat();

  private record VersionedInfo(BiglistInfo info, ConsistentBlob.Tag tag) {
  }

  private final Location location;
  private final boolean ownsLocation;
  private final BiglistConfig config;
  private final ConsistentBlob infoBlob;
  private final Lock lock;
  private final Codec<T> codec;
  private final DataFileNames names;

  private BiglistInfo info;
  private @Nullable BiglistFileSeq<T> fileSeq = null;

  private List<T> appendBuffer = new ArrayList<>();
  private final List<PendingFile> pendingFiles = new ArrayList<>();
  private final List<WriteFailure> failedFiles = new ArrayList<>();
  private @Nullable String eagerRecordName = null;

  private @Nullable WorkerPool writePool = null;
  private boolean ownsWritePool = false;
  private @Nullable WorkerPool readPool = null;
  private boolean ownsReadPool = false;
  private @Nullable Dumper dumper = null;

  private boolean closed = false;

  private Biglist(Location location, boolean ownsLocation, BiglistConfig config, ConsistentBlob infoBlob, BiglistInfo info) throws IOException {
    this.location = location;
    this.ownsLocation = ownsLocation;
    this.config = config;
    this.infoBlob = infoBlob;
    this.lock = location.lock(LOCK_REGISTER, config.getLockLease(), config.getWallClock());
    this.codec = config.getCodecs().get(info.getStorageFormat());
    this.names = new DataFileNames(config.getWallClock(), config.getFileNameTag(), CodecRegistry.normalize(info.getStorageFormat()));
    this.info = info;
  }

  private static ConsistentBlob infoBlob(Location location) throws IOException {
    return new ConsistentBlobOnDirectory(location.register(INFO_REGISTER), location.directory(), INFO_PREFIX, INFO_SUFFIX);
  }

  /**
   * Create a new, empty biglist.
   *
   * @param location where to store it
   * @param config settings; see {@link BiglistConfig}
   * @return the new biglist
   * @throws FileAlreadyExistsException if the location already holds a biglist
   * @throws IllegalArgumentException if the storage format is not in the config's codecs,
   *   or if the batch size or a thread count is not positive
   * @throws IOException if the location cannot be written
   */
  public static <T> Biglist<T> create(Location location, BiglistConfig config) throws IOException {
    return create(location, false, config);
  }

  /**
   * Create a new, empty biglist in a fresh temporary folder.
   */
  public static <T> Biglist<T> create(BiglistConfig config) throws IOException {
    LocalLocation location = LocalLocation.createTemp();
    try {
      return create(location, true, config);
    } catch (IOException | RuntimeException e) {
      try {
        location.destroy();
      } catch (IOException onDestroy) {
        e.addSuppressed(onDestroy);
      }
      throw e;
    }
  }

  private static <T> Biglist<T> create(Location location, boolean ownsLocation, BiglistConfig config) throws IOException {
    config.checkThreadCounts();
    Integer requestedBatchSize = config.getBatchSize();
    int batchSize;
    if (requestedBatchSize == null) {
      log.warn("The default batch size, {}, may be unsuitable for your data; pass a batch size that suits the size of your elements",
          BiglistConfig.DEFAULT_BATCH_SIZE);
      batchSize = BiglistConfig.DEFAULT_BATCH_SIZE;
    } else {
      batchSize = requestedBatchSize;
    }
    if (batchSize <= 0) {
      throw new IllegalArgumentException("batch size must be positive: " + batchSize);
    }
    String storageFormat = CodecRegistry.normalize(config.getStorageFormat());
    if (!config.getCodecs().contains(storageFormat)) {
      throw new IllegalArgumentException("unknown storage format '" + storageFormat + "'; known formats are " + config.getCodecs().names());
    }

    ConsistentBlob blob = infoBlob(location);
    ConsistentBlob.Tag head = blob.head();
    if (holdsValue(blob, head)) {
      throw new FileAlreadyExistsException(location + " already holds a biglist");
    }

    BiglistInfo info = BiglistInfo.empty(storageFormat, batchSize);
    try {
      blob.write(head, new ByteArrayInputStream(FORMAT.serializeInfo(info)));
    } catch (PreconditionFailed e) {
      FileAlreadyExistsException ex = new FileAlreadyExistsException(location + " already holds a biglist");
      ex.initCause(e);
      throw ex;
    }
    log.debug("Created biglist at {} with format {} and batch size {}", location, storageFormat, batchSize);
    return new Biglist<>(location, ownsLocation, config, blob, info);
  }

  private static boolean holdsValue(ConsistentBlob blob, ConsistentBlob.Tag head) throws IOException {
    try (InputStream in = blob.read(head)) {
      return true;
    } catch (NoValue e) {
      return false;
    } catch (ConsistentBlob.TagExpired e) {
      return true;
    }
  }

  /**
   * Open an existing biglist.  The batch size and storage format stored with the biglist
   * override the ones in <code>config</code>.
   *
   * @throws NoSuchFileException if the location holds no biglist
   * @throws IllegalArgumentException if the biglist's storage format is not in the config's
   *   codecs, or if a thread count in the config is not positive
   * @throws IOException if the location cannot be read
   */
  public static <T> Biglist<T> open(Location location, BiglistConfig config) throws IOException {
    config.checkThreadCounts();
    ConsistentBlob blob = infoBlob(location);
    VersionedInfo current = readInfo(blob, location);
    return new Biglist<>(location, false, config, blob, current.info());
  }

  private static VersionedInfo readInfo(ConsistentBlob blob, Location location) throws IOException {
    for (;;) {
      ConsistentBlob.Tag tag = blob.head();
      try (InputStream in = blob.read(tag)) {
        return new VersionedInfo(FORMAT.loadInfo(Util.read(in)), tag);
      } catch (NoValue e) {
        NoSuchFileException ex = new NoSuchFileException(location + " holds no biglist");
        ex.initCause(e);
        throw ex;
      } catch (ConsistentBlob.TagExpired e) {
        log.debug("Index version {} expired while reading; retrying", tag);
      }
    }
  }

  // ---------------------------------------------------------------- accessors

  public Location location() {
    return location;
  }

  public int batchSize() {
    return info.getBatchSize();
  }

  public String storageFormat() {
    return info.getStorageFormat();
  }

  public int storageVersion() {
    return info.getStorageVersion();
  }

  /**
   * @return this instance's view of the index
   */
  public BiglistInfo info() {
    return info;
  }

  /**
   * @return data files written by this instance that are not merged into the index yet
   */
  public List<PendingFile> pendingFiles() {
    return ImmutableList.copyOf(pendingFiles);
  }

  /**
   * @return every data file this instance failed to write, oldest first
   */
  public List<WriteFailure> failedFiles() {
    return ImmutableList.copyOf(failedFiles);
  }

  // ---------------------------------------------------------------- pools

  private WorkerPool writePool() {
    WorkerPool pool = writePool;
    if (pool == null) {
      pool = config.getWritePool();
      if (pool == null) {
        pool = new WorkerPool("biglist-writer");
        ownsWritePool = true;
      }
      writePool = pool;
    }
    return pool;
  }

  @Override
  protected WorkerPool readPool() {
    WorkerPool pool = readPool;
    if (pool == null) {
      pool = config.getReadPool();
      if (pool == null) {
        pool = new WorkerPool("biglist-reader");
        ownsReadPool = true;
      }
      readPool = pool;
    }
    return pool;
  }

  @Override
  protected int readThreads() {
    return config.getReadThreads();
  }

  private Dumper dumper() {
    Dumper d = dumper;
    if (d == null) {
      d = new Dumper(writePool(), config.getWriteThreads());
      dumper = d;
    }
    return d;
  }

  // ---------------------------------------------------------------- writing

  private void ensureOpen() {
    if (closed) {
      throw new IllegalStateException("biglist at " + location + " is closed");
    }
  }

  /**
   * Add an element at the end.  The element is not visible to readers until the next
   * {@link #flush()}.  Blocks if too many data file writes are already in flight.
   */
  public void append(T element) {
    ensureOpen();
    appendBuffer.add(element);
    if (appendBuffer.size() >= info.getBatchSize()) {
      flushToFile();
    }
  }

  public void extend(Iterable<? extends T> elements) {
    for (T element : elements) {
      append(element);
    }
  }

  private void writeBatch(List<T> batch, String destination) throws IOException {
    location.directory().writeBytes(destination, codec.serialize(batch), false);
  }

  /**
   * Hand the append buffer to the background writer as a new data file.  If the writer
   * rejects it, the elements stay in the buffer.
   */
  private void flushToFile() {
    if (appendBuffer.isEmpty()) {
      return;
    }
    List<T> batch = appendBuffer;
    String name = names.nextDataFileName(batch.size());
    dumper().dumpFile(this::writeBatch, batch, DATA_FOLDER + name);
    appendBuffer = new ArrayList<>(Math.min(info.getBatchSize(), 1024));
    pendingFiles.add(new PendingFile(name, batch.size(), PendingFile.State.PENDING));
  }

  @VisibleForTesting
  List<T> bufferedElements() {
    return Collections.unmodifiableList(new ArrayList<>(appendBuffer));
  }

  /**
   * Persist everything appended so far and merge it into the index, waiting up to the
   * configured lock timeout and throwing the first write failure, if any.
   *
   * @see #flush(boolean, Duration, boolean)
   */
  public void flush() throws IOException, LockAcquireFailed, PreconditionFailed {
    flush(false, config.getLockTimeout(), true);
  }

  /**
   * Persist everything appended so far.
   *
   * <p>The partial append buffer is written out, and this method waits for every data file
   * write.  Files that failed to write are logged, deleted if partially present, and
   * recorded in {@link #failedFiles()}; they never enter the index.
   *
   * <p>Without <code>eager</code>, the lock is taken, the index is re-read, this writer's
   * new files and every interim record left by any writer are merged in, the index is
   * written back, and the consumed interim records are deleted.
   *
   * <p>With <code>eager</code>, no lock is taken.  This writer's new files go into an
   * interim record and into this instance's view of the index only; other instances see
   * them after the next non-eager flush by anyone.
   *
   * @param eager whether to skip the lock and the index update
   * @param lockTimeout how long to wait for the lock
   * @param raiseOnWriteError whether to throw the first write failure (after cleaning it
   *   up) instead of returning it.  Files that did get written stay pending and are merged
   *   by the next flush.
   * @return the write failures since the last flush
   * @throws LockAcquireFailed if the lock could not be taken in time; the index is unchanged
   * @throws PreconditionFailed if another writer changed the index while this one held an
   *   expired lock; the new files stay pending
   * @throws NoSuchFileException if the biglist was destroyed
   * @throws IOException if storage fails, or (with <code>raiseOnWriteError</code>) if a
   *   data file write failed
   */
  public List<WriteFailure> flush(boolean eager, Duration lockTimeout, boolean raiseOnWriteError)
      throws IOException, LockAcquireFailed, PreconditionFailed {
    ensureOpen();
    flushToFile();
    List<WriteFailure> failures = collectWrites();
    if (raiseOnWriteError && !failures.isEmpty()) {
      Dumper.rethrow(failures.get(0).error());
    }
    if (eager) {
      flushEager();
    } else {
      flushMerged(lockTimeout);
    }
    return failures;
  }

  /**
   * Wait for the background writer and settle every pending file as confirmed or failed.
   */
  private List<WriteFailure> collectWrites() throws IOException {
    if (dumper == null) {
      return ImmutableList.of();
    }
    List<WriteFailure> failures = dumper.waitForAll(false);
    List<String> failedNames = new ArrayList<>(failures.size());
    for (WriteFailure failure : failures) {
      failedNames.add(failure.destination().substring(DATA_FOLDER.length()));
    }
    for (int i = 0; i < pendingFiles.size(); ++i) {
      PendingFile f = pendingFiles.get(i);
      if (f.state() == PendingFile.State.PENDING) {
        pendingFiles.set(i, f.withState(failedNames.contains(f.fileName()) ? PendingFile.State.FAILED : PendingFile.State.CONFIRMED));
      }
    }

    Directory dir = location.directory();
    for (WriteFailure failure : failures) {
      log.error("Failed to write data file {}", failure.destination(), failure.error());
      try {
        if (dir.exists(failure.destination())) {
          dir.delete(failure.destination());
        }
      } catch (IOException e) {
        log.error("Failed to delete data file {} after its write failed", failure.destination(), e);
      }
      failedFiles.add(failure);
    }
    pendingFiles.removeIf(f -> f.state() == PendingFile.State.FAILED);
    return failures;
  }

  private List<DataFileEntry> confirmedEntries() {
    return pendingFiles.stream()
        .filter(f -> f.state() == PendingFile.State.CONFIRMED)
        .map(PendingFile::entry)
        .collect(Collectors.toList());
  }

  private void flushEager() throws IOException {
    List<DataFileEntry> confirmed = confirmedEntries();
    if (confirmed.isEmpty()) {
      return;
    }

    // Each eager flush writes a fresh record holding everything in the previous one plus
    // the new entries, then deletes the previous one.  A record is never rewritten in
    // place, so a concurrent merge that consumes the previous record cannot lose entries.
    Directory dir = location.directory();
    List<DataFileEntry> entries = new ArrayList<>();
    String previous = eagerRecordName;
    if (previous != null) {
      try {
        entries.addAll(FORMAT.loadInterim(dir.readBytes(EAGER_FOLDER + previous)));
      } catch (NoSuchFileException consumed) {
        log.debug("Interim record {} was already merged by another writer", previous);
      }
    }
    entries.addAll(confirmed);

    String name = names.nextInterimName();
    dir.writeBytes(EAGER_FOLDER + name, FORMAT.serializeInterim(entries), false);
    eagerRecordName = name;
    if (previous != null) {
      dir.delete(EAGER_FOLDER + previous);
    }

    setInfo(info.withDataFilesInfo(DataFilesInfo.merge(info.getDataFilesInfo(), confirmed)));
    pendingFiles.removeIf(f -> f.state() == PendingFile.State.CONFIRMED);
  }

  private void flushMerged(Duration lockTimeout) throws IOException, LockAcquireFailed, PreconditionFailed {
    List<DataFileEntry> confirmed = confirmedEntries();
    Directory dir = location.directory();

    try (Lock.Guard guard = lock.acquire(lockTimeout)) {
      VersionedInfo current = readInfo(infoBlob, location);

      List<DataFileEntry> additions = new ArrayList<>(confirmed);
      List<String> consumed = new ArrayList<>();
      List<String> interimRecords;
      try (Stream<String> entries = dir.list(EAGER_FOLDER)) {
        interimRecords = entries.sorted().collect(Collectors.toList());
      }
      for (String interim : interimRecords) {
        try {
          additions.addAll(FORMAT.loadInterim(dir.readBytes(interim)));
          consumed.add(interim);
        } catch (NoSuchFileException replaced) {
          // its writer replaced it with a newer record, which holds the same entries
          log.debug("Interim record {} vanished before it could be merged", interim);
        }
      }

      BiglistInfo merged = current.info();
      if (!additions.isEmpty()) {
        merged = merged.withDataFilesInfo(DataFilesInfo.merge(merged.getDataFilesInfo(), additions));
        infoBlob.write(current.tag(), new ByteArrayInputStream(FORMAT.serializeInfo(merged)));
        log.debug("Merged {} data file entries ({} interim records) into {} as lock holder {}",
            additions.size(), consumed.size(), location, guard.token());
      }

      for (String interim : consumed) {
        try {
          dir.delete(interim);
        } catch (IOException e) {
          log.warn("Failed to delete merged interim record {}; merging it again is harmless", interim, e);
        }
        if (interim.equals(EAGER_FOLDER + eagerRecordName)) {
          eagerRecordName = null;
        }
      }

      setInfo(merged);
      pendingFiles.removeIf(f -> f.state() == PendingFile.State.CONFIRMED);
    }

    try {
      infoBlob.cleanup();
    } catch (IOException e) {
      log.warn("Failed to delete old index versions at {}; the next flush will retry", location, e);
    }
  }

  /**
   * Re-read the index, picking up merges by other writers.
   *
   * @throws NoSuchFileException if the biglist was destroyed
   */
  public void reload() throws IOException {
    ensureOpen();
    setInfo(readInfo(infoBlob, location).info());
  }

  private void setInfo(BiglistInfo newInfo) {
    info = newInfo;
    fileSeq = null;
    invalidateCache();
  }

  // ---------------------------------------------------------------- reading

  @Override
  protected FileSeq<T> fileSeq() {
    BiglistFileSeq<T> result = fileSeq;
    if (result == null) {
      result = new BiglistFileSeq<>(DATA_FOLDER, info.getDataFilesInfo(),
          new BiglistFileReader.DirectoryLoader<>(location.directory(), codec));
      fileSeq = result;
    }
    return result;
  }

  @VisibleForTesting
  boolean warnFlush(String source) {
    if (!appendBuffer.isEmpty() || !pendingFiles.isEmpty()) {
      log.warn("did you forget to flush {} at '{}' (about to call `{}`)?", getClass().getSimpleName(), location, source);
      return true;
    }
    return false;
  }

  /**
   * The data files as of this instance's view of the index.  Readers from the returned
   * sequence can be handed to other threads or, for local and in-memory locations,
   * serialized and sent to other processes.
   */
  @Override
  public FileSeq<T> files() {
    ensureOpen();
    warnFlush("files");
    return super.files();
  }

  @Override
  public long size() {
    ensureOpen();
    warnFlush("size");
    return super.size();
  }

  @Override
  public T get(long index) {
    ensureOpen();
    return super.get(index);
  }

  @Override
  public Iterator<T> iterator() {
    ensureOpen();
    warnFlush("iterator");
    return super.iterator();
  }

  // ---------------------------------------------------------------- lifecycle

  /**
   * Delete the biglist and everything at its location.  Unflushed elements are dropped.
   * The instance cannot be used afterward.
   */
  public void destroy() throws IOException {
    if (dumper != null) {
      List<WriteFailure> dropped = dumper.waitForAll(false);
      for (WriteFailure failure : dropped) {
        log.debug("Ignoring failed write of {} while destroying", failure.destination(), failure.error());
      }
    }
    appendBuffer.clear();
    pendingFiles.clear();
    eagerRecordName = null;
    location.destroy();
    setInfo(info.withDataFilesInfo(ImmutableList.of()));
    closeResources();
  }

  /**
   * Flush if there is unflushed data (with a warning), then release the worker pools and
   * connections this instance created.  Pools passed in through the config are left open.
   */
  @Override
  public void close() throws IOException {
    if (closed) {
      return;
    }
    try {
      if (warnFlush("close")) {
        flush();
      }
    } catch (LockAcquireFailed | PreconditionFailed e) {
      throw new IOException("failed to flush " + this + " while closing", e);
    } finally {
      closeResources();
    }
  }

  private void closeResources() throws IOException {
    closed = true;
    if (ownsWritePool && writePool != null) {
      writePool.close();
    }
    if (ownsReadPool && readPool != null) {
      readPool.close();
    }
    if (ownsLocation) {
      location.close();
    }
  }

  // ---------------------------------------------------------------- serialization

  private static final class SerializedForm implements Serializable {
    private static final long serialVersionUID = 1L;

    private final Location location;
    private final String storageFormat;
    private final CodecRegistry codecs;
    private final int writeThreads;
    private final int readThreads;
    private final Duration lockTimeout;
    private final Duration lockLease;
    private final @Nullable String fileNameTag;

    SerializedForm(Location location, BiglistConfig config) {
      this.location = location;
      this.storageFormat = config.getStorageFormat();
      this.codecs = config.getCodecs();
      this.writeThreads = config.getWriteThreads();
      this.readThreads = config.getReadThreads();
      this.lockTimeout = config.getLockTimeout();
      this.lockLease = config.getLockLease();
      this.fileNameTag = config.getFileNameTag();
    }

    private Object readResolve() throws ObjectStreamException {
      BiglistConfig config = BiglistConfig.builder()
          .storageFormat(storageFormat)
          .codecs(codecs)
          .writeThreads(writeThreads)
          .readThreads(readThreads)
          .lockTimeout(lockTimeout)
          .lockLease(lockLease)
          .fileNameTag(fileNameTag)
          .build();
      try {
        return Biglist.open(location, config);
      } catch (IOException e) {
        InvalidObjectException ex = new InvalidObjectException("failed to reopen biglist at " + location);
        ex.initCause(e);
        throw ex;
      }
    }
  }

  private Object writeReplace() {
    ensureOpen();
    warnFlush("writeReplace");
    return new SerializedForm(location, config);
  }

  private void readObject(ObjectInputStream in) throws InvalidObjectException {
    throw new InvalidObjectException("biglists are deserialized through their serialized form");
  }

  @Override
  public String toString() {
    FileSeq<T> files = fileSeq();
    return "<" + getClass().getSimpleName() + " at '" + location + "' with " + files.numDataItems()
        + " elements in " + files.size() + " data file(s)>";
  }

}
