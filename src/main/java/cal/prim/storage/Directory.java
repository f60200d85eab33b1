package cal.prim.storage;

import cal.prim.Util;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.NoSuchFileException;
import java.util.stream.Stream;

/**
 * A flat namespace mapping string names to byte arrays.  Often called an "object store",
 * implementations of this interface range from a folder on local disk to a bucket in the
 * cloud.  To avoid confusion with the Java term "Object", this interface has the name
 * "directory" instead of "object store".
 *
 * <p>Names may contain <code>/</code>, which implementations may map to nested folders.
 * Listing is always recursive and always returns full names.
 *
 * <p>Every implementation offers read-after-write consistency for a single name: once
 * {@link #createOrReplace(String, InputStream)} returns, {@link #open(String)} will see
 * the new data.  Listing may lag behind writes on some implementations.
 */
public interface Directory {

  /**
   * List the entries whose names start with <code>prefix</code>.  The returned list is not
   * guaranteed to be in any particular order.  It will never contain duplicates.
   *
   * <p>Because the list may be streamed from external storage, it may throw
   * {@link java.io.UncheckedIOException} during iteration.
   *
   * @param prefix a name prefix; the empty string lists everything
   * @return a stream of full entry names
   * @throws IOException if the external storage could not be reached
   */
  Stream<String> list(String prefix) throws IOException;

  /**
   * @param name the name of the entry
   * @return whether the entry exists
   * @throws IOException if the external storage could not be reached
   */
  boolean exists(String name) throws IOException;

  /**
   * Create or overwrite an entry.  Readers never observe a partially-written entry.
   *
   * @param name the name of the entry
   * @param stream the data to write
   * @throws IOException if the write fails, or if the given <code>stream</code> throws an
   *   <code>IOException</code> while reading
   */
  void createOrReplace(String name, InputStream stream) throws IOException;

  /**
   * Create an entry that must not exist yet.
   *
   * <p>Implementations backed by eventually consistent stores may only check on a
   * best-effort basis; callers that need true exclusion must use a register.
   *
   * @param name the name of the entry
   * @param stream the data to write
   * @throws FileAlreadyExistsException if the entry already exists
   * @throws IOException if the write fails
   */
  void create(String name, InputStream stream) throws IOException;

  /**
   * Open an entry for reading.
   *
   * @param name the name of the entry
   * @return an unbuffered stream over the entry's contents
   * @throws NoSuchFileException if there is no such entry
   * @throws IOException if the external storage could not be reached
   */
  InputStream open(String name) throws IOException;

  /**
   * Delete an entry.  Deleting an entry that does not exist is not an error.
   *
   * @param name the name of the entry
   * @throws IOException if the external storage could not be reached
   */
  void delete(String name) throws IOException;

  default byte[] readBytes(String name) throws IOException {
    try (InputStream in = open(name)) {
      return Util.read(in);
    }
  }

  default void writeBytes(String name, byte[] data, boolean overwrite) throws IOException {
    if (overwrite) {
      createOrReplace(name, new ByteArrayInputStream(data));
    } else {
      create(name, new ByteArrayInputStream(data));
    }
  }

}
