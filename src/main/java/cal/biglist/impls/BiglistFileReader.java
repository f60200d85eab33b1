package cal.biglist.impls;

import cal.biglist.types.Codec;
import cal.biglist.types.FileReader;
import cal.prim.storage.Directory;

import java.io.IOException;
import java.io.Serializable;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * Reads one data file through a {@link Codec}.  The loaded elements are not serialized
 * with the reader; a deserialized reader loads them again on first use.
 */
public class BiglistFileReader<T> implements FileReader<T> {

  private static final long serialVersionUID = 1L;

  /**
   * Fetches and decodes a data file.  A reader is serializable exactly when its loader is.
   */
  @FunctionalInterface
  public interface Loader<T> extends Serializable {
    List<T> load(String name) throws IOException;
  }

  /**
   * Loads files from a directory.  Serializable when the directory is.
   */
  public static class DirectoryLoader<T> implements Loader<T> {
    private static final long serialVersionUID = 1L;

    private final Directory directory;
    private final Codec<T> codec;

    public DirectoryLoader(Directory directory, Codec<T> codec) {
      this.directory = directory;
      this.codec = codec;
    }

    @Override
    public List<T> load(String name) throws IOException {
      return codec.deserialize(directory.readBytes(name));
    }

    @Override
    public String toString() {
      return directory.toString();
    }
  }

  private final String name;
  private final Loader<T> loader;
  private transient volatile List<T> data;

  public BiglistFileReader(String name, Loader<T> loader) {
    this.name = name;
    this.loader = loader;
  }

  @Override
  public String name() {
    return name;
  }

  @Override
  public void load() throws IOException {
    if (data == null) {
      // elements may be null, which rules out ImmutableList
      data = Collections.unmodifiableList(new ArrayList<>(loader.load(name)));
    }
  }

  @Override
  public boolean isLoaded() {
    return data != null;
  }

  private List<T> data() {
    List<T> result = data;
    if (result == null) {
      try {
        load();
      } catch (IOException e) {
        throw new UncheckedIOException("failed to load " + name, e);
      }
      result = data;
    }
    return result;
  }

  @Override
  public long size() {
    return data().size();
  }

  @Override
  public T get(long index) {
    List<T> d = data();
    long i = index < 0 ? index + d.size() : index;
    if (i < 0 || i >= d.size()) {
      throw new IndexOutOfBoundsException("index " + index + " out of range for " + name + " with " + d.size() + " elements");
    }
    return d.get((int)i);
  }

  @Override
  public Iterator<T> iterator() {
    return data().iterator();
  }

  @Override
  public String toString() {
    return "FileReader(" + loader + '/' + name + ')';
  }

}
