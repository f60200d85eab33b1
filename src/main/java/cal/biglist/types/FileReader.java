package cal.biglist.types;

import java.io.IOException;
import java.io.Serializable;

/**
 * A lazy handle on one data file.  Until {@link #load()} is called a reader carries only
 * the file's name and the means to read it, so it can be handed to another thread, or
 * serialized and sent to another process, cheaply.
 *
 * <p>{@link #size()}, {@link #get(long)} and iteration load the file on first use.
 */
public interface FileReader<T> extends Seq<T>, Serializable {

  /**
   * @return the name of the file this reader reads
   */
  String name();

  /**
   * Read the whole file into memory.  Calling this more than once has no further effect.
   *
   * @throws IOException if the file could not be read or decoded
   */
  void load() throws IOException;

  boolean isLoaded();

}
