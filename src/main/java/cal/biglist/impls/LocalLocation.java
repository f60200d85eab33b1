package cal.biglist.impls;

import cal.prim.concurrency.SQLiteStringRegister;
import cal.prim.concurrency.StringRegister;
import cal.prim.storage.Directory;
import cal.prim.storage.LocalDirectory;
import com.google.common.io.MoreFiles;
import com.google.common.io.RecursiveDeleteOption;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.io.InvalidObjectException;
import java.io.ObjectInputStream;
import java.io.ObjectStreamException;
import java.io.Serializable;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * A location in a folder on local disk.  Registers live in a SQLite database inside the
 * folder, so processes on one machine can share a biglist.
 *
 * <p>A serialized location records only its folder.
 */
public class LocalLocation extends AbstractLocation implements Serializable {

  private static final long serialVersionUID = 1L;

  private static final Logger log = LoggerFactory.getLogger(LocalLocation.class);

  static final String REGISTER_DB = ".registers.sqlite";

  private final Path root;
  private final LocalDirectory directory;

  public LocalLocation(Path root) throws IOException {
    this.root = root.toAbsolutePath();
    this.directory = new LocalDirectory(this.root);
  }

  /**
   * @return a location in a fresh temporary folder
   */
  public static LocalLocation createTemp() throws IOException {
    Path dir = Files.createTempDirectory("biglist-");
    log.debug("Created temporary location {}", dir);
    return new LocalLocation(dir);
  }

  public Path root() {
    return root;
  }

  @Override
  public Directory directory() {
    return directory;
  }

  @Override
  protected StringRegister newRegister(String name) throws IOException {
    return new SQLiteStringRegister(root.resolve(REGISTER_DB), name);
  }

  @Override
  public void destroy() throws IOException {
    close();
    if (Files.exists(root)) {
      MoreFiles.deleteRecursively(root, RecursiveDeleteOption.ALLOW_INSECURE);
    }
    log.debug("Destroyed {}", this);
  }

  @Override
  public void close() throws IOException {
    IOException failure = null;
    for (StringRegister register : openRegisters()) {
      try {
        ((Closeable)register).close();
      } catch (IOException e) {
        if (failure == null) {
          failure = e;
        } else {
          failure.addSuppressed(e);
        }
      }
    }
    forgetRegisters();
    if (failure != null) {
      throw failure;
    }
  }

  private static final class SerializedForm implements Serializable {
    private static final long serialVersionUID = 1L;

    private final String root;

    SerializedForm(String root) {
      this.root = root;
    }

    private Object readResolve() throws ObjectStreamException {
      try {
        return new LocalLocation(Paths.get(root));
      } catch (IOException e) {
        InvalidObjectException ex = new InvalidObjectException("cannot open local location " + root);
        ex.initCause(e);
        throw ex;
      }
    }
  }

  private Object writeReplace() {
    return new SerializedForm(root.toString());
  }

  private void readObject(ObjectInputStream in) throws InvalidObjectException {
    throw new InvalidObjectException("local locations are deserialized through their serialized form");
  }

  @Override
  public String toString() {
    return root.toString();
  }

}
