package cal.prim.storage;

import cal.prim.Util;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.Serializable;
import java.nio.channels.Channels;
import java.nio.channels.FileChannel;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * A {@link Directory} stored in a folder on local disk.  Names containing <code>/</code>
 * become nested folders.
 *
 * <p>Writes go to a temporary file under {@value #TMP_DIR} which is synced and then moved
 * into place, so readers never see partial entries.  Entries whose path has a component
 * starting with "." are private to the implementation (or to other tenants of the folder,
 * such as a register database) and are never listed.
 */
public class LocalDirectory implements Directory, Serializable {

  private static final long serialVersionUID = 1L;

  static final String TMP_DIR = ".tmp";

  // Path is not Serializable
  private final String root;

  public LocalDirectory(Path root) throws IOException {
    Files.createDirectories(root);
    this.root = root.toAbsolutePath().toString();
  }

  public Path root() {
    return Paths.get(root);
  }

  private Path resolve(String name) {
    if (name.isEmpty() || name.startsWith("/") || name.contains("..")) {
      throw new IllegalArgumentException("illegal entry name: '" + name + '\'');
    }
    return root().resolve(name);
  }

  private static boolean isHidden(Path relative) {
    for (Path component : relative) {
      if (component.toString().startsWith(".")) {
        return true;
      }
    }
    return false;
  }

  private static String toName(Path relative) {
    return relative.toString().replace(relative.getFileSystem().getSeparator(), "/");
  }

  @Override
  public Stream<String> list(String prefix) throws IOException {
    Path base = root();
    if (!Files.isDirectory(base)) {
      return Stream.empty();
    }
    List<String> result;
    try (Stream<Path> entries = Files.walk(base)) {
      result = entries
              .filter(Files::isRegularFile)
              .map(base::relativize)
              .filter(p -> !isHidden(p))
              .map(LocalDirectory::toName)
              .filter(name -> name.startsWith(prefix))
              .collect(Collectors.toList());
    }
    return result.stream();
  }

  @Override
  public boolean exists(String name) {
    return Files.isRegularFile(resolve(name));
  }

  /**
   * Write <code>data</code> to a fresh temporary file and force it to disk.
   */
  private Path writeTemp(InputStream data) throws IOException {
    Path tmpDir = root().resolve(TMP_DIR);
    Files.createDirectories(tmpDir);
    Path tmp = tmpDir.resolve(UUID.randomUUID().toString());
    try (FileChannel channel = FileChannel.open(tmp, StandardOpenOption.WRITE, StandardOpenOption.CREATE_NEW)) {
      OutputStream out = Channels.newOutputStream(channel);
      Util.copyStream(data, out);
      channel.force(true);
    } catch (IOException e) {
      try {
        Files.deleteIfExists(tmp);
      } catch (IOException onDelete) {
        e.addSuppressed(onDelete);
      }
      throw e;
    }
    return tmp;
  }

  @Override
  public void createOrReplace(String name, InputStream data) throws IOException {
    Path target = resolve(name);
    Files.createDirectories(target.getParent());
    Path tmp = writeTemp(data);
    try {
      Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    } catch (IOException e) {
      Files.deleteIfExists(tmp);
      throw e;
    }
  }

  @Override
  public void create(String name, InputStream data) throws IOException {
    Path target = resolve(name);
    Files.createDirectories(target.getParent());
    Path tmp = writeTemp(data);
    try {
      // A hard link fails atomically if the target exists, unlike a rename.
      Files.createLink(target, tmp);
    } catch (UnsupportedOperationException e) {
      Files.move(tmp, target);
    } finally {
      Files.deleteIfExists(tmp);
    }
  }

  @Override
  public InputStream open(String name) throws IOException {
    Path path = resolve(name);
    if (!Files.isRegularFile(path)) {
      throw new NoSuchFileException(name);
    }
    return Files.newInputStream(path);
  }

  @Override
  public void delete(String name) throws IOException {
    Files.deleteIfExists(resolve(name));
  }

  @Override
  public String toString() {
    return root;
  }

}
