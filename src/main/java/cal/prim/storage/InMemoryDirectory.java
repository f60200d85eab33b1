package cal.prim.storage;

import cal.prim.Util;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.Serializable;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.NoSuchFileException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * A {@link Directory} that lives in the heap.  Useful for tests.  Serializing an instance
 * copies its current contents.
 */
public class InMemoryDirectory implements Directory, Serializable {

  private static final long serialVersionUID = 1L;

  private final Map<String, byte[]> entries = new HashMap<>();

  @Override
  public synchronized Stream<String> list(String prefix) {
    List<String> result = new ArrayList<>();
    for (String name : entries.keySet()) {
      if (name.startsWith(prefix)) {
        result.add(name);
      }
    }
    return result.stream();
  }

  @Override
  public synchronized boolean exists(String name) {
    return entries.containsKey(name);
  }

  @Override
  public void createOrReplace(String name, InputStream stream) throws IOException {
    byte[] data = Util.read(stream);
    synchronized (this) {
      entries.put(name, data);
    }
  }

  @Override
  public void create(String name, InputStream stream) throws IOException {
    byte[] data = Util.read(stream);
    synchronized (this) {
      if (entries.putIfAbsent(name, data) != null) {
        throw new FileAlreadyExistsException(name);
      }
    }
  }

  @Override
  public InputStream open(String name) throws NoSuchFileException {
    byte[] data;
    synchronized (this) {
      data = entries.get(name);
    }
    if (data == null) {
      throw new NoSuchFileException(name);
    }
    return new ByteArrayInputStream(data);
  }

  @Override
  public synchronized void delete(String name) {
    entries.remove(name);
  }

  @Override
  public synchronized String toString() {
    return "memory:" + entries.keySet();
  }

}
