package cal.biglist.types;

import java.io.IOException;
import java.util.List;

/**
 * Persists one batch of elements under a name.
 */
@FunctionalInterface
public interface BatchWriter<T> {
  void write(List<T> batch, String destination) throws IOException;
}
