package cal.biglist.types;

import java.io.IOException;
import java.io.Serializable;
import java.util.List;

/**
 * Converts one batch of elements to bytes and back.
 *
 * <p>Codecs are {@link Serializable} since they travel inside {@link FileReader}s.
 */
public interface Codec<T> extends Serializable {

  byte[] serialize(List<T> batch) throws IOException;

  List<T> deserialize(byte[] data) throws IOException;

}
