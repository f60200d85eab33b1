package cal.biglist.impls;

import cal.biglist.types.Codec;
import cal.prim.MalformedDataException;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Stores a batch with Java serialization.  Elements must be {@link java.io.Serializable}.
 * Only read data files written by trusted code with this codec.
 */
public class JavaSerializationCodec<T> implements Codec<T> {

  private static final long serialVersionUID = 1L;

  @Override
  public byte[] serialize(List<T> batch) throws IOException {
    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    try (ObjectOutputStream out = new ObjectOutputStream(bytes)) {
      out.writeObject(new ArrayList<>(batch));
    }
    return bytes.toByteArray();
  }

  @Override
  @SuppressWarnings("unchecked")
  public List<T> deserialize(byte[] data) throws IOException {
    try (ObjectInputStream in = new ObjectInputStream(new ByteArrayInputStream(data))) {
      Object result = in.readObject();
      if (!(result instanceof List)) {
        throw new MalformedDataException("expected a serialized list but found " + (result == null ? "null" : result.getClass().getName()));
      }
      return (List<T>)result;
    } catch (ClassNotFoundException e) {
      throw new MalformedDataException("data file refers to an unknown class", e);
    }
  }

  @Override
  public String toString() {
    return "java";
  }

}
