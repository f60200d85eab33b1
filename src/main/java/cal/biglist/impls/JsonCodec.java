package cal.biglist.impls;

import cal.biglist.types.Codec;
import cal.prim.MalformedDataException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.util.List;

/**
 * Stores a batch as a JSON array using Jackson.  With element type {@link Object},
 * elements come back as Jackson's natural types (maps, lists, strings, numbers, booleans).
 */
public class JsonCodec<T> implements Codec<T> {

  private static final long serialVersionUID = 1L;

  private final Class<T> elementType;
  // shared by reader threads; batchType is published before mapper
  private transient volatile ObjectMapper mapper;
  private transient volatile JavaType batchType;

  public JsonCodec(Class<T> elementType) {
    this.elementType = elementType;
  }

  private ObjectMapper mapper() {
    ObjectMapper m = mapper;
    if (m == null) {
      m = new ObjectMapper();
      batchType = m.getTypeFactory().constructCollectionType(List.class, elementType);
      mapper = m;
    }
    return m;
  }

  @Override
  public byte[] serialize(List<T> batch) throws IOException {
    return mapper().writeValueAsBytes(batch);
  }

  @Override
  public List<T> deserialize(byte[] data) throws IOException {
    ObjectMapper m = mapper();
    try {
      return m.readValue(data, batchType);
    } catch (JsonProcessingException e) {
      throw new MalformedDataException("data file is not a well-formed JSON array of " + elementType.getSimpleName(), e);
    }
  }

  @Override
  public String toString() {
    return "json(" + elementType.getSimpleName() + ')';
  }

}
