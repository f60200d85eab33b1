package cal.biglist.impls;

import cal.biglist.types.Codec;
import cal.prim.Util;
import cal.prim.transforms.BlobTransformer;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/**
 * A codec whose output is passed through a {@link BlobTransformer}, such as compression.
 */
public class TransformedCodec<T> implements Codec<T> {

  private static final long serialVersionUID = 1L;

  private final Codec<T> inner;
  private final BlobTransformer transformer;

  public TransformedCodec(Codec<T> inner, BlobTransformer transformer) {
    this.inner = inner;
    this.transformer = transformer;
  }

  @Override
  public byte[] serialize(List<T> batch) throws IOException {
    try (InputStream in = transformer.apply(new ByteArrayInputStream(inner.serialize(batch)))) {
      return Util.read(in);
    }
  }

  @Override
  public List<T> deserialize(byte[] data) throws IOException {
    byte[] raw;
    try (InputStream in = transformer.unApply(new ByteArrayInputStream(data))) {
      raw = Util.read(in);
    }
    return inner.deserialize(raw);
  }

  @Override
  public String toString() {
    return inner + "+" + transformer;
  }

}
