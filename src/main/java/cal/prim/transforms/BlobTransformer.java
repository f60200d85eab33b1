package cal.prim.transforms;

import org.checkerframework.checker.mustcall.qual.MustCallAlias;

import java.io.IOException;
import java.io.InputStream;
import java.io.Serializable;

/**
 * A reversible transformation on byte streams, such as compression.
 * <code>unApply(apply(s))</code> yields the bytes of <code>s</code>.
 *
 * <p>Transformers are {@link Serializable} so that they can travel inside lazy file
 * readers to other processes.
 */
public interface BlobTransformer extends Serializable {

  @MustCallAlias InputStream apply(@MustCallAlias InputStream data) throws IOException;
  @MustCallAlias InputStream unApply(@MustCallAlias InputStream data) throws IOException;

}
