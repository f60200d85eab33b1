package cal.prim;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

public abstract class Util {

  public static final long ONE_MB = 1024L * 1024L;

  /**
   * Buffer size for stream copies; matches {@link java.io.BufferedInputStream}.
   */
  public static final int SUGGESTED_BUFFER_SIZE = 8192;

  private static final ThreadLocal<byte[]> COPY_BUFFER = ThreadLocal.withInitial(() -> new byte[SUGGESTED_BUFFER_SIZE]);

  /**
   * Copy <code>in</code> to <code>out</code> until end-of-stream.  Neither stream is closed.
   *
   * @return the number of bytes copied
   */
  public static long copyStream(InputStream in, OutputStream out) throws IOException {
    byte[] buffer = COPY_BUFFER.get();
    long total = 0;
    for (int n = in.read(buffer); n >= 0; n = in.read(buffer)) {
      out.write(buffer, 0, n);
      total += n;
    }
    return total;
  }

  public static byte[] read(InputStream in) throws IOException {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    copyStream(in, out);
    return out.toByteArray();
  }

  /**
   * Fill <code>chunk</code> from <code>in</code>, stopping early only at end-of-stream.
   *
   * @return the number of bytes read
   */
  public static int readChunk(InputStream in, byte[] chunk) throws IOException {
    int soFar = 0;
    while (soFar < chunk.length) {
      int n = in.read(chunk, soFar, chunk.length - soFar);
      if (n < 0) {
        break;
      }
      soFar += n;
    }
    return soFar;
  }

}
