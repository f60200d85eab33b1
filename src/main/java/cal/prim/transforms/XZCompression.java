package cal.prim.transforms;

import cal.prim.Util;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tukaani.xz.LZMA2Options;
import org.tukaani.xz.UnsupportedOptionsException;
import org.tukaani.xz.XZInputStream;
import org.tukaani.xz.XZOutputStream;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;

/**
 * XZ (LZMA2) compression.
 *
 * <p>{@link #apply(InputStream)} compresses the whole input into memory before returning.
 * Batches in this project are held in memory anyway, and this avoids a helper thread
 * per stream.
 */
public class XZCompression implements BlobTransformer {

  private static final long serialVersionUID = 1L;

  private static final Logger log = LoggerFactory.getLogger(XZCompression.class);

  public static final int DEFAULT_PRESET = LZMA2Options.PRESET_DEFAULT;

  private final int preset;

  public XZCompression() {
    this(DEFAULT_PRESET);
  }

  public XZCompression(int preset) {
    if (preset < LZMA2Options.PRESET_MIN || preset > LZMA2Options.PRESET_MAX) {
      throw new IllegalArgumentException("XZ preset must be in [" + LZMA2Options.PRESET_MIN + ", " + LZMA2Options.PRESET_MAX + "]: " + preset);
    }
    this.preset = preset;
  }

  private LZMA2Options options() {
    try {
      return new LZMA2Options(preset);
    } catch (UnsupportedOptionsException e) {
      log.warn("XZ library does not support compression level {}; using the default level instead", preset);
      return new LZMA2Options();
    }
  }

  @Override
  public InputStream apply(InputStream data) throws IOException {
    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    try (XZOutputStream out = new XZOutputStream(bytes, options());
         InputStream copy = data /* ensure data gets closed */) {
      Util.copyStream(copy, out);
    }
    return new ByteArrayInputStream(bytes.toByteArray());
  }

  @Override
  public InputStream unApply(InputStream data) throws IOException {
    return new XZInputStream(data);
  }

  @Override
  public String toString() {
    return "xz(" + preset + ')';
  }

}
