package cal.prim;

import java.io.IOException;

/**
 * Thrown when stored data can be read but not understood.  Corrupt data is a storage
 * failure from the caller's point of view, so this is an {@link IOException}.
 */
public class MalformedDataException extends IOException {
  public MalformedDataException(String message) {
    super(message);
  }

  public MalformedDataException(String message, Throwable cause) {
    super(message, cause);
  }
}
