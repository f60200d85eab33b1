package cal.biglist.types;

/**
 * A data file that a writer has handed to the background writer but not yet merged into
 * the index.
 */
public record PendingFile(String fileName, int count, State state) {

  public enum State {
    /** Submitted; the write may still be running. */
    PENDING,
    /** Written successfully; waiting to be merged. */
    CONFIRMED,
    /** The write failed; the file will never be merged. */
    FAILED
  }

  public PendingFile withState(State newState) {
    return new PendingFile(fileName, count, newState);
  }

  public DataFileEntry entry() {
    return new DataFileEntry(fileName, count);
  }

}
