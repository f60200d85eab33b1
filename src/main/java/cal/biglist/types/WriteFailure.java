package cal.biglist.types;

/**
 * A data file that could not be written.
 *
 * @param destination the name the file would have had
 * @param error what went wrong
 */
public record WriteFailure(String destination, Throwable error) {
}
