package cal.biglist.impls;

import cal.prim.time.UnreliableWallClock;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.security.SecureRandom;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.Random;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.regex.Pattern;

/**
 * Makes names for the files a writer creates.
 *
 * <p>Data files are named <code>{timestamp}_{tag_}{16 hex digits}_{count}.{ext}</code>,
 * where the timestamp is UTC with microseconds (<code>yyyyMMddHHmmss.SSSSSS</code>),
 * the tag is optional, and the extension is the storage format with "-" replaced by "_".
 * The random part keeps names from different writers apart.  Names from one instance
 * are strictly increasing: if the clock has not moved (or has moved backward) since the
 * last name, the timestamp is bumped by one microsecond.
 */
public class DataFileNames {

  private static final DateTimeFormatter TIMESTAMP =
      DateTimeFormatter.ofPattern("yyyyMMddHHmmss.SSSSSS").withZone(ZoneOffset.UTC);

  private static final Pattern LEGAL_TAG = Pattern.compile("[A-Za-z0-9-]+");

  private static final Random RANDOM = new SecureRandom();

  private final UnreliableWallClock clock;
  private final @Nullable String tag;
  private final String extension;
  private long lastMicros = Long.MIN_VALUE;

  /**
   * @param clock the time source
   * @param tag an optional label naming the writer; letters, digits, and "-" only
   * @param storageFormat the storage format of the data files
   */
  public DataFileNames(UnreliableWallClock clock, @Nullable String tag, String storageFormat) {
    if (tag != null && !LEGAL_TAG.matcher(tag).matches()) {
      throw new IllegalArgumentException("illegal file name tag '" + tag + "'; use letters, digits, and '-'");
    }
    this.clock = clock;
    this.tag = tag;
    this.extension = storageFormat.replace('-', '_');
  }

  static String formatTimestamp(Instant instant) {
    return TIMESTAMP.format(instant.truncatedTo(ChronoUnit.MICROS));
  }

  private synchronized Instant nextTimestamp() {
    Instant now = clock.now();
    long micros = TimeUnit.SECONDS.toMicros(now.getEpochSecond()) + TimeUnit.NANOSECONDS.toMicros(now.getNano());
    if (micros <= lastMicros) {
      micros = lastMicros + 1;
    }
    lastMicros = micros;
    return Instant.EPOCH.plus(micros, ChronoUnit.MICROS);
  }

  /**
   * @param count the number of elements the file will hold
   * @return a fresh data file name
   */
  public String nextDataFileName(int count) {
    StringBuilder name = new StringBuilder(formatTimestamp(nextTimestamp())).append('_');
    if (tag != null) {
      name.append(tag).append('_');
    }
    name.append(String.format("%016x", RANDOM.nextLong()));
    name.append('_').append(count).append('.').append(extension);
    return name.toString();
  }

  /**
   * @return a fresh name for an interim record: <code>{timestamp}_{32 hex digits}</code>
   */
  public String nextInterimName() {
    return formatTimestamp(nextTimestamp()) + '_' + UUID.randomUUID().toString().replace("-", "");
  }

}
