package cal.prim.storage;

import cal.prim.NoValue;
import cal.prim.PreconditionFailed;
import cal.prim.concurrency.StringRegister;
import lombok.NonNull;
import lombok.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.nio.file.NoSuchFileException;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * A {@link ConsistentBlob} whose versions are immutable entries in a {@link Directory}.
 * A {@link StringRegister} (the "clock") holds the name of the current version; writes
 * create a new entry and then compare-and-swap the clock.
 *
 * <p>Version names look like <code>{prefix}{N}-{uuid}{suffix}</code>, where <code>N</code>
 * counts the successful writes.  An empty clock means nothing has been written yet.
 */
public class ConsistentBlobOnDirectory implements ConsistentBlob {

  private static final Logger log = LoggerFactory.getLogger(ConsistentBlobOnDirectory.class);

  private static final int MAX_READ_ATTEMPTS = 5;
  private static final long READ_RETRY_DELAY_MILLIS = 100;

  private final StringRegister clock;
  private final Directory directory;
  private final String namePrefix;
  private final String nameSuffix;
  private final Pattern namePattern;

  public ConsistentBlobOnDirectory(StringRegister clock, Directory directory, String namePrefix, String nameSuffix) {
    this.clock = clock;
    this.directory = directory;
    this.namePrefix = namePrefix;
    this.nameSuffix = nameSuffix;
    this.namePattern = Pattern.compile(Pattern.quote(namePrefix) + "(\\d+)-.*" + Pattern.quote(nameSuffix));
  }

  @Value
  private static class MyTag implements Tag {
    @NonNull String id;

    @Override
    public String toString() {
      return id.isEmpty() ? "<none>" : id;
    }
  }

  private MyTag upcast(Tag tag) {
    try {
      return (MyTag)tag;
    } catch (ClassCastException ignored) {
      throw new IllegalArgumentException("the given tag belongs to some other class");
    }
  }

  private String freshName(long associatedClockValue) {
    return namePrefix + associatedClockValue + '-' + UUID.randomUUID() + nameSuffix;
  }

  private long associatedClockValue(String name) {
    if (name.isEmpty()) {
      return 0L;
    }
    Matcher m = namePattern.matcher(name);
    if (m.matches()) {
      try {
        return Long.parseLong(m.group(1));
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException("not a well-formed name: " + name, e);
      }
    }
    throw new IllegalArgumentException("not a well-formed name: " + name);
  }

  @Override
  public MyTag head() throws IOException {
    return new MyTag(clock.read());
  }

  @Override
  public InputStream read(Tag entry) throws IOException, NoValue, TagExpired {
    String id = upcast(entry).id;
    if (id.isEmpty()) {
      throw new NoValue();
    }
    for (int attempt = 1; ; ++attempt) {
      try {
        return directory.open(id);
      } catch (NoSuchFileException e) {
        // Either a newer version replaced this one and cleanup() removed it, or the
        // directory has not made the entry visible yet.  Only the first case changes
        // the head.
        if (!Objects.equals(head(), entry)) {
          throw new TagExpired(entry);
        }
        if (attempt >= MAX_READ_ATTEMPTS) {
          throw e;
        }
        try {
          Thread.sleep(READ_RETRY_DELAY_MILLIS);
        } catch (InterruptedException interrupted) {
          Thread.currentThread().interrupt();
          InterruptedIOException ex = new InterruptedIOException("interrupted while reading " + id);
          ex.initCause(interrupted);
          throw ex;
        }
      }
    }
  }

  @Override
  public Tag write(Tag expected, InputStream data) throws IOException, PreconditionFailed {
    String expectedId = upcast(expected).id;
    String currentName = clock.read();
    if (!currentName.equals(expectedId)) {
      throw new PreconditionFailed("expected " + expected + " but got " + new MyTag(currentName));
    }

    String name = freshName(associatedClockValue(expectedId) + 1);
    directory.createOrReplace(name, data);
    try {
      clock.write(expectedId, name);
    } catch (PreconditionFailed e) {
      try {
        directory.delete(name);
      } catch (IOException onDelete) {
        log.warn("Failed to delete unused version {}; cleanup() will retry", name, onDelete);
      }
      throw e;
    }
    // The old version stays around for readers that already hold its tag.  It will get
    // clobbered by cleanup() later.
    return new MyTag(name);
  }

  @Override
  public void cleanup() throws IOException {
    String currentHead = head().id;
    if (currentHead.isEmpty()) {
      return;
    }
    final long cutoff = associatedClockValue(currentHead);

    List<String> candidates;
    try (Stream<String> entries = directory.list(namePrefix)) {
      candidates = entries.collect(Collectors.toList());
    }

    for (String name : candidates) {
      final long clockValue;
      try {
        clockValue = associatedClockValue(name);
      } catch (IllegalArgumentException e) {
        log.warn("Keeping object with malformed name {}", name);
        continue;
      }

      // The current head can NOT be deleted.  An entry with a clock value <= cutoff is
      // either a previous head or a write that lost its compare-and-swap.  An entry with a
      // clock value > cutoff is a write that MAY still succeed.
      if (clockValue <= cutoff && !Objects.equals(name, currentHead)) {
        log.debug("Deleting old version {}", name);
        directory.delete(name);
      }
    }
  }

  @Override
  public String toString() {
    return directory + "/" + namePrefix + "* @ " + clock;
  }

}
