package cal.prim.concurrency;

import cal.prim.PreconditionFailed;
import cal.prim.time.UnreliableWallClock;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Stopwatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * A leased {@link Lock} on top of a {@link StringRegister}.
 *
 * <p>The register holds <code>""</code> when the lock is free and
 * <code>{token}@{expiry millis}</code> while it is held.  A holder that crashes leaves its
 * value behind; once the expiry passes, the next acquirer replaces it.
 */
public class RegisterLock implements Lock {

  private static final Logger log = LoggerFactory.getLogger(RegisterLock.class);

  @VisibleForTesting
  static final Duration POLL_INTERVAL = Duration.ofMillis(100);

  private final StringRegister register;
  private final Duration lease;
  private final UnreliableWallClock clock;

  public RegisterLock(StringRegister register, Duration lease, UnreliableWallClock clock) {
    if (lease.isNegative() || lease.isZero()) {
      throw new IllegalArgumentException("lease must be positive: " + lease);
    }
    this.register = register;
    this.lease = lease;
    this.clock = clock;
  }

  public RegisterLock(StringRegister register, Duration lease) {
    this(register, lease, UnreliableWallClock.SYSTEM_CLOCK);
  }

  @VisibleForTesting
  static Instant expiry(String value) {
    int at = value.lastIndexOf('@');
    if (at < 0) {
      throw new IllegalArgumentException("malformed lock value: '" + value + '\'');
    }
    try {
      return Instant.ofEpochMilli(Long.parseLong(value.substring(at + 1)));
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("malformed lock value: '" + value + '\'', e);
    }
  }

  private boolean isExpired(String value) {
    try {
      return !clock.now().isBefore(expiry(value));
    } catch (IllegalArgumentException e) {
      log.warn("Treating malformed value in {} as expired", register, e);
      return true;
    }
  }

  @Override
  public Guard acquire(Duration timeout) throws IOException, LockAcquireFailed {
    String token = UUID.randomUUID().toString();
    Stopwatch stopwatch = Stopwatch.createStarted();
    for (;;) {
      String current = register.read();
      if (current.isEmpty() || isExpired(current)) {
        String mine = token + '@' + clock.now().plus(lease).toEpochMilli();
        try {
          register.write(current, mine);
          if (!current.isEmpty()) {
            log.warn("Took over expired lock {} (was held as {})", register, current);
          }
          return new RegisterGuard(token, mine);
        } catch (PreconditionFailed lostRace) {
          log.debug("Lost race for lock {}", register);
          continue;
        }
      }

      if (stopwatch.elapsed().compareTo(timeout) >= 0) {
        throw new LockAcquireFailed("could not acquire " + register + " within " + timeout + " (held as " + current + ")");
      }
      try {
        Thread.sleep(POLL_INTERVAL.toMillis());
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        InterruptedIOException ex = new InterruptedIOException("interrupted while acquiring " + register);
        ex.initCause(e);
        throw ex;
      }
    }
  }

  private class RegisterGuard implements Guard {
    private final String token;
    private final String value;
    private boolean released = false;

    RegisterGuard(String token, String value) {
      this.token = token;
      this.value = value;
    }

    @Override
    public String token() {
      return token;
    }

    @Override
    public synchronized void close() throws IOException {
      if (released) {
        return;
      }
      released = true;
      try {
        register.write(value, "");
      } catch (PreconditionFailed e) {
        log.warn("Lost lease on {} before release; another holder took over", register);
      }
    }
  }

  @Override
  public String toString() {
    return "lock:" + register;
  }

}
