package cal.prim.time;

import java.time.Instant;

/**
 * A wall clock can tell you the date and time.  Most ways of measuring wall
 * clock time (such as Java's <code>Instant.now()</code>) are unreliable: a
 * computer's notion of wall clock time can be wrong, and it can jump forward
 * and backward.
 *
 * <p>Code in this project only uses wall clock time where a little error is
 * harmless: to name files so that they sort roughly by creation time, and to
 * stamp lock leases with an expiry.  Leases assume that machines agree on
 * the time to well within the lease length.
 */
public interface UnreliableWallClock {
  Instant now();

  UnreliableWallClock SYSTEM_CLOCK = Instant::now;

  /**
   * A clock that always reports the same instant.  Mostly useful in tests.
   *
   * @param instant the instant to report
   * @return a stopped clock
   */
  static UnreliableWallClock fixed(Instant instant) {
    return () -> instant;
  }
}
