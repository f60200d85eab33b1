package cal.biglist.impls;

import cal.prim.time.UnreliableWallClock;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

@Test
public class DataFileNamesTests {

  private static final Instant NOW = Instant.parse("2024-01-02T03:04:05.123456789Z");

  @Test
  public void testFormat() {
    DataFileNames names = new DataFileNames(UnreliableWallClock.fixed(NOW), null, "java-xz");
    String name = names.nextDataFileName(1000);
    Assert.assertTrue(Pattern.matches("20240102030405\\.123456_[0-9a-f]{16}_1000\\.java_xz", name), name);
  }

  @Test
  public void testTag() {
    DataFileNames names = new DataFileNames(UnreliableWallClock.fixed(NOW), "worker-7", "json");
    String name = names.nextDataFileName(3);
    Assert.assertTrue(Pattern.matches("20240102030405\\.123456_worker-7_[0-9a-f]{16}_3\\.json", name), name);
    Assert.assertThrows(IllegalArgumentException.class, () -> new DataFileNames(UnreliableWallClock.SYSTEM_CLOCK, "bad_tag", "json"));
  }

  @Test
  public void testStrictlyIncreasingWhenClockStops() {
    DataFileNames names = new DataFileNames(UnreliableWallClock.fixed(NOW), null, "json");
    List<String> generated = new ArrayList<>();
    for (int i = 0; i < 100; ++i) {
      generated.add(names.nextDataFileName(1));
    }
    for (int i = 1; i < generated.size(); ++i) {
      Assert.assertTrue(generated.get(i - 1).compareTo(generated.get(i)) < 0, generated.get(i - 1) + " vs " + generated.get(i));
    }
    Assert.assertTrue(generated.get(1).startsWith("20240102030405.123457_"), generated.get(1));
  }

  @Test
  public void testInterimName() {
    DataFileNames names = new DataFileNames(UnreliableWallClock.fixed(NOW), null, "json");
    Assert.assertTrue(Pattern.matches("20240102030405\\.123456_[0-9a-f]{32}", names.nextInterimName()));
  }

}
