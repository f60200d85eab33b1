package cal.biglist.impls;

import cal.prim.concurrency.StringRegister;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.nio.file.Files;
import java.util.stream.Collectors;
import java.util.stream.Stream;

@Test
public class LocationTests {

  @Test
  public void testRegistersAreCached() throws Exception {
    InMemoryLocation location = new InMemoryLocation("regs");
    Assert.assertSame(location.register("info"), location.register("info"));
    Assert.assertNotSame(location.register("info"), location.register("lock"));
    Assert.assertThrows(IllegalArgumentException.class, () -> location.register("no/slashes"));
    Assert.assertThrows(IllegalArgumentException.class, () -> location.register(""));
  }

  @Test
  public void testDestroyResetsEverything() throws Exception {
    InMemoryLocation location = new InMemoryLocation();
    StringRegister register = location.register("info");
    register.write("", "v1");
    location.directory().writeBytes("a/b", new byte[] {1}, false);
    location.directory().writeBytes("c", new byte[] {2}, false);

    location.destroy();
    Assert.assertEquals(register.read(), "");
    try (Stream<String> names = location.directory().list("")) {
      Assert.assertEquals(names.collect(Collectors.toList()).size(), 0);
    }
  }

  @Test
  public void testLocalRegistersShareState() throws Exception {
    LocalLocation first = LocalLocation.createTemp();
    try (LocalLocation second = new LocalLocation(first.root())) {
      first.register("info").write("", "hello");
      Assert.assertEquals(second.register("info").read(), "hello");
      try (Stream<String> names = first.directory().list("")) {
        Assert.assertEquals(names.count(), 0L, "register database should be hidden");
      }
    } finally {
      first.destroy();
    }
    Assert.assertFalse(Files.exists(first.root()));
  }

}
