package cal.prim.concurrency;

import cal.prim.PreconditionFailed;
import com.google.common.io.MoreFiles;
import com.google.common.io.RecursiveDeleteOption;
import org.testng.Assert;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

@Test
public class SQLiteStringRegisterTests {

  private Path dir;

  @BeforeMethod
  public void setup() throws IOException {
    dir = Files.createTempDirectory("sqlite-register-test");
  }

  @AfterMethod
  public void teardown() throws IOException {
    MoreFiles.deleteRecursively(dir, RecursiveDeleteOption.ALLOW_INSECURE);
  }

  @Test
  public void testCompareAndSwap() throws Exception {
    try (SQLiteStringRegister register = new SQLiteStringRegister(dir.resolve("db.sqlite"), "a")) {
      Assert.assertEquals(register.read(), "");
      register.write("", "one");
      Assert.assertEquals(register.read(), "one");
      Assert.assertThrows(PreconditionFailed.class, () -> register.write("", "two"));
      Assert.assertEquals(register.read(), "one");
      register.write("one", "");
      Assert.assertEquals(register.read(), "");
    }
  }

  @Test
  public void testNamesAreIndependent() throws Exception {
    Path db = dir.resolve("db.sqlite");
    try (SQLiteStringRegister a = new SQLiteStringRegister(db, "a");
         SQLiteStringRegister b = new SQLiteStringRegister(db, "b")) {
      a.write("", "x");
      Assert.assertEquals(b.read(), "");
      b.write("", "y");
      Assert.assertEquals(a.read(), "x");
    }
  }

  @Test
  public void testConnectionsShareState() throws Exception {
    Path db = dir.resolve("nested").resolve("db.sqlite");
    try (SQLiteStringRegister first = new SQLiteStringRegister(db, "shared");
         SQLiteStringRegister second = new SQLiteStringRegister(db, "shared")) {
      first.write("", "hello");
      Assert.assertEquals(second.read(), "hello");
      Assert.assertThrows(PreconditionFailed.class, () -> first.write("", "again"));
      second.write("hello", "bye");
      Assert.assertEquals(first.read(), "bye");
    }

    try (SQLiteStringRegister reopened = new SQLiteStringRegister(db, "shared")) {
      Assert.assertEquals(reopened.read(), "bye");
    }
  }

}
