package cal.prim.storage;

import com.google.common.io.MoreFiles;
import com.google.common.io.RecursiveDeleteOption;
import org.testng.Assert;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Set;
import java.util.stream.Collectors;

@Test
public class LocalDirectoryTests {

  private Path root;

  @BeforeMethod
  public void setup() throws IOException {
    root = Files.createTempDirectory("local-directory-test");
  }

  @AfterMethod
  public void teardown() throws IOException {
    MoreFiles.deleteRecursively(root, RecursiveDeleteOption.ALLOW_INSECURE);
  }

  private static byte[] bytes(String s) {
    return s.getBytes(StandardCharsets.UTF_8);
  }

  @Test
  public void testReadWrite() throws Exception {
    Directory dir = new LocalDirectory(root);
    dir.createOrReplace("a/b/c.txt", new ByteArrayInputStream(bytes("hello")));
    Assert.assertTrue(dir.exists("a/b/c.txt"));
    Assert.assertEquals(dir.readBytes("a/b/c.txt"), bytes("hello"));

    dir.createOrReplace("a/b/c.txt", new ByteArrayInputStream(bytes("bye")));
    Assert.assertEquals(dir.readBytes("a/b/c.txt"), bytes("bye"));
  }

  @Test
  public void testCreateRefusesToOverwrite() throws Exception {
    Directory dir = new LocalDirectory(root);
    dir.writeBytes("x", bytes("1"), false);
    Assert.assertThrows(FileAlreadyExistsException.class, () -> dir.writeBytes("x", bytes("2"), false));
    Assert.assertEquals(dir.readBytes("x"), bytes("1"));
  }

  @Test
  public void testListing() throws Exception {
    Directory dir = new LocalDirectory(root);
    dir.writeBytes("store/one", bytes("1"), false);
    dir.writeBytes("store/two", bytes("2"), false);
    dir.writeBytes("other/three", bytes("3"), false);
    Files.writeString(root.resolve(".hidden"), "secret");

    Set<String> all = dir.list("").collect(Collectors.toSet());
    Assert.assertEquals(all, Set.of("store/one", "store/two", "other/three"));

    Set<String> store = dir.list("store/").collect(Collectors.toSet());
    Assert.assertEquals(store, Set.of("store/one", "store/two"));

    // no temporary files are left behind
    try (var entries = Files.list(root.resolve(LocalDirectory.TMP_DIR))) {
      Assert.assertEquals(entries.count(), 0L);
    }
  }

  @Test
  public void testMissingEntries() throws Exception {
    Directory dir = new LocalDirectory(root);
    Assert.assertFalse(dir.exists("nope"));
    Assert.assertThrows(NoSuchFileException.class, () -> dir.open("nope"));
    dir.delete("nope");
  }

  @Test
  public void testIllegalNames() throws Exception {
    Directory dir = new LocalDirectory(root);
    Assert.assertThrows(IllegalArgumentException.class, () -> dir.exists("../escape"));
    Assert.assertThrows(IllegalArgumentException.class, () -> dir.exists("/absolute"));
  }

  @Test
  public void testSerializable() throws Exception {
    LocalDirectory dir = new LocalDirectory(root);
    dir.writeBytes("f", bytes("data"), false);

    ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    try (ObjectOutputStream out = new ObjectOutputStream(buffer)) {
      out.writeObject(dir);
    }
    Directory copy;
    try (ObjectInputStream in = new ObjectInputStream(new ByteArrayInputStream(buffer.toByteArray()))) {
      copy = (Directory)in.readObject();
    }
    Assert.assertEquals(copy.readBytes("f"), bytes("data"));
  }

}
