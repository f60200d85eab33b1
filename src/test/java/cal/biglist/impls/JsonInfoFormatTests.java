package cal.biglist.impls;

import cal.biglist.types.BiglistInfo;
import cal.biglist.types.DataFileEntry;
import cal.biglist.types.DataFileInfo;
import cal.prim.MalformedDataException;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

@Test
public class JsonInfoFormatTests {

  private final JsonInfoFormat format = new JsonInfoFormat();

  private static byte[] utf8(String s) {
    return s.getBytes(StandardCharsets.UTF_8);
  }

  @Test
  public void testLoadIndex() throws Exception {
    BiglistInfo info = format.loadInfo(utf8("{\"storage_format\": \"json\", \"storage_version\": 3, \"batch_size\": 3, "
        + "\"data_files_info\": [[\"a.json\", 3, 3], [\"b.json\", 1, 4]]}"));
    Assert.assertEquals(info.getStorageFormat(), "json");
    Assert.assertEquals(info.getStorageVersion(), 3);
    Assert.assertEquals(info.getBatchSize(), 3);
    Assert.assertEquals(info.getDataFilesInfo(), List.of(new DataFileInfo("a.json", 3, 3), new DataFileInfo("b.json", 1, 4)));
    Assert.assertEquals(info.numDataItems(), 4L);
  }

  @Test
  public void testSerializedKeyOrder() throws Exception {
    BiglistInfo info = BiglistInfo.empty("java-xz", 10).withDataFilesInfo(List.of(new DataFileInfo("x", 10, 10)));
    String json = new String(format.serializeInfo(info), StandardCharsets.UTF_8);
    Assert.assertEquals(json, "{\"storage_format\":\"java-xz\",\"storage_version\":3,\"batch_size\":10,\"data_files_info\":[[\"x\",10,10]]}");
  }

  @Test
  public void testUnknownFieldsSurvive() throws Exception {
    BiglistInfo info = format.loadInfo(utf8("{\"storage_format\": \"json\", \"batch_size\": 5, \"data_files_info\": [], "
        + "\"owner\": \"someone\", \"extra\": {\"a\": [1, 2]}}"));
    Assert.assertEquals(info.getOtherFields().get("owner"), "someone");
    BiglistInfo again = format.loadInfo(format.serializeInfo(info.withDataFilesInfo(List.of(new DataFileInfo("f", 1, 1)))));
    Assert.assertEquals(again.getOtherFields(), info.getOtherFields());
    Assert.assertEquals(again.numDataItems(), 1L);
  }

  @Test
  public void testMalformedIndex() {
    Assert.assertThrows(MalformedDataException.class, () -> format.loadInfo(utf8("not json")));
    Assert.assertThrows(MalformedDataException.class, () -> format.loadInfo(utf8("[]")));
    Assert.assertThrows(MalformedDataException.class, () -> format.loadInfo(utf8("{\"batch_size\": 1}")));
    Assert.assertThrows(MalformedDataException.class, () -> format.loadInfo(utf8(
        "{\"storage_format\": \"json\", \"batch_size\": 1, \"data_files_info\": [[\"a\", 2]]}")));
    Assert.assertThrows(MalformedDataException.class, () -> format.loadInfo(utf8(
        "{\"storage_format\": \"json\", \"batch_size\": 1, \"data_files_info\": [[\"a\", 2, 3]]}")));
    Assert.assertThrows(MalformedDataException.class, () -> format.loadInfo(utf8(
        "{\"storage_format\": \"json\", \"batch_size\": 1, \"data_files_info\": [[\"a\", -1, -1]]}")));
  }

  @Test
  public void testInterimRecord() throws Exception {
    List<DataFileEntry> entries = List.of(new DataFileEntry("b", 2), new DataFileEntry("a", 7));
    byte[] bytes = format.serializeInterim(entries);
    Assert.assertEquals(new String(bytes, StandardCharsets.UTF_8), "[[\"b\",2],[\"a\",7]]");
    Assert.assertEquals(format.loadInterim(bytes), entries);
    Assert.assertThrows(MalformedDataException.class, () -> format.loadInterim(utf8("[[\"a\"]]")));
    Assert.assertThrows(MalformedDataException.class, () -> format.loadInterim(utf8("{}")));
  }

}
