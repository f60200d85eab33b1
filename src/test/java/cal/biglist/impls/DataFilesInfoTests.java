package cal.biglist.impls;

import cal.biglist.types.DataFileEntry;
import cal.biglist.types.DataFileInfo;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.util.List;

@Test
public class DataFilesInfoTests {

  @Test
  public void testMergeSortsAndRecomputesCounts() {
    List<DataFileInfo> existing = List.of(
        new DataFileInfo("b", 3, 3),
        new DataFileInfo("d", 2, 5));
    List<DataFileInfo> merged = DataFilesInfo.merge(existing, List.of(
        new DataFileEntry("c", 4),
        new DataFileEntry("a", 1)));
    Assert.assertEquals(merged, List.of(
        new DataFileInfo("a", 1, 1),
        new DataFileInfo("b", 3, 4),
        new DataFileInfo("c", 4, 8),
        new DataFileInfo("d", 2, 10)));
  }

  @Test
  public void testMergeIsIdempotent() {
    List<DataFileEntry> additions = List.of(new DataFileEntry("x", 5), new DataFileEntry("y", 7));
    List<DataFileInfo> once = DataFilesInfo.merge(List.of(), additions);
    List<DataFileInfo> twice = DataFilesInfo.merge(once, additions);
    Assert.assertEquals(twice, once);
    Assert.assertEquals(DataFilesInfo.merge(once, List.of()), once);
  }

  @Test
  public void testSameNameDifferentCountIsDistinct() {
    List<DataFileInfo> merged = DataFilesInfo.merge(List.of(), List.of(new DataFileEntry("f", 2), new DataFileEntry("f", 1)));
    Assert.assertEquals(merged, List.of(new DataFileInfo("f", 1, 1), new DataFileInfo("f", 2, 3)));
  }

  @Test
  public void testFileIndexOf() {
    List<DataFileInfo> info = List.of(
        new DataFileInfo("a", 3, 3),
        new DataFileInfo("b", 0, 3),
        new DataFileInfo("c", 3, 6),
        new DataFileInfo("d", 1, 7));
    Assert.assertEquals(DataFilesInfo.fileIndexOf(info, 0, 0, 4), 0);
    Assert.assertEquals(DataFilesInfo.fileIndexOf(info, 2, 0, 4), 0);
    Assert.assertEquals(DataFilesInfo.fileIndexOf(info, 3, 0, 4), 2);
    Assert.assertEquals(DataFilesInfo.fileIndexOf(info, 6, 0, 4), 3);
    Assert.assertEquals(DataFilesInfo.fileIndexOf(info, 5, 2, 4), 2);
  }

}
