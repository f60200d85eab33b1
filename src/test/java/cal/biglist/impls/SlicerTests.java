package cal.biglist.impls;

import cal.biglist.types.BiglistConfig;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

@Test
public class SlicerTests {

  private static List<Integer> range(int lo, int hi) {
    return IntStream.range(lo, hi).boxed().collect(Collectors.toList());
  }

  @Test
  public void testSliceAndSelect() {
    ListSeq<Integer> data = new ListSeq<>(range(0, 30));
    Slicer<Integer> slicer = new Slicer<>(data);
    Assert.assertEquals(slicer.size(), 30L);
    Assert.assertEquals(slicer.select(1, 3, 5, 6, 7, 8, 9, 13, 14).slice(null, null, 2).get(-2), (Integer)9);

    Slicer<Integer> window = slicer.slice(3, 11);
    Assert.assertEquals(window.size(), 8L);
    Assert.assertEquals(window.collect(), range(3, 11));
    Assert.assertEquals(window.slice(2, 4).collect(), List.of(5, 6));
    Assert.assertSame(window.raw(), data);
    Assert.assertTrue(window.toString().startsWith("<Slicer into 8/30 of "), window.toString());
  }

  @Test
  public void testSlicingReadsNothing() {
    ListSeq<Integer> data = new ListSeq<>(range(0, 30));
    Slicer<Integer> window = new Slicer<>(data).slice(5, 25).slice(null, null, 3).select(0, -1);
    Assert.assertEquals(data.gets, 0);
    Assert.assertEquals(window.collect(), List.of(5, 23));
    Assert.assertEquals(data.gets, 2);
  }

  @Test
  public void testBoundsAndSteps() {
    Slicer<Integer> slicer = new Slicer<>(new ListSeq<>(range(0, 30)));
    Assert.assertEquals(slicer.slice(-5, 100).collect(), range(25, 30));
    Assert.assertEquals(slicer.slice(20, 10).size(), 0L);
    Assert.assertEquals(slicer.slice(10L, 2L, -3).collect(), List.of(10, 7, 4));
    Assert.assertEquals(slicer.slice(null, null, -1).get(0), (Integer)29);
    Assert.assertEquals(slicer.slice(null, null, -1).size(), 30L);
    Assert.assertEquals(slicer.slice(0, 0).collect(), List.of());
    Assert.assertEquals(slicer.slice(-100, 2).collect(), List.of(0, 1));
  }

  @Test
  public void testBadArguments() {
    Slicer<Integer> slicer = new Slicer<>(new ListSeq<>(range(0, 30)));
    Assert.assertThrows(IllegalArgumentException.class, () -> slicer.slice(0L, 10L, 0));
    Assert.assertThrows(IndexOutOfBoundsException.class, () -> slicer.select(30));
    Assert.assertThrows(IndexOutOfBoundsException.class, () -> slicer.get(-31));
    Assert.assertThrows(IndexOutOfBoundsException.class, () -> slicer.slice(0, 5).get(5));
  }

  @Test
  public void testSliceOfBiglist() throws Exception {
    BiglistConfig config = BiglistConfig.builder().batchSize(4).storageFormat("json").build();
    try (Biglist<Integer> list = Biglist.create(new InMemoryLocation(), config)) {
      list.extend(range(0, 20));
      list.flush();
      Assert.assertEquals(new Slicer<>(list).slice(5, 15).collect(), range(5, 15));
      Assert.assertEquals(new Slicer<>(list).collect(), range(0, 20));
    }
  }

}
