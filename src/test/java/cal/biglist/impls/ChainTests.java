package cal.biglist.impls;

import cal.biglist.types.BiglistConfig;
import cal.biglist.types.Seq;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

@Test
public class ChainTests {

  private static List<Integer> range(int lo, int hi) {
    return IntStream.range(lo, hi).boxed().collect(Collectors.toList());
  }

  private static <T> List<T> toList(Iterable<T> elements) {
    List<T> result = new ArrayList<>();
    elements.forEach(result::add);
    return result;
  }

  @Test
  public void testChain() {
    Chain<Integer> chain = new Chain<>(new ListSeq<>(range(0, 10)), new ListSeq<>(List.<Integer>of()), new ListSeq<>(range(10, 15)));
    Assert.assertEquals(chain.size(), 15L);
    Assert.assertEquals(chain.raw().size(), 3);
    Assert.assertEquals(toList(chain), range(0, 15));
    Assert.assertEquals(chain.get(9), (Integer)9);
    Assert.assertEquals(chain.get(10), (Integer)10);
    Assert.assertEquals(chain.get(0), (Integer)0);
    Assert.assertEquals(chain.get(-1), (Integer)14);
    Assert.assertThrows(IndexOutOfBoundsException.class, () -> chain.get(15));
    Assert.assertThrows(IndexOutOfBoundsException.class, () -> chain.get(-16));
  }

  @Test
  public void testRandomAccessMatchesIteration() {
    List<Seq<Integer>> members = new ArrayList<>();
    for (int i = 0; i < 10; ++i) {
      members.add(new ListSeq<>(range(i * 7, i * 7 + (i % 3) * 7)));
    }
    Chain<Integer> chain = new Chain<>(members);
    List<Integer> all = toList(chain);
    Assert.assertEquals((long)all.size(), chain.size());

    List<Integer> order = range(0, all.size());
    Collections.shuffle(order, new Random(12));
    for (int i : order) {
      Assert.assertEquals(chain.get(i), all.get(i));
    }
  }

  @Test
  public void testEmptyChain() {
    Assert.assertThrows(IllegalArgumentException.class, () -> new Chain<Integer>(List.of()));
    Chain<Integer> chain = new Chain<>(new ListSeq<>(List.<Integer>of()));
    Assert.assertEquals(chain.size(), 0L);
    Assert.assertFalse(chain.iterator().hasNext());
  }

  @Test
  public void testChainOfBiglists() throws Exception {
    BiglistConfig config = BiglistConfig.builder().batchSize(3).storageFormat("json").build();
    try (Biglist<Integer> a = Biglist.create(new InMemoryLocation(), config);
         Biglist<Integer> b = Biglist.create(new InMemoryLocation(), config)) {
      a.extend(range(0, 7));
      a.flush();
      b.extend(range(7, 12));
      b.flush();
      Chain<Integer> chain = new Chain<>(a, new ListSeq<>(List.of(-1)), b);
      Assert.assertEquals(chain.size(), 13L);
      Assert.assertEquals(chain.get(7), (Integer)(-1));
      Assert.assertEquals(chain.get(8), (Integer)7);
      List<Integer> expected = new ArrayList<>(range(0, 7));
      expected.add(-1);
      expected.addAll(range(7, 12));
      Assert.assertEquals(toList(chain), expected);
    }
  }

}
