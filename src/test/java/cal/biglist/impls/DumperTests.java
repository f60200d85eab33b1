package cal.biglist.impls;

import cal.biglist.types.WriteFailure;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

@Test
public class DumperTests {

  @Test
  public void testWritesEverything() throws Exception {
    List<String> written = Collections.synchronizedList(new ArrayList<>());
    try (WorkerPool pool = new WorkerPool("dumper-test", 4)) {
      Dumper dumper = new Dumper(pool, 2);
      for (int i = 0; i < 20; ++i) {
        dumper.dumpFile((batch, dest) -> written.add(dest + "=" + batch.size()), List.of(i, i), "file" + i);
      }
      Assert.assertEquals(dumper.waitForAll(true), List.of());
      Assert.assertEquals(dumper.numTrackedJobs(), 0);
    }
    Assert.assertEquals(written.size(), 20);
    Assert.assertTrue(written.contains("file7=2"));
  }

  @Test
  public void testConcurrencyIsBounded() throws Exception {
    AtomicInteger running = new AtomicInteger();
    AtomicInteger maxRunning = new AtomicInteger();
    try (WorkerPool pool = new WorkerPool("dumper-test", 8)) {
      Dumper dumper = new Dumper(pool, 3);
      Assert.assertEquals(dumper.permits(), 3);
      for (int i = 0; i < 30; ++i) {
        dumper.dumpFile((batch, dest) -> {
          int now = running.incrementAndGet();
          maxRunning.accumulateAndGet(now, Math::max);
          try {
            Thread.sleep(5);
          } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
          }
          running.decrementAndGet();
        }, List.of(), "file" + i);
      }
      dumper.waitForAll(true);
    }
    Assert.assertTrue(maxRunning.get() <= 3, "max concurrent writes: " + maxRunning.get());
  }

  @Test
  public void testPermitsCappedByPool() {
    try (WorkerPool pool = new WorkerPool("dumper-test", 2)) {
      Assert.assertEquals(new Dumper(pool, 10).permits(), 2);
    }
    Assert.assertThrows(IllegalArgumentException.class, () -> new Dumper(new WorkerPool("unused", 1), 0));
  }

  @Test
  public void testFailuresReportedOnce() throws Exception {
    try (WorkerPool pool = new WorkerPool("dumper-test", 4)) {
      Dumper dumper = new Dumper(pool, 4);
      dumper.dumpFile((batch, dest) -> { }, List.of(1), "good");
      dumper.dumpFile((batch, dest) -> {
        throw new IOException("disk full");
      }, List.of(2), "bad");

      List<WriteFailure> failures = dumper.waitForAll(false);
      Assert.assertEquals(failures.size(), 1);
      Assert.assertEquals(failures.get(0).destination(), "bad");
      Assert.assertEquals(failures.get(0).error().getMessage(), "disk full");
      Assert.assertEquals(dumper.numTrackedJobs(), 0);
      Assert.assertEquals(dumper.waitForAll(true), List.of());
    }
  }

  @Test
  public void testRaiseOnError() throws Exception {
    try (WorkerPool pool = new WorkerPool("dumper-test", 2)) {
      Dumper dumper = new Dumper(pool, 2);
      dumper.dumpFile((batch, dest) -> {
        throw new IllegalStateException("boom");
      }, List.of(), "bad");
      IllegalStateException e = Assert.expectThrows(IllegalStateException.class, () -> dumper.waitForAll(true));
      Assert.assertEquals(e.getMessage(), "boom");
    }
  }

  @Test
  public void testFailedJobStaysTrackedUntilReported() throws Exception {
    CountDownLatch started = new CountDownLatch(1);
    try (WorkerPool pool = new WorkerPool("dumper-test", 2)) {
      Dumper dumper = new Dumper(pool, 2);
      dumper.dumpFile((batch, dest) -> {
        started.countDown();
        throw new IOException("nope");
      }, List.of(), "bad");
      Assert.assertTrue(started.await(10, TimeUnit.SECONDS));
      Thread.sleep(50);
      Assert.assertEquals(dumper.numTrackedJobs(), 1);
      Assert.assertEquals(dumper.waitForAll(false).size(), 1);
      Assert.assertEquals(dumper.numTrackedJobs(), 0);
    }
  }

  @Test
  public void testClosedPoolRejects() throws Exception {
    WorkerPool pool = new WorkerPool("dumper-test", 1);
    pool.close();
    Dumper dumper = new Dumper(pool, 1);
    Assert.assertThrows(RejectedExecutionException.class, () -> dumper.dumpFile((batch, dest) -> { }, List.of(), "x"));
    Assert.assertEquals(dumper.numTrackedJobs(), 0);
  }

  @Test
  public void testRethrowWrapsCheckedExceptions() {
    IOException e = Assert.expectThrows(IOException.class, () -> Dumper.rethrow(new Exception("checked")));
    Assert.assertEquals(e.getCause().getMessage(), "checked");
  }

}
