package exm.pylower.common;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;

import org.apache.log4j.Level;
import org.junit.Test;

import exm.pylower.common.lang.TargetVersion;
import exm.pylower.frontend.LogHelper;
import exm.pylower.frontend.LoweringContext;
import exm.pylower.frontend.Trees;

public class LoggingTest {

  private static int emittedWithPrefix(String prefix) {
    int count = 0;
    for (String key: Logging.emitted) {
      if (key.startsWith(Level.WARN + ":" + prefix)) {
        count++;
      }
    }
    return count;
  }

  @Test
  public void testAddEmittedOnce() {
    assertTrue(Logging.addEmitted(Level.WARN, "emitted once"));
    assertFalse(Logging.addEmitted(Level.WARN, "emitted once"));
    assertTrue("Levels are kept apart",
               Logging.addEmitted(Level.INFO, "emitted once"));
  }

  @Test
  public void testUniqueWarnIgnoresLocation() {
    LoweringContext context = new LoweringContext("a.py", TargetVersion.LATEST);
    LogHelper.uniqueWarn(context, Trees.name("x", 0), "same place warning");
    LogHelper.uniqueWarn(context, Trees.name("y", 10), "same place warning");
    LogHelper.uniqueWarn(new LoweringContext("b.py", TargetVersion.LATEST),
                         Trees.name("z", 3), "same place warning");
    assertEquals(1, emittedWithPrefix("same place warning"));
  }

  @Test
  public void testUniqueWarnFromManyThreads() throws InterruptedException {
    final int threadCount = 8;
    final int messageCount = 200;
    final CountDownLatch start = new CountDownLatch(1);
    final LoweringContext context =
                new LoweringContext("threads.py", TargetVersion.LATEST);
    List<Thread> threads = new ArrayList<Thread>();
    for (int t = 0; t < threadCount; t++) {
      final int column = t;
      Thread thread = new Thread(new Runnable() {
        @Override
        public void run() {
          try {
            start.await();
          } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return;
          }
          for (int i = 0; i < messageCount; i++) {
            LogHelper.uniqueWarn(context, Trees.name("x", column),
                                 "threaded warning " + i);
          }
        }
      });
      threads.add(thread);
      thread.start();
    }
    start.countDown();
    for (Thread thread: threads) {
      thread.join();
    }
    assertEquals(messageCount, emittedWithPrefix("threaded warning "));
  }
}
