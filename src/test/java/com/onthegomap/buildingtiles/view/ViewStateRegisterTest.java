package com.onthegomap.buildingtiles.view;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.Test;

class ViewStateRegisterTest {

  private final ViewStateRegister register = new ViewStateRegister();

  @Test
  void testEmptyUntilSet() {
    assertEquals(Optional.empty(), register.getView());
  }

  @Test
  void testLastWriteWins() {
    Viewport first = new Viewport(52.1, 52.0, 5.2, 5.1, 14d);
    Viewport second = new Viewport(52.2, 52.1, 5.3, 5.2, null);
    register.setView(first);
    assertEquals(Optional.of(first), register.getView());
    register.setView(second);
    assertEquals(Optional.of(second), register.getView());
  }

  @Test
  void testRejectsNull() {
    assertThrows(NullPointerException.class, () -> register.setView(null));
  }

  @Test
  void testReadersNeverSeeMixedViews() throws InterruptedException {
    CountDownLatch done = new CountDownLatch(2);
    AtomicReference<Viewport> torn = new AtomicReference<>();
    Thread writer = new Thread(() -> {
      for (int i = 0; i < 50_000; i++) {
        // every field of a view holds the same value
        double value = i % 90;
        register.setView(new Viewport(value, value, value, value, value));
      }
      done.countDown();
    });
    Thread reader = new Thread(() -> {
      for (int i = 0; i < 50_000; i++) {
        register.getView().ifPresent(view -> {
          if (view.north() != view.south() || view.south() != view.east() || view.east() != view.west() ||
            view.west() != view.zoom()) {
            torn.set(view);
          }
        });
      }
      done.countDown();
    });
    writer.start();
    reader.start();
    done.await();
    assertNull(torn.get());
  }

  @Test
  void testConcurrentWritersLeaveOneOfTheirViews() throws InterruptedException {
    int writers = 4;
    int viewsPerWriter = 10_000;
    Set<Viewport> submitted = ConcurrentHashMap.newKeySet();
    CountDownLatch start = new CountDownLatch(1);
    List<Thread> threads = new ArrayList<>();
    for (int w = 0; w < writers; w++) {
      int writer = w;
      Thread thread = new Thread(() -> {
        try {
          start.await();
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          return;
        }
        for (int i = 0; i < viewsPerWriter; i++) {
          Viewport view = new Viewport(writer, writer, i, i, (double) writer);
          submitted.add(view);
          register.setView(view);
        }
      });
      thread.start();
      threads.add(thread);
    }
    start.countDown();
    for (Thread thread : threads) {
      thread.join();
    }

    assertEquals(writers * viewsPerWriter, submitted.size());
    Viewport last = register.getView().orElseThrow();
    assertTrue(submitted.contains(last), last::toString);
    // each writer finishes with its own last view, so the survivor is one of those
    assertEquals(viewsPerWriter - 1, last.east());
  }
}
