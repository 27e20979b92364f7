package com.onthegomap.buildingtiles.store;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class WorkerConnectionsTest {

  private static class Resource implements AutoCloseable {

    final int id;
    final String owner = Thread.currentThread().getName();
    volatile boolean closed = false;

    Resource(int id) {
      this.id = id;
    }

    @Override
    public void close() {
      closed = true;
    }
  }

  private final AtomicInteger created = new AtomicInteger();
  private final List<Resource> all = new CopyOnWriteArrayList<>();
  private final WorkerConnections<Resource> connections = new WorkerConnections<>(() -> {
    Resource resource = new Resource(created.incrementAndGet());
    all.add(resource);
    return resource;
  });

  @Test
  void testSameThreadReusesResource() {
    Resource first = connections.forThread();
    assertSame(first, connections.forThread());
    assertEquals(1, connections.size());
  }

  @Test
  void testResourceIsOnlyUsedByThreadThatCreatedIt() throws InterruptedException {
    int threads = 4;
    ExecutorService executor = Executors.newFixedThreadPool(threads);
    CountDownLatch allStarted = new CountDownLatch(threads);
    Set<String> mismatches = ConcurrentHashMap.newKeySet();
    try {
      for (int i = 0; i < threads; i++) {
        executor.submit(() -> {
          allStarted.countDown();
          try {
            allStarted.await();
          } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return;
          }
          for (int j = 0; j < 100; j++) {
            Resource resource = connections.forThread();
            if (!resource.owner.equals(Thread.currentThread().getName())) {
              mismatches.add(resource.owner);
            }
          }
        });
      }
    } finally {
      executor.shutdown();
      assertTrue(executor.awaitTermination(10, TimeUnit.SECONDS));
    }
    assertEquals(Set.of(), mismatches);
    assertEquals(threads, connections.size());
  }

  @Test
  void testCloseReleasesEveryThreadsResource() throws InterruptedException {
    connections.forThread();
    Thread thread = new Thread(connections::forThread);
    thread.start();
    thread.join();
    assertEquals(2, all.size());

    connections.close();
    assertTrue(all.stream().allMatch(resource -> resource.closed));
    assertEquals(0, connections.size());
    assertThrows(IllegalStateException.class, connections::forThread);
  }

  @Test
  void testReleasesResourcesOfEndedThreads() throws InterruptedException {
    int threads = 50;
    for (int i = 0; i < threads; i++) {
      Thread thread = new Thread(connections::forThread);
      thread.start();
      thread.join();
    }
    assertEquals(threads, all.size());

    Resource mine = connections.forThread();
    assertEquals(1, connections.size());
    assertTrue(all.stream().filter(resource -> resource != mine).allMatch(resource -> resource.closed));
    assertFalse(mine.closed);
    assertEquals(0, connections.releaseEndedThreads());
  }

  @Test
  void testKeepsResourcesOfRunningThreads() throws InterruptedException {
    CountDownLatch opened = new CountDownLatch(1);
    CountDownLatch finish = new CountDownLatch(1);
    Thread running = new Thread(() -> {
      connections.forThread();
      opened.countDown();
      try {
        finish.await();
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    });
    running.start();
    opened.await();

    assertEquals(0, connections.releaseEndedThreads());
    assertEquals(1, connections.size());

    finish.countDown();
    running.join();
    assertEquals(1, connections.releaseEndedThreads());
    assertEquals(0, connections.size());
    assertTrue(all.get(0).closed);
  }

  @Test
  void testCloseContinuesPastFailures() {
    AtomicInteger closed = new AtomicInteger();
    WorkerConnections<AutoCloseable> failing = new WorkerConnections<>(() -> () -> {
      closed.incrementAndGet();
      throw new IllegalStateException("boom");
    });
    failing.forThread();
    assertDoesNotThrow(failing::close);
    assertEquals(1, closed.get());
  }
}
