package com.onthegomap.buildingtiles.store;

import java.lang.ref.WeakReference;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Supplier;
import net.jcip.annotations.ThreadSafe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lazily opens one resource per thread that asks for it and closes them all together.
 * <p>
 * Request threads come and go with the server's thread pool, so whenever a thread opens a new resource, the resources
 * of threads that have since ended are closed.
 *
 * @param <T> the per-thread resource, usually a database connection
 */
@ThreadSafe
public class WorkerConnections<T extends AutoCloseable> implements AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(WorkerConnections.class);

  private record Owned<T>(WeakReference<Thread> owner, T resource) {

    boolean ownerEnded() {
      Thread thread = owner.get();
      return thread == null || !thread.isAlive();
    }
  }

  private final List<Owned<T>> all = new CopyOnWriteArrayList<>();
  private final ThreadLocal<T> thread;
  private volatile boolean closed = false;

  public WorkerConnections(Supplier<T> factory) {
    this.thread = ThreadLocal.withInitial(() -> {
      releaseEndedThreads();
      T resource = factory.get();
      all.add(new Owned<>(new WeakReference<>(Thread.currentThread()), resource));
      LOGGER.debug("Opened connection {} for {}", all.size(), Thread.currentThread().getName());
      return resource;
    });
  }

  /**
   * Returns the calling thread's resource, opening it on first use.
   *
   * @throws IllegalStateException if {@link #close()} was already called
   */
  public T forThread() {
    if (closed) {
      throw new IllegalStateException("Connections already closed");
    }
    return thread.get();
  }

  /** Returns the number of resources currently open. */
  public int size() {
    return all.size();
  }

  /** Closes the resources of threads that are no longer running and returns how many were closed. */
  public int releaseEndedThreads() {
    int released = 0;
    for (Owned<T> owned : all) {
      // remove returns false if another thread released it first
      if (owned.ownerEnded() && all.remove(owned)) {
        closeResource(owned.resource());
        released++;
      }
    }
    if (released > 0) {
      LOGGER.debug("Closed {} connections of ended threads", released);
    }
    return released;
  }

  private static void closeResource(AutoCloseable resource) {
    try {
      resource.close();
    } catch (Exception e) {
      LOGGER.warn("Error closing connection", e);
    }
  }

  @Override
  public void close() {
    closed = true;
    for (Owned<T> owned : all) {
      closeResource(owned.resource());
    }
    all.clear();
  }
}
