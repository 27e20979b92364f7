package com.onthegomap.buildingtiles.view;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import net.jcip.annotations.ThreadSafe;

/**
 * Holds the single most recent {@link Viewport} reported by any client.
 * <p>
 * Writes replace the whole value atomically, so a reader always sees one complete viewport and never blocks a writer.
 * Last write wins and no history is kept.
 */
@ThreadSafe
public class ViewStateRegister {

  private final AtomicReference<Viewport> current = new AtomicReference<>();

  /** Replaces the current viewport with {@code view}. */
  public void setView(Viewport view) {
    current.set(Objects.requireNonNull(view));
  }

  /** Returns the most recent viewport, or empty if no client has reported one yet. */
  public Optional<Viewport> getView() {
    return Optional.ofNullable(current.get());
  }
}
