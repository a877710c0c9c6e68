package com.acme.streams.worker;

import java.util.ArrayList;
import java.util.List;

/**
 * One-way cancellation signal shared between an owner and the work it started. Once cancelled it
 * stays cancelled; callbacks registered with {@link #onCancel} run exactly once.
 */
public final class CancellationToken {
  private final List<Runnable> callbacks = new ArrayList<>();
  private volatile boolean cancelled;

  /**
   * @return {@code true} if this call cancelled the token, {@code false} if it already was
   */
  public boolean cancel() {
    List<Runnable> toRun;
    synchronized (this) {
      if (cancelled) {
        return false;
      }
      cancelled = true;
      toRun = List.copyOf(callbacks);
      callbacks.clear();
    }
    toRun.forEach(Runnable::run);
    return true;
  }

  public boolean isCancelled() {
    return cancelled;
  }

  /** Run {@code callback} on cancellation, or right away if the token is already cancelled. */
  public void onCancel(Runnable callback) {
    synchronized (this) {
      if (!cancelled) {
        callbacks.add(callback);
        return;
      }
    }
    callback.run();
  }
}
