package com.scholary.mp3.converter.pipe;

import java.time.Duration;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Inactivity timer that fires once when {@link #touch()} hasn't been called for a full window.
 *
 * <p>Touching is a single volatile write, so it can be called for every chunk read without
 * rescheduling anything. The check reschedules itself for the remainder of the window.
 */
public final class Watchdog implements AutoCloseable {

  private final ScheduledExecutorService scheduler;
  private final long windowNanos;
  private final Runnable onTimeout;
  private final AtomicLong lastActivity = new AtomicLong();
  private final AtomicBoolean fired = new AtomicBoolean();
  private volatile boolean closed;
  private volatile ScheduledFuture<?> pending;

  private Watchdog(ScheduledExecutorService scheduler, Duration window, Runnable onTimeout) {
    this.scheduler = scheduler;
    this.windowNanos = window.toNanos();
    this.onTimeout = onTimeout;
  }

  /**
   * Start a watchdog.
   *
   * @param scheduler scheduler the checks run on
   * @param window inactivity window
   * @param onTimeout run once, on the scheduler thread, when the window elapses
   * @return the running watchdog
   */
  public static Watchdog start(
      ScheduledExecutorService scheduler, Duration window, Runnable onTimeout) {
    Watchdog watchdog = new Watchdog(scheduler, window, onTimeout);
    watchdog.touch();
    watchdog.schedule(watchdog.windowNanos);
    return watchdog;
  }

  /** Record activity. */
  public void touch() {
    lastActivity.set(System.nanoTime());
  }

  public boolean hasFired() {
    return fired.get();
  }

  @Override
  public void close() {
    closed = true;
    ScheduledFuture<?> current = pending;
    if (current != null) {
      current.cancel(false);
    }
  }

  private void schedule(long delayNanos) {
    if (!closed) {
      pending = scheduler.schedule(this::check, delayNanos, TimeUnit.NANOSECONDS);
    }
  }

  private void check() {
    if (closed) {
      return;
    }
    long idle = System.nanoTime() - lastActivity.get();
    if (idle >= windowNanos) {
      if (fired.compareAndSet(false, true)) {
        onTimeout.run();
      }
    } else {
      schedule(windowNanos - idle);
    }
  }
}
