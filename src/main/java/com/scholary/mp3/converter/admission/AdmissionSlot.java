package com.scholary.mp3.converter.admission;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One unit of admitted concurrency.
 *
 * <p>Use with try-with-resources. {@link #close()} gives the slot back to the controller exactly
 * once; further calls are no-ops.
 */
public final class AdmissionSlot implements AutoCloseable {

  private final AdmissionController controller;
  private final Tier tier;
  private final Instant acquiredAt;
  private final AtomicBoolean released = new AtomicBoolean(false);

  AdmissionSlot(AdmissionController controller, Tier tier, Instant acquiredAt) {
    this.controller = controller;
    this.tier = tier;
    this.acquiredAt = acquiredAt;
  }

  public Tier tier() {
    return tier;
  }

  public Instant acquiredAt() {
    return acquiredAt;
  }

  public boolean isReleased() {
    return released.get();
  }

  @Override
  public void close() {
    if (released.compareAndSet(false, true)) {
      controller.release(this);
    }
  }
}
