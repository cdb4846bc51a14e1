package com.scholary.mp3.converter.admission;

import com.scholary.mp3.converter.logging.StructuredLogger;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Bounds the number of concurrent conversions, with per-tier ceilings.
 *
 * <p>There is a single active counter shared by all tiers. A caller is admitted when the counter
 * is below its tier's ceiling; otherwise it waits in a FIFO queue. When a slot is released we
 * scan the queue (HIGH priority first, then NORMAL) for the first waiter whose ceiling is above
 * the new active count and hand the slot to it. That lets a higher-tier waiter overtake an
 * earlier lower-tier one that still doesn't fit.
 *
 * <p>Every acquired slot must be closed, on every exit path. {@link AdmissionSlot} is {@link
 * AutoCloseable} so callers can rely on try-with-resources.
 */
@Component
public class AdmissionController {

  private static final Logger LOGGER = LoggerFactory.getLogger(AdmissionController.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private final AdmissionProperties properties;
  private final ReentrantLock lock = new ReentrantLock();
  private final Deque<Waiter> highQueue = new ArrayDeque<>();
  private final Deque<Waiter> normalQueue = new ArrayDeque<>();
  private int active;

  public AdmissionController(AdmissionProperties properties) {
    Tier previous = null;
    for (Tier tier : Tier.values()) {
      if (previous != null && properties.ceiling(tier) < properties.ceiling(previous)) {
        throw new IllegalArgumentException(
            String.format(
                "Ceiling for %s (%d) must be >= ceiling for %s (%d)",
                tier, properties.ceiling(tier), previous, properties.ceiling(previous)));
      }
      previous = tier;
    }
    this.properties = properties;
    LOGGER.info(
        "Initialized admission controller: standard={}, premium={}, business={}, enterprise={}",
        properties.standard(),
        properties.premium(),
        properties.business(),
        properties.enterprise());
  }

  /** Acquire a slot at normal priority. */
  public AdmissionSlot acquire(Tier tier) throws InterruptedException {
    return acquire(tier, Priority.NORMAL);
  }

  /**
   * Acquire a slot, blocking until one is granted.
   *
   * <p>If the waiting thread is interrupted before being granted, it leaves the queue and the
   * interrupt propagates. If the grant already happened, the slot is returned and the interrupt
   * flag is restored.
   *
   * @param tier the caller's tier
   * @param priority queue priority
   * @return the slot; close it when done
   * @throws InterruptedException if interrupted while waiting
   */
  public AdmissionSlot acquire(Tier tier, Priority priority) throws InterruptedException {
    Instant requestedAt = Instant.now();
    lock.lock();
    try {
      if (active < ceiling(tier)) {
        active++;
        return grantedSlot(tier, requestedAt);
      }

      Waiter waiter = new Waiter(tier, lock.newCondition());
      Deque<Waiter> queue = priority == Priority.HIGH ? highQueue : normalQueue;
      queue.addLast(waiter);
      structuredLogger.logAdmissionQueued(tier.name(), priority.name(), active, queuedCount());

      try {
        while (!waiter.admitted) {
          waiter.signal.await();
        }
      } catch (InterruptedException e) {
        if (!waiter.admitted) {
          queue.remove(waiter);
          throw e;
        }
        Thread.currentThread().interrupt();
      }
      return grantedSlot(tier, requestedAt);
    } finally {
      lock.unlock();
    }
  }

  /** Give a slot back. Called by {@link AdmissionSlot#close()} only. */
  void release(AdmissionSlot slot) {
    lock.lock();
    try {
      if (active == 0) {
        LOGGER.error("Release without matching acquire: tier={}", slot.tier());
        return;
      }
      active--;
      Waiter next = pollFirstAdmissible(highQueue);
      if (next == null) {
        next = pollFirstAdmissible(normalQueue);
      }
      if (next != null) {
        active++;
        next.admitted = true;
        next.signal.signal();
      }
      LOGGER.debug(
          "Released slot: tier={}, held={}ms, active={}, queued={}",
          slot.tier(),
          Duration.between(slot.acquiredAt(), Instant.now()).toMillis(),
          active,
          queuedCount());
    } finally {
      lock.unlock();
    }
  }

  public int activeCount() {
    lock.lock();
    try {
      return active;
    } finally {
      lock.unlock();
    }
  }

  public int queuedCount() {
    lock.lock();
    try {
      return highQueue.size() + normalQueue.size();
    } finally {
      lock.unlock();
    }
  }

  public int ceiling(Tier tier) {
    return properties.ceiling(tier);
  }

  private Waiter pollFirstAdmissible(Deque<Waiter> queue) {
    Iterator<Waiter> it = queue.iterator();
    while (it.hasNext()) {
      Waiter waiter = it.next();
      if (ceiling(waiter.tier) > active) {
        it.remove();
        return waiter;
      }
    }
    return null;
  }

  private AdmissionSlot grantedSlot(Tier tier, Instant requestedAt) {
    Instant now = Instant.now();
    structuredLogger.logAdmissionGranted(
        tier.name(), Duration.between(requestedAt, now).toMillis(), active);
    return new AdmissionSlot(this, tier, now);
  }

  private static final class Waiter {
    private final Tier tier;
    private final Condition signal;
    private boolean admitted;

    private Waiter(Tier tier, Condition signal) {
      this.tier = tier;
      this.signal = signal;
    }
  }
}
