package com.scholary.mp3.converter.admission;

/**
 * Request priority within the admission queue.
 *
 * <p>HIGH waiters are always considered before NORMAL ones when a slot frees up.
 */
public enum Priority {
  HIGH,
  NORMAL
}
