package com.logicsignalprotector.cortexconnector.relay;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import org.springframework.stereotype.Component;

/**
 * Unbounded FIFO of serialized envelopes awaiting the connection writer.
 *
 * <p>There is no backpressure: the queue grows with the number of chats waiting for a connection.
 */
@Component
public class OutboundQueue {

  private final Deque<String> items = new ArrayDeque<>();
  private final ReentrantLock lock = new ReentrantLock();
  private final Condition notEmpty = lock.newCondition();

  public void enqueue(String payload) {
    if (payload == null) {
      throw new IllegalArgumentException("payload must not be null");
    }
    lock.lock();
    try {
      items.addLast(payload);
      notEmpty.signal();
    } finally {
      lock.unlock();
    }
  }

  /** Removes and returns everything queued, atomically with respect to {@link #enqueue}. */
  public List<String> drainAll() {
    lock.lock();
    try {
      List<String> out = new ArrayList<>(items);
      items.clear();
      return out;
    } finally {
      lock.unlock();
    }
  }

  /** Blocks until an item is available. */
  public String dequeueNext() throws InterruptedException {
    lock.lockInterruptibly();
    try {
      while (items.isEmpty()) {
        notEmpty.await();
      }
      return items.removeFirst();
    } finally {
      lock.unlock();
    }
  }

  /** Like {@link #dequeueNext()} but gives up after {@code timeout}, returning null. */
  String dequeueNext(long timeout, TimeUnit unit) throws InterruptedException {
    long nanos = unit.toNanos(timeout);
    lock.lockInterruptibly();
    try {
      while (items.isEmpty()) {
        if (nanos <= 0L) {
          return null;
        }
        nanos = notEmpty.awaitNanos(nanos);
      }
      return items.removeFirst();
    } finally {
      lock.unlock();
    }
  }

  public int size() {
    lock.lock();
    try {
      return items.size();
    } finally {
      lock.unlock();
    }
  }
}
