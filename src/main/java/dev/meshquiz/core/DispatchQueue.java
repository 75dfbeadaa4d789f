package dev.meshquiz.core;

import dev.meshquiz.core.Config.QueueOverflowPolicy;
import java.util.ArrayDeque;
import java.util.Objects;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/** Bounded FIFO between message producers and the single radio worker. */
final class DispatchQueue {
  private final ReentrantLock lock = new ReentrantLock();
  private final Condition notEmpty = lock.newCondition();
  private final ArrayDeque<PendingMessage> deque = new ArrayDeque<>();
  private final int maxSize;
  private final QueueOverflowPolicy overflowPolicy;

  private boolean closed;

  DispatchQueue(int maxSize, QueueOverflowPolicy overflowPolicy) {
    if (maxSize <= 0) {
      throw new IllegalArgumentException("maxSize must be > 0");
    }
    this.maxSize = maxSize;
    this.overflowPolicy = Objects.requireNonNull(overflowPolicy, "overflowPolicy");
  }

  PushResult enqueue(PendingMessage message) {
    lock.lock();
    try {
      if (closed) {
        return PushResult.rejected();
      }
      if (deque.size() >= maxSize) {
        return switch (overflowPolicy) {
          case DROP_OLDEST -> {
            PendingMessage dropped = deque.poll();
            deque.add(message);
            notEmpty.signal();
            yield PushResult.enqueuedWithDrop(dropped);
          }
          case DROP_NEWEST, REJECT -> PushResult.rejected();
        };
      }
      deque.add(message);
      notEmpty.signal();
      return PushResult.enqueued();
    } finally {
      lock.unlock();
    }
  }

  /** Blocks until a message is available; returns null once closed and drained. */
  PendingMessage take() throws InterruptedException {
    lock.lock();
    try {
      while (deque.isEmpty()) {
        if (closed) {
          return null;
        }
        notEmpty.await();
      }
      return deque.poll();
    } finally {
      lock.unlock();
    }
  }

  int size() {
    lock.lock();
    try {
      return deque.size();
    } finally {
      lock.unlock();
    }
  }

  int capacity() { return maxSize; }

  void close() {
    lock.lock();
    try {
      closed = true;
      for (PendingMessage pending : deque) {
        pending.completeQueueFull();
      }
      deque.clear();
      notEmpty.signalAll();
    } finally {
      lock.unlock();
    }
  }

  record PushResult(boolean accepted, PendingMessage dropped) {
    static PushResult enqueued() { return new PushResult(true, null); }

    static PushResult enqueuedWithDrop(PendingMessage dropped) { return new PushResult(true, dropped); }

    static PushResult rejected() { return new PushResult(false, null); }
  }
}
