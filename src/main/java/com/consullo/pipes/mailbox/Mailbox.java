package com.consullo.pipes.mailbox;

import com.consullo.pipes.stream.Sink;
import com.consullo.pipes.stream.Source;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import org.apache.commons.lang3.Validate;

/**
 * Bounded, sealable handoff channel between a background pump and a pipeline stage.
 *
 * <p>At most {@code capacity} items are buffered; {@link #send(Object)} blocks while the buffer is full, which is
 * how backpressure crosses the thread boundary. {@link #seal()} may be called from either end, any number of times:
 * afterwards {@code send} refuses every item, and {@link #receive()} hands out whatever is still buffered before
 * reporting end-of-stream. Sealing wakes every blocked party.
 *
 * @param <T> item type
 * @since 1.0
 */
public final class Mailbox<T> {

  private final int capacity;

  private final ReentrantLock lock = new ReentrantLock();
  private final Condition notFull = lock.newCondition();
  private final Condition notEmpty = lock.newCondition();
  private final Deque<T> buffer;
  private boolean sealed;

  /**
   * Creates a mailbox holding one item.
   */
  public Mailbox() {
    this(1);
  }

  /**
   * Creates a mailbox.
   *
   * @param capacity number of items buffered before {@code send} blocks, at least 1
   */
  public Mailbox(final int capacity) {
    Validate.isTrue(capacity >= 1, "capacity must be at least 1");
    this.capacity = capacity;
    this.buffer = new ArrayDeque<>(capacity);
  }

  public int capacity() {
    return capacity;
  }

  /**
   * Puts an item into the mailbox, waiting for room.
   *
   * @param item item to deliver
   * @return {@code false} if the mailbox is sealed; the item was not delivered
   * @throws InterruptedException if interrupted while waiting for room
   */
  public boolean send(final T item) throws InterruptedException {
    Validate.notNull(item, "item must not be null");
    lock.lockInterruptibly();
    try {
      while (!sealed && buffer.size() >= capacity) {
        notFull.await();
      }
      if (sealed) {
        return false;
      }
      buffer.addLast(item);
      notEmpty.signal();
      return true;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Takes the next item, waiting for one to arrive.
   *
   * @return next item, or {@code null} once the mailbox is sealed and empty
   * @throws InterruptedException if interrupted while waiting
   */
  public T receive() throws InterruptedException {
    lock.lockInterruptibly();
    try {
      while (buffer.isEmpty() && !sealed) {
        notEmpty.await();
      }
      final T item = buffer.pollFirst();
      if (item != null) {
        notFull.signal();
      }
      return item;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Seals the mailbox. Idempotent.
   *
   * @return true if this call sealed it, false if it was already sealed
   */
  public boolean seal() {
    lock.lock();
    try {
      if (sealed) {
        return false;
      }
      sealed = true;
      notFull.signalAll();
      notEmpty.signalAll();
      return true;
    } finally {
      lock.unlock();
    }
  }

  public boolean isSealed() {
    lock.lock();
    try {
      return sealed;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Number of items currently buffered.
   */
  public int size() {
    lock.lock();
    try {
      return buffer.size();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Returns the sending end as a pipeline {@link Sink}. Completing or closing it seals the mailbox.
   */
  public Sink<T> sink() {
    return new Sink<>() {
      @Override
      public boolean offer(T item) throws InterruptedException {
        return send(item);
      }

      @Override
      public void complete() {
        seal();
      }
    };
  }

  /**
   * Returns the receiving end as a pipeline {@link Source}. Closing it seals the mailbox.
   */
  public Source<T> source() {
    return new Source<>() {
      @Override
      public T poll() throws InterruptedException {
        return receive();
      }

      @Override
      public void close() {
        seal();
      }
    };
  }
}
