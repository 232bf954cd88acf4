package taskengine.dispatch;

import java.util.ArrayDeque;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Fixed-capacity FIFO with blocking producers and consumers and an explicit closed state.
 *
 * <p>After {@link #close()}, {@link #put} refuses new items while {@link #take} keeps
 * returning the remaining ones; once drained it returns {@code null} to every consumer.
 *
 * @param <E> element type
 */
public final class BoundedQueue<E> {
  private final String name;
  private final int capacity;
  private final ArrayDeque<E> items;
  private final ReentrantLock lock = new ReentrantLock();
  private final Condition notEmpty = lock.newCondition();
  private final Condition notFull = lock.newCondition();
  private boolean closed;

  public BoundedQueue(String name, int capacity) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("capacity must be > 0");
    }
    this.name = name;
    this.capacity = capacity;
    this.items = new ArrayDeque<>(capacity);
  }

  public String name() {
    return name;
  }

  /**
   * Appends an item, waiting while the queue is full.
   *
   * @return {@code false} if the queue is (or becomes) closed before the item is accepted
   * @throws InterruptedException if interrupted while waiting for space
   */
  public boolean put(E item) throws InterruptedException {
    if (item == null) {
      throw new NullPointerException("item");
    }
    lock.lockInterruptibly();
    try {
      while (!closed && items.size() == capacity) {
        notFull.await();
      }
      if (closed) {
        return false;
      }
      items.addLast(item);
      notEmpty.signal();
      return true;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Removes the head, waiting while the queue is empty and open.
   *
   * @return the head, or {@code null} once the queue is closed and drained
   * @throws InterruptedException if interrupted while waiting
   */
  public E take() throws InterruptedException {
    lock.lockInterruptibly();
    try {
      while (items.isEmpty() && !closed) {
        notEmpty.await();
      }
      return dequeue();
    } finally {
      lock.unlock();
    }
  }

  private E dequeue() {
    E item = items.pollFirst();
    if (item != null) {
      notFull.signal();
    } else {
      // closed and drained: let the other consumers see it too
      notEmpty.signalAll();
    }
    return item;
  }

  /**
   * Stops accepting items and wakes every waiting producer and consumer. Idempotent.
   */
  public void close() {
    lock.lock();
    try {
      closed = true;
      notEmpty.signalAll();
      notFull.signalAll();
    } finally {
      lock.unlock();
    }
  }

  public boolean isClosed() {
    lock.lock();
    try {
      return closed;
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
