package taskengine.dispatch;

import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Logger;

/**
 * Global running/paused switch consulted by pausable worker pools.
 *
 * <p>Pausing only stops pausable workers from <em>starting</em> a handler. A handler that
 * is already running is never interrupted, and the high-priority pool and the dispatch
 * router never wait on this switch.
 */
public final class ExecutionController {
  private static final Logger logger = Logger.getLogger(ExecutionController.class.getName());

  /** Execution states. */
  public enum State {
    RUNNING,
    PAUSED
  }

  private final ReentrantLock lock = new ReentrantLock();
  private final Condition resumed = lock.newCondition();
  private State state = State.RUNNING;

  /** Temporarily pauses execution of new tasks in pausable pools. */
  public void pause() {
    lock.lock();
    try {
      if (state != State.PAUSED) {
        logger.info("Pausing task execution.");
      }
      state = State.PAUSED;
    } finally {
      lock.unlock();
    }
  }

  /** Resumes execution and releases every waiting worker. */
  public void resume() {
    lock.lock();
    try {
      if (state != State.RUNNING) {
        logger.info("Resuming task execution.");
      }
      state = State.RUNNING;
      resumed.signalAll();
    } finally {
      lock.unlock();
    }
  }

  public State state() {
    lock.lock();
    try {
      return state;
    } finally {
      lock.unlock();
    }
  }

  public boolean isPaused() {
    return state() == State.PAUSED;
  }

  /**
   * Blocks while execution is paused.
   *
   * @throws InterruptedException if interrupted while waiting
   */
  public void awaitRunning() throws InterruptedException {
    lock.lockInterruptibly();
    try {
      while (state == State.PAUSED) {
        resumed.await();
      }
    } finally {
      lock.unlock();
    }
  }
}
