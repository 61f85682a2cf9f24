package com.github.trex_paxos.binexport;

import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/// A wrapper around ReentrantReadWriteLock that hands out AutoCloseable guards so a
/// table can never forget to unlock:
/// <pre>
/// try (var ignored = lock.writeLock()) {
///   // append here
/// }
/// </pre>
final class GuardedReentrantReadWriteLock {
  private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

  Guard readLock() {
    return new Guard(lock.readLock());
  }

  Guard writeLock() {
    return new Guard(lock.writeLock());
  }

  /// Holds a lock until closed.
  static final class Guard implements AutoCloseable {
    private final Lock lock;

    Guard(Lock lock) {
      this.lock = lock;
      lock.lock();
    }

    @Override
    public void close() {
      lock.unlock();
    }
  }
}
