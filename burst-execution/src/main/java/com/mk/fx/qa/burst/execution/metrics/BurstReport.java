package com.mk.fx.qa.burst.execution.metrics;

import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Run-wide request counters shared by every worker of a run.
 *
 * <p>Each record call bumps the total and exactly one outcome counter under a shared lock, while
 * {@link #snapshot()} takes the exclusive lock, so a snapshot never observes a total without its
 * matching success or failure.
 */
public class BurstReport {

  private final AtomicLong totalRequests = new AtomicLong();
  private final AtomicLong totalSuccess = new AtomicLong();
  private final AtomicLong totalFail = new AtomicLong();
  private final FailureTracker failures = new FailureTracker();
  private final ReadWriteLock lock = new ReentrantReadWriteLock();

  public void recordSuccess() {
    lock.readLock().lock();
    try {
      totalRequests.incrementAndGet();
      totalSuccess.incrementAndGet();
    } finally {
      lock.readLock().unlock();
    }
  }

  public void recordUnacceptedStatus(int statusCode) {
    recordFailure();
    failures.recordStatus(statusCode);
  }

  public void recordTransportFailure(Throwable t) {
    recordFailure();
    failures.recordTransportFailure(t);
  }

  private void recordFailure() {
    lock.readLock().lock();
    try {
      totalRequests.incrementAndGet();
      totalFail.incrementAndGet();
    } finally {
      lock.readLock().unlock();
    }
  }

  public long totalRequests() {
    return totalRequests.get();
  }

  public long totalSuccess() {
    return totalSuccess.get();
  }

  public long totalFail() {
    return totalFail.get();
  }

  /** Failure counts keyed by category, e.g. {@code HTTP_500} or {@code CONNECTION_REFUSED}. */
  public Map<String, Long> failureBreakdown() {
    return failures.breakdownSnapshot();
  }

  public ReportSnapshot snapshot() {
    lock.writeLock().lock();
    try {
      return new ReportSnapshot(totalRequests.get(), totalSuccess.get(), totalFail.get());
    } finally {
      lock.writeLock().unlock();
    }
  }
}
