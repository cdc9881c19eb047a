package com.mk.fx.qa.burst.execution.executors;

import com.mk.fx.qa.burst.execution.model.RequestOutcome;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import lombok.extern.slf4j.Slf4j;

/**
 * Unbounded, closable queue of outcomes belonging to one burst.
 *
 * <p>Publishing never blocks. After {@link #close()} the consumer drains whatever was published
 * before the close and then sees the end of the stream.
 */
@Slf4j
public final class OutcomeChannel {

  private static final RequestOutcome END_OF_STREAM =
      RequestOutcome.ofError(0, 0, new IllegalStateException("end of stream"));

  private final String name;
  private final BlockingQueue<RequestOutcome> queue = new LinkedBlockingQueue<>();
  private boolean closed;

  public OutcomeChannel(String name) {
    this.name = name;
  }

  /**
   * Publishes an outcome.
   *
   * @return false if the channel was already closed and the outcome was not enqueued
   */
  public synchronized boolean publish(RequestOutcome outcome) {
    if (closed) {
      log.warn(
          "Channel {} already closed, outcome of request #{} not delivered",
          name,
          outcome.sequenceIndex());
      return false;
    }
    return queue.offer(outcome);
  }

  /**
   * Waits for the next outcome.
   *
   * @return the next outcome, or empty once the channel is closed and drained
   */
  public Optional<RequestOutcome> take() throws InterruptedException {
    RequestOutcome next = queue.take();
    if (next == END_OF_STREAM) {
      // leave the marker for any other consumer
      queue.offer(END_OF_STREAM);
      return Optional.empty();
    }
    return Optional.of(next);
  }

  public synchronized void close() {
    if (!closed) {
      closed = true;
      queue.offer(END_OF_STREAM);
    }
  }

  public synchronized boolean isClosed() {
    return closed;
  }

  public String name() {
    return name;
  }
}
