package com.acme.streams.worker;

/**
 * Handed to the {@link MessageHandler} with every envelope. Long-running handlers should poll
 * {@link #isCancelled()} and give up early once the worker is shutting down.
 */
public record WorkerContext(String streamName, int loopId, CancellationToken cancellation) {

  public boolean isCancelled() {
    return cancellation.isCancelled();
  }
}
