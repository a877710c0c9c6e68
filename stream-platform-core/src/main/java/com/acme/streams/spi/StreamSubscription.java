package com.acme.streams.spi;

import com.acme.streams.worker.CancellationToken;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Pull subscription bound to one consumer of one stream. Implementations must allow concurrent
 * {@link #fetch} calls from several dispatch loops without external locking.
 */
public interface StreamSubscription {

  /**
   * Pull up to {@code batchSize} messages, waiting at most {@code maxWait}.
   *
   * @return the messages received; empty when nothing arrived in time or the token was cancelled
   * @throws com.acme.streams.core.FetchTimeoutException if the adapter reports an elapsed wait as
   *     an error instead of an empty batch
   * @throws com.acme.streams.core.BrokerException on transport or protocol failure
   */
  List<Envelope> fetch(int batchSize, Duration maxWait, CancellationToken token);

  /**
   * Stop delivering new messages while letting in-flight acknowledgments settle.
   *
   * @return completes with {@code true} when the drain finished within {@code timeout}
   */
  CompletableFuture<Boolean> drain(Duration timeout);

  boolean isActive();
}
