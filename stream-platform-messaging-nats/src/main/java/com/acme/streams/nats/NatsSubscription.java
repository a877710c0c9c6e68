package com.acme.streams.nats;

import com.acme.streams.core.BrokerException;
import com.acme.streams.spi.Envelope;
import com.acme.streams.spi.StreamSubscription;
import com.acme.streams.worker.CancellationToken;
import io.nats.client.JetStreamSubscription;
import io.nats.client.Message;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link StreamSubscription} over a JetStream pull subscription. Fetches from concurrent loops are
 * serialized on one lock; a loop that cannot get the lock within {@code maxWait} gets an empty
 * batch. Dispatching the fetched messages still happens concurrently in the callers.
 *
 * <p>Fetch throughput therefore does not grow with the number of loops, only handler throughput
 * does. Raise the fetch batch size rather than the concurrency when handlers are fast and the
 * worker is fetch-bound.
 */
public class NatsSubscription implements StreamSubscription {
  private static final Logger log = LoggerFactory.getLogger(NatsSubscription.class);

  private final JetStreamSubscription subscription;
  private final String description;
  private final ReentrantLock fetchLock = new ReentrantLock();

  public NatsSubscription(JetStreamSubscription subscription, String description) {
    this.subscription = subscription;
    this.description = description;
  }

  @Override
  public List<Envelope> fetch(int batchSize, Duration maxWait, CancellationToken token) {
    if (token.isCancelled()) {
      return List.of();
    }
    try {
      if (!fetchLock.tryLock(maxWait.toMillis(), TimeUnit.MILLISECONDS)) {
        return List.of();
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return List.of();
    }
    List<Message> messages;
    try {
      if (token.isCancelled()) {
        return List.of();
      }
      messages = subscription.fetch(batchSize, maxWait);
    } catch (IllegalStateException e) {
      throw new BrokerException("Fetch failed on " + description + ": " + e.getMessage(), e);
    } finally {
      fetchLock.unlock();
    }

    List<Envelope> envelopes = new ArrayList<>(messages.size());
    for (Message message : messages) {
      envelopes.add(new NatsEnvelope(message));
    }
    return envelopes;
  }

  @Override
  public CompletableFuture<Boolean> drain(Duration timeout) {
    log.debug("Draining {}", description);
    try {
      return subscription.drain(timeout);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return CompletableFuture.completedFuture(false);
    } catch (IllegalStateException e) {
      return CompletableFuture.failedFuture(
          new BrokerException("Drain failed on " + description + ": " + e.getMessage(), e));
    }
  }

  @Override
  public boolean isActive() {
    return subscription.isActive();
  }

  @Override
  public String toString() {
    return "NatsSubscription{" + description + '}';
  }
}
