package com.acme.streams.worker;

import com.acme.streams.config.WorkerConfig;
import com.acme.streams.core.FetchTimeoutException;
import com.acme.streams.spi.Envelope;
import com.acme.streams.spi.StreamSubscription;
import com.acme.streams.worker.DispatchListener.Signal;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * One pull loop of a {@link StreamWorker}. Repeatedly fetches a batch from the shared subscription
 * and hands each envelope to the handler, acking on success and naking on failure. Steady-state
 * errors are logged and absorbed; only cancellation (or thread interruption) ends the loop.
 */
public class DispatchLoop implements Callable<Void> {
  private static final Logger log = LoggerFactory.getLogger(DispatchLoop.class);

  static final String MDC_STREAM = "streamWorker";
  static final String MDC_LOOP = "loopId";

  public enum State {
    FETCHING,
    DISPATCHING,
    STOPPED
  }

  private final int loopId;
  private final StreamSubscription subscription;
  private final MessageHandler handler;
  private final DispatchListener listener;
  private final String streamName;
  private final int batchSize;
  private final Duration maxWait;
  private final Duration errorBackoff;
  private final CancellationToken token;
  private final Sleeper sleeper;
  private final WorkerContext context;

  private final AtomicLong fetchErrors = new AtomicLong();
  private final AtomicLong acked = new AtomicLong();
  private final AtomicLong nakked = new AtomicLong();
  private volatile State state = State.FETCHING;

  public DispatchLoop(
      int loopId,
      WorkerConfig config,
      StreamSubscription subscription,
      CancellationToken token,
      Sleeper sleeper) {
    this.loopId = loopId;
    this.subscription = subscription;
    this.handler = config.handler();
    this.listener = config.dispatchListener();
    this.streamName = config.streamName();
    this.batchSize = config.fetchBatchSize();
    this.maxWait = config.fetchMaxWait();
    this.errorBackoff = config.fetchErrorBackoff();
    this.token = token;
    this.sleeper = sleeper;
    this.context = new WorkerContext(streamName, loopId, token);
  }

  @Override
  public Void call() {
    MDC.put(MDC_STREAM, streamName);
    MDC.put(MDC_LOOP, String.valueOf(loopId));
    log.debug("Dispatch loop {} started", loopId);
    try {
      loop();
    } finally {
      state = State.STOPPED;
      log.debug(
          "Dispatch loop {} stopped: acked={}, nakked={}, fetchErrors={}",
          loopId,
          acked.get(),
          nakked.get(),
          fetchErrors.get());
      MDC.remove(MDC_STREAM);
      MDC.remove(MDC_LOOP);
    }
    return null;
  }

  private void loop() {
    while (!stopRequested()) {
      state = State.FETCHING;
      List<Envelope> batch;
      try {
        batch = subscription.fetch(batchSize, maxWait, token);
      } catch (FetchTimeoutException e) {
        log.trace("Fetch timed out, retrying");
        continue;
      } catch (RuntimeException e) {
        if (stopRequested()) {
          return;
        }
        fetchErrors.incrementAndGet();
        log.error("Error fetching messages from stream {}", streamName, e);
        listener.onFetchError(e);
        if (!backOff()) {
          return;
        }
        continue;
      }

      if (batch.isEmpty()) {
        continue;
      }
      state = State.DISPATCHING;
      // A fetched batch is always dispatched in full, even after cancellation.
      for (Envelope envelope : batch) {
        dispatch(envelope);
      }
    }
  }

  private void dispatch(Envelope envelope) {
    try {
      handler.handle(context, envelope);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.error("Interrupted while processing message on {}", envelope.subject(), e);
      nak(envelope, e);
      return;
    } catch (Exception e) {
      log.error(
          "Error processing message: subject={}, attempt={}",
          envelope.subject(),
          envelope.deliveryAttempt(),
          e);
      nak(envelope, e);
      return;
    }
    ack(envelope);
  }

  private void ack(Envelope envelope) {
    try {
      envelope.ack();
    } catch (RuntimeException e) {
      log.warn("Failed to ack message on {}", envelope.subject(), e);
      listener.onAckFailure(envelope, Signal.ACK, e);
      return;
    }
    acked.incrementAndGet();
    log.debug("Acked message on {}", envelope.subject());
    listener.onAck(envelope);
  }

  private void nak(Envelope envelope, Exception cause) {
    try {
      envelope.nak();
    } catch (RuntimeException e) {
      log.warn("Failed to nak message on {}", envelope.subject(), e);
      listener.onAckFailure(envelope, Signal.NAK, e);
      return;
    }
    nakked.incrementAndGet();
    listener.onNak(envelope, cause);
  }

  /** @return false if the loop was interrupted while sleeping and must stop */
  private boolean backOff() {
    try {
      sleeper.sleep(errorBackoff);
      return true;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    }
  }

  private boolean stopRequested() {
    return token.isCancelled() || Thread.currentThread().isInterrupted();
  }

  public int loopId() {
    return loopId;
  }

  public State state() {
    return state;
  }

  public long fetchErrorCount() {
    return fetchErrors.get();
  }

  public long ackedCount() {
    return acked.get();
  }

  public long nakkedCount() {
    return nakked.get();
  }
}
