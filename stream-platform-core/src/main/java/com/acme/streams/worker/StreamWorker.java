package com.acme.streams.worker;

import com.acme.streams.config.WorkerConfig;
import com.acme.streams.spi.StreamBroker;
import com.acme.streams.spi.StreamSubscription;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Durable-stream worker: provisions a stream and durable consumer, then runs {@code concurrency}
 * {@link DispatchLoop}s that pull from one shared subscription.
 *
 * <p>Example:
 *
 * <pre>
 * WorkerConfig config = WorkerConfig.builder()
 *     .streamName("ORDERS")
 *     .subject("orders")
 *     .durableName("order-worker")
 *     .handler((ctx, envelope) -&gt; process(envelope.payload()))
 *     .concurrency(4)
 *     .build();
 *
 * StreamWorker worker = StreamWorker.create(broker, config);
 * // blocks until shutdown() is called or the owner's token is cancelled
 * worker.run(token);
 * </pre>
 *
 * <p>The worker installs no process signal handlers; translating SIGTERM and friends into {@link
 * #shutdown()} is up to the embedding application.
 */
public class StreamWorker implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(StreamWorker.class);

  private final WorkerConfig config;
  private final StreamSubscription subscription;
  private final Sleeper sleeper;
  private final CancellationToken lifecycle = new CancellationToken();
  private final AtomicBoolean started = new AtomicBoolean();
  private final AtomicBoolean shutdownRequested = new AtomicBoolean();
  private volatile List<DispatchLoop> loops = List.of();

  StreamWorker(WorkerConfig config, StreamSubscription subscription, Sleeper sleeper) {
    this.config = config;
    this.subscription = subscription;
    this.sleeper = sleeper;
  }

  /**
   * Provision the stream and consumer described by {@code config} and bind a pull subscription to
   * it. Nothing is returned unless every step succeeded.
   *
   * @throws com.acme.streams.core.BrokerException if provisioning or binding fails
   */
  public static StreamWorker create(StreamBroker broker, WorkerConfig config) {
    Objects.requireNonNull(broker, "broker");
    Objects.requireNonNull(config, "config");

    new StreamProvisioner(broker).provision(config);
    StreamSubscription subscription =
        broker.pullSubscribe(config.streamName(), config.consumerName(), config.filterSubject());
    log.info(
        "Bound pull subscription: stream={}, consumer={}, filter={}",
        config.streamName(),
        config.consumerName(),
        config.filterSubject());
    return new StreamWorker(config, subscription, Sleeper.THREAD);
  }

  /** Run until {@link #shutdown()} is called. */
  public void run() {
    run(new CancellationToken());
  }

  /**
   * Start the dispatch loops and block until all of them have stopped, which happens once {@code
   * owner} is cancelled or {@link #shutdown()} is called. A worker can only be run once.
   */
  public void run(CancellationToken owner) {
    if (!started.compareAndSet(false, true)) {
      throw new IllegalStateException("Worker for stream " + config.streamName() + " already ran");
    }
    owner.onCancel(lifecycle::cancel);

    List<DispatchLoop> created = new ArrayList<>(config.concurrency());
    for (int i = 0; i < config.concurrency(); i++) {
      created.add(new DispatchLoop(i, config, subscription, lifecycle, sleeper));
    }
    loops = List.copyOf(created);

    log.info(
        "Stream worker started: stream={}, consumer={}, concurrency={}",
        config.streamName(),
        config.consumerName(),
        config.concurrency());

    ExecutorService pool =
        Executors.newFixedThreadPool(config.concurrency(), threadFactory(config.streamName()));
    try {
      List<Future<Void>> results = pool.invokeAll(loops);
      for (Future<Void> result : results) {
        try {
          result.get();
        } catch (ExecutionException e) {
          log.error("Dispatch loop terminated abnormally", e.getCause());
        }
      }
    } catch (InterruptedException e) {
      lifecycle.cancel();
      Thread.currentThread().interrupt();
    } finally {
      pool.shutdownNow();
    }
    log.info("Stream worker stopped: stream={}", config.streamName());
  }

  /**
   * Stop fetching and drain the subscription so in-flight acknowledgments can settle. Returns
   * without waiting for the loops; {@link #run} returning is the signal that they stopped. Repeated
   * or concurrent calls are no-ops.
   */
  public void shutdown() {
    if (!shutdownRequested.compareAndSet(false, true)) {
      log.debug("Shutdown already requested for stream {}", config.streamName());
      return;
    }
    log.info("Shutting down stream worker: stream={}", config.streamName());
    lifecycle.cancel();
    try {
      subscription
          .drain(config.drainTimeout())
          .whenComplete(
              (drained, error) -> {
                if (error != null) {
                  log.warn("Subscription drain failed for stream {}", config.streamName(), error);
                } else if (!Boolean.TRUE.equals(drained)) {
                  log.warn(
                      "Subscription drain did not finish within {} for stream {}",
                      config.drainTimeout(),
                      config.streamName());
                } else {
                  log.info("Subscription drained for stream {}", config.streamName());
                }
              });
    } catch (RuntimeException e) {
      log.warn("Failed to drain subscription for stream {}", config.streamName(), e);
    }
  }

  @Override
  public void close() {
    shutdown();
  }

  /** True between {@link #run} starting and cancellation, while the subscription is still bound. */
  public boolean isRunning() {
    return started.get() && !lifecycle.isCancelled() && subscription.isActive();
  }

  public WorkerConfig config() {
    return config;
  }

  /** Loops of the current run; empty before {@link #run} is called. */
  public List<DispatchLoop> loops() {
    return loops;
  }

  private static ThreadFactory threadFactory(String streamName) {
    AtomicInteger counter = new AtomicInteger();
    return r -> {
      Thread thread = Executors.defaultThreadFactory().newThread(r);
      thread.setName("stream-worker-" + streamName + "-" + counter.incrementAndGet());
      return thread;
    };
  }
}
