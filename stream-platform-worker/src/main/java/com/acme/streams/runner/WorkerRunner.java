package com.acme.streams.runner;

import com.acme.streams.config.WorkerProperties;
import com.acme.streams.worker.StreamWorker;
import io.micronaut.context.annotation.Requires;
import io.micronaut.context.event.ApplicationEventListener;
import io.micronaut.context.event.StartupEvent;
import jakarta.annotation.PreDestroy;
import jakarta.inject.Singleton;
import java.time.Duration;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs the stream worker on its own thread once the application has started, and shuts it down
 * when the application context closes. SIGTERM reaches {@link #stop()} through the context's
 * shutdown hook.
 */
@Slf4j
@Singleton
@Requires(property = "worker.enabled", value = "true", defaultValue = "true")
public class WorkerRunner implements ApplicationEventListener<StartupEvent> {

  private final StreamWorker worker;
  private final Duration shutdownTimeout;
  private volatile Thread thread;

  public WorkerRunner(StreamWorker worker, WorkerProperties properties) {
    this.worker = worker;
    this.shutdownTimeout = properties.getShutdownTimeout();
  }

  @Override
  public synchronized void onApplicationEvent(StartupEvent event) {
    if (thread != null) {
      return;
    }
    Thread t = new Thread(this::runWorker, "stream-worker-runner");
    t.setDaemon(false);
    thread = t;
    t.start();
  }

  private void runWorker() {
    try {
      worker.run();
    } catch (RuntimeException e) {
      log.error("Stream worker for {} failed", worker.config().streamName(), e);
    }
  }

  @PreDestroy
  public void stop() {
    worker.shutdown();
    Thread t = thread;
    if (t == null) {
      return;
    }
    try {
      t.join(shutdownTimeout.toMillis());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
    if (t.isAlive()) {
      log.warn(
          "Stream worker for {} did not stop within {}, interrupting",
          worker.config().streamName(),
          shutdownTimeout);
      t.interrupt();
    } else {
      log.info("Stream worker for {} stopped", worker.config().streamName());
    }
  }

  public boolean isAlive() {
    Thread t = thread;
    return t != null && t.isAlive();
  }
}
