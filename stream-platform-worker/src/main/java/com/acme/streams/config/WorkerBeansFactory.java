package com.acme.streams.config;

import com.acme.streams.nats.NatsStreamBroker;
import com.acme.streams.spi.StreamBroker;
import com.acme.streams.worker.MessageHandler;
import com.acme.streams.worker.StreamWorker;
import io.micronaut.context.annotation.Bean;
import io.micronaut.context.annotation.ConfigurationProperties;
import io.micronaut.context.annotation.Factory;
import io.micronaut.context.annotation.Requires;
import io.nats.client.Connection;
import jakarta.inject.Singleton;

/**
 * Factory for the stream worker beans.
 *
 * <p>The core and NATS modules stay free of framework dependencies; this module binds their POJOs
 * to {@code application.yml} and wires them together. Broker beans are only created when {@code
 * worker.enabled} is true (the default).
 */
@Factory
public class WorkerBeansFactory {

  /** Creates WorkerProperties bean populated from application.yml worker.* properties */
  @Singleton
  @ConfigurationProperties("worker")
  public WorkerProperties workerProperties() {
    return new WorkerProperties();
  }

  /** Creates NatsProperties bean populated from application.yml nats.* properties */
  @Singleton
  @ConfigurationProperties("nats")
  public NatsProperties natsProperties() {
    return new NatsProperties();
  }

  /** Opens the NATS connection; closed when the context shuts down, after the worker has drained */
  @Singleton
  @Bean(preDestroy = "close")
  @Requires(property = "worker.enabled", value = "true", defaultValue = "true")
  public Connection natsConnection(NatsProperties natsProperties) {
    return natsProperties.toConnectionFactory().connect();
  }

  @Singleton
  @Requires(property = "worker.enabled", value = "true", defaultValue = "true")
  public StreamBroker streamBroker(Connection connection) {
    return NatsStreamBroker.from(connection);
  }

  /** Provisions the stream and consumer, then binds the worker's pull subscription */
  @Singleton
  @Requires(property = "worker.enabled", value = "true", defaultValue = "true")
  public StreamWorker streamWorker(
      StreamBroker broker, WorkerProperties workerProperties, MessageHandler handler) {
    return StreamWorker.create(broker, workerProperties.toWorkerConfig(handler));
  }
}
