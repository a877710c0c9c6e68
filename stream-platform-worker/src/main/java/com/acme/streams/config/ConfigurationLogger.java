package com.acme.streams.config;

import io.micronaut.context.annotation.Requires;
import io.micronaut.context.event.ApplicationEventListener;
import io.micronaut.context.event.StartupEvent;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs effective configuration on application startup for visibility and troubleshooting.
 * Disabled in test environment.
 */
@Singleton
@Requires(notEnv = "test")
public class ConfigurationLogger implements ApplicationEventListener<StartupEvent> {

  private static final Logger LOG = LoggerFactory.getLogger(ConfigurationLogger.class);

  private final WorkerProperties worker;
  private final NatsProperties nats;

  public ConfigurationLogger(WorkerProperties worker, NatsProperties nats) {
    this.worker = worker;
    this.nats = nats;
  }

  @Override
  public void onApplicationEvent(StartupEvent event) {
    LOG.info("═══════════════════════════════════════════════════════════════════════════════");
    LOG.info("                         EFFECTIVE CONFIGURATION                                ");
    LOG.info("═══════════════════════════════════════════════════════════════════════════════");

    LOG.info("━━━ NATS Connection ━━━");
    LOG.info("  URL:                {}", nats.getUrl());
    LOG.info("  Connection Name:    {}", nats.getConnectionName());
    LOG.info("  Connect Timeout:    {}", nats.getConnectionTimeout());
    LOG.info(
        "  Max Reconnects:     {}",
        nats.getMaxReconnects() < 0 ? "unlimited" : nats.getMaxReconnects());
    LOG.info("");

    LOG.info("━━━ Stream Worker ━━━");
    LOG.info("  Enabled:            {}", worker.isEnabled() ? "ENABLED" : "DISABLED");
    LOG.info("  Stream:             {} ({} storage)", worker.getStreamName(), worker.getStorageType());
    LOG.info("  Subject:            {}", worker.getSubject());
    LOG.info("  Durable:            {}", orDefault(worker.getDurableName(), "<stream name>"));
    LOG.info("  Consumer:           {}", orDefault(worker.getConsumerName(), "<durable name>"));
    LOG.info("  Filter:             {}", orDefault(worker.getFilterSubject(), "<subject>.>"));
    LOG.info("  Concurrency:        {} (pull loops sharing one subscription)", worker.getConcurrency());
    LOG.info("  Ack Wait:           {} (redelivery after an unacked message)", worker.getAckWait());
    LOG.info("  Max Deliver:        {}", worker.getMaxDeliver());
    LOG.info("  Deliver Policy:     {}", worker.getDeliverPolicy());
    LOG.info("  Replay Policy:      {}", worker.getReplayPolicy());
    LOG.info(
        "  Fetch:              batch={}, maxWait={}, errorBackoff={}",
        worker.getFetchBatchSize(),
        worker.getFetchMaxWait(),
        worker.getFetchErrorBackoff());
    LOG.info("  Drain Timeout:      {}", worker.getDrainTimeout());
    LOG.info("═══════════════════════════════════════════════════════════════════════════════");
  }

  private static String orDefault(String value, String fallback) {
    return value == null || value.isBlank() ? fallback : value;
  }
}
