package com.acme.streams.nats;

import com.acme.streams.core.BrokerException;
import io.nats.client.Connection;
import io.nats.client.ConnectionListener;
import io.nats.client.Nats;
import io.nats.client.Options;
import java.io.IOException;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Opens client connections to an external NATS server. */
public class NatsConnectionFactory {
  private static final Logger log = LoggerFactory.getLogger(NatsConnectionFactory.class);

  private final String url;
  private final String connectionName;
  private final Duration connectionTimeout;
  private final int maxReconnects;
  private final Duration reconnectWait;

  public NatsConnectionFactory(
      String url,
      String connectionName,
      Duration connectionTimeout,
      int maxReconnects,
      Duration reconnectWait) {
    this.url = url;
    this.connectionName = connectionName;
    this.connectionTimeout = connectionTimeout;
    this.maxReconnects = maxReconnects;
    this.reconnectWait = reconnectWait;
  }

  public Options options() {
    return new Options.Builder()
        .server(url)
        .connectionName(connectionName)
        .connectionTimeout(connectionTimeout)
        .maxReconnects(maxReconnects)
        .reconnectWait(reconnectWait)
        .connectionListener(NatsConnectionFactory::logEvent)
        .build();
  }

  public Connection connect() {
    try {
      Connection connection = Nats.connect(options());
      log.info("Connected to NATS: url={}, name={}", url, connectionName);
      return connection;
    } catch (IOException e) {
      throw new BrokerException("Failed to connect to NATS at " + url + ": " + e.getMessage(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new BrokerException("Interrupted while connecting to NATS at " + url, e);
    }
  }

  private static void logEvent(Connection connection, ConnectionListener.Events event) {
    switch (event) {
      case DISCONNECTED:
      case CLOSED:
        log.warn("NATS connection event: {}", event);
        break;
      default:
        log.info("NATS connection event: {}", event);
    }
  }
}
