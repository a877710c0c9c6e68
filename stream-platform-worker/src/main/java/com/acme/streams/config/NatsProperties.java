package com.acme.streams.config;

import com.acme.streams.nats.NatsConnectionFactory;
import java.time.Duration;

/** NATS client settings bound from {@code nats.*}. */
public class NatsProperties {

  private String url = "nats://localhost:4222";
  private String connectionName = "stream-worker";
  private Duration connectionTimeout = Duration.ofSeconds(5);
  private int maxReconnects = -1; // unlimited
  private Duration reconnectWait = Duration.ofSeconds(2);

  public NatsConnectionFactory toConnectionFactory() {
    return new NatsConnectionFactory(
        url, connectionName, connectionTimeout, maxReconnects, reconnectWait);
  }

  public String getUrl() {
    return url;
  }

  public void setUrl(String url) {
    this.url = url;
  }

  public String getConnectionName() {
    return connectionName;
  }

  public void setConnectionName(String connectionName) {
    this.connectionName = connectionName;
  }

  public Duration getConnectionTimeout() {
    return connectionTimeout;
  }

  public void setConnectionTimeout(Duration connectionTimeout) {
    this.connectionTimeout = connectionTimeout;
  }

  public int getMaxReconnects() {
    return maxReconnects;
  }

  public void setMaxReconnects(int maxReconnects) {
    this.maxReconnects = maxReconnects;
  }

  public Duration getReconnectWait() {
    return reconnectWait;
  }

  public void setReconnectWait(Duration reconnectWait) {
    this.reconnectWait = reconnectWait;
  }
}
