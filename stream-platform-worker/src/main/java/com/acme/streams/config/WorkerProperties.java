package com.acme.streams.config;

import com.acme.streams.worker.MessageHandler;
import java.time.Duration;

/**
 * Stream worker settings bound from {@code worker.*}. Pure POJO - no framework dependencies; {@link
 * #toWorkerConfig} validates it into a {@link WorkerConfig}.
 */
public class WorkerProperties {

  private boolean enabled = true;
  private String streamName;
  private String subject;
  private String durableName;
  private String consumerName;
  private String filterSubject;
  private int concurrency = WorkerConfig.DEFAULT_CONCURRENCY;
  private Duration ackWait = WorkerConfig.DEFAULT_ACK_WAIT;
  private int maxDeliver = WorkerConfig.DEFAULT_MAX_DELIVER;
  private DeliverPolicy deliverPolicy = DeliverPolicy.ALL;
  private ReplayPolicy replayPolicy = ReplayPolicy.INSTANT;
  private StorageType storageType = StorageType.FILE;
  private int fetchBatchSize = WorkerConfig.DEFAULT_FETCH_BATCH_SIZE;
  private Duration fetchMaxWait = WorkerConfig.DEFAULT_FETCH_MAX_WAIT;
  private Duration fetchErrorBackoff = WorkerConfig.DEFAULT_FETCH_ERROR_BACKOFF;
  private Duration drainTimeout = WorkerConfig.DEFAULT_DRAIN_TIMEOUT;
  private Duration shutdownTimeout = Duration.ofSeconds(35); // how long stop waits for the loops

  /**
   * @throws WorkerConfigException if a required setting is missing or out of range
   */
  public WorkerConfig toWorkerConfig(MessageHandler handler) {
    return WorkerConfig.builder()
        .streamName(streamName)
        .subject(subject)
        .durableName(durableName)
        .consumerName(consumerName)
        .filterSubject(filterSubject)
        .handler(handler)
        .concurrency(concurrency)
        .ackWait(ackWait)
        .maxDeliver(maxDeliver)
        .deliverPolicy(deliverPolicy)
        .replayPolicy(replayPolicy)
        .storageType(storageType)
        .fetchBatchSize(fetchBatchSize)
        .fetchMaxWait(fetchMaxWait)
        .fetchErrorBackoff(fetchErrorBackoff)
        .drainTimeout(drainTimeout)
        .build();
  }

  public boolean isEnabled() {
    return enabled;
  }

  public void setEnabled(boolean enabled) {
    this.enabled = enabled;
  }

  public String getStreamName() {
    return streamName;
  }

  public void setStreamName(String streamName) {
    this.streamName = streamName;
  }

  public String getSubject() {
    return subject;
  }

  public void setSubject(String subject) {
    this.subject = subject;
  }

  public String getDurableName() {
    return durableName;
  }

  public void setDurableName(String durableName) {
    this.durableName = durableName;
  }

  public String getConsumerName() {
    return consumerName;
  }

  public void setConsumerName(String consumerName) {
    this.consumerName = consumerName;
  }

  public String getFilterSubject() {
    return filterSubject;
  }

  public void setFilterSubject(String filterSubject) {
    this.filterSubject = filterSubject;
  }

  public int getConcurrency() {
    return concurrency;
  }

  public void setConcurrency(int concurrency) {
    this.concurrency = concurrency;
  }

  public Duration getAckWait() {
    return ackWait;
  }

  public void setAckWait(Duration ackWait) {
    this.ackWait = ackWait;
  }

  public int getMaxDeliver() {
    return maxDeliver;
  }

  public void setMaxDeliver(int maxDeliver) {
    this.maxDeliver = maxDeliver;
  }

  public DeliverPolicy getDeliverPolicy() {
    return deliverPolicy;
  }

  public void setDeliverPolicy(DeliverPolicy deliverPolicy) {
    this.deliverPolicy = deliverPolicy;
  }

  public ReplayPolicy getReplayPolicy() {
    return replayPolicy;
  }

  public void setReplayPolicy(ReplayPolicy replayPolicy) {
    this.replayPolicy = replayPolicy;
  }

  public StorageType getStorageType() {
    return storageType;
  }

  public void setStorageType(StorageType storageType) {
    this.storageType = storageType;
  }

  public int getFetchBatchSize() {
    return fetchBatchSize;
  }

  public void setFetchBatchSize(int fetchBatchSize) {
    this.fetchBatchSize = fetchBatchSize;
  }

  public Duration getFetchMaxWait() {
    return fetchMaxWait;
  }

  public void setFetchMaxWait(Duration fetchMaxWait) {
    this.fetchMaxWait = fetchMaxWait;
  }

  public Duration getFetchErrorBackoff() {
    return fetchErrorBackoff;
  }

  public void setFetchErrorBackoff(Duration fetchErrorBackoff) {
    this.fetchErrorBackoff = fetchErrorBackoff;
  }

  public Duration getDrainTimeout() {
    return drainTimeout;
  }

  public void setDrainTimeout(Duration drainTimeout) {
    this.drainTimeout = drainTimeout;
  }

  public Duration getShutdownTimeout() {
    return shutdownTimeout;
  }

  public void setShutdownTimeout(Duration shutdownTimeout) {
    this.shutdownTimeout = shutdownTimeout;
  }
}
