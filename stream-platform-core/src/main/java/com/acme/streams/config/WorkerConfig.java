package com.acme.streams.config;

import com.acme.streams.config.WorkerConfigException.Reason;
import com.acme.streams.worker.DispatchListener;
import com.acme.streams.worker.MessageHandler;
import java.time.Duration;
import java.util.Objects;

/**
 * Validated, immutable configuration of a stream worker. Instances only come out of {@link
 * Builder#build()}, so a {@code WorkerConfig} in hand always has a handler, a stream name and a
 * subject.
 */
public final class WorkerConfig {

  public static final int DEFAULT_CONCURRENCY = 1;
  public static final Duration DEFAULT_ACK_WAIT = Duration.ofSeconds(30);
  public static final int DEFAULT_MAX_DELIVER = 1;
  public static final int DEFAULT_FETCH_BATCH_SIZE = 10;
  public static final Duration DEFAULT_FETCH_MAX_WAIT = Duration.ofSeconds(5);
  public static final Duration DEFAULT_FETCH_ERROR_BACKOFF = Duration.ofSeconds(1);
  public static final Duration DEFAULT_DRAIN_TIMEOUT = Duration.ofSeconds(30);

  private final String streamName;
  private final String subject;
  private final String filterSubject;
  private final String durableName;
  private final String consumerName;
  private final MessageHandler handler;
  private final int concurrency;
  private final Duration ackWait;
  private final int maxDeliver;
  private final DeliverPolicy deliverPolicy;
  private final ReplayPolicy replayPolicy;
  private final StorageType storageType;
  private final int fetchBatchSize;
  private final Duration fetchMaxWait;
  private final Duration fetchErrorBackoff;
  private final Duration drainTimeout;
  private final DispatchListener dispatchListener;

  private WorkerConfig(Builder b) {
    this.streamName = b.streamName;
    this.subject = b.subject;
    this.filterSubject = isBlank(b.filterSubject) ? b.subject + ".>" : b.filterSubject;
    this.durableName = resolveDurableName(b);
    this.consumerName = this.durableName;
    this.handler = b.handler;
    this.concurrency = b.concurrency;
    this.ackWait = b.ackWait;
    this.maxDeliver = b.maxDeliver;
    this.deliverPolicy = b.deliverPolicy;
    this.replayPolicy = b.replayPolicy;
    this.storageType = b.storageType;
    this.fetchBatchSize = b.fetchBatchSize;
    this.fetchMaxWait = b.fetchMaxWait;
    this.fetchErrorBackoff = b.fetchErrorBackoff;
    this.drainTimeout = b.drainTimeout;
    this.dispatchListener = b.dispatchListener;
  }

  public static Builder builder() {
    return new Builder();
  }

  public String streamName() {
    return streamName;
  }

  public String subject() {
    return subject;
  }

  /** Subject pattern the stream captures: every subject below {@link #subject()}. */
  public String streamSubjects() {
    return subject + ".>";
  }

  public String filterSubject() {
    return filterSubject;
  }

  public String durableName() {
    return durableName;
  }

  /** Name the pull subscription binds to; always the durable name the consumer is created under. */
  public String consumerName() {
    return consumerName;
  }

  public MessageHandler handler() {
    return handler;
  }

  public int concurrency() {
    return concurrency;
  }

  public Duration ackWait() {
    return ackWait;
  }

  public int maxDeliver() {
    return maxDeliver;
  }

  public DeliverPolicy deliverPolicy() {
    return deliverPolicy;
  }

  public ReplayPolicy replayPolicy() {
    return replayPolicy;
  }

  public StorageType storageType() {
    return storageType;
  }

  public int fetchBatchSize() {
    return fetchBatchSize;
  }

  public Duration fetchMaxWait() {
    return fetchMaxWait;
  }

  public Duration fetchErrorBackoff() {
    return fetchErrorBackoff;
  }

  public Duration drainTimeout() {
    return drainTimeout;
  }

  public DispatchListener dispatchListener() {
    return dispatchListener;
  }

  @Override
  public String toString() {
    return "WorkerConfig{stream="
        + streamName
        + ", subject="
        + subject
        + ", filterSubject="
        + filterSubject
        + ", durable="
        + durableName
        + ", consumer="
        + consumerName
        + ", concurrency="
        + concurrency
        + ", ackWait="
        + ackWait
        + ", maxDeliver="
        + maxDeliver
        + ", deliverPolicy="
        + deliverPolicy
        + ", replayPolicy="
        + replayPolicy
        + ", storage="
        + storageType
        + '}';
  }

  private static boolean isBlank(String s) {
    return s == null || s.isBlank();
  }

  // durable, then consumer name, then stream name
  private static String resolveDurableName(Builder b) {
    if (!isBlank(b.durableName)) {
      return b.durableName;
    }
    return isBlank(b.consumerName) ? b.streamName : b.consumerName;
  }

  private static boolean isPositive(Duration d) {
    return !d.isZero() && !d.isNegative();
  }

  public static final class Builder {
    private String streamName;
    private String subject;
    private String filterSubject;
    private String durableName;
    private String consumerName;
    private MessageHandler handler;
    private int concurrency = DEFAULT_CONCURRENCY;
    private Duration ackWait = DEFAULT_ACK_WAIT;
    private int maxDeliver = DEFAULT_MAX_DELIVER;
    private DeliverPolicy deliverPolicy = DeliverPolicy.ALL;
    private ReplayPolicy replayPolicy = ReplayPolicy.INSTANT;
    private StorageType storageType = StorageType.FILE;
    private int fetchBatchSize = DEFAULT_FETCH_BATCH_SIZE;
    private Duration fetchMaxWait = DEFAULT_FETCH_MAX_WAIT;
    private Duration fetchErrorBackoff = DEFAULT_FETCH_ERROR_BACKOFF;
    private Duration drainTimeout = DEFAULT_DRAIN_TIMEOUT;
    private DispatchListener dispatchListener = DispatchListener.NOOP;

    private Builder() {}

    public Builder streamName(String streamName) {
      this.streamName = streamName;
      return this;
    }

    public Builder subject(String subject) {
      this.subject = subject;
      return this;
    }

    /**
     * Sets the consumer name together with the subject it consumes. Without an explicit durable
     * name the consumer name becomes the durable.
     */
    public Builder consumer(String consumerName, String subject) {
      this.consumerName = consumerName;
      this.subject = subject;
      return this;
    }

    public Builder filterSubject(String filterSubject) {
      this.filterSubject = filterSubject;
      return this;
    }

    public Builder durableName(String durableName) {
      this.durableName = durableName;
      return this;
    }

    public Builder consumerName(String consumerName) {
      this.consumerName = consumerName;
      return this;
    }

    public Builder handler(MessageHandler handler) {
      this.handler = handler;
      return this;
    }

    public Builder concurrency(int concurrency) {
      this.concurrency = concurrency;
      return this;
    }

    public Builder ackWait(Duration ackWait) {
      this.ackWait = ackWait;
      return this;
    }

    public Builder maxDeliver(int maxDeliver) {
      this.maxDeliver = maxDeliver;
      return this;
    }

    public Builder deliverPolicy(DeliverPolicy deliverPolicy) {
      this.deliverPolicy = Objects.requireNonNull(deliverPolicy, "deliverPolicy");
      return this;
    }

    public Builder replayPolicy(ReplayPolicy replayPolicy) {
      this.replayPolicy = Objects.requireNonNull(replayPolicy, "replayPolicy");
      return this;
    }

    public Builder storageType(StorageType storageType) {
      this.storageType = Objects.requireNonNull(storageType, "storageType");
      return this;
    }

    public Builder fetchBatchSize(int fetchBatchSize) {
      this.fetchBatchSize = fetchBatchSize;
      return this;
    }

    public Builder fetchMaxWait(Duration fetchMaxWait) {
      this.fetchMaxWait = Objects.requireNonNull(fetchMaxWait, "fetchMaxWait");
      return this;
    }

    public Builder fetchErrorBackoff(Duration fetchErrorBackoff) {
      this.fetchErrorBackoff = Objects.requireNonNull(fetchErrorBackoff, "fetchErrorBackoff");
      return this;
    }

    public Builder drainTimeout(Duration drainTimeout) {
      this.drainTimeout = Objects.requireNonNull(drainTimeout, "drainTimeout");
      return this;
    }

    public Builder dispatchListener(DispatchListener dispatchListener) {
      this.dispatchListener = dispatchListener == null ? DispatchListener.NOOP : dispatchListener;
      return this;
    }

    /**
     * Validate and freeze the configuration. Required fields are checked in the order handler,
     * stream name, subject; the first one missing determines the reported {@link Reason}. A
     * consumer name that differs from an explicit durable name is rejected, since the subscription
     * binds to the durable.
     *
     * @throws WorkerConfigException if the configuration is invalid
     */
    public WorkerConfig build() {
      if (handler == null) {
        throw new WorkerConfigException(Reason.HANDLER_REQUIRED);
      }
      if (isBlank(streamName)) {
        throw new WorkerConfigException(Reason.STREAM_NAME_REQUIRED);
      }
      if (isBlank(subject)) {
        throw new WorkerConfigException(Reason.SUBJECT_REQUIRED);
      }
      if (!isBlank(consumerName) && !isBlank(durableName) && !consumerName.equals(durableName)) {
        throw new WorkerConfigException(Reason.CONSUMER_NAME_MISMATCH);
      }
      if (concurrency < 1) {
        throw new WorkerConfigException(Reason.INVALID_CONCURRENCY);
      }
      if (maxDeliver < 1) {
        throw new WorkerConfigException(Reason.INVALID_MAX_DELIVER);
      }
      if (ackWait == null || !isPositive(ackWait)) {
        throw new WorkerConfigException(Reason.INVALID_ACK_WAIT);
      }
      if (fetchBatchSize < 1) {
        throw new WorkerConfigException(Reason.INVALID_FETCH_BATCH_SIZE);
      }
      if (!isPositive(fetchMaxWait)) {
        throw new WorkerConfigException(Reason.INVALID_FETCH_MAX_WAIT);
      }
      if (fetchErrorBackoff.isNegative()) {
        throw new WorkerConfigException(Reason.INVALID_FETCH_ERROR_BACKOFF);
      }
      if (!isPositive(drainTimeout)) {
        throw new WorkerConfigException(Reason.INVALID_DRAIN_TIMEOUT);
      }
      return new WorkerConfig(this);
    }
  }
}
