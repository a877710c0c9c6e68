package com.acme.streams.config;

import com.acme.streams.core.PermanentException;

/** Thrown by {@link WorkerConfig.Builder#build()} when the configuration is unusable. */
public class WorkerConfigException extends PermanentException {

  public enum Reason {
    HANDLER_REQUIRED("handler is required"),
    STREAM_NAME_REQUIRED("stream name required"),
    SUBJECT_REQUIRED("subject required"),
    CONSUMER_NAME_MISMATCH("consumer name must match the durable name"),
    INVALID_CONCURRENCY("concurrency must be at least 1"),
    INVALID_MAX_DELIVER("max deliver must be at least 1"),
    INVALID_ACK_WAIT("ack wait must be positive"),
    INVALID_FETCH_BATCH_SIZE("fetch batch size must be at least 1"),
    INVALID_FETCH_MAX_WAIT("fetch max wait must be positive"),
    INVALID_FETCH_ERROR_BACKOFF("fetch error backoff must not be negative"),
    INVALID_DRAIN_TIMEOUT("drain timeout must be positive");

    private final String description;

    Reason(String description) {
      this.description = description;
    }

    public String description() {
      return description;
    }
  }

  private final Reason reason;

  public WorkerConfigException(Reason reason) {
    super(reason.description());
    this.reason = reason;
  }

  public Reason getReason() {
    return reason;
  }
}
