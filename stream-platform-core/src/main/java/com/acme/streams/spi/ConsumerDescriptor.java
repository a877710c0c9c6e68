package com.acme.streams.spi;

import com.acme.streams.config.DeliverPolicy;
import com.acme.streams.config.ReplayPolicy;
import com.acme.streams.config.WorkerConfig;
import java.time.Duration;

public record ConsumerDescriptor(
    String durableName,
    AckPolicy ackPolicy,
    Duration ackWait,
    int maxDeliver,
    String filterSubject,
    DeliverPolicy deliverPolicy,
    ReplayPolicy replayPolicy) {

  /** Durable consumer with explicit acks, as every stream worker requires. */
  public static ConsumerDescriptor forWorker(WorkerConfig config) {
    return new ConsumerDescriptor(
        config.durableName(),
        AckPolicy.EXPLICIT,
        config.ackWait(),
        config.maxDeliver(),
        config.filterSubject(),
        config.deliverPolicy(),
        config.replayPolicy());
  }
}
