package com.acme.streams.nats;

import com.acme.streams.config.DeliverPolicy;
import com.acme.streams.config.ReplayPolicy;
import com.acme.streams.config.StorageType;
import com.acme.streams.spi.AckPolicy;
import com.acme.streams.spi.ConsumerDescriptor;
import com.acme.streams.spi.StreamDescriptor;
import io.nats.client.api.ConsumerConfiguration;
import io.nats.client.api.StreamConfiguration;
import io.nats.client.api.StreamInfo;
import java.util.List;

/** Helper class to map broker-neutral descriptors and policies to JetStream configuration */
public final class NatsMappers {

  private NatsMappers() {}

  public static StreamConfiguration toStreamConfiguration(StreamDescriptor stream) {
    return StreamConfiguration.builder()
        .name(stream.name())
        .subjects(stream.subjects())
        .storageType(toNats(stream.storageType()))
        .build();
  }

  public static StreamDescriptor toStreamDescriptor(StreamInfo info) {
    StreamConfiguration config = info.getConfiguration();
    List<String> subjects = config.getSubjects();
    return new StreamDescriptor(
        config.getName(),
        subjects == null ? "" : String.join(",", subjects),
        fromNats(config.getStorageType()));
  }

  public static ConsumerConfiguration toConsumerConfiguration(ConsumerDescriptor consumer) {
    return ConsumerConfiguration.builder()
        .durable(consumer.durableName())
        .ackPolicy(toNats(consumer.ackPolicy()))
        .ackWait(consumer.ackWait())
        .maxDeliver(consumer.maxDeliver())
        .filterSubject(consumer.filterSubject())
        .deliverPolicy(toNats(consumer.deliverPolicy()))
        .replayPolicy(toNats(consumer.replayPolicy()))
        .build();
  }

  static io.nats.client.api.StorageType toNats(StorageType storageType) {
    if (storageType == null) {
      return io.nats.client.api.StorageType.File;
    }
    switch (storageType) {
      case MEMORY:
        return io.nats.client.api.StorageType.Memory;
      case FILE:
      default:
        return io.nats.client.api.StorageType.File;
    }
  }

  static StorageType fromNats(io.nats.client.api.StorageType storageType) {
    return storageType == io.nats.client.api.StorageType.Memory
        ? StorageType.MEMORY
        : StorageType.FILE;
  }

  static io.nats.client.api.AckPolicy toNats(AckPolicy ackPolicy) {
    switch (ackPolicy) {
      case ALL:
        return io.nats.client.api.AckPolicy.All;
      case NONE:
        return io.nats.client.api.AckPolicy.None;
      case EXPLICIT:
      default:
        return io.nats.client.api.AckPolicy.Explicit;
    }
  }

  static io.nats.client.api.DeliverPolicy toNats(DeliverPolicy deliverPolicy) {
    switch (deliverPolicy) {
      case NEW:
        return io.nats.client.api.DeliverPolicy.New;
      case LAST:
        return io.nats.client.api.DeliverPolicy.Last;
      case LAST_PER_SUBJECT:
        return io.nats.client.api.DeliverPolicy.LastPerSubject;
      case ALL:
      default:
        return io.nats.client.api.DeliverPolicy.All;
    }
  }

  static io.nats.client.api.ReplayPolicy toNats(ReplayPolicy replayPolicy) {
    return replayPolicy == ReplayPolicy.ORIGINAL
        ? io.nats.client.api.ReplayPolicy.Original
        : io.nats.client.api.ReplayPolicy.Instant;
  }
}
