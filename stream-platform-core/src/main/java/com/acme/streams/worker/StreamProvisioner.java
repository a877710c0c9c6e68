package com.acme.streams.worker;

import com.acme.streams.config.WorkerConfig;
import com.acme.streams.core.StreamNotFoundException;
import com.acme.streams.spi.ConsumerDescriptor;
import com.acme.streams.spi.StreamBroker;
import com.acme.streams.spi.StreamDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ensures the stream and durable consumer a worker reads from exist. Safe to run on every start:
 * an existing stream is reused by name and consumer creation is idempotent on the broker side.
 * Any broker error other than "stream not found" is rethrown as is.
 */
public class StreamProvisioner {
  private static final Logger log = LoggerFactory.getLogger(StreamProvisioner.class);

  private final StreamBroker broker;

  public StreamProvisioner(StreamBroker broker) {
    this.broker = broker;
  }

  public void provision(WorkerConfig config) {
    ensureStream(config);
    ensureConsumer(config);
  }

  void ensureStream(WorkerConfig config) {
    try {
      StreamDescriptor existing = broker.lookupStream(config.streamName());
      log.debug("Stream {} already exists with subjects {}", existing.name(), existing.subjects());
    } catch (StreamNotFoundException e) {
      StreamDescriptor stream = StreamDescriptor.forWorker(config);
      log.info(
          "Creating stream: name={}, subjects={}, storage={}",
          stream.name(),
          stream.subjects(),
          stream.storageType());
      broker.createStream(stream);
    }
  }

  void ensureConsumer(WorkerConfig config) {
    ConsumerDescriptor consumer = ConsumerDescriptor.forWorker(config);
    broker.addOrUpdateConsumer(config.streamName(), consumer);
    log.info(
        "Consumer ensured: stream={}, durable={}, filter={}, ackWait={}, maxDeliver={}",
        config.streamName(),
        consumer.durableName(),
        consumer.filterSubject(),
        consumer.ackWait(),
        consumer.maxDeliver());
  }
}
