package com.acme.streams.spi;

/**
 * Administrative and consuming capability of a message broker, as needed by a stream worker.
 * Unchecked exceptions only: {@link com.acme.streams.core.BrokerException} for client failures,
 * {@link com.acme.streams.core.StreamNotFoundException} when a looked-up stream is absent.
 */
public interface StreamBroker {

  StreamDescriptor lookupStream(String name);

  void createStream(StreamDescriptor stream);

  /** Create the consumer, or accept an existing one with the same configuration. */
  void addOrUpdateConsumer(String streamName, ConsumerDescriptor consumer);

  /**
   * @throws com.acme.streams.core.ConsumerNotFoundException if no such consumer exists on the
   *     stream
   */
  StreamSubscription pullSubscribe(String streamName, String consumerName, String filterSubject);
}
