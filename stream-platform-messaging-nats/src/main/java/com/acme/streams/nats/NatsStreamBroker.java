package com.acme.streams.nats;

import com.acme.streams.core.BrokerException;
import com.acme.streams.core.ConsumerNotFoundException;
import com.acme.streams.core.StreamNotFoundException;
import com.acme.streams.spi.ConsumerDescriptor;
import com.acme.streams.spi.StreamBroker;
import com.acme.streams.spi.StreamDescriptor;
import com.acme.streams.spi.StreamSubscription;
import io.nats.client.Connection;
import io.nats.client.JetStream;
import io.nats.client.JetStreamApiException;
import io.nats.client.JetStreamManagement;
import io.nats.client.JetStreamSubscription;
import io.nats.client.PullSubscribeOptions;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** JetStream implementation of {@link StreamBroker}. */
public class NatsStreamBroker implements StreamBroker {
  private static final Logger log = LoggerFactory.getLogger(NatsStreamBroker.class);

  static final int NOT_FOUND = 404;
  static final int STREAM_NOT_FOUND_API_ERROR = 10059;
  static final int CONSUMER_NOT_FOUND_API_ERROR = 10014;
  // client-side error raised when binding to a durable that does not exist
  static final String CONSUMER_REQUIRED_IN_BIND = "SUB-90011";

  private final JetStreamManagement management;
  private final JetStream jetStream;

  public NatsStreamBroker(JetStreamManagement management, JetStream jetStream) {
    this.management = management;
    this.jetStream = jetStream;
  }

  public static NatsStreamBroker from(Connection connection) {
    try {
      return new NatsStreamBroker(connection.jetStreamManagement(), connection.jetStream());
    } catch (IOException e) {
      throw new BrokerException("JetStream is not available: " + e.getMessage(), e);
    }
  }

  @Override
  public StreamDescriptor lookupStream(String name) {
    try {
      return NatsMappers.toStreamDescriptor(management.getStreamInfo(name));
    } catch (JetStreamApiException e) {
      if (isStreamNotFound(e)) {
        throw new StreamNotFoundException(name, e);
      }
      throw new BrokerException("Failed to look up stream " + name + ": " + e.getMessage(), e);
    } catch (IOException e) {
      throw new BrokerException("Failed to look up stream " + name + ": " + e.getMessage(), e);
    }
  }

  @Override
  public void createStream(StreamDescriptor stream) {
    try {
      management.addStream(NatsMappers.toStreamConfiguration(stream));
      log.info(
          "Created JetStream stream: name={}, subjects={}, storage={}",
          stream.name(),
          stream.subjects(),
          stream.storageType());
    } catch (JetStreamApiException | IOException e) {
      throw new BrokerException(
          "Failed to create stream " + stream.name() + ": " + e.getMessage(), e);
    }
  }

  @Override
  public void addOrUpdateConsumer(String streamName, ConsumerDescriptor consumer) {
    try {
      management.addOrUpdateConsumer(streamName, NatsMappers.toConsumerConfiguration(consumer));
    } catch (JetStreamApiException | IOException e) {
      throw new BrokerException(
          "Failed to add consumer "
              + consumer.durableName()
              + " to stream "
              + streamName
              + ": "
              + e.getMessage(),
          e);
    }
  }

  @Override
  public StreamSubscription pullSubscribe(
      String streamName, String consumerName, String filterSubject) {
    PullSubscribeOptions options =
        PullSubscribeOptions.builder().stream(streamName).durable(consumerName).bind(true).build();
    try {
      JetStreamSubscription subscription = jetStream.subscribe(filterSubject, options);
      return new NatsSubscription(subscription, streamName + "/" + consumerName);
    } catch (JetStreamApiException e) {
      if (e.getApiErrorCode() == CONSUMER_NOT_FOUND_API_ERROR) {
        throw new ConsumerNotFoundException(streamName, consumerName, e);
      }
      throw new BrokerException(
          "Failed to subscribe to " + streamName + "/" + consumerName + ": " + e.getMessage(), e);
    } catch (IllegalArgumentException e) {
      if (e.getMessage() != null && e.getMessage().contains(CONSUMER_REQUIRED_IN_BIND)) {
        throw new ConsumerNotFoundException(streamName, consumerName, e);
      }
      throw e;
    } catch (IOException e) {
      throw new BrokerException(
          "Failed to subscribe to " + streamName + "/" + consumerName + ": " + e.getMessage(), e);
    }
  }

  static boolean isStreamNotFound(JetStreamApiException e) {
    return e.getApiErrorCode() == STREAM_NOT_FOUND_API_ERROR || e.getErrorCode() == NOT_FOUND;
  }
}
