package com.acme.streams.core;

public class ConsumerNotFoundException extends PermanentException {
  private final String streamName;
  private final String consumerName;

  public ConsumerNotFoundException(String streamName, String consumerName, Throwable e) {
    super("consumer not found: " + consumerName + " on stream " + streamName, e);
    this.streamName = streamName;
    this.consumerName = consumerName;
  }

  public String getStreamName() {
    return streamName;
  }

  public String getConsumerName() {
    return consumerName;
  }
}
