package com.acme.streams.core;

public class StreamNotFoundException extends PermanentException {
  private final String streamName;

  public StreamNotFoundException(String streamName) {
    super("stream not found: " + streamName);
    this.streamName = streamName;
  }

  public StreamNotFoundException(String streamName, Throwable e) {
    super("stream not found: " + streamName, e);
    this.streamName = streamName;
  }

  public String getStreamName() {
    return streamName;
  }
}
