package com.acme.streams.nats;

import com.acme.streams.spi.Envelope;
import io.nats.client.Message;
import io.nats.client.impl.Headers;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** {@link Envelope} over a JetStream message. */
public class NatsEnvelope implements Envelope {
  private static final byte[] EMPTY = new byte[0];

  private final Message message;

  public NatsEnvelope(Message message) {
    this.message = message;
  }

  @Override
  public String subject() {
    return message.getSubject();
  }

  @Override
  public byte[] payload() {
    byte[] data = message.getData();
    return data == null ? EMPTY : data;
  }

  @Override
  public Map<String, String> headers() {
    Headers headers = message.getHeaders();
    if (headers == null || headers.isEmpty()) {
      return Collections.emptyMap();
    }
    Map<String, String> result = new LinkedHashMap<>();
    for (String key : headers.keySet()) {
      result.put(key, headers.getFirst(key));
    }
    return result;
  }

  @Override
  public long deliveryAttempt() {
    try {
      return message.metaData().deliveredCount();
    } catch (IllegalStateException e) {
      // core NATS message without JetStream metadata
      return 1;
    }
  }

  @Override
  public void ack() {
    message.ack();
  }

  @Override
  public void nak() {
    message.nak();
  }

  public Message message() {
    return message;
  }
}
