package com.acme.streams.spi;

import java.util.Map;

/**
 * A single delivered message. Exactly one of {@link #ack()} or {@link #nak()} should be called;
 * both only signal the broker and do not wait for confirmation.
 */
public interface Envelope {

  String subject();

  byte[] payload();

  /** First value of each header; empty when the message carries none. */
  Map<String, String> headers();

  /** How many times the broker has delivered this message, starting at 1. */
  long deliveryAttempt();

  /** Processing succeeded; the message will not be redelivered. */
  void ack();

  /** Processing failed; the broker redelivers until the consumer's max-deliver is reached. */
  void nak();
}
