package com.acme.streams.spi;

public enum AckPolicy {
  /** Every message needs its own ack. */
  EXPLICIT,
  /** Acking a message acks everything delivered before it. */
  ALL,
  NONE
}
