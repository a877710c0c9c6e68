package com.acme.streams.worker;

import com.acme.streams.spi.Envelope;

/** Hook for observing dispatch outcomes, e.g. to feed metrics. Callbacks run on loop threads. */
public interface DispatchListener {

  DispatchListener NOOP = new DispatchListener() {};

  enum Signal {
    ACK,
    NAK
  }

  default void onAck(Envelope envelope) {}

  default void onNak(Envelope envelope, Exception cause) {}

  /** An ack or nak could not be sent; the broker's ack-wait timeout will redeliver the message. */
  default void onAckFailure(Envelope envelope, Signal signal, RuntimeException failure) {}

  default void onFetchError(RuntimeException failure) {}
}
