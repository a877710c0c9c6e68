package com.acme.streams.worker;

import com.acme.streams.spi.Envelope;

/**
 * Application callback invoked once per delivered message. Returning normally acks the message;
 * throwing naks it so the broker redelivers it. Handlers must not ack or nak the envelope
 * themselves.
 */
@FunctionalInterface
public interface MessageHandler {
  void handle(WorkerContext context, Envelope envelope) throws Exception;
}
