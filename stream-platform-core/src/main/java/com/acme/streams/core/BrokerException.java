package com.acme.streams.core;

/** Transport or protocol failure reported by the broker client. */
public class BrokerException extends TransientException {
  public BrokerException(String message) {
    super(message);
  }

  public BrokerException(String message, Throwable e) {
    super(message, e);
  }
}
