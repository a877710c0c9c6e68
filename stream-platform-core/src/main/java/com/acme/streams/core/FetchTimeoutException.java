package com.acme.streams.core;

/**
 * Raised by a subscription when a fetch waited its full max-wait without receiving anything.
 * Dispatch loops treat it as "try again", never as a failure.
 */
public class FetchTimeoutException extends TransientException {
  public FetchTimeoutException(String message) {
    super(message);
  }
}
