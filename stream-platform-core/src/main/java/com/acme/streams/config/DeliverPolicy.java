package com.acme.streams.config;

/** Where a newly created consumer starts reading in the stream. */
public enum DeliverPolicy {
  ALL,
  NEW,
  LAST,
  LAST_PER_SUBJECT
}
