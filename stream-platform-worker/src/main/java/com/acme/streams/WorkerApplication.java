package com.acme.streams;

import io.micronaut.runtime.Micronaut;

/**
 * Stream Worker Application - consumes a durable JetStream stream with a pool of pull loops and
 * hands each message to the configured handler. Can run multiple instances against the same
 * durable consumer for horizontal scaling.
 */
public class WorkerApplication {
  public static void main(String[] args) {
    Micronaut.run(WorkerApplication.class, args);
  }
}
