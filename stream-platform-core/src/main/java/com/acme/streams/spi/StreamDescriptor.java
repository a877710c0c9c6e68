package com.acme.streams.spi;

import com.acme.streams.config.StorageType;
import com.acme.streams.config.WorkerConfig;

public record StreamDescriptor(String name, String subjects, StorageType storageType) {

  public static StreamDescriptor forWorker(WorkerConfig config) {
    return new StreamDescriptor(
        config.streamName(), config.streamSubjects(), config.storageType());
  }
}
