package com.acme.streams.config;

public enum StorageType {
  FILE,
  MEMORY
}
