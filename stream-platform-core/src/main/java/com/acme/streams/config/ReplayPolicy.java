package com.acme.streams.config;

public enum ReplayPolicy {
  INSTANT,
  ORIGINAL
}
