package com.codeheadsystems.oluso.server.store;

public enum DeviceCodeStatus {
  PENDING,
  APPROVED,
  DENIED,
  CONSUMED
}
