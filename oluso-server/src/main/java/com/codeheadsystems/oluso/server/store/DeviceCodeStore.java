package com.codeheadsystems.oluso.server.store;

import java.util.Optional;

/**
 * Storage for device authorizations. {@link #replace} is an atomic compare-and-swap.
 */
public interface DeviceCodeStore {

  void store(DeviceCodeData data);

  Optional<DeviceCodeData> findByDeviceCode(String deviceCode);

  Optional<DeviceCodeData> findByUserCode(String userCode);

  boolean replace(DeviceCodeData expected, DeviceCodeData updated);

  void remove(String deviceCode);
}
