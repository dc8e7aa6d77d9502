package com.codeheadsystems.oluso.server.store;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent in-memory {@link DeviceCodeStore} with a user code index.
 */
public class InMemoryDeviceCodeStore implements DeviceCodeStore {

  private static final Logger log = LoggerFactory.getLogger(InMemoryDeviceCodeStore.class);

  private final ConcurrentHashMap<String, DeviceCodeData> byDeviceCode = new ConcurrentHashMap<>();
  // userCode -> deviceCode, kept in sync with byDeviceCode.
  private final ConcurrentHashMap<String, String> userCodeIndex = new ConcurrentHashMap<>();

  public InMemoryDeviceCodeStore() {
    log.warn("Using InMemoryDeviceCodeStore - device authorizations will NOT survive restarts.");
  }

  @Override
  public void store(DeviceCodeData data) {
    byDeviceCode.put(data.deviceCode(), data);
    userCodeIndex.put(data.userCode(), data.deviceCode());
  }

  @Override
  public Optional<DeviceCodeData> findByDeviceCode(String deviceCode) {
    if (deviceCode == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(byDeviceCode.get(deviceCode));
  }

  @Override
  public Optional<DeviceCodeData> findByUserCode(String userCode) {
    if (userCode == null) {
      return Optional.empty();
    }
    String deviceCode = userCodeIndex.get(userCode);
    return deviceCode == null ? Optional.empty() : findByDeviceCode(deviceCode);
  }

  @Override
  public boolean replace(DeviceCodeData expected, DeviceCodeData updated) {
    return byDeviceCode.replace(expected.deviceCode(), expected, updated);
  }

  @Override
  public void remove(String deviceCode) {
    DeviceCodeData removed = byDeviceCode.remove(deviceCode);
    if (removed != null) {
      userCodeIndex.remove(removed.userCode());
    }
  }
}
