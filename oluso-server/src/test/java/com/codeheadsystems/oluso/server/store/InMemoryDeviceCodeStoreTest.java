package com.codeheadsystems.oluso.server.store;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class InMemoryDeviceCodeStoreTest {

  private static final Instant NOW = Instant.parse("2024-01-01T00:00:00Z");

  private InMemoryDeviceCodeStore store;
  private DeviceCodeData pending;

  @BeforeEach
  void setUp() {
    store = new InMemoryDeviceCodeStore();
    pending = new DeviceCodeData("dc-1", "BCDFGHJK", "tv", "acme", "openid", DeviceCodeStatus.PENDING,
        null, null, NOW, NOW.plusSeconds(300), 5, null);
    store.store(pending);
  }

  @Test
  void findByUserCode_followsTheIndex() {
    assertThat(store.findByUserCode("BCDFGHJK")).contains(pending);
    assertThat(store.findByUserCode("ZZZZZZZZ")).isEmpty();
    assertThat(store.findByUserCode(null)).isEmpty();
  }

  @Test
  void replace_failsWhenTheStoredValueChanged() {
    DeviceCodeData approved = new DeviceCodeData("dc-1", "BCDFGHJK", "tv", "acme", "openid",
        DeviceCodeStatus.APPROVED, "user-1", "sid-1", NOW, NOW.plusSeconds(300), 5, null);

    assertThat(store.replace(pending, approved)).isTrue();
    assertThat(store.replace(pending, approved)).isFalse();
    assertThat(store.findByDeviceCode("dc-1")).map(DeviceCodeData::status).contains(DeviceCodeStatus.APPROVED);
  }

  @Test
  void remove_dropsBothLookups() {
    store.remove("dc-1");

    assertThat(store.findByDeviceCode("dc-1")).isEmpty();
    assertThat(store.findByUserCode("BCDFGHJK")).isEmpty();
  }
}
