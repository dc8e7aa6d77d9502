package com.codeheadsystems.oluso.server.event;

/**
 * Receives audit events. Implementations must not throw back into protocol flows.
 */
public interface EventSink {

  void publish(OlusoEvent event);

  /**
   * A sink that drops everything.
   *
   * @return the sink
   */
  static EventSink noop() {
    return event -> {
    };
  }
}
