package com.codeheadsystems.oluso.server.journey;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Step handlers keyed by step type.
 */
@Singleton
public class StepHandlerRegistry {

  private static final Logger log = LoggerFactory.getLogger(StepHandlerRegistry.class);

  private final Map<String, StepHandler> handlers = new HashMap<>();

  @Inject
  public StepHandlerRegistry(Set<StepHandler> stepHandlers) {
    for (StepHandler handler : stepHandlers) {
      String key = handler.stepType().toLowerCase(Locale.ROOT);
      if (handlers.putIfAbsent(key, handler) != null) {
        throw new IllegalArgumentException("Duplicate step handler for type " + handler.stepType());
      }
    }
    log.info("StepHandlerRegistry({})", handlers.keySet());
  }

  public Optional<StepHandler> handlerFor(String stepType) {
    if (stepType == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(handlers.get(stepType.toLowerCase(Locale.ROOT)));
  }
}
