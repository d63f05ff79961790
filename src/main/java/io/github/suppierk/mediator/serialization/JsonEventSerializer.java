/*
 * Copyright 2024 Roman Khlebnov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.github.suppierk.mediator.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.suppierk.mediator.domain.DomainEvent;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Converts {@link DomainEvent}s to JSON and back using Jackson.
 *
 * <p>The event type name stored next to the payload is resolved to a class through a registry
 * built at construction time. Events with a custom {@link DomainEvent#eventType()} or a previous
 * name still present in storage are registered by name.
 */
public final class JsonEventSerializer {
  private final ObjectMapper objectMapper;
  private final Map<String, Class<? extends DomainEvent<?>>> eventClasses;

  /**
   * Registers event classes under their default type names.
   *
   * <p>Events overriding {@link DomainEvent#eventType()} must be registered through {@link
   * #JsonEventSerializer(ObjectMapper, Map)} instead.
   *
   * @param objectMapper to use for conversion
   * @param eventClasses which can be converted
   * @throws IllegalArgumentException if any of the arguments or any event class is {@code null}
   * @throws IllegalStateException if two event classes share the same type name
   */
  public JsonEventSerializer(
      final ObjectMapper objectMapper,
      final Collection<? extends Class<? extends DomainEvent<?>>> eventClasses) {
    this(objectMapper, defaultTypeNames(eventClasses));
  }

  /**
   * Registers event classes under explicit type names.
   *
   * <p>The name written for an event is always its {@link DomainEvent#eventType()}, so each class
   * must be registered at least under that name. Additional names of the same class are accepted
   * when reading, which keeps events stored under a previous name readable.
   *
   * @param objectMapper to use for conversion
   * @param eventTypes mapping type names to event classes
   * @throws IllegalArgumentException if any of the arguments, any name or any class is {@code null}
   *     or a name is blank
   */
  public JsonEventSerializer(
      final ObjectMapper objectMapper,
      final Map<String, ? extends Class<? extends DomainEvent<?>>> eventTypes) {
    if (objectMapper == null) {
      throw new IllegalArgumentException("Object mapper cannot be null");
    }

    if (eventTypes == null) {
      throw new IllegalArgumentException("Event types cannot be null");
    }

    final Map<String, Class<? extends DomainEvent<?>>> registry = new LinkedHashMap<>();
    eventTypes.forEach(
        (eventType, eventClass) -> {
          if (eventType == null || eventType.isBlank()) {
            throw new IllegalArgumentException("Event type cannot be blank");
          }

          if (eventClass == null) {
            throw new IllegalArgumentException(
                "Event class of '%s' cannot be null".formatted(eventType));
          }

          registry.put(eventType, eventClass);
        });

    this.objectMapper = objectMapper;
    this.eventClasses = Collections.unmodifiableMap(registry);
  }

  /**
   * @return registered event type names
   */
  public Set<String> getEventTypes() {
    return eventClasses.keySet();
  }

  /**
   * @param event to convert
   * @return JSON payload
   * @throws IllegalArgumentException if event is {@code null} or its class is not registered
   * @throws IllegalStateException if Jackson failed to convert the event
   */
  public String serialize(final DomainEvent<?> event) {
    if (event == null) {
      throw new IllegalArgumentException("Event cannot be null");
    }

    final Class<? extends DomainEvent<?>> registered = eventClasses.get(event.eventType());
    if (registered == null || !registered.equals(event.getClass())) {
      throw new IllegalArgumentException(
          "Event type '%s' of %s is not registered"
              .formatted(event.eventType(), event.getClass().getName()));
    }

    try {
      return objectMapper.writeValueAsString(event);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException(
          "Failed to serialize '%s'".formatted(event.eventType()), e);
    }
  }

  /**
   * @param eventType stored next to the payload
   * @param payload in JSON format
   * @return restored event
   * @throws IllegalArgumentException if any of the arguments is {@code null}
   * @throws IllegalStateException if event type is unknown or Jackson failed to convert the payload
   */
  public DomainEvent<?> deserialize(final String eventType, final String payload) {
    if (eventType == null) {
      throw new IllegalArgumentException("Event type cannot be null");
    }

    if (payload == null) {
      throw new IllegalArgumentException("Payload cannot be null");
    }

    final Class<? extends DomainEvent<?>> eventClass = eventClasses.get(eventType);
    if (eventClass == null) {
      throw new IllegalStateException("Unknown event type '%s'".formatted(eventType));
    }

    try {
      return objectMapper.readValue(payload, eventClass);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to deserialize '%s'".formatted(eventType), e);
    }
  }

  private static Map<String, Class<? extends DomainEvent<?>>> defaultTypeNames(
      final Collection<? extends Class<? extends DomainEvent<?>>> eventClasses) {
    if (eventClasses == null) {
      throw new IllegalArgumentException("Event classes cannot be null");
    }

    final Map<String, Class<? extends DomainEvent<?>>> names = new LinkedHashMap<>();
    for (Class<? extends DomainEvent<?>> eventClass : eventClasses) {
      final String eventType = DomainEvent.typeNameOf(eventClass);
      final Class<? extends DomainEvent<?>> existing = names.putIfAbsent(eventType, eventClass);
      if (existing != null && !existing.equals(eventClass)) {
        throw new IllegalStateException(
            "Event type '%s' is used by both %s and %s"
                .formatted(eventType, existing.getName(), eventClass.getName()));
      }
    }

    return names;
  }
}
