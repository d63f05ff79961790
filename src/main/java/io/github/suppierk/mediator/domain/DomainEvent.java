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

package io.github.suppierk.mediator.domain;

/**
 * Represents an immutable fact describing a state change that already happened to an {@link
 * Entity}.
 *
 * <p>It is highly recommended to use this interface with Java {@link Record}s.
 *
 * <p>Events do not carry their position within the stream: sequence numbers are assigned by the
 * event store at append time, which is why the same event value can be raised, applied and only
 * then committed.
 *
 * @param <K> is the type of the owning entity identifier
 */
public interface DomainEvent<K> {
  /**
   * @return identifier of the entity which raised this event
   */
  K aggregateId();

  /**
   * Defines the name under which the event is persisted and looked up again.
   *
   * <p>Overriding this method requires registering the event class under the new name explicitly
   * with every serializer reading the stream.
   *
   * @return event type identifier, simple class name by default
   */
  default String eventType() {
    return typeNameOf(getClass());
  }

  /**
   * @param eventClass to derive the name for
   * @return default event type identifier for the given class
   */
  static String typeNameOf(final Class<?> eventClass) {
    if (eventClass == null) {
      throw new IllegalArgumentException("Event class cannot be null");
    }

    return eventClass.getSimpleName();
  }
}
