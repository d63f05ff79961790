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

package io.github.suppierk.mediator.data;

import io.github.suppierk.mediator.domain.DomainEvent;
import java.time.Instant;

/**
 * {@link DomainEvent} as it was recorded in the event stream.
 *
 * @param streamId of the stream the event belongs to
 * @param sequence of the event within the stream, starting from 1
 * @param eventType under which the event was recorded
 * @param event payload
 * @param recordedAt is the moment of the append
 */
public record StoredEvent(
    String streamId, long sequence, String eventType, DomainEvent<?> event, Instant recordedAt) {
  public StoredEvent {
    if (streamId == null) {
      throw new IllegalArgumentException("Stream ID cannot be null");
    }

    if (sequence < 1) {
      throw new IllegalArgumentException("Sequence must be positive");
    }

    if (eventType == null) {
      throw new IllegalArgumentException("Event type cannot be null");
    }

    if (event == null) {
      throw new IllegalArgumentException("Event cannot be null");
    }

    if (recordedAt == null) {
      throw new IllegalArgumentException("Record time cannot be null");
    }
  }
}
