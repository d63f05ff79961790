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
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link EventStore} keeping streams in memory.
 *
 * <p>Appends to the same stream are serialized by {@link ConcurrentHashMap#compute}, appends to
 * different streams run in parallel.
 */
public final class InMemoryEventStore implements EventStore {
  private static final Logger log = LoggerFactory.getLogger(InMemoryEventStore.class);

  private final Map<String, List<StoredEvent>> streams;
  private final Clock clock;

  public InMemoryEventStore() {
    this(Clock.systemUTC());
  }

  /**
   * @param clock used to stamp appended events
   * @throws IllegalArgumentException if clock is {@code null}
   */
  public InMemoryEventStore(final Clock clock) {
    if (clock == null) {
      throw new IllegalArgumentException("Clock cannot be null");
    }

    this.streams = new ConcurrentHashMap<>();
    this.clock = clock;
  }

  /** {@inheritDoc} */
  @Override
  public long append(
      final String streamId,
      final long expectedVersion,
      final List<? extends DomainEvent<?>> events) {
    EventStore.requireStreamId(streamId);
    EventStore.requireVersion(expectedVersion);

    if (events == null) {
      throw new IllegalArgumentException("Events cannot be null");
    }

    final List<DomainEvent<?>> batch = List.copyOf(events);
    final List<StoredEvent> updated =
        streams.compute(
            streamId,
            (id, existing) -> {
              final List<StoredEvent> current = existing == null ? List.of() : existing;
              if (current.size() != expectedVersion) {
                throw new ConcurrencyConflictException(id, expectedVersion, current.size());
              }

              if (batch.isEmpty()) {
                return existing;
              }

              final Instant now = clock.instant();
              final List<StoredEvent> next = new ArrayList<>(current);
              long sequence = expectedVersion;
              for (DomainEvent<?> event : batch) {
                next.add(new StoredEvent(id, ++sequence, event.eventType(), event, now));
              }

              return Collections.unmodifiableList(next);
            });

    final long version = updated == null ? 0 : updated.size();
    log.debug("Appended {} event(s) to '{}', version {}", batch.size(), streamId, version);
    return version;
  }

  /** {@inheritDoc} */
  @Override
  public List<StoredEvent> readStream(final String streamId, final long fromVersion) {
    EventStore.requireStreamId(streamId);
    EventStore.requireVersion(fromVersion);

    final List<StoredEvent> stream = streams.getOrDefault(streamId, List.of());
    if (fromVersion >= stream.size()) {
      return List.of();
    }

    return stream.subList((int) fromVersion, stream.size());
  }

  /** {@inheritDoc} */
  @Override
  public long currentVersion(final String streamId) {
    EventStore.requireStreamId(streamId);
    return streams.getOrDefault(streamId, List.of()).size();
  }
}
