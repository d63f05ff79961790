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

import io.github.suppierk.mediator.domain.AggregateRoot;
import io.github.suppierk.mediator.domain.DomainEvent;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link Repository} storing {@link AggregateRoot}s as streams of their events.
 *
 * <p>Aggregates are rebuilt by replaying their stream into a blank instance and saved by appending
 * the events raised since they were loaded, using the loaded version as the expected stream
 * version.
 *
 * <p>Streams are never hard-deleted: {@link #delete(Object)} is not supported, removal must be
 * modelled as an event instead.
 *
 * @param <A> is the type of the aggregate
 * @param <K> is the type of the aggregate identifier
 * @param <E> is the base type of the aggregate events
 * @see <a href="https://rules.sonarsource.com/java/RSPEC-119/">Suppressed Sonar rule for the sake
 *     to have more readable type names</a>
 */
@SuppressWarnings("squid:S119")
// @formatter:off
public class EventSourcedRepository<
  A extends AggregateRoot<K, E>,
  K,
  E extends DomainEvent<K>
> implements Repository<A, K> {
// @formatter:on
  private static final Logger log = LoggerFactory.getLogger(EventSourcedRepository.class);

  private final EventStore eventStore;
  private final Function<K, A> blankAggregateFactory;
  private final Class<E> eventClass;

  /**
   * Default constructor.
   *
   * @param eventStore holding the aggregate streams
   * @param blankAggregateFactory creating an aggregate without any applied events for a given ID
   * @param eventClass is the base type of the aggregate events
   * @throws IllegalArgumentException if any of the arguments is {@code null}
   */
  public EventSourcedRepository(
      final EventStore eventStore,
      final Function<K, A> blankAggregateFactory,
      final Class<E> eventClass) {
    if (eventStore == null) {
      throw new IllegalArgumentException("Event store cannot be null");
    }

    if (blankAggregateFactory == null) {
      throw new IllegalArgumentException("Blank aggregate factory cannot be null");
    }

    if (eventClass == null) {
      throw new IllegalArgumentException("Event class cannot be null");
    }

    this.eventStore = eventStore;
    this.blankAggregateFactory = blankAggregateFactory;
    this.eventClass = eventClass;
  }

  /**
   * Maps aggregate identifier to the stream identifier.
   *
   * <p>Override to prefix the stream with the aggregate type if several aggregate types share one
   * event store.
   *
   * @param id of the aggregate
   * @return stream identifier
   */
  protected String streamIdFor(final K id) {
    return String.valueOf(id);
  }

  /** {@inheritDoc} */
  @Override
  public Optional<A> getById(final K id) {
    if (id == null) {
      throw new IllegalArgumentException("Aggregate ID cannot be null");
    }

    final List<StoredEvent> stream = eventStore.readStream(streamIdFor(id));
    if (stream.isEmpty()) {
      return Optional.empty();
    }

    final List<E> history = new ArrayList<>(stream.size());
    for (StoredEvent stored : stream) {
      if (!eventClass.isInstance(stored.event())) {
        throw new IllegalStateException(
            "Stream '%s' contains '%s' at %d which is not a %s"
                .formatted(
                    stored.streamId(),
                    stored.eventType(),
                    stored.sequence(),
                    eventClass.getSimpleName()));
      }

      history.add(eventClass.cast(stored.event()));
    }

    final A aggregate = blankAggregateFactory.apply(id);
    if (aggregate == null) {
      throw new IllegalStateException(
          "Blank aggregate factory returned null for '%s'".formatted(id));
    }

    aggregate.loadFromHistory(history);
    UnitOfWork.current().ifPresent(unitOfWork -> unitOfWork.enlistForChanges(aggregate, this));
    return Optional.of(aggregate);
  }

  /** {@inheritDoc} */
  @Override
  public boolean contains(final K id) {
    if (id == null) {
      throw new IllegalArgumentException("Aggregate ID cannot be null");
    }

    return eventStore.containsStream(streamIdFor(id));
  }

  /**
   * Appends events raised since the aggregate was loaded or last saved.
   *
   * <p>Events stay uncommitted until the unit of work dispatches them.
   *
   * @param aggregate to save
   * @throws IllegalArgumentException if aggregate is {@code null}
   * @throws ConcurrencyConflictException if the stream was appended concurrently
   */
  @Override
  public void save(final A aggregate) {
    if (aggregate == null) {
      throw new IllegalArgumentException("Aggregate cannot be null");
    }

    if (!aggregate.hasUnsavedEvents()) {
      return;
    }

    final String streamId = streamIdFor(aggregate.getId());
    final long persistedVersion = aggregate.getPersistedVersion();
    final long version =
        aggregate.appendUnsavedEvents(
            (expectedVersion, events) -> eventStore.append(streamId, expectedVersion, events));

    log.debug(
        "Saved {} event(s) of '{}', version {}", version - persistedVersion, streamId, version);
    UnitOfWork.current().ifPresent(unitOfWork -> unitOfWork.enlist(aggregate));
  }

  /**
   * Compares the stream version with the version the unsaved events of the aggregate are based
   * on. Aggregates without unsaved events are always accepted.
   *
   * @param aggregate to verify
   * @throws IllegalArgumentException if aggregate is {@code null}
   * @throws ConcurrencyConflictException if the stream was appended concurrently
   */
  @Override
  public void verifyVersion(final A aggregate) {
    if (aggregate == null) {
      throw new IllegalArgumentException("Aggregate cannot be null");
    }

    if (!aggregate.hasUnsavedEvents()) {
      return;
    }

    final String streamId = streamIdFor(aggregate.getId());
    final long actualVersion = eventStore.currentVersion(streamId);
    if (actualVersion != aggregate.getPersistedVersion()) {
      throw new ConcurrencyConflictException(
          streamId, aggregate.getPersistedVersion(), actualVersion);
    }
  }

  /**
   * Event streams are append-only.
   *
   * @throws UnsupportedOperationException always
   */
  @Override
  public void delete(final K id) {
    throw new UnsupportedOperationException(
        "Event-sourced aggregates cannot be deleted, raise an event instead");
  }
}
